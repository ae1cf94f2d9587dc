package org.calista.theorysynth.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * FileIO: единая точка I/O для адаптеров (конфиг, входные файлы, экспорт).
 *
 * - прозрачное чтение .gz/.gzip
 * - атомарная запись: temp-файл рядом с целью + ATOMIC_MOVE, (опционально) fsync
 * - запись пропускается, если содержимое не изменилось
 * - resolve() внутри baseDir защищён от выхода через ".."
 *
 * The synthesis core never touches this class.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v, "charset");
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** Input files supplied by the user live anywhere: normalization only. */
    public Path resolveExternal(String anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return Paths.get(anyPath).toAbsolutePath().normalize();
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Read
    // ----------------------------

    /** Whole file as text; .gz/.gzip are decompressed on the fly. */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
                return new String(in.readAllBytes(), opt.charset);
            }
        }
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    // ----------------------------
    // Write
    // ----------------------------

    /**
     * Writes text, atomically when enabled. Unchanged content is not rewritten.
     *
     * @return false when the file already held exactly this content
     */
    public boolean writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return false;
        }

        if (!opt.atomicWrites) {
            writeDirect(file, content);
            return true;
        }

        Path tmp = tempSibling(file);
        writeDirect(tmp, content);
        atomicCommit(tmp, file);
        return true;
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private Path tempSibling(Path target) {
        String name = target.getFileName().toString();
        return target.resolveSibling("." + name + ".tmp-" + Long.toHexString(System.nanoTime()));
    }

    private void writeDirect(Path file, String content) throws IOException {
        Files.writeString(file, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        if (opt.fsyncOnCommit) fsync(file);
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // если move не удался, tmp может остаться
            if (Files.exists(tmp)) {
                try {
                    Files.delete(tmp);
                } catch (IOException e) {
                    log.warn("Failed to remove temp file {}: {}", tmp, e.toString());
                }
            }
        }
    }

    private void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }

    private boolean isSameContent(Path file, String content) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != content.getBytes(opt.charset).length) return false;
            return Files.readString(file, opt.charset).equals(content);
        } catch (IOException e) {
            log.debug("isSameContent: cannot read {} ({}), rewriting", file, e.toString());
            return false;
        }
    }

    private static boolean isGzip(Path file) {
        Path name = file.getFileName();
        if (name == null) return false;
        String n = name.toString().toLowerCase(Locale.ROOT);
        return n.endsWith(".gz") || n.endsWith(".gzip");
    }
}
