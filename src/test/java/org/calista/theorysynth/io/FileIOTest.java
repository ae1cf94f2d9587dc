package org.calista.theorysynth.io;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FileIO.
 */
class FileIOTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("writeString creates parents and reports unchanged content")
    void testWriteAndSkip() throws Exception {
        FileIO io = new FileIO(dir);
        Path p = io.resolve("out/sintese.md");

        assertTrue(io.writeString(p, "# Núcleo Teórico"));
        assertEquals("# Núcleo Teórico", io.readString(p));
        assertFalse(io.writeString(p, "# Núcleo Teórico"));
        assertTrue(io.writeString(p, "outro"));
        assertEquals("outro", Files.readString(p, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("atomic writes leave no temp files behind")
    void testNoTempLeftovers() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().fsyncOnCommit(true).build());
        io.writeString(io.resolve("a.json"), "{}");
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("non-atomic mode writes in place")
    void testDirectWrite() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().atomicWrites(false).build());
        Path p = io.resolve("b.txt");
        io.writeString(p, "texto");
        assertEquals("texto", io.readString(p));
    }

    @Test
    @DisplayName("gzip files are decompressed transparently")
    void testGzipRead() throws Exception {
        Path gz = dir.resolve("notas.txt.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
            out.write("energia comprimida".getBytes(StandardCharsets.UTF_8));
        }
        assertEquals("energia comprimida", new FileIO(dir).readString(gz));
    }

    @Test
    @DisplayName("resolve refuses absolute paths and traversal")
    void testResolveGuard() {
        FileIO io = new FileIO(dir);
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../fora.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.toAbsolutePath().toString()));
        assertEquals(dir.toAbsolutePath().normalize().resolve("x/y.txt"), io.resolve("x/./y.txt"));
    }

    @Test
    @DisplayName("missing files surface as NoSuchFileException or empty Optional")
    void testMissing() throws Exception {
        FileIO io = new FileIO(dir);
        Path missing = dir.resolve("nada.txt");
        assertThrows(NoSuchFileException.class, () -> io.readString(missing));
        assertTrue(io.readStringIfExists(missing).isEmpty());
        assertFalse(io.exists(missing));
    }
}
