package org.calista.theorysynth;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.theorysynth.core.SynthComposer;
import org.calista.theorysynth.core.SynthConfig;
import org.calista.theorysynth.ingest.LoadedSource;
import org.calista.theorysynth.ingest.SourceLoader;
import org.calista.theorysynth.io.FileIO;
import org.calista.theorysynth.model.Medium;
import org.calista.theorysynth.model.TheorySynthesis;
import org.calista.theorysynth.render.TheoryJson;
import org.calista.theorysynth.render.TheoryMarkdownWriter;
import org.calista.theorysynth.synth.TheorySynthesizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * TheoryApp: console runner.
 *
 * Lifecycle:
 *  1) parse arguments
 *  2) load (or create) config
 *  3) compose TheorySynthesizer
 *  4) load the source for the chosen medium
 *  5) synthesize, write exports, print markdown
 *
 * Usage: {@code [--config file] [--medium text|pdf|audio] [--out dir] [--json] <input|->}
 * where {@code -} reads text from stdin.
 */
public final class TheoryApp {

    private static final Logger log = LogManager.getLogger(TheoryApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO = 1;
    public static final int EXIT_INVALID = 2;

    static final String DEFAULT_CONFIG = "config/synth.json";
    static final String STDIN = "-";

    // user-facing messages
    static final String MSG_MEDIUM_MISSING = "Formato de entrada não informado.";
    static final String MSG_TEXT_MISSING = "Texto não fornecido.";
    static final String MSG_PDF_MISSING = "Arquivo PDF não encontrado.";
    static final String MSG_AUDIO_MISSING = "Arquivo de áudio não encontrado.";
    static final String MSG_MEDIUM_UNSUPPORTED = "Tipo de entrada não suportado.";
    static final String MSG_NOTHING_EXTRACTED = "Nenhum conteúdo pôde ser extraído.";
    static final String MSG_FORMAT_UNSUPPORTED = "Formato de arquivo não suportado. Forneça o texto extraído do documento.";
    static final String MSG_FAILURE = "Falha ao processar a entrada. Verifique o arquivo ou tente novamente.";

    static final String USAGE = "Uso: theory-synth [--config arquivo] [--medium text|pdf|audio] [--out dir] [--json] <entrada|->";

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;

    public TheoryApp(PrintStream out, PrintStream err, InputStream in) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.in = Objects.requireNonNull(in, "in");
    }

    public static void main(String[] args) {
        int code = new TheoryApp(System.out, System.err, System.in).run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    public int run(String[] args) {
        final Args a;
        try {
            a = Args.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_INVALID;
        }

        try {
            ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            FileIO io = new FileIO(Path.of("."));

            // 1) config
            SynthConfig cfg = SynthConfig.loadOrCreate(io, io.resolveExternal(a.configFile), mapper);
            if (a.outDir != null) cfg.output.dir = a.outDir;
            if (a.json) cfg.output.writeJson = true;

            // 2) synthesizer
            TheorySynthesizer synthesizer = new SynthComposer(cfg).build();

            // 3) source
            SourceLoader loader = new SourceLoader(io);
            LoadedSource source = STDIN.equals(a.input)
                    ? loader.fromText(new String(in.readAllBytes(), StandardCharsets.UTF_8))
                    : loader.load(a.medium, io.resolveExternal(a.input));

            // 4) synthesis
            TheorySynthesis theory = synthesizer.synthesize(source.content, source.descriptor);

            TheoryMarkdownWriter md = new TheoryMarkdownWriter();
            String markdown = md.render(theory);

            // 5) exports first, so a failed write leaves stdout empty
            writeExports(cfg, io, source, theory, markdown, mapper);

            out.println(md.summary(theory));
            out.println();
            out.println(markdown);
            return EXIT_OK;
        } catch (InvalidInputException e) {
            log.debug("Invalid input: {}", e.getMessage());
            err.println(messageFor(e));
            return EXIT_INVALID;
        } catch (NoSuchFileException e) {
            log.debug("Input not found: {}", e.getMessage());
            err.println(missingMessage(a.medium));
            return EXIT_INVALID;
        } catch (IOException | UncheckedIOException e) {
            log.error("Processing failed for {}", a.input, e);
            err.println(MSG_FAILURE);
            return EXIT_IO;
        } catch (IllegalArgumentException e) {
            // bad paths from config or flags (traversal, absolute export names)
            log.error("Rejected path while processing {}: {}", a.input, e.getMessage());
            err.println(MSG_FAILURE);
            return EXIT_IO;
        }
    }

    private void writeExports(SynthConfig cfg, FileIO io, LoadedSource source, TheorySynthesis theory,
                              String markdown, ObjectMapper mapper) throws IOException {
        if (!cfg.output.writeMarkdown && !cfg.output.writeJson) return;

        FileIO outIo = new FileIO(io.resolveExternal(cfg.output.dir), io.options());
        if (cfg.output.writeMarkdown) {
            Path p = outIo.resolve(cfg.output.markdownFile);
            outIo.writeString(p, markdown + "\n");
            log.info("Markdown written to {}", p);
        }
        if (cfg.output.writeJson) {
            Path p = outIo.resolve(cfg.output.jsonFile);
            outIo.writeString(p, new TheoryJson(mapper).write(source.content, theory) + "\n");
            log.info("JSON written to {}", p);
        }
    }

    static String messageFor(InvalidInputException e) {
        switch (e.kind()) {
            case UNSUPPORTED_FORMAT: return MSG_FORMAT_UNSUPPORTED;
            case BLANK_CONTENT: return MSG_TEXT_MISSING;
            case NOTHING_EXTRACTED:
            default: return MSG_NOTHING_EXTRACTED;
        }
    }

    static String missingMessage(Medium medium) {
        switch (medium) {
            case PDF: return MSG_PDF_MISSING;
            case AUDIO: return MSG_AUDIO_MISSING;
            case TEXT:
            default: return MSG_TEXT_MISSING;
        }
    }

    // ---------------------------------------------------------------------
    // Arguments
    // ---------------------------------------------------------------------

    static final class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }

    static final class Args {
        String configFile = DEFAULT_CONFIG;
        Medium medium = Medium.TEXT;
        String outDir;
        boolean json;
        String input;

        static Args parse(String[] argv) throws UsageException {
            Args a = new Args();
            String[] args = argv == null ? new String[0] : argv;

            for (int i = 0; i < args.length; i++) {
                String s = args[i];
                switch (s) {
                    case "--config":
                        a.configFile = value(args, ++i, s, "Arquivo de configuração não informado.");
                        break;
                    case "--medium":
                        String m = value(args, ++i, s, MSG_MEDIUM_MISSING);
                        try {
                            a.medium = Medium.parse(m);
                        } catch (IllegalArgumentException e) {
                            throw new UsageException(MSG_MEDIUM_UNSUPPORTED);
                        }
                        break;
                    case "--out":
                        a.outDir = value(args, ++i, s, "Diretório de saída não informado.");
                        break;
                    case "--json":
                        a.json = true;
                        break;
                    default:
                        if (s.startsWith("--")) throw new UsageException("Opção desconhecida: " + s);
                        if (a.input != null) throw new UsageException("Apenas uma entrada é aceita.");
                        a.input = s;
                }
            }

            if (a.input == null) throw new UsageException(missingMessage(a.medium));
            if (STDIN.equals(a.input) && a.medium != Medium.TEXT) throw new UsageException(MSG_MEDIUM_UNSUPPORTED);
            return a;
        }

        private static String value(String[] args, int i, String opt, String missing) throws UsageException {
            if (i >= args.length || args[i].isBlank() || args[i].startsWith("--")) {
                throw new UsageException(missing);
            }
            return args[i];
        }
    }
}
