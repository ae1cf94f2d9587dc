package org.calista.theorysynth.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.theorysynth.io.FileIO;
import org.calista.theorysynth.synth.ConceptExtractor;
import org.calista.theorysynth.synth.ExperimentRecommender;
import org.calista.theorysynth.synth.FormulaSynthesizer;
import org.calista.theorysynth.synth.PhenomenonIdentifier;
import org.calista.theorysynth.synth.SystemModelSelector;
import org.calista.theorysynth.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * SynthConfig: простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SynthConfig {

    private static final Logger log = LoggerFactory.getLogger(SynthConfig.class);

    public static final String DEFAULT_MARKDOWN_FILE = "sintese-teorica.md";
    public static final String DEFAULT_JSON_FILE = "sintese-teorica.json";

    public Engine engine = new Engine();
    public Output output = new Output();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Engine {
        /** Input window; longer content is analyzed by prefix. */
        public int maxChars = TextNormalizer.DEFAULT_MAX_CHARS;

        public int conceptLimit = ConceptExtractor.DEFAULT_LIMIT;
        public int phenomenonLimit = PhenomenonIdentifier.DEFAULT_LIMIT;
        public int formulaLimit = FormulaSynthesizer.MAX_FORMULAS;
        public int modelLimit = SystemModelSelector.MAX_MODELS;
        public int experimentLimit = ExperimentRecommender.MAX_EXPERIMENTS;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Output {
        public String dir = "out";
        public String markdownFile = DEFAULT_MARKDOWN_FILE;
        public String jsonFile = DEFAULT_JSON_FILE;
        public boolean writeMarkdown = true;
        public boolean writeJson = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static SynthConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            SynthConfig created = new SynthConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            SynthConfig created = new SynthConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        SynthConfig cfg = mapper.readValue(json, SynthConfig.class);
        if (cfg == null) cfg = new SynthConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, SynthConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, SynthConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (engine == null) engine = new Engine();

        if (engine.maxChars < 1) {
            log.warn("engine.maxChars={} is not positive, using {}", engine.maxChars, TextNormalizer.DEFAULT_MAX_CHARS);
            engine.maxChars = TextNormalizer.DEFAULT_MAX_CHARS;
        }
        if (engine.conceptLimit < 1) engine.conceptLimit = 1;
        engine.phenomenonLimit = clamp("engine.phenomenonLimit", engine.phenomenonLimit, 1, PhenomenonIdentifier.DEFAULT_LIMIT);
        engine.formulaLimit = clamp("engine.formulaLimit", engine.formulaLimit, 1, FormulaSynthesizer.MAX_FORMULAS);
        engine.modelLimit = clamp("engine.modelLimit", engine.modelLimit, 1, SystemModelSelector.MAX_MODELS);
        engine.experimentLimit = clamp("engine.experimentLimit", engine.experimentLimit,
                ExperimentRecommender.MIN_EXPERIMENTS, ExperimentRecommender.MAX_EXPERIMENTS);

        if (output == null) output = new Output();
        if (output.dir == null || output.dir.isBlank()) output.dir = "out";
        output.markdownFile = plainFileName("output.markdownFile", output.markdownFile, DEFAULT_MARKDOWN_FILE);
        output.jsonFile = plainFileName("output.jsonFile", output.jsonFile, DEFAULT_JSON_FILE);
    }

    /** Export names live inside output.dir: no separators, no "." or "..". */
    private static String plainFileName(String key, String v, String def) {
        if (v == null || v.isBlank()) return def;
        String name = v.trim();
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf(':') >= 0
                || name.equals(".") || name.equals("..")) {
            log.warn("{}='{}' is not a plain file name, using {}", key, v, def);
            return def;
        }
        return name;
    }

    private static int clamp(String key, int v, int min, int max) {
        if (v >= min && v <= max) return v;
        int c = Math.max(min, Math.min(max, v));
        log.warn("{}={} out of range [{}, {}], clamped to {}", key, v, min, max, c);
        return c;
    }
}
