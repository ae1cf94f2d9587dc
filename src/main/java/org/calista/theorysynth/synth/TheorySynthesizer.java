package org.calista.theorysynth.synth;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.theorysynth.InvalidInputException;
import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.ParameterEntry;
import org.calista.theorysynth.model.SignalProfile;
import org.calista.theorysynth.model.SourceDescriptor;
import org.calista.theorysynth.model.SystemModel;
import org.calista.theorysynth.model.TheorySynthesis;
import org.calista.theorysynth.text.NormalizedText;
import org.calista.theorysynth.text.TextNormalizer;
import org.calista.theorysynth.text.Tokenizer;
import org.calista.theorysynth.text.impl.UnicodeTokenizer;

import java.util.List;
import java.util.Objects;

/**
 * TheorySynthesizer: the content-to-theory pipeline.
 *
 * Stages (fixed order, each fed explicitly with the previous outputs):
 *  1) normalize      -> sentences + tokens
 *  2) concepts       -> ranked salient terms
 *  3) metrics        -> complexity / coherence
 *  4) phenomena      -> statements from adjacent concept pairs
 *  5) formulas       -> catalog templates bound to concepts
 *  6) system models  -> best matching archetypes
 *  7) parameters     -> glossary of symbols used by 5 and 6
 *  8) inference      -> narration of 2..6
 *  9) experiments    -> model focus x phenomena
 *
 * No mutable state survives a call: one instance can serve any number of concurrent requests.
 * The only failure is {@link InvalidInputException} for blank content; every other input
 * produces a complete {@link TheorySynthesis}.
 */
public final class TheorySynthesizer {

    private static final Logger log = LogManager.getLogger(TheorySynthesizer.class);

    private final Config config;
    private final Tokenizer tokenizer;

    private final TextNormalizer normalizer;
    private final ConceptExtractor conceptExtractor;
    private final MetricEngine metricEngine;
    private final PhenomenonIdentifier phenomenonIdentifier;
    private final FormulaSynthesizer formulaSynthesizer;
    private final SystemModelSelector modelSelector;
    private final ParameterTableBuilder parameterTableBuilder;
    private final InferenceNarrator narrator;
    private final ExperimentRecommender experimentRecommender;
    private final ThesisComposer thesisComposer;

    private TheorySynthesizer(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config").freezeAndValidate();
        this.tokenizer = (b.tokenizer != null) ? b.tokenizer : new UnicodeTokenizer();

        this.normalizer = new TextNormalizer(tokenizer, config.maxChars);
        this.conceptExtractor = new ConceptExtractor(config.conceptLimit);
        this.metricEngine = new MetricEngine();
        this.phenomenonIdentifier = new PhenomenonIdentifier(config.phenomenonLimit);
        this.formulaSynthesizer = new FormulaSynthesizer(config.formulaLimit);
        this.modelSelector = new SystemModelSelector(config.modelLimit);
        this.parameterTableBuilder = new ParameterTableBuilder();
        this.narrator = new InferenceNarrator();
        this.experimentRecommender = new ExperimentRecommender(config.experimentLimit);
        this.thesisComposer = new ThesisComposer();

        logCreation();
    }

    public static TheorySynthesizer withDefaults() {
        return builder().build();
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * Runs the full pipeline.
     *
     * @throws InvalidInputException if {@code content} is null, empty or whitespace-only
     * @throws NullPointerException  if {@code descriptor} is null
     */
    public TheorySynthesis synthesize(String content, SourceDescriptor descriptor) {
        if (content == null || content.isBlank()) throw InvalidInputException.blankContent();
        Objects.requireNonNull(descriptor, "descriptor");

        NormalizedText text = normalizer.normalize(content);
        List<Concept> concepts = conceptExtractor.extract(text.tokens);
        TextMetrics metrics = metricEngine.measure(text, concepts);
        List<String> phenomena = phenomenonIdentifier.identify(concepts);
        List<Formula> formulas = formulaSynthesizer.synthesize(concepts);
        List<SystemArchetype> archetypes = modelSelector.rank(concepts);
        List<SystemModel> models = modelSelector.toModels(archetypes, concepts);
        List<ParameterEntry> parameters = parameterTableBuilder.build(formulas, models, concepts);
        List<String> steps = narrator.narrate(text, concepts, metrics, models, formulas);
        List<String> experiments = experimentRecommender.recommend(models, phenomena, concepts);
        String thesis = thesisComposer.compose(text, concepts, archetypes);

        if (log.isDebugEnabled()) {
            log.debug("synthesize: medium={} tokens={} concepts={} formulas={} models={} params={} complexity={} coherence={}",
                    descriptor.medium, text.tokenCount(), concepts.size(), formulas.size(), models.size(),
                    parameters.size(), metrics.complexityScore, metrics.coherence);
        }

        return new TheorySynthesis(
                thesis,
                phenomena,
                formulas,
                models,
                parameters,
                metrics.complexityScore,
                metrics.coherence,
                SignalProfile.of(descriptor),
                steps,
                experiments
        );
    }

    // ---------------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------------

    public Config getConfig() { return config; }

    public Tokenizer getTokenizer() { return tokenizer; }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Tokenizer tokenizer;
        private Config config = Config.defaults();

        private Builder() {}

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
            return this;
        }

        public Builder config(Config cfg) {
            this.config = Objects.requireNonNull(cfg, "config");
            return this;
        }

        public TheorySynthesizer build() {
            return new TheorySynthesizer(this);
        }
    }

    public static final class Config {
        // normalizer
        public int maxChars = TextNormalizer.DEFAULT_MAX_CHARS;

        // ranking / output caps
        public int conceptLimit = ConceptExtractor.DEFAULT_LIMIT;
        public int phenomenonLimit = PhenomenonIdentifier.DEFAULT_LIMIT;
        public int formulaLimit = FormulaSynthesizer.MAX_FORMULAS;
        public int modelLimit = SystemModelSelector.MAX_MODELS;
        public int experimentLimit = ExperimentRecommender.MAX_EXPERIMENTS;

        private boolean frozen = false;

        public static Config defaults() { return new Config(); }

        /** Smaller input window and fewer concepts; for latency-sensitive callers. */
        public static Config compact() {
            Config c = new Config();
            c.maxChars = 4_000;
            c.conceptLimit = 4;
            c.formulaLimit = 3;
            c.modelLimit = 1;
            c.experimentLimit = 2;
            return c;
        }

        public boolean isFrozen() { return frozen; }

        public Config freezeAndValidate() {
            if (frozen) return this;

            maxChars = Math.max(1, maxChars);
            conceptLimit = Math.max(1, conceptLimit);
            phenomenonLimit = Math.max(1, Math.min(PhenomenonIdentifier.DEFAULT_LIMIT, phenomenonLimit));
            formulaLimit = Math.max(1, Math.min(FormulaSynthesizer.MAX_FORMULAS, formulaLimit));
            modelLimit = Math.max(1, Math.min(SystemModelSelector.MAX_MODELS, modelLimit));
            experimentLimit = Math.max(ExperimentRecommender.MIN_EXPERIMENTS,
                    Math.min(ExperimentRecommender.MAX_EXPERIMENTS, experimentLimit));

            frozen = true;
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void logCreation() {
        if (!log.isDebugEnabled()) return;
        log.debug("TheorySynthesizer initialized: tokenizer={}, maxChars={}, concepts<={}, phenomena<={}, "
                        + "formulas<={}, models<={}, experiments<={}",
                tokenizer.getClass().getSimpleName(), config.maxChars, config.conceptLimit,
                config.phenomenonLimit, config.formulaLimit, config.modelLimit, config.experimentLimit);
    }
}
