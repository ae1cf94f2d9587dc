package org.calista.theorysynth.core;

import org.calista.theorysynth.synth.TheorySynthesizer;
import org.calista.theorysynth.text.Tokenizer;
import org.calista.theorysynth.text.impl.UnicodeTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * SynthComposer: wires {@link SynthConfig} onto a ready {@link TheorySynthesizer}.
 */
public final class SynthComposer {

    private static final Logger log = LoggerFactory.getLogger(SynthComposer.class);

    private final SynthConfig config;

    public SynthComposer(SynthConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public TheorySynthesizer build() {
        return build(new UnicodeTokenizer());
    }

    public TheorySynthesizer build(Tokenizer tokenizer) {
        Objects.requireNonNull(tokenizer, "tokenizer");
        config.validate();

        TheorySynthesizer.Config synthCfg = toEngineConfig(config.engine);

        log.info("Building TheorySynthesizer");
        if (log.isDebugEnabled()) {
            log.debug("Output settings: dir={}, markdown={}, json={}",
                    config.output.dir,
                    config.output.writeMarkdown ? config.output.markdownFile : "off",
                    config.output.writeJson ? config.output.jsonFile : "off");
        }

        return TheorySynthesizer.builder()
                .tokenizer(tokenizer)
                .config(synthCfg)
                .build();
    }

    public SynthConfig config() {
        return config;
    }

    static TheorySynthesizer.Config toEngineConfig(SynthConfig.Engine e) {
        TheorySynthesizer.Config c = TheorySynthesizer.Config.defaults();
        c.maxChars = e.maxChars;
        c.conceptLimit = e.conceptLimit;
        c.phenomenonLimit = e.phenomenonLimit;
        c.formulaLimit = e.formulaLimit;
        c.modelLimit = e.modelLimit;
        c.experimentLimit = e.experimentLimit;
        return c;
    }
}
