package org.calista.theorysynth.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.theorysynth.model.TheorySynthesis;

import java.util.Objects;

/**
 * JSON export: {@code {"content": ..., "theory": {...}}}, the extracted text next to its synthesis.
 */
public final class TheoryJson {

    public static final String DEFAULT_FILE_NAME = "sintese-teorica.json";

    private final ObjectMapper mapper;

    public TheoryJson() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public TheoryJson(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String write(String content, TheorySynthesis theory) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new Export(content, theory));
    }

    public Export read(String json) throws JsonProcessingException {
        Objects.requireNonNull(json, "json");
        return mapper.readValue(json, Export.class);
    }

    @JsonPropertyOrder({"content", "theory"})
    public static final class Export {
        public final String content;
        public final TheorySynthesis theory;

        @JsonCreator
        public Export(@JsonProperty("content") String content,
                      @JsonProperty("theory") TheorySynthesis theory) {
            this.content = Objects.requireNonNull(content, "content");
            this.theory = Objects.requireNonNull(theory, "theory");
        }
    }
}
