package org.calista.theorysynth.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Medium.
 */
class MediumTest {

    @Test
    @DisplayName("parse accepts wire names case-insensitively")
    void testParse() {
        assertEquals(Medium.TEXT, Medium.parse("text"));
        assertEquals(Medium.PDF, Medium.parse(" PDF "));
        assertEquals(Medium.AUDIO, Medium.parse("Audio"));
    }

    @Test
    @DisplayName("parse rejects blank and unknown values")
    void testParseRejects() {
        assertThrows(IllegalArgumentException.class, () -> Medium.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Medium.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> Medium.parse("video"));
    }

    @Test
    @DisplayName("JSON uses the lowercase wire name")
    void testJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"pdf\"", mapper.writeValueAsString(Medium.PDF));
        assertEquals(Medium.AUDIO, mapper.readValue("\"audio\"", Medium.class));
        assertEquals("text", Medium.TEXT.toString());
    }
}
