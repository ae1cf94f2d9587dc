package org.calista.theorysynth.text;

import java.util.List;

/**
 * Splits text into normalized lowercase tokens.
 *
 * Implementations must be deterministic and stateless: the same input always yields
 * the same token list, and one instance may be shared across threads.
 */
public interface Tokenizer {
    List<String> tokenize(String text);
}
