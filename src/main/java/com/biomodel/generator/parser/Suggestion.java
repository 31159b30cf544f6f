package com.biomodel.generator.parser;

import lombok.Value;

/**
 * Closest registered trigger phrase to an unrecognized sentence.
 */
@Value
public class Suggestion {
    /** Registered phrase, without its leading space. */
    String phrase;
    /** Exact substring of the sentence the phrase was compared against. */
    String matchedText;
    double score;
}
