package com.biomodel.generator.config;

import org.apache.commons.lang3.StringUtils;

import lombok.Value;

/**
 * A user-defined trigger phrase for an existing rule, written {@code rule=phrase}.
 */
@Value
public class PhraseRegistration {
    String ruleId;
    String phrase;

    /**
     * @throws IllegalArgumentException if {@code text} is not of the form {@code rule=phrase}
     */
    public static PhraseRegistration parse(String text) {
        if (text == null || !text.contains("=")) {
            throw new IllegalArgumentException("Expected rule=phrase, got '" + text + "'");
        }
        String ruleId = StringUtils.substringBefore(text, "=").trim();
        String phrase = StringUtils.substringAfter(text, "=").trim();
        if (ruleId.isEmpty() || phrase.isEmpty()) {
            throw new IllegalArgumentException("Expected rule=phrase, got '" + text + "'");
        }
        return new PhraseRegistration(ruleId, phrase);
    }
}
