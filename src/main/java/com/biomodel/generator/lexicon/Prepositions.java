package com.biomodel.generator.lexicon;

import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Prepositions that may end a trigger phrase ("is dissociated into") and are
 * ignored when deciding which rule a sentence describes.
 */
@UtilityClass
public class Prepositions {

    // Longer forms first so "into" wins over "to"
    static final List<String> PREPOSITIONS = List.of(
            "towards", "through", "between", "across", "toward", "within", "inside",
            "into", "onto", "with", "from", "upon", "over",
            "of", "to", "by", "in", "on", "at", "for", "via");

    /**
     * " is dissociated into" -> " is dissociated". Phrases without a trailing
     * preposition are returned unchanged.
     */
    public static String stripTrailing(String phrase) {
        for (String preposition : PREPOSITIONS) {
            String suffix = " " + preposition;
            if (phrase.endsWith(suffix) && phrase.length() > suffix.length()) {
                return phrase.substring(0, phrase.length() - suffix.length());
            }
        }
        return phrase;
    }

    /**
     * "to nucleus" -> "nucleus".
     */
    public static String stripLeading(String fragment) {
        String trimmed = fragment.trim();
        for (String preposition : PREPOSITIONS) {
            if (trimmed.startsWith(preposition + " ")) {
                return trimmed.substring(preposition.length() + 1).trim();
            }
        }
        return trimmed;
    }
}
