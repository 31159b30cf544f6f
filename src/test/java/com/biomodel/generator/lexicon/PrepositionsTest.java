package com.biomodel.generator.lexicon;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class PrepositionsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            " is dissociated into| is dissociated",
            " is translated into| is translated",
            " forms complexes with| forms complexes",
            " promotes synthesis of| promotes synthesis",
            " binds| binds",
            " is degraded| is degraded"
    }, ignoreLeadingAndTrailingWhitespace = false)
    void testStripTrailing(String phrase, String expected) {
        assertThat(Prepositions.stripTrailing(phrase)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "to nucleus|nucleus",
            "into A and B|A and B",
            "tomato|tomato",
            "A and B|A and B"
    })
    void testStripLeading(String fragment, String expected) {
        assertThat(Prepositions.stripLeading(fragment)).isEqualTo(expected);
    }
}
