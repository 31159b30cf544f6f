package com.biomodel.generator.parser;

import lombok.Value;

/**
 * One physical input line with its normalized text.
 */
@Value
public class SourceLine {
    int number;
    String raw;
    String text;
    LineKind kind;

    public boolean isBlank() {
        return kind == LineKind.BLANK;
    }
}
