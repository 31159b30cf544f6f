package com.biomodel.generator.parser;

public enum LineKind {
    BLANK,
    ANNOTATION,
    REACTION
}
