package com.biomodel.generator.parser;

import com.biomodel.generator.lexicon.ReactionRule;

import lombok.Builder;
import lombok.Value;

/**
 * A reaction line split around its trigger phrase.
 * For {@code "A binds B --> C | kf=1 | A=2"} and the bind rule the subject is
 * {@code A}, the object {@code B --> C}, the parameter clause {@code kf=1} and
 * the initial-value clause {@code A=2}.
 */
@Value
@Builder
public class ReactionLine {
    int lineNumber;
    String text;
    String sentence;
    ReactionRule rule;
    String phrase;
    String subject;
    String object;
    String parameterClause;
    String initialValueClause;

    public boolean hasParameterClause() {
        return parameterClause != null && !parameterClause.isEmpty();
    }

    public boolean hasInitialValueClause() {
        return initialValueClause != null && !initialValueClause.isEmpty();
    }
}
