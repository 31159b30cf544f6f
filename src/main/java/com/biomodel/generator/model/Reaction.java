package com.biomodel.generator.model;

import com.biomodel.generator.lexicon.ReactionRule;

import lombok.Value;

@Value
public class Reaction {
    int lineNumber;
    ReactionRule rule;
    String sentence;
    String rateLaw;

    /**
     * {@code v[3] = kf3*A*B - kr3*C}
     */
    public String getStatement() {
        return "v[" + lineNumber + "] = " + rateLaw;
    }
}
