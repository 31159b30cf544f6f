package com.biomodel.generator.model;

import lombok.Value;

@Value
public class ParameterInitializer {
    String parameter;
    String expression;

    /**
     * {@code kf2 = 0.5} or, for a constrained parameter, {@code kf5 = kf2}.
     */
    public String getStatement() {
        return parameter + " = " + expression;
    }
}
