package com.biomodel.generator.model;

import lombok.Value;

/**
 * Forces {@code parameter} to take the value of {@code reference}.
 */
@Value
public class ParameterConstraint {
    String parameter;
    String reference;

    public String getStatement() {
        return parameter + " = " + reference;
    }
}
