package com.biomodel.generator.model;

import lombok.Value;

@Value
public class InitialCondition {
    String species;
    String value;

    public String getStatement() {
        return species + " = " + value;
    }
}
