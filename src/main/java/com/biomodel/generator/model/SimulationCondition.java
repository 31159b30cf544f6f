package com.biomodel.generator.model;

import java.util.Arrays;
import java.util.List;

import lombok.Value;

/**
 * A named perturbation, e.g. {@code condition EGF: init[EGF] = 10}.
 */
@Value
public class SimulationCondition {
    String name;
    String statementText;
    int lineNumber;

    public List<String> getStatements() {
        return Arrays.stream(statementText.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
