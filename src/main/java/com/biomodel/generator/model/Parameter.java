package com.biomodel.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * A kinetic parameter introduced by one reaction line. Its symbol is the base
 * name followed by the line number, e.g. {@code kf3}.
 */
@Value
@Builder(toBuilder = true)
public class Parameter {
    String name;
    String baseName;
    int lineNumber;
    boolean excluded;
    String initialValue;
    Integer constraintLine;

    public static Parameter of(String baseName, int lineNumber) {
        return Parameter.builder()
                .name(baseName + lineNumber)
                .baseName(baseName)
                .lineNumber(lineNumber)
                .build();
    }

    public boolean isConstrained() {
        return constraintLine != null;
    }
}
