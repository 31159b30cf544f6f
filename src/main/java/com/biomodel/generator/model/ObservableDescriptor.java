package com.biomodel.generator.model;

import lombok.Value;

@Value
public class ObservableDescriptor {
    String name;
    String expression;
    int lineNumber;
}
