package com.biomodel.generator.model;

import lombok.Value;

@Value
public class SimulationTimeSpan {
    long start;
    long end;
}
