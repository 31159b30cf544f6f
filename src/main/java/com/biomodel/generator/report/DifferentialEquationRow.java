package com.biomodel.generator.report;

import lombok.Value;

@Value
public class DifferentialEquationRow {
    String number;
    String equation;
}
