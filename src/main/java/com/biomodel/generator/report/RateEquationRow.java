package com.biomodel.generator.report;

import lombok.Value;

/**
 * One row of rate_equation.md.
 */
@Value
public class RateEquationRow {
    String number;
    String reaction;
    String rateEquation;
}
