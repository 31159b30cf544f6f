package com.biomodel.generator.model;

import lombok.Value;

/**
 * One signed contribution of a reaction rate to a species balance.
 * A scale, when present, multiplies the rate (compartment volume ratio).
 */
@Value
public class FluxTerm {
    int reactionLine;
    int coefficient;
    String scale;

    public static FluxTerm of(int reactionLine, int coefficient) {
        return new FluxTerm(reactionLine, coefficient, null);
    }

    public boolean isNegative() {
        return coefficient < 0;
    }

    String body() {
        int magnitude = Math.abs(coefficient);
        StringBuilder sb = new StringBuilder();
        if (magnitude != 1) {
            sb.append(magnitude).append('*');
        }
        sb.append("v[").append(reactionLine).append(']');
        if (scale != null) {
            sb.append("*(").append(scale).append(')');
        }
        return sb.toString();
    }

    /**
     * Rendering as the first term of an expression: {@code -2*v[1]}, {@code +v[4]}.
     */
    public String renderLeading() {
        return (isNegative() ? "-" : "+") + body();
    }

    /**
     * Rendering as a later term: {@code " + v[4]"}, {@code " - 2*v[3]"}.
     */
    public String renderFollowing() {
        return (isNegative() ? " - " : " + ") + body();
    }
}
