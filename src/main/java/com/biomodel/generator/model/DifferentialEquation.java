package com.biomodel.generator.model;

import java.util.List;

import lombok.Value;

@Value
public class DifferentialEquation {
    String species;
    List<FluxTerm> terms;

    public DifferentialEquation(String species, List<FluxTerm> terms) {
        this.species = species;
        this.terms = List.copyOf(terms);
    }

    public String getExpression() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            sb.append(i == 0 ? terms.get(i).renderLeading() : terms.get(i).renderFollowing());
        }
        return sb.toString();
    }

    /**
     * {@code dA/dt = -2*v[1] + v[4]}
     */
    public String getStatement() {
        return "d" + species + "/dt = " + getExpression();
    }
}
