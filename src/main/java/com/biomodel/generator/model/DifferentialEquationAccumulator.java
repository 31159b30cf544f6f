package com.biomodel.generator.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects signed flux terms per species. Entries keep the order in which each
 * species was first touched; terms keep the order in which they were added.
 */
public class DifferentialEquationAccumulator {

    private final Map<String, List<FluxTerm>> entries = new LinkedHashMap<>();

    public void add(String species, FluxTerm term) {
        entries.computeIfAbsent(species, key -> new ArrayList<>()).add(term);
    }

    public boolean contains(String species) {
        return entries.containsKey(species);
    }

    public int size() {
        return entries.size();
    }

    public List<DifferentialEquation> toEquations() {
        List<DifferentialEquation> equations = new ArrayList<>(entries.size());
        entries.forEach((species, terms) -> equations.add(new DifferentialEquation(species, terms)));
        return equations;
    }
}
