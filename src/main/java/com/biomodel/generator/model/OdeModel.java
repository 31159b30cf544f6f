package com.biomodel.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable result of one model build: every collection is ordered by first
 * textual appearance in the source, and nothing here references the source
 * text again.
 */
@Value
@Builder
public class OdeModel {
    List<Parameter> parameters;
    List<String> species;
    List<Reaction> reactions;
    List<DifferentialEquation> differentialEquations;
    List<ParameterInitializer> parameterInitializers;
    List<InitialCondition> initialConditions;
    List<ParameterConstraint> parameterConstraints;
    List<ProteinPair> proteinPairs;
    List<ObservableDescriptor> observables;
    SimulationTimeSpan timeSpan;
    List<SimulationCondition> conditions;
    String unperturbed;

    public List<String> getParameterNames() {
        return parameters.stream().map(Parameter::getName).toList();
    }

    /**
     * Parameters fixed at their declared value: zero, {@code const}, or bound
     * to another line.
     */
    public List<String> getExcludedParameters() {
        return parameters.stream()
                .filter(Parameter::isExcluded)
                .map(Parameter::getName)
                .toList();
    }

    public Optional<Parameter> findParameter(String name) {
        return parameters.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Optional<DifferentialEquation> findEquation(String species) {
        return differentialEquations.stream().filter(eq -> eq.getSpecies().equals(species)).findFirst();
    }

    public boolean hasTimeSpan() {
        return timeSpan != null;
    }

    public boolean hasUnperturbed() {
        return unperturbed != null && !unperturbed.isEmpty();
    }
}
