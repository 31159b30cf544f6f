package com.biomodel.generator.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of a single model build. Owned by one parse call and handed to
 * every reaction handler; frozen by {@link #build()}, after which any mutation
 * fails.
 */
public class ModelBuilder {

    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private final Set<String> species = new LinkedHashSet<>();
    private final List<Reaction> reactions = new ArrayList<>();
    private final DifferentialEquationAccumulator equations = new DifferentialEquationAccumulator();
    private final List<ParameterInitializer> parameterInitializers = new ArrayList<>();
    private final List<InitialCondition> initialConditions = new ArrayList<>();
    private final List<ParameterConstraint> parameterConstraints = new ArrayList<>();
    private final List<ProteinPair> proteinPairs = new ArrayList<>();
    private final List<ObservableDescriptor> observables = new ArrayList<>();
    private final List<SimulationCondition> conditions = new ArrayList<>();
    private final List<String> unperturbed = new ArrayList<>();
    private SimulationTimeSpan timeSpan;
    private boolean built;

    // ---------------------------------------------------------------- parameters

    /**
     * Registers {@code base + line} for each base name; already known symbols are kept.
     */
    public void registerParameters(int lineNumber, List<String> baseNames) {
        ensureOpen();
        for (String baseName : baseNames) {
            Parameter parameter = Parameter.of(baseName, lineNumber);
            parameters.putIfAbsent(parameter.getName(), parameter);
        }
    }

    public boolean hasParameter(String name) {
        return parameters.containsKey(name);
    }

    public void assignParameter(String name, String value, boolean excluded) {
        ensureOpen();
        Parameter parameter = requireParameter(name);
        parameters.put(name, parameter.toBuilder()
                .initialValue(value)
                .excluded(parameter.isExcluded() || excluded)
                .build());
        parameterInitializers.add(new ParameterInitializer(name, value));
    }

    /**
     * Binds {@code name} to {@code reference}; the bound parameter is excluded.
     */
    public void constrainParameter(String name, String reference, int referencedLine) {
        ensureOpen();
        Parameter parameter = requireParameter(name);
        parameters.put(name, parameter.toBuilder()
                .excluded(true)
                .constraintLine(referencedLine)
                .build());
        parameterInitializers.add(new ParameterInitializer(name, reference));
        parameterConstraints.add(new ParameterConstraint(name, reference));
    }

    private Parameter requireParameter(String name) {
        Parameter parameter = parameters.get(name);
        if (parameter == null) {
            throw new IllegalStateException("Parameter " + name + " has not been registered");
        }
        return parameter;
    }

    // ------------------------------------------------------------------- species

    public void registerSpecies(String... names) {
        ensureOpen();
        for (String name : names) {
            species.add(name);
        }
    }

    public boolean hasSpecies(String name) {
        return species.contains(name);
    }

    public void addInitialCondition(String speciesName, String value) {
        ensureOpen();
        initialConditions.add(new InitialCondition(speciesName, value));
    }

    // ----------------------------------------------------------------- reactions

    public void addReaction(Reaction reaction) {
        ensureOpen();
        reactions.add(reaction);
    }

    public void addFlux(String speciesName, FluxTerm term) {
        ensureOpen();
        equations.add(speciesName, term);
    }

    public void recordPhosphorylation(String unphosphorylated, String phosphorylated) {
        ensureOpen();
        proteinPairs.add(new ProteinPair(unphosphorylated, phosphorylated));
    }

    public List<ProteinPair> getProteinPairs() {
        return List.copyOf(proteinPairs);
    }

    // --------------------------------------------------------------- annotations

    public void addObservable(ObservableDescriptor observable) {
        ensureOpen();
        observables.add(observable);
    }

    public boolean hasTimeSpan() {
        return timeSpan != null;
    }

    public void setTimeSpan(SimulationTimeSpan timeSpan) {
        ensureOpen();
        this.timeSpan = timeSpan;
    }

    public void addCondition(SimulationCondition condition) {
        ensureOpen();
        conditions.add(condition);
    }

    public void addUnperturbed(String statementText) {
        ensureOpen();
        unperturbed.add(statementText);
    }

    // --------------------------------------------------------------------- build

    public OdeModel build() {
        ensureOpen();
        built = true;
        return OdeModel.builder()
                .parameters(List.copyOf(parameters.values()))
                .species(List.copyOf(species))
                .reactions(List.copyOf(reactions))
                .differentialEquations(List.copyOf(equations.toEquations()))
                .parameterInitializers(List.copyOf(parameterInitializers))
                .initialConditions(List.copyOf(initialConditions))
                .parameterConstraints(List.copyOf(parameterConstraints))
                .proteinPairs(List.copyOf(proteinPairs))
                .observables(List.copyOf(observables))
                .timeSpan(timeSpan)
                .conditions(List.copyOf(conditions))
                .unperturbed(unperturbed.isEmpty() ? null : String.join("; ", unperturbed))
                .build();
    }

    public boolean isBuilt() {
        return built;
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Model has already been built");
        }
    }
}
