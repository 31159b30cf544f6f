package com.biomodel.generator.individualization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Makes a model patient- or cell-line-specific by weighting gene expression
 * levels into protein amounts.
 *
 * <p>For each protein, the estimated level in a sample is
 * {@code sum(w_gene * tpm(gene, sample))} over its related genes, where each
 * {@code w_gene} is a model parameter. Inputs are never modified; every
 * operation returns new values.
 */
@Getter
public class Individualization {

    public static final String DEFAULT_PREFIX = "w_";

    private final List<String> parameters;
    private final List<String> species;
    private final ExpressionTable expression;
    private final Map<String, List<String>> structure;
    private final String prefix;

    /**
     * @param structure protein mapped to the genes that encode it
     */
    public Individualization(List<String> parameters, List<String> species, ExpressionTable expression,
                             Map<String, List<String>> structure) {
        this(parameters, species, expression, structure, DEFAULT_PREFIX);
    }

    public Individualization(List<String> parameters, List<String> species, ExpressionTable expression,
                             Map<String, List<String>> structure, String prefix) {
        this.parameters = List.copyOf(parameters);
        this.species = List.copyOf(species);
        this.expression = expression;
        this.structure = new LinkedHashMap<>(structure);
        this.prefix = prefix;
    }

    /**
     * Estimated protein levels in {@code sample}, in structure order.
     */
    public Map<String, Double> weightedSum(String sample, double[] x) {
        requireLength("parameter", x, parameters.size());
        Map<String, Double> sums = new LinkedHashMap<>();
        structure.forEach((protein, genes) -> {
            double sum = 0.0;
            for (String gene : genes) {
                sum += x[indexOf(parameters, prefix + gene, "parameters")] * expression.tpm(gene, sample);
            }
            sums.put(protein, sum);
        });
        return sums;
    }

    /**
     * Scales each protein's initial value by its estimated level.
     */
    public double[] asInitialCondition(String sample, double[] x, double[] y0) {
        requireLength("initial value", y0, species.size());
        Map<String, Double> sums = weightedSum(sample, x);
        double[] individualized = y0.clone();
        sums.forEach((protein, level) -> individualized[indexOf(species, protein, "species")] *= level);
        return individualized;
    }

    /**
     * Maximal transcription rate {@code parameterName} scaled by the estimated
     * level of {@code protein}.
     */
    public double asMaximalTranscriptionRate(String sample, double[] x, String parameterName, String protein) {
        Map<String, Double> sums = weightedSum(sample, x);
        Double level = sums.get(protein);
        if (level == null) {
            throw new IllegalArgumentException(protein + " has no related genes");
        }
        return x[indexOf(parameters, parameterName, "parameters")] * level;
    }

    private static int indexOf(List<String> names, String name, String kind) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("'" + name + "' is not defined in model " + kind);
        }
        return index;
    }

    private static void requireLength(String kind, double[] values, int expected) {
        if (values.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " " + kind + " values, got " + values.length);
        }
    }
}
