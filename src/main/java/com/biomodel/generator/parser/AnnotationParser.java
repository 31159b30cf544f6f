package com.biomodel.generator.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.model.ObservableDescriptor;
import com.biomodel.generator.model.SimulationCondition;
import com.biomodel.generator.model.SimulationTimeSpan;
import com.biomodel.generator.parser.exception.AnnotationSyntaxException;
import com.biomodel.generator.parser.exception.NonNumericValueException;

/**
 * Handles {@code @obs} and {@code @sim} lines.
 */
public class AnnotationParser {

    private static final Pattern TSPAN = Pattern.compile("\\[([^,\\]]*),([^,\\]]*)]");
    private static final Pattern NON_NEGATIVE_INTEGER = Pattern.compile("\\d{1,9}");
    private static final String CONDITION_PREFIX = "condition ";

    public void parse(SourceLine line, ModelBuilder builder) {
        String text = line.getText();
        if (text.startsWith(LinePreprocessor.OBSERVABLE_PREFIX)) {
            parseObservable(line.getNumber(), text.substring(LinePreprocessor.OBSERVABLE_PREFIX.length()), builder);
        } else if (text.startsWith(LinePreprocessor.SIMULATION_PREFIX)) {
            parseSimulation(line.getNumber(), text.substring(LinePreprocessor.SIMULATION_PREFIX.length()), builder);
        } else {
            throw new AnnotationSyntaxException(line.getNumber(), "Not an annotation: '" + text + "'.");
        }
    }

    private void parseObservable(int lineNumber, String body, ModelBuilder builder) {
        String name = StringUtils.substringBefore(body, "=").trim();
        String expression = StringUtils.substringAfter(body, "=").trim();
        if (!body.contains("=") || name.isEmpty() || expression.isEmpty()) {
            throw new AnnotationSyntaxException(lineNumber,
                    "Observables are written as '@obs name = expression'.");
        }
        builder.addObservable(new ObservableDescriptor(name, expression, lineNumber));
    }

    private void parseSimulation(int lineNumber, String body, ModelBuilder builder) {
        if (StringUtils.countMatches(body, ':') != 1) {
            throw new AnnotationSyntaxException(lineNumber, "@sim lines take exactly one ':'.");
        }
        String key = StringUtils.substringBefore(body, ":").trim();
        String value = StringUtils.substringAfter(body, ":").trim();

        if (key.equals("tspan")) {
            parseTimeSpan(lineNumber, value, builder);
        } else if (key.equals("unperturbed")) {
            requireStatements(lineNumber, key, value);
            builder.addUnperturbed(value);
        } else if (key.startsWith(CONDITION_PREFIX)) {
            String name = key.substring(CONDITION_PREFIX.length()).trim();
            if (name.isEmpty()) {
                throw new AnnotationSyntaxException(lineNumber, "Name the condition: '@sim condition NAME: ...'.");
            }
            requireStatements(lineNumber, key, value);
            builder.addCondition(new SimulationCondition(name, value, lineNumber));
        } else {
            throw new AnnotationSyntaxException(lineNumber, "Unknown option '" + key
                    + "'. Available options are '@sim tspan:', '@sim unperturbed:' or '@sim condition NAME:'.");
        }
    }

    private void parseTimeSpan(int lineNumber, String value, ModelBuilder builder) {
        if (builder.hasTimeSpan()) {
            throw new AnnotationSyntaxException(lineNumber, "tspan is already defined.");
        }
        Matcher matcher = TSPAN.matcher(value);
        if (!matcher.matches()) {
            throw new AnnotationSyntaxException(lineNumber,
                    "tspan must be a two element vector [t0, tf] specifying the initial and final times.");
        }
        long start = parseTime(lineNumber, "t0", matcher.group(1).trim());
        long end = parseTime(lineNumber, "tf", matcher.group(2).trim());
        if (end < start) {
            throw new AnnotationSyntaxException(lineNumber, "tf must not be less than t0 in tspan.");
        }
        builder.setTimeSpan(new SimulationTimeSpan(start, end));
    }

    private static long parseTime(int lineNumber, String label, String value) {
        if (!ClauseExtractor.isNumeric(value)) {
            throw new NonNumericValueException(lineNumber, label, value);
        }
        if (!NON_NEGATIVE_INTEGER.matcher(value).matches()) {
            throw new AnnotationSyntaxException(lineNumber, label + " must be a non-negative integer, got '" + value + "'.");
        }
        return Long.parseLong(value);
    }

    private static void requireStatements(int lineNumber, String key, String value) {
        if (value.isEmpty()) {
            throw new AnnotationSyntaxException(lineNumber, "'@sim " + key + ":' has no statements.");
        }
    }
}
