package com.biomodel.generator.report;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

import com.biomodel.generator.model.DifferentialEquation;
import com.biomodel.generator.model.Parameter;

/**
 * Markdown rendering of rate laws and differential equations.
 */
@UtilityClass
public class MarkdownFormatter {

    private static final Pattern IDENTIFIER = Pattern.compile("(\\^?)([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern RATE_REFERENCE = Pattern.compile("v\\[(\\d+)]");
    private static final String MULTIPLY = "·";

    /**
     * {@code V7*TF^n7/(K7^n7 + TF^n7)} becomes
     * {@code V<sub>7</sub>·[TF]<sup>n<sub>7</sub></sup>/(K<sub>7</sub><sup>n<sub>7</sub></sup> + [TF]<sup>n<sub>7</sub></sup>)}.
     */
    public static String rateEquation(String rateLaw, Map<String, Parameter> parameters, Set<String> species) {
        Matcher matcher = IDENTIFIER.matcher(rateLaw);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            boolean exponent = !matcher.group(1).isEmpty();
            String name = matcher.group(2);
            String rendered;
            Parameter parameter = parameters.get(name);
            if (parameter != null) {
                rendered = parameter.getBaseName() + "<sub>" + parameter.getLineNumber() + "</sub>";
            } else if (species.contains(name)) {
                rendered = "[" + name + "]";
            } else {
                rendered = name;
            }
            if (exponent) {
                rendered = "<sup>" + rendered + "</sup>";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(rendered));
        }
        matcher.appendTail(sb);
        return sb.toString().replace("*", MULTIPLY);
    }

    /**
     * {@code dA/dt = -2*v[1] + v[4]} becomes {@code d[A]/dt = -2·_v_ <sub>1</sub> + _v_ <sub>4</sub>}.
     */
    public static String differentialEquation(DifferentialEquation equation) {
        String expression = RATE_REFERENCE.matcher(equation.getExpression()).replaceAll("_v_ <sub>$1</sub>");
        return "d[" + equation.getSpecies() + "]/dt = " + expression.replace("*", MULTIPLY);
    }
}
