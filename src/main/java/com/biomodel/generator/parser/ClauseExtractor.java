package com.biomodel.generator.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.model.ModelBuilder;
import com.biomodel.generator.parser.exception.DanglingReferenceException;
import com.biomodel.generator.parser.exception.MalformedSentenceException;
import com.biomodel.generator.parser.exception.NonNumericValueException;
import com.biomodel.generator.parser.exception.UndefinedSpeciesException;
import com.biomodel.generator.parser.exception.UnknownParameterException;

/**
 * Interprets the parameter clause and the initial-value clause of a reaction line.
 *
 * <p>A parameter clause is either a list of {@code name=value} assignments
 * ({@code kf=0.5, const kr=1}) or a single line number whose parameters the
 * current line's parameters are bound to ({@code 3}).
 */
public class ClauseExtractor {
    private static final Logger log = LoggerFactory.getLogger(ClauseExtractor.class);

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern LINE_REFERENCE = Pattern.compile("\\d{1,9}");
    private static final String CONST_PREFIX = "const ";

    public static boolean isNumeric(String value) {
        return value != null && NUMBER.matcher(value.trim()).matches();
    }

    public void applyParameterClause(ReactionLine line, List<String> parameterNames, ModelBuilder builder) {
        if (!line.hasParameterClause()) {
            return;
        }
        String clause = line.getParameterClause();
        if (LINE_REFERENCE.matcher(clause).matches()) {
            constrain(line.getLineNumber(), Integer.parseInt(clause), parameterNames, builder);
        } else {
            assign(line.getLineNumber(), clause, parameterNames, builder);
        }
    }

    private void constrain(int lineNumber, int referencedLine, List<String> parameterNames, ModelBuilder builder) {
        List<String> missing = new ArrayList<>();
        for (String baseName : parameterNames) {
            if (referencedLine == lineNumber || !builder.hasParameter(baseName + referencedLine)) {
                missing.add(baseName + referencedLine);
            }
        }
        if (!missing.isEmpty()) {
            throw new DanglingReferenceException(lineNumber, referencedLine, missing);
        }
        for (String baseName : parameterNames) {
            builder.constrainParameter(baseName + lineNumber, baseName + referencedLine, referencedLine);
        }
        log.debug("line {}: parameters bound to line {}", lineNumber, referencedLine);
    }

    private void assign(int lineNumber, String clause, List<String> parameterNames, ModelBuilder builder) {
        Set<String> seen = new HashSet<>();
        for (String token : clause.split(",")) {
            String assignment = token.trim();
            int eq = assignment.indexOf('=');
            if (eq < 0) {
                throw new MalformedSentenceException(lineNumber, "=",
                        "to set a parameter value, e.g. 'kf=1.0'. Got '" + assignment + "'.");
            }
            String name = assignment.substring(0, eq).trim();
            String value = assignment.substring(eq + 1).trim();

            boolean fixed = false;
            if (name.startsWith(CONST_PREFIX)) {
                name = name.substring(CONST_PREFIX.length()).trim();
                fixed = true;
            }
            if (!parameterNames.contains(name)) {
                throw new UnknownParameterException(lineNumber, name, parameterNames);
            }
            if (!seen.add(name)) {
                throw new MalformedSentenceException(lineNumber,
                        "'" + name + "' is assigned more than once.");
            }
            if (!isNumeric(value)) {
                throw new NonNumericValueException(lineNumber, "Value of '" + name + "'", value);
            }
            boolean excluded = fixed || Double.parseDouble(value) == 0.0;
            builder.assignParameter(name + lineNumber, value, excluded);
        }
    }

    /**
     * @param reactionSpecies every species name written in the reaction sentence
     */
    public void applyInitialValueClause(ReactionLine line, List<String> reactionSpecies, ModelBuilder builder) {
        if (!line.hasInitialValueClause()) {
            return;
        }
        int lineNumber = line.getLineNumber();
        Set<String> seen = new HashSet<>();
        for (String token : line.getInitialValueClause().split(",")) {
            String assignment = token.trim();
            int eq = assignment.indexOf('=');
            if (eq < 0) {
                throw new MalformedSentenceException(lineNumber, "=",
                        "to set an initial value, e.g. 'A=1.0'. Got '" + assignment + "'.");
            }
            String species = assignment.substring(0, eq).trim();
            String value = assignment.substring(eq + 1).trim();
            if (!reactionSpecies.contains(species)) {
                throw UndefinedSpeciesException.notInReaction(lineNumber, species);
            }
            if (!seen.add(species)) {
                throw new MalformedSentenceException(lineNumber,
                        "Initial value of '" + species + "' is assigned more than once.");
            }
            if (!isNumeric(value)) {
                throw new NonNumericValueException(lineNumber, "Initial value of '" + species + "'", value);
            }
            builder.addInitialCondition(species, value);
        }
    }
}
