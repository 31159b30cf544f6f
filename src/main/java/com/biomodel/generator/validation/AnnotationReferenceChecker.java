package com.biomodel.generator.validation;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.model.ObservableDescriptor;
import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.model.SimulationCondition;
import com.biomodel.generator.parser.exception.UndefinedSpeciesException;
import com.biomodel.generator.parser.exception.UnknownParameterException;

/**
 * Verifies that names referenced from annotations exist in the model.
 *
 * References:
 * - p[name]: model parameter, allowed everywhere
 * - u[name]: species time course, allowed in observables
 * - init[name]: species initial value, allowed in conditions and unperturbed statements
 */
public class AnnotationReferenceChecker {
    private static final Logger log = LoggerFactory.getLogger(AnnotationReferenceChecker.class);

    private static final Pattern PARAMETER_REF = Pattern.compile("\\bp\\[([^\\]]*)]");
    private static final Pattern SPECIES_REF = Pattern.compile("\\bu\\[([^\\]]*)]");
    private static final Pattern INITIAL_REF = Pattern.compile("\\binit\\[([^\\]]*)]");

    public void check(OdeModel model) {
        List<String> parameters = model.getParameterNames();
        List<String> species = model.getSpecies();

        for (ObservableDescriptor observable : model.getObservables()) {
            checkParameters(observable.getLineNumber(), observable.getExpression(), parameters);
            checkSpecies(observable.getLineNumber(), observable.getExpression(), SPECIES_REF, species);
        }
        for (SimulationCondition condition : model.getConditions()) {
            checkParameters(condition.getLineNumber(), condition.getStatementText(), parameters);
            checkSpecies(condition.getLineNumber(), condition.getStatementText(), INITIAL_REF, species);
        }
        if (model.hasUnperturbed()) {
            checkParameters(0, model.getUnperturbed(), parameters);
            checkSpecies(0, model.getUnperturbed(), INITIAL_REF, species);
        }
        log.debug("Annotation references verified: {} observables, {} conditions",
                model.getObservables().size(), model.getConditions().size());
    }

    private static void checkParameters(int lineNumber, String text, List<String> parameters) {
        Matcher matcher = PARAMETER_REF.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!parameters.contains(name)) {
                throw new UnknownParameterException(lineNumber, name);
            }
        }
    }

    private static void checkSpecies(int lineNumber, String text, Pattern reference, List<String> species) {
        Matcher matcher = reference.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!species.contains(name)) {
                throw UndefinedSpeciesException.notInModel(lineNumber, name);
            }
        }
    }
}
