package com.biomodel.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.ConversionResult;
import com.biomodel.generator.cli.model.ConvertOptions;
import com.biomodel.generator.cli.model.ValidatedConvertOptions;
import com.biomodel.generator.config.PhraseRegistration;
import com.biomodel.generator.model.OdeModel;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("Text to ODE Model Converter");
        log.info("=================================================");
        log.info("Model Name: {}", v.getModelName());
        log.info("Model File: {}", v.getModelFile());
        log.info("Similarity Threshold: {}", o.getSimilarityThreshold());
        log.info("Reference Check: {}", o.isSkipReferenceCheck() ? "skipped" : "enabled");
        log.info("Markdown Directory: {}", v.getMarkdownDir() != null ? v.getMarkdownDir() : "None");
        if (!v.getRegistrations().isEmpty()) {
            log.info("-------------------------------------------------");
            log.info("User-defined Rule Words:");
            for (PhraseRegistration registration : v.getRegistrations()) {
                log.info("  {} <- '{}'", registration.getRuleId(), registration.getPhrase());
            }
        }
        log.info("=================================================");
    }

    public void printSuccess(ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Model Information:");
        log.info("  Reactions: {}", result.getReactionCount());
        log.info("  Species: {}", result.getSpeciesCount());
        log.info("  Parameters: {} ({} excluded)", result.getParameterCount(), result.getExcludedParameterCount());
        log.info("  Observables: {}", result.getObservableCount());
        log.info("  Conditions: {}", result.getConditionCount());

        OdeModel model = result.getModel();
        if (model != null && model.hasTimeSpan()) {
            log.info("  Time Span: [{}, {}]", model.getTimeSpan().getStart(), model.getTimeSpan().getEnd());
        }
        if (result.getReportPath() != null) {
            log.info("");
            log.info("Markdown Report: {}", result.getReportPath());
        }
        log.info("=================================================");
    }

    public void printFailure(ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }
}
