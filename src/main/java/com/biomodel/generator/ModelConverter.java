package com.biomodel.generator;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.config.GeneratorConfig;
import com.biomodel.generator.config.PhraseRegistration;
import com.biomodel.generator.lexicon.LexiconConfigurationException;
import com.biomodel.generator.lexicon.RuleLexicon;
import com.biomodel.generator.model.OdeModel;
import com.biomodel.generator.parser.ModelTextParser;
import com.biomodel.generator.parser.exception.ModelBuildException;
import com.biomodel.generator.report.MarkdownReportGenerator;
import com.biomodel.generator.validation.AnnotationReferenceChecker;

/**
 * Converts a model text into an ODE model and, optionally, a Markdown report.
 */
public class ModelConverter {
    private static final Logger log = LoggerFactory.getLogger(ModelConverter.class);

    private final GeneratorConfig config;
    private final AnnotationReferenceChecker referenceChecker;
    private final MarkdownReportGenerator reportGenerator;

    public ModelConverter(GeneratorConfig config) {
        this.config = config;
        this.referenceChecker = new AnnotationReferenceChecker();
        this.reportGenerator = new MarkdownReportGenerator();
    }

    public ConversionResult convert() {
        try {
            log.info("Starting model conversion...");

            // Step 1: Rule vocabulary
            log.info("Step 1: Preparing rule vocabulary...");
            RuleLexicon lexicon = new RuleLexicon();
            for (PhraseRegistration registration : config.getRegistrations()) {
                lexicon.register(registration.getRuleId(), registration.getPhrase());
                log.info("  Registered '{}' for {}", registration.getPhrase(), registration.getRuleId());
            }

            // Step 2: Parse
            log.info("Step 2: Parsing {}...", config.getModelFile());
            ModelTextParser parser = new ModelTextParser(lexicon, config.getSimilarityThreshold());
            OdeModel model = parser.parse(config.getModelFile());

            // Step 3: Annotation references
            if (config.isCheckReferences()) {
                log.info("Step 3: Checking annotation references...");
                referenceChecker.check(model);
            } else {
                log.info("Step 3: Skipping annotation reference check");
            }

            // Step 4: Markdown
            Path reportPath = null;
            if (config.isMarkdownEnabled()) {
                log.info("Step 4: Writing Markdown report...");
                reportPath = reportGenerator.generate(model, config.getModelName(),
                        config.getMarkdownDir(), config.getReactionLimit());
            }

            return ConversionResult.builder()
                    .success(true)
                    .model(model)
                    .reportPath(reportPath)
                    .reactionCount(model.getReactions().size())
                    .speciesCount(model.getSpecies().size())
                    .parameterCount(model.getParameters().size())
                    .excludedParameterCount(model.getExcludedParameters().size())
                    .observableCount(model.getObservables().size())
                    .conditionCount(model.getConditions().size())
                    .build();

        } catch (ModelBuildException e) {
            log.debug("Model build failed", e);
            return ConversionResult.failure(e.getMessage(), e.getLineNumber());
        } catch (LexiconConfigurationException e) {
            return ConversionResult.failure(e.getMessage());
        } catch (IOException e) {
            log.debug("I/O failure during conversion", e);
            return ConversionResult.failure("I/O error: " + e.getMessage());
        }
    }
}
