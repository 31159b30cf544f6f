package com.biomodel.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.biomodel.generator.ConversionResult;
import com.biomodel.generator.ModelConverter;
import com.biomodel.generator.cli.exception.OptionsValidationException;
import com.biomodel.generator.cli.model.ConvertOptions;
import com.biomodel.generator.cli.model.ValidatedConvertOptions;
import com.biomodel.generator.cli.output.ConvertResultsPrinter;
import com.biomodel.generator.cli.validation.ConvertOptionsValidator;
import com.biomodel.generator.config.GeneratorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for compiling a biochemical reaction text into an ODE model.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        version = "text2ode-generator 1.0.0",
        description = "Compiles biochemical event sentences into rate equations and differential equations."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Found {} invalid option(s):", e.getErrorCount());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .modelFile(validated.getModelFile())
                .modelName(validated.getModelName())
                .registrations(validated.getRegistrations())
                .similarityThreshold(options.getSimilarityThreshold())
                .checkReferences(!options.isSkipReferenceCheck())
                .markdownDir(validated.getMarkdownDir())
                .reactionLimit(options.getReactionLimit())
                .build();

        ConversionResult result = new ModelConverter(config).convert();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }
}
