package com.querybuilder.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.cli.exception.OptionsValidationException;
import com.querybuilder.generator.cli.model.GenerateOptions;
import com.querybuilder.generator.cli.model.ValidatedGenerateOptions;
import com.querybuilder.generator.cli.output.GenerateResultsPrinter;
import com.querybuilder.generator.cli.validation.GenerateOptionsValidator;
import com.querybuilder.generator.codegen.GeneratorConfig;
import com.querybuilder.generator.codegen.GeneratorResult;
import com.querybuilder.generator.codegen.QueryBuilderGenerator;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates Go query builders from schema documents.
 */
@Command(
        name = "querybuilder",
        mixinStandardHelpOptions = true,
        version = "querybuilder-generator 1.0.0",
        description = "Generates type-safe filter, updater and sort-option builders for annotated records."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);
    private static final String BASE_LOGGER = "com.querybuilder.generator";

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        if (options.isShowTypes()) {
            printer.printSupportedTypes();
            return 0;
        }

        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            GeneratorConfig config = GeneratorConfig.builder()
                    .inputFile(validated.isDirectoryMode() ? null : validated.getInputPath())
                    .inputDir(validated.isDirectoryMode() ? validated.getInputPath() : null)
                    .outputFile(validated.getOutputPath())
                    .suffix(options.getSuffix())
                    .dryRun(options.isDryRun())
                    .runtimeImport(options.getRuntimeImport())
                    .timeTypes(validated.getTimePatterns())
                    .build();

            GeneratorResult result = new QueryBuilderGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(options, result);
            return 0;
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 2;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(BASE_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
