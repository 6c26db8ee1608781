package com.querybuilder.generator.cli.output;

import java.nio.file.Path;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.cli.model.GenerateOptions;
import com.querybuilder.generator.cli.model.ValidatedGenerateOptions;
import com.querybuilder.generator.codegen.GeneratorResult;
import com.querybuilder.generator.codegen.classify.FieldCategory;
import com.querybuilder.generator.codegen.classify.TimePatternTable;
import com.querybuilder.generator.codegen.field.FieldModel;
import com.querybuilder.generator.codegen.field.Operator;

/**
 * Responsible only for printing CLI output for the generate command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Query Builder Generator");
        log.info("=================================================");
        log.info("{}: {}", v.isDirectoryMode() ? "Schema Directory" : "Schema File", v.getInputPath());
        if (v.getOutputPath() != null) {
            log.info("Output File: {}", v.getOutputPath());
        }
        log.info("Record Suffix: {}", o.getSuffix() != null && !o.getSuffix().isEmpty() ? o.getSuffix() : "None");
        log.info("Runtime Import: {}", o.getRuntimeImport());
        if (!v.getTimePatterns().isEmpty()) {
            log.info("Extra Time Types: {}", v.getTimePatterns().size());
        }
        if (o.isDryRun()) {
            log.info("Dry Run: nothing will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info(o.isDryRun() ? "DRY RUN COMPLETE" : "GENERATION SUCCESSFUL");
        log.info("=================================================");
        for (Path output : result.getOutputPaths()) {
            log.info("Output: {}", output.toAbsolutePath());
        }
        log.info("Schemas Processed: {}", result.getSchemasProcessed());
        log.info("Records Generated: {}", result.getRecordsGenerated());
        log.info("Fields Classified: {}", result.getFieldsClassified());
        log.info("Fields Skipped: {}", result.getFieldsSkipped());
        log.info("");
        log.info("Methods Summary:");
        log.info("  Filter: {}", result.getFilterMethods());
        log.info("  Updater: {}", result.getUpdaterMethods());
        log.info("  Order: {}", result.getOrderMethods());

        if (!result.getFileErrors().isEmpty()) {
            log.warn("");
            log.warn("{} schema file(s) were skipped:", result.getFileErrors().size());
            for (String error : result.getFileErrors()) {
                log.warn("  {}", error);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        for (String error : result.getFileErrors()) {
            log.error("  {}", error);
        }
    }

    public void printSupportedTypes() {
        log.info("Filterable field categories:");
        for (FieldCategory category : FieldModel.filterableCategories()) {
            log.info("  {} -> {}", category.getLabel(), FieldModel.operatorsFor(category).stream()
                    .map(Operator::getSymbol)
                    .collect(Collectors.joining(" ")));
        }
        log.info("");
        log.info("Non-filterable field categories (updater only):");
        for (FieldCategory category : FieldModel.nonFilterableCategories()) {
            log.info("  {}", category.getLabel());
        }
        log.info("");
        log.info("Built-in time types:");
        TimePatternTable.defaults().getPatterns().forEach(p ->
                log.info("  {}{}", p.getExactTypeName(), p.isOrderable() ? "" : " (unordered)"));
    }
}
