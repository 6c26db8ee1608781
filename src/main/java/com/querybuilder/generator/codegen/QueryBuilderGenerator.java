package com.querybuilder.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.codegen.classify.TimePatternTable;
import com.querybuilder.generator.codegen.classify.TypeClassifier;
import com.querybuilder.generator.codegen.exception.NoEligibleRecordsException;
import com.querybuilder.generator.codegen.render.QueryBuilderRenderer;
import com.querybuilder.generator.codegen.synth.MethodSynthesizer;
import com.querybuilder.generator.codegen.synth.RecordPlan;
import com.querybuilder.generator.codegen.synth.RecordPlanner;
import com.querybuilder.generator.codegen.util.FileWriteUtil;
import com.querybuilder.generator.model.RecordDescriptor;
import com.querybuilder.generator.model.SchemaModel;
import com.querybuilder.generator.parser.AnnotationDetector;
import com.querybuilder.generator.schema.SchemaLoader;

/**
 * Generates Go query builder sources from schema documents.
 */
public class QueryBuilderGenerator {
    private static final Logger log = LoggerFactory.getLogger(QueryBuilderGenerator.class);

    private static final String SCHEMA_EXTENSION = ".json";

    private final GeneratorConfig config;
    private final QueryBuilderRenderer renderer;
    private final MethodSynthesizer synthesizer = new MethodSynthesizer();

    public QueryBuilderGenerator(GeneratorConfig config) {
        this.config = config;
        this.renderer = new QueryBuilderRenderer(config.getRuntimeImport());
    }

    /**
     * Run generation for the configured file or directory.
     */
    public GeneratorResult generate() {
        try {
            if (config.isDirectoryMode()) {
                return generateDirectory(config.getInputDir());
            }

            Path input = config.getInputFile();
            Path output = config.getOutputFile() != null
                    ? config.getOutputFile() : FileWriteUtil.defaultOutputPath(input);
            GeneratorResult result = GeneratorResult.builder().success(true).build();
            generateFile(input, output, result);
            return result;
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private GeneratorResult generateDirectory(Path dir) throws IOException {
        log.info("Scanning {} for schema documents...", dir);
        List<Path> schemas = findSchemaFiles(dir);
        if (schemas.isEmpty()) {
            return GeneratorResult.failure("No schema files (*" + SCHEMA_EXTENSION + ") found in directory " + dir);
        }

        GeneratorResult result = GeneratorResult.builder().success(true).build();
        for (Path schema : schemas) {
            try {
                generateFile(schema, FileWriteUtil.defaultOutputPath(schema), result);
            } catch (Exception e) {
                log.warn("Skipped {}: {}", schema, e.getMessage());
                result.getFileErrors().add(schema + ": " + e.getMessage());
            }
        }

        log.info("Processed {} of {} schema files successfully", result.getSchemasProcessed(), schemas.size());
        if (result.getSchemasProcessed() == 0) {
            result.setSuccess(false);
            result.setErrorMessage("No schema file in " + dir + " could be generated");
        }
        return result;
    }

    static List<Path> findSchemaFiles(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SCHEMA_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private void generateFile(Path input, Path output, GeneratorResult result) throws IOException {
        log.info("Step 1: Loading schema {}...", input);
        SchemaModel schema = SchemaLoader.load(input);

        log.info("Step 2: Planning query builders...");
        List<RecordPlan> plans = plan(schema, input.toString());

        log.info("Step 3: Rendering {} record(s)...", plans.size());
        String source = renderer.render(schema.getPackageName(), schema.getImports(), plans,
                input.getFileName().toString());

        if (config.isDryRun()) {
            log.info("Dry run: would write {} ({} bytes)", output, source.length());
            log.debug("Generated source for {}:{}{}", output, System.lineSeparator(), source);
        } else {
            log.info("Step 4: Writing {}...", output);
            FileWriteUtil.safeWriteString(output, source);
        }

        result.getOutputPaths().add(output);
        result.setSchemasProcessed(result.getSchemasProcessed() + 1);
        for (RecordPlan plan : plans) {
            result.setRecordsGenerated(result.getRecordsGenerated() + 1);
            result.setFieldsClassified(result.getFieldsClassified() + plan.getFields().size());
            result.setFieldsSkipped(result.getFieldsSkipped() + plan.getSkippedFields().size());
            result.setFilterMethods(result.getFilterMethods() + plan.getFilterMethods().size());
            result.setUpdaterMethods(result.getUpdaterMethods() + plan.getUpdaterMethods().size());
            result.setOrderMethods(result.getOrderMethods() + plan.getOrderMethods().size());
        }
    }

    /**
     * Plans every annotated record of a schema, in declaration order, with the
     * configured suffix applied to record names.
     *
     * @throws NoEligibleRecordsException if no record is annotated
     */
    public List<RecordPlan> plan(SchemaModel schema, String sourceName) {
        TimePatternTable timePatterns = TimePatternTable.builder()
                .addAll(schema.getTimePatterns())
                .addAll(config.getTimeTypes())
                .build();
        RecordPlanner planner = new RecordPlanner(
                new TypeClassifier(timePatterns, schema.getPackageName()), synthesizer);

        List<RecordPlan> plans = new ArrayList<>();
        for (RecordDescriptor record : schema.getRecords()) {
            if (!AnnotationDetector.isAnnotated(record)) {
                log.debug("Record {} is not annotated, skipping", record.getName());
                continue;
            }
            RecordDescriptor named = config.hasSuffix() ? record.withName(record.getName() + config.getSuffix()) : record;
            plans.add(planner.plan(named));
        }

        if (plans.isEmpty()) {
            throw new NoEligibleRecordsException(sourceName);
        }
        return plans;
    }
}
