package com.querybuilder.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    /** Files written, or that would be written in dry-run mode. */
    @Builder.Default
    private List<Path> outputPaths = new ArrayList<>();
    /** Per-file failures in directory mode, as {@code path: message}. */
    @Builder.Default
    private List<String> fileErrors = new ArrayList<>();

    private int schemasProcessed;
    private int recordsGenerated;
    private int fieldsClassified;
    private int fieldsSkipped;
    private int filterMethods;
    private int updaterMethods;
    private int orderMethods;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
