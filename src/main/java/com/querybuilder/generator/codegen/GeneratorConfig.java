package com.querybuilder.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.querybuilder.generator.codegen.classify.TimePattern;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for the query builder generator.
 */
@Data
@Builder
public class GeneratorConfig {
    /** Single schema document; mutually exclusive with {@link #inputDir}. */
    private Path inputFile;
    /** Directory scanned recursively for {@code *.json} schema documents. */
    private Path inputDir;
    /** Single-file mode only; defaults to {@code <base>_querybuilder.go} beside the input. */
    private Path outputFile;
    private String suffix;
    private boolean dryRun;
    private String runtimeImport;
    /** Extra time patterns, appended after the built-ins and the document's own. */
    @Singular
    private List<TimePattern> timeTypes;

    public boolean isDirectoryMode() {
        return inputDir != null;
    }

    public boolean hasSuffix() {
        return suffix != null && !suffix.isEmpty();
    }
}
