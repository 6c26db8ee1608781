package com.querybuilder.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.querybuilder.generator.codegen.classify.TimePattern;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    boolean directoryMode;
    Path inputPath;
    /** Null in directory mode, where every output sits beside its schema. */
    Path outputPath;
    List<TimePattern> timePatterns;
}
