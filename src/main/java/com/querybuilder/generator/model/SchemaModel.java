package com.querybuilder.generator.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.querybuilder.generator.codegen.classify.TimePattern;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A loaded schema document: the records of one package plus the settings
 * that travel with them.
 */
@Value
@Builder(toBuilder = true)
public class SchemaModel {

    /**
     * Where the document was read from, if anywhere.
     */
    Path sourcePath;

    @NonNull
    String packageName;

    /**
     * Import alias to import path.
     */
    @Singular("importPath")
    Map<String, String> imports;

    /**
     * Time patterns contributed by the document, appended after the built-ins.
     */
    @Singular
    List<TimePattern> timePatterns;

    @Singular
    List<RecordDescriptor> records;
}
