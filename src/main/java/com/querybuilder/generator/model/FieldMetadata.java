package com.querybuilder.generator.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Tag-derived settings of a field.
 *
 * Pure structure only. Produced by the tag parser, read by the classifier.
 */
@Value
@Builder(toBuilder = true)
public class FieldMetadata {

    public static final FieldMetadata EMPTY = FieldMetadata.builder().build();

    /**
     * Explicit column name override, or null when the default naming applies.
     */
    String columnName;

    /**
     * Whether the field carries the exclusion marker.
     */
    boolean excluded;

    /**
     * All parsed settings, keys upper-cased.
     */
    @NonNull
    @Builder.Default
    Map<String, String> settings = Map.of();
}
