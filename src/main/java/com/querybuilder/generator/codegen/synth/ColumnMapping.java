package com.querybuilder.generator.codegen.synth;

import lombok.NonNull;
import lombok.Value;

/**
 * Logical field name to physical column name.
 */
@Value
public class ColumnMapping {

    @NonNull
    String logicalName;

    @NonNull
    String columnName;
}
