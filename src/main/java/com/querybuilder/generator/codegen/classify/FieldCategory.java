package com.querybuilder.generator.codegen.classify;

/**
 * Bounded semantic category a field type is classified into.
 */
public enum FieldCategory {
    STRING("string"),
    NUMERIC("numeric"),
    TIME("time"),
    BOOLEAN("bool"),
    POINTER("pointer"),
    SLICE("slice"),
    MAP("map"),
    AGGREGATE("struct"),
    UNKNOWN("unknown");

    private final String label;

    FieldCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
