package com.querybuilder.generator.codegen.synth;

/**
 * Which body template renders a method.
 */
public enum BodyTemplate {
    /** Appends a runtime filter for the field's column. */
    FILTER,
    /** Records the new value in the change set. */
    CHANGE,
    /** Appends a sort field option. */
    SORT
}
