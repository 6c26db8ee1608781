package com.querybuilder.generator.codegen.synth;

/**
 * Call shape of a synthesized method.
 */
public enum BodyKind {
    /**
     * Exactly one parameter of the field's type.
     */
    BINARY,

    /**
     * No parameters.
     */
    UNARY,

    /**
     * Zero or more values of the field's type.
     */
    VARIADIC
}
