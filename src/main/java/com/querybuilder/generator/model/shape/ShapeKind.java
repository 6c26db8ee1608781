package com.querybuilder.generator.model.shape;

/**
 * Discriminant of a {@link RawFieldShape}.
 */
public enum ShapeKind {
    PRIMITIVE,
    POINTER,
    SLICE,
    MAP,
    NAMED,
    AGGREGATE,

    /**
     * Arrays, channels, functions, interfaces and unbound type parameters.
     */
    UNSUPPORTED
}
