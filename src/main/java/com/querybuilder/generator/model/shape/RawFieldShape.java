package com.querybuilder.generator.model.shape;

/**
 * Base class for the recursively described type of a record field.
 *
 * Pure structure only. Every subclass is immutable and reports its
 * {@link ShapeKind} so callers can match exhaustively.
 */
public abstract class RawFieldShape {

    public abstract ShapeKind getKind();

    /**
     * Source spelling of the type, e.g. {@code []string} or {@code map[string]int64}.
     */
    public abstract String getTypeName();

    /**
     * Spelling as written inside {@code consumingNamespace}: types declared
     * there are unqualified.
     */
    public String getTypeName(String consumingNamespace) {
        return getTypeName();
    }

    public abstract <R> R accept(TypeShapeVisitor<R> visitor);

    @Override
    public String toString() {
        return getKind() + "(" + getTypeName() + ")";
    }
}
