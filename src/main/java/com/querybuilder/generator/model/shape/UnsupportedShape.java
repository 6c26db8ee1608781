package com.querybuilder.generator.model.shape;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A type the query builder has no semantics for. Classified as unknown.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class UnsupportedShape extends RawFieldShape {

    @NonNull
    String typeName;

    /**
     * What kind of construct this was ("array", "chan", "type parameter", ...).
     */
    @NonNull
    String reason;

    @Override
    public ShapeKind getKind() {
        return ShapeKind.UNSUPPORTED;
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
