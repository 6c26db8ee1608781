package com.querybuilder.generator.model.shape;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A struct literal type. Its members are never inspected.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class AggregateShape extends RawFieldShape {

    @NonNull
    String typeName;

    @Override
    public ShapeKind getKind() {
        return ShapeKind.AGGREGATE;
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitAggregate(this);
    }
}
