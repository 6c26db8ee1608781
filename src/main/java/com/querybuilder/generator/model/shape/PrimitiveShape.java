package com.querybuilder.generator.model.shape;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A predeclared basic type. The string/numeric flags are intrinsic to the
 * primitive; {@code bool} carries neither.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class PrimitiveShape extends RawFieldShape {

    @NonNull
    String name;

    boolean string;

    boolean numeric;

    @Override
    public ShapeKind getKind() {
        return ShapeKind.PRIMITIVE;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }
}
