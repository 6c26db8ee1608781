package com.querybuilder.generator.model.shape;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class SliceShape extends RawFieldShape {

    @NonNull
    RawFieldShape element;

    @Override
    public ShapeKind getKind() {
        return ShapeKind.SLICE;
    }

    @Override
    public String getTypeName() {
        return "[]" + element.getTypeName();
    }

    @Override
    public String getTypeName(String consumingNamespace) {
        return "[]" + element.getTypeName(consumingNamespace);
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }
}
