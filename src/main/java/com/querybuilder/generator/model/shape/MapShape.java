package com.querybuilder.generator.model.shape;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class MapShape extends RawFieldShape {

    @NonNull
    RawFieldShape key;

    @NonNull
    RawFieldShape value;

    @Override
    public ShapeKind getKind() {
        return ShapeKind.MAP;
    }

    @Override
    public String getTypeName() {
        return "map[" + key.getTypeName() + "]" + value.getTypeName();
    }

    @Override
    public String getTypeName(String consumingNamespace) {
        return "map[" + key.getTypeName(consumingNamespace) + "]" + value.getTypeName(consumingNamespace);
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
