package com.querybuilder.generator.model.shape;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared type with its underlying shape and, for generic instantiations,
 * its type arguments.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(callSuper = false)
public class NamedShape extends RawFieldShape {

    /**
     * Package the type is declared in.
     */
    @NonNull
    String namespace;

    @NonNull
    String name;

    @NonNull
    RawFieldShape underlying;

    @Singular
    List<RawFieldShape> typeArguments;

    /**
     * Name as seen from {@code consumingNamespace}: unqualified when declared
     * there, {@code namespace.Name} otherwise.
     */
    public String relativeName(String consumingNamespace) {
        if (namespace.isEmpty() || namespace.equals(consumingNamespace)) {
            return name;
        }
        return namespace + "." + name;
    }

    public boolean isInstantiated() {
        return !typeArguments.isEmpty();
    }

    @Override
    public ShapeKind getKind() {
        return ShapeKind.NAMED;
    }

    @Override
    public String getTypeName() {
        String base = namespace.isEmpty() ? name : namespace + "." + name;
        if (typeArguments.isEmpty()) {
            return base;
        }
        return base + typeArguments.stream()
                .map(RawFieldShape::getTypeName)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String getTypeName(String consumingNamespace) {
        String base = relativeName(consumingNamespace);
        if (typeArguments.isEmpty()) {
            return base;
        }
        return base + typeArguments.stream()
                .map(argument -> argument.getTypeName(consumingNamespace))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public <R> R accept(TypeShapeVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }
}
