package com.querybuilder.generator.codegen.classify;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.codegen.util.NamingUtil;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.FieldMetadata;
import com.querybuilder.generator.model.shape.AggregateShape;
import com.querybuilder.generator.model.shape.MapShape;
import com.querybuilder.generator.model.shape.NamedShape;
import com.querybuilder.generator.model.shape.PointerShape;
import com.querybuilder.generator.model.shape.PrimitiveShape;
import com.querybuilder.generator.model.shape.RawFieldShape;
import com.querybuilder.generator.model.shape.SliceShape;
import com.querybuilder.generator.model.shape.TypeShapeVisitor;
import com.querybuilder.generator.model.shape.UnsupportedShape;

/**
 * Resolves a field's raw type shape into a {@link ClassifiedField}.
 *
 * Classification is a pure function of the field and the time pattern table:
 * the only early exit is the exclusion marker (an empty result), every other
 * shape gets a category, falling back to {@link FieldCategory#UNKNOWN}.
 * Instances hold only immutable state and may be shared between threads.
 */
public class TypeClassifier {
    private static final Logger log = LoggerFactory.getLogger(TypeClassifier.class);

    private final TimePatternTable timePatterns;
    private final String namespace;

    /**
     * @param timePatterns table finalized for this generation run
     * @param namespace    package of the consuming schema; named types declared
     *                     there are displayed unqualified
     */
    public TypeClassifier(TimePatternTable timePatterns, String namespace) {
        this.timePatterns = timePatterns;
        this.namespace = namespace == null ? "" : namespace;
    }

    /**
     * Classifies one field.
     *
     * @return the classified field, or empty when the field is excluded
     */
    public Optional<ClassifiedField> classify(FieldDescriptor field) {
        FieldMetadata metadata = field.getMetadata();
        Optional<TypeTraits> resolved = resolve(field.getShape(), metadata);
        if (resolved.isEmpty()) {
            log.debug("Skipping excluded field {}", field.getName());
            return Optional.empty();
        }

        TypeTraits traits = resolved.get();
        String columnName = metadata.getColumnName() != null && !metadata.getColumnName().isBlank()
                ? metadata.getColumnName()
                : NamingUtil.toColumnName(field.getName());

        ClassifiedField classified = ClassifiedField.builder()
                .name(field.getName())
                .columnName(columnName)
                .displayTypeName(traits.displayName)
                .declaredTypeName(traits.declaredName)
                .category(traits.category())
                .orderableTime(traits.time && traits.orderableTime)
                .pointer(traits.pointer)
                .pointedCategory(traits.pointer ? traits.pointedCategory : null)
                .genericInstantiation(traits.generic)
                .typeArguments(traits.typeArguments)
                .build();

        log.debug("Classified {} ({}) as {}", classified.getName(), classified.getDisplayTypeName(),
                classified.getCategory());
        return Optional.of(classified);
    }

    /**
     * Descends one shape. Nested shapes are resolved with the owning field's
     * metadata, so an excluded field is skipped at every level.
     */
    private Optional<TypeTraits> resolve(RawFieldShape shape, FieldMetadata metadata) {
        if (metadata.isExcluded()) {
            return Optional.empty();
        }

        String name = shape.getTypeName(namespace);
        TypeTraits traits = new TypeTraits(name, name);

        // Named types match on their base name in visitNamed, which keeps type arguments
        if (!(shape instanceof NamedShape)) {
            Optional<TimePattern> timePattern = timePatterns.match(name);
            if (timePattern.isPresent()) {
                traits.markTime(timePattern.get());
                return Optional.of(traits);
            }
        }

        return shape.accept(new ShapeResolver(traits, metadata));
    }

    private class ShapeResolver implements TypeShapeVisitor<Optional<TypeTraits>> {

        private final TypeTraits traits;
        private final FieldMetadata metadata;

        ShapeResolver(TypeTraits traits, FieldMetadata metadata) {
            this.traits = traits;
            this.metadata = metadata;
        }

        @Override
        public Optional<TypeTraits> visitPrimitive(PrimitiveShape primitive) {
            traits.string = primitive.isString();
            traits.numeric = primitive.isNumeric();
            return Optional.of(traits);
        }

        @Override
        public Optional<TypeTraits> visitPointer(PointerShape pointer) {
            Optional<TypeTraits> pointed = resolve(pointer.getElement(), metadata);
            if (pointed.isEmpty()) {
                return Optional.empty();
            }
            TypeTraits pointee = pointed.get();
            TypeTraits result = new TypeTraits("*" + pointee.displayName, "*" + pointee.declaredName);
            result.pointer = true;
            result.pointedCategory = pointee.category();
            return Optional.of(result);
        }

        @Override
        public Optional<TypeTraits> visitSlice(SliceShape slice) {
            traits.slice = true;
            return Optional.of(traits);
        }

        @Override
        public Optional<TypeTraits> visitMap(MapShape map) {
            traits.map = true;
            return Optional.of(traits);
        }

        @Override
        public Optional<TypeTraits> visitAggregate(AggregateShape aggregate) {
            traits.aggregate = true;
            return Optional.of(traits);
        }

        @Override
        public Optional<TypeTraits> visitUnsupported(UnsupportedShape unsupported) {
            log.debug("Unsupported type {} ({})",
                    unsupported.getTypeName(), unsupported.getReason());
            traits.unsupported = true;
            return Optional.of(traits);
        }

        @Override
        public Optional<TypeTraits> visitNamed(NamedShape named) {
            Optional<TypeTraits> underlying = resolve(named.getUnderlying(), metadata);
            if (underlying.isEmpty()) {
                return Optional.empty();
            }

            TypeTraits result = underlying.get();
            String baseName = named.relativeName(namespace);
            result.displayName = baseName;
            result.declaredName = baseName;

            timePatterns.match(baseName).ifPresent(result::markTime);

            if (named.isInstantiated()) {
                StringBuilder display = new StringBuilder(baseName).append('<');
                StringBuilder declared = new StringBuilder(baseName).append('[');
                int index = 0;
                for (RawFieldShape argument : named.getTypeArguments()) {
                    Optional<TypeTraits> argTraits = resolve(argument, metadata);
                    if (argTraits.isEmpty()) {
                        continue;
                    }
                    if (index++ > 0) {
                        display.append(", ");
                        declared.append(", ");
                    }
                    display.append(argTraits.get().displayName);
                    declared.append(argTraits.get().declaredName);
                    result.typeArguments.add(argTraits.get().displayName);
                }
                result.displayName = display.append('>').toString();
                result.declaredName = declared.append(']').toString();
                result.generic = true;
            }
            return Optional.of(result);
        }
    }
}
