package com.querybuilder.generator.model.shape;

/**
 * Visitor over the closed set of {@link RawFieldShape} kinds.
 */
public interface TypeShapeVisitor<R> {
    R visitPrimitive(PrimitiveShape primitive);
    R visitPointer(PointerShape pointer);
    R visitSlice(SliceShape slice);
    R visitMap(MapShape map);
    R visitNamed(NamedShape named);
    R visitAggregate(AggregateShape aggregate);
    R visitUnsupported(UnsupportedShape unsupported);
}
