package com.querybuilder.generator.model;

import com.querybuilder.generator.model.shape.RawFieldShape;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One declared member of a record: name, raw type shape and metadata.
 */
@Value
@Builder(toBuilder = true)
public class FieldDescriptor {

    @NonNull
    String name;

    @NonNull
    RawFieldShape shape;

    @NonNull
    @Builder.Default
    FieldMetadata metadata = FieldMetadata.EMPTY;
}
