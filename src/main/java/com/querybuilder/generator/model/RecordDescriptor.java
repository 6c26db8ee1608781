package com.querybuilder.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A record declaration as handed over by schema ingestion. Field order is
 * declaration order and is preserved through generation.
 */
@Value
@Builder(toBuilder = true)
public class RecordDescriptor {

    @NonNull
    String name;

    /**
     * Doc comment lines attached to the declaration.
     */
    @Singular
    List<String> comments;

    @Singular
    List<FieldDescriptor> fields;

    public RecordDescriptor withName(String newName) {
        return toBuilder().name(newName).build();
    }
}
