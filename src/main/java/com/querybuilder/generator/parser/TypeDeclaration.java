package com.querybuilder.generator.parser;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named type declaration: {@code type Name[P1, P2] underlying}.
 */
@Value
@Builder
public class TypeDeclaration {

    @NonNull
    String name;

    @Singular
    List<String> typeParameters;

    /**
     * Underlying type expression; may reference the type parameters.
     */
    @NonNull
    String underlying;
}
