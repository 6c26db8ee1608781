package com.querybuilder.generator.codegen.synth;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structured method body, filled into a template at render time.
 *
 * FILTER bodies carry the operator constant and value expression, SORT bodies
 * the direction, CHANGE bodies the value expression.
 */
@Value
@Builder
public class MethodBody {

    @NonNull
    BodyTemplate template;

    @NonNull
    String receiverName;

    @NonNull
    String recordName;

    @NonNull
    String fieldName;

    /**
     * Runtime operator constant, FILTER only.
     */
    String operatorConstant;

    /**
     * Parameter identifier, or {@code nil} for nullary filters.
     */
    String valueExpression;

    /**
     * SORT only.
     */
    SortDirection direction;
}
