package com.querybuilder.generator.codegen.synth;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Description of one generated API method. Immutable; created once during
 * synthesis and consumed once by rendering. The parameter list is empty if and
 * only if the body kind is {@link BodyKind#UNARY}.
 */
@Value
@Builder
public class MethodSpec {

    @NonNull
    String name;

    @NonNull
    String receiverName;

    @NonNull
    String receiverType;

    @Singular
    List<MethodParameter> parameters;

    @NonNull
    String returnType;

    @NonNull
    BodyKind bodyKind;

    @NonNull
    MethodBody body;

    @NonNull
    String documentation;

    /**
     * Receiver clause, e.g. {@code f *UserFilters}.
     */
    public String getReceiverExpr() {
        return receiverName + " *" + receiverType;
    }

    /**
     * Rendered parameter list, empty for nullary methods.
     */
    public String getParameterList() {
        return parameters.stream().map(MethodParameter::render).collect(Collectors.joining(", "));
    }
}
