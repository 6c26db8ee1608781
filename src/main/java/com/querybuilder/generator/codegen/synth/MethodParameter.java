package com.querybuilder.generator.codegen.synth;

import lombok.NonNull;
import lombok.Value;

@Value
public class MethodParameter {

    @NonNull
    String name;

    /**
     * Element type; for a variadic parameter the type of each value.
     */
    @NonNull
    String typeName;

    boolean variadic;

    /**
     * Source form, e.g. {@code name string} or {@code ids ...int64}.
     */
    public String render() {
        return name + (variadic ? " ..." : " ") + typeName;
    }
}
