package com.querybuilder.generator.codegen.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Mutable flag set accumulated while descending a type shape. Resolved to a
 * single {@link FieldCategory} once descent is complete.
 */
final class TypeTraits {

    String displayName;
    String declaredName;

    boolean string;
    boolean numeric;
    boolean time;
    boolean orderableTime;
    boolean aggregate;
    boolean slice;
    boolean map;
    boolean pointer;
    boolean unsupported;
    boolean generic;

    FieldCategory pointedCategory;
    final List<String> typeArguments = new ArrayList<>();

    TypeTraits(String displayName, String declaredName) {
        this.displayName = displayName;
        this.declaredName = declaredName;
    }

    void markTime(TimePattern pattern) {
        time = true;
        aggregate = false;
        orderableTime = pattern.isOrderable();
        numeric = pattern.isOrderable();
    }

    /**
     * Highest priority first: time, slice, map, aggregate, pointer, string,
     * numeric, boolean by name, unknown.
     */
    FieldCategory category() {
        if (time) {
            return FieldCategory.TIME;
        }
        if (slice) {
            return FieldCategory.SLICE;
        }
        if (map) {
            return FieldCategory.MAP;
        }
        if (aggregate) {
            return FieldCategory.AGGREGATE;
        }
        if (pointer) {
            return FieldCategory.POINTER;
        }
        if (string) {
            return FieldCategory.STRING;
        }
        if (numeric) {
            return FieldCategory.NUMERIC;
        }
        if (!unsupported && displayName.toLowerCase(Locale.ROOT).contains("bool")) {
            return FieldCategory.BOOLEAN;
        }
        return FieldCategory.UNKNOWN;
    }
}
