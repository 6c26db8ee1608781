package com.querybuilder.generator.codegen.classify;

import lombok.NonNull;
import lombok.Value;

/**
 * Maps an exact type name to time semantics.
 */
@Value
public class TimePattern {

    /**
     * Type name as displayed for the consuming package, e.g. {@code time.Time}.
     * Matched exactly; no prefix or wildcard matching.
     */
    @NonNull
    String exactTypeName;

    /**
     * Whether values compare like numbers (range operators make sense).
     */
    boolean orderable;

    /**
     * Parses {@code NAME}, {@code NAME:orderable} or {@code NAME:unordered}.
     */
    public static TimePattern parse(String spec) {
        String trimmed = spec == null ? "" : spec.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return new TimePattern(requireName(trimmed, spec), true);
        }
        String name = requireName(trimmed.substring(0, colon).trim(), spec);
        String flag = trimmed.substring(colon + 1).trim().toLowerCase();
        return switch (flag) {
            case "orderable", "ordered", "true" -> new TimePattern(name, true);
            case "unordered", "false" -> new TimePattern(name, false);
            default -> throw new IllegalArgumentException(
                    "Invalid time type '" + spec + "' (expected NAME[:orderable|:unordered])");
        };
    }

    private static String requireName(String name, String spec) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Time type name is empty in '" + spec + "'");
        }
        return name;
    }
}
