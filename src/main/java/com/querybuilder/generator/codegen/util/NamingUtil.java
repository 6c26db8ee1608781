package com.querybuilder.generator.codegen.util;

import java.util.Locale;
import java.util.Set;

/**
 * Identifier conventions for generated Go code and database columns.
 */
public class NamingUtil {

    /**
     * Go reserved keywords. A parameter may never be spelled as one of these.
     */
    public static final Set<String> RESERVED_KEYWORDS = Set.of(
            "break", "case", "chan", "const", "continue",
            "default", "defer", "else", "fallthrough", "for",
            "func", "go", "goto", "if", "import",
            "interface", "map", "package", "range", "return",
            "select", "struct", "switch", "type", "var");

    private static final String KEYWORD_SUFFIX = "Value";

    private NamingUtil() {
        // Utility class
    }

    public static boolean isReservedKeyword(String identifier) {
        return RESERVED_KEYWORDS.contains(identifier);
    }

    /**
     * Converts a field name to lowerCamel, lowering a leading initialism as a
     * whole: {@code Name -> name}, {@code ID -> id}, {@code URLPath -> urlPath}.
     * A plural {@code s} closing the run stays with it: {@code IDs -> ids}.
     */
    public static String toLowerCamel(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        int upperRun = 0;
        while (upperRun < name.length() && Character.isUpperCase(name.charAt(upperRun))) {
            upperRun++;
        }
        if (upperRun == 0) {
            return name;
        }
        if (upperRun == name.length()) {
            return name.toLowerCase(Locale.ROOT);
        }
        if (upperRun > 1 && isPluralSuffix(name, upperRun)) {
            return name.substring(0, upperRun + 1).toLowerCase(Locale.ROOT) + name.substring(upperRun + 1);
        }
        // In "URLPath" the P starts the next word
        int lowered = upperRun > 1 && Character.isLowerCase(name.charAt(upperRun)) ? upperRun - 1 : upperRun;
        return name.substring(0, lowered).toLowerCase(Locale.ROOT) + name.substring(lowered);
    }

    private static boolean isPluralSuffix(String name, int index) {
        if (name.charAt(index) != 's') {
            return false;
        }
        return index + 1 == name.length() || !Character.isLowerCase(name.charAt(index + 1));
    }

    /**
     * Parameter identifier for a single value of the field. Gets the
     * {@code Value} suffix when it would be a keyword or shadow the receiver.
     */
    public static String toParameterName(String fieldName, String receiverName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return "value";
        }
        return escape(toLowerCamel(fieldName), receiverName);
    }

    /**
     * Parameter identifier for a list of values of the field: pluralized
     * before escaping.
     */
    public static String toVariadicParameterName(String fieldName, String receiverName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return "values";
        }
        return escape(toLowerCamel(fieldName) + "s", receiverName);
    }

    /**
     * Receiver identifier for a generated type: its first letter, lower-cased.
     */
    public static String toReceiverName(String typeName) {
        if (typeName == null || typeName.isEmpty()) {
            return "r";
        }
        return typeName.substring(0, 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Converts a field name to snake_case, keeping initialism runs together:
     * {@code UserID -> user_id}, {@code HTTPCode -> http_code}.
     */
    public static String toColumnName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = name.charAt(i - 1);
                boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev)
                        || (Character.isUpperCase(prev) && nextIsLower)) {
                    sb.append('_');
                }
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    private static String escape(String identifier, String receiverName) {
        return isReservedKeyword(identifier) || identifier.equals(receiverName)
                ? identifier + KEYWORD_SUFFIX : identifier;
    }
}
