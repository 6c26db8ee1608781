package com.querybuilder.generator.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.querybuilder.generator.model.FieldMetadata;

import lombok.experimental.UtilityClass;

/**
 * Reads column settings out of a field's struct tags.
 *
 * The {@code sql} and {@code gorm} tags are parsed in that order as
 * {@code KEY:value;KEY;...}; a later tag overrides an earlier one. Keys are
 * upper-cased, a bare key maps to itself and values keep embedded colons.
 */
@UtilityClass
public class TagSettingsParser {

    public static final String COLUMN = "COLUMN";
    public static final String EXCLUDE = "-";

    private static final List<String> SETTING_TAGS = List.of("sql", "gorm");

    public static FieldMetadata parse(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return FieldMetadata.EMPTY;
        }

        Map<String, String> settings = new LinkedHashMap<>();
        for (String tagName : SETTING_TAGS) {
            String value = tags.get(tagName);
            if (value != null && !value.isEmpty()) {
                parseSettings(value, settings);
            }
        }

        String column = settings.get(COLUMN);
        return FieldMetadata.builder()
                .columnName(column == null || column.isBlank() ? null : column.trim())
                .excluded(settings.containsKey(EXCLUDE))
                .settings(Map.copyOf(settings))
                .build();
    }

    static void parseSettings(String tag, Map<String, String> settings) {
        for (String part : tag.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int colon = part.indexOf(':');
            if (colon < 0) {
                String key = part.trim().toUpperCase(Locale.ROOT);
                settings.put(key, key);
            } else {
                String key = part.substring(0, colon).trim().toUpperCase(Locale.ROOT);
                settings.put(key, part.substring(colon + 1));
            }
        }
    }
}
