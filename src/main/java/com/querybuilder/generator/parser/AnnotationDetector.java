package com.querybuilder.generator.parser;

import java.util.List;
import java.util.Locale;

import com.querybuilder.generator.model.RecordDescriptor;

import lombok.experimental.UtilityClass;

/**
 * Decides whether a record asked for a query builder through one of its
 * doc comment lines.
 */
@UtilityClass
public class AnnotationDetector {

    public static final List<String> ANNOTATIONS = List.of(
            "gen:querybuilder",
            "@querybuilder",
            "+querybuilder",
            "//go:generate querybuilder"
    );

    public static boolean isAnnotated(RecordDescriptor record) {
        return record.getComments().stream().anyMatch(AnnotationDetector::isAnnotation);
    }

    /**
     * Matches case-insensitively, both on the raw line and with comment
     * markers stripped.
     */
    public static boolean isAnnotation(String commentLine) {
        if (commentLine == null || commentLine.isBlank()) {
            return false;
        }
        String raw = commentLine.trim().toLowerCase(Locale.ROOT);
        String cleaned = stripCommentMarkers(raw);
        return ANNOTATIONS.stream().anyMatch(annotation -> raw.contains(annotation) || cleaned.contains(annotation));
    }

    static String stripCommentMarkers(String line) {
        String text = line.trim();
        if (text.startsWith("//")) {
            text = text.substring(2);
        } else if (text.startsWith("/*")) {
            text = text.substring(2);
        }
        if (text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        return text.trim();
    }
}
