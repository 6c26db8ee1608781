package com.querybuilder.generator.parser;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Underlying types of commonly used external named types, keyed by
 * {@code package.Name}. Any other external type is treated as opaque.
 */
@UtilityClass
public class WellKnownTypes {

    private static final Map<String, TypeDeclaration> DECLARATIONS = Map.ofEntries(
            entry("time.Time", "struct{}"),
            entry("time.Duration", "int64"),
            entry("time.Month", "int"),
            entry("sql.NullTime", "struct{}"),
            entry("sql.NullString", "struct{}"),
            entry("sql.NullInt16", "struct{}"),
            entry("sql.NullInt32", "struct{}"),
            entry("sql.NullInt64", "struct{}"),
            entry("sql.NullFloat64", "struct{}"),
            entry("sql.NullBool", "struct{}"),
            entry("sql.NullByte", "struct{}"),
            generic("sql.Null", "struct{}", "T"),
            entry("pq.NullTime", "struct{}"),
            entry("json.RawMessage", "[]byte"),
            entry("datatypes.Date", "time.Time"),
            entry("datatypes.Time", "time.Duration"),
            entry("datatypes.DateTime", "time.Time"),
            entry("datatypes.JSON", "json.RawMessage"),
            entry("datatypes.JSONMap", "map[string]any"),
            generic("datatypes.JSONType", "struct{}", "T"),
            generic("datatypes.JSONSlice", "[]T", "T"),
            entry("decimal.Decimal", "struct{}"),
            entry("uuid.UUID", "[16]byte"));

    public Optional<TypeDeclaration> lookup(String qualifiedName) {
        return Optional.ofNullable(DECLARATIONS.get(qualifiedName));
    }

    private static Map.Entry<String, TypeDeclaration> entry(String qualifiedName, String underlying) {
        return generic(qualifiedName, underlying);
    }

    private static Map.Entry<String, TypeDeclaration> generic(String qualifiedName, String underlying,
                                                              String... typeParameters) {
        TypeDeclaration declaration = TypeDeclaration.builder()
                .name(qualifiedName.substring(qualifiedName.indexOf('.') + 1))
                .typeParameters(List.of(typeParameters))
                .underlying(underlying)
                .build();
        return Map.entry(qualifiedName, declaration);
    }
}
