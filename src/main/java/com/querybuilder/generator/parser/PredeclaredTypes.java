package com.querybuilder.generator.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.querybuilder.generator.model.shape.PrimitiveShape;
import com.querybuilder.generator.model.shape.RawFieldShape;
import com.querybuilder.generator.model.shape.UnsupportedShape;

import lombok.experimental.UtilityClass;

/**
 * Go's predeclared type identifiers.
 */
@UtilityClass
public class PredeclaredTypes {

    private static final Map<String, RawFieldShape> TYPES = buildTypes();

    private static Map<String, RawFieldShape> buildTypes() {
        Map<String, RawFieldShape> types = new HashMap<>();
        types.put("string", new PrimitiveShape("string", true, false));
        types.put("bool", new PrimitiveShape("bool", false, false));
        for (String numeric : new String[] {
                "int", "int8", "int16", "int32", "int64",
                "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
                "float32", "float64", "complex64", "complex128",
                "byte", "rune" }) {
            types.put(numeric, new PrimitiveShape(numeric, false, true));
        }
        types.put("any", new UnsupportedShape("any", "interface"));
        types.put("error", new UnsupportedShape("error", "interface"));
        return Map.copyOf(types);
    }

    public Optional<RawFieldShape> lookup(String name) {
        return Optional.ofNullable(TYPES.get(name));
    }
}
