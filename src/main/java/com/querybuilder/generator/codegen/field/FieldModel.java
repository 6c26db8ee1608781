package com.querybuilder.generator.codegen.field;

import static com.querybuilder.generator.codegen.field.Operator.*;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.querybuilder.generator.codegen.classify.FieldCategory;

import lombok.experimental.UtilityClass;

/**
 * Which categories are filterable and which operators each one supports.
 *
 * Pointers get nullability checks only, whatever they point to. Every
 * filterable category starts with Equal, NotEqual.
 */
@UtilityClass
public class FieldModel {

    private static final List<Operator> BASE = List.of(EQUAL, NOT_EQUAL);

    private static final List<Operator> ORDERED = List.of(
            EQUAL, NOT_EQUAL,
            LESS_THAN, GREATER_THAN, LESS_OR_EQUAL, GREATER_OR_EQUAL,
            IN, NOT_IN);

    private static final Map<FieldCategory, List<Operator>> OPERATORS = buildOperatorTable();

    private static Map<FieldCategory, List<Operator>> buildOperatorTable() {
        Map<FieldCategory, List<Operator>> table = new EnumMap<>(FieldCategory.class);
        table.put(FieldCategory.STRING, List.of(
                EQUAL, NOT_EQUAL,
                LIKE, NOT_LIKE, IN, NOT_IN,
                LESS_THAN, GREATER_THAN, LESS_OR_EQUAL, GREATER_OR_EQUAL));
        table.put(FieldCategory.NUMERIC, ORDERED);
        table.put(FieldCategory.TIME, ORDERED);
        table.put(FieldCategory.BOOLEAN, BASE);
        table.put(FieldCategory.POINTER, List.of(EQUAL, NOT_EQUAL, IS_NULL, IS_NOT_NULL));
        table.put(FieldCategory.UNKNOWN, BASE);
        table.put(FieldCategory.SLICE, List.of());
        table.put(FieldCategory.MAP, List.of());
        table.put(FieldCategory.AGGREGATE, List.of());
        return table;
    }

    public boolean isFilterable(FieldCategory category) {
        return category != FieldCategory.SLICE
                && category != FieldCategory.MAP
                && category != FieldCategory.AGGREGATE;
    }

    public List<Operator> operatorsFor(FieldCategory category) {
        return OPERATORS.get(category);
    }

    public List<FieldCategory> filterableCategories() {
        return Arrays.stream(FieldCategory.values()).filter(FieldModel::isFilterable).toList();
    }

    public List<FieldCategory> nonFilterableCategories() {
        return Arrays.stream(FieldCategory.values()).filter(c -> !isFilterable(c)).toList();
    }
}
