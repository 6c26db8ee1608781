package com.querybuilder.generator.codegen.classify;

import java.util.List;

import com.querybuilder.generator.codegen.field.FieldModel;
import com.querybuilder.generator.codegen.field.Operator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A field after classification: names, category and type flags.
 */
@Value
@Builder(toBuilder = true)
public class ClassifiedField {

    /**
     * Logical field name as declared.
     */
    @NonNull
    String name;

    /**
     * Physical column name (tag override or snake_case of the name).
     */
    @NonNull
    String columnName;

    /**
     * Human readable type, generic instantiations rendered as {@code Base<A, B>}.
     */
    @NonNull
    String displayTypeName;

    /**
     * Type as it must be spelled in generated source, e.g. {@code Base[A, B]}.
     */
    @NonNull
    String declaredTypeName;

    @NonNull
    FieldCategory category;

    /**
     * Only meaningful when the category is {@link FieldCategory#TIME}.
     */
    boolean orderableTime;

    boolean pointer;

    /**
     * Category of the dereferenced type; null unless {@link #isPointer()}.
     */
    FieldCategory pointedCategory;

    boolean genericInstantiation;

    /**
     * Display names of the type arguments, for rendering only.
     */
    @Singular
    List<String> typeArguments;

    public boolean isFilterable() {
        return FieldModel.isFilterable(category);
    }

    public List<Operator> getOperators() {
        return FieldModel.operatorsFor(category);
    }
}
