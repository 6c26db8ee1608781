package com.querybuilder.generator.codegen.synth;

import java.util.List;

import com.querybuilder.generator.codegen.classify.ClassifiedField;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything rendering needs for one record, in field declaration order.
 */
@Value
@Builder
public class RecordPlan {

    @NonNull
    String recordName;

    @Singular
    List<ClassifiedField> fields;

    @Singular
    List<ColumnMapping> columns;

    @Singular
    List<MethodSpec> filterMethods;

    @Singular
    List<MethodSpec> updaterMethods;

    @Singular
    List<MethodSpec> orderMethods;

    /**
     * Names of fields dropped because of the exclusion marker.
     */
    @Singular
    List<String> skippedFields;

    public String getFiltersType() {
        return recordName + MethodSynthesizer.FILTERS_SUFFIX;
    }

    public String getUpdaterType() {
        return recordName + MethodSynthesizer.UPDATER_SUFFIX;
    }

    public String getOptionsType() {
        return recordName + MethodSynthesizer.OPTIONS_SUFFIX;
    }

    public String getSchemaFieldType() {
        return recordName + "DBSchemaField";
    }

    public String getSchemaVariable() {
        return recordName + "DBSchema";
    }
}
