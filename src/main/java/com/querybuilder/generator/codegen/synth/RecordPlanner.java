package com.querybuilder.generator.codegen.synth;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.codegen.classify.ClassifiedField;
import com.querybuilder.generator.codegen.classify.TypeClassifier;
import com.querybuilder.generator.codegen.field.Operator;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.RecordDescriptor;

/**
 * Classifies a record's fields and synthesizes its filter, updater and sort
 * methods plus the column map.
 *
 * Filter and sort methods are only requested for filterable fields; every
 * classified field gets an updater method and a column entry.
 */
public class RecordPlanner {
    private static final Logger log = LoggerFactory.getLogger(RecordPlanner.class);

    private final TypeClassifier classifier;
    private final MethodSynthesizer synthesizer;

    public RecordPlanner(TypeClassifier classifier, MethodSynthesizer synthesizer) {
        this.classifier = classifier;
        this.synthesizer = synthesizer;
    }

    public RecordPlan plan(RecordDescriptor record) {
        String recordName = record.getName();
        RecordPlan.RecordPlanBuilder plan = RecordPlan.builder().recordName(recordName);

        for (FieldDescriptor descriptor : record.getFields()) {
            Optional<ClassifiedField> classified = classifier.classify(descriptor);
            if (classified.isEmpty()) {
                plan.skippedField(descriptor.getName());
                continue;
            }

            ClassifiedField field = classified.get();
            plan.field(field);
            plan.column(new ColumnMapping(field.getName(), field.getColumnName()));

            if (field.isFilterable()) {
                for (Operator operator : field.getOperators()) {
                    plan.filterMethod(synthesizer.createFilterMethod(recordName, field, operator));
                }
                plan.orderMethod(synthesizer.createOrderMethod(recordName, field, SortDirection.ASC));
                plan.orderMethod(synthesizer.createOrderMethod(recordName, field, SortDirection.DESC));
            } else {
                log.debug("{}.{} is a {} field: updater only", recordName, field.getName(),
                        field.getCategory().getLabel());
            }
            plan.updaterMethod(synthesizer.createUpdaterMethod(recordName, field));
        }

        RecordPlan result = plan.build();
        log.info("Planned {}: {} fields, {} filter methods, {} updater methods, {} order methods",
                recordName, result.getFields().size(), result.getFilterMethods().size(),
                result.getUpdaterMethods().size(), result.getOrderMethods().size());
        return result;
    }
}
