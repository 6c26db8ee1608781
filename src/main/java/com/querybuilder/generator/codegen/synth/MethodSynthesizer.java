package com.querybuilder.generator.codegen.synth;

import java.util.Locale;

import com.querybuilder.generator.codegen.classify.ClassifiedField;
import com.querybuilder.generator.codegen.field.Operator;
import com.querybuilder.generator.codegen.util.NamingUtil;

/**
 * Maps a classified field (and operator) to the generated method that exposes it.
 *
 * Synthesis is pure: identical inputs yield equal specs. Asking for a filter or
 * sort method on a non-filterable field, or for an operator the field's
 * category does not support, is a caller bug and fails fast.
 */
public class MethodSynthesizer {

    public static final String FILTERS_SUFFIX = "Filters";
    public static final String UPDATER_SUFFIX = "Updater";
    public static final String OPTIONS_SUFFIX = "Options";

    private static final String NULL_VALUE = "nil";

    public MethodSpec createFilterMethod(String recordName, ClassifiedField field, Operator operator) {
        if (!field.isFilterable()) {
            throw new IllegalStateException("Field " + recordName + "." + field.getName()
                    + " of category " + field.getCategory() + " is not filterable");
        }
        if (!field.getOperators().contains(operator)) {
            throw new IllegalStateException("Operator " + operator + " is not supported by field "
                    + recordName + "." + field.getName() + " of category " + field.getCategory());
        }

        String methodName = field.getName() + operator.getMethodSuffix();
        String receiverType = recordName + FILTERS_SUFFIX;
        String receiverName = NamingUtil.toReceiverName(receiverType);

        MethodSpec.MethodSpecBuilder spec = MethodSpec.builder()
                .name(methodName)
                .receiverName(receiverName)
                .receiverType(receiverType)
                .returnType("*" + receiverType);
        MethodBody.MethodBodyBuilder body = MethodBody.builder()
                .template(BodyTemplate.FILTER)
                .receiverName(receiverName)
                .recordName(recordName)
                .fieldName(field.getName())
                .operatorConstant(operator.getRuntimeConstant());

        if (operator.isNullary()) {
            return spec.bodyKind(BodyKind.UNARY)
                    .body(body.valueExpression(NULL_VALUE).build())
                    .documentation(methodName + " filters by " + field.getName() + " "
                            + (operator == Operator.IS_NULL ? "is null" : "is not null") + " check")
                    .build();
        }

        if (operator.isVariadic()) {
            String paramName = NamingUtil.toVariadicParameterName(field.getName(), receiverName);
            return spec.bodyKind(BodyKind.VARIADIC)
                    .parameter(new MethodParameter(paramName, field.getDeclaredTypeName(), true))
                    .body(body.valueExpression(paramName).build())
                    .documentation(methodName + " filters by " + field.getName()
                            + (operator == Operator.IN ? " in list" : " not in list"))
                    .build();
        }

        String paramName = NamingUtil.toParameterName(field.getName(), receiverName);
        return spec.bodyKind(BodyKind.BINARY)
                .parameter(new MethodParameter(paramName, field.getDeclaredTypeName(), false))
                .body(body.valueExpression(paramName).build())
                .documentation(methodName + " filters by " + field.getName() + " "
                        + operator.getMethodSuffix().toLowerCase(Locale.ROOT))
                .build();
    }

    /**
     * Setter recording a new value for the field. Produced for every field,
     * filterable or not.
     */
    public MethodSpec createUpdaterMethod(String recordName, ClassifiedField field) {
        String methodName = "Set" + field.getName();
        String receiverType = recordName + UPDATER_SUFFIX;
        String receiverName = NamingUtil.toReceiverName(receiverType);
        String paramName = NamingUtil.toParameterName(field.getName(), receiverName);

        return MethodSpec.builder()
                .name(methodName)
                .receiverName(receiverName)
                .receiverType(receiverType)
                .parameter(new MethodParameter(paramName, field.getDeclaredTypeName(), false))
                .returnType("*" + receiverType)
                .bodyKind(BodyKind.BINARY)
                .body(MethodBody.builder()
                        .template(BodyTemplate.CHANGE)
                        .receiverName(receiverName)
                        .recordName(recordName)
                        .fieldName(field.getName())
                        .valueExpression(paramName)
                        .build())
                .documentation(methodName + " sets the " + field.getName() + " field for update")
                .build();
    }

    public MethodSpec createOrderMethod(String recordName, ClassifiedField field, SortDirection direction) {
        if (!field.isFilterable()) {
            throw new IllegalStateException("Field " + recordName + "." + field.getName()
                    + " of category " + field.getCategory() + " cannot be sorted on");
        }

        String methodName = "OrderBy" + field.getName() + direction.getMethodSuffix();
        String receiverType = recordName + OPTIONS_SUFFIX;
        String receiverName = NamingUtil.toReceiverName(receiverType);

        return MethodSpec.builder()
                .name(methodName)
                .receiverName(receiverName)
                .receiverType(receiverType)
                .returnType("*" + receiverType)
                .bodyKind(BodyKind.UNARY)
                .body(MethodBody.builder()
                        .template(BodyTemplate.SORT)
                        .receiverName(receiverName)
                        .recordName(recordName)
                        .fieldName(field.getName())
                        .direction(direction)
                        .build())
                .documentation(methodName + " orders results by " + field.getName() + " " + direction.getKeyword())
                .build();
    }
}
