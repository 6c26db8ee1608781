package com.querybuilder.generator.codegen.field;

/**
 * Comparison kinds usable in a generated filter predicate.
 */
public enum Operator {
    EQUAL("=", "Eq", "OperatorEqual"),
    NOT_EQUAL("!=", "Ne", "OperatorNotEqual"),
    LESS_THAN("<", "Lt", "OperatorLessThan"),
    LESS_OR_EQUAL("<=", "Lte", "OperatorLessThanOrEqual"),
    GREATER_THAN(">", "Gt", "OperatorGreaterThan"),
    GREATER_OR_EQUAL(">=", "Gte", "OperatorGreaterThanOrEqual"),
    LIKE("LIKE", "Like", "OperatorLike"),
    NOT_LIKE("NOT_LIKE", "NotLike", "OperatorNotLike"),
    IS_NULL("IS_NULL", "IsNull", "OperatorIsNull"),
    IS_NOT_NULL("IS_NOT_NULL", "IsNotNull", "OperatorIsNotNull"),
    IN("IN", "In", "OperatorIn"),
    NOT_IN("NOT_IN", "NotIn", "OperatorNotIn");

    private final String symbol;
    private final String methodSuffix;
    private final String runtimeConstant;

    Operator(String symbol, String methodSuffix, String runtimeConstant) {
        this.symbol = symbol;
        this.methodSuffix = methodSuffix;
        this.runtimeConstant = runtimeConstant;
    }

    /**
     * Value the persistence runtime uses for this operator.
     */
    public String getSymbol() {
        return symbol;
    }

    public String getMethodSuffix() {
        return methodSuffix;
    }

    /**
     * Name of the operator constant in the runtime package.
     */
    public String getRuntimeConstant() {
        return runtimeConstant;
    }

    public boolean isNullary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    public boolean isVariadic() {
        return this == IN || this == NOT_IN;
    }
}
