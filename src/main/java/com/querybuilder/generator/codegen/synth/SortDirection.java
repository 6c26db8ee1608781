package com.querybuilder.generator.codegen.synth;

public enum SortDirection {
    ASC("Asc", "asc"),
    DESC("Desc", "desc");

    private final String methodSuffix;
    private final String keyword;

    SortDirection(String methodSuffix, String keyword) {
        this.methodSuffix = methodSuffix;
        this.keyword = keyword;
    }

    public String getMethodSuffix() {
        return methodSuffix;
    }

    public String getKeyword() {
        return keyword;
    }
}
