package com.querybuilder.generator.codegen.exception;

/**
 * No record survived annotation filtering, so there is nothing to generate.
 */
public class NoEligibleRecordsException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public NoEligibleRecordsException(String source) {
        super("No eligible records (annotated with gen:querybuilder) found in " + source);
    }
}
