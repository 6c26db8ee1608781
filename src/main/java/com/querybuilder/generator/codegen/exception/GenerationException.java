package com.querybuilder.generator.codegen.exception;

/**
 * Base class for failures that abort a generation run.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
