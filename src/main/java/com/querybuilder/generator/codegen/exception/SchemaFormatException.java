package com.querybuilder.generator.codegen.exception;

import java.util.List;

/**
 * The schema document is malformed. Holds every problem found, not just the first.
 */
public class SchemaFormatException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public SchemaFormatException(String source, List<String> errors) {
        super("Invalid schema " + source + ":" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
