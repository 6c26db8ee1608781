package com.querybuilder.generator.parser;

/**
 * A type expression could not be parsed.
 */
public class TypeParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TypeParseException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'");
    }

    public TypeParseException(String message, String expression) {
        super(message + " in '" + expression + "'");
    }
}
