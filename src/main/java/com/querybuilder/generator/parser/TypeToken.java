package com.querybuilder.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of a type expression.
 */
@Data
@AllArgsConstructor
public class TypeToken {
    private TokenType type;
    private String value;
    private int start;
    private int end;

    public enum TokenType {
        IDENTIFIER,
        NUMBER,
        STAR,
        DOT,
        ELLIPSIS,
        COMMA,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        ARROW,
        OTHER,
        EOF
    }

    /**
     * Whether a type can start at this token.
     */
    public boolean startsType() {
        return type == TokenType.IDENTIFIER || type == TokenType.STAR
                || type == TokenType.LBRACKET || type == TokenType.LPAREN;
    }
}
