package com.querybuilder.generator.parser;

import java.util.ArrayList;
import java.util.List;

import com.querybuilder.generator.parser.TypeToken.TokenType;

/**
 * Tokenizer for Go type expressions such as {@code map[string][]*pkg.T}.
 */
public class TypeExpressionTokenizer {

    private final String source;
    private int pos = 0;

    public TypeExpressionTokenizer(String source) {
        this.source = source;
    }

    public List<TypeToken> tokenize() {
        List<TypeToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new TypeToken(TokenType.EOF, "", source.length(), source.length()));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private TypeToken nextToken() {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return token(TokenType.IDENTIFIER, start);
        }

        if (Character.isDigit(c)) {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
            return token(TokenType.NUMBER, start);
        }

        if (source.startsWith("...", pos)) {
            pos += 3;
            return token(TokenType.ELLIPSIS, start);
        }

        if (source.startsWith("<-", pos)) {
            pos += 2;
            return token(TokenType.ARROW, start);
        }

        pos++;
        return switch (c) {
            case '*' -> token(TokenType.STAR, start);
            case '.' -> token(TokenType.DOT, start);
            case ',' -> token(TokenType.COMMA, start);
            case '[' -> token(TokenType.LBRACKET, start);
            case ']' -> token(TokenType.RBRACKET, start);
            case '{' -> token(TokenType.LBRACE, start);
            case '}' -> token(TokenType.RBRACE, start);
            case '(' -> token(TokenType.LPAREN, start);
            case ')' -> token(TokenType.RPAREN, start);
            default -> token(TokenType.OTHER, start);
        };
    }

    private TypeToken token(TokenType type, int start) {
        return new TypeToken(type, source.substring(start, pos), start, pos);
    }
}
