package com.querybuilder.generator.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.model.shape.AggregateShape;
import com.querybuilder.generator.model.shape.MapShape;
import com.querybuilder.generator.model.shape.NamedShape;
import com.querybuilder.generator.model.shape.PointerShape;
import com.querybuilder.generator.model.shape.RawFieldShape;
import com.querybuilder.generator.model.shape.SliceShape;
import com.querybuilder.generator.model.shape.UnsupportedShape;
import com.querybuilder.generator.parser.TypeToken.TokenType;

/**
 * Parses Go type expressions into {@link RawFieldShape} trees.
 *
 * Names resolve, in order, to: bound type arguments, unbound type parameters
 * (unsupported), types declared in the schema's package, predeclared types,
 * well-known external types, and finally opaque named types. Generic
 * declarations are expanded with their arguments substituted, so a field is
 * always described by its concrete instantiation.
 */
public class TypeExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(TypeExpressionParser.class);

    private final String packageName;
    private final Map<String, TypeDeclaration> declarations;

    /**
     * Declarations currently being expanded, to cut recursive definitions.
     */
    private final Deque<String> expanding = new ArrayDeque<>();

    public TypeExpressionParser(String packageName, Collection<TypeDeclaration> declarations) {
        this.packageName = packageName;
        this.declarations = new HashMap<>();
        for (TypeDeclaration declaration : declarations) {
            this.declarations.put(declaration.getName(), declaration);
        }
    }

    public RawFieldShape parse(String expression) {
        return parse(expression, Set.of());
    }

    /**
     * @param typeParameters type parameters of the enclosing record; references
     *                       to them cannot be resolved to a concrete type
     */
    public RawFieldShape parse(String expression, Set<String> typeParameters) {
        if (expression == null || expression.isBlank()) {
            throw new TypeParseException("Empty type expression", String.valueOf(expression));
        }
        return new Session(expression, Map.of(), typeParameters).parseComplete();
    }

    private RawFieldShape expand(String namespace, TypeDeclaration declaration, List<RawFieldShape> arguments,
                                 String expression) {
        String qualifiedName = namespace + "." + declaration.getName();
        if (declaration.getTypeParameters().size() != arguments.size()) {
            throw new TypeParseException("Type " + qualifiedName + " expects "
                    + declaration.getTypeParameters().size() + " type argument(s) but got " + arguments.size(),
                    expression);
        }

        RawFieldShape underlying;
        if (expanding.contains(qualifiedName)) {
            log.debug("Recursive type declaration {}", qualifiedName);
            underlying = new UnsupportedShape(declaration.getName(), "recursive type");
        } else {
            Map<String, RawFieldShape> bindings = new HashMap<>();
            for (int i = 0; i < arguments.size(); i++) {
                bindings.put(declaration.getTypeParameters().get(i), arguments.get(i));
            }
            expanding.push(qualifiedName);
            try {
                underlying = new Session(declaration.getUnderlying(), bindings, Set.of()).parseComplete();
            } finally {
                expanding.pop();
            }
        }

        // The underlying type of a named type is never itself named
        while (underlying instanceof NamedShape named) {
            underlying = named.getUnderlying();
        }

        return NamedShape.builder()
                .namespace(namespace)
                .name(declaration.getName())
                .underlying(underlying)
                .typeArguments(arguments)
                .build();
    }

    /**
     * Parsing state for one expression.
     */
    private class Session {
        private final String source;
        private final List<TypeToken> tokens;
        private final Map<String, RawFieldShape> bindings;
        private final Set<String> unbound;
        private int pos = 0;

        Session(String source, Map<String, RawFieldShape> bindings, Set<String> unbound) {
            this.source = source;
            this.tokens = new TypeExpressionTokenizer(source).tokenize();
            this.bindings = bindings;
            this.unbound = unbound;
        }

        RawFieldShape parseComplete() {
            RawFieldShape shape = parseType();
            if (!isAtEnd()) {
                throw error("Unexpected '" + peek().getValue() + "'");
            }
            return shape;
        }

        private RawFieldShape parseType() {
            TypeToken token = peek();
            switch (token.getType()) {
                case STAR:
                    advance();
                    return new PointerShape(parseType());
                case LBRACKET:
                    return parseSliceOrArray();
                case LPAREN:
                    advance();
                    RawFieldShape inner = parseType();
                    expect(TokenType.RPAREN);
                    return inner;
                case ARROW:
                    return parseChannel();
                case IDENTIFIER:
                    return parseIdentifierType();
                default:
                    throw error("Expected a type but found '" + token.getValue() + "'");
            }
        }

        private RawFieldShape parseSliceOrArray() {
            int start = expect(TokenType.LBRACKET).getStart();
            if (check(TokenType.RBRACKET)) {
                advance();
                return new SliceShape(parseType());
            }
            while (!isAtEnd() && !check(TokenType.RBRACKET)) {
                advance();
            }
            expect(TokenType.RBRACKET);
            parseType();
            return new UnsupportedShape(text(start), "array");
        }

        private RawFieldShape parseChannel() {
            int start = peek().getStart();
            if (check(TokenType.ARROW)) {
                advance();
            }
            expectKeyword("chan");
            if (check(TokenType.ARROW)) {
                advance();
            }
            parseType();
            return new UnsupportedShape(text(start), "chan");
        }

        private RawFieldShape parseIdentifierType() {
            TypeToken token = peek();
            int start = token.getStart();
            switch (token.getValue()) {
                case "map": {
                    advance();
                    expect(TokenType.LBRACKET);
                    RawFieldShape key = parseType();
                    expect(TokenType.RBRACKET);
                    return new MapShape(key, parseType());
                }
                case "struct":
                    advance();
                    skipBalanced(TokenType.LBRACE, TokenType.RBRACE);
                    return new AggregateShape(text(start));
                case "interface":
                    advance();
                    skipBalanced(TokenType.LBRACE, TokenType.RBRACE);
                    return new UnsupportedShape(text(start), "interface");
                case "chan":
                    return parseChannel();
                case "func":
                    advance();
                    skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
                    if (check(TokenType.LPAREN)) {
                        skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
                    } else if (peek().startsType()) {
                        parseType();
                    }
                    return new UnsupportedShape(text(start), "func");
                default:
                    return parseTypeName();
            }
        }

        private RawFieldShape parseTypeName() {
            String first = expect(TokenType.IDENTIFIER).getValue();
            String qualifier = null;
            String name = first;
            if (check(TokenType.DOT)) {
                advance();
                qualifier = first;
                name = expect(TokenType.IDENTIFIER).getValue();
            }

            List<RawFieldShape> arguments = new ArrayList<>();
            if (check(TokenType.LBRACKET)) {
                advance();
                arguments.add(parseType());
                while (check(TokenType.COMMA)) {
                    advance();
                    arguments.add(parseType());
                }
                expect(TokenType.RBRACKET);
            }

            return resolveName(qualifier, name, arguments);
        }

        private RawFieldShape resolveName(String qualifier, String name, List<RawFieldShape> arguments) {
            if (qualifier == null || qualifier.equals(packageName)) {
                if (qualifier == null && bindings.containsKey(name)) {
                    requireNoArguments(name, arguments);
                    return bindings.get(name);
                }
                if (qualifier == null && unbound.contains(name)) {
                    requireNoArguments(name, arguments);
                    return new UnsupportedShape(name, "type parameter");
                }
                TypeDeclaration declared = declarations.get(name);
                if (declared != null) {
                    return expand(packageName, declared, arguments, source);
                }
                if (qualifier == null) {
                    Optional<RawFieldShape> predeclared = PredeclaredTypes.lookup(name);
                    if (predeclared.isPresent()) {
                        requireNoArguments(name, arguments);
                        return predeclared.get();
                    }
                }
                return opaque(packageName, name, arguments);
            }

            Optional<TypeDeclaration> wellKnown = WellKnownTypes.lookup(qualifier + "." + name);
            if (wellKnown.isPresent()) {
                return expand(qualifier, wellKnown.get(), arguments, source);
            }
            return opaque(qualifier, name, arguments);
        }

        private RawFieldShape opaque(String namespace, String name, List<RawFieldShape> arguments) {
            log.debug("No declaration for {}.{}, treating as opaque", namespace, name);
            return NamedShape.builder()
                    .namespace(namespace)
                    .name(name)
                    .underlying(new UnsupportedShape(namespace + "." + name, "undeclared type"))
                    .typeArguments(arguments)
                    .build();
        }

        private void requireNoArguments(String name, List<RawFieldShape> arguments) {
            if (!arguments.isEmpty()) {
                throw new TypeParseException("Type " + name + " does not take type arguments", source);
            }
        }

        private void skipBalanced(TokenType open, TokenType close) {
            expect(open);
            int depth = 1;
            while (depth > 0) {
                if (isAtEnd()) {
                    throw error("Unbalanced '" + open + "'");
                }
                TokenType type = advance().getType();
                if (type == open) {
                    depth++;
                } else if (type == close) {
                    depth--;
                }
            }
        }

        private void expectKeyword(String keyword) {
            if (!check(TokenType.IDENTIFIER) || !peek().getValue().equals(keyword)) {
                throw error("Expected '" + keyword + "'");
            }
            advance();
        }

        /**
         * Source text from {@code start} to the end of the last consumed token,
         * whitespace collapsed.
         */
        private String text(int start) {
            return source.substring(start, previous().getEnd()).trim().replaceAll("\\s+", " ");
        }

        private TypeParseException error(String message) {
            return new TypeParseException(message, source, peek().getStart());
        }

        private boolean isAtEnd() {
            return peek().getType() == TokenType.EOF;
        }

        private TypeToken peek() {
            return tokens.get(pos);
        }

        private TypeToken previous() {
            return tokens.get(pos - 1);
        }

        private boolean check(TokenType type) {
            if (isAtEnd()) return false;
            return peek().getType() == type;
        }

        private TypeToken advance() {
            if (!isAtEnd()) pos++;
            return previous();
        }

        private TypeToken expect(TokenType type) {
            if (check(type)) {
                return advance();
            }
            throw error("Expected " + type + " but found '" + peek().getValue() + "'");
        }
    }
}
