package com.nevis.ingest.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for node and relationship literals embedded in free-form
 * model output:
 *
 * <pre>
 * literal    := ("Node" | "Relationship") "(" [argument ("," argument)* [","]] ")"
 * argument   := IDENTIFIER "=" value | value
 * value      := STRING | INTEGER | literal | IDENTIFIER | map | list
 * map        := "{" [(STRING | IDENTIFIER) ":" value ("," ...)*] "}"
 * list       := "[" [value ("," value)*] "]"
 * </pre>
 *
 * Only top-level literals are collected; a node literal nested inside a relationship
 * belongs to that relationship. A malformed literal is reported as a diagnostic and
 * skipped, and scanning resumes after it.
 */
public class GraphLiteralParser {

    private static final Pattern LITERAL_START = Pattern.compile("(?<![A-Za-z0-9_])(Node|Relationship)\\s*\\(");
    private static final int MAX_DEPTH = 16;
    private static final int MAX_FRAGMENT_LENGTH = 120;

    public ParseResult parse(String text) {
        List<GraphLiteral> nodes = new ArrayList<>();
        List<GraphLiteral> relationships = new ArrayList<>();
        List<ParseDiagnostic> diagnostics = new ArrayList<>();

        if (text == null || text.isBlank()) {
            return new ParseResult(nodes, relationships, diagnostics);
        }

        Matcher matcher = LITERAL_START.matcher(text);
        int from = 0;
        while (from < text.length() && matcher.find(from)) {
            int start = matcher.start();
            try {
                GraphLiteral literal = new Cursor(new GraphLiteralLexer(text, start)).literal(0);
                if (literal.kind() == GraphLiteral.Kind.NODE) {
                    nodes.add(literal);
                } else {
                    relationships.add(literal);
                }
                from = literal.end();
            } catch (SyntaxException e) {
                int resume = recoveryPoint(text, start, matcher.end());
                diagnostics.add(new ParseDiagnostic(e.position, fragment(text, start, resume), e.getMessage()));
                from = resume;
            }
        }

        return new ParseResult(nodes, relationships, diagnostics);
    }

    /**
     * End of the balanced parenthesised region opened at {@code start}, or the end of the
     * keyword when the region never closes.
     */
    private static int recoveryPoint(String text, int start, int keywordEnd) {
        int depth = 0;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote || c == '\n') {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return keywordEnd;
    }

    private static String fragment(String text, int start, int end) {
        int limit = Math.min(Math.max(end, start), Math.min(text.length(), start + MAX_FRAGMENT_LENGTH));
        return text.substring(start, limit);
    }

    private static final class Cursor {

        private final GraphLiteralLexer lexer;
        private final List<Token> lookahead = new ArrayList<>();

        Cursor(GraphLiteralLexer lexer) {
            this.lexer = lexer;
        }

        GraphLiteral literal(int depth) {
            if (depth > MAX_DEPTH) {
                throw new SyntaxException(peek(0).start(), "literal nested too deeply");
            }
            Token keyword = expect(Token.Kind.IDENTIFIER);
            GraphLiteral.Kind kind = GraphLiteral.Kind.fromKeyword(keyword.text());
            if (kind == null) {
                throw new SyntaxException(keyword.start(), "unknown literal " + keyword.text());
            }
            expect(Token.Kind.LEFT_PAREN);

            Map<String, Object> named = new LinkedHashMap<>();
            List<Object> positional = new ArrayList<>();

            while (!peek(0).is(Token.Kind.RIGHT_PAREN)) {
                if (peek(0).is(Token.Kind.IDENTIFIER) && peek(1).is(Token.Kind.EQUALS)) {
                    String name = advance().text();
                    advance();
                    named.put(name, value(depth));
                } else if (named.isEmpty()) {
                    positional.add(value(depth));
                } else {
                    throw new SyntaxException(peek(0).start(), "positional argument after named argument");
                }

                if (peek(0).is(Token.Kind.COMMA)) {
                    advance();
                } else if (!peek(0).is(Token.Kind.RIGHT_PAREN)) {
                    throw unexpected(peek(0), "',' or ')'");
                }
            }
            Token close = expect(Token.Kind.RIGHT_PAREN);

            return new GraphLiteral(
                kind,
                Collections.unmodifiableMap(named),
                Collections.unmodifiableList(positional),
                keyword.start(),
                close.end()
            );
        }

        private Object value(int depth) {
            Token token = peek(0);
            return switch (token.kind()) {
                case STRING -> advance().text();
                case INTEGER -> integer(advance());
                case IDENTIFIER -> identifierValue(depth);
                case LEFT_BRACE -> map(depth);
                case LEFT_BRACKET -> list(depth);
                default -> throw unexpected(token, "a value");
            };
        }

        private Object identifierValue(int depth) {
            Token token = peek(0);
            if (GraphLiteral.Kind.fromKeyword(token.text()) != null && peek(1).is(Token.Kind.LEFT_PAREN)) {
                return literal(depth + 1);
            }
            advance();
            return switch (token.text()) {
                case "None", "null" -> null;
                default -> token.text();
            };
        }

        private Map<String, Object> map(int depth) {
            expect(Token.Kind.LEFT_BRACE);
            Map<String, Object> entries = new LinkedHashMap<>();
            while (!peek(0).is(Token.Kind.RIGHT_BRACE)) {
                Token key = advance();
                if (!key.is(Token.Kind.STRING) && !key.is(Token.Kind.IDENTIFIER)) {
                    throw unexpected(key, "a map key");
                }
                expect(Token.Kind.COLON);
                entries.put(key.text(), value(depth + 1));
                if (peek(0).is(Token.Kind.COMMA)) {
                    advance();
                } else if (!peek(0).is(Token.Kind.RIGHT_BRACE)) {
                    throw unexpected(peek(0), "',' or '}'");
                }
            }
            expect(Token.Kind.RIGHT_BRACE);
            return Collections.unmodifiableMap(entries);
        }

        private List<Object> list(int depth) {
            expect(Token.Kind.LEFT_BRACKET);
            List<Object> items = new ArrayList<>();
            while (!peek(0).is(Token.Kind.RIGHT_BRACKET)) {
                items.add(value(depth + 1));
                if (peek(0).is(Token.Kind.COMMA)) {
                    advance();
                } else if (!peek(0).is(Token.Kind.RIGHT_BRACKET)) {
                    throw unexpected(peek(0), "',' or ']'");
                }
            }
            expect(Token.Kind.RIGHT_BRACKET);
            return Collections.unmodifiableList(items);
        }

        private static Object integer(Token token) {
            try {
                return Long.parseLong(token.text());
            } catch (NumberFormatException e) {
                return token.text();
            }
        }

        private Token peek(int offset) {
            while (lookahead.size() <= offset) {
                lookahead.add(lexer.next());
            }
            return lookahead.get(offset);
        }

        private Token advance() {
            Token token = peek(0);
            if (token.is(Token.Kind.EOF)) {
                throw new SyntaxException(token.start(), "unexpected end of text");
            }
            lookahead.remove(0);
            return token;
        }

        private Token expect(Token.Kind kind) {
            Token token = peek(0);
            if (!token.is(kind)) {
                throw unexpected(token, kind.name());
            }
            return advance();
        }

        private static SyntaxException unexpected(Token token, String expected) {
            if (token.is(Token.Kind.EOF)) {
                return new SyntaxException(token.start(), "unexpected end of text, expected " + expected);
            }
            if (token.is(Token.Kind.ERROR)) {
                return new SyntaxException(token.start(), "invalid input (" + token.text() + "), expected " + expected);
            }
            return new SyntaxException(token.start(), "unexpected '" + token.text() + "', expected " + expected);
        }
    }

    private static final class SyntaxException extends RuntimeException {

        private final int position;

        SyntaxException(int position, String message) {
            super(message);
            this.position = position;
        }
    }
}
