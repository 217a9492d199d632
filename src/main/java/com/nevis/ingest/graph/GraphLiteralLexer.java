package com.nevis.ingest.graph;

/**
 * Tokenizer for node and relationship literals. Starts at an arbitrary offset of
 * free-form text and produces tokens on demand, so the parser never tokenizes the
 * prose around a literal.
 */
class GraphLiteralLexer {

    private final String text;
    private int position;

    GraphLiteralLexer(String text, int start) {
        this.text = text;
        this.position = start;
    }

    Token next() {
        skipWhitespace();
        if (position >= text.length()) {
            return new Token(Token.Kind.EOF, "", position, position);
        }

        int start = position;
        char c = text.charAt(position);

        Token.Kind single = switch (c) {
            case '(' -> Token.Kind.LEFT_PAREN;
            case ')' -> Token.Kind.RIGHT_PAREN;
            case '{' -> Token.Kind.LEFT_BRACE;
            case '}' -> Token.Kind.RIGHT_BRACE;
            case '[' -> Token.Kind.LEFT_BRACKET;
            case ']' -> Token.Kind.RIGHT_BRACKET;
            case ',' -> Token.Kind.COMMA;
            case '=' -> Token.Kind.EQUALS;
            case ':' -> Token.Kind.COLON;
            default -> null;
        };
        if (single != null) {
            position++;
            return new Token(single, String.valueOf(c), start, position);
        }

        if (c == '\'' || c == '"') {
            return string(c);
        }
        if (Character.isDigit(c) || (c == '-' && position + 1 < text.length() && Character.isDigit(text.charAt(position + 1)))) {
            position++;
            while (position < text.length() && Character.isDigit(text.charAt(position))) {
                position++;
            }
            return new Token(Token.Kind.INTEGER, text.substring(start, position), start, position);
        }
        if (Character.isLetter(c) || c == '_') {
            while (position < text.length() && isIdentifierPart(text.charAt(position))) {
                position++;
            }
            return new Token(Token.Kind.IDENTIFIER, text.substring(start, position), start, position);
        }

        position++;
        return new Token(Token.Kind.ERROR, String.valueOf(c), start, position);
    }

    private Token string(char quote) {
        int start = position;
        StringBuilder value = new StringBuilder();
        position++;
        while (position < text.length()) {
            char c = text.charAt(position);
            if (c == '\\' && position + 1 < text.length()) {
                char escaped = text.charAt(position + 1);
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> escaped;
                });
                position += 2;
                continue;
            }
            if (c == quote) {
                position++;
                return new Token(Token.Kind.STRING, value.toString(), start, position);
            }
            if (c == '\n') {
                break;
            }
            value.append(c);
            position++;
        }
        return new Token(Token.Kind.ERROR, "unterminated string", start, position);
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
