package com.nevis.ingest.graph;

record Token(Kind kind, String text, int start, int end) {

    enum Kind {
        IDENTIFIER,
        STRING,
        INTEGER,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACE,
        RIGHT_BRACE,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        COMMA,
        EQUALS,
        COLON,
        ERROR,
        EOF
    }

    boolean is(Kind expected) {
        return kind == expected;
    }
}
