package com.challenges.hushfmt.ast;

import java.util.Locale;

public enum Keyword {
    LET,
    IF,
    THEN,
    ELSE,
    END,
    FOR,
    IN,
    DO,
    WHILE,
    FUNCTION,
    RETURN,
    BREAK,
    SELF;

    private final String text = name().toLowerCase(Locale.ROOT);

    public String text() {
        return text;
    }
}
