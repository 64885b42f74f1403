package com.challenges.hushfmt.ast;

public enum CommandBlockKind {
    SYNCHRONOUS("{"),
    ASYNCHRONOUS("&{"),
    CAPTURE("${");

    public static final String CLOSING = "}";

    private final String opening;

    CommandBlockKind(String opening) {
        this.opening = opening;
    }

    public String opening() {
        return opening;
    }

    /** The opening token without its brace: empty, {@code &} or {@code $}. */
    public String sigil() {
        return opening.substring(0, opening.length() - 1);
    }
}
