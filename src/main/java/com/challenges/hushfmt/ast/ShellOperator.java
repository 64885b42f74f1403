package com.challenges.hushfmt.ast;

public enum ShellOperator {
    PIPE("|"),
    TRY("?"),
    SEQUENCE(";"),
    OUTPUT(">"),
    APPEND(">>"),
    INPUT("<"),
    HERE_STRING("<<");

    private final String token;

    ShellOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
