package com.challenges.hushfmt.ast;

public enum UnaryOp {
    MINUS("-"),
    NOT("not"),
    TRY("?");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPostfix() {
        return this == TRY;
    }

    public static UnaryOp fromSymbol(String symbol) {
        for (UnaryOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}
