package com.challenges.hushfmt.symbol;

/**
 * Opaque handle for an interned identifier. Only a {@link SymbolResolver} can turn it back into source text.
 */
public record Symbol(int id) {
    public Symbol {
        if (id < 0) {
            throw new IllegalArgumentException("Symbol handle must not be negative: " + id);
        }
    }

    public static Symbol of(int id) {
        return new Symbol(id);
    }
}
