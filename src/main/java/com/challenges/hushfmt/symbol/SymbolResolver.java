package com.challenges.hushfmt.symbol;

@FunctionalInterface
public interface SymbolResolver {
    String resolve(Symbol symbol);
}
