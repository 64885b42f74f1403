package com.challenges.hushfmt.ast;

import com.challenges.hushfmt.symbol.Symbol;

import java.nio.file.Path;

public record Ast(Block statements, Symbol source, Path path) {
}
