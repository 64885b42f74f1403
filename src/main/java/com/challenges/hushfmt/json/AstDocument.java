package com.challenges.hushfmt.json;

import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.symbol.SymbolInterner;

/**
 * A decoded tree together with the symbol table its handles refer to.
 */
public record AstDocument(Ast ast, SymbolInterner symbols) {
}
