package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Statement;

/**
 * One rendering mode. Implementations write the whole subtree to the sink in one pass and keep no state between
 * calls.
 */
public interface AstRenderer {
    void render(Ast ast, TextSink out);

    void render(Block block, TextSink out);

    void render(Statement statement, TextSink out);

    void render(Expr expr, TextSink out);

    void render(Literal literal, TextSink out);

    void render(CommandBlock block, TextSink out);

    void render(Argument argument, TextSink out);
}
