package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Statement;

/**
 * Source-like rendering with resolved names and colored keywords, literals and error markers.
 * Every call starts from the same base context; nested nodes only ever see copies of it.
 */
public class HumanRenderer implements AstRenderer {
    public static final String ILL_FORMED = "***ill-formed***";

    private final RenderContext context;

    public HumanRenderer(RenderContext context) {
        this.context = context;
    }

    public RenderContext context() {
        return context;
    }

    static void illFormed(TextSink out) {
        out.append(Style.ERROR, ILL_FORMED);
    }

    @Override
    public void render(Ast ast, TextSink out) {
        if (context.isIndented()) {
            out.append(Style.HEADER, "AST").append(" for ").append(context.name(ast.source())).append("\n");
        }
        ast.statements().accept(new CoreRenderer(out), context);
    }

    @Override
    public void render(Block block, TextSink out) {
        block.accept(new CoreRenderer(out), context);
    }

    @Override
    public void render(Statement statement, TextSink out) {
        statement.accept(new CoreRenderer(out), context);
    }

    @Override
    public void render(Expr expr, TextSink out) {
        expr.accept(new CoreRenderer(out), context);
    }

    @Override
    public void render(Literal literal, TextSink out) {
        literal.accept(new CoreRenderer(out), context);
    }

    @Override
    public void render(CommandBlock block, TextSink out) {
        new ShellRenderer(out).commandBlock(block, context);
    }

    @Override
    public void render(Argument argument, TextSink out) {
        new ShellRenderer(out).argument(argument, context);
    }
}
