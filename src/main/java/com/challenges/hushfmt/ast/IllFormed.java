package com.challenges.hushfmt.ast;

/**
 * Stand-in for a region of the script that failed to parse. The same value is a valid
 * {@link Block}, {@link Expr}, {@link Statement} and {@link Redirection}, so renderers
 * handle it once through {@code visitIllFormed}.
 */
public record IllFormed() implements Block, Expr, Statement, Redirection {
    public static final IllFormed INSTANCE = new IllFormed();

    @Override
    public <C> void accept(Block.Visitor<C> visitor, C context) {
        visitor.visitIllFormed(this, context);
    }

    @Override
    public <C> void accept(Expr.Visitor<C> visitor, C context) {
        visitor.visitIllFormed(this, context);
    }

    @Override
    public <C> void accept(Statement.Visitor<C> visitor, C context) {
        visitor.visitIllFormed(this, context);
    }

    @Override
    public <C> void accept(Redirection.Visitor<C> visitor, C context) {
        visitor.visitIllFormed(this, context);
    }
}
