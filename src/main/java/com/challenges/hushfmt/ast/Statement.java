package com.challenges.hushfmt.ast;

import com.challenges.hushfmt.symbol.Symbol;

public sealed interface Statement permits Statement.Let, Statement.Assign, Statement.Return, Statement.Break,
        Statement.While, Statement.For, Statement.ExprStatement, IllFormed {

    <C> void accept(Visitor<C> visitor, C context);

    static Statement expr(Expr expr) {
        return new ExprStatement(expr);
    }

    record Let(Symbol identifier, Expr init) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitLet(this, context);
        }
    }

    record Assign(Expr left, Expr right) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitAssign(this, context);
        }
    }

    record Return(Expr expr) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitReturn(this, context);
        }
    }

    record Break() implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitBreak(this, context);
        }
    }

    record While(Expr condition, Block body) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitWhile(this, context);
        }
    }

    record For(Symbol identifier, Expr iterable, Block body) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitFor(this, context);
        }
    }

    record ExprStatement(Expr expr) implements Statement {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitExprStatement(this, context);
        }
    }

    interface Visitor<C> {
        void visitLet(Let statement, C context);
        void visitAssign(Assign statement, C context);
        void visitReturn(Return statement, C context);
        void visitBreak(Break statement, C context);
        void visitWhile(While statement, C context);
        void visitFor(For statement, C context);
        void visitExprStatement(ExprStatement statement, C context);
        void visitIllFormed(IllFormed node, C context);
    }
}
