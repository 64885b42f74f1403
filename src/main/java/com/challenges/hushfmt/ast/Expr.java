package com.challenges.hushfmt.ast;

import com.challenges.hushfmt.symbol.Symbol;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface Expr permits Expr.Self, Expr.Identifier, Expr.LiteralExpr, Expr.Unary, Expr.Binary,
        Expr.If, Expr.Access, Expr.Call, Expr.CommandBlockExpr, IllFormed {

    <C> void accept(Visitor<C> visitor, C context);

    static Expr literal(Literal literal) {
        return new LiteralExpr(literal);
    }

    static Expr identifier(Symbol symbol) {
        return new Identifier(symbol);
    }

    record Self() implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitSelf(this, context);
        }
    }

    record Identifier(Symbol symbol) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitIdentifier(this, context);
        }
    }

    record LiteralExpr(Literal literal) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitLiteral(this, context);
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitUnary(this, context);
        }
    }

    record Binary(Expr left, BinaryOp op, Expr right) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitBinary(this, context);
        }
    }

    record If(Expr condition, Block then, Block otherwise) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitIf(this, context);
        }
    }

    /**
     * Field access and indexing share this node: {@code obj.name} is {@code obj["name"]} with an
     * identifier literal as the field.
     */
    record Access(Expr object, Expr field) implements Expr {
        public boolean isDotAccess() {
            return field instanceof LiteralExpr expr && expr.literal() instanceof Literal.Identifier;
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitAccess(this, context);
        }
    }

    record Call(Expr function, ImmutableList<Expr> args) implements Expr {
        public static Call of(Expr function, Expr... args) {
            return new Call(function, Lists.immutable.of(args));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitCall(this, context);
        }
    }

    record CommandBlockExpr(CommandBlock block) implements Expr {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitCommandBlock(this, context);
        }
    }

    interface Visitor<C> {
        void visitSelf(Self expr, C context);
        void visitIdentifier(Identifier expr, C context);
        void visitLiteral(LiteralExpr expr, C context);
        void visitUnary(Unary expr, C context);
        void visitBinary(Binary expr, C context);
        void visitIf(If expr, C context);
        void visitAccess(Access expr, C context);
        void visitCall(Call expr, C context);
        void visitCommandBlock(CommandBlockExpr expr, C context);
        void visitIllFormed(IllFormed node, C context);
    }
}
