package com.challenges.hushfmt.ast;

public sealed interface ArgPart {
    <C> void accept(Visitor<C> visitor, C context);

    static ArgPart unit(ArgUnit unit) {
        return new Unit(unit);
    }

    static ArgPart expansion(ArgExpansion expansion) {
        return new Expansion(expansion);
    }

    record Unit(ArgUnit unit) implements ArgPart {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitUnit(this, context);
        }
    }

    record Expansion(ArgExpansion expansion) implements ArgPart {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitExpansion(this, context);
        }
    }

    interface Visitor<C> {
        void visitUnit(Unit part, C context);
        void visitExpansion(Expansion part, C context);
    }
}
