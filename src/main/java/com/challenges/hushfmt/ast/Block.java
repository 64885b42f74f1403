package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface Block permits Block.Statements, IllFormed {
    <C> void accept(Visitor<C> visitor, C context);

    // an ill-formed block is never empty
    default boolean isEmpty() {
        return this instanceof Statements block && block.statements().isEmpty();
    }

    static Block of(Statement... statements) {
        return new Statements(Lists.immutable.of(statements));
    }

    static Block empty() {
        return new Statements(Lists.immutable.empty());
    }

    record Statements(ImmutableList<Statement> statements) implements Block {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitStatements(this, context);
        }
    }

    interface Visitor<C> {
        void visitStatements(Statements block, C context);
        void visitIllFormed(IllFormed node, C context);
    }
}
