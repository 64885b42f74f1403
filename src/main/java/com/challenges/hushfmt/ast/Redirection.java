package com.challenges.hushfmt.ast;

public sealed interface Redirection permits Redirection.Output, Redirection.Input, IllFormed {
    <C> void accept(Visitor<C> visitor, C context);

    record Output(int source, RedirectionTarget target) implements Redirection {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitOutput(this, context);
        }
    }

    /**
     * {@code literal} marks a here-string ({@code <<}), where the argument itself is fed to stdin.
     */
    record Input(boolean literal, Argument source) implements Redirection {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitInput(this, context);
        }
    }

    interface Visitor<C> {
        void visitOutput(Output redirection, C context);
        void visitInput(Input redirection, C context);
        void visitIllFormed(IllFormed node, C context);
    }
}
