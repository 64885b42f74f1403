package com.challenges.hushfmt.ast;

public sealed interface RedirectionTarget {
    <C> void accept(Visitor<C> visitor, C context);

    record Fd(int fd) implements RedirectionTarget {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitFd(this, context);
        }
    }

    record Overwrite(Argument target) implements RedirectionTarget {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitOverwrite(this, context);
        }
    }

    record Append(Argument target) implements RedirectionTarget {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitAppend(this, context);
        }
    }

    interface Visitor<C> {
        void visitFd(Fd target, C context);
        void visitOverwrite(Overwrite target, C context);
        void visitAppend(Append target, C context);
    }
}
