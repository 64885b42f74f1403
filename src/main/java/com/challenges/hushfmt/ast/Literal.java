package com.challenges.hushfmt.ast;

import com.challenges.hushfmt.symbol.Symbol;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableByteList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.ByteLists;

import java.nio.charset.StandardCharsets;

public sealed interface Literal {
    <C> void accept(Visitor<C> visitor, C context);

    record Nil() implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitNil(this, context);
        }
    }

    record Bool(boolean value) implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitBool(this, context);
        }
    }

    record Int(long value) implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitInt(this, context);
        }
    }

    record Float(double value) implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitFloat(this, context);
        }
    }

    record Byte(byte value) implements Literal {
        public static Byte of(char c) {
            return new Byte((byte) c);
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitByte(this, context);
        }
    }

    record ByteString(ImmutableByteList bytes) implements Literal {
        public static ByteString of(String text) {
            return new ByteString(ByteLists.immutable.of(text.getBytes(StandardCharsets.UTF_8)));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitByteString(this, context);
        }
    }

    record Array(ImmutableList<Expr> items) implements Literal {
        public static Array of(Expr... items) {
            return new Array(Lists.immutable.of(items));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitArray(this, context);
        }
    }

    /**
     * Entries keep their source order. Repeated keys are allowed here; which one wins is up to the evaluator.
     */
    record Dict(ImmutableList<DictEntry> entries) implements Literal {
        public static Dict of(DictEntry... entries) {
            return new Dict(Lists.immutable.of(entries));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitDict(this, context);
        }
    }

    record Function(ImmutableList<Parameter> params, Block body) implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitFunction(this, context);
        }
    }

    record Identifier(Symbol symbol) implements Literal {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitIdentifierLiteral(this, context);
        }
    }

    record DictEntry(Symbol key, SourcePos keyPos, Expr value) {}

    record Parameter(Symbol symbol, SourcePos pos) {}

    interface Visitor<C> {
        void visitNil(Nil literal, C context);
        void visitBool(Bool literal, C context);
        void visitInt(Int literal, C context);
        void visitFloat(Float literal, C context);
        void visitByte(Byte literal, C context);
        void visitByteString(ByteString literal, C context);
        void visitArray(Array literal, C context);
        void visitDict(Dict literal, C context);
        void visitFunction(Function literal, C context);
        void visitIdentifierLiteral(Identifier literal, C context);
    }
}
