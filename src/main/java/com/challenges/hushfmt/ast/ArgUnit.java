package com.challenges.hushfmt.ast;

import com.challenges.hushfmt.symbol.Symbol;
import org.eclipse.collections.api.list.primitive.ImmutableByteList;
import org.eclipse.collections.impl.factory.primitive.ByteLists;

import java.nio.charset.StandardCharsets;

public sealed interface ArgUnit {
    <C> void accept(Visitor<C> visitor, C context);

    record Raw(ImmutableByteList bytes) implements ArgUnit {
        public static Raw of(String text) {
            return new Raw(ByteLists.immutable.of(text.getBytes(StandardCharsets.UTF_8)));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitRaw(this, context);
        }
    }

    record Dollar(Symbol symbol, SourcePos pos) implements ArgUnit {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitDollar(this, context);
        }
    }

    interface Visitor<C> {
        void visitRaw(Raw unit, C context);
        void visitDollar(Dollar unit, C context);
    }
}
