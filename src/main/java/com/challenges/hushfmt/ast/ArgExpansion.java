package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableByteList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.ByteLists;

import java.nio.charset.StandardCharsets;

public sealed interface ArgExpansion {
    <C> void accept(Visitor<C> visitor, C context);

    record Home() implements ArgExpansion {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitHome(this, context);
        }
    }

    // inclusive on both ends
    record Range(long start, long end) implements ArgExpansion {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitRange(this, context);
        }
    }

    record Collection(ImmutableList<Argument> items) implements ArgExpansion {
        public static Collection of(Argument... items) {
            return new Collection(Lists.immutable.of(items));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitCollection(this, context);
        }
    }

    record Star() implements ArgExpansion {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitStar(this, context);
        }
    }

    record Question() implements ArgExpansion {
        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitQuestion(this, context);
        }
    }

    record CharClass(ImmutableByteList chars) implements ArgExpansion {
        public static CharClass of(String chars) {
            return new CharClass(ByteLists.immutable.of(chars.getBytes(StandardCharsets.UTF_8)));
        }

        @Override
        public <C> void accept(Visitor<C> visitor, C context) {
            visitor.visitCharClass(this, context);
        }
    }

    interface Visitor<C> {
        void visitHome(Home expansion, C context);
        void visitRange(Range expansion, C context);
        void visitCollection(Collection expansion, C context);
        void visitStar(Star expansion, C context);
        void visitQuestion(Question expansion, C context);
        void visitCharClass(CharClass expansion, C context);
    }
}
