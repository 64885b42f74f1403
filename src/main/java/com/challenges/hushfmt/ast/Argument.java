package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A single shell word. There is no ill-formed variant: the parser signals failure by tagging the
 * argument with {@link SourcePos#ILL_FORMED}.
 */
public record Argument(ImmutableList<ArgPart> parts, SourcePos pos) {
    public static Argument of(SourcePos pos, ArgPart... parts) {
        return new Argument(Lists.immutable.of(parts), pos);
    }

    public static Argument literal(String text) {
        return new Argument(Lists.immutable.of(ArgPart.unit(ArgUnit.Raw.of(text))), SourcePos.of(1, 1));
    }

    public static Argument illFormed() {
        return new Argument(Lists.immutable.empty(), SourcePos.ILL_FORMED);
    }

    public boolean isIllFormed() {
        return pos.isIllFormed();
    }
}
