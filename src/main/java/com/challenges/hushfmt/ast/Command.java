package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public record Command(BasicCommand head, ImmutableList<BasicCommand> tail) {
    public static Command of(BasicCommand head, BasicCommand... tail) {
        return new Command(head, Lists.immutable.of(tail));
    }
}
