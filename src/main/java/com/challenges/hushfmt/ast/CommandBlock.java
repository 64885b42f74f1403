package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Shell commands embedded in an expression, run in sequence: {@code { head; tail[0]; ... }}.
 */
public record CommandBlock(CommandBlockKind kind, Command head, ImmutableList<Command> tail) {
    public static CommandBlock of(CommandBlockKind kind, Command head, Command... tail) {
        return new CommandBlock(kind, head, Lists.immutable.of(tail));
    }

    public ImmutableList<Command> commands() {
        return Lists.immutable.of(head).newWithAll(tail);
    }
}
