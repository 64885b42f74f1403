package com.challenges.hushfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public record BasicCommand(
        Argument program,
        ImmutableList<Argument> arguments,
        ImmutableList<Redirection> redirections,
        boolean abortOnError) {

    public static BasicCommand of(String program, String... arguments) {
        return new BasicCommand(
                Argument.literal(program),
                Lists.immutable.of(arguments).collect(Argument::literal),
                Lists.immutable.empty(),
                true);
    }

    public BasicCommand withRedirections(Redirection... redirections) {
        return new BasicCommand(program, arguments, Lists.immutable.of(redirections), abortOnError);
    }

    public BasicCommand tolerant() {
        return new BasicCommand(program, arguments, redirections, false);
    }
}
