package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.ArgExpansion;
import com.challenges.hushfmt.ast.ArgPart;
import com.challenges.hushfmt.ast.ArgUnit;
import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.BasicCommand;
import com.challenges.hushfmt.ast.Command;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.CommandBlockKind;
import com.challenges.hushfmt.ast.IllFormed;
import com.challenges.hushfmt.ast.Redirection;
import com.challenges.hushfmt.ast.RedirectionTarget;
import com.challenges.hushfmt.ast.ShellOperator;

/**
 * Reconstructs command block syntax: quoted arguments, expansions, redirections, pipelines.
 * Only command blocks look at the indentation; everything below them is a single line.
 */
final class ShellRenderer implements ArgPart.Visitor<RenderContext>, ArgUnit.Visitor<RenderContext>,
        ArgExpansion.Visitor<RenderContext>, Redirection.Visitor<RenderContext>,
        RedirectionTarget.Visitor<RenderContext> {

    private final TextSink out;

    ShellRenderer(TextSink out) {
        this.out = out;
    }

    void commandBlock(CommandBlock block, RenderContext context) {
        RenderContext nested = context.indent();

        out.append(block.kind().opening());
        out.append(nested.step());
        command(block.head(), context);

        for (Command command : block.tail()) {
            out.append(ShellOperator.SEQUENCE.token());
            out.append(nested.step());
            command(command, context);
        }

        out.append(context.step());
        out.append(CommandBlockKind.CLOSING);
    }

    void command(Command command, RenderContext context) {
        basicCommand(command.head(), context);

        for (BasicCommand next : command.tail()) {
            out.append(" ").append(ShellOperator.PIPE.token()).append(" ");
            basicCommand(next, context);
        }
    }

    void basicCommand(BasicCommand command, RenderContext context) {
        argument(command.program(), context);

        for (Argument argument : command.arguments()) {
            out.append(" ");
            argument(argument, context);
        }

        for (Redirection redirection : command.redirections()) {
            out.append(" ");
            redirection.accept(this, context);
        }

        if (!command.abortOnError()) {
            out.append(" ").append(ShellOperator.TRY.token());
        }
    }

    void argument(Argument argument, RenderContext context) {
        if (argument.isIllFormed()) {
            HumanRenderer.illFormed(out);
            return;
        }

        out.append('"');
        for (ArgPart part : argument.parts()) {
            part.accept(this, context);
        }
        out.append('"');
    }

    @Override
    public void visitUnit(ArgPart.Unit part, RenderContext context) {
        part.unit().accept(this, context);
    }

    @Override
    public void visitExpansion(ArgPart.Expansion part, RenderContext context) {
        part.expansion().accept(this, context);
    }

    @Override
    public void visitRaw(ArgUnit.Raw unit, RenderContext context) {
        out.append(Escapes.escapeString(Escapes.lossy(unit.bytes())));
    }

    @Override
    public void visitDollar(ArgUnit.Dollar unit, RenderContext context) {
        out.append("${").append(context.name(unit.symbol())).append("}");
    }

    @Override
    public void visitHome(ArgExpansion.Home expansion, RenderContext context) {
        out.append("~/");
    }

    @Override
    public void visitRange(ArgExpansion.Range expansion, RenderContext context) {
        out.append("{").append(Long.toString(expansion.start()))
                .append("..").append(Long.toString(expansion.end())).append("}");
    }

    @Override
    public void visitCollection(ArgExpansion.Collection expansion, RenderContext context) {
        out.append("{");
        out.join(expansion.items(), ",", item -> argument(item, context));
        out.append("}");
    }

    @Override
    public void visitStar(ArgExpansion.Star expansion, RenderContext context) {
        out.append("*");
    }

    @Override
    public void visitQuestion(ArgExpansion.Question expansion, RenderContext context) {
        out.append("?");
    }

    @Override
    public void visitCharClass(ArgExpansion.CharClass expansion, RenderContext context) {
        out.append("[").append(Escapes.escapeString(Escapes.lossy(expansion.chars()))).append("]");
    }

    @Override
    public void visitOutput(Redirection.Output redirection, RenderContext context) {
        out.append(Integer.toString(redirection.source()));
        redirection.target().accept(this, context);
    }

    @Override
    public void visitInput(Redirection.Input redirection, RenderContext context) {
        ShellOperator operator = redirection.literal() ? ShellOperator.HERE_STRING : ShellOperator.INPUT;
        out.append(operator.token());
        argument(redirection.source(), context);
    }

    @Override
    public void visitIllFormed(IllFormed node, RenderContext context) {
        HumanRenderer.illFormed(out);
    }

    @Override
    public void visitFd(RedirectionTarget.Fd target, RenderContext context) {
        out.append(ShellOperator.OUTPUT.token()).append(Integer.toString(target.fd()));
    }

    @Override
    public void visitOverwrite(RedirectionTarget.Overwrite target, RenderContext context) {
        out.append(ShellOperator.OUTPUT.token());
        argument(target.target(), context);
    }

    @Override
    public void visitAppend(RedirectionTarget.Append target, RenderContext context) {
        out.append(ShellOperator.APPEND.token());
        argument(target.target(), context);
    }
}
