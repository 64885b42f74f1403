package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.ArgExpansion;
import com.challenges.hushfmt.ast.ArgPart;
import com.challenges.hushfmt.ast.ArgUnit;
import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.BasicCommand;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.Command;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.IllFormed;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Redirection;
import com.challenges.hushfmt.ast.RedirectionTarget;
import com.challenges.hushfmt.ast.Statement;
import com.challenges.hushfmt.symbol.Symbol;

/**
 * Lossless developer dump of the tree. Identifiers stay as raw {@code id#N} handles, every operator application is
 * parenthesized, and nothing is colored. The {@code expanded} flag applies to the whole call.
 */
public class DiagnosticRenderer implements AstRenderer,
        Block.Visitor<TextSink>, Literal.Visitor<TextSink>, Expr.Visitor<TextSink>, Statement.Visitor<TextSink>,
        ArgPart.Visitor<TextSink>, ArgUnit.Visitor<TextSink>, ArgExpansion.Visitor<TextSink>,
        Redirection.Visitor<TextSink>, RedirectionTarget.Visitor<TextSink> {

    private final boolean expanded;

    public DiagnosticRenderer(boolean expanded) {
        this.expanded = expanded;
    }

    public boolean isExpanded() {
        return expanded;
    }

    @Override
    public void render(Ast ast, TextSink out) {
        if (expanded) {
            out.append("AST for ").append(String.valueOf(ast.path())).append("\n");
        }
        ast.statements().accept(this, out);
        out.append("\n");
    }

    @Override
    public void render(Block block, TextSink out) {
        block.accept(this, out);
    }

    @Override
    public void render(Statement statement, TextSink out) {
        statement.accept(this, out);
    }

    @Override
    public void render(Expr expr, TextSink out) {
        expr.accept(this, out);
    }

    @Override
    public void render(Literal literal, TextSink out) {
        literal.accept(this, out);
    }

    @Override
    public void render(CommandBlock block, TextSink out) {
        commandBlock(block, out);
    }

    @Override
    public void render(Argument argument, TextSink out) {
        argument(argument, out);
    }

    // ============================================================
    // Blocks, literals, expressions, statements
    // ============================================================

    @Override
    public void visitStatements(Block.Statements block, TextSink out) {
        if (expanded) {
            DebugStructure.set(out, true)
                    .entries(block.statements(), (statement, sink) -> statement.accept(this, sink))
                    .finish();
        } else {
            for (Statement statement : block.statements()) {
                statement.accept(this, out);
                out.append("; ");
            }
        }
    }

    @Override
    public void visitIllFormed(IllFormed node, TextSink out) {
        out.append("IllFormed");
    }

    @Override
    public void visitNil(Literal.Nil literal, TextSink out) {
        out.append("nil");
    }

    @Override
    public void visitBool(Literal.Bool literal, TextSink out) {
        out.append(String.valueOf(literal.value()));
    }

    @Override
    public void visitInt(Literal.Int literal, TextSink out) {
        out.append(Long.toString(literal.value()));
    }

    @Override
    public void visitFloat(Literal.Float literal, TextSink out) {
        out.append(FloatText.of(literal.value()));
    }

    @Override
    public void visitByte(Literal.Byte literal, TextSink out) {
        out.append('\'').append(Escapes.escapeChar((char) (literal.value() & 0xFF))).append('\'');
    }

    @Override
    public void visitByteString(Literal.ByteString literal, TextSink out) {
        quoted(Escapes.lossy(literal.bytes()), out);
    }

    @Override
    public void visitArray(Literal.Array literal, TextSink out) {
        DebugStructure.list(out, expanded)
                .entries(literal.items(), (item, sink) -> item.accept(this, sink))
                .finish();
    }

    @Override
    public void visitDict(Literal.Dict literal, TextSink out) {
        DebugStructure map = DebugStructure.map(out, expanded);
        for (Literal.DictEntry entry : literal.entries()) {
            map.entry(
                    sink -> sink.append("(").append(id(entry.key())).append(", ").append(entry.keyPos().toString()).append(")"),
                    sink -> entry.value().accept(this, sink));
        }
        map.finish();
    }

    @Override
    public void visitFunction(Literal.Function literal, TextSink out) {
        out.append("function(");
        out.join(literal.params(), ", ", param -> out.append(id(param.symbol())));
        out.append(") ");
        literal.body().accept(this, out);
        if (!expanded) {
            out.append(" end");
        }
    }

    @Override
    public void visitIdentifierLiteral(Literal.Identifier literal, TextSink out) {
        out.append(id(literal.symbol()));
    }

    @Override
    public void visitSelf(Expr.Self expr, TextSink out) {
        out.append("self");
    }

    @Override
    public void visitIdentifier(Expr.Identifier expr, TextSink out) {
        out.append(id(expr.symbol()));
    }

    @Override
    public void visitLiteral(Expr.LiteralExpr expr, TextSink out) {
        expr.literal().accept(this, out);
    }

    @Override
    public void visitUnary(Expr.Unary expr, TextSink out) {
        out.append("(").append(expr.op().symbol()).append(" ");
        expr.operand().accept(this, out);
        out.append(")");
    }

    @Override
    public void visitBinary(Expr.Binary expr, TextSink out) {
        out.append("(");
        expr.left().accept(this, out);
        out.append(" ").append(expr.op().symbol()).append(" ");
        expr.right().accept(this, out);
        out.append(")");
    }

    @Override
    public void visitIf(Expr.If expr, TextSink out) {
        out.append("if ");
        expr.condition().accept(this, out);
        out.append(expanded ? " " : " then ");
        expr.then().accept(this, out);
        out.append(" else ");
        expr.otherwise().accept(this, out);
        if (!expanded) {
            out.append(" end");
        }
    }

    @Override
    public void visitAccess(Expr.Access expr, TextSink out) {
        expr.object().accept(this, out);
        out.append("[");
        expr.field().accept(this, out);
        out.append("]");
    }

    @Override
    public void visitCall(Expr.Call expr, TextSink out) {
        expr.function().accept(this, out);
        out.append("(");
        out.join(expr.args(), ", ", arg -> arg.accept(this, out));
        out.append(")");
    }

    @Override
    public void visitCommandBlock(Expr.CommandBlockExpr expr, TextSink out) {
        commandBlock(expr.block(), out);
    }

    @Override
    public void visitLet(Statement.Let statement, TextSink out) {
        out.append("let ").append(id(statement.identifier())).append(" = ");
        statement.init().accept(this, out);
    }

    @Override
    public void visitAssign(Statement.Assign statement, TextSink out) {
        statement.left().accept(this, out);
        out.append(" = ");
        statement.right().accept(this, out);
    }

    @Override
    public void visitReturn(Statement.Return statement, TextSink out) {
        out.append("return ");
        statement.expr().accept(this, out);
    }

    @Override
    public void visitBreak(Statement.Break statement, TextSink out) {
        out.append("break");
    }

    @Override
    public void visitWhile(Statement.While statement, TextSink out) {
        out.append("while ");
        statement.condition().accept(this, out);
        out.append(" do ");
        loopBody(statement.body(), out);
    }

    @Override
    public void visitFor(Statement.For statement, TextSink out) {
        out.append("for ").append(id(statement.identifier())).append(" in ");
        statement.iterable().accept(this, out);
        out.append(" do ");
        loopBody(statement.body(), out);
    }

    @Override
    public void visitExprStatement(Statement.ExprStatement statement, TextSink out) {
        statement.expr().accept(this, out);
    }

    private void loopBody(Block body, TextSink out) {
        body.accept(this, out);
        if (!expanded) {
            out.append(" end");
        }
    }

    // ============================================================
    // Shell constructs
    // ============================================================

    private void commandBlock(CommandBlock block, TextSink out) {
        out.append(block.kind().sigil());
        DebugStructure.set(out, expanded)
                .entries(block.commands(), this::command)
                .finish();
    }

    private void command(Command command, TextSink out) {
        DebugStructure.struct(out, expanded, "Command")
                .field("head", sink -> basicCommand(command.head(), sink))
                .field("tail", sink -> DebugStructure.list(sink, expanded)
                        .entries(command.tail(), this::basicCommand)
                        .finish())
                .finish();
    }

    private void basicCommand(BasicCommand command, TextSink out) {
        DebugStructure.struct(out, expanded, "BasicCommand")
                .field("program", sink -> argument(command.program(), sink))
                .field("arguments", sink -> DebugStructure.list(sink, expanded)
                        .entries(command.arguments(), this::argument)
                        .finish())
                .field("redirections", sink -> DebugStructure.list(sink, expanded)
                        .entries(command.redirections(), (redirection, inner) -> redirection.accept(this, inner))
                        .finish())
                .field("abortOnError", sink -> sink.append(String.valueOf(command.abortOnError())))
                .finish();
    }

    private void argument(Argument argument, TextSink out) {
        DebugStructure.struct(out, expanded, "Argument")
                .field("parts", sink -> DebugStructure.list(sink, expanded)
                        .entries(argument.parts(), (part, inner) -> part.accept(this, inner))
                        .finish())
                .field("pos", sink -> sink.append(argument.pos().toString()))
                .finish();
    }

    @Override
    public void visitUnit(ArgPart.Unit part, TextSink out) {
        part.unit().accept(this, out);
    }

    @Override
    public void visitExpansion(ArgPart.Expansion part, TextSink out) {
        part.expansion().accept(this, out);
    }

    @Override
    public void visitRaw(ArgUnit.Raw unit, TextSink out) {
        DebugStructure.tuple(out, expanded, "Raw")
                .entry(sink -> quoted(Escapes.lossy(unit.bytes()), sink))
                .finish();
    }

    @Override
    public void visitDollar(ArgUnit.Dollar unit, TextSink out) {
        DebugStructure.tuple(out, expanded, "Dollar")
                .entry(sink -> sink.append(id(unit.symbol())))
                .entry(sink -> sink.append(unit.pos().toString()))
                .finish();
    }

    @Override
    public void visitHome(ArgExpansion.Home expansion, TextSink out) {
        out.append("Home");
    }

    @Override
    public void visitRange(ArgExpansion.Range expansion, TextSink out) {
        DebugStructure.tuple(out, expanded, "Range")
                .entry(sink -> sink.append(Long.toString(expansion.start())))
                .entry(sink -> sink.append(Long.toString(expansion.end())))
                .finish();
    }

    @Override
    public void visitCollection(ArgExpansion.Collection expansion, TextSink out) {
        DebugStructure.tuple(out, expanded, "Collection")
                .entry(sink -> DebugStructure.list(sink, expanded)
                        .entries(expansion.items(), this::argument)
                        .finish())
                .finish();
    }

    @Override
    public void visitStar(ArgExpansion.Star expansion, TextSink out) {
        out.append("Star");
    }

    @Override
    public void visitQuestion(ArgExpansion.Question expansion, TextSink out) {
        out.append("Question");
    }

    @Override
    public void visitCharClass(ArgExpansion.CharClass expansion, TextSink out) {
        DebugStructure.tuple(out, expanded, "CharClass")
                .entry(sink -> quoted(Escapes.lossy(expansion.chars()), sink))
                .finish();
    }

    @Override
    public void visitOutput(Redirection.Output redirection, TextSink out) {
        DebugStructure.struct(out, expanded, "Output")
                .field("source", sink -> sink.append(Integer.toString(redirection.source())))
                .field("target", sink -> redirection.target().accept(this, sink))
                .finish();
    }

    @Override
    public void visitInput(Redirection.Input redirection, TextSink out) {
        DebugStructure.struct(out, expanded, "Input")
                .field("literal", sink -> sink.append(String.valueOf(redirection.literal())))
                .field("source", sink -> argument(redirection.source(), sink))
                .finish();
    }

    @Override
    public void visitFd(RedirectionTarget.Fd target, TextSink out) {
        DebugStructure.tuple(out, expanded, "Fd")
                .entry(sink -> sink.append(Integer.toString(target.fd())))
                .finish();
    }

    @Override
    public void visitOverwrite(RedirectionTarget.Overwrite target, TextSink out) {
        DebugStructure.tuple(out, expanded, "Overwrite")
                .entry(sink -> argument(target.target(), sink))
                .finish();
    }

    @Override
    public void visitAppend(RedirectionTarget.Append target, TextSink out) {
        DebugStructure.tuple(out, expanded, "Append")
                .entry(sink -> argument(target.target(), sink))
                .finish();
    }

    private static String id(Symbol symbol) {
        return "id#" + symbol.id();
    }

    private static void quoted(String text, TextSink out) {
        out.append('"').append(Escapes.escapeString(text)).append('"');
    }
}
