package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.IllFormed;
import com.challenges.hushfmt.ast.Keyword;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Statement;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.function.Consumer;

/**
 * Human rendering of blocks, literals, expressions and statements.
 * <p>
 * Operator operands, conditions, call arguments and access targets are always rendered inlined. Right-hand sides of
 * let, assignment and return keep the ambient layout so a function literal bound by {@code let} can span lines.
 */
final class CoreRenderer implements Block.Visitor<RenderContext>, Literal.Visitor<RenderContext>,
        Expr.Visitor<RenderContext>, Statement.Visitor<RenderContext> {

    private final TextSink out;
    private final ShellRenderer shell;

    CoreRenderer(TextSink out) {
        this.out = out;
        this.shell = new ShellRenderer(out);
    }

    // ============================================================
    // Blocks
    // ============================================================

    @Override
    public void visitStatements(Block.Statements block, RenderContext context) {
        out.join(block.statements(), context.statementSeparator(), statement -> {
            out.append(context.lineStart());
            statement.accept(this, context);
        });
    }

    @Override
    public void visitIllFormed(IllFormed node, RenderContext context) {
        HumanRenderer.illFormed(out);
    }

    /**
     * Body of a conditional branch, loop or function, one level deeper than {@code context}. Writes nothing for an
     * empty block; the caller closes the construct with {@link RenderContext#step()}.
     */
    private void nestedBlock(Block block, RenderContext context) {
        if (block.isEmpty()) {
            return;
        }
        RenderContext nested = context.indent();
        if (context.isIndented()) {
            out.append("\n");
        }
        if (block instanceof IllFormed) {
            out.append(nested.lineStart());
        }
        block.accept(this, nested);
    }

    private void keyword(Keyword keyword) {
        out.append(Style.KEYWORD, keyword.text());
    }

    // ============================================================
    // Literals
    // ============================================================

    @Override
    public void visitNil(Literal.Nil literal, RenderContext context) {
        out.append(Style.LITERAL, "nil");
    }

    @Override
    public void visitBool(Literal.Bool literal, RenderContext context) {
        out.append(Style.LITERAL, String.valueOf(literal.value()));
    }

    @Override
    public void visitInt(Literal.Int literal, RenderContext context) {
        out.append(Long.toString(literal.value()));
    }

    @Override
    public void visitFloat(Literal.Float literal, RenderContext context) {
        out.append(FloatText.of(literal.value()));
    }

    @Override
    public void visitByte(Literal.Byte literal, RenderContext context) {
        out.append('\'')
                .append(Style.STRING, Escapes.escapeChar((char) (literal.value() & 0xFF)))
                .append('\'');
    }

    @Override
    public void visitByteString(Literal.ByteString literal, RenderContext context) {
        out.append('"')
                .append(Style.STRING, Escapes.escapeString(Escapes.lossy(literal.bytes())))
                .append('"');
    }

    @Override
    public void visitArray(Literal.Array literal, RenderContext context) {
        RenderContext nested = context.indent();
        out.append("[");
        elements(literal.items(), context, item -> item.accept(this, nested));
        out.append("]");
    }

    @Override
    public void visitDict(Literal.Dict literal, RenderContext context) {
        RenderContext nested = context.indent();
        out.append("@[");
        elements(literal.entries(), context, entry -> {
            out.append(nested.name(entry.key())).append(": ");
            entry.value().accept(this, nested);
        });
        out.append("]");
    }

    private <T> void elements(ImmutableList<T> elements, RenderContext context, Consumer<T> each) {
        RenderContext nested = context.indent();
        out.join(elements, ",", element -> {
            out.append(nested.step());
            each.accept(element);
        });
        if (elements.notEmpty()) {
            out.append(context.step());
        }
    }

    @Override
    public void visitFunction(Literal.Function literal, RenderContext context) {
        keyword(Keyword.FUNCTION);
        out.append("(");
        out.join(literal.params(), ", ", param -> out.append(context.name(param.symbol())));
        out.append(")");
        nestedBlock(literal.body(), context);
        out.append(context.step());
        keyword(Keyword.END);
    }

    @Override
    public void visitIdentifierLiteral(Literal.Identifier literal, RenderContext context) {
        out.append(context.name(literal.symbol()));
    }

    // ============================================================
    // Expressions
    // ============================================================

    @Override
    public void visitSelf(Expr.Self expr, RenderContext context) {
        keyword(Keyword.SELF);
    }

    @Override
    public void visitIdentifier(Expr.Identifier expr, RenderContext context) {
        out.append(context.name(expr.symbol()));
    }

    @Override
    public void visitLiteral(Expr.LiteralExpr expr, RenderContext context) {
        expr.literal().accept(this, context);
    }

    @Override
    public void visitUnary(Expr.Unary expr, RenderContext context) {
        boolean postfix = expr.op().isPostfix();

        out.append("(");
        if (!postfix) {
            out.append(expr.op().symbol()).append(" ");
        }
        expr.operand().accept(this, context.inlined());
        if (postfix) {
            out.append(" ").append(expr.op().symbol());
        }
        out.append(")");
    }

    @Override
    public void visitBinary(Expr.Binary expr, RenderContext context) {
        out.append("(");
        expr.left().accept(this, context.inlined());
        out.append(" ").append(expr.op().symbol()).append(" ");
        expr.right().accept(this, context.inlined());
        out.append(")");
    }

    @Override
    public void visitIf(Expr.If expr, RenderContext context) {
        keyword(Keyword.IF);
        out.append(" ");
        expr.condition().accept(this, context.inlined());

        if (!expr.then().isEmpty()) {
            out.append(" ");
            keyword(Keyword.THEN);
            nestedBlock(expr.then(), context);
        }

        if (!expr.otherwise().isEmpty()) {
            out.append(context.step());
            keyword(Keyword.ELSE);
            nestedBlock(expr.otherwise(), context);
        }

        out.append(context.step());
        keyword(Keyword.END);
    }

    @Override
    public void visitAccess(Expr.Access expr, RenderContext context) {
        RenderContext inlined = context.inlined();
        expr.object().accept(this, inlined);
        if (expr.isDotAccess()) {
            out.append(".");
            expr.field().accept(this, inlined);
        } else {
            out.append("[");
            expr.field().accept(this, inlined);
            out.append("]");
        }
    }

    @Override
    public void visitCall(Expr.Call expr, RenderContext context) {
        RenderContext inlined = context.inlined();
        expr.function().accept(this, inlined);
        out.append("(");
        out.join(expr.args(), ", ", arg -> arg.accept(this, inlined));
        out.append(")");
    }

    @Override
    public void visitCommandBlock(Expr.CommandBlockExpr expr, RenderContext context) {
        shell.commandBlock(expr.block(), context);
    }

    // ============================================================
    // Statements
    // ============================================================

    @Override
    public void visitLet(Statement.Let statement, RenderContext context) {
        keyword(Keyword.LET);
        out.append(" ").append(context.name(statement.identifier())).append(" = ");
        statement.init().accept(this, context);
    }

    @Override
    public void visitAssign(Statement.Assign statement, RenderContext context) {
        statement.left().accept(this, context.inlined());
        out.append(" = ");
        statement.right().accept(this, context);
    }

    @Override
    public void visitReturn(Statement.Return statement, RenderContext context) {
        keyword(Keyword.RETURN);
        out.append(" ");
        statement.expr().accept(this, context);
    }

    @Override
    public void visitBreak(Statement.Break statement, RenderContext context) {
        keyword(Keyword.BREAK);
    }

    @Override
    public void visitWhile(Statement.While statement, RenderContext context) {
        keyword(Keyword.WHILE);
        out.append(" ");
        statement.condition().accept(this, context.inlined());
        out.append(" ");
        loop(statement.body(), context);
    }

    @Override
    public void visitFor(Statement.For statement, RenderContext context) {
        keyword(Keyword.FOR);
        out.append(" ").append(context.name(statement.identifier())).append(" ");
        keyword(Keyword.IN);
        out.append(" ");
        statement.iterable().accept(this, context.inlined());
        out.append(" ");
        loop(statement.body(), context);
    }

    private void loop(Block body, RenderContext context) {
        keyword(Keyword.DO);
        nestedBlock(body, context);
        out.append(context.step());
        keyword(Keyword.END);
    }

    @Override
    public void visitExprStatement(Statement.ExprStatement statement, RenderContext context) {
        statement.expr().accept(this, context);
    }
}
