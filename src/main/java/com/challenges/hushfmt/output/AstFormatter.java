package com.challenges.hushfmt.output;

import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Statement;
import com.challenges.hushfmt.symbol.SymbolResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Consumer;

/**
 * Entry point for rendering. Picks the mode once and formats any node either to a string or straight into an
 * {@link Appendable}.
 */
public class AstFormatter {
    private final AstRenderer renderer;
    private final boolean colorOutput;

    // StringBuilder pool for format(...)
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public AstFormatter(AstRenderer renderer, boolean colorOutput) {
        this.renderer = renderer;
        this.colorOutput = colorOutput;
    }

    public static AstFormatter human(SymbolResolver resolver, boolean prettyPrint, boolean colorOutput) {
        RenderContext context = prettyPrint ? RenderContext.indented(resolver) : RenderContext.compact(resolver);
        return new AstFormatter(new HumanRenderer(context), colorOutput);
    }

    public static AstFormatter diagnostic(boolean expanded) {
        return new AstFormatter(new DiagnosticRenderer(expanded), false);
    }

    public AstRenderer renderer() {
        return renderer;
    }

    public String format(Ast ast) {
        return capture(sink -> renderer.render(ast, sink));
    }

    public String format(Block block) {
        return capture(sink -> renderer.render(block, sink));
    }

    public String format(Statement statement) {
        return capture(sink -> renderer.render(statement, sink));
    }

    public String format(Expr expr) {
        return capture(sink -> renderer.render(expr, sink));
    }

    public String format(Literal literal) {
        return capture(sink -> renderer.render(literal, sink));
    }

    public String format(CommandBlock block) {
        return capture(sink -> renderer.render(block, sink));
    }

    public String format(Argument argument) {
        return capture(sink -> renderer.render(argument, sink));
    }

    public void write(Ast ast, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(ast, sink));
    }

    public void write(Block block, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(block, sink));
    }

    public void write(Statement statement, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(statement, sink));
    }

    public void write(Expr expr, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(expr, sink));
    }

    public void write(Literal literal, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(literal, sink));
    }

    public void write(CommandBlock block, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(block, sink));
    }

    public void write(Argument argument, Appendable out) throws IOException {
        emit(out, sink -> renderer.render(argument, sink));
    }

    private String capture(Consumer<TextSink> action) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        action.accept(new TextSink(sb, colorOutput));

        return sb.toString();
    }

    private void emit(Appendable out, Consumer<TextSink> action) throws IOException {
        try {
            action.accept(new TextSink(out, colorOutput));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
