package com.challenges.hushfmt.output;

import com.challenges.hushfmt.AstFixtures;
import com.challenges.hushfmt.ast.ArgExpansion;
import com.challenges.hushfmt.ast.ArgPart;
import com.challenges.hushfmt.ast.ArgUnit;
import com.challenges.hushfmt.ast.Argument;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.BasicCommand;
import com.challenges.hushfmt.ast.BinaryOp;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.Command;
import com.challenges.hushfmt.ast.CommandBlock;
import com.challenges.hushfmt.ast.CommandBlockKind;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.IllFormed;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Redirection;
import com.challenges.hushfmt.ast.RedirectionTarget;
import com.challenges.hushfmt.ast.SourcePos;
import com.challenges.hushfmt.ast.Statement;
import com.challenges.hushfmt.ast.UnaryOp;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static com.challenges.hushfmt.AstFixtures.binary;
import static com.challenges.hushfmt.AstFixtures.bool;
import static com.challenges.hushfmt.AstFixtures.integer;
import static com.challenges.hushfmt.AstFixtures.stmt;
import static com.challenges.hushfmt.AstFixtures.string;
import static com.challenges.hushfmt.AstFixtures.unary;
import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticRendererTest {

    private final AstFixtures fx = new AstFixtures();
    private final AstFormatter compact = AstFormatter.diagnostic(false);
    private final AstFormatter expanded = AstFormatter.diagnostic(true);

    // ============================================================
    // Core nodes
    // ============================================================

    @Test
    public void testIdentifiersStayAsHandles() {
        Block block = Block.of(fx.let("x", integer(1)), stmt(fx.id("x")));

        assertEquals("let id#0 = 1; id#0; ", compact.format(block));
    }

    @Test
    public void testExpandedBlockIsOneEntryPerLine() {
        Block block = Block.of(fx.let("x", integer(1)), stmt(fx.id("x")));

        assertEquals("{\n    let id#0 = 1,\n    id#0,\n}", expanded.format(block));
    }

    @Test
    public void testOperatorsAreParenthesized() {
        Expr expr = binary(unary(UnaryOp.MINUS, integer(1)), BinaryOp.PLUS, unary(UnaryOp.TRY, fx.id("f")));

        assertEquals("((- 1) + (? id#0))", compact.format(expr));
    }

    @Test
    public void testConditional() {
        Expr conditional = new Expr.If(bool(true), Block.of(stmt(fx.id("x"))), Block.empty());

        assertEquals("if true then id#0;  else  end", compact.format(conditional));
    }

    @Test
    public void testExpandedConditional() {
        Expr conditional = new Expr.If(fx.id("c"), Block.of(stmt(integer(1))), Block.empty());

        assertEquals("if id#0 {\n    1,\n} else {}", expanded.format(conditional));
    }

    @Test
    public void testFunctionLiteral() {
        Expr function = Expr.literal(fx.function(Block.of(new Statement.Return(fx.id("a"))), "a"));

        assertEquals("function(id#0) return id#0;  end", compact.format(function));
    }

    @Test
    public void testDictKeepsKeyPositions() {
        Expr dict = Expr.literal(Literal.Dict.of(fx.entry("k", integer(1))));

        assertEquals("{(id#0, 1:2): 1}", compact.format(dict));
    }

    @Test
    public void testArraysAndStrings() {
        Expr array = Expr.literal(Literal.Array.of(string("a\nb"), Expr.literal(Literal.Byte.of('\t'))));

        assertEquals("[\"a\\nb\", '\\t']", compact.format(array));
        assertEquals("[\n    \"a\\nb\",\n    '\\t',\n]", expanded.format(array));
    }

    @Test
    public void testAccessAlwaysUsesBrackets() {
        Expr access = new Expr.Access(fx.id("obj"), fx.field("name"));

        assertEquals("id#0[id#1]", compact.format(access));
    }

    @Test
    public void testLoops() {
        Statement loop = new Statement.For(fx.sym("x"), fx.id("xs"), Block.of(new Statement.Break()));

        assertEquals("for id#0 in id#1 do break;  end", compact.format(loop));
    }

    @Test
    public void testIllFormed() {
        Expr broken = IllFormed.INSTANCE;

        assertEquals("IllFormed", compact.format(broken));
        assertEquals("let id#0 = IllFormed", compact.format(fx.let("x", broken)));
    }

    @Test
    public void testFloatIsPositional() {
        assertEquals("1.0", compact.format(new Literal.Float(1.0)));
        assertEquals("0.00001", compact.format(new Literal.Float(1e-5)));
        assertEquals("10000000000.0", compact.format(new Literal.Float(1e10)));
    }

    // ============================================================
    // Whole trees
    // ============================================================

    @Test
    public void testAstCompact() {
        Ast ast = new Ast(Block.of(stmt(integer(1))), fx.sym("a"), Path.of("a.hsh"));

        assertEquals("1; \n", compact.format(ast));
    }

    @Test
    public void testAstExpandedHasHeader() {
        Ast ast = new Ast(Block.of(stmt(integer(1))), fx.sym("a"), Path.of("a.hsh"));

        assertEquals("AST for a.hsh\n{\n    1,\n}\n", expanded.format(ast));
    }

    // ============================================================
    // Shell constructs
    // ============================================================

    @Test
    public void testCompactCommandBlock() {
        CommandBlock block = CommandBlock.of(CommandBlockKind.SYNCHRONOUS, Command.of(BasicCommand.of("ls")));

        assertEquals(
            "{Command { head: BasicCommand { program: Argument { parts: [Raw(\"ls\")], pos: 1:1 }, "
                + "arguments: [], redirections: [], abortOnError: true }, tail: [] }}",
            compact.format(block));
    }

    @Test
    public void testExpandedCommandBlockNestsStructures() {
        CommandBlock block = CommandBlock.of(CommandBlockKind.SYNCHRONOUS, Command.of(BasicCommand.of("ls")));

        String expected = String.join("\n",
            "{",
            "    Command {",
            "        head: BasicCommand {",
            "            program: Argument {",
            "                parts: [",
            "                    Raw(",
            "                        \"ls\",",
            "                    ),",
            "                ],",
            "                pos: 1:1,",
            "            },",
            "            arguments: [],",
            "            redirections: [],",
            "            abortOnError: true,",
            "        },",
            "        tail: [],",
            "    },",
            "}");

        assertEquals(expected, expanded.format(block));
    }

    @Test
    public void testBlockKindSigil() {
        CommandBlock block = CommandBlock.of(CommandBlockKind.CAPTURE, Command.of(BasicCommand.of("ls")));

        assertTrue(compact.format(block).startsWith("${Command {"));
        assertTrue(compact.format(new Expr.CommandBlockExpr(
            CommandBlock.of(CommandBlockKind.ASYNCHRONOUS, Command.of(BasicCommand.of("ls"))))).startsWith("&{"));
    }

    @Test
    public void testArgumentParts() {
        Argument argument = Argument.of(SourcePos.of(2, 5),
            ArgPart.unit(new ArgUnit.Dollar(fx.sym("home"), SourcePos.of(2, 6))),
            ArgPart.expansion(new ArgExpansion.Home()),
            ArgPart.expansion(new ArgExpansion.Range(1, 9)),
            ArgPart.expansion(new ArgExpansion.Star()),
            ArgPart.expansion(new ArgExpansion.Question()),
            ArgPart.expansion(ArgExpansion.CharClass.of("ab")));

        assertEquals(
            "Argument { parts: [Dollar(id#0, 2:6), Home, Range(1, 9), Star, Question, CharClass(\"ab\")], pos: 2:5 }",
            compact.format(argument));
    }

    @Test
    public void testIllFormedArgumentShowsPosition() {
        assertEquals("Argument { parts: [], pos: ill-formed }", compact.format(Argument.illFormed()));
    }

    @Test
    public void testRedirections() {
        BasicCommand command = BasicCommand.of("cmd").withRedirections(
            new Redirection.Output(2, new RedirectionTarget.Fd(1)),
            new Redirection.Input(true, Argument.literal("x")),
            IllFormed.INSTANCE).tolerant();
        CommandBlock block = CommandBlock.of(CommandBlockKind.SYNCHRONOUS, Command.of(command));

        String rendered = compact.format(block);

        assertTrue(rendered.contains("redirections: [Output { source: 2, target: Fd(1) }, "
            + "Input { literal: true, source: Argument { parts: [Raw(\"x\")], pos: 1:1 } }, IllFormed]"));
        assertTrue(rendered.contains("abortOnError: false"));
    }

    @Test
    public void testNeverColored() {
        String rendered = expanded.format(Block.of(stmt(AstFixtures.nil()), new Statement.Break()));

        assertFalse(rendered.contains("\u001B["));
    }
}
