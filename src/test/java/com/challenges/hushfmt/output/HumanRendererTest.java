package com.challenges.hushfmt.output;

import com.challenges.hushfmt.AstFixtures;
import com.challenges.hushfmt.ast.Ast;
import com.challenges.hushfmt.ast.BinaryOp;
import com.challenges.hushfmt.ast.Block;
import com.challenges.hushfmt.ast.Expr;
import com.challenges.hushfmt.ast.IllFormed;
import com.challenges.hushfmt.ast.Literal;
import com.challenges.hushfmt.ast.Statement;
import com.challenges.hushfmt.ast.UnaryOp;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Path;
import java.util.stream.Stream;

import static com.challenges.hushfmt.AstFixtures.binary;
import static com.challenges.hushfmt.AstFixtures.bool;
import static com.challenges.hushfmt.AstFixtures.integer;
import static com.challenges.hushfmt.AstFixtures.nil;
import static com.challenges.hushfmt.AstFixtures.stmt;
import static com.challenges.hushfmt.AstFixtures.string;
import static com.challenges.hushfmt.AstFixtures.unary;
import static org.junit.jupiter.api.Assertions.*;

public class HumanRendererTest {

    private final AstFixtures fx = new AstFixtures();

    private String indented(Expr expr) {
        return AstFormatter.human(fx.symbols(), true, false).format(expr);
    }

    private String indented(Statement statement) {
        return AstFormatter.human(fx.symbols(), true, false).format(statement);
    }

    private String compact(Expr expr) {
        return AstFormatter.human(fx.symbols(), false, false).format(expr);
    }

    private String compact(Statement statement) {
        return AstFormatter.human(fx.symbols(), false, false).format(statement);
    }

    // ============================================================
    // Literals
    // ============================================================

    static Stream<Arguments> primitiveLiterals() {
        return Stream.of(
            Arguments.of(new Literal.Nil(), "nil"),
            Arguments.of(new Literal.Bool(true), "true"),
            Arguments.of(new Literal.Bool(false), "false"),
            Arguments.of(new Literal.Int(42), "42"),
            Arguments.of(new Literal.Int(-7), "-7"),
            Arguments.of(new Literal.Float(1.5), "1.5"),
            Arguments.of(new Literal.Float(1.0), "1.0"),
            Arguments.of(new Literal.Float(1e-5), "0.00001"),
            Arguments.of(new Literal.Float(1e10), "10000000000.0"),
            Arguments.of(new Literal.Float(-2.25), "-2.25"),
            Arguments.of(new Literal.Float(-0.0), "-0.0"),
            Arguments.of(new Literal.Float(Double.NaN), "NaN"),
            Arguments.of(new Literal.Float(Double.POSITIVE_INFINITY), "inf"),
            Arguments.of(new Literal.Float(Double.NEGATIVE_INFINITY), "-inf"),
            Arguments.of(Literal.Byte.of('a'), "'a'"),
            Arguments.of(Literal.Byte.of('\n'), "'\\n'"),
            Arguments.of(Literal.Byte.of('\''), "'\\''"),
            Arguments.of(Literal.Byte.of('"'), "'\"'"),
            Arguments.of(Literal.ByteString.of("hello"), "\"hello\""),
            Arguments.of(Literal.ByteString.of("say \"hi\"\n"), "\"say \\\"hi\\\"\\n\""),
            Arguments.of(Literal.ByteString.of("tab\there"), "\"tab\\there\"")
        );
    }

    @ParameterizedTest
    @MethodSource("primitiveLiterals")
    public void testPrimitiveLiteralsRenderAsSource(Literal literal, String expected) {
        AstFormatter formatter = AstFormatter.human(fx.symbols(), true, false);
        assertEquals(expected, formatter.format(literal));
        assertEquals(expected, AstFormatter.human(fx.symbols(), false, false).format(literal));
    }

    @Test
    public void testEmptyArray() {
        assertEquals("[]", indented(Expr.literal(Literal.Array.of())));
        assertEquals("[]", compact(Expr.literal(Literal.Array.of())));
    }

    @Test
    public void testArrayLayouts() {
        Expr array = Expr.literal(Literal.Array.of(integer(1), integer(2)));

        assertEquals("[\n    1,\n    2\n]", indented(array));
        assertEquals("[ 1, 2 ]", compact(array));
    }

    @Test
    public void testNestedArrayIndentsEachLevel() {
        Expr array = Expr.literal(Literal.Array.of(Expr.literal(Literal.Array.of(integer(1)))));

        assertEquals("[\n    [\n        1\n    ]\n]", indented(array));
    }

    @Test
    public void testDictDropsKeyPositions() {
        Expr dict = Expr.literal(Literal.Dict.of(fx.entry("a", integer(1)), fx.entry("b", string("x"))));

        assertEquals("@[ a: 1, b: \"x\" ]", compact(dict));
        assertEquals("@[\n    a: 1,\n    b: \"x\"\n]", indented(dict));
        assertEquals("@[]", compact(Expr.literal(Literal.Dict.of())));
    }

    @Test
    public void testFunctionLiteralBoundByLetSpansLines() {
        Literal.Function function = fx.function(
            Block.of(new Statement.Return(binary(fx.id("a"), BinaryOp.PLUS, fx.id("b")))), "a", "b");
        Statement let = fx.let("f", Expr.literal(function));

        assertEquals("let f = function(a, b)\n    return (a + b)\nend", indented(let));
        assertEquals("let f = function(a, b) return (a + b) end", compact(let));
    }

    @Test
    public void testFunctionWithEmptyBody() {
        Expr function = Expr.literal(fx.function(Block.empty()));

        assertEquals("function()\nend", indented(function));
        assertEquals("function() end", compact(function));
    }

    // ============================================================
    // Operators
    // ============================================================

    @Test
    public void testBinaryIsAlwaysParenthesized() {
        Expr sum = binary(integer(1), BinaryOp.PLUS, integer(2));
        Expr product = binary(sum, BinaryOp.TIMES, integer(3));

        assertEquals("(1 + 2)", indented(sum));
        assertEquals("((1 + 2) * 3)", indented(product));
        assertEquals("(x == nil)", indented(binary(fx.id("x"), BinaryOp.EQUALS, nil())));
        assertEquals("(a and b)", compact(binary(fx.id("a"), BinaryOp.AND, fx.id("b"))));
    }

    @Test
    public void testOperandsAreInlinedInIndentedContext() {
        Expr concat = binary(
            Expr.literal(Literal.Array.of(integer(1), integer(2))),
            BinaryOp.CONCAT,
            Expr.literal(Literal.Array.of(integer(3))));

        assertEquals("([ 1, 2 ] ++ [ 3 ])", indented(concat));
    }

    @Test
    public void testUnaryOperators() {
        assertEquals("(not true)", indented(unary(UnaryOp.NOT, bool(true))));
        assertEquals("(- 5)", indented(unary(UnaryOp.MINUS, integer(5))));
    }

    @Test
    public void testTryOperatorIsPostfix() {
        Expr call = Expr.Call.of(fx.id("f"));

        assertEquals("(f() ?)", indented(unary(UnaryOp.TRY, call)));
    }

    // ============================================================
    // Conditionals, access, calls
    // ============================================================

    @Test
    public void testConditionalOmitsEmptyElse() {
        Expr conditional = new Expr.If(
            bool(true),
            Block.of(fx.let("x", integer(1)), stmt(fx.id("x"))),
            Block.empty());

        assertEquals("if true then\n    let x = 1\n    x\nend", indented(conditional));
        assertEquals("if true then let x = 1; x end", compact(conditional));
    }

    @Test
    public void testConditionalWithBothBranches() {
        Expr conditional = new Expr.If(fx.id("c"), Block.of(stmt(integer(1))), Block.of(stmt(integer(2))));

        assertEquals("if c then\n    1\nelse\n    2\nend", indented(conditional));
        assertEquals("if c then 1 else 2 end", compact(conditional));
    }

    @Test
    public void testConditionalWithOnlyElse() {
        Expr conditional = new Expr.If(fx.id("c"), Block.empty(), Block.of(stmt(integer(2))));

        assertEquals("if c\nelse\n    2\nend", indented(conditional));
        assertEquals("if c else 2 end", compact(conditional));
    }

    @Test
    public void testConditionalWithNoBranches() {
        Expr conditional = new Expr.If(fx.id("c"), Block.empty(), Block.empty());

        assertEquals("if c\nend", indented(conditional));
        assertEquals("if c end", compact(conditional));
    }

    @Test
    public void testAccessUsesDotOnlyForIdentifierLiterals() {
        assertEquals("obj.name", indented(new Expr.Access(fx.id("obj"), fx.field("name"))));
        assertEquals("obj[0]", indented(new Expr.Access(fx.id("obj"), integer(0))));
        assertEquals("obj[\"name\"]", indented(new Expr.Access(fx.id("obj"), string("name"))));
        // an identifier expression is a variable lookup, not a field name
        assertEquals("obj[key]", indented(new Expr.Access(fx.id("obj"), fx.id("key"))));
    }

    @Test
    public void testCallArgumentsAreInlined() {
        Expr lambda = Expr.literal(fx.function(Block.of(new Statement.Return(integer(1)))));
        Expr call = Expr.Call.of(fx.id("f"), integer(1), binary(fx.id("a"), BinaryOp.MINUS, fx.id("b")), lambda);

        assertEquals("f(1, (a - b), function() return 1 end)", indented(call));
    }

    @Test
    public void testSelf() {
        assertEquals("self.count", compact(new Expr.Access(new Expr.Self(), fx.field("count"))));
    }

    // ============================================================
    // Statements
    // ============================================================

    @Test
    public void testWhileLoop() {
        Statement loop = new Statement.While(
            binary(fx.id("i"), BinaryOp.LOWER, integer(10)),
            Block.of(new Statement.Assign(fx.id("i"), binary(fx.id("i"), BinaryOp.PLUS, integer(1)))));

        assertEquals("while (i < 10) do\n    i = (i + 1)\nend", indented(loop));
        assertEquals("while (i < 10) do i = (i + 1) end", compact(loop));
    }

    @Test
    public void testLoopWithEmptyBodyIsStillClosed() {
        Statement loop = new Statement.While(bool(true), Block.empty());

        assertEquals("while true do\nend", indented(loop));
        assertEquals("while true do end", compact(loop));
    }

    @Test
    public void testNestedLoopsIndentMonotonically() {
        Statement inner = new Statement.While(fx.id("c"), Block.of(stmt(Expr.Call.of(fx.id("f"), fx.id("x")))));
        Statement outer = new Statement.For(fx.sym("x"), fx.id("xs"), Block.of(inner));

        String rendered = indented(outer);

        assertEquals("for x in xs do\n    while c do\n        f(x)\n    end\nend", rendered);
        String[] lines = rendered.split("\n");
        assertTrue(leadingSpaces(lines[1]) > leadingSpaces(lines[0]));
        assertTrue(leadingSpaces(lines[2]) > leadingSpaces(lines[1]));
    }

    @Test
    public void testReturnAndBreak() {
        assertEquals("return nil", indented(new Statement.Return(nil())));
        assertEquals("break", indented(new Statement.Break()));
    }

    @Test
    public void testBlockSeparators() {
        Block block = Block.of(fx.let("x", integer(1)), stmt(fx.id("x")));
        AstFormatter formatter = AstFormatter.human(fx.symbols(), true, false);

        assertEquals("let x = 1\nx", formatter.format(block));
        assertEquals(" let x = 1; x", AstFormatter.human(fx.symbols(), false, false).format(block));
    }

    // ============================================================
    // Ill-formed regions
    // ============================================================

    @Test
    public void testIllFormedRendersMarkerOnly() {
        Expr expr = IllFormed.INSTANCE;
        Statement statement = IllFormed.INSTANCE;
        Block block = IllFormed.INSTANCE;

        for (boolean pretty : new boolean[] {true, false}) {
            AstFormatter formatter = AstFormatter.human(fx.symbols(), pretty, false);
            assertEquals(HumanRenderer.ILL_FORMED, formatter.format(expr));
            assertEquals(HumanRenderer.ILL_FORMED, formatter.format(statement));
            assertEquals(HumanRenderer.ILL_FORMED, formatter.format(block));
        }
    }

    @Test
    public void testIllFormedLoopBody() {
        Block body = IllFormed.INSTANCE;
        Statement loop = new Statement.While(bool(true), body);

        assertEquals("while true do\n    ***ill-formed***\nend", indented(loop));
        assertEquals("while true do ***ill-formed*** end", compact(loop));
    }

    @Test
    public void testIllFormedPartsOfExpressions() {
        Expr broken = IllFormed.INSTANCE;

        assertEquals("(1 + ***ill-formed***)", indented(binary(integer(1), BinaryOp.PLUS, broken)));
        assertEquals("let x = ***ill-formed***", indented(fx.let("x", broken)));
    }

    // ============================================================
    // Whole trees
    // ============================================================

    @Test
    public void testAstHeaderInIndentedMode() {
        Ast ast = new Ast(Block.of(fx.let("x", integer(1)), stmt(fx.id("x"))), fx.sym("script"), Path.of("script.hsh"));

        assertEquals("AST for script\nlet x = 1\nx", AstFormatter.human(fx.symbols(), true, false).format(ast));
    }

    @Test
    public void testRenderingIsPureFunctionOfTree() {
        AstFixtures other = new AstFixtures();

        Expr first = new Expr.If(bool(true), Block.of(fx.let("x", integer(1)), stmt(fx.id("x"))), Block.empty());
        Expr second = new Expr.If(bool(true), Block.of(other.let("x", integer(1)), stmt(other.id("x"))), Block.empty());

        assertEquals(first, second);
        assertEquals(
            AstFormatter.human(fx.symbols(), true, false).format(first),
            AstFormatter.human(other.symbols(), true, false).format(second));
        assertEquals(indented(first), indented(first));
    }

    @Test
    public void testColoredOutputWrapsCategories() {
        AstFormatter colored = AstFormatter.human(fx.symbols(), true, true);

        assertEquals("\u001B[34mnil\u001B[39m", colored.format(nil()));
        assertEquals("\u001B[35mbreak\u001B[39m", colored.format(new Statement.Break()));
        assertEquals("\u001B[31m***ill-formed***\u001B[39m", colored.format((Expr) IllFormed.INSTANCE));
        assertEquals("42", colored.format(integer(42)));
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }
}
