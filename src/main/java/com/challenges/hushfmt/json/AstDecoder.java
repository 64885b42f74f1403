package com.challenges.hushfmt.json;

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
import com.challenges.hushfmt.symbol.Symbol;
import com.challenges.hushfmt.symbol.SymbolInterner;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Builds a tree from its JSON dump.
 * <pre>
 * {"source": "deploy", "path": "scripts/deploy.hsh", "symbols": ["x", "y"], "statements": [...]}
 * </pre>
 * Symbol handles are indexes into {@code symbols}; a spelling may repeat under several handles. Nodes are objects
 * tagged with {@code kind}; arguments may also be plain strings. An argument position of {@code 0:0} is the
 * ill-formed sentinel, so such an argument renders as ill-formed. Shape errors raise
 * {@link IllegalArgumentException} naming the path of the offending value.
 */
public class AstDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(AstDecoder.class);

    private static final String ILL_FORMED = "ill-formed";
    private static final SourcePos DEFAULT_POS = SourcePos.of(1, 1);

    private final JsonTreeReader reader = new JsonTreeReader();

    public AstDocument read(InputStream input) throws IOException {
        return decode(reader.read(input));
    }

    public AstDocument read(String json) throws IOException {
        return decode(reader.read(json));
    }

    public AstDocument decode(JsonValue tree) {
        JsonValue.JsonObject root = object(tree, "$");

        SymbolInterner symbols = new SymbolInterner();
        JsonValue names = root.get("symbols");
        if (names != null) {
            MutableList<JsonValue> spellings = array(names, "$.symbols");
            for (int i = 0; i < spellings.size(); i++) {
                symbols.define(string(spellings.get(i), "$.symbols[" + i + "]"));
            }
        }

        Decoding decoding = new Decoding(symbols.size());
        Block statements = decoding.block(required(root, "statements", "$"), "$.statements");
        JsonValue source = root.get("source");
        Symbol sourceName = symbols.intern(source != null ? string(source, "$.source") : "<unknown>");
        JsonValue path = root.get("path");
        Path origin = Path.of(path != null ? string(path, "$.path") : "");

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Decoded tree for {} with {} symbols", origin, symbols.size());
        }
        return new AstDocument(new Ast(statements, sourceName, origin), symbols);
    }

    /**
     * One pass over a document. Symbol handles must be below {@code symbolCount}.
     */
    private static final class Decoding {
        private final int symbolCount;

        private Decoding(int symbolCount) {
            this.symbolCount = symbolCount;
        }

        // ============================================================
        // Core language
        // ============================================================

        Block block(JsonValue value, String where) {
            if (value instanceof JsonValue.JsonObject node) {
                expectIllFormed(node, where);
                return IllFormed.INSTANCE;
            }
            return new Block.Statements(list(value, where, this::statement));
        }

        Statement statement(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "let" -> new Statement.Let(symbol(node, "id", where), expr(required(node, "init", where), where + ".init"));
                case "assign" -> new Statement.Assign(
                        expr(required(node, "left", where), where + ".left"),
                        expr(required(node, "right", where), where + ".right"));
                case "return" -> new Statement.Return(expr(required(node, "expr", where), where + ".expr"));
                case "break" -> new Statement.Break();
                case "while" -> new Statement.While(
                        expr(required(node, "condition", where), where + ".condition"),
                        block(required(node, "body", where), where + ".body"));
                case "for" -> new Statement.For(
                        symbol(node, "id", where),
                        expr(required(node, "iterable", where), where + ".iterable"),
                        block(required(node, "body", where), where + ".body"));
                case "expr" -> Statement.expr(expr(required(node, "expr", where), where + ".expr"));
                case ILL_FORMED -> IllFormed.INSTANCE;
                default -> throw unknownKind(kind, where);
            };
        }

        Expr expr(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "self" -> new Expr.Self();
                case "identifier" -> new Expr.Identifier(symbol(node, "id", where));
                case "literal" -> new Expr.LiteralExpr(literal(required(node, "literal", where), where + ".literal"));
                case "unary" -> new Expr.Unary(
                        operator(node, where, UnaryOp::fromSymbol),
                        expr(required(node, "operand", where), where + ".operand"));
                case "binary" -> new Expr.Binary(
                        expr(required(node, "left", where), where + ".left"),
                        operator(node, where, BinaryOp::fromSymbol),
                        expr(required(node, "right", where), where + ".right"));
                case "if" -> new Expr.If(
                        expr(required(node, "condition", where), where + ".condition"),
                        optionalBlock(node, "then", where),
                        optionalBlock(node, "else", where));
                case "access" -> new Expr.Access(
                        expr(required(node, "object", where), where + ".object"),
                        expr(required(node, "field", where), where + ".field"));
                case "call" -> new Expr.Call(
                        expr(required(node, "function", where), where + ".function"),
                        optionalList(node, "args", where, this::expr));
                case "command-block" -> new Expr.CommandBlockExpr(commandBlock(required(node, "block", where), where + ".block"));
                case ILL_FORMED -> IllFormed.INSTANCE;
                default -> throw unknownKind(kind, where);
            };
        }

        Literal literal(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "nil" -> new Literal.Nil();
                case "bool" -> new Literal.Bool(bool(required(node, "value", where), where + ".value"));
                case "int" -> new Literal.Int(integer(required(node, "value", where), where + ".value"));
                case "float" -> new Literal.Float(number(required(node, "value", where), where + ".value"));
                case "byte" -> new Literal.Byte(singleByte(required(node, "value", where), where + ".value"));
                case "string" -> Literal.ByteString.of(string(required(node, "value", where), where + ".value"));
                case "array" -> new Literal.Array(list(required(node, "items", where), where + ".items", this::expr));
                case "dict" -> new Literal.Dict(list(required(node, "entries", where), where + ".entries", this::dictEntry));
                case "function" -> new Literal.Function(
                        optionalList(node, "params", where, this::parameter),
                        block(required(node, "body", where), where + ".body"));
                case "identifier" -> new Literal.Identifier(symbol(node, "id", where));
                default -> throw unknownKind(kind, where);
            };
        }

        private Literal.DictEntry dictEntry(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            return new Literal.DictEntry(
                    symbol(node, "key", where),
                    pos(node, where),
                    expr(required(node, "value", where), where + ".value"));
        }

        /** Either a bare handle or {@code {"id": n, "pos": ...}}. */
        private Literal.Parameter parameter(JsonValue value, String where) {
            if (value instanceof JsonValue.JsonLong handle) {
                return new Literal.Parameter(checkSymbol(handle.value(), where), DEFAULT_POS);
            }
            JsonValue.JsonObject node = object(value, where);
            return new Literal.Parameter(symbol(node, "id", where), pos(node, where));
        }

        private Block optionalBlock(JsonValue.JsonObject node, String field, String where) {
            JsonValue value = node.get(field);
            return value == null ? Block.empty() : block(value, where + "." + field);
        }

        // ============================================================
        // Shell constructs
        // ============================================================

        CommandBlock commandBlock(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            JsonValue kindName = node.get("kind");
            CommandBlockKind kind = kindName == null
                    ? CommandBlockKind.SYNCHRONOUS
                    : blockKind(string(kindName, where + ".kind"), where);
            ImmutableList<Command> commands = list(required(node, "commands", where), where + ".commands", this::command);
            if (commands.isEmpty()) {
                throw new IllegalArgumentException("Command block needs at least one command at " + where);
            }
            return new CommandBlock(kind, commands.getFirst(), commands.drop(1));
        }

        /** A pipeline is an array of basic commands. */
        Command command(JsonValue value, String where) {
            ImmutableList<BasicCommand> pipeline = list(value, where, this::basicCommand);
            if (pipeline.isEmpty()) {
                throw new IllegalArgumentException("Pipeline needs at least one command at " + where);
            }
            return new Command(pipeline.getFirst(), pipeline.drop(1));
        }

        BasicCommand basicCommand(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            return new BasicCommand(
                    argument(required(node, "program", where), where + ".program"),
                    optionalList(node, "args", where, this::argument),
                    optionalList(node, "redirections", where, this::redirection),
                    optionalBool(node, "abortOnError", true, where));
        }

        Argument argument(JsonValue value, String where) {
            if (value instanceof JsonValue.JsonString text) {
                return Argument.literal(text.value());
            }
            JsonValue.JsonObject node = object(value, where);
            JsonValue kind = node.get("kind");
            if (kind instanceof JsonValue.JsonString tag && ILL_FORMED.equals(tag.value())) {
                return Argument.illFormed();
            }
            return new Argument(list(required(node, "parts", where), where + ".parts", this::argPart), pos(node, where));
        }

        ArgPart argPart(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "raw" -> ArgPart.unit(ArgUnit.Raw.of(string(required(node, "value", where), where + ".value")));
                case "dollar" -> ArgPart.unit(new ArgUnit.Dollar(symbol(node, "id", where), pos(node, where)));
                case "home" -> ArgPart.expansion(new ArgExpansion.Home());
                case "range" -> ArgPart.expansion(new ArgExpansion.Range(
                        integer(required(node, "start", where), where + ".start"),
                        integer(required(node, "end", where), where + ".end")));
                case "collection" -> ArgPart.expansion(new ArgExpansion.Collection(
                        list(required(node, "items", where), where + ".items", this::argument)));
                case "star" -> ArgPart.expansion(new ArgExpansion.Star());
                case "question" -> ArgPart.expansion(new ArgExpansion.Question());
                case "char-class" -> ArgPart.expansion(
                        ArgExpansion.CharClass.of(string(required(node, "value", where), where + ".value")));
                default -> throw unknownKind(kind, where);
            };
        }

        Redirection redirection(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "output" -> {
                    JsonValue source = node.get("source");
                    yield new Redirection.Output(
                            source == null ? 1 : smallInt(source, where + ".source"),
                            target(required(node, "target", where), where + ".target"));
                }
                case "input" -> new Redirection.Input(
                        optionalBool(node, "literal", false, where),
                        argument(required(node, "source", where), where + ".source"));
                case ILL_FORMED -> IllFormed.INSTANCE;
                default -> throw unknownKind(kind, where);
            };
        }

        RedirectionTarget target(JsonValue value, String where) {
            JsonValue.JsonObject node = object(value, where);
            String kind = kind(node, where);
            return switch (kind) {
                case "fd" -> new RedirectionTarget.Fd(smallInt(required(node, "fd", where), where + ".fd"));
                case "overwrite" -> new RedirectionTarget.Overwrite(argument(required(node, "target", where), where + ".target"));
                case "append" -> new RedirectionTarget.Append(argument(required(node, "target", where), where + ".target"));
                default -> throw unknownKind(kind, where);
            };
        }

        // ============================================================
        // Scalars
        // ============================================================

        private Symbol symbol(JsonValue.JsonObject node, String field, String where) {
            return checkSymbol(integer(required(node, field, where), where + "." + field), where + "." + field);
        }

        private Symbol checkSymbol(long handle, String where) {
            if (handle < 0 || handle >= symbolCount) {
                throw new IllegalArgumentException("Symbol handle " + handle + " out of range at " + where);
            }
            return new Symbol((int) handle);
        }

        private <T> ImmutableList<T> list(JsonValue value, String where, BiFunction<JsonValue, String, T> element) {
            MutableList<JsonValue> items = array(value, where);
            MutableList<T> result = Lists.mutable.withInitialCapacity(items.size());
            for (int i = 0; i < items.size(); i++) {
                result.add(element.apply(items.get(i), where + "[" + i + "]"));
            }
            return result.toImmutable();
        }

        private <T> ImmutableList<T> optionalList(JsonValue.JsonObject node, String field, String where,
                                                  BiFunction<JsonValue, String, T> element) {
            JsonValue value = node.get(field);
            return value == null ? Lists.immutable.empty() : list(value, where + "." + field, element);
        }
    }

    // ============================================================
    // Shape helpers
    // ============================================================

    private static JsonValue.JsonObject object(JsonValue value, String where) {
        if (!(value instanceof JsonValue.JsonObject node)) {
            throw mismatch("an object", value, where);
        }
        return node;
    }

    private static MutableList<JsonValue> array(JsonValue value, String where) {
        if (!(value instanceof JsonValue.JsonArray array)) {
            throw mismatch("an array", value, where);
        }
        return array.elements();
    }

    private static JsonValue required(JsonValue.JsonObject node, String field, String where) {
        JsonValue value = node.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing field '" + field + "' at " + where);
        }
        return value;
    }

    private static String kind(JsonValue.JsonObject node, String where) {
        return string(required(node, "kind", where), where + ".kind");
    }

    private static void expectIllFormed(JsonValue.JsonObject node, String where) {
        String kind = kind(node, where);
        if (!ILL_FORMED.equals(kind)) {
            throw new IllegalArgumentException("Expected a statement list or ill-formed marker at " + where);
        }
    }

    private static String string(JsonValue value, String where) {
        if (!(value instanceof JsonValue.JsonString text)) {
            throw mismatch("a string", value, where);
        }
        return text.value();
    }

    private static long integer(JsonValue value, String where) {
        if (!(value instanceof JsonValue.JsonLong number)) {
            throw mismatch("an integer", value, where);
        }
        return number.value();
    }

    /** Descriptors and positions: a non-negative integer that fits an {@code int}. */
    private static int smallInt(JsonValue value, String where) {
        long number = integer(value, where);
        if (number < 0 || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Integer " + number + " out of range at " + where);
        }
        return (int) number;
    }

    private static double number(JsonValue value, String where) {
        if (value instanceof JsonValue.JsonDouble number) {
            return number.value();
        }
        if (value instanceof JsonValue.JsonLong number) {
            return number.value();
        }
        throw mismatch("a number", value, where);
    }

    private static boolean bool(JsonValue value, String where) {
        if (!(value instanceof JsonValue.JsonBoolean flag)) {
            throw mismatch("a boolean", value, where);
        }
        return flag.value();
    }

    private static boolean optionalBool(JsonValue.JsonObject node, String field, boolean fallback, String where) {
        JsonValue value = node.get(field);
        return value == null ? fallback : bool(value, where + "." + field);
    }

    /** A one-character string or a number in 0..255. */
    private static byte singleByte(JsonValue value, String where) {
        if (value instanceof JsonValue.JsonString text && text.value().length() == 1 && text.value().charAt(0) <= 0xFF) {
            return (byte) text.value().charAt(0);
        }
        if (value instanceof JsonValue.JsonLong number && number.value() >= 0 && number.value() <= 0xFF) {
            return (byte) number.value();
        }
        throw mismatch("a single byte", value, where);
    }

    private static SourcePos pos(JsonValue.JsonObject node, String where) {
        JsonValue value = node.get("pos");
        if (value == null) {
            return DEFAULT_POS;
        }
        JsonValue.JsonObject pos = object(value, where + ".pos");
        return SourcePos.of(
                smallInt(required(pos, "line", where + ".pos"), where + ".pos.line"),
                smallInt(required(pos, "column", where + ".pos"), where + ".pos.column"));
    }

    private static <T> T operator(JsonValue.JsonObject node, String where, Function<String, T> lookup) {
        return lookup.apply(string(required(node, "op", where), where + ".op"));
    }

    private static CommandBlockKind blockKind(String name, String where) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "synchronous" -> CommandBlockKind.SYNCHRONOUS;
            case "asynchronous" -> CommandBlockKind.ASYNCHRONOUS;
            case "capture" -> CommandBlockKind.CAPTURE;
            default -> throw new IllegalArgumentException("Unknown command block kind '" + name + "' at " + where);
        };
    }

    private static IllegalArgumentException unknownKind(String kind, String where) {
        return new IllegalArgumentException("Unknown node kind '" + kind + "' at " + where);
    }

    private static IllegalArgumentException mismatch(String expected, JsonValue actual, String where) {
        return new IllegalArgumentException("Expected " + expected + " at " + where + " but got " + actual.typeName());
    }
}
