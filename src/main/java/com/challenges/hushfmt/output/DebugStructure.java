package com.challenges.hushfmt.output;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Generic notation for the diagnostic dump: {@code {a, b}} sets, {@code [a, b]} lists, {@code {k: v}} maps,
 * {@code Name { field: v }} structs and {@code Name(v)} tuples. In expanded layout every entry sits on its own
 * line, one level deeper, followed by a comma.
 */
final class DebugStructure {
    private enum Shape {
        SET("{", "}"),
        LIST("[", "]"),
        MAP("{", "}"),
        STRUCT(" {", "}"),
        TUPLE("(", ")");

        private final String open;
        private final String close;

        Shape(String open, String close) {
            this.open = open;
            this.close = close;
        }

        // an empty struct or tuple prints as its bare name
        private boolean isNamed() {
            return this == STRUCT || this == TUPLE;
        }
    }

    private final TextSink out;
    private final boolean expanded;
    private final Shape shape;
    private boolean hasEntries;

    private DebugStructure(TextSink out, boolean expanded, Shape shape, String name) {
        this.out = out;
        this.expanded = expanded;
        this.shape = shape;
        if (shape.isNamed()) {
            out.append(name);
        } else {
            out.append(shape.open);
        }
    }

    static DebugStructure set(TextSink out, boolean expanded) {
        return new DebugStructure(out, expanded, Shape.SET, null);
    }

    static DebugStructure list(TextSink out, boolean expanded) {
        return new DebugStructure(out, expanded, Shape.LIST, null);
    }

    static DebugStructure map(TextSink out, boolean expanded) {
        return new DebugStructure(out, expanded, Shape.MAP, null);
    }

    static DebugStructure struct(TextSink out, boolean expanded, String name) {
        return new DebugStructure(out, expanded, Shape.STRUCT, name);
    }

    static DebugStructure tuple(TextSink out, boolean expanded, String name) {
        return new DebugStructure(out, expanded, Shape.TUPLE, name);
    }

    DebugStructure entry(Consumer<TextSink> value) {
        return write(null, value);
    }

    DebugStructure field(String name, Consumer<TextSink> value) {
        return write(sink -> sink.append(name), value);
    }

    DebugStructure entry(Consumer<TextSink> key, Consumer<TextSink> value) {
        return write(key, value);
    }

    <T> DebugStructure entries(Iterable<T> items, BiConsumer<T, TextSink> each) {
        for (T item : items) {
            entry(sink -> each.accept(item, sink));
        }
        return this;
    }

    void finish() {
        if (shape.isNamed() && !hasEntries) {
            return;
        }
        if (!expanded && shape == Shape.STRUCT) {
            out.append(" ");
        }
        out.append(shape.close);
    }

    private DebugStructure write(Consumer<TextSink> key, Consumer<TextSink> value) {
        if (expanded) {
            if (!hasEntries) {
                if (shape.isNamed()) {
                    out.append(shape.open);
                }
                out.append("\n");
            }
            TextSink padded = out.padded();
            writeEntry(padded, key, value);
            padded.append(",\n");
        } else {
            if (!hasEntries) {
                if (shape.isNamed()) {
                    out.append(shape.open);
                }
                if (shape == Shape.STRUCT) {
                    out.append(" ");
                }
            } else {
                out.append(", ");
            }
            writeEntry(out, key, value);
        }
        hasEntries = true;
        return this;
    }

    private static void writeEntry(TextSink sink, Consumer<TextSink> key, Consumer<TextSink> value) {
        if (key != null) {
            key.accept(sink);
            sink.append(": ");
        }
        value.accept(sink);
    }
}
