package com.challenges.hushfmt.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Consumer;

/**
 * Append-only target for rendered text.
 * <p>
 * Write failures of the underlying {@link Appendable} surface as {@link UncheckedIOException} so they abort the
 * tree walk at once; {@link AstFormatter} turns them back into {@link IOException}.
 */
public final class TextSink {
    private static final String PAD = "    ";

    private final Appendable out;
    private final boolean colored;

    public TextSink(Appendable out, boolean colored) {
        this.out = out;
        this.colored = colored;
    }

    public static TextSink plain(Appendable out) {
        return new TextSink(out, false);
    }

    public boolean isColored() {
        return colored;
    }

    public TextSink append(CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public TextSink append(char c) {
        try {
            out.append(c);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public TextSink append(Style style, CharSequence text) {
        if (!colored) {
            return append(text);
        }
        return append(style.on()).append(text).append(style.off());
    }

    public <T> TextSink join(Iterable<T> items, String separator, Consumer<T> each) {
        boolean first = true;
        for (T item : items) {
            if (!first) {
                append(separator);
            }
            first = false;
            each.accept(item);
        }
        return this;
    }

    /**
     * A view of this sink that starts every non-empty line one level further right.
     */
    public TextSink padded() {
        return new TextSink(new PaddingAppendable(out, PAD), colored);
    }
}
