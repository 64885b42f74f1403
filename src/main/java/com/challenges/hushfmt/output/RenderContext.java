package com.challenges.hushfmt.output;

import com.challenges.hushfmt.symbol.Symbol;
import com.challenges.hushfmt.symbol.SymbolResolver;

import java.util.Objects;

/**
 * Immutable state handed down the tree by the human renderer.
 *
 * @param resolver    turns identifier handles back into names
 * @param indentation current nesting depth, or {@code null} when the subtree is laid out on a single line
 */
public record RenderContext(SymbolResolver resolver, Indentation indentation) {
    public RenderContext {
        Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public static RenderContext indented(SymbolResolver resolver) {
        return new RenderContext(resolver, Indentation.ZERO);
    }

    public static RenderContext compact(SymbolResolver resolver) {
        return new RenderContext(resolver, null);
    }

    public RenderContext indent() {
        return indentation == null ? this : new RenderContext(resolver, indentation.increase());
    }

    public RenderContext inlined() {
        return indentation == null ? this : new RenderContext(resolver, null);
    }

    public boolean isIndented() {
        return indentation != null;
    }

    public String name(Symbol symbol) {
        return resolver.resolve(symbol);
    }

    public String lineStart() {
        return indentation == null ? " " : indentation.toString();
    }

    // newline plus indent, or a single space on one line
    public String step() {
        return indentation == null ? " " : "\n" + indentation;
    }

    public String statementSeparator() {
        return indentation == null ? ";" : "\n";
    }
}
