package com.challenges.hushfmt.output;

import picocli.CommandLine.Help.Ansi;

/**
 * Cosmetic category of a span of rendered text. Only a colored {@link TextSink} turns it into escape codes.
 */
public enum Style {
    KEYWORD(Ansi.Style.fg_magenta),
    LITERAL(Ansi.Style.fg_blue),
    STRING(Ansi.Style.bold),
    ERROR(Ansi.Style.fg_red),
    HEADER(Ansi.Style.fg_yellow);

    private final Ansi.IStyle[] styles;

    Style(Ansi.IStyle... styles) {
        this.styles = styles;
    }

    String on() {
        return Ansi.Style.on(styles);
    }

    String off() {
        return Ansi.Style.off(styles);
    }
}
