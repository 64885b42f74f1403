package com.challenges.hushfmt.ast;

/**
 * Line/column position in a script. {@link #ILL_FORMED} marks an argument the parser gave up on.
 */
public record SourcePos(int line, int column) {
    public static final SourcePos ILL_FORMED = new SourcePos(0, 0);

    public static SourcePos of(int line, int column) {
        return new SourcePos(line, column);
    }

    public boolean isIllFormed() {
        return equals(ILL_FORMED);
    }

    @Override
    public String toString() {
        return isIllFormed() ? "ill-formed" : line + ":" + column;
    }
}
