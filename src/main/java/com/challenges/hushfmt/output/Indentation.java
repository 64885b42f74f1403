package com.challenges.hushfmt.output;

public record Indentation(int level) {
    public static final Indentation ZERO = new Indentation(0);

    private static final String UNIT = "    ";

    public Indentation increase() {
        return new Indentation(level + 1);
    }

    @Override
    public String toString() {
        return UNIT.repeat(level);
    }
}
