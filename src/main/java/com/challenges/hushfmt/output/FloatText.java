package com.challenges.hushfmt.output;

import java.math.BigDecimal;

/**
 * Float literals as source text: always positional, never an exponent, and a whole value keeps {@code .0}.
 * Non-finite values print as {@code NaN}, {@code inf} and {@code -inf}.
 */
final class FloatText {
    private FloatText() {
    }

    static String of(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            // BigDecimal has no negative zero
            return 1 / value < 0 ? "-0.0" : "0.0";
        }

        String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }
}
