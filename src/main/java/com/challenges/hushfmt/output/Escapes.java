package com.challenges.hushfmt.output;

import org.eclipse.collections.api.list.primitive.ByteList;

import java.nio.charset.StandardCharsets;

final class Escapes {
    private Escapes() {
    }

    static String lossy(ByteList bytes) {
        return new String(bytes.toArray(), StandardCharsets.UTF_8);
    }

    static String escapeString(String s) {
        return escape(s, '"');
    }

    static String escapeChar(char c) {
        return escape(String.valueOf(c), '\'');
    }

    private static String escape(String s, char quote) {
        // Fast path: nothing to escape
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == quote || Character.isISOControl(c)) {
                needsEscaping = true;
                break;
            }
        }
        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        s.codePoints().forEach(cp -> {
            switch (cp) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case 0 -> result.append("\\0");
                default -> {
                    if (cp == quote) {
                        result.append('\\').append(quote);
                    } else if (Character.isISOControl(cp)) {
                        result.append("\\u{").append(Integer.toHexString(cp)).append('}');
                    } else {
                        result.appendCodePoint(cp);
                    }
                }
            }
        });
        return result.toString();
    }
}
