package com.challenges.hushfmt.output;

import java.io.IOException;

final class PaddingAppendable implements Appendable {
    private final Appendable out;
    private final String pad;
    private boolean onNewline = true;

    PaddingAppendable(Appendable out, String pad) {
        this.out = out;
        this.pad = pad;
    }

    @Override
    public Appendable append(CharSequence csq) throws IOException {
        return append(csq, 0, csq.length());
    }

    @Override
    public Appendable append(CharSequence csq, int start, int end) throws IOException {
        for (int i = start; i < end; i++) {
            append(csq.charAt(i));
        }
        return this;
    }

    @Override
    public Appendable append(char c) throws IOException {
        // blank lines stay blank
        if (onNewline && c != '\n') {
            out.append(pad);
        }
        onNewline = c == '\n';
        out.append(c);
        return this;
    }
}
