package org.pragmatica.hcl.expr;

/**
 * Whitespace strip markers ({@code ~}) on a template interpolation or directive tag.
 */
public enum Strip {
    NONE(false, false),
    START(true, false),
    END(false, true),
    BOTH(true, true);

    private final boolean start;
    private final boolean end;

    Strip(boolean start, boolean end) {
        this.start = start;
        this.end = end;
    }

    public static Strip of(boolean start, boolean end) {
        if (start) {
            return end ? BOTH : START;
        }
        return end ? END : NONE;
    }

    public boolean stripStart() {
        return start;
    }

    public boolean stripEnd() {
        return end;
    }
}
