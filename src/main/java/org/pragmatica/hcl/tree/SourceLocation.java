package org.pragmatica.hcl.tree;

/**
 * A position in source text.
 *
 * <p>Line and column are 1-based; the column counts code points so that it matches what an
 * editor displays. The offset is the UTF-16 index into the input string.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
