package org.pragmatica.hcl.error;

import org.pragmatica.hcl.tree.SourceLocation;

/**
 * Compiler-style rendering of a parse failure.
 *
 * <p>Example output:
 * <pre>
 *  --> HCL parse error in line 2, column 5
 *   |
 * 2 | bar [
 *   |     ^---
 *   |
 *   = invalid structure; expected `{`, `=`, `"` or identifier
 * </pre>
 *
 * @param location   failure position
 * @param sourceLine the full physical line containing the failure
 * @param cause      the cause clause shown after {@code =}
 */
public record Diagnostic(SourceLocation location, String sourceLine, String cause) {

    public static Diagnostic of(ParseError error) {
        return new Diagnostic(error.location(), error.sourceLine(), error.category() + "; " + error.detail());
    }

    /**
     * Render an error against the source text it was produced from.
     */
    public static String render(ParseError error, String source) {
        var line = lineAt(source, error.line());
        return new Diagnostic(error.location(), line, error.category() + "; " + error.detail()).format();
    }

    /**
     * Extract the 1-based physical line from source text, without its terminator.
     */
    public static String lineAt(String source, int lineNumber) {
        int start = 0;
        for (int current = 1; current < lineNumber; current++) {
            int newline = source.indexOf('\n', start);
            if (newline < 0) {
                return "";
            }
            start = newline + 1;
        }
        int end = source.indexOf('\n', start);
        if (end < 0) {
            end = source.length();
        }
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        return source.substring(start, end);
    }

    public String format() {
        var lineNumber = String.valueOf(location.line());
        var gutter = " ".repeat(lineNumber.length());
        var sb = new StringBuilder();

        sb.append(gutter)
          .append("--> HCL parse error in line ")
          .append(location.line())
          .append(", column ")
          .append(location.column())
          .append('\n');
        sb.append(gutter).append(" |\n");
        sb.append(lineNumber).append(" | ").append(sourceLine).append('\n');
        sb.append(gutter)
          .append(" | ")
          .append(" ".repeat(Math.max(0, location.column() - 1)))
          .append("^---\n");
        sb.append(gutter).append(" |\n");
        sb.append(gutter).append(" = ").append(cause);

        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
