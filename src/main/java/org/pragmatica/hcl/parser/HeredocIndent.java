package org.pragmatica.hcl.parser;

import org.pragmatica.hcl.expr.TemplateElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the common leading whitespace of an indented ({@code <<-}) heredoc.
 *
 * <p>Lines holding only whitespace do not count towards the common indentation. A line that
 * starts with an interpolation or directive has no removable indentation, which pins the
 * amount to zero.
 */
final class HeredocIndent {
    private HeredocIndent() {}

    static List<TemplateElement> dedent(List<TemplateElement> elements) {
        int amount = commonIndent(elements);
        if (amount == 0) {
            return elements;
        }
        var result = new ArrayList<TemplateElement>(elements.size());
        boolean lineStart = true;
        for (var element : elements) {
            if (!(element instanceof TemplateElement.Literal literal)) {
                result.add(element);
                lineStart = false;
                continue;
            }
            var text = literal.text();
            var sb = new StringBuilder(text.length());
            int pos = 0;
            while (pos < text.length()) {
                if (lineStart) {
                    int skipped = 0;
                    while (skipped < amount && pos < text.length() && isBlank(text.charAt(pos))) {
                        pos++;
                        skipped++;
                    }
                    lineStart = false;
                    continue;
                }
                char c = text.charAt(pos++);
                sb.append(c);
                if (c == '\n') {
                    lineStart = true;
                }
            }
            if (!sb.isEmpty()) {
                result.add(new TemplateElement.Literal(sb.toString()));
            }
        }
        return result;
    }

    private static int commonIndent(List<TemplateElement> elements) {
        int min = Integer.MAX_VALUE;
        boolean lineStart = true;
        for (int i = 0; i < elements.size(); i++) {
            if (!(elements.get(i) instanceof TemplateElement.Literal literal)) {
                if (lineStart) {
                    min = 0;
                }
                lineStart = false;
                continue;
            }
            var text = literal.text();
            int pos = 0;
            while (pos < text.length()) {
                if (lineStart) {
                    int end = pos;
                    while (end < text.length() && isBlank(text.charAt(end))) {
                        end++;
                    }
                    boolean followedByMarkup = end == text.length() && i + 1 < elements.size();
                    boolean blankLine = end == text.length() || text.charAt(end) == '\n' || text.charAt(end) == '\r';
                    if (followedByMarkup || !blankLine) {
                        min = Math.min(min, end - pos);
                    }
                    lineStart = false;
                }
                int newline = text.indexOf('\n', pos);
                if (newline < 0) {
                    break;
                }
                pos = newline + 1;
                lineStart = true;
            }
        }
        return min == Integer.MAX_VALUE ? 0 : min;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
