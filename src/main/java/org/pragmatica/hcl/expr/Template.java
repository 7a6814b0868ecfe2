package org.pragmatica.hcl.expr;

import java.util.List;

/**
 * Parsed content of a quoted template or heredoc.
 */
public record Template(List<TemplateElement> elements) {

    public static final Template EMPTY = new Template(List.of());

    public Template {
        elements = List.copyOf(elements);
    }

    public static Template of(TemplateElement... elements) {
        return new Template(List.of(elements));
    }

    public static Template literal(String text) {
        return text.isEmpty() ? EMPTY : of(new TemplateElement.Literal(text));
    }

    /**
     * True when the template holds no interpolations or directives.
     */
    public boolean isLiteral() {
        return elements.stream()
                       .allMatch(TemplateElement.Literal.class::isInstance);
    }

    /**
     * Concatenated literal text; only meaningful when {@link #isLiteral()} holds.
     */
    public String literalText() {
        var sb = new StringBuilder();
        for (var element : elements) {
            if (element instanceof TemplateElement.Literal literal) {
                sb.append(literal.text());
            }
        }
        return sb.toString();
    }
}
