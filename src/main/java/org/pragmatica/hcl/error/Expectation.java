package org.pragmatica.hcl.error;

/**
 * One alternative the parser would have accepted at a failure position.
 *
 * <p>Literals are exact terminals and render in backticks; descriptions name an abstract
 * category such as {@code identifier} or {@code newline}.
 */
public record Expectation(String text, boolean literal) {

    public static Expectation literal(String text) {
        return new Expectation(text, true);
    }

    public static Expectation description(String text) {
        return new Expectation(text, false);
    }

    public String display() {
        return literal ? "`" + text + "`" : text;
    }

    @Override
    public String toString() {
        return display();
    }
}
