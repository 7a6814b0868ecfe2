package org.pragmatica.hcl;

import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.format.Formatter;
import org.pragmatica.hcl.format.FormatterConfig;
import org.pragmatica.hcl.parser.HclParser;
import org.pragmatica.hcl.parser.ParserConfig;
import org.pragmatica.hcl.structure.Body;
import org.pragmatica.hcl.tree.HclNode;

/**
 * Entry point for parsing and formatting HCL.
 *
 * <p>Example usage:
 * <pre>{@code
 * var body = Hcl.parseBody("""
 *     service "web" {
 *       port = 8080
 *     }
 *     """).unwrap();
 *
 * var text = Hcl.toString(body);
 * }</pre>
 *
 * <p>All methods are stateless and safe to call from any thread.
 */
public final class Hcl {
    private Hcl() {}

    /**
     * Parse a configuration file body.
     */
    public static HclResult<Body> parseBody(String input) {
        return HclParser.parseBody(input);
    }

    /**
     * Parse a configuration file body with custom configuration.
     */
    public static HclResult<Body> parseBody(String input, ParserConfig config) {
        return HclParser.parseBody(input, config);
    }

    /**
     * Parse a single expression.
     */
    public static HclResult<Expression> parseExpression(String input) {
        return HclParser.parseExpression(input);
    }

    /**
     * Parse a single expression with custom configuration.
     */
    public static HclResult<Expression> parseExpression(String input, ParserConfig config) {
        return HclParser.parseExpression(input, config);
    }

    /**
     * Canonical text of a node with the default formatter settings.
     */
    public static String toString(HclNode node) {
        return Formatter.create().format(node);
    }

    /**
     * Canonical text of a node as a result value.
     */
    public static HclResult<String> format(HclNode node) {
        return HclResult.success(toString(node));
    }

    /**
     * Write the canonical text of a node into a sink.
     */
    public static <A extends Appendable> HclResult<A> format(HclNode node, A sink) {
        return Formatter.create().format(node, sink);
    }

    /**
     * Create a formatter builder for non-default settings.
     */
    public static FormatterBuilder formatter() {
        return new FormatterBuilder();
    }

    public static final class FormatterBuilder {
        private FormatterConfig config = FormatterConfig.DEFAULT;

        private FormatterBuilder() {}

        public FormatterBuilder indent(String indent) {
            config = config.withIndent(indent);
            return this;
        }

        public FormatterBuilder compactArrays(boolean compact) {
            config = config.withCompactArrays(compact);
            return this;
        }

        public FormatterBuilder compactObjects(boolean compact) {
            config = config.withCompactObjects(compact);
            return this;
        }

        public Formatter build() {
            return Formatter.create(config);
        }
    }
}
