package org.pragmatica.hcl.format;

import org.pragmatica.hcl.HclResult;
import org.pragmatica.hcl.error.FormatError;
import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.expr.ObjectItem;
import org.pragmatica.hcl.expr.ObjectKey;
import org.pragmatica.hcl.expr.Strip;
import org.pragmatica.hcl.expr.Template;
import org.pragmatica.hcl.expr.TemplateElement;
import org.pragmatica.hcl.expr.TraversalOperator;
import org.pragmatica.hcl.structure.Attribute;
import org.pragmatica.hcl.structure.Block;
import org.pragmatica.hcl.structure.BlockLabel;
import org.pragmatica.hcl.structure.Body;
import org.pragmatica.hcl.tree.HclNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders the document model as canonical HCL text.
 *
 * <p>Output is deterministic: the same tree and configuration always produce the same text, and
 * parsing the output and formatting it again reproduces it unchanged.
 *
 * <p>Example:
 * <pre>{@code
 * var text = Formatter.create().format(body);
 * }</pre>
 */
public final class Formatter {
    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private final FormatterConfig config;

    private Formatter(FormatterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static Formatter create() {
        return create(FormatterConfig.DEFAULT);
    }

    public static Formatter create(FormatterConfig config) {
        return new Formatter(config);
    }

    public FormatterConfig config() {
        return config;
    }

    /**
     * Render a body, block, attribute or expression. Structures end with a line terminator;
     * a standalone expression does not.
     */
    public String format(HclNode node) {
        Objects.requireNonNull(node, "node");
        if (node instanceof Body body) {
            return body(body, 0);
        }
        if (node instanceof Block block) {
            return block(block, 0);
        }
        if (node instanceof Attribute attribute) {
            return attribute(attribute, 0);
        }
        if (node instanceof Expression expression) {
            return new Printer(0, true).render(expression);
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }

    /**
     * Render a node into the given sink. A failing sink is reported as a {@link FormatError}.
     */
    public <A extends Appendable> HclResult<A> format(HclNode node, A sink) {
        var text = format(node);
        try {
            sink.append(text);
            return HclResult.success(sink);
        } catch (IOException e) {
            log.warn("Writing formatted output failed", e);
            return HclResult.failure(new FormatError(e));
        }
    }

    // === Structures ===

    private String body(Body body, int level) {
        var sb = new StringBuilder();
        for (var structure : body.structures()) {
            if (structure instanceof Attribute attribute) {
                sb.append(attribute(attribute, level));
            } else if (structure instanceof Block block) {
                sb.append(block(block, level));
            }
        }
        return sb.toString();
    }

    private String attribute(Attribute attribute, int level) {
        var value = new Printer(level, true).render(attribute.value());
        return indent(level) + attribute.key().name() + " = " + endLine(value);
    }

    private String block(Block block, int level) {
        var sb = new StringBuilder();
        sb.append(indent(level)).append(block.identifier().name());
        for (var label : block.labels()) {
            sb.append(' ').append(label(label));
        }
        if (block.body().isEmpty()) {
            return sb.append(" {}\n").toString();
        }
        return sb.append(" {\n")
                 .append(body(block.body(), level + 1))
                 .append(indent(level))
                 .append("}\n")
                 .toString();
    }

    private static String label(BlockLabel label) {
        if (label instanceof BlockLabel.IdentifierLabel identifier) {
            return identifier.identifier().name();
        }
        return quote(label.asString());
    }

    private String indent(int level) {
        return config.indent().repeat(level);
    }

    private static String endLine(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }

    // === Strings ===

    private static String quote(String value) {
        return "\"" + escapeQuoted(value) + "\"";
    }

    private static String escapeQuoted(String text) {
        var sb = new StringBuilder(text.length() + 2);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '$', '%' -> {
                    sb.append(c);
                    if (i + 1 < text.length() && text.charAt(i + 1) == '{') {
                        sb.append(c);
                    }
                }
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String tag(Strip strip, String content) {
        return "%{" + (strip.stripStart() ? "~" : "") + " " + content + " " + (strip.stripEnd() ? "~" : "") + "}";
    }

    // Heredoc text has no backslash escapes, only the doubled template openers
    private static String escapeHeredoc(String text) {
        return text.replace("${", "$${")
                   .replace("%{", "%%{");
    }

    /**
     * Expression renderer for one nesting level. {@code expand} tells whether an object at this
     * position is written one item per line.
     */
    private final class Printer implements Expression.Visitor<String> {
        private final int level;
        private final boolean expand;

        private Printer(int level, boolean expand) {
            this.level = level;
            this.expand = expand;
        }

        String render(Expression expression) {
            return expression.accept(this);
        }

        private String compact(Expression expression) {
            return expression.accept(new Printer(level, false));
        }

        // A heredoc must be followed by a line terminator; wrap it when something follows on the same line
        private String operand(Expression expression) {
            var text = compact(expression);
            return text.endsWith("\n") ? "(" + text + ")" : text;
        }

        @Override
        public String visitNull(Expression.NullLiteral expr) {
            return "null";
        }

        @Override
        public String visitBool(Expression.BoolLiteral expr) {
            return String.valueOf(expr.value());
        }

        @Override
        public String visitNumber(Expression.NumberLiteral expr) {
            return expr.value().toString();
        }

        @Override
        public String visitString(Expression.StringLiteral expr) {
            return quote(expr.value());
        }

        @Override
        public String visitTuple(Expression.TupleExpr expr) {
            if (expr.elements().isEmpty()) {
                return "[]";
            }
            if (config.compactArrays()) {
                var elements = new ArrayList<String>(expr.elements().size());
                for (var element : expr.elements()) {
                    elements.add(compact(element));
                }
                return "[" + String.join(", ", elements) + "]";
            }
            var inner = new Printer(level + 1, false);
            var sb = new StringBuilder("[\n");
            for (var element : expr.elements()) {
                sb.append(indent(level + 1)).append(inner.render(element)).append(",\n");
            }
            return sb.append(indent(level)).append(']').toString();
        }

        @Override
        public String visitObject(Expression.ObjectExpr expr) {
            if (expr.items().isEmpty()) {
                return "{}";
            }
            if (!expand || config.compactObjects()) {
                var items = new ArrayList<String>(expr.items().size());
                for (var item : expr.items()) {
                    var value = compact(item.value());
                    if (value.endsWith("\n")) {
                        return expanded(expr.items());
                    }
                    items.add(key(item.key()) + " = " + value);
                }
                return "{ " + String.join(", ", items) + " }";
            }
            return expanded(expr.items());
        }

        private String expanded(List<ObjectItem> items) {
            var inner = new Printer(level + 1, true);
            var sb = new StringBuilder("{\n");
            for (var item : items) {
                sb.append(indent(level + 1))
                  .append(key(item.key()))
                  .append(" = ")
                  .append(endLine(inner.render(item.value())));
            }
            return sb.append(indent(level)).append('}').toString();
        }

        private String key(ObjectKey key) {
            if (key instanceof ObjectKey.IdentifierKey identifier) {
                return identifier.identifier().name();
            }
            return operand(((ObjectKey.ExpressionKey) key).expression());
        }

        @Override
        public String visitTemplate(Expression.TemplateExpr expr) {
            return "\"" + template(expr.template(), false) + "\"";
        }

        @Override
        public String visitHeredoc(Expression.HeredocExpr expr) {
            var content = template(expr.template(), true);
            if (!content.isEmpty() && !content.endsWith("\n")) {
                content = content + "\n";
            }
            var delimiter = expr.delimiter().name();
            return "<<" + (expr.indented() ? "-" : "") + delimiter + "\n" + content + delimiter + "\n";
        }

        @Override
        public String visitFuncCall(Expression.FuncCall expr) {
            var args = new ArrayList<String>(expr.args().size());
            for (var arg : expr.args()) {
                args.add(compact(arg));
            }
            return expr.name() + "(" + String.join(", ", args) + (expr.expandFinal() ? "..." : "") + ")";
        }

        @Override
        public String visitTraversal(Expression.Traversal expr) {
            var sb = new StringBuilder(operand(expr.expression()));
            for (var operator : expr.operators()) {
                if (operator instanceof TraversalOperator.GetAttr getAttr) {
                    sb.append('.').append(getAttr.name().name());
                } else if (operator instanceof TraversalOperator.Index index) {
                    sb.append('[').append(compact(index.index())).append(']');
                } else if (operator instanceof TraversalOperator.LegacyIndex legacyIndex) {
                    sb.append('.').append(legacyIndex.index());
                } else if (operator instanceof TraversalOperator.AttrSplat) {
                    sb.append(".*");
                } else if (operator instanceof TraversalOperator.FullSplat) {
                    sb.append("[*]");
                }
            }
            return sb.toString();
        }

        @Override
        public String visitUnaryOp(Expression.UnaryOp expr) {
            return expr.operator().symbol() + operand(expr.operand());
        }

        @Override
        public String visitBinaryOp(Expression.BinaryOp expr) {
            return operand(expr.lhs()) + " " + expr.operator().symbol() + " " + compact(expr.rhs());
        }

        @Override
        public String visitParenthesis(Expression.Parenthesis expr) {
            return "(" + compact(expr.inner()) + ")";
        }

        @Override
        public String visitConditional(Expression.Conditional expr) {
            return operand(expr.condition()) + " ? " + operand(expr.trueExpr()) + " : " + compact(expr.falseExpr());
        }

        @Override
        public String visitVariable(Expression.Variable expr) {
            return expr.name().name();
        }

        @Override
        public String visitFor(Expression.ForExpr expr) {
            var sb = new StringBuilder();
            sb.append(expr.isObject() ? "{" : "[").append("for ");
            expr.keyVariable().ifPresent(key -> sb.append(key.name()).append(", "));
            sb.append(expr.valueVariable().name())
              .append(" in ")
              .append(operand(expr.collection()))
              .append(" : ");
            expr.keyExpr().ifPresent(key -> sb.append(operand(key)).append(" => "));
            sb.append(operand(expr.valueExpr()));
            if (expr.grouping()) {
                sb.append("...");
            }
            expr.condition().ifPresent(condition -> sb.append(" if ").append(operand(condition)));
            return sb.append(expr.isObject() ? "}" : "]").toString();
        }

        // === Templates ===

        private String template(Template template, boolean heredoc) {
            var sb = new StringBuilder();
            for (var element : template.elements()) {
                if (element instanceof TemplateElement.Literal literal) {
                    sb.append(heredoc ? escapeHeredoc(literal.text()) : escapeQuoted(literal.text()));
                } else if (element instanceof TemplateElement.Interpolation interpolation) {
                    sb.append("${")
                      .append(interpolation.strip().stripStart() ? "~" : "")
                      .append(compact(interpolation.expression()))
                      .append(interpolation.strip().stripEnd() ? "~" : "")
                      .append('}');
                } else if (element instanceof TemplateElement.IfDirective directive) {
                    sb.append(tag(directive.ifStrip(), "if " + compact(directive.condition())))
                      .append(template(directive.trueTemplate(), heredoc));
                    directive.falseTemplate()
                             .ifPresent(falseTemplate -> sb.append(tag(directive.elseStrip(), "else"))
                                                           .append(template(falseTemplate, heredoc)));
                    sb.append(tag(directive.endifStrip(), "endif"));
                } else if (element instanceof TemplateElement.ForDirective directive) {
                    var header = new StringBuilder("for ");
                    directive.keyVariable().ifPresent(key -> header.append(key.name()).append(", "));
                    header.append(directive.valueVariable().name())
                          .append(" in ")
                          .append(compact(directive.collection()));
                    sb.append(tag(directive.forStrip(), header.toString()))
                      .append(template(directive.template(), heredoc))
                      .append(tag(directive.endforStrip(), "endfor"));
                }
            }
            return sb.toString();
        }
    }
}
