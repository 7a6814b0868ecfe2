package org.pragmatica.hcl.expr;

import org.pragmatica.hcl.structure.Identifier;
import org.pragmatica.hcl.tree.HclNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * HCL expression types - one record per grammar production.
 *
 * <p>The set is closed. Consumers dispatch through {@link Visitor}, so adding a variant breaks
 * every consumer at compile time until it handles the new case.
 */
public sealed interface Expression extends HclNode {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over all expression variants.
     */
    interface Visitor<R> {
        R visitNull(NullLiteral expr);

        R visitBool(BoolLiteral expr);

        R visitNumber(NumberLiteral expr);

        R visitString(StringLiteral expr);

        R visitTuple(TupleExpr expr);

        R visitObject(ObjectExpr expr);

        R visitTemplate(TemplateExpr expr);

        R visitHeredoc(HeredocExpr expr);

        R visitFuncCall(FuncCall expr);

        R visitTraversal(Traversal expr);

        R visitUnaryOp(UnaryOp expr);

        R visitBinaryOp(BinaryOp expr);

        R visitParenthesis(Parenthesis expr);

        R visitConditional(Conditional expr);

        R visitVariable(Variable expr);

        R visitFor(ForExpr expr);
    }

    // === Literals ===

    NullLiteral NULL = new NullLiteral();

    record NullLiteral() implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record BoolLiteral(boolean value) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record NumberLiteral(BigDecimal value) implements Expression {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record StringLiteral(String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    // === Collections ===

    /**
     * {@code [a, b, c]}
     */
    record TupleExpr(List<Expression> elements) implements Expression {
        public TupleExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    /**
     * {@code { key = value, ... }}
     */
    record ObjectExpr(List<ObjectItem> items) implements Expression {
        public ObjectExpr {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    // === Templates ===

    /**
     * Quoted template containing at least one interpolation or directive.
     */
    record TemplateExpr(Template template) implements Expression {
        public TemplateExpr {
            Objects.requireNonNull(template, "template");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTemplate(this);
        }
    }

    /**
     * {@code <<DELIM} or {@code <<-DELIM} heredoc. The template holds the content lines including
     * their line terminators; for indented heredocs the common indentation is already removed.
     */
    record HeredocExpr(Identifier delimiter, boolean indented, Template template) implements Expression {
        public HeredocExpr {
            Objects.requireNonNull(delimiter, "delimiter");
            Objects.requireNonNull(template, "template");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHeredoc(this);
        }
    }

    // === Calls and references ===

    /**
     * {@code name(arg, ...)}; {@code expandFinal} marks a trailing {@code ...} on the last argument.
     */
    record FuncCall(FuncName name, List<Expression> args, boolean expandFinal) implements Expression {
        public FuncCall {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
            if (expandFinal && args.isEmpty()) {
                throw new IllegalArgumentException("Expansion marker requires at least one argument");
            }
        }

        public static Builder builder(String name) {
            return new Builder(FuncName.of(name));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFuncCall(this);
        }

        public static final class Builder {
            private final FuncName name;
            private final List<Expression> args = new ArrayList<>();
            private boolean expandFinal;

            private Builder(FuncName name) {
                this.name = name;
            }

            public Builder arg(Expression arg) {
                args.add(arg);
                return this;
            }

            public Builder expandFinal(boolean expandFinal) {
                this.expandFinal = expandFinal;
                return this;
            }

            public FuncCall build() {
                return new FuncCall(name, args, expandFinal);
            }
        }
    }

    /**
     * Base expression followed by one or more attribute, index or splat operators.
     */
    record Traversal(Expression expression, List<TraversalOperator> operators) implements Expression {
        public Traversal {
            Objects.requireNonNull(expression, "expression");
            operators = List.copyOf(operators);
            if (operators.isEmpty()) {
                throw new IllegalArgumentException("Traversal requires at least one operator");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTraversal(this);
        }
    }

    /**
     * Reference to a named value. The names {@code true}, {@code false} and {@code null} are
     * literals in HCL and cannot name a variable.
     */
    record Variable(Identifier name) implements Expression {
        private static final Set<String> LITERAL_NAMES = Set.of("true", "false", "null");

        public Variable {
            Objects.requireNonNull(name, "name");
            if (LITERAL_NAMES.contains(name.name())) {
                throw new IllegalArgumentException("'" + name.name() + "' is a literal, not a variable name");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    // === Operations ===

    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * Operands are rendered as they are; a tree whose nesting contradicts operator precedence
     * must wrap the operand in {@link Parenthesis} to survive a round trip.
     */
    record BinaryOp(Expression lhs, BinaryOperator operator, Expression rhs) implements Expression {
        public BinaryOp {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    record Parenthesis(Expression inner) implements Expression {
        public Parenthesis {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParenthesis(this);
        }
    }

    /**
     * {@code condition ? trueExpr : falseExpr}
     */
    record Conditional(Expression condition, Expression trueExpr, Expression falseExpr) implements Expression {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(trueExpr, "trueExpr");
            Objects.requireNonNull(falseExpr, "falseExpr");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /**
     * {@code [for k, v in coll : v if cond]} or, with a key expression,
     * {@code {for k, v in coll : k => v... if cond}}.
     */
    record ForExpr(
    Optional<Identifier> keyVariable,
    Identifier valueVariable,
    Expression collection,
    Optional<Expression> keyExpr,
    Expression valueExpr,
    boolean grouping,
    Optional<Expression> condition) implements Expression {
        public ForExpr {
            Objects.requireNonNull(keyVariable, "keyVariable");
            Objects.requireNonNull(valueVariable, "valueVariable");
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(keyExpr, "keyExpr");
            Objects.requireNonNull(valueExpr, "valueExpr");
            Objects.requireNonNull(condition, "condition");
            if (grouping && keyExpr.isEmpty()) {
                throw new IllegalArgumentException("Grouping is only allowed in object for expressions");
            }
        }

        public boolean isObject() {
            return keyExpr.isPresent();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    // === Factories ===

    static StringLiteral string(String value) {
        return new StringLiteral(value);
    }

    static NumberLiteral number(long value) {
        return new NumberLiteral(BigDecimal.valueOf(value));
    }

    static NumberLiteral number(String value) {
        return new NumberLiteral(new BigDecimal(value));
    }

    static BoolLiteral bool(boolean value) {
        return new BoolLiteral(value);
    }

    static Variable variable(String name) {
        return new Variable(Identifier.of(name));
    }

    static TupleExpr tuple(Expression... elements) {
        return new TupleExpr(List.of(elements));
    }

    static ObjectExpr object(ObjectItem... items) {
        return new ObjectExpr(List.of(items));
    }

    static FuncCall call(String name, Expression... args) {
        return new FuncCall(FuncName.of(name), List.of(args), false);
    }

    /**
     * A quoted template in canonical form: literal-only templates become a {@link StringLiteral}.
     */
    static Expression template(Template template) {
        if (template.isLiteral()) {
            return new StringLiteral(template.literalText());
        }
        return new TemplateExpr(template);
    }
}
