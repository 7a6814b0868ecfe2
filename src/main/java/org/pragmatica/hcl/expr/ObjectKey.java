package org.pragmatica.hcl.expr;

import org.pragmatica.hcl.structure.Identifier;

import java.util.Objects;

/**
 * Key of an object item: a bare identifier or any other expression (quoted string, parenthesized, ...).
 */
public sealed interface ObjectKey {

    static ObjectKey identifier(String name) {
        return new IdentifierKey(Identifier.of(name));
    }

    /**
     * A key from an expression. A plain variable reference is written bare in HCL, so it
     * becomes an {@link IdentifierKey}.
     */
    static ObjectKey of(Expression expression) {
        if (expression instanceof Expression.Variable variable) {
            return new IdentifierKey(variable.name());
        }
        return new ExpressionKey(expression);
    }

    record IdentifierKey(Identifier identifier) implements ObjectKey {
        public IdentifierKey {
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    record ExpressionKey(Expression expression) implements ObjectKey {
        public ExpressionKey {
            Objects.requireNonNull(expression, "expression");
        }
    }
}
