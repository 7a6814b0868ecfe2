package org.pragmatica.hcl.structure;

import org.pragmatica.hcl.expr.Expression;

import java.util.Objects;

/**
 * {@code key = value}.
 */
public record Attribute(Identifier key, Expression value) implements Structure {

    public Attribute {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static Attribute of(String key, Expression value) {
        return new Attribute(Identifier.of(key), value);
    }

    public static Attribute of(String key, String value) {
        return new Attribute(Identifier.of(key), Expression.string(value));
    }
}
