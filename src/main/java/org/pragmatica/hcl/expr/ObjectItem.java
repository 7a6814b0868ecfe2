package org.pragmatica.hcl.expr;

import java.util.Objects;

public record ObjectItem(ObjectKey key, Expression value) {

    public ObjectItem {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static ObjectItem of(String key, Expression value) {
        return new ObjectItem(ObjectKey.identifier(key), value);
    }
}
