package org.pragmatica.hcl.structure;

import java.util.Objects;

/**
 * A block label: either a bare identifier or a quoted string.
 *
 * <p>The two kinds stay distinguishable in the model. {@link #asString()} drops the
 * distinction; after it there is no telling whether the label was quoted.
 */
public sealed interface BlockLabel {

    String asString();

    static BlockLabel identifier(String name) {
        return new IdentifierLabel(Identifier.of(name));
    }

    static BlockLabel string(String value) {
        return new StringLabel(value);
    }

    record IdentifierLabel(Identifier identifier) implements BlockLabel {
        public IdentifierLabel {
            Objects.requireNonNull(identifier, "identifier");
        }

        @Override
        public String asString() {
            return identifier.name();
        }
    }

    record StringLabel(String value) implements BlockLabel {
        public StringLabel {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asString() {
            return value;
        }
    }
}
