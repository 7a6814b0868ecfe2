package org.pragmatica.hcl.structure;

import org.pragmatica.hcl.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A block: identifier, zero or more labels and a nested body.
 *
 * <pre>
 * resource "aws_s3_bucket" mybucket {
 *   name = "mybucket"
 * }
 * </pre>
 */
public record Block(Identifier identifier, List<BlockLabel> labels, Body body) implements Structure {

    public Block {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(body, "body");
        labels = List.copyOf(labels);
    }

    public static Block of(String identifier, Body body) {
        return new Block(Identifier.of(identifier), List.of(), body);
    }

    public static Builder builder(String identifier) {
        return new Builder(Identifier.of(identifier));
    }

    /**
     * Accumulates labels and body structures; {@link #build()} produces the immutable block.
     */
    public static final class Builder {
        private final Identifier identifier;
        private final List<BlockLabel> labels = new ArrayList<>();
        private final Body.Builder body = Body.builder();

        private Builder(Identifier identifier) {
            this.identifier = identifier;
        }

        /**
         * Add a quoted string label.
         */
        public Builder label(String value) {
            labels.add(BlockLabel.string(value));
            return this;
        }

        public Builder label(BlockLabel label) {
            labels.add(label);
            return this;
        }

        public Builder attribute(String key, Expression value) {
            body.attribute(key, value);
            return this;
        }

        public Builder attribute(Attribute attribute) {
            body.structure(attribute);
            return this;
        }

        public Builder block(Block block) {
            body.structure(block);
            return this;
        }

        public Block build() {
            return new Block(identifier, labels, body.build());
        }
    }
}
