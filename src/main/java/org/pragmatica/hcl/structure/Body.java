package org.pragmatica.hcl.structure;

import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.tree.HclNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered sequence of structures forming a document or the inside of a block.
 *
 * <p>Order is significant. Repeated attribute keys and block identifiers are kept positionally;
 * the parser does not merge or de-duplicate them.
 */
public record Body(List<Structure> structures) implements HclNode {

    public static final Body EMPTY = new Body(List.of());

    public Body {
        structures = List.copyOf(structures);
    }

    public static Body of(Structure... structures) {
        return new Body(List.of(structures));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return structures.isEmpty();
    }

    public int size() {
        return structures.size();
    }

    public Stream<Attribute> attributes() {
        return structures.stream()
                         .filter(Attribute.class::isInstance)
                         .map(Attribute.class::cast);
    }

    public Stream<Block> blocks() {
        return structures.stream()
                         .filter(Block.class::isInstance)
                         .map(Block.class::cast);
    }

    public static final class Builder {
        private final List<Structure> structures = new ArrayList<>();

        private Builder() {}

        public Builder attribute(String key, Expression value) {
            structures.add(Attribute.of(key, value));
            return this;
        }

        public Builder block(Block block) {
            structures.add(block);
            return this;
        }

        public Builder structure(Structure structure) {
            structures.add(structure);
            return this;
        }

        public Body build() {
            return new Body(structures);
        }
    }
}
