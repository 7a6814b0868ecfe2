package org.pragmatica.hcl.expr;

import org.pragmatica.hcl.structure.Identifier;

import java.util.Objects;

/**
 * One step of a traversal chain.
 */
public sealed interface TraversalOperator {

    /**
     * {@code .name}
     */
    record GetAttr(Identifier name) implements TraversalOperator {
        public GetAttr {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code [expr]}
     */
    record Index(Expression index) implements TraversalOperator {
        public Index {
            Objects.requireNonNull(index, "index");
        }
    }

    /**
     * {@code .0} - tuple index written with attribute syntax.
     */
    record LegacyIndex(long index) implements TraversalOperator {
        public LegacyIndex {
            if (index < 0) {
                throw new IllegalArgumentException("Legacy index must be unsigned: " + index);
            }
        }
    }

    /**
     * {@code .*}
     */
    record AttrSplat() implements TraversalOperator {}

    /**
     * {@code [*]}
     */
    record FullSplat() implements TraversalOperator {}
}
