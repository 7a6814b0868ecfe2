package org.pragmatica.hcl.tree;

/**
 * Any node of the document model the formatter can render: a body, a structure or an expression.
 */
public interface HclNode {
}
