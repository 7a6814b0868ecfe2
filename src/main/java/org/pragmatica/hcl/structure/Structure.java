package org.pragmatica.hcl.structure;

import org.pragmatica.hcl.tree.HclNode;

/**
 * One entry of a {@link Body}: an attribute or a block.
 */
public sealed interface Structure extends HclNode permits Attribute, Block {
}
