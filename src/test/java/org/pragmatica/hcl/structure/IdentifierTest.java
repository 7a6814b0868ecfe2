package org.pragmatica.hcl.structure;

import org.junit.jupiter.api.Test;
import org.pragmatica.hcl.expr.Expression;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTest {

    @Test
    void isValid_acceptsHclIdentifiers() {
        assertTrue(Identifier.isValid("foo"));
        assertTrue(Identifier.isValid("_foo"));
        assertTrue(Identifier.isValid("aws-instance_2"));
        assertTrue(Identifier.isValid("größe"));
    }

    @Test
    void isValid_rejectsOtherText() {
        assertFalse(Identifier.isValid(null));
        assertFalse(Identifier.isValid(""));
        assertFalse(Identifier.isValid("1abc"));
        assertFalse(Identifier.isValid("-abc"));
        assertFalse(Identifier.isValid("a b"));
        assertFalse(Identifier.isValid("a.b"));
    }

    @Test
    void of_invalidName_throws() {
        var thrown = assertThrows(IllegalArgumentException.class, () -> Identifier.of("9lives"));

        assertEquals("Invalid HCL identifier: '9lives'", thrown.getMessage());
    }

    @Test
    void identifiers_compareByName() {
        assertTrue(Identifier.of("alpha").compareTo(Identifier.of("beta")) < 0);
        assertEquals(Identifier.of("x"), Identifier.of("x"));
        assertEquals("x", Identifier.of("x").toString());
    }

    @Test
    void block_builderKeepsLabelsAndBody() {
        var block = Block.builder("resource")
                         .label("type")
                         .label(BlockLabel.identifier("name"))
                         .attribute("a", Expression.number(1))
                         .build();

        assertEquals(2, block.labels().size());
        assertEquals("type", block.labels().get(0).asString());
        assertInstanceOf(BlockLabel.IdentifierLabel.class, block.labels().get(1));
        assertEquals(1, block.body().size());
    }
}
