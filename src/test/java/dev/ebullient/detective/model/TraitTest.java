package dev.ebullient.detective.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TraitTest {

    @Test
    void negated_keepsUpperCasePrefix() {
        Trait trait = Trait.negated("publisher", "marvel", 0.8, 3);
        assertEquals("NOT_marvel", trait.value());
        assertTrue(trait.isNegated());
        assertEquals("marvel", trait.baseValue());
    }

    @Test
    void lowerCasePrefix_isNotNegation() {
        Trait trait = new Trait("species", "non_human", 0.8, 3);
        assertFalse(trait.isNegated());
        assertEquals("non_human", trait.baseValue());
    }

    @Test
    void fromKey_mapsLegacyName() {
        assertEquals(TraitKey.ORIGIN_MEDIUM, TraitKey.fromKey("media_origin"));
        assertEquals(TraitKey.HAS_POWERS, TraitKey.fromKey(" Has_Powers "));
        assertNull(TraitKey.fromKey("favourite_food"));
    }
}
