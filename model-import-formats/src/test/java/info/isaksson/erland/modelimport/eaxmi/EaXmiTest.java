package info.isaksson.erland.modelimport.eaxmi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EaXmiTest {

    @Test
    void guidBracesAndCaseAreLookupVariants() {
        assertEquals(List.of("{AB-12}", "{ab-12}", "AB-12", "ab-12"), EaXmi.refTokens(" {AB-12} "));
        assertEquals(List.of("EAID_X", "eaid_x"), EaXmi.refTokens("EAID_X"));
        assertTrue(EaXmi.refTokens("  ").isEmpty());
        assertTrue(EaXmi.refTokens(null).isEmpty());
    }

    @Test
    void numericEntitiesAreDecoded() {
        assertEquals("Café & bar", EaXmi.decodeNumericEntities("Caf&#xE9; &#38; bar"));
        assertEquals("&#x110000;", EaXmi.decodeNumericEntities("&#x110000;"), "out of range code points stay as written");
    }

    @Test
    void umlRelationshipTypeFollowsStereotype() {
        assertEquals("uml.dependency", EaXmi.umlRelationshipType("Dependency", null));
        assertEquals("uml.generalization", EaXmi.umlRelationshipType("Generalization", null));
        assertEquals("uml.include", EaXmi.umlRelationshipType("Dependency", "include"));
        assertEquals("uml.generalization", EaXmi.umlRelationshipType("Generalization", "extend"));
        assertNull(EaXmi.umlRelationshipType("Trace", null));
    }
}
