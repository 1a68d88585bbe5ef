package info.isaksson.erland.modelimport.types;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ArchimateTypeMappingTest {

    @Test
    void exactPaletteTypesAreKnown() {
        TypeMapping m = ArchimateTypeMapping.mapElementType("BusinessActor", "meff");
        assertTrue(m.known);
        assertEquals("BusinessActor", m.type);
        assertNull(m.unknownName);
    }

    @Test
    void tokensAreMatchedLeniently() {
        assertEquals("BusinessActor", ArchimateTypeMapping.mapElementType("archimate:Business Actor", "s").type);
        assertEquals("ApplicationComponent", ArchimateTypeMapping.mapElementType("application-component", "s").type);
        assertEquals("TechnologyService", ArchimateTypeMapping.mapElementType("InfrastructureService", "s").type);
        assertEquals("Assignment", ArchimateTypeMapping.mapRelationshipType("AssignmentRelationship", "s").type);
        assertEquals("Realization", ArchimateTypeMapping.mapRelationshipType("Realisation", "s").type);
    }

    @Test
    void unknownTokensArePreservedVerbatim() {
        TypeMapping m = ArchimateTypeMapping.mapElementType("TotallyMadeUp", "archimate-meff");
        assertFalse(m.known);
        assertEquals(TypeMapping.UNKNOWN, m.type);
        assertEquals("archimate-meff", m.unknownNs);
        assertEquals("TotallyMadeUp", m.unknownName);
    }

    @Test
    void usedByIsNotSilentlyMapped() {
        assertFalse(ArchimateTypeMapping.mapRelationshipType("UsedBy", "s").known);
    }

    @Test
    void emptyTokenIsMissingType() {
        TypeMapping m = ArchimateTypeMapping.mapRelationshipType("  ", "s");
        assertFalse(m.known);
        assertEquals(ArchimateTypeMapping.MISSING_TYPE, m.unknownName);
    }

    @Test
    void paletteKnowsLayers() {
        assertEquals(ArchimateLayer.MOTIVATION, ArchimatePalette.layerOf("Goal"));
        assertNull(ArchimatePalette.layerOf("uml.class"));
        assertTrue(ArchimatePalette.VIEWPOINT_IDS.contains("layered"));
    }
}
