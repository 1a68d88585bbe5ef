package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.types.ArchimateLayer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TypeResolverTest {

    @Test
    void qualifiedTokensAreKeptVerbatim() {
        ResolvedType task = TypeResolver.resolveElementType("bpmn.userTask", null);
        assertEquals(ResolvedType.Taxonomy.BPMN, task.taxonomy);
        assertEquals("bpmn.userTask", task.type);
        assertNull(task.layer);

        ResolvedType assoc = TypeResolver.resolveRelationshipType("uml.association", null);
        assertEquals(ResolvedType.Taxonomy.UML, assoc.taxonomy);
        assertEquals("uml.association", assoc.type);
    }

    @Test
    void archimatePaletteTypesCarryTheirLayer() {
        ResolvedType t = TypeResolver.resolveElementType("ApplicationComponent", null);
        assertEquals(ResolvedType.Taxonomy.ARCHIMATE, t.taxonomy);
        assertEquals(ArchimateLayer.APPLICATION, t.layer);

        assertEquals(ResolvedType.Taxonomy.ARCHIMATE, TypeResolver.resolveRelationshipType("Triggering", null).taxonomy);
    }

    @Test
    void everythingElseIsUnknownWithAGuessedLayer() {
        ResolvedType t = TypeResolver.resolveElementType("TotallyMadeUp", null);
        assertTrue(t.isUnknown());
        assertEquals("Unknown", t.type);
        assertEquals("TotallyMadeUp", t.sourceToken);
        assertEquals(ArchimateLayer.BUSINESS, t.layer);

        assertTrue(TypeResolver.resolveElementType("bpmn.", null).isUnknown());
        assertTrue(TypeResolver.resolveRelationshipType("Serving ", null).taxonomy == ResolvedType.Taxonomy.ARCHIMATE);
        assertTrue(TypeResolver.resolveRelationshipType("BusinessActor", null).isUnknown());
    }

    @Test
    void sourceTypeReplacesAnUnknownToken() {
        ResolvedType t = TypeResolver.resolveElementType("Unknown", Map.of(IrMeta.SOURCE_TYPE, "MotivationThing"));
        assertEquals("MotivationThing", t.sourceToken);
        assertEquals(ArchimateLayer.MOTIVATION, t.layer);

        ResolvedType kept = TypeResolver.resolveElementType("BusinessActor", Map.of(IrMeta.SOURCE_TYPE, "Other"));
        assertEquals("BusinessActor", kept.type);
    }

    @Test
    void layerGuessByKeyword() {
        assertEquals(ArchimateLayer.STRATEGY, TypeResolver.guessLayer("StrategyMap"));
        assertEquals(ArchimateLayer.APPLICATION, TypeResolver.guessLayer("legacyApplicationThing"));
        assertEquals(ArchimateLayer.PHYSICAL, TypeResolver.guessLayer("PhysicalBox"));
        assertEquals(ArchimateLayer.IMPLEMENTATION_MIGRATION, TypeResolver.guessLayer("MigrationStep"));
        assertEquals(ArchimateLayer.BUSINESS, TypeResolver.guessLayer(null));
    }
}
