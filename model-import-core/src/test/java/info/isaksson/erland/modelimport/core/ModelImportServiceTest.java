package info.isaksson.erland.modelimport.core;

import info.isaksson.erland.modelimport.apply.UnknownTypePolicy;
import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.ExternalIdRef;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewObjectType;
import info.isaksson.erland.modelimport.framework.ImportSource;
import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.framework.UnsupportedImportFormatException;
import info.isaksson.erland.modelimport.store.InMemoryModelStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ModelImportServiceTest {

    private final InMemoryModelStore store = new InMemoryModelStore();
    private final ModelImportService service = new ModelImportService(store);

    @Test
    void bpmnFileBecomesABpmnModel() throws IOException {
        ModelImportResult res = service.importSource(fixture("fixtures/scenario-a.bpmn"), options());

        assertEquals("bpmn2", res.importerId);
        assertEquals(ModelKind.BPMN, res.model.kind);
        assertEquals("scenario-a", res.model.metadata.name);
        assertEquals(3, res.model.elements.size());
        assertEquals(2, res.model.relationships.size());
        for (Relationship r : res.model.relationships.values()) {
            assertEquals("bpmn.sequenceFlow", r.type);
            assertTrue(res.model.elements.containsKey(r.sourceId));
            assertTrue(res.model.elements.containsKey(r.targetId));
        }

        Element task = res.model.elements.get(res.mappings.elements.get("Task_1"));
        assertEquals("Check order", task.name);
        assertTrue(task.externalIds.contains(new ExternalIdRef("bpmn2", "Task_1")));

        // No DI in the file: the fallback grid view is applied.
        assertEquals(1, res.model.views.size());
        View auto = res.model.views.values().iterator().next();
        assertEquals(3, auto.nodes.size());
        assertEquals(res.modelId, res.model.id);
    }

    @Test
    void meffFileKeepsUnknownTypesAndContainment() throws IOException {
        ModelImportResult res = service.importSource(fixture("fixtures/scenario-c.xml"), options());

        assertEquals(ModelKind.ARCHIMATE, res.model.kind);
        assertEquals("Shop", res.model.metadata.name);
        assertEquals(4, res.model.elements.size());
        assertEquals(3, res.model.relationships.size());

        Element odd = res.model.elements.get(res.mappings.elements.get("id-odd"));
        assertEquals("Unknown", odd.type);
        assertEquals("FancyThing", odd.unknownType.name);
        assertEquals(res.mappings.elements.get("id-service"), odd.parentElementId);
        assertEquals(Map.of("archimate-meff:FancyThing", 1), res.report.getUnknownElementTypes());

        Element actor = res.model.elements.get(res.mappings.elements.get("id-actor"));
        assertEquals("Business", res.model.folders.get(actor.folderId).name);
        assertEquals("Owner", actor.taggedValues.get(0).key);

        View main = res.model.views.get(res.mappings.views.get("id-view-1"));
        assertEquals("service-realization", main.viewpointId);
        assertEquals(3, main.nodes.size());
        assertEquals(ViewObjectType.GROUP_BOX, main.objects.get(0).type);
        assertEquals(1, main.relationships.size());
        assertEquals(res.mappings.relationships.get("id-rel-serving"), main.relationships.get(0).relationshipId);
    }

    @Test
    void skipPolicyIsPassedThrough() throws IOException {
        ModelImportOptions o = options();
        o.unknownTypePolicy = UnknownTypePolicy.SKIP;
        o.sourceSystem = "archi";

        ModelImportResult res = service.importSource(fixture("fixtures/scenario-c.xml"), o);

        assertEquals(3, res.model.elements.size());
        assertNull(res.mappings.elements.get("id-odd"));
        assertEquals(Map.of("archimate-meff:FancyThing", 1), res.report.getUnknownElementTypes(),
                "counted while parsing even though Apply skipped it");
        Element actor = res.model.elements.get(res.mappings.elements.get("id-actor"));
        assertTrue(actor.externalIds.contains(new ExternalIdRef("archi", "id-actor")));
    }

    @Test
    void keptDanglingRelationshipIsSkippedByApply() throws IOException {
        ModelImportOptions o = options();
        o.dropDanglingRelationships = false;

        ModelImportResult res = service.importSource(fixture("fixtures/scenario-c.xml"), o);

        assertTrue(res.ir.relationships.stream().anyMatch(r -> r.id.equals("id-rel-dangling")));
        assertEquals(3, res.model.relationships.size());
        assertNull(res.mappings.relationships.get("id-rel-dangling"));
        assertTrue(res.report.getWarnings().stream().anyMatch(w -> w.contains("missing target \"id-missing\"")),
                res.report.getWarnings().toString());
    }

    @Test
    void extensionTagLimitsReachTheFormatNormalizer() throws IOException {
        ModelImportResult defaults = service.importSource(fixture("fixtures/collaboration.bpmn"), options());
        assertTrue(hasExtensionTag(defaults, "Task_Check"));

        ModelImportOptions o = options();
        o.maxExtensionTags = 0;
        ModelImportResult limited = service.importSource(fixture("fixtures/collaboration.bpmn"), o);
        assertFalse(hasExtensionTag(limited, "Task_Check"));
    }

    @Test
    void fatalConditionsPropagate() {
        ImportSource notAModel = new ImportSource("notes.txt", "hello".getBytes(StandardCharsets.UTF_8), "text/plain");
        assertThrows(UnsupportedImportFormatException.class, () -> service.importSource(notAModel, options()));

        ImportSource broken = new ImportSource("broken.bpmn",
                "<definitions xmlns=\"http://www.omg.org/spec/BPMN/20100524/MODEL\"><process id=\"P\">".getBytes(StandardCharsets.UTF_8), null);
        assertThrows(StructuralParseException.class, () -> service.importSource(broken, options()));

        assertTrue(store.modelIds().isEmpty());
    }

    private static boolean hasExtensionTag(ModelImportResult res, String irElementId) {
        Element e = res.model.elements.get(res.mappings.elements.get(irElementId));
        return e.taggedValues.stream().anyMatch(tv -> tv.key.startsWith("ext:"));
    }

    private static ModelImportOptions options() {
        ModelImportOptions o = new ModelImportOptions();
        o.clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        return o;
    }

    private static ImportSource fixture(String resource) throws IOException {
        try (InputStream in = ModelImportServiceTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            return new ImportSource(resource.substring(resource.lastIndexOf('/') + 1), in.readAllBytes(), null);
        }
    }
}
