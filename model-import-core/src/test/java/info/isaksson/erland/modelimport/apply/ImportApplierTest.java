package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.ExternalIdRef;
import info.isaksson.erland.modelimport.domain.Folder;
import info.isaksson.erland.modelimport.domain.LayoutPoint;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObject;
import info.isaksson.erland.modelimport.domain.ViewObjectType;
import info.isaksson.erland.modelimport.domain.ViewRelationshipLayout;
import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrPoint;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.sink.ModelAllocationException;
import info.isaksson.erland.modelimport.sink.ModelSink;
import info.isaksson.erland.modelimport.store.InMemoryModelStore;
import info.isaksson.erland.modelimport.types.ArchimateLayer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ImportApplierTest {

    private final InMemoryModelStore store = new InMemoryModelStore();

    @Test
    void everyElementAndRelationshipKeepsItsIrIdAsExternalId() {
        IrModel ir = model(null,
                List.of(el("a", "BusinessActor", "A"),
                        new IrElement("b", "BusinessRole", "B", null, null, null, null,
                                List.of(new IrExternalId(null, "guid-b", null)), null, null)),
                List.of(rel("r1", "Assignment", "a", "b")),
                null);

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);

        for (IrElement e : ir.elements) {
            Element created = m.elements.get(res.mappings.elements.get(e.id));
            assertNotNull(created, e.id);
            assertTrue(created.externalIds.contains(new ExternalIdRef("test", e.id)), e.id);
        }
        Relationship r = m.relationships.get(res.mappings.relationships.get("r1"));
        assertTrue(r.externalIds.contains(new ExternalIdRef("test", "r1")));

        Element b = m.elements.get(res.mappings.elements.get("b"));
        assertEquals(List.of(new ExternalIdRef("test", "guid-b"), new ExternalIdRef("test", "b")), b.externalIds);
        assertEquals(ArchimateLayer.BUSINESS, b.layer);
        assertEquals(ModelKind.ARCHIMATE, m.kind);
        assertFalse(res.report.hasWarnings());
    }

    @Test
    void explicitSourceSystemNamespacesExternalIdsAndTaggedValues() {
        IrModel ir = model(null,
                List.of(new IrElement("a", "BusinessActor", "A", null, null, null,
                        List.of(new IrTaggedValue("Owner", "Sales"), new IrTaggedValue("  ", "dropped")), null, null, null)),
                null, null);
        ApplyOptions o = new ApplyOptions();
        o.sourceSystem = "archi";

        ApplyResult res = apply(ir, o);
        Element a = store.snapshot(res.modelId).elements.get(res.mappings.elements.get("a"));

        assertEquals(List.of(new ExternalIdRef("archi", "a")), a.externalIds);
        assertEquals(1, a.taggedValues.size());
        assertEquals("archi", a.taggedValues.get(0).ns);
        assertEquals("Owner", a.taggedValues.get(0).key);
        assertEquals("Sales", a.taggedValues.get(0).value);
        assertNotNull(a.taggedValues.get(0).id);
    }

    @Test
    void totallyMadeUpTypeBecomesUnknownWithTokenPreserved() {
        IrModel ir = model(null,
                List.of(el("x", "TotallyMadeUp", "X"), el("y", "TechnologyWidget", "Y")),
                List.of(rel("r", "Whatever", "x", "y")),
                null);

        ApplyResult res = assertDoesNotThrow(() -> apply(ir, new ApplyOptions()));
        Model m = store.snapshot(res.modelId);

        Element x = m.elements.get(res.mappings.elements.get("x"));
        assertEquals("Unknown", x.type);
        assertEquals("TotallyMadeUp", x.unknownType.name);
        assertEquals("test", x.unknownType.ns);
        assertEquals(ArchimateLayer.BUSINESS, x.layer);
        assertEquals(ArchimateLayer.TECHNOLOGY, m.elements.get(res.mappings.elements.get("y")).layer);

        Relationship r = m.relationships.get(res.mappings.relationships.get("r"));
        assertEquals("Unknown", r.type);
        assertEquals("Whatever", r.unknownType.name);

        assertEquals(Map.of("test:TotallyMadeUp", 1, "test:TechnologyWidget", 1), res.report.getUnknownElementTypes());
        assertEquals(Map.of("test:Whatever", 1), res.report.getUnknownRelationshipTypes());
    }

    @Test
    void sourceTypeMetaIsTheReportedTokenForUnknownItems() {
        IrModel ir = model(null,
                List.of(new IrElement("x", "Unknown", "X", null, null, null, null, null, null,
                        Map.of(IrMeta.SOURCE_TYPE, "FancyThing"))),
                null, null);

        ApplyResult res = apply(ir, new ApplyOptions());
        Element x = store.snapshot(res.modelId).elements.get(res.mappings.elements.get("x"));

        assertEquals("FancyThing", x.unknownType.name);
        assertEquals(Map.of("test:FancyThing", 1), res.report.getUnknownElementTypes());
    }

    @Test
    void finishedModelCountsMergeWithCountsRecordedWhileParsing() {
        ImportReport report = new ImportReport("test");
        report.countUnknownElementType("test", "TotallyMadeUp");
        report.countUnknownRelationshipType("test", "DroppedLater");
        IrModel ir = model(null,
                List.of(el("x", "TotallyMadeUp", "X"), el("y", "TotallyMadeUp", "Y")),
                null, null);

        ApplyResult res = new ImportApplier(store).apply(ir, new ApplyOptions(), report);

        assertSame(report, res.report);
        assertEquals(Map.of("test:TotallyMadeUp", 2), res.report.getUnknownElementTypes());
        assertEquals(Map.of("test:DroppedLater", 1), res.report.getUnknownRelationshipTypes());
    }

    @Test
    void skipPolicyDropsUnknownItemsWithWarnings() {
        IrModel ir = model(null,
                List.of(el("a", "BusinessActor", "A"), el("x", "TotallyMadeUp", "X")),
                List.of(rel("r1", "Serving", "x", "a"), rel("r2", "Bogus", "a", "a")),
                null);
        ApplyOptions o = new ApplyOptions();
        o.unknownTypePolicy = UnknownTypePolicy.SKIP;

        ApplyResult res = apply(ir, o);

        assertEquals(List.of("a"), List.copyOf(res.mappings.elements.keySet()));
        assertTrue(res.mappings.relationships.isEmpty());
        List<String> warnings = res.report.getWarnings();
        assertTrue(warnings.stream().anyMatch(w -> w.contains("Skipped element \"X\" of unknown type \"TotallyMadeUp\"")), warnings.toString());
        assertTrue(warnings.stream().anyMatch(w -> w.contains("unknown type \"Bogus\"")), warnings.toString());
        assertTrue(warnings.stream().anyMatch(w -> w.contains("missing source \"x\"")), warnings.toString());
        assertTrue(res.report.getUnknownElementTypes().isEmpty());
    }

    @Test
    void relationshipWithMissingEndpointIsSkippedWithOneWarning() {
        IrModel ir = model(null,
                List.of(el("a", "BusinessActor", "A")),
                List.of(rel("r1", "Serving", "a", "ghost")),
                null);

        ApplyResult res = apply(ir, new ApplyOptions());

        assertTrue(res.mappings.relationships.isEmpty());
        assertTrue(store.snapshot(res.modelId).relationships.isEmpty());
        assertEquals(1, res.report.getIssues(ImportApplier.APPLY_CODE).size());
        assertTrue(res.report.getWarnings().get(0).contains("missing target \"ghost\""));
    }

    @Test
    void foldersAreCreatedParentFirstAndUndefinedParentsGetPlaceholders() {
        IrModel ir = model(
                List.of(new IrFolder("f2", "Child", "f1", null, null, null, null),
                        new IrFolder("f1", "Parent", null, null, null, null, null),
                        new IrFolder("f3", "Orphan", "ghost", null, null, null, null)),
                List.of(new IrElement("a", "BusinessActor", "A", null, "f2", null, null, null, null, null),
                        new IrElement("b", "BusinessActor", "B", null, "nowhere", null, null, null, null, null)),
                null, null);

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);
        String root = m.rootFolder().id;

        Folder parent = m.folders.get(res.mappings.folders.get("f1"));
        Folder child = m.folders.get(res.mappings.folders.get("f2"));
        assertEquals(root, parent.parentId);
        assertEquals(parent.id, child.parentId);
        assertTrue(parent.externalIds.contains(new ExternalIdRef("test", "f1")));

        Folder placeholder = m.folders.get(res.mappings.folders.get("ghost"));
        assertNotNull(placeholder);
        assertEquals("Imported folder (ghost)", placeholder.name);
        assertEquals(root, placeholder.parentId);
        assertEquals(placeholder.id, m.folders.get(res.mappings.folders.get("f3")).parentId);

        assertEquals(child.id, m.elements.get(res.mappings.elements.get("a")).folderId);
        assertEquals(root, m.elements.get(res.mappings.elements.get("b")).folderId);

        List<String> warnings = res.report.getWarnings();
        assertTrue(warnings.stream().anyMatch(w -> w.contains("Folder \"ghost\" is referenced but not defined")), warnings.toString());
        assertTrue(warnings.stream().anyMatch(w -> w.contains("missing folder \"nowhere\"")), warnings.toString());
    }

    @Test
    void bpmnReferencesInAttrsAreRewrittenToInternalIds() {
        IrModel ir = new IrModel(null, List.of(
                el("T", "bpmn.task", "Check"),
                el("M", "bpmn.message", "Order"),
                new IrElement("B", "bpmn.boundaryEvent", "Late", null, null, null, null, null,
                        Map.of("attachedToRef", "T",
                                "eventDefinition", Map.of("kind", "message", "messageRef", "M")), null),
                new IrElement("L", "bpmn.lane", "Clerk", null, null, null, null, null,
                        Map.of("flowNodeRefs", List.of("T", "Gone")), null),
                new IrElement("P", "bpmn.pool", "Shop", null, null, null, null, null,
                        Map.of("processRef", "Proc_missing"), null)),
                null, null, Map.of(IrMeta.FORMAT, "bpmn2"));

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);
        String t = res.mappings.elements.get("T");

        Element b = m.elements.get(res.mappings.elements.get("B"));
        assertEquals(t, b.attrs.get("attachedToRef"));
        assertEquals(res.mappings.elements.get("M"), ((Map<?, ?>) b.attrs.get("eventDefinition")).get("messageRef"));
        assertEquals("message", ((Map<?, ?>) b.attrs.get("eventDefinition")).get("kind"));
        assertFalse(b.attrs.containsKey(IrMeta.UNRESOLVED_REFS));

        Element lane = m.elements.get(res.mappings.elements.get("L"));
        assertEquals(List.of(t), lane.attrs.get("flowNodeRefs"));
        assertEquals(Map.of("flowNodeRefs", List.of("Gone")), lane.attrs.get(IrMeta.UNRESOLVED_REFS));

        Element pool = m.elements.get(res.mappings.elements.get("P"));
        assertFalse(pool.attrs.containsKey("processRef"));
        assertEquals(Map.of("processRef", "Proc_missing"), pool.attrs.get(IrMeta.UNRESOLVED_REFS));

        assertEquals(ModelKind.BPMN, m.kind);
        assertEquals(ModelKind.BPMN, lane.kind);
        assertEquals("bpmn2", ImportApplier.sourceSystem(ir, new ApplyOptions()));
        assertEquals(2, res.report.getIssues(ImportApplier.APPLY_CODE).size());
    }

    @Test
    void associationClassBackReferencesPointAtInternalIds() {
        IrModel ir = model(null,
                List.of(el("C1", "uml.class", "Order"), el("C2", "uml.class", "Product"),
                        new IrElement("AC", "uml.associationClass", "OrderLine", null, null, null, null, null,
                                Map.of(IrMeta.ASSOCIATION_RELATIONSHIP_ID, "AC__association"), null)),
                List.of(new IrRelationship("AC__association", "uml.association", "C1", "C2", null, null, null, null,
                        Map.of(IrMeta.ASSOCIATION_CLASS_ELEMENT_ID, "AC"), null)),
                null);

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);

        Element ac = m.elements.get(res.mappings.elements.get("AC"));
        Relationship assoc = m.relationships.get(res.mappings.relationships.get("AC__association"));
        assertEquals(assoc.id, ac.attrs.get(IrMeta.ASSOCIATION_RELATIONSHIP_ID));
        assertEquals(ac.id, assoc.attrs.get(IrMeta.ASSOCIATION_CLASS_ELEMENT_ID));
        assertEquals(ModelKind.UML, m.kind);
        assertFalse(res.report.hasWarnings());
    }

    @Test
    void missingParentElementIsClearedWithWarning() {
        IrModel ir = model(null,
                List.of(new IrElement("a", "BusinessService", "A", null, null, "ghost", null, null, null, null),
                        new IrElement("b", "BusinessService", "B", null, null, "a", null, null, null, null)),
                null, null);

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);

        String a = res.mappings.elements.get("a");
        assertNull(m.elements.get(a).parentElementId);
        assertEquals(a, m.elements.get(res.mappings.elements.get("b")).parentElementId);
        assertEquals(1, res.report.getWarnings().size());
        assertTrue(res.report.getWarnings().get(0).contains("missing parentElementId \"ghost\""));
    }

    @Test
    void viewsGetElementNodesObjectsAndRouting() {
        IrModel ir = model(null,
                List.of(el("a", "BusinessActor", "Customer"), el("s", "BusinessService", "Ordering")),
                List.of(rel("r", "Serving", "s", "a")),
                List.of(new IrView("v1", "Main", null, null, "Service Realization",
                        List.of(node("n1", IrViewNodeKind.ELEMENT, "a", null, new IrBounds(10, 20, 120, 55)),
                                node("g", IrViewNodeKind.GROUP, null, "Services", new IrBounds(200, 0, 400, 300)),
                                node("n2", IrViewNodeKind.ELEMENT, "s", null, new IrBounds(220, 40, 120, 55)),
                                node("note", IrViewNodeKind.NOTE, null, "hi", null),
                                node("lost", IrViewNodeKind.ELEMENT, "missing", null, null)),
                        List.of(new IrViewConnection("c1", "r", "n2", "n1", "s", "a", null,
                                        List.of(new IrPoint(150, 60)), null, null, null),
                                new IrViewConnection("c2", "nope", "n1", "n2", null, null, null, null, null, null, null)),
                        null, null, Map.of(IrMeta.OWNING_ELEMENT_ID, "s")),
                        new IrView("v2", "Other", null, null, null, null, null, null, null, null)));

        ApplyResult res = apply(ir, new ApplyOptions());
        Model m = store.snapshot(res.modelId);

        View v = m.views.get(res.mappings.views.get("v1"));
        assertEquals("service-realization", v.viewpointId);
        assertEquals(res.mappings.elements.get("s"), v.ownerElementId);
        assertEquals(m.rootFolder().id, v.folderId);
        assertEquals(4, v.nodes.size());

        assertEquals(2, v.objects.size());
        ViewObject group = v.object(res.mappings.viewNode("v1", "g").id);
        assertEquals(ViewObjectType.GROUP_BOX, group.type);
        assertEquals("Services", group.text);
        assertEquals(ViewObjectType.NOTE, v.object(res.mappings.viewNode("v1", "note").id).type);
        assertEquals(ViewNodeRef.Kind.ELEMENT, res.mappings.viewNode("v1", "n1").kind);
        assertNull(res.mappings.viewNode("v1", "lost"));

        ViewNodeLayout n1 = v.nodes.get(0);
        assertEquals(res.mappings.elements.get("a"), n1.elementId);
        assertEquals(10.0, n1.x);
        assertEquals(55.0, n1.height);

        ViewNodeLayout groupLayout = v.nodes.get(1);
        ViewNodeLayout n2 = v.nodes.get(2);
        assertTrue(groupLayout.zIndex < n2.zIndex);
        assertNull(v.nodes.get(3).zIndex);

        String r = res.mappings.relationships.get("r");
        assertEquals(1, v.relationships.size());
        assertEquals(r, v.relationships.get(0).relationshipId);
        assertEquals(List.of(new LayoutPoint(150, 60)), v.relationships.get(0).points);
        assertEquals(List.of(r), v.visibleRelationshipIds);

        View other = m.views.get(res.mappings.views.get("v2"));
        assertEquals("layered", other.viewpointId);
        assertNull(other.visibleRelationshipIds);

        List<String> warnings = res.report.getWarnings();
        assertEquals(2, warnings.size(), warnings.toString());
        assertTrue(warnings.stream().anyMatch(w -> w.contains("missing element \"missing\"")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("missing relationship \"nope\"")));
    }

    @Test
    void failingToAllocateTheModelIsFatal() {
        ImportApplier applier = new ImportApplier(new InMemoryModelStore(0));
        IrModel ir = model(null, List.of(el("a", "BusinessActor", "A")), null, null);

        assertThrows(ModelAllocationException.class, () -> applier.apply(ir, new ApplyOptions(), null));
    }

    @Test
    void singleItemFailureIsWarnedAndTheRunContinues() {
        ModelSink flaky = new RejectingSink(store, "Boom");
        IrModel ir = model(null,
                List.of(el("a", "BusinessActor", "A"), el("b", "BusinessRole", "Boom"), el("c", "BusinessRole", "C")),
                List.of(rel("r1", "Assignment", "a", "b"), rel("r2", "Assignment", "a", "c")),
                null);

        ApplyResult res = new ImportApplier(flaky).apply(ir, new ApplyOptions(), new ImportReport("test"));

        assertEquals(List.of("a", "c"), List.copyOf(res.mappings.elements.keySet()));
        assertEquals(List.of("r2"), List.copyOf(res.mappings.relationships.keySet()));
        List<String> warnings = res.report.getWarnings();
        assertTrue(warnings.stream().anyMatch(w -> w.contains("Failed to create element \"Boom\"")), warnings.toString());
        assertTrue(warnings.stream().anyMatch(w -> w.contains("missing target \"b\"")), warnings.toString());
    }

    @Test
    void deterministicSeedGivesStableIdsAcrossStores() {
        IrModel ir = model(List.of(new IrFolder("f", "F", null, null, null, null, null)),
                List.of(el("a", "BusinessActor", "A"), el("b", "BusinessRole", "B")),
                List.of(rel("r", "Assignment", "a", "b")),
                null);
        ApplyOptions o = new ApplyOptions();
        o.deterministicIdSeed = "seed";

        ApplyResult first = new ImportApplier(new InMemoryModelStore()).apply(ir, o, null);
        ApplyResult second = new ImportApplier(new InMemoryModelStore()).apply(ir, o, null);

        assertEquals(first.mappings.folders, second.mappings.folders);
        assertEquals(first.mappings.elements, second.mappings.elements);
        assertEquals(first.mappings.relationships, second.mappings.relationships);
        assertTrue(first.mappings.elements.get("a").startsWith("element_"));
    }

    @Test
    void metadataDefaultsToTheIrModelName() {
        IrModel ir = new IrModel(null, List.of(el("a", "BusinessActor", "A")), null, null,
                Map.of(IrMeta.FORMAT, "test", IrMeta.MODEL_NAME, "Shop"));

        ApplyResult res = apply(ir, new ApplyOptions());
        assertEquals("Shop", store.snapshot(res.modelId).metadata.name);

        ApplyOptions o = new ApplyOptions();
        o.metadata = new ModelMetadata("Given", "desc");
        ApplyResult named = apply(ir, o);
        assertEquals("Given", store.snapshot(named.modelId).metadata.name);
    }

    @Test
    void modelKindInference() {
        assertEquals(ModelKind.BPMN, ImportApplier.inferModelKind(IrModel.empty("bpmn2"), null));
        assertEquals(ModelKind.ARCHIMATE, ImportApplier.inferModelKind(IrModel.empty("archimate-meff"), null));
        assertEquals(ModelKind.UML, ImportApplier.inferModelKind(IrModel.empty("ea-xmi-uml"), null));

        IrModel archimateInXmi = new IrModel(null, List.of(el("a", "BusinessActor", "A"), el("c", "uml.class", "C")),
                null, null, Map.of(IrMeta.FORMAT, "ea-xmi-uml"));
        assertEquals(ModelKind.ARCHIMATE, ImportApplier.inferModelKind(archimateInXmi, "sparx-ea"));

        IrModel bpmnTyped = model(null, List.of(el("t", "bpmn.task", "T"), el("a", "BusinessActor", "A")), null, null);
        assertEquals(ModelKind.BPMN, ImportApplier.inferModelKind(bpmnTyped, "test"));

        IrModel umlTyped = model(null, List.of(el("c", "uml.class", "C")), null, null);
        assertEquals(ModelKind.UML, ImportApplier.inferModelKind(umlTyped, "test"));
    }

    private ApplyResult apply(IrModel ir, ApplyOptions options) {
        return new ImportApplier(store).apply(ir, options, null);
    }

    private static IrModel model(List<IrFolder> folders, List<IrElement> elements,
                                 List<IrRelationship> relationships, List<IrView> views) {
        return new IrModel(folders, elements, relationships, views, Map.of(IrMeta.FORMAT, "test"));
    }

    private static IrElement el(String id, String type, String name) {
        return new IrElement(id, type, name, null, null, null, null, null, null, null);
    }

    private static IrRelationship rel(String id, String type, String source, String target) {
        return new IrRelationship(id, type, source, target, null, null, null, null, null, null);
    }

    private static IrViewNode node(String id, IrViewNodeKind kind, String elementId, String label, IrBounds bounds) {
        return new IrViewNode(id, kind, elementId, null, label, bounds, null, null, null);
    }

    /** Delegates to a real store but refuses elements with one particular name. */
    private static final class RejectingSink implements ModelSink {
        private final ModelSink delegate;
        private final String rejectedName;

        RejectingSink(ModelSink delegate, String rejectedName) {
            this.delegate = delegate;
            this.rejectedName = rejectedName;
        }

        @Override public String allocateModel(ModelKind kind, ModelMetadata metadata) { return delegate.allocateModel(kind, metadata); }
        @Override public String rootFolderId(String modelId) { return delegate.rootFolderId(modelId); }
        @Override public void addFolder(String modelId, Folder folder) { delegate.addFolder(modelId, folder); }

        @Override public void addElement(String modelId, Element element) {
            if (rejectedName.equals(element.name)) throw new IllegalStateException("rejected");
            delegate.addElement(modelId, element);
        }

        @Override public void addRelationship(String modelId, Relationship relationship) { delegate.addRelationship(modelId, relationship); }
        @Override public void addView(String modelId, View view) { delegate.addView(modelId, view); }
        @Override public void addElementToView(String modelId, String viewId, ViewNodeLayout layout) { delegate.addElementToView(modelId, viewId, layout); }
        @Override public void addViewObject(String modelId, String viewId, ViewObject object, ViewNodeLayout layout) { delegate.addViewObject(modelId, viewId, object, layout); }
        @Override public void setViewRelationships(String modelId, String viewId, List<ViewRelationshipLayout> relationships) { delegate.setViewRelationships(modelId, viewId, relationships); }
        @Override public void updateViewNodes(String modelId, String viewId, List<ViewNodeLayout> nodes) { delegate.updateViewNodes(modelId, viewId, nodes); }
        @Override public Model snapshot(String modelId) { return delegate.snapshot(modelId); }
    }
}
