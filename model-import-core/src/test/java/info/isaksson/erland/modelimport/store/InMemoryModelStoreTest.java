package info.isaksson.erland.modelimport.store;

import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.Folder;
import info.isaksson.erland.modelimport.domain.FolderKind;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObject;
import info.isaksson.erland.modelimport.domain.ViewObjectType;
import info.isaksson.erland.modelimport.domain.ViewRelationshipLayout;
import info.isaksson.erland.modelimport.sink.ModelAllocationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryModelStoreTest {

    private final InMemoryModelStore store = new InMemoryModelStore(2);

    @Test
    void allocatedModelStartsWithARootFolder() {
        String id = store.allocateModel(ModelKind.UML, ModelMetadata.named("M"));
        Model m = store.snapshot(id);

        assertEquals(ModelKind.UML, m.kind);
        assertEquals("M", m.metadata.name);
        assertEquals(1, m.folders.size());
        assertEquals(FolderKind.ROOT, m.rootFolder().kind);
        assertEquals(store.rootFolderId(id), m.rootFolder().id);
        assertEquals(List.of(id), store.modelIds());
    }

    @Test
    void rejectsDuplicatesAndDanglingReferences() {
        String id = store.allocateModel(ModelKind.ARCHIMATE, null);
        String root = store.rootFolderId(id);
        store.addElement(id, element("e1", root));

        assertThrows(IllegalStateException.class, () -> store.addElement(id, element("e1", root)));
        assertThrows(IllegalArgumentException.class, () -> store.addElement(id, element("e2", "no-such-folder")));
        assertThrows(IllegalArgumentException.class, () -> store.addFolder(id,
                new Folder("f", FolderKind.CUSTOM, "F", "no-such-folder", null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> store.addRelationship(id,
                new Relationship("r", ModelKind.ARCHIMATE, "Serving", "e1", "ghost", null, null, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> store.snapshot("other"));
    }

    @Test
    void viewLayoutUpdates() {
        String id = store.allocateModel(ModelKind.ARCHIMATE, null);
        String root = store.rootFolderId(id);
        store.addElement(id, element("a", root));
        store.addElement(id, element("b", root));
        store.addRelationship(id, new Relationship("r", ModelKind.ARCHIMATE, "Serving", "a", "b", null, null, null, null, null, null));
        store.addView(id, new View("v", ModelKind.ARCHIMATE, "V", "layered", null, root, null, null, null));

        store.addElementToView(id, "v", ViewNodeLayout.forElement("a").withBounds(0, 0, 10, 10));
        assertThrows(IllegalStateException.class, () -> store.addElementToView(id, "v", ViewNodeLayout.forElement("a")));
        store.addViewObject(id, "v", new ViewObject("o", ViewObjectType.LABEL, "hi"), null);
        store.setViewRelationships(id, "v", List.of(new ViewRelationshipLayout("r", null, null),
                new ViewRelationshipLayout("r", null, 3)));
        store.updateViewNodes(id, "v", List.of(ViewNodeLayout.forElement("a").withBounds(1, 2, 3, 4).withZIndex(7)));

        View v = store.snapshot(id).views.get("v");
        assertEquals(2, v.nodes.size());
        assertEquals(7, v.nodes.get(0).zIndex);
        assertEquals(1.0, v.nodes.get(0).x);
        assertEquals("obj:o", v.nodes.get(1).key());
        assertEquals(List.of("r"), v.visibleRelationshipIds);
        assertThrows(IllegalArgumentException.class, () -> store.setViewRelationships(id, "v",
                List.of(new ViewRelationshipLayout("nope", null, null))));
    }

    @Test
    void fullStoreCannotAllocate() {
        store.allocateModel(ModelKind.BPMN, null);
        String second = store.allocateModel(ModelKind.BPMN, null);
        assertThrows(ModelAllocationException.class, () -> store.allocateModel(ModelKind.BPMN, null));

        assertTrue(store.removeModel(second));
        assertNotNull(store.allocateModel(ModelKind.BPMN, null));
    }

    @Test
    void snapshotsAreDetachedFromLaterChanges() {
        String id = store.allocateModel(ModelKind.ARCHIMATE, null);
        Model before = store.snapshot(id);
        store.addElement(id, element("late", store.rootFolderId(id)));

        assertTrue(before.elements.isEmpty());
        assertEquals(1, store.snapshot(id).elements.size());
    }

    private static Element element(String id, String folderId) {
        return new Element(id, ModelKind.ARCHIMATE, "BusinessActor", null, id, null, folderId, null, null, null, null, null);
    }
}
