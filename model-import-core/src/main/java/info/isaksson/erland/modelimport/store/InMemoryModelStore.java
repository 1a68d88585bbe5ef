package info.isaksson.erland.modelimport.store;

import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.Folder;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObject;
import info.isaksson.erland.modelimport.domain.ViewRelationshipLayout;
import info.isaksson.erland.modelimport.sink.ModelAllocationException;
import info.isaksson.erland.modelimport.sink.ModelSink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ModelSink} holding any number of models in memory.
 *
 * <p>All methods are synchronized on the store, so concurrent imports into separate models are safe.</p>
 */
public final class InMemoryModelStore implements ModelSink {

    public static final int DEFAULT_MAX_MODELS = 1000;

    private final Map<String, MutableModel> models = new LinkedHashMap<>();
    private final int maxModels;

    public InMemoryModelStore() {
        this(DEFAULT_MAX_MODELS);
    }

    public InMemoryModelStore(int maxModels) {
        this.maxModels = maxModels;
    }

    @Override
    public synchronized String allocateModel(ModelKind kind, ModelMetadata metadata) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (models.size() >= maxModels) {
            throw new ModelAllocationException("Store is full (" + maxModels + " models)");
        }
        String modelId = "model_" + UUID.randomUUID();
        MutableModel m = new MutableModel(modelId, kind, metadata == null ? ModelMetadata.named("Imported model") : metadata);
        String rootId = "folder_" + UUID.randomUUID();
        m.folders.put(rootId, Folder.root(rootId, "Model"));
        m.rootFolderId = rootId;
        models.put(modelId, m);
        return modelId;
    }

    @Override
    public synchronized String rootFolderId(String modelId) {
        return model(modelId).rootFolderId;
    }

    @Override
    public synchronized void addFolder(String modelId, Folder folder) {
        MutableModel m = model(modelId);
        requireNewId(m.folders, folder.id, "folder");
        if (folder.parentId == null || !m.folders.containsKey(folder.parentId)) {
            throw new IllegalArgumentException("Unknown parent folder: " + folder.parentId);
        }
        m.folders.put(folder.id, folder);
    }

    @Override
    public synchronized void addElement(String modelId, Element element) {
        MutableModel m = model(modelId);
        requireNewId(m.elements, element.id, "element");
        requireFolder(m, element.folderId);
        m.elements.put(element.id, element);
    }

    @Override
    public synchronized void addRelationship(String modelId, Relationship relationship) {
        MutableModel m = model(modelId);
        requireNewId(m.relationships, relationship.id, "relationship");
        requireElement(m, relationship.sourceId);
        requireElement(m, relationship.targetId);
        m.relationships.put(relationship.id, relationship);
    }

    @Override
    public synchronized void addView(String modelId, View view) {
        MutableModel m = model(modelId);
        requireNewId(m.views, view.id, "view");
        requireFolder(m, view.folderId);
        if (view.ownerElementId != null) requireElement(m, view.ownerElementId);
        m.views.put(view.id, view);
    }

    @Override
    public synchronized void addElementToView(String modelId, String viewId, ViewNodeLayout layout) {
        MutableModel m = model(modelId);
        View v = view(m, viewId);
        if (layout == null || layout.elementId == null) throw new IllegalArgumentException("layout.elementId must not be null");
        requireElement(m, layout.elementId);
        for (ViewNodeLayout n : v.nodes) {
            if (layout.elementId.equals(n.elementId)) {
                throw new IllegalStateException("Element " + layout.elementId + " is already in view " + viewId);
            }
        }
        List<ViewNodeLayout> nodes = new ArrayList<>(v.nodes);
        nodes.add(layout);
        m.views.put(viewId, v.withNodes(nodes));
    }

    @Override
    public synchronized void addViewObject(String modelId, String viewId, ViewObject object, ViewNodeLayout layout) {
        MutableModel m = model(modelId);
        View v = view(m, viewId);
        if (object == null) throw new IllegalArgumentException("object must not be null");
        if (v.object(object.id) != null) throw new IllegalStateException("Duplicate view object id: " + object.id);
        List<ViewObject> objects = new ArrayList<>(v.objects);
        objects.add(object);
        List<ViewNodeLayout> nodes = new ArrayList<>(v.nodes);
        nodes.add(layout != null ? layout : new ViewNodeLayout(null, object.id, null, null, null, null, null));
        m.views.put(viewId, v.withObjects(objects).withNodes(nodes));
    }

    @Override
    public synchronized void setViewRelationships(String modelId, String viewId, List<ViewRelationshipLayout> relationships) {
        MutableModel m = model(modelId);
        View v = view(m, viewId);
        LinkedHashSet<String> visible = new LinkedHashSet<>();
        for (ViewRelationshipLayout r : relationships) {
            if (!m.relationships.containsKey(r.relationshipId)) {
                throw new IllegalArgumentException("Unknown relationship: " + r.relationshipId);
            }
            visible.add(r.relationshipId);
        }
        m.views.put(viewId, v.withRelationships(relationships, new ArrayList<>(visible)));
    }

    @Override
    public synchronized void updateViewNodes(String modelId, String viewId, List<ViewNodeLayout> nodes) {
        MutableModel m = model(modelId);
        View v = view(m, viewId);
        Map<String, ViewNodeLayout> byKey = new LinkedHashMap<>();
        for (ViewNodeLayout n : nodes) byKey.put(n.key(), n);
        List<ViewNodeLayout> out = new ArrayList<>(v.nodes.size());
        for (ViewNodeLayout existing : v.nodes) {
            out.add(byKey.getOrDefault(existing.key(), existing));
        }
        m.views.put(viewId, v.withNodes(out));
    }

    @Override
    public synchronized Model snapshot(String modelId) {
        MutableModel m = model(modelId);
        return new Model(m.id, m.kind, m.metadata, m.folders, m.elements, m.relationships, m.views);
    }

    public synchronized List<String> modelIds() {
        return List.copyOf(models.keySet());
    }

    public synchronized boolean removeModel(String modelId) {
        return models.remove(modelId) != null;
    }

    private MutableModel model(String modelId) {
        MutableModel m = modelId == null ? null : models.get(modelId);
        if (m == null) throw new IllegalArgumentException("Unknown model: " + modelId);
        return m;
    }

    private static View view(MutableModel m, String viewId) {
        View v = viewId == null ? null : m.views.get(viewId);
        if (v == null) throw new IllegalArgumentException("Unknown view: " + viewId);
        return v;
    }

    private static void requireNewId(Map<String, ?> table, String id, String what) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException(what + " id must not be blank");
        if (table.containsKey(id)) throw new IllegalStateException("Duplicate " + what + " id: " + id);
    }

    private static void requireFolder(MutableModel m, String folderId) {
        if (folderId == null || !m.folders.containsKey(folderId)) {
            throw new IllegalArgumentException("Unknown folder: " + folderId);
        }
    }

    private static void requireElement(MutableModel m, String elementId) {
        if (elementId == null || !m.elements.containsKey(elementId)) {
            throw new IllegalArgumentException("Unknown element: " + elementId);
        }
    }

    private static final class MutableModel {
        final String id;
        final ModelKind kind;
        final ModelMetadata metadata;
        final Map<String, Folder> folders = new LinkedHashMap<>();
        final Map<String, Element> elements = new LinkedHashMap<>();
        final Map<String, Relationship> relationships = new LinkedHashMap<>();
        final Map<String, View> views = new LinkedHashMap<>();
        String rootFolderId;

        MutableModel(String id, ModelKind kind, ModelMetadata metadata) {
            this.id = id;
            this.kind = kind;
            this.metadata = metadata;
        }
    }
}
