package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Diagram of a model.
 *
 * <p>A view with a non-null {@code visibleRelationshipIds} shows exactly those relationships;
 * otherwise every relationship between two of its element nodes is shown.</p>
 */
@JsonPropertyOrder({"id","kind","name","viewpointId","documentation","folderId","ownerElementId",
        "externalIds","taggedValues","objects","nodes","relationships","visibleRelationshipIds"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class View {
    public final String id;
    public final ModelKind kind;
    public final String name;
    public final String viewpointId;
    public final String documentation;
    public final String folderId;
    public final String ownerElementId;
    public final List<ExternalIdRef> externalIds;
    public final List<TaggedValue> taggedValues;

    public final List<ViewObject> objects;
    public final List<ViewNodeLayout> nodes;
    public final List<ViewRelationshipLayout> relationships;
    public final List<String> visibleRelationshipIds;

    public View(String id, ModelKind kind, String name, String viewpointId, String documentation, String folderId,
                String ownerElementId, List<ExternalIdRef> externalIds, List<TaggedValue> taggedValues) {
        this(id, kind, name, viewpointId, documentation, folderId, ownerElementId, externalIds, taggedValues,
                null, null, null, null);
    }

    private View(String id, ModelKind kind, String name, String viewpointId, String documentation, String folderId,
                 String ownerElementId, List<ExternalIdRef> externalIds, List<TaggedValue> taggedValues,
                 List<ViewObject> objects, List<ViewNodeLayout> nodes, List<ViewRelationshipLayout> relationships,
                 List<String> visibleRelationshipIds) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.viewpointId = viewpointId;
        this.documentation = documentation;
        this.folderId = folderId;
        this.ownerElementId = ownerElementId;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.objects = objects == null ? List.of() : List.copyOf(objects);
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.relationships = relationships == null ? List.of() : List.copyOf(relationships);
        this.visibleRelationshipIds = visibleRelationshipIds == null ? null : List.copyOf(visibleRelationshipIds);
    }

    public View withObjects(List<ViewObject> newObjects) {
        return new View(id, kind, name, viewpointId, documentation, folderId, ownerElementId, externalIds, taggedValues,
                newObjects, nodes, relationships, visibleRelationshipIds);
    }

    public View withNodes(List<ViewNodeLayout> newNodes) {
        return new View(id, kind, name, viewpointId, documentation, folderId, ownerElementId, externalIds, taggedValues,
                objects, newNodes, relationships, visibleRelationshipIds);
    }

    public View withRelationships(List<ViewRelationshipLayout> newRelationships, List<String> newVisibleIds) {
        return new View(id, kind, name, viewpointId, documentation, folderId, ownerElementId, externalIds, taggedValues,
                objects, nodes, newRelationships, newVisibleIds);
    }

    public ViewObject object(String objectId) {
        for (ViewObject o : objects) {
            if (o.id.equals(objectId)) return o;
        }
        return null;
    }

    @Override public String toString() {
        return "View{" + id + " '" + name + "' nodes=" + nodes.size() + " relationships=" + relationships.size() + "}";
    }
}
