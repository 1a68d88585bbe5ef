package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A diagram: nodes plus connections, all ids scoped to this view. */
@JsonPropertyOrder({"id","name","documentation","folderId","viewpoint","nodes","connections","taggedValues","externalIds","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrView {
    public final String id;
    public final String name;
    public final String documentation;
    public final String folderId;
    public final String viewpoint;

    public final List<IrViewNode> nodes;
    public final List<IrViewConnection> connections;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrView(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("folderId") String folderId,
            @JsonProperty("viewpoint") String viewpoint,
            @JsonProperty("nodes") List<IrViewNode> nodes,
            @JsonProperty("connections") List<IrViewConnection> connections,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.name = name;
        this.documentation = documentation;
        this.folderId = folderId;
        this.viewpoint = viewpoint;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.connections = connections == null ? List.of() : List.copyOf(connections);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrView withContent(List<IrViewNode> newNodes, List<IrViewConnection> newConnections) {
        return new IrView(id, name, documentation, folderId, viewpoint, newNodes, newConnections, taggedValues, externalIds, meta);
    }

    public IrView withFolderId(String newFolderId) {
        return new IrView(id, name, documentation, newFolderId, viewpoint, nodes, connections, taggedValues, externalIds, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrView)) return false;
        IrView that = (IrView) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(folderId, that.folderId) &&
                Objects.equals(viewpoint, that.viewpoint) &&
                Objects.equals(nodes, that.nodes) &&
                Objects.equals(connections, that.connections) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, documentation, folderId, viewpoint, nodes, connections, taggedValues, externalIds, meta);
    }

    @Override public String toString() {
        return "IrView{" + id + " '" + name + "' nodes=" + nodes.size() + " connections=" + connections.size() + "}";
    }
}
