package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A shape on a diagram, optionally bound to an element and nested in another node. */
@JsonPropertyOrder({"id","kind","elementId","parentNodeId","label","bounds","taggedValues","externalIds","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrViewNode {
    public final String id;
    public final IrViewNodeKind kind;
    public final String elementId;
    public final String parentNodeId;
    public final String label;
    public final IrBounds bounds;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrViewNode(
            @JsonProperty("id") String id,
            @JsonProperty("kind") IrViewNodeKind kind,
            @JsonProperty("elementId") String elementId,
            @JsonProperty("parentNodeId") String parentNodeId,
            @JsonProperty("label") String label,
            @JsonProperty("bounds") IrBounds bounds,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.kind = kind == null ? IrViewNodeKind.OTHER : kind;
        this.elementId = elementId;
        this.parentNodeId = parentNodeId;
        this.label = label;
        this.bounds = bounds;
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrViewNode withElementId(String newElementId) {
        return new IrViewNode(id, kind, newElementId, parentNodeId, label, bounds, taggedValues, externalIds, meta);
    }

    public IrViewNode withParentNodeId(String newParentNodeId) {
        return new IrViewNode(id, kind, elementId, newParentNodeId, label, bounds, taggedValues, externalIds, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrViewNode)) return false;
        IrViewNode that = (IrViewNode) o;
        return Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(elementId, that.elementId) &&
                Objects.equals(parentNodeId, that.parentNodeId) &&
                Objects.equals(label, that.label) &&
                Objects.equals(bounds, that.bounds) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, elementId, parentNodeId, label, bounds, taggedValues, externalIds, meta);
    }

    @Override public String toString() {
        return "IrViewNode{" + id + " " + kind + (elementId == null ? "" : " -> " + elementId) + "}";
    }
}
