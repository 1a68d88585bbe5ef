package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An edge drawn on a diagram.
 *
 * <p>Exporters do not always say which relationship an edge stands for; in that case
 * {@code relationshipId} is null until the view-connection resolver infers it from the endpoints.</p>
 */
@JsonPropertyOrder({"id","relationshipId","sourceNodeId","targetNodeId","sourceElementId","targetElementId","label","points","taggedValues","externalIds","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrViewConnection {
    public final String id;
    public final String relationshipId;
    public final String sourceNodeId;
    public final String targetNodeId;
    public final String sourceElementId;
    public final String targetElementId;
    public final String label;
    public final List<IrPoint> points;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrViewConnection(
            @JsonProperty("id") String id,
            @JsonProperty("relationshipId") String relationshipId,
            @JsonProperty("sourceNodeId") String sourceNodeId,
            @JsonProperty("targetNodeId") String targetNodeId,
            @JsonProperty("sourceElementId") String sourceElementId,
            @JsonProperty("targetElementId") String targetElementId,
            @JsonProperty("label") String label,
            @JsonProperty("points") List<IrPoint> points,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.relationshipId = relationshipId;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.sourceElementId = sourceElementId;
        this.targetElementId = targetElementId;
        this.label = label;
        this.points = points == null ? List.of() : List.copyOf(points);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrViewConnection withRelationshipId(String newRelationshipId) {
        return new IrViewConnection(id, newRelationshipId, sourceNodeId, targetNodeId, sourceElementId, targetElementId,
                label, points, taggedValues, externalIds, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrViewConnection)) return false;
        IrViewConnection that = (IrViewConnection) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(relationshipId, that.relationshipId) &&
                Objects.equals(sourceNodeId, that.sourceNodeId) &&
                Objects.equals(targetNodeId, that.targetNodeId) &&
                Objects.equals(sourceElementId, that.sourceElementId) &&
                Objects.equals(targetElementId, that.targetElementId) &&
                Objects.equals(label, that.label) &&
                Objects.equals(points, that.points) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, relationshipId, sourceNodeId, targetNodeId, sourceElementId, targetElementId,
                label, points, taggedValues, externalIds, meta);
    }

    @Override public String toString() {
        return "IrViewConnection{" + id + (relationshipId == null ? "" : " rel=" + relationshipId) + "}";
    }
}
