package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A directed relationship between two IR elements. */
@JsonPropertyOrder({"id","type","sourceId","targetId","name","documentation","taggedValues","externalIds","attrs","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrRelationship {
    public final String id;
    public final String type;
    public final String sourceId;
    public final String targetId;
    public final String name;
    public final String documentation;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> attrs;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrRelationship(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("name") String name,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("attrs") Map<String, Object> attrs,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.type = type;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.name = name;
        this.documentation = documentation;
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.attrs = IrMaps.copyOf(attrs);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrRelationship withAttrs(Map<String, Object> newAttrs) {
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, taggedValues, externalIds, newAttrs, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrRelationship)) return false;
        IrRelationship that = (IrRelationship) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(type, that.type) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetId, that.targetId) &&
                Objects.equals(name, that.name) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(attrs, that.attrs) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, sourceId, targetId, name, documentation, taggedValues, externalIds, attrs, meta);
    }

    @Override public String toString() {
        return "IrRelationship{" + id + " " + type + " " + sourceId + "->" + targetId + "}";
    }
}
