package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A container in the model tree. {@code parentId == null} means root level. */
@JsonPropertyOrder({"id","name","parentId","documentation","taggedValues","externalIds","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrFolder {
    public final String id;
    public final String name;
    public final String parentId;
    public final String documentation;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrFolder(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.documentation = documentation;
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrFolder withParentId(String newParentId) {
        return new IrFolder(id, name, newParentId, documentation, taggedValues, externalIds, meta);
    }

    public IrFolder withName(String newName) {
        return new IrFolder(id, newName, parentId, documentation, taggedValues, externalIds, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFolder)) return false;
        IrFolder that = (IrFolder) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(parentId, that.parentId) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, parentId, documentation, taggedValues, externalIds, meta);
    }

    @Override public String toString() {
        return "IrFolder{" + id + " '" + name + "'}";
    }
}
