package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A model element as found in the source file.
 *
 * <p>{@code type} is a dialect token ({@code bpmn.task}, {@code uml.class}, {@code BusinessActor}, ...)
 * that has not been resolved against any taxonomy yet. {@code attrs} carries notation specific
 * structured data (BPMN event definitions, UML association ends...).</p>
 */
@JsonPropertyOrder({"id","type","name","documentation","folderId","parentElementId","taggedValues","externalIds","attrs","meta"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrElement {
    public final String id;
    public final String type;
    public final String name;
    public final String documentation;
    public final String folderId;
    public final String parentElementId;

    public final List<IrTaggedValue> taggedValues;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> attrs;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrElement(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("folderId") String folderId,
            @JsonProperty("parentElementId") String parentElementId,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("attrs") Map<String, Object> attrs,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.documentation = documentation;
        this.folderId = folderId;
        this.parentElementId = parentElementId;
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.attrs = IrMaps.copyOf(attrs);
        this.meta = IrMaps.copyOf(meta);
    }

    public IrElement withFolderId(String newFolderId) {
        return new IrElement(id, type, name, documentation, newFolderId, parentElementId, taggedValues, externalIds, attrs, meta);
    }

    public IrElement withParentElementId(String newParentElementId) {
        return new IrElement(id, type, name, documentation, folderId, newParentElementId, taggedValues, externalIds, attrs, meta);
    }

    public IrElement withAttrs(Map<String, Object> newAttrs) {
        return new IrElement(id, type, name, documentation, folderId, parentElementId, taggedValues, externalIds, newAttrs, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrElement)) return false;
        IrElement that = (IrElement) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(type, that.type) &&
                Objects.equals(name, that.name) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(folderId, that.folderId) &&
                Objects.equals(parentElementId, that.parentElementId) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(attrs, that.attrs) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, name, documentation, folderId, parentElementId, taggedValues, externalIds, attrs, meta);
    }

    @Override public String toString() {
        return "IrElement{" + id + " " + type + " '" + name + "'}";
    }
}
