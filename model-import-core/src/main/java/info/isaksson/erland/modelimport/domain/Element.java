package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.types.ArchimateLayer;

import java.util.List;
import java.util.Map;

/**
 * Model element.
 *
 * <p>{@code type} is an ArchiMate element type, a qualified {@code bpmn.*} / {@code uml.*} token, or
 * {@code Unknown}; in the last case {@code unknownType} holds the source token.</p>
 */
@JsonPropertyOrder({"id","kind","type","layer","name","documentation","folderId","parentElementId",
        "unknownType","externalIds","taggedValues","attrs"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Element {
    public final String id;
    public final ModelKind kind;
    public final String type;
    public final ArchimateLayer layer;
    public final String name;
    public final String documentation;
    public final String folderId;
    public final String parentElementId;
    public final UnknownType unknownType;
    public final List<ExternalIdRef> externalIds;
    public final List<TaggedValue> taggedValues;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> attrs;

    public Element(String id, ModelKind kind, String type, ArchimateLayer layer, String name, String documentation,
                   String folderId, String parentElementId, UnknownType unknownType,
                   List<ExternalIdRef> externalIds, List<TaggedValue> taggedValues, Map<String, Object> attrs) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.layer = layer;
        this.name = name;
        this.documentation = documentation;
        this.folderId = folderId;
        this.parentElementId = parentElementId;
        this.unknownType = unknownType;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.attrs = IrMaps.copyOf(attrs);
    }

    @JsonIgnore
    public boolean isUnknown() {
        return unknownType != null;
    }

    @Override public String toString() {
        return "Element{" + id + " " + type + " '" + name + "'}";
    }
}
