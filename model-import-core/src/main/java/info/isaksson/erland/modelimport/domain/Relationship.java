package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.modelimport.ir.IrMaps;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"id","kind","type","sourceId","targetId","name","documentation","unknownType",
        "externalIds","taggedValues","attrs"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Relationship {
    public final String id;
    public final ModelKind kind;
    public final String type;
    public final String sourceId;
    public final String targetId;
    public final String name;
    public final String documentation;
    public final UnknownType unknownType;
    public final List<ExternalIdRef> externalIds;
    public final List<TaggedValue> taggedValues;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> attrs;

    public Relationship(String id, ModelKind kind, String type, String sourceId, String targetId, String name,
                        String documentation, UnknownType unknownType, List<ExternalIdRef> externalIds,
                        List<TaggedValue> taggedValues, Map<String, Object> attrs) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.name = name;
        this.documentation = documentation;
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
        return "Relationship{" + id + " " + type + " " + sourceId + "->" + targetId + "}";
    }
}
