package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Folder in the model tree. Only the root folder has no parent. */
@JsonPropertyOrder({"id","kind","name","parentId","documentation","externalIds","taggedValues"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Folder {
    public final String id;
    public final FolderKind kind;
    public final String name;
    public final String parentId;
    public final String documentation;
    public final List<ExternalIdRef> externalIds;
    public final List<TaggedValue> taggedValues;

    public Folder(String id, FolderKind kind, String name, String parentId, String documentation,
                  List<ExternalIdRef> externalIds, List<TaggedValue> taggedValues) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.parentId = parentId;
        this.documentation = documentation;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
    }

    public static Folder root(String id, String name) {
        return new Folder(id, FolderKind.ROOT, name, null, null, null, null);
    }

    @Override public String toString() {
        return "Folder{" + id + " '" + name + "'}";
    }
}
