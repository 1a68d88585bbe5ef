package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one model, keyed by internal id in insertion order.
 */
@JsonPropertyOrder({"id","kind","metadata","folders","elements","relationships","views"})
public final class Model {
    public final String id;
    public final ModelKind kind;
    public final ModelMetadata metadata;
    public final Map<String, Folder> folders;
    public final Map<String, Element> elements;
    public final Map<String, Relationship> relationships;
    public final Map<String, View> views;

    public Model(String id, ModelKind kind, ModelMetadata metadata,
                 Map<String, Folder> folders, Map<String, Element> elements,
                 Map<String, Relationship> relationships, Map<String, View> views) {
        this.id = id;
        this.kind = kind;
        this.metadata = metadata;
        this.folders = Collections.unmodifiableMap(new LinkedHashMap<>(folders));
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
        this.views = Collections.unmodifiableMap(new LinkedHashMap<>(views));
    }

    public Folder rootFolder() {
        for (Folder f : folders.values()) {
            if (f.kind == FolderKind.ROOT) return f;
        }
        return null;
    }

    @Override public String toString() {
        return "Model{" + id + " " + kind + " folders=" + folders.size() + " elements=" + elements.size()
                + " relationships=" + relationships.size() + " views=" + views.size() + "}";
    }
}
