package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the intermediate representation shared by parsers, normalizers and the apply stage.
 *
 * <p>Instances are immutable. Every pipeline stage returns a new model.</p>
 */
@JsonPropertyOrder({"folders","elements","relationships","views","meta"})
public final class IrModel {
    public final List<IrFolder> folders;
    public final List<IrElement> elements;
    public final List<IrRelationship> relationships;
    public final List<IrView> views;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrModel(
            @JsonProperty("folders") List<IrFolder> folders,
            @JsonProperty("elements") List<IrElement> elements,
            @JsonProperty("relationships") List<IrRelationship> relationships,
            @JsonProperty("views") List<IrView> views,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.folders = folders == null ? List.of() : List.copyOf(folders);
        this.elements = elements == null ? List.of() : List.copyOf(elements);
        this.relationships = relationships == null ? List.of() : List.copyOf(relationships);
        this.views = views == null ? List.of() : List.copyOf(views);
        this.meta = IrMaps.copyOf(meta);
    }

    public static IrModel empty(String format) {
        return new IrModel(null, null, null, null, Map.of(IrMeta.FORMAT, format));
    }

    public String format() {
        return IrMaps.string(meta, IrMeta.FORMAT);
    }

    public IrModel withMeta(Map<String, Object> newMeta) {
        return new IrModel(folders, elements, relationships, views, newMeta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrModel)) return false;
        IrModel that = (IrModel) o;
        return Objects.equals(folders, that.folders) &&
                Objects.equals(elements, that.elements) &&
                Objects.equals(relationships, that.relationships) &&
                Objects.equals(views, that.views) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(folders, elements, relationships, views, meta);
    }

    @Override public String toString() {
        return "IrModel{folders=" + folders.size() + ", elements=" + elements.size()
                + ", relationships=" + relationships.size() + ", views=" + views.size() + "}";
    }
}
