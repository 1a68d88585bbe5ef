package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Name and description of a model, supplied by the caller of an import. */
@JsonPropertyOrder({"name","description"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ModelMetadata {
    public final String name;
    public final String description;

    public ModelMetadata(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public static ModelMetadata named(String name) {
        return new ModelMetadata(name, null);
    }

    @Override public String toString() {
        return "ModelMetadata{" + name + "}";
    }
}
