package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Identifier of a model object in a foreign tool. */
@JsonPropertyOrder({"system","id"})
public final class ExternalIdRef {
    public final String system;
    public final String id;

    public ExternalIdRef(String system, String id) {
        this.system = system;
        this.id = id;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalIdRef)) return false;
        ExternalIdRef that = (ExternalIdRef) o;
        return Objects.equals(system, that.system) && Objects.equals(id, that.id);
    }

    @Override public int hashCode() {
        return Objects.hash(system, id);
    }

    @Override public String toString() {
        return system + ":" + id;
    }
}
