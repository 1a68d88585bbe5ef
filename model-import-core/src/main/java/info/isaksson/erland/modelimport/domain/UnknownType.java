package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Source type token that could not be resolved, kept verbatim so a user can map it later.
 */
@JsonPropertyOrder({"ns","name"})
public final class UnknownType {
    public final String ns;
    public final String name;

    public UnknownType(String ns, String name) {
        this.ns = ns;
        this.name = name;
    }

    /** Report key, {@code ns:name}. */
    public String key() {
        return ns + ":" + name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnknownType)) return false;
        UnknownType that = (UnknownType) o;
        return Objects.equals(ns, that.ns) && Objects.equals(name, that.name);
    }

    @Override public int hashCode() {
        return Objects.hash(ns, name);
    }

    @Override public String toString() {
        return key();
    }
}
