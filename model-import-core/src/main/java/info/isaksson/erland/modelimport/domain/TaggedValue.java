package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Namespaced key/value pair attached to a model object. */
@JsonPropertyOrder({"id","ns","key","value"})
public final class TaggedValue {
    public final String id;
    public final String ns;
    public final String key;
    public final String value;

    public TaggedValue(String id, String ns, String key, String value) {
        this.id = id;
        this.ns = ns;
        this.key = key;
        this.value = value;
    }

    @Override public String toString() {
        return ns + ":" + key + "=" + value;
    }
}
