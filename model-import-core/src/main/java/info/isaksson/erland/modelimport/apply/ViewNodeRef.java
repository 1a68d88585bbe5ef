package info.isaksson.erland.modelimport.apply;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** What an IR view node became: an element node or a view-local object. */
@JsonPropertyOrder({"kind","id"})
public final class ViewNodeRef {

    public enum Kind {
        ELEMENT,
        OBJECT
    }

    public final Kind kind;
    /** Internal element id or view object id. */
    public final String id;

    public ViewNodeRef(Kind kind, String id) {
        this.kind = kind;
        this.id = id;
    }

    @Override public String toString() {
        return kind + ":" + id;
    }
}
