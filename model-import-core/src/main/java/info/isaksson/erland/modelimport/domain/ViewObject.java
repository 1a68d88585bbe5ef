package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"id","type","text"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ViewObject {
    public final String id;
    public final ViewObjectType type;
    public final String text;

    public ViewObject(String id, ViewObjectType type, String text) {
        this.id = id;
        this.type = type;
        this.text = text;
    }

    @Override public String toString() {
        return "ViewObject{" + id + " " + type + "}";
    }
}
