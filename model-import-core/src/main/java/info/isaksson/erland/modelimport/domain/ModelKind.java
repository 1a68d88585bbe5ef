package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Notation a model (and its views) is rendered in. */
public enum ModelKind {
    ARCHIMATE("archimate"),
    BPMN("bpmn"),
    UML("uml");

    private final String id;

    ModelKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
