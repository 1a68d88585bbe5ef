package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FolderKind {
    ROOT("root"),
    CUSTOM("custom");

    private final String id;

    FolderKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
