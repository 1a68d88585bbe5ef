package info.isaksson.erland.modelimport.domain;

/** View-local shapes that do not stand for a model element. */
public enum ViewObjectType {
    LABEL,
    NOTE,
    GROUP_BOX
}
