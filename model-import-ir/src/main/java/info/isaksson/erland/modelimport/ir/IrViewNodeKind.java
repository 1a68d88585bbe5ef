package info.isaksson.erland.modelimport.ir;

/**
 * What a diagram node represents. Only {@link #ELEMENT} nodes are bound to a model element.
 */
public enum IrViewNodeKind {
    ELEMENT,
    GROUP,
    NOTE,
    LABEL,
    IMAGE,
    SHAPE,
    OTHER
}
