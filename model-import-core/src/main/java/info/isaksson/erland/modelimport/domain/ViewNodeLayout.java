package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Placement of one node in a view. Exactly one of {@code elementId} and {@code objectId} is set.
 * Geometry is absent for nodes the source placed without bounds.
 */
@JsonPropertyOrder({"elementId","objectId","x","y","width","height","zIndex"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ViewNodeLayout {
    public final String elementId;
    public final String objectId;
    public final Double x;
    public final Double y;
    public final Double width;
    public final Double height;
    public final Integer zIndex;

    public ViewNodeLayout(String elementId, String objectId, Double x, Double y, Double width, Double height, Integer zIndex) {
        this.elementId = elementId;
        this.objectId = objectId;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.zIndex = zIndex;
    }

    public static ViewNodeLayout forElement(String elementId) {
        return new ViewNodeLayout(elementId, null, null, null, null, null, null);
    }

    public boolean hasBounds() {
        return x != null && y != null && width != null && height != null;
    }

    public ViewNodeLayout withBounds(double newX, double newY, double newWidth, double newHeight) {
        return new ViewNodeLayout(elementId, objectId, newX, newY, newWidth, newHeight, zIndex);
    }

    public ViewNodeLayout withZIndex(Integer newZIndex) {
        return new ViewNodeLayout(elementId, objectId, x, y, width, height, newZIndex);
    }

    /** {@code el:<id>} or {@code obj:<id>}. */
    public String key() {
        return elementId != null ? "el:" + elementId : "obj:" + objectId;
    }

    @Override public String toString() {
        return "ViewNodeLayout{" + key() + (hasBounds() ? " " + x + "," + y + " " + width + "x" + height : "") + "}";
    }
}
