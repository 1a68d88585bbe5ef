package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Node geometry in diagram pixel space (top-left origin). */
@JsonPropertyOrder({"x","y","width","height"})
public final class IrBounds {
    public final double x;
    public final double y;
    public final double width;
    public final double height;

    @JsonCreator
    public IrBounds(
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height
    ) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /** Finite coordinates and strictly positive size. */
    @JsonIgnore
    public boolean isUsable() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width > 0 && height > 0;
    }

    public double area() {
        return width * height;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrBounds)) return false;
        IrBounds that = (IrBounds) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0 && Double.compare(height, that.height) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override public String toString() {
        return "IrBounds{" + x + "," + y + " " + width + "x" + height + "}";
    }
}
