package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A polyline point in diagram pixel space. */
@JsonPropertyOrder({"x","y"})
public final class IrPoint {
    public final double x;
    public final double y;

    @JsonCreator
    public IrPoint(
            @JsonProperty("x") double x,
            @JsonProperty("y") double y
    ) {
        this.x = x;
        this.y = y;
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPoint)) return false;
        IrPoint that = (IrPoint) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
    }

    @Override public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override public String toString() {
        return "(" + x + "," + y + ")";
    }
}
