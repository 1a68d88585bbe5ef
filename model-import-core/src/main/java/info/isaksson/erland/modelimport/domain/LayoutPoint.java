package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"x","y"})
public final class LayoutPoint {
    public final double x;
    public final double y;

    public LayoutPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayoutPoint)) return false;
        LayoutPoint that = (LayoutPoint) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override public String toString() {
        return "(" + x + "," + y + ")";
    }
}
