package info.isaksson.erland.modelimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Routing of one relationship in a view: the bend points between its two end nodes. */
@JsonPropertyOrder({"relationshipId","points","zIndex"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ViewRelationshipLayout {
    public final String relationshipId;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<LayoutPoint> points;
    public final Integer zIndex;

    public ViewRelationshipLayout(String relationshipId, List<LayoutPoint> points, Integer zIndex) {
        this.relationshipId = relationshipId;
        this.points = points == null ? List.of() : List.copyOf(points);
        this.zIndex = zIndex;
    }

    @Override public String toString() {
        return "ViewRelationshipLayout{" + relationshipId + " " + points + "}";
    }
}
