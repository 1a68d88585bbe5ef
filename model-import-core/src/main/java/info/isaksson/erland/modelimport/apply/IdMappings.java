package info.isaksson.erland.modelimport.apply;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IR id to internal id tables built by one apply run. View nodes are keyed by IR view id, then IR node id.
 */
@JsonPropertyOrder({"folders","elements","relationships","views","viewNodes"})
public final class IdMappings {
    public final Map<String, String> folders = new LinkedHashMap<>();
    public final Map<String, String> elements = new LinkedHashMap<>();
    public final Map<String, String> relationships = new LinkedHashMap<>();
    public final Map<String, String> views = new LinkedHashMap<>();
    public final Map<String, Map<String, ViewNodeRef>> viewNodes = new LinkedHashMap<>();

    void putViewNode(String irViewId, String irNodeId, ViewNodeRef ref) {
        viewNodes.computeIfAbsent(irViewId, k -> new LinkedHashMap<>()).put(irNodeId, ref);
    }

    public ViewNodeRef viewNode(String irViewId, String irNodeId) {
        return viewNodes.getOrDefault(irViewId, Collections.emptyMap()).get(irNodeId);
    }

    @Override public String toString() {
        return "IdMappings{folders=" + folders.size() + " elements=" + elements.size()
                + " relationships=" + relationships.size() + " views=" + views.size() + "}";
    }
}
