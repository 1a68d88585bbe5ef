package info.isaksson.erland.modelimport.normalize;

import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.report.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills in {@code relationshipId} on view connections that only state their endpoints.
 *
 * <p>A connection is bound when exactly one relationship runs between its endpoint elements in the drawn
 * direction. When nothing runs in the drawn direction, exactly one relationship in the opposite direction binds it, and the
 * connection endpoints are swapped so the arrow follows the relationship ({@code meta.reversed = true}).
 * Any other multiple match is left unresolved and reported as {@value #AMBIGUOUS}.</p>
 */
public final class ViewConnectionRelationshipResolver {

    public static final String AMBIGUOUS = "view-connection-ambiguous";

    private static final Logger log = LoggerFactory.getLogger(ViewConnectionRelationshipResolver.class);

    private ViewConnectionRelationshipResolver() {}

    public static IrModel resolve(IrModel model, ImportReport report, String label) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (model.views.isEmpty()) return model;

        Map<String, List<String>> index = index(model.relationships);
        int resolved = 0;

        List<IrView> views = new ArrayList<>(model.views.size());
        for (IrView v : model.views) {
            Map<String, IrViewNode> nodes = new HashMap<>();
            for (IrViewNode n : v.nodes) {
                if (n.id != null) nodes.put(n.id, n);
            }

            boolean changed = false;
            List<IrViewConnection> connections = new ArrayList<>(v.connections.size());
            for (IrViewConnection c : v.connections) {
                IrViewConnection next = resolveOne(c, nodes, index, report, label);
                if (next != c) {
                    changed = true;
                    resolved++;
                }
                connections.add(next);
            }
            views.add(changed ? v.withContent(v.nodes, connections) : v);
        }

        log.debug("{}: resolved {} view connection(s) to relationships", label, resolved);
        return new IrModel(model.folders, model.elements, model.relationships, views, model.meta);
    }

    private static IrViewConnection resolveOne(IrViewConnection c, Map<String, IrViewNode> nodes,
                                               Map<String, List<String>> index, ImportReport report, String label) {
        if (c.id == null || c.relationshipId != null) return c;

        String src = endpoint(c.sourceElementId, c.sourceNodeId, nodes);
        String tgt = endpoint(c.targetElementId, c.targetNodeId, nodes);
        if (src == null || tgt == null) return c;

        List<String> forward = index.getOrDefault(key(src, tgt), List.of());
        List<String> reverse = index.getOrDefault(key(tgt, src), List.of());

        if (forward.size() == 1) {
            return c.withRelationshipId(forward.get(0));
        }
        if (forward.isEmpty() && reverse.size() == 1) {
            return new IrViewConnection(c.id, reverse.get(0),
                    c.targetNodeId, c.sourceNodeId, tgt, src,
                    c.label, c.points, c.taggedValues, c.externalIds,
                    IrMaps.with(c.meta, IrMeta.REVERSED, Boolean.TRUE));
        }

        int matches = forward.size() + reverse.size();
        if (matches > 1 && report != null) {
            report.warn(AMBIGUOUS,
                    label + ": Diagram connection \"" + c.id + "\" could not be mapped to a single relationship between \""
                            + src + "\" and \"" + tgt + "\" (matches: " + matches + ").",
                    "connectionId", c.id);
        }
        return c;
    }

    private static String endpoint(String elementId, String nodeId, Map<String, IrViewNode> nodes) {
        if (elementId != null) return elementId;
        if (nodeId == null) return null;
        IrViewNode n = nodes.get(nodeId);
        return n == null ? null : n.elementId;
    }

    private static Map<String, List<String>> index(List<IrRelationship> relationships) {
        Map<String, List<String>> out = new HashMap<>();
        for (IrRelationship r : relationships) {
            if (r.id == null || r.sourceId == null || r.targetId == null) continue;
            out.computeIfAbsent(key(r.sourceId, r.targetId), k -> new ArrayList<>()).add(r.id);
        }
        return out;
    }

    private static String key(String source, String target) {
        return source + "→" + target;
    }
}
