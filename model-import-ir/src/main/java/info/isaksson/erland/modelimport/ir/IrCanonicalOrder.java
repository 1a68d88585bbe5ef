package info.isaksson.erland.modelimport.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Produces a stable, deterministic ordering of all IR lists so JSON output and test fixtures are reproducible.
 *
 * <p>Folders, elements, relationships, views and connections are sorted by id. Tagged values are sorted
 * by (key, value), external ids by (system, id, kind).</p>
 *
 * <p>IMPORTANT: view node order is the drawing (z) order and connection points are a polyline;
 * both are preserved as provided (do not sort).</p>
 */
public final class IrCanonicalOrder {

    private IrCanonicalOrder() {}

    public static IrModel apply(IrModel in) {
        if (in == null) return null;

        List<IrFolder> folders = new ArrayList<>(in.folders.size());
        for (IrFolder f : in.folders) {
            if (f == null) continue;
            folders.add(new IrFolder(f.id, f.name, f.parentId, f.documentation,
                    taggedValues(f.taggedValues), externalIds(f.externalIds), f.meta));
        }

        List<IrElement> elements = new ArrayList<>(in.elements.size());
        for (IrElement e : in.elements) {
            if (e == null) continue;
            elements.add(new IrElement(e.id, e.type, e.name, e.documentation, e.folderId, e.parentElementId,
                    taggedValues(e.taggedValues), externalIds(e.externalIds), e.attrs, e.meta));
        }

        List<IrRelationship> relationships = new ArrayList<>(in.relationships.size());
        for (IrRelationship r : in.relationships) {
            if (r == null) continue;
            relationships.add(new IrRelationship(r.id, r.type, r.sourceId, r.targetId, r.name, r.documentation,
                    taggedValues(r.taggedValues), externalIds(r.externalIds), r.attrs, r.meta));
        }

        List<IrView> views = new ArrayList<>(in.views.size());
        for (IrView v : in.views) {
            if (v == null) continue;
            views.add(view(v));
        }

        return new IrModel(
                sortedById(folders, f -> f.id),
                sortedById(elements, e -> e.id),
                sortedById(relationships, r -> r.id),
                sortedById(views, v -> v.id),
                in.meta
        );
    }

    private static IrView view(IrView v) {
        List<IrViewNode> nodes = new ArrayList<>(v.nodes.size());
        for (IrViewNode n : v.nodes) {
            if (n == null) continue;
            nodes.add(new IrViewNode(n.id, n.kind, n.elementId, n.parentNodeId, n.label, n.bounds,
                    taggedValues(n.taggedValues), externalIds(n.externalIds), n.meta));
        }
        List<IrViewConnection> connections = new ArrayList<>(v.connections.size());
        for (IrViewConnection c : v.connections) {
            if (c == null) continue;
            connections.add(new IrViewConnection(c.id, c.relationshipId, c.sourceNodeId, c.targetNodeId,
                    c.sourceElementId, c.targetElementId, c.label, c.points,
                    taggedValues(c.taggedValues), externalIds(c.externalIds), c.meta));
        }
        return new IrView(v.id, v.name, v.documentation, v.folderId, v.viewpoint,
                nodes, sortedById(connections, c -> c.id),
                taggedValues(v.taggedValues), externalIds(v.externalIds), v.meta);
    }

    /** Stable sort by id; entries with equal ids keep their relative order. */
    public static <T> List<T> sortedById(List<T> in, Function<T, String> id) {
        if (in == null) return List.of();
        List<T> out = new ArrayList<>(in);
        out.sort(Comparator.comparing((T t) -> safe(id.apply(t))));
        return List.copyOf(out);
    }

    public static List<IrTaggedValue> taggedValues(List<IrTaggedValue> in) {
        if (in == null) return List.of();
        List<IrTaggedValue> out = new ArrayList<>();
        for (IrTaggedValue tv : in) {
            if (tv != null) out.add(tv);
        }
        out.sort(Comparator
                .comparing((IrTaggedValue tv) -> safe(tv.key))
                .thenComparing(tv -> safe(tv.value)));
        return List.copyOf(out);
    }

    public static List<IrExternalId> externalIds(List<IrExternalId> in) {
        if (in == null) return List.of();
        List<IrExternalId> out = new ArrayList<>();
        for (IrExternalId x : in) {
            if (x != null) out.add(x);
        }
        out.sort(Comparator
                .comparing((IrExternalId x) -> safe(x.system))
                .thenComparing(x -> safe(x.id))
                .thenComparing(x -> safe(x.kind)));
        return List.copyOf(out);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
