package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObjectType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Assigns z-indexes to the nodes of an imported view so that large containers (groups, packages, pools)
 * do not cover the nodes drawn inside them.
 *
 * <p>Nodes fall into three bands: background (group boxes, packages, groupings, locations, pools, lanes),
 * normal, and overlay (labels, notes). Within a band a container is ordered before every node it
 * (mostly) contains; otherwise the import order is kept. Nodes without bounds keep their z-index.</p>
 */
final class ViewZOrder {

    static final int BACKGROUND_BASE = 0;
    static final int NORMAL_BASE = 10000;
    static final int OVERLAY_BASE = 20000;

    private static final double CONTAINER_AREA_FACTOR = 1.2;
    private static final double CONTAINMENT_MARGIN = 2;
    private static final double MOSTLY_INSIDE = 0.92;

    private ViewZOrder() {}

    /**
     * @param elementTypes internal element id to type
     * @param objectTypes view object id to type
     */
    static List<ViewNodeLayout> normalize(List<ViewNodeLayout> nodes,
                                          Map<String, String> elementTypes,
                                          Map<String, ViewObjectType> objectTypes) {
        List<List<Item>> bands = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        for (int i = 0; i < nodes.size(); i++) {
            ViewNodeLayout n = nodes.get(i);
            if (!n.hasBounds()) continue;
            bands.get(band(n, elementTypes, objectTypes)).add(new Item(i, n));
        }

        Map<Integer, Integer> zByIndex = new HashMap<>();
        int[] bases = {BACKGROUND_BASE, NORMAL_BASE, OVERLAY_BASE};
        for (int b = 0; b < 3; b++) {
            List<Item> order = sortByContainment(bands.get(b));
            for (int j = 0; j < order.size(); j++) {
                zByIndex.put(order.get(j).idx, bases[b] + j);
            }
        }

        List<ViewNodeLayout> out = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            Integer z = zByIndex.get(i);
            out.add(z == null ? nodes.get(i) : nodes.get(i).withZIndex(z));
        }
        return out;
    }

    static int band(ViewNodeLayout n, Map<String, String> elementTypes, Map<String, ViewObjectType> objectTypes) {
        if (n.objectId != null) {
            ViewObjectType t = objectTypes.get(n.objectId);
            if (t == ViewObjectType.GROUP_BOX) return 0;
            if (t == ViewObjectType.LABEL || t == ViewObjectType.NOTE) return 2;
            return 1;
        }
        String type = elementTypes.getOrDefault(n.elementId, "");
        switch (type) {
            case "uml.package":
            case "uml.subject":
            case "Grouping":
            case "Location":
            case "bpmn.pool":
            case "bpmn.lane":
                return 0;
            case "uml.note":
            case "bpmn.textAnnotation":
                return 2;
            default:
                return 1;
        }
    }

    /** Kahn's algorithm over container-before-contained edges, ties broken by import order. */
    private static List<Item> sortByContainment(List<Item> items) {
        if (items.size() < 2) return items;
        Map<Integer, Set<Item>> edges = new HashMap<>();
        Map<Integer, Integer> indegree = new HashMap<>();
        for (Item a : items) {
            edges.put(a.idx, new LinkedHashSet<>());
            indegree.put(a.idx, 0);
        }
        for (Item a : items) {
            for (Item b : items) {
                if (a == b || a.area <= b.area * CONTAINER_AREA_FACTOR) continue;
                if (containsMostly(a, b) && edges.get(a.idx).add(b)) {
                    indegree.merge(b.idx, 1, Integer::sum);
                }
            }
        }

        PriorityQueue<Item> available = new PriorityQueue<>(Comparator.comparingInt(i -> i.idx));
        for (Item a : items) {
            if (indegree.get(a.idx) == 0) available.add(a);
        }
        List<Item> result = new ArrayList<>(items.size());
        while (!available.isEmpty()) {
            Item cur = available.poll();
            result.add(cur);
            for (Item to : edges.get(cur.idx)) {
                if (indegree.merge(to.idx, -1, Integer::sum) == 0) available.add(to);
            }
        }
        // Cycles only arise from degenerate geometry; keep import order then.
        return result.size() == items.size() ? result : new ArrayList<>(items);
    }

    private static boolean containsMostly(Item a, Item b) {
        double ax1 = a.x - CONTAINMENT_MARGIN;
        double ay1 = a.y - CONTAINMENT_MARGIN;
        double ax2 = a.x + a.w + CONTAINMENT_MARGIN;
        double ay2 = a.y + a.h + CONTAINMENT_MARGIN;
        double bx2 = b.x + b.w;
        double by2 = b.y + b.h;
        if (b.x >= ax1 && b.y >= ay1 && bx2 <= ax2 && by2 <= ay2) return true;

        double iw = Math.max(0, Math.min(ax2, bx2) - Math.max(ax1, b.x));
        double ih = Math.max(0, Math.min(ay2, by2) - Math.max(ay1, b.y));
        return b.area > 0 && (iw * ih) / b.area >= MOSTLY_INSIDE;
    }

    private static final class Item {
        final int idx;
        final double x;
        final double y;
        final double w;
        final double h;
        final double area;

        Item(int idx, ViewNodeLayout n) {
            this.idx = idx;
            this.x = n.x;
            this.y = n.y;
            this.w = n.width;
            this.h = n.height;
            this.area = Math.max(0, w) * Math.max(0, h);
        }
    }
}
