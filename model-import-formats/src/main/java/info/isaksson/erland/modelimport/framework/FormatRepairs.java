package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.normalize.ImportText;
import info.isaksson.erland.modelimport.report.ImportReport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Repairs shared by the format-specific normalizers: extension tags, early removal of dangling
 * relationships and of view content that points at missing model entities.
 *
 * <p>Warnings read {@code "<source>: <label> normalize: ..."}, one per dropped item.</p>
 */
public final class FormatRepairs {

    public static final String EXTENSION_TAG_PREFIX = "ext:";

    private FormatRepairs() {}

    /**
     * Tagged values from the {@code meta.extensionTags} summary a parser recorded, prefixed {@code ext:}.
     * Blank, over-long or excess entries are skipped.
     */
    public static List<IrTaggedValue> extensionTags(Map<String, Object> meta, FormatNormalizeOptions options) {
        Map<String, Object> tags = IrMaps.map(meta, IrMeta.EXTENSION_TAGS);
        if (tags.isEmpty()) return List.of();
        List<IrTaggedValue> out = new ArrayList<>();
        for (Map.Entry<String, Object> e : tags.entrySet()) {
            if (out.size() >= options.maxExtensionTags) break;
            String key = ImportText.trimToNull(e.getKey());
            String value = e.getValue() == null ? null : ImportText.trimToNull(e.getValue().toString());
            if (key == null || value == null) continue;
            if (key.length() > options.maxTagKeyLength || value.length() > options.maxTagValueLength) continue;
            out.add(new IrTaggedValue(EXTENSION_TAG_PREFIX + key, value));
        }
        return out;
    }

    /** {@code base} followed by {@code extra}, trimmed, without empty keys or repeated key/value pairs. */
    public static List<IrTaggedValue> mergeTaggedValues(List<IrTaggedValue> base, List<IrTaggedValue> extra) {
        Set<IrTaggedValue> out = new LinkedHashSet<>();
        for (List<IrTaggedValue> list : List.of(base, extra)) {
            for (IrTaggedValue tv : list) {
                String key = ImportText.trimToNull(tv.key);
                if (key == null) continue;
                out.add(new IrTaggedValue(key, ImportText.trimToEmpty(tv.value)));
            }
        }
        return new ArrayList<>(out);
    }

    /** Stable copy ordered by id, null ids first. */
    public static <T> List<T> sortedById(List<T> items, Function<T, String> id) {
        List<T> out = new ArrayList<>(items);
        out.sort(Comparator.comparing(id, Comparator.nullsFirst(Comparator.naturalOrder())));
        return out;
    }

    /** Unchanged copy when {@link FormatNormalizeOptions#dropDanglingRelationships} is off. */
    public static List<IrRelationship> dropDanglingRelationships(List<IrRelationship> relationships, Set<String> elementIds,
                                                               ImportReport report, FormatNormalizeOptions options, String label) {
        if (!options.dropDanglingRelationships) return new ArrayList<>(relationships);
        List<IrRelationship> out = new ArrayList<>(relationships.size());
        for (IrRelationship r : relationships) {
            if (elementIds.contains(r.sourceId) && elementIds.contains(r.targetId)) {
                out.add(r);
                continue;
            }
            warn(report, options, label, "Dropped relationship \"" + r.id + "\" referencing missing element(s) (source: \""
                    + r.sourceId + "\", target: \"" + r.targetId + "\").");
        }
        return out;
    }

    /** Drops nodes bound to missing elements and connections bound to missing relationships or elements. */
    public static IrView dropMissingViewRefs(IrView view, Set<String> elementIds, Set<String> relationshipIds,
                                             ImportReport report, FormatNormalizeOptions options, String label) {
        List<IrViewNode> nodes = new ArrayList<>(view.nodes.size());
        for (IrViewNode n : view.nodes) {
            if (n.elementId != null && !elementIds.contains(n.elementId)) {
                warn(report, options, label, "Dropped view node \"" + n.id + "\" referencing missing elementId \"" + n.elementId + "\".");
                continue;
            }
            nodes.add(n);
        }
        List<IrViewConnection> connections = new ArrayList<>(view.connections.size());
        for (IrViewConnection c : view.connections) {
            String missing = null;
            if (c.relationshipId != null && !relationshipIds.contains(c.relationshipId)) {
                missing = "relationshipId \"" + c.relationshipId + "\"";
            } else if (c.sourceElementId != null && !elementIds.contains(c.sourceElementId)) {
                missing = "sourceElementId \"" + c.sourceElementId + "\"";
            } else if (c.targetElementId != null && !elementIds.contains(c.targetElementId)) {
                missing = "targetElementId \"" + c.targetElementId + "\"";
            }
            if (missing != null) {
                warn(report, options, label, "Dropped view connection \"" + c.id + "\" referencing missing " + missing + ".");
                continue;
            }
            connections.add(c);
        }
        return view.withContent(nodes, connections);
    }

    public static void warn(ImportReport report, FormatNormalizeOptions options, String label, String message) {
        if (report != null) report.warn(options.prefix() + label + " normalize: " + message);
    }
}
