package info.isaksson.erland.modelimport.bpmn2;

import info.isaksson.erland.modelimport.framework.FormatNormalizeOptions;
import info.isaksson.erland.modelimport.framework.FormatNormalizer;
import info.isaksson.erland.modelimport.framework.FormatRepairs;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.normalize.ImportText;
import info.isaksson.erland.modelimport.normalize.ViewConnectionRelationshipResolver;
import info.isaksson.erland.modelimport.report.ImportReport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * BPMN2 repair pass: id-sorted collections, name defaults, documentation cleanup, {@code ext:} tags,
 * early removal of dangling references, then connection-to-relationship resolution.
 *
 * <p>View nodes keep their parser order, which carries the pool/lane-first z-order.</p>
 */
public final class Bpmn2Normalizer implements FormatNormalizer {

    static final String LABEL = "BPMN2";

    @Override
    public String format() {
        return IrMeta.Formats.BPMN2;
    }

    @Override
    public IrModel normalize(IrModel model, ImportReport report, FormatNormalizeOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        FormatNormalizeOptions opts = options != null ? options : FormatNormalizeOptions.forSource(null);

        List<IrFolder> folders = new ArrayList<>();
        for (IrFolder f : FormatRepairs.sortedById(model.folders, f -> f.id)) {
            String name = ImportText.trimToNull(f.name);
            folders.add(new IrFolder(f.id, name != null ? name : "Imported folder", f.parentId,
                    ImportText.cleanDocumentation(f.documentation),
                    FormatRepairs.mergeTaggedValues(f.taggedValues, FormatRepairs.extensionTags(f.meta, opts)),
                    f.externalIds, f.meta));
        }

        List<IrElement> elements = new ArrayList<>();
        Set<String> elementIds = new HashSet<>();
        for (IrElement e : FormatRepairs.sortedById(model.elements, e -> e.id)) {
            String name = ImportText.trimToNull(e.name);
            elements.add(new IrElement(e.id, e.type, name != null ? name : "Unnamed (" + e.type + ")",
                    ImportText.cleanDocumentation(e.documentation), e.folderId, e.parentElementId,
                    FormatRepairs.mergeTaggedValues(e.taggedValues, FormatRepairs.extensionTags(e.meta, opts)),
                    e.externalIds, e.attrs, e.meta));
            elementIds.add(e.id);
        }

        List<IrRelationship> relationships = new ArrayList<>();
        for (IrRelationship r : FormatRepairs.sortedById(model.relationships, r -> r.id)) {
            relationships.add(new IrRelationship(r.id, r.type,
                    ImportText.trimToEmpty(r.sourceId), ImportText.trimToEmpty(r.targetId),
                    ImportText.trimToNull(r.name), ImportText.cleanDocumentation(r.documentation),
                    FormatRepairs.mergeTaggedValues(r.taggedValues, FormatRepairs.extensionTags(r.meta, opts)),
                    r.externalIds, r.attrs, r.meta));
        }
        relationships = FormatRepairs.dropDanglingRelationships(relationships, elementIds, report, opts, LABEL);

        Set<String> relationshipIds = new HashSet<>();
        for (IrRelationship r : relationships) relationshipIds.add(r.id);

        List<IrView> views = new ArrayList<>();
        for (IrView v : FormatRepairs.sortedById(model.views, v -> v.id)) {
            IrView cleaned = FormatRepairs.dropMissingViewRefs(v, elementIds, relationshipIds, report, opts, LABEL);
            views.add(normalizeView(cleaned, opts));
        }

        IrModel out = new IrModel(folders, elements, relationships, views, model.meta);
        return ViewConnectionRelationshipResolver.resolve(out, report, LABEL);
    }

    private static IrView normalizeView(IrView v, FormatNormalizeOptions opts) {
        List<IrViewNode> nodes = new ArrayList<>(v.nodes.size());
        for (IrViewNode n : v.nodes) {
            nodes.add(new IrViewNode(n.id, n.kind, n.elementId, n.parentNodeId, ImportText.trimToNull(n.label), n.bounds,
                    FormatRepairs.mergeTaggedValues(n.taggedValues, FormatRepairs.extensionTags(n.meta, opts)),
                    n.externalIds, n.meta));
        }
        List<IrViewConnection> connections = new ArrayList<>(v.connections.size());
        for (IrViewConnection c : FormatRepairs.sortedById(v.connections, c -> c.id)) {
            connections.add(new IrViewConnection(c.id, c.relationshipId, c.sourceNodeId, c.targetNodeId,
                    c.sourceElementId, c.targetElementId, ImportText.trimToNull(c.label), c.points,
                    FormatRepairs.mergeTaggedValues(c.taggedValues, FormatRepairs.extensionTags(c.meta, opts)),
                    c.externalIds, c.meta));
        }
        String name = ImportText.trimToNull(v.name);
        return new IrView(v.id, name != null ? name : "Imported BPMN diagram",
                ImportText.cleanDocumentation(v.documentation), v.folderId, v.viewpoint, nodes, connections,
                FormatRepairs.mergeTaggedValues(v.taggedValues, FormatRepairs.extensionTags(v.meta, opts)),
                v.externalIds, v.meta);
    }
}
