package info.isaksson.erland.modelimport.meff;

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

/** MEFF repair pass, run before the generic normalizer. */
public final class MeffNormalizer implements FormatNormalizer {

    static final String LABEL = "MEFF";

    @Override
    public String format() {
        return IrMeta.Formats.MEFF;
    }

    @Override
    public IrModel normalize(IrModel model, ImportReport report, FormatNormalizeOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        FormatNormalizeOptions opts = options != null ? options : FormatNormalizeOptions.forSource(null);

        List<IrFolder> folders = new ArrayList<>();
        for (IrFolder f : FormatRepairs.sortedById(model.folders, f -> f.id)) {
            String name = ImportText.trimToNull(f.name);
            folders.add(new IrFolder(f.id, name != null ? name : "Group", ImportText.trimToNull(f.parentId),
                    ImportText.cleanDocumentation(f.documentation), f.taggedValues, f.externalIds, f.meta));
        }

        List<IrElement> elements = new ArrayList<>();
        Set<String> elementIds = new HashSet<>();
        for (IrElement e : FormatRepairs.sortedById(model.elements, e -> e.id)) {
            String name = ImportText.trimToNull(e.name);
            elements.add(new IrElement(e.id, e.type, name != null ? name : "Unnamed (" + e.type + ")",
                    ImportText.cleanDocumentation(e.documentation), ImportText.trimToNull(e.folderId),
                    ImportText.trimToNull(e.parentElementId), e.taggedValues, e.externalIds, e.attrs, e.meta));
            elementIds.add(e.id);
        }

        List<IrRelationship> relationships = new ArrayList<>();
        for (IrRelationship r : FormatRepairs.sortedById(model.relationships, r -> r.id)) {
            relationships.add(new IrRelationship(r.id, r.type,
                    ImportText.trimToEmpty(r.sourceId), ImportText.trimToEmpty(r.targetId),
                    ImportText.trimToNull(r.name), ImportText.cleanDocumentation(r.documentation),
                    r.taggedValues, r.externalIds, r.attrs, r.meta));
        }
        relationships = FormatRepairs.dropDanglingRelationships(relationships, elementIds, report, opts, LABEL);

        Set<String> relationshipIds = new HashSet<>();
        for (IrRelationship r : relationships) relationshipIds.add(r.id);

        List<IrView> views = new ArrayList<>();
        for (IrView v : FormatRepairs.sortedById(model.views, v -> v.id)) {
            IrView cleaned = FormatRepairs.dropMissingViewRefs(v, elementIds, relationshipIds, report, opts, LABEL);
            List<IrViewNode> nodes = new ArrayList<>();
            for (IrViewNode n : cleaned.nodes) {
                nodes.add(new IrViewNode(n.id, n.kind, n.elementId, n.parentNodeId, ImportText.trimToNull(n.label),
                        n.bounds, n.taggedValues, n.externalIds, n.meta));
            }
            List<IrViewConnection> connections = new ArrayList<>();
            for (IrViewConnection c : FormatRepairs.sortedById(cleaned.connections, c -> c.id)) {
                connections.add(new IrViewConnection(c.id, c.relationshipId, c.sourceNodeId, c.targetNodeId,
                        c.sourceElementId, c.targetElementId, ImportText.trimToNull(c.label), c.points,
                        c.taggedValues, c.externalIds, c.meta));
            }
            String name = ImportText.trimToNull(cleaned.name);
            views.add(new IrView(cleaned.id, name != null ? name : "View",
                    ImportText.cleanDocumentation(cleaned.documentation), cleaned.folderId, cleaned.viewpoint,
                    FormatRepairs.sortedById(nodes, n -> n.id), connections,
                    cleaned.taggedValues, cleaned.externalIds, cleaned.meta));
        }

        IrModel out = new IrModel(folders, elements, relationships, views, model.meta);
        return ViewConnectionRelationshipResolver.resolve(out, report, LABEL);
    }
}
