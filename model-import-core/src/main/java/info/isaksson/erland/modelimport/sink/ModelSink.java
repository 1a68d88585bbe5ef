package info.isaksson.erland.modelimport.sink;

import info.isaksson.erland.modelimport.domain.Element;
import info.isaksson.erland.modelimport.domain.Folder;
import info.isaksson.erland.modelimport.domain.Model;
import info.isaksson.erland.modelimport.domain.ModelKind;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.domain.Relationship;
import info.isaksson.erland.modelimport.domain.View;
import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObject;
import info.isaksson.erland.modelimport.domain.ViewRelationshipLayout;

import java.util.List;

/**
 * Write side of a model store, as used by the apply stage.
 *
 * <p>Ids are chosen by the caller. Mutating methods throw an unchecked exception (typically
 * {@link IllegalArgumentException} or {@link IllegalStateException}) when an item cannot be added:
 * an unknown model, folder, element or view id, or a duplicate id.</p>
 *
 * <p>An apply run only touches the model it allocated. Implementations backed by shared state must
 * either be thread safe or be driven by callers that serialize apply runs against them.</p>
 */
public interface ModelSink {

    /**
     * Create an empty model with a root folder.
     *
     * @return the new model id
     * @throws ModelAllocationException when no model can be created
     */
    String allocateModel(ModelKind kind, ModelMetadata metadata);

    String rootFolderId(String modelId);

    void addFolder(String modelId, Folder folder);

    void addElement(String modelId, Element element);

    void addRelationship(String modelId, Relationship relationship);

    void addView(String modelId, View view);

    /** Add an element node; the element must exist and may appear at most once per view. */
    void addElementToView(String modelId, String viewId, ViewNodeLayout layout);

    void addViewObject(String modelId, String viewId, ViewObject object, ViewNodeLayout layout);

    /**
     * Replace the relationship routing of a view in one batch. The listed relationships become the
     * explicit set of relationships shown in the view.
     */
    void setViewRelationships(String modelId, String viewId, List<ViewRelationshipLayout> relationships);

    /** Replace node layouts of a view, matched by element or object id. */
    void updateViewNodes(String modelId, String viewId, List<ViewNodeLayout> nodes);

    Model snapshot(String modelId);
}
