package info.isaksson.erland.modelimport.meff;

import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code <organizations>} tree: labelled items become folders, reference items file the referenced
 * element, relationship or view into the enclosing folder. A reference item nested under another
 * reference item records the outer reference as the inner one's owner.
 */
final class MeffOrganizations {

    private static final String[] REF_ATTRS = {"identifierRef", "ref", "idref", "elementRef"};

    final List<IrFolder> folders = new ArrayList<>();
    /** Referenced id to folder id; first filing wins. */
    final Map<String, String> refToFolder = new LinkedHashMap<>();
    /** Referenced id to the id of the reference it is nested under. */
    final Map<String, String> refToParentRef = new LinkedHashMap<>();

    private final MeffProperties properties;
    private int autoId;

    private MeffOrganizations(MeffProperties properties) {
        this.properties = properties;
    }

    static MeffOrganizations parse(Element root, MeffProperties properties) {
        MeffOrganizations orgs = new MeffOrganizations(properties);
        Element orgRoot = Xml.child(root, "organizations");
        if (orgRoot == null) orgRoot = Xml.q(root, "organizations");
        if (orgRoot == null) orgRoot = Xml.q(root, "organization");
        if (orgRoot == null) return orgs;

        List<Element> items = groupChildren(orgRoot);
        if (!items.isEmpty()) {
            for (Element item : items) orgs.walk(item, null);
        } else if (!Xml.children(orgRoot).isEmpty()) {
            // Flat list of references directly under the root.
            String id = orgs.folderId(Xml.attrTrim(orgRoot, "identifier", "id"));
            String name = label(orgRoot);
            orgs.folders.add(new IrFolder(id, name != null ? name : "Organization", null, null, null, null, null));
            for (Element child : Xml.children(orgRoot)) orgs.fileRef(child, id);
        }
        return orgs;
    }

    private void walk(Element item, String parentId) {
        String id = folderId(Xml.attrTrim(item, "identifier", "id"));
        String name = label(item);
        List<IrTaggedValue> tags = properties.taggedValues(item);
        folders.add(new IrFolder(id, name != null ? name : "Group", parentId,
                Xml.childText(item, "documentation"), tags, null, null));

        for (Element child : Xml.children(item)) {
            if (!isGroupTag(child)) {
                fileRef(child, id);
                continue;
            }
            boolean hasRef = ref(child) != null;
            boolean hasLabel = label(child) != null;
            if (hasRef && !hasLabel) {
                fileRefTree(child, id, null);
            } else {
                walk(child, id);
            }
        }
    }

    /** A reference item and any reference items nested under it, all filed into {@code folderId}. */
    private void fileRefTree(Element refItem, String folderId, String parentRef) {
        String ref = fileRef(refItem, folderId);
        if (ref != null && parentRef != null) refToParentRef.putIfAbsent(ref, parentRef);
        for (Element nested : groupChildren(refItem)) {
            if (ref(nested) != null && label(nested) == null) {
                fileRefTree(nested, folderId, ref != null ? ref : parentRef);
            } else {
                walk(nested, folderId);
            }
        }
    }

    private String fileRef(Element el, String folderId) {
        String ref = ref(el);
        if (ref != null) refToFolder.putIfAbsent(ref, folderId);
        return ref;
    }

    private String folderId(String raw) {
        if (raw != null) return raw;
        autoId++;
        return "org-auto-" + autoId;
    }

    private static String ref(Element el) {
        String ref = Xml.attrTrim(el, REF_ATTRS);
        if (ref == null) ref = Xml.childText(el, "identifierRef");
        if (ref == null) ref = Xml.childText(el, "ref");
        return ref;
    }

    private static String label(Element el) {
        String label = Xml.childText(el, "label");
        if (label == null) label = Xml.childText(el, "name");
        if (label == null) label = Xml.attrTrim(el, "label", "name");
        return label;
    }

    private static boolean isGroupTag(Element el) {
        return Xml.is(el, "item") || Xml.is(el, "organization") || Xml.is(el, "folder");
    }

    private static List<Element> groupChildren(Element el) {
        List<Element> out = new ArrayList<>();
        for (Element c : Xml.children(el)) {
            if (isGroupTag(c)) out.add(c);
        }
        return out;
    }
}
