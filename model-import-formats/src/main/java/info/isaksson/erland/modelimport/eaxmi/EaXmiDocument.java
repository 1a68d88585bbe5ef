package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A parsed EA XMI document plus the indexes every reader needs: all elements in document order,
 * {@code xmi:id} lookup, documentation kept in the EA extension, and the folder id given to each package.
 */
final class EaXmiDocument {

    final Document doc;
    final Element root;
    final List<Element> all;

    private final Map<String, Element> byId = new HashMap<>();
    private final Map<String, String> extensionDocs = new HashMap<>();
    private final Map<Element, String> packageFolderIds = new IdentityHashMap<>();

    EaXmiDocument(Document doc) {
        this.doc = doc;
        this.root = doc.getDocumentElement();
        List<Element> elements = new ArrayList<>();
        collect(root, elements);
        this.all = Collections.unmodifiableList(elements);
        for (Element el : all) {
            String id = EaXmi.xmiId(el);
            if (id != null) byId.putIfAbsent(id, el);
            if (Xml.is(el, "element") && EaXmi.isInsideExtension(el)) indexExtensionDoc(el);
        }
    }

    private static void collect(Element el, List<Element> out) {
        if (el == null) return;
        out.add(el);
        for (Element ch : Xml.children(el)) collect(ch, out);
    }

    private void indexExtensionDoc(Element el) {
        String idref = EaXmi.xmiIdRef(el);
        if (idref == null) return;
        for (Element props : Xml.children(el, "properties")) {
            String d = Xml.attrTrim(props, "documentation", "doc", "notes", "note");
            if (d != null) {
                extensionDocs.putIfAbsent(idref, EaXmi.decodeNumericEntities(d));
                return;
            }
        }
    }

    Element byId(String id) {
        return id == null ? null : byId.get(id);
    }

    List<Element> eaExtensions() {
        List<Element> out = new ArrayList<>();
        for (Element el : all) {
            if (EaXmi.isEaExtension(el)) out.add(el);
        }
        return out;
    }

    void registerPackage(Element pkg, String folderId) {
        packageFolderIds.put(pkg, folderId);
    }

    String packageFolderId(Element pkg) {
        String id = packageFolderIds.get(pkg);
        return id != null ? id : EaXmi.xmiId(pkg);
    }

    /** Folder id of the nearest enclosing package, or null at model level. */
    String owningFolderId(Element el) {
        for (Element p = Xml.parent(el); p != null; p = Xml.parent(p)) {
            if (EaXmi.isPackage(p)) return packageFolderId(p);
        }
        return null;
    }

    /** Nearest enclosing non-package UML element ({@code xmi:type="uml:..."}) with an {@code xmi:id}. */
    String owningClassifierId(Element el) {
        for (Element p = Xml.parent(el); p != null; p = Xml.parent(p)) {
            String t = EaXmi.xmiType(p);
            if (t == null || !t.toLowerCase(Locale.ROOT).startsWith("uml:")) continue;
            if (EaXmi.isPackage(p) || t.toLowerCase(Locale.ROOT).endsWith(":model")) return null;
            String id = EaXmi.xmiId(p);
            if (id != null) return id;
        }
        return null;
    }

    /**
     * Body text, an owned comment, a documentation attribute or properties child, then the documentation
     * EA keeps in its extension for the element's {@code xmi:id}.
     */
    String documentation(Element el) {
        return documentation(el, true);
    }

    /** With {@code deep} false, comments owned by nested elements are not considered. */
    String documentation(Element el, boolean deep) {
        for (Element ch : Xml.children(el)) {
            String ln = Xml.localName(ch);
            if (ln.equals("body")) {
                String t = Xml.text(ch);
                if (!t.isEmpty()) return t;
            }
            if (ln.equals("ownedcomment") || ln.equals("comment")) {
                String body = Xml.childText(ch, "body");
                if (body == null) body = Xml.attrTrim(ch, "body");
                if (body != null) return body;
            }
        }
        String attrDoc = Xml.attrTrim(el, "documentation", "doc", "notes", "note");
        if (attrDoc != null) return attrDoc;

        Element nested = deep ? Xml.q(el, "ownedComment") : null;
        if (nested != null) {
            String body = Xml.childText(nested, "body");
            if (body != null) return body;
        }
        for (Element props : Xml.children(el, "properties")) {
            String d = Xml.attrTrim(props, "documentation", "doc", "notes", "note");
            if (d != null) return d;
        }
        String id = EaXmi.xmiId(el);
        return id == null ? null : extensionDocs.get(id);
    }
}
