package info.isaksson.erland.modelimport.xml;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class XmlTest {

    private static Element parse(String xml) throws Exception {
        Document doc = XmlDocuments.parse(xml.getBytes(StandardCharsets.UTF_8));
        return doc.getDocumentElement();
    }

    @Test
    void elementsMatchByLocalNameWhateverThePrefix() throws Exception {
        Element root = parse("<ns0:Model xmlns:ns0=\"urn:a\"><ns0:Elements><ns0:Element id=\"e1\"/></ns0:Elements>"
                + "<Element id=\"e2\" xmlns=\"urn:b\"/></ns0:Model>");

        assertEquals("model", Xml.localName(root));
        assertTrue(Xml.is(root, "MODEL"));
        assertEquals(1, Xml.children(root, "element").size(), "children are direct only");
        assertEquals(2, Xml.qa(root, "element").size());
        assertEquals("e1", Xml.attr(Xml.q(root, "element"), "id"));
        assertNull(Xml.child(root, "relationships"));
    }

    @Test
    void attributesMatchExactlyThenBySuffix() throws Exception {
        Element el = parse("<e xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\" xsi:type=\"BusinessActor\" "
                + "Name=\" padded \" blank=\"  \" x=\"12.5\" y=\"NaN\" w=\"abc\"/>");

        assertEquals("BusinessActor", Xml.type(el));
        assertEquals("BusinessActor", Xml.attr(el, "type"), "suffix match on the prefixed name");
        assertEquals(" padded ", Xml.attr(el, "name"));
        assertEquals("padded", Xml.attrTrim(el, "missing", "name"));
        assertNull(Xml.attrTrim(el, "blank"));
        assertEquals(12.5, Xml.number(el, "x"));
        assertNull(Xml.number(el, "y"), "non-finite numbers are rejected");
        assertNull(Xml.number(el, "w"));
    }

    @Test
    void childTextPrefersEnglish() throws Exception {
        Element el = parse("<e><name xml:lang=\"sv\">Kund</name><name xml:lang=\"en-GB\">Customer</name>"
                + "<documentation>  </documentation></e>");

        assertEquals("Customer", Xml.childText(el, "name"));
        assertNull(Xml.childText(el, "documentation"));
        assertNull(Xml.childText(el, "label"));
    }

    @Test
    void parentStopsAtTheDocumentElement() throws Exception {
        Element root = parse("<a><b/></a>");
        Element b = Xml.child(root, "b");

        assertSame(root, Xml.parent(b));
        assertNull(Xml.parent(root));
    }

    @Test
    void doctypeDeclarationsAreRejected() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";
        assertThrows(SAXException.class, () -> XmlDocuments.parse(xxe.getBytes(StandardCharsets.UTF_8)));
    }
}
