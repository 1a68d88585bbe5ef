package info.isaksson.erland.modelimport.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Namespace-aware DOM parsing with DOCTYPEs and external entities disabled.
 */
public final class XmlDocuments {

    private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

    private XmlDocuments() {}

    public static Document parse(byte[] content) throws IOException, SAXException {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        DocumentBuilder builder = newBuilder();
        // Silence the default stderr error handler; errors still surface as SAXParseException.
        builder.setErrorHandler(new DefaultHandler());
        return builder.parse(new InputSource(new ByteArrayInputStream(content)));
    }

    private static DocumentBuilder newBuilder() throws IOException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);
        feature(dbf, XMLConstants.FEATURE_SECURE_PROCESSING, true);
        feature(dbf, "http://apache.org/xml/features/disallow-doctype-decl", true);
        feature(dbf, "http://xml.org/sax/features/external-general-entities", false);
        feature(dbf, "http://xml.org/sax/features/external-parameter-entities", false);
        feature(dbf, "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        try {
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("Cannot create XML parser: " + e.getMessage(), e);
        }
    }

    private static void feature(DocumentBuilderFactory dbf, String name, boolean value) {
        try {
            dbf.setFeature(name, value);
        } catch (ParserConfigurationException e) {
            log.debug("XML parser does not support feature {}", name, e);
        }
    }
}
