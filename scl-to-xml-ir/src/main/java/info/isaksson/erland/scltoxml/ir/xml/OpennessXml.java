package info.isaksson.erland.scltoxml.ir.xml;

import info.isaksson.erland.scltoxml.ir.ConversionException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM plumbing for the interchange XML: hardened parsing, indented serialization and
 * namespace-agnostic child lookup.
 *
 * <p>Documents are built without namespace awareness; the two default namespaces the dialect uses
 * are written as plain {@code xmlns} attributes. Parsing is namespace aware and every lookup
 * compares local names, so inputs with or without namespaces read the same.</p>
 */
public final class OpennessXml {

    public static final String INTERFACE_NS = "http://www.siemens.com/automation/Openness/SW/Interface/v5";
    public static final String STRUCTURED_TEXT_NS =
            "http://www.siemens.com/automation/Openness/SW/NetworkSource/StructuredText/v3";
    public static final String CULTURE = "en-US";

    private OpennessXml() {}

    public static Document newDocument() {
        try {
            Document doc = secureFactory().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            return doc;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    /** Parses {@code xml}; any parse failure is malformed input. */
    public static Document parse(String xml) throws ConversionException {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        try {
            DocumentBuilder builder = secureFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw ConversionException.malformed("Input is not well-formed XML: " + e.getMessage());
        } catch (IOException e) {
            throw ConversionException.io("Failed to read XML input", e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    /** Serializes with two-space indentation and a trailing newline. */
    public static String serialize(Document doc) {
        try {
            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.setOutputProperty(OutputKeys.METHOD, "xml");
            t.setOutputProperty(OutputKeys.INDENT, "yes");
            t.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter out = new StringWriter();
            t.transform(new DOMSource(doc), new StreamResult(out));
            String s = out.toString();
            return s.endsWith("\n") ? s : s + "\n";
        } catch (TransformerException e) {
            throw new IllegalStateException("XML serialization failed", e);
        }
    }

    private static DocumentBuilderFactory secureFactory() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setExpandEntityReferences(false);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return dbf;
    }

    // -------------------- building --------------------

    public static Element append(Element parent, String name) {
        Element e = parent.getOwnerDocument().createElement(name);
        parent.appendChild(e);
        return e;
    }

    public static Element appendText(Element parent, String name, String text) {
        Element e = append(parent, name);
        e.setTextContent(text == null ? "" : text);
        return e;
    }

    // -------------------- reading --------------------

    public static String localName(Node n) {
        String local = n.getLocalName();
        if (local != null) return local;
        String name = n.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** Element children in document order. */
    public static List<Element> children(Element parent) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
        }
        return out;
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        for (Element e : children(parent)) {
            if (localName.equals(localName(e))) out.add(e);
        }
        return out;
    }

    public static Element child(Element parent, String localName) {
        for (Element e : children(parent)) {
            if (localName.equals(localName(e))) return e;
        }
        return null;
    }

    /** First descendant (depth first, document order) with the local name, or {@code null}. */
    public static Element descendant(Element root, String localName) {
        if (root == null) return null;
        for (Element e : children(root)) {
            if (localName.equals(localName(e))) return e;
            Element found = descendant(e, localName);
            if (found != null) return found;
        }
        return null;
    }

    /** Trimmed text of the named child, or {@code null} when absent or blank. */
    public static String childText(Element parent, String localName) {
        Element e = child(parent, localName);
        if (e == null) return null;
        String text = e.getTextContent();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /** Attribute value, or {@code null} when absent (DOM returns an empty string). */
    public static String attribute(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }
}
