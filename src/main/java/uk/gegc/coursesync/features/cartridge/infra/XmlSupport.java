package uk.gegc.coursesync.features.cartridge.infra;

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.dom4j.io.XMLWriter;
import org.xml.sax.SAXException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Namespace-tolerant dom4j helpers. Every lookup first tries the expected namespaces, then retries
 * with unqualified names, since producers differ in whether and which namespace they declare.
 */
public final class XmlSupport {

    private XmlSupport() {
    }

    /**
     * Parses with DOCTYPE declarations refused, so no external entity is ever resolved.
     */
    public static Document read(Path file) throws DocumentException, IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return reader().read(in);
        }
    }

    public static Document read(InputStream in) throws DocumentException {
        return reader().read(in);
    }

    private static SAXReader reader() throws DocumentException {
        SAXReader reader = new SAXReader();
        try {
            reader.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            reader.setFeature("http://xml.org/sax/features/external-general-entities", false);
            reader.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (SAXException ex) {
            throw new DocumentException("XML parser does not support secure processing", ex);
        }
        return reader;
    }

    public static Optional<Element> child(Element parent, String name, String... namespaces) {
        if (parent == null) {
            return Optional.empty();
        }
        List<Element> found = children(parent, name, namespaces);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public static List<Element> children(Element parent, String name, String... namespaces) {
        if (parent == null) {
            return List.of();
        }
        List<Element> qualified = new ArrayList<>();
        List<Element> unqualified = new ArrayList<>();
        for (Element element : parent.elements()) {
            collect(element, name, namespaces, qualified, unqualified);
        }
        return qualified.isEmpty() ? unqualified : qualified;
    }

    public static Optional<Element> descendant(Element root, String name, String... namespaces) {
        List<Element> found = descendants(root, name, namespaces);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Matching elements below {@code root} in document order, {@code root} excluded.
     */
    public static List<Element> descendants(Element root, String name, String... namespaces) {
        if (root == null) {
            return List.of();
        }
        List<Element> qualified = new ArrayList<>();
        List<Element> unqualified = new ArrayList<>();
        walk(root, name, namespaces, qualified, unqualified);
        return qualified.isEmpty() ? unqualified : qualified;
    }

    private static void walk(Element element, String name, String[] namespaces,
                             List<Element> qualified, List<Element> unqualified) {
        for (Element child : element.elements()) {
            collect(child, name, namespaces, qualified, unqualified);
            walk(child, name, namespaces, qualified, unqualified);
        }
    }

    private static void collect(Element element, String name, String[] namespaces,
                                List<Element> qualified, List<Element> unqualified) {
        if (!name.equals(element.getName())) {
            return;
        }
        String uri = element.getNamespaceURI();
        if (Arrays.asList(namespaces).contains(uri)) {
            qualified.add(element);
        } else if (uri == null || uri.isEmpty()) {
            unqualified.add(element);
        }
    }

    /**
     * Trimmed text of the first matching child, empty when missing or blank.
     */
    public static Optional<String> childText(Element parent, String name, String... namespaces) {
        return child(parent, name, namespaces)
                .map(Element::getText)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    public static Optional<String> descendantText(Element root, String name, String... namespaces) {
        return descendant(root, name, namespaces)
                .map(Element::getText)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    /**
     * Adds {@code <name>text</name>} in the parent's namespace; nothing when {@code text} is null.
     */
    public static Element addText(Element parent, String name, Object text) {
        if (text == null) {
            return null;
        }
        Element element = parent.addElement(name, parent.getNamespaceURI());
        element.setText(text.toString());
        return element;
    }

    /**
     * Indented output that keeps text nodes verbatim, so embedded HTML keeps its line breaks.
     */
    public static byte[] toBytes(Document document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OutputFormat format = new OutputFormat("  ", true, "UTF-8");
        format.setTrimText(false);
        try {
            XMLWriter writer = new XMLWriter(out, format);
            writer.write(document);
            writer.flush();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to serialize XML document", ex);
        }
        return out.toByteArray();
    }
}
