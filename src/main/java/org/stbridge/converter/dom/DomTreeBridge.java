package org.stbridge.converter.dom;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.File;
import java.io.InputStream;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * Moves documents between JAXP DOM and {@link StbDocument}. Element tags are read by local name, attributes
 * (namespace declarations included) by qualified name, so a document written back keeps its namespace.
 */
public class DomTreeBridge {

    private DomTreeBridge() {
    }

    public static StbDocument read(File file) {
        try {
            return fromDom(newBuilder().parse(file));
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse ST-Bridge document: " + file, e);
        }
    }

    public static StbDocument read(InputStream in) {
        try {
            return fromDom(newBuilder().parse(in));
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse ST-Bridge document from stream", e);
        }
    }

    private static DocumentBuilder newBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder();
    }

    public static StbDocument fromDom(Document dom) {
        Element root = dom.getDocumentElement();
        return new StbDocument(tagOf(root), toNode(root));
    }

    private static StbNode toNode(Element element) {
        StbNode node = new StbNode();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            node.setAttr(attr.getName(), attr.getValue());
        }
        NodeList children = element.getChildNodes();
        StringBuilder text = new StringBuilder();
        boolean hasElements = false;
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                Element childElement = (Element) child;
                node.addChild(tagOf(childElement), toNode(childElement));
                hasElements = true;
            } else if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        if (!hasElements && !text.toString().isBlank()) {
            node.setText(text.toString().trim());
        }
        return node;
    }

    private static String tagOf(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    /**
     * Builds a DOM document. The root is always written under the canonical {@code ST-Bridge} tag.
     */
    public static Document toDom(StbDocument document) {
        try {
            Document dom = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element root = dom.createElement(StbDocument.CANONICAL_ROOT_TAG);
            fill(dom, root, document.getRootNode());
            dom.appendChild(root);
            return dom;
        } catch (Exception e) {
            throw new RuntimeException("Failed to build DOM for ST-Bridge document", e);
        }
    }

    private static void fill(Document dom, Element element, StbNode node) {
        if (node == null) {
            return;
        }
        node.attributes().forEach(element::setAttribute);
        if (node.text() != null) {
            element.setTextContent(node.text());
        }
        for (Map.Entry<String, List<StbNode>> entry : node.childMap().entrySet()) {
            for (StbNode child : entry.getValue()) {
                Element childElement = dom.createElement(entry.getKey());
                fill(dom, childElement, child);
                element.appendChild(childElement);
            }
        }
    }

    public static String toXml(StbDocument document) {
        try {
            Transformer transformer = newTransformer();
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(toDom(document)), new StreamResult(writer));
            return writer.toString();
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize ST-Bridge document", e);
        }
    }

    private static Transformer newTransformer() throws Exception {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        return transformer;
    }

    public static void write(StbDocument document, File file) {
        try {
            Transformer transformer = newTransformer();
            transformer.transform(new DOMSource(toDom(document)), new StreamResult(file));
        } catch (Exception e) {
            throw new RuntimeException("Failed to write ST-Bridge document: " + file, e);
        }
    }
}
