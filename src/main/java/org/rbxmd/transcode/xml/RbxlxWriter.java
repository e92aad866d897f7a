package org.rbxmd.transcode.xml;

import org.rbxmd.transcode.model.PropertyValue;
import org.rbxmd.transcode.model.SceneNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 场景树 -> rbxlx（XML）文档。
 * <p>
 * 每个 Item 先写 {@code Name} 与 {@code UniqueId} 两个属性，再写其余属性；输出缩进两格。
 */
public final class RbxlxWriter {

    private RbxlxWriter() {
    }

    /**
     * @param roots    顶层节点
     * @param warnings 非致命告警输出（无法写出的属性会被跳过并记录）
     */
    public static String write(List<SceneNode> roots, List<String> warnings) {
        Document doc = newDocument();
        Element root = doc.createElement("roblox");
        root.setAttribute("xmlns:xmime", "http://www.w3.org/2005/05/xmlmime");
        root.setAttribute("xmlns:xsi", "http://www.w3.org/2001/XMLSchema-instance");
        root.setAttribute("xsi:noNamespaceSchemaLocation", "http://www.roblox.com/roblox.xsd");
        root.setAttribute("version", "4");
        doc.appendChild(root);

        if (roots != null) {
            for (SceneNode node : roots) {
                root.appendChild(writeItem(doc, node, warnings));
            }
        }
        return serialize(doc);
    }

    private static Element writeItem(Document doc, SceneNode node, List<String> warnings) {
        Element item = doc.createElement(RbxlxReader.ITEM_TAG);
        item.setAttribute(RbxlxReader.CLASS_ATTRIBUTE, node.className() == null ? RbxlxReader.UNKNOWN_CLASS : node.className());
        if (node.id() != null) {
            item.setAttribute("referent", node.id());
        }

        Element props = doc.createElement(RbxlxReader.PROPERTIES_TAG);
        item.appendChild(props);

        Element name = doc.createElement("string");
        name.setAttribute(XmlPropertyMapper.NAME_ATTRIBUTE, SceneNode.NAME_PROPERTY);
        name.setTextContent(node.name() == null ? "" : node.name());
        props.appendChild(name);

        if (node.id() != null) {
            Element id = doc.createElement(SceneNode.UNIQUE_ID_PROPERTY);
            id.setAttribute(XmlPropertyMapper.NAME_ATTRIBUTE, SceneNode.UNIQUE_ID_PROPERTY);
            id.setTextContent(node.id());
            props.appendChild(id);
        }

        for (Map.Entry<String, PropertyValue> e : node.properties().entrySet()) {
            if (SceneNode.isReservedProperty(e.getKey())) {
                continue;
            }
            try {
                props.appendChild(XmlPropertyMapper.write(doc, e.getKey(), e.getValue()));
            } catch (IllegalArgumentException ex) {
                if (warnings != null) {
                    warnings.add("属性 '" + e.getKey() + "' 无法写出，已跳过：" + ex.getMessage());
                }
            }
        }

        for (SceneNode child : node.children()) {
            item.appendChild(writeItem(doc, child, warnings));
        }
        return item;
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML 文档创建失败：" + e.getMessage(), e);
        }
    }

    private static String serialize(Document doc) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("XML 序列化失败：" + e.getMessage(), e);
        }
    }
}
