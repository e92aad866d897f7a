package org.rbxmd.transcode.xml;

import org.rbxmd.transcode.model.PropertyValue;
import org.rbxmd.transcode.model.SceneNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * rbxlx（XML）文档 -> 场景树。
 * <p>
 * 结构：{@code <roblox>} 下的 {@code <Item class="...">}，每个 Item 含一个 {@code <Properties>} 与若干子 Item。
 * {@code string[name=Name]} 作为节点名称，{@code UniqueId[name=UniqueId]} 作为节点标识，其余属性交给
 * {@link XmlPropertyMapper}。
 * <p>
 * 文档无法解析时直接抛出 {@link IllegalArgumentException}，不尝试部分恢复。
 */
public final class RbxlxReader {

    public static final String ITEM_TAG = "Item";
    public static final String PROPERTIES_TAG = "Properties";
    public static final String CLASS_ATTRIBUTE = "class";
    public static final String UNKNOWN_CLASS = "Unknown";

    private RbxlxReader() {
    }

    public static List<SceneNode> read(String xml) {
        Document doc = parse(xml);
        Element root = doc.getDocumentElement();
        List<SceneNode> roots = new ArrayList<>();
        for (Element item : XmlPropertyMapper.childElements(root, ITEM_TAG)) {
            roots.add(readItem(item));
        }
        return roots;
    }

    private static SceneNode readItem(Element item) {
        String className = item.hasAttribute(CLASS_ATTRIBUTE) ? item.getAttribute(CLASS_ATTRIBUTE) : UNKNOWN_CLASS;
        String name = null;
        String id = null;
        Map<String, PropertyValue> properties = new LinkedHashMap<>();

        Element props = XmlPropertyMapper.firstChild(item, PROPERTIES_TAG);
        if (props != null) {
            for (Element prop : XmlPropertyMapper.childElements(props)) {
                String propName = prop.getAttribute(XmlPropertyMapper.NAME_ATTRIBUTE);
                if (propName.isEmpty()) {
                    continue;
                }
                String tag = prop.getTagName();
                if (SceneNode.NAME_PROPERTY.equals(propName) && "string".equals(tag)) {
                    if (name == null) {
                        name = prop.getTextContent();
                    }
                    continue;
                }
                if (SceneNode.UNIQUE_ID_PROPERTY.equals(propName) && SceneNode.UNIQUE_ID_PROPERTY.equals(tag)) {
                    if (id == null) {
                        id = prop.getTextContent().strip();
                    }
                    continue;
                }
                properties.putIfAbsent(propName, XmlPropertyMapper.read(prop));
            }
        }

        List<SceneNode> children = new ArrayList<>();
        for (Element child : XmlPropertyMapper.childElements(item, ITEM_TAG)) {
            children.add(readItem(child));
        }
        return new SceneNode(id, className, name, properties, children);
    }

    static Document parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new IllegalArgumentException("rbxlx 内容为空");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new IllegalArgumentException("rbxlx 解析失败：" + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("读取 rbxlx 内容失败：" + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML 解析器配置失败：" + e.getMessage(), e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // 禁止 DTD 与外部实体
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
