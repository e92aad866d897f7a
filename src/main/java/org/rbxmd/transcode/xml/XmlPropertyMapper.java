package org.rbxmd.transcode.xml;

import org.rbxmd.transcode.model.PropertyValue;
import org.rbxmd.transcode.model.PropertyValue.CFrame;
import org.rbxmd.transcode.model.PropertyValue.Color3;
import org.rbxmd.transcode.model.PropertyValue.Color3uint8;
import org.rbxmd.transcode.model.PropertyValue.ColorKeypoint;
import org.rbxmd.transcode.model.PropertyValue.ColorSequence;
import org.rbxmd.transcode.model.PropertyValue.Face;
import org.rbxmd.transcode.model.PropertyValue.Faces;
import org.rbxmd.transcode.model.PropertyValue.Font;
import org.rbxmd.transcode.model.PropertyValue.NumberKeypoint;
import org.rbxmd.transcode.model.PropertyValue.NumberRange;
import org.rbxmd.transcode.model.PropertyValue.NumberSequence;
import org.rbxmd.transcode.model.PropertyValue.OptionalCFrame;
import org.rbxmd.transcode.model.PropertyValue.PhysicalProperties;
import org.rbxmd.transcode.model.PropertyValue.Ray;
import org.rbxmd.transcode.model.PropertyValue.Rect2D;
import org.rbxmd.transcode.model.PropertyValue.Scalar;
import org.rbxmd.transcode.model.PropertyValue.ScalarKind;
import org.rbxmd.transcode.model.PropertyValue.UDim;
import org.rbxmd.transcode.model.PropertyValue.UDim2;
import org.rbxmd.transcode.model.PropertyValue.Unsupported;
import org.rbxmd.transcode.model.PropertyValue.UnsupportedChild;
import org.rbxmd.transcode.model.PropertyValue.Vector2;
import org.rbxmd.transcode.model.PropertyValue.Vector3;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * rbxlx 属性元素与 {@link PropertyValue} 之间的映射。
 * <p>
 * 读取时同时兼容两种写法：
 * <ul>
 *   <li>子元素写法（{@code <R>}/{@code <G>}/{@code <B>}、{@code <Min>}/{@code <Max>}、{@code <Top>true</Top>} 等）</li>
 *   <li>Studio 实际导出的紧凑写法（打包的 Color3uint8 整数、文本形式的 NumberSequence/ColorSequence/NumberRange、
 *       {@code <faces>} 位掩码、{@code <min>/<max>} 的 Rect2D、{@code X..R22} 的 CoordinateFrame）</li>
 * </ul>
 * 写出时统一使用 Studio 的写法。
 */
public final class XmlPropertyMapper {

    public static final String NAME_ATTRIBUTE = "name";

    static final String[] CFRAME_TAGS = {
            "X", "Y", "Z",
            "R00", "R01", "R02",
            "R10", "R11", "R12",
            "R20", "R21", "R22"
    };

    private static final Pattern XML_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, ScalarKind> SCALAR_TAGS = new HashMap<>();

    static {
        for (ScalarKind kind : ScalarKind.values()) {
            SCALAR_TAGS.put(kind.tag(), kind);
        }
        SCALAR_TAGS.put("double", ScalarKind.FLOAT);
        SCALAR_TAGS.put("Reference", ScalarKind.REF);
        // Content 有 <url>/<null> 子元素，单独处理
        SCALAR_TAGS.remove(ScalarKind.CONTENT.tag());
    }

    private XmlPropertyMapper() {
    }

    public static boolean isValidTag(String tag) {
        return tag != null && XML_NAME.matcher(tag).matches();
    }

    // ---------------------------------------------------------------- read

    public static PropertyValue read(Element prop) {
        String tag = prop.getTagName();
        ScalarKind scalar = SCALAR_TAGS.get(tag);
        if (scalar != null) {
            return Scalar.of(scalar, prop.getTextContent());
        }
        return switch (tag) {
            case "Content" -> readContent(prop);
            case "Color3uint8" -> readColor3uint8(prop);
            case "Color3" -> new Color3(childText(prop, "R"), childText(prop, "G"), childText(prop, "B"));
            case "Vector3" -> readVector3(prop);
            case "Vector2" -> new Vector2(childText(prop, "X"), childText(prop, "Y"));
            case "CoordinateFrame", "CFrame" -> readCFrame(prop);
            case "OptionalCoordinateFrame" -> readOptionalCFrame(prop);
            case "UDim" -> new UDim(childText(prop, "S"), childText(prop, "O"));
            case "UDim2" -> new UDim2(childText(prop, "XS"), childText(prop, "XO"),
                    childText(prop, "YS"), childText(prop, "YO"));
            case "NumberRange" -> readNumberRange(prop);
            case "Rect2D" -> readRect2D(prop);
            case "PhysicalProperties" -> new PhysicalProperties(
                    childText(prop, "Density"), childText(prop, "Friction"), childText(prop, "Elasticity"));
            case "Faces" -> readFaces(prop);
            case "Ray" -> new Ray(readVector3(firstChild(prop, "Origin")), readVector3(firstChild(prop, "Direction")));
            case "Font" -> readFont(prop);
            case "NumberSequence" -> readNumberSequence(prop);
            case "ColorSequence" -> readColorSequence(prop);
            default -> readUnsupported(prop);
        };
    }

    private static PropertyValue readContent(Element prop) {
        Element url = firstChild(prop, "url");
        if (url != null) {
            return Scalar.of(ScalarKind.CONTENT, url.getTextContent());
        }
        if (firstChild(prop, "null") != null) {
            return Scalar.of(ScalarKind.CONTENT, "");
        }
        return Scalar.of(ScalarKind.CONTENT, prop.getTextContent());
    }

    private static PropertyValue readColor3uint8(Element prop) {
        if (firstChild(prop, "R") != null) {
            return new Color3uint8(childText(prop, "R"), childText(prop, "G"), childText(prop, "B"));
        }
        String packed = prop.getTextContent().strip();
        if (!packed.matches("\\d+")) {
            return new Color3uint8(null, null, null);
        }
        long argb;
        try {
            argb = Long.parseLong(packed);
        } catch (NumberFormatException e) {
            // 超出 long 范围的数字按缺失分量处理
            return new Color3uint8(null, null, null);
        }
        return new Color3uint8(
                Long.toString((argb >> 16) & 0xFF),
                Long.toString((argb >> 8) & 0xFF),
                Long.toString(argb & 0xFF));
    }

    private static Vector3 readVector3(Element element) {
        if (element == null) {
            return new Vector3(null, null, null);
        }
        return new Vector3(childText(element, "X"), childText(element, "Y"), childText(element, "Z"));
    }

    private static CFrame readCFrame(Element prop) {
        List<String> components = new ArrayList<>(CFrame.COMPONENT_COUNT);
        for (int i = 0; i < CFrame.COMPONENT_COUNT; i++) {
            String value = childText(prop, CFRAME_TAGS[i]);
            if (value == null) {
                value = childText(prop, "V" + i);
            }
            if (value == null) {
                value = childText(prop, "R" + i);
            }
            components.add(value == null ? "0" : value);
        }
        return new CFrame(components);
    }

    private static OptionalCFrame readOptionalCFrame(Element prop) {
        Element inner = firstChild(prop, "CFrame");
        if (inner != null) {
            return new OptionalCFrame(readCFrame(inner));
        }
        if (!childElements(prop).isEmpty()) {
            return new OptionalCFrame(readCFrame(prop));
        }
        return OptionalCFrame.none();
    }

    private static NumberRange readNumberRange(Element prop) {
        if (firstChild(prop, "Min") != null || firstChild(prop, "Max") != null) {
            return new NumberRange(childText(prop, "Min"), childText(prop, "Max"));
        }
        String[] parts = tokens(prop.getTextContent());
        return new NumberRange(parts.length > 0 ? parts[0] : null, parts.length > 1 ? parts[1] : null);
    }

    private static Rect2D readRect2D(Element prop) {
        Element min = firstChild(prop, "min");
        Element max = firstChild(prop, "max");
        if (min != null || max != null) {
            return new Rect2D(
                    min == null ? null : childText(min, "X"),
                    min == null ? null : childText(min, "Y"),
                    max == null ? null : childText(max, "X"),
                    max == null ? null : childText(max, "Y"));
        }
        return new Rect2D(childText(prop, "min_x"), childText(prop, "min_y"),
                childText(prop, "max_x"), childText(prop, "max_y"));
    }

    private static Faces readFaces(Element prop) {
        EnumSet<Face> faces = EnumSet.noneOf(Face.class);
        String mask = childText(prop, "faces");
        if (mask != null && mask.strip().matches("\\d+")) {
            int bits;
            try {
                bits = Integer.parseInt(mask.strip());
            } catch (NumberFormatException e) {
                return new Faces(faces);
            }
            for (Face face : Face.values()) {
                if ((bits & face.bit()) != 0) {
                    faces.add(face);
                }
            }
            return new Faces(faces);
        }
        for (Face face : Face.values()) {
            if ("true".equalsIgnoreCase(strip(childText(prop, face.label())))) {
                faces.add(face);
            }
        }
        return new Faces(faces);
    }

    private static Font readFont(Element prop) {
        Element family = firstChild(prop, "Family");
        String familyText = null;
        if (family != null) {
            Element url = firstChild(family, "url");
            familyText = url != null ? url.getTextContent() : family.getTextContent();
        }
        return new Font(strip(familyText), strip(childText(prop, "Weight")), strip(childText(prop, "Style")));
    }

    private static NumberSequence readNumberSequence(Element prop) {
        List<NumberKeypoint> keypoints = new ArrayList<>();
        List<Element> keypointElements = childElements(prop, "Keypoint");
        if (!keypointElements.isEmpty()) {
            for (Element k : keypointElements) {
                keypoints.add(new NumberKeypoint(childText(k, "Time"), childText(k, "Value"), childText(k, "Envelope")));
            }
            return new NumberSequence(keypoints);
        }
        // 文本写法：time value envelope 三个一组
        String[] parts = tokens(prop.getTextContent());
        for (int i = 0; i + 2 < parts.length; i += 3) {
            keypoints.add(new NumberKeypoint(parts[i], parts[i + 1], parts[i + 2]));
        }
        return new NumberSequence(keypoints);
    }

    private static ColorSequence readColorSequence(Element prop) {
        List<ColorKeypoint> keypoints = new ArrayList<>();
        List<Element> keypointElements = childElements(prop, "Keypoint");
        if (!keypointElements.isEmpty()) {
            for (Element k : keypointElements) {
                Element value = firstChild(k, "Value");
                keypoints.add(new ColorKeypoint(
                        childText(k, "Time"),
                        value == null ? null : childText(value, "R"),
                        value == null ? null : childText(value, "G"),
                        value == null ? null : childText(value, "B"),
                        childText(k, "Envelope")));
            }
            return new ColorSequence(keypoints);
        }
        // 文本写法：time r g b envelope 五个一组
        String[] parts = tokens(prop.getTextContent());
        for (int i = 0; i + 4 < parts.length; i += 5) {
            keypoints.add(new ColorKeypoint(parts[i], parts[i + 1], parts[i + 2], parts[i + 3], parts[i + 4]));
        }
        return new ColorSequence(keypoints);
    }

    private static Unsupported readUnsupported(Element prop) {
        List<Element> children = childElements(prop);
        if (children.isEmpty()) {
            return new Unsupported(prop.getTagName(), prop.getTextContent(), List.of());
        }
        List<UnsupportedChild> out = new ArrayList<>(children.size());
        for (Element child : children) {
            String name = child.hasAttribute(NAME_ATTRIBUTE) ? child.getAttribute(NAME_ATTRIBUTE) : null;
            out.add(new UnsupportedChild(child.getTagName(), name, child.getTextContent()));
        }
        return new Unsupported(prop.getTagName(), null, out);
    }

    // ---------------------------------------------------------------- write

    /**
     * 创建属性元素（调用方负责挂到 {@code <Properties>} 下）。
     *
     * @throws IllegalArgumentException 类型标签不是合法的 XML 元素名
     */
    public static Element write(Document doc, String name, PropertyValue value) {
        String tag = value.typeName();
        if (!isValidTag(tag)) {
            throw new IllegalArgumentException("属性类型标签不是合法的 XML 元素名：" + tag);
        }
        Element prop = doc.createElement(tag);
        prop.setAttribute(NAME_ATTRIBUTE, name);

        if (value instanceof Scalar s) {
            writeScalar(doc, prop, s);
        } else if (value instanceof Color3uint8 c) {
            long argb = (0xFFL << 24) | ((long) channel(c.r()) << 16) | ((long) channel(c.g()) << 8) | channel(c.b());
            prop.setTextContent(Long.toString(argb));
        } else if (value instanceof Color3 c) {
            append(doc, prop, "R", c.r());
            append(doc, prop, "G", c.g());
            append(doc, prop, "B", c.b());
        } else if (value instanceof Vector3 v) {
            appendVector3(doc, prop, v);
        } else if (value instanceof Vector2 v) {
            append(doc, prop, "X", v.x());
            append(doc, prop, "Y", v.y());
        } else if (value instanceof CFrame cf) {
            appendCFrame(doc, prop, cf);
        } else if (value instanceof OptionalCFrame optional) {
            if (optional.isPresent()) {
                Element inner = doc.createElement("CFrame");
                appendCFrame(doc, inner, optional.value());
                prop.appendChild(inner);
            }
        } else if (value instanceof UDim u) {
            append(doc, prop, "S", u.scale());
            append(doc, prop, "O", u.offset());
        } else if (value instanceof UDim2 u) {
            append(doc, prop, "XS", u.xScale());
            append(doc, prop, "XO", u.xOffset());
            append(doc, prop, "YS", u.yScale());
            append(doc, prop, "YO", u.yOffset());
        } else if (value instanceof NumberRange r) {
            prop.setTextContent(num(r.min()) + " " + num(r.max()) + " ");
        } else if (value instanceof Rect2D r) {
            Element min = doc.createElement("min");
            append(doc, min, "X", r.minX());
            append(doc, min, "Y", r.minY());
            Element max = doc.createElement("max");
            append(doc, max, "X", r.maxX());
            append(doc, max, "Y", r.maxY());
            prop.appendChild(min);
            prop.appendChild(max);
        } else if (value instanceof PhysicalProperties p) {
            append(doc, prop, "CustomPhysics", "true");
            append(doc, prop, "Density", p.density());
            append(doc, prop, "Friction", p.friction());
            append(doc, prop, "Elasticity", p.elasticity());
        } else if (value instanceof Faces f) {
            int bits = 0;
            for (Face face : f.faces()) {
                bits |= face.bit();
            }
            append(doc, prop, "faces", Integer.toString(bits));
        } else if (value instanceof Ray r) {
            Element origin = doc.createElement("Origin");
            appendVector3(doc, origin, r.origin() == null ? new Vector3(null, null, null) : r.origin());
            Element direction = doc.createElement("Direction");
            appendVector3(doc, direction, r.direction() == null ? new Vector3(null, null, null) : r.direction());
            prop.appendChild(origin);
            prop.appendChild(direction);
        } else if (value instanceof Font f) {
            Element family = doc.createElement("Family");
            Element url = doc.createElement("url");
            url.setTextContent(nullToEmpty(f.family()));
            family.appendChild(url);
            prop.appendChild(family);
            appendText(doc, prop, "Weight", nullToEmpty(f.weight()));
            appendText(doc, prop, "Style", nullToEmpty(f.style()));
        } else if (value instanceof NumberSequence s) {
            StringBuilder text = new StringBuilder();
            for (NumberKeypoint k : s.keypoints()) {
                text.append(num(k.time())).append(' ').append(num(k.value())).append(' ').append(num(k.envelope())).append(' ');
            }
            prop.setTextContent(text.toString());
        } else if (value instanceof ColorSequence s) {
            StringBuilder text = new StringBuilder();
            for (ColorKeypoint k : s.keypoints()) {
                text.append(num(k.time())).append(' ')
                        .append(num(k.r())).append(' ').append(num(k.g())).append(' ').append(num(k.b())).append(' ')
                        .append(num(k.envelope())).append(' ');
            }
            prop.setTextContent(text.toString());
        } else if (value instanceof Unsupported u) {
            writeUnsupported(doc, prop, u);
        }
        return prop;
    }

    private static void writeScalar(Document doc, Element prop, Scalar s) {
        String text = s.text();
        switch (s.kind()) {
            case CONTENT -> {
                if (text == null || text.isEmpty()) {
                    prop.appendChild(doc.createElement("null"));
                } else {
                    appendText(doc, prop, "url", text);
                }
            }
            case BOOL -> prop.setTextContent(text == null || text.isEmpty() ? "false" : text);
            case INT32, INT64, SECURITY_CAPABILITIES -> prop.setTextContent(num(text));
            case FLOAT -> prop.setTextContent(text == null || text.isEmpty() ? "0.0" : text);
            default -> prop.setTextContent(nullToEmpty(text));
        }
    }

    private static void writeUnsupported(Document doc, Element prop, Unsupported u) {
        if (u.children().isEmpty()) {
            prop.setTextContent(nullToEmpty(u.text()));
            return;
        }
        for (UnsupportedChild child : u.children()) {
            if (!isValidTag(child.tag())) {
                continue;
            }
            Element element = doc.createElement(child.tag());
            if (child.name() != null) {
                element.setAttribute(NAME_ATTRIBUTE, child.name());
            }
            element.setTextContent(nullToEmpty(child.text()));
            prop.appendChild(element);
        }
    }

    private static void appendCFrame(Document doc, Element parent, CFrame cf) {
        for (int i = 0; i < CFrame.COMPONENT_COUNT; i++) {
            append(doc, parent, CFRAME_TAGS[i], cf.components().get(i));
        }
    }

    private static void appendVector3(Document doc, Element parent, Vector3 v) {
        append(doc, parent, "X", v.x());
        append(doc, parent, "Y", v.y());
        append(doc, parent, "Z", v.z());
    }

    private static void append(Document doc, Element parent, String tag, String number) {
        appendText(doc, parent, tag, num(number));
    }

    private static void appendText(Document doc, Element parent, String tag, String text) {
        Element child = doc.createElement(tag);
        child.setTextContent(text);
        parent.appendChild(child);
    }

    // ---------------------------------------------------------------- dom helpers

    static Element firstChild(Element parent, String tag) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element e && tag.equals(e.getTagName())) {
                return e;
            }
        }
        return null;
    }

    static List<Element> childElements(Element parent) {
        return childElements(parent, null);
    }

    static List<Element> childElements(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element e && (tag == null || tag.equals(e.getTagName()))) {
                out.add(e);
            }
        }
        return out;
    }

    private static String childText(Element parent, String tag) {
        Element child = firstChild(parent, tag);
        return child == null ? null : child.getTextContent().strip();
    }

    private static String[] tokens(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }

    private static int channel(String text) {
        String trimmed = strip(text);
        if (trimmed == null || !trimmed.matches("\\d{1,9}")) {
            return 0;
        }
        return Math.min(255, Integer.parseInt(trimmed));
    }

    private static String num(String text) {
        return text == null || text.isEmpty() ? "0" : text;
    }

    private static String strip(String text) {
        return text == null ? null : text.strip();
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
