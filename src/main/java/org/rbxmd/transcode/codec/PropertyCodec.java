package org.rbxmd.transcode.codec;

import org.rbxmd.transcode.model.Property;
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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 属性值与单行文本之间的编解码。
 * <p>
 * 编码（树 -> Markdown）：每种类型有固定模板，输出 {@code - Name: value}；结构化类型缺失的子字段按
 * {@code "0"}/{@code "false"} 兜底，不会失败。未知类型输出 {@code [UNSUPPORTED TYPE: tag]} 标记并写入 warnings。
 * <p>
 * 解码（Markdown -> 树）：文本中没有类型标签，只能按 {@link #decodeRuleNames()} 的顺序逐条尝试匹配，
 * 第一条命中的规则决定类型，全部不命中时退回字符串。
 * <p>
 * 注意：解码本质上是“尽力而为”的逆操作。例如 token/Enum 的纯数字值会被识别为 int，
 * 纯数字的 BrickColor 名称与字符串无法区分；这是文本格式本身丢失了类型信息，不在这里做额外猜测。
 */
public final class PropertyCodec {

    public static final String BINARY_MARKER = "[Binary Data]";
    public static final String NIL = "nil";

    private static final String INDENT = "  ";
    private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    // 数值分量：整数/小数，允许指数部分（rbxlx 中偶尔出现 1e-05 之类的写法）
    private static final String NUM = "-?\\d+(?:\\.\\d+)?(?:[eE][-+]?\\d+)?";
    private static final String FACE = "(?:Top|Bottom|Left|Right|Front|Back)";

    private static final Pattern UNSUPPORTED_HEADER =
            Pattern.compile("^-\\s+([^\\s:]+)\\s+\\[UNSUPPORTED TYPE: ([^\\]]+)\\]$");
    private static final Pattern NUMBER_KEYPOINT =
            Pattern.compile("t:([^,;]*),v:([^,;]*),e:([^,;]*)");
    private static final Pattern COLOR_KEYPOINT =
            Pattern.compile("t:([^,;]*),rgb\\(([^,;]*),([^,;]*),([^,;)]*)\\),e:([^,;]*)");

    /**
     * 解码规则：按列表顺序匹配，先命中者优先。
     * <p>
     * {@code constructor} 返回 null 表示“形状匹配但内容不可用”，继续尝试后续规则。
     */
    private record DecodeRule(String name, Pattern pattern, Function<Matcher, PropertyValue> constructor) {
    }

    /**
     * 解码结果。
     *
     * @param rule  命中的规则名
     * @param value 推断出的属性值
     */
    public record Decoded(String rule, PropertyValue value) {
    }

    private static final List<DecodeRule> DECODE_RULES = List.of(
            rule("bool", "(?i)true|false",
                    m -> Scalar.of(ScalarKind.BOOL, m.group().toLowerCase(Locale.ROOT))),
            rule("int", "-?\\d+", m -> decodeInteger(m.group())),
            rule("float", "-?\\d+\\.\\d+(?:[eE][-+]?\\d+)?",
                    m -> Scalar.of(ScalarKind.FLOAT, m.group())),
            rule("Color3uint8", "RGB\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)",
                    m -> new Color3uint8(m.group(1), m.group(2), m.group(3))),
            rule("Vector3", "\\(\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*\\)",
                    m -> new Vector3(m.group(1), m.group(2), m.group(3))),
            rule("Vector2", "\\(\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*\\)",
                    m -> new Vector2(m.group(1), m.group(2))),
            rule("CFrame", "CFrame\\((.*)\\)", m -> decodeCFrame(m.group(1))),
            rule("UDim2", "X\\(\\s*Scale:\\s*(" + NUM + ")\\s*,\\s*Offset:\\s*(" + NUM + ")\\s*\\)\\s*,\\s*"
                            + "Y\\(\\s*Scale:\\s*(" + NUM + ")\\s*,\\s*Offset:\\s*(" + NUM + ")\\s*\\)",
                    m -> new UDim2(m.group(1), m.group(2), m.group(3), m.group(4))),
            rule("UDim", "Scale:\\s*(" + NUM + ")\\s*,\\s*Offset:\\s*(" + NUM + ")",
                    m -> new UDim(m.group(1), m.group(2))),
            rule("BinaryString", Pattern.quote(BINARY_MARKER),
                    m -> Scalar.of(ScalarKind.BINARY_STRING, "")),
            rule("SharedString", "SharedString\\((.*)\\)",
                    m -> Scalar.of(ScalarKind.SHARED_STRING, m.group(1))),
            rule("Ref", "Ref\\((.*)\\)", m -> Scalar.of(ScalarKind.REF, m.group(1))),
            rule("Enum", "Enum\\((.*)\\)", m -> Scalar.of(ScalarKind.ENUM, m.group(1))),
            rule("BrickColor", "BrickColor\\((.*)\\)", m -> Scalar.of(ScalarKind.BRICK_COLOR, m.group(1))),
            rule("Color3", "Color3\\((.*)\\)", m -> decodeColor3(m.group(1))),
            rule("NumberRange", "Range\\(\\s*(" + NUM + ")\\s+to\\s+(" + NUM + ")\\s*\\)",
                    m -> new NumberRange(m.group(1), m.group(2))),
            rule("Rect2D", "Rect\\(\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*\\)",
                    m -> new Rect2D(m.group(1), m.group(2), m.group(3), m.group(4))),
            rule("PhysicalProperties", "PhysicalProperties\\(\\s*Density:\\s*(" + NUM + ")\\s*,\\s*Friction:\\s*("
                            + NUM + ")\\s*,\\s*Elasticity:\\s*(" + NUM + ")\\s*\\)",
                    m -> new PhysicalProperties(m.group(1), m.group(2), m.group(3))),
            rule("Font", "Font\\((.*)\\)", m -> decodeFont(m.group(1))),
            rule("Ray", "Ray\\(\\s*Origin:\\s*\\(\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*\\)\\s*,\\s*"
                            + "Direction:\\s*\\(\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*,\\s*(" + NUM + ")\\s*\\)\\s*\\)",
                    m -> new Ray(
                            new Vector3(m.group(1), m.group(2), m.group(3)),
                            new Vector3(m.group(4), m.group(5), m.group(6)))),
            rule("NumberSequence", "NumberSequence\\((.*)\\)", m -> decodeNumberSequence(m.group(1))),
            rule("ColorSequence", "ColorSequence\\((.*)\\)", m -> decodeColorSequence(m.group(1))),
            rule("Faces", "\\[\\s*(?:" + FACE + "(?:\\s*,\\s*" + FACE + ")*)?\\s*\\]", m -> decodeFaces(m.group())),
            rule("OptionalCFrame", NIL, m -> OptionalCFrame.none()),
            rule("Unsupported", "(.+) \\[UNSUPPORTED TYPE: ([^\\]]+)\\]",
                    m -> new Unsupported(m.group(2), m.group(1), List.of())),
            rule("string", "(?s).*", m -> Scalar.of(ScalarKind.STRING, m.group()))
    );

    private PropertyCodec() {
    }

    private static DecodeRule rule(String name, String regex, Function<Matcher, PropertyValue> constructor) {
        return new DecodeRule(name, Pattern.compile(regex), constructor);
    }

    // ---------------------------------------------------------------- encode

    /**
     * 把属性编码为一行或多行文本（多行仅出现在未知类型的子元素展开时）。
     *
     * @param property    属性
     * @param indentLevel 缩进层级（每级两个空格）
     * @param warnings    非致命告警输出（未知类型会追加一条）
     */
    public static List<String> encode(Property property, int indentLevel, List<String> warnings) {
        String indent = INDENT.repeat(Math.max(0, indentLevel));
        String name = property.name();
        PropertyValue value = property.value();

        List<String> lines = new ArrayList<>(1);
        if (value instanceof Unsupported unsupported) {
            if (warnings != null) {
                warnings.add("不支持的属性类型 '" + unsupported.tag() + "'（属性 '" + name + "'），已按通用格式输出。");
            }
            boolean leaf = unsupported.children().isEmpty();
            if (leaf && !isBlank(unsupported.text())) {
                lines.add(indent + "- " + name + ": " + inlineUnsupported(unsupported));
            } else {
                lines.add(indent + "- " + name + " [UNSUPPORTED TYPE: " + unsupported.tag() + "]");
                for (UnsupportedChild child : unsupported.children()) {
                    String label = child.name() != null ? child.name() : child.tag();
                    lines.add(indent + INDENT + "- " + label + ": " + nullToEmpty(child.text()));
                }
            }
        } else {
            lines.add(indent + "- " + name + ": " + encodeValue(value));
        }
        warnIfMultiline(lines, name, warnings);
        return lines;
    }

    /**
     * 属性行按行解析：值里的换行会把后半段变成独立的行，回读时丢失或被误认为另一条属性。
     */
    private static void warnIfMultiline(List<String> lines, String name, List<String> warnings) {
        if (warnings == null) {
            return;
        }
        for (String line : lines) {
            if (line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
                warnings.add("属性 '" + name + "' 的值包含换行，转回 rbxlx 时换行之后的内容会丢失。");
                return;
            }
        }
    }

    public static String encodeBlock(Property property, List<String> warnings) {
        return String.join("\n", encode(property, 0, warnings));
    }

    /**
     * 单行值文本（不含 {@code - Name:} 前缀）。
     */
    public static String encodeValue(PropertyValue value) {
        if (value instanceof Scalar scalar) {
            return encodeScalar(scalar);
        }
        if (value instanceof Color3uint8 c) {
            return "RGB(" + num(c.r()) + ", " + num(c.g()) + ", " + num(c.b()) + ")";
        }
        if (value instanceof Vector3 v) {
            return vector3(v);
        }
        if (value instanceof Vector2 v) {
            return "(" + num(v.x()) + ", " + num(v.y()) + ")";
        }
        if (value instanceof CFrame cf) {
            return cframe(cf);
        }
        if (value instanceof OptionalCFrame optional) {
            return optional.isPresent() ? cframe(optional.value()) : NIL;
        }
        if (value instanceof UDim u) {
            return "Scale: " + num(u.scale()) + ", Offset: " + num(u.offset());
        }
        if (value instanceof UDim2 u) {
            return "X(Scale: " + num(u.xScale()) + ", Offset: " + num(u.xOffset()) + "), "
                    + "Y(Scale: " + num(u.yScale()) + ", Offset: " + num(u.yOffset()) + ")";
        }
        if (value instanceof Color3 c) {
            return "Color3(" + num(c.r()) + ", " + num(c.g()) + ", " + num(c.b()) + ")";
        }
        if (value instanceof NumberRange r) {
            return "Range(" + num(r.min()) + " to " + num(r.max()) + ")";
        }
        if (value instanceof Rect2D r) {
            return "Rect(" + num(r.minX()) + ", " + num(r.minY()) + ", " + num(r.maxX()) + ", " + num(r.maxY()) + ")";
        }
        if (value instanceof Faces f) {
            return f.faces().stream().map(Face::label).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Ray r) {
            Vector3 origin = r.origin() != null ? r.origin() : new Vector3(null, null, null);
            Vector3 direction = r.direction() != null ? r.direction() : new Vector3(null, null, null);
            return "Ray(Origin: " + vector3(origin) + ", Direction: " + vector3(direction) + ")";
        }
        if (value instanceof Font f) {
            return "Font(" + nullToEmpty(f.family()) + ", " + nullToEmpty(f.weight()) + ", " + nullToEmpty(f.style()) + ")";
        }
        if (value instanceof PhysicalProperties p) {
            return "PhysicalProperties(Density: " + num(p.density()) + ", Friction: " + num(p.friction())
                    + ", Elasticity: " + num(p.elasticity()) + ")";
        }
        if (value instanceof NumberSequence s) {
            return s.keypoints().stream()
                    .map(k -> "t:" + num(k.time()) + ",v:" + num(k.value()) + ",e:" + num(k.envelope()))
                    .collect(Collectors.joining("; ", "NumberSequence(", ")"));
        }
        if (value instanceof ColorSequence s) {
            return s.keypoints().stream()
                    .map(k -> "t:" + num(k.time()) + ",rgb(" + num(k.r()) + "," + num(k.g()) + "," + num(k.b())
                            + "),e:" + num(k.envelope()))
                    .collect(Collectors.joining("; ", "ColorSequence(", ")"));
        }
        if (value instanceof Unsupported u) {
            return inlineUnsupported(u);
        }
        throw new IllegalArgumentException("未知的属性值类型：" + value);
    }

    private static String encodeScalar(Scalar scalar) {
        String text = scalar.text();
        return switch (scalar.kind()) {
            case BOOL -> isEmpty(text) ? "false" : text;
            case INT32, INT64, SECURITY_CAPABILITIES -> isEmpty(text) ? "0" : text;
            case FLOAT -> isEmpty(text) ? "0.0" : text;
            case ENUM -> "Enum(" + nullToEmpty(text) + ")";
            case BRICK_COLOR -> "BrickColor(" + nullToEmpty(text) + ")";
            case REF -> "Ref(" + nullToEmpty(text) + ")";
            case SHARED_STRING -> "SharedString(" + nullToEmpty(text) + ")";
            case BINARY_STRING, PROTECTED_STRING -> BINARY_MARKER;
            case STRING, TOKEN, CONTENT, UNIQUE_ID -> nullToEmpty(text);
        };
    }

    private static String inlineUnsupported(Unsupported u) {
        return nullToEmpty(u.text()) + " [UNSUPPORTED TYPE: " + u.tag() + "]";
    }

    private static String vector3(Vector3 v) {
        return "(" + num(v.x()) + ", " + num(v.y()) + ", " + num(v.z()) + ")";
    }

    private static String cframe(CFrame cf) {
        return cf.components().stream().map(PropertyCodec::num).collect(Collectors.joining(", ", "CFrame(", ")"));
    }

    // ---------------------------------------------------------------- decode

    public static List<String> decodeRuleNames() {
        return DECODE_RULES.stream().map(DecodeRule::name).toList();
    }

    public static PropertyValue decode(String valueText) {
        return decodeDetailed(valueText).value();
    }

    public static Decoded decodeDetailed(String valueText) {
        String text = valueText == null ? "" : valueText.strip();
        for (DecodeRule rule : DECODE_RULES) {
            Matcher m = rule.pattern().matcher(text);
            if (!m.matches()) {
                continue;
            }
            PropertyValue value = rule.constructor().apply(m);
            if (value != null) {
                return new Decoded(rule.name(), value);
            }
        }
        // 最后一条规则匹配任意文本，理论上不会走到这里
        return new Decoded("string", Scalar.of(ScalarKind.STRING, text));
    }

    /**
     * 解析一条属性行：{@code - Name: value}。
     *
     * @return 非属性行（不以 {@code -} 开头、缺少冒号）返回 null
     */
    public static Property decodeLine(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (!trimmed.startsWith("-")) {
            return null;
        }
        Matcher header = UNSUPPORTED_HEADER.matcher(trimmed);
        if (header.matches()) {
            return new Property(header.group(1), new Unsupported(header.group(2), null, List.of()));
        }
        String body = trimmed.length() >= 2 ? trimmed.substring(2) : "";
        int colon = body.indexOf(':');
        if (colon < 0) {
            return null;
        }
        String name = body.substring(0, colon).strip();
        if (name.isEmpty()) {
            return null;
        }
        return new Property(name, decode(body.substring(colon + 1)));
    }

    /**
     * 解析一个属性块：首行为属性行，后续缩进行仅对未知类型有意义（作为子元素还原）。
     */
    public static Property decodeBlock(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        Property head = decodeLine(lines.get(0));
        if (head == null || lines.size() == 1) {
            return head;
        }
        if (!(head.value() instanceof Unsupported unsupported) || unsupported.text() != null) {
            return head;
        }
        List<UnsupportedChild> children = new ArrayList<>(lines.size() - 1);
        for (String sub : lines.subList(1, lines.size())) {
            String trimmed = sub.strip();
            if (!trimmed.startsWith("- ")) {
                continue;
            }
            String body = trimmed.substring(2);
            int colon = body.indexOf(':');
            if (colon < 0) {
                continue;
            }
            children.add(new UnsupportedChild(body.substring(0, colon).strip(), null, body.substring(colon + 1).strip()));
        }
        return new Property(head.name(), new Unsupported(unsupported.tag(), null, children));
    }

    private static PropertyValue decodeInteger(String digits) {
        BigInteger value = new BigInteger(digits);
        ScalarKind kind = value.abs().compareTo(INT32_MAX) > 0 ? ScalarKind.INT64 : ScalarKind.INT32;
        return Scalar.of(kind, digits);
    }

    private static PropertyValue decodeCFrame(String inner) {
        List<String> parts = splitComma(inner);
        if (parts.size() != CFrame.COMPONENT_COUNT) {
            return null;
        }
        for (String part : parts) {
            if (!part.matches(NUM)) {
                return null;
            }
        }
        return new CFrame(parts);
    }

    private static PropertyValue decodeColor3(String inner) {
        List<String> parts = splitComma(inner);
        if (parts.size() != 3) {
            return null;
        }
        return new Color3(parts.get(0), parts.get(1), parts.get(2));
    }

    private static PropertyValue decodeFont(String inner) {
        List<String> parts = splitComma(inner);
        if (parts.size() < 3) {
            return null;
        }
        // 字体族可能包含逗号：只把最后两段当作 weight/style
        int n = parts.size();
        String family = String.join(", ", parts.subList(0, n - 2));
        return new Font(family, parts.get(n - 2), parts.get(n - 1));
    }

    private static PropertyValue decodeNumberSequence(String inner) {
        List<NumberKeypoint> keypoints = new ArrayList<>();
        for (String part : splitKeypoints(inner)) {
            Matcher m = NUMBER_KEYPOINT.matcher(part);
            if (!m.matches()) {
                return null;
            }
            keypoints.add(new NumberKeypoint(m.group(1).strip(), m.group(2).strip(), m.group(3).strip()));
        }
        return new NumberSequence(keypoints);
    }

    private static PropertyValue decodeColorSequence(String inner) {
        List<ColorKeypoint> keypoints = new ArrayList<>();
        for (String part : splitKeypoints(inner)) {
            Matcher m = COLOR_KEYPOINT.matcher(part);
            if (!m.matches()) {
                return null;
            }
            keypoints.add(new ColorKeypoint(
                    m.group(1).strip(), m.group(2).strip(), m.group(3).strip(), m.group(4).strip(), m.group(5).strip()));
        }
        return new ColorSequence(keypoints);
    }

    private static PropertyValue decodeFaces(String text) {
        String inner = text.strip();
        inner = inner.substring(1, inner.length() - 1);
        EnumSet<Face> faces = EnumSet.noneOf(Face.class);
        for (String part : splitComma(inner)) {
            Face face = Face.fromLabel(part);
            if (face != null) {
                faces.add(face);
            }
        }
        return new Faces(faces);
    }

    private static List<String> splitKeypoints(String inner) {
        List<String> out = new ArrayList<>();
        if (inner == null || inner.isBlank()) {
            return out;
        }
        for (String part : inner.split(";")) {
            out.add(part.strip());
        }
        return out;
    }

    private static List<String> splitComma(String inner) {
        List<String> out = new ArrayList<>();
        if (inner == null || inner.isBlank()) {
            return out;
        }
        for (String part : inner.split(",", -1)) {
            out.add(part.strip());
        }
        return out;
    }

    private static String num(String text) {
        return isEmpty(text) ? "0" : text;
    }

    private static boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
