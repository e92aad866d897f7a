package org.rbxmd.transcode.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 属性值（封闭的类型集合）。
 * <p>
 * 说明：
 * <ul>
 *   <li>所有分量均以“文本”保存（数值/布尔的原始写法），避免浮点格式化造成的往返差异。</li>
 *   <li>分量为 {@code null} 表示源文档缺失该子字段；编码时会按 {@code "0"}/{@code "false"} 兜底。</li>
 *   <li>{@link Unsupported} 是兜底分支：未知类型不会中断转换，而是保留原文/子元素供输出。</li>
 * </ul>
 * {@link #typeName()} 返回 rbxlx 中使用的类型标签（只当作不透明字符串使用）。
 */
public sealed interface PropertyValue {

    String typeName();

    /**
     * 标量类型及其 rbxlx 标签。
     */
    enum ScalarKind {
        STRING("string"),
        BOOL("bool"),
        INT32("int"),
        INT64("int64"),
        FLOAT("float"),
        TOKEN("token"),
        CONTENT("Content"),
        UNIQUE_ID("UniqueId"),
        SECURITY_CAPABILITIES("SecurityCapabilities"),
        ENUM("Enum"),
        BRICK_COLOR("BrickColor"),
        REF("Ref"),
        SHARED_STRING("SharedString"),
        BINARY_STRING("BinaryString"),
        PROTECTED_STRING("ProtectedString");

        private final String tag;

        ScalarKind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }

        public boolean isOpaqueBinary() {
            return this == BINARY_STRING || this == PROTECTED_STRING;
        }
    }

    record Scalar(ScalarKind kind, String text) implements PropertyValue {
        public static Scalar of(ScalarKind kind, String text) {
            return new Scalar(kind, text);
        }

        @Override
        public String typeName() {
            return kind.tag();
        }
    }

    record Vector2(String x, String y) implements PropertyValue {
        @Override
        public String typeName() {
            return "Vector2";
        }
    }

    record Vector3(String x, String y, String z) implements PropertyValue {
        @Override
        public String typeName() {
            return "Vector3";
        }
    }

    /**
     * 浮点颜色（0~1）。
     */
    record Color3(String r, String g, String b) implements PropertyValue {
        @Override
        public String typeName() {
            return "Color3";
        }
    }

    /**
     * 8 位颜色（0~255）。
     */
    record Color3uint8(String r, String g, String b) implements PropertyValue {
        @Override
        public String typeName() {
            return "Color3uint8";
        }
    }

    /**
     * 坐标系：位置 3 个分量 + 旋转矩阵 9 个分量，共 12 个。
     */
    record CFrame(List<String> components) implements PropertyValue {
        public static final int COMPONENT_COUNT = 12;

        public CFrame {
            if (components == null || components.size() != COMPONENT_COUNT) {
                throw new IllegalArgumentException("CFrame 必须包含 12 个分量");
            }
            components = List.copyOf(components);
        }

        @Override
        public String typeName() {
            return "CoordinateFrame";
        }
    }

    /**
     * 可选坐标系：{@code value == null} 表示 nil。
     */
    record OptionalCFrame(CFrame value) implements PropertyValue {
        public static OptionalCFrame none() {
            return new OptionalCFrame(null);
        }

        public boolean isPresent() {
            return value != null;
        }

        @Override
        public String typeName() {
            return "OptionalCoordinateFrame";
        }
    }

    record UDim(String scale, String offset) implements PropertyValue {
        @Override
        public String typeName() {
            return "UDim";
        }
    }

    record UDim2(String xScale, String xOffset, String yScale, String yOffset) implements PropertyValue {
        @Override
        public String typeName() {
            return "UDim2";
        }
    }

    record NumberRange(String min, String max) implements PropertyValue {
        @Override
        public String typeName() {
            return "NumberRange";
        }
    }

    record Rect2D(String minX, String minY, String maxX, String maxY) implements PropertyValue {
        @Override
        public String typeName() {
            return "Rect2D";
        }
    }

    record Ray(Vector3 origin, Vector3 direction) implements PropertyValue {
        @Override
        public String typeName() {
            return "Ray";
        }
    }

    record Font(String family, String weight, String style) implements PropertyValue {
        @Override
        public String typeName() {
            return "Font";
        }
    }

    record PhysicalProperties(String density, String friction, String elasticity) implements PropertyValue {
        @Override
        public String typeName() {
            return "PhysicalProperties";
        }
    }

    /**
     * 面集合。输出顺序固定为 {@link Face} 的声明顺序。
     */
    record Faces(Set<Face> faces) implements PropertyValue {
        public Faces {
            EnumSet<Face> copy = EnumSet.noneOf(Face.class);
            if (faces != null) {
                copy.addAll(faces);
            }
            faces = Collections.unmodifiableSet(copy);
        }

        @Override
        public String typeName() {
            return "Faces";
        }
    }

    enum Face {
        TOP("Top", 1),
        BOTTOM("Bottom", 4),
        LEFT("Left", 3),
        RIGHT("Right", 0),
        FRONT("Front", 5),
        BACK("Back", 2);

        private final String label;
        // rbxlx 中 faces 位掩码使用的 NormalId 序号
        private final int normalId;

        Face(String label, int normalId) {
            this.label = label;
            this.normalId = normalId;
        }

        public String label() {
            return label;
        }

        public int bit() {
            return 1 << normalId;
        }

        public static Face fromLabel(String text) {
            if (text == null) {
                return null;
            }
            String trimmed = text.trim();
            for (Face face : values()) {
                if (face.label.equalsIgnoreCase(trimmed)) {
                    return face;
                }
            }
            return null;
        }
    }

    record NumberKeypoint(String time, String value, String envelope) {
    }

    record NumberSequence(List<NumberKeypoint> keypoints) implements PropertyValue {
        public NumberSequence {
            keypoints = keypoints == null ? List.of() : List.copyOf(keypoints);
        }

        @Override
        public String typeName() {
            return "NumberSequence";
        }
    }

    record ColorKeypoint(String time, String r, String g, String b, String envelope) {
    }

    record ColorSequence(List<ColorKeypoint> keypoints) implements PropertyValue {
        public ColorSequence {
            keypoints = keypoints == null ? List.of() : List.copyOf(keypoints);
        }

        @Override
        public String typeName() {
            return "ColorSequence";
        }
    }

    /**
     * 未知类型的子元素：{@code name == null} 时为结构分量（如 X/Y/Z），否则为带 name 的嵌套属性。
     */
    record UnsupportedChild(String tag, String name, String text) {
    }

    /**
     * 未支持的类型（兜底）。
     *
     * @param tag      原始类型标签
     * @param text     元素自身文本（可能为空）
     * @param children 子元素（按文档顺序）
     */
    record Unsupported(String tag, String text, List<UnsupportedChild> children) implements PropertyValue {
        public Unsupported {
            children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public String typeName() {
            return tag;
        }
    }
}
