package org.rbxmd.transcode.codec;

import org.junit.jupiter.api.Test;
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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyCodecTest {

    private static final CFrame IDENTITY = new CFrame(List.of("1", "2", "3", "1", "0", "0", "0", "1", "0", "0", "0", "1"));

    @Test
    void decode_rgbAndParenthesisedTriples() {
        assertThat(PropertyCodec.decode("RGB(255, 0, 0)")).isEqualTo(new Color3uint8("255", "0", "0"));
        assertThat(PropertyCodec.decode("(1.0, 2.0, 3.0)")).isEqualTo(new Vector3("1.0", "2.0", "3.0"));
        assertThat(PropertyCodec.decodeDetailed("RGB(255, 0, 0)").rule()).isEqualTo("Color3uint8");
        assertThat(PropertyCodec.decodeDetailed("(1.0, 2.0, 3.0)").rule()).isEqualTo("Vector3");
    }

    @Test
    void decode_scalars() {
        assertThat(PropertyCodec.decode("True")).isEqualTo(Scalar.of(ScalarKind.BOOL, "true"));
        assertThat(PropertyCodec.decode("42")).isEqualTo(Scalar.of(ScalarKind.INT32, "42"));
        assertThat(PropertyCodec.decode("9999999999")).isEqualTo(Scalar.of(ScalarKind.INT64, "9999999999"));
        assertThat(PropertyCodec.decode("-3.25")).isEqualTo(Scalar.of(ScalarKind.FLOAT, "-3.25"));
        assertThat(PropertyCodec.decode("  Hello world  ")).isEqualTo(Scalar.of(ScalarKind.STRING, "Hello world"));
        assertThat(PropertyCodec.decode("")).isEqualTo(Scalar.of(ScalarKind.STRING, ""));
    }

    @Test
    void decode_invertsEncodeForStructuredValues() {
        List<PropertyValue> values = List.of(
                new Vector3("1.5", "-2", "3e-05"),
                new Vector2("0.5", "10"),
                new Color3uint8("12", "34", "56"),
                new Color3("0.5", "0.25", "1"),
                IDENTITY,
                OptionalCFrame.none(),
                new UDim("0.5", "10"),
                new UDim2("0", "100", "0.5", "0"),
                new NumberRange("0", "10"),
                new Rect2D("0", "0", "100", "50"),
                new PhysicalProperties("0.7", "0.3", "0.5"),
                new Ray(new Vector3("0", "5", "0"), new Vector3("0", "-1", "0")),
                new Font("rbxasset://fonts/families/SourceSansPro.json", "Regular", "Normal"),
                new NumberSequence(List.of(new NumberKeypoint("0", "1", "0"), new NumberKeypoint("1", "0", "0"))),
                new ColorSequence(List.of(
                        new ColorKeypoint("0", "1", "0", "0", "0"),
                        new ColorKeypoint("1", "0", "0", "1", "0"))),
                new Faces(EnumSet.of(Face.TOP, Face.FRONT)),
                new Faces(EnumSet.noneOf(Face.class)),
                Scalar.of(ScalarKind.ENUM, "3"),
                Scalar.of(ScalarKind.BRICK_COLOR, "Bright red"),
                Scalar.of(ScalarKind.REF, "RBX0123ABC"),
                Scalar.of(ScalarKind.SHARED_STRING, "aGVsbG8="),
                Scalar.of(ScalarKind.STRING, "Hello world"));

        for (PropertyValue value : values) {
            assertThat(PropertyCodec.decode(PropertyCodec.encodeValue(value)))
                    .as("%s", value)
                    .isEqualTo(value);
        }
    }

    @Test
    void decode_optionalCFrameIsReadBackAsPlainCFrame() {
        // 文本里 OptionalCoordinateFrame 与 CFrame 同形
        assertThat(PropertyCodec.encodeValue(new OptionalCFrame(IDENTITY)))
                .isEqualTo("CFrame(1, 2, 3, 1, 0, 0, 0, 1, 0, 0, 0, 1)");
        assertThat(PropertyCodec.decode("nil")).isEqualTo(OptionalCFrame.none());
    }

    @Test
    void decode_knownLossyCases() {
        assertThat(PropertyCodec.decode(PropertyCodec.encodeValue(Scalar.of(ScalarKind.TOKEN, "3"))))
                .isEqualTo(Scalar.of(ScalarKind.INT32, "3"));
        assertThat(PropertyCodec.decode(PropertyCodec.encodeValue(Scalar.of(ScalarKind.FLOAT, "1"))))
                .isEqualTo(Scalar.of(ScalarKind.INT32, "1"));
        assertThat(PropertyCodec.decode(PropertyCodec.encodeValue(Scalar.of(ScalarKind.STRING, "true"))))
                .isEqualTo(Scalar.of(ScalarKind.BOOL, "true"));
        assertThat(PropertyCodec.decode(PropertyCodec.encodeValue(Scalar.of(ScalarKind.PROTECTED_STRING, "print(1)"))))
                .isEqualTo(Scalar.of(ScalarKind.BINARY_STRING, ""));
    }

    @Test
    void decode_malformedStructuredTextFallsBackToString() {
        assertThat(PropertyCodec.decode("CFrame(1, 2, 3)")).isEqualTo(Scalar.of(ScalarKind.STRING, "CFrame(1, 2, 3)"));
        assertThat(PropertyCodec.decode("NumberSequence(garbage)"))
                .isEqualTo(Scalar.of(ScalarKind.STRING, "NumberSequence(garbage)"));
        assertThat(PropertyCodec.decode("(a, b)")).isEqualTo(Scalar.of(ScalarKind.STRING, "(a, b)"));
    }

    @Test
    void decodeRuleNames_triesSpecificShapesBeforeGeneralOnes() {
        List<String> rules = PropertyCodec.decodeRuleNames();

        assertThat(rules).startsWith("bool", "int", "float", "Color3uint8", "Vector3", "Vector2", "CFrame", "UDim2", "UDim");
        assertThat(rules).endsWith("Unsupported", "string");
        assertThat(rules.indexOf("UDim2")).isLessThan(rules.indexOf("UDim"));
    }

    @Test
    void encodeValue_fillsMissingComponentsWithDefaults() {
        assertThat(PropertyCodec.encodeValue(new Vector3(null, "2", null))).isEqualTo("(0, 2, 0)");
        assertThat(PropertyCodec.encodeValue(Scalar.of(ScalarKind.BOOL, null))).isEqualTo("false");
        assertThat(PropertyCodec.encodeValue(Scalar.of(ScalarKind.INT32, ""))).isEqualTo("0");
        assertThat(PropertyCodec.encodeValue(Scalar.of(ScalarKind.FLOAT, null))).isEqualTo("0.0");
        assertThat(PropertyCodec.encodeValue(Scalar.of(ScalarKind.BINARY_STRING, "AAAA"))).isEqualTo("[Binary Data]");
        assertThat(PropertyCodec.encodeValue(new Faces(EnumSet.of(Face.BACK, Face.TOP)))).isEqualTo("[Top, Back]");
    }

    @Test
    void encode_indentsAndPrefixesName() {
        List<String> warnings = new ArrayList<>();

        List<String> lines = PropertyCodec.encode(new Property("Anchored", Scalar.of(ScalarKind.BOOL, "true")), 1, warnings);

        assertThat(lines).containsExactly("  - Anchored: true");
        assertThat(warnings).isEmpty();
    }

    @Test
    void encode_unsupportedLeafIsInlineAndWarns() {
        List<String> warnings = new ArrayList<>();
        Property property = new Property("Mystery", new Unsupported("Widget", "abc", List.of()));

        List<String> lines = PropertyCodec.encode(property, 0, warnings);

        assertThat(lines).containsExactly("- Mystery: abc [UNSUPPORTED TYPE: Widget]");
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("Widget").contains("Mystery");
        assertThat(PropertyCodec.decodeLine(lines.get(0))).isEqualTo(property);
    }

    @Test
    void encode_valueWithLineBreakWarnsAboutTruncation() {
        List<String> warnings = new ArrayList<>();

        List<String> lines = PropertyCodec.encode(
                new Property("Text", Scalar.of(ScalarKind.STRING, "line1\nline2")), 0, warnings);

        assertThat(lines).containsExactly("- Text: line1\nline2");
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("Text").contains("换行");

        List<String> unsupportedWarnings = new ArrayList<>();
        PropertyCodec.encode(new Property("Blob", new Unsupported("Widget", "a\r\nb", List.of())), 0, unsupportedWarnings);
        assertThat(unsupportedWarnings).hasSize(2);
        assertThat(unsupportedWarnings.get(1)).contains("Blob").contains("换行");
    }

    @Test
    void encode_unsupportedWithChildrenUsesHeaderAndSubLines() {
        Property property = new Property("Axes",
                new Unsupported("Axes", null, List.of(new UnsupportedChild("axes", null, "7"))));

        List<String> lines = PropertyCodec.encode(property, 0, new ArrayList<>());

        assertThat(lines).containsExactly("- Axes [UNSUPPORTED TYPE: Axes]", "  - axes: 7");
        assertThat(PropertyCodec.decodeBlock(lines)).isEqualTo(property);
    }

    @Test
    void decodeLine_splitsAtFirstColon() {
        assertThat(PropertyCodec.decodeLine("- Anchored: true"))
                .isEqualTo(new Property("Anchored", Scalar.of(ScalarKind.BOOL, "true")));
        assertThat(PropertyCodec.decodeLine("  - Source: http://example.com/a"))
                .isEqualTo(new Property("Source", Scalar.of(ScalarKind.STRING, "http://example.com/a")));
        assertThat(PropertyCodec.decodeLine("- Position: (1, 2, 3)"))
                .isEqualTo(new Property("Position", new Vector3("1", "2", "3")));
    }

    @Test
    void decodeLine_rejectsNonPropertyLines() {
        assertThat(PropertyCodec.decodeLine("Workspace (W)")).isNull();
        assertThat(PropertyCodec.decodeLine("- no colon here")).isNull();
        assertThat(PropertyCodec.decodeLine("- : value")).isNull();
        assertThat(PropertyCodec.decodeLine(null)).isNull();
    }
}
