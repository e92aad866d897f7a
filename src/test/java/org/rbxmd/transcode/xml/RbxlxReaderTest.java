package org.rbxmd.transcode.xml;

import org.junit.jupiter.api.Test;
import org.rbxmd.transcode.model.PropertyValue.CFrame;
import org.rbxmd.transcode.model.PropertyValue.Color3uint8;
import org.rbxmd.transcode.model.PropertyValue.Face;
import org.rbxmd.transcode.model.PropertyValue.Faces;
import org.rbxmd.transcode.model.PropertyValue.NumberKeypoint;
import org.rbxmd.transcode.model.PropertyValue.NumberSequence;
import org.rbxmd.transcode.model.PropertyValue.Scalar;
import org.rbxmd.transcode.model.PropertyValue.ScalarKind;
import org.rbxmd.transcode.model.PropertyValue.Unsupported;
import org.rbxmd.transcode.model.PropertyValue.UnsupportedChild;
import org.rbxmd.transcode.model.PropertyValue.Vector3;
import org.rbxmd.transcode.model.SceneNode;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RbxlxReaderTest {

    private static final String PLACE = """
            <roblox xmlns:xmime="http://www.w3.org/2005/05/xmlmime" version="4">
              <Meta name="ExplicitAutoJoints">true</Meta>
              <Item class="Workspace" referent="RBX0">
                <Properties>
                  <string name="Name">Workspace</string>
                  <UniqueId name="UniqueId">W</UniqueId>
                </Properties>
                <Item class="Part" referent="RBX1">
                  <Properties>
                    <string name="Name">Baseplate</string>
                    <UniqueId name="UniqueId"> U1 </UniqueId>
                    <bool name="Anchored">true</bool>
                    <Vector3 name="size">
                      <X>512</X>
                      <Y>20</Y>
                      <Z>512</Z>
                    </Vector3>
                    <CoordinateFrame name="CFrame">
                      <X>0</X><Y>-10</Y><Z>0</Z>
                      <R00>1</R00><R01>0</R01><R02>0</R02>
                      <R10>0</R10><R11>1</R11><R12>0</R12>
                      <R20>0</R20><R21>0</R21><R22>1</R22>
                    </CoordinateFrame>
                    <Color3uint8 name="Color3uint8">4294901760</Color3uint8>
                    <token name="Material">256</token>
                    <Faces name="ResizeFaces"><faces>3</faces></Faces>
                    <NumberSequence name="Transparency">0 1 0 1 0 0 </NumberSequence>
                    <Axes name="Axes"><axes>7</axes></Axes>
                    <ProtectedString name="Source"><![CDATA[print("hi")]]></ProtectedString>
                    <Content name="Texture"><url>rbxassetid://1</url></Content>
                  </Properties>
                </Item>
              </Item>
              <Item>
                <Properties>
                  <bool name="Archivable">true</bool>
                </Properties>
              </Item>
            </roblox>
            """;

    @Test
    void read_buildsTreeFromItems() {
        List<SceneNode> roots = RbxlxReader.read(PLACE);

        assertThat(roots).hasSize(2);
        SceneNode workspace = roots.get(0);
        assertThat(workspace.id()).isEqualTo("W");
        assertThat(workspace.className()).isEqualTo("Workspace");
        assertThat(workspace.name()).isEqualTo("Workspace");
        assertThat(workspace.properties()).isEmpty();

        SceneNode baseplate = workspace.children().get(0);
        assertThat(baseplate.id()).isEqualTo("U1");
        assertThat(baseplate.name()).isEqualTo("Baseplate");
        assertThat(baseplate.properties()).doesNotContainKeys("Name", "UniqueId");
    }

    @Test
    void read_mapsStudioPropertyForms() {
        SceneNode baseplate = RbxlxReader.read(PLACE).get(0).children().get(0);

        assertThat(baseplate.properties())
                .containsEntry("Anchored", Scalar.of(ScalarKind.BOOL, "true"))
                .containsEntry("size", new Vector3("512", "20", "512"))
                .containsEntry("CFrame", new CFrame(List.of("0", "-10", "0", "1", "0", "0", "0", "1", "0", "0", "0", "1")))
                .containsEntry("Color3uint8", new Color3uint8("255", "0", "0"))
                .containsEntry("Material", Scalar.of(ScalarKind.TOKEN, "256"))
                .containsEntry("ResizeFaces", new Faces(EnumSet.of(Face.RIGHT, Face.TOP)))
                .containsEntry("Transparency", new NumberSequence(List.of(
                        new NumberKeypoint("0", "1", "0"), new NumberKeypoint("1", "0", "0"))))
                .containsEntry("Axes", new Unsupported("Axes", null, List.of(new UnsupportedChild("axes", null, "7"))))
                .containsEntry("Source", Scalar.of(ScalarKind.PROTECTED_STRING, "print(\"hi\")"))
                .containsEntry("Texture", Scalar.of(ScalarKind.CONTENT, "rbxassetid://1"));
    }

    @Test
    void read_itemWithoutClassOrNameOrId() {
        SceneNode anonymous = RbxlxReader.read(PLACE).get(1);

        assertThat(anonymous.className()).isEqualTo("Unknown");
        assertThat(anonymous.name()).isNull();
        assertThat(anonymous.id()).isNull();
        assertThat(anonymous.properties()).containsOnlyKeys("Archivable");
    }

    @Test
    void read_overflowingNumbersDegradeInsteadOfAbortingTheDocument() {
        String xml = """
                <roblox version="4">
                  <Item class="Part">
                    <Properties>
                      <string name="Name">Broken</string>
                      <Color3uint8 name="Color">99999999999999999999</Color3uint8>
                      <Faces name="ResizeFaces"><faces>99999999999</faces></Faces>
                      <bool name="Anchored">true</bool>
                    </Properties>
                  </Item>
                </roblox>
                """;

        SceneNode part = RbxlxReader.read(xml).get(0);

        assertThat(part.properties())
                .containsEntry("Color", new Color3uint8(null, null, null))
                .containsEntry("ResizeFaces", new Faces(EnumSet.noneOf(Face.class)))
                .containsEntry("Anchored", Scalar.of(ScalarKind.BOOL, "true"));
    }

    @Test
    void read_rejectsMalformedOrEmptyDocuments() {
        assertThatThrownBy(() -> RbxlxReader.read("<roblox><Item>"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RbxlxReader.read("   "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_rejectsDoctype() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE roblox [<!ENTITY x "y">]>
                <roblox>&x;</roblox>
                """;

        assertThatThrownBy(() -> RbxlxReader.read(xml)).isInstanceOf(IllegalArgumentException.class);
    }
}
