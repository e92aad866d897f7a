package org.rbxmd.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rbxmd.transcode.TranscodeProperties;
import org.rbxmd.transcode.WorkspacePathResolver;
import org.rbxmd.transcode.dto.MarkdownExportResult;
import org.rbxmd.transcode.dto.MarkdownFileEntry;
import org.rbxmd.transcode.dto.PathSplitResult;
import org.rbxmd.transcode.dto.PropertyDecodeResult;
import org.rbxmd.transcode.dto.RbxlxImportResult;
import org.rbxmd.transcode.model.SceneNode;
import org.rbxmd.transcode.xml.RbxlxReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RbxlxMcpToolsTest {

    private static final String PLACE = """
            <roblox version="4">
              <Item class="Workspace" referent="RBX0">
                <Properties>
                  <string name="Name">Workspace</string>
                  <UniqueId name="UniqueId">W</UniqueId>
                </Properties>
                <Item class="Part" referent="RBX1">
                  <Properties>
                    <string name="Name">Baseplate</string>
                    <UniqueId name="UniqueId">U1</UniqueId>
                    <bool name="Anchored">true</bool>
                    <Color3uint8 name="Color">4294901760</Color3uint8>
                    <Vector3 name="size"><X>4</X><Y>1.2</Y><Z>2</Z></Vector3>
                  </Properties>
                </Item>
                <Item class="SpawnLocation" referent="RBX2">
                  <Properties>
                    <string name="Name">Spawn Point</string>
                    <UniqueId name="UniqueId">U2</UniqueId>
                    <float name="Transparency">0.5</float>
                  </Properties>
                </Item>
              </Item>
              <Item class="Lighting" referent="RBX3">
                <Properties>
                  <string name="Name">Lighting</string>
                  <UniqueId name="UniqueId">L</UniqueId>
                </Properties>
              </Item>
            </roblox>
            """;

    @TempDir
    Path tempDir;

    private TranscodeProperties properties;
    private RbxlxMcpTools tools;

    @BeforeEach
    void setUp() throws Exception {
        properties = new TranscodeProperties();
        properties.setRoots(List.of(tempDir.toString()));
        tools = new RbxlxMcpTools(properties, new WorkspacePathResolver(properties.getRoots(), false));
        Files.writeString(tempDir.resolve("sample.rbxlx"), PLACE);
    }

    @Test
    void convertToMarkdown_writesOneFilePerTopLevelGroup() throws Exception {
        MarkdownExportResult result = tools.convertToMarkdown(null, "sample.rbxlx", null, null, true, true, false);

        assertThat(result.rootId()).isEqualTo("root0");
        assertThat(result.records()).isEqualTo(4);
        assertThat(result.files()).extracting(MarkdownFileEntry::path)
                .containsExactly("sample/Workspace.md", "sample/Lighting.md");
        assertThat(result.settingsPath()).isNull();
        assertThat(result.warnings()).isNull();

        String workspace = Files.readString(tempDir.resolve("sample/Workspace.md"));
        assertThat(workspace).startsWith("Workspace (W) [Workspace]\n\n");
        assertThat(workspace).contains("""
                Workspace.Baseplate (U1) [Part]
                - Anchored: true
                - Color: RGB(255, 0, 0)
                - size: (4, 1.2, 2)
                """);
        assertThat(workspace).contains("Workspace[\"Spawn Point\"] (U2) [SpawnLocation]\n- Transparency: 0.5");
        assertThat(result.outputLines()).isLessThan(result.inputLines());
    }

    @Test
    void convertToMarkdown_groupsWithCollidingFileNamesGetNumberedSuffix() throws Exception {
        Files.writeString(tempDir.resolve("clash.rbxlx"), """
                <roblox version="4">
                  <Item class="Folder" referent="RBX0">
                    <Properties>
                      <string name="Name">A/B</string>
                      <UniqueId name="UniqueId">F1</UniqueId>
                    </Properties>
                  </Item>
                  <Item class="Folder" referent="RBX1">
                    <Properties>
                      <string name="Name">A_B</string>
                      <UniqueId name="UniqueId">F2</UniqueId>
                    </Properties>
                  </Item>
                </roblox>
                """);

        MarkdownExportResult result = tools.convertToMarkdown(null, "clash.rbxlx", null, null, true, false, false);

        assertThat(result.files()).extracting(MarkdownFileEntry::path)
                .containsExactly("clash/A_B.md", "clash/A_B-2.md");
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("A_B-2.md");
        assertThat(Files.readString(tempDir.resolve("clash/A_B.md"))).startsWith("A/B (F1) [Folder]");
        assertThat(Files.readString(tempDir.resolve("clash/A_B-2.md"))).startsWith("A_B (F2) [Folder]");
    }

    @Test
    void convertToMarkdown_appliesSiblingSettingsFile() throws Exception {
        Files.writeString(tempDir.resolve("rbxlx-to-md-settings.json"), """
                { "Ignore": { "Path": ["game.Lighting"] } }
                """);

        MarkdownExportResult result = tools.convertToMarkdown(null, "sample.rbxlx", "out.md", null, false, true, true);

        assertThat(result.settingsPath()).isEqualTo("rbxlx-to-md-settings.json");
        assertThat(result.records()).isEqualTo(3);
        assertThat(result.files()).hasSize(1);
        assertThat(result.files().get(0).group()).isNull();
        assertThat(result.files().get(0).path()).isEqualTo("out.md");
        assertThat(Files.readString(tempDir.resolve("out.md"))).doesNotContain("Lighting").doesNotContain("[Part]");
    }

    @Test
    void convertToMarkdown_missingExplicitSettingsIsReported() {
        MarkdownExportResult result = tools.convertToMarkdown(null, "sample.rbxlx", null, "missing.json", null, null, true);

        assertThat(result.records()).isEqualTo(4);
        assertThat(result.settingsPath()).isNull();
        assertThat(result.warnings()).hasSize(1);
        assertThat(Files.exists(tempDir.resolve("sample.md"))).isTrue();
    }

    @Test
    void convertToRbxlx_rebuildsConvertedScene() throws Exception {
        Files.writeString(tempDir.resolve("rbxlx-to-md-settings.json"), """
                { "Ignore": { "Path": ["game.Lighting"] } }
                """);
        tools.convertToMarkdown(null, "sample.rbxlx", null, null, true, true, false);

        RbxlxImportResult result = tools.convertToRbxlx(null, "sample", "rebuilt.rbxlx", null);

        assertThat(result.outputPath()).isEqualTo("rebuilt.rbxlx");
        assertThat(result.sourceFiles()).containsExactly("sample/Workspace.md");
        assertThat(result.records()).isEqualTo(3);
        assertThat(result.items()).isEqualTo(3);
        assertThat(result.placeholderCount()).isZero();
        assertThat(result.bytesWritten()).isPositive();

        SceneNode original = RbxlxReader.read(PLACE).get(0);
        List<SceneNode> rebuilt = RbxlxReader.read(Files.readString(tempDir.resolve("rebuilt.rbxlx")));
        assertThat(rebuilt).containsExactly(original);
    }

    @Test
    void convertToRbxlx_createsPlaceholdersForMissingAncestors() throws Exception {
        Files.writeString(tempDir.resolve("parts.md"), """
                Workspace.Model.Part (P1)
                - Anchored: true
                """);

        RbxlxImportResult result = tools.convertToRbxlx(null, "parts.md", null, "MeshPart");

        assertThat(result.outputPath()).isEqualTo("parts.rbxlx");
        assertThat(result.items()).isEqualTo(3);
        assertThat(result.placeholderCount()).isEqualTo(2);
        SceneNode workspace = RbxlxReader.read(Files.readString(tempDir.resolve("parts.rbxlx"))).get(0);
        assertThat(workspace.className()).isEqualTo("Folder");
        SceneNode part = workspace.children().get(0).children().get(0);
        assertThat(part.className()).isEqualTo("MeshPart");
        assertThat(part.id()).isEqualTo("P1");
    }

    @Test
    void convertToRbxlx_directoryWithoutMarkdownIsRejected() throws Exception {
        Files.createDirectories(tempDir.resolve("empty"));

        assertThatThrownBy(() -> tools.convertToRbxlx(null, "empty", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("未找到 Markdown 文件");
    }

    @Test
    void convert_rejectsPathsOutsideRootAndDisabledWrites() {
        assertThatThrownBy(() -> tools.convertToMarkdown(null, "../outside.rbxlx", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);

        properties.setAllowWrite(false);
        assertThatThrownBy(() -> tools.convertToMarkdown(null, "sample.rbxlx", null, null, null, null, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void decodeProperty_reportsRuleAndCanonicalText() {
        PropertyDecodeResult color = tools.decodeProperty("- Color: RGB(255,0,0)");
        assertThat(color.name()).isEqualTo("Color");
        assertThat(color.rule()).isEqualTo("Color3uint8");
        assertThat(color.typeName()).isEqualTo("Color3uint8");
        assertThat(color.canonicalText()).isEqualTo("RGB(255, 0, 0)");

        PropertyDecodeResult vector = tools.decodeProperty("(1.0, 2.0, 3.0)");
        assertThat(vector.name()).isNull();
        assertThat(vector.rule()).isEqualTo("Vector3");

        PropertyDecodeResult header = tools.decodeProperty("- Axes [UNSUPPORTED TYPE: Axes]");
        assertThat(header.name()).isEqualTo("Axes");
        assertThat(header.rule()).isEqualTo("Unsupported");
        assertThat(header.typeName()).isEqualTo("Axes");
    }

    @Test
    void splitPath_returnsSegmentsAndCanonicalPath() {
        PathSplitResult result = tools.splitPath("Workspace[\"Spawn Point\"].Decal");

        assertThat(result.segments()).containsExactly("Workspace", "Spawn Point", "Decal");
        assertThat(result.leafName()).isEqualTo("Decal");
        assertThat(result.canonicalPath()).isEqualTo("Workspace[\"Spawn Point\"].Decal");
    }
}
