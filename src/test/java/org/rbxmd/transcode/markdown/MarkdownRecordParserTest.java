package org.rbxmd.transcode.markdown;

import org.junit.jupiter.api.Test;
import org.rbxmd.transcode.model.NodeRecord;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownRecordParserTest {

    @Test
    void parse_readsHeadersAndPropertyLines() {
        String markdown = """
                Workspace (W) [Workspace]

                Workspace.Baseplate (U1) [Part]
                - Anchored: true
                - Size: (4, 1, 2)

                """;
        List<String> warnings = new ArrayList<>();

        List<NodeRecord> records = MarkdownRecordParser.parse(markdown, "Part", warnings);

        assertThat(records).containsExactly(
                new NodeRecord("Workspace", "W", "Workspace", List.of()),
                new NodeRecord("Workspace.Baseplate", "U1", "Part", List.of("- Anchored: true", "- Size: (4, 1, 2)")));
        assertThat(warnings).isEmpty();
    }

    @Test
    void parse_invertsRender() {
        List<NodeRecord> records = List.of(
                new NodeRecord("Workspace", "W", "Workspace", List.of()),
                new NodeRecord("Workspace[\"A (1)\"]", "U9", "Model", List.of("- Color: RGB(255, 0, 0)")),
                new NodeRecord("Workspace.Part", "U2", "Part",
                        List.of("- Axes [UNSUPPORTED TYPE: Axes]\n  - axes: 7", "- Transparency: 0.5")));

        List<NodeRecord> parsed = MarkdownRecordParser.parse(MarkdownRecordWriter.render(records, true, true), null, null);

        assertThat(parsed).containsExactlyInAnyOrderElementsOf(records);
    }

    @Test
    void parse_missingClassUsesDefault() {
        List<NodeRecord> records = MarkdownRecordParser.parse("Lighting.Sky (S1)\n- StarCount: 3000\n", "Folder", null);

        assertThat(records).containsExactly(new NodeRecord("Lighting.Sky", "S1", "Folder", List.of("- StarCount: 3000")));
    }

    @Test
    void parse_normalisesIndentedPropertyLines() {
        String markdown = """
                Workspace.Baseplate (U1) [Part]
                  - Anchored: true
                  - Size: (4, 1, 2)
                """;

        List<NodeRecord> records = MarkdownRecordParser.parse(markdown, "Part", null);

        assertThat(records.get(0).properties()).containsExactly("- Anchored: true", "- Size: (4, 1, 2)");
    }

    @Test
    void parse_propertyLineWithParenthesesIsNotAHeader() {
        String markdown = """
                Workspace.Part (U1) [Part]
                - Position (old): (1, 2, 3)
                """;

        List<NodeRecord> records = MarkdownRecordParser.parse(markdown, "Part", null);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).properties()).containsExactly("- Position (old): (1, 2, 3)");
    }

    @Test
    void parse_unrecognisedLinesAreReported() {
        List<String> warnings = new ArrayList<>();

        List<NodeRecord> records = MarkdownRecordParser.parse("# Title\nWorkspace (W)\n", "Part", warnings);

        assertThat(records).extracting(NodeRecord::path).containsExactly("Workspace");
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("# Title");
    }
}
