/*
 * DocTree - Canonical Document Tree, Sections and Splitting
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.doctree.serialization;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Alignment;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.DefinitionDescription;
import net.boyechko.doctree.node.DefinitionList;
import net.boyechko.doctree.node.DefinitionTerm;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.FootnoteDefinition;
import net.boyechko.doctree.node.FootnoteReference;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.MathInline;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.SourceLocation;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.StructuralException;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.TaskStatus;
import net.boyechko.doctree.node.Text;
import org.junit.jupiter.api.Test;

class NodeSerializerTest {

    private static Document sample() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("title", "Report");
        meta.put("pages", 3);
        SourceLocation loc =
                new SourceLocation("pdf", 2, null, null, "p-17", Map.of("font", "Serif"));

        Link link =
                new Link("https://example.org", List.of(new Text("x")), "Example", Map.of(), null);
        Image image = new Image("fig.png", "Figure", null, 640, 480, Map.of(), null);
        MathInline math =
                new MathInline("x", "latex", Map.of("mathml", "<mi>x</mi>"), Map.of(), null);
        ListItem task =
                new ListItem(List.of(Paragraph.text("done")), TaskStatus.CHECKED, Map.of(), null);
        Table table =
                new Table(
                        TableRow.headerOf(TableCell.text("k"), TableCell.text("v")),
                        List.of(TableRow.of(TableCell.text("a"), TableCell.text("1"))),
                        List.of(Alignment.LEFT, Alignment.NONE),
                        "Pairs",
                        Map.of(),
                        null);
        DefinitionDescription description =
                new DefinitionDescription(List.of(Paragraph.text("interface")));
        DefinitionList definitions =
                new DefinitionList(
                        List.of(
                                new DefinitionList.Item(
                                        new DefinitionTerm(List.of(new Text("API"))),
                                        List.of(description))));

        return new Document(
                List.of(
                        new Heading(2, List.of(new Text("Scope")), Map.of(), loc),
                        Paragraph.of(
                                new Text("see "),
                                Strong.of(link),
                                new LineBreak(true),
                                image,
                                math,
                                new FootnoteReference("n1")),
                        new ListBlock(true, List.of(task), 4, false, Map.of(), null),
                        table,
                        definitions,
                        new CodeBlock("ls -l\n", "sh", "~", 4, Map.of(), null),
                        new FootnoteDefinition("n1", List.of(Paragraph.text("Note")))),
                meta,
                null);
    }

    @Test
    void mapUsesNodeTypeAndSnakeCaseFields() {
        Map<String, Object> map = NodeSerializer.toMap(Heading.text(2, "Title"));

        assertEquals("Heading", map.get("node_type"));
        assertEquals(2, map.get("level"));
        assertEquals(
                List.of(Map.of("node_type", "Text", "content", "Title")), map.get("content"));
        assertFalse(map.containsKey("metadata"));
        assertFalse(map.containsKey("source_location"));
    }

    @Test
    void mapIncludesSourceLocationWhenPresent() {
        Node node =
                new Text("t", Map.of("lang", "en"), SourceLocation.atLine("markdown", 12, 3));

        Map<String, Object> map = NodeSerializer.toMap(node);

        assertEquals(Map.of("lang", "en"), map.get("metadata"));
        assertEquals(
                Map.of("format", "markdown", "line", 12, "column", 3), map.get("source_location"));
    }

    @Test
    void listUsesSerializedKindName() {
        Map<String, Object> map =
                NodeSerializer.toMap(ListBlock.bullets(ListItem.of(Paragraph.text("a"))));

        assertEquals("List", map.get("node_type"));
        assertEquals(false, map.get("ordered"));
    }

    @Test
    void yamlRoundTripPreservesTree() {
        Document doc = sample();

        String yaml = NodeSerializer.toYaml(doc);
        Document restored = NodeSerializer.documentFromYaml(yaml);

        assertEquals(doc, restored);
        assertTrue(yaml.contains("node_type: FootnoteDefinition"), yaml);
    }

    @Test
    void mapRoundTripPreservesTree() {
        Document doc = sample();
        assertEquals(doc, NodeSerializer.fromMap(NodeSerializer.toMap(doc)));
    }

    @Test
    void unknownNodeTypeIsRejected() {
        StructuralException e =
                assertThrows(
                        StructuralException.class,
                        () -> NodeSerializer.fromMap(Map.of("node_type", "Widget")));
        assertEquals("Unknown node_type 'Widget'", e.getMessage());
    }

    @Test
    void missingFieldsAreRejected() {
        StructuralException e =
                assertThrows(
                        StructuralException.class,
                        () -> NodeSerializer.fromMap(Map.of("node_type", "Text")));
        assertEquals("Text is missing required field 'content'", e.getMessage());

        assertThrows(
                StructuralException.class, () -> NodeSerializer.fromMap(Map.of("level", 1)));
    }

    @Test
    void constructorRulesStillApply() {
        String yaml = "node_type: Heading\nlevel: 9\ncontent: []\n";

        StructuralException e =
                assertThrows(StructuralException.class, () -> NodeSerializer.fromYaml(yaml));
        assertTrue(e.getMessage().contains("1-6"), e.getMessage());
    }

    @Test
    void childOfWrongKindIsRejected() {
        String yaml =
                "node_type: Document\n"
                        + "children:\n"
                        + "- node_type: Text\n"
                        + "  content: loose inline\n";

        StructuralException e =
                assertThrows(StructuralException.class, () -> NodeSerializer.fromYaml(yaml));
        assertTrue(e.getMessage().contains("Block"), e.getMessage());
    }

    @Test
    void metadataKeysAreReadAsStrings() {
        String yaml =
                "node_type: Text\n"
                        + "content: x\n"
                        + "metadata:\n"
                        + "  1: one\n"
                        + "  2.5: half\n"
                        + "  draft: true\n";

        Node node = NodeSerializer.fromYaml(yaml);

        assertEquals("one", node.metadata().get("1"));
        assertEquals("half", node.metadata().get("2.5"));
        assertEquals(Boolean.TRUE, node.metadata().get("draft"));
        for (Object key : node.metadata().keySet()) {
            assertInstanceOf(String.class, key);
        }
    }

    @Test
    void wrongFieldTypeIsRejected() {
        String yaml = "node_type: Heading\nlevel: two\ncontent: []\n";

        StructuralException e =
                assertThrows(StructuralException.class, () -> NodeSerializer.fromYaml(yaml));
        assertTrue(e.getMessage().contains("'level' must be an integer"), e.getMessage());
    }

    @Test
    void malformedOrForeignYamlIsRejected() {
        assertThrows(StructuralException.class, () -> NodeSerializer.fromYaml("- a\n- b\n"));
        assertThrows(StructuralException.class, () -> NodeSerializer.fromYaml("key: [unclosed"));
        assertThrows(
                StructuralException.class,
                () -> NodeSerializer.fromYaml("node_type: !!java.io.File [\"/tmp\"]\n"));
    }

    @Test
    void documentFromYamlRequiresDocumentRoot() {
        String yaml = NodeSerializer.toYaml(Paragraph.text("p"));

        assertThrows(StructuralException.class, () -> NodeSerializer.documentFromYaml(yaml));
        assertEquals(Paragraph.text("p"), NodeSerializer.fromYaml(yaml));
    }
}
