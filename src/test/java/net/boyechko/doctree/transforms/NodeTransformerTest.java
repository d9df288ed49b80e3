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
package net.boyechko.doctree.transforms;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Alignment;
import net.boyechko.doctree.node.BlockQuote;
import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.DefinitionDescription;
import net.boyechko.doctree.node.DefinitionList;
import net.boyechko.doctree.node.DefinitionTerm;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Emphasis;
import net.boyechko.doctree.node.FootnoteDefinition;
import net.boyechko.doctree.node.FootnoteReference;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.MathBlock;
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
import net.boyechko.doctree.node.ThematicBreak;
import org.junit.jupiter.api.Test;

class NodeTransformerTest {

    static Document richDocument() {
        TableRow header = TableRow.headerOf(TableCell.text("Name"), TableCell.text("Value"));
        TableRow row = TableRow.of(TableCell.text("pi"), TableCell.text("3.14"));
        DefinitionList defs =
                new DefinitionList(
                        List.of(
                                new DefinitionList.Item(
                                        new DefinitionTerm(List.of(new Text("Term"))),
                                        List.of(
                                                new DefinitionDescription(
                                                        List.of(Paragraph.text("Meaning")))))));
        return new Document(
                List.of(
                        Heading.text(1, "Title"),
                        Paragraph.of(
                                new Text("Some "),
                                Strong.of(new Text("bold")),
                                new LineBreak(true),
                                Link.text("https://example.org", "link"),
                                new Image("fig.png", "figure"),
                                new Code("x++"),
                                new FootnoteReference("1")),
                        BlockQuote.of(Paragraph.of(Emphasis.of(new Text("quoted")))),
                        new ListBlock(
                                true,
                                List.of(
                                        new ListItem(
                                                List.of(Paragraph.text("done")),
                                                TaskStatus.CHECKED,
                                                Map.of(),
                                                null)),
                                3,
                                false,
                                Map.of(),
                                null),
                        new Table(
                                header,
                                List.of(row),
                                List.of(Alignment.LEFT, Alignment.RIGHT),
                                "Constants",
                                Map.of(),
                                null),
                        defs,
                        new CodeBlock("print(1)", "python"),
                        new MathBlock("E = mc^2"),
                        new ThematicBreak(),
                        new FootnoteDefinition("1", List.of(Paragraph.text("Note")))),
                Map.of("title", "Rich"),
                SourceLocation.atPage("pdf", 1));
    }

    @Test
    void transformerOverridingNothingIsIdentity() {
        Document doc = richDocument();

        Document result = new NodeTransformer() {}.transformDocument(doc);

        assertEquals(doc, result);
        assertEquals("Rich", result.metadata().get("title"));
    }

    @Test
    void returningNullDeletesNode() {
        NodeTransformer dropEmphasis =
                new NodeTransformer() {
                    @Override
                    public Node visitEmphasis(Emphasis node) {
                        return null;
                    }
                };
        Document doc =
                Document.of(Paragraph.of(new Text("keep "), Emphasis.of(new Text("drop"))));

        Document result = dropEmphasis.transformDocument(doc);

        assertEquals(Document.of(Paragraph.of(new Text("keep "))), result);
    }

    @Test
    void replacementOfWrongKindIsStructuralError() {
        NodeTransformer textToParagraph =
                new NodeTransformer() {
                    @Override
                    public Node visitText(Text node) {
                        return Paragraph.of(node);
                    }
                };
        Document doc = Document.of(Paragraph.text("inline only"));

        StructuralException e =
                assertThrows(
                        StructuralException.class, () -> textToParagraph.transformDocument(doc));
        assertTrue(e.getMessage().contains("Inline"), e.getMessage());
    }

    @Test
    void rootMustStayADocument() {
        NodeTransformer deleteRoot =
                new NodeTransformer() {
                    @Override
                    public Node visitDocument(Document node) {
                        return null;
                    }
                };

        assertThrows(StructuralException.class, () -> deleteRoot.transformDocument(new Document()));
    }

    @Test
    void deletedTermDropsItsDescriptions() {
        NodeTransformer dropTerms =
                new NodeTransformer() {
                    @Override
                    public Node visitDefinitionTerm(DefinitionTerm node) {
                        return null;
                    }
                };
        Document doc = richDocument();

        Document result = dropTerms.transformDocument(doc);

        DefinitionList defs = (DefinitionList) result.children().get(5);
        assertTrue(defs.items().isEmpty());
    }

    @Test
    void inputIsUnchangedAfterTransform() {
        Document doc = richDocument();
        Document copy = richDocument();

        new TextReplacer("bold", "plain").transformDocument(doc);

        assertEquals(copy, doc);
    }
}
