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
import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Emphasis;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.Text;
import org.junit.jupiter.api.Test;

class InlineFormattingConsolidatorTest {

    private static Document consolidate(Inline... content) {
        Document doc = Document.of(Paragraph.of(content));
        return new InlineFormattingConsolidator().transformDocument(doc);
    }

    private static Strong strong(String text) {
        return Strong.of(new Text(text));
    }

    private static Emphasis emphasis(String text) {
        return Emphasis.of(new Text(text));
    }

    @Test
    void adjacentBoldFragmentsBecomeOne() {
        Document result = consolidate(strong("bold "), strong("text"), new Text(" after"));

        assertEquals(Document.of(Paragraph.of(strong("bold text"), new Text(" after"))), result);
    }

    @Test
    void whitespaceMovesOutsideFormatting() {
        assertEquals(
                Document.of(Paragraph.of(new Text("a"), strong("b"), new Text(" c"))),
                consolidate(new Text("a"), strong("b "), new Text("c")));
        assertEquals(
                Document.of(Paragraph.of(new Text("a "), emphasis("x"))),
                consolidate(new Text("a"), emphasis(" x")));
    }

    @Test
    void whitespaceOnlyAndEmptyFormattingDisappear() {
        assertEquals(
                Document.of(Paragraph.text("a  b")),
                consolidate(new Text("a"), strong("  "), new Text("b")));
        assertEquals(
                Document.of(Paragraph.text("ab")),
                consolidate(new Text("a"), Strong.of(), new Text("b")));
    }

    @Test
    void differentFormattingKindsStaySeparate() {
        Document result = consolidate(strong("x"), emphasis("y"));

        assertEquals(Document.of(Paragraph.of(strong("x"), emphasis("y"))), result);
    }

    @Test
    void nestedFormattingIsConsolidatedInsideButNotMergedAcross() {
        Document result =
                consolidate(
                        Emphasis.of(strong("a"), strong("b")), Emphasis.of(strong("c")));

        assertEquals(
                Document.of(Paragraph.of(Emphasis.of(strong("ab")), Emphasis.of(strong("c")))),
                result);
    }

    @Test
    void formattingWithCodeIsLeftAlone() {
        Strong mixed = Strong.of(new Text("x"), new Code("y"));

        Document result = consolidate(mixed, strong("z"));

        assertEquals(Document.of(Paragraph.of(mixed, strong("z"))), result);
    }

    @Test
    void mergingStopsAtLinkBoundaries() {
        Link first = new Link("a.html", List.of(strong("one")));
        Link second = new Link("b.html", List.of(strong("two")));
        Link split = new Link("c.html", List.of(strong("th"), strong("ree")));

        Document result = consolidate(first, second, split);

        assertEquals(
                Document.of(
                        Paragraph.of(
                                first, second, new Link("c.html", List.of(strong("three"))))),
                result);
    }

    @Test
    void mergedNodeKeepsFirstFragmentMetadata() {
        Strong tagged = new Strong(List.of(new Text("a")), Map.of("span", 1), null);

        Document result = consolidate(tagged, strong("b"));

        Strong merged = (Strong) ((Paragraph) result.children().get(0)).content().get(0);
        assertEquals(Map.of("span", 1), merged.metadata());
        assertEquals(List.of(new Text("ab")), merged.content());
    }

    @Test
    void headingsCellsAndNestedBlocksAreConsolidated() {
        Table table =
                new Table(
                        null,
                        List.of(
                                new TableRow(
                                        List.of(
                                                new TableCell(
                                                        List.of(
                                                                new Text("1"),
                                                                new Text("2")))),
                                        false)));
        Document doc =
                Document.of(
                        Heading.of(1, strong("Ti"), strong("tle")),
                        table,
                        new ListBlock(
                                false, List.of(ListItem.of(Paragraph.of(emphasis("it "))))),
                        new CodeBlock("**a** **b**", null));

        Document result = new InlineFormattingConsolidator().transformDocument(doc);

        assertEquals(
                Document.of(
                        Heading.of(1, strong("Title")),
                        new Table(
                                null,
                                List.of(
                                        new TableRow(
                                                List.of(TableCell.text("12")), false))),
                        new ListBlock(
                                false,
                                List.of(
                                        ListItem.of(
                                                Paragraph.of(emphasis("it"), new Text(" "))))),
                        new CodeBlock("**a** **b**", null)),
                result);
    }

    @Test
    void cleanParagraphIsUnchanged() {
        Document doc =
                Document.of(Paragraph.of(new Text("plain "), strong("bold"), new Text(" end")));

        assertEquals(doc, new InlineFormattingConsolidator().transformDocument(doc));
    }
}
