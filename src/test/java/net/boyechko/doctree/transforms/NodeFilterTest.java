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

import net.boyechko.doctree.node.Comment;
import net.boyechko.doctree.node.CommentInline;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.HtmlBlock;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Text;
import org.junit.jupiter.api.Test;

class NodeFilterTest {

    @Test
    void removesMatchingNodesAtAnyDepth() {
        Document doc =
                Document.of(
                        new Comment("editor note"),
                        Paragraph.of(new Text("body"), new CommentInline("todo")));

        Document result =
                new NodeFilter(n -> n instanceof Comment || n instanceof CommentInline)
                        .transformDocument(doc);

        assertEquals(Document.of(Paragraph.text("body")), result);
    }

    @Test
    void removingByKind() {
        Document doc = Document.of(new HtmlBlock("<br>"), Paragraph.text("kept"));

        Document result = NodeFilter.removing(HtmlBlock.class).transformDocument(doc);

        assertEquals(Document.of(Paragraph.text("kept")), result);
    }

    @Test
    void documentRootIsNeverRemoved() {
        Document doc = Document.of(Paragraph.text("x"));

        Document result = new NodeFilter(n -> true).transformDocument(doc);

        assertTrue(result.children().isEmpty());
    }
}
