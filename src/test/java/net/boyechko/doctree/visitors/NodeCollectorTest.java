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
package net.boyechko.doctree.visitors;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.doctree.node.BlockQuote;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Text;
import org.junit.jupiter.api.Test;

class NodeCollectorTest {

    @Test
    void collectsByTypeInDocumentOrder() {
        Document doc =
                Document.of(
                        Heading.text(1, "A"),
                        BlockQuote.of(Heading.text(2, "B")),
                        Heading.text(3, "C"));

        List<Heading> headings = NodeCollector.collect(doc, Heading.class);

        assertEquals(List.of(1, 2, 3), headings.stream().map(Heading::level).toList());
    }

    @Test
    void collectsByPredicate() {
        Document doc = Document.of(Paragraph.text("short"), Paragraph.text("much longer text"));

        List<Node> longTexts =
                NodeCollector.collect(
                        doc, n -> n instanceof Text t && t.content().length() > 5);

        assertEquals(List.of(new Text("much longer text")), longTexts);
    }
}
