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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.validation.DocumentWalker;
import org.junit.jupiter.api.Test;

class TreePrinterTest {

    @Test
    void printsIndentedOutline() {
        Document doc =
                Document.of(
                        Heading.text(2, "Intro"),
                        Paragraph.of(
                                new Text("see "),
                                Link.text("https://example.org", "here"),
                                new LineBreak(true),
                                new Image("a.png", "A")),
                        ListBlock.numbered(ListItem.of(Paragraph.text("one"))),
                        new CodeBlock("a\nb", "sh"));

        String expected =
                String.join(
                        "\n",
                        "- Document",
                        "  - Heading h2",
                        "    - Text \"Intro\"",
                        "  - Paragraph",
                        "    - Text \"see \"",
                        "    - Link <https://example.org>",
                        "      - Text \"here\"",
                        "    - LineBreak soft",
                        "    - Image <a.png> \"A\"",
                        "  - List ordered start=1",
                        "    - ListItem",
                        "      - Paragraph",
                        "        - Text \"one\"",
                        "  - CodeBlock [sh] \"a\\nb\"",
                        "");

        assertEquals(expected, TreePrinter.print(doc));
    }

    @Test
    void longContentIsTruncated() {
        String text = "x".repeat(60);

        String out = TreePrinter.print(new Text(text));

        assertEquals("- Text \"" + "x".repeat(37) + "...\"\n", out);
    }

    @Test
    void writesToConsumer() {
        List<String> lines = new ArrayList<>();
        new DocumentWalker()
                .addVisitor(new TreePrinter(lines::add))
                .walk(Document.of(Paragraph.text("p")));

        assertEquals(List.of("- Document", "  - Paragraph", "    - Text \"p\""), lines);
    }
}
