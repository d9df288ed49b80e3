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

import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Text;
import org.junit.jupiter.api.Test;

class TextReplacerTest {

    @Test
    void replacesLiteralTextButNotCode() {
        Document doc = Document.of(Paragraph.of(new Text("use foo()"), new Code("foo()")));

        Document result = new TextReplacer("foo()", "bar()").transformDocument(doc);

        assertEquals(
                Document.of(Paragraph.of(new Text("use bar()"), new Code("foo()"))), result);
    }

    @Test
    void literalReplacementTreatsDollarSignsLiterally() {
        Document doc = Document.of(Paragraph.text("price: X"));

        Document result = new TextReplacer("X", "$5").transformDocument(doc);

        assertEquals(Document.of(Paragraph.text("price: $5")), result);
    }

    @Test
    void regexReplacementSupportsGroups() {
        Document doc = Document.of(Paragraph.text("2024-01-31"));

        Document result =
                new TextReplacer("(\\d+)-(\\d+)-(\\d+)", "$3/$2/$1", true).transformDocument(doc);

        assertEquals(Document.of(Paragraph.text("31/01/2024")), result);
    }

    @Test
    void unchangedTextKeepsSameInstance() {
        Text text = new Text("nothing here");
        assertSame(text, new TextReplacer("absent", "x").transform(text));
    }

    @Test
    void rejectsEmptyOrInvalidPattern() {
        assertThrows(IllegalArgumentException.class, () -> new TextReplacer("", "x"));
        assertThrows(IllegalArgumentException.class, () -> new TextReplacer("(", "x", true));
    }
}
