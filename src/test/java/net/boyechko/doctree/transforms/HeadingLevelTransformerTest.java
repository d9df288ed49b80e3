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

import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Paragraph;
import org.junit.jupiter.api.Test;

class HeadingLevelTransformerTest {

    private static int level(Document doc, int index) {
        return ((Heading) doc.children().get(index)).level();
    }

    @Test
    void shiftsAndClampsLevels() {
        Document doc =
                Document.of(
                        Heading.text(1, "A"),
                        Paragraph.text("text"),
                        Heading.text(3, "B"),
                        Heading.text(6, "C"));

        Document result = new HeadingLevelTransformer(1).transformDocument(doc);

        assertEquals(2, level(result, 0));
        assertEquals(4, level(result, 2));
        assertEquals(6, level(result, 3));
        assertEquals(doc.children().get(1), result.children().get(1));
    }

    @Test
    void negativeOffsetRespectsMinimum() {
        Document doc = Document.of(Heading.text(2, "A"), Heading.text(4, "B"));

        Document result = new HeadingLevelTransformer(-3, 2, 6).transformDocument(doc);

        assertEquals(2, level(result, 0));
        assertEquals(2, level(result, 1));
    }

    @Test
    void rejectsInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new HeadingLevelTransformer(0, 4, 2));
        assertThrows(IllegalArgumentException.class, () -> new HeadingLevelTransformer(0, 0, 6));
    }
}
