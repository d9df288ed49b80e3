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
package net.boyechko.doctree.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Paragraph;
import org.junit.jupiter.api.Test;

class DocumentsTest {

    private static Document first() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("author", "Alice");
        meta.put("version", "1.0");
        meta.put("tags", List.of("python", "ast"));
        return new Document(List.of(Paragraph.text("a")), meta, null);
    }

    private static Document second() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("version", "2.0");
        meta.put("date", "2025-01-01");
        meta.put("tags", List.of("markdown"));
        return new Document(List.of(Paragraph.text("b"), Paragraph.text("c")), meta, null);
    }

    @Test
    void mergeConcatenatesChildrenAndLaterMetadataWins() {
        Document merged = Documents.merge(List.of(first(), second()));

        assertEquals(
                List.of(Paragraph.text("a"), Paragraph.text("b"), Paragraph.text("c")),
                merged.children());
        assertEquals("Alice", merged.metadata().get("author"));
        assertEquals("2.0", merged.metadata().get("version"));
        assertEquals("2025-01-01", merged.metadata().get("date"));
        assertEquals(List.of("markdown"), merged.metadata().get("tags"));
    }

    @Test
    void firstWriteWinsKeepsEarlierValues() {
        Document merged =
                Documents.merge(List.of(first(), second()), MetadataMerger.FIRST_WRITE_WINS);

        assertEquals("1.0", merged.metadata().get("version"));
        assertEquals("2025-01-01", merged.metadata().get("date"));
        assertEquals(List.of("python", "ast"), merged.metadata().get("tags"));
    }

    @Test
    void mergeListsConcatenatesListValues() {
        Document merged = Documents.merge(List.of(first(), second()), MetadataMerger.MERGE_LISTS);

        assertEquals(List.of("python", "ast", "markdown"), merged.metadata().get("tags"));
        assertEquals("2.0", merged.metadata().get("version"));
    }

    @Test
    void customMergerSeesEveryDocumentInOrder() {
        MetadataMerger countDocs =
                (existing, incoming) ->
                        Map.of("docs", (Integer) existing.getOrDefault("docs", 0) + 1);

        Document merged = Documents.merge(List.of(first(), second(), first()), countDocs);

        assertEquals(Map.of("docs", 3), merged.metadata());
        assertEquals(4, merged.children().size());
    }

    @Test
    void mergingNothingGivesAnEmptyDocument() {
        Document merged = Documents.merge(List.of());

        assertTrue(merged.children().isEmpty());
        assertTrue(merged.metadata().isEmpty());
        assertThrows(
                IllegalArgumentException.class, () -> Documents.merge(List.of(first()), null));
    }
}
