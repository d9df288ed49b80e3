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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Whole-document operations. */
public final class Documents {
    private static final Logger logger = LoggerFactory.getLogger(Documents.class);

    private Documents() {}

    /** Merges with {@link MetadataMerger#LAST_WRITE_WINS}. */
    public static Document merge(List<Document> docs) {
        return merge(docs, MetadataMerger.LAST_WRITE_WINS);
    }

    /**
     * Concatenates the children of {@code docs} in order. Metadata is folded from an empty map
     * through {@code merger}, one document at a time. The result has no source location.
     */
    public static Document merge(List<Document> docs, MetadataMerger merger) {
        if (merger == null) {
            throw new IllegalArgumentException("Metadata merger must not be null");
        }
        List<Block> children = new ArrayList<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Document doc : docs) {
            children.addAll(doc.children());
            metadata = merger.merge(metadata, doc.metadata());
        }
        logger.debug(
                "Merged {} documents into {} blocks and {} metadata keys",
                docs.size(),
                children.size(),
                metadata.size());
        return new Document(children, metadata, null);
    }
}
