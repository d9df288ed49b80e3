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
package net.boyechko.doctree.split;

import java.util.LinkedHashMap;
import java.util.Map;
import net.boyechko.doctree.document.Slugs;
import net.boyechko.doctree.node.Document;

/** One self-contained part produced by {@link DocumentSplitter}. */
public final class SplitResult {
    public static final String PREAMBLE_TITLE = "Preamble";

    private final Document document;
    private final int index;
    private final String title;
    private final int wordCount;
    private final Map<String, Object> metadata;

    public SplitResult(Document document, int index, String title, int wordCount) {
        this(document, index, title, wordCount, Map.of());
    }

    public SplitResult(
            Document document,
            int index,
            String title,
            int wordCount,
            Map<String, Object> metadata) {
        this.document = document;
        this.index = index;
        this.title = title;
        this.wordCount = wordCount;
        this.metadata = new LinkedHashMap<>(metadata);
    }

    public Document document() {
        return document;
    }

    /** 1-based position of this part. */
    public int index() {
        return index;
    }

    /** Part title, or null when the part is the whole document and no title applies. */
    public String title() {
        return title;
    }

    public int wordCount() {
        return wordCount;
    }

    /** Splitting annotations such as {@code strategy} and {@code reason}; mutable. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Filesystem-safe slug of the title; empty when there is no title. */
    public String getFilenameSlug() {
        return Slugs.slugify(title);
    }

    @Override
    public String toString() {
        return "SplitResult[" + index + ", " + title + ", " + wordCount + " words]";
    }
}
