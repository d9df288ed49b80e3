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
import java.util.List;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.visitors.TextExtractor;

/**
 * A heading and the blocks that belong to it, as a view over a document's children. Sections are
 * derived on demand and never stored in the tree.
 *
 * @param heading the heading, or null for the preamble before the first heading
 * @param level heading level, or 0 for the preamble
 * @param content blocks after the heading, up to {@code endIndex}
 * @param startIndex index of the heading (or first preamble block) in the document's children
 * @param endIndex exclusive end index in the document's children
 */
public record Section(
        Heading heading, int level, List<Block> content, int startIndex, int endIndex) {

    public Section {
        content = List.copyOf(content);
    }

    public boolean isPreamble() {
        return heading == null;
    }

    /** Heading followed by content, as they appear in the document. */
    public List<Block> blocks() {
        if (heading == null) {
            return content;
        }
        List<Block> out = new ArrayList<>(content.size() + 1);
        out.add(heading);
        out.addAll(content);
        return out;
    }

    /** Plain text of the heading, or the empty string for the preamble. */
    public String headingText() {
        return heading != null ? TextExtractor.extract(heading, "") : "";
    }
}
