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
package net.boyechko.doctree.node;

import java.util.List;
import java.util.Map;

/**
 * Table cell with inline content. Spans below 1 are accepted here so malformed input survives a
 * round trip; {@code ValidationVisitor} reports them.
 */
public record TableCell(
        List<Inline> content,
        int colspan,
        int rowspan,
        Alignment alignment,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Node {

    public TableCell {
        content = Nodes.copyOf(content, Inline.class, "TableCell");
        alignment = alignment != null ? alignment : Alignment.NONE;
        metadata = Nodes.copyMetadata(metadata);
    }

    public TableCell(List<Inline> content) {
        this(content, 1, 1, Alignment.NONE, Map.of(), null);
    }

    public static TableCell text(String text) {
        return new TableCell(List.of(new Text(text)));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableCell(this);
    }
}
