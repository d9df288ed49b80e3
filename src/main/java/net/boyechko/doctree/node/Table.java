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
 * Table with an optional header row and positional column alignments.
 *
 * @param header header row, or null for a headerless table
 * @param rows data rows, excluding the header
 * @param alignments one entry per column
 * @param caption table caption, or null
 */
public record Table(
        TableRow header,
        List<TableRow> rows,
        List<Alignment> alignments,
        String caption,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    public Table {
        rows = Nodes.copyOf(rows, TableRow.class, "Table");
        alignments =
                alignments != null
                        ? alignments.stream().map(a -> a != null ? a : Alignment.NONE).toList()
                        : List.of();
        metadata = Nodes.copyMetadata(metadata);
    }

    public Table(TableRow header, List<TableRow> rows) {
        this(header, rows, List.of(), null, Map.of(), null);
    }

    /** Number of columns, taken from the header row or else the first data row. */
    public int columnCount() {
        if (header != null) return header.cells().size();
        return rows.isEmpty() ? 0 : rows.get(0).cells().size();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
