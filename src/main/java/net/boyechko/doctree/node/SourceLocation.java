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

import java.util.Map;

/**
 * Where a node originated in its source document.
 *
 * @param format source format tag, e.g. {@code pdf}, {@code html}, {@code docx}
 * @param page page number for paginated formats, or null
 * @param line line number for text formats, or null
 * @param column column number, or null
 * @param elementId source element identifier (an HTML id, a PDF object reference), or null
 * @param metadata additional format-specific location details
 */
public record SourceLocation(
        String format,
        Integer page,
        Integer line,
        Integer column,
        String elementId,
        Map<String, Object> metadata) {

    public SourceLocation {
        if (format == null || format.isBlank()) {
            throw new StructuralException("SourceLocation format must be non-empty");
        }
        metadata = Nodes.copyMetadata(metadata);
    }

    public SourceLocation(String format) {
        this(format, null, null, null, null, Map.of());
    }

    public static SourceLocation atPage(String format, int page) {
        return new SourceLocation(format, page, null, null, null, Map.of());
    }

    public static SourceLocation atLine(String format, int line, Integer column) {
        return new SourceLocation(format, null, line, column, null, Map.of());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(format);
        if (page != null) sb.append(" p.").append(page);
        if (line != null) {
            sb.append(" l.").append(line);
            if (column != null) sb.append(':').append(column);
        }
        if (elementId != null) sb.append(" #").append(elementId);
        return sb.toString();
    }
}
