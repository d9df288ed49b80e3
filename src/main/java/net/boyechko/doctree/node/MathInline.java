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

/** Inline math; see {@link MathBlock} for the notation fields. */
public record MathInline(
        String content,
        String notation,
        Map<String, String> representations,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Inline {

    public MathInline {
        content = Nodes.requireText(content, "MathInline", "content");
        notation = notation != null ? notation : "latex";
        representations = representations != null ? Map.copyOf(representations) : Map.of();
        metadata = Nodes.copyMetadata(metadata);
    }

    public MathInline(String content) {
        this(content, "latex", Map.of(), Map.of(), null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMathInline(this);
    }
}
