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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public record Strikethrough(
        List<Inline> content, Map<String, Object> metadata, SourceLocation sourceLocation)
        implements Inline {

    public Strikethrough {
        content = Nodes.copyOf(content, Inline.class, "Strikethrough");
        metadata = Nodes.copyMetadata(metadata);
    }

    public Strikethrough(List<Inline> content) {
        this(content, Map.of(), null);
    }

    public static Strikethrough of(Inline... content) {
        return new Strikethrough(Arrays.asList(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStrikethrough(this);
    }
}
