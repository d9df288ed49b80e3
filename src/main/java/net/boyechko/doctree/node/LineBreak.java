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

/** Hard line break, or a soft one when {@code soft} is set. */
public record LineBreak(boolean soft, Map<String, Object> metadata, SourceLocation sourceLocation)
        implements Inline {

    public LineBreak {
        metadata = Nodes.copyMetadata(metadata);
    }

    public LineBreak(boolean soft) {
        this(soft, Map.of(), null);
    }

    public LineBreak() {
        this(false);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLineBreak(this);
    }
}
