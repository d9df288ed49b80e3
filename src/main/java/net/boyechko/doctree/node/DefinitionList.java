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

/** Sequence of terms, each followed by one or more descriptions. */
public record DefinitionList(
        List<DefinitionList.Item> items,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    /** A term and its descriptions. Not a node in its own right. */
    public record Item(DefinitionTerm term, List<DefinitionDescription> descriptions) {
        public Item {
            if (term == null) {
                throw new StructuralException("DefinitionList item term must not be null");
            }
            descriptions =
                    Nodes.copyOf(descriptions, DefinitionDescription.class, "DefinitionList item");
        }
    }

    public DefinitionList {
        items = items != null ? List.copyOf(items) : List.of();
        metadata = Nodes.copyMetadata(metadata);
    }

    public DefinitionList(List<Item> items) {
        this(items, Map.of(), null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDefinitionList(this);
    }
}
