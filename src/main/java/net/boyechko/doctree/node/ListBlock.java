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

/**
 * Ordered (numbered) or unordered (bulleted) list.
 *
 * @param start first number of an ordered list
 * @param tight whether the source had no blank lines between items
 */
public record ListBlock(
        boolean ordered,
        List<ListItem> items,
        int start,
        boolean tight,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    public ListBlock {
        items = Nodes.copyOf(items, ListItem.class, "List");
        metadata = Nodes.copyMetadata(metadata);
    }

    public ListBlock(boolean ordered, List<ListItem> items) {
        this(ordered, items, 1, true, Map.of(), null);
    }

    public static ListBlock bullets(ListItem... items) {
        return new ListBlock(false, Arrays.asList(items));
    }

    public static ListBlock numbered(ListItem... items) {
        return new ListBlock(true, Arrays.asList(items));
    }

    @Override
    public String kind() {
        return "List";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
