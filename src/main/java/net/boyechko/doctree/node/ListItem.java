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

/** One list entry holding block content; task-list items also carry a checkbox state. */
public record ListItem(
        List<Block> children,
        TaskStatus taskStatus,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Node {

    public ListItem {
        children = Nodes.copyOf(children, Block.class, "ListItem");
        taskStatus = taskStatus != null ? taskStatus : TaskStatus.NONE;
        metadata = Nodes.copyMetadata(metadata);
    }

    public ListItem(List<Block> children) {
        this(children, TaskStatus.NONE, Map.of(), null);
    }

    public static ListItem of(Block... children) {
        return new ListItem(Arrays.asList(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListItem(this);
    }
}
