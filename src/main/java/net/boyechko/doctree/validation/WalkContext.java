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
package net.boyechko.doctree.validation;

import java.util.List;
import net.boyechko.doctree.node.Node;

/**
 * Immutable context passed to visitors during a document walk. Contains pre-computed information
 * about the current node and its position in the tree.
 */
public record WalkContext(
        Node node,
        String path,
        String kind,
        String parentKind,
        List<Node> children,
        /** Depth in the tree (0 = the root). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    public boolean isKind(String kindName) {
        return kindName.equals(kind);
    }

    public boolean hasAnyKind(String... kindNames) {
        for (String k : kindNames) {
            if (k.equals(kind)) return true;
        }
        return false;
    }

    public boolean isRoot() {
        return depth == 0;
    }
}
