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
package net.boyechko.doctree.transforms;

import java.util.function.Predicate;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Node;

/**
 * Deletes every node matching a predicate, together with its subtree. The document root is
 * always kept.
 */
public class NodeFilter extends NodeTransformer {
    private final Predicate<? super Node> remove;

    public NodeFilter(Predicate<? super Node> remove) {
        this.remove = remove;
    }

    /** Filter that deletes every node of the given kind. */
    public static NodeFilter removing(Class<? extends Node> type) {
        return new NodeFilter(type::isInstance);
    }

    @Override
    public Node transform(Node node) {
        if (!(node instanceof Document) && remove.test(node)) {
            return null;
        }
        return super.transform(node);
    }
}
