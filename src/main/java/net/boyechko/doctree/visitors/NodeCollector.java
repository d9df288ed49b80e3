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
package net.boyechko.doctree.visitors;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.validation.DocumentWalker;
import net.boyechko.doctree.validation.TreeVisitor;
import net.boyechko.doctree.validation.WalkContext;

/** Collects the nodes matching a predicate, in document order. */
public class NodeCollector implements TreeVisitor {
    private final Predicate<? super Node> predicate;
    private final List<Node> collected = new ArrayList<>();

    public NodeCollector(Predicate<? super Node> predicate) {
        this.predicate = predicate;
    }

    /** Returns every node of type {@code type} under and including {@code root}. */
    public static <T extends Node> List<T> collect(Node root, Class<T> type) {
        NodeCollector collector = new NodeCollector(type::isInstance);
        new DocumentWalker().addVisitor(collector).walk(root);
        return collector.getCollected().stream().map(type::cast).toList();
    }

    public static List<Node> collect(Node root, Predicate<? super Node> predicate) {
        NodeCollector collector = new NodeCollector(predicate);
        new DocumentWalker().addVisitor(collector).walk(root);
        return collector.getCollected();
    }

    @Override
    public String name() {
        return "Node Collector";
    }

    @Override
    public boolean enterNode(WalkContext ctx) {
        if (predicate.test(ctx.node())) {
            collected.add(ctx.node());
        }
        return true;
    }

    public List<Node> getCollected() {
        return List.copyOf(collected);
    }
}
