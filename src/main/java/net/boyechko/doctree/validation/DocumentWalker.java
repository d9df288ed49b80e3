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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.doctree.issues.IssueList;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a node tree once in document order, invoking multiple visitors at each node. Exceptions
 * thrown by a visitor abort the walk and reach the caller unchanged.
 */
public class DocumentWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentWalker.class);

    private final List<TreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public DocumentWalker addVisitor(TreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(Node root) {
        this.globalIndex = 0;

        for (TreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkNode(root, null, "/", 0);

        IssueList allIssues = new IssueList();
        for (TreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        logger.debug(
                "Walked {} nodes with {} visitors, {} issues",
                globalIndex,
                visitors.size(),
                allIssues.size());
        return allIssues;
    }

    private void walkNode(Node node, String parentKind, String parentPath, int depth) {
        globalIndex++;

        String kind = node.kind();
        List<Node> children = Nodes.children(node);
        WalkContext ctx =
                new WalkContext(
                        node,
                        parentPath + kind + "[" + globalIndex + "]",
                        kind,
                        parentKind,
                        children,
                        depth,
                        globalIndex);

        // Every visitor sees the node even if an earlier one asked to skip its children
        boolean continueToChildren = true;
        for (TreeVisitor visitor : visitors) {
            if (!visitor.enterNode(ctx)) {
                continueToChildren = false;
            }
        }

        if (continueToChildren) {
            for (Node child : children) {
                walkNode(child, kind, ctx.path() + ".", depth + 1);
            }
        }

        for (TreeVisitor visitor : visitors) {
            visitor.leaveNode(ctx);
        }
    }
}
