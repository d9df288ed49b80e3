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
 * Root of the tree: an ordered sequence of block nodes plus document-level metadata (title,
 * author and the like). Inline nodes may never appear directly under a document; this is checked
 * at construction even for lists that slipped past the type system.
 */
public record Document(
        List<Block> children, Map<String, Object> metadata, SourceLocation sourceLocation)
        implements Node {

    public Document {
        children = Nodes.copyOf(children, Block.class, "Document");
        metadata = Nodes.copyMetadata(metadata);
    }

    public Document(List<Block> children) {
        this(children, Map.of(), null);
    }

    public Document() {
        this(List.of(), Map.of(), null);
    }

    public static Document of(Block... children) {
        return new Document(Arrays.asList(children));
    }

    /**
     * Builds a document from nodes of unknown kind, as produced by parsers and deserializers.
     *
     * @throws StructuralException if any node is not a block
     */
    public static Document fromNodes(
            List<? extends Node> nodes, Map<String, Object> metadata, SourceLocation location) {
        return new Document(Nodes.copyOf(nodes, Block.class, "Document"), metadata, location);
    }

    /** Returns a document with the same metadata and source location but new children. */
    public Document withChildren(List<Block> newChildren) {
        return new Document(newChildren, metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }
}
