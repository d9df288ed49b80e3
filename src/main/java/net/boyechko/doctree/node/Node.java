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

/**
 * A single element of the document tree. The set of node kinds is closed: every kind is either a
 * {@link Block}, an {@link Inline}, one of the structural parts that only live inside their
 * container ({@link ListItem}, {@link TableRow}, {@link TableCell}, {@link DefinitionTerm}, {@link
 * DefinitionDescription}), or the {@link Document} root.
 *
 * <p>Nodes are immutable once built. Rewriting happens by constructing new nodes, usually through
 * a {@code NodeTransformer}.
 */
public sealed interface Node
        permits Block,
                Inline,
                Document,
                ListItem,
                TableRow,
                TableCell,
                DefinitionTerm,
                DefinitionDescription {

    /** Dispatches to the {@code visitX} method of {@code visitor} matching this node's kind. */
    <R> R accept(NodeVisitor<R> visitor);

    /** Free-form, format-specific annotations. Never null. */
    Map<String, Object> metadata();

    /** Where the node came from, or null when the producer did not record it. */
    SourceLocation sourceLocation();

    /** Kind name used in paths, dumps and the serialized form. */
    default String kind() {
        return getClass().getSimpleName();
    }
}
