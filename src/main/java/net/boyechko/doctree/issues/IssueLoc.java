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
package net.boyechko.doctree.issues;

import net.boyechko.doctree.node.SourceLocation;

/** Where in a document tree a finding was made. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    /**
     * @param path walk path of the node, such as {@code /Table[4].TableRow[5]}
     * @param source source location recorded by the parser, or null
     */
    record AtNode(String path, SourceLocation source) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(String path, SourceLocation source) {
        return new AtNode(path, source);
    }

    /** Returns the walk path if available, null otherwise. */
    default String path() {
        return this instanceof AtNode at ? at.path() : null;
    }

    /** Returns the source page if the parser recorded one, null otherwise. */
    default Integer page() {
        if (this instanceof AtNode at && at.source() != null) {
            return at.source().page();
        }
        return null;
    }
}
