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
package net.boyechko.doctree.document;

/** Identifies one section of a document, by heading text or by position. */
public sealed interface SectionTarget {

    /** Heading text match, ignoring surrounding whitespace. */
    record ByHeading(String text, boolean caseSensitive) implements SectionTarget {
        public ByHeading {
            if (text == null) {
                throw new IllegalArgumentException("Section heading text must not be null");
            }
        }

        @Override
        public String toString() {
            return "heading '" + text + "'";
        }
    }

    /** 0-based index into the document's sections. */
    record ByIndex(int index) implements SectionTarget {
        @Override
        public String toString() {
            return "section index " + index;
        }
    }

    static SectionTarget heading(String text) {
        return new ByHeading(text, false);
    }

    static SectionTarget heading(String text, boolean caseSensitive) {
        return new ByHeading(text, caseSensitive);
    }

    static SectionTarget index(int index) {
        return new ByIndex(index);
    }
}
