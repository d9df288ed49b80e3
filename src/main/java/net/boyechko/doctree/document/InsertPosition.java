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

/** Where {@link Sections#insertIntoSection} places new blocks. */
public enum InsertPosition {
    /** Before the first content block; same as {@link #AFTER_HEADING}. */
    START,
    /** After the last content block, including any sub-sections. */
    END,
    AFTER_HEADING
}
