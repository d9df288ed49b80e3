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
package net.boyechko.doctree.split;

/** Splitting strategies named by a split spec string. */
public enum SplitStrategy {
    HEADING("heading"),
    LENGTH("length"),
    PARTS("parts"),
    DELIMITER("delimiter"),
    AUTO("auto"),
    BREAK("break"),
    /** Page boundaries, only known to format parsers. */
    PAGE("page"),
    /** Chapter boundaries, only known to format parsers. */
    CHAPTER("chapter");

    private final String key;

    SplitStrategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
