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

/** Category of a structural finding reported by validation. */
public enum IssueType {
    // Identifiers and references
    EMPTY_FOOTNOTE_IDENTIFIER("footnotes without an identifier"),

    // Block structure
    HEADING_LEVEL_OUT_OF_RANGE("headings with a level outside 1-6"),
    CODE_FENCE_INVALID("code blocks with an invalid fence"),
    LIST_EMPTY("lists without items"),
    LIST_START_NEGATIVE("ordered lists starting below zero"),
    COMMENT_EMPTY("empty comments"),
    MATH_NOTATION_UNKNOWN("math with an unknown notation"),

    // Tables
    TABLE_SPAN_INVALID("table cells with a span below 1"),
    TABLE_COLUMN_MISMATCH("table rows with inconsistent column counts"),
    TABLE_ALIGNMENT_MISMATCH("tables whose alignments do not match their columns"),

    // Content safety
    RAW_HTML_NOT_ALLOWED("raw HTML where it is not allowed"),
    URL_EMPTY("links or images without a URL"),
    URL_DANGEROUS_SCHEME("links or images with a dangerous URL scheme");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
