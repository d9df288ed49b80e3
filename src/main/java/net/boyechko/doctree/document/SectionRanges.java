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

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Parser for 1-based section range lists such as {@code 1-3}, {@code 5}, {@code 8-} or {@code
 * 1-3,5,10-}.
 */
public final class SectionRanges {

    private SectionRanges() {}

    /**
     * Parses {@code ranges} against a document with {@code totalSections} sections.
     *
     * <p>A missing start means the first section and a missing end means the last. Reversed ranges
     * such as {@code 5-3} are read as {@code 3-5}. Numbers outside {@code 1..totalSections} are
     * dropped, so the result may be empty.
     *
     * @return sorted, distinct 0-based section indexes
     * @throws IllegalArgumentException if a range bound is not a number
     */
    public static List<Integer> parse(String ranges, int totalSections) {
        SortedSet<Integer> indexes = new TreeSet<>();
        for (String raw : ranges.split(",")) {
            String part = raw.strip();
            if (part.isEmpty()) {
                continue;
            }
            int dash = part.indexOf('-');
            if (dash < 0) {
                addIfInRange(indexes, number(part, part) - 1, totalSections);
                continue;
            }
            String from = part.substring(0, dash).strip();
            String to = part.substring(dash + 1).strip();
            int start = from.isEmpty() ? 0 : number(from, part) - 1;
            int end = to.isEmpty() ? totalSections - 1 : number(to, part) - 1;
            if (start > end) {
                int swap = start;
                start = end;
                end = swap;
            }
            for (int i = start; i <= end; i++) {
                addIfInRange(indexes, i, totalSections);
            }
        }
        return List.copyOf(indexes);
    }

    private static void addIfInRange(SortedSet<Integer> indexes, int index, int total) {
        if (index >= 0 && index < total) {
            indexes.add(index);
        }
    }

    private static int number(String token, String part) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid section number '" + token + "' in range '" + part + "'", e);
        }
    }
}
