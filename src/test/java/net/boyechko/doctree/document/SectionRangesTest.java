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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SectionRangesTest {

    @Test
    void combinesRangesAndSingleNumbers() {
        assertEquals(List.of(0, 1, 2, 4), SectionRanges.parse("1-3,5", 10));
        assertEquals(List.of(0, 2), SectionRanges.parse(" 3 , 1,3 ", 5));
    }

    @Test
    void openEndedRangesRunToTheEdges() {
        assertEquals(List.of(7, 8, 9), SectionRanges.parse("8-", 10));
        assertEquals(List.of(0, 1), SectionRanges.parse("-2", 5));
    }

    @Test
    void reversedRangeIsSwapped() {
        assertEquals(List.of(4, 5, 6, 7, 8, 9), SectionRanges.parse("10-5", 10));
    }

    @Test
    void numbersOutsideTheDocumentAreDropped() {
        assertEquals(List.of(1), SectionRanges.parse("0,2,6", 5));
        assertEquals(List.of(3, 4), SectionRanges.parse("4-99", 5));
        assertTrue(SectionRanges.parse(" , ", 5).isEmpty());
    }

    @ParameterizedTest(name = "\"{0}\" rejected")
    @ValueSource(strings = {"one", "1-x", "a-3", "2,,b"})
    void nonNumericBoundsAreRejected(String ranges) {
        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> SectionRanges.parse(ranges, 5));
        assertTrue(e.getMessage().contains("Invalid section number"), e.getMessage());
    }
}
