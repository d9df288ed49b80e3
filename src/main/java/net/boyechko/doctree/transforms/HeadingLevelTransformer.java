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
package net.boyechko.doctree.transforms;

import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.Node;

/** Shifts every heading level by a fixed offset, clamped to a level range. */
public class HeadingLevelTransformer extends NodeTransformer {
    private final int offset;
    private final int minLevel;
    private final int maxLevel;

    public HeadingLevelTransformer(int offset) {
        this(offset, Heading.MIN_LEVEL, Heading.MAX_LEVEL);
    }

    public HeadingLevelTransformer(int offset, int minLevel, int maxLevel) {
        if (!Heading.isValidLevel(minLevel)
                || !Heading.isValidLevel(maxLevel)
                || minLevel > maxLevel) {
            throw new IllegalArgumentException(
                    "Invalid heading level range " + minLevel + ".." + maxLevel);
        }
        this.offset = offset;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    @Override
    public Node visitHeading(Heading node) {
        int level = Math.max(minLevel, Math.min(maxLevel, node.level() + offset));
        return new Heading(
                level,
                transformAll(node.content(), Inline.class, "Heading"),
                node.metadata(),
                node.sourceLocation());
    }
}
