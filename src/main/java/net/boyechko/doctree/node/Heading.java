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

/** Heading of level 1 (most important) to 6 with inline content. */
public record Heading(
        int level,
        List<Inline> content,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;

    public Heading {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new StructuralException("Heading level must be 1-6, got " + level);
        }
        content = Nodes.copyOf(content, Inline.class, "Heading");
        metadata = Nodes.copyMetadata(metadata);
    }

    public Heading(int level, List<Inline> content) {
        this(level, content, Map.of(), null);
    }

    public static Heading of(int level, Inline... content) {
        return new Heading(level, Arrays.asList(content));
    }

    public static Heading text(int level, String text) {
        return new Heading(level, List.of(new Text(text)));
    }

    public static boolean isValidLevel(int level) {
        return level >= MIN_LEVEL && level <= MAX_LEVEL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
