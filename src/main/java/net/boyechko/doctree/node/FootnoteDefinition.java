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

import java.util.List;
import java.util.Map;

/**
 * Body of a footnote. An empty identifier is accepted so malformed input can round-trip; the
 * validator flags it.
 */
public record FootnoteDefinition(
        String identifier,
        List<Block> content,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    public FootnoteDefinition {
        identifier = identifier != null ? identifier : "";
        content = Nodes.copyOf(content, Block.class, "FootnoteDefinition");
        metadata = Nodes.copyMetadata(metadata);
    }

    public FootnoteDefinition(String identifier, List<Block> content) {
        this(identifier, content, Map.of(), null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFootnoteDefinition(this);
    }
}
