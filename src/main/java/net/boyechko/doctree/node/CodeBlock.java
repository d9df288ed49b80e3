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

import java.util.Map;

/**
 * Fenced or indented code. The content is literal text, never parsed further.
 *
 * @param language language hint for highlighting, or null
 * @param fenceChar fence character used by the source ({@code `} or {@code ~})
 * @param fenceLength number of fence characters
 */
public record CodeBlock(
        String content,
        String language,
        String fenceChar,
        int fenceLength,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Block {

    public CodeBlock {
        content = Nodes.requireText(content, "CodeBlock", "content");
        fenceChar = fenceChar != null ? fenceChar : "`";
        metadata = Nodes.copyMetadata(metadata);
    }

    public CodeBlock(String content, String language) {
        this(content, language, "`", 3, Map.of(), null);
    }

    public CodeBlock(String content) {
        this(content, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
