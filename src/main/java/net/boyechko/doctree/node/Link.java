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
 * Hyperlink. The URL is kept verbatim; {@code ValidationVisitor} rejects empty URLs and script
 * schemes.
 */
public record Link(
        String url,
        List<Inline> content,
        String title,
        Map<String, Object> metadata,
        SourceLocation sourceLocation)
        implements Inline {

    public Link {
        url = Nodes.requireText(url, "Link", "url");
        content = Nodes.copyOf(content, Inline.class, "Link");
        metadata = Nodes.copyMetadata(metadata);
    }

    public Link(String url, List<Inline> content) {
        this(url, content, null, Map.of(), null);
    }

    public static Link text(String url, String text) {
        return new Link(url, List.of(new Text(text)));
    }

    public Link withUrl(String newUrl) {
        return new Link(newUrl, content, title, metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLink(this);
    }
}
