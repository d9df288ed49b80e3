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

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.validation.ValidationVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the URL of every link and image. Unless disabled, a rewritten URL that uses a
 * script-capable scheme aborts the transform.
 */
public class LinkRewriter extends NodeTransformer {
    private static final Logger logger = LoggerFactory.getLogger(LinkRewriter.class);

    private final UnaryOperator<String> urlMapper;
    private final boolean validateUrls;

    public LinkRewriter(UnaryOperator<String> urlMapper) {
        this(urlMapper, true);
    }

    public LinkRewriter(UnaryOperator<String> urlMapper, boolean validateUrls) {
        this.urlMapper = urlMapper;
        this.validateUrls = validateUrls;
    }

    /** Rewriter that applies a regular-expression replacement to each URL. */
    public static LinkRewriter replacing(String regex, String replacement) {
        Pattern pattern = Pattern.compile(regex);
        return new LinkRewriter(url -> pattern.matcher(url).replaceAll(replacement));
    }

    private String rewrite(String url, String context) {
        String rewritten = urlMapper.apply(url);
        if (rewritten == null) {
            throw new IllegalArgumentException(context + " URL mapper returned null for " + url);
        }
        if (validateUrls) {
            String scheme = ValidationVisitor.findDangerousScheme(rewritten);
            if (scheme != null) {
                throw new IllegalArgumentException(
                        context + " URL rewritten to dangerous scheme '" + scheme + "': " + url);
            }
        }
        if (!rewritten.equals(url)) {
            logger.debug("Rewrote {} URL {} -> {}", context, url, rewritten);
        }
        return rewritten;
    }

    @Override
    public Node visitLink(Link node) {
        return new Link(
                rewrite(node.url(), "Link"),
                transformAll(node.content(), Inline.class, "Link"),
                node.title(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitImage(Image node) {
        return node.withUrl(rewrite(node.url(), "Image"));
    }
}
