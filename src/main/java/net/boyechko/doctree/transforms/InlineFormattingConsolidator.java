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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Emphasis;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs inline formatting that a converter split into fragments, such as {@code **a** **b**}
 * produced from separate text spans. Within paragraphs, headings and table cells it
 *
 * <ol>
 *   <li>merges adjacent {@link Strong} (or adjacent {@link Emphasis}) nodes into one;
 *   <li>moves leading and trailing whitespace out of the formatting, turning whitespace-only
 *       formatting into plain text and dropping empty formatting;
 *   <li>joins adjacent {@link Text} nodes.
 * </ol>
 *
 * <p>Only formatting that holds nothing but text is merged or trimmed; nested formatting, code
 * spans and links inside it are left as they are. Merging never crosses a link boundary, but
 * link content is consolidated on its own.
 */
public class InlineFormattingConsolidator extends NodeTransformer {
    private static final Logger logger =
            LoggerFactory.getLogger(InlineFormattingConsolidator.class);

    @Override
    public Node visitParagraph(Paragraph node) {
        return new Paragraph(consolidate(node.content()), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitHeading(Heading node) {
        return new Heading(
                node.level(), consolidate(node.content()), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitTableCell(TableCell node) {
        return new TableCell(
                consolidate(node.content()),
                node.colspan(),
                node.rowspan(),
                node.alignment(),
                node.metadata(),
                node.sourceLocation());
    }

    /** Consolidates one run of inline siblings, children first. */
    public List<Inline> consolidate(List<Inline> nodes) {
        List<Inline> processed = new ArrayList<>(nodes.size());
        for (Inline node : nodes) {
            if (isFormatting(node)) {
                processed.add(rebuild(node, consolidate(formattedContent(node))));
            } else if (node instanceof Link link) {
                processed.add(
                        new Link(
                                link.url(),
                                consolidate(link.content()),
                                link.title(),
                                link.metadata(),
                                link.sourceLocation()));
            } else {
                processed.add(node);
            }
        }
        List<Inline> result = joinText(moveWhitespaceOut(mergeAdjacent(processed)));
        if (result.size() != nodes.size()) {
            logger.debug("Consolidated {} inline nodes into {}", nodes.size(), result.size());
        }
        return result;
    }

    private static List<Inline> mergeAdjacent(List<Inline> nodes) {
        List<Inline> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            Inline current = nodes.get(i);
            if (!isPlain(current)) {
                out.add(current);
                i++;
                continue;
            }
            StringBuilder text = new StringBuilder(plainText(current));
            int j = i + 1;
            while (j < nodes.size()
                    && nodes.get(j).getClass() == current.getClass()
                    && isPlain(nodes.get(j))) {
                text.append(plainText(nodes.get(j)));
                j++;
            }
            if (j == i + 1) {
                out.add(current);
            } else if (text.length() > 0) {
                out.add(withText(current, text.toString()));
            }
            i = j;
        }
        return out;
    }

    private static List<Inline> moveWhitespaceOut(List<Inline> nodes) {
        List<Inline> out = new ArrayList<>(nodes.size());
        for (Inline node : nodes) {
            if (!isPlain(node)) {
                out.add(node);
                continue;
            }
            String inner = plainText(node);
            if (inner.isEmpty()) {
                continue;
            }
            if (inner.isBlank()) {
                out.add(new Text(inner, node.metadata(), node.sourceLocation()));
                continue;
            }
            int start = inner.length() - inner.stripLeading().length();
            int end = inner.stripTrailing().length();
            if (start == 0 && end == inner.length()) {
                out.add(node);
                continue;
            }
            if (start > 0) {
                String leading = inner.substring(0, start);
                out.add(new Text(leading, node.metadata(), node.sourceLocation()));
            }
            out.add(withText(node, inner.substring(start, end)));
            if (end < inner.length()) {
                out.add(new Text(inner.substring(end), node.metadata(), node.sourceLocation()));
            }
        }
        return out;
    }

    private static List<Inline> joinText(List<Inline> nodes) {
        List<Inline> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            if (!(nodes.get(i) instanceof Text first)) {
                out.add(nodes.get(i));
                i++;
                continue;
            }
            StringBuilder text = new StringBuilder(first.content());
            int j = i + 1;
            while (j < nodes.size() && nodes.get(j) instanceof Text next) {
                text.append(next.content());
                j++;
            }
            if (j == i + 1) {
                if (!first.content().isEmpty()) {
                    out.add(first);
                }
            } else if (text.length() > 0) {
                out.add(new Text(text.toString(), first.metadata(), first.sourceLocation()));
            }
            i = j;
        }
        return out;
    }

    private static boolean isFormatting(Inline node) {
        return node instanceof Strong || node instanceof Emphasis;
    }

    /** Formatting whose children are all {@link Text}; only these are merged or trimmed. */
    private static boolean isPlain(Inline node) {
        return isFormatting(node)
                && formattedContent(node).stream().allMatch(child -> child instanceof Text);
    }

    private static List<Inline> formattedContent(Inline node) {
        return node instanceof Strong strong ? strong.content() : ((Emphasis) node).content();
    }

    private static String plainText(Inline node) {
        StringBuilder sb = new StringBuilder();
        for (Inline child : formattedContent(node)) {
            sb.append(((Text) child).content());
        }
        return sb.toString();
    }

    private static Inline rebuild(Inline like, List<Inline> content) {
        if (like instanceof Strong strong) {
            return new Strong(content, strong.metadata(), strong.sourceLocation());
        }
        Emphasis emphasis = (Emphasis) like;
        return new Emphasis(content, emphasis.metadata(), emphasis.sourceLocation());
    }

    private static Inline withText(Inline like, String text) {
        return rebuild(like, List.of(new Text(text, Map.of(), like.sourceLocation())));
    }
}
