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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Static helpers shared by every node kind. */
public final class Nodes {
    private static final DirectChildren DIRECT_CHILDREN = new DirectChildren();

    private Nodes() {}

    /**
     * Returns the direct children of {@code node} in document order. Leaves return an empty list;
     * a table yields its header row (if any) followed by its data rows; a definition list yields
     * each term followed by its descriptions.
     */
    public static List<Node> children(Node node) {
        return node.accept(DIRECT_CHILDREN);
    }

    public static boolean isBlock(Node node) {
        return node instanceof Block;
    }

    public static boolean isInline(Node node) {
        return node instanceof Inline;
    }

    /**
     * Copies {@code items} into an unmodifiable list, checking that every element is a non-null
     * instance of {@code type}. The runtime check catches heap pollution from raw or unchecked
     * lists, which the type system alone cannot.
     */
    static <T> List<T> copyOf(List<?> items, Class<T> type, String owner) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item == null) {
                throw new StructuralException(owner + " child " + i + " is null");
            }
            if (!type.isInstance(item)) {
                throw new StructuralException(
                        owner
                                + " can only contain "
                                + describe(type)
                                + " nodes, but child "
                                + i
                                + " is "
                                + item.getClass().getSimpleName());
            }
            copy.add(type.cast(item));
        }
        return Collections.unmodifiableList(copy);
    }

    static Map<String, Object> copyMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static String requireText(String value, String owner, String field) {
        if (value == null) {
            throw new StructuralException(owner + " " + field + " must not be null");
        }
        return value;
    }

    private static String describe(Class<?> type) {
        if (type == Block.class) return "block";
        if (type == Inline.class) return "inline";
        return type.getSimpleName();
    }

    private static final class DirectChildren implements NodeVisitor<List<Node>> {

        private static List<Node> of(List<? extends Node> nodes) {
            return Collections.unmodifiableList(nodes);
        }

        @Override
        public List<Node> visitDocument(Document node) {
            return of(node.children());
        }

        @Override
        public List<Node> visitHeading(Heading node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitParagraph(Paragraph node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitCodeBlock(CodeBlock node) {
            return List.of();
        }

        @Override
        public List<Node> visitBlockQuote(BlockQuote node) {
            return of(node.children());
        }

        @Override
        public List<Node> visitList(ListBlock node) {
            return of(node.items());
        }

        @Override
        public List<Node> visitListItem(ListItem node) {
            return of(node.children());
        }

        @Override
        public List<Node> visitTable(Table node) {
            List<Node> rows = new ArrayList<>();
            if (node.header() != null) {
                rows.add(node.header());
            }
            rows.addAll(node.rows());
            return of(rows);
        }

        @Override
        public List<Node> visitTableRow(TableRow node) {
            return of(node.cells());
        }

        @Override
        public List<Node> visitTableCell(TableCell node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitThematicBreak(ThematicBreak node) {
            return List.of();
        }

        @Override
        public List<Node> visitHtmlBlock(HtmlBlock node) {
            return List.of();
        }

        @Override
        public List<Node> visitComment(Comment node) {
            return List.of();
        }

        @Override
        public List<Node> visitFootnoteDefinition(FootnoteDefinition node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitDefinitionList(DefinitionList node) {
            List<Node> out = new ArrayList<>();
            for (DefinitionList.Item item : node.items()) {
                out.add(item.term());
                out.addAll(item.descriptions());
            }
            return of(out);
        }

        @Override
        public List<Node> visitDefinitionTerm(DefinitionTerm node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitDefinitionDescription(DefinitionDescription node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitMathBlock(MathBlock node) {
            return List.of();
        }

        @Override
        public List<Node> visitText(Text node) {
            return List.of();
        }

        @Override
        public List<Node> visitEmphasis(Emphasis node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitStrong(Strong node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitStrikethrough(Strikethrough node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitUnderline(Underline node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitSuperscript(Superscript node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitSubscript(Subscript node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitCode(Code node) {
            return List.of();
        }

        @Override
        public List<Node> visitLink(Link node) {
            return of(node.content());
        }

        @Override
        public List<Node> visitImage(Image node) {
            return List.of();
        }

        @Override
        public List<Node> visitLineBreak(LineBreak node) {
            return List.of();
        }

        @Override
        public List<Node> visitHtmlInline(HtmlInline node) {
            return List.of();
        }

        @Override
        public List<Node> visitCommentInline(CommentInline node) {
            return List.of();
        }

        @Override
        public List<Node> visitFootnoteReference(FootnoteReference node) {
            return List.of();
        }

        @Override
        public List<Node> visitMathInline(MathInline node) {
            return List.of();
        }
    }
}
