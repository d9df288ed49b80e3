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
package net.boyechko.doctree.visitors;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.doctree.node.AbstractNodeVisitor;
import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.MathBlock;
import net.boyechko.doctree.node.MathInline;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Nodes;
import net.boyechko.doctree.node.Text;

/**
 * Extracts the plain text of a subtree. Inline runs are concatenated as written; block-level
 * pieces are separated by a caller-supplied joiner. Raw HTML, comments and image alt text are
 * not part of the text.
 */
public final class TextExtractor extends AbstractNodeVisitor<String> {
    private final String joiner;

    private TextExtractor(String joiner) {
        this.joiner = joiner;
    }

    public static String extract(Node node) {
        return extract(node, " ");
    }

    public static String extract(Node node, String joiner) {
        return node.accept(new TextExtractor(joiner));
    }

    public static String extract(List<? extends Node> nodes, String joiner) {
        return new TextExtractor(joiner).join(nodes);
    }

    /** Counts whitespace-separated words in the text of {@code nodes}. */
    public static int countWords(List<? extends Node> nodes) {
        return countWords(extract(nodes, " "));
    }

    public static int countWords(Node node) {
        return countWords(extract(node, " "));
    }

    public static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private String join(List<? extends Node> nodes) {
        boolean inline = !nodes.isEmpty() && nodes.stream().allMatch(n -> n instanceof Inline);
        List<String> parts = new ArrayList<>();
        for (Node node : nodes) {
            String text = node.accept(this);
            if (text != null && !text.isEmpty()) {
                parts.add(text);
            }
        }
        return String.join(inline ? "" : joiner, parts);
    }

    @Override
    protected String genericVisit(Node node) {
        return join(Nodes.children(node));
    }

    @Override
    public String visitText(Text node) {
        return node.content();
    }

    @Override
    public String visitCode(Code node) {
        return node.content();
    }

    @Override
    public String visitCodeBlock(CodeBlock node) {
        return node.content();
    }

    @Override
    public String visitMathInline(MathInline node) {
        return node.content();
    }

    @Override
    public String visitMathBlock(MathBlock node) {
        return node.content();
    }

    @Override
    public String visitLineBreak(LineBreak node) {
        return " ";
    }
}
