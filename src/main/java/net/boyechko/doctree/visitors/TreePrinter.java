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
import java.util.Locale;
import java.util.function.Consumer;
import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Comment;
import net.boyechko.doctree.node.CommentInline;
import net.boyechko.doctree.node.FootnoteDefinition;
import net.boyechko.doctree.node.FootnoteReference;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.HtmlBlock;
import net.boyechko.doctree.node.HtmlInline;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.MathBlock;
import net.boyechko.doctree.node.MathInline;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.TaskStatus;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.validation.DocumentWalker;
import net.boyechko.doctree.validation.TreeVisitor;
import net.boyechko.doctree.validation.WalkContext;

/**
 * Outputs an indented outline of a node tree, one line per node. The format is stable, so it is
 * also used for snapshot comparisons.
 *
 * <pre>
 * - Document
 *   - Heading h1
 *     - Text "Intro"
 * </pre>
 */
public class TreePrinter implements TreeVisitor {

    private static final String INDENT = "  ";
    private static final int CONTENT_SUMMARY_WIDTH = 40;

    private final Consumer<String> output;

    public TreePrinter(Consumer<String> output) {
        this.output = output;
    }

    /** Returns the outline of {@code root} as newline-terminated lines. */
    public static String print(Node root) {
        List<String> lines = new ArrayList<>();
        new DocumentWalker().addVisitor(new TreePrinter(lines::add)).walk(root);
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String name() {
        return "Tree Printer";
    }

    @Override
    public String description() {
        return "Outputs an indented outline of the document tree";
    }

    @Override
    public boolean enterNode(WalkContext ctx) {
        output.accept(INDENT.repeat(ctx.depth()) + "- " + ctx.kind() + detail(ctx.node()));
        return true;
    }

    private static String detail(Node node) {
        if (node instanceof Heading h) {
            return " h" + h.level();
        } else if (node instanceof Text t) {
            return " " + quote(t.content());
        } else if (node instanceof Code c) {
            return " " + quote(c.content());
        } else if (node instanceof CodeBlock cb) {
            return (cb.language() != null ? " [" + cb.language() + "]" : "")
                    + " "
                    + quote(cb.content());
        } else if (node instanceof MathInline m) {
            return " " + quote(m.content());
        } else if (node instanceof MathBlock m) {
            return " " + quote(m.content());
        } else if (node instanceof HtmlBlock h) {
            return " " + quote(h.content());
        } else if (node instanceof HtmlInline h) {
            return " " + quote(h.content());
        } else if (node instanceof Comment c) {
            return " " + quote(c.content());
        } else if (node instanceof CommentInline c) {
            return " " + quote(c.content());
        } else if (node instanceof Link l) {
            return " <" + l.url() + ">";
        } else if (node instanceof Image i) {
            return " <" + i.url() + "> " + quote(i.altText());
        } else if (node instanceof ListBlock l) {
            return l.ordered() ? " ordered start=" + l.start() : " bullet";
        } else if (node instanceof ListItem li && li.taskStatus() != TaskStatus.NONE) {
            return " [" + li.taskStatus().name().toLowerCase(Locale.ROOT) + "]";
        } else if (node instanceof FootnoteReference f) {
            return " [^" + f.identifier() + "]";
        } else if (node instanceof FootnoteDefinition f) {
            return " [^" + f.identifier() + "]";
        } else if (node instanceof LineBreak lb && lb.soft()) {
            return " soft";
        }
        return "";
    }

    private static String quote(String content) {
        String flat = content.replace("\n", "\\n");
        if (flat.length() > CONTENT_SUMMARY_WIDTH) {
            flat = flat.substring(0, CONTENT_SUMMARY_WIDTH - 3) + "...";
        }
        return "\"" + flat + "\"";
    }
}
