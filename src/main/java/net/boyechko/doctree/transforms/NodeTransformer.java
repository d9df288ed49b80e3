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
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.BlockQuote;
import net.boyechko.doctree.node.Code;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Comment;
import net.boyechko.doctree.node.CommentInline;
import net.boyechko.doctree.node.DefinitionDescription;
import net.boyechko.doctree.node.DefinitionList;
import net.boyechko.doctree.node.DefinitionTerm;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Emphasis;
import net.boyechko.doctree.node.FootnoteDefinition;
import net.boyechko.doctree.node.FootnoteReference;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.HtmlBlock;
import net.boyechko.doctree.node.HtmlInline;
import net.boyechko.doctree.node.Image;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.MathBlock;
import net.boyechko.doctree.node.MathInline;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.NodeVisitor;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Strikethrough;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.StructuralException;
import net.boyechko.doctree.node.Subscript;
import net.boyechko.doctree.node.Superscript;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.node.ThematicBreak;
import net.boyechko.doctree.node.Underline;

/**
 * Rewriting visitor. Each {@code visitX} returns the node that replaces its argument, or null to
 * delete it from the parent's sequence.
 *
 * <p>The defaults rebuild every container from its transformed children and return leaves
 * unchanged, so a subclass that overrides nothing is the identity transform. Subclasses override
 * only the kinds they rewrite and may call {@code super.visitX} to keep recursing into children.
 * Nodes are immutable, so a transform that throws leaves the input tree as it was.
 */
public abstract class NodeTransformer implements NodeVisitor<Node> {

    /** Transforms a single node; null means the node was deleted. */
    public Node transform(Node node) {
        return node.accept(this);
    }

    /** Transforms a whole document. The root itself can be replaced but not deleted. */
    public Document transformDocument(Document document) {
        Node result = transform(document);
        if (!(result instanceof Document transformed)) {
            throw new StructuralException(
                    getClass().getSimpleName()
                            + " must return a Document for the root, got "
                            + (result == null ? "null" : result.kind()));
        }
        return transformed;
    }

    /**
     * Transforms every node of {@code children}, dropping deleted ones. A replacement that is not
     * a {@code type} is a structural error.
     */
    protected <T extends Node> List<T> transformAll(
            List<? extends Node> children, Class<T> type, String owner) {
        List<T> out = new ArrayList<>(children.size());
        for (Node child : children) {
            Node result = transform(child);
            if (result == null) {
                continue;
            }
            if (!type.isInstance(result)) {
                throw new StructuralException(
                        getClass().getSimpleName()
                                + " replaced a "
                                + child.kind()
                                + " in "
                                + owner
                                + " with "
                                + result.kind()
                                + ", which is not a "
                                + type.getSimpleName());
            }
            out.add(type.cast(result));
        }
        return out;
    }

    private <T extends Node> T transformOne(Node child, Class<T> type, String owner) {
        List<T> result = transformAll(List.of(child), type, owner);
        return result.isEmpty() ? null : result.get(0);
    }

    private List<Inline> inlines(List<Inline> content, String owner) {
        return transformAll(content, Inline.class, owner);
    }

    private List<Block> blocks(List<Block> children, String owner) {
        return transformAll(children, Block.class, owner);
    }

    @Override
    public Node visitDocument(Document node) {
        return node.withChildren(blocks(node.children(), "Document"));
    }

    @Override
    public Node visitHeading(Heading node) {
        return new Heading(
                node.level(),
                inlines(node.content(), "Heading"),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitParagraph(Paragraph node) {
        return new Paragraph(
                inlines(node.content(), "Paragraph"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitCodeBlock(CodeBlock node) {
        return node;
    }

    @Override
    public Node visitBlockQuote(BlockQuote node) {
        return new BlockQuote(
                blocks(node.children(), "BlockQuote"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitList(ListBlock node) {
        return new ListBlock(
                node.ordered(),
                transformAll(node.items(), ListItem.class, "List"),
                node.start(),
                node.tight(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitListItem(ListItem node) {
        return new ListItem(
                blocks(node.children(), "ListItem"),
                node.taskStatus(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitTable(Table node) {
        TableRow header =
                node.header() != null ? transformOne(node.header(), TableRow.class, "Table") : null;
        return new Table(
                header,
                transformAll(node.rows(), TableRow.class, "Table"),
                node.alignments(),
                node.caption(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitTableRow(TableRow node) {
        return new TableRow(
                transformAll(node.cells(), TableCell.class, "TableRow"),
                node.header(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitTableCell(TableCell node) {
        return new TableCell(
                inlines(node.content(), "TableCell"),
                node.colspan(),
                node.rowspan(),
                node.alignment(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitThematicBreak(ThematicBreak node) {
        return node;
    }

    @Override
    public Node visitHtmlBlock(HtmlBlock node) {
        return node;
    }

    @Override
    public Node visitComment(Comment node) {
        return node;
    }

    @Override
    public Node visitFootnoteDefinition(FootnoteDefinition node) {
        return new FootnoteDefinition(
                node.identifier(),
                blocks(node.content(), "FootnoteDefinition"),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitDefinitionList(DefinitionList node) {
        List<DefinitionList.Item> items = new ArrayList<>();
        for (DefinitionList.Item item : node.items()) {
            DefinitionTerm term = transformOne(item.term(), DefinitionTerm.class, "DefinitionList");
            // A deleted term takes its descriptions with it
            if (term == null) {
                continue;
            }
            items.add(
                    new DefinitionList.Item(
                            term,
                            transformAll(
                                    item.descriptions(),
                                    DefinitionDescription.class,
                                    "DefinitionList")));
        }
        return new DefinitionList(items, node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitDefinitionTerm(DefinitionTerm node) {
        return new DefinitionTerm(
                inlines(node.content(), "DefinitionTerm"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitDefinitionDescription(DefinitionDescription node) {
        return new DefinitionDescription(
                blocks(node.content(), "DefinitionDescription"),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitMathBlock(MathBlock node) {
        return node;
    }

    @Override
    public Node visitText(Text node) {
        return node;
    }

    @Override
    public Node visitEmphasis(Emphasis node) {
        return new Emphasis(
                inlines(node.content(), "Emphasis"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitStrong(Strong node) {
        return new Strong(
                inlines(node.content(), "Strong"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitStrikethrough(Strikethrough node) {
        return new Strikethrough(
                inlines(node.content(), "Strikethrough"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitUnderline(Underline node) {
        return new Underline(
                inlines(node.content(), "Underline"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitSuperscript(Superscript node) {
        return new Superscript(
                inlines(node.content(), "Superscript"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitSubscript(Subscript node) {
        return new Subscript(
                inlines(node.content(), "Subscript"), node.metadata(), node.sourceLocation());
    }

    @Override
    public Node visitCode(Code node) {
        return node;
    }

    @Override
    public Node visitLink(Link node) {
        return new Link(
                node.url(),
                inlines(node.content(), "Link"),
                node.title(),
                node.metadata(),
                node.sourceLocation());
    }

    @Override
    public Node visitImage(Image node) {
        return node;
    }

    @Override
    public Node visitLineBreak(LineBreak node) {
        return node;
    }

    @Override
    public Node visitHtmlInline(HtmlInline node) {
        return node;
    }

    @Override
    public Node visitCommentInline(CommentInline node) {
        return node;
    }

    @Override
    public Node visitFootnoteReference(FootnoteReference node) {
        return node;
    }

    @Override
    public Node visitMathInline(MathInline node) {
        return node;
    }
}
