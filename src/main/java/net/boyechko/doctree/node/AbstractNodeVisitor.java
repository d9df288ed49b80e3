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

/**
 * Base class for partial visitors. Every {@code visitX} method falls through to {@link
 * #genericVisit(Node)}, which does nothing and returns null. It does <em>not</em> recurse: a
 * subclass that wants children visited must do so itself, which lets it skip whole subtrees for
 * free.
 */
public abstract class AbstractNodeVisitor<R> implements NodeVisitor<R> {

    /** Fallback for every kind this visitor does not override. Non-recursive. */
    protected R genericVisit(Node node) {
        return null;
    }

    @Override
    public R visitDocument(Document node) {
        return genericVisit(node);
    }

    @Override
    public R visitHeading(Heading node) {
        return genericVisit(node);
    }

    @Override
    public R visitParagraph(Paragraph node) {
        return genericVisit(node);
    }

    @Override
    public R visitCodeBlock(CodeBlock node) {
        return genericVisit(node);
    }

    @Override
    public R visitBlockQuote(BlockQuote node) {
        return genericVisit(node);
    }

    @Override
    public R visitList(ListBlock node) {
        return genericVisit(node);
    }

    @Override
    public R visitListItem(ListItem node) {
        return genericVisit(node);
    }

    @Override
    public R visitTable(Table node) {
        return genericVisit(node);
    }

    @Override
    public R visitTableRow(TableRow node) {
        return genericVisit(node);
    }

    @Override
    public R visitTableCell(TableCell node) {
        return genericVisit(node);
    }

    @Override
    public R visitThematicBreak(ThematicBreak node) {
        return genericVisit(node);
    }

    @Override
    public R visitHtmlBlock(HtmlBlock node) {
        return genericVisit(node);
    }

    @Override
    public R visitComment(Comment node) {
        return genericVisit(node);
    }

    @Override
    public R visitFootnoteDefinition(FootnoteDefinition node) {
        return genericVisit(node);
    }

    @Override
    public R visitDefinitionList(DefinitionList node) {
        return genericVisit(node);
    }

    @Override
    public R visitDefinitionTerm(DefinitionTerm node) {
        return genericVisit(node);
    }

    @Override
    public R visitDefinitionDescription(DefinitionDescription node) {
        return genericVisit(node);
    }

    @Override
    public R visitMathBlock(MathBlock node) {
        return genericVisit(node);
    }

    @Override
    public R visitText(Text node) {
        return genericVisit(node);
    }

    @Override
    public R visitEmphasis(Emphasis node) {
        return genericVisit(node);
    }

    @Override
    public R visitStrong(Strong node) {
        return genericVisit(node);
    }

    @Override
    public R visitStrikethrough(Strikethrough node) {
        return genericVisit(node);
    }

    @Override
    public R visitUnderline(Underline node) {
        return genericVisit(node);
    }

    @Override
    public R visitSuperscript(Superscript node) {
        return genericVisit(node);
    }

    @Override
    public R visitSubscript(Subscript node) {
        return genericVisit(node);
    }

    @Override
    public R visitCode(Code node) {
        return genericVisit(node);
    }

    @Override
    public R visitLink(Link node) {
        return genericVisit(node);
    }

    @Override
    public R visitImage(Image node) {
        return genericVisit(node);
    }

    @Override
    public R visitLineBreak(LineBreak node) {
        return genericVisit(node);
    }

    @Override
    public R visitHtmlInline(HtmlInline node) {
        return genericVisit(node);
    }

    @Override
    public R visitCommentInline(CommentInline node) {
        return genericVisit(node);
    }

    @Override
    public R visitFootnoteReference(FootnoteReference node) {
        return genericVisit(node);
    }

    @Override
    public R visitMathInline(MathInline node) {
        return genericVisit(node);
    }
}
