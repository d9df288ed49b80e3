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
 * Double-dispatch target for every node kind: {@code node.accept(v)} calls the matching {@code
 * visitX} method. Implement this interface directly when every kind must be handled (renderers,
 * serializers); adding a node kind then breaks compilation instead of being silently ignored.
 * Visitors that only care about a few kinds extend {@link AbstractNodeVisitor}.
 *
 * <p>Visitors drive their own recursion. Nothing here descends into children.
 *
 * @param <R> result type of a visit
 */
public interface NodeVisitor<R> {

    R visitDocument(Document node);

    // Blocks

    R visitHeading(Heading node);

    R visitParagraph(Paragraph node);

    R visitCodeBlock(CodeBlock node);

    R visitBlockQuote(BlockQuote node);

    R visitList(ListBlock node);

    R visitListItem(ListItem node);

    R visitTable(Table node);

    R visitTableRow(TableRow node);

    R visitTableCell(TableCell node);

    R visitThematicBreak(ThematicBreak node);

    R visitHtmlBlock(HtmlBlock node);

    R visitComment(Comment node);

    R visitFootnoteDefinition(FootnoteDefinition node);

    R visitDefinitionList(DefinitionList node);

    R visitDefinitionTerm(DefinitionTerm node);

    R visitDefinitionDescription(DefinitionDescription node);

    R visitMathBlock(MathBlock node);

    // Inlines

    R visitText(Text node);

    R visitEmphasis(Emphasis node);

    R visitStrong(Strong node);

    R visitStrikethrough(Strikethrough node);

    R visitUnderline(Underline node);

    R visitSuperscript(Superscript node);

    R visitSubscript(Subscript node);

    R visitCode(Code node);

    R visitLink(Link node);

    R visitImage(Image node);

    R visitLineBreak(LineBreak node);

    R visitHtmlInline(HtmlInline node);

    R visitCommentInline(CommentInline node);

    R visitFootnoteReference(FootnoteReference node);

    R visitMathInline(MathInline node);
}
