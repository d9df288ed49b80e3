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
package net.boyechko.doctree.validation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.boyechko.doctree.issues.Issue;
import net.boyechko.doctree.issues.IssueList;
import net.boyechko.doctree.issues.IssueLoc;
import net.boyechko.doctree.issues.IssueSev;
import net.boyechko.doctree.issues.IssueType;
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
import net.boyechko.doctree.node.LineBreak;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.MathBlock;
import net.boyechko.doctree.node.MathInline;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.NodeVisitor;
import net.boyechko.doctree.node.Nodes;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Strikethrough;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.Subscript;
import net.boyechko.doctree.node.Superscript;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.node.ThematicBreak;
import net.boyechko.doctree.node.Underline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-checks a finished tree for problems the node constructors let through: empty
 * footnote identifiers, bad table spans, unsafe URLs, raw HTML and the like.
 *
 * <p>In strict mode the first error is thrown as a {@link ValidationException}. Otherwise every
 * finding is recorded and the walk continues; read them back with {@link #getErrors()} or {@link
 * #getIssues()}. The visitor keeps its findings across calls, so use a fresh instance per tree.
 */
public class ValidationVisitor implements NodeVisitor<Void> {
    private static final Logger logger = LoggerFactory.getLogger(ValidationVisitor.class);

    private static final Set<String> MATH_NOTATIONS = Set.of("latex", "mathml", "html");
    private static final List<String> DANGEROUS_SCHEMES =
            List.of("javascript:", "vbscript:", "data:text/html");
    private static final Set<String> SAFE_SCHEMES =
            Set.of("http", "https", "ftp", "ftps", "mailto", "tel", "file");
    private static final int URL_PREVIEW = 50;

    private final boolean strict;
    private final boolean allowRawHtml;
    private final IssueList issues = new IssueList();
    private final Deque<String> path = new ArrayDeque<>();
    private int globalIndex;

    public ValidationVisitor() {
        this(true, false);
    }

    public ValidationVisitor(boolean strict) {
        this(strict, false);
    }

    public ValidationVisitor(boolean strict, boolean allowRawHtml) {
        this.strict = strict;
        this.allowRawHtml = allowRawHtml;
    }

    /** Validates {@code node} and everything below it, returning the findings so far. */
    public IssueList validate(Node node) {
        descend(node);
        return issues;
    }

    public IssueList getIssues() {
        return issues;
    }

    public List<String> getErrors() {
        return issues.messages();
    }

    public boolean isStrict() {
        return strict;
    }

    private void descend(Node node) {
        globalIndex++;
        String parent = path.isEmpty() ? "/" : path.peek() + ".";
        path.push(parent + node.kind() + "[" + globalIndex + "]");
        try {
            node.accept(this);
        } finally {
            path.pop();
        }
    }

    private Void visitChildren(Node node) {
        for (Node child : Nodes.children(node)) {
            descend(child);
        }
        return null;
    }

    private void report(Node node, IssueType type, IssueSev sev, String message) {
        Issue issue =
                new Issue(type, sev, IssueLoc.atNode(path.peek(), node.sourceLocation()), message);
        if (strict && sev == IssueSev.ERROR) {
            throw new ValidationException(issue);
        }
        logger.debug("Validation finding at {}: {}", path.peek(), message);
        issues.add(issue);
    }

    private void error(Node node, IssueType type, String message) {
        report(node, type, IssueSev.ERROR, message);
    }

    /**
     * Returns the script-capable scheme {@code url} starts with, such as {@code javascript:}, or
     * null if it has none. Case and surrounding whitespace are ignored.
     */
    public static String findDangerousScheme(String url) {
        String lower = url.toLowerCase(Locale.ROOT).strip();
        for (String scheme : DANGEROUS_SCHEMES) {
            if (lower.startsWith(scheme)) {
                return scheme;
            }
        }
        return null;
    }

    private void checkUrl(Node node, String url, String context, boolean allowImageData) {
        if (url.isEmpty()) {
            error(node, IssueType.URL_EMPTY, context + " url must be non-empty");
            return;
        }
        String lower = url.toLowerCase(Locale.ROOT).strip();
        String preview = url.length() > URL_PREVIEW ? url.substring(0, URL_PREVIEW) : url;

        if (lower.startsWith("data:")) {
            if (!allowImageData || !lower.startsWith("data:image/")) {
                error(
                        node,
                        IssueType.URL_DANGEROUS_SCHEME,
                        context + " data URI must have image/* MIME type, got: " + preview);
            }
            return;
        }
        String dangerous = findDangerousScheme(url);
        if (dangerous != null) {
            error(
                    node,
                    IssueType.URL_DANGEROUS_SCHEME,
                    context + " URL uses dangerous scheme '" + dangerous + "': " + preview);
            return;
        }
        int sep = lower.indexOf("://");
        if (sep > 0 && !SAFE_SCHEMES.contains(lower.substring(0, sep))) {
            report(
                    node,
                    IssueType.URL_DANGEROUS_SCHEME,
                    IssueSev.WARNING,
                    context
                            + " URL has unrecognized scheme '"
                            + lower.substring(0, sep)
                            + "': "
                            + preview);
        }
    }

    private void checkMath(
            Node node, String kind, String notation, Map<String, String> representations) {
        if (!MATH_NOTATIONS.contains(notation)) {
            error(
                    node,
                    IssueType.MATH_NOTATION_UNKNOWN,
                    kind + " uses unsupported notation '" + notation + "'");
        }
        for (String key : representations.keySet()) {
            if (!MATH_NOTATIONS.contains(key)) {
                error(
                        node,
                        IssueType.MATH_NOTATION_UNKNOWN,
                        kind + " has invalid representation key '" + key + "'");
            }
        }
    }

    private void checkRawHtml(Node node) {
        if (!allowRawHtml) {
            error(
                    node,
                    IssueType.RAW_HTML_NOT_ALLOWED,
                    "Raw HTML content (" + node.kind() + ") is not allowed");
        }
    }

    @Override
    public Void visitDocument(Document node) {
        return visitChildren(node);
    }

    @Override
    public Void visitHeading(Heading node) {
        // Unreachable through the constructor, but trees can come from elsewhere
        if (!Heading.isValidLevel(node.level())) {
            error(
                    node,
                    IssueType.HEADING_LEVEL_OUT_OF_RANGE,
                    "Invalid heading level: " + node.level());
        }
        return visitChildren(node);
    }

    @Override
    public Void visitParagraph(Paragraph node) {
        return visitChildren(node);
    }

    @Override
    public Void visitCodeBlock(CodeBlock node) {
        if (node.fenceLength() < 1) {
            error(
                    node,
                    IssueType.CODE_FENCE_INVALID,
                    "CodeBlock fence length must be >= 1, got " + node.fenceLength());
        }
        if (!"`".equals(node.fenceChar()) && !"~".equals(node.fenceChar())) {
            error(
                    node,
                    IssueType.CODE_FENCE_INVALID,
                    "CodeBlock fence char must be '`' or '~', got '" + node.fenceChar() + "'");
        }
        return null;
    }

    @Override
    public Void visitBlockQuote(BlockQuote node) {
        return visitChildren(node);
    }

    @Override
    public Void visitList(ListBlock node) {
        if (node.ordered() && node.start() < 0) {
            error(
                    node,
                    IssueType.LIST_START_NEGATIVE,
                    "Ordered list start must be >= 0, got " + node.start());
        }
        if (node.items().isEmpty()) {
            error(node, IssueType.LIST_EMPTY, "List must have at least one item");
        }
        return visitChildren(node);
    }

    @Override
    public Void visitListItem(ListItem node) {
        return visitChildren(node);
    }

    @Override
    public Void visitTable(Table node) {
        int expected = node.columnCount();
        if (node.header() != null || !node.rows().isEmpty()) {
            for (int i = 0; i < node.rows().size(); i++) {
                int cells = node.rows().get(i).cells().size();
                if (cells != expected) {
                    error(
                            node,
                            IssueType.TABLE_COLUMN_MISMATCH,
                            "Table row " + i + " has " + cells + " cells, expected " + expected);
                }
            }
            if (!node.alignments().isEmpty() && node.alignments().size() != expected) {
                error(
                        node,
                        IssueType.TABLE_ALIGNMENT_MISMATCH,
                        "Table has "
                                + node.alignments().size()
                                + " alignments but "
                                + expected
                                + " columns");
            }
        }
        return visitChildren(node);
    }

    @Override
    public Void visitTableRow(TableRow node) {
        return visitChildren(node);
    }

    @Override
    public Void visitTableCell(TableCell node) {
        if (node.colspan() < 1) {
            error(
                    node,
                    IssueType.TABLE_SPAN_INVALID,
                    "TableCell colspan must be >= 1, got " + node.colspan());
        }
        if (node.rowspan() < 1) {
            error(
                    node,
                    IssueType.TABLE_SPAN_INVALID,
                    "TableCell rowspan must be >= 1, got " + node.rowspan());
        }
        return visitChildren(node);
    }

    @Override
    public Void visitThematicBreak(ThematicBreak node) {
        return null;
    }

    @Override
    public Void visitHtmlBlock(HtmlBlock node) {
        checkRawHtml(node);
        return null;
    }

    @Override
    public Void visitComment(Comment node) {
        if (node.content().isEmpty()) {
            error(node, IssueType.COMMENT_EMPTY, "Comment node should have content");
        }
        return null;
    }

    @Override
    public Void visitFootnoteDefinition(FootnoteDefinition node) {
        if (node.identifier().isEmpty()) {
            error(
                    node,
                    IssueType.EMPTY_FOOTNOTE_IDENTIFIER,
                    "FootnoteDefinition must have an identifier");
        }
        return visitChildren(node);
    }

    @Override
    public Void visitDefinitionList(DefinitionList node) {
        return visitChildren(node);
    }

    @Override
    public Void visitDefinitionTerm(DefinitionTerm node) {
        return visitChildren(node);
    }

    @Override
    public Void visitDefinitionDescription(DefinitionDescription node) {
        return visitChildren(node);
    }

    @Override
    public Void visitMathBlock(MathBlock node) {
        checkMath(node, "MathBlock", node.notation(), node.representations());
        return null;
    }

    @Override
    public Void visitText(Text node) {
        return null;
    }

    @Override
    public Void visitEmphasis(Emphasis node) {
        return visitChildren(node);
    }

    @Override
    public Void visitStrong(Strong node) {
        return visitChildren(node);
    }

    @Override
    public Void visitStrikethrough(Strikethrough node) {
        return visitChildren(node);
    }

    @Override
    public Void visitUnderline(Underline node) {
        return visitChildren(node);
    }

    @Override
    public Void visitSuperscript(Superscript node) {
        return visitChildren(node);
    }

    @Override
    public Void visitSubscript(Subscript node) {
        return visitChildren(node);
    }

    @Override
    public Void visitCode(Code node) {
        return null;
    }

    @Override
    public Void visitLink(Link node) {
        checkUrl(node, node.url(), "Link", false);
        return visitChildren(node);
    }

    @Override
    public Void visitImage(Image node) {
        checkUrl(node, node.url(), "Image", true);
        return null;
    }

    @Override
    public Void visitLineBreak(LineBreak node) {
        return null;
    }

    @Override
    public Void visitHtmlInline(HtmlInline node) {
        checkRawHtml(node);
        return null;
    }

    @Override
    public Void visitCommentInline(CommentInline node) {
        if (node.content().isEmpty()) {
            error(node, IssueType.COMMENT_EMPTY, "CommentInline node should have content");
        }
        return null;
    }

    @Override
    public Void visitFootnoteReference(FootnoteReference node) {
        if (node.identifier().isEmpty()) {
            error(
                    node,
                    IssueType.EMPTY_FOOTNOTE_IDENTIFIER,
                    "FootnoteReference must have an identifier");
        }
        return null;
    }

    @Override
    public Void visitMathInline(MathInline node) {
        checkMath(node, "MathInline", node.notation(), node.representations());
        return null;
    }
}
