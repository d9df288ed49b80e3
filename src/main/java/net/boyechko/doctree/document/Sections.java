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
package net.boyechko.doctree.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import net.boyechko.doctree.core.DocTreeConfig;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Link;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.node.ThematicBreak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Section queries and section-level editing over a document's top-level blocks.
 *
 * <p>Sections follow outline rules: a heading's section runs until the next heading of the same
 * or a higher rank (a level number less than or equal to its own), so the content of deeper
 * sub-headings belongs to the enclosing section too. Every result is recomputed from the
 * document on each call, and every editing operation returns a new document with the input's
 * metadata.
 */
public final class Sections {
    private static final Logger logger = LoggerFactory.getLogger(Sections.class);

    public static final String TOC_TITLE = "Table of Contents";

    private Sections() {}

    // Queries

    public static List<Section> getAllSections(Document doc) {
        return getAllSections(doc, Heading.MIN_LEVEL, Heading.MAX_LEVEL);
    }

    /**
     * Returns one section per heading whose level is within {@code [minLevel, maxLevel]}, in
     * document order. Sections at different levels overlap where one nests inside another.
     *
     * @throws IllegalArgumentException if the level range is not within 1-6 or is reversed
     */
    public static List<Section> getAllSections(Document doc, int minLevel, int maxLevel) {
        if (!Heading.isValidLevel(minLevel)
                || !Heading.isValidLevel(maxLevel)
                || minLevel > maxLevel) {
            throw new IllegalArgumentException(
                    "Invalid level range: minLevel="
                            + minLevel
                            + ", maxLevel="
                            + maxLevel
                            + "; levels must be 1-6 with minLevel <= maxLevel");
        }
        List<Block> children = doc.children();
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (!(children.get(i) instanceof Heading heading)
                    || heading.level() < minLevel
                    || heading.level() > maxLevel) {
                continue;
            }
            int end = i + 1;
            while (end < children.size()
                    && !(children.get(end) instanceof Heading next
                            && next.level() <= heading.level())) {
                end++;
            }
            sections.add(
                    new Section(heading, heading.level(), children.subList(i + 1, end), i, end));
        }
        return sections;
    }

    /**
     * Cuts the document into consecutive, non-overlapping sections. A section starts at every
     * heading of level {@code level} or higher rank; content before the first such heading forms
     * a preamble section (heading null, level 0) when it is non-empty. Concatenating the blocks
     * of the result reproduces the document's children exactly.
     */
    public static List<Section> partition(Document doc, int level) {
        if (!Heading.isValidLevel(level)) {
            throw new IllegalArgumentException("Heading level must be 1-6, got " + level);
        }
        List<Block> children = doc.children();
        List<Section> parts = new ArrayList<>();
        int start = 0;
        Heading current = null;
        for (int i = 0; i <= children.size(); i++) {
            boolean boundary =
                    i == children.size()
                            || (children.get(i) instanceof Heading h && h.level() <= level);
            if (!boundary) {
                continue;
            }
            if (current != null) {
                parts.add(
                        new Section(
                                current,
                                current.level(),
                                children.subList(start + 1, i),
                                start,
                                i));
            } else if (i > start) {
                parts.add(new Section(null, 0, children.subList(start, i), start, i));
            }
            if (i < children.size()) {
                current = (Heading) children.get(i);
                start = i;
            }
        }
        return parts;
    }

    /** Returns the blocks before the first heading of any level. */
    public static List<Block> getPreamble(Document doc) {
        List<Block> preamble = new ArrayList<>();
        for (Block block : doc.children()) {
            if (block instanceof Heading) {
                break;
            }
            preamble.add(block);
        }
        return preamble;
    }

    /** Returns the first top-level heading with the given text, or null if there is none. */
    public static Heading findHeading(Document doc, String text, boolean caseSensitive) {
        for (Section section : getAllSections(doc)) {
            if (textMatches(section.headingText(), text, caseSensitive)) {
                return section.heading();
            }
        }
        return null;
    }

    public static int countSections(Document doc) {
        return getAllSections(doc).size();
    }

    public static int countSections(Document doc, int level) {
        return getAllSections(doc, level, level).size();
    }

    /**
     * Returns the sections whose heading text matches {@code pattern}. A pattern containing
     * {@code *}, {@code ?} or a {@code [...]} class is a wildcard pattern matched against the
     * whole heading text; any other pattern must equal the heading text.
     */
    public static List<Section> query(Document doc, String pattern, boolean caseSensitive) {
        return query(doc, headingMatches(pattern, caseSensitive));
    }

    /**
     * Returns the sections at the given 0-based indexes, in the order given.
     *
     * @throws SectionResolutionException if any index is out of range
     */
    public static List<Section> query(Document doc, List<Integer> indexes) {
        List<Section> sections = getAllSections(doc);
        List<Section> out = new ArrayList<>(indexes.size());
        for (int index : indexes) {
            out.add(resolveIndex(sections, index));
        }
        return out;
    }

    public static List<Section> query(Document doc, Predicate<Section> predicate) {
        return query(doc, Heading.MIN_LEVEL, Heading.MAX_LEVEL, predicate);
    }

    /** Sections with a level in {@code [minLevel, maxLevel]} that satisfy {@code predicate}. */
    public static List<Section> query(
            Document doc, int minLevel, int maxLevel, Predicate<Section> predicate) {
        return getAllSections(doc, minLevel, maxLevel).stream().filter(predicate).toList();
    }

    /** Heading-text predicate used by {@link #query(Document, String, boolean)}. */
    public static Predicate<Section> headingMatches(String pattern, boolean caseSensitive) {
        if (pattern == null) {
            throw new IllegalArgumentException("Section pattern must not be null");
        }
        if (!isWildcard(pattern)) {
            return section -> textMatches(section.headingText(), pattern, caseSensitive);
        }
        Pattern regex = wildcardRegex(pattern.strip(), caseSensitive);
        return section -> regex.matcher(section.headingText().strip()).matches();
    }

    private static boolean isWildcard(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0;
    }

    /** Translates shell wildcards ({@code * ? [abc] [!abc]}) to an anchored regex. */
    private static Pattern wildcardRegex(String wildcard, boolean caseSensitive) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < wildcard.length()) {
            char c = wildcard.charAt(i);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && classEnd(wildcard, i) > 0) {
                int end = classEnd(wildcard, i);
                String body = wildcard.substring(i + 1, end);
                regex.append('[');
                if (body.startsWith("!")) {
                    regex.append('^');
                    body = body.substring(1);
                }
                for (char member : body.toCharArray()) {
                    if (member == '-' || Character.isLetterOrDigit(member)) {
                        regex.append(member);
                    } else {
                        regex.append('\\').append(member);
                    }
                }
                regex.append(']');
                i = end;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        int flags = Pattern.DOTALL;
        if (!caseSensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return Pattern.compile(regex.toString(), flags);
    }

    /** Index of the {@code ]} closing the class opened at {@code open}, or -1 if unclosed. */
    private static int classEnd(String wildcard, int open) {
        int j = open + 1;
        if (j < wildcard.length() && wildcard.charAt(j) == '!') {
            j++;
        }
        if (j < wildcard.length() && wildcard.charAt(j) == ']') {
            j++;
        }
        return wildcard.indexOf(']', j);
    }

    /**
     * Resolves {@code target} against {@link #getAllSections(Document)}.
     *
     * @throws SectionResolutionException if no section, or more than one, matches
     */
    public static Section resolve(Document doc, SectionTarget target) {
        List<Section> sections = getAllSections(doc);
        Section resolved;
        if (target instanceof SectionTarget.ByIndex byIndex) {
            resolved = resolveIndex(sections, byIndex.index());
        } else {
            resolved = resolveHeading(sections, (SectionTarget.ByHeading) target);
        }
        logger.debug(
                "Resolved {} to section '{}' [{}, {})",
                target,
                resolved.headingText(),
                resolved.startIndex(),
                resolved.endIndex());
        return resolved;
    }

    private static Section resolveIndex(List<Section> sections, int index) {
        if (sections.isEmpty()) {
            throw new SectionResolutionException(
                    "Section index " + index + " out of range: document has no sections");
        }
        if (index < 0 || index >= sections.size()) {
            throw new SectionResolutionException(
                    "Section index "
                            + index
                            + " out of range (0-"
                            + (sections.size() - 1)
                            + ")");
        }
        return sections.get(index);
    }

    private static Section resolveHeading(List<Section> sections, SectionTarget.ByHeading target) {
        List<Section> matches = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            if (textMatches(section.headingText(), target.text(), target.caseSensitive())) {
                matches.add(section);
                indexes.add(i);
            }
        }
        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.isEmpty()) {
            throw new SectionResolutionException(
                    "Target section not found: "
                            + target
                            + "; available headings: "
                            + sections.stream().map(Section::headingText).toList());
        }
        throw new SectionResolutionException(
                "Ambiguous target "
                        + target
                        + " matches "
                        + matches.size()
                        + " sections at indexes "
                        + indexes
                        + "; use a section index instead");
    }

    private static boolean textMatches(String headingText, String wanted, boolean caseSensitive) {
        String a = headingText.strip();
        String b = wanted.strip();
        return caseSensitive
                ? a.equals(b)
                : a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    // Editing

    /** Returns the target section, heading included, as a standalone document. */
    public static Document extractSection(Document doc, SectionTarget target) {
        return doc.withChildren(resolve(doc, target).blocks());
    }

    /** Same as {@link #extractSections(Document, String, boolean, Block)} with thematic breaks. */
    public static Document extractSections(Document doc, String spec) {
        return extractSections(doc, spec, false, new ThematicBreak());
    }

    /**
     * Extracts several sections into one document that keeps the input's metadata.
     *
     * <p>{@code spec} is either {@code #:} followed by 1-based ranges as accepted by {@link
     * SectionRanges#parse(String, int)} (for example {@code #:1-3}, {@code #:3-} or {@code
     * #:1,3,5}), or a heading pattern as accepted by {@link #query(Document, String, boolean)}.
     * Sections appear in document order for ranges and match order for patterns, each heading
     * included, with {@code separator} between consecutive sections unless it is null.
     *
     * @throws SectionResolutionException if the document has no sections, the range is malformed,
     *     or nothing matches
     */
    public static Document extractSections(
            Document doc, String spec, boolean caseSensitive, Block separator) {
        if (spec == null || spec.isBlank()) {
            throw new SectionResolutionException("Section specification must not be empty");
        }
        List<Section> sections = requireSections(doc);
        List<Section> selected;
        if (spec.startsWith("#:")) {
            List<Integer> indexes;
            try {
                indexes = SectionRanges.parse(spec.substring(2), sections.size());
            } catch (IllegalArgumentException e) {
                throw new SectionResolutionException(
                        "Invalid section range '" + spec + "': " + e.getMessage());
            }
            if (indexes.isEmpty()) {
                throw new SectionResolutionException(
                        "No sections in range '"
                                + spec
                                + "'; document has "
                                + sections.size()
                                + " sections");
            }
            selected = indexes.stream().map(sections::get).toList();
        } else {
            Predicate<Section> matches = headingMatches(spec, caseSensitive);
            selected = sections.stream().filter(matches).toList();
            if (selected.isEmpty()) {
                throw new SectionResolutionException(
                        "No sections match pattern '"
                                + spec
                                + "'; available headings: "
                                + sections.stream().map(Section::headingText).toList());
            }
        }
        logger.debug("Extracting {} sections for '{}'", selected.size(), spec);
        return joinSections(doc, selected, separator);
    }

    /**
     * Extracts the sections at the given 0-based indexes, in the order given. Indexes out of range
     * are skipped.
     *
     * @throws SectionResolutionException if the document has no sections or no index is valid
     */
    public static Document extractSections(
            Document doc, List<Integer> indexes, Block separator) {
        List<Section> sections = requireSections(doc);
        List<Section> selected = new ArrayList<>();
        for (int index : indexes) {
            if (index >= 0 && index < sections.size()) {
                selected.add(sections.get(index));
            }
        }
        if (selected.isEmpty()) {
            throw new SectionResolutionException(
                    "No valid sections in index list "
                            + indexes
                            + " (0-"
                            + (sections.size() - 1)
                            + ")");
        }
        return joinSections(doc, selected, separator);
    }

    private static List<Section> requireSections(Document doc) {
        List<Section> sections = getAllSections(doc);
        if (sections.isEmpty()) {
            throw new SectionResolutionException("Document contains no sections (headings)");
        }
        return sections;
    }

    private static Document joinSections(Document doc, List<Section> sections, Block separator) {
        List<Block> children = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            if (i > 0 && separator != null) {
                children.add(separator);
            }
            children.addAll(sections.get(i).blocks());
        }
        return doc.withChildren(children);
    }

    /** Replaces the target section, heading included, with {@code replacement}. */
    public static Document replaceSection(
            Document doc, SectionTarget target, List<? extends Block> replacement) {
        Section section = resolve(doc, target);
        return splice(doc, section.startIndex(), section.endIndex(), replacement);
    }

    public static Document removeSection(Document doc, SectionTarget target) {
        Section section = resolve(doc, target);
        return splice(doc, section.startIndex(), section.endIndex(), List.of());
    }

    public static Document insertIntoSection(
            Document doc, SectionTarget target, List<? extends Block> blocks, InsertPosition at) {
        Section section = resolve(doc, target);
        int pos =
                switch (at) {
                    case START, AFTER_HEADING -> section.startIndex() + 1;
                    case END -> section.endIndex();
                };
        return splice(doc, pos, pos, blocks);
    }

    /** Inserts {@code newSection} (usually a heading followed by content) before the target. */
    public static Document addSectionBefore(
            Document doc, SectionTarget target, List<? extends Block> newSection) {
        int pos = resolve(doc, target).startIndex();
        return splice(doc, pos, pos, newSection);
    }

    /** Inserts {@code newSection} after the target's last block, sub-sections included. */
    public static Document addSectionAfter(
            Document doc, SectionTarget target, List<? extends Block> newSection) {
        int pos = resolve(doc, target).endIndex();
        return splice(doc, pos, pos, newSection);
    }

    public static Document addSectionAfter(Document doc, SectionTarget target, Section section) {
        return addSectionAfter(doc, target, section.blocks());
    }

    public static Document addSectionBefore(Document doc, SectionTarget target, Section section) {
        return addSectionBefore(doc, target, section.blocks());
    }

    /**
     * Returns one document per section of {@link #getAllSections(Document)}, preceded by the
     * preamble when {@code includePreamble} is set and the preamble is non-empty.
     */
    public static List<Document> splitBySections(Document doc, boolean includePreamble) {
        List<Document> out = new ArrayList<>();
        if (includePreamble) {
            List<Block> preamble = getPreamble(doc);
            if (!preamble.isEmpty()) {
                out.add(doc.withChildren(preamble));
            }
        }
        for (Section section : getAllSections(doc)) {
            out.add(doc.withChildren(section.blocks()));
        }
        return out;
    }

    private static Document splice(
            Document doc, int from, int to, List<? extends Block> replacement) {
        List<Block> children = new ArrayList<>(doc.children().subList(0, from));
        children.addAll(replacement);
        children.addAll(doc.children().subList(to, doc.children().size()));
        return doc.withChildren(children);
    }

    // Table of contents

    /**
     * Returns a markdown table of contents: a title line, a blank line and one indented anchor
     * link per heading up to {@code maxLevel}. A document without headings gives "".
     */
    public static String generateToc(Document doc, int maxLevel) {
        List<Section> sections = tocSections(doc, maxLevel);
        if (sections.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("# ").append(TOC_TITLE).append("\n\n");
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            String text = section.headingText();
            sb.append("  ".repeat(section.level() - 1))
                    .append("- [")
                    .append(text)
                    .append("](#")
                    .append(Slugs.uniqueSlug(text, seen))
                    .append(')');
            if (i < sections.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /** Same as {@link #generateToc(Document, int)} with the configured {@code toc_max_level}. */
    public static String generateToc(Document doc, DocTreeConfig config) {
        return generateToc(doc, config.getTocMaxLevel());
    }

    /**
     * Returns the table of contents as a bulleted list of heading texts. When {@code nested},
     * deeper headings sit in sub-lists under the preceding shallower heading, with empty items
     * filling skipped levels.
     */
    public static ListBlock generateTocList(Document doc, int maxLevel, boolean nested) {
        List<Section> sections = tocSections(doc, maxLevel);
        if (!nested) {
            List<ListItem> items = new ArrayList<>();
            for (Section section : sections) {
                items.add(ListItem.of(Paragraph.text(section.headingText())));
            }
            return new ListBlock(false, items);
        }
        return nestedToc(sections).toList();
    }

    /** Returns a copy of {@code doc} with a table of contents inserted at {@code position}. */
    public static Document insertToc(
            Document doc, TocPosition position, int maxLevel, TocStyle style) {
        List<Block> toc = new ArrayList<>();
        if (style == TocStyle.MARKDOWN) {
            List<Section> sections = tocSections(doc, maxLevel);
            if (!sections.isEmpty()) {
                toc.add(Heading.text(1, TOC_TITLE));
                toc.add(linkList(sections));
            }
        } else {
            toc.add(generateTocList(doc, maxLevel, style == TocStyle.NESTED));
        }

        int pos = 0;
        if (position == TocPosition.AFTER_FIRST_HEADING) {
            for (int i = 0; i < doc.children().size(); i++) {
                if (doc.children().get(i) instanceof Heading) {
                    pos = i + 1;
                    break;
                }
            }
        }
        return splice(doc, pos, pos, toc);
    }

    public static Document insertToc(
            Document doc, TocPosition position, TocStyle style, DocTreeConfig config) {
        return insertToc(doc, position, config.getTocMaxLevel(), style);
    }

    private static List<Section> tocSections(Document doc, int maxLevel) {
        if (!Heading.isValidLevel(maxLevel)) {
            throw new IllegalArgumentException(
                    "maxLevel must be between 1 and 6, got " + maxLevel);
        }
        return getAllSections(doc, Heading.MIN_LEVEL, maxLevel);
    }

    private static ListBlock linkList(List<Section> sections) {
        Set<String> seen = new HashSet<>();
        List<ListItem> items = new ArrayList<>();
        for (Section section : sections) {
            String text = section.headingText();
            Link link = Link.text("#" + Slugs.uniqueSlug(text, seen), text);
            items.add(ListItem.of(Paragraph.of(link)));
        }
        return new ListBlock(false, items);
    }

    private static TocEntry nestedToc(List<Section> sections) {
        TocEntry root = new TocEntry(null);
        if (sections.isEmpty()) {
            return root;
        }
        int minLevel = sections.stream().mapToInt(Section::level).min().getAsInt();

        // Each stack frame is an entry whose children hold headings of the paired level
        Deque<TocEntry> entries = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        entries.push(root);
        levels.push(minLevel);

        for (Section section : sections) {
            int level = section.level();
            while (entries.size() > 1 && levels.peek() > level) {
                entries.pop();
                levels.pop();
            }
            TocEntry current = entries.peek();
            int currentLevel = levels.peek();
            while (currentLevel < level) {
                if (current.children.isEmpty()) {
                    current.children.add(new TocEntry(null));
                }
                current = current.last();
                currentLevel++;
                entries.push(current);
                levels.push(currentLevel);
            }
            current.children.add(new TocEntry(section.headingText()));
        }
        return root;
    }

    private static final class TocEntry {
        private final String text;
        private final List<TocEntry> children = new ArrayList<>();

        TocEntry(String text) {
            this.text = text;
        }

        TocEntry last() {
            return children.get(children.size() - 1);
        }

        ListBlock toList() {
            List<ListItem> items = new ArrayList<>();
            for (TocEntry child : children) {
                items.add(child.toItem());
            }
            return new ListBlock(false, items);
        }

        ListItem toItem() {
            List<Block> blocks = new ArrayList<>();
            if (text != null) {
                blocks.add(new Paragraph(List.of(new Text(text))));
            }
            if (!children.isEmpty()) {
                blocks.add(toList());
            }
            return new ListItem(blocks);
        }
    }
}
