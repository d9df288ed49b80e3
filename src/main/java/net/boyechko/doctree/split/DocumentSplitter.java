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
package net.boyechko.doctree.split;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import net.boyechko.doctree.core.DocTreeConfig;
import net.boyechko.doctree.document.Section;
import net.boyechko.doctree.document.Sections;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.ThematicBreak;
import net.boyechko.doctree.visitors.TextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a document into self-contained parts. Every strategy cuts only between top-level
 * blocks, so each block of the input lands in exactly one part, and part documents inherit the
 * input's metadata and source location.
 */
public class DocumentSplitter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentSplitter.class);

    public static final String STRATEGY_KEY = "strategy";
    public static final String REASON_KEY = "reason";

    private static final Pattern RULE_DELIMITER = Pattern.compile("^-{3,}$|^\\*{3,}$|^_{3,}$");

    private final DocTreeConfig config;

    public DocumentSplitter() {
        this(DocTreeConfig.loadDefault());
    }

    public DocumentSplitter(DocTreeConfig config) {
        this.config = config;
    }

    /**
     * Splits according to a parsed spec.
     *
     * @throws UnsupportedOperationException for {@code page} and {@code chapter}, which depend on
     *     the source format and must be handled by the caller
     */
    public List<SplitResult> split(Document doc, SplitSpec spec) {
        logger.debug("Splitting document with {} blocks by {}", doc.children().size(), spec);
        return switch (spec.strategy()) {
            case HEADING -> splitByHeadingLevel(doc, spec.number(), true);
            case LENGTH -> splitByWordCount(doc, spec.number());
            case PARTS -> splitByParts(doc, spec.number());
            case DELIMITER -> splitByDelimiter(doc, spec.delimiter());
            case BREAK -> splitByBreak(doc);
            case AUTO -> splitAuto(doc);
            case PAGE, CHAPTER -> throw new UnsupportedOperationException(
                    "Split strategy '"
                            + spec.strategy().key()
                            + "' depends on the source format and is not supported on a"
                            + " document tree");
        };
    }

    public List<SplitResult> splitByHeadingLevel(Document doc, int level) {
        return splitByHeadingLevel(doc, level, true);
    }

    /**
     * Starts a new part at every heading of {@code level}. A heading of higher rank also starts a
     * part, titled with its own text, so that no content is lost. Content before the first such
     * heading becomes a part titled {@value SplitResult#PREAMBLE_TITLE} when {@code
     * includePreamble} is set and is dropped otherwise.
     *
     * <p>If the document has no heading of exactly {@code level}, the result is a single untitled
     * part holding the whole document, with {@code reason = no_headings_found}.
     */
    public List<SplitResult> splitByHeadingLevel(
            Document doc, int level, boolean includePreamble) {
        if (!Heading.isValidLevel(level)) {
            throw new IllegalArgumentException(
                    "Heading level must be between 1 and 6, got " + level);
        }
        boolean found =
                doc.children().stream().anyMatch(b -> b instanceof Heading h && h.level() == level);
        if (!found) {
            logger.debug("No level {} headings; returning the whole document", level);
            return List.of(whole(doc, null, "no_headings_found"));
        }

        List<SplitResult> parts = new ArrayList<>();
        for (Section section : Sections.partition(doc, level)) {
            if (section.isPreamble()) {
                if (includePreamble) {
                    String title = SplitResult.PREAMBLE_TITLE;
                    parts.add(part(doc, section.blocks(), parts.size() + 1, title));
                }
                continue;
            }
            parts.add(part(doc, section.blocks(), parts.size() + 1, section.headingText()));
        }
        return parts;
    }

    /**
     * Greedily packs whole sections (every heading starts one) into parts of at most {@code
     * targetWords} words. A section is never divided, so a section larger than the target
     * becomes a part of its own. Content before the first heading is packed like a section.
     */
    public List<SplitResult> splitByWordCount(Document doc, int targetWords) {
        if (targetWords < 1) {
            throw new IllegalArgumentException(
                    "Target word count must be at least 1, got " + targetWords);
        }
        List<Section> units = Sections.partition(doc, Heading.MAX_LEVEL);
        if (units.stream().allMatch(Section::isPreamble)) {
            return List.of(whole(doc, null, "no_sections"));
        }

        List<SplitResult> parts = new ArrayList<>();
        List<Block> current = new ArrayList<>();
        int currentWords = 0;
        String currentTitle = null;

        for (Section unit : units) {
            List<Block> blocks = unit.blocks();
            int words = TextExtractor.countWords(blocks);
            String title = unit.isPreamble() ? SplitResult.PREAMBLE_TITLE : unit.headingText();
            if (words > targetWords) {
                logger.warn(
                        "Section '{}' has {} words, more than the target of {}; it becomes an"
                                + " oversized part",
                        title,
                        words,
                        targetWords);
            }

            if (currentWords + words > targetWords && !current.isEmpty()) {
                parts.add(part(doc, current, parts.size() + 1, currentTitle, currentWords));
                current = new ArrayList<>();
                currentWords = 0;
                currentTitle = null;
            }
            current.addAll(blocks);
            currentWords += words;
            if (currentTitle == null) {
                currentTitle = title;
            }
        }
        if (!current.isEmpty()) {
            parts.add(part(doc, current, parts.size() + 1, currentTitle, currentWords));
        }
        return parts;
    }

    /**
     * Splits into roughly {@code numParts} parts by packing sections against a target of {@code
     * totalWords / numParts}. The result may have more or fewer parts than requested.
     */
    public List<SplitResult> splitByParts(Document doc, int numParts) {
        if (numParts < 1) {
            throw new IllegalArgumentException(
                    "Number of parts must be at least 1, got " + numParts);
        }
        int totalWords = TextExtractor.countWords(doc.children());
        if (totalWords == 0) {
            return List.of(whole(doc, null, null));
        }
        int target = Math.max(1, totalWords / numParts);
        logger.debug(
                "Splitting {} words into {} parts, target {} words", totalWords, numParts, target);
        return splitByWordCount(doc, target);
    }

    /**
     * Ends a part at every paragraph whose text, trimmed, equals the trimmed delimiter. When the
     * delimiter looks like a horizontal rule ({@code ---}, {@code ***}, {@code ___}), thematic
     * breaks count too. Delimiters are dropped and empty parts are skipped; parts are titled
     * "Part n".
     */
    public List<SplitResult> splitByDelimiter(Document doc, String delimiter) {
        if (delimiter == null || delimiter.isBlank()) {
            throw new IllegalArgumentException("Delimiter cannot be empty");
        }
        String wanted = delimiter.strip();
        boolean ruleLike = RULE_DELIMITER.matcher(wanted).matches();
        return splitAt(
                doc,
                block -> {
                    if (block instanceof ThematicBreak) {
                        return ruleLike;
                    }
                    return block instanceof Paragraph p
                            && TextExtractor.extract(p, "").strip().equals(wanted);
                },
                "no_delimiters_found");
    }

    /** Ends a part at every thematic break; parts are titled "Part n". */
    public List<SplitResult> splitByBreak(Document doc) {
        return splitAt(doc, block -> block instanceof ThematicBreak, "no_breaks_found");
    }

    private List<SplitResult> splitAt(
            Document doc, Predicate<Block> isSeparator, String noMatchReason) {
        List<SplitResult> parts = new ArrayList<>();
        List<Block> current = new ArrayList<>();
        boolean matched = false;
        for (Block block : doc.children()) {
            if (!isSeparator.test(block)) {
                current.add(block);
                continue;
            }
            matched = true;
            if (!current.isEmpty()) {
                parts.add(part(doc, current, parts.size() + 1, "Part " + (parts.size() + 1)));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            parts.add(part(doc, current, parts.size() + 1, "Part " + (parts.size() + 1)));
        }
        if (!matched) {
            return List.of(whole(doc, "Part 1", noMatchReason));
        }
        if (parts.isEmpty()) {
            parts.add(part(doc, List.of(), 1, "Part 1"));
        }
        return parts;
    }

    public List<SplitResult> splitAuto(Document doc) {
        return splitAuto(doc, config.getAutoTargetWords());
    }

    /**
     * Picks a strategy from the document's shape: H1 sections when the largest is at most {@code
     * auto_h1_max_factor} times the target, otherwise H2 sections when their average is at most
     * {@code auto_h2_avg_factor} times the target, otherwise word-count packing. Every part
     * records the choice under {@code metadata.strategy}.
     */
    public List<SplitResult> splitAuto(Document doc, int targetWords) {
        if (targetWords < 1) {
            throw new IllegalArgumentException(
                    "Target word count must be at least 1, got " + targetWords);
        }
        List<SplitResult> parts;
        String strategy;

        List<Integer> h1Words = sectionWords(doc, 1);
        List<Integer> h2Words = sectionWords(doc, 2);
        int maxH1 = h1Words.stream().mapToInt(Integer::intValue).max().orElse(0);
        double avgH2 = h2Words.stream().mapToInt(Integer::intValue).average().orElse(0);

        if (!h1Words.isEmpty() && maxH1 <= config.getAutoH1MaxFactor() * targetWords) {
            strategy = "auto:h1";
            parts = splitByHeadingLevel(doc, 1, true);
        } else if (!h2Words.isEmpty() && avgH2 <= config.getAutoH2AvgFactor() * targetWords) {
            strategy = "auto:h2";
            parts = splitByHeadingLevel(doc, 2, true);
        } else {
            strategy = "auto:word_count";
            parts = splitByWordCount(doc, targetWords);
        }
        logger.debug(
                "Auto split chose {} (target {}, {} H1 sections max {} words, {} H2 sections avg"
                        + " {} words)",
                strategy,
                targetWords,
                h1Words.size(),
                maxH1,
                h2Words.size(),
                avgH2);
        for (SplitResult part : parts) {
            part.metadata().put(STRATEGY_KEY, strategy);
        }
        return parts;
    }

    /**
     * One part per section, where every heading starts a section. The preamble, if any, comes
     * first when {@code includePreamble} is set.
     */
    public List<SplitResult> splitBySections(Document doc, boolean includePreamble) {
        List<SplitResult> parts = new ArrayList<>();
        for (Section section : Sections.partition(doc, Heading.MAX_LEVEL)) {
            if (section.isPreamble() && !includePreamble) {
                continue;
            }
            String title =
                    section.isPreamble() ? SplitResult.PREAMBLE_TITLE : section.headingText();
            parts.add(part(doc, section.blocks(), parts.size() + 1, title));
        }
        return parts;
    }

    private static List<Integer> sectionWords(Document doc, int level) {
        return Sections.getAllSections(doc, level, level).stream()
                .map(section -> TextExtractor.countWords(section.blocks()))
                .toList();
    }

    private static SplitResult part(Document doc, List<Block> blocks, int index, String title) {
        return part(doc, blocks, index, title, TextExtractor.countWords(blocks));
    }

    private static SplitResult part(
            Document doc, List<Block> blocks, int index, String title, int wordCount) {
        Document partDoc = new Document(blocks, doc.metadata(), doc.sourceLocation());
        return new SplitResult(partDoc, index, title, wordCount);
    }

    private static SplitResult whole(Document doc, String title, String reason) {
        Map<String, Object> metadata = reason != null ? Map.of(REASON_KEY, reason) : Map.of();
        return new SplitResult(
                doc, 1, title, TextExtractor.countWords(doc.children()), metadata);
    }
}
