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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.doctree.core.DocTreeConfig;
import net.boyechko.doctree.document.DocumentBuilder;
import net.boyechko.doctree.document.Section;
import net.boyechko.doctree.document.Sections;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.ThematicBreak;
import net.boyechko.doctree.visitors.TextExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

class DocumentSplitterTest {

    private final DocumentSplitter splitter = new DocumentSplitter(DocTreeConfig.defaults());

    private static String words(int n) {
        return String.join(" ", Collections.nCopies(n, "word"));
    }

    private static Document scenario() {
        return new DocumentBuilder()
                .paragraph("pre")
                .heading(1, "Intro")
                .paragraph("a")
                .heading(1, "Methods")
                .paragraph("b")
                .heading(1, "Results")
                .paragraph("c")
                .build();
    }

    private static Document mixed() {
        return new DocumentBuilder()
                .paragraph("Opening remarks here")
                .heading(1, "Part One")
                .paragraph(words(3))
                .heading(2, "Background")
                .paragraph(words(4))
                .heading(3, "Detail")
                .paragraph(words(2))
                .heading(1, "Part Two")
                .thematicBreak()
                .heading(2, "Summary")
                .paragraph(words(5))
                .metadata("title", "Mixed")
                .build();
    }

    private static List<Block> reassemble(List<SplitResult> parts) {
        List<Block> all = new ArrayList<>();
        for (SplitResult part : parts) {
            all.addAll(part.document().children());
        }
        return all;
    }

    private static List<String> titles(List<SplitResult> parts) {
        return parts.stream().map(SplitResult::title).toList();
    }

    // Heading level

    @Test
    void splitsAtEachTopLevelHeadingWithPreamble() {
        List<SplitResult> parts = splitter.splitByHeadingLevel(scenario(), 1);

        assertEquals(List.of("Preamble", "Intro", "Methods", "Results"), titles(parts));
        for (SplitResult part : parts) {
            long paragraphs =
                    part.document().children().stream()
                            .filter(b -> b instanceof Paragraph)
                            .count();
            assertEquals(1, paragraphs, part.toString());
        }
        assertEquals(List.of(1, 2, 3, 4), parts.stream().map(SplitResult::index).toList());
    }

    @Test
    void preambleCanBeDropped() {
        List<SplitResult> parts = splitter.splitByHeadingLevel(scenario(), 1, false);

        assertEquals(List.of("Intro", "Methods", "Results"), titles(parts));
    }

    @ParameterizedTest(name = "level {0}")
    @ValueSource(ints = {1, 2, 3, 4})
    void headingSplitReassemblesDocument(int level) {
        Document doc = mixed();

        List<SplitResult> parts = splitter.splitByHeadingLevel(doc, level, true);

        assertEquals(doc.children(), reassemble(parts));
    }

    @ParameterizedTest(name = "level {0}")
    @ValueSource(ints = {1, 2, 3})
    void sectionPartitionHasNoGapsOrOverlaps(int level) {
        Document doc = mixed();
        int expectedStart = 0;
        for (Section section : Sections.partition(doc, level)) {
            assertEquals(expectedStart, section.startIndex());
            expectedStart = section.endIndex();
        }
        assertEquals(doc.children().size(), expectedStart);
    }

    @Test
    void higherRankHeadingsStillStartParts() {
        List<SplitResult> parts = splitter.splitByHeadingLevel(mixed(), 2);

        assertEquals(
                List.of("Preamble", "Part One", "Background", "Part Two", "Summary"),
                titles(parts));
    }

    @Test
    void missingLevelGivesWholeDocument() {
        Document doc = scenario();

        List<SplitResult> parts = splitter.splitByHeadingLevel(doc, 2);

        assertEquals(1, parts.size());
        SplitResult only = parts.get(0);
        assertNull(only.title());
        assertEquals("", only.getFilenameSlug());
        assertEquals("no_headings_found", only.metadata().get(DocumentSplitter.REASON_KEY));
        assertEquals(doc, only.document());
    }

    @Test
    void partsInheritDocumentMetadata() {
        for (SplitResult part : splitter.splitByHeadingLevel(mixed(), 1)) {
            assertEquals("Mixed", part.document().metadata().get("title"));
        }
    }

    @Test
    void rejectsInvalidHeadingLevel() {
        assertThrows(
                IllegalArgumentException.class, () -> splitter.splitByHeadingLevel(mixed(), 7));
    }

    // Word count

    @Test
    void wordCountPacksWholeSectionsGreedily() {
        Document doc =
                new DocumentBuilder()
                        .heading(1, "A")
                        .paragraph(words(2))
                        .heading(2, "B")
                        .paragraph(words(3))
                        .heading(2, "C")
                        .paragraph(words(11))
                        .heading(1, "D")
                        .paragraph(words(1))
                        .build();

        List<SplitResult> parts = splitter.splitByWordCount(doc, 8);

        assertEquals(List.of("A", "C", "D"), titles(parts));
        assertEquals(List.of(7, 12, 2), parts.stream().map(SplitResult::wordCount).toList());
        assertEquals(doc.children(), reassemble(parts));
    }

    @ParameterizedTest(name = "target {0}")
    @ValueSource(ints = {1, 3, 5, 8, 20, 100})
    void wordCountNeverOvershootsExceptForSingleSections(int target) {
        Document doc = mixed();
        List<List<Block>> units =
                Sections.partition(doc, Heading.MAX_LEVEL).stream()
                        .map(Section::blocks)
                        .toList();

        for (SplitResult part : splitter.splitByWordCount(doc, target)) {
            assertEquals(TextExtractor.countWords(part.document().children()), part.wordCount());
            if (part.wordCount() > target) {
                assertTrue(
                        units.contains(part.document().children()),
                        "oversized part is not a single section: " + part);
            }
        }
    }

    @Test
    void oversizedSectionLogsWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(DocumentSplitter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Document doc =
                    new DocumentBuilder().heading(1, "Huge").paragraph(words(30)).build();

            List<SplitResult> parts = splitter.splitByWordCount(doc, 10);

            assertEquals(1, parts.size());
            assertEquals(31, parts.get(0).wordCount());
            List<ILoggingEvent> warnings =
                    appender.list.stream().filter(e -> e.getLevel() == Level.WARN).toList();
            assertEquals(1, warnings.size());
            assertTrue(
                    warnings.get(0).getFormattedMessage().contains("'Huge' has 31 words"),
                    warnings.get(0).getFormattedMessage());
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void headinglessDocumentIsOnePart() {
        Document doc = Document.of(Paragraph.text(words(50)));

        List<SplitResult> parts = splitter.splitByWordCount(doc, 10);

        assertEquals(1, parts.size());
        assertEquals("no_sections", parts.get(0).metadata().get(DocumentSplitter.REASON_KEY));
    }

    // Parts

    @Test
    void splitByPartsPreservesWordCount() {
        Document doc =
                Document.of(
                        Paragraph.text("alpha beta"),
                        Paragraph.text("gamma delta epsilon"),
                        Paragraph.text("zeta"));

        List<SplitResult> parts = splitter.splitByParts(doc, 3);

        int total = parts.stream().mapToInt(SplitResult::wordCount).sum();
        assertEquals(6, total);
        assertEquals(6, TextExtractor.countWords(reassemble(parts)));
    }

    @Test
    void splitByPartsBalancesEqualSections() {
        DocumentBuilder builder = new DocumentBuilder();
        for (int i = 1; i <= 4; i++) {
            builder.heading(1, "S" + i).paragraph(words(4));
        }

        List<SplitResult> parts = splitter.splitByParts(builder.build(), 2);

        assertEquals(List.of("S1", "S3"), titles(parts));
        assertEquals(List.of(10, 10), parts.stream().map(SplitResult::wordCount).toList());
    }

    @Test
    void splitByPartsOfEmptyDocumentIsWholeDocument() {
        List<SplitResult> parts = splitter.splitByParts(Document.of(new ThematicBreak()), 3);

        assertEquals(1, parts.size());
        assertEquals(0, parts.get(0).wordCount());
    }

    @Test
    void rejectsNonPositiveCounts() {
        assertThrows(IllegalArgumentException.class, () -> splitter.splitByParts(mixed(), 0));
        assertThrows(IllegalArgumentException.class, () -> splitter.splitByWordCount(mixed(), 0));
    }

    // Delimiters and breaks

    @Test
    void splitsAtDelimiterParagraphs() {
        Document doc =
                new DocumentBuilder()
                        .paragraph("one")
                        .paragraph("---")
                        .paragraph("two")
                        .paragraph("  ---  ")
                        .paragraph("three")
                        .build();

        List<SplitResult> parts = splitter.splitByDelimiter(doc, "---");

        assertEquals(List.of("Part 1", "Part 2", "Part 3"), titles(parts));
        assertEquals(
                List.of("one", "two", "three"),
                parts.stream().map(p -> TextExtractor.extract(p.document())).toList());
    }

    @Test
    void ruleLikeDelimiterAlsoMatchesThematicBreaks() {
        Document doc =
                new DocumentBuilder()
                        .paragraph("one")
                        .thematicBreak()
                        .paragraph("two")
                        .paragraph("***")
                        .paragraph("three")
                        .build();

        assertEquals(3, splitter.splitByDelimiter(doc, "***").size());
        assertEquals(1, splitter.splitByDelimiter(doc, "###").size());
        assertEquals(2, splitter.splitByDelimiter(doc, "---").size());
    }

    @Test
    void emptyPartsBetweenDelimitersAreSkipped() {
        Document doc =
                new DocumentBuilder()
                        .paragraph("a")
                        .paragraph("%%")
                        .paragraph("%%")
                        .paragraph("b")
                        .paragraph("%%")
                        .build();

        assertEquals(List.of("Part 1", "Part 2"), titles(splitter.splitByDelimiter(doc, "%%")));
    }

    @Test
    void documentWithoutDelimitersIsOnePart() {
        Document doc = scenario();

        List<SplitResult> parts = splitter.splitByDelimiter(doc, "===");

        assertEquals(1, parts.size());
        assertEquals("Part 1", parts.get(0).title());
        assertEquals("no_delimiters_found", parts.get(0).metadata().get("reason"));
        assertEquals(doc, parts.get(0).document());
    }

    @Test
    void blankDelimiterIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> splitter.splitByDelimiter(mixed(), " "));
    }

    @Test
    void splitsAtThematicBreaks() {
        Document doc = Document.of(Paragraph.text("a"), new ThematicBreak(), Paragraph.text("b"));

        List<SplitResult> parts = splitter.splitByBreak(doc);

        assertEquals(List.of("Part 1", "Part 2"), titles(parts));
        assertEquals(
                "no_breaks_found",
                splitter.splitByBreak(scenario()).get(0).metadata().get("reason"));
    }

    // Auto

    private static DocumentSplitter smallTarget() {
        return new DocumentSplitter(DocTreeConfig.fromResource("/config/small-target.yaml"));
    }

    @Test
    void autoUsesH1WhenSectionsAreSmallEnough() {
        Document doc =
                new DocumentBuilder()
                        .heading(1, "A")
                        .paragraph(words(5))
                        .heading(1, "B")
                        .paragraph(words(5))
                        .build();

        List<SplitResult> parts = smallTarget().splitAuto(doc);

        assertEquals(List.of("A", "B"), titles(parts));
        for (SplitResult part : parts) {
            assertEquals("auto:h1", part.metadata().get(DocumentSplitter.STRATEGY_KEY));
        }
    }

    @Test
    void autoFallsBackToH2() {
        DocumentBuilder builder = new DocumentBuilder().heading(1, "Big");
        for (String name : List.of("One", "Two", "Three")) {
            builder.heading(2, name).paragraph(words(8));
        }

        List<SplitResult> parts = smallTarget().splitAuto(builder.build());

        assertEquals(List.of("Big", "One", "Two", "Three"), titles(parts));
        assertEquals("auto:h2", parts.get(0).metadata().get(DocumentSplitter.STRATEGY_KEY));
    }

    @Test
    void autoFallsBackToWordCount() {
        Document doc = new DocumentBuilder().heading(1, "Huge").paragraph(words(50)).build();

        List<SplitResult> parts = smallTarget().splitAuto(doc);

        assertEquals(1, parts.size());
        assertEquals(
                "auto:word_count", parts.get(0).metadata().get(DocumentSplitter.STRATEGY_KEY));
    }

    @Test
    void autoOnHeadinglessDocumentKeepsReason() {
        List<SplitResult> parts =
                smallTarget().splitAuto(Document.of(Paragraph.text(words(40))));

        assertEquals(1, parts.size());
        assertEquals("auto:word_count", parts.get(0).metadata().get("strategy"));
        assertEquals("no_sections", parts.get(0).metadata().get("reason"));
    }

    @Test
    void defaultConfigSplitsShortDocumentAtH1() {
        List<SplitResult> parts = new DocumentSplitter().splitAuto(scenario());

        assertEquals(List.of("Preamble", "Intro", "Methods", "Results"), titles(parts));
    }

    // Spec dispatch

    @Test
    void dispatchesParsedSpecs() {
        Document doc = scenario();

        assertEquals(
                titles(splitter.splitByHeadingLevel(doc, 1)),
                titles(splitter.split(doc, SplitSpec.parse("h1"))));
        assertEquals(1, splitter.split(doc, SplitSpec.parse("break")).size());
        assertEquals(4, splitter.split(doc, SplitSpec.parse("length=1")).size());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"page", "chapter"})
    void formatDependentStrategiesAreUnsupported(String spec) {
        SplitSpec parsed = SplitSpec.parse(spec);
        assertThrows(UnsupportedOperationException.class, () -> splitter.split(scenario(), parsed));
    }

    @Test
    void splitBySectionsGivesOnePartPerHeading() {
        List<SplitResult> parts = splitter.splitBySections(mixed(), true);

        assertEquals(
                List.of("Preamble", "Part One", "Background", "Detail", "Part Two", "Summary"),
                titles(parts));
        assertEquals(mixed().children(), reassemble(parts));
        assertEquals(5, splitter.splitBySections(mixed(), false).size());
    }

    @Test
    void filenameSlugFollowsTitle() {
        SplitResult result = new SplitResult(Document.of(), 1, "Results & Discussion", 0);
        assertEquals("results-discussion", result.getFilenameSlug());
    }
}
