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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.doctree.node.Block;
import net.boyechko.doctree.node.CodeBlock;
import net.boyechko.doctree.node.Document;
import net.boyechko.doctree.node.Heading;
import net.boyechko.doctree.node.Inline;
import net.boyechko.doctree.node.ListBlock;
import net.boyechko.doctree.node.ListItem;
import net.boyechko.doctree.node.Paragraph;
import net.boyechko.doctree.node.SourceLocation;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.ThematicBreak;

/**
 * Fluent builder for documents, mainly for tests and programmatic generation.
 *
 * <pre>{@code
 * Document doc = new DocumentBuilder()
 *         .heading(1, "Intro")
 *         .paragraph("Some text.")
 *         .build();
 * }</pre>
 */
public class DocumentBuilder {
    private final List<Block> children = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private SourceLocation sourceLocation;

    public DocumentBuilder block(Block block) {
        children.add(block);
        return this;
    }

    public DocumentBuilder heading(int level, String text) {
        return block(Heading.text(level, text));
    }

    public DocumentBuilder heading(int level, Inline... content) {
        return block(Heading.of(level, content));
    }

    public DocumentBuilder paragraph(String text) {
        return block(Paragraph.text(text));
    }

    public DocumentBuilder paragraph(Inline... content) {
        return block(Paragraph.of(content));
    }

    public DocumentBuilder code(String content, String language) {
        return block(new CodeBlock(content, language));
    }

    public DocumentBuilder thematicBreak() {
        return block(new ThematicBreak());
    }

    /** Adds a tight list with one single-paragraph item per string. */
    public DocumentBuilder list(boolean ordered, String... items) {
        List<ListItem> listItems = new ArrayList<>();
        for (String item : items) {
            listItems.add(ListItem.of(Paragraph.text(item)));
        }
        return block(new ListBlock(ordered, listItems));
    }

    /** Adds a table of plain-text cells; {@code header} may be null for a headerless table. */
    public DocumentBuilder table(List<String> header, List<List<String>> rows) {
        TableRow headerRow = header != null ? new TableRow(cells(header), true) : null;
        List<TableRow> dataRows = new ArrayList<>();
        for (List<String> row : rows) {
            dataRows.add(new TableRow(cells(row), false));
        }
        return block(new Table(headerRow, dataRows));
    }

    public DocumentBuilder table(String[] header, String[]... rows) {
        List<List<String>> data = new ArrayList<>();
        for (String[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return table(header != null ? Arrays.asList(header) : null, data);
    }

    public DocumentBuilder metadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    public DocumentBuilder sourceLocation(SourceLocation location) {
        this.sourceLocation = location;
        return this;
    }

    public Document build() {
        return new Document(children, metadata, sourceLocation);
    }

    private static List<TableCell> cells(List<String> texts) {
        List<TableCell> cells = new ArrayList<>();
        for (String text : texts) {
            cells.add(TableCell.text(text));
        }
        return cells;
    }
}
