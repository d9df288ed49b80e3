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
package net.boyechko.doctree.serialization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.doctree.node.Alignment;
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
import net.boyechko.doctree.node.SourceLocation;
import net.boyechko.doctree.node.Strikethrough;
import net.boyechko.doctree.node.Strong;
import net.boyechko.doctree.node.StructuralException;
import net.boyechko.doctree.node.Subscript;
import net.boyechko.doctree.node.Superscript;
import net.boyechko.doctree.node.Table;
import net.boyechko.doctree.node.TableCell;
import net.boyechko.doctree.node.TableRow;
import net.boyechko.doctree.node.TaskStatus;
import net.boyechko.doctree.node.Text;
import net.boyechko.doctree.node.ThematicBreak;
import net.boyechko.doctree.node.Underline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Converts node trees to and from plain maps and YAML.
 *
 * <p>Every node becomes a map whose {@code node_type} key names its kind ({@code Heading},
 * {@code List}, {@code HTMLBlock}, ...) and whose other keys are its fields in snake_case.
 * Child nodes nest as lists of such maps. Empty metadata and absent optional fields are omitted.
 * Reading goes through the ordinary node constructors, so persisted input is held to the same
 * structural rules as trees built in code.
 */
public final class NodeSerializer {
    private static final Logger logger = LoggerFactory.getLogger(NodeSerializer.class);

    public static final String TYPE_KEY = "node_type";

    private static final ToMap TO_MAP = new ToMap();

    private NodeSerializer() {}

    public static Map<String, Object> toMap(Node node) {
        return node.accept(TO_MAP);
    }

    public static String toYaml(Node node) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(toMap(node));
    }

    /**
     * Reads a tree written by {@link #toYaml(Node)}. Only plain YAML types are constructed.
     *
     * @throws StructuralException if the YAML is malformed or does not describe a valid tree
     */
    public static Node fromYaml(String yaml) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yaml);
        } catch (YAMLException e) {
            throw new StructuralException("Malformed node YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new StructuralException(
                    "Node YAML must be a mapping, got "
                            + (loaded == null ? "nothing" : loaded.getClass().getSimpleName()));
        }
        return fromMap(map);
    }

    public static Document documentFromYaml(String yaml) {
        Node node = fromYaml(yaml);
        if (!(node instanceof Document doc)) {
            throw new StructuralException("Expected a Document, got " + node.kind());
        }
        return doc;
    }

    /**
     * Rebuilds a node from its map form.
     *
     * @throws StructuralException on an unknown {@code node_type}, a missing required field, a
     *     field of the wrong type, or a child of the wrong kind
     */
    public static Node fromMap(Map<?, ?> map) {
        String type = string(map, TYPE_KEY, "node");
        Map<String, Object> meta = metadata(map, type);
        SourceLocation loc = sourceLocation(map.get("source_location"), type);

        switch (type) {
            case "Document":
                return new Document(nodes(map, "children", Block.class, type), meta, loc);
            case "Heading":
                return new Heading(
                        integer(map, "level", type), inlines(map, type), meta, loc);
            case "Paragraph":
                return new Paragraph(inlines(map, type), meta, loc);
            case "CodeBlock":
                return new CodeBlock(
                        string(map, "content", type),
                        optString(map, "language", type),
                        optString(map, "fence_char", type),
                        optInteger(map, "fence_length", 3, type),
                        meta,
                        loc);
            case "BlockQuote":
                return new BlockQuote(nodes(map, "children", Block.class, type), meta, loc);
            case "List":
                return new ListBlock(
                        bool(map, "ordered", false, type),
                        nodes(map, "items", ListItem.class, type),
                        optInteger(map, "start", 1, type),
                        bool(map, "tight", true, type),
                        meta,
                        loc);
            case "ListItem":
                return new ListItem(
                        nodes(map, "children", Block.class, type),
                        enumValue(map, "task_status", TaskStatus.class, TaskStatus.NONE, type),
                        meta,
                        loc);
            case "Table":
                return new Table(
                        optNode(map, "header", TableRow.class, type),
                        nodes(map, "rows", TableRow.class, type),
                        alignments(map, type),
                        optString(map, "caption", type),
                        meta,
                        loc);
            case "TableRow":
                return new TableRow(
                        nodes(map, "cells", TableCell.class, type),
                        bool(map, "is_header", false, type),
                        meta,
                        loc);
            case "TableCell":
                return new TableCell(
                        inlines(map, type),
                        optInteger(map, "colspan", 1, type),
                        optInteger(map, "rowspan", 1, type),
                        enumValue(map, "alignment", Alignment.class, Alignment.NONE, type),
                        meta,
                        loc);
            case "ThematicBreak":
                return new ThematicBreak(meta, loc);
            case "HTMLBlock":
                return new HtmlBlock(string(map, "content", type), meta, loc);
            case "Comment":
                return new Comment(string(map, "content", type), meta, loc);
            case "FootnoteDefinition":
                return new FootnoteDefinition(
                        optString(map, "identifier", type),
                        nodes(map, "content", Block.class, type),
                        meta,
                        loc);
            case "DefinitionList":
                return new DefinitionList(definitionItems(map, type), meta, loc);
            case "DefinitionTerm":
                return new DefinitionTerm(inlines(map, type), meta, loc);
            case "DefinitionDescription":
                return new DefinitionDescription(
                        nodes(map, "content", Block.class, type), meta, loc);
            case "MathBlock":
                return new MathBlock(
                        string(map, "content", type),
                        optString(map, "notation", type),
                        representations(map, type),
                        meta,
                        loc);
            case "Text":
                return new Text(string(map, "content", type), meta, loc);
            case "Emphasis":
                return new Emphasis(inlines(map, type), meta, loc);
            case "Strong":
                return new Strong(inlines(map, type), meta, loc);
            case "Strikethrough":
                return new Strikethrough(inlines(map, type), meta, loc);
            case "Underline":
                return new Underline(inlines(map, type), meta, loc);
            case "Superscript":
                return new Superscript(inlines(map, type), meta, loc);
            case "Subscript":
                return new Subscript(inlines(map, type), meta, loc);
            case "Code":
                return new Code(string(map, "content", type), meta, loc);
            case "Link":
                return new Link(
                        string(map, "url", type),
                        inlines(map, type),
                        optString(map, "title", type),
                        meta,
                        loc);
            case "Image":
                return new Image(
                        string(map, "url", type),
                        optString(map, "alt_text", type),
                        optString(map, "title", type),
                        optInteger(map, "width", null, type),
                        optInteger(map, "height", null, type),
                        meta,
                        loc);
            case "LineBreak":
                return new LineBreak(bool(map, "soft", false, type), meta, loc);
            case "HTMLInline":
                return new HtmlInline(string(map, "content", type), meta, loc);
            case "CommentInline":
                return new CommentInline(string(map, "content", type), meta, loc);
            case "FootnoteReference":
                return new FootnoteReference(optString(map, "identifier", type), meta, loc);
            case "MathInline":
                return new MathInline(
                        string(map, "content", type),
                        optString(map, "notation", type),
                        representations(map, type),
                        meta,
                        loc);
            default:
                logger.debug("Rejecting unknown node type {}", type);
                throw new StructuralException("Unknown node_type '" + type + "'");
        }
    }

    // Reading helpers

    private static String string(Map<?, ?> map, String key, String type) {
        Object value = map.get(key);
        if (value == null) {
            throw new StructuralException(type + " is missing required field '" + key + "'");
        }
        if (!(value instanceof String s)) {
            throw wrongType(type, key, "a string", value);
        }
        return s;
    }

    private static String optString(Map<?, ?> map, String key, String type) {
        return map.get(key) == null ? null : string(map, key, type);
    }

    private static int integer(Map<?, ?> map, String key, String type) {
        Object value = map.get(key);
        if (value == null) {
            throw new StructuralException(type + " is missing required field '" + key + "'");
        }
        if (!(value instanceof Integer i)) {
            throw wrongType(type, key, "an integer", value);
        }
        return i;
    }

    private static Integer optInteger(Map<?, ?> map, String key, Integer fallback, String type) {
        return map.get(key) == null ? fallback : Integer.valueOf(integer(map, key, type));
    }

    private static boolean bool(Map<?, ?> map, String key, boolean fallback, String type) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean b)) {
            throw wrongType(type, key, "a boolean", value);
        }
        return b;
    }

    private static <E extends Enum<E>> E enumValue(
            Map<?, ?> map, String key, Class<E> enumType, E fallback, String type) {
        String value = optString(map, key, type);
        if (value == null) {
            return fallback;
        }
        try {
            return Enum.valueOf(enumType, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StructuralException(
                    type + " field '" + key + "' has unknown value '" + value + "'", e);
        }
    }

    private static List<?> list(Map<?, ?> map, String key, String type) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> l)) {
            throw wrongType(type, key, "a list", value);
        }
        return l;
    }

    private static <T extends Node> T node(Object value, Class<T> kind, String type, String key) {
        if (!(value instanceof Map<?, ?> child)) {
            throw wrongType(type, key, "a node mapping", value);
        }
        Node node = fromMap(child);
        if (!kind.isInstance(node)) {
            throw new StructuralException(
                    type
                            + " field '"
                            + key
                            + "' can only contain "
                            + kind.getSimpleName()
                            + " nodes, but got "
                            + node.kind());
        }
        return kind.cast(node);
    }

    private static <T extends Node> T optNode(
            Map<?, ?> map, String key, Class<T> kind, String type) {
        Object value = map.get(key);
        return value == null ? null : node(value, kind, type, key);
    }

    private static <T extends Node> List<T> nodes(
            Map<?, ?> map, String key, Class<T> kind, String type) {
        List<T> out = new ArrayList<>();
        for (Object item : list(map, key, type)) {
            out.add(node(item, kind, type, key));
        }
        return out;
    }

    private static List<Inline> inlines(Map<?, ?> map, String type) {
        return nodes(map, "content", Inline.class, type);
    }

    private static List<Alignment> alignments(Map<?, ?> map, String type) {
        List<Alignment> out = new ArrayList<>();
        for (Object item : list(map, "alignments", type)) {
            if (item == null) {
                out.add(Alignment.NONE);
                continue;
            }
            try {
                out.add(Alignment.valueOf(item.toString().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new StructuralException(type + " has unknown alignment '" + item + "'", e);
            }
        }
        return out;
    }

    private static List<DefinitionList.Item> definitionItems(Map<?, ?> map, String type) {
        List<DefinitionList.Item> items = new ArrayList<>();
        for (Object item : list(map, "items", type)) {
            if (!(item instanceof Map<?, ?> entry)) {
                throw wrongType(type, "items", "a list of term mappings", item);
            }
            Object term = entry.get("term");
            if (term == null) {
                throw new StructuralException(type + " item is missing required field 'term'");
            }
            items.add(
                    new DefinitionList.Item(
                            node(term, DefinitionTerm.class, type, "term"),
                            nodes(entry, "descriptions", DefinitionDescription.class, type)));
        }
        return items;
    }

    private static Map<String, String> representations(Map<?, ?> map, String type) {
        Object value = map.get("representations");
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> reps)) {
            throw wrongType(type, "representations", "a mapping", value);
        }
        Map<String, String> out = new LinkedHashMap<>();
        reps.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    private static Map<String, Object> metadata(Map<?, ?> map, String type) {
        Object value = map.get("metadata");
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> entries)) {
            throw wrongType(type, "metadata", "a mapping", value);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        entries.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static SourceLocation sourceLocation(Object value, String type) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw wrongType(type, "source_location", "a mapping", value);
        }
        String owner = type + ".source_location";
        return new SourceLocation(
                string(map, "format", owner),
                optInteger(map, "page", null, owner),
                optInteger(map, "line", null, owner),
                optInteger(map, "column", null, owner),
                optString(map, "element_id", owner),
                metadata(map, owner));
    }

    private static StructuralException wrongType(
            String type, String key, String expected, Object value) {
        return new StructuralException(
                type
                        + " field '"
                        + key
                        + "' must be "
                        + expected
                        + ", got "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    // Writing

    private static final class ToMap implements NodeVisitor<Map<String, Object>> {

        private static Map<String, Object> start(Node node) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(TYPE_KEY, node.kind());
            return map;
        }

        private static Map<String, Object> finish(Node node, Map<String, Object> map) {
            if (!node.metadata().isEmpty()) {
                map.put("metadata", new LinkedHashMap<>(node.metadata()));
            }
            SourceLocation loc = node.sourceLocation();
            if (loc != null) {
                Map<String, Object> locMap = new LinkedHashMap<>();
                locMap.put("format", loc.format());
                putIfPresent(locMap, "page", loc.page());
                putIfPresent(locMap, "line", loc.line());
                putIfPresent(locMap, "column", loc.column());
                putIfPresent(locMap, "element_id", loc.elementId());
                if (!loc.metadata().isEmpty()) {
                    locMap.put("metadata", new LinkedHashMap<>(loc.metadata()));
                }
                map.put("source_location", locMap);
            }
            return map;
        }

        private static void putIfPresent(Map<String, Object> map, String key, Object value) {
            if (value != null) {
                map.put(key, value);
            }
        }

        private List<Map<String, Object>> all(List<? extends Node> nodes) {
            List<Map<String, Object>> out = new ArrayList<>(nodes.size());
            for (Node node : nodes) {
                out.add(node.accept(this));
            }
            return out;
        }

        private Map<String, Object> withContent(Node node, List<? extends Node> content) {
            Map<String, Object> map = start(node);
            map.put("content", all(content));
            return finish(node, map);
        }

        private Map<String, Object> withText(Node node, String content) {
            Map<String, Object> map = start(node);
            map.put("content", content);
            return finish(node, map);
        }

        private Map<String, Object> math(
                Node node, String content, String notation, Map<String, String> reps) {
            Map<String, Object> map = start(node);
            map.put("content", content);
            map.put("notation", notation);
            if (!reps.isEmpty()) {
                map.put("representations", new LinkedHashMap<>(reps));
            }
            return finish(node, map);
        }

        private static String lower(Enum<?> value) {
            return value.name().toLowerCase(Locale.ROOT);
        }

        @Override
        public Map<String, Object> visitDocument(Document node) {
            Map<String, Object> map = start(node);
            map.put("children", all(node.children()));
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitHeading(Heading node) {
            Map<String, Object> map = start(node);
            map.put("level", node.level());
            map.put("content", all(node.content()));
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitParagraph(Paragraph node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitCodeBlock(CodeBlock node) {
            Map<String, Object> map = start(node);
            map.put("content", node.content());
            putIfPresent(map, "language", node.language());
            map.put("fence_char", node.fenceChar());
            map.put("fence_length", node.fenceLength());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitBlockQuote(BlockQuote node) {
            Map<String, Object> map = start(node);
            map.put("children", all(node.children()));
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitList(ListBlock node) {
            Map<String, Object> map = start(node);
            map.put("ordered", node.ordered());
            map.put("items", all(node.items()));
            map.put("start", node.start());
            map.put("tight", node.tight());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitListItem(ListItem node) {
            Map<String, Object> map = start(node);
            map.put("children", all(node.children()));
            if (node.taskStatus() != TaskStatus.NONE) {
                map.put("task_status", lower(node.taskStatus()));
            }
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitTable(Table node) {
            Map<String, Object> map = start(node);
            if (node.header() != null) {
                map.put("header", node.header().accept(this));
            }
            map.put("rows", all(node.rows()));
            if (!node.alignments().isEmpty()) {
                map.put("alignments", node.alignments().stream().map(a -> lower(a)).toList());
            }
            putIfPresent(map, "caption", node.caption());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitTableRow(TableRow node) {
            Map<String, Object> map = start(node);
            map.put("cells", all(node.cells()));
            map.put("is_header", node.header());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitTableCell(TableCell node) {
            Map<String, Object> map = start(node);
            map.put("content", all(node.content()));
            map.put("colspan", node.colspan());
            map.put("rowspan", node.rowspan());
            map.put("alignment", lower(node.alignment()));
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitThematicBreak(ThematicBreak node) {
            return finish(node, start(node));
        }

        @Override
        public Map<String, Object> visitHtmlBlock(HtmlBlock node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitComment(Comment node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitFootnoteDefinition(FootnoteDefinition node) {
            Map<String, Object> map = start(node);
            map.put("identifier", node.identifier());
            map.put("content", all(node.content()));
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitDefinitionList(DefinitionList node) {
            Map<String, Object> map = start(node);
            List<Map<String, Object>> items = new ArrayList<>();
            for (DefinitionList.Item item : node.items()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("term", item.term().accept(this));
                entry.put("descriptions", all(item.descriptions()));
                items.add(entry);
            }
            map.put("items", items);
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitDefinitionTerm(DefinitionTerm node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitDefinitionDescription(DefinitionDescription node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitMathBlock(MathBlock node) {
            return math(node, node.content(), node.notation(), node.representations());
        }

        @Override
        public Map<String, Object> visitText(Text node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitEmphasis(Emphasis node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitStrong(Strong node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitStrikethrough(Strikethrough node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitUnderline(Underline node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitSuperscript(Superscript node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitSubscript(Subscript node) {
            return withContent(node, node.content());
        }

        @Override
        public Map<String, Object> visitCode(Code node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitLink(Link node) {
            Map<String, Object> map = start(node);
            map.put("url", node.url());
            map.put("content", all(node.content()));
            putIfPresent(map, "title", node.title());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitImage(Image node) {
            Map<String, Object> map = start(node);
            map.put("url", node.url());
            map.put("alt_text", node.altText());
            putIfPresent(map, "title", node.title());
            putIfPresent(map, "width", node.width());
            putIfPresent(map, "height", node.height());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitLineBreak(LineBreak node) {
            Map<String, Object> map = start(node);
            map.put("soft", node.soft());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitHtmlInline(HtmlInline node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitCommentInline(CommentInline node) {
            return withText(node, node.content());
        }

        @Override
        public Map<String, Object> visitFootnoteReference(FootnoteReference node) {
            Map<String, Object> map = start(node);
            map.put("identifier", node.identifier());
            return finish(node, map);
        }

        @Override
        public Map<String, Object> visitMathInline(MathInline node) {
            return math(node, node.content(), node.notation(), node.representations());
        }
    }
}
