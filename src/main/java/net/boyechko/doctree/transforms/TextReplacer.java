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

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import net.boyechko.doctree.node.Node;
import net.boyechko.doctree.node.Text;

/**
 * Replaces a literal string or regular expression inside every {@link Text} node. Code spans,
 * code blocks and raw HTML are left alone.
 */
public class TextReplacer extends NodeTransformer {
    private final Pattern pattern;
    private final String replacement;

    /** Literal replacement of every occurrence of {@code target}. */
    public TextReplacer(String target, String replacement) {
        this(target, replacement, false);
    }

    /**
     * @param useRegex treat {@code target} as a regular expression and {@code replacement} as a
     *     replacement template with {@code $n} group references
     * @throws IllegalArgumentException if {@code target} is empty or not a valid expression
     */
    public TextReplacer(String target, String replacement, boolean useRegex) {
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Text replacement pattern must not be empty");
        }
        try {
            this.pattern = Pattern.compile(useRegex ? target : Pattern.quote(target));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid replacement pattern: " + target, e);
        }
        this.replacement = useRegex ? replacement : Matcher.quoteReplacement(replacement);
    }

    @Override
    public Node visitText(Text node) {
        String replaced = pattern.matcher(node.content()).replaceAll(replacement);
        if (replaced.equals(node.content())) {
            return node;
        }
        return new Text(replaced, node.metadata(), node.sourceLocation());
    }
}
