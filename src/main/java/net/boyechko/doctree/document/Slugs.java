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

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Converts titles to URL- and filename-safe slugs. */
public final class Slugs {
    public static final int MAX_LENGTH = 100;

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private Slugs() {}

    /**
     * Returns a slug of at most {@link #MAX_LENGTH} characters from {@code [a-z0-9-]}, without
     * leading or trailing hyphens. Accented letters lose their accents; other characters are
     * dropped. A null or blank title gives the empty string.
     */
    public static String slugify(String title) {
        return slugify(title, MAX_LENGTH);
    }

    public static String slugify(String title, int maxLength) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String s = Normalizer.normalize(title, Normalizer.Form.NFKD).toLowerCase(Locale.ROOT);
        s = DISALLOWED.matcher(s).replaceAll("");
        s = SEPARATORS.matcher(s).replaceAll("-");
        s = EDGE_HYPHENS.matcher(s).replaceAll("");
        if (s.length() > maxLength) {
            s = EDGE_HYPHENS.matcher(s.substring(0, maxLength)).replaceAll("");
        }
        return s;
    }

    /**
     * Returns an anchor slug unique within {@code seen}, adding it to the set. Empty slugs become
     * {@code section}; repeats get {@code -1}, {@code -2}, ... suffixes.
     */
    public static String uniqueSlug(String title, Set<String> seen) {
        String base = slugify(title);
        if (base.isEmpty()) {
            base = "section";
        }
        String slug = base;
        int n = 1;
        while (seen.contains(slug)) {
            slug = base + "-" + n++;
        }
        seen.add(slug);
        return slug;
    }
}
