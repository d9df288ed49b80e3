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

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.doctree.node.Heading;

/**
 * A parsed split spec such as {@code h2}, {@code length=500}, {@code parts=3}, {@code
 * delimiter=---} or {@code auto}.
 *
 * @param number heading level, target words or part count; 0 when the strategy takes none
 * @param delimiter delimiter text for {@link SplitStrategy#DELIMITER}, null otherwise
 */
public record SplitSpec(SplitStrategy strategy, int number, String delimiter) {

    private static final Pattern HEADING_SPEC =
            Pattern.compile("h(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final List<SplitStrategy> KEYWORDS =
            List.of(
                    SplitStrategy.AUTO,
                    SplitStrategy.BREAK,
                    SplitStrategy.PAGE,
                    SplitStrategy.CHAPTER);

    public static SplitSpec heading(int level) {
        return new SplitSpec(SplitStrategy.HEADING, level, null);
    }

    public static SplitSpec length(int words) {
        return new SplitSpec(SplitStrategy.LENGTH, words, null);
    }

    public static SplitSpec parts(int count) {
        return new SplitSpec(SplitStrategy.PARTS, count, null);
    }

    public static SplitSpec delimiter(String delimiter) {
        return new SplitSpec(SplitStrategy.DELIMITER, 0, delimiter);
    }

    public static SplitSpec of(SplitStrategy strategy) {
        return new SplitSpec(strategy, 0, null);
    }

    /**
     * Parses a split spec. Keys and keywords are case-insensitive and surrounding whitespace is
     * ignored. A delimiter value may use the escapes {@code \n}, {@code \t}, {@code \r}, {@code
     * \\} and {@code \}{@code uXXXX}.
     *
     * @throws SplitSpecException naming the offending token if the spec is malformed
     */
    public static SplitSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new SplitSpecException("Split specification must not be empty");
        }
        String s = spec.strip();

        Matcher headingMatch = HEADING_SPEC.matcher(s);
        if (headingMatch.matches()) {
            int level = parseNumber(headingMatch.group(1), "heading level", s);
            if (!Heading.isValidLevel(level)) {
                throw new SplitSpecException(
                        "Heading level must be between 1 and 6, got " + level + " in '" + s + "'");
            }
            return heading(level);
        }

        int eq = s.indexOf('=');
        if (eq >= 0) {
            String key = s.substring(0, eq).strip().toLowerCase(Locale.ROOT);
            String value = s.substring(eq + 1).strip();
            switch (key) {
                case "length":
                    return length(parsePositive(value, "length"));
                case "parts":
                    return parts(parsePositive(value, "parts"));
                case "delimiter":
                    String text = unescape(value);
                    if (text.isBlank()) {
                        throw new SplitSpecException(
                                "Delimiter value cannot be empty or whitespace in '" + s + "'");
                    }
                    return delimiter(text);
                default:
                    throw new SplitSpecException(
                            "Unknown split strategy '" + key + "' in '" + s + "'");
            }
        }

        String keyword = s.toLowerCase(Locale.ROOT);
        for (SplitStrategy strategy : KEYWORDS) {
            if (strategy.key().equals(keyword)) {
                return of(strategy);
            }
        }
        throw new SplitSpecException(
                "Invalid split specification '"
                        + s
                        + "'; expected h1-h6, length=N, parts=N, delimiter=TEXT, auto, break,"
                        + " page or chapter");
    }

    private static int parsePositive(String value, String key) {
        int n = parseNumber(value, key, key + "=" + value);
        if (n < 1) {
            throw new SplitSpecException(
                    "Invalid " + key + " value '" + value + "': must be at least 1");
        }
        return n;
    }

    private static int parseNumber(String value, String what, String token) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SplitSpecException(
                    "Invalid " + what + " value '" + value + "' in '" + token + "'", e);
        }
    }

    /** Expands backslash escapes; unknown escapes are kept literally. */
    static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\' -> sb.append('\\');
                case 'u' -> {
                    if (isHex(value, i + 2, i + 6)) {
                        sb.append((char) Integer.parseInt(value.substring(i + 2, i + 6), 16));
                        i += 4;
                    } else {
                        sb.append(c).append(next);
                    }
                }
                default -> sb.append(c).append(next);
            }
            i++;
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int from, int to) {
        if (to > s.length()) {
            return false;
        }
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /** The spec in its string form, as accepted by {@link #parse(String)}. */
    @Override
    public String toString() {
        return switch (strategy) {
            case HEADING -> "h" + number;
            case LENGTH, PARTS -> strategy.key() + "=" + number;
            case DELIMITER -> "delimiter=" + delimiter;
            default -> strategy.key();
        };
    }
}
