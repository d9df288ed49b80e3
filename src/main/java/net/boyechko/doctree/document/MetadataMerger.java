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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the metadata accumulated so far with the metadata of the next document during {@link
 * Documents#merge(List, MetadataMerger)}.
 */
@FunctionalInterface
public interface MetadataMerger {

    Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> incoming);

    /** Later values overwrite earlier ones. */
    MetadataMerger LAST_WRITE_WINS =
            (existing, incoming) -> {
                Map<String, Object> result = new LinkedHashMap<>(existing);
                result.putAll(incoming);
                return result;
            };

    /** Earlier values are kept; keys seen for the first time are added. */
    MetadataMerger FIRST_WRITE_WINS =
            (existing, incoming) -> {
                Map<String, Object> result = new LinkedHashMap<>(existing);
                incoming.forEach(result::putIfAbsent);
                return result;
            };

    /** Concatenates values that are lists on both sides; other keys are last-write-wins. */
    MetadataMerger MERGE_LISTS =
            (existing, incoming) -> {
                Map<String, Object> result = new LinkedHashMap<>(existing);
                incoming.forEach(
                        (key, value) -> {
                            Object current = result.get(key);
                            if (current instanceof List<?> before
                                    && value instanceof List<?> after) {
                                List<Object> joined = new ArrayList<>(before);
                                joined.addAll(after);
                                result.put(key, joined);
                            } else {
                                result.put(key, value);
                            }
                        });
                return result;
            };
}
