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
package net.boyechko.doctree.core;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.doctree.node.Heading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Tunable defaults for splitting and table-of-contents generation, loaded from YAML. */
public final class DocTreeConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/doctree-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(DocTreeConfig.class);

    /** Target words per part for automatic splitting. */
    public int auto_target_words = 1500;

    /** Largest H1 section, as a multiple of the target, that still splits at H1. */
    public double auto_h1_max_factor = 2.0;

    /** Largest average H2 section, as a multiple of the target, that still splits at H2. */
    public double auto_h2_avg_factor = 1.5;

    public int toc_max_level = 3;

    public int getAutoTargetWords() {
        return auto_target_words;
    }

    public double getAutoH1MaxFactor() {
        return auto_h1_max_factor;
    }

    public double getAutoH2AvgFactor() {
        return auto_h2_avg_factor;
    }

    public int getTocMaxLevel() {
        return toc_max_level;
    }

    /**
     * Load configuration from a classpath resource (e.g., from src/main/resources/). Keys missing
     * from the file keep their built-in defaults.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static DocTreeConfig fromResource(String resourcePath) {
        try (var inputStream = DocTreeConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(DocTreeConfig.class, new LoaderOptions()));
            DocTreeConfig config = yaml.load(inputStream);
            if (config == null) {
                logger.debug("Config resource {} is empty; using defaults", resourcePath);
                config = defaults();
            }
            logger.debug(
                    "Loaded config from {}: target={} words, h1 factor={}, h2 factor={}",
                    resourcePath,
                    config.auto_target_words,
                    config.auto_h1_max_factor,
                    config.auto_h2_avg_factor);

            var warnings = config.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Config loaded from {} has {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return config;
        } catch (Exception e) {
            logger.error(
                    "Failed to load config from resource {}: {}", resourcePath, e.getMessage());
            throw new RuntimeException(
                    "Failed to load config from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default configuration from standard location */
    public static DocTreeConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    /** Built-in defaults, without reading any resource. */
    public static DocTreeConfig defaults() {
        return new DocTreeConfig();
    }

    /**
     * Checks the values for settings that cannot work as intended.
     *
     * @return List of warning messages (empty if the configuration is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        if (auto_target_words < 1) {
            warnings.add("auto_target_words must be positive, got " + auto_target_words);
        }
        if (auto_h1_max_factor <= 0) {
            warnings.add("auto_h1_max_factor must be positive, got " + auto_h1_max_factor);
        }
        if (auto_h2_avg_factor <= 0) {
            warnings.add("auto_h2_avg_factor must be positive, got " + auto_h2_avg_factor);
        }
        if (auto_h2_avg_factor > auto_h1_max_factor) {
            warnings.add(
                    String.format(
                            "auto_h2_avg_factor=%s exceeds auto_h1_max_factor=%s; H2 splits may"
                                    + " produce larger parts than H1 splits",
                            auto_h2_avg_factor, auto_h1_max_factor));
        }
        if (!Heading.isValidLevel(toc_max_level)) {
            warnings.add("toc_max_level must be between 1 and 6, got " + toc_max_level);
        }
        return warnings;
    }
}
