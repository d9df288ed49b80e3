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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DocTreeConfigTest {

    @Test
    void loadDefault() {
        DocTreeConfig config = DocTreeConfig.loadDefault();

        assertEquals(1500, config.getAutoTargetWords());
        assertEquals(2.0, config.getAutoH1MaxFactor());
        assertEquals(1.5, config.getAutoH2AvgFactor());
        assertEquals(3, config.getTocMaxLevel());
        assertTrue(config.validateConsistency().isEmpty());
    }

    @Test
    void loadFromResource() {
        DocTreeConfig config = DocTreeConfig.fromResource("/config/small-target.yaml");

        assertEquals(10, config.getAutoTargetWords());
        assertEquals(2, config.getTocMaxLevel());
    }

    @Test
    void emptyResourceFallsBackToDefaults() {
        DocTreeConfig config = DocTreeConfig.fromResource("/config/empty.yaml");

        assertEquals(DocTreeConfig.defaults().getAutoTargetWords(), config.getAutoTargetWords());
    }

    @Test
    void missingResourceFails() {
        RuntimeException e =
                assertThrows(
                        RuntimeException.class,
                        () -> DocTreeConfig.fromResource("/config/nope.yaml"));
        assertTrue(e.getMessage().contains("/config/nope.yaml"), e.getMessage());
    }

    @Test
    void inconsistentValuesAreWarnedAboutButLoaded() {
        Logger logger = (Logger) LoggerFactory.getLogger(DocTreeConfig.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            DocTreeConfig config = DocTreeConfig.fromResource("/config/inconsistent.yaml");

            List<String> warnings = config.validateConsistency();
            assertEquals(3, warnings.size(), warnings.toString());
            assertTrue(warnings.contains("toc_max_level must be between 1 and 6, got 9"));

            long logged =
                    appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
            assertEquals(4, logged, "header line plus one line per warning");
        } finally {
            logger.detachAppender(appender);
        }
    }
}
