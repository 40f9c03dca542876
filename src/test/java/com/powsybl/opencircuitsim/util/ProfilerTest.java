/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Circuit Sim developers
 */
class ProfilerTest {

    @Test
    void testStages() {
        Profiler profiler = Profiler.create();
        assertEquals(3, profiler.profile("Parse", () -> 3));
        assertEquals("x", profiler.profile("Solve", () -> "x"));
        profiler.profile("Parse", () -> null);
        assertEquals(List.of("Parse", "Solve"), List.copyOf(profiler.getElapsedTimes().keySet()));
        assertTrue(profiler.getElapsedTimes().values().stream().allMatch(t -> t >= 0));
        assertDoesNotThrow(profiler::printSummary);
    }

    @Test
    void testSummaryTable() {
        Logger logger = (Logger) LoggerFactory.getLogger(Profiler.class);
        Level level = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        try {
            Profiler profiler = Profiler.create();
            profiler.profile("Solve", () -> 1);
            profiler.printSummary();
        } finally {
            logger.setLevel(level);
            logger.detachAppender(appender);
        }
        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.DEBUG, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("Simulation stages"));
        assertTrue(event.getFormattedMessage().contains("Solve"));
    }

    @Test
    void testFailingStageIsRecorded() {
        Profiler profiler = Profiler.create();
        assertThrows(IllegalStateException.class, () -> profiler.profile("Assemble", () -> {
            throw new IllegalStateException();
        }));
        assertTrue(profiler.getElapsedTimes().containsKey("Assemble"));
    }

    @Test
    void testNoOp() {
        assertEquals(1, Profiler.NO_OP.profile("Parse", () -> 1));
        assertTrue(Profiler.NO_OP.getElapsedTimes().isEmpty());
    }
}
