/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.util;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.io.table.AsciiTableFormatter;
import com.powsybl.commons.io.table.Column;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Time the stages of a simulation. Stages are not nested: a simulation is a sequence of stages.
 *
 * @author Open Circuit Sim developers
 */
public interface Profiler {

    Profiler NO_OP = new Profiler() {

        @Override
        public <T> T profile(String stageName, Supplier<T> stage) {
            return stage.get();
        }

        @Override
        public Map<String, Long> getElapsedTimes() {
            return Collections.emptyMap();
        }

        @Override
        public void printSummary() {
            // no-op
        }
    };

    static Profiler create() {
        return new StageProfiler();
    }

    /**
     * Run a stage and record its duration.
     */
    <T> T profile(String stageName, Supplier<T> stage);

    /**
     * Cumulated elapsed time of each stage in microseconds, in first run order.
     */
    Map<String, Long> getElapsedTimes();

    void printSummary();

    class StageProfiler implements Profiler {

        private static final Logger LOGGER = LoggerFactory.getLogger(Profiler.class);

        private final Map<String, Long> elapsedTimes = new LinkedHashMap<>();

        @Override
        public <T> T profile(String stageName, Supplier<T> stage) {
            Objects.requireNonNull(stageName);
            Objects.requireNonNull(stage);
            Stopwatch stopwatch = Stopwatch.createStarted();
            try {
                return stage.get();
            } finally {
                long elapsed = stopwatch.elapsed(TimeUnit.MICROSECONDS);
                elapsedTimes.merge(stageName, elapsed, Long::sum);
                LOGGER.trace(Markers.PERFORMANCE_MARKER, "Stage '{}' done in {} us", stageName, elapsed);
            }
        }

        @Override
        public Map<String, Long> getElapsedTimes() {
            return Collections.unmodifiableMap(elapsedTimes);
        }

        @Override
        public void printSummary() {
            if (!LOGGER.isDebugEnabled()) {
                return;
            }
            StringWriter writer = new StringWriter();
            try (AsciiTableFormatter formatter = new AsciiTableFormatter(writer,
                    "Simulation stages",
                    new Column("Stage"),
                    new Column("Time (us)"))) {
                for (Map.Entry<String, Long> e : elapsedTimes.entrySet()) {
                    formatter.writeCell(e.getKey())
                            .writeCell(Long.toString(e.getValue()));
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            LOGGER.debug(Markers.PERFORMANCE_MARKER, "{}", writer.toString().stripTrailing());
        }
    }
}
