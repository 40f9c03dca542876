/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.netlist;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opencircuitsim.util.NumberParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of the {@code .DC} simulation command. When a netlist has several {@code .DC} lines, they are merged
 * key by key and the last value of a key wins.
 *
 * @author Open Circuit Sim developers
 */
public class SweepDirective {

    public static final String START = "Start";
    public static final String STOP = "Stop";
    public static final String POINTS = "Points";
    public static final String PARAM = "Param";

    public static final String START_DEFAULT_VALUE = "0";
    public static final String STOP_DEFAULT_VALUE = "10";
    public static final String POINTS_DEFAULT_VALUE = "2";
    public static final String PARAM_DEFAULT_VALUE = "sweep";

    private final Map<String, String> parameters = new LinkedHashMap<>();

    public SweepDirective merge(Map<String, String> otherParameters) {
        parameters.putAll(otherParameters);
        return this;
    }

    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public double getStart() {
        return parseDouble(START, START_DEFAULT_VALUE);
    }

    public double getStop() {
        return parseDouble(STOP, STOP_DEFAULT_VALUE);
    }

    public int getPoints() {
        String value = parameters.getOrDefault(POINTS, POINTS_DEFAULT_VALUE);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new PowsyblException("Invalid sweep " + POINTS + " value '" + value + "'", e);
        }
    }

    public String getParam() {
        return parameters.getOrDefault(PARAM, PARAM_DEFAULT_VALUE);
    }

    /**
     * Sweep values: {@code points} values linearly spaced from start to stop, both included.
     */
    public double[] getSweepValues() {
        int points = getPoints();
        double start = getStart();
        double step = points > 1 ? (getStop() - start) / (points - 1) : 0;
        double[] values = new double[Math.max(points, 0)];
        for (int i = 0; i < values.length; i++) {
            values[i] = start + i * step;
        }
        return values;
    }

    private double parseDouble(String key, String defaultValue) {
        String value = parameters.getOrDefault(key, defaultValue);
        return NumberParser.parseDouble(value)
                .orElseThrow(() -> new PowsyblException("Invalid sweep " + key + " value '" + value + "'"));
    }

    @Override
    public String toString() {
        return "SweepDirective(" + parameters + ")";
    }
}
