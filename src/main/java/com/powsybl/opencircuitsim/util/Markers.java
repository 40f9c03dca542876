/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.util;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Log markers, to route timing and numerical diagnostics to dedicated appenders.
 *
 * @author Open Circuit Sim developers
 */
public final class Markers {

    public static final Marker PERFORMANCE_MARKER = MarkerFactory.getMarker("PERFORMANCE");

    public static final Marker NUMERICAL_MARKER = MarkerFactory.getMarker("NUMERICAL");

    private Markers() {
    }
}
