/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding a result file: the values by variable name, or an error message when there was nothing to
 * decode.
 *
 * @author Open Circuit Sim developers
 */
public final class DecodeResult {

    private final Map<String, List<Double>> values;

    private final String error;

    private DecodeResult(Map<String, List<Double>> values, String error) {
        this.values = values;
        this.error = error;
    }

    public static DecodeResult success(Map<String, List<Double>> values) {
        return new DecodeResult(Collections.unmodifiableMap(new LinkedHashMap<>(values)), null);
    }

    public static DecodeResult error(String error) {
        return new DecodeResult(Collections.emptyMap(), Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Values by variable name, empty on error.
     */
    public Map<String, List<Double>> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return isSuccess() ? "DecodeResult(values=" + values.keySet() + ")" : "DecodeResult(error=" + error + ")";
    }
}
