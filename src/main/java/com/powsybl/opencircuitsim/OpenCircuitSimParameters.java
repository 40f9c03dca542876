/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.PlatformConfig;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * @see #load(PlatformConfig)
 *
 * @author Open Circuit Sim developers
 */
public class OpenCircuitSimParameters {

    public static final String MODULE_NAME = "open-circuitsim-default-parameters";

    public static final String PIVOT_EPSILON_PARAM_NAME = "pivotEpsilon";
    public static final double PIVOT_EPSILON_DEFAULT_VALUE = 1e-12;

    public static final String REFERENCE_NODES_PARAM_NAME = "referenceNodes";
    public static final List<String> REFERENCE_NODES_DEFAULT_VALUE = List.of("0", "gnd");

    public static final String PROFILING_PARAM_NAME = "profiling";
    public static final boolean PROFILING_DEFAULT_VALUE = false;

    private double pivotEpsilon = PIVOT_EPSILON_DEFAULT_VALUE;

    private List<String> referenceNodes = REFERENCE_NODES_DEFAULT_VALUE;

    private boolean profiling = PROFILING_DEFAULT_VALUE;

    public double getPivotEpsilon() {
        return pivotEpsilon;
    }

    public OpenCircuitSimParameters setPivotEpsilon(double pivotEpsilon) {
        if (!(pivotEpsilon >= 0)) {
            throw new PowsyblException("Invalid pivot epsilon value: " + pivotEpsilon);
        }
        this.pivotEpsilon = pivotEpsilon;
        return this;
    }

    public List<String> getReferenceNodes() {
        return referenceNodes;
    }

    public OpenCircuitSimParameters setReferenceNodes(List<String> referenceNodes) {
        this.referenceNodes = List.copyOf(Objects.requireNonNull(referenceNodes));
        return this;
    }

    public boolean isProfiling() {
        return profiling;
    }

    public OpenCircuitSimParameters setProfiling(boolean profiling) {
        this.profiling = profiling;
        return this;
    }

    public static OpenCircuitSimParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenCircuitSimParameters load(PlatformConfig platformConfig) {
        OpenCircuitSimParameters parameters = new OpenCircuitSimParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setPivotEpsilon(config.getDoubleProperty(PIVOT_EPSILON_PARAM_NAME, PIVOT_EPSILON_DEFAULT_VALUE))
                .setReferenceNodes(config.getStringListProperty(REFERENCE_NODES_PARAM_NAME, REFERENCE_NODES_DEFAULT_VALUE))
                .setProfiling(config.getBooleanProperty(PROFILING_PARAM_NAME, PROFILING_DEFAULT_VALUE)));
        return parameters;
    }

    public static OpenCircuitSimParameters load(Map<String, String> properties) {
        return new OpenCircuitSimParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return List.of();
        }
        return Arrays.stream(prop.split("[:,]")).map(String::trim).toList();
    }

    public OpenCircuitSimParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(PIVOT_EPSILON_PARAM_NAME))
                .ifPresent(prop -> this.setPivotEpsilon(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(REFERENCE_NODES_PARAM_NAME))
                .ifPresent(prop -> this.setReferenceNodes(parseStringListProp(prop)));
        Optional.ofNullable(properties.get(PROFILING_PARAM_NAME))
                .ifPresent(prop -> this.setProfiling(Boolean.parseBoolean(prop)));
        return this;
    }

    @Override
    public String toString() {
        return "OpenCircuitSimParameters(" +
                "pivotEpsilon=" + pivotEpsilon +
                ", referenceNodes=" + referenceNodes +
                ", profiling=" + profiling +
                ')';
    }
}
