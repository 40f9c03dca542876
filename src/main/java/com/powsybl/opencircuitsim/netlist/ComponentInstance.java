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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A component line of a netlist, for instance {@code R:R1 n1 n2 R="1k"}.
 *
 * @author Open Circuit Sim developers
 */
public class ComponentInstance {

    private final String type;

    private final String name;

    private final List<String> nodes;

    private final Map<String, String> parameters;

    public ComponentInstance(String type, String name, List<String> nodes, Map<String, String> parameters) {
        this.type = Objects.requireNonNull(type);
        this.name = Objects.requireNonNull(name);
        this.nodes = List.copyOf(nodes);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Get the identity token of this component, {@code TYPE:NAME}.
     */
    public String getId() {
        return type + ":" + name;
    }

    public List<String> getNodes() {
        return nodes;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public Optional<String> getParameter(String key) {
        return Optional.ofNullable(parameters.get(key));
    }

    /**
     * Get a numeric parameter, falling back to the default text when the parameter is absent.
     * A value that is present but not a number is an error: there is no fallback for it.
     */
    public double getDoubleParameter(String key, String defaultValue) {
        String value = parameters.getOrDefault(key, defaultValue);
        return NumberParser.parseDouble(value)
                .orElseThrow(() -> new PowsyblException("Invalid value '" + value + "' for parameter '" + key + "' of component '" + getId() + "'"));
    }

    @Override
    public String toString() {
        return "ComponentInstance(type=" + type
                + ", name=" + name
                + ", nodes=" + nodes
                + ", parameters=" + parameters
                + ")";
    }
}
