/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed netlist: components in line order, the merged sweep directive and every node token seen on a component line.
 *
 * @author Open Circuit Sim developers
 */
public class Netlist {

    private final List<ComponentInstance> components = new ArrayList<>();

    private final Set<String> nodes = new LinkedHashSet<>();

    private final SweepDirective sweepDirective = new SweepDirective();

    void addComponent(ComponentInstance component) {
        components.add(Objects.requireNonNull(component));
        nodes.addAll(component.getNodes());
    }

    public List<ComponentInstance> getComponents() {
        return Collections.unmodifiableList(components);
    }

    /**
     * Node tokens in first seen order, reference tokens included.
     */
    public Set<String> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public SweepDirective getSweepDirective() {
        return sweepDirective;
    }
}
