/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.mna;

import com.powsybl.opencircuitsim.netlist.ComponentInstance;
import com.powsybl.opencircuitsim.network.Circuit;
import com.powsybl.opencircuitsim.network.NodeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assemble the modified nodal analysis system of a circuit by applying the stamp of each component.
 *
 * @author Open Circuit Sim developers
 */
public class MnaSystemCreator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MnaSystemCreator.class);

    private final Circuit circuit;

    private final StampRegistry stampRegistry;

    public MnaSystemCreator(Circuit circuit, StampRegistry stampRegistry) {
        this.circuit = Objects.requireNonNull(circuit);
        this.stampRegistry = Objects.requireNonNull(stampRegistry);
    }

    private static int[] getNodeNums(ComponentInstance component, NodeIndex nodeIndex) {
        List<String> nodes = component.getNodes();
        int[] nodeNums = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            nodeNums[i] = nodeIndex.getNum(nodes.get(i));
        }
        return nodeNums;
    }

    public MnaSystem create() {
        MnaSystem system = new MnaSystem(circuit);
        for (ComponentInstance component : circuit.getComponents()) {
            Optional<Stamp> stamp = stampRegistry.find(component.getType());
            if (stamp.isEmpty()) {
                LOGGER.debug("No stamp for component '{}' of type '{}', skipped", component.getName(), component.getType());
                continue;
            }
            int terminalCount = stamp.get().getTerminalCount();
            if (component.getNodes().size() < terminalCount) {
                LOGGER.warn("Component '{}' has {} nodes but {} are expected, skipped",
                        component.getId(), component.getNodes().size(), terminalCount);
                continue;
            }
            stamp.get().apply(component, getNodeNums(component, circuit.getNodeIndex()), system);
        }

        LOGGER.debug("MNA system created: {} nodes, {} branches, size {}",
                circuit.getNodeCount(), circuit.getBranchCount(), system.getSize());

        return system;
    }
}
