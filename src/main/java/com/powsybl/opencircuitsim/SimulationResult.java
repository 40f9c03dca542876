/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opencircuitsim.netlist.ComponentInstance;
import com.powsybl.opencircuitsim.network.Circuit;
import com.powsybl.opencircuitsim.network.NodeIndex;
import com.powsybl.opencircuitsim.result.ResultBlock;
import com.powsybl.opencircuitsim.result.ResultEncoder;
import com.powsybl.opencircuitsim.solver.LinearSolution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Solved circuit: node voltages and branch currents.
 *
 * @author Open Circuit Sim developers
 */
public class SimulationResult {

    private final Circuit circuit;

    private final LinearSolution solution;

    public SimulationResult(Circuit circuit, LinearSolution solution) {
        this.circuit = Objects.requireNonNull(circuit);
        this.solution = Objects.requireNonNull(solution);
        if (solution.x().length != circuit.getUnknownCount()) {
            throw new IllegalArgumentException("Solution size " + solution.x().length
                    + " does not match unknown count " + circuit.getUnknownCount());
        }
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public NodeIndex getNodeIndex() {
        return circuit.getNodeIndex();
    }

    /**
     * Node voltages then branch currents.
     */
    public double[] getX() {
        return solution.x().clone();
    }

    public List<Integer> getDegradedRows() {
        return solution.degradedRows();
    }

    public boolean isDegraded() {
        return solution.isDegraded();
    }

    /**
     * Get the voltage of a node, 0 for the reference node.
     */
    public double getNodeVoltage(String node) {
        int num = circuit.getNodeIndex().getNum(node);
        return num == NodeIndex.REFERENCE ? 0 : solution.x()[num];
    }

    public Map<String, Double> getNodeVoltages() {
        Map<String, Double> voltages = new LinkedHashMap<>();
        for (String node : circuit.getNodeIndex().getNodes()) {
            voltages.put(node, getNodeVoltage(node));
        }
        return voltages;
    }

    /**
     * Get the current flowing through a branch component, from its positive terminal to its negative terminal
     * inside the component.
     *
     * @param componentName the component name, {@code V1} for {@code Vdc:V1}
     */
    public double getBranchCurrent(String componentName) {
        Objects.requireNonNull(componentName);
        List<ComponentInstance> branches = circuit.getBranches();
        for (int k = 0; k < branches.size(); k++) {
            if (branches.get(k).getName().equals(componentName)) {
                return solution.x()[circuit.getNodeCount() + k];
            }
        }
        throw new PowsyblException("Branch '" + componentName + "' not found");
    }

    public List<ResultBlock> toBlocks() {
        return ResultEncoder.createBlocks(circuit.getNodeIndex(), solution.x(), circuit.getSweepDirective());
    }

    public String encode() {
        return ResultEncoder.encode(circuit.getNodeIndex(), solution.x(), circuit.getSweepDirective());
    }

    @Override
    public String toString() {
        return "SimulationResult(nodeCount=" + circuit.getNodeCount()
                + ", branchCount=" + circuit.getBranchCount()
                + ", degradedRows=" + solution.degradedRows()
                + ")";
    }
}
