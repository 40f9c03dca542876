/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.network;

import com.powsybl.opencircuitsim.netlist.ComponentInstance;
import com.powsybl.opencircuitsim.netlist.Netlist;
import com.powsybl.opencircuitsim.netlist.SweepDirective;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Circuit ready to be put into equations: components, node numbering and the components owning a branch current
 * unknown (ideal voltage sources).
 *
 * @author Open Circuit Sim developers
 */
public class Circuit {

    private final List<ComponentInstance> components;

    private final SweepDirective sweepDirective;

    private final NodeIndex nodeIndex;

    private final List<ComponentInstance> branches;

    private final Map<ComponentInstance, Integer> branchNums = new IdentityHashMap<>();

    public Circuit(List<ComponentInstance> components, SweepDirective sweepDirective, NodeIndex nodeIndex,
                   Predicate<ComponentInstance> hasBranchCurrent) {
        this.components = List.copyOf(components);
        this.sweepDirective = Objects.requireNonNull(sweepDirective);
        this.nodeIndex = Objects.requireNonNull(nodeIndex);
        Objects.requireNonNull(hasBranchCurrent);
        List<ComponentInstance> branchComponents = new ArrayList<>();
        for (ComponentInstance component : this.components) {
            if (hasBranchCurrent.test(component)) {
                // identity based: two identical lines still own two different unknowns
                branchNums.put(component, branchComponents.size());
                branchComponents.add(component);
            }
        }
        this.branches = Collections.unmodifiableList(branchComponents);
    }

    public static Circuit create(Netlist netlist, Collection<String> referenceNodes, Predicate<ComponentInstance> hasBranchCurrent) {
        Objects.requireNonNull(netlist);
        NodeIndex nodeIndex = NodeIndex.create(netlist.getNodes(), referenceNodes);
        return new Circuit(netlist.getComponents(), netlist.getSweepDirective(), nodeIndex, hasBranchCurrent);
    }

    public List<ComponentInstance> getComponents() {
        return components;
    }

    public SweepDirective getSweepDirective() {
        return sweepDirective;
    }

    public NodeIndex getNodeIndex() {
        return nodeIndex;
    }

    /**
     * Components owning a branch current unknown, in netlist order.
     */
    public List<ComponentInstance> getBranches() {
        return branches;
    }

    /**
     * Get the position of a component among the branches, or -1 if it does not own a branch current.
     */
    public int getBranchNum(ComponentInstance component) {
        return branchNums.getOrDefault(component, -1);
    }

    public int getNodeCount() {
        return nodeIndex.getNodeCount();
    }

    public int getBranchCount() {
        return branches.size();
    }

    /**
     * Number of unknowns of the modified nodal analysis: node voltages then branch currents.
     */
    public int getUnknownCount() {
        return getNodeCount() + getBranchCount();
    }
}
