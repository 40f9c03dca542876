/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.network;

import com.powsybl.commons.PowsyblException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Numbering of the free nodes of a circuit.
 *
 * <p>Reference node tokens are removed and the remaining tokens are numbered in natural string order, so the
 * numbering only depends on the set of tokens and not on the order they appear in the netlist.</p>
 *
 * @author Open Circuit Sim developers
 */
public final class NodeIndex {

    public static final int REFERENCE = -1;

    private final Set<String> referenceNodes;

    private final Map<String, Integer> numByNode;

    private final List<String> nodes;

    private NodeIndex(Set<String> referenceNodes, Map<String, Integer> numByNode) {
        this.referenceNodes = referenceNodes;
        this.numByNode = numByNode;
        this.nodes = List.copyOf(numByNode.keySet());
    }

    public static NodeIndex create(Collection<String> nodeTokens, Collection<String> referenceNodes) {
        Objects.requireNonNull(nodeTokens);
        Set<String> references = Set.copyOf(referenceNodes);
        TreeSet<String> sortedNodes = new TreeSet<>(nodeTokens);
        sortedNodes.removeAll(references);
        Map<String, Integer> numByNode = new LinkedHashMap<>();
        for (String node : sortedNodes) {
            numByNode.put(node, numByNode.size());
        }
        return new NodeIndex(references, Collections.unmodifiableMap(numByNode));
    }

    public boolean isReference(String node) {
        return referenceNodes.contains(node);
    }

    /**
     * Get the number of a node token, {@link #REFERENCE} for a reference node.
     */
    public int getNum(String node) {
        if (isReference(node)) {
            return REFERENCE;
        }
        Integer num = numByNode.get(node);
        if (num == null) {
            throw new PowsyblException("Node '" + node + "' not found");
        }
        return num;
    }

    public String getNode(int num) {
        return nodes.get(num);
    }

    /**
     * Free nodes, in numbering order.
     */
    public List<String> getNodes() {
        return nodes;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public Map<String, Integer> toMap() {
        return numByNode;
    }

    @Override
    public String toString() {
        return "NodeIndex(" + numByNode + ")";
    }
}
