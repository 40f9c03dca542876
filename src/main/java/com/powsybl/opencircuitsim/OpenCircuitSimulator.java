/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim;

import com.powsybl.opencircuitsim.mna.MnaSystem;
import com.powsybl.opencircuitsim.mna.MnaSystemCreator;
import com.powsybl.opencircuitsim.mna.StampRegistry;
import com.powsybl.opencircuitsim.netlist.Netlist;
import com.powsybl.opencircuitsim.netlist.NetlistParser;
import com.powsybl.opencircuitsim.network.Circuit;
import com.powsybl.opencircuitsim.result.DecodeResult;
import com.powsybl.opencircuitsim.result.ResultDecoder;
import com.powsybl.opencircuitsim.result.ResultEncoder;
import com.powsybl.opencircuitsim.solver.GaussianEliminationSolver;
import com.powsybl.opencircuitsim.solver.LinearSolution;
import com.powsybl.opencircuitsim.util.Markers;
import com.powsybl.opencircuitsim.util.Profiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DC operating point simulator of resistive circuits, using modified nodal analysis.
 *
 * <p>A simulation parses the netlist, numbers the nodes, assembles and solves the linear system and writes the
 * result in the block tagged format. Nothing is shared between two simulations, so a simulator can be used
 * concurrently.</p>
 *
 * @author Open Circuit Sim developers
 */
public class OpenCircuitSimulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCircuitSimulator.class);

    private final OpenCircuitSimParameters parameters;

    private final StampRegistry stampRegistry;

    public OpenCircuitSimulator() {
        this(new OpenCircuitSimParameters());
    }

    public OpenCircuitSimulator(OpenCircuitSimParameters parameters) {
        this(parameters, StampRegistry.load());
    }

    public OpenCircuitSimulator(OpenCircuitSimParameters parameters, StampRegistry stampRegistry) {
        this.parameters = Objects.requireNonNull(parameters);
        this.stampRegistry = Objects.requireNonNull(stampRegistry).toReadOnly();
    }

    public OpenCircuitSimParameters getParameters() {
        return parameters;
    }

    public StampRegistry getStampRegistry() {
        return stampRegistry;
    }

    /**
     * Simulate a netlist and write the result in the block tagged format.
     */
    public String run(String netlistText) {
        Profiler profiler = createProfiler();
        SimulationResult result = simulate(netlistText, profiler);
        String resultText = profiler.profile("Encode", () -> ResultEncoder.encode(result.getNodeIndex(),
                result.getX(), result.getCircuit().getSweepDirective()));
        profiler.printSummary();
        return resultText;
    }

    public SimulationResult simulate(String netlistText) {
        Profiler profiler = createProfiler();
        SimulationResult result = simulate(netlistText, profiler);
        profiler.printSummary();
        return result;
    }

    private SimulationResult simulate(String netlistText, Profiler profiler) {
        Objects.requireNonNull(netlistText);

        Netlist netlist = profiler.profile("Parse", () -> NetlistParser.parse(netlistText));

        Circuit circuit = profiler.profile("IndexNodes",
            () -> Circuit.create(netlist, parameters.getReferenceNodes(), stampRegistry::hasBranchCurrent));

        MnaSystem system = profiler.profile("Assemble", () -> new MnaSystemCreator(circuit, stampRegistry).create());

        GaussianEliminationSolver solver = new GaussianEliminationSolver(parameters.getPivotEpsilon());
        LinearSolution solution = profiler.profile("Solve", () -> solver.solve(system.copyMatrix(), system.getRhs().clone()));

        if (solution.isDegraded()) {
            LOGGER.warn(Markers.NUMERICAL_MARKER, "Singular system: {} unknowns set to zero {}", solution.degradedRows().size(),
                    solution.degradedRows().stream().map(system::getUnknownName).toList());
        }

        return new SimulationResult(circuit, solution);
    }

    /**
     * Decode a result in the block tagged format: values by variable name.
     */
    public Map<String, List<Double>> decode(String resultText) {
        return ResultDecoder.decode(resultText);
    }

    /**
     * Decode a result file. A missing file gives an error result, it is not an exception.
     */
    public DecodeResult decode(Path resultFile) {
        return ResultDecoder.decode(resultFile);
    }

    private Profiler createProfiler() {
        return parameters.isProfiling() ? Profiler.create() : Profiler.NO_OP;
    }
}
