/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.tools;

import com.google.auto.service.AutoService;
import com.powsybl.commons.io.table.AsciiTableFormatter;
import com.powsybl.commons.io.table.Column;
import com.powsybl.opencircuitsim.OpenCircuitSimParameters;
import com.powsybl.opencircuitsim.OpenCircuitSimulator;
import com.powsybl.opencircuitsim.SimulationResult;
import com.powsybl.tools.Command;
import com.powsybl.tools.Tool;
import com.powsybl.tools.ToolRunningContext;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Command line simulation of a netlist file: {@code itools simulate-circuit -i circuit.net -o circuit.dat}.
 *
 * @author Open Circuit Sim developers
 */
@AutoService(Tool.class)
public class SimulateCircuitTool implements Tool {

    static final String COMMAND_NAME = "simulate-circuit";
    static final String INPUT_FILE = "input-file";
    static final String OUTPUT_FILE = "output-file";

    private final Supplier<OpenCircuitSimParameters> parametersSupplier;

    public SimulateCircuitTool() {
        this(OpenCircuitSimParameters::load);
    }

    public SimulateCircuitTool(Supplier<OpenCircuitSimParameters> parametersSupplier) {
        this.parametersSupplier = Objects.requireNonNull(parametersSupplier);
    }

    @Override
    public Command getCommand() {
        return new Command() {
            @Override
            public String getName() {
                return COMMAND_NAME;
            }

            @Override
            public String getTheme() {
                return "Computation";
            }

            @Override
            public String getDescription() {
                return "Run a DC simulation of a resistive circuit netlist";
            }

            @Override
            public Options getOptions() {
                Options options = new Options();
                options.addOption(Option.builder("i")
                        .longOpt(INPUT_FILE)
                        .desc("the netlist file")
                        .hasArg()
                        .argName("FILE")
                        .required()
                        .build());
                options.addOption(Option.builder("o")
                        .longOpt(OUTPUT_FILE)
                        .desc("the result file")
                        .hasArg()
                        .argName("FILE")
                        .required()
                        .build());
                return options;
            }

            @Override
            public String getUsageFooter() {
                return null;
            }
        };
    }

    @Override
    public void run(CommandLine line, ToolRunningContext context) throws IOException {
        Path inputFile = context.getFileSystem().getPath(line.getOptionValue(INPUT_FILE));
        Path outputFile = context.getFileSystem().getPath(line.getOptionValue(OUTPUT_FILE));

        String netlistText = Files.readString(inputFile, StandardCharsets.UTF_8);
        OpenCircuitSimulator simulator = new OpenCircuitSimulator(parametersSupplier.get());
        SimulationResult result = simulator.simulate(netlistText);
        Files.writeString(outputFile, result.encode(), StandardCharsets.UTF_8);

        context.getOutputStream().print(formatNodeVoltages(result.getNodeVoltages()));
        if (result.isDegraded()) {
            context.getErrorStream().println("Warning: singular system, " + result.getDegradedRows().size() + " unknowns set to zero");
        }
    }

    private static String formatNodeVoltages(Map<String, Double> voltages) throws IOException {
        StringWriter writer = new StringWriter();
        try (AsciiTableFormatter formatter = new AsciiTableFormatter(writer, "Node voltages",
                new Column("Node"),
                new Column("Voltage (V)"))) {
            for (Map.Entry<String, Double> e : voltages.entrySet()) {
                formatter.writeCell(e.getKey())
                        .writeCell(e.getValue());
            }
        }
        return writer.toString();
    }
}
