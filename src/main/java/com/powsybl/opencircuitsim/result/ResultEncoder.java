/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.result;

import com.powsybl.opencircuitsim.netlist.SweepDirective;
import com.powsybl.opencircuitsim.network.NodeIndex;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Write a DC sweep result in the block tagged format.
 *
 * <p>The swept values go into an {@code indep} block, then each free node gets a {@code dep} block. The system is
 * solved once, so every point of a {@code dep} block holds the same node voltage (constant sweep approximation).</p>
 *
 * @author Open Circuit Sim developers
 */
public final class ResultEncoder {

    private ResultEncoder() {
    }

    public static List<ResultBlock> createBlocks(NodeIndex nodeIndex, double[] x, SweepDirective sweepDirective) {
        Objects.requireNonNull(nodeIndex);
        Objects.requireNonNull(x);
        Objects.requireNonNull(sweepDirective);
        double[] sweepValues = sweepDirective.getSweepValues();
        String param = sweepDirective.getParam();

        List<ResultBlock> blocks = new ArrayList<>(1 + nodeIndex.getNodeCount());
        List<Double> indepValues = new ArrayList<>(sweepValues.length);
        for (double value : sweepValues) {
            indepValues.add(value);
        }
        blocks.add(new ResultBlock(ResultBlockKind.INDEP, param, Integer.toString(sweepDirective.getPoints()), indepValues));
        for (String node : nodeIndex.getNodes()) {
            double v = x[nodeIndex.getNum(node)];
            blocks.add(new ResultBlock(ResultBlockKind.DEP, node, param, Collections.nCopies(sweepValues.length, v)));
        }
        return blocks;
    }

    public static String encode(NodeIndex nodeIndex, double[] x, SweepDirective sweepDirective) {
        StringWriter writer = new StringWriter();
        write(createBlocks(nodeIndex, x, sweepDirective), writer);
        return writer.toString();
    }

    public static void write(List<ResultBlock> blocks, Writer writer) {
        Objects.requireNonNull(blocks);
        Objects.requireNonNull(writer);
        try {
            for (ResultBlock block : blocks) {
                String tag = block.kind().getTag();
                writer.write("<" + tag + " " + block.name() + " " + block.typeTag() + ">\n");
                for (double value : block.values()) {
                    writer.write(formatValue(value));
                    writer.write('\n');
                }
                writer.write("</" + tag + ">\n");
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Exponent notation with 6 fraction digits, {@code 5.000000e+00}. Non finite values are written {@code nan},
     * {@code inf} and {@code -inf}.
     */
    public static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return String.format(Locale.ROOT, "%e", value);
    }
}
