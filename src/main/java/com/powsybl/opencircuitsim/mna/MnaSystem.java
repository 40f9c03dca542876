/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.mna;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.opencircuitsim.netlist.ComponentInstance;
import com.powsybl.opencircuitsim.network.Circuit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Modified nodal analysis linear system {@code G x = I}.
 *
 * <p>Unknowns {@code 0..N-1} are the node voltages in node index order, unknowns {@code N..N+M-1} are the branch
 * currents in circuit branch order. The matrix is square of size {@code N+M}, possibly 0.</p>
 *
 * @author Open Circuit Sim developers
 */
public class MnaSystem {

    private final Circuit circuit;

    private final int size;

    private final DenseMatrix matrix;

    private final double[] rhs;

    public MnaSystem(Circuit circuit) {
        this.circuit = Objects.requireNonNull(circuit);
        this.size = circuit.getUnknownCount();
        this.matrix = new DenseMatrix(size, size);
        this.rhs = new double[size];
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public int getSize() {
        return size;
    }

    public DenseMatrix getMatrix() {
        return matrix;
    }

    public double[] getRhs() {
        return rhs;
    }

    public void addToMatrix(int row, int column, double value) {
        matrix.add(row, column, value);
    }

    public void addToRhs(int row, double value) {
        rhs[row] += value;
    }

    /**
     * Get the row (and column) of the branch current unknown of a component.
     */
    public int getBranchRow(ComponentInstance component) {
        int branchNum = circuit.getBranchNum(component);
        if (branchNum < 0) {
            throw new PowsyblException("Component '" + component.getId() + "' has no branch current");
        }
        return circuit.getNodeCount() + branchNum;
    }

    public String getUnknownName(int row) {
        int nodeCount = circuit.getNodeCount();
        if (row < nodeCount) {
            return "v(" + circuit.getNodeIndex().getNode(row) + ")";
        }
        return "i(" + circuit.getBranches().get(row - nodeCount).getId() + ")";
    }

    public DenseMatrix copyMatrix() {
        DenseMatrix copy = new DenseMatrix(size, size);
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                copy.set(i, j, matrix.get(i, j));
            }
        }
        return copy;
    }

    public boolean isSymmetric(double epsilon) {
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (Math.abs(matrix.get(i, j) - matrix.get(j, i)) > epsilon) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Write non zero terms and right hand side, one equation per line.
     */
    public void write(Writer writer) {
        try {
            for (int i = 0; i < size; i++) {
                writer.write("row " + i + ": ");
                boolean first = true;
                for (int j = 0; j < size; j++) {
                    double value = matrix.get(i, j);
                    if (value != 0) {
                        if (!first) {
                            writer.write(" + ");
                        }
                        writer.write(value + " * " + getUnknownName(j));
                        first = false;
                    }
                }
                if (first) {
                    writer.write("0");
                }
                writer.write(" = " + rhs[i]);
                writer.write(System.lineSeparator());
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
