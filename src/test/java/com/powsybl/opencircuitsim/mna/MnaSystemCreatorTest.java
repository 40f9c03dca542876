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
import com.powsybl.opencircuitsim.netlist.NetlistParser;
import com.powsybl.opencircuitsim.network.Circuit;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Circuit Sim developers
 */
class MnaSystemCreatorTest {

    private static MnaSystem createSystem(String netlistText) {
        StampRegistry registry = StampRegistry.createDefault();
        Circuit circuit = Circuit.create(NetlistParser.parse(netlistText), List.of("0", "gnd"), registry::hasBranchCurrent);
        return new MnaSystemCreator(circuit, registry).create();
    }

    private static void assertMatrixEquals(double[][] expected, DenseMatrix actual) {
        assertEquals(expected.length, actual.getRowCount());
        assertEquals(expected.length, actual.getColumnCount());
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected.length; j++) {
                assertEquals(expected[i][j], actual.get(i, j), 1e-15, "(" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void testResistorStamp() {
        MnaSystem system = createSystem("R:R1 a b R=\"2\"\nR:R2 b 0 R=\"4\"");
        assertEquals(2, system.getSize());
        assertMatrixEquals(new double[][] {
            {0.5, -0.5},
            {-0.5, 0.75}
        }, system.getMatrix());
        assertArrayEquals(new double[] {0, 0}, system.getRhs(), 0);
    }

    @Test
    void testDefaultResistance() {
        MnaSystem system = createSystem("R:R1 a gnd");
        assertMatrixEquals(new double[][] {{0.001}}, system.getMatrix());
    }

    @Test
    void testVoltageSourceStamp() {
        MnaSystem system = createSystem("Vdc:V1 a b U=\"5\"\nVdc:V2 0 b\nR:R1 a b R=\"1\"");
        // unknowns: v(a), v(b), i(V1), i(V2)
        assertEquals(4, system.getSize());
        assertMatrixEquals(new double[][] {
            {1, -1, 1, 0},
            {-1, 1, -1, -1},
            {1, -1, 0, 0},
            {0, -1, 0, 0}
        }, system.getMatrix());
        assertArrayEquals(new double[] {0, 0, 5, 1}, system.getRhs(), 0);
        assertEquals("i(Vdc:V2)", system.getUnknownName(3));
        assertEquals("v(b)", system.getUnknownName(1));
    }

    @Test
    void testSymmetry() {
        MnaSystem system = createSystem(String.join("\n",
                "Vdc:V1 in 0 U=\"12\"",
                "R:R1 in a R=\"100\"",
                "R:R2 a b R=\"220\"",
                "R:R3 b gnd R=\"330\"",
                "R:R4 a gnd R=\"470\"",
                "Vdc:V2 b a U=\"3\"",
                "R:R5 in b"));
        assertEquals(5, system.getSize());
        assertTrue(system.isSymmetric(0));
    }

    @Test
    void testUnknownTypesAreSkipped() {
        MnaSystem system = createSystem("Diode:D1 a b\nR:R1 a 0 R=\"1\"");
        assertEquals(2, system.getSize());
        assertMatrixEquals(new double[][] {
            {1, 0},
            {0, 0}
        }, system.getMatrix());
    }

    @Test
    void testMissingTerminalIsSkipped() {
        MnaSystem system = createSystem("R:R1 a\nVdc:V1 b");
        // V1 still owns a branch current unknown, left empty
        assertEquals(3, system.getSize());
        assertMatrixEquals(new double[3][3], system.getMatrix());
        assertArrayEquals(new double[3], system.getRhs(), 0);
    }

    @Test
    void testExtraTerminalsAreIgnored() {
        MnaSystem system = createSystem("R:R1 a b c R=\"1\"");
        assertMatrixEquals(new double[][] {
            {1, -1, 0},
            {-1, 1, 0},
            {0, 0, 0}
        }, system.getMatrix());
    }

    @Test
    void testEmptySystem() {
        MnaSystem system = createSystem("# nothing\n");
        assertEquals(0, system.getSize());
        assertEquals(0, system.getMatrix().getRowCount());
        assertEquals(0, system.getRhs().length);
    }

    @Test
    void testIdenticalSourcesOwnDistinctUnknowns() {
        MnaSystem system = createSystem("Vdc:V1 a 0 U=\"2\"\nVdc:V1 a 0 U=\"2\"");
        assertMatrixEquals(new double[][] {
            {0, 1, 1},
            {1, 0, 0},
            {1, 0, 0}
        }, system.getMatrix());
        assertArrayEquals(new double[] {0, 2, 2}, system.getRhs(), 0);
    }

    @Test
    void testMalformedValues() {
        PowsyblException e = assertThrows(PowsyblException.class, () -> createSystem("R:R1 a 0 R=\"abc\""));
        assertEquals("Invalid value 'abc' for parameter 'R' of component 'R:R1'", e.getMessage());

        e = assertThrows(PowsyblException.class, () -> createSystem("Vdc:V1 a 0 U=\"5V\""));
        assertEquals("Invalid value '5V' for parameter 'U' of component 'Vdc:V1'", e.getMessage());

        e = assertThrows(PowsyblException.class, () -> createSystem("R:R1 a 0 R=\"0\""));
        assertEquals("Zero resistance for component 'R:R1'", e.getMessage());
    }

    @Test
    void testWrite() {
        MnaSystem system = createSystem("Vdc:V1 a 0 U=\"2\"\nR:R1 a 0 R=\"0.5\"");
        StringWriter writer = new StringWriter();
        system.write(writer);
        assertEquals(String.join(System.lineSeparator(),
                "row 0: 2.0 * v(a) + 1.0 * i(Vdc:V1) = 0.0",
                "row 1: 1.0 * v(a) = 2.0",
                ""), writer.toString());
    }
}
