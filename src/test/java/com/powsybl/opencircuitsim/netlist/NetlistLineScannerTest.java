/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.netlist;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Circuit Sim developers
 */
class NetlistLineScannerTest {

    @Test
    void testTokenize() {
        assertEquals(List.of("R:R1", "n1", "n2", "R=\"1", "k\""), NetlistLineScanner.tokenize("  R:R1\tn1  n2 R=\"1 k\" "));
        assertTrue(NetlistLineScanner.tokenize("   ").isEmpty());
    }

    @Test
    void testParameters() {
        assertEquals(Map.of("R", "1000", "Temp", "26.85"),
                NetlistLineScanner.scanParameters("R:R1 n1 n2 R=\"1000\" Temp=\"26.85\""));
    }

    @Test
    void testValueWithSpaces() {
        assertEquals(Map.of("Param", "my sweep"), NetlistLineScanner.scanParameters(".DC Param=\"my sweep\""));
    }

    @Test
    void testParametersNotSeparated() {
        assertEquals(Map.of("a", "1", "b", "2"), NetlistLineScanner.scanParameters("a=\"1\"b=\"2\""));
    }

    @Test
    void testKeyIsWordSuffix() {
        // the scan restarts after a failed candidate, so only the word part before '=' is the key
        assertEquals(Map.of("R", "5"), NetlistLineScanner.scanParameters("-R=\"5\""));
        assertEquals(Map.of("b", "c"), NetlistLineScanner.scanParameters("a\"b=\"c\""));
    }

    @Test
    void testDuplicatedKeyLastWins() {
        assertEquals(Map.of("R", "2"), NetlistLineScanner.scanParameters("R:R1 a b R=\"1\" R=\"2\""));
    }

    @Test
    void testMalformedParameters() {
        assertTrue(NetlistLineScanner.scanParameters("R:R1 a b R=\"\"").isEmpty());
        assertTrue(NetlistLineScanner.scanParameters("R:R1 a b R=\"1000").isEmpty());
        assertTrue(NetlistLineScanner.scanParameters("R:R1 a b R=1000").isEmpty());
        assertTrue(NetlistLineScanner.scanParameters("R:R1 a b =\"1000\"").isEmpty());
        assertTrue(NetlistLineScanner.scanParameters("R:R1 a b R = \"1000\"").isEmpty());
    }
}
