/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Circuit Sim developers
 */
class OpenCircuitSimParametersTest {

    private FileSystem fileSystem;

    private InMemoryPlatformConfig platformConfig;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        OpenCircuitSimParameters parameters = OpenCircuitSimParameters.load(platformConfig);
        assertEquals(1e-12, parameters.getPivotEpsilon());
        assertEquals(List.of("0", "gnd"), parameters.getReferenceNodes());
        assertFalse(parameters.isProfiling());
        assertEquals("OpenCircuitSimParameters(pivotEpsilon=1.0E-12, referenceNodes=[0, gnd], profiling=false)", parameters.toString());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("open-circuitsim-default-parameters");
        moduleConfig.setStringProperty("pivotEpsilon", "1e-9");
        moduleConfig.setStringListProperty("referenceNodes", List.of("vss", "0"));
        moduleConfig.setStringProperty("profiling", "true");

        OpenCircuitSimParameters parameters = OpenCircuitSimParameters.load(platformConfig);
        assertEquals(1e-9, parameters.getPivotEpsilon());
        assertEquals(List.of("vss", "0"), parameters.getReferenceNodes());
        assertTrue(parameters.isProfiling());
    }

    @Test
    void testPartialConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("open-circuitsim-default-parameters");
        moduleConfig.setStringProperty("profiling", "true");

        OpenCircuitSimParameters parameters = OpenCircuitSimParameters.load(platformConfig);
        assertEquals(1e-12, parameters.getPivotEpsilon());
        assertEquals(List.of("0", "gnd"), parameters.getReferenceNodes());
        assertTrue(parameters.isProfiling());
    }

    @Test
    void testInvalidConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("open-circuitsim-default-parameters");
        moduleConfig.setStringProperty("pivotEpsilon", "-1");
        PowsyblException e = assertThrows(PowsyblException.class, () -> OpenCircuitSimParameters.load(platformConfig));
        assertEquals("Invalid pivot epsilon value: -1.0", e.getMessage());
    }

    @Test
    void testLoadFromMap() {
        OpenCircuitSimParameters parameters = OpenCircuitSimParameters.load(Map.of(
                "pivotEpsilon", "0",
                "referenceNodes", "gnd, vss:0",
                "profiling", "true"));
        assertEquals(0, parameters.getPivotEpsilon());
        assertEquals(List.of("gnd", "vss", "0"), parameters.getReferenceNodes());
        assertTrue(parameters.isProfiling());

        parameters.update(Map.of("referenceNodes", " "));
        assertTrue(parameters.getReferenceNodes().isEmpty());
        assertEquals(0, parameters.getPivotEpsilon());
    }

    @Test
    void testSetters() {
        OpenCircuitSimParameters parameters = new OpenCircuitSimParameters();
        assertThrows(PowsyblException.class, () -> parameters.setPivotEpsilon(Double.NaN));
        assertThrows(NullPointerException.class, () -> parameters.setReferenceNodes(null));
        assertSame(parameters, parameters.setPivotEpsilon(1e-6));
        assertEquals(1e-6, parameters.getPivotEpsilon());
    }
}
