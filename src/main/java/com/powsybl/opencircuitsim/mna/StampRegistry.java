/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.mna;

import com.powsybl.opencircuitsim.netlist.ComponentInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Component type tag to stamp mapping.
 *
 * @author Open Circuit Sim developers
 */
public class StampRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(StampRegistry.class);

    private final Map<String, Stamp> stampsByType;

    private final boolean readOnly;

    public StampRegistry() {
        this(new LinkedHashMap<>(), false);
    }

    private StampRegistry(Map<String, Stamp> stampsByType, boolean readOnly) {
        this.stampsByType = stampsByType;
        this.readOnly = readOnly;
    }

    /**
     * Create a registry with the resistor and voltage source stamps only.
     */
    public static StampRegistry createDefault() {
        return new StampRegistry()
                .register(new ResistorStamp())
                .register(new VoltageSourceStamp());
    }

    /**
     * Create the default registry, extended by the stamps declared as {@link Stamp} services. A service stamp replaces
     * a default one of the same component type.
     */
    public static StampRegistry load() {
        StampRegistry registry = createDefault();
        for (Stamp stamp : ServiceLoader.load(Stamp.class)) {
            LOGGER.debug("Stamp service found for component type '{}': {}", stamp.getComponentType(), stamp.getClass().getName());
            registry.register(stamp);
        }
        return registry;
    }

    /**
     * Get a copy of this registry that cannot be changed anymore, so that it can be shared between threads.
     */
    public StampRegistry toReadOnly() {
        return readOnly ? this : new StampRegistry(new LinkedHashMap<>(stampsByType), true);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public StampRegistry register(Stamp stamp) {
        Objects.requireNonNull(stamp);
        if (readOnly) {
            throw new UnsupportedOperationException("Stamp registry is read only");
        }
        stampsByType.put(Objects.requireNonNull(stamp.getComponentType()), stamp);
        return this;
    }

    public Optional<Stamp> find(String componentType) {
        return Optional.ofNullable(stampsByType.get(componentType));
    }

    public boolean hasBranchCurrent(ComponentInstance component) {
        return find(component.getType()).map(Stamp::hasBranchCurrent).orElse(false);
    }

    public Map<String, Stamp> getStamps() {
        return Collections.unmodifiableMap(stampsByType);
    }
}
