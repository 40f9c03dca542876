/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.netlist;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line oriented netlist parser.
 *
 * <pre>
 * # comment
 * TYPE:NAME node1 node2 ... key="value" ...
 * .DC Start="0" Stop="10" Points="2" Param="sweep"
 * </pre>
 *
 * Lines that cannot be interpreted are skipped, the parser never fails.
 *
 * @author Open Circuit Sim developers
 */
public final class NetlistParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetlistParser.class);

    public static final String COMMENT_PREFIX = "#";

    public static final String DC_COMMAND_PREFIX = ".DC";

    private static final char TYPE_NAME_SEPARATOR = ':';

    private static final char PARAMETER_MARKER = '=';

    private NetlistParser() {
    }

    public static Netlist parse(String text) {
        Objects.requireNonNull(text);
        Netlist netlist = new Netlist();
        text.lines().forEach(line -> parseLine(line.strip(), netlist));
        LOGGER.debug("Netlist parsed: {} components, {} node tokens", netlist.getComponents().size(), netlist.getNodes().size());
        return netlist;
    }

    private static void parseLine(String line, Netlist netlist) {
        if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
            return;
        }

        Map<String, String> parameters = NetlistLineScanner.scanParameters(line);
        List<String> tokens = NetlistLineScanner.tokenize(line);
        String identity = tokens.get(0);

        if (identity.startsWith(DC_COMMAND_PREFIX)) {
            netlist.getSweepDirective().merge(parameters);
            return;
        }

        Pair<String, String> typeAndName = splitIdentity(identity);
        if (typeAndName == null) {
            LOGGER.debug("Skipping unrecognized netlist line '{}'", line);
            return;
        }

        List<String> nodes = new ArrayList<>();
        for (String token : tokens.subList(1, tokens.size())) {
            if (token.indexOf(PARAMETER_MARKER) >= 0) {
                break;
            }
            nodes.add(token);
        }
        netlist.addComponent(new ComponentInstance(typeAndName.getLeft(), typeAndName.getRight(), nodes, parameters));
    }

    /**
     * Split {@code TYPE:NAME} on the first colon, or return null if the token has no colon.
     */
    static Pair<String, String> splitIdentity(String identity) {
        int separator = identity.indexOf(TYPE_NAME_SEPARATOR);
        if (separator < 0) {
            return null;
        }
        return Pair.of(identity.substring(0, separator), identity.substring(separator + 1));
    }
}
