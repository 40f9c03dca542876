/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.netlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Character level scanner of a single netlist line.
 *
 * <p>A parameter is a {@code key="value"} sequence found anywhere in the line: the key is a run of word characters
 * (letters, digits and underscore) immediately followed by {@code ="}, the value is a non-empty run of characters
 * other than a double quote, closed by a double quote. There is no escaping. When a candidate does not complete, the
 * scan restarts at the next character, so {@code a"b="c"} yields the parameter {@code b}.</p>
 *
 * @author Open Circuit Sim developers
 */
public final class NetlistLineScanner {

    private static final char QUOTE = '"';

    private static final char EQUALS = '=';

    private NetlistLineScanner() {
    }

    static boolean isWordCharacter(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    /**
     * Split a line into whitespace delimited tokens. Quotes are not special here.
     */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        int tokenStart = -1;
        for (int i = 0; i < line.length(); i++) {
            if (Character.isWhitespace(line.charAt(i))) {
                if (tokenStart >= 0) {
                    tokens.add(line.substring(tokenStart, i));
                    tokenStart = -1;
                }
            } else if (tokenStart < 0) {
                tokenStart = i;
            }
        }
        if (tokenStart >= 0) {
            tokens.add(line.substring(tokenStart));
        }
        return tokens;
    }

    /**
     * Extract every {@code key="value"} parameter of a line. A key seen twice keeps its last value.
     */
    public static Map<String, String> scanParameters(String line) {
        Map<String, String> parameters = new LinkedHashMap<>();
        int i = 0;
        while (i < line.length()) {
            int end = scanParameter(line, i, parameters);
            i = end > i ? end : i + 1;
        }
        return parameters;
    }

    /**
     * Try to read one parameter starting exactly at {@code start}.
     *
     * @return the index following the closing quote, or -1 if no parameter starts here
     */
    private static int scanParameter(String line, int start, Map<String, String> parameters) {
        int length = line.length();
        int keyEnd = start;
        while (keyEnd < length && isWordCharacter(line.charAt(keyEnd))) {
            keyEnd++;
        }
        if (keyEnd == start || keyEnd + 1 >= length || line.charAt(keyEnd) != EQUALS || line.charAt(keyEnd + 1) != QUOTE) {
            return -1;
        }
        int valueStart = keyEnd + 2;
        int valueEnd = line.indexOf(QUOTE, valueStart);
        if (valueEnd <= valueStart) {
            // unterminated or empty value
            return -1;
        }
        parameters.put(line.substring(start, keyEnd), line.substring(valueStart, valueEnd));
        return valueEnd + 1;
    }
}
