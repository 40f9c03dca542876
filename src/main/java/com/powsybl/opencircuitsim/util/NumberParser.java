/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.util;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Floating point literals as written in netlists and result files.
 *
 * <p>Accepted: decimal and exponent notation with an optional sign, single underscores between digits, and
 * {@code nan}, {@code inf} or {@code infinity} in any case. Surrounding whitespace is ignored. Java specific forms
 * like {@code 1f}, {@code 5d} or hexadecimal {@code 0x1p0} are rejected.</p>
 *
 * @author Open Circuit Sim developers
 */
public final class NumberParser {

    private static final String DIGITS = "\\d(?:_?\\d)*";

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")"
            + "(?:[eE][+-]?" + DIGITS + ")?");

    private NumberParser() {
    }

    public static OptionalDouble parseDouble(String text) {
        String value = text.strip();
        String lowerCase = value.toLowerCase(Locale.ROOT);
        boolean negative = lowerCase.startsWith("-");
        String unsigned = negative || lowerCase.startsWith("+") ? lowerCase.substring(1) : lowerCase;
        switch (unsigned) {
            case "nan":
                return OptionalDouble.of(Double.NaN);
            case "inf", "infinity":
                return OptionalDouble.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            default:
                break;
        }
        if (!DECIMAL_PATTERN.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(value.replace("_", "")));
    }
}
