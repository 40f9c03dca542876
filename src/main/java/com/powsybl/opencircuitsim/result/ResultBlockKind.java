/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.result;

import java.util.Arrays;
import java.util.Optional;

/**
 * @author Open Circuit Sim developers
 */
public enum ResultBlockKind {
    INDEP("indep"), // swept variable
    DEP("dep"); // variable depending on the swept one

    private final String tag;

    ResultBlockKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<ResultBlockKind> fromTag(String tag) {
        return Arrays.stream(values()).filter(kind -> kind.tag.equals(tag)).findFirst();
    }
}
