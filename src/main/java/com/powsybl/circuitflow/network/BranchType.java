/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.network;

import java.util.Arrays;

/**
 * Kind of a two terminal circuit element, with the unit of its value.
 */
public enum BranchType {
    RESISTOR("R", "ohm"),
    VOLTAGE_SOURCE("V", "V"),
    CURRENT_SOURCE("I", "A");

    private final String code;

    private final String unit;

    BranchType(String code, String unit) {
        this.code = code;
        this.unit = unit;
    }

    public String getCode() {
        return code;
    }

    public String getUnit() {
        return unit;
    }

    public static BranchType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown branch type code: " + code));
    }
}
