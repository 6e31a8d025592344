/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.mna;

import com.powsybl.circuitflow.network.BranchType;

import java.util.Objects;

/**
 * A branch left out of the equations because of an unusable value. The rest of the circuit is still solved, the
 * skipped branch behaving as an open circuit.
 *
 * @param branchId id of the skipped branch
 * @param branchType kind of the skipped branch
 * @param value the rejected value
 * @param reason why the value has been rejected
 */
public record InvalidComponentWarning(String branchId, BranchType branchType, double value, String reason) {

    public InvalidComponentWarning {
        Objects.requireNonNull(branchId);
        Objects.requireNonNull(branchType);
        Objects.requireNonNull(reason);
    }

    public String getMessage() {
        return "Branch '" + branchId + "' (" + branchType + ", value=" + value + ") skipped: " + reason;
    }
}
