/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.circuitflow.util;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.PlatformConfig;

import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

public final class DebugUtil {

    public static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd--HH-mm-ss-SSS");

    private DebugUtil() {
    }

    /**
     * Resolve a debug directory in the file system of the platform configuration directory.
     */
    public static Path getDebugDir(String debugDirStr, PlatformConfig platformConfig) {
        Objects.requireNonNull(debugDirStr);
        Objects.requireNonNull(platformConfig);
        return platformConfig.getConfigDir()
                .map(dir -> dir.getFileSystem().getPath(debugDirStr))
                .orElseThrow(() -> new PowsyblException("Cannot write to debug directory as no configuration directory has been defined"));
    }

    public static Path getDebugDir(String debugDirStr) {
        return getDebugDir(debugDirStr, PlatformConfig.defaultConfig());
    }
}
