package io.vrton.assetsync.utils;

/*
 * Copyright (c) vrton
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/// Formats byte counts for display.
public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private ByteSizes() {
    }

    /// Renders a byte count with binary units and up to two decimals, e.g. `1.5 MB`.
    /// @param bytes the count, negative values render as `unknown`
    /// @return the formatted size
    public static String format(long bytes) {
        if (bytes < 0) {
            return "unknown";
        }
        double len = bytes;
        int order = 0;
        while (len >= 1024 && order < UNITS.length - 1) {
            order++;
            len = len / 1024;
        }
        DecimalFormat df = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return df.format(len) + " " + UNITS[order];
    }
}
