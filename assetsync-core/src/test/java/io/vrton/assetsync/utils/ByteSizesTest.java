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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ByteSizesTest {

    @Test
    public void formatsWithBinaryUnits() {
        assertThat(ByteSizes.format(0)).isEqualTo("0 B");
        assertThat(ByteSizes.format(1023)).isEqualTo("1023 B");
        assertThat(ByteSizes.format(2048)).isEqualTo("2 KB");
        assertThat(ByteSizes.format(1536)).isEqualTo("1.5 KB");
        assertThat(ByteSizes.format(5L * 1024 * 1024)).isEqualTo("5 MB");
        assertThat(ByteSizes.format(3L * 1024 * 1024 * 1024 * 1024)).isEqualTo("3072 GB");
    }

    @Test
    public void negativeSizesAreUnknown() {
        assertThat(ByteSizes.format(-1)).isEqualTo("unknown");
    }
}
