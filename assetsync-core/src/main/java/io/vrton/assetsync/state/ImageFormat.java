package io.vrton.assetsync.state;

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

import java.util.Optional;

/// Image formats accepted as previews, recognised by their leading bytes.
public enum ImageFormat {
    PNG(new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}),
    JPEG(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
    GIF(new byte[]{'G', 'I', 'F', '8'});

    private final byte[] magic;

    ImageFormat(byte[] magic) {
        this.magic = magic;
    }

    /// @param data
    ///     the start of an image resource
    /// @return the recognised format, or empty
    public static Optional<ImageFormat> sniff(byte[] data) {
        if (data == null) {
            return Optional.empty();
        }
        outer:
        for (ImageFormat format : values()) {
            if (data.length < format.magic.length) {
                continue;
            }
            for (int i = 0; i < format.magic.length; i++) {
                if (data[i] != format.magic[i]) {
                    continue outer;
                }
            }
            return Optional.of(format);
        }
        return Optional.empty();
    }
}
