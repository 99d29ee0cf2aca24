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

import java.util.Arrays;

/// Raw preview image bytes, handed to the presentation layer for decoding.
/// @param url
///     where the image was fetched from
/// @param format
///     the sniffed image format
/// @param data
///     the encoded image
public record PreviewImage(String url, ImageFormat format, byte[] data) {

    public PreviewImage {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /// @return the encoded size in bytes
    public int length() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PreviewImage p && p.url.equals(url) && p.format == format && Arrays.equals(p.data, data);
    }

    @Override
    public int hashCode() {
        return 31 * url.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PreviewImage[" + format + ", " + data.length + " bytes, " + url + "]";
    }
}
