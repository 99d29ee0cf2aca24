package io.vrton.assetsync.transport;

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

import java.nio.file.Path;

/// The outcome of a completed transfer.
///
/// Exactly one of {@link #body()} and {@link #file()} carries the payload, depending on whether
/// the transfer was buffered in memory or streamed to a file.
///
/// @param url
///     the requested URL
/// @param statusCode
///     the final HTTP status
/// @param declaredLength
///     the Content-Length the server announced, or -1
/// @param contentType
///     the announced media type, or null
/// @param bytes
///     the number of payload bytes received
/// @param body
///     the payload when buffered, otherwise null
/// @param file
///     the file the payload was streamed to, otherwise null
public record TransferResult(
    String url,
    int statusCode,
    long declaredLength,
    String contentType,
    long bytes,
    byte[] body,
    Path file
) {
    /// @return true if the server announced a usable length
    public boolean hasDeclaredLength() {
        return declaredLength >= 0;
    }
}
