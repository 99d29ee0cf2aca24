package io.vrton.assetsync;

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

/// Classifies every failure the engine can report.
///
/// The kind is what callers branch on; the message is for humans.
public enum ErrorKind {
    /// Connection, DNS, protocol failure or a non-success HTTP status
    NETWORK(true),
    /// A configured time bound was exceeded
    TIMEOUT(true),
    /// The response was expected to be a hosting API envelope but was not a usable one
    ENVELOPE(false),
    /// The body is not a valid catalog document
    MALFORMED_CATALOG(false),
    /// A URL failed the security policy
    VALIDATION_REJECTED(false),
    /// A payload was larger than the configured maximum, before or after transfer
    SIZE_LIMIT_EXCEEDED(false),
    /// A transfer reported success but produced no usable bytes or file
    INTEGRITY(true),
    /// The importer rejected an otherwise good package
    IMPORT(true),
    /// The operation was aborted by a shutdown or an explicit cancel
    CANCELLED(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /// @return true if trying the same operation again may succeed
    public boolean isRetryable() {
        return retryable;
    }
}
