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

import java.util.Objects;

/// A recoverable failure of a catalog, probe or download operation.
///
/// Instances are usually delivered as data inside a result record rather than thrown across
/// an asynchronous boundary. Use {@link #kind()} to decide how to react.
public class AssetSyncException extends Exception {

    private final ErrorKind kind;

    public AssetSyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AssetSyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /// @return the failure classification
    public ErrorKind kind() {
        return kind;
    }

    /// @return true if the failed operation may be retried as-is
    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /// Wraps an arbitrary throwable, keeping an existing classification when there is one.
    /// @param fallback the kind to use when the throwable is not already classified
    /// @param t the failure, possibly wrapped in a completion exception
    /// @return an AssetSyncException describing the failure
    public static AssetSyncException wrap(ErrorKind fallback, Throwable t) {
        Throwable cause = t;
        while ((cause instanceof java.util.concurrent.CompletionException
            || cause instanceof java.util.concurrent.ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof AssetSyncException ase) {
            return ase;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new AssetSyncException(fallback, message, cause);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
