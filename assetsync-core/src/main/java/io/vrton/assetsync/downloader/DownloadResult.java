package io.vrton.assetsync.downloader;

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

import io.vrton.assetsync.AssetSyncException;
import io.vrton.assetsync.ErrorKind;

import java.nio.file.Path;
import java.util.Optional;

/// Represents the result of a package download request.
///
/// @param entryName The entry the download was requested for
/// @param status How the request ended
/// @param path The local file the package was written to, or null if none was written
/// @param bytes The number of bytes downloaded
/// @param error The failure, or null for IMPORTED and SKIPPED
public record DownloadResult(
    String entryName,
    DownloadStatus status,
    Path path,
    long bytes,
    AssetSyncException error
) {
    /// @param entryName the entry
    /// @param path the file handed to the importer
    /// @param bytes the package size
    /// @return an IMPORTED result
    public static DownloadResult imported(String entryName, Path path, long bytes) {
        return new DownloadResult(entryName, DownloadStatus.IMPORTED, path, bytes, null);
    }

    /// @param entryName the entry
    /// @param path the file handed to the importer
    /// @param bytes the package size
    /// @param error the importer failure
    /// @return an IMPORT_FAILED result
    public static DownloadResult importFailed(String entryName, Path path, long bytes, AssetSyncException error) {
        return new DownloadResult(entryName, DownloadStatus.IMPORT_FAILED, path, bytes, error);
    }

    /// Creates the result matching a failure's kind: TIMED_OUT, CANCELLED, or FAILED.
    /// @param entryName the entry
    /// @param error the failure
    /// @return the result
    public static DownloadResult failed(String entryName, AssetSyncException error) {
        DownloadStatus status = switch (error.kind()) {
            case TIMEOUT -> DownloadStatus.TIMED_OUT;
            case CANCELLED -> DownloadStatus.CANCELLED;
            default -> DownloadStatus.FAILED;
        };
        return new DownloadResult(entryName, status, null, 0, error);
    }

    /// @param entryName the entry
    /// @param reason why nothing was started
    /// @return a SKIPPED result
    public static DownloadResult skipped(String entryName, String reason) {
        return new DownloadResult(entryName, DownloadStatus.SKIPPED, null, 0,
            reason == null ? null : new AssetSyncException(ErrorKind.VALIDATION_REJECTED, reason));
    }

    /// @return true if the package was downloaded and imported
    public boolean isSuccess() {
        return status == DownloadStatus.IMPORTED;
    }

    /// @return true if the package bytes arrived intact, whatever the importer did with them
    public boolean isDownloaded() {
        return status == DownloadStatus.IMPORTED || status == DownloadStatus.IMPORT_FAILED;
    }

    /// @return the failure, if any
    public Optional<AssetSyncException> failure() {
        return Optional.ofNullable(error);
    }

    /// @return the failure kind, if any
    public Optional<ErrorKind> errorKind() {
        return failure().map(AssetSyncException::kind);
    }

    /// @return a one line description for status displays
    public String describe() {
        return switch (status) {
            case IMPORTED -> "Successfully downloaded and imported " + entryName;
            case IMPORT_FAILED -> "Downloaded " + entryName + " but import failed: " + message();
            case FAILED -> "Failed to download " + entryName + ": " + message();
            case TIMED_OUT -> "Download of " + entryName + " timed out";
            case CANCELLED -> "Download of " + entryName + " was cancelled";
            case SKIPPED -> "Download of " + entryName + " skipped" + (error == null ? "" : ": " + message());
        };
    }

    private String message() {
        return error == null ? "unknown error" : error.getMessage();
    }
}
