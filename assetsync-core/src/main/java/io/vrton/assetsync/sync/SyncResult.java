package io.vrton.assetsync.sync;

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
import io.vrton.assetsync.catalog.Catalog;
import io.vrton.assetsync.catalog.ParsedCatalog;

import java.util.Optional;

/// The outcome of one catalog refresh.
///
/// @param status
///     how the refresh ended
/// @param catalog
///     the catalog published by this refresh, or null unless OK
/// @param totalParsed
///     entries found in the document
/// @param rejected
///     entries dropped because their download URL is not permitted
/// @param duplicates
///     entries dropped because an earlier entry has the same name
/// @param error
///     the failure, or null unless FAILED
/// @param message
///     the status message posted for this refresh
public record SyncResult(
    SyncStatus status,
    Catalog catalog,
    int totalParsed,
    int rejected,
    int duplicates,
    AssetSyncException error,
    String message
) {

    public static SyncResult ok(ParsedCatalog parsed) {
        return new SyncResult(SyncStatus.OK, parsed.catalog(), parsed.totalParsed(), parsed.rejected(),
            parsed.duplicates(), null, "Loaded " + parsed.surviving() + " assets");
    }

    public static SyncResult failed(AssetSyncException error) {
        return new SyncResult(SyncStatus.FAILED, null, 0, 0, 0, error,
            "Failed to load catalog: " + error.getMessage());
    }

    public static SyncResult skipped(String reason) {
        return new SyncResult(SyncStatus.SKIPPED, null, 0, 0, 0, null, reason);
    }

    /// @return true if a new catalog was published
    public boolean isOk() {
        return status == SyncStatus.OK;
    }

    /// @return the number of entries published
    public int published() {
        return catalog == null ? 0 : catalog.size();
    }

    /// @return the failure, if any
    public Optional<AssetSyncException> failure() {
        return Optional.ofNullable(error);
    }
}
