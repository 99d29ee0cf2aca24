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

import io.vrton.assetsync.catalog.Catalog;

/// Observer of engine state. Callbacks arrive on engine or network threads and must not block.
public interface AssetSyncListener {

    /// A refresh published a new catalog.
    /// @param catalog the new catalog
    default void onCatalogReplaced(Catalog catalog) {
    }

    /// An entry's runtime state changed.
    /// @param status the new snapshot
    default void onEntryChanged(EntryStatus status) {
    }

    /// The rolling status message changed.
    /// @param message the new message
    default void onStatusChanged(String message) {
    }

    /// A refresh started or ended.
    /// @param syncing true while a refresh is running
    default void onSyncStateChanged(boolean syncing) {
    }
}
