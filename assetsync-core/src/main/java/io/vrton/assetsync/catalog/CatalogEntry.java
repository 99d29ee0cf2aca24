package io.vrton.assetsync.catalog;

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

/// One downloadable package as published by the remote catalog.
///
/// Entries are immutable. Runtime state (download progress, probed size, preview) lives in
/// {@link io.vrton.assetsync.state.EntryStateRegistry} keyed by {@link #name()}.
///
/// @param name
///     the unique key of the entry within a catalog
/// @param description
///     free text
/// @param version
///     free text, used in the destination file name
/// @param downloadUrl
///     absolute URL of the package
/// @param imageUrl
///     absolute URL of a preview image, or empty
/// @param category
///     free text grouping key
/// @param fileSize
///     the package size in bytes as published, 0 when unknown
public record CatalogEntry(
    String name,
    String description,
    String version,
    String downloadUrl,
    String imageUrl,
    String category,
    long fileSize
) {
    public CatalogEntry {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        version = version == null ? "" : version;
        downloadUrl = downloadUrl == null ? "" : downloadUrl.trim();
        imageUrl = imageUrl == null ? "" : imageUrl.trim();
        category = category == null ? "" : category;
        fileSize = Math.max(0L, fileSize);
    }

    /// @return true if the catalog published a size for this entry
    public boolean hasKnownSize() {
        return fileSize > 0;
    }

    /// @return true if the entry has a preview image URL
    public boolean hasImage() {
        return !imageUrl.isEmpty();
    }
}
