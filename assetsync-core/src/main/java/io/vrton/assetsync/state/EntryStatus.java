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

/// A read-only snapshot of an entry's runtime state.
/// @param name
///     the entry key
/// @param state
///     the current lifecycle state
/// @param progress
///     download progress in [0, 1]
/// @param fileSize
///     the best known size in bytes, 0 when unknown
/// @param preview
///     the preview image, or null while the placeholder is shown
/// @param lastOutcome
///     how the most recent download ended, or null if none has ended
/// @param lastMessage
///     a human readable description of the most recent outcome, or null
public record EntryStatus(
    String name,
    DownloadState state,
    double progress,
    long fileSize,
    PreviewImage preview,
    DownloadState lastOutcome,
    String lastMessage
) {
    /// @return true while a download for this entry is in flight
    public boolean isDownloading() {
        return state == DownloadState.REQUESTING;
    }

    /// @return true if a preview image has been fetched
    public boolean previewAvailable() {
        return preview != null;
    }

    /// @return the preview, if fetched
    public Optional<PreviewImage> previewImage() {
        return Optional.ofNullable(preview);
    }
}
