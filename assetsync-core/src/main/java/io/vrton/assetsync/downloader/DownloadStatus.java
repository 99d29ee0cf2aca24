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

import io.vrton.assetsync.state.DownloadState;

/// How a download request ended.
public enum DownloadStatus {
    /// The package was downloaded, verified and imported
    IMPORTED(DownloadState.SUCCEEDED),
    /// The package was downloaded and verified, but the importer rejected it
    IMPORT_FAILED(DownloadState.SUCCEEDED),
    /// The request failed, including size limit and integrity failures
    FAILED(DownloadState.FAILED),
    /// The whole-operation bound was exceeded
    TIMED_OUT(DownloadState.TIMED_OUT),
    /// The download was aborted by a cancel or shutdown
    CANCELLED(DownloadState.CANCELLED),
    /// Nothing was started: another download for the entry was in flight, or the entry is not downloadable
    SKIPPED(null);

    private final DownloadState terminalState;

    DownloadStatus(DownloadState terminalState) {
        this.terminalState = terminalState;
    }

    /// @return the state the entry passes through when a download ends this way, or null for SKIPPED
    public DownloadState terminalState() {
        return terminalState;
    }
}
