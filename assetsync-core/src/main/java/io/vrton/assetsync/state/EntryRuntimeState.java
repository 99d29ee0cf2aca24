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

import io.vrton.assetsync.catalog.CatalogEntry;

/// Mutable runtime state of one entry, owned by an {@link EntryStateRegistry}.
///
/// An instance belongs to one catalog generation. When a refresh replaces it, late writes from
/// operations that started earlier are still accepted by the instance but are no longer visible
/// through the registry; callers check {@link EntryStateRegistry#owns(EntryRuntimeState)} first.
public final class EntryRuntimeState {

    private final CatalogEntry entry;
    private final StatusBoard board;

    private DownloadState state = DownloadState.IDLE;
    private double progress;
    private long probedSize;
    private PreviewImage preview;
    private DownloadState lastOutcome;
    private String lastMessage;

    EntryRuntimeState(CatalogEntry entry, StatusBoard board) {
        this.entry = entry;
        this.board = board;
    }

    /// @return the entry this state was created for
    public CatalogEntry entry() {
        return entry;
    }

    /// @return the entry key
    public String name() {
        return entry.name();
    }

    /// Moves to REQUESTING with zero progress.
    /// @return false if a download was already in flight, in which case nothing changes
    public boolean beginRequest() {
        EntryStatus changed;
        synchronized (this) {
            if (state == DownloadState.REQUESTING) {
                return false;
            }
            state = DownloadState.REQUESTING;
            progress = 0.0d;
            changed = snapshotLocked();
        }
        board.entryChanged(changed);
        return true;
    }

    /// Publishes download progress. Values are clamped to [0, 1] and never move backwards.
    /// @param value the observed progress
    public void publishProgress(double value) {
        EntryStatus changed;
        synchronized (this) {
            double clamped = Math.max(0.0d, Math.min(1.0d, value));
            if (state != DownloadState.REQUESTING || clamped <= progress) {
                return;
            }
            progress = clamped;
            changed = snapshotLocked();
        }
        board.entryChanged(changed);
    }

    /// Ends the current download. Observers see the terminal state, then IDLE.
    /// @param outcome a terminal state
    /// @param message a human readable description of the outcome
    public void finish(DownloadState outcome, String message) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("not a terminal state: " + outcome);
        }
        EntryStatus terminal;
        EntryStatus idle;
        synchronized (this) {
            state = outcome;
            if (outcome == DownloadState.SUCCEEDED) {
                progress = 1.0d;
            }
            lastOutcome = outcome;
            lastMessage = message;
            terminal = snapshotLocked();
            state = DownloadState.IDLE;
            idle = snapshotLocked();
        }
        board.entryChanged(terminal);
        board.entryChanged(idle);
    }

    /// Records a size learned from a probe. Ignored if a size is already known.
    /// @param size the size in bytes
    public void publishSize(long size) {
        EntryStatus changed;
        synchronized (this) {
            if (size <= 0 || knownSizeLocked() > 0) {
                return;
            }
            probedSize = size;
            changed = snapshotLocked();
        }
        board.entryChanged(changed);
    }

    /// Records a fetched preview image.
    /// @param image the image
    public void publishPreview(PreviewImage image) {
        EntryStatus changed;
        synchronized (this) {
            preview = image;
            changed = snapshotLocked();
        }
        board.entryChanged(changed);
    }

    /// @return the published size if present, otherwise a probed size, otherwise 0
    public synchronized long knownSize() {
        return knownSizeLocked();
    }

    /// @return true if a preview has been fetched
    public synchronized boolean hasPreview() {
        return preview != null;
    }

    /// @return true while a download is in flight
    public synchronized boolean isRequesting() {
        return state == DownloadState.REQUESTING;
    }

    /// @return a consistent read-only snapshot
    public synchronized EntryStatus snapshot() {
        return snapshotLocked();
    }

    private long knownSizeLocked() {
        return entry.fileSize() > 0 ? entry.fileSize() : probedSize;
    }

    private EntryStatus snapshotLocked() {
        return new EntryStatus(entry.name(), state, progress, knownSizeLocked(), preview, lastOutcome, lastMessage);
    }
}
