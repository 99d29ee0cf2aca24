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
import io.vrton.assetsync.catalog.CatalogEntry;
import io.vrton.assetsync.config.AssetSyncConfig;
import io.vrton.assetsync.state.EntryRuntimeState;
import io.vrton.assetsync.state.EntryStateRegistry;
import io.vrton.assetsync.state.StatusBoard;
import io.vrton.assetsync.transport.HttpTransport;
import io.vrton.assetsync.transport.TransferHandle;
import io.vrton.assetsync.transport.TransferResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// Runs package downloads, at most one per entry.
///
/// A download streams into a `.part` file in the scratch directory while a poller publishes
/// progress and enforces the whole-download deadline. A finished payload is size checked,
/// moved to its final name, checked again, handed to the {@link PackageImporter} and deleted.
/// Each download holds its final name until its transfer has ended and its files are gone, and no
/// other download is given that name meanwhile.
/// Every download ends exactly once, with its entry back in IDLE and its in-flight slot released,
/// whichever way it ended.
public class DownloadCoordinator implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DownloadCoordinator.class);

    private final AssetSyncConfig config;
    private final HttpTransport transport;
    private final EntryStateRegistry registry;
    private final StatusBoard board;
    private final PackageImporter importer;
    private final ScheduledExecutorService scheduler;
    private final Executor completionExecutor;

    private final Map<String, ActiveDownload> inFlight = new ConcurrentHashMap<>();
    private final Map<Path, ActiveDownload> reservedPaths = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// @param config
    ///     limits, scratch directory and timing
    /// @param transport
    ///     the transport downloads are issued on
    /// @param registry
    ///     the entry states progress and outcomes are published to
    /// @param board
    ///     receives a status message per finished download
    /// @param importer
    ///     consumes verified packages
    /// @param scheduler
    ///     runs the progress pollers
    /// @param completionExecutor
    ///     runs verification and import once a transfer ends
    public DownloadCoordinator(
        AssetSyncConfig config,
        HttpTransport transport,
        EntryStateRegistry registry,
        StatusBoard board,
        PackageImporter importer,
        ScheduledExecutorService scheduler,
        Executor completionExecutor
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.board = Objects.requireNonNull(board, "board");
        this.importer = Objects.requireNonNull(importer, "importer");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
    }

    /// Starts downloading an entry of the published catalog.
    ///
    /// If a download for the same entry is already in flight, its future is returned and no new
    /// request is made. Failures are never thrown; they arrive as the result's status and error.
    /// @param entry
    ///     the entry to download, as found in the published catalog
    /// @return a future completed when the download has ended
    public CompletableFuture<DownloadResult> startDownload(CatalogEntry entry) {
        if (closed.get()) {
            return CompletableFuture.completedFuture(DownloadResult.failed(entry.name(),
                new AssetSyncException(ErrorKind.CANCELLED, "downloads have been shut down")));
        }
        if (entry.downloadUrl().isEmpty()) {
            return CompletableFuture.completedFuture(DownloadResult.skipped(entry.name(), "entry has no download URL"));
        }
        EntryRuntimeState state = registry.get(entry.name()).filter(s -> s.entry().equals(entry)).orElse(null);
        if (state == null) {
            return CompletableFuture.completedFuture(
                DownloadResult.skipped(entry.name(), "entry is not part of the published catalog"));
        }

        ActiveDownload active = new ActiveDownload(entry, state);
        ActiveDownload existing = inFlight.putIfAbsent(entry.name(), active);
        if (existing != null) {
            logger.debug("download of {} already in flight", entry.name());
            return existing.future;
        }
        if (!state.beginRequest()) {
            inFlight.remove(entry.name(), active);
            return CompletableFuture.completedFuture(
                DownloadResult.skipped(entry.name(), "a download is already in flight"));
        }

        try {
            launch(active);
        } catch (AssetSyncException e) {
            settle(active, DownloadResult.failed(entry.name(), e));
            abandon(active);
        } catch (RuntimeException e) {
            logger.error("could not start download of {}", entry.name(), e);
            settle(active, DownloadResult.failed(entry.name(), AssetSyncException.wrap(ErrorKind.NETWORK, e)));
            abandon(active);
        }
        return active.future;
    }

    private void launch(ActiveDownload active) throws AssetSyncException {
        CatalogEntry entry = active.entry;
        long maxBytes = config.maxDownloadBytes();
        long knownSize = active.state.knownSize();
        if (knownSize > maxBytes) {
            throw new AssetSyncException(ErrorKind.SIZE_LIMIT_EXCEEDED,
                entry.name() + " is " + knownSize + " bytes, over the limit of " + maxBytes + " bytes");
        }

        Path destination;
        try {
            destination = reserveDestination(active);
            Files.createDirectories(destination.getParent());
        } catch (IOException | IllegalStateException e) {
            throw new AssetSyncException(ErrorKind.INTEGRITY,
                "Unable to prepare scratch file for " + entry.name() + ": " + e.getMessage(), e);
        }
        active.partFile = destination.resolveSibling(destination.getFileName() + ".part");

        long deadline = System.nanoTime() + config.downloadTimeout().toNanos();
        TransferHandle handle = transport.download(entry.downloadUrl(), maxBytes, active.partFile);
        active.handle = handle;
        logger.info("Downloading {} from {} to {}", entry.name(), entry.downloadUrl(), destination);
        handle.result().whenCompleteAsync((result, error) -> complete(active, result, error), completionExecutor);

        long interval = config.pollInterval().toMillis();
        active.poller = scheduler.scheduleWithFixedDelay(() -> poll(active, deadline), interval, interval,
            TimeUnit.MILLISECONDS);
        if (active.settled.get()) {
            active.poller.cancel(false);
        }
    }

    /// Claims the first copy of the entry's scratch name that no other download holds.
    private Path reserveDestination(ActiveDownload active) {
        for (int copy = 1; ; copy++) {
            Path candidate = PackageFileNames.destinationFor(config.scratchDirectory(), active.entry,
                config.packageExtension(), copy);
            if (reservedPaths.putIfAbsent(candidate, active) == null) {
                active.destination = candidate;
                if (copy > 1) {
                    logger.debug("scratch name for {} taken, using {}", active.entry.name(), candidate.getFileName());
                }
                return candidate;
            }
        }
    }

    private void release(ActiveDownload active) {
        Path destination = active.destination;
        if (destination != null) {
            reservedPaths.remove(destination, active);
        }
    }

    /// Cleans up after a download that failed to start. A transfer that did start releases the
    /// scratch name itself once it has ended.
    private void abandon(ActiveDownload active) {
        TransferHandle handle = active.handle;
        if (handle == null) {
            release(active);
        } else {
            handle.abort(ErrorKind.CANCELLED);
        }
    }

    private void poll(ActiveDownload active, long deadline) {
        TransferHandle handle = active.handle;
        if (handle == null || handle.isDone()) {
            return;
        }
        if (registry.owns(active.state)) {
            active.state.publishProgress(handle.progress());
        }
        if (System.nanoTime() - deadline >= 0) {
            logger.warn("Download of {} exceeded {}", active.entry.name(), config.downloadTimeout());
            handle.abort(ErrorKind.TIMEOUT);
        }
    }

    private void complete(ActiveDownload active, TransferResult transfer, Throwable error) {
        DownloadResult result = null;
        try {
            if (error != null) {
                result = DownloadResult.failed(active.entry.name(), AssetSyncException.wrap(ErrorKind.NETWORK, error));
            } else {
                result = verifyAndImport(active, transfer);
            }
        } catch (AssetSyncException e) {
            result = DownloadResult.failed(active.entry.name(), e);
        } catch (RuntimeException e) {
            logger.error("unexpected failure finishing download of {}", active.entry.name(), e);
            result = DownloadResult.failed(active.entry.name(), AssetSyncException.wrap(ErrorKind.INTEGRITY, e));
        } finally {
            if (result == null) {
                result = DownloadResult.failed(active.entry.name(),
                    new AssetSyncException(ErrorKind.INTEGRITY, "download of " + active.entry.name() + " aborted"));
            }
            deleteBestEffort(active.partFile);
            release(active);
            settle(active, result);
        }
    }

    private DownloadResult verifyAndImport(ActiveDownload active, TransferResult transfer) throws AssetSyncException {
        String name = active.entry.name();
        long maxBytes = config.maxDownloadBytes();
        long size = sizeOf(transfer.file());
        if (size <= 0 || transfer.bytes() <= 0) {
            throw new AssetSyncException(ErrorKind.INTEGRITY, "Download of " + name + " produced an empty file");
        }
        if (size > maxBytes) {
            throw new AssetSyncException(ErrorKind.SIZE_LIMIT_EXCEEDED,
                "Download of " + name + " is " + size + " bytes, over the limit of " + maxBytes + " bytes");
        }

        Path destination = active.destination;
        try {
            move(transfer.file(), destination);
            if (sizeOf(destination) <= 0) {
                throw new AssetSyncException(ErrorKind.INTEGRITY, "Downloaded file for " + name + " is empty");
            }
            if (active.cancelled.get()) {
                throw new AssetSyncException(ErrorKind.CANCELLED, "Download of " + name + " was cancelled");
            }
            try {
                importer.importPackage(destination);
            } catch (IOException | RuntimeException e) {
                logger.error("Import of {} failed", destination, e);
                return DownloadResult.importFailed(name, destination, size,
                    new AssetSyncException(ErrorKind.IMPORT, "Import of " + name + " failed: " + e.getMessage(), e));
            }
            logger.info("Imported {} ({} bytes)", name, size);
            return DownloadResult.imported(name, destination, size);
        } finally {
            deleteBestEffort(destination);
        }
    }

    private static long sizeOf(Path file) throws AssetSyncException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new AssetSyncException(ErrorKind.INTEGRITY, "Downloaded file is missing: " + file);
        }
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new AssetSyncException(ErrorKind.INTEGRITY, "Unable to read size of " + file, e);
        }
    }

    private static void move(Path from, Path to) throws AssetSyncException {
        try {
            try {
                Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new AssetSyncException(ErrorKind.INTEGRITY, "Unable to move " + from + " to " + to, e);
        }
    }

    private static void deleteBestEffort(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    /// Ends a download exactly once: stops its poller, removes its partial file, releases its
    /// in-flight slot, moves its entry back to IDLE and completes its future.
    private void settle(ActiveDownload active, DownloadResult result) {
        if (!active.settled.compareAndSet(false, true)) {
            return;
        }
        try {
            ScheduledFuture<?> poller = active.poller;
            if (poller != null) {
                poller.cancel(false);
            }
            deleteBestEffort(active.partFile);
        } finally {
            inFlight.remove(active.entry.name(), active);
            String message = result.describe();
            if (registry.owns(active.state)) {
                if (result.status().terminalState() != null) {
                    active.state.finish(result.status().terminalState(), message);
                }
                board.post(message);
            } else {
                logger.debug("{} (entry no longer published)", message);
            }
            if (result.isDownloaded() || result.status() == DownloadStatus.CANCELLED) {
                logger.info(message);
            } else {
                logger.warn(message);
            }
            active.future.complete(result);
        }
    }

    /// Cancels the in-flight downloads of the given entries.
    /// @param names
    ///     entry names
    public void cancel(Collection<String> names) {
        for (String name : names) {
            ActiveDownload active = inFlight.get(name);
            if (active != null) {
                cancel(active);
            }
        }
    }

    /// Cancels every in-flight download. Safe to call at any time and any number of times.
    public void cancelAll() {
        for (ActiveDownload active : List.copyOf(inFlight.values())) {
            try {
                cancel(active);
            } catch (RuntimeException e) {
                logger.error("error cancelling download of {}", active.entry.name(), e);
            }
        }
    }

    private void cancel(ActiveDownload active) {
        active.cancelled.set(true);
        TransferHandle handle = active.handle;
        if (handle != null) {
            handle.abort(ErrorKind.CANCELLED);
        }
        settle(active, DownloadResult.failed(active.entry.name(),
            new AssetSyncException(ErrorKind.CANCELLED, "Download of " + active.entry.name() + " was cancelled")));
    }

    /// @param name
    ///     an entry name
    /// @return true if a download for the entry is in flight
    public boolean isDownloading(String name) {
        return inFlight.containsKey(name);
    }

    /// @return the number of downloads in flight
    public int activeCount() {
        return inFlight.size();
    }

    /// Cancels everything in flight and refuses new downloads.
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cancelAll();
        }
    }

    private static final class ActiveDownload {
        private final CatalogEntry entry;
        private final EntryRuntimeState state;
        private final CompletableFuture<DownloadResult> future = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile TransferHandle handle;
        private volatile ScheduledFuture<?> poller;
        private volatile Path destination;
        private volatile Path partFile;

        private ActiveDownload(CatalogEntry entry, EntryRuntimeState state) {
            this.entry = entry;
            this.state = state;
        }
    }
}
