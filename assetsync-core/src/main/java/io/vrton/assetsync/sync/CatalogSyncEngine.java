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
import io.vrton.assetsync.ErrorKind;
import io.vrton.assetsync.catalog.Catalog;
import io.vrton.assetsync.catalog.CatalogEntry;
import io.vrton.assetsync.catalog.CatalogParser;
import io.vrton.assetsync.catalog.ParsedCatalog;
import io.vrton.assetsync.config.AssetSyncConfig;
import io.vrton.assetsync.downloader.DownloadCoordinator;
import io.vrton.assetsync.downloader.DownloadResult;
import io.vrton.assetsync.downloader.PackageImporter;
import io.vrton.assetsync.probe.MetadataProber;
import io.vrton.assetsync.security.UrlSecurityValidator;
import io.vrton.assetsync.state.AssetSyncListener;
import io.vrton.assetsync.state.EntryStateRegistry;
import io.vrton.assetsync.state.EntryStatus;
import io.vrton.assetsync.state.PreviewImage;
import io.vrton.assetsync.state.StatusBoard;
import io.vrton.assetsync.transport.HttpTransport;
import io.vrton.assetsync.transport.TransferHandle;
import io.vrton.assetsync.transport.TransferResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// Owns the published catalog and everything that acts on it.
///
/// A refresh fetches the configured catalog URL, decodes and filters it, and then publishes the
/// new catalog and resets per-entry state in one step. A refresh that fails leaves the previously
/// published catalog in place. Downloads and probes are started against the published catalog and
/// write their results to per-entry state, which callers read through {@link #entryStatus(String)}
/// or observe with an {@link AssetSyncListener}.
///
/// Every method returns without waiting on the network. Each engine instance owns its own
/// transport, scheduler and worker threads; {@link #close()} releases them.
public class CatalogSyncEngine implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(CatalogSyncEngine.class);

    private static final AtomicInteger ENGINE_IDS = new AtomicInteger();

    private final AssetSyncConfig config;
    private final boolean allowPrivateHosts;
    private final HttpTransport transport;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final StatusBoard board = new StatusBoard();
    private final EntryStateRegistry registry = new EntryStateRegistry(board);
    private final DownloadCoordinator coordinator;
    private final MetadataProber prober;

    private final Object publishLock = new Object();
    private final AtomicReference<Catalog> published = new AtomicReference<>(Catalog.empty());
    private final AtomicBoolean syncing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile TransferHandle catalogFetch;

    /// Creates an engine with an empty catalog. Nothing is fetched until {@link #sync()}.
    /// @param config
    ///     the engine configuration
    /// @param importer
    ///     receives every verified package
    public CatalogSyncEngine(AssetSyncConfig config, PackageImporter importer) {
        this.config = config;
        this.allowPrivateHosts = config.allowPrivateHosts()
            || UrlSecurityValidator.hasPrivateOrLoopbackHost(config.catalogUrl());
        if (allowPrivateHosts && !config.allowPrivateHosts()) {
            logger.info("Catalog source {} is a private host, allowing private hosts for its entries",
                config.catalogUrl());
        }

        int id = ENGINE_IDS.incrementAndGet();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "assetsync-" + id + "-poller");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "assetsync-" + id + "-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.transport = new HttpTransport(config.requestTimeout(), () -> allowPrivateHosts);
        this.coordinator = new DownloadCoordinator(config, transport, registry, board, importer, scheduler, workers);
        this.prober = new MetadataProber(transport, registry, scheduler, config.requestTimeout(),
            () -> allowPrivateHosts);
    }

    /// Starts a catalog refresh.
    ///
    /// Returns a SKIPPED result at once if a refresh is already running. The in-progress flag is
    /// cleared and listeners are notified before the returned future completes, whichever way the
    /// refresh ends.
    /// @return a future completed with the refresh outcome, never exceptionally
    public CompletableFuture<SyncResult> sync() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(SyncResult.skipped("engine is closed"));
        }
        if (!syncing.compareAndSet(false, true)) {
            logger.debug("refresh already in progress");
            return CompletableFuture.completedFuture(SyncResult.skipped("a refresh is already in progress"));
        }
        board.syncStateChanged(true);
        board.post("Loading catalog...");

        CompletableFuture<SyncResult> outcome;
        try {
            outcome = fetchAndPublish();
        } catch (RuntimeException e) {
            logger.error("could not start catalog fetch", e);
            outcome = CompletableFuture.completedFuture(fail(AssetSyncException.wrap(ErrorKind.NETWORK, e)));
        }

        CompletableFuture<SyncResult> done = new CompletableFuture<>();
        outcome.whenComplete((result, error) -> {
            catalogFetch = null;
            syncing.set(false);
            try {
                board.syncStateChanged(false);
            } finally {
                if (error != null) {
                    logger.error("catalog refresh failed unexpectedly", error);
                    done.complete(fail(AssetSyncException.wrap(ErrorKind.NETWORK, error)));
                } else {
                    done.complete(result);
                }
            }
        });
        return done;
    }

    private CompletableFuture<SyncResult> fetchAndPublish() {
        String url = config.catalogUrl();
        if (!UrlSecurityValidator.isPermittedHost(url, allowPrivateHosts)) {
            return CompletableFuture.completedFuture(
                fail(new AssetSyncException(ErrorKind.VALIDATION_REJECTED, "catalog URL is not permitted: " + url)));
        }
        logger.debug("fetching catalog from {}", url);
        TransferHandle handle = transport.get(url, config.maxDownloadBytes());
        catalogFetch = handle;
        ScheduledFuture<?> deadline = scheduler.schedule(() -> handle.abort(ErrorKind.TIMEOUT),
            config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return handle.result().handleAsync((result, error) -> {
            deadline.cancel(false);
            return publish(result, error);
        }, workers);
    }

    private SyncResult publish(TransferResult fetched, Throwable error) {
        if (error != null) {
            return fail(AssetSyncException.wrap(ErrorKind.NETWORK, error));
        }
        ParsedCatalog parsed;
        try {
            parsed = CatalogParser.parse(fetched.body(), config.sourceIsApiEnvelope(), allowPrivateHosts);
        } catch (AssetSyncException e) {
            return fail(e);
        }
        Set<String> orphaned;
        synchronized (publishLock) {
            if (closed.get()) {
                return SyncResult.skipped("engine is closed");
            }
            orphaned = registry.replaceAll(parsed.catalog());
            published.set(parsed.catalog());
        }
        if (!orphaned.isEmpty()) {
            logger.info("Cancelling downloads of entries changed or removed by the refresh: {}", orphaned);
            coordinator.cancel(orphaned);
        }
        SyncResult result = SyncResult.ok(parsed);
        logger.info("{} from {} ({} parsed, {} rejected, {} duplicates)", result.message(), config.catalogUrl(),
            parsed.totalParsed(), parsed.rejected(), parsed.duplicates());
        board.catalogReplaced(parsed.catalog());
        board.post(result.message());
        return result;
    }

    private SyncResult fail(AssetSyncException error) {
        SyncResult result = SyncResult.failed(error);
        logger.warn(result.message());
        board.post(result.message());
        return result;
    }

    /// @return the published catalog, empty before the first successful refresh
    public Catalog catalog() {
        return published.get();
    }

    /// @return the rolling status message
    public String status() {
        return board.message();
    }

    /// @return true while a refresh is running
    public boolean isSyncing() {
        return syncing.get();
    }

    /// @return the private host policy applied to this engine's catalog entries
    public boolean allowsPrivateHosts() {
        return allowPrivateHosts;
    }

    /// @return the engine configuration
    public AssetSyncConfig config() {
        return config;
    }

    /// @param name
    ///     an entry name
    /// @return the entry's runtime state, if it is in the published catalog
    public Optional<EntryStatus> entryStatus(String name) {
        return registry.status(name);
    }

    /// Starts downloading the published entry with the given name.
    /// @param name
    ///     an entry name, matched exactly first and then ignoring case
    /// @return a future completed when the download has ended, never exceptionally
    public CompletableFuture<DownloadResult> startDownload(String name) {
        Optional<CatalogEntry> entry = findEntry(name);
        if (entry.isEmpty()) {
            return CompletableFuture.completedFuture(DownloadResult.skipped(name, "no such entry in the catalog"));
        }
        return startDownload(entry.get());
    }

    /// Starts downloading an entry of the published catalog.
    /// @param entry
    ///     the entry
    /// @return a future completed when the download has ended, never exceptionally
    public CompletableFuture<DownloadResult> startDownload(CatalogEntry entry) {
        return coordinator.startDownload(entry);
    }

    /// @param entry
    ///     an entry of the published catalog
    /// @return the probed size, or empty if none was learned
    public CompletableFuture<OptionalLong> probeSize(CatalogEntry entry) {
        return prober.probeSize(entry);
    }

    /// @param name
    ///     an entry name
    /// @return the probed size, or empty if none was learned
    public CompletableFuture<OptionalLong> probeSize(String name) {
        return findEntry(name).map(prober::probeSize)
            .orElseGet(() -> CompletableFuture.completedFuture(OptionalLong.empty()));
    }

    /// @param entry
    ///     an entry of the published catalog
    /// @return the preview, or empty if none was fetched
    public CompletableFuture<Optional<PreviewImage>> probeImage(CatalogEntry entry) {
        return prober.probeImage(entry);
    }

    /// @param name
    ///     an entry name
    /// @return the preview, or empty if none was fetched
    public CompletableFuture<Optional<PreviewImage>> probeImage(String name) {
        return findEntry(name).map(prober::probeImage)
            .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty()));
    }

    /// Cancels every download in flight.
    public void cancelAllDownloads() {
        coordinator.cancelAll();
    }

    /// @param listener
    ///     the listener to add
    public void addListener(AssetSyncListener listener) {
        board.addListener(listener);
    }

    /// @param listener
    ///     the listener to remove
    public void removeListener(AssetSyncListener listener) {
        board.removeListener(listener);
    }

    /// Finds a published entry by name, matched exactly first and then ignoring case.
    /// @param name
    ///     an entry name
    /// @return the published entry, or empty if there is none
    public Optional<CatalogEntry> findEntry(String name) {
        Catalog current = published.get();
        for (CatalogEntry entry : current.entries()) {
            if (entry.name().equals(name)) {
                return Optional.of(entry);
            }
        }
        return current.findExact(name);
    }

    /// Shuts the engine down: aborts a running catalog fetch, cancels every download, abandons
    /// probes and releases threads and connections. Later calls return SKIPPED or CANCELLED results.
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.debug("closing engine for {}", config.catalogUrl());
        try {
            TransferHandle fetch = catalogFetch;
            if (fetch != null) {
                fetch.abort(ErrorKind.CANCELLED);
            }
            coordinator.close();
            prober.close();
            synchronized (publishLock) {
                registry.clear();
            }
        } finally {
            scheduler.shutdownNow();
            workers.shutdown();
            transport.close();
        }
    }
}
