package io.vrton.assetsync.probe;

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
import io.vrton.assetsync.security.UrlSecurityValidator;
import io.vrton.assetsync.state.EntryRuntimeState;
import io.vrton.assetsync.state.EntryStateRegistry;
import io.vrton.assetsync.state.ImageFormat;
import io.vrton.assetsync.state.PreviewImage;
import io.vrton.assetsync.transport.HttpTransport;
import io.vrton.assetsync.transport.TransferHandle;
import io.vrton.assetsync.transport.TransferResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/// Fills in entry metadata the catalog left out: package sizes from a HEAD request, and preview
/// images.
///
/// Probes are bounded by the request timeout only, not by the download size limit.
/// Probes are best effort. A failed probe is logged and leaves the entry as it was; the returned
/// futures never complete exceptionally. Concurrent probes of the same URL share one request, and
/// a result is published to every entry of the current catalog that carries that URL.
public class MetadataProber implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(MetadataProber.class);

    private final HttpTransport transport;
    private final EntryStateRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration requestTimeout;
    private final BooleanSupplier allowPrivateHosts;

    private final Map<String, CompletableFuture<OptionalLong>> sizeProbes = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Optional<PreviewImage>>> imageProbes = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// @param transport
    ///     the transport probes are issued on
    /// @param registry
    ///     where probed metadata is published
    /// @param scheduler
    ///     runs the per-probe deadlines
    /// @param requestTimeout
    ///     the bound on each probe
    /// @param allowPrivateHosts
    ///     the private host policy in effect for the current catalog source
    public MetadataProber(
        HttpTransport transport,
        EntryStateRegistry registry,
        ScheduledExecutorService scheduler,
        Duration requestTimeout,
        BooleanSupplier allowPrivateHosts
    ) {
        this.transport = transport;
        this.registry = registry;
        this.scheduler = scheduler;
        this.requestTimeout = requestTimeout;
        this.allowPrivateHosts = allowPrivateHosts;
    }

    /// Learns the size of an entry's package from the Content-Length of a HEAD request.
    ///
    /// Nothing is requested when the entry already has a known size, has no download URL, or
    /// is not part of the published catalog.
    /// @param entry
    ///     the entry to probe
    /// @return the probed size, or empty if none was learned
    public CompletableFuture<OptionalLong> probeSize(CatalogEntry entry) {
        Optional<EntryRuntimeState> state = registry.get(entry.name());
        if (state.isPresent() && state.get().knownSize() > 0) {
            return CompletableFuture.completedFuture(OptionalLong.of(state.get().knownSize()));
        }
        String url = entry.downloadUrl();
        if (closed.get() || state.isEmpty() || url.isEmpty()) {
            return CompletableFuture.completedFuture(OptionalLong.empty());
        }
        return dedup(sizeProbes, url, this::requestSize, OptionalLong.empty());
    }

    private CompletableFuture<OptionalLong> requestSize(String url) {
        return bounded(transport.head(url)).handle((result, error) -> {
            if (error != null) {
                logger.debug("size probe of {} failed: {}", url, AssetSyncException.wrap(ErrorKind.NETWORK, error));
                return OptionalLong.empty();
            }
            if (!result.hasDeclaredLength() || result.declaredLength() <= 0) {
                logger.debug("size probe of {} found no Content-Length", url);
                return OptionalLong.empty();
            }
            long size = result.declaredLength();
            for (EntryRuntimeState state : registry.withDownloadUrl(url)) {
                state.publishSize(size);
            }
            return OptionalLong.of(size);
        });
    }

    /// Fetches an entry's preview image.
    ///
    /// Nothing is requested when the entry has no image URL, already has a preview, or is not part
    /// of the published catalog, or when the image host is not permitted. Responses that are not
    /// PNG, JPEG or GIF are discarded.
    /// @param entry
    ///     the entry to fetch a preview for
    /// @return the preview, or empty if none was fetched
    public CompletableFuture<Optional<PreviewImage>> probeImage(CatalogEntry entry) {
        Optional<EntryRuntimeState> state = registry.get(entry.name());
        String url = entry.imageUrl();
        if (closed.get() || state.isEmpty() || url.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (state.get().hasPreview()) {
            return CompletableFuture.completedFuture(Optional.ofNullable(state.get().snapshot().preview()));
        }
        if (!UrlSecurityValidator.isPermittedHost(url, allowPrivateHosts.getAsBoolean())) {
            logger.warn("Preview image URL for {} rejected: {}", entry.name(), url);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return dedup(imageProbes, url, this::requestImage, Optional.empty());
    }

    private CompletableFuture<Optional<PreviewImage>> requestImage(String url) {
        return bounded(transport.get(url, 0)).handle((result, error) -> {
            if (error != null) {
                logger.debug("image fetch of {} failed: {}", url, AssetSyncException.wrap(ErrorKind.NETWORK, error));
                return Optional.empty();
            }
            Optional<ImageFormat> format = ImageFormat.sniff(result.body());
            if (format.isEmpty()) {
                logger.debug("image fetch of {} returned no recognised image ({})", url, result.contentType());
                return Optional.empty();
            }
            PreviewImage image = new PreviewImage(url, format.get(), result.body());
            for (EntryRuntimeState state : registry.withImageUrl(url)) {
                state.publishPreview(image);
            }
            return Optional.of(image);
        });
    }

    private <T> CompletableFuture<T> dedup(
        Map<String, CompletableFuture<T>> inFlight,
        String url,
        Function<String, CompletableFuture<T>> request,
        T fallback
    ) {
        CompletableFuture<T> placeholder = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(url, placeholder);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<T> started;
        try {
            started = request.apply(url);
        } catch (RuntimeException e) {
            logger.warn("probe of {} could not start: {}", url, e.getMessage());
            inFlight.remove(url, placeholder);
            placeholder.complete(fallback);
            return placeholder;
        }
        started.whenComplete((value, error) -> {
            inFlight.remove(url, placeholder);
            placeholder.complete(error == null ? value : fallback);
        });
        return placeholder;
    }

    private CompletableFuture<TransferResult> bounded(TransferHandle handle) {
        ScheduledFuture<?> deadline = scheduler.schedule(() -> handle.abort(ErrorKind.TIMEOUT),
            requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return handle.result().whenComplete((result, error) -> deadline.cancel(false));
    }

    /// @return the number of probes in flight
    public int activeCount() {
        return sizeProbes.size() + imageProbes.size();
    }

    /// Refuses new probes. Probes in flight end with the transport.
    @Override
    public void close() {
        closed.set(true);
    }
}
