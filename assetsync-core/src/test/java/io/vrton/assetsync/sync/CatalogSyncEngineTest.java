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

import io.vrton.assetsync.ErrorKind;
import io.vrton.assetsync.catalog.Catalog;
import io.vrton.assetsync.catalog.CatalogEntry;
import io.vrton.assetsync.config.AssetSyncConfig;
import io.vrton.assetsync.config.EnvelopeMode;
import io.vrton.assetsync.downloader.DownloadResult;
import io.vrton.assetsync.downloader.DownloadStatus;
import io.vrton.assetsync.state.AssetSyncListener;
import io.vrton.assetsync.state.DownloadState;
import io.vrton.assetsync.testserver.JettyFileServerExtension;
import io.vrton.assetsync.testserver.JettyFileServerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(JettyFileServerExtension.class)
public class CatalogSyncEngineTest {

    @TempDir
    Path scratch;

    private JettyFileServerFixture server;
    private final List<Path> imported = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void setUp() {
        server = JettyFileServerExtension.getServer();
    }

    private static String asset(String name, String version, String url, String category) {
        return "{\"name\":\"" + name + "\",\"description\":\"" + name + " for avatars\",\"version\":\"" + version
            + "\",\"downloadUrl\":\"" + url + "\",\"category\":\"" + category + "\"}";
    }

    private static String document(String... assets) {
        return "{\"assets\":[" + String.join(",", assets) + "]}";
    }

    private String threeAssets() {
        return document(
            asset("Summer Dress", "1.0", server.payloadUrl("sync-dress.unitypackage", "size=3000"), "tops"),
            asset("Boots", "0.3", server.payloadUrl("sync-boots.zip", "size=1000"), "shoes"),
            asset("Hat", "2", server.payloadUrl("sync-hat.zip", "size=500"), "accessories"),
            asset("Sneaky", "1", "ftp://example.com/download/sneaky.zip", "tops"));
    }

    private CatalogSyncEngine engine(String catalogUrl) {
        return engine(config(catalogUrl));
    }

    private CatalogSyncEngine engine(AssetSyncConfig config) {
        return new CatalogSyncEngine(config, imported::add);
    }

    private AssetSyncConfig config(String catalogUrl) {
        return AssetSyncConfig.defaults()
            .withCatalogUrl(catalogUrl)
            .withScratchDirectory(scratch)
            .withRequestTimeout(Duration.ofSeconds(5))
            .withPollInterval(Duration.ofMillis(20));
    }

    private static SyncResult await(CompletableFuture<SyncResult> future) throws Exception {
        return future.get(20, TimeUnit.SECONDS);
    }

    @Test
    public void publishesTheFilteredCatalog() throws Exception {
        String url = JettyFileServerExtension.publish("sync/publish/catalog.json", threeAssets());

        try (CatalogSyncEngine engine = engine(url)) {
            assertThat(engine.catalog().isEmpty()).isTrue();
            assertThat(engine.allowsPrivateHosts()).isTrue();

            SyncResult result = await(engine.sync());

            assertThat(result.status()).isEqualTo(SyncStatus.OK);
            assertThat(result.totalParsed()).isEqualTo(4);
            assertThat(result.rejected()).isEqualTo(1);
            assertThat(result.published()).isEqualTo(3);
            assertThat(result.message()).isEqualTo("Loaded 3 assets");
            assertThat(engine.status()).isEqualTo("Loaded 3 assets");
            assertThat(engine.isSyncing()).isFalse();
            assertThat(engine.catalog().entries()).extracting(CatalogEntry::name)
                .containsExactly("Summer Dress", "Boots", "Hat");
            assertThat(engine.entryStatus("Boots").orElseThrow().state()).isEqualTo(DownloadState.IDLE);
            assertThat(engine.entryStatus("Sneaky")).isEmpty();
        }
    }

    @Test
    public void repeatedRefreshesPublishEqualCatalogs() throws Exception {
        String url = JettyFileServerExtension.publish("sync/repeat/catalog.json", threeAssets());

        try (CatalogSyncEngine engine = engine(url)) {
            Catalog first = await(engine.sync()).catalog();
            Catalog second = await(engine.sync()).catalog();

            assertThat(second).isEqualTo(first);
            assertThat(engine.catalog()).isEqualTo(first);
        }
    }

    @Test
    public void failedRefreshKeepsThePublishedCatalog() throws Exception {
        String url = JettyFileServerExtension.publish("sync/keep/catalog.json", threeAssets());

        try (CatalogSyncEngine engine = engine(url)) {
            assertThat(await(engine.sync()).isOk()).isTrue();

            JettyFileServerExtension.publish("sync/keep/catalog.json", "{\"assets\": oops");
            SyncResult failed = await(engine.sync());

            assertThat(failed.status()).isEqualTo(SyncStatus.FAILED);
            assertThat(failed.failure()).get().extracting(e -> e.kind()).isEqualTo(ErrorKind.MALFORMED_CATALOG);
            assertThat(failed.message()).startsWith("Failed to load catalog: ");
            assertThat(engine.status()).isEqualTo(failed.message());
            assertThat(engine.catalog().size()).isEqualTo(3);
            assertThat(engine.entryStatus("Hat")).isPresent();
        }
    }

    @Test
    public void unreachableCatalogsFailWithNetworkErrors() throws Exception {
        try (CatalogSyncEngine engine = engine(server.url("temp/sync/none/catalog.json"))) {
            SyncResult result = await(engine.sync());

            assertThat(result.status()).isEqualTo(SyncStatus.FAILED);
            assertThat(result.failure()).get().extracting(e -> e.kind()).isEqualTo(ErrorKind.NETWORK);
            assertThat(engine.catalog().isEmpty()).isTrue();
        }
    }

    @Test
    public void slowCatalogFetchesTimeOut() throws Exception {
        // each chunk arrives well inside the read timeout, the whole body does not
        String trickle = server.payloadUrl("sync-trickle-catalog.json", "size=3000&chunks=30&delayMs=100");

        try (CatalogSyncEngine engine = engine(config(trickle).withRequestTimeout(Duration.ofMillis(600)))) {
            long started = System.nanoTime();
            SyncResult result = await(engine.sync());

            assertThat(result.status()).isEqualTo(SyncStatus.FAILED);
            assertThat(result.failure()).get().extracting(e -> e.kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(2500));
            assertThat(engine.isSyncing()).isFalse();
            assertThat(engine.catalog().isEmpty()).isTrue();
        }
    }

    @Test
    public void overlappingRefreshesAreSkipped() throws Exception {
        String slow = server.payloadUrl("sync-slow.json", "size=64&chunks=2&delayMs=400");

        try (CatalogSyncEngine engine = engine(slow)) {
            CompletableFuture<SyncResult> first = engine.sync();
            SyncResult second = await(engine.sync());

            assertThat(second.status()).isEqualTo(SyncStatus.SKIPPED);
            assertThat(engine.isSyncing()).isTrue();
            SyncResult firstResult = await(first);
            assertThat(firstResult.failure()).get().extracting(e -> e.kind()).isEqualTo(ErrorKind.MALFORMED_CATALOG);
            assertThat(engine.isSyncing()).isFalse();
        }
    }

    @Test
    public void envelopesAreUnwrapped() throws Exception {
        String content = Base64.getMimeEncoder().encodeToString(threeAssets().getBytes(StandardCharsets.UTF_8))
            .replace("\r\n", "\\n");
        String url = JettyFileServerExtension.publish("sync/envelope/catalog.json",
            "{\"type\":\"file\",\"encoding\":\"base64\",\"content\":\"" + content + "\"}");

        try (CatalogSyncEngine engine = engine(config(url).withEnvelopeMode(EnvelopeMode.ENVELOPE))) {
            SyncResult result = await(engine.sync());

            assertThat(result.isOk()).isTrue();
            assertThat(result.published()).isEqualTo(3);
        }
    }

    @Test
    public void rawDocumentsAreNotEnvelopes() throws Exception {
        String url = JettyFileServerExtension.publish("sync/not-envelope/catalog.json", threeAssets());

        try (CatalogSyncEngine engine = engine(config(url).withEnvelopeMode(EnvelopeMode.ENVELOPE))) {
            SyncResult result = await(engine.sync());

            assertThat(result.failure()).get().extracting(e -> e.kind()).isEqualTo(ErrorKind.ENVELOPE);
            assertThat(engine.catalog().isEmpty()).isTrue();
        }
    }

    @Test
    public void listenersFollowTheRefresh() throws Exception {
        String url = JettyFileServerExtension.publish("sync/listen/catalog.json", threeAssets());
        List<String> events = new CopyOnWriteArrayList<>();
        AssetSyncListener listener = new AssetSyncListener() {
            @Override
            public void onCatalogReplaced(Catalog catalog) {
                events.add("catalog:" + catalog.size());
            }

            @Override
            public void onStatusChanged(String message) {
                events.add("status:" + message);
            }

            @Override
            public void onSyncStateChanged(boolean syncing) {
                events.add("syncing:" + syncing);
            }
        };

        try (CatalogSyncEngine engine = engine(url)) {
            engine.addListener(listener);
            await(engine.sync());
            engine.removeListener(listener);
            await(engine.sync());
        }

        assertThat(events).containsExactly(
            "syncing:true", "status:Loading catalog...", "catalog:3", "status:Loaded 3 assets", "syncing:false");
    }

    @Test
    public void downloadsByNameIgnoringCase() throws Exception {
        String url = JettyFileServerExtension.publish("sync/download/catalog.json", threeAssets());

        try (CatalogSyncEngine engine = engine(url)) {
            await(engine.sync());

            DownloadResult result = engine.startDownload("summer dress").get(20, TimeUnit.SECONDS);
            DownloadResult missing = engine.startDownload("Scarf").get(20, TimeUnit.SECONDS);

            assertThat(result.status()).isEqualTo(DownloadStatus.IMPORTED);
            assertThat(result.entryName()).isEqualTo("Summer Dress");
            assertThat(imported).hasSize(1);
            assertThat(missing.status()).isEqualTo(DownloadStatus.SKIPPED);
            assertThat(engine.entryStatus("Summer Dress").orElseThrow().lastOutcome())
                .isEqualTo(DownloadState.SUCCEEDED);
            assertThat(engine.probeSize("Boots").get(20, TimeUnit.SECONDS)).hasValue(1000);
        }
    }

    @Test
    public void refreshCancelsDownloadsOfChangedEntries() throws Exception {
        String slowUrl = server.payloadUrl("sync-orphan.zip", "size=1000&chunks=10&delayMs=300");
        String url = JettyFileServerExtension.publish("sync/orphan/catalog.json",
            document(asset("Cape", "1", slowUrl, "tops")));

        try (CatalogSyncEngine engine = engine(url)) {
            await(engine.sync());
            CompletableFuture<DownloadResult> download = engine.startDownload("Cape");

            JettyFileServerExtension.publish("sync/orphan/catalog.json", document(asset("Cape", "2", slowUrl, "tops")));
            await(engine.sync());

            assertThat(download.get(20, TimeUnit.SECONDS).status()).isEqualTo(DownloadStatus.CANCELLED);
            assertThat(engine.entryStatus("Cape").orElseThrow().state()).isEqualTo(DownloadState.IDLE);
            assertThat(engine.entryStatus("Cape").orElseThrow().lastOutcome()).isNull();
        }
        assertThat(imported).isEmpty();
    }

    @Test
    public void closedEnginesRefuseWork() throws Exception {
        String url = JettyFileServerExtension.publish("sync/closed/catalog.json", threeAssets());
        CatalogSyncEngine engine = engine(url);
        await(engine.sync());
        CompletableFuture<DownloadResult> running = engine.startDownload("Hat");

        engine.close();
        engine.close();

        assertThat(running.get(20, TimeUnit.SECONDS).status())
            .isIn(DownloadStatus.CANCELLED, DownloadStatus.IMPORTED);
        assertThat(await(engine.sync()).status()).isEqualTo(SyncStatus.SKIPPED);
        assertThat(engine.startDownload(engine.catalog().entries().get(0)).get(20, TimeUnit.SECONDS).status())
            .isEqualTo(DownloadStatus.CANCELLED);
        assertThat(engine.entryStatus("Hat")).isEmpty();
    }
}
