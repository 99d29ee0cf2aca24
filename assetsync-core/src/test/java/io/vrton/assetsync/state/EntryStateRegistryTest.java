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
import io.vrton.assetsync.catalog.CatalogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EntryStateRegistryTest {

    private StatusBoard board;
    private EntryStateRegistry registry;
    private final List<EntryStatus> changes = new ArrayList<>();

    private static CatalogEntry entry(String name, String version, long size) {
        return new CatalogEntry(name, "", version, "https://example.com/download/" + name + ".zip",
            "https://example.com/img/" + name + ".png", "", size);
    }

    @BeforeEach
    public void setUp() {
        board = new StatusBoard();
        board.addListener(new AssetSyncListener() {
            @Override
            public void onEntryChanged(EntryStatus status) {
                changes.add(status);
            }
        });
        registry = new EntryStateRegistry(board);
    }

    @Test
    public void freshStateIsIdle() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));

        EntryStatus status = registry.status("A").orElseThrow();
        assertThat(status.state()).isEqualTo(DownloadState.IDLE);
        assertThat(status.progress()).isZero();
        assertThat(status.previewAvailable()).isFalse();
        assertThat(status.lastOutcome()).isNull();
        assertThat(registry.status("B")).isEmpty();
    }

    @Test
    public void republishingNeverHidesStatesFromConcurrentReaders() throws Exception {
        Catalog catalog = new Catalog(List.of(entry("A", "1", 0), entry("B", "1", 0)));
        registry.replaceAll(catalog);
        EntryRuntimeState requesting = registry.get("A").orElseThrow();
        assertThat(requesting.beginRequest()).isTrue();

        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger unowned = new AtomicInteger();
        AtomicInteger missing = new AtomicInteger();
        AtomicInteger reads = new AtomicInteger();
        Thread reader = new Thread(() -> {
            while (running.get()) {
                if (!registry.owns(requesting)) {
                    unowned.incrementAndGet();
                }
                if (registry.get("B").isEmpty()) {
                    missing.incrementAndGet();
                }
                reads.incrementAndGet();
            }
        }, "registry-reader");
        reader.start();
        try {
            for (int i = 0; i < 20_000; i++) {
                registry.replaceAll(catalog);
            }
        } finally {
            running.set(false);
            reader.join(10_000);
        }

        assertThat(reads.get()).isPositive();
        assertThat(unowned.get()).isZero();
        assertThat(missing.get()).isZero();
        assertThat(registry.get("A")).containsSame(requesting);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    public void onlyOneRequestAtATime() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));
        EntryRuntimeState state = registry.get("A").orElseThrow();

        assertThat(state.beginRequest()).isTrue();
        assertThat(state.beginRequest()).isFalse();
        assertThat(state.isRequesting()).isTrue();
    }

    @Test
    public void progressIsClampedAndNeverMovesBackwards() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));
        EntryRuntimeState state = registry.get("A").orElseThrow();

        state.publishProgress(0.5);
        assertThat(state.snapshot().progress()).as("ignored while idle").isZero();

        state.beginRequest();
        state.publishProgress(0.4);
        state.publishProgress(0.2);
        assertThat(state.snapshot().progress()).isEqualTo(0.4);
        state.publishProgress(7.0);
        assertThat(state.snapshot().progress()).isEqualTo(1.0);
        state.publishProgress(-1.0);
        assertThat(state.snapshot().progress()).isEqualTo(1.0);
    }

    @Test
    public void finishShowsTheOutcomeThenReturnsToIdle() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));
        EntryRuntimeState state = registry.get("A").orElseThrow();
        state.beginRequest();
        changes.clear();

        state.finish(DownloadState.FAILED, "Failed to download A: boom");

        assertThat(changes).extracting(EntryStatus::state).containsExactly(DownloadState.FAILED, DownloadState.IDLE);
        EntryStatus status = state.snapshot();
        assertThat(status.state()).isEqualTo(DownloadState.IDLE);
        assertThat(status.lastOutcome()).isEqualTo(DownloadState.FAILED);
        assertThat(status.lastMessage()).isEqualTo("Failed to download A: boom");
        assertThat(state.beginRequest()).as("a new attempt may start").isTrue();
        assertThatThrownBy(() -> state.finish(DownloadState.REQUESTING, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void successCompletesProgress() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));
        EntryRuntimeState state = registry.get("A").orElseThrow();
        state.beginRequest();
        state.finish(DownloadState.SUCCEEDED, "done");
        assertThat(state.snapshot().progress()).isEqualTo(1.0);
    }

    @Test
    public void publishedSizeWinsOverProbedSize() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 100), entry("B", "1", 0))));

        registry.get("A").orElseThrow().publishSize(999);
        registry.get("B").orElseThrow().publishSize(999);
        registry.get("B").orElseThrow().publishSize(5);

        assertThat(registry.status("A").orElseThrow().fileSize()).isEqualTo(100);
        assertThat(registry.status("B").orElseThrow().fileSize()).isEqualTo(999);
    }

    @Test
    public void replacingKeepsOnlyInFlightUnchangedEntries() {
        CatalogEntry a = entry("A", "1", 0);
        CatalogEntry b = entry("B", "1", 0);
        CatalogEntry c = entry("C", "1", 0);
        registry.replaceAll(new Catalog(List.of(a, b, c)));
        EntryRuntimeState stateA = registry.get("A").orElseThrow();
        EntryRuntimeState stateB = registry.get("B").orElseThrow();
        EntryRuntimeState stateC = registry.get("C").orElseThrow();
        stateA.beginRequest();
        stateB.beginRequest();
        stateC.beginRequest();

        Set<String> orphaned = registry.replaceAll(new Catalog(List.of(a, entry("B", "2", 0), entry("D", "1", 0))));

        assertThat(orphaned).containsExactlyInAnyOrder("B", "C");
        assertThat(registry.owns(stateA)).isTrue();
        assertThat(registry.owns(stateB)).isFalse();
        assertThat(registry.owns(stateC)).isFalse();
        assertThat(registry.status("B").orElseThrow().state()).isEqualTo(DownloadState.IDLE);
        assertThat(registry.get("C")).isEmpty();
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    public void idleEntriesGetFreshState() {
        CatalogEntry a = entry("A", "1", 0);
        registry.replaceAll(new Catalog(List.of(a)));
        EntryRuntimeState first = registry.get("A").orElseThrow();
        first.publishSize(10);

        assertThat(registry.replaceAll(new Catalog(List.of(a)))).isEmpty();
        assertThat(registry.owns(first)).isFalse();
        assertThat(registry.status("A").orElseThrow().fileSize()).isZero();
    }

    @Test
    public void findsStatesByUrl() {
        CatalogEntry a = entry("A", "1", 0);
        CatalogEntry alias = new CatalogEntry("Alias", "", "1", a.downloadUrl(), a.imageUrl(), "", 0);
        registry.replaceAll(new Catalog(List.of(a, alias, entry("B", "1", 0))));

        assertThat(registry.withDownloadUrl(a.downloadUrl())).extracting(EntryRuntimeState::name)
            .containsExactlyInAnyOrder("A", "Alias");
        assertThat(registry.withImageUrl(a.imageUrl())).hasSize(2);
        assertThat(registry.withImageUrl("https://example.com/none.png")).isEmpty();
    }

    @Test
    public void failingListenersDoNotAffectOthers() {
        List<String> messages = new ArrayList<>();
        board.addListener(new AssetSyncListener() {
            @Override
            public void onStatusChanged(String message) {
                throw new IllegalStateException("listener bug");
            }
        });
        board.addListener(new AssetSyncListener() {
            @Override
            public void onStatusChanged(String message) {
                messages.add(message);
            }
        });

        board.post("Loading catalog...");

        assertThat(messages).containsExactly("Loading catalog...");
        assertThat(board.message()).isEqualTo("Loading catalog...");
    }

    @Test
    public void previewsAreRecognisedByTheirLeadingBytes() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0};
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0};
        byte[] gif = "GIF89a".getBytes();

        assertThat(ImageFormat.sniff(png)).contains(ImageFormat.PNG);
        assertThat(ImageFormat.sniff(jpeg)).contains(ImageFormat.JPEG);
        assertThat(ImageFormat.sniff(gif)).contains(ImageFormat.GIF);
        assertThat(ImageFormat.sniff("<html>".getBytes())).isEmpty();
        assertThat(ImageFormat.sniff(new byte[]{(byte) 0x89})).isEmpty();
        assertThat(ImageFormat.sniff(null)).isEmpty();
    }

    @Test
    public void previewsArePublished() {
        registry.replaceAll(new Catalog(List.of(entry("A", "1", 0))));
        PreviewImage image = new PreviewImage("https://example.com/img/A.png", ImageFormat.GIF, "GIF89a".getBytes());

        registry.get("A").orElseThrow().publishPreview(image);

        assertThat(registry.status("A").orElseThrow().previewImage()).contains(image);
    }
}
