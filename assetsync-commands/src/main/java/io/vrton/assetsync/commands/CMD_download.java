package io.vrton.assetsync.commands;

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
import io.vrton.assetsync.config.AssetSyncConfig;
import io.vrton.assetsync.downloader.DownloadResult;
import io.vrton.assetsync.state.EntryStatus;
import io.vrton.assetsync.sync.CatalogSyncEngine;
import io.vrton.assetsync.sync.SyncResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/// Download packages from an asset catalog
@CommandLine.Command(name = "download",
    header = "Download packages from an asset catalog",
    description = "Fetches the catalog, downloads the named entries and copies each verified package into a directory",
    exitCodeList = {"0: success", "1: error"})
public class CMD_download implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_download.class);

    @CommandLine.Parameters(description = "Names of the catalog entries to download", arity = "1..*")
    private List<String> names = new ArrayList<>();

    @CommandLine.Mixin
    private EngineOptions engineOptions = new EngineOptions();

    @CommandLine.Option(names = {"--into", "-o"},
        description = "Directory to copy downloaded packages into",
        defaultValue = "./imported")
    private Path into;

    @CommandLine.Option(names = {"--progress-interval"},
        description = "Milliseconds between progress reports",
        defaultValue = "500")
    private long progressInterval;

    @Override
    public Integer call() {
        AssetSyncConfig config;
        try {
            config = engineOptions.resolve();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        DirectoryPackageImporter importer = new DirectoryPackageImporter(into);
        try (CatalogSyncEngine engine = new CatalogSyncEngine(config, importer)) {
            SyncResult synced = engine.sync().join();
            if (!synced.isOk()) {
                System.err.println(synced.message());
                return 1;
            }

            boolean ok = true;
            Map<String, CompletableFuture<DownloadResult>> downloads = new LinkedHashMap<>();
            for (String name : names) {
                Optional<CatalogEntry> entry = engine.findEntry(name);
                if (entry.isEmpty()) {
                    System.err.println("No asset named '" + name + "' in " + config.catalogUrl());
                    ok = false;
                    continue;
                }
                downloads.put(entry.get().name(), engine.startDownload(entry.get()));
            }

            if (!awaitWithProgress(engine, downloads)) {
                engine.cancelAllDownloads();
                return 1;
            }

            for (CompletableFuture<DownloadResult> download : downloads.values()) {
                DownloadResult result = download.join();
                System.out.println(result.describe());
                ok &= result.isSuccess();
            }
            if (!importer.imported().isEmpty()) {
                System.out.println("Imported " + importer.imported().size() + " package(s) into "
                    + importer.targetDirectory());
            }
            return ok ? 0 : 1;
        }
    }

    private boolean awaitWithProgress(CatalogSyncEngine engine, Map<String, CompletableFuture<DownloadResult>> downloads) {
        Map<String, Integer> reported = new HashMap<>();
        CompletableFuture<Void> all = CompletableFuture.allOf(downloads.values().toArray(CompletableFuture[]::new));
        while (!all.isDone()) {
            for (String name : downloads.keySet()) {
                EntryStatus status = engine.entryStatus(name).orElse(null);
                if (status == null || !status.isDownloading()) {
                    continue;
                }
                int percent = (int) Math.floor(status.progress() * 100);
                Integer previous = reported.put(name, percent);
                if (previous == null || previous != percent) {
                    System.out.println(name + ": " + percent + "%");
                }
            }
            try {
                Thread.sleep(Math.max(10, progressInterval));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("interrupted while waiting for downloads");
                return false;
            }
        }
        return true;
    }
}
