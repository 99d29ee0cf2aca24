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

import io.vrton.assetsync.catalog.Catalog;
import io.vrton.assetsync.catalog.CatalogEntry;
import io.vrton.assetsync.catalog.CatalogParser;
import io.vrton.assetsync.config.AssetSyncConfig;
import io.vrton.assetsync.state.EntryStatus;
import io.vrton.assetsync.sync.CatalogSyncEngine;
import io.vrton.assetsync.sync.SyncResult;
import io.vrton.assetsync.utils.ByteSizes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/// List the entries of an asset catalog
@CommandLine.Command(name = "catalog",
    header = "List the entries of an asset catalog",
    description = "Fetches the catalog once and prints each permitted entry with its version, category and size",
    exitCodeList = {"0: success", "1: error"})
public class CMD_catalog implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_catalog.class);

    @CommandLine.Mixin
    private EngineOptions engineOptions = new EngineOptions();

    @CommandLine.Option(names = {"--sizes"},
        description = "Probe the size of entries the catalog does not give one for")
    private boolean sizes = false;

    @CommandLine.Option(names = {"--by-category"},
        description = "Group entries by category")
    private boolean byCategory = false;

    @CommandLine.Option(names = {"--json"},
        description = "Print the filtered catalog as a catalog document instead of a table")
    private boolean json = false;

    @Override
    public Integer call() {
        AssetSyncConfig config;
        try {
            config = engineOptions.resolve();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try (CatalogSyncEngine engine = new CatalogSyncEngine(config,
            file -> logger.debug("listing does not import packages, ignoring {}", file))) {
            SyncResult result = engine.sync().join();
            if (!result.isOk()) {
                System.err.println(result.message());
                return 1;
            }
            Catalog catalog = engine.catalog();
            if (sizes) {
                CompletableFuture.allOf(catalog.entries().stream()
                    .filter(e -> !e.hasKnownSize())
                    .map(engine::probeSize)
                    .toArray(CompletableFuture[]::new)).join();
            }

            if (json) {
                System.out.println(CatalogParser.render(catalog));
                return 0;
            }
            if (byCategory) {
                for (Map.Entry<String, List<CatalogEntry>> group : catalog.byCategory().entrySet()) {
                    System.out.println("[" + (group.getKey().isEmpty() ? "uncategorized" : group.getKey()) + "]");
                    group.getValue().forEach(entry -> System.out.println("  " + describe(engine, entry)));
                }
            } else {
                catalog.entries().forEach(entry -> System.out.println(describe(engine, entry)));
            }

            System.out.println(result.message() + (result.rejected() + result.duplicates() > 0
                ? " (" + result.rejected() + " rejected, " + result.duplicates() + " duplicates)" : ""));
            return 0;
        }
    }

    private static String describe(CatalogSyncEngine engine, CatalogEntry entry) {
        long size = engine.entryStatus(entry.name()).map(EntryStatus::fileSize).orElse(entry.fileSize());
        return String.format("%-32s %-10s %-16s %s",
            entry.name(),
            entry.version().isEmpty() ? "-" : entry.version(),
            entry.category().isEmpty() ? "-" : entry.category(),
            size > 0 ? ByteSizes.format(size) : "unknown");
    }
}
