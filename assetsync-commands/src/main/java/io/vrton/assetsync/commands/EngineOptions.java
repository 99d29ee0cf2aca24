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

import io.vrton.assetsync.config.AssetSyncConfig;
import picocli.CommandLine;

import java.nio.file.Path;

/// Options shared by commands that run a sync engine.
public class EngineOptions {

    @CommandLine.Option(names = {"--catalog"},
        description = "The catalog URL, overriding the configured one")
    private String catalogUrl;

    @CommandLine.Option(names = {"--configdir"},
        description = "The directory to read assetsync.yaml from",
        defaultValue = AssetSyncConfig.DEFAULT_CONFIG_DIR)
    private Path configdir = Path.of(AssetSyncConfig.DEFAULT_CONFIG_DIR);

    @CommandLine.Option(names = {"--allow-private-hosts"},
        description = "Accept catalog entries on private and loopback hosts")
    private boolean allowPrivateHosts;

    /// Loads the configuration and applies the command line overrides.
    /// @return the effective configuration
    /// @throws IllegalArgumentException if the configuration file is invalid
    public AssetSyncConfig resolve() {
        AssetSyncConfig config = AssetSyncConfig.load(configdir);
        if (catalogUrl != null && !catalogUrl.isBlank()) {
            config = config.withCatalogUrl(catalogUrl.trim());
        }
        if (allowPrivateHosts) {
            config = config.withAllowPrivateHosts(true);
        }
        return config;
    }
}
