package io.vrton.assetsync.config;

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

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Configuration for a catalog sync engine.
///
/// All values are externally supplied; {@link #defaults()} gives the values used when a key is
/// absent. Instances are immutable, use the `with*` methods to derive variants.
///
/// @param catalogUrl
///     the URL the catalog document is fetched from
/// @param scratchDirectory
///     the directory downloaded packages are written to before import
/// @param requestTimeout
///     the bound for catalog fetches and metadata probes
/// @param downloadTimeoutMultiplier
///     downloads are bounded by requestTimeout times this factor
/// @param maxDownloadBytes
///     the largest package accepted, checked before and after transfer
/// @param allowPrivateHosts
///     whether download URLs may point at loopback or private network hosts
/// @param envelopeMode
///     how the catalog response body is interpreted
/// @param apiEnvelopeHosts
///     hosts whose responses are envelopes when envelopeMode is AUTO
/// @param packageExtension
///     the file extension used when the download URL does not end with a known one
/// @param pollInterval
///     how often in-flight downloads are polled for progress and deadline
public record AssetSyncConfig(
    String catalogUrl,
    Path scratchDirectory,
    Duration requestTimeout,
    double downloadTimeoutMultiplier,
    long maxDownloadBytes,
    boolean allowPrivateHosts,
    EnvelopeMode envelopeMode,
    List<String> apiEnvelopeHosts,
    String packageExtension,
    Duration pollInterval
) {

    /// The name of the configuration file looked up in a configuration directory
    public static final String CONFIG_FILE = "assetsync.yaml";
    /// The default configuration directory
    public static final String DEFAULT_CONFIG_DIR = "~/.config/assetsync";

    private static final Set<String> KNOWN_KEYS = Set.of(
        "catalog_url", "scratch_dir", "request_timeout_ms", "download_timeout_multiplier",
        "max_download_bytes", "allow_private_hosts", "envelope_mode", "api_envelope_hosts",
        "package_extension", "poll_interval_ms"
    );

    public AssetSyncConfig {
        Objects.requireNonNull(catalogUrl, "catalogUrl");
        Objects.requireNonNull(scratchDirectory, "scratchDirectory");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(envelopeMode, "envelopeMode");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (!(downloadTimeoutMultiplier >= 1.0d)) {
            throw new IllegalArgumentException(
                "downloadTimeoutMultiplier must be at least 1.0: " + downloadTimeoutMultiplier);
        }
        if (maxDownloadBytes <= 0) {
            throw new IllegalArgumentException("maxDownloadBytes must be positive: " + maxDownloadBytes);
        }
        apiEnvelopeHosts = apiEnvelopeHosts == null ? List.of() : List.copyOf(apiEnvelopeHosts);
        packageExtension = normalizeExtension(packageExtension);
    }

    /// @return a configuration with every default value
    public static AssetSyncConfig defaults() {
        return new AssetSyncConfig(
            "http://vrton.org/data/catalog.json",
            Path.of(System.getProperty("java.io.tmpdir"), "assetsync"),
            Duration.ofSeconds(30),
            10.0d,
            500L * 1024 * 1024,
            false,
            EnvelopeMode.AUTO,
            List.of("api.github.com"),
            "unitypackage",
            Duration.ofMillis(100)
        );
    }

    /// Loads `assetsync.yaml` from a configuration directory, falling back to defaults for
    /// absent keys, or entirely when the file does not exist.
    /// @param configDir
    ///     the configuration directory, a leading `~` is expanded
    /// @return the loaded configuration
    /// @throws IllegalArgumentException
    ///     if the file is not a map or contains unknown keys or invalid values
    public static AssetSyncConfig load(Path configDir) {
        Path dir = Path.of(expandTilde(configDir.toString()));
        Path file = dir.resolve(CONFIG_FILE);
        if (!Files.exists(file)) {
            return defaults();
        }
        LoadSettings loadSettings = LoadSettings.builder().setLabel(file.toString()).build();
        Load yaml = new Load(loadSettings);
        Object loaded;
        try {
            loaded = yaml.loadFromString(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read configuration file: " + file, e);
        }
        if (loaded == null) {
            return defaults();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(CONFIG_FILE + " must contain a map of settings: " + file);
        }
        return fromMap(map);
    }

    /// Builds a configuration from a map of the keys used in `assetsync.yaml`.
    /// @param values
    ///     the settings, absent keys keep their default
    /// @return the configuration
    public static AssetSyncConfig fromMap(Map<?, ?> values) {
        for (Object key : values.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                throw new IllegalArgumentException("Unknown configuration key '" + key + "', expected one of "
                    + KNOWN_KEYS);
            }
        }
        AssetSyncConfig d = defaults();
        return new AssetSyncConfig(
            stringValue(values, "catalog_url", d.catalogUrl()),
            values.containsKey("scratch_dir")
                ? Path.of(expandTilde(String.valueOf(values.get("scratch_dir")))) : d.scratchDirectory(),
            values.containsKey("request_timeout_ms")
                ? Duration.ofMillis(longValue(values, "request_timeout_ms")) : d.requestTimeout(),
            values.containsKey("download_timeout_multiplier")
                ? doubleValue(values, "download_timeout_multiplier") : d.downloadTimeoutMultiplier(),
            values.containsKey("max_download_bytes")
                ? longValue(values, "max_download_bytes") : d.maxDownloadBytes(),
            values.containsKey("allow_private_hosts")
                ? Boolean.parseBoolean(String.valueOf(values.get("allow_private_hosts"))) : d.allowPrivateHosts(),
            values.containsKey("envelope_mode")
                ? EnvelopeMode.valueOf(String.valueOf(values.get("envelope_mode")).toUpperCase(Locale.ROOT))
                : d.envelopeMode(),
            values.containsKey("api_envelope_hosts") ? listValue(values, "api_envelope_hosts") : d.apiEnvelopeHosts(),
            stringValue(values, "package_extension", d.packageExtension()),
            values.containsKey("poll_interval_ms")
                ? Duration.ofMillis(longValue(values, "poll_interval_ms")) : d.pollInterval()
        );
    }

    /// @return the bound applied to a whole package download
    public Duration downloadTimeout() {
        return Duration.ofMillis((long) Math.ceil(requestTimeout.toMillis() * downloadTimeoutMultiplier));
    }

    /// Decides whether the catalog response is a hosting API envelope.
    /// @return true if the body must be unwrapped before parsing
    public boolean sourceIsApiEnvelope() {
        switch (envelopeMode) {
            case RAW:
                return false;
            case ENVELOPE:
                return true;
            default:
                String host = hostOf(catalogUrl);
                return host != null && apiEnvelopeHosts.stream().anyMatch(h -> h.equalsIgnoreCase(host));
        }
    }

    public AssetSyncConfig withCatalogUrl(String url) {
        return new AssetSyncConfig(url, scratchDirectory, requestTimeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withScratchDirectory(Path dir) {
        return new AssetSyncConfig(catalogUrl, dir, requestTimeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withRequestTimeout(Duration timeout) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, timeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withDownloadTimeoutMultiplier(double multiplier) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, requestTimeout, multiplier,
            maxDownloadBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withMaxDownloadBytes(long maxBytes) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, requestTimeout, downloadTimeoutMultiplier,
            maxBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withAllowPrivateHosts(boolean allow) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, requestTimeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allow, envelopeMode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withEnvelopeMode(EnvelopeMode mode) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, requestTimeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allowPrivateHosts, mode, apiEnvelopeHosts, packageExtension, pollInterval);
    }

    public AssetSyncConfig withPollInterval(Duration interval) {
        return new AssetSyncConfig(catalogUrl, scratchDirectory, requestTimeout, downloadTimeoutMultiplier,
            maxDownloadBytes, allowPrivateHosts, envelopeMode, apiEnvelopeHosts, packageExtension, interval);
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "unitypackage";
        }
        String trimmed = extension.trim();
        while (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty() || !trimmed.matches("[A-Za-z0-9.]+")) {
            throw new IllegalArgumentException("Invalid package extension: " + extension);
        }
        return trimmed;
    }

    private static String stringValue(Map<?, ?> values, String key, String fallback) {
        Object v = values.get(key);
        return v == null ? fallback : v.toString();
    }

    private static long longValue(Map<?, ?> values, String key) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' must be an integer: " + v, e);
        }
    }

    private static double doubleValue(Map<?, ?> values, String key) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' must be a number: " + v, e);
        }
    }

    private static List<String> listValue(Map<?, ?> values, String key) {
        Object v = values.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            list.forEach(item -> out.add(String.valueOf(item)));
        } else if (v != null) {
            out.add(String.valueOf(v));
        }
        return out;
    }

    /// Expands a leading `~` to the user's home directory.
    /// @param path the path text
    /// @return the expanded path text
    public static String expandTilde(String path) {
        if (path.startsWith("~")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
