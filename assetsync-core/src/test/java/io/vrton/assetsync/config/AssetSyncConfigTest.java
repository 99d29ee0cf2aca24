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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AssetSyncConfigTest {

    @Test
    public void defaultsMatchTheDocumentedValues() {
        AssetSyncConfig d = AssetSyncConfig.defaults();
        assertThat(d.catalogUrl()).isEqualTo("http://vrton.org/data/catalog.json");
        assertThat(d.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(d.downloadTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(d.maxDownloadBytes()).isEqualTo(500L * 1024 * 1024);
        assertThat(d.allowPrivateHosts()).isFalse();
        assertThat(d.envelopeMode()).isEqualTo(EnvelopeMode.AUTO);
        assertThat(d.packageExtension()).isEqualTo("unitypackage");
    }

    @Test
    public void missingFileMeansDefaults(@TempDir Path dir) {
        assertThat(AssetSyncConfig.load(dir)).isEqualTo(AssetSyncConfig.defaults());
    }

    @Test
    public void loadsYamlOverDefaults(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(AssetSyncConfig.CONFIG_FILE), String.join("\n",
            "catalog_url: https://api.github.com/repos/v/c/contents/catalog.json",
            "scratch_dir: " + dir.resolve("scratch"),
            "request_timeout_ms: 2000",
            "download_timeout_multiplier: 2.5",
            "max_download_bytes: 1048576",
            "allow_private_hosts: true",
            "api_envelope_hosts: [api.github.com, git.example.org]",
            "package_extension: .zip",
            ""));

        AssetSyncConfig config = AssetSyncConfig.load(dir);

        assertThat(config.scratchDirectory()).isEqualTo(dir.resolve("scratch"));
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.downloadTimeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(config.maxDownloadBytes()).isEqualTo(1048576L);
        assertThat(config.allowPrivateHosts()).isTrue();
        assertThat(config.apiEnvelopeHosts()).containsExactly("api.github.com", "git.example.org");
        assertThat(config.packageExtension()).isEqualTo("zip");
        assertThat(config.pollInterval()).isEqualTo(AssetSyncConfig.defaults().pollInterval());
        assertThat(config.sourceIsApiEnvelope()).isTrue();
    }

    @Test
    public void unknownKeysAreRejected(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(AssetSyncConfig.CONFIG_FILE), "catalog_link: http://example.com/c.json\n");
        assertThatThrownBy(() -> AssetSyncConfig.load(dir))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("catalog_link");
    }

    @Test
    public void nonMapDocumentsAreRejected(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(AssetSyncConfig.CONFIG_FILE), "- one\n- two\n");
        assertThatThrownBy(() -> AssetSyncConfig.load(dir)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void invalidValuesAreRejected() {
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("request_timeout_ms", "soon")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("request_timeout_ms", 0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("download_timeout_multiplier", 0.5)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("max_download_bytes", -1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("envelope_mode", "sometimes")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetSyncConfig.fromMap(Map.of("package_extension", "../x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void envelopeModeDecidesHowBodiesAreRead() {
        AssetSyncConfig github = AssetSyncConfig.defaults()
            .withCatalogUrl("https://api.github.com/repos/v/c/contents/catalog.json");
        AssetSyncConfig plain = AssetSyncConfig.defaults();

        assertThat(github.sourceIsApiEnvelope()).isTrue();
        assertThat(plain.sourceIsApiEnvelope()).isFalse();
        assertThat(github.withEnvelopeMode(EnvelopeMode.RAW).sourceIsApiEnvelope()).isFalse();
        assertThat(plain.withEnvelopeMode(EnvelopeMode.ENVELOPE).sourceIsApiEnvelope()).isTrue();
        assertThat(AssetSyncConfig.fromMap(Map.of("envelope_mode", "raw")).envelopeMode())
            .isEqualTo(EnvelopeMode.RAW);
    }

    @Test
    public void expandsLeadingTilde() {
        String home = System.getProperty("user.home");
        assertThat(AssetSyncConfig.expandTilde("~/scratch")).isEqualTo(home + "/scratch");
        assertThat(AssetSyncConfig.expandTilde("/tmp/~x")).isEqualTo("/tmp/~x");
        assertThat(AssetSyncConfig.fromMap(Map.of("scratch_dir", "~/pkgs")).scratchDirectory())
            .isEqualTo(Path.of(home + "/pkgs"));
    }

    @Test
    public void singleEnvelopeHostMayBeAScalar() {
        assertThat(AssetSyncConfig.fromMap(Map.of("api_envelope_hosts", "git.example.org")).apiEnvelopeHosts())
            .isEqualTo(List.of("git.example.org"));
    }
}
