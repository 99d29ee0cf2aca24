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

import io.vrton.assetsync.catalog.CatalogEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PackageFileNamesTest {

    @TempDir
    Path scratch;

    private static CatalogEntry entry(String name, String version, String url) {
        return new CatalogEntry(name, "", version, url, null, null, 0);
    }

    @Test
    public void namesCombineEntryNameAndVersion() {
        Path p = PackageFileNames.destinationFor(scratch,
            entry("Summer Dress", "1.0", "https://example.com/download/dress.unitypackage"), "unitypackage");
        assertThat(p.getFileName().toString()).isEqualTo("SummerDress_1.0.unitypackage");
        assertThat(p.getParent()).isEqualTo(scratch.toAbsolutePath().normalize());
    }

    @Test
    public void furtherCopiesAreNumberedBeforeTheExtension() {
        CatalogEntry spaced = entry("My Pack", "1", "https://example.com/download/p.tar.gz");
        CatalogEntry joined = entry("MyPack", "1", "https://example.com/download/q.tar.gz");

        assertThat(PackageFileNames.destinationFor(scratch, spaced, "zip"))
            .isEqualTo(PackageFileNames.destinationFor(scratch, joined, "zip"));
        assertThat(PackageFileNames.destinationFor(scratch, spaced, "zip", 1).getFileName().toString())
            .isEqualTo("MyPack_1.tar.gz");
        assertThat(PackageFileNames.destinationFor(scratch, joined, "zip", 3).getFileName().toString())
            .isEqualTo("MyPack_1-3.tar.gz");
        assertThatThrownBy(() -> PackageFileNames.destinationFor(scratch, joined, "zip", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void traversalAttemptsStayInsideTheScratchDirectory() {
        for (String name : new String[]{"../../evil", "..\\..\\evil", "/etc/passwd", "a/../../b", "...."}) {
            Path p = PackageFileNames.destinationFor(scratch,
                entry(name, "../1", "https://example.com/download/x.zip"), "unitypackage");
            assertThat(p.getParent()).as(name).isEqualTo(scratch.toAbsolutePath().normalize());
            assertThat(p.getFileName().toString()).as(name).doesNotContain("..").doesNotStartWith(".");
        }
    }

    @Test
    public void sanitizeFallsBackWhenNothingIsLeft() {
        assertThat(PackageFileNames.sanitize("", "package")).isEqualTo("package");
        assertThat(PackageFileNames.sanitize("***", "package")).isEqualTo("package");
        assertThat(PackageFileNames.sanitize(null, "0")).isEqualTo("0");
        assertThat(PackageFileNames.sanitize("../../evil", "package")).isEqualTo("evil");
    }

    @Test
    public void reservedDeviceNamesArePrefixed() {
        assertThat(PackageFileNames.sanitize("CON", "package")).isEqualTo("_CON");
        assertThat(PackageFileNames.sanitize("lpt1", "package")).isEqualTo("_lpt1");
    }

    @Test
    public void longNamesAreCapped() {
        assertThat(PackageFileNames.sanitize("x".repeat(500), "package")).hasSize(96);
    }

    @Test
    public void extensionComesFromTheUrlPath() {
        assertThat(PackageFileNames.extensionFor("https://example.com/download/a.TAR.GZ", "unitypackage"))
            .isEqualTo("tar.gz");
        assertThat(PackageFileNames.extensionFor("https://example.com/download/a.zip?x=1", "unitypackage"))
            .isEqualTo("zip");
        assertThat(PackageFileNames.extensionFor("https://example.com/download/a.unitypackage", "zip"))
            .isEqualTo("unitypackage");
        assertThat(PackageFileNames.extensionFor("https://example.com/download/latest", "unitypackage"))
            .isEqualTo("unitypackage");
        assertThat(PackageFileNames.extensionFor("not a url", "zip")).isEqualTo("zip");
    }
}
