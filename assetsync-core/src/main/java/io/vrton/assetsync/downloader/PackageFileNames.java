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

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/// Derives scratch file names for downloaded packages.
///
/// Names have the form `<name>_<version>.<extension>`. Every character outside `[A-Za-z0-9._-]`
/// is stripped, runs of dots collapse to one, and leading or trailing dots are removed, so the
/// result is always a direct child of the scratch directory.
///
/// Distinct entries can reduce to the same name. Callers running downloads side by side ask for
/// a further copy of a name that is taken.
public final class PackageFileNames {

    private static final int MAX_PART_LENGTH = 96;
    private static final Set<String> RESERVED = Set.of(
        "con", "prn", "aux", "nul",
        "com1", "com2", "com3", "com4", "com5", "com6", "com7", "com8", "com9",
        "lpt1", "lpt2", "lpt3", "lpt4", "lpt5", "lpt6", "lpt7", "lpt8", "lpt9"
    );

    private PackageFileNames() {
    }

    /// @param scratchDirectory
    ///     the directory downloads are written to
    /// @param entry
    ///     the entry being downloaded
    /// @param defaultExtension
    ///     the extension used when the download URL does not end with a known one
    /// @return an absolute path directly inside the scratch directory
    /// @throws IllegalStateException
    ///     if the derived path would escape the scratch directory
    public static Path destinationFor(Path scratchDirectory, CatalogEntry entry, String defaultExtension) {
        return destinationFor(scratchDirectory, entry, defaultExtension, 1);
    }

    /// Like {@link #destinationFor(Path, CatalogEntry, String)}, for the given copy of a name that
    /// is already taken. Copy 1 is the plain name; copy `n` adds `-n` before the extension.
    /// @param scratchDirectory
    ///     the directory downloads are written to
    /// @param entry
    ///     the entry being downloaded
    /// @param defaultExtension
    ///     the extension used when the download URL does not end with a known one
    /// @param copy
    ///     which copy of the name to derive, starting at 1
    /// @return an absolute path directly inside the scratch directory
    public static Path destinationFor(Path scratchDirectory, CatalogEntry entry, String defaultExtension, int copy) {
        if (copy < 1) {
            throw new IllegalArgumentException("copy must be at least 1: " + copy);
        }
        Path dir = scratchDirectory.toAbsolutePath().normalize();
        String fileName = sanitize(entry.name(), "package") + "_" + sanitize(entry.version(), "0")
            + (copy > 1 ? "-" + copy : "") + "." + extensionFor(entry.downloadUrl(), defaultExtension);
        Path destination = dir.resolve(fileName).normalize();
        if (!dir.equals(destination.getParent())) {
            throw new IllegalStateException("Derived path escapes the scratch directory: " + destination);
        }
        return destination;
    }

    /// @param text
    ///     any text
    /// @param fallback
    ///     returned when nothing usable is left
    /// @return the text reduced to a safe single path segment
    public static String sanitize(String text, String fallback) {
        if (text == null) {
            return fallback;
        }
        String cleaned = text.replaceAll("[^A-Za-z0-9._-]", "")
            .replaceAll("\\.{2,}", ".")
            .replaceAll("^[.\\-]+", "")
            .replaceAll("\\.+$", "");
        if (cleaned.length() > MAX_PART_LENGTH) {
            cleaned = cleaned.substring(0, MAX_PART_LENGTH);
        }
        if (cleaned.isEmpty()) {
            return fallback;
        }
        if (RESERVED.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return "_" + cleaned;
        }
        return cleaned;
    }

    /// @param downloadUrl
    ///     the package URL
    /// @param defaultExtension
    ///     the fallback extension, without a leading dot
    /// @return `tar.gz`, `zip` or `unitypackage` when the URL path ends that way, else the fallback
    public static String extensionFor(String downloadUrl, String defaultExtension) {
        String path;
        try {
            path = URI.create(downloadUrl).getPath();
        } catch (IllegalArgumentException e) {
            path = null;
        }
        if (path != null) {
            String lower = path.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".tar.gz")) {
                return "tar.gz";
            }
            if (lower.endsWith(".zip")) {
                return "zip";
            }
            if (lower.endsWith(".unitypackage")) {
                return "unitypackage";
            }
        }
        return defaultExtension;
    }
}
