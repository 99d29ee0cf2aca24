package io.vrton.assetsync.catalog;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// An ordered, immutable list of catalog entries. Order is display order.
/// @param entries
///     the entries in the order they were published
public record Catalog(List<CatalogEntry> entries) {

    private static final Catalog EMPTY = new Catalog(List.of());

    public Catalog {
        entries = List.copyOf(entries);
    }

    /// @return the catalog a new engine starts with
    public static Catalog empty() {
        return EMPTY;
    }

    /// @return the number of entries
    public int size() {
        return entries.size();
    }

    /// @return true if there are no entries
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Finds an entry by its name, case insensitive.
    /// @param name
    ///     the entry name
    /// @return the entry, or empty if not present
    public Optional<CatalogEntry> findExact(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (CatalogEntry entry : entries) {
            if (entry.name().equalsIgnoreCase(name)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /// Tells whether this catalog still holds exactly the given entry.
    /// @param entry
    ///     an entry previously read from some catalog
    /// @return true if an equal entry is present
    public boolean contains(CatalogEntry entry) {
        return entries.contains(entry);
    }

    /// Groups entries by category, keeping both category and entry order.
    /// @return entries keyed by category
    public Map<String, List<CatalogEntry>> byCategory() {
        Map<String, List<CatalogEntry>> grouped = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            String key = entry.category().isBlank() ? "" : entry.category().trim().toLowerCase(Locale.ROOT);
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }
}
