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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Maps entry names to their runtime state for the currently published catalog.
///
/// Only the engine replaces the mapping, and it does so in the same step that publishes a new
/// catalog. The mapping is immutable and swapped whole, so readers see either the old or the
/// new catalog's states, never a partly built one. Everything else reads snapshots or writes
/// through a state instance it checked with {@link #owns(EntryRuntimeState)}.
public class EntryStateRegistry {

    private final StatusBoard board;
    private volatile Map<String, EntryRuntimeState> states = Map.of();

    public EntryStateRegistry(StatusBoard board) {
        this.board = board;
    }

    /// Rebuilds the mapping for a new catalog.
    ///
    /// Entries that are still present get fresh state, except an entry whose download is in
    /// flight for an unchanged entry record, which keeps its state so the running download stays
    /// visible. Entries no longer present lose their state.
    /// @param catalog
    ///     the catalog being published
    /// @return the names whose state was dropped or replaced while a download was in flight
    public synchronized Set<String> replaceAll(Catalog catalog) {
        Map<String, EntryRuntimeState> previous = states;
        Set<String> orphaned = new HashSet<>();
        Map<String, EntryRuntimeState> next = new HashMap<>();
        for (CatalogEntry entry : catalog.entries()) {
            EntryRuntimeState current = previous.get(entry.name());
            if (current != null && current.isRequesting() && current.entry().equals(entry)) {
                next.put(entry.name(), current);
            } else {
                next.put(entry.name(), new EntryRuntimeState(entry, board));
            }
        }
        for (EntryRuntimeState old : previous.values()) {
            if (old.isRequesting() && next.get(old.name()) != old) {
                orphaned.add(old.name());
            }
        }
        states = Map.copyOf(next);
        return orphaned;
    }

    /// Drops all state.
    public synchronized void clear() {
        states = Map.of();
    }

    /// @param name
    ///     the entry key
    /// @return the current state for the entry, if it is in the published catalog
    public Optional<EntryRuntimeState> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(states.get(name));
    }

    /// @param state
    ///     a state instance obtained earlier
    /// @return true if the instance is still the current one for its entry
    public boolean owns(EntryRuntimeState state) {
        return states.get(state.name()) == state;
    }

    /// @param url
    ///     a download URL
    /// @return current states of every entry with that download URL
    public List<EntryRuntimeState> withDownloadUrl(String url) {
        List<EntryRuntimeState> found = new ArrayList<>();
        for (EntryRuntimeState state : states.values()) {
            if (state.entry().downloadUrl().equals(url)) {
                found.add(state);
            }
        }
        return found;
    }

    /// @param url
    ///     an image URL
    /// @return current states of every entry with that image URL
    public List<EntryRuntimeState> withImageUrl(String url) {
        List<EntryRuntimeState> found = new ArrayList<>();
        for (EntryRuntimeState state : states.values()) {
            if (state.entry().imageUrl().equals(url)) {
                found.add(state);
            }
        }
        return found;
    }

    /// @param name
    ///     the entry key
    /// @return a snapshot of the entry's state, if it is in the published catalog
    public Optional<EntryStatus> status(String name) {
        return get(name).map(EntryRuntimeState::snapshot);
    }

    /// @return the number of tracked entries
    public int size() {
        return states.size();
    }
}
