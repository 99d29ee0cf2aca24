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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/// Holds the rolling status message and fans change notifications out to listeners.
///
/// A listener that throws is logged and skipped; it never affects the engine or other listeners.
public class StatusBoard {

    private static final Logger logger = LogManager.getLogger(StatusBoard.class);

    private final AtomicReference<String> message = new AtomicReference<>("");
    private final List<AssetSyncListener> listeners = new CopyOnWriteArrayList<>();

    /// @param listener the listener to add
    public void addListener(AssetSyncListener listener) {
        listeners.add(listener);
    }

    /// @param listener the listener to remove
    public void removeListener(AssetSyncListener listener) {
        listeners.remove(listener);
    }

    /// @return the current status message, empty before the first one
    public String message() {
        return message.get();
    }

    /// Replaces the status message.
    /// @param text the new message
    public void post(String text) {
        message.set(text);
        fire(l -> l.onStatusChanged(text));
    }

    void entryChanged(EntryStatus status) {
        fire(l -> l.onEntryChanged(status));
    }

    /// @param catalog the newly published catalog
    public void catalogReplaced(Catalog catalog) {
        fire(l -> l.onCatalogReplaced(catalog));
    }

    /// @param syncing whether a refresh is running
    public void syncStateChanged(boolean syncing) {
        fire(l -> l.onSyncStateChanged(syncing));
    }

    private void fire(Consumer<AssetSyncListener> event) {
        for (AssetSyncListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("listener {} failed", listener, e);
            }
        }
    }
}
