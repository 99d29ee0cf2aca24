package io.vrton.assetsync.sync;

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

/// How a catalog refresh ended.
public enum SyncStatus {
    /// A new catalog was published
    OK,
    /// The fetch or parse failed; the previous catalog is still published
    FAILED,
    /// Nothing was done because a refresh was already running or the engine is closed
    SKIPPED
}
