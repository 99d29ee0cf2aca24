/// Per-entry runtime state and change notification.
///
/// ## Key Components
///
/// - {@link io.vrton.assetsync.state.EntryStateRegistry}: Name to state mapping for the published catalog
/// - {@link io.vrton.assetsync.state.EntryRuntimeState}: Download lifecycle, progress, size and preview of one entry
/// - {@link io.vrton.assetsync.state.StatusBoard}: Rolling status message and listener fan-out
/// - {@link io.vrton.assetsync.state.AssetSyncListener}: Observer interface for presentation layers
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
