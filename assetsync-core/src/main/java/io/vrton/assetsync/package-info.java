/// Catalog sync and download engine for avatar asset packages.
///
/// A {@link io.vrton.assetsync.sync.CatalogSyncEngine} fetches a remote catalog of packages,
/// filters it against {@link io.vrton.assetsync.security.UrlSecurityValidator}, and downloads
/// packages on request, handing each verified file to a
/// {@link io.vrton.assetsync.downloader.PackageImporter}.
///
/// ## Key Components
///
/// - {@link io.vrton.assetsync.ErrorKind}: Failure classification shared by every operation
/// - {@link io.vrton.assetsync.AssetSyncException}: Failure carrier delivered inside results
///
/// ## Usage Example
///
/// ```java
/// try (CatalogSyncEngine engine = new CatalogSyncEngine(AssetSyncConfig.load(configDir), importer)) {
///     SyncResult result = engine.sync().join();
///     engine.startDownload("Summer Dress").thenAccept(r -> System.out.println(r.describe()));
/// }
/// ```
package io.vrton.assetsync;

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
