/// Package downloads: transfer, verification, import and cleanup.
///
/// ## Key Components
///
/// - {@link io.vrton.assetsync.downloader.DownloadCoordinator}: Runs at most one download per entry
/// - {@link io.vrton.assetsync.downloader.DownloadResult}: Outcome of a download request
/// - {@link io.vrton.assetsync.downloader.PackageFileNames}: Safe scratch file naming
/// - {@link io.vrton.assetsync.downloader.PackageImporter}: Consumer of verified packages
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
