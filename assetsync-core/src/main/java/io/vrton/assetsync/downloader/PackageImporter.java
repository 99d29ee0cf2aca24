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

import java.io.IOException;
import java.nio.file.Path;

/// Consumes a downloaded, verified package file. The file is deleted after this returns.
@FunctionalInterface
public interface PackageImporter {

    /// @param packageFile
    ///     an existing, non-empty file inside the scratch directory
    /// @throws IOException
    ///     if the package could not be imported
    void importPackage(Path packageFile) throws IOException;
}
