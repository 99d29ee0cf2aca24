package io.vrton.assetsync.commands;

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

import io.vrton.assetsync.downloader.PackageImporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// Imports packages by copying them into a target directory.
public class DirectoryPackageImporter implements PackageImporter {

    private static final Logger logger = LogManager.getLogger(DirectoryPackageImporter.class);

    private final Path targetDirectory;
    private final List<Path> imported = new CopyOnWriteArrayList<>();

    /// @param targetDirectory
    ///     the directory packages are copied into, created when needed
    public DirectoryPackageImporter(Path targetDirectory) {
        this.targetDirectory = targetDirectory.toAbsolutePath().normalize();
    }

    @Override
    public void importPackage(Path packageFile) throws IOException {
        Files.createDirectories(targetDirectory);
        Path target = targetDirectory.resolve(packageFile.getFileName().toString());
        Files.copy(packageFile, target, StandardCopyOption.REPLACE_EXISTING);
        imported.add(target);
        logger.info("Imported {} into {}", packageFile.getFileName(), targetDirectory);
    }

    /// @return the files copied so far
    public List<Path> imported() {
        return List.copyOf(imported);
    }

    /// @return the directory packages are copied into
    public Path targetDirectory() {
        return targetDirectory;
    }
}
