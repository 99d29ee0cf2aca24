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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Browse and download packages from an asset catalog
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "assetsync",
    header = "Browse and download packages from an asset catalog",
    description = "Contains subcommands to list a remote asset catalog and download its packages",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_assetsync.Version.class,
    subcommands = {
        CMD_catalog.class,
        CMD_download.class,
        CommandLine.HelpCommand.class
    })
public class CMD_assetsync implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_assetsync.class);

    /// Create the CMD_assetsync command
    public CMD_assetsync() {}

    /// Run an assetsync command
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return a command line for the assetsync command tree
    public static CommandLine commandLine() {
        logger.debug("instancing commandline");
        return new CommandLine(new CMD_assetsync()).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }

    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_assetsync.class.getPackage().getImplementationVersion();
            return new String[]{"assetsync " + (version == null ? "development build" : version)};
        }
    }
}
