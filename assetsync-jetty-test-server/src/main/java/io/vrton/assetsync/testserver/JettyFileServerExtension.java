package io.vrton.assetsync.testserver;

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
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// A JUnit Jupiter extension sharing one {@link JettyFileServerFixture} across a module's tests.
///
/// The server is started when first needed and stopped by a shutdown hook when the JVM exits.
/// It serves `src/test/resources/testserver` of the module under test; tests write generated
/// files such as catalogs below {@link #TEMP_RESOURCES_ROOT}, which is served as `temp/`.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTest {
///     String catalogUrl = JettyFileServerExtension.publish("mytest/catalog.json", json);
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);

    /// Overrides the served directory
    public static final String RESOURCES_ROOT_PROPERTY = "assetsync.test.resources.root";
    private static final String DEFAULT_RESOURCES_PATH = "src/test/resources/testserver";

    public static final Path DEFAULT_RESOURCES_ROOT;
    public static final Path TEMP_RESOURCES_ROOT;

    private static final Object lock = new Object();
    private static JettyFileServerFixture server;

    static {
        DEFAULT_RESOURCES_ROOT = Path.of(System.getProperty(RESOURCES_ROOT_PROPERTY, DEFAULT_RESOURCES_PATH))
            .toAbsolutePath();
        TEMP_RESOURCES_ROOT = DEFAULT_RESOURCES_ROOT.resolve("temp");
    }

    /// Starts the shared server if it is not running yet.
    public static void initialize() {
        synchronized (lock) {
            if (server != null) {
                return;
            }
            try {
                Files.createDirectories(TEMP_RESOURCES_ROOT);
                JettyFileServerFixture fixture = new JettyFileServerFixture(DEFAULT_RESOURCES_ROOT);
                fixture.setTempDirectory(TEMP_RESOURCES_ROOT);
                fixture.start();
                server = fixture;
                logger.info("Jetty test web server started at {}", fixture.getBaseUrl());
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    synchronized (lock) {
                        if (server != null) {
                            server.close();
                            server = null;
                        }
                    }
                }, "assetsync-testserver-shutdown"));
            } catch (IOException e) {
                logger.error("Failed to start Jetty test web server", e);
                throw new UncheckedIOException("Failed to start Jetty test web server", e);
            }
        }
    }

    /// @return the base URL of the shared server
    public static URI getBaseUrl() {
        return getServer().getBaseUrl();
    }

    /// @return the shared server
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    /// Writes a file below the temp directory and returns its URL.
    /// @param relativePath
    ///     the path below `temp/`
    /// @param content
    ///     the file content
    /// @return the URL the file is served at
    public static String publish(String relativePath, String content) {
        return publish(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    /// Writes a file below the temp directory and returns its URL.
    /// @param relativePath
    ///     the path below `temp/`
    /// @param content
    ///     the file content
    /// @return the URL the file is served at
    public static String publish(String relativePath, byte[] content) {
        Path target = TEMP_RESOURCES_ROOT.resolve(relativePath).normalize();
        if (!target.startsWith(TEMP_RESOURCES_ROOT)) {
            throw new IllegalArgumentException("path escapes the temp directory: " + relativePath);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write " + target, e);
        }
        return getServer().url("temp/" + TEMP_RESOURCES_ROOT.relativize(target).toString().replace('\\', '/'));
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyFileServerExtension beforeAll called for {}", context.getDisplayName());
    }
}
