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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A test fixture that starts a Jetty web server to host catalogs, preview images and packages.
 * <p>
 * Static files are served from a resources directory. Requests below
 * {@value #PAYLOAD_PATH} are answered by a {@link PayloadServlet}, which produces package
 * payloads of any size, pace or status without needing files on disk.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture()) {
 *     server.start();
 *     String catalogUrl = server.url("temp/mytest/catalog.json");
 *     // Use catalogUrl in your tests
 * }
 * ```
 * Files outside the temp directory are treated as read-only; {@link #close()} fails if a test
 * changed, deleted or added one.
 */
public class JettyFileServerFixture implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    /// Mount point of the synthetic payload servlet
    public static final String PAYLOAD_PATH = "/download/generated";

    private final Path resourcesRoot;
    private final Map<Path, FileTime> snapshot = new HashMap<>();
    private final PayloadServlet payloads = new PayloadServlet();
    private Path tempDirectory;
    private Server server;
    private int port;

    /**
     * Creates a fixture serving {@code src/test/resources/testserver}.
     */
    public JettyFileServerFixture() {
        this(Path.of("src/test/resources/testserver"));
    }

    /**
     * Creates a fixture serving the given directory.
     *
     * @param resourcesRoot The root directory containing the resources to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
        this.resourcesRoot = resourcesRoot.toAbsolutePath().normalize();
        logger.debug("resourcesRoot: {}", this.resourcesRoot);
    }

    /**
     * Sets the directory tests may write to. It is excluded from the read-only check.
     *
     * @param tempDirectory The temporary directory path
     */
    public void setTempDirectory(Path tempDirectory) {
        this.tempDirectory = tempDirectory.toAbsolutePath().normalize();
    }

    /**
     * Starts the web server on a random free port of the loopback interface.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        takeSnapshot();

        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toString());
        server.setHandler(context);

        context.addServlet(new ServletHolder("payloads", payloads), PAYLOAD_PATH + "/*");

        ServletHolder files = new ServletHolder("default", DefaultServlet.class);
        files.setInitParameter("dirAllowed", "false");
        files.setInitParameter("acceptRanges", "true");
        files.setInitParameter("etags", "true");
        context.addServlet(files, "/");

        try {
            server.start();
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
        port = connector.getLocalPort();
        logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
    }

    /**
     * @return the base URL of the server, ending with a slash
     */
    public URI getBaseUrl() {
        return URI.create("http://127.0.0.1:" + port + "/");
    }

    /**
     * @param relativePath a path relative to the server root, with or without a leading slash
     * @return the absolute URL of the path
     */
    public String url(String relativePath) {
        String path = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
        return getBaseUrl() + path;
    }

    /**
     * @param name a payload name
     * @param query query parameters understood by {@link PayloadServlet}, without the leading '?', or null
     * @return the URL of a synthetic payload
     */
    public String payloadUrl(String name, String query) {
        return url(PAYLOAD_PATH + "/" + name + (query == null || query.isEmpty() ? "" : "?" + query));
    }

    /**
     * @return the servlet answering payload requests
     */
    public PayloadServlet payloads() {
        return payloads;
    }

    /**
     * @return The root directory being served
     */
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * Stops the server and verifies that no read-only file was modified, deleted or added.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
            server = null;
        }
        verifySnapshot();
    }

    private void takeSnapshot() {
        snapshot.clear();
        try (Stream<Path> files = Files.walk(resourcesRoot)) {
            files.filter(Files::isRegularFile).filter(f -> !isTemporary(f)).forEach(f -> {
                try {
                    snapshot.put(f, Files.getLastModifiedTime(f));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to take file timestamp snapshot: {}", e.getMessage());
        }
        logger.debug("Took timestamp snapshot of {} files in {}", snapshot.size(), resourcesRoot);
    }

    private void verifySnapshot() {
        if (snapshot.isEmpty()) {
            return;
        }
        try (Stream<Path> files = Files.walk(resourcesRoot)) {
            for (Map.Entry<Path, FileTime> entry : snapshot.entrySet()) {
                Path file = entry.getKey();
                if (!Files.exists(file)) {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to delete files in the testserver directory: " + file);
                }
                if (!Files.getLastModifiedTime(file).equals(entry.getValue())) {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to modify files in the testserver directory: " + file);
                }
            }
            files.filter(Files::isRegularFile).filter(f -> !isTemporary(f)).filter(f -> !snapshot.containsKey(f))
                .findFirst()
                .ifPresent(f -> {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to create files in the testserver directory: " + f);
                });
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to check for modified files: {}", e.getMessage());
        }
    }

    private boolean isTemporary(Path file) {
        return tempDirectory != null && file.toAbsolutePath().normalize().startsWith(tempDirectory);
    }
}
