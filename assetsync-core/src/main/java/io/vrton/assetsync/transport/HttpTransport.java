package io.vrton.assetsync.transport;

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

import io.vrton.assetsync.security.UrlSecurityValidator;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/// Asynchronous HTTP access for catalog fetches, metadata probes and package downloads.
///
/// Every request is enqueued on OkHttp's dispatcher and returned as a {@link TransferHandle},
/// so no caller thread blocks on the network. Each network hop, including redirects, is checked
/// against the host rules of {@link UrlSecurityValidator}.
public class HttpTransport implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(HttpTransport.class);

    /// HTTP client shared by every request issued through this transport
    private final OkHttpClient httpClient;

    /// Flag to track if this transport has been closed
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// Creates a transport whose connect and read timeouts follow the request timeout.
    /// @param requestTimeout
    ///     the socket level bound; whole-operation deadlines are enforced by callers
    /// @param allowPrivateHosts
    ///     consulted on every hop, see {@link UrlSecurityValidator#isPermittedHost(String, boolean)}
    public HttpTransport(Duration requestTimeout, BooleanSupplier allowPrivateHosts) {
        this(createClient(requestTimeout, allowPrivateHosts));
    }

    /// Creates a transport on a preconfigured client.
    /// @param httpClient
    ///     the client to use
    public HttpTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    private static OkHttpClient createClient(Duration requestTimeout, BooleanSupplier allowPrivateHosts) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(64);
        dispatcher.setMaxRequestsPerHost(16);

        return new OkHttpClient.Builder()
            .dispatcher(dispatcher)
            .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
            .connectTimeout(requestTimeout)
            .readTimeout(requestTimeout)
            .writeTimeout(requestTimeout)
            .followRedirects(true)
            .followSslRedirects(true)
            .retryOnConnectionFailure(true)
            .addNetworkInterceptor(new HopGuard(allowPrivateHosts))
            .build();
    }

    /// Starts a GET whose body is buffered in memory.
    /// @param url
    ///     the URL to fetch
    /// @param maxBytes
    ///     the largest acceptable body, 0 for no limit
    /// @return the handle of the started transfer
    public TransferHandle get(String url, long maxBytes) {
        return start(new Request.Builder().url(url).get().build(), maxBytes, null);
    }

    /// Starts a GET whose body is streamed to a file.
    /// @param url
    ///     the URL to fetch
    /// @param maxBytes
    ///     the largest acceptable body, 0 for no limit
    /// @param target
    ///     the file to write, created or truncated
    /// @return the handle of the started transfer
    public TransferHandle download(String url, long maxBytes, Path target) {
        return start(new Request.Builder().url(url).get().build(), maxBytes, Objects.requireNonNull(target));
    }

    /// Starts a HEAD request. The result carries the announced Content-Length and no body.
    /// @param url
    ///     the URL to probe
    /// @return the handle of the started request
    public TransferHandle head(String url) {
        return start(new Request.Builder().url(url).head().build(), 0, null);
    }

    private TransferHandle start(Request request, long maxBytes, Path target) {
        if (closed.get()) {
            throw new IllegalStateException("HttpTransport has been closed");
        }
        TransferHandle handle = new TransferHandle(request.url().toString(), httpClient.newCall(request), maxBytes,
            target);
        logger.debug("{} {}", request.method(), request.url());
        handle.start();
        return handle;
    }

    /// @return true once {@link #close()} has been called
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            httpClient.dispatcher().cancelAll();
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    /// Rejects any hop, including redirect targets, whose host is not permitted.
    private static final class HopGuard implements Interceptor {
        private final BooleanSupplier allowPrivateHosts;

        private HopGuard(BooleanSupplier allowPrivateHosts) {
            this.allowPrivateHosts = allowPrivateHosts;
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            String url = chain.request().url().toString();
            if (!UrlSecurityValidator.isPermittedHost(url, allowPrivateHosts.getAsBoolean())) {
                throw new HostRejectedException(chain.request().url().host());
            }
            return chain.proceed(chain.request());
        }
    }

    /// Raised from the network interceptor when a hop targets a host that is not permitted.
    static final class HostRejectedException extends IOException {
        HostRejectedException(String host) {
            super("Refusing to contact non-permitted host: " + host);
        }
    }
}
