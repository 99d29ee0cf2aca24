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

import io.vrton.assetsync.AssetSyncException;
import io.vrton.assetsync.ErrorKind;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/// A single in-flight HTTP request that can be observed and aborted.
///
/// The handle is completed exactly once: normally with a {@link TransferResult}, or
/// exceptionally with an {@link AssetSyncException} whose kind tells why. Progress counters
/// may be read from any thread while the transfer runs.
public final class TransferHandle implements Callback {

    private static final Logger logger = LogManager.getLogger(TransferHandle.class);

    /// Buffer size for reading the response body (16KB)
    private static final int BUFFER_SIZE = 8192 * 2;
    static final int MAX_INITIAL_CAPACITY = 1024 * 1024;

    private final String url;
    private final Call call;
    private final long maxBytes;
    private final Path target;
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong expectedLength = new AtomicLong(-1);
    private final AtomicReference<ErrorKind> abortReason = new AtomicReference<>();
    private final CompletableFuture<TransferResult> result = new CompletableFuture<>();

    TransferHandle(String url, Call call, long maxBytes, Path target) {
        this.url = url;
        this.call = call;
        this.maxBytes = maxBytes;
        this.target = target;
    }

    void start() {
        call.enqueue(this);
    }

    /// @return the requested URL
    public String url() {
        return url;
    }

    /// @return the number of payload bytes received so far
    public long receivedBytes() {
        return received.get();
    }

    /// @return the announced payload length, or -1 until headers arrive or if not announced
    public long expectedBytes() {
        return expectedLength.get();
    }

    /// @return received over expected bytes in [0, 1], or 0 while the length is unknown
    public double progress() {
        long total = expectedLength.get();
        if (total <= 0) {
            return result.isDone() && !result.isCompletedExceptionally() ? 1.0d : 0.0d;
        }
        return Math.min(1.0d, (double) received.get() / total);
    }

    /// @return the future completed when the transfer ends
    public CompletableFuture<TransferResult> result() {
        return result;
    }

    /// @return true once the transfer has ended in any way
    public boolean isDone() {
        return result.isDone();
    }

    /// Aborts the transfer. The first reason given wins, later calls have no effect.
    /// @param reason
    ///     why the transfer is aborted, usually TIMEOUT or CANCELLED
    public void abort(ErrorKind reason) {
        if (abortReason.compareAndSet(null, reason)) {
            call.cancel();
            result.completeExceptionally(new AssetSyncException(reason, describeAbort(reason)));
        }
    }

    @Override
    public void onFailure(Call call, IOException e) {
        ErrorKind reason = abortReason.get();
        if (reason == null) {
            if (e instanceof HttpTransport.HostRejectedException) {
                reason = ErrorKind.VALIDATION_REJECTED;
            } else {
                reason = e instanceof InterruptedIOException ? ErrorKind.TIMEOUT : ErrorKind.NETWORK;
            }
        }
        fail(new AssetSyncException(reason, "Request to " + url + " failed: " + e.getMessage(), e));
    }

    @Override
    public void onResponse(Call call, Response response) {
        try (response) {
            if (!response.isSuccessful()) {
                fail(new AssetSyncException(ErrorKind.NETWORK,
                    "Request to " + url + " returned HTTP " + response.code()
                        + (response.message().isEmpty() ? "" : " " + response.message())));
                return;
            }
            long declared = parseLength(response.header("Content-Length"));
            expectedLength.set(declared);
            if (maxBytes > 0 && declared > maxBytes) {
                fail(sizeLimit(declared));
                return;
            }
            String contentType = response.header("Content-Type");
            ResponseBody body = response.body();
            if (body == null || "HEAD".equals(response.request().method())) {
                result.complete(new TransferResult(url, response.code(), declared, contentType, 0, new byte[0], null));
                return;
            }
            if (target != null) {
                try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(target)) {
                    copy(in, out);
                } catch (IOException | AssetSyncException e) {
                    discardTarget();
                    throw e;
                }
                result.complete(new TransferResult(url, response.code(), declared, contentType,
                    received.get(), null, target));
            } else {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream(initialCapacity(declared));
                try (InputStream in = body.byteStream()) {
                    copy(in, buffer);
                }
                result.complete(new TransferResult(url, response.code(), declared, contentType,
                    received.get(), buffer.toByteArray(), null));
            }
        } catch (AssetSyncException e) {
            fail(e);
        } catch (IOException e) {
            onFailure(call, e);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure reading response from {}", url, e);
            fail(new AssetSyncException(ErrorKind.NETWORK, "Unexpected failure reading " + url + ": " + e, e));
        }
    }

    /// The declared length only sizes the first allocation, up to {@link #MAX_INITIAL_CAPACITY}.
    /// Larger bodies grow the buffer as bytes actually arrive.
    static int initialCapacity(long declared) {
        if (declared <= 0) {
            return BUFFER_SIZE;
        }
        return (int) Math.min(declared, MAX_INITIAL_CAPACITY);
    }

    private void copy(InputStream in, OutputStream out) throws IOException, AssetSyncException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            ErrorKind reason = abortReason.get();
            if (reason != null) {
                throw new AssetSyncException(reason, describeAbort(reason));
            }
            long total = received.addAndGet(read);
            if (maxBytes > 0 && total > maxBytes) {
                call.cancel();
                throw sizeLimit(total);
            }
            out.write(buffer, 0, read);
        }
    }

    private void fail(AssetSyncException e) {
        if (!result.completeExceptionally(e)) {
            logger.trace("late failure for {} ignored: {}", url, e.getMessage());
        }
    }

    private void discardTarget() {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            logger.warn("could not remove partial file {}: {}", target, e.getMessage());
        }
    }

    private AssetSyncException sizeLimit(long size) {
        return new AssetSyncException(ErrorKind.SIZE_LIMIT_EXCEEDED,
            "Payload from " + url + " exceeds the limit of " + maxBytes + " bytes (" + size + " bytes)");
    }

    private String describeAbort(ErrorKind reason) {
        return switch (reason) {
            case TIMEOUT -> "Request to " + url + " timed out";
            case CANCELLED -> "Request to " + url + " was cancelled";
            default -> "Request to " + url + " was aborted: " + reason;
        };
    }

    private static long parseLength(String header) {
        if (header == null || header.isBlank()) {
            return -1;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
