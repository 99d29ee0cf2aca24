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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// Serves synthetic package payloads whose shape is chosen by query parameters.
///
/// | parameter | meaning | default |
/// |---|---|---|
/// | `size` | payload bytes | 1024 |
/// | `chunks` | number of flushed writes the payload is split into | 1 |
/// | `delayMs` | pause before each write | 0 |
/// | `waitMs` | pause before the status line, for GET and HEAD alike | 0 |
/// | `sized` | whether Content-Length is sent | true |
/// | `status` | HTTP status to answer with, bodies are only sent for 2xx | 200 |
///
/// Every GET and HEAD is counted per path so tests can assert how many requests were made.
public class PayloadServlet extends HttpServlet {

    private static final Logger logger = LogManager.getLogger(PayloadServlet.class);

    private final Map<String, AtomicInteger> requests = new ConcurrentHashMap<>();

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        respond(req, resp, true);
    }

    @Override
    protected void doHead(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        respond(req, resp, false);
    }

    private void respond(HttpServletRequest req, HttpServletResponse resp, boolean withBody) throws IOException {
        String path = req.getPathInfo() == null ? "/" : req.getPathInfo();
        requests.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();

        int status = intParam(req, "status", 200);
        long size = longParam(req, "size", 1024);
        int chunks = Math.max(1, intParam(req, "chunks", 1));
        long delayMs = longParam(req, "delayMs", 0);
        long waitMs = longParam(req, "waitMs", 0);
        boolean sized = !"false".equalsIgnoreCase(req.getParameter("sized"));
        logger.debug("{} {} status={} size={} chunks={} delayMs={} sized={}", req.getMethod(), path, status, size,
            chunks, delayMs, sized);

        pause(waitMs);
        resp.setStatus(status);
        if (status < 200 || status >= 300) {
            return;
        }
        resp.setContentType("application/octet-stream");
        if (sized) {
            resp.setContentLengthLong(size);
        }
        if (!withBody) {
            return;
        }

        long chunkSize = Math.max(1, (size + chunks - 1) / chunks);
        byte[] buffer = new byte[(int) Math.min(chunkSize, 64 * 1024)];
        Arrays.fill(buffer, (byte) 'x');
        OutputStream out = resp.getOutputStream();
        long remaining = size;
        while (remaining > 0) {
            pause(delayMs);
            long chunkRemaining = Math.min(chunkSize, remaining);
            while (chunkRemaining > 0) {
                int n = (int) Math.min(buffer.length, chunkRemaining);
                out.write(buffer, 0, n);
                chunkRemaining -= n;
                remaining -= n;
            }
            out.flush();
        }
    }

    /// @param path
    ///     a path below the servlet mount point, starting with `/`
    /// @return how many GET or HEAD requests were made for the path
    public int requestCount(String path) {
        AtomicInteger count = requests.get(path);
        return count == null ? 0 : count.get();
    }

    /// Forgets all request counts.
    public void resetCounts() {
        requests.clear();
    }

    private static void pause(long millis) throws IOException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while pacing payload");
        }
    }

    private static int intParam(HttpServletRequest req, String name, int fallback) {
        String value = req.getParameter(name);
        return value == null ? fallback : Integer.parseInt(value);
    }

    private static long longParam(HttpServletRequest req, String name, long fallback) {
        String value = req.getParameter(name);
        return value == null ? fallback : Long.parseLong(value);
    }
}
