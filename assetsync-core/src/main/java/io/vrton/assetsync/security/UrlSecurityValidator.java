package io.vrton.assetsync.security;

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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/// Decides whether a URL from a remote catalog may be fetched.
///
/// A URL is permitted only when all of these hold:
/// 1. it parses as an absolute URL
/// 2. its scheme is `http` or `https`
/// 3. its host is neither loopback nor in 10/8, 172.16/12 or 192.168/16, unless private hosts
///    are allowed for the current catalog
/// 4. its path or query ends with a package extension, or contains a download, release or
///    attachment marker
///
/// Checks are purely lexical. No name resolution is performed.
public final class UrlSecurityValidator {

    /// Extensions accepted at the end of the path or query
    public static final List<String> PACKAGE_EXTENSIONS = List.of(".unitypackage", ".zip", ".tar.gz");

    /// Path markers produced by release and attachment hosting
    public static final List<String> PATH_MARKERS = List.of("/download", "/releases/", "/attachments/");

    private static final List<String> SOURCE_HOSTING_HOSTS = List.of(
        "github.com", "api.github.com", "objects.githubusercontent.com", "gitlab.com", "codeberg.org"
    );

    private UrlSecurityValidator() {
    }

    /// @param url
    ///     the candidate download URL, may be null
    /// @param allowPrivateHosts
    ///     whether loopback and private network hosts are acceptable
    /// @return true if the URL satisfies every rule
    public static boolean isPermitted(String url, boolean allowPrivateHosts) {
        URI uri = parseAbsolute(url);
        if (uri == null || !hasPermittedHost(uri, allowPrivateHosts)) {
            return false;
        }
        return hasDownloadShape(uri);
    }

    /// Applies the scheme and host rules only. Used for preview images, which do not carry a
    /// package shape.
    /// @param url
    ///     the candidate URL, may be null
    /// @param allowPrivateHosts
    ///     whether loopback and private network hosts are acceptable
    /// @return true if the URL is absolute, http(s), and on an acceptable host
    public static boolean isPermittedHost(String url, boolean allowPrivateHosts) {
        URI uri = parseAbsolute(url);
        return uri != null && hasPermittedHost(uri, allowPrivateHosts);
    }

    /// @param host
    ///     a host name or IP literal, brackets around IPv6 literals are tolerated
    /// @return true if the host is loopback or inside a private IPv4 range
    public static boolean isPrivateOrLoopbackHost(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        if (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        if (h.equals("localhost") || h.endsWith(".localhost") || h.equals("::1") || h.equals("0:0:0:0:0:0:0:1")) {
            return true;
        }
        int[] octets = ipv4Octets(h);
        if (octets == null) {
            return false;
        }
        return octets[0] == 127
            || octets[0] == 10
            || (octets[0] == 172 && octets[1] >= 16 && octets[1] <= 31)
            || (octets[0] == 192 && octets[1] == 168);
    }

    /// @param url
    ///     any URL text
    /// @return true if the URL parses and its host is loopback or private
    public static boolean hasPrivateOrLoopbackHost(String url) {
        URI uri = parseAbsolute(url);
        return uri != null && isPrivateOrLoopbackHost(uri.getHost());
    }

    private static URI parseAbsolute(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (!uri.isAbsolute() || uri.isOpaque() || uri.getHost() == null) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean hasPermittedHost(URI uri, boolean allowPrivateHosts) {
        String scheme = uri.getScheme();
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return false;
        }
        return allowPrivateHosts || !isPrivateOrLoopbackHost(uri.getHost());
    }

    private static boolean hasDownloadShape(URI uri) {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath().toLowerCase(Locale.ROOT);
        String query = uri.getRawQuery() == null ? "" : uri.getRawQuery().toLowerCase(Locale.ROOT);
        for (String ext : PACKAGE_EXTENSIONS) {
            if (path.endsWith(ext) || query.endsWith(ext)) {
                return true;
            }
        }
        for (String marker : PATH_MARKERS) {
            if (path.contains(marker) || query.contains(marker)) {
                return true;
            }
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (SOURCE_HOSTING_HOSTS.contains(host)) {
            return path.contains("/releases/") || path.contains("/download/");
        }
        return false;
    }

    // dotted-quad only; anything else is treated as a name
    private static int[] ipv4Octets(String host) {
        String[] parts = host.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        int[] octets = new int[4];
        for (int i = 0; i < 4; i++) {
            String p = parts[i];
            if (p.isEmpty() || p.length() > 3 || !p.chars().allMatch(Character::isDigit)) {
                return null;
            }
            octets[i] = Integer.parseInt(p);
            if (octets[i] > 255) {
                return null;
            }
        }
        return octets;
    }
}
