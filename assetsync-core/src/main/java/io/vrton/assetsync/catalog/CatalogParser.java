package io.vrton.assetsync.catalog;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.vrton.assetsync.security.UrlSecurityValidator;
import io.vrton.assetsync.utils.SHARED;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Turns a catalog response into a filtered {@link Catalog}.
///
/// The document format is
/// ```json
/// { "assets": [ { "name": "...", "description": "...", "version": "...",
///                 "downloadUrl": "...", "imageUrl": "...", "category": "...",
///                 "fileSize": 0 } ] }
/// ```
/// Entries whose download URL fails {@link UrlSecurityValidator#isPermitted(String, boolean)}
/// never reach the returned catalog.
public final class CatalogParser {

    private static final Logger logger = LogManager.getLogger(CatalogParser.class);

    /// The name of the array holding the entries
    public static final String ASSETS_FIELD = "assets";

    private CatalogParser() {
    }

    /// Decodes, parses and filters a catalog response.
    /// @param raw
    ///     the response body
    /// @param sourceIsApiEnvelope
    ///     whether the body is a hosting API envelope around the document
    /// @param allowPrivateHosts
    ///     whether download URLs may point at loopback or private hosts
    /// @return the filtered catalog with counts
    /// @throws EnvelopeException
    ///     if an envelope was expected and could not be unwrapped
    /// @throws MalformedCatalogException
    ///     if the text is not a catalog document
    public static ParsedCatalog parse(byte[] raw, boolean sourceIsApiEnvelope, boolean allowPrivateHosts)
        throws EnvelopeException, MalformedCatalogException {
        String text = new String(raw == null ? new byte[0] : raw, StandardCharsets.UTF_8);
        if (sourceIsApiEnvelope) {
            text = EnvelopeDecoder.unwrap(text);
        }
        List<CatalogEntry> parsed = parseDocument(text);

        List<CatalogEntry> surviving = new ArrayList<>(parsed.size());
        Set<String> seen = new HashSet<>();
        int rejected = 0;
        int duplicates = 0;
        for (CatalogEntry entry : parsed) {
            if (!UrlSecurityValidator.isPermitted(entry.downloadUrl(), allowPrivateHosts)) {
                logger.debug("dropping '{}': download URL not permitted: {}", entry.name(), entry.downloadUrl());
                rejected++;
                continue;
            }
            if (!seen.add(entry.name())) {
                logger.warn("dropping duplicate catalog entry '{}'", entry.name());
                duplicates++;
                continue;
            }
            surviving.add(entry);
        }
        return new ParsedCatalog(new Catalog(surviving), parsed.size(), rejected, duplicates);
    }

    /// Parses a catalog document without any filtering. Array elements that are not objects or
    /// have no name are returned as entries with an empty download URL, so that they are counted
    /// and then rejected by the security policy.
    /// @param text
    ///     the document text
    /// @return all entries, in document order
    /// @throws MalformedCatalogException
    ///     if the text is not a JSON object with an `assets` array
    public static List<CatalogEntry> parseDocument(String text) throws MalformedCatalogException {
        if (text == null || text.isBlank()) {
            throw new MalformedCatalogException("Catalog document is empty");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new MalformedCatalogException("Catalog document is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new MalformedCatalogException("Catalog document is not a JSON object");
        }
        JsonElement assets = root.getAsJsonObject().get(ASSETS_FIELD);
        if (assets == null || !assets.isJsonArray()) {
            throw new MalformedCatalogException("Catalog document has no '" + ASSETS_FIELD + "' array");
        }
        JsonArray array = assets.getAsJsonArray();
        List<CatalogEntry> entries = new ArrayList<>(array.size());
        int index = 0;
        for (JsonElement element : array) {
            entries.add(toEntry(element, index++));
        }
        return entries;
    }

    /// Renders a catalog as a document that {@link #parseDocument(String)} reads back.
    /// @param catalog
    ///     the catalog to render
    /// @return the pretty printed document
    public static String render(Catalog catalog) {
        JsonObject document = new JsonObject();
        document.add(ASSETS_FIELD, SHARED.gson.toJsonTree(catalog.entries()));
        return SHARED.gson.toJson(document);
    }

    private static CatalogEntry toEntry(JsonElement element, int index) {
        if (!element.isJsonObject()) {
            logger.debug("catalog element {} is not an object", index);
            return new CatalogEntry("#" + index, "", "", "", "", "", 0);
        }
        JsonObject o = element.getAsJsonObject();
        String name = text(o, "name");
        if (name == null || name.isBlank()) {
            logger.debug("catalog element {} has no name", index);
            return new CatalogEntry("#" + index, "", "", "", "", "", 0);
        }
        return new CatalogEntry(
            name,
            text(o, "description"),
            text(o, "version"),
            text(o, "downloadUrl"),
            text(o, "imageUrl"),
            text(o, "category"),
            size(o, "fileSize")
        );
    }

    private static String text(JsonObject o, String field) {
        JsonElement e = o.get(field);
        if (e == null || e.isJsonNull()) {
            return null;
        }
        return e.isJsonPrimitive() ? e.getAsString() : e.toString();
    }

    private static long size(JsonObject o, String field) {
        JsonElement e = o.get(field);
        if (e == null || !e.isJsonPrimitive()) {
            return 0;
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        try {
            if (p.isNumber()) {
                return Math.max(0, p.getAsLong());
            }
            if (p.isString()) {
                return Math.max(0, Long.parseLong(p.getAsString().trim()));
            }
        } catch (NumberFormatException nfe) {
            logger.debug("ignoring unusable {} '{}'", field, p);
        }
        return 0;
    }
}
