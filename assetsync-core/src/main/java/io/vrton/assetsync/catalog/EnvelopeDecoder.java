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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/// Unwraps the JSON envelope that source hosting APIs put around file contents.
///
/// The envelope is an object with a base64 `content` field and an `encoding` field, for
/// example `{"content": "eyJhc3NldHMiOltdfQ==", "encoding": "base64"}`. Hosting APIs wrap
/// the base64 text at fixed widths, so whitespace inside `content` is ignored.
public final class EnvelopeDecoder {

    private static final String UTF8_BOM = "\uFEFF";

    private EnvelopeDecoder() {
    }

    /// @param body
    ///     the raw response text
    /// @return the decoded payload as UTF-8 text
    /// @throws EnvelopeException
    ///     if the body is not an envelope or its content cannot be decoded
    public static String unwrap(String body) throws EnvelopeException {
        if (body == null || body.isBlank()) {
            throw new EnvelopeException("Envelope body is empty");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new EnvelopeException("Envelope is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new EnvelopeException("Envelope is not a JSON object");
        }
        JsonObject envelope = root.getAsJsonObject();

        String encoding = textField(envelope, "encoding");
        if (encoding != null && !encoding.isBlank() && !encoding.trim().equalsIgnoreCase("base64")) {
            throw new EnvelopeException("Unsupported envelope encoding '" + encoding + "'");
        }

        String content = textField(envelope, "content");
        if (content == null || content.isBlank()) {
            throw new EnvelopeException("Envelope has no content");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(content.replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new EnvelopeException("Envelope content is not valid base64: " + e.getMessage(), e);
        }
        String text = new String(decoded, StandardCharsets.UTF_8);
        return text.startsWith(UTF8_BOM) ? text.substring(1) : text;
    }

    private static String textField(JsonObject object, String field) throws EnvelopeException {
        JsonElement e = object.get(field);
        if (e == null || e.isJsonNull()) {
            return null;
        }
        if (!e.isJsonPrimitive()) {
            throw new EnvelopeException("Envelope field '" + field + "' is not a string");
        }
        return e.getAsString();
    }
}
