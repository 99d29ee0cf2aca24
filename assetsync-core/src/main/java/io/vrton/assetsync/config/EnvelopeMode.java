package io.vrton.assetsync.config;

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

/// How the body of a catalog response is interpreted.
public enum EnvelopeMode {
    /// Treat the body as an envelope when the catalog URL host is a known hosting API host
    AUTO,
    /// Always a raw catalog document
    RAW,
    /// Always a hosting API envelope carrying the document as base64
    ENVELOPE
}
