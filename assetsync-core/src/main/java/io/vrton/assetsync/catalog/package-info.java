/// Catalog document model and parsing.
///
/// ## Key Components
///
/// - {@link io.vrton.assetsync.catalog.CatalogEntry}: One package as published
/// - {@link io.vrton.assetsync.catalog.Catalog}: Ordered immutable list of entries
/// - {@link io.vrton.assetsync.catalog.CatalogParser}: Decoding, parsing and filtering of responses
/// - {@link io.vrton.assetsync.catalog.EnvelopeDecoder}: Hosting API envelope unwrapping
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
