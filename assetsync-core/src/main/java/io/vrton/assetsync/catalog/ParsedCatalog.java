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

/// The outcome of decoding, parsing and filtering one catalog response.
/// @param catalog
///     the surviving entries, in document order
/// @param totalParsed
///     how many entries the document contained
/// @param rejected
///     entries dropped because they were unusable or their download URL failed the security policy
/// @param duplicates
///     entries dropped because an earlier entry had the same name
public record ParsedCatalog(Catalog catalog, int totalParsed, int rejected, int duplicates) {

    /// @return the number of surviving entries
    public int surviving() {
        return catalog.size();
    }

    /// @return the number of entries that were parsed but are not in the catalog
    public int dropped() {
        return totalParsed - catalog.size();
    }
}
