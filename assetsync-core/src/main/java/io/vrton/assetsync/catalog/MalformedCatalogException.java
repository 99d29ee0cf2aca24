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

import io.vrton.assetsync.AssetSyncException;
import io.vrton.assetsync.ErrorKind;

/// The body is not a catalog document: not JSON, not an object, or missing the `assets` array.
public class MalformedCatalogException extends AssetSyncException {

    public MalformedCatalogException(String message) {
        super(ErrorKind.MALFORMED_CATALOG, message);
    }

    public MalformedCatalogException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_CATALOG, message, cause);
    }
}
