/// Asynchronous HTTP transfers on OkHttp.
///
/// Each request is represented by a {@link io.vrton.assetsync.transport.TransferHandle} which can
/// be polled for progress and aborted with a reason. Transfers are buffered in memory or streamed
/// to a file, and can be bounded by a maximum payload size.
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
