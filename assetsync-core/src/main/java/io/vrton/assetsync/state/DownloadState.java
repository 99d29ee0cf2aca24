package io.vrton.assetsync.state;

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

/// Per-entry download lifecycle.
///
/// `IDLE -> REQUESTING -> (SUCCEEDED | FAILED | TIMED_OUT | CANCELLED) -> IDLE`. Terminal
/// states are observable only briefly; once the coordinator has finalized an operation the
/// entry is back to IDLE and the terminal state is kept as the last outcome.
public enum DownloadState {
    IDLE,
    REQUESTING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    /// @return true for the states an operation can end in
    public boolean isTerminal() {
        return this != IDLE && this != REQUESTING;
    }
}
