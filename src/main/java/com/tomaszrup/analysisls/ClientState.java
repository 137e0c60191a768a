////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.analysisls;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Connection state of an {@link LspClient}:
 *
 * <pre>
 * DISCONNECTED -&gt; CONNECTED -&gt; INITIALIZING -&gt; READY
 *       ^             |              |            |
 *       +-------------+--------------+------------+
 * </pre>
 *
 * Every state may fall back to DISCONNECTED; forward moves go one step at
 * a time.
 */
public enum ClientState {
    DISCONNECTED,
    CONNECTED,
    INITIALIZING,
    READY;

    public Set<ClientState> successors() {
        switch (this) {
            case DISCONNECTED:
                return Collections.unmodifiableSet(EnumSet.of(CONNECTED));
            case CONNECTED:
                return Collections.unmodifiableSet(EnumSet.of(INITIALIZING, DISCONNECTED));
            case INITIALIZING:
                return Collections.unmodifiableSet(EnumSet.of(READY, DISCONNECTED));
            case READY:
                return Collections.unmodifiableSet(EnumSet.of(DISCONNECTED));
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(ClientState next) {
        return successors().contains(next);
    }

    /**
     * @return {@code next}
     * @throws IllegalStateException if the move is not allowed
     */
    public ClientState transitionTo(ClientState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal client state transition " + this + " -> " + next);
        }
        return next;
    }
}
