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
package com.tomaszrup.analysisls.transport;

import java.util.Locale;

import com.google.gson.annotations.SerializedName;

/**
 * Channel kind used to reach an analysis server. Fixed per client.
 */
public enum ConnectionType {
    /** Child process, framed messages over stdin/stdout. */
    @SerializedName("stdio")
    STDIO,
    /** Raw socket with the same framing as stdio. */
    @SerializedName("tcp")
    TCP,
    /** Persistent WebSocket; one text frame per message. */
    @SerializedName("websocket")
    WEBSOCKET,
    /** One HTTP POST per message; the HTTP response is the reply. */
    @SerializedName("http")
    HTTP;

    /** Header-framed byte streams (stdio, tcp). */
    public boolean isStreamBased() {
        return this == STDIO || this == TCP;
    }

    /** No inbound message loop: replies come back from {@code send}. */
    public boolean isRequestPerCall() {
        return this == HTTP;
    }

    /** Kinds with a long-lived channel that the heartbeat keeps checking. */
    public boolean supportsHeartbeat() {
        return this != HTTP;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectionType fromId(String id) {
        for (ConnectionType type : values()) {
            if (type.id().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported connection type: " + id);
    }
}
