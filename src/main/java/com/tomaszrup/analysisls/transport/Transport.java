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

import java.io.IOException;
import java.util.Optional;

/**
 * Byte-level channel to an analysis server. Payloads are complete JSON-RPC
 * messages; each implementation frames them as its channel kind requires.
 *
 * <p>{@link #connect()} either succeeds or leaves nothing behind: a failed
 * connect releases whatever it had acquired. {@link #disconnect()} is
 * idempotent and never throws.</p>
 */
public interface Transport {

    ConnectionType getType();

    /**
     * Establishes the channel.
     *
     * @throws IOException if the channel could not be established; no
     *                     resources are held afterwards
     */
    void connect() throws IOException;

    /**
     * Sends one message.
     *
     * @return the reply payload for request-per-call transports, or
     *         {@code null} when replies arrive through {@link #receive()}
     */
    byte[] send(byte[] payload) throws IOException;

    /**
     * Blocks until the next inbound message.
     *
     * @return the payload, or {@code null} once the channel has been closed
     */
    byte[] receive() throws IOException;

    boolean isConnected();

    /** The server process when this transport launched one. */
    default Optional<ProcessHandle> getProcess() {
        return Optional.empty();
    }

    void disconnect();
}
