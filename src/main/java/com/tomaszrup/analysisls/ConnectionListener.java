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

/**
 * Observes the connection of an {@link LspClient}. Callbacks run on the
 * thread that caused the change; exceptions are logged and ignored.
 */
public interface ConnectionListener {

    void onConnectionStateChanged(ClientState previous, ClientState current);

    /**
     * The client lost its connection and gave up reconnecting.
     *
     * @param attempts reconnect attempts made since the connection was lost
     */
    default void onReconnectFailed(int attempts) {
    }
}
