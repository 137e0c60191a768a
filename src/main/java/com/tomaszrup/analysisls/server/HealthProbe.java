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
package com.tomaszrup.analysisls.server;

import com.tomaszrup.analysisls.LspClient;

/**
 * Decides whether a running server is healthy. Called from the health
 * monitor while the server's lifecycle lock is held.
 */
@FunctionalInterface
public interface HealthProbe {

    boolean isHealthy(ServerInfo server);

    /**
     * Healthy when the client is ready, its transport is open, and the
     * client's current server process (if there is one) is alive.
     */
    HealthProbe DEFAULT = server -> {
        LspClient client = server.getClient().orElse(null);
        if (client == null || !client.isConnected() || !client.isTransportConnected()) {
            return false;
        }
        return server.getProcess().map(ProcessHandle::isAlive).orElse(true);
    };
}
