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

import com.tomaszrup.analysisls.transport.HttpTransport;
import com.tomaszrup.analysisls.transport.StdioTransport;
import com.tomaszrup.analysisls.transport.TcpTransport;
import com.tomaszrup.analysisls.transport.Transport;
import com.tomaszrup.analysisls.transport.WebSocketTransport;

/**
 * Creates the transport for a client. Called once per connection attempt,
 * so every reconnect gets a fresh channel.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(LspClientOptions options);

    TransportFactory DEFAULT = options -> {
        switch (options.getConnectionType()) {
            case STDIO:
                return new StdioTransport(options.getCommand(), options.getWorkingDirectory(),
                        options.getEnvironment());
            case TCP:
                return new TcpTransport(options.getHost(), options.getPort(), options.getConnectTimeout());
            case WEBSOCKET:
                return new WebSocketTransport(options.getHost(), options.getPort(), options.getConnectTimeout());
            case HTTP:
                return new HttpTransport(options.getHost(), options.getPort(), options.getConnectTimeout(),
                        options.getRequestTimeout());
            default:
                throw new IllegalArgumentException("Unsupported connection type: " + options.getConnectionType());
        }
    };
}
