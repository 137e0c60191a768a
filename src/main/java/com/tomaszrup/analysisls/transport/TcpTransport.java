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
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects to an analysis server listening on a TCP port; uses the same
 * header framing as stdio.
 */
public class TcpTransport extends StreamTransport {

    private static final Logger logger = LoggerFactory.getLogger(TcpTransport.class);

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private volatile Socket socket;

    public TcpTransport(String host, int port, Duration connectTimeout) {
        this.host = host;
        this.port = port;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public ConnectionType getType() {
        return ConnectionType.TCP;
    }

    @Override
    public void connect() throws IOException {
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            attach(s.getInputStream(), s.getOutputStream());
        } catch (IOException | RuntimeException e) {
            closeQuietly(s, "socket");
            throw e;
        }
        this.socket = s;
        logger.info("Connected to analysis server at {}:{}", host, port);
    }

    @Override
    public boolean isConnected() {
        Socket s = socket;
        return super.isConnected() && s != null && s.isConnected() && !s.isClosed();
    }

    @Override
    protected void releaseChannel() {
        Socket s = socket;
        socket = null;
        closeQuietly(s, "socket");
    }

    @Override
    public String toString() {
        return "TcpTransport [" + host + ":" + port + "]";
    }
}
