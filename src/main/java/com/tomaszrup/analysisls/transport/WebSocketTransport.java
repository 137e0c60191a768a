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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.analysisls.protocol.LspConnectionException;

/**
 * One JSON-RPC message per text frame over {@code ws://host:port/lsp}.
 */
public class WebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final byte[] END_OF_STREAM = new byte[0];

    private final URI endpoint;
    private final Duration connectTimeout;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object sendLock = new Object();
    private volatile WebSocket webSocket;

    public WebSocketTransport(String host, int port, Duration connectTimeout) {
        this.endpoint = URI.create("ws://" + host + ":" + port + "/lsp");
        this.connectTimeout = connectTimeout;
    }

    @Override
    public ConnectionType getType() {
        return ConnectionType.WEBSOCKET;
    }

    URI getEndpoint() {
        return endpoint;
    }

    @Override
    public void connect() throws IOException {
        HttpClient client = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        CompletableFuture<WebSocket> pending = client.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(endpoint, new InboundListener());
        try {
            webSocket = pending.get(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new IOException("Interrupted while connecting to " + endpoint, e);
        } catch (ExecutionException e) {
            throw new IOException("WebSocket connection to " + endpoint + " failed", e.getCause());
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IOException("Timed out connecting to " + endpoint, e);
        }
        closed.set(false);
        logger.info("Connected to analysis server at {}", endpoint);
    }

    @Override
    public byte[] send(byte[] payload) throws IOException {
        WebSocket ws = webSocket;
        if (ws == null || closed.get()) {
            throw new LspConnectionException("No websocket connection");
        }
        synchronized (sendLock) {
            try {
                ws.sendText(new String(payload, StandardCharsets.UTF_8), true).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while sending to " + endpoint, e);
            } catch (ExecutionException e) {
                throw new IOException("Failed to send to " + endpoint, e.getCause());
            }
        }
        return null;
    }

    @Override
    public byte[] receive() throws IOException {
        if (closed.get() && inbound.isEmpty()) {
            return null;
        }
        try {
            byte[] next = inbound.take();
            if (next == END_OF_STREAM) {
                inbound.offer(END_OF_STREAM);
                return null;
            }
            return next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    public boolean isConnected() {
        WebSocket ws = webSocket;
        return ws != null && !closed.get() && !ws.isInputClosed() && !ws.isOutputClosed();
    }

    @Override
    public void disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = webSocket;
        webSocket = null;
        if (ws != null) {
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                        .get(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.debug("WebSocket close handshake did not complete: {}", e.getMessage());
            }
            ws.abort();
        }
        inbound.offer(END_OF_STREAM);
    }

    private final class InboundListener implements WebSocket.Listener {

        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                inbound.offer(partial.toString().getBytes(StandardCharsets.UTF_8));
                partial.setLength(0);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            logger.info("WebSocket closed by server ({}): {}", statusCode, reason);
            inbound.offer(END_OF_STREAM);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            logger.warn("WebSocket error on {}: {}", endpoint, error.toString());
            inbound.offer(END_OF_STREAM);
        }
    }

    @Override
    public String toString() {
        return "WebSocketTransport [" + endpoint + "]";
    }
}
