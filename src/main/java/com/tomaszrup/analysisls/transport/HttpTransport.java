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
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.analysisls.protocol.LspConnectionException;

/**
 * Request-per-call channel: each message is POSTed to
 * {@code http://host:port/lsp} and the response body, if any, is the reply.
 * Server-initiated messages are not possible, so {@link #receive()} never
 * yields anything.
 */
public class HttpTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);

    private final URI endpoint;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private volatile HttpClient client;

    public HttpTransport(String host, int port, Duration connectTimeout, Duration requestTimeout) {
        this.endpoint = URI.create("http://" + host + ":" + port + "/lsp");
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ConnectionType getType() {
        return ConnectionType.HTTP;
    }

    URI getEndpoint() {
        return endpoint;
    }

    @Override
    public void connect() {
        client = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        logger.info("Using HTTP endpoint {}", endpoint);
    }

    @Override
    public byte[] send(byte[] payload) throws IOException {
        HttpClient c = client;
        if (c == null) {
            throw new LspConnectionException("No http connection");
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        HttpResponse<byte[]> response;
        try {
            response = c.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while posting to " + endpoint, e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " from " + endpoint);
        }
        byte[] body = response.body();
        return body != null ? body : new byte[0];
    }

    @Override
    public byte[] receive() {
        return null;
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    @Override
    public void disconnect() {
        client = null;
    }

    @Override
    public String toString() {
        return "HttpTransport [" + endpoint + "]";
    }
}
