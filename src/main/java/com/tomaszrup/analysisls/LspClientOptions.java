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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.tomaszrup.analysisls.transport.ConnectionType;

/**
 * Immutable settings of one {@link LspClient}. Obtain through
 * {@link #builder(ConnectionType)}.
 */
public final class LspClientOptions {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    public static final Duration DEFAULT_RECONNECT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RECONNECT_MAX_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final String DEFAULT_CLIENT_NAME = "analysis-ls-client";
    public static final String DEFAULT_CLIENT_VERSION = "0.1.0";

    private final ConnectionType connectionType;
    private final List<String> command;
    private final String workingDirectory;
    private final Map<String, String> environment;
    private final String host;
    private final int port;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final Duration shutdownTimeout;
    private final boolean autoReconnect;
    private final int maxReconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final Duration heartbeatInterval;
    private final String clientName;
    private final String clientVersion;
    private final String workspaceRoot;

    private LspClientOptions(Builder b) {
        this.connectionType = b.connectionType;
        this.command = Collections.unmodifiableList(new ArrayList<>(b.command));
        this.workingDirectory = b.workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(b.environment));
        this.host = b.host;
        this.port = b.port;
        this.requestTimeout = b.requestTimeout;
        this.connectTimeout = b.connectTimeout;
        this.shutdownTimeout = b.shutdownTimeout;
        this.autoReconnect = b.autoReconnect;
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.reconnectBaseDelay = b.reconnectBaseDelay;
        this.reconnectMaxDelay = b.reconnectMaxDelay;
        this.heartbeatInterval = b.heartbeatInterval;
        this.clientName = b.clientName;
        this.clientVersion = b.clientVersion;
        this.workspaceRoot = b.workspaceRoot;
    }

    public static Builder builder(ConnectionType connectionType) {
        return new Builder(connectionType);
    }

    /** A builder pre-filled with these options. */
    public Builder toBuilder() {
        return new Builder(connectionType)
                .command(command)
                .workingDirectory(workingDirectory)
                .environment(environment)
                .host(host)
                .port(port)
                .requestTimeout(requestTimeout)
                .connectTimeout(connectTimeout)
                .shutdownTimeout(shutdownTimeout)
                .autoReconnect(autoReconnect)
                .maxReconnectAttempts(maxReconnectAttempts)
                .reconnectBaseDelay(reconnectBaseDelay)
                .reconnectMaxDelay(reconnectMaxDelay)
                .heartbeatInterval(heartbeatInterval)
                .clientInfo(clientName, clientVersion)
                .workspaceRoot(workspaceRoot);
    }

    public ConnectionType getConnectionType() {
        return connectionType;
    }

    public List<String> getCommand() {
        return command;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public boolean isAutoReconnect() {
        return autoReconnect;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration getReconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    public Duration getReconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    /** Zero disables the heartbeat. */
    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public String getClientName() {
        return clientName;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    /** Directory announced as the workspace folder, or {@code null}. */
    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    @Override
    public String toString() {
        String endpoint = connectionType == ConnectionType.STDIO ? String.join(" ", command) : host + ":" + port;
        return "LspClientOptions [" + connectionType.id() + " " + endpoint + "]";
    }

    public static final class Builder {
        private final ConnectionType connectionType;
        private final List<String> command = new ArrayList<>();
        private String workingDirectory;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String host = "localhost";
        private int port = 8080;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private boolean autoReconnect = true;
        private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private Duration reconnectBaseDelay = DEFAULT_RECONNECT_BASE_DELAY;
        private Duration reconnectMaxDelay = DEFAULT_RECONNECT_MAX_DELAY;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private String clientName = DEFAULT_CLIENT_NAME;
        private String clientVersion = DEFAULT_CLIENT_VERSION;
        private String workspaceRoot;

        private Builder(ConnectionType connectionType) {
            this.connectionType = Objects.requireNonNull(connectionType, "connectionType");
        }

        public Builder command(List<String> value) {
            command.clear();
            if (value != null) {
                command.addAll(value);
            }
            return this;
        }

        public Builder workingDirectory(String value) {
            this.workingDirectory = value;
            return this;
        }

        public Builder environment(Map<String, String> value) {
            environment.clear();
            if (value != null) {
                environment.putAll(value);
            }
            return this;
        }

        public Builder host(String value) {
            this.host = value;
            return this;
        }

        public Builder port(int value) {
            this.port = value;
            return this;
        }

        public Builder requestTimeout(Duration value) {
            this.requestTimeout = requirePositive(value, "requestTimeout");
            return this;
        }

        public Builder connectTimeout(Duration value) {
            this.connectTimeout = requirePositive(value, "connectTimeout");
            return this;
        }

        public Builder shutdownTimeout(Duration value) {
            this.shutdownTimeout = requirePositive(value, "shutdownTimeout");
            return this;
        }

        public Builder autoReconnect(boolean value) {
            this.autoReconnect = value;
            return this;
        }

        public Builder maxReconnectAttempts(int value) {
            this.maxReconnectAttempts = value;
            return this;
        }

        public Builder reconnectBaseDelay(Duration value) {
            this.reconnectBaseDelay = Objects.requireNonNull(value, "reconnectBaseDelay");
            return this;
        }

        public Builder reconnectMaxDelay(Duration value) {
            this.reconnectMaxDelay = Objects.requireNonNull(value, "reconnectMaxDelay");
            return this;
        }

        public Builder heartbeatInterval(Duration value) {
            this.heartbeatInterval = Objects.requireNonNull(value, "heartbeatInterval");
            return this;
        }

        public Builder clientInfo(String name, String version) {
            this.clientName = name;
            this.clientVersion = version;
            return this;
        }

        public Builder workspaceRoot(String value) {
            this.workspaceRoot = value;
            return this;
        }

        public LspClientOptions build() {
            if (connectionType == ConnectionType.STDIO && command.isEmpty()) {
                throw new IllegalArgumentException("A stdio connection needs a command");
            }
            if (connectionType != ConnectionType.STDIO && (host == null || host.isEmpty())) {
                throw new IllegalArgumentException("A " + connectionType.id() + " connection needs a host");
            }
            if (connectionType != ConnectionType.STDIO && (port <= 0 || port > 65535)) {
                throw new IllegalArgumentException("Invalid port: " + port);
            }
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException("maxReconnectAttempts must not be negative");
            }
            return new LspClientOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
