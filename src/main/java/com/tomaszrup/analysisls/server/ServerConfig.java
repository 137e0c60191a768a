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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.tomaszrup.analysisls.LspClientOptions;
import com.tomaszrup.analysisls.transport.ConnectionType;

/**
 * Configuration of one managed analysis server, keyed by its name.
 *
 * <p>Persisted as JSON with snake_case keys
 * ({@code name, command, working_directory, environment, connection_type,
 * host, port, auto_start, auto_restart, max_restart_attempts,
 * health_check_interval, startup_timeout, shutdown_timeout}); the three
 * durations are stored in seconds.</p>
 */
public class ServerConfig {

    private String name;
    private List<String> command = new ArrayList<>();
    private String workingDirectory;
    private Map<String, String> environment = new LinkedHashMap<>();
    private ConnectionType connectionType = ConnectionType.STDIO;
    private String host = "localhost";
    private int port = 8080;
    private boolean autoStart = true;
    private boolean autoRestart = true;
    private int maxRestartAttempts = 3;
    private double healthCheckInterval = 30.0;
    private double startupTimeout = 60.0;
    private double shutdownTimeout = 30.0;

    public ServerConfig() {
    }

    public ServerConfig(String name, List<String> command) {
        this.name = name;
        setCommand(command);
    }

    public ServerConfig copy() {
        ServerConfig copy = new ServerConfig(name, command);
        copy.workingDirectory = workingDirectory;
        copy.setEnvironment(environment);
        copy.connectionType = connectionType;
        copy.host = host;
        copy.port = port;
        copy.autoStart = autoStart;
        copy.autoRestart = autoRestart;
        copy.maxRestartAttempts = maxRestartAttempts;
        copy.healthCheckInterval = healthCheckInterval;
        copy.startupTimeout = startupTimeout;
        copy.shutdownTimeout = shutdownTimeout;
        return copy;
    }

    /**
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Server name must not be empty");
        }
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Server name must be usable as a file name: " + name);
        }
        if (connectionType == null) {
            throw new IllegalArgumentException("Server " + name + " has no connection type");
        }
        if (connectionType == ConnectionType.STDIO && (command == null || command.isEmpty())) {
            throw new IllegalArgumentException("Server " + name + " needs a command for a stdio connection");
        }
        if (connectionType != ConnectionType.STDIO && (port <= 0 || port > 65535)) {
            throw new IllegalArgumentException("Server " + name + " has an invalid port: " + port);
        }
        if (maxRestartAttempts < 0) {
            throw new IllegalArgumentException("max_restart_attempts must not be negative");
        }
        if (healthCheckInterval <= 0 || startupTimeout <= 0 || shutdownTimeout < 0) {
            throw new IllegalArgumentException("Server " + name + " has an invalid interval or timeout");
        }
    }

    /** Options for the client that talks to this server. */
    public LspClientOptions toClientOptions() {
        LspClientOptions.Builder builder = LspClientOptions.builder(connectionType)
                .command(command)
                .workingDirectory(workingDirectory)
                .environment(environment)
                .host(host)
                .port(port)
                .autoReconnect(autoRestart)
                .workspaceRoot(workingDirectory);
        if (shutdownTimeout > 0) {
            builder.shutdownTimeout(getShutdownTimeout());
        }
        return builder.build();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getCommand() {
        return command != null ? Collections.unmodifiableList(command) : Collections.emptyList();
    }

    public void setCommand(List<String> command) {
        this.command = command != null ? new ArrayList<>(command) : new ArrayList<>();
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public Map<String, String> getEnvironment() {
        return environment != null ? Collections.unmodifiableMap(environment) : Collections.emptyMap();
    }

    public void setEnvironment(Map<String, String> environment) {
        this.environment = environment != null ? new LinkedHashMap<>(environment) : new LinkedHashMap<>();
    }

    public ConnectionType getConnectionType() {
        return connectionType;
    }

    public void setConnectionType(ConnectionType connectionType) {
        this.connectionType = connectionType;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isAutoRestart() {
        return autoRestart;
    }

    public void setAutoRestart(boolean autoRestart) {
        this.autoRestart = autoRestart;
    }

    public int getMaxRestartAttempts() {
        return maxRestartAttempts;
    }

    public void setMaxRestartAttempts(int maxRestartAttempts) {
        this.maxRestartAttempts = maxRestartAttempts;
    }

    public Duration getHealthCheckInterval() {
        return toDuration(healthCheckInterval);
    }

    public void setHealthCheckInterval(Duration value) {
        this.healthCheckInterval = toSeconds(value);
    }

    public Duration getStartupTimeout() {
        return toDuration(startupTimeout);
    }

    public void setStartupTimeout(Duration value) {
        this.startupTimeout = toSeconds(value);
    }

    public Duration getShutdownTimeout() {
        return toDuration(shutdownTimeout);
    }

    public void setShutdownTimeout(Duration value) {
        this.shutdownTimeout = toSeconds(value);
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    private static double toSeconds(Duration value) {
        return value.toMillis() / 1000.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerConfig)) {
            return false;
        }
        ServerConfig other = (ServerConfig) o;
        return Objects.equals(name, other.name) && getCommand().equals(other.getCommand())
                && Objects.equals(workingDirectory, other.workingDirectory)
                && getEnvironment().equals(other.getEnvironment()) && connectionType == other.connectionType
                && Objects.equals(host, other.host) && port == other.port && autoStart == other.autoStart
                && autoRestart == other.autoRestart && maxRestartAttempts == other.maxRestartAttempts
                && Double.compare(healthCheckInterval, other.healthCheckInterval) == 0
                && Double.compare(startupTimeout, other.startupTimeout) == 0
                && Double.compare(shutdownTimeout, other.shutdownTimeout) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getCommand(), workingDirectory, connectionType, host, port);
    }

    @Override
    public String toString() {
        return "ServerConfig [name=" + name + ", connectionType=" + connectionType + ", command=" + command
                + ", host=" + host + ", port=" + port + "]";
    }
}
