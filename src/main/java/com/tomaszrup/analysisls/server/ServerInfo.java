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
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;

import com.tomaszrup.analysisls.LspClient;

/**
 * Runtime record of one registered server. Only {@link ServerManager}
 * mutates it; callers get a live, read-only view.
 */
public class ServerInfo {

    private final ServerConfig config;
    private volatile ServerStatus status = ServerStatus.STOPPED;
    private volatile LspClient client;
    private volatile ProcessHandle process;
    private volatile Instant startTime;
    private volatile Instant lastHealthCheck;
    private volatile int restartCount;
    private volatile String errorMessage;
    private volatile boolean lastStopForced;

    // guarded by the ServerInfo monitor
    private Future<?> healthMonitor;
    private long monitorGeneration;

    ServerInfo(ServerConfig config) {
        this.config = config;
    }

    public String getName() {
        return config.getName();
    }

    /** A copy of the registered configuration. */
    public ServerConfig getConfig() {
        return config.copy();
    }

    ServerConfig config() {
        return config;
    }

    public ServerStatus getStatus() {
        return status;
    }

    void setStatus(ServerStatus status) {
        this.status = status;
    }

    /** Present while the server is starting or running. */
    public Optional<LspClient> getClient() {
        return Optional.ofNullable(client);
    }

    void setClient(LspClient client) {
        this.client = client;
    }

    /**
     * The server process. A client that reconnected over stdio runs a new
     * process, so the client's current one wins over the one recorded at
     * start.
     */
    public Optional<ProcessHandle> getProcess() {
        LspClient c = client;
        if (c != null) {
            Optional<ProcessHandle> current = c.getProcess();
            if (current.isPresent()) {
                return current;
            }
        }
        return Optional.ofNullable(process);
    }

    public Optional<Long> getProcessId() {
        return getProcess().map(ProcessHandle::pid);
    }

    void setProcess(ProcessHandle process) {
        this.process = process;
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Optional<Duration> getUptime() {
        Instant started = startTime;
        return started != null ? Optional.of(Duration.between(started, Instant.now())) : Optional.empty();
    }

    public Optional<Instant> getLastHealthCheck() {
        return Optional.ofNullable(lastHealthCheck);
    }

    void setLastHealthCheck(Instant lastHealthCheck) {
        this.lastHealthCheck = lastHealthCheck;
    }

    public int getRestartCount() {
        return restartCount;
    }

    void setRestartCount(int restartCount) {
        this.restartCount = restartCount;
    }

    /** Why the last start, stop or health check failed, or {@code null}. */
    public String getErrorMessage() {
        return errorMessage;
    }

    void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    /** Whether the last stop had to terminate the process. */
    public boolean isLastStopForced() {
        return lastStopForced;
    }

    void setLastStopForced(boolean lastStopForced) {
        this.lastStopForced = lastStopForced;
    }

    public boolean isHealthy() {
        LspClient c = client;
        return status == ServerStatus.RUNNING && c != null && c.isConnected();
    }

    Future<?> getHealthMonitor() {
        return healthMonitor;
    }

    void setHealthMonitor(Future<?> healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    long getMonitorGeneration() {
        return monitorGeneration;
    }

    long nextMonitorGeneration() {
        return ++monitorGeneration;
    }

    @Override
    public String toString() {
        return "ServerInfo [name=" + getName() + ", status=" + status + ", restartCount=" + restartCount
                + (errorMessage != null ? ", error=" + errorMessage : "") + "]";
    }
}
