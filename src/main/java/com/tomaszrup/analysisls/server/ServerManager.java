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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;
import java.util.function.Supplier;

import com.tomaszrup.analysisls.ExecutorPools;
import com.tomaszrup.analysisls.LspClient;
import com.tomaszrup.analysisls.TransportFactory;
import com.tomaszrup.analysisls.util.MdcServerContext;
import com.tomaszrup.analysisls.util.Throwables;

/**
 * Registry and lifecycle owner of named analysis servers.
 *
 * <p>Each server moves through {@link ServerStatus}: {@code start} goes
 * STOPPED/ERROR → STARTING → RUNNING (or ERROR), {@code stop} goes
 * → STOPPING → STOPPED. Lifecycle operations on one server are serialized
 * on its {@link ServerInfo}; different servers proceed independently.</p>
 *
 * <h3>Health monitoring</h3>
 * While a server is RUNNING a one-shot task is scheduled every
 * {@code health_check_interval}. A failed probe restarts the server when
 * {@code auto_restart} is on and fewer than {@code max_restart_attempts}
 * restarts have been made; otherwise the server goes to ERROR and the
 * monitor ends. {@link #stop} cancels the monitor before shutting down, and
 * a probe that was already running finishes first.
 *
 * <h3>Persistence</h3>
 * Registered configurations live in a {@link ServerConfigStore} and are
 * loaded when the manager is created.
 */
public class ServerManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServerManager.class);

    static final Duration DEFAULT_RESTART_DELAY = Duration.ofSeconds(2);
    static final Duration FORCE_KILL_GRACE = Duration.ofSeconds(5);

    private final ServerConfigStore store;
    private final ExecutorPools pools;
    private final boolean ownsPools;
    private final Function<ServerConfig, LspClient> clientFactory;
    private final HealthProbe healthProbe;
    private final Clock clock;

    private final Map<String, ServerInfo> servers = new ConcurrentHashMap<>();
    private final List<ServerStatusListener> statusListeners = new CopyOnWriteArrayList<>();
    private volatile Duration restartDelay = DEFAULT_RESTART_DELAY;

    public ServerManager(Path configDirectory) {
        this(new ServerConfigStore(configDirectory), new ExecutorPools(), true, null, HealthProbe.DEFAULT,
                Clock.systemUTC());
    }

    /**
     * @param clientFactory creates the client for a configuration; {@code null}
     *                      builds one from {@link ServerConfig#toClientOptions()}
     *                      on the shared pools
     */
    public ServerManager(Path configDirectory, ExecutorPools pools,
                         Function<ServerConfig, LspClient> clientFactory, HealthProbe healthProbe) {
        this(new ServerConfigStore(configDirectory), pools, false, clientFactory, healthProbe, Clock.systemUTC());
    }

    ServerManager(ServerConfigStore store, ExecutorPools pools, boolean ownsPools,
                  Function<ServerConfig, LspClient> clientFactory, HealthProbe healthProbe, Clock clock) {
        this.store = store;
        this.pools = pools;
        this.ownsPools = ownsPools;
        this.clientFactory = clientFactory != null
                ? clientFactory
                : config -> new LspClient(config.toClientOptions(), this.pools, TransportFactory.DEFAULT);
        this.healthProbe = healthProbe != null ? healthProbe : HealthProbe.DEFAULT;
        this.clock = clock;

        for (ServerConfig config : store.loadAll()) {
            servers.put(config.getName(), new ServerInfo(config));
        }
    }

    // ---- Registry ----

    /**
     * Register (or replace) a server configuration and persist it.
     * A server that is not stopped cannot be replaced.
     *
     * @return {@code false} if the configuration is invalid, the existing
     *         server is active, or the file could not be written
     */
    public boolean register(ServerConfig config) {
        ServerConfig copy = config.copy();
        try {
            copy.validate();
        } catch (IllegalArgumentException e) {
            logger.error("Cannot register server: {}", e.getMessage());
            return false;
        }
        String name = copy.getName();
        ServerInfo existing = servers.get(name);
        if (existing != null && existing.getStatus() != ServerStatus.STOPPED) {
            logger.warn("Cannot re-register server {} while it is {}", name, existing.getStatus().id());
            return false;
        }
        try {
            store.save(copy);
        } catch (IOException e) {
            logger.error("Failed to persist configuration of server {}: {}", name, e.getMessage());
            return false;
        }
        servers.put(name, new ServerInfo(copy));
        logger.info("Registered server {}", name);
        return true;
    }

    /** Stop the server if needed, then forget it and delete its file. */
    public boolean unregister(String name) {
        ServerInfo info = servers.get(name);
        if (info == null) {
            logger.warn("Server not found: {}", name);
            return false;
        }
        stop(name);
        servers.remove(name, info);
        store.delete(name);
        logger.info("Unregistered server {}", name);
        return true;
    }

    public Optional<ServerInfo> getServerInfo(String name) {
        return Optional.ofNullable(servers.get(name));
    }

    /** Snapshot of all registered servers, ordered by name. */
    public Map<String, ServerInfo> getAllServers() {
        return Collections.unmodifiableMap(new TreeMap<>(servers));
    }

    public Map<String, ServerInfo> getRunningServers() {
        Map<String, ServerInfo> running = new TreeMap<>();
        servers.forEach((name, info) -> {
            if (info.getStatus() == ServerStatus.RUNNING) {
                running.put(name, info);
            }
        });
        return Collections.unmodifiableMap(running);
    }

    /** The client of a running server. */
    public Optional<LspClient> getServerClient(String name) {
        ServerInfo info = servers.get(name);
        if (info == null || info.getStatus() != ServerStatus.RUNNING) {
            return Optional.empty();
        }
        return info.getClient();
    }

    public List<ServerConfig> discover(List<Path> searchPaths) {
        return ServerDiscovery.discover(searchPaths);
    }

    public Path getConfigDirectory() {
        return store.getDirectory();
    }

    public void addStatusListener(ServerStatusListener listener) {
        statusListeners.add(listener);
    }

    public void removeStatusListener(ServerStatusListener listener) {
        statusListeners.remove(listener);
    }

    /** Pause between the stop and start halves of a restart. */
    public void setRestartDelay(Duration restartDelay) {
        this.restartDelay = Objects.requireNonNull(restartDelay, "restartDelay");
    }

    // ---- Lifecycle ----

    /**
     * Start a server and wait for its client to become ready, bounded by
     * {@code startup_timeout}. Starting a running server is a no-op success.
     */
    public boolean start(String name) {
        ServerInfo info = servers.get(name);
        if (info == null) {
            logger.error("Server not found: {}", name);
            return false;
        }
        return withServer(name, () -> {
            synchronized (info) {
                return startInternal(info, true);
            }
        });
    }

    /**
     * Stop a server, bounded by {@code shutdown_timeout}. When the client
     * does not finish in time, the process is terminated and then killed.
     * Either way the server ends STOPPED. Stopping a stopped server is a
     * no-op success.
     */
    public boolean stop(String name) {
        ServerInfo info = servers.get(name);
        if (info == null) {
            logger.error("Server not found: {}", name);
            return false;
        }
        return withServer(name, () -> {
            synchronized (info) {
                return stopInternal(info);
            }
        });
    }

    /**
     * Stop, wait for the restart delay, start. The restart count grows by
     * one whether or not the start succeeds.
     */
    public boolean restart(String name) {
        ServerInfo info = servers.get(name);
        if (info == null) {
            logger.error("Server not found: {}", name);
            return false;
        }
        return withServer(name, () -> {
            synchronized (info) {
                return restartInternal(info);
            }
        });
    }

    /** Start every server whose configuration has {@code auto_start}. */
    public Map<String, Boolean> startAll() {
        Map<String, Boolean> results = new TreeMap<>();
        for (ServerInfo info : new TreeMap<>(servers).values()) {
            if (info.config().isAutoStart()) {
                results.put(info.getName(), start(info.getName()));
            }
        }
        return results;
    }

    public Map<String, Boolean> stopAll() {
        Map<String, Boolean> results = new TreeMap<>();
        for (String name : new TreeSet<>(servers.keySet())) {
            results.put(name, stop(name));
        }
        return results;
    }

    @Override
    public void close() {
        stopAll();
        if (ownsPools) {
            pools.shutdownAll();
        }
    }

    // ---- Internals (caller holds the ServerInfo monitor) ----

    private boolean startInternal(ServerInfo info, boolean resetRestartCount) {
        String name = info.getName();
        if (info.getStatus() == ServerStatus.RUNNING) {
            logger.info("Server {} is already running", name);
            return true;
        }
        ServerConfig config = info.config();
        releaseClient(info);
        transition(info, ServerStatus.STARTING);
        logger.info("Starting server {}", name);

        LspClient client;
        try {
            client = clientFactory.apply(config);
        } catch (RuntimeException e) {
            logger.debug("Client creation failed for server {}", name, e);
            return failStart(info, null, messageOf(e));
        }
        info.setClient(client);

        Callable<Boolean> connectTask = client::connect;
        Future<Boolean> connecting = pools.getIoPool().submit(connectTask);
        boolean connected;
        try {
            connected = connecting.get(config.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            connecting.cancel(true);
            return failStart(info, client, "Server startup timeout");
        } catch (ExecutionException e) {
            Throwable cause = Throwables.unwrap(e);
            logger.debug("Connect failed for server {}", name, cause);
            return failStart(info, client, messageOf(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connecting.cancel(true);
            return failStart(info, client, "Interrupted while starting");
        }
        if (!connected) {
            return failStart(info, client, "Failed to connect to server");
        }

        info.setProcess(client.getProcess().orElse(null));
        info.setStartTime(clock.instant());
        info.setLastHealthCheck(null);
        info.setErrorMessage(null);
        info.setLastStopForced(false);
        if (resetRestartCount) {
            info.setRestartCount(0);
        }
        transition(info, ServerStatus.RUNNING);
        startHealthMonitor(info);
        logger.info("Server {} is running", name);
        return true;
    }

    private boolean failStart(ServerInfo info, LspClient client, String message) {
        if (client != null) {
            info.setClient(client);
        }
        releaseClient(info);
        info.setErrorMessage(message);
        transition(info, ServerStatus.ERROR);
        logger.error("Failed to start server {}: {}", info.getName(), message);
        return false;
    }

    /**
     * Drops whatever client the server still holds without the shutdown
     * handshake, and terminates its process.
     */
    private void releaseClient(ServerInfo info) {
        LspClient client = info.getClient().orElse(null);
        Optional<ProcessHandle> process = info.getProcess();
        info.setClient(null);
        info.setProcess(null);
        info.setStartTime(null);
        if (client == null) {
            return;
        }
        client.abort();
        // close() may wait for an in-flight connect; keep it off this thread
        try {
            pools.getIoPool().execute(() -> {
                client.close();
                process.ifPresent(p -> ProcessTerminator.terminate(p, FORCE_KILL_GRACE));
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Client of server {} not closed: pools are shut down", info.getName());
        }
    }

    private boolean stopInternal(ServerInfo info) {
        String name = info.getName();
        if (info.getStatus() == ServerStatus.STOPPED) {
            logger.info("Server {} is already stopped", name);
            return true;
        }
        cancelHealthMonitor(info);
        transition(info, ServerStatus.STOPPING);
        logger.info("Stopping server {}", name);

        boolean forced = false;
        LspClient client = info.getClient().orElse(null);
        if (client != null) {
            Duration timeout = info.config().getShutdownTimeout();
            Future<?> closing = pools.getIoPool().submit(client::close);
            try {
                closing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.error("Server {} did not shut down within {} ms, terminating it", name, timeout.toMillis());
                forced = true;
            } catch (ExecutionException e) {
                logger.warn("Error while stopping server {}: {}", name, Throwables.summarize(Throwables.unwrap(e)));
                forced = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                forced = true;
            }
            if (forced) {
                forceStop(info, client);
            }
        }

        info.setClient(null);
        info.setProcess(null);
        info.setStartTime(null);
        info.setLastHealthCheck(null);
        info.setErrorMessage(null);
        info.setLastStopForced(forced);
        transition(info, ServerStatus.STOPPED);
        logger.info("Server {} stopped{}", name, forced ? " (forced)" : "");
        return true;
    }

    private void forceStop(ServerInfo info, LspClient client) {
        Optional<ProcessHandle> process = client.getProcess();
        if (process.isEmpty()) {
            process = info.getProcess();
        }
        process.ifPresent(p -> {
            if (!ProcessTerminator.terminate(p, FORCE_KILL_GRACE)) {
                logger.error("Process {} of server {} survived termination", p.pid(), info.getName());
            }
        });
        client.abort();
    }

    private boolean restartInternal(ServerInfo info) {
        String name = info.getName();
        logger.info("Restarting server {}", name);
        int previousCount = info.getRestartCount();
        if (!stopInternal(info)) {
            logger.error("Restart of server {} aborted: stop failed", name);
            return false;
        }
        if (!restartDelay.isZero()) {
            try {
                Thread.sleep(restartDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Restart of server {} interrupted", name);
                return false;
            }
        }
        boolean started = startInternal(info, false);
        info.setRestartCount(previousCount + 1);
        return started;
    }

    private void transition(ServerInfo info, ServerStatus next) {
        ServerStatus previous = info.getStatus();
        info.setStatus(next);
        logger.debug("Server {}: {} -> {}", info.getName(), previous.id(), next.id());
        for (ServerStatusListener listener : statusListeners) {
            try {
                listener.onStatusChanged(info.getName(), previous, next);
            } catch (RuntimeException e) {
                logger.error("Status listener failed for server {}: {}", info.getName(), e.getMessage(), e);
            }
        }
    }

    // ---- Health monitor ----

    private void startHealthMonitor(ServerInfo info) {
        cancelHealthMonitor(info);
        scheduleHealthCheck(info, info.nextMonitorGeneration());
    }

    private void cancelHealthMonitor(ServerInfo info) {
        Future<?> monitor = info.getHealthMonitor();
        if (monitor != null) {
            monitor.cancel(false);
            info.setHealthMonitor(null);
        }
        info.nextMonitorGeneration();
    }

    private void scheduleHealthCheck(ServerInfo info, long generation) {
        long delay = info.config().getHealthCheckInterval().toMillis();
        try {
            info.setHealthMonitor(pools.getSchedulingPool().schedule(
                    () -> pools.getIoPool().execute(() -> runHealthCheck(info, generation)),
                    delay, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.debug("Health monitor for server {} not scheduled: pools are shut down", info.getName());
        }
    }

    private void runHealthCheck(ServerInfo info, long generation) {
        withServer(info.getName(), () -> {
            synchronized (info) {
                if (info.getStatus() != ServerStatus.RUNNING || info.getMonitorGeneration() != generation) {
                    return null;
                }
                checkHealth(info, generation);
                return null;
            }
        });
    }

    private void checkHealth(ServerInfo info, long generation) {
        String name = info.getName();
        info.getClient().flatMap(LspClient::getProcess).ifPresent(info::setProcess);
        boolean healthy;
        try {
            healthy = healthProbe.isHealthy(info);
        } catch (RuntimeException e) {
            logger.warn("Health probe for server {} failed: {}", name, Throwables.summarize(e));
            healthy = false;
        }
        info.setLastHealthCheck(clock.instant());
        if (healthy) {
            scheduleHealthCheck(info, generation);
            return;
        }

        ServerConfig config = info.config();
        logger.warn("Health check failed for server {}", name);
        if (config.isAutoRestart() && info.getRestartCount() < config.getMaxRestartAttempts()) {
            logger.info("Auto-restarting server {} (attempt {}/{})", name, info.getRestartCount() + 1,
                    config.getMaxRestartAttempts());
            restartInternal(info);
            return;
        }
        cancelHealthMonitor(info);
        releaseClient(info);
        info.setErrorMessage("Health check failed");
        transition(info, ServerStatus.ERROR);
    }

    // ---- Helpers ----

    private static <T> T withServer(String name, Supplier<T> action) {
        Map<String, String> previous = MdcServerContext.snapshot();
        MdcServerContext.setServer(name);
        try {
            return action.get();
        } finally {
            MdcServerContext.restore(previous);
        }
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : Throwables.summarize(t);
    }
}
