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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.analysisls.server;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.analysisls.ClientState;
import com.tomaszrup.analysisls.ExecutorPools;
import com.tomaszrup.analysisls.LspClient;
import com.tomaszrup.analysisls.ScriptedTransport;
import com.tomaszrup.analysisls.protocol.Protocol;
import com.tomaszrup.analysisls.transport.ConnectionType;

/**
 * Tests for {@link ServerManager} with clients wired to scripted in-memory
 * servers.
 */
class ServerManagerTests {

	@TempDir
	Path configDir;

	private ExecutorPools pools;
	private ServerManager manager;
	private final List<ScriptedTransport> transports = new CopyOnWriteArrayList<>();
	private volatile Supplier<ScriptedTransport> transportSupplier = ScriptedTransport::new;
	private volatile Duration clientShutdownTimeout;
	private volatile HealthProbe probe = HealthProbe.DEFAULT;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools();
		manager = newManager();
		manager.setRestartDelay(Duration.ZERO);
	}

	@AfterEach
	void tearDown() {
		manager.close();
		pools.shutdownAll();
	}

	private ServerManager newManager() {
		return new ServerManager(configDir, pools, this::createClient, info -> probe.isHealthy(info));
	}

	private LspClient createClient(ServerConfig config) {
		var options = config.toClientOptions().toBuilder()
				.heartbeatInterval(Duration.ZERO)
				.reconnectBaseDelay(Duration.ofMillis(20));
		if (clientShutdownTimeout != null) {
			options.shutdownTimeout(clientShutdownTimeout);
		}
		return new LspClient(options.build(), pools, opts -> {
			ScriptedTransport transport = transportSupplier.get();
			transports.add(transport);
			return transport;
		});
	}

	private static ServerConfig tcpConfig(String name) {
		ServerConfig config = new ServerConfig(name, List.of());
		config.setConnectionType(ConnectionType.TCP);
		config.setPort(7000);
		config.setStartupTimeout(Duration.ofSeconds(5));
		config.setShutdownTimeout(Duration.ofSeconds(5));
		return config;
	}

	private static void await(BooleanSupplier condition, String message) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				Assertions.fail(message);
			}
			Thread.sleep(10);
		}
	}

	// ------------------------------------------------------------------
	// Registry
	// ------------------------------------------------------------------

	@Test
	void testRegisterPersistsAcrossManagers() {
		ServerConfig config = tcpConfig("alpha");
		config.setMaxRestartAttempts(7);
		Assertions.assertTrue(manager.register(config));
		Assertions.assertTrue(Files.isRegularFile(configDir.resolve("alpha.json")));

		try (ServerManager reloaded = newManager()) {
			ServerInfo info = reloaded.getServerInfo("alpha").orElseThrow();
			Assertions.assertEquals(ServerStatus.STOPPED, info.getStatus());
			Assertions.assertEquals(config, info.getConfig());
			Assertions.assertEquals(7, info.getConfig().getMaxRestartAttempts());
		}
	}

	@Test
	void testRegisterRejectsInvalidConfig() {
		Assertions.assertFalse(manager.register(new ServerConfig("no-command", List.of())));
		Assertions.assertFalse(manager.register(new ServerConfig("../escape", List.of("server"))));
		Assertions.assertTrue(manager.getAllServers().isEmpty());
	}

	@Test
	void testRegisteredConfigIsCopied() {
		ServerConfig config = tcpConfig("alpha");
		manager.register(config);
		config.setPort(1);
		Assertions.assertEquals(7000, manager.getServerInfo("alpha").orElseThrow().getConfig().getPort());
	}

	@Test
	void testCannotReplaceRunningServer() {
		manager.register(tcpConfig("alpha"));
		Assertions.assertTrue(manager.start("alpha"));
		Assertions.assertFalse(manager.register(tcpConfig("alpha")));
		Assertions.assertTrue(manager.stop("alpha"));
		Assertions.assertTrue(manager.register(tcpConfig("alpha")));
	}

	@Test
	void testUnregisterStopsAndDeletes() {
		manager.register(tcpConfig("alpha"));
		manager.start("alpha");
		Assertions.assertTrue(manager.unregister("alpha"));

		Assertions.assertFalse(manager.getServerInfo("alpha").isPresent());
		Assertions.assertFalse(Files.exists(configDir.resolve("alpha.json")));
		Assertions.assertTrue(transports.get(0).getSentMethods().contains(Protocol.SHUTDOWN));
		Assertions.assertFalse(manager.unregister("alpha"));
	}

	@Test
	void testUnknownServerOperationsFail() {
		Assertions.assertFalse(manager.start("ghost"));
		Assertions.assertFalse(manager.stop("ghost"));
		Assertions.assertFalse(manager.restart("ghost"));
		Assertions.assertFalse(manager.getServerClient("ghost").isPresent());
	}

	// ------------------------------------------------------------------
	// Start and stop
	// ------------------------------------------------------------------

	@Test
	void testStartAndStop() {
		List<String> changes = new CopyOnWriteArrayList<>();
		manager.addStatusListener((name, previous, current) -> changes.add(previous.id() + ">" + current.id()));
		manager.register(tcpConfig("alpha"));

		Assertions.assertTrue(manager.start("alpha"));
		ServerInfo info = manager.getServerInfo("alpha").orElseThrow();
		Assertions.assertEquals(ServerStatus.RUNNING, info.getStatus());
		Assertions.assertTrue(info.getStartTime().isPresent());
		Assertions.assertTrue(manager.getServerClient("alpha").orElseThrow().isConnected());
		Assertions.assertEquals(List.of("alpha"), List.copyOf(manager.getRunningServers().keySet()));
		Assertions.assertTrue(manager.start("alpha"), "Starting a running server succeeds");
		Assertions.assertEquals(1, transports.size());

		Assertions.assertTrue(manager.stop("alpha"));
		Assertions.assertEquals(ServerStatus.STOPPED, info.getStatus());
		Assertions.assertFalse(info.getClient().isPresent());
		Assertions.assertFalse(info.isLastStopForced());
		Assertions.assertTrue(manager.stop("alpha"), "Stopping a stopped server succeeds");
		Assertions.assertEquals(List.of("stopped>starting", "starting>running", "running>stopping", "stopping>stopped"),
				changes);
	}

	@Test
	void testStartFailureRecordsError() {
		transportSupplier = () -> new ScriptedTransport().failingConnect();
		manager.register(tcpConfig("alpha"));

		Assertions.assertFalse(manager.start("alpha"));
		ServerInfo info = manager.getServerInfo("alpha").orElseThrow();
		Assertions.assertEquals(ServerStatus.ERROR, info.getStatus());
		Assertions.assertEquals("Failed to connect to server", info.getErrorMessage());
		Assertions.assertFalse(info.getClient().isPresent());
		Assertions.assertFalse(manager.getServerClient("alpha").isPresent());

		transportSupplier = ScriptedTransport::new;
		Assertions.assertTrue(manager.start("alpha"), "A server in error can be started again");
		Assertions.assertNull(info.getErrorMessage());
	}

	@Test
	void testStartupTimeout() {
		transportSupplier = () -> new ScriptedTransport().silent(Protocol.INITIALIZE);
		ServerConfig config = tcpConfig("slow");
		config.setStartupTimeout(Duration.ofMillis(300));
		manager.register(config);

		long started = System.nanoTime();
		Assertions.assertFalse(manager.start("slow"));
		Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(4)) < 0);
		ServerInfo info = manager.getServerInfo("slow").orElseThrow();
		Assertions.assertEquals(ServerStatus.ERROR, info.getStatus());
		Assertions.assertEquals("Server startup timeout", info.getErrorMessage());
	}

	@Test
	void testStopForcedWhenShutdownHangs() {
		transportSupplier = () -> new ScriptedTransport().silent(Protocol.SHUTDOWN);
		clientShutdownTimeout = Duration.ofSeconds(5);
		ServerConfig config = tcpConfig("stuck");
		config.setShutdownTimeout(Duration.ofMillis(300));
		manager.register(config);
		manager.start("stuck");

		long started = System.nanoTime();
		Assertions.assertTrue(manager.stop("stuck"));
		Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(4)) < 0,
				"Stop must not wait for the client's own shutdown timeout");
		ServerInfo info = manager.getServerInfo("stuck").orElseThrow();
		Assertions.assertEquals(ServerStatus.STOPPED, info.getStatus());
		Assertions.assertTrue(info.isLastStopForced());
	}

	@Test
	void testRestartCountsAttempts() {
		manager.register(tcpConfig("alpha"));
		manager.start("alpha");
		Assertions.assertTrue(manager.restart("alpha"));
		Assertions.assertTrue(manager.restart("alpha"));

		ServerInfo info = manager.getServerInfo("alpha").orElseThrow();
		Assertions.assertEquals(ServerStatus.RUNNING, info.getStatus());
		Assertions.assertEquals(2, info.getRestartCount());
		Assertions.assertEquals(3, transports.size());

		manager.stop("alpha");
		manager.start("alpha");
		Assertions.assertEquals(0, info.getRestartCount(), "An explicit start resets the count");
	}

	@Test
	void testStartAllHonoursAutoStart() {
		ServerConfig manual = tcpConfig("manual");
		manual.setAutoStart(false);
		manager.register(manual);
		manager.register(tcpConfig("auto"));

		Assertions.assertEquals(List.of("auto"), List.copyOf(manager.startAll().keySet()));
		Assertions.assertEquals(ServerStatus.STOPPED, manager.getServerInfo("manual").orElseThrow().getStatus());

		Assertions.assertEquals(List.of("auto", "manual"), List.copyOf(manager.stopAll().keySet()));
		Assertions.assertTrue(manager.getRunningServers().isEmpty());
	}

	@Test
	void testFailingStatusListenerIsIsolated() {
		AtomicInteger calls = new AtomicInteger();
		manager.addStatusListener((name, previous, current) -> {
			throw new IllegalStateException("listener bug");
		});
		manager.addStatusListener((name, previous, current) -> calls.incrementAndGet());
		manager.register(tcpConfig("alpha"));
		Assertions.assertTrue(manager.start("alpha"));
		Assertions.assertEquals(2, calls.get());
	}

	// ------------------------------------------------------------------
	// Health monitor
	// ------------------------------------------------------------------

	@Test
	void testHealthyServerKeepsRunning() throws InterruptedException {
		ServerConfig config = tcpConfig("alpha");
		config.setHealthCheckInterval(Duration.ofMillis(50));
		manager.register(config);
		manager.start("alpha");

		ServerInfo info = manager.getServerInfo("alpha").orElseThrow();
		await(() -> info.getLastHealthCheck().isPresent(), "Health check never ran");
		Assertions.assertEquals(ServerStatus.RUNNING, info.getStatus());
		Assertions.assertEquals(0, info.getRestartCount());
	}

	@Test
	void testUnhealthyServerRestartsThenFails() throws InterruptedException {
		probe = info -> false;
		ServerConfig config = tcpConfig("flaky");
		config.setHealthCheckInterval(Duration.ofMillis(50));
		config.setMaxRestartAttempts(2);
		manager.register(config);
		manager.start("flaky");

		ServerInfo info = manager.getServerInfo("flaky").orElseThrow();
		await(() -> info.getStatus() == ServerStatus.ERROR, "Server never gave up");
		Assertions.assertEquals(2, info.getRestartCount());
		Assertions.assertEquals("Health check failed", info.getErrorMessage());
		Assertions.assertEquals(3, transports.size());
	}

	@Test
	void testNoAutoRestartGoesStraightToError() throws InterruptedException {
		probe = info -> false;
		ServerConfig config = tcpConfig("fragile");
		config.setHealthCheckInterval(Duration.ofMillis(50));
		config.setAutoRestart(false);
		manager.register(config);
		manager.start("fragile");

		ServerInfo info = manager.getServerInfo("fragile").orElseThrow();
		await(() -> info.getStatus() == ServerStatus.ERROR, "Server never failed");
		Assertions.assertEquals(0, info.getRestartCount());
		Assertions.assertEquals(1, transports.size());
	}

	@Test
	void testDefaultProbeDetectsLostConnection() throws InterruptedException {
		ServerConfig config = tcpConfig("alpha");
		config.setHealthCheckInterval(Duration.ofMillis(50));
		config.setAutoRestart(false);
		manager.register(config);
		manager.start("alpha");

		transports.get(0).drop();
		ServerInfo info = manager.getServerInfo("alpha").orElseThrow();
		await(() -> info.getStatus() == ServerStatus.ERROR, "Lost connection was not detected");
		Assertions.assertFalse(info.isHealthy());
	}

	@Test
	void testHealthFailureReleasesClient() throws InterruptedException {
		probe = info -> false;
		ServerConfig config = tcpConfig("fragile");
		config.setHealthCheckInterval(Duration.ofMillis(50));
		config.setAutoRestart(false);
		manager.register(config);
		manager.start("fragile");

		ServerInfo info = manager.getServerInfo("fragile").orElseThrow();
		LspClient first = info.getClient().orElseThrow();
		await(() -> info.getStatus() == ServerStatus.ERROR, "Server never failed");
		Assertions.assertFalse(info.getClient().isPresent());
		Assertions.assertFalse(info.getStartTime().isPresent());
		await(() -> first.getState() == ClientState.DISCONNECTED, "Client of the failed server is still connected");
		Assertions.assertFalse(transports.get(0).isConnected());
		Assertions.assertTrue(transports.get(0).getDisconnectCount() > 0);

		probe = HealthProbe.DEFAULT;
		Assertions.assertTrue(manager.start("fragile"));
		Assertions.assertEquals(2, transports.size());
		Assertions.assertNotSame(first, info.getClient().orElseThrow());
		Assertions.assertEquals(ClientState.DISCONNECTED, first.getState());
	}

	@Test
	@EnabledOnOs({ OS.LINUX, OS.MAC })
	void testProbeFollowsProcessOfReconnectedClient() throws Exception {
		Process original = new ProcessBuilder("sleep", "30").start();
		Process replacement = new ProcessBuilder("sleep", "30").start();
		try {
			List<Process> processes = List.of(original, replacement);
			AtomicInteger next = new AtomicInteger();
			transportSupplier = () -> new ScriptedTransport()
					.withProcess(processes.get(Math.min(next.getAndIncrement(), 1)).toHandle());
			ServerConfig config = tcpConfig("stdio-like");
			config.setHealthCheckInterval(Duration.ofHours(1));
			manager.register(config);
			Assertions.assertTrue(manager.start("stdio-like"));

			ServerInfo info = manager.getServerInfo("stdio-like").orElseThrow();
			Assertions.assertEquals(original.pid(), info.getProcessId().orElseThrow());

			original.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
			transports.get(0).drop();
			LspClient client = info.getClient().orElseThrow();
			await(() -> transports.size() == 2 && client.isConnected(), "Client did not reconnect");

			Assertions.assertEquals(replacement.pid(), info.getProcessId().orElseThrow());
			Assertions.assertTrue(HealthProbe.DEFAULT.isHealthy(info));
			Assertions.assertEquals(ServerStatus.RUNNING, info.getStatus());
		} finally {
			original.destroyForcibly();
			replacement.destroyForcibly();
		}
	}
}
