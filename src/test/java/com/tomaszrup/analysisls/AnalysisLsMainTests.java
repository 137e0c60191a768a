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
package com.tomaszrup.analysisls;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tomaszrup.analysisls.protocol.Protocol;
import com.tomaszrup.analysisls.server.ServerConfig;
import com.tomaszrup.analysisls.server.ServerConfigStore;
import com.tomaszrup.analysisls.server.ServerManager;
import com.tomaszrup.analysisls.transport.ConnectionType;

class AnalysisLsMainTests {

	@TempDir
	Path configDir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();
	private ExecutorPools pools;
	private ScriptedTransport transport;
	private AnalysisLsMain main;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools();
		transport = new ScriptedTransport();
		main = new AnalysisLsMain(new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8),
				dir -> new ServerManager(dir, pools, config -> new LspClient(
						config.toClientOptions().toBuilder().heartbeatInterval(Duration.ZERO).build(),
						pools, opts -> transport), null));
	}

	@AfterEach
	void tearDown() {
		pools.shutdownAll();
	}

	private int run(String... args) {
		return main.run(args);
	}

	private String stdout() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr() {
		return err.toString(StandardCharsets.UTF_8);
	}

	private void registerTcpServer(String name) throws IOException {
		ServerConfig config = new ServerConfig(name, List.of());
		config.setConnectionType(ConnectionType.TCP);
		config.setHost("127.0.0.1");
		config.setPort(7000);
		new ServerConfigStore(configDir).save(config);
	}

	// ------------------------------------------------------------------
	// Usage
	// ------------------------------------------------------------------

	@Test
	void testUsageErrors() {
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run());
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run("frobnicate"));
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run("--config-dir"));
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run("--color", "always", "list"));
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run("--log-level", "chatty", "list"));
		Assertions.assertEquals(AnalysisLsMain.EXIT_USAGE, run("check"));
		Assertions.assertTrue(stderr().contains(AnalysisLsMain.USAGE));
	}

	// ------------------------------------------------------------------
	// list / discover
	// ------------------------------------------------------------------

	@Test
	void testListEmptyDirectory() {
		Assertions.assertEquals(AnalysisLsMain.EXIT_OK, run("--config-dir", configDir.toString(), "list"));
		Assertions.assertTrue(stdout().startsWith("No servers registered in "));
	}

	@Test
	void testListRegisteredServers() throws IOException {
		registerTcpServer("remote");
		new ServerConfigStore(configDir).save(new ServerConfig("local", List.of("/opt/bin/serena", "--stdio")));

		Assertions.assertEquals(AnalysisLsMain.EXIT_OK, run("--config-dir", configDir.toString(), "list"));
		String[] lines = stdout().trim().split("\\R");
		Assertions.assertEquals("local\tstopped\tstdio\t/opt/bin/serena --stdio", lines[0]);
		Assertions.assertEquals("remote\tstopped\ttcp\t127.0.0.1:7000", lines[1]);
	}

	@Test
	void testDiscoverPrintsJson() throws IOException {
		Path bin = Files.createDirectories(configDir.resolve("bin"));
		Path server = Files.writeString(bin.resolve("serena"), "#!/bin/sh\n");
		Assertions.assertTrue(server.toFile().setExecutable(true));

		Assertions.assertEquals(AnalysisLsMain.EXIT_OK, run("discover", bin.toString()));
		JsonArray found = JsonParser.parseString(stdout()).getAsJsonArray();
		Assertions.assertEquals(1, found.size());
		JsonObject config = found.get(0).getAsJsonObject();
		Assertions.assertEquals("discovered_serena", config.get("name").getAsString());
		Assertions.assertEquals("stdio", config.get("connection_type").getAsString());
	}

	// ------------------------------------------------------------------
	// check
	// ------------------------------------------------------------------

	@Test
	void testCheckUnknownServer() {
		Assertions.assertEquals(AnalysisLsMain.EXIT_FAILURE,
				run("--config-dir", configDir.toString(), "check", "ghost"));
		Assertions.assertTrue(stderr().contains("Unknown server: ghost"));
	}

	@Test
	void testCheckReportsStartFailure() throws IOException {
		registerTcpServer("remote");
		transport.failingConnect();

		Assertions.assertEquals(AnalysisLsMain.EXIT_FAILURE,
				run("--config-dir", configDir.toString(), "check", "remote"));
		Assertions.assertTrue(stderr().contains("Failed to start remote: Failed to connect to server"));
	}

	@Test
	void testCheckPrintsComprehensiveErrors() throws IOException {
		registerTcpServer("remote");
		transport.respond(Protocol.REQUEST_GET_COMPREHENSIVE_ERRORS, request -> JsonParser.parseString(
				"{\"diagnostics\":{\"file:///w/a.py\":[{\"message\":\"undefined name\",\"severity\":1}]}}"));

		Assertions.assertEquals(AnalysisLsMain.EXIT_OK, run("--config-dir", configDir.toString(), "check", "remote"));
		JsonObject result = JsonParser.parseString(stdout()).getAsJsonObject();
		Assertions.assertEquals(1, result.getAsJsonArray("errors").size());
		Assertions.assertTrue(transport.getSentMethods().contains(Protocol.SHUTDOWN), "Server is stopped afterwards");
	}
}
