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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.analysisls.transport.ConnectionType;

class ServerDiscoveryTests {

	@TempDir
	Path dir;

	private static Path executable(Path directory, String name) throws IOException {
		Files.createDirectories(directory);
		Path file = Files.writeString(directory.resolve(name), "#!/bin/sh\n");
		Assertions.assertTrue(file.toFile().setExecutable(true));
		return file;
	}

	private static List<String> names(List<ServerConfig> configs) {
		return configs.stream().map(ServerConfig::getName).collect(Collectors.toList());
	}

	@Test
	void testDiscoversKnownExecutables() throws IOException {
		Path bin = dir.resolve("bin");
		Path server = executable(bin, "serena-lsp-server");
		executable(bin, "serena");
		executable(bin, "unrelated-tool");

		List<ServerConfig> found = ServerDiscovery.discover(List.of(bin));
		Assertions.assertEquals(List.of("discovered_serena-lsp-server", "discovered_serena"), names(found));

		ServerConfig config = found.get(0);
		Assertions.assertEquals(List.of(server.toAbsolutePath().normalize().toString()), config.getCommand());
		Assertions.assertEquals(ConnectionType.STDIO, config.getConnectionType());
		config.validate();
	}

	@Test
	void testFirstDirectoryWins() throws IOException {
		Path first = dir.resolve("first");
		Path second = dir.resolve("second");
		Path winner = executable(first, "serena-server");
		executable(second, "serena-server");
		executable(second, "serena-language-server");

		List<ServerConfig> found = ServerDiscovery.discover(Arrays.asList(first, second));
		Assertions.assertEquals(List.of("discovered_serena-server", "discovered_serena-language-server"), names(found));
		Assertions.assertEquals(winner.toAbsolutePath().normalize().toString(), found.get(0).getCommand().get(0));
	}

	@Test
	void testSkipsNonExecutablesAndMissingDirectories() throws IOException {
		Path bin = dir.resolve("bin");
		Files.createDirectories(bin);
		Path plain = Files.writeString(bin.resolve("serena"), "data");
		plain.toFile().setExecutable(false);
		Files.createDirectories(bin.resolve("serena-server"));

		List<ServerConfig> found = ServerDiscovery.discover(List.of(bin, dir.resolve("missing")));
		Assertions.assertTrue(found.isEmpty());
	}

	@Test
	void testDefaultSearchPaths() {
		List<Path> defaults = ServerDiscovery.defaultSearchPaths();
		Assertions.assertEquals(4, defaults.size());
		Assertions.assertTrue(defaults.contains(Path.of("/usr/local/bin")));
	}
}
