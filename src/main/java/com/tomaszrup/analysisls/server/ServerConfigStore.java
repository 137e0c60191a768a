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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Persists server configurations, one pretty-printed JSON file per server
 * ({@code <name>.json}) in a user-level directory
 * ({@code ~/.analysisls/servers/} by default).
 *
 * <p>Files are written atomically (write-to-temp then rename). Unreadable
 * or invalid files are skipped with a warning when loading, so one broken
 * record never hides the others.</p>
 */
public class ServerConfigStore {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfigStore.class);

    private static final String EXTENSION = ".json";

    static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private final Path directory;

    public ServerConfigStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public static Path defaultDirectory() {
        return Paths.get(System.getProperty("user.home"), ".analysisls", "servers");
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String serverName) {
        return directory.resolve(serverName + EXTENSION);
    }

    /**
     * Load every valid configuration in the directory, ordered by file name.
     * A missing directory yields an empty list.
     */
    public List<ServerConfig> loadAll() {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list server configurations in {}: {}", directory, e.getMessage());
            return Collections.emptyList();
        }

        List<ServerConfig> configs = new ArrayList<>();
        for (Path file : files) {
            load(file).ifPresent(configs::add);
        }
        logger.info("Loaded {} server configuration(s) from {}", configs.size(), directory);
        return configs;
    }

    Optional<ServerConfig> load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ServerConfig config = GSON.fromJson(reader, ServerConfig.class);
            if (config == null) {
                logger.warn("Skipping empty server configuration {}", file);
                return Optional.empty();
            }
            config.validate();
            return Optional.of(config);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            logger.warn("Skipping unreadable server configuration {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Write {@code config} to {@code <name>.json}, replacing any previous file.
     *
     * @throws IOException if the directory or file cannot be written
     */
    public void save(ServerConfig config) throws IOException {
        Path file = fileFor(config.getName());
        Files.createDirectories(directory);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            GSON.toJson(config, writer);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Server configuration saved to {}", file);
    }

    /** @return whether a file was removed */
    public boolean delete(String serverName) {
        Path file = fileFor(serverName);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete server configuration {}: {}", file, e.getMessage());
            return false;
        }
    }
}
