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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Looks for known analysis server executables in a list of directories.
 *
 * <p>Only direct children of each directory are checked; a candidate must
 * be a regular, executable file. Each hit becomes a configuration named
 * {@code discovered_<executable>} whose command is the absolute path. When
 * the same executable name appears in several directories, the first
 * directory wins.</p>
 */
public final class ServerDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(ServerDiscovery.class);

    /** Executable names probed in every search directory, in this order. */
    static final List<String> EXECUTABLE_NAMES = Collections.unmodifiableList(Arrays.asList(
            "serena-lsp-server",
            "serena-server",
            "serena-language-server",
            "serena"
    ));

    static final String NAME_PREFIX = "discovered_";

    private ServerDiscovery() {
        // utility class
    }

    public static List<Path> defaultSearchPaths() {
        String home = System.getProperty("user.home");
        return Collections.unmodifiableList(Arrays.asList(
                Paths.get("/usr/local/bin"),
                Paths.get("/usr/bin"),
                Paths.get(home, ".local", "bin"),
                Paths.get(home, "bin")));
    }

    /**
     * @param searchPaths directories to probe; {@code null} or empty means
     *                    {@link #defaultSearchPaths()}
     * @return unregistered candidate configurations, in discovery order
     */
    public static List<ServerConfig> discover(List<Path> searchPaths) {
        List<Path> paths = searchPaths == null || searchPaths.isEmpty() ? defaultSearchPaths() : searchPaths;
        Map<String, ServerConfig> found = new LinkedHashMap<>();

        for (Path dir : paths) {
            if (!Files.isDirectory(dir)) {
                logger.debug("Skipping search path {}: not a directory", dir);
                continue;
            }
            for (String executable : EXECUTABLE_NAMES) {
                Path candidate = dir.resolve(executable);
                if (!isExecutableFile(candidate)) {
                    continue;
                }
                String name = NAME_PREFIX + executable;
                if (found.containsKey(name)) {
                    logger.debug("Ignoring {}: {} already found earlier on the search path", candidate, name);
                    continue;
                }
                ServerConfig config = new ServerConfig(name,
                        Collections.singletonList(candidate.toAbsolutePath().normalize().toString()));
                found.put(name, config);
                logger.info("Discovered analysis server {} at {}", name, candidate);
            }
        }

        logger.info("Discovery found {} server executable(s) in {} search path(s)", found.size(), paths.size());
        return new ArrayList<>(found.values());
    }

    static boolean isExecutableFile(Path candidate) {
        try {
            return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
        } catch (SecurityException e) {
            logger.debug("Cannot access {}: {}", candidate, e.getMessage());
            return false;
        }
    }
}
