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

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tomaszrup.analysisls.errors.CodeError;
import com.tomaszrup.analysisls.errors.ComprehensiveErrorList;
import com.tomaszrup.analysisls.errors.ErrorQuery;
import com.tomaszrup.analysisls.protocol.LspException;
import com.tomaszrup.analysisls.server.ServerConfig;
import com.tomaszrup.analysisls.server.ServerConfigStore;
import com.tomaszrup.analysisls.server.ServerDiscovery;
import com.tomaszrup.analysisls.server.ServerInfo;
import com.tomaszrup.analysisls.server.ServerManager;
import com.tomaszrup.analysisls.transport.ConnectionType;
import com.tomaszrup.analysisls.util.LogLevels;
import com.tomaszrup.analysisls.util.Throwables;

/**
 * Command line front end for the server manager.
 *
 * <pre>
 * analysisls [--config-dir DIR] [--log-level LEVEL] list
 * analysisls [--config-dir DIR] [--log-level LEVEL] discover [PATH...]
 * analysisls [--config-dir DIR] [--log-level LEVEL] check NAME [FILE...]
 * </pre>
 *
 * Results go to stdout, logs to stderr.
 */
public final class AnalysisLsMain {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisLsMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: analysisls [--config-dir DIR] [--log-level LEVEL] "
            + "list | discover [PATH...] | check NAME [FILE...]";

    private static final Gson OUTPUT = new GsonBuilder()
            .setPrettyPrinting()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private final PrintStream out;
    private final PrintStream err;
    private final Function<Path, ServerManager> managerFactory;

    AnalysisLsMain(PrintStream out, PrintStream err, Function<Path, ServerManager> managerFactory) {
        this.out = out;
        this.err = err;
        this.managerFactory = managerFactory;
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}",
                        thread.getName(), throwable.getMessage(), throwable));
        int code = new AnalysisLsMain(System.out, System.err, ServerManager::new).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        Path configDir = ServerConfigStore.defaultDirectory();
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        while (!rest.isEmpty() && rest.get(0).startsWith("--")) {
            String option = rest.remove(0);
            if (rest.isEmpty()) {
                return usage("Missing value for " + option);
            }
            String value = rest.remove(0);
            switch (option) {
                case "--config-dir":
                    configDir = Paths.get(value);
                    break;
                case "--log-level":
                    if (!LogLevels.apply(value)) {
                        return usage("Unknown log level: " + value);
                    }
                    break;
                default:
                    return usage("Unknown option: " + option);
            }
        }
        if (rest.isEmpty()) {
            return usage("Missing command");
        }

        String command = rest.remove(0);
        switch (command) {
            case "list":
                if (!rest.isEmpty()) {
                    return usage("list takes no arguments");
                }
                return list(configDir);
            case "discover":
                return discover(rest);
            case "check":
                if (rest.isEmpty()) {
                    return usage("check needs a server name");
                }
                return check(configDir, rest.get(0), rest.subList(1, rest.size()));
            default:
                return usage("Unknown command: " + command);
        }
    }

    private int usage(String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private int list(Path configDir) {
        try (ServerManager manager = managerFactory.apply(configDir)) {
            Map<String, ServerInfo> servers = manager.getAllServers();
            if (servers.isEmpty()) {
                out.println("No servers registered in " + configDir);
                return EXIT_OK;
            }
            for (ServerInfo info : servers.values()) {
                ServerConfig config = info.getConfig();
                String target = config.getConnectionType() == ConnectionType.STDIO
                        ? String.join(" ", config.getCommand())
                        : config.getHost() + ":" + config.getPort();
                out.println(info.getName() + "\t" + info.getStatus().id() + "\t"
                        + config.getConnectionType().id() + "\t" + target);
            }
            return EXIT_OK;
        }
    }

    private int discover(List<String> paths) {
        List<Path> searchPaths = new ArrayList<>();
        for (String p : paths) {
            searchPaths.add(Paths.get(p));
        }
        List<ServerConfig> found = ServerDiscovery.discover(searchPaths);
        out.println(OUTPUT.toJson(found));
        return EXIT_OK;
    }

    private int check(Path configDir, String name, List<String> files) {
        try (ServerManager manager = managerFactory.apply(configDir)) {
            if (manager.getServerInfo(name).isEmpty()) {
                err.println("Unknown server: " + name);
                return EXIT_FAILURE;
            }
            if (!manager.start(name)) {
                String reason = manager.getServerInfo(name).map(ServerInfo::getErrorMessage).orElse(null);
                err.println("Failed to start " + name + (reason != null ? ": " + reason : ""));
                return EXIT_FAILURE;
            }
            try {
                LspClient client = manager.getServerClient(name).orElseThrow();
                if (files.isEmpty()) {
                    ComprehensiveErrorList errors = client.getComprehensiveErrors(ErrorQuery.defaults());
                    out.println(OUTPUT.toJson(errors.toJson()));
                } else {
                    JsonObject byFile = new JsonObject();
                    for (String file : files) {
                        JsonArray array = new JsonArray();
                        for (CodeError error : client.getFileErrors(file)) {
                            array.add(error.toJson());
                        }
                        byFile.add(file, array);
                    }
                    out.println(OUTPUT.toJson(byFile));
                }
                return EXIT_OK;
            } catch (LspException e) {
                err.println("Check failed: " + Throwables.summarize(e));
                return EXIT_FAILURE;
            } finally {
                manager.stop(name);
            }
        }
    }
}
