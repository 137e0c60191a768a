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
package com.tomaszrup.analysisls.transport;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.analysisls.util.MdcServerContext;

/**
 * Launches the analysis server as a child process and talks to it over its
 * stdin/stdout. The child's stderr is forwarded to the log at DEBUG.
 */
public class StdioTransport extends StreamTransport {

    private static final Logger logger = LoggerFactory.getLogger(StdioTransport.class);

    /** How long a graceful {@code destroy()} may take before the process is killed. */
    private static final long DESTROY_GRACE_SECONDS = 2;

    private final List<String> command;
    private final String workingDirectory;
    private final Map<String, String> environment;
    private volatile Process process;

    public StdioTransport(List<String> command, String workingDirectory, Map<String, String> environment) {
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.workingDirectory = workingDirectory;
        this.environment = environment != null ? new LinkedHashMap<>(environment) : Collections.emptyMap();
    }

    @Override
    public ConnectionType getType() {
        return ConnectionType.STDIO;
    }

    @Override
    public void connect() throws IOException {
        if (command.isEmpty() || command.stream().anyMatch(part -> part == null || part.isEmpty())) {
            throw new IOException("Unable to start analysis server: empty command " + command);
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null && !workingDirectory.isEmpty()) {
            builder.directory(new File(workingDirectory));
        }
        builder.environment().putAll(environment);

        Process started = builder.start();
        if (!started.isAlive()) {
            int exitCode = started.exitValue();
            destroy(started);
            throw new IOException("Analysis server exited immediately with code " + exitCode + ": " + command);
        }
        this.process = started;
        attach(started.getInputStream(), started.getOutputStream());
        startStderrDrain(started);
        logger.info("Started analysis server process {} ({})", started.pid(), command);
    }

    @Override
    public boolean isConnected() {
        Process p = process;
        return super.isConnected() && p != null && p.isAlive();
    }

    @Override
    public Optional<ProcessHandle> getProcess() {
        Process p = process;
        return p != null ? Optional.of(p.toHandle()) : Optional.empty();
    }

    @Override
    protected void releaseChannel() {
        Process p = process;
        process = null;
        if (p != null) {
            destroy(p);
        }
    }

    private static void destroy(Process p) {
        p.destroy();
        try {
            if (!p.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Analysis server process {} did not exit, killing it", p.pid());
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
    }

    private void startStderrDrain(Process p) {
        Runnable drain = MdcServerContext.wrap(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.debug("[server stderr] {}", line);
                }
            } catch (IOException e) {
                logger.trace("stderr drain ended: {}", e.getMessage());
            }
        });
        Thread thread = new Thread(drain, "analysisls-stderr-" + p.pid());
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public String toString() {
        return "StdioTransport [command=" + command + ", workingDirectory=" + workingDirectory + "]";
    }
}
