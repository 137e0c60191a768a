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
package com.tomaszrup.analysisls.util;

import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Keeps the SLF4J MDC key {@code "server"} set to the name of the analysis
 * server a thread is currently working for, so log lines from several
 * managed servers can be told apart.
 *
 * <pre>{@code
 * MdcServerContext.setServer(config.getName());
 * try {
 *     // log lines carry [name]
 * } finally {
 *     MdcServerContext.clear();
 * }
 * }</pre>
 *
 * <p>{@link #wrap(Runnable)} and {@link #wrap(Callable)} carry the caller's
 * context over to pool threads.</p>
 */
public final class MdcServerContext {

    /** MDC key used in the logback pattern via {@code %X{server}}. */
    public static final String MDC_KEY = "server";

    private MdcServerContext() {
    }

    public static void setServer(String serverName) {
        if (serverName == null || serverName.isEmpty()) {
            MDC.put(MDC_KEY, "default");
        } else {
            MDC.put(MDC_KEY, serverName);
        }
    }

    /** The server name on this thread, or {@code null}. */
    public static String currentServer() {
        return MDC.get(MDC_KEY);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Captures the caller's MDC now and installs it around {@code task} when
     * it runs; the executing thread's own MDC is put back afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }

    /** Callable flavour of {@link #wrap(Runnable)}. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                return task.call();
            } finally {
                restore(previousContext);
            }
        };
    }
}
