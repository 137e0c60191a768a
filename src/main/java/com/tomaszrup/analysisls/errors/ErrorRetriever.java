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
package com.tomaszrup.analysisls.errors;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.analysisls.protocol.LspConnectionException;
import com.tomaszrup.analysisls.protocol.LspException;
import com.tomaszrup.analysisls.protocol.LspTimeoutException;
import com.tomaszrup.analysisls.protocol.Protocol;
import com.tomaszrup.analysisls.protocol.ProtocolHandler;
import com.tomaszrup.analysisls.util.Throwables;

/**
 * Pulls diagnostics from the server, normalizes them into
 * {@link CodeError}s and keeps the latest list per file.
 *
 * <p>Every ingestion, whether the result of a request or a
 * {@code serena/errorUpdated} / {@code textDocument/publishDiagnostics}
 * push, replaces the cache entry of each file it covers and then notifies
 * the listeners with the new errors. Whole-workspace queries degrade to an
 * empty list when the server call fails.</p>
 */
public class ErrorRetriever {

    private static final Logger logger = LoggerFactory.getLogger(ErrorRetriever.class);

    private final RequestSender sender;
    private final Clock clock;
    private final Map<String, List<CodeError>> cache = new ConcurrentHashMap<>();
    private final List<ErrorListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Instant lastRetrieval;

    public ErrorRetriever(ProtocolHandler protocol, RequestSender sender) {
        this(protocol, sender, Clock.systemUTC());
    }

    ErrorRetriever(ProtocolHandler protocol, RequestSender sender, Clock clock) {
        this.sender = sender;
        this.clock = clock;
        protocol.registerNotificationHandler(Protocol.NOTIFICATION_ERROR_UPDATED, this::handleDiagnosticsPush);
        protocol.registerNotificationHandler(Protocol.PUBLISH_DIAGNOSTICS, this::handleDiagnosticsPush);
    }

    public ComprehensiveErrorList getComprehensiveErrors(ErrorQuery query, Duration timeout) {
        long startNanos = System.nanoTime();
        JsonObject params = Protocol.comprehensiveErrorsParams(query.isIncludeContext(),
                query.isIncludeSuggestions(), query.getMaxErrors(), query.severityFilterIds());
        try {
            JsonElement result = sender.send(Protocol.REQUEST_GET_COMPREHENSIVE_ERRORS, params, timeout);
            List<CodeError> all = ingestWorkspace(DiagnosticParser.parseWorkspaceResult(result));
            return select(all, query, startNanos);
        } catch (LspException e) {
            logFailure("Comprehensive error query", e);
            return emptyResult(startNanos);
        }
    }

    /**
     * Queries one file. A timeout or a lost connection propagates; other
     * failures yield an empty list and leave the cache untouched.
     *
     * @throws LspTimeoutException    if the server did not answer in time
     * @throws LspConnectionException if the client is not connected
     */
    public List<CodeError> getFileErrors(String filePath, Duration timeout) {
        String path = DiagnosticParser.toPath(filePath);
        List<CodeError> errors;
        try {
            JsonElement result = sender.send(Protocol.REQUEST_GET_ERRORS,
                    Protocol.getErrorsParams(filePath, null), timeout);
            errors = DiagnosticParser.parseFileResult(result, path);
        } catch (LspTimeoutException | LspConnectionException e) {
            throw e;
        } catch (LspException e) {
            logFailure("Error query for " + filePath, e);
            return Collections.emptyList();
        }
        List<CodeError> stored = replace(path, errors);
        markRetrieval();
        notifyListeners(stored);
        return stored;
    }

    public ComprehensiveErrorList analyzeCodebase(String rootPath, List<String> includePatterns,
            List<String> excludePatterns, Duration timeout) {
        long startNanos = System.nanoTime();
        JsonObject params = Protocol.analyzeCodebaseParams(rootPath, includePatterns, excludePatterns);
        try {
            JsonElement result = sender.send(Protocol.REQUEST_ANALYZE_CODEBASE, params, timeout);
            List<CodeError> all = ingestWorkspace(DiagnosticParser.parseWorkspaceResult(result));
            return select(all, ErrorQuery.defaults(), startNanos);
        } catch (LspException e) {
            logFailure("Codebase analysis of " + rootPath, e);
            return emptyResult(startNanos);
        }
    }

    /**
     * Refreshes a file's cache entry from a {@code serena/analyzeFile}
     * result when it carries diagnostics.
     */
    public void ingestFileResult(String filePath, JsonElement result) {
        if (result == null || !result.isJsonObject()) {
            return;
        }
        JsonElement diagnostics = result.getAsJsonObject().get("diagnostics");
        if (diagnostics == null || !diagnostics.isJsonArray()) {
            return;
        }
        String path = DiagnosticParser.toPath(filePath);
        try {
            notifyListeners(replace(path, DiagnosticParser.parseAll(diagnostics, path)));
        } catch (LspException e) {
            logFailure("Analysis result for " + filePath, e);
        }
    }

    void handleDiagnosticsPush(JsonElement params) {
        if (params == null || !params.isJsonObject()) {
            logger.warn("Ignoring diagnostics notification without parameters");
            return;
        }
        JsonObject object = params.getAsJsonObject();
        JsonElement uri = object.get("uri");
        if (uri == null || !uri.isJsonPrimitive()) {
            logger.warn("Ignoring diagnostics notification without uri");
            return;
        }
        String path = DiagnosticParser.toPath(uri.getAsString());
        JsonElement diagnostics = object.has("diagnostics") ? object.get("diagnostics") : new JsonArray();
        List<CodeError> errors;
        try {
            errors = DiagnosticParser.parseAll(diagnostics, path);
        } catch (LspException e) {
            logFailure("Diagnostics notification for " + path, e);
            return;
        }
        logger.debug("Received {} diagnostics for {}", errors.size(), path);
        notifyListeners(replace(path, errors));
    }

    private List<CodeError> ingestWorkspace(Map<String, List<CodeError>> byFile) {
        List<CodeError> all = new ArrayList<>();
        for (Map.Entry<String, List<CodeError>> entry : byFile.entrySet()) {
            all.addAll(replace(entry.getKey(), entry.getValue()));
        }
        markRetrieval();
        notifyListeners(Collections.unmodifiableList(all));
        return all;
    }

    private List<CodeError> replace(String path, List<CodeError> errors) {
        List<CodeError> stored = Collections.unmodifiableList(new ArrayList<>(errors));
        cache.put(path, stored);
        return stored;
    }

    private ComprehensiveErrorList select(List<CodeError> all, ErrorQuery query, long startNanos) {
        List<CodeError> accepted = new ArrayList<>();
        for (CodeError error : all) {
            if (query.accepts(error)) {
                accepted.add(error);
            }
        }
        ComprehensiveErrorList list = new ComprehensiveErrorList(accepted);
        if (query.getMaxErrors() != null) {
            list.truncate(query.getMaxErrors());
        }
        list.setAnalysisDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        return list;
    }

    private static ComprehensiveErrorList emptyResult(long startNanos) {
        ComprehensiveErrorList list = new ComprehensiveErrorList();
        list.setAnalysisDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        return list;
    }

    private void markRetrieval() {
        lastRetrieval = clock.instant();
    }

    private void notifyListeners(List<CodeError> errors) {
        for (ErrorListener listener : listeners) {
            try {
                listener.onErrors(errors);
            } catch (RuntimeException e) {
                logger.error("Error listener failed: {}", Throwables.summarize(e), e);
            }
        }
    }

    private static void logFailure(String operation, LspException e) {
        logger.warn("{} failed: {}", operation, Throwables.summarize(e));
        logger.debug("{} failure details", operation, e);
    }

    public void addErrorListener(ErrorListener listener) {
        listeners.add(listener);
    }

    public void removeErrorListener(ErrorListener listener) {
        listeners.remove(listener);
    }

    /** Latest errors known for a file; empty if none are cached. */
    public List<CodeError> getCachedErrors(String filePath) {
        return cache.getOrDefault(DiagnosticParser.toPath(filePath), Collections.emptyList());
    }

    public List<CodeError> getAllCachedErrors() {
        List<CodeError> all = new ArrayList<>();
        for (String path : getCachedFiles()) {
            all.addAll(cache.getOrDefault(path, Collections.emptyList()));
        }
        return all;
    }

    public Set<String> getCachedFiles() {
        return Collections.unmodifiableSet(new TreeSet<>(cache.keySet()));
    }

    public void clearCache(String filePath) {
        cache.remove(DiagnosticParser.toPath(filePath));
    }

    public void clearCache() {
        cache.clear();
    }

    /** When the last pulled retrieval completed. Pushes do not count. */
    public Optional<Instant> getLastRetrieval() {
        return Optional.ofNullable(lastRetrieval);
    }
}
