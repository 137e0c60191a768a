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
package com.tomaszrup.analysisls.protocol;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Method names and parameter builders for the messages exchanged with an
 * analysis server: the LSP lifecycle methods plus the analysis extensions.
 */
public final class Protocol {

    private Protocol() {
    }

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "initialized";
    public static final String SHUTDOWN = "shutdown";
    public static final String EXIT = "exit";
    public static final String PING = "$/ping";
    public static final String WORKSPACE_CONFIGURATION = "workspace/configuration";
    public static final String PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";

    public static final String REQUEST_ANALYZE_FILE = "serena/analyzeFile";
    public static final String REQUEST_GET_ERRORS = "serena/getErrors";
    public static final String REQUEST_GET_COMPREHENSIVE_ERRORS = "serena/getComprehensiveErrors";
    public static final String REQUEST_ANALYZE_CODEBASE = "serena/analyzeCodebase";
    public static final String REQUEST_REFRESH_ANALYSIS = "serena/refreshAnalysis";

    public static final String NOTIFICATION_ERROR_UPDATED = "serena/errorUpdated";
    public static final String NOTIFICATION_ANALYSIS_COMPLETE = "serena/analysisComplete";
    public static final String NOTIFICATION_PROGRESS = "serena/progress";

    /**
     * Key under {@code capabilities.experimental} announcing support for the
     * analysis extension requests.
     */
    public static final String EXTENSIONS_CAPABILITY = "serenaExtensions";

    public static JsonObject analyzeFileParams(String filePath, String content) {
        JsonObject params = new JsonObject();
        params.addProperty("uri", toFileUri(filePath));
        if (content != null) {
            params.addProperty("content", content);
        }
        return params;
    }

    public static JsonObject getErrorsParams(String filePath, Collection<String> severityFilter) {
        JsonObject params = new JsonObject();
        if (filePath != null) {
            params.addProperty("uri", toFileUri(filePath));
        }
        if (severityFilter != null && !severityFilter.isEmpty()) {
            params.add("severityFilter", toArray(severityFilter));
        }
        return params;
    }

    public static JsonObject comprehensiveErrorsParams(boolean includeContext, boolean includeSuggestions,
            Integer maxErrors, Collection<String> severityFilter) {
        JsonObject params = new JsonObject();
        params.addProperty("includeContext", includeContext);
        params.addProperty("includeSuggestions", includeSuggestions);
        if (maxErrors != null) {
            params.addProperty("maxErrors", maxErrors);
        }
        if (severityFilter != null && !severityFilter.isEmpty()) {
            params.add("severityFilter", toArray(severityFilter));
        }
        return params;
    }

    public static JsonObject analyzeCodebaseParams(String rootPath, List<String> includePatterns,
            List<String> excludePatterns) {
        JsonObject params = new JsonObject();
        params.addProperty("rootUri", toFileUri(rootPath));
        if (includePatterns != null && !includePatterns.isEmpty()) {
            params.add("includePatterns", toArray(includePatterns));
        }
        if (excludePatterns != null && !excludePatterns.isEmpty()) {
            params.add("excludePatterns", toArray(excludePatterns));
        }
        return params;
    }

    /**
     * Converts a local path to a {@code file://} URI. Relative paths are
     * resolved against the working directory.
     */
    public static String toFileUri(String filePath) {
        return Path.of(filePath).toAbsolutePath().normalize().toUri().toString();
    }

    private static JsonArray toArray(Collection<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
