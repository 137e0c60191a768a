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

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.analysisls.protocol.LspProtocolException;
import com.tomaszrup.lsp.utils.Positions;

/**
 * Converts diagnostics as they arrive on the wire into {@link CodeError}s.
 *
 * <p>A wire diagnostic looks like
 * {@code {range:{start:{line,character},end:{line,character}}, severity, message, code, source, data}}
 * with zero-based positions. Missing pieces get defaults rather than
 * failing the whole batch; only the shape of the surrounding response can
 * raise {@link LspProtocolException}.</p>
 */
public final class DiagnosticParser {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticParser.class);

    // two or more characters, so a Windows drive letter is not taken for a scheme
    private static final Pattern URI_SCHEME = Pattern.compile("[a-zA-Z][a-zA-Z0-9+.-]+:");

    private DiagnosticParser() {
    }

    /**
     * Cache key for a file: {@code file:} URIs and plain paths both map to
     * the absolute, normalized local path. Other URIs are kept as they are.
     */
    public static String toPath(String uriOrPath) {
        if (uriOrPath == null) {
            return null;
        }
        if (uriOrPath.startsWith("file:")) {
            try {
                return Path.of(URI.create(uriOrPath)).toString();
            } catch (IllegalArgumentException | FileSystemNotFoundException e) {
                logger.debug("Cannot convert {} to a path: {}", uriOrPath, e.getMessage());
                return uriOrPath.startsWith("file://") ? uriOrPath.substring("file://".length())
                        : uriOrPath.substring("file:".length());
            }
        }
        if (URI_SCHEME.matcher(uriOrPath).lookingAt()) {
            return uriOrPath;
        }
        try {
            return Path.of(uriOrPath).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            return uriOrPath;
        }
    }

    public static CodeError parse(JsonObject diagnostic, String filePath) {
        JsonElement range = diagnostic.get("range");
        Position start = null;
        Position end = null;
        if (range != null && range.isJsonObject()) {
            start = Positions.fromJson(range.getAsJsonObject().get("start"));
            end = Positions.fromJson(range.getAsJsonObject().get("end"));
        }
        if (start == null) {
            start = new Position(0, 0);
        }
        ErrorLocation location = new ErrorLocation(filePath,
                Positions.displayLine(start), Positions.displayColumn(start),
                end != null ? Integer.valueOf(Positions.displayLine(end)) : null,
                end != null ? Integer.valueOf(Positions.displayColumn(end)) : null);

        CodeError.Builder builder = CodeError.builder(location)
                .id(readString(diagnostic.get("id")))
                .message(readMessage(diagnostic.get("message")))
                .severity(readSeverity(diagnostic.get("severity")))
                .code(readString(diagnostic.get("code")))
                .source(readString(diagnostic.get("source")));

        JsonElement data = diagnostic.get("data");
        if (data != null && data.isJsonObject()) {
            JsonObject context = data.getAsJsonObject();
            builder.context(context)
                    .suggestions(readStrings(context.get("suggestions")))
                    .relatedErrors(readStrings(context.get("relatedErrors")));
        }
        return builder.build();
    }

    /**
     * Parses an array of diagnostics for one file. Entries that are not
     * objects are skipped.
     */
    public static List<CodeError> parseAll(JsonElement diagnostics, String filePath) {
        if (diagnostics == null || diagnostics.isJsonNull()) {
            return Collections.emptyList();
        }
        if (!diagnostics.isJsonArray()) {
            throw new LspProtocolException("Expected an array of diagnostics for " + filePath);
        }
        List<CodeError> errors = new ArrayList<>();
        for (JsonElement element : diagnostics.getAsJsonArray()) {
            if (element.isJsonObject()) {
                errors.add(parse(element.getAsJsonObject(), filePath));
            } else {
                logger.debug("Skipping malformed diagnostic for {}: {}", filePath, element);
            }
        }
        return errors;
    }

    /**
     * Parses a whole-workspace result. Accepts
     * {@code {diagnostics: {uri: [...]}}} and
     * {@code {diagnostics: [{uri, diagnostics: [...]}]}}.
     *
     * @return errors grouped by file path, in response order; a file listed
     *         with no diagnostics maps to an empty list
     */
    public static Map<String, List<CodeError>> parseWorkspaceResult(JsonElement result) {
        Map<String, List<CodeError>> byFile = new LinkedHashMap<>();
        if (result == null || result.isJsonNull()) {
            return byFile;
        }
        if (!result.isJsonObject()) {
            throw new LspProtocolException("Expected an object result, got " + describe(result));
        }
        JsonElement diagnostics = result.getAsJsonObject().get("diagnostics");
        if (diagnostics == null || diagnostics.isJsonNull()) {
            return byFile;
        }
        if (diagnostics.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : diagnostics.getAsJsonObject().entrySet()) {
                String path = toPath(entry.getKey());
                byFile.computeIfAbsent(path, k -> new ArrayList<>()).addAll(parseAll(entry.getValue(), path));
            }
            return byFile;
        }
        if (diagnostics.isJsonArray()) {
            for (JsonElement element : diagnostics.getAsJsonArray()) {
                if (!element.isJsonObject()) {
                    throw new LspProtocolException("Expected {uri, diagnostics} entries, got " + describe(element));
                }
                JsonObject fileEntry = element.getAsJsonObject();
                String uri = readString(fileEntry.get("uri"));
                if (uri == null) {
                    throw new LspProtocolException("Diagnostics entry without uri");
                }
                String path = toPath(uri);
                byFile.computeIfAbsent(path, k -> new ArrayList<>())
                        .addAll(parseAll(fileEntry.get("diagnostics"), path));
            }
            return byFile;
        }
        throw new LspProtocolException("Unexpected diagnostics shape: " + describe(diagnostics));
    }

    /**
     * Parses a single-file result: {@code {diagnostics: [...]}} or a bare
     * array.
     */
    public static List<CodeError> parseFileResult(JsonElement result, String filePath) {
        if (result == null || result.isJsonNull()) {
            return Collections.emptyList();
        }
        if (result.isJsonArray()) {
            return parseAll(result, filePath);
        }
        if (!result.isJsonObject()) {
            throw new LspProtocolException("Expected an object result, got " + describe(result));
        }
        return parseAll(result.getAsJsonObject().get("diagnostics"), filePath);
    }

    private static ErrorSeverity readSeverity(JsonElement json) {
        if (json == null || !json.isJsonPrimitive() || !json.getAsJsonPrimitive().isNumber()) {
            return ErrorSeverity.ERROR;
        }
        return ErrorSeverity.fromCode(json.getAsInt());
    }

    private static String readMessage(JsonElement json) {
        if (json != null && json.isJsonObject()) {
            // markup content
            return readString(json.getAsJsonObject().get("value"));
        }
        return readString(json);
    }

    private static String readString(JsonElement json) {
        if (json == null || !json.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = json.getAsJsonPrimitive();
        return primitive.isNumber() ? primitive.getAsNumber().toString() : primitive.getAsString();
    }

    private static List<String> readStrings(JsonElement json) {
        if (json == null || !json.isJsonArray()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        JsonArray array = json.getAsJsonArray();
        for (JsonElement element : array) {
            String value = element.isJsonObject() ? readString(element.getAsJsonObject().get("id"))
                    : readString(element);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private static String describe(JsonElement element) {
        if (element.isJsonArray()) {
            return "array";
        }
        if (element.isJsonPrimitive()) {
            return "primitive " + element;
        }
        return element.isJsonObject() ? "object" : "null";
    }
}
