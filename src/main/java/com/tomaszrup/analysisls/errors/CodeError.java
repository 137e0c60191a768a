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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * A finding about analyzed source, normalized from a server diagnostic.
 * Instances are immutable; the category is derived from the source and
 * message when the error is built.
 */
public final class CodeError {

    public static final String DEFAULT_SOURCE = "serena";
    public static final String DEFAULT_MESSAGE = "Unknown error";

    private final String id;
    private final String message;
    private final ErrorSeverity severity;
    private final ErrorCategory category;
    private final ErrorLocation location;
    private final String code;
    private final String source;
    private final List<String> suggestions;
    private final JsonObject context;
    private final List<String> relatedErrors;
    private final Instant timestamp;

    private CodeError(Builder builder) {
        this.location = Objects.requireNonNull(builder.location, "location");
        this.message = builder.message != null ? builder.message : DEFAULT_MESSAGE;
        this.severity = builder.severity != null ? builder.severity : ErrorSeverity.ERROR;
        this.code = builder.code;
        this.source = builder.source != null ? builder.source : DEFAULT_SOURCE;
        this.id = builder.id != null ? builder.id : location.getFilePath() + "_" + (location.getLine() - 1)
                + "_" + (location.getColumn() - 1);
        this.category = ErrorCategoryClassifier.classify(source, message);
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(builder.suggestions));
        this.relatedErrors = Collections.unmodifiableList(new ArrayList<>(builder.relatedErrors));
        this.context = builder.context != null ? builder.context.deepCopy() : new JsonObject();
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    public static Builder builder(ErrorLocation location) {
        return new Builder(location);
    }

    public String getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public ErrorLocation getLocation() {
        return location;
    }

    /** The diagnostic code, or {@code null}. */
    public String getCode() {
        return code;
    }

    public String getSource() {
        return source;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    /** Free-form data the server attached to the diagnostic. Returns a copy. */
    public JsonObject getContext() {
        return context.deepCopy();
    }

    public List<String> getRelatedErrors() {
        return relatedErrors;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isCritical() {
        return severity == ErrorSeverity.ERROR;
    }

    /** {@code [SEVERITY] file:range - message} */
    public String getDisplayText() {
        return "[" + severity.id().toUpperCase(Locale.ROOT) + "] " + location.getFileName() + ":"
                + location.getRangeText() + " - " + message;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("message", message);
        json.addProperty("severity", severity.id());
        json.addProperty("category", category.id());
        json.add("location", location.toJson());
        json.addProperty("code", code);
        json.addProperty("source", source);
        json.add("suggestions", toArray(suggestions));
        json.add("context", context.deepCopy());
        json.add("related_errors", toArray(relatedErrors));
        json.addProperty("timestamp", timestamp.toString());
        return json;
    }

    private static JsonArray toArray(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CodeError)) {
            return false;
        }
        CodeError other = (CodeError) o;
        return id.equals(other.id) && message.equals(other.message) && severity == other.severity
                && location.equals(other.location) && Objects.equals(code, other.code)
                && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, message, severity, location, code, source);
    }

    @Override
    public String toString() {
        return getDisplayText();
    }

    public static final class Builder {
        private final ErrorLocation location;
        private String id;
        private String message;
        private ErrorSeverity severity;
        private String code;
        private String source;
        private final List<String> suggestions = new ArrayList<>();
        private JsonObject context;
        private final List<String> relatedErrors = new ArrayList<>();
        private Instant timestamp;

        private Builder(ErrorLocation location) {
            this.location = location;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder severity(ErrorSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            this.suggestions.addAll(suggestions);
            return this;
        }

        public Builder context(JsonObject context) {
            this.context = context;
            return this;
        }

        public Builder relatedErrors(List<String> relatedErrors) {
            this.relatedErrors.addAll(relatedErrors);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public CodeError build() {
            return new CodeError(this);
        }
    }
}
