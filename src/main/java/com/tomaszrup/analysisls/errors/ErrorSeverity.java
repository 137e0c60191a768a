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

import java.util.Locale;

import org.eclipse.lsp4j.DiagnosticSeverity;

import com.google.gson.annotations.SerializedName;

public enum ErrorSeverity {
    @SerializedName("error")
    ERROR("error", DiagnosticSeverity.Error),
    @SerializedName("warning")
    WARNING("warning", DiagnosticSeverity.Warning),
    @SerializedName("info")
    INFO("info", DiagnosticSeverity.Information),
    @SerializedName("hint")
    HINT("hint", DiagnosticSeverity.Hint);

    private final String id;
    private final DiagnosticSeverity lspSeverity;

    ErrorSeverity(String id, DiagnosticSeverity lspSeverity) {
        this.id = id;
        this.lspSeverity = lspSeverity;
    }

    /** Lower-case name used on the wire and in JSON output. */
    public String id() {
        return id;
    }

    public DiagnosticSeverity toLsp() {
        return lspSeverity;
    }

    /** Maps an LSP severity; {@code null} (unspecified) reads as an error. */
    public static ErrorSeverity fromLsp(DiagnosticSeverity severity) {
        if (severity == null) {
            return ERROR;
        }
        for (ErrorSeverity candidate : values()) {
            if (candidate.lspSeverity == severity) {
                return candidate;
            }
        }
        return ERROR;
    }

    /** Maps the numeric LSP code 1..4; anything else reads as an error. */
    public static ErrorSeverity fromCode(int code) {
        try {
            return fromLsp(DiagnosticSeverity.forValue(code));
        } catch (IllegalArgumentException e) {
            return ERROR;
        }
    }

    /**
     * Parses {@code error}, {@code warning}, {@code info} or {@code hint},
     * ignoring case.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static ErrorSeverity fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (ErrorSeverity candidate : values()) {
            if (candidate.id.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + id);
    }
}
