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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * An ordered batch of errors with counts that are recomputed on every
 * mutation. Not thread-safe; a list belongs to the caller that received it.
 */
public class ComprehensiveErrorList {

    private final List<CodeError> errors = new ArrayList<>();
    private int totalCount;
    private int criticalCount;
    private int warningCount;
    private int infoCount;
    private Set<String> filesAnalyzed = Collections.emptySet();
    private Instant analysisTimestamp;
    private Duration analysisDuration = Duration.ZERO;

    public ComprehensiveErrorList() {
        this(Collections.emptyList());
    }

    public ComprehensiveErrorList(Collection<CodeError> initial) {
        this.analysisTimestamp = Instant.now();
        errors.addAll(initial);
        recount();
    }

    public void addError(CodeError error) {
        errors.add(error);
        recount();
    }

    public void addErrors(Collection<CodeError> more) {
        errors.addAll(more);
        recount();
    }

    /** Keeps only the first {@code maxErrors} entries. */
    public void truncate(int maxErrors) {
        if (maxErrors >= 0 && errors.size() > maxErrors) {
            errors.subList(maxErrors, errors.size()).clear();
            recount();
        }
    }

    private void recount() {
        int critical = 0;
        int warning = 0;
        int info = 0;
        Set<String> files = new LinkedHashSet<>();
        for (CodeError error : errors) {
            switch (error.getSeverity()) {
                case ERROR:
                    critical++;
                    break;
                case WARNING:
                    warning++;
                    break;
                default:
                    info++;
                    break;
            }
            files.add(error.getLocation().getFilePath());
        }
        totalCount = errors.size();
        criticalCount = critical;
        warningCount = warning;
        infoCount = info;
        filesAnalyzed = Collections.unmodifiableSet(files);
    }

    public List<CodeError> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public int getTotalCount() {
        return totalCount;
    }

    public int getCriticalCount() {
        return criticalCount;
    }

    public int getWarningCount() {
        return warningCount;
    }

    /** Info plus hint entries. */
    public int getInfoCount() {
        return infoCount;
    }

    public Set<String> getFilesAnalyzed() {
        return filesAnalyzed;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public Instant getAnalysisTimestamp() {
        return analysisTimestamp;
    }

    public Duration getAnalysisDuration() {
        return analysisDuration;
    }

    public void setAnalysisDuration(Duration analysisDuration) {
        this.analysisDuration = analysisDuration != null ? analysisDuration : Duration.ZERO;
    }

    public List<CodeError> getErrorsBySeverity(ErrorSeverity severity) {
        return errors.stream().filter(e -> e.getSeverity() == severity).collect(Collectors.toList());
    }

    public List<CodeError> getErrorsByCategory(ErrorCategory category) {
        return errors.stream().filter(e -> e.getCategory() == category).collect(Collectors.toList());
    }

    public List<CodeError> getErrorsByFile(String filePath) {
        return errors.stream().filter(e -> e.getLocation().getFilePath().equals(filePath))
                .collect(Collectors.toList());
    }

    public List<CodeError> getCriticalErrors() {
        return getErrorsBySeverity(ErrorSeverity.ERROR);
    }

    public JsonObject getSummary() {
        JsonObject breakdown = new JsonObject();
        for (ErrorCategory category : ErrorCategory.values()) {
            breakdown.addProperty(category.id(), getErrorsByCategory(category).size());
        }
        JsonObject summary = new JsonObject();
        summary.addProperty("total_errors", totalCount);
        summary.addProperty("critical_errors", criticalCount);
        summary.addProperty("warnings", warningCount);
        summary.addProperty("info_hints", infoCount);
        summary.addProperty("files_with_errors", filesAnalyzed.size());
        summary.add("category_breakdown", breakdown);
        summary.addProperty("analysis_timestamp", analysisTimestamp.toString());
        summary.addProperty("analysis_duration", analysisDuration.toMillis() / 1000.0);
        return summary;
    }

    public JsonObject toJson() {
        JsonArray array = new JsonArray();
        for (CodeError error : errors) {
            array.add(error.toJson());
        }
        JsonObject json = new JsonObject();
        json.add("errors", array);
        json.add("summary", getSummary());
        return json;
    }

    @Override
    public String toString() {
        return "ComprehensiveErrorList [total=" + totalCount + ", critical=" + criticalCount + ", warnings="
                + warningCount + ", info=" + infoCount + ", files=" + filesAnalyzed.size() + "]";
    }
}
