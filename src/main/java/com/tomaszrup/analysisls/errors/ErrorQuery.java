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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options of a whole-workspace error query. Immutable; the {@code with}
 * methods return modified copies.
 */
public final class ErrorQuery {

    private static final ErrorQuery DEFAULTS = new ErrorQuery(true, true, null, Collections.emptySet());

    private final boolean includeContext;
    private final boolean includeSuggestions;
    private final Integer maxErrors;
    private final Set<ErrorSeverity> severityFilter;

    private ErrorQuery(boolean includeContext, boolean includeSuggestions, Integer maxErrors,
            Set<ErrorSeverity> severityFilter) {
        this.includeContext = includeContext;
        this.includeSuggestions = includeSuggestions;
        this.maxErrors = maxErrors;
        this.severityFilter = severityFilter;
    }

    /** Context and suggestions included, no limit, no severity filter. */
    public static ErrorQuery defaults() {
        return DEFAULTS;
    }

    public ErrorQuery withIncludeContext(boolean value) {
        return new ErrorQuery(value, includeSuggestions, maxErrors, severityFilter);
    }

    public ErrorQuery withIncludeSuggestions(boolean value) {
        return new ErrorQuery(includeContext, value, maxErrors, severityFilter);
    }

    /**
     * @param value the maximum number of errors returned, or {@code null} for no limit
     */
    public ErrorQuery withMaxErrors(Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative: " + value);
        }
        return new ErrorQuery(includeContext, includeSuggestions, value, severityFilter);
    }

    /** An empty collection removes the filter. */
    public ErrorQuery withSeverityFilter(Collection<ErrorSeverity> severities) {
        Set<ErrorSeverity> filter = severities == null || severities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(severities));
        return new ErrorQuery(includeContext, includeSuggestions, maxErrors, filter);
    }

    public boolean isIncludeContext() {
        return includeContext;
    }

    public boolean isIncludeSuggestions() {
        return includeSuggestions;
    }

    public Integer getMaxErrors() {
        return maxErrors;
    }

    public Set<ErrorSeverity> getSeverityFilter() {
        return severityFilter;
    }

    public boolean accepts(CodeError error) {
        return severityFilter.isEmpty() || severityFilter.contains(error.getSeverity());
    }

    List<String> severityFilterIds() {
        return severityFilter.stream().map(ErrorSeverity::id)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ErrorQuery [includeContext=" + includeContext + ", includeSuggestions=" + includeSuggestions
                + ", maxErrors=" + maxErrors + ", severityFilter=" + severityFilter + "]";
    }
}
