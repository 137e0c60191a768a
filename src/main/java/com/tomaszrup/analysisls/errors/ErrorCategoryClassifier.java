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

/**
 * Keyword heuristic assigning a category to a diagnostic. The checks run in
 * a fixed order and the first match wins, so ambiguous diagnostics (a type
 * checker message mentioning an import, say) classify the same way every
 * time:
 *
 * <ol>
 *   <li>source contains {@code syntax}, or message contains {@code parse}: SYNTAX</li>
 *   <li>source or message contains {@code type}: TYPE</li>
 *   <li>source or message contains {@code security}: SECURITY</li>
 *   <li>source or message contains {@code performance}: PERFORMANCE</li>
 *   <li>source contains {@code style} or {@code lint}: STYLE</li>
 *   <li>message contains {@code import} or {@code dependency}: DEPENDENCY</li>
 *   <li>message contains {@code compatibility}: COMPATIBILITY</li>
 *   <li>otherwise LOGIC</li>
 * </ol>
 *
 * Matching is case-insensitive. The diagnostic code is not consulted.
 */
public final class ErrorCategoryClassifier {

    private ErrorCategoryClassifier() {
    }

    public static ErrorCategory classify(String source, String message) {
        String src = lower(source);
        String msg = lower(message);

        if (src.contains("syntax") || msg.contains("parse")) {
            return ErrorCategory.SYNTAX;
        }
        if (src.contains("type") || msg.contains("type")) {
            return ErrorCategory.TYPE;
        }
        if (src.contains("security") || msg.contains("security")) {
            return ErrorCategory.SECURITY;
        }
        if (src.contains("performance") || msg.contains("performance")) {
            return ErrorCategory.PERFORMANCE;
        }
        if (src.contains("style") || src.contains("lint")) {
            return ErrorCategory.STYLE;
        }
        if (msg.contains("import") || msg.contains("dependency")) {
            return ErrorCategory.DEPENDENCY;
        }
        if (msg.contains("compatibility")) {
            return ErrorCategory.COMPATIBILITY;
        }
        return ErrorCategory.LOGIC;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
