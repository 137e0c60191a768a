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

import java.time.Duration;

/**
 * No matching response arrived within the request's time bound. By the time
 * this is thrown the request has already been removed from the pending table.
 */
public class LspTimeoutException extends LspException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final Duration timeout;

    public LspTimeoutException(String method, Duration timeout) {
        super("Request " + method + " timed out after " + timeout.toMillis() + "ms");
        this.method = method;
        this.timeout = timeout;
    }

    public String getMethod() {
        return method;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
