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
package com.tomaszrup.analysisls;

import java.time.Duration;

/**
 * Exponential reconnect backoff: attempt {@code n} (zero-based) waits
 * {@code base * 2^n}, never more than the ceiling.
 */
public final class ReconnectPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Reconnect delays must not be negative");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectPolicy from(LspClientOptions options) {
        return new ReconnectPolicy(options.getReconnectBaseDelay(), options.getReconnectMaxDelay(),
                options.getMaxReconnectAttempts());
    }

    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        if (baseMillis == 0) {
            return Duration.ZERO;
        }
        // 2^attempt overflows long long before it matters
        if (attempt >= 62 || baseMillis > (maxMillis >> Math.min(attempt, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << attempt, maxMillis));
    }

    /**
     * @param attemptsMade reconnect attempts already made since the loss
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "ReconnectPolicy [base=" + baseDelay + ", max=" + maxDelay + ", maxAttempts=" + maxAttempts + "]";
    }
}
