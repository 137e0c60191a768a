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

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonElement;

/**
 * Entry of the pending-request table: the single-resolution result slot for
 * one outstanding request, plus when it was issued.
 */
public final class PendingRequest {

    private final String id;
    private final String method;
    private final Instant createdAt;
    private final CompletableFuture<JsonElement> result = new CompletableFuture<>();

    PendingRequest(String id, String method, Instant createdAt) {
        this.id = id;
        this.method = method;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * The slot callers wait on. Completed at most once, by the protocol
     * handler.
     */
    public CompletableFuture<JsonElement> getResult() {
        return result;
    }
}
