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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Sends one request on the owning client's connection and waits for its
 * result.
 */
@FunctionalInterface
public interface RequestSender {

    /**
     * @param timeout how long to wait, or {@code null} for the client default
     * @return the result member of the response
     * @throws com.tomaszrup.analysisls.protocol.LspException on any failure
     */
    JsonElement send(String method, JsonObject params, Duration timeout);
}
