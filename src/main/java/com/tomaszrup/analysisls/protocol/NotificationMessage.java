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

import java.util.Objects;

import com.google.gson.JsonElement;

/**
 * One-way message; never answered and never carries an id.
 */
public final class NotificationMessage extends Message {

    private final String method;
    private final JsonElement params;

    public NotificationMessage(String method, JsonElement params) {
        this.method = Objects.requireNonNull(method, "method");
        this.params = params;
    }

    @Override
    public Kind getKind() {
        return Kind.NOTIFICATION;
    }

    public String getMethod() {
        return method;
    }

    public JsonElement getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NotificationMessage)) {
            return false;
        }
        NotificationMessage other = (NotificationMessage) o;
        return method.equals(other.method) && Objects.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, params);
    }

    @Override
    public String toString() {
        return "NotificationMessage[method=" + method + "]";
    }
}
