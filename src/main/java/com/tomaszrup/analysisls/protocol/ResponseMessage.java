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
 * Reply to a request. Carries either a result or an {@link ResponseError},
 * never both.
 */
public final class ResponseMessage extends Message {

    private final String id;
    private final JsonElement result;
    private final ResponseError error;

    private ResponseMessage(String id, JsonElement result, ResponseError error) {
        this.id = Objects.requireNonNull(id, "id");
        this.result = result;
        this.error = error;
    }

    public static ResponseMessage success(String id, JsonElement result) {
        return new ResponseMessage(id, result, null);
    }

    public static ResponseMessage failure(String id, ResponseError error) {
        return new ResponseMessage(id, null, Objects.requireNonNull(error, "error"));
    }

    @Override
    public Kind getKind() {
        return Kind.RESPONSE;
    }

    public String getId() {
        return id;
    }

    public JsonElement getResult() {
        return result;
    }

    public ResponseError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResponseMessage)) {
            return false;
        }
        ResponseMessage other = (ResponseMessage) o;
        return id.equals(other.id) && Objects.equals(result, other.result)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, result, error);
    }

    @Override
    public String toString() {
        return "ResponseMessage[id=" + id + (error != null ? ", error=" + error.getCode() : "") + "]";
    }
}
