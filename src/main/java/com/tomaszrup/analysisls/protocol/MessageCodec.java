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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Converts between {@link Message} values and their JSON-RPC 2.0 text form.
 * Framing is not handled here; see
 * {@link com.tomaszrup.analysisls.transport.MessageFraming}.
 *
 * <p>Ids are kept as strings internally. Ids that look like non-negative
 * integers are written as JSON numbers, matching what most servers expect.</p>
 */
public final class MessageCodec {

    /** Longest integer or fraction part accepted in a numeric id. */
    private static final int MAX_ID_DIGITS = 64;
    private static final Pattern NUMERIC_ID = Pattern.compile("0|[1-9][0-9]{0,17}");

    private final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    public byte[] encode(Message message) {
        return encodeToString(message).getBytes(StandardCharsets.UTF_8);
    }

    public String encodeToString(Message message) {
        return gson.toJson(toJson(message));
    }

    JsonObject toJson(Message message) {
        JsonObject json = new JsonObject();
        json.addProperty("jsonrpc", Message.JSONRPC_VERSION);
        switch (message.getKind()) {
            case REQUEST: {
                RequestMessage request = (RequestMessage) message;
                json.add("id", encodeId(request.getId()));
                json.addProperty("method", request.getMethod());
                if (request.getParams() != null) {
                    json.add("params", request.getParams());
                }
                break;
            }
            case NOTIFICATION: {
                NotificationMessage notification = (NotificationMessage) message;
                json.addProperty("method", notification.getMethod());
                if (notification.getParams() != null) {
                    json.add("params", notification.getParams());
                }
                break;
            }
            case RESPONSE: {
                ResponseMessage response = (ResponseMessage) message;
                json.add("id", encodeId(response.getId()));
                if (response.isError()) {
                    ResponseError error = response.getError();
                    JsonObject errorJson = new JsonObject();
                    errorJson.addProperty("code", error.getCode());
                    errorJson.addProperty("message", error.getMessage());
                    if (error.getData() != null) {
                        errorJson.add("data", error.getData());
                    }
                    json.add("error", errorJson);
                } else {
                    json.add("result", response.getResult() != null ? response.getResult() : JsonNull.INSTANCE);
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown message kind: " + message.getKind());
        }
        return json;
    }

    public Message decode(byte[] payload) {
        return decode(new String(payload, StandardCharsets.UTF_8));
    }

    /**
     * @throws LspProtocolException if the text is not valid JSON or does not
     *                              have the shape of a request, response or
     *                              notification
     */
    public Message decode(String text) {
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new LspProtocolException("Invalid JSON in message: " + e.getMessage(), e);
        }
        if (element == null || !element.isJsonObject()) {
            throw new LspProtocolException("Message is not a JSON object");
        }
        JsonObject json = element.getAsJsonObject();

        JsonElement version = json.get("jsonrpc");
        if (version == null || !version.isJsonPrimitive()
                || !Message.JSONRPC_VERSION.equals(version.getAsString())) {
            throw new LspProtocolException("Invalid or missing jsonrpc version");
        }

        String method = readMethod(json);
        JsonElement idElement = json.get("id");
        boolean hasId = idElement != null && !idElement.isJsonNull();

        if (hasId && method != null) {
            return new RequestMessage(decodeId(idElement), method, json.get("params"));
        }
        if (method != null) {
            return new NotificationMessage(method, json.get("params"));
        }
        if (!hasId) {
            throw new LspProtocolException("Message has neither method nor id");
        }

        String id = decodeId(idElement);
        JsonElement errorElement = json.get("error");
        if (errorElement != null && !errorElement.isJsonNull()) {
            return ResponseMessage.failure(id, decodeError(errorElement));
        }
        if (!json.has("result")) {
            throw new LspProtocolException("Response " + id + " has neither result nor error");
        }
        return ResponseMessage.success(id, json.get("result"));
    }

    private static String readMethod(JsonObject json) {
        JsonElement method = json.get("method");
        if (method == null || method.isJsonNull()) {
            return null;
        }
        if (!method.isJsonPrimitive() || !method.getAsJsonPrimitive().isString()) {
            throw new LspProtocolException("Method must be a string");
        }
        return method.getAsString();
    }

    private static ResponseError decodeError(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new LspProtocolException("Response error must be an object");
        }
        JsonObject error = element.getAsJsonObject();
        JsonElement code = error.get("code");
        if (code == null || !code.isJsonPrimitive() || !code.getAsJsonPrimitive().isNumber()) {
            throw new LspProtocolException("Response error has no numeric code");
        }
        int value;
        try {
            value = code.getAsInt();
        } catch (NumberFormatException e) {
            throw new LspProtocolException("Response error code out of range: " + code, e);
        }
        JsonElement message = error.get("message");
        String text = message != null && message.isJsonPrimitive() ? message.getAsString() : "";
        return new ResponseError(value, text, error.get("data"));
    }

    private static JsonElement encodeId(String id) {
        if (NUMERIC_ID.matcher(id).matches()) {
            return new JsonPrimitive(Long.parseLong(id));
        }
        return new JsonPrimitive(id);
    }

    private static String decodeId(JsonElement id) {
        if (!id.isJsonPrimitive()) {
            throw new LspProtocolException("Message id must be a number or a string");
        }
        JsonPrimitive primitive = id.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            try {
                BigDecimal number = primitive.getAsBigDecimal();
                if (number.precision() - number.scale() > MAX_ID_DIGITS || number.scale() > MAX_ID_DIGITS) {
                    throw new LspProtocolException("Numeric message id out of range");
                }
                return number.stripTrailingZeros().toPlainString();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new LspProtocolException("Numeric message id out of range", e);
            }
        }
        if (primitive.isString()) {
            return primitive.getAsString();
        }
        throw new LspProtocolException("Message id must be a number or a string");
    }
}
