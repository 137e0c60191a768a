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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Request/response correlation and inbound dispatch for one connection.
 *
 * <p>Outbound requests get a fresh id from {@link #createRequest} and a
 * pending slot from {@link #trackRequest}. Every inbound message goes through
 * {@link #handleMessage}: responses resolve and remove their slot (unknown or
 * expired ids are dropped), notifications fan out to the handlers registered
 * for the method, and server requests are answered by a registered request
 * handler or with {@code MethodNotFound}.</p>
 *
 * <p>A pending slot is removed from the table before it is completed, so a
 * slot is resolved at most once no matter how many responses carry its
 * id.</p>
 */
public class ProtocolHandler {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolHandler.class);

    private final AtomicLong idCounter = new AtomicLong();
    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<JsonElement>>> notificationHandlers = new ConcurrentHashMap<>();
    private final Map<String, Function<JsonElement, JsonElement>> requestHandlers = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProtocolHandler() {
        this(Clock.systemUTC());
    }

    ProtocolHandler(Clock clock) {
        this.clock = clock;
        registerRequestHandler(Protocol.WORKSPACE_CONFIGURATION, ProtocolHandler::emptyConfiguration);
    }

    public RequestMessage createRequest(String method, JsonElement params) {
        return new RequestMessage(Long.toString(idCounter.incrementAndGet()), method, params);
    }

    public NotificationMessage createNotification(String method, JsonElement params) {
        return new NotificationMessage(method, params);
    }

    /**
     * Registers a pending slot for the request's id.
     *
     * @return the slot the caller waits on
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<JsonElement> trackRequest(RequestMessage request) {
        PendingRequest pending = new PendingRequest(request.getId(), request.getMethod(), clock.instant());
        PendingRequest existing = pendingRequests.putIfAbsent(request.getId(), pending);
        if (existing != null) {
            throw new IllegalStateException("Request id " + request.getId() + " is already pending");
        }
        return pending.getResult();
    }

    /**
     * Removes a pending slot without resolving it. A response that arrives
     * for the id afterwards is discarded.
     *
     * @return {@code true} if the id was pending
     */
    public boolean cancelRequest(String id) {
        PendingRequest removed = pendingRequests.remove(id);
        if (removed == null) {
            return false;
        }
        removed.getResult().cancel(false);
        logger.debug("Cancelled pending request {} ({})", id, removed.getMethod());
        return true;
    }

    /**
     * Rejects every pending slot, e.g. when the transport goes away.
     */
    public void failAll(Throwable cause) {
        for (String id : new ArrayList<>(pendingRequests.keySet())) {
            PendingRequest removed = pendingRequests.remove(id);
            if (removed != null) {
                removed.getResult().completeExceptionally(cause);
            }
        }
    }

    public List<String> getPendingRequestIds() {
        return Collections.unmodifiableList(new ArrayList<>(pendingRequests.keySet()));
    }

    public boolean isPending(String id) {
        return pendingRequests.containsKey(id);
    }

    public void registerNotificationHandler(String method, Consumer<JsonElement> handler) {
        notificationHandlers.computeIfAbsent(method, key -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void removeNotificationHandler(String method, Consumer<JsonElement> handler) {
        List<Consumer<JsonElement>> handlers = notificationHandlers.get(method);
        if (handlers != null) {
            handlers.remove(handler);
        }
    }

    /**
     * Registers the handler answering server-initiated requests for
     * {@code method}. The handler's return value becomes the result; an
     * exception becomes an {@code InternalError} response.
     */
    public void registerRequestHandler(String method, Function<JsonElement, JsonElement> handler) {
        requestHandlers.put(method, handler);
    }

    /**
     * Single entry point for inbound traffic.
     *
     * @return the reply to send back when the message was a server request
     */
    public Optional<ResponseMessage> handleMessage(Message message) {
        switch (message.getKind()) {
            case RESPONSE:
                handleResponse((ResponseMessage) message);
                return Optional.empty();
            case NOTIFICATION:
                handleNotification((NotificationMessage) message);
                return Optional.empty();
            case REQUEST:
                return Optional.of(handleRequest((RequestMessage) message));
            default:
                return Optional.empty();
        }
    }

    private void handleResponse(ResponseMessage response) {
        PendingRequest pending = pendingRequests.remove(response.getId());
        if (pending == null) {
            logger.debug("Discarding response for unknown or expired request id {}", response.getId());
            return;
        }
        if (response.isError()) {
            pending.getResult().completeExceptionally(
                    new LspResponseException(pending.getMethod(), response.getError()));
        } else {
            pending.getResult().complete(response.getResult() != null ? response.getResult() : JsonNull.INSTANCE);
        }
    }

    private void handleNotification(NotificationMessage notification) {
        List<Consumer<JsonElement>> handlers = notificationHandlers.get(notification.getMethod());
        if (handlers == null || handlers.isEmpty()) {
            logger.trace("No handler for notification {}", notification.getMethod());
            return;
        }
        JsonElement params = notification.getParams() != null ? notification.getParams() : new JsonObject();
        for (Consumer<JsonElement> handler : handlers) {
            try {
                handler.accept(params);
            } catch (RuntimeException e) {
                logger.error("Notification handler for {} failed: {}", notification.getMethod(), e.getMessage(), e);
            }
        }
    }

    private ResponseMessage handleRequest(RequestMessage request) {
        Function<JsonElement, JsonElement> handler = requestHandlers.get(request.getMethod());
        if (handler == null) {
            return ResponseMessage.failure(request.getId(), new ResponseError(ResponseErrorCode.MethodNotFound,
                    "Method '" + request.getMethod() + "' not found"));
        }
        try {
            return ResponseMessage.success(request.getId(), handler.apply(request.getParams()));
        } catch (RuntimeException e) {
            logger.warn("Request handler for {} failed: {}", request.getMethod(), e.getMessage());
            return ResponseMessage.failure(request.getId(), new ResponseError(ResponseErrorCode.InternalError,
                    "Handler error: " + e.getMessage()));
        }
    }

    private static JsonElement emptyConfiguration(JsonElement params) {
        JsonArray result = new JsonArray();
        if (params != null && params.isJsonObject() && params.getAsJsonObject().has("items")
                && params.getAsJsonObject().get("items").isJsonArray()) {
            int count = params.getAsJsonObject().getAsJsonArray("items").size();
            for (int i = 0; i < count; i++) {
                result.add(JsonNull.INSTANCE);
            }
        }
        return result;
    }
}
