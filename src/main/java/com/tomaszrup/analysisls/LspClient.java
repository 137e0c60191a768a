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

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.ClientInfo;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.PublishDiagnosticsCapabilities;
import org.eclipse.lsp4j.SynchronizationCapabilities;
import org.eclipse.lsp4j.TextDocumentClientCapabilities;
import org.eclipse.lsp4j.WorkspaceClientCapabilities;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.analysisls.errors.CodeError;
import com.tomaszrup.analysisls.errors.ComprehensiveErrorList;
import com.tomaszrup.analysisls.errors.ErrorListener;
import com.tomaszrup.analysisls.errors.ErrorQuery;
import com.tomaszrup.analysisls.errors.ErrorRetriever;
import com.tomaszrup.analysisls.protocol.LspConnectionException;
import com.tomaszrup.analysisls.protocol.LspException;
import com.tomaszrup.analysisls.protocol.LspProtocolException;
import com.tomaszrup.analysisls.protocol.LspTimeoutException;
import com.tomaszrup.analysisls.protocol.Message;
import com.tomaszrup.analysisls.protocol.MessageCodec;
import com.tomaszrup.analysisls.protocol.Protocol;
import com.tomaszrup.analysisls.protocol.ProtocolHandler;
import com.tomaszrup.analysisls.protocol.RequestMessage;
import com.tomaszrup.analysisls.protocol.ResponseMessage;
import com.tomaszrup.analysisls.transport.Transport;
import com.tomaszrup.analysisls.util.Throwables;

/**
 * Client for one analysis server connection.
 *
 * <p>{@link #connect()} opens the transport, starts the inbound message
 * loop, runs the {@code initialize}/{@code initialized} handshake and starts
 * the heartbeat; the client is then {@link ClientState#READY READY}. Every
 * public operation requires READY and fails with
 * {@link LspConnectionException} otherwise.</p>
 *
 * <p>When the transport is lost unexpectedly, all pending requests fail
 * at once, the connection is released and, with auto-reconnect enabled, a
 * new connection is attempted after an exponential backoff. After the
 * configured number of failed attempts the client stays DISCONNECTED and
 * tells its {@link ConnectionListener}s.</p>
 *
 * <p>Lifecycle changes are serialized on an internal lock. The message loop
 * never takes it, so a handshake waiting for its response cannot block the
 * loop that delivers it.</p>
 */
public class LspClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LspClient.class);

    private final LspClientOptions options;
    private final ExecutorPools pools;
    private final boolean ownsPools;
    private final TransportFactory transportFactory;
    private final ReconnectPolicy reconnectPolicy;
    private final MessageCodec codec = new MessageCodec();
    private final ProtocolHandler protocol = new ProtocolHandler();
    private final ErrorRetriever errorRetriever;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final List<ConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Message>> messageHandlers = new CopyOnWriteArrayList<>();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private volatile ClientState state = ClientState.DISCONNECTED;
    private volatile Transport transport;
    private volatile boolean closing;
    private volatile Future<?> messageLoop;
    private volatile Future<?> heartbeat;
    private volatile Future<?> reconnect;
    private volatile JsonObject serverCapabilities;
    private volatile Instant lastHeartbeat;

    public LspClient(LspClientOptions options) {
        this(options, new ExecutorPools(), true, TransportFactory.DEFAULT);
    }

    /**
     * @param pools shared pools; the client does not shut them down
     */
    public LspClient(LspClientOptions options, ExecutorPools pools, TransportFactory transportFactory) {
        this(options, pools, false, transportFactory);
    }

    private LspClient(LspClientOptions options, ExecutorPools pools, boolean ownsPools,
            TransportFactory transportFactory) {
        this.options = options;
        this.pools = pools;
        this.ownsPools = ownsPools;
        this.transportFactory = transportFactory;
        this.reconnectPolicy = ReconnectPolicy.from(options);
        this.errorRetriever = new ErrorRetriever(protocol, this::sendExtensionRequest);
        protocol.registerNotificationHandler(Protocol.NOTIFICATION_ANALYSIS_COMPLETE,
                params -> logger.info("Server finished analysis: {}", params));
        protocol.registerNotificationHandler(Protocol.NOTIFICATION_PROGRESS,
                params -> logger.debug("Analysis progress: {}", params));
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /**
     * Connects and initializes. Returns {@code true} once READY,
     * {@code false} if the transport or the handshake failed; nothing is
     * left open on failure.
     */
    public boolean connect() {
        lifecycleLock.lock();
        try {
            if (state != ClientState.DISCONNECTED) {
                logger.debug("connect() ignored in state {}", state);
                return state == ClientState.READY;
            }
            closing = false;
            cancel(reconnect);
            reconnect = null;
            reconnectAttempts.set(0);
            return openConnection();
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Shuts the server down politely ({@code shutdown}, then {@code exit},
     * bounded by the shutdown timeout) and releases the connection.
     * Calling it again is a no-op.
     */
    public void disconnect() {
        lifecycleLock.lock();
        try {
            closing = true;
            cancel(reconnect);
            reconnect = null;
            Transport t = transport;
            if (t == null) {
                if (state != ClientState.DISCONNECTED) {
                    setState(ClientState.DISCONNECTED);
                }
                return;
            }
            cancel(heartbeat);
            heartbeat = null;
            if (state == ClientState.READY) {
                shutdownHandshake(t);
            }
            releaseConnection(t, new LspConnectionException("Client disconnected"));
            setState(ClientState.DISCONNECTED);
            logger.info("Disconnected from analysis server ({})", options);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Drops the connection immediately, without the shutdown handshake and
     * without waiting for a lifecycle operation in progress. Pending
     * requests, including a blocked {@code shutdown}, fail at once.
     */
    public void abort() {
        closing = true;
        cancel(reconnect);
        cancel(heartbeat);
        Transport t = transport;
        if (t != null) {
            t.disconnect();
        }
        protocol.failAll(new LspConnectionException("Connection aborted"));
        if (lifecycleLock.tryLock()) {
            try {
                if (transport != null) {
                    releaseConnection(transport, new LspConnectionException("Connection aborted"));
                }
                if (state != ClientState.DISCONNECTED) {
                    setState(ClientState.DISCONNECTED);
                }
            } finally {
                lifecycleLock.unlock();
            }
        }
        logger.info("Aborted connection to analysis server ({})", options);
    }

    /** Disconnects and, if the client created its own pools, shuts them down. */
    @Override
    public void close() {
        try {
            disconnect();
        } finally {
            if (ownsPools) {
                pools.shutdownAll();
            }
        }
    }

    private boolean openConnection() {
        Transport t;
        try {
            t = transportFactory.create(options);
        } catch (RuntimeException e) {
            logger.error("Cannot create {} transport: {}", options.getConnectionType().id(), Throwables.summarize(e));
            return false;
        }
        try {
            t.connect();
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to connect to analysis server ({}): {}", options, Throwables.summarize(e));
            logger.debug("Connect failure details", e);
            t.disconnect();
            return false;
        }
        if (closing) {
            t.disconnect();
            return false;
        }
        transport = t;
        setState(ClientState.CONNECTED);
        if (!options.getConnectionType().isRequestPerCall()) {
            startMessageLoop(t);
        }
        try {
            setState(ClientState.INITIALIZING);
            initializeHandshake(t);
        } catch (LspException e) {
            logger.error("Initialize handshake with analysis server failed: {}", Throwables.summarize(e));
            releaseConnection(t, new LspConnectionException("Initialize failed", e));
            setState(ClientState.DISCONNECTED);
            return false;
        }
        setState(ClientState.READY);
        reconnectAttempts.set(0);
        startHeartbeat(t);
        logger.info("Connected to analysis server ({})", options);
        return true;
    }

    private void initializeHandshake(Transport t) {
        JsonElement result = exchange(t, Protocol.INITIALIZE, buildInitializeParams(), options.getRequestTimeout());
        JsonObject capabilities = new JsonObject();
        if (result != null && result.isJsonObject()) {
            JsonElement caps = result.getAsJsonObject().get("capabilities");
            if (caps != null && caps.isJsonObject()) {
                capabilities = caps.getAsJsonObject();
            }
        }
        serverCapabilities = capabilities;
        sendNotification(t, Protocol.INITIALIZED, new JsonObject());
    }

    JsonElement buildInitializeParams() {
        PublishDiagnosticsCapabilities publishDiagnostics = new PublishDiagnosticsCapabilities();
        publishDiagnostics.setRelatedInformation(true);
        publishDiagnostics.setVersionSupport(true);
        publishDiagnostics.setCodeDescriptionSupport(true);
        publishDiagnostics.setDataSupport(true);
        SynchronizationCapabilities synchronization = new SynchronizationCapabilities(true, true, true);
        synchronization.setDynamicRegistration(true);
        TextDocumentClientCapabilities textDocument = new TextDocumentClientCapabilities();
        textDocument.setPublishDiagnostics(publishDiagnostics);
        textDocument.setSynchronization(synchronization);

        WorkspaceClientCapabilities workspace = new WorkspaceClientCapabilities();
        workspace.setWorkspaceFolders(true);
        workspace.setConfiguration(true);

        JsonObject experimental = new JsonObject();
        experimental.addProperty(Protocol.EXTENSIONS_CAPABILITY, true);

        InitializeParams params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setClientInfo(new ClientInfo(options.getClientName(), options.getClientVersion()));
        params.setCapabilities(new ClientCapabilities(workspace, textDocument, experimental));
        if (options.getWorkspaceRoot() != null) {
            Path root = Path.of(options.getWorkspaceRoot()).toAbsolutePath().normalize();
            Path fileName = root.getFileName();
            params.setWorkspaceFolders(Collections.singletonList(new WorkspaceFolder(root.toUri().toString(),
                    fileName != null ? fileName.toString() : root.toString())));
        }
        return new MessageJsonHandler(Collections.emptyMap()).getGson().toJsonTree(params);
    }

    private void shutdownHandshake(Transport t) {
        try {
            exchange(t, Protocol.SHUTDOWN, null, options.getShutdownTimeout());
        } catch (LspException e) {
            logger.warn("Shutdown request failed: {}", Throwables.summarize(e));
        }
        try {
            sendNotification(t, Protocol.EXIT, null);
        } catch (LspException e) {
            logger.debug("Could not send exit: {}", e.getMessage());
        }
    }

    /**
     * Stops the loop and heartbeat, closes the transport and fails whatever
     * is still pending. Caller holds the lifecycle lock.
     */
    private void releaseConnection(Transport t, LspException reason) {
        cancel(heartbeat);
        heartbeat = null;
        Future<?> loop = messageLoop;
        messageLoop = null;
        if (loop != null) {
            loop.cancel(true);
        }
        t.disconnect();
        if (transport == t) {
            transport = null;
        }
        protocol.failAll(reason);
    }

    // -----------------------------------------------------------------------
    // Background tasks
    // -----------------------------------------------------------------------

    private void startMessageLoop(Transport t) {
        messageLoop = pools.getIoPool().submit(() -> runMessageLoop(t));
    }

    private void runMessageLoop(Transport t) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                byte[] payload = t.receive();
                if (payload == null) {
                    break;
                }
                dispatch(t, payload);
            }
            connectionFailed(t, new EOFException("Server closed the connection"));
        } catch (IOException | RuntimeException e) {
            connectionFailed(t, e);
        }
    }

    private void dispatch(Transport t, byte[] payload) {
        Message message;
        try {
            message = codec.decode(payload);
        } catch (LspProtocolException e) {
            logger.warn("Dropping malformed message from server: {}", e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.warn("Dropping undecodable message from server: {}", Throwables.summarize(e));
            logger.debug("Decode failure details", e);
            return;
        }
        Optional<ResponseMessage> reply = protocol.handleMessage(message);
        if (reply.isPresent()) {
            try {
                t.send(codec.encode(reply.get()));
            } catch (IOException | LspException e) {
                logger.warn("Could not answer server request {}: {}", reply.get().getId(), e.getMessage());
            }
        }
        for (Consumer<Message> handler : messageHandlers) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                logger.error("Message handler failed: {}", Throwables.summarize(e), e);
            }
        }
    }

    private void startHeartbeat(Transport t) {
        Duration interval = options.getHeartbeatInterval();
        if (!options.getConnectionType().supportsHeartbeat() || interval.isZero() || interval.isNegative()) {
            return;
        }
        long millis = interval.toMillis();
        heartbeat = pools.getSchedulingPool().scheduleWithFixedDelay(
                () -> submitQuietly(() -> sendHeartbeat(t)), millis, millis, TimeUnit.MILLISECONDS);
    }

    private void sendHeartbeat(Transport t) {
        if (state != ClientState.READY || transport != t) {
            return;
        }
        try {
            sendNotification(t, Protocol.PING, new JsonObject());
            lastHeartbeat = Instant.now();
        } catch (LspException e) {
            logger.warn("Heartbeat failed: {}", Throwables.summarize(e));
            connectionFailed(t, e);
        }
    }

    /**
     * Entry point for every unexpected failure of {@code t}. Pending
     * requests fail right away; the state change happens on the io pool.
     */
    private void connectionFailed(Transport t, Throwable cause) {
        if (closing || transport != t) {
            logger.debug("Ignoring failure of a released transport: {}", Throwables.summarize(cause));
            return;
        }
        protocol.failAll(new LspConnectionException("Connection lost: " + Throwables.summarize(cause), cause));
        submitQuietly(() -> handleConnectionLost(t, cause));
    }

    private void handleConnectionLost(Transport t, Throwable cause) {
        lifecycleLock.lock();
        try {
            if (closing || transport != t) {
                return;
            }
            logger.warn("Lost connection to analysis server: {}", Throwables.summarize(cause));
            releaseConnection(t, new LspConnectionException("Connection lost", cause));
            setState(ClientState.DISCONNECTED);
            if (options.isAutoReconnect()) {
                scheduleReconnect();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void scheduleReconnect() {
        int attempt = reconnectAttempts.get();
        if (!reconnectPolicy.shouldRetry(attempt)) {
            logger.error("Giving up on analysis server after {} reconnect attempts", attempt);
            fireReconnectFailed(attempt);
            return;
        }
        Duration delay = reconnectPolicy.delayForAttempt(attempt);
        reconnectAttempts.incrementAndGet();
        logger.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), attempt + 1,
                reconnectPolicy.getMaxAttempts());
        try {
            reconnect = pools.getSchedulingPool().schedule(() -> submitQuietly(this::attemptReconnect),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Reconnect not scheduled, pools are shut down");
        }
    }

    private void attemptReconnect() {
        lifecycleLock.lock();
        try {
            if (closing || state != ClientState.DISCONNECTED) {
                return;
            }
            if (openConnection()) {
                logger.info("Reconnected to analysis server");
                return;
            }
            if (!closing) {
                scheduleReconnect();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void submitQuietly(Runnable task) {
        try {
            pools.getIoPool().execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Task rejected, pools are shut down");
        }
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    // -----------------------------------------------------------------------
    // Requests
    // -----------------------------------------------------------------------

    /**
     * Sends a request and waits for its result.
     *
     * @param timeout how long to wait, or {@code null} for the request timeout
     * @throws LspConnectionException if not READY or the connection fails
     * @throws LspTimeoutException    if no response arrives in time; the
     *                                request is no longer pending afterwards
     * @throws com.tomaszrup.analysisls.protocol.LspResponseException if the
     *                                server answers with an error
     */
    public JsonElement request(String method, JsonElement params, Duration timeout) {
        return exchange(requireReady(), method, params, timeout);
    }

    public void notify(String method, JsonElement params) {
        sendNotification(requireReady(), method, params);
    }

    private JsonElement exchange(Transport t, String method, JsonElement params, Duration timeout) {
        Duration wait = timeout != null ? timeout : options.getRequestTimeout();
        RequestMessage request = protocol.createRequest(method, params);
        CompletableFuture<JsonElement> pending = protocol.trackRequest(request);
        try {
            byte[] reply = t.send(codec.encode(request));
            if (reply != null && reply.length > 0) {
                dispatch(t, reply);
            }
        } catch (IOException e) {
            protocol.cancelRequest(request.getId());
            connectionFailed(t, e);
            throw new LspConnectionException("Failed to send " + method + ": " + e.getMessage(), e);
        } catch (LspException e) {
            protocol.cancelRequest(request.getId());
            throw e;
        }
        try {
            return pending.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            protocol.cancelRequest(request.getId());
            throw new LspTimeoutException(method, wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            protocol.cancelRequest(request.getId());
            throw new LspConnectionException("Interrupted while waiting for " + method, e);
        } catch (CancellationException e) {
            throw new LspConnectionException("Request " + method + " was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = Throwables.unwrap(e);
            if (cause instanceof LspException) {
                throw (LspException) cause;
            }
            throw new LspProtocolException("Request " + method + " failed: " + Throwables.summarize(cause), cause);
        }
    }

    private void sendNotification(Transport t, String method, JsonElement params) {
        try {
            byte[] reply = t.send(codec.encode(protocol.createNotification(method, params)));
            if (reply != null && reply.length > 0) {
                dispatch(t, reply);
            }
        } catch (IOException e) {
            connectionFailed(t, e);
            throw new LspConnectionException("Failed to send " + method + ": " + e.getMessage(), e);
        }
    }

    private JsonElement sendExtensionRequest(String method, JsonObject params, Duration timeout) {
        Transport t = requireReady();
        if (!supportsExtensions()) {
            throw new LspProtocolException("Server does not support " + method);
        }
        return exchange(t, method, params, timeout);
    }

    private Transport requireReady() {
        Transport t = transport;
        if (state != ClientState.READY || t == null) {
            throw new LspConnectionException("Not connected to analysis server (state " + state + ")");
        }
        return t;
    }

    // -----------------------------------------------------------------------
    // Analysis operations
    // -----------------------------------------------------------------------

    public ComprehensiveErrorList getComprehensiveErrors(ErrorQuery query) {
        return getComprehensiveErrors(query, null);
    }

    public ComprehensiveErrorList getComprehensiveErrors(ErrorQuery query, Duration timeout) {
        requireReady();
        return errorRetriever.getComprehensiveErrors(query, timeout);
    }

    public List<CodeError> getFileErrors(String filePath) {
        return getFileErrors(filePath, null);
    }

    public List<CodeError> getFileErrors(String filePath, Duration timeout) {
        requireReady();
        return errorRetriever.getFileErrors(filePath, timeout);
    }

    public ComprehensiveErrorList analyzeCodebase(String rootPath, List<String> includePatterns,
            List<String> excludePatterns) {
        return analyzeCodebase(rootPath, includePatterns, excludePatterns, null);
    }

    public ComprehensiveErrorList analyzeCodebase(String rootPath, List<String> includePatterns,
            List<String> excludePatterns, Duration timeout) {
        requireReady();
        return errorRetriever.analyzeCodebase(rootPath, includePatterns, excludePatterns, timeout);
    }

    /**
     * Asks the server to analyze one file, optionally with unsaved content.
     * Diagnostics in the result refresh the file's cached errors.
     *
     * @return the result object, empty if the server returned something else
     */
    public JsonObject analyzeFile(String filePath, String content) {
        JsonElement result = sendExtensionRequest(Protocol.REQUEST_ANALYZE_FILE,
                Protocol.analyzeFileParams(filePath, content), null);
        errorRetriever.ingestFileResult(filePath, result);
        return result != null && result.isJsonObject() ? result.getAsJsonObject() : new JsonObject();
    }

    /**
     * @return {@code false} if the server did not confirm the refresh
     */
    public boolean refreshAnalysis() {
        requireReady();
        try {
            sendExtensionRequest(Protocol.REQUEST_REFRESH_ANALYSIS, new JsonObject(), null);
            return true;
        } catch (LspException e) {
            logger.warn("Refresh analysis failed: {}", Throwables.summarize(e));
            return false;
        }
    }

    // -----------------------------------------------------------------------
    // Listeners and views
    // -----------------------------------------------------------------------

    private void setState(ClientState next) {
        ClientState previous = state;
        if (previous == next) {
            return;
        }
        state = previous.transitionTo(next);
        logger.debug("Client state {} -> {}", previous, next);
        for (ConnectionListener listener : connectionListeners) {
            try {
                listener.onConnectionStateChanged(previous, next);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed: {}", Throwables.summarize(e), e);
            }
        }
    }

    private void fireReconnectFailed(int attempts) {
        for (ConnectionListener listener : connectionListeners) {
            try {
                listener.onReconnectFailed(attempts);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed: {}", Throwables.summarize(e), e);
            }
        }
    }

    public void addConnectionListener(ConnectionListener listener) {
        connectionListeners.add(listener);
    }

    public void removeConnectionListener(ConnectionListener listener) {
        connectionListeners.remove(listener);
    }

    public void addErrorListener(ErrorListener listener) {
        errorRetriever.addErrorListener(listener);
    }

    public void removeErrorListener(ErrorListener listener) {
        errorRetriever.removeErrorListener(listener);
    }

    /** Observes every decoded inbound message after protocol handling. */
    public void addMessageHandler(Consumer<Message> handler) {
        messageHandlers.add(handler);
    }

    public void removeMessageHandler(Consumer<Message> handler) {
        messageHandlers.remove(handler);
    }

    public ClientState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ClientState.READY;
    }

    /** Whether the underlying channel is still open, regardless of state. */
    public boolean isTransportConnected() {
        Transport t = transport;
        return t != null && t.isConnected();
    }

    /** Copy of the capabilities reported in the last initialize response. */
    public JsonObject getServerCapabilities() {
        JsonObject caps = serverCapabilities;
        return caps != null ? caps.deepCopy() : new JsonObject();
    }

    /**
     * {@code false} only when the server explicitly reported
     * {@code experimental.serenaExtensions = false}.
     */
    public boolean supportsExtensions() {
        JsonObject caps = serverCapabilities;
        if (caps == null || !caps.has("experimental") || !caps.get("experimental").isJsonObject()) {
            return true;
        }
        JsonElement flag = caps.getAsJsonObject("experimental").get(Protocol.EXTENSIONS_CAPABILITY);
        return flag == null || !flag.isJsonPrimitive() || !flag.getAsJsonPrimitive().isBoolean()
                || flag.getAsBoolean();
    }

    public Optional<Instant> getLastHeartbeat() {
        return Optional.ofNullable(lastHeartbeat);
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    /** The server process, when this client launched it over stdio. */
    public Optional<ProcessHandle> getProcess() {
        Transport t = transport;
        return t != null ? t.getProcess() : Optional.empty();
    }

    public LspClientOptions getOptions() {
        return options;
    }

    public ErrorRetriever getErrorRetriever() {
        return errorRetriever;
    }

    public ProtocolHandler getProtocolHandler() {
        return protocol;
    }

    @Override
    public String toString() {
        return "LspClient [" + options + ", state=" + state + "]";
    }
}
