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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.analysisls.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tomaszrup.analysisls.ClientState;
import com.tomaszrup.analysisls.LspClient;
import com.tomaszrup.analysisls.LspClientOptions;
import com.tomaszrup.analysisls.ScriptedTransport;
import com.tomaszrup.analysisls.protocol.LspConnectionException;
import com.tomaszrup.analysisls.protocol.Message;
import com.tomaszrup.analysisls.protocol.MessageCodec;
import com.tomaszrup.analysisls.protocol.NotificationMessage;
import com.tomaszrup.analysisls.protocol.Protocol;
import com.tomaszrup.analysisls.protocol.RequestMessage;
import com.tomaszrup.analysisls.protocol.ResponseMessage;

/**
 * Tests for {@link HttpTransport} and the request-per-call client path
 * against the JDK's embedded HTTP server.
 */
class HttpTransportTests {

	private final MessageCodec codec = new MessageCodec();
	private final List<String> received = new CopyOnWriteArrayList<>();
	private volatile int forcedStatus;
	private HttpServer server;
	private HttpTransport transport;

	@BeforeEach
	void setup() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/lsp", this::handle);
		server.start();
		transport = new HttpTransport("127.0.0.1", server.getAddress().getPort(), Duration.ofSeconds(2),
				Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() {
		transport.disconnect();
		server.stop(0);
	}

	private void handle(HttpExchange exchange) throws IOException {
		try {
			if (forcedStatus != 0) {
				exchange.sendResponseHeaders(forcedStatus, -1);
				return;
			}
			Message message = codec.decode(exchange.getRequestBody().readAllBytes());
			if (message instanceof NotificationMessage) {
				received.add(((NotificationMessage) message).getMethod());
				exchange.sendResponseHeaders(204, -1);
				return;
			}
			RequestMessage request = (RequestMessage) message;
			received.add(request.getMethod());
			byte[] reply = codec.encode(ResponseMessage.success(request.getId(), resultFor(request)));
			exchange.getResponseHeaders().set("Content-Type", "application/json");
			exchange.sendResponseHeaders(200, reply.length);
			exchange.getResponseBody().write(reply);
		} finally {
			exchange.close();
		}
	}

	private static JsonElement resultFor(RequestMessage request) {
		if (Protocol.INITIALIZE.equals(request.getMethod())) {
			return ScriptedTransport.initializeResult(true);
		}
		if ("custom/echo".equals(request.getMethod())) {
			return request.getParams();
		}
		return JsonNull.INSTANCE;
	}

	private static byte[] utf8(String text) {
		return text.getBytes(StandardCharsets.UTF_8);
	}

	// ------------------------------------------------------------------
	// Transport
	// ------------------------------------------------------------------

	@Test
	void testPostsMessageAndReturnsReply() throws IOException {
		transport.connect();
		Assertions.assertTrue(transport.isConnected());
		Assertions.assertEquals(ConnectionType.HTTP, transport.getType());
		Assertions.assertEquals("/lsp", transport.getEndpoint().getPath());

		byte[] reply = transport.send(utf8("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"custom/echo\",\"params\":{\"a\":1}}"));
		ResponseMessage response = (ResponseMessage) codec.decode(reply);
		Assertions.assertEquals("7", response.getId());
		Assertions.assertEquals(1, response.getResult().getAsJsonObject().get("a").getAsInt());
		Assertions.assertNull(transport.receive());
	}

	@Test
	void testNotificationGetsEmptyReply() throws IOException {
		transport.connect();
		byte[] reply = transport.send(utf8("{\"jsonrpc\":\"2.0\",\"method\":\"initialized\",\"params\":{}}"));
		Assertions.assertEquals(0, reply.length);
		Assertions.assertEquals(List.of(Protocol.INITIALIZED), received);
	}

	@Test
	void testErrorStatusFailsSend() {
		forcedStatus = 500;
		transport.connect();
		IOException e = Assertions.assertThrows(IOException.class, () -> transport.send(utf8("{}")));
		Assertions.assertTrue(e.getMessage().contains("500"));
	}

	@Test
	void testSendRequiresConnect() {
		Assertions.assertThrows(LspConnectionException.class, () -> transport.send(utf8("{}")));
		transport.connect();
		transport.disconnect();
		Assertions.assertFalse(transport.isConnected());
		Assertions.assertThrows(LspConnectionException.class, () -> transport.send(utf8("{}")));
	}

	// ------------------------------------------------------------------
	// Client over http
	// ------------------------------------------------------------------

	@Test
	void testClientHandshakeAndRequest() throws InterruptedException {
		LspClientOptions options = LspClientOptions.builder(ConnectionType.HTTP)
				.host("127.0.0.1")
				.port(server.getAddress().getPort())
				.heartbeatInterval(Duration.ofMillis(20))
				.requestTimeout(Duration.ofSeconds(5))
				.build();
		try (LspClient client = new LspClient(options)) {
			Assertions.assertTrue(client.connect());
			Assertions.assertEquals(ClientState.READY, client.getState());
			Assertions.assertTrue(client.supportsExtensions());

			JsonObject params = new JsonObject();
			params.addProperty("value", "hello");
			JsonElement result = client.request("custom/echo", params, null);
			Assertions.assertEquals("hello", result.getAsJsonObject().get("value").getAsString());
			Assertions.assertTrue(client.getProtocolHandler().getPendingRequestIds().isEmpty());

			Thread.sleep(100);
			Assertions.assertEquals(List.of(Protocol.INITIALIZE, Protocol.INITIALIZED, "custom/echo"), received,
					"No heartbeat is sent over http");

			client.disconnect();
			Assertions.assertEquals(ClientState.DISCONNECTED, client.getState());
			Assertions.assertEquals(List.of(Protocol.SHUTDOWN, Protocol.EXIT), received.subList(3, 5));
		}
	}
}
