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
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.analysisls.protocol.LspConnectionException;

/**
 * Tests for {@link WebSocketTransport} without a peer.
 */
class WebSocketTransportTests {

	private static int closedPort() throws IOException {
		try (ServerSocket socket = new ServerSocket(0)) {
			return socket.getLocalPort();
		}
	}

	@Test
	void testEndpointAndType() {
		WebSocketTransport transport = new WebSocketTransport("127.0.0.1", 9123, Duration.ofSeconds(1));
		Assertions.assertEquals("ws://127.0.0.1:9123/lsp", transport.getEndpoint().toString());
		Assertions.assertEquals(ConnectionType.WEBSOCKET, transport.getType());
		Assertions.assertFalse(transport.getProcess().isPresent());
	}

	@Test
	void testConnectRefused() throws IOException {
		WebSocketTransport transport = new WebSocketTransport("127.0.0.1", closedPort(), Duration.ofSeconds(2));
		Assertions.assertThrows(IOException.class, transport::connect);
		Assertions.assertFalse(transport.isConnected());
	}

	@Test
	void testSendWithoutConnectionFails() {
		WebSocketTransport transport = new WebSocketTransport("127.0.0.1", 9123, Duration.ofSeconds(1));
		Assertions.assertThrows(LspConnectionException.class,
				() -> transport.send("{}".getBytes(StandardCharsets.UTF_8)));
	}

	@Test
	void testDisconnectIsIdempotentAndEndsStream() throws IOException {
		WebSocketTransport transport = new WebSocketTransport("127.0.0.1", closedPort(), Duration.ofSeconds(1));
		transport.disconnect();
		transport.disconnect();

		Assertions.assertFalse(transport.isConnected());
		Assertions.assertNull(transport.receive());
		Assertions.assertNull(transport.receive(), "End of stream is sticky");
		Assertions.assertThrows(LspConnectionException.class,
				() -> transport.send("{}".getBytes(StandardCharsets.UTF_8)));
	}
}
