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
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.analysisls.protocol.LspConnectionException;

/**
 * Tests for {@link TcpTransport} against a loopback socket.
 */
class TcpTransportTests {

	private ServerSocket serverSocket;
	private TcpTransport transport;

	@BeforeEach
	void setup() throws IOException {
		serverSocket = new ServerSocket(0);
		transport = new TcpTransport("127.0.0.1", serverSocket.getLocalPort(), Duration.ofSeconds(2));
	}

	@AfterEach
	void tearDown() throws IOException {
		transport.disconnect();
		serverSocket.close();
	}

	private static byte[] utf8(String text) {
		return text.getBytes(StandardCharsets.UTF_8);
	}

	@Test
	void testExchangesFramedMessages() throws Exception {
		CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
			try {
				return serverSocket.accept();
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
		});
		transport.connect();
		Assertions.assertTrue(transport.isConnected());
		Assertions.assertEquals(ConnectionType.TCP, transport.getType());

		try (Socket peer = accepted.get(5, TimeUnit.SECONDS)) {
			Assertions.assertNull(transport.send(utf8("{\"jsonrpc\":\"2.0\",\"method\":\"ping\"}")));
			InputStream in = peer.getInputStream();
			Assertions.assertEquals("{\"jsonrpc\":\"2.0\",\"method\":\"ping\"}",
					new String(MessageFraming.readFrame(in), StandardCharsets.UTF_8));

			OutputStream out = peer.getOutputStream();
			MessageFraming.writeFrame(out, utf8("{\"id\":\"1\",\"result\":\"hé\"}"));
			Assertions.assertEquals("{\"id\":\"1\",\"result\":\"hé\"}",
					new String(transport.receive(), StandardCharsets.UTF_8));
		}
	}

	@Test
	void testPeerCloseEndsStream() throws Exception {
		CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
			try {
				return serverSocket.accept();
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
		});
		transport.connect();
		accepted.get(5, TimeUnit.SECONDS).close();
		Assertions.assertNull(transport.receive());
	}

	@Test
	void testDisconnectClosesChannel() throws IOException {
		transport.connect();
		transport.disconnect();
		transport.disconnect();

		Assertions.assertFalse(transport.isConnected());
		Assertions.assertNull(transport.receive());
		Assertions.assertThrows(LspConnectionException.class, () -> transport.send(utf8("{}")));
	}

	@Test
	void testConnectRefused() throws IOException {
		int port = serverSocket.getLocalPort();
		serverSocket.close();
		TcpTransport refused = new TcpTransport("127.0.0.1", port, Duration.ofSeconds(2));
		Assertions.assertThrows(IOException.class, refused::connect);
		Assertions.assertFalse(refused.isConnected());
	}
}
