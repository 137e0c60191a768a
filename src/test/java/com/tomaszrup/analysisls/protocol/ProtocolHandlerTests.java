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
package com.tomaszrup.analysisls.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

class ProtocolHandlerTests {

	private ProtocolHandler handler;

	@BeforeEach
	void setup() {
		handler = new ProtocolHandler();
	}

	// ------------------------------------------------------------------
	// Correlation
	// ------------------------------------------------------------------

	@Test
	void testIdsAreUniqueAndIncreasing() {
		RequestMessage first = handler.createRequest("a", null);
		RequestMessage second = handler.createRequest("b", null);
		Assertions.assertNotEquals(first.getId(), second.getId());
		Assertions.assertTrue(Long.parseLong(second.getId()) > Long.parseLong(first.getId()));
	}

	@Test
	void testResponseResolvesMatchingRequestOnce() throws Exception {
		RequestMessage request = handler.createRequest("serena/getErrors", new JsonObject());
		CompletableFuture<JsonElement> result = handler.trackRequest(request);
		Assertions.assertTrue(handler.isPending(request.getId()));

		handler.handleMessage(ResponseMessage.success(request.getId(), new JsonPrimitive(42)));
		handler.handleMessage(ResponseMessage.success(request.getId(), new JsonPrimitive(43)));

		Assertions.assertEquals(42, result.get().getAsInt());
		Assertions.assertFalse(handler.isPending(request.getId()));
		Assertions.assertTrue(handler.getPendingRequestIds().isEmpty());
	}

	@Test
	void testUnknownResponseIsDropped() {
		RequestMessage request = handler.createRequest("m", null);
		CompletableFuture<JsonElement> result = handler.trackRequest(request);
		Optional<ResponseMessage> reply = handler.handleMessage(ResponseMessage.success("999", new JsonObject()));
		Assertions.assertFalse(reply.isPresent());
		Assertions.assertFalse(result.isDone());
		Assertions.assertTrue(handler.isPending(request.getId()));
	}

	@Test
	void testErrorResponseCompletesExceptionally() {
		RequestMessage request = handler.createRequest("serena/analyzeFile", null);
		CompletableFuture<JsonElement> result = handler.trackRequest(request);
		handler.handleMessage(ResponseMessage.failure(request.getId(),
				new ResponseError(ResponseErrorCode.InvalidParams, "bad params")));

		ExecutionException e = Assertions.assertThrows(ExecutionException.class, result::get);
		Assertions.assertTrue(e.getCause() instanceof LspResponseException);
		Assertions.assertEquals(ResponseErrorCode.InvalidParams.getValue(),
				((LspResponseException) e.getCause()).getError().getCode());
	}

	@Test
	void testNullResultBecomesJsonNull() throws Exception {
		RequestMessage request = handler.createRequest("shutdown", null);
		CompletableFuture<JsonElement> result = handler.trackRequest(request);
		handler.handleMessage(ResponseMessage.success(request.getId(), null));
		Assertions.assertTrue(result.get().isJsonNull());
	}

	@Test
	void testCancelledRequestIgnoresLateResponse() {
		RequestMessage request = handler.createRequest("m", null);
		CompletableFuture<JsonElement> result = handler.trackRequest(request);
		Assertions.assertTrue(handler.cancelRequest(request.getId()));
		Assertions.assertFalse(handler.cancelRequest(request.getId()));

		handler.handleMessage(ResponseMessage.success(request.getId(), new JsonPrimitive(1)));
		Assertions.assertTrue(result.isCancelled());
		Assertions.assertTrue(handler.getPendingRequestIds().isEmpty());
	}

	@Test
	void testDuplicateTrackingIsRejected() {
		RequestMessage request = handler.createRequest("m", null);
		handler.trackRequest(request);
		Assertions.assertThrows(IllegalStateException.class, () -> handler.trackRequest(request));
	}

	@Test
	void testFailAllRejectsEverything() {
		CompletableFuture<JsonElement> a = handler.trackRequest(handler.createRequest("a", null));
		CompletableFuture<JsonElement> b = handler.trackRequest(handler.createRequest("b", null));
		handler.failAll(new LspConnectionException("gone"));

		Assertions.assertTrue(a.isCompletedExceptionally());
		Assertions.assertTrue(b.isCompletedExceptionally());
		Assertions.assertTrue(handler.getPendingRequestIds().isEmpty());
	}

	// ------------------------------------------------------------------
	// Notifications
	// ------------------------------------------------------------------

	@Test
	void testNotificationHandlersAreIsolated() {
		List<String> calls = new ArrayList<>();
		handler.registerNotificationHandler("serena/progress", params -> {
			throw new IllegalStateException("broken handler");
		});
		handler.registerNotificationHandler("serena/progress", params -> calls.add("second"));

		handler.handleMessage(new NotificationMessage("serena/progress", null));
		Assertions.assertEquals(List.of("second"), calls);
	}

	@Test
	void testRemovedNotificationHandlerIsNotCalled() {
		List<JsonElement> seen = new ArrayList<>();
		java.util.function.Consumer<JsonElement> h = seen::add;
		handler.registerNotificationHandler("x", h);
		handler.removeNotificationHandler("x", h);
		handler.handleMessage(new NotificationMessage("x", new JsonObject()));
		Assertions.assertTrue(seen.isEmpty());
	}

	// ------------------------------------------------------------------
	// Server requests
	// ------------------------------------------------------------------

	@Test
	void testUnknownServerRequestGetsMethodNotFound() {
		Optional<ResponseMessage> reply = handler.handleMessage(new RequestMessage("s1", "window/showMessageRequest", null));
		Assertions.assertTrue(reply.isPresent());
		Assertions.assertEquals("s1", reply.get().getId());
		Assertions.assertEquals(ResponseErrorCode.MethodNotFound.getValue(), reply.get().getError().getCode());
	}

	@Test
	void testWorkspaceConfigurationIsAnsweredWithNulls() {
		JsonObject params = new JsonObject();
		JsonArray items = new JsonArray();
		items.add(new JsonObject());
		items.add(new JsonObject());
		params.add("items", items);

		ResponseMessage reply = handler.handleMessage(
				new RequestMessage("s2", Protocol.WORKSPACE_CONFIGURATION, params)).orElseThrow();
		Assertions.assertFalse(reply.isError());
		Assertions.assertEquals(2, reply.getResult().getAsJsonArray().size());
		Assertions.assertTrue(reply.getResult().getAsJsonArray().get(0).isJsonNull());
	}

	@Test
	void testFailingRequestHandlerProducesInternalError() {
		handler.registerRequestHandler("custom/boom", params -> {
			throw new IllegalArgumentException("bad");
		});
		ResponseMessage reply = handler.handleMessage(new RequestMessage("s3", "custom/boom", null)).orElseThrow();
		Assertions.assertEquals(ResponseErrorCode.InternalError.getValue(), reply.getError().getCode());
	}
}
