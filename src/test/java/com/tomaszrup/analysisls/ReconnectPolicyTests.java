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
package com.tomaszrup.analysisls;

import java.time.Duration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.analysisls.transport.ConnectionType;

class ReconnectPolicyTests {

	@Test
	void testDelayDoublesUpToCeiling() {
		ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 5);
		Assertions.assertEquals(Duration.ofSeconds(1), policy.delayForAttempt(0));
		Assertions.assertEquals(Duration.ofSeconds(2), policy.delayForAttempt(1));
		Assertions.assertEquals(Duration.ofSeconds(4), policy.delayForAttempt(2));
		Assertions.assertEquals(Duration.ofSeconds(32), policy.delayForAttempt(5));
		Assertions.assertEquals(Duration.ofSeconds(60), policy.delayForAttempt(6));
		Assertions.assertEquals(Duration.ofSeconds(60), policy.delayForAttempt(500));
	}

	@Test
	void testZeroBaseMeansImmediateRetry() {
		ReconnectPolicy policy = new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(60), 3);
		Assertions.assertEquals(Duration.ZERO, policy.delayForAttempt(10));
	}

	@Test
	void testShouldRetryStopsAtMaxAttempts() {
		ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(10), Duration.ofMillis(100), 2);
		Assertions.assertTrue(policy.shouldRetry(0));
		Assertions.assertTrue(policy.shouldRetry(1));
		Assertions.assertFalse(policy.shouldRetry(2));
		Assertions.assertFalse(new ReconnectPolicy(Duration.ZERO, Duration.ZERO, 0).shouldRetry(0));
	}

	@Test
	void testInvalidArgumentsAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new ReconnectPolicy(Duration.ofMillis(-1), Duration.ZERO, 1));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new ReconnectPolicy(Duration.ZERO, Duration.ZERO, -1));
		ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(1), Duration.ofMillis(1), 1);
		Assertions.assertThrows(IllegalArgumentException.class, () -> policy.delayForAttempt(-1));
	}

	@Test
	void testFromOptionsUsesClientDefaults() {
		ReconnectPolicy policy = ReconnectPolicy.from(
				LspClientOptions.builder(ConnectionType.TCP).host("localhost").port(7000).build());
		Assertions.assertEquals(5, policy.getMaxAttempts());
		Assertions.assertEquals(Duration.ofSeconds(1), policy.delayForAttempt(0));
		Assertions.assertEquals(Duration.ofSeconds(60), policy.delayForAttempt(10));
	}
}
