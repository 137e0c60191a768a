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
package com.tomaszrup.analysisls.errors;

import java.time.Instant;
import java.util.List;

import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

class CodeErrorTests {

	@Test
	void testDefaults() {
		CodeError error = CodeError.builder(new ErrorLocation("/src/a.py", 5, 3)).build();
		Assertions.assertEquals(CodeError.DEFAULT_MESSAGE, error.getMessage());
		Assertions.assertEquals(ErrorSeverity.ERROR, error.getSeverity());
		Assertions.assertEquals(CodeError.DEFAULT_SOURCE, error.getSource());
		Assertions.assertEquals("/src/a.py_4_2", error.getId());
		Assertions.assertTrue(error.isCritical());
		Assertions.assertTrue(error.getSuggestions().isEmpty());
	}

	@Test
	void testDisplayText() {
		CodeError point = CodeError.builder(new ErrorLocation("/src/pkg/mod.py", 12, 4))
				.severity(ErrorSeverity.WARNING)
				.message("unused import")
				.build();
		Assertions.assertEquals("[WARNING] mod.py:12:4 - unused import", point.getDisplayText());

		CodeError ranged = CodeError.builder(new ErrorLocation("C:\\work\\mod.py", 1, 1, 1, 9))
				.message("x")
				.build();
		Assertions.assertEquals("[ERROR] mod.py:1:1-1:9 - x", ranged.getDisplayText());
	}

	@Test
	void testCategoryIsDerivedFromSourceAndMessage() {
		CodeError error = CodeError.builder(new ErrorLocation("/a.py", 1, 1))
				.source("mypy")
				.message("Argument has incompatible type")
				.code("import-error")
				.build();
		Assertions.assertEquals(ErrorCategory.TYPE, error.getCategory());
	}

	@Test
	void testContextIsCopied() {
		JsonObject context = new JsonObject();
		context.addProperty("snippet", "x = 1");
		CodeError error = CodeError.builder(new ErrorLocation("/a.py", 1, 1)).context(context).build();
		context.addProperty("snippet", "changed");
		Assertions.assertEquals("x = 1", error.getContext().get("snippet").getAsString());
	}

	@Test
	void testToJsonUsesSnakeCase() {
		Instant at = Instant.parse("2026-01-02T03:04:05Z");
		CodeError error = CodeError.builder(new ErrorLocation("/a.py", 2, 5, 2, 8))
				.severity(ErrorSeverity.HINT)
				.message("consider f-string")
				.code("C0209")
				.suggestions(List.of("use f\"...\""))
				.relatedErrors(List.of("/a.py_0_0"))
				.timestamp(at)
				.build();
		JsonObject json = error.toJson();
		Assertions.assertEquals("hint", json.get("severity").getAsString());
		Assertions.assertEquals("C0209", json.get("code").getAsString());
		Assertions.assertEquals(8, json.getAsJsonObject("location").get("end_column").getAsInt());
		Assertions.assertEquals("/a.py", json.getAsJsonObject("location").get("file_path").getAsString());
		Assertions.assertEquals(1, json.getAsJsonArray("related_errors").size());
		Assertions.assertEquals("2026-01-02T03:04:05Z", json.get("timestamp").getAsString());
	}

	// ------------------------------------------------------------------
	// Severity mapping
	// ------------------------------------------------------------------

	@Test
	void testSeverityFromLspCode() {
		Assertions.assertEquals(ErrorSeverity.ERROR, ErrorSeverity.fromCode(1));
		Assertions.assertEquals(ErrorSeverity.WARNING, ErrorSeverity.fromCode(2));
		Assertions.assertEquals(ErrorSeverity.INFO, ErrorSeverity.fromCode(3));
		Assertions.assertEquals(ErrorSeverity.HINT, ErrorSeverity.fromCode(4));
		Assertions.assertEquals(ErrorSeverity.ERROR, ErrorSeverity.fromCode(99));
		Assertions.assertEquals(DiagnosticSeverity.Hint, ErrorSeverity.HINT.toLsp());
		Assertions.assertEquals(ErrorSeverity.ERROR, ErrorSeverity.fromLsp(null));
	}

	@Test
	void testSeverityFromId() {
		Assertions.assertEquals(ErrorSeverity.INFO, ErrorSeverity.fromId("info"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ErrorSeverity.fromId("fatal"));
	}
}
