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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

public class Positions {
	private Positions() {
	}

	/**
	 * Reads a wire position ({@code {line, character}}, zero-based). Missing
	 * or non-numeric fields read as 0; negative values are clamped to 0.
	 *
	 * @return the position, or {@code null} if {@code json} is not an object
	 */
	public static Position fromJson(JsonElement json) {
		if (json == null || !json.isJsonObject()) {
			return null;
		}
		JsonObject object = json.getAsJsonObject();
		return new Position(readIndex(object, "line"), readIndex(object, "character"));
	}

	/** One-based line of a zero-based wire position. */
	public static int displayLine(Position p) {
		return p.getLine() + 1;
	}

	/** One-based column of a zero-based wire position. */
	public static int displayColumn(Position p) {
		return p.getCharacter() + 1;
	}

	private static int readIndex(JsonObject object, String key) {
		JsonElement value = object.get(key);
		if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
			return 0;
		}
		return Math.max(0, value.getAsInt());
	}
}
