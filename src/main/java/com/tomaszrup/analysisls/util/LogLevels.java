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
package com.tomaszrup.analysisls.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

public final class LogLevels {

	private static final Logger logger = LoggerFactory.getLogger(LogLevels.class);

	private LogLevels() {
	}

	/**
	 * Dynamically set the Logback root logger level from a string value.
	 * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
	 * Invalid values are ignored and a warning is logged.
	 *
	 * @return whether the level was applied
	 */
	public static boolean apply(String levelName) {
		try {
			Level level = levelName != null ? Level.toLevel(levelName, null) : null;
			if (level == null) {
				logger.warn("Unknown log level '{}', keeping current level", levelName);
				return false;
			}
			ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
					LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
			Level previous = root.getLevel();
			root.setLevel(level);
			logger.debug("Log level changed from {} to {}", previous, level);
			return true;
		} catch (ClassCastException e) {
			logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
			return false;
		}
	}

	/** Current root level name, or {@code null} when Logback is not the backend. */
	public static String current() {
		org.slf4j.Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger) {
			Level level = ((ch.qos.logback.classic.Logger) root).getLevel();
			return level != null ? level.toString() : null;
		}
		return null;
	}
}
