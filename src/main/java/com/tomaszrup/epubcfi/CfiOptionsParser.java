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
package com.tomaszrup.epubcfi;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses engine options from a JSON object such as
 * <pre>{@code {"ignoreClass": "annotator-hl", "useXPath": false, "logLevel": "DEBUG"}}</pre>
 * Unknown keys are ignored; values of the wrong JSON type leave the default.
 */
public final class CfiOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(CfiOptionsParser.class);

    private static final String IGNORE_CLASS_OPTION = "ignoreClass";
    private static final String USE_XPATH_OPTION = "useXPath";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    private CfiOptionsParser() {
        // utility class
    }

    /**
     * Parse options and apply the log level, if one is given.
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    public static CfiOptions parse(Object options) {
        if (!(options instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) options;

        String ignoreClass = stringOption(opts, IGNORE_CLASS_OPTION);
        if (ignoreClass != null) {
            logger.info("Ignoring elements with class '{}'", ignoreClass);
        }

        boolean useXPath = true;
        if (isPrimitive(opts, USE_XPATH_OPTION)) {
            useXPath = opts.get(USE_XPATH_OPTION).getAsBoolean();
            if (!useXPath) {
                logger.info("XPath lookup disabled via options");
            }
        }

        String logLevel = stringOption(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }
        return new CfiOptions(ignoreClass, useXPath, logLevel);
    }

    /**
     * Parses a JSON document.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static CfiOptions parseJson(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed options JSON: " + e.getMessage(), e);
        }
        return parse(element);
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     *
     * @return whether the level was changed
     */
    public static boolean applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return false;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
            return false;
        }
    }

    private static boolean isPrimitive(JsonObject opts, String key) {
        return opts.has(key) && opts.get(key).isJsonPrimitive();
    }

    private static String stringOption(JsonObject opts, String key) {
        if (!isPrimitive(opts, key)) {
            return null;
        }
        String value = opts.get(key).getAsString().trim();
        return value.isEmpty() ? null : value;
    }
}
