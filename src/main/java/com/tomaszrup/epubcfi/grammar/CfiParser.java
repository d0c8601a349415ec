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
package com.tomaszrup.epubcfi.grammar;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.Terminal;

/**
 * Parses {@code epubcfi(...)} strings into {@link Cfi} values.
 *
 * <p>Parsing is lenient: step tokens that do not start with a number are
 * dropped, a non-numeric terminal offset reads as 0, and a missing or
 * too-short base yields {@link Cfi#invalid()} instead of an exception.</p>
 */
public final class CfiParser {
	private static final Logger logger = LoggerFactory.getLogger(CfiParser.class);

	static final String PREFIX = "epubcfi(";
	static final String SUFFIX = ")";

	private CfiParser() {
		// utility class
	}

	/**
	 * @return {@code true} when the string is wrapped in {@code epubcfi( ... )}
	 */
	public static boolean isCfiString(String text) {
		return text != null && text.startsWith(PREFIX) && text.endsWith(SUFFIX);
	}

	public static Cfi parse(String text) {
		if (text == null) {
			return Cfi.invalid();
		}
		String body = text;
		if (isCfiString(body)) {
			body = body.substring(PREFIX.length(), body.length() - SUFFIX.length());
		}

		List<String> indirection = CfiEscapes.split(body, '!');
		String baseComponent = indirection.get(0);
		if (baseComponent.isEmpty()) {
			return Cfi.invalid();
		}
		Segment base = parseComponent(baseComponent);
		if (base.size() < 2) {
			logger.debug("CFI base '{}' has fewer than two steps", baseComponent);
			return Cfi.invalid();
		}

		if (indirection.size() < 2) {
			return Cfi.positional(base, Segment.EMPTY);
		}
		List<String> ranges = CfiEscapes.split(indirection.get(1), ',');
		Segment path = parseComponent(ranges.get(0));
		if (ranges.size() == 3) {
			return Cfi.range(base, path, parseComponent(ranges.get(1)), parseComponent(ranges.get(2)));
		}
		return Cfi.positional(base, path);
	}

	/**
	 * Parses one {@code /step/step:terminal} component.
	 */
	public static Segment parseComponent(String component) {
		if (component == null || component.isEmpty()) {
			return Segment.EMPTY;
		}
		int colon = CfiEscapes.indexOf(component, ':');
		String stepsPart = colon >= 0 ? component.substring(0, colon) : component;
		Terminal terminal = colon >= 0 ? parseTerminal(component.substring(colon + 1)) : Terminal.NONE;

		List<String> tokens = CfiEscapes.split(stepsPart, '/');
		List<Step> steps = new ArrayList<>(tokens.size());
		for (int i = 0; i < tokens.size(); i++) {
			String token = tokens.get(i);
			if (i == 0 && token.isEmpty()) {
				continue;
			}
			Step step = parseStep(token);
			if (step != null) {
				steps.add(step);
			} else {
				logger.debug("Dropping unrecognised CFI step token '{}'", token);
			}
		}
		return Segment.of(steps, terminal);
	}

	/**
	 * @return the decoded step, or {@code null} when the token is not numeric
	 */
	static Step parseStep(String token) {
		int value = StepCodec.leadingNumber(token);
		if (value <= 0) {
			return null;
		}
		return StepCodec.decode(value, CfiEscapes.bracketContent(token));
	}

	static Terminal parseTerminal(String terminal) {
		int value = StepCodec.leadingNumber(terminal);
		String assertion = CfiEscapes.bracketContent(terminal);
		return Terminal.of(Math.max(value, 0), assertion != null ? assertion : "");
	}
}
