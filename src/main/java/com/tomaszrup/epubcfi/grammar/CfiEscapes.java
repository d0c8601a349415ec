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

/**
 * Circumflex escaping and bracket-aware splitting for CFI strings.
 *
 * <p>Inside an id assertion the characters {@code ^ [ ] ( ) , ; =} are
 * written with a leading {@code ^}. A text-location assertion uses
 * {@code , ; =} as its own separators, so only {@code ^ [ ] ( )} are
 * escaped there. Separators ({@code ! , : /}) only count when they appear
 * outside square brackets and are not escaped.</p>
 */
final class CfiEscapes {

	private static final String SPECIAL = "^[](),;=";
	private static final String TEXT_ASSERTION_SPECIAL = "^[]()";

	private CfiEscapes() {
		// utility class
	}

	static String escape(String raw) {
		return escape(raw, SPECIAL);
	}

	/**
	 * Escapes a text-location assertion such as {@code prevword,nextword},
	 * keeping its parameter separators as written.
	 */
	static String escapeTextAssertion(String raw) {
		return escape(raw, TEXT_ASSERTION_SPECIAL);
	}

	private static String escape(String raw, String special) {
		if (raw == null || raw.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder(raw.length() + 4);
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			if (special.indexOf(c) >= 0) {
				sb.append('^');
			}
			sb.append(c);
		}
		return sb.toString();
	}

	static String unescape(String escaped) {
		if (escaped == null || escaped.indexOf('^') < 0) {
			return escaped;
		}
		StringBuilder sb = new StringBuilder(escaped.length());
		for (int i = 0; i < escaped.length(); i++) {
			char c = escaped.charAt(i);
			if (c == '^' && i + 1 < escaped.length()) {
				i++;
				c = escaped.charAt(i);
			}
			sb.append(c);
		}
		return sb.toString();
	}

	/**
	 * Splits on every top-level occurrence of {@code separator}.
	 */
	static List<String> split(String text, char separator) {
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int from = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '^') {
				i++;
			} else if (c == '[') {
				depth++;
			} else if (c == ']') {
				if (depth > 0) {
					depth--;
				}
			} else if (c == separator && depth == 0) {
				parts.add(text.substring(from, i));
				from = i + 1;
			}
		}
		parts.add(text.substring(Math.min(from, text.length())));
		return parts;
	}

	/**
	 * Index of the first top-level occurrence of {@code separator}, or -1.
	 */
	static int indexOf(String text, char separator) {
		int depth = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '^') {
				i++;
			} else if (c == '[') {
				depth++;
			} else if (c == ']') {
				if (depth > 0) {
					depth--;
				}
			} else if (c == separator && depth == 0) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Content of the first top-level bracket pair, unescaped.
	 *
	 * @return the bracket content, or {@code null} when there is none
	 */
	static String bracketContent(String token) {
		int open = -1;
		for (int i = 0; i < token.length(); i++) {
			char c = token.charAt(i);
			if (c == '^') {
				i++;
			} else if (c == '[') {
				open = i;
				break;
			}
		}
		if (open < 0) {
			return null;
		}
		int depth = 0;
		for (int i = open; i < token.length(); i++) {
			char c = token.charAt(i);
			if (c == '^') {
				i++;
			} else if (c == '[') {
				depth++;
			} else if (c == ']') {
				depth--;
				if (depth == 0) {
					return unescape(token.substring(open + 1, i));
				}
			}
		}
		return null;
	}
}
