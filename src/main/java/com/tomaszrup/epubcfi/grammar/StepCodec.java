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

import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.StepKind;

/**
 * Maps steps to the integers written in a CFI: element steps are even
 * ({@code 2 * (index + 1)}), text steps are odd ({@code 2 * index + 1}).
 */
public final class StepCodec {

	private StepCodec() {
		// utility class
	}

	public static int encode(StepKind kind, int siblingIndex) {
		if (siblingIndex < 0) {
			throw new IllegalArgumentException("Negative sibling index: " + siblingIndex);
		}
		return kind == StepKind.ELEMENT ? 2 * (siblingIndex + 1) : 2 * siblingIndex + 1;
	}

	public static int encode(Step step) {
		return encode(step.getKind(), step.getSiblingIndex());
	}

	/**
	 * Decodes a positive step integer.
	 *
	 * @throws IllegalArgumentException for zero or negative values
	 */
	public static Step decode(int encoded) {
		return decode(encoded, null);
	}

	public static Step decode(int encoded, String id) {
		if (encoded <= 0) {
			throw new IllegalArgumentException("Step value must be positive: " + encoded);
		}
		if (encoded % 2 == 0) {
			return Step.element(encoded / 2 - 1, id);
		}
		return Step.of(StepKind.TEXT, (encoded - 1) / 2, id);
	}

	/**
	 * Reads the leading decimal digits of a step token. Anything after the
	 * digits is ignored.
	 *
	 * @return the decoded value, or {@code -1} when the token does not start
	 *         with a digit or its value does not fit a step
	 */
	public static int leadingNumber(String token) {
		if (token == null) {
			return -1;
		}
		int end = 0;
		while (end < token.length() && Character.isDigit(token.charAt(end))) {
			end++;
		}
		if (end == 0) {
			return -1;
		}
		try {
			return Integer.parseInt(token.substring(0, end));
		} catch (NumberFormatException e) {
			return -1;
		}
	}
}
