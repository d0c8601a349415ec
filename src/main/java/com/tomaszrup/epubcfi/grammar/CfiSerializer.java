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

import java.util.List;

import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.Terminal;

/**
 * Writes {@link Cfi} values back to their {@code epubcfi(...)} form. The
 * output parses back into an equal value.
 */
public final class CfiSerializer {

	private CfiSerializer() {
		// utility class
	}

	public static String serialize(Cfi cfi) {
		StringBuilder sb = new StringBuilder(64);
		sb.append(CfiParser.PREFIX);
		appendSegment(sb, cfi.getBase());
		sb.append('!');
		appendSegment(sb, cfi.getPath());
		if (cfi.isRange()) {
			sb.append(',');
			appendSegment(sb, cfi.getStart());
			sb.append(',');
			appendSegment(sb, cfi.getEnd());
		}
		sb.append(CfiParser.SUFFIX);
		return sb.toString();
	}

	public static String segmentString(Segment segment) {
		StringBuilder sb = new StringBuilder(32);
		appendSegment(sb, segment);
		return sb.toString();
	}

	/**
	 * Joins encoded steps with {@code /}, without a leading slash.
	 */
	public static String joinSteps(List<Step> steps) {
		StringBuilder sb = new StringBuilder(steps.size() * 4);
		for (int i = 0; i < steps.size(); i++) {
			if (i > 0) {
				sb.append('/');
			}
			appendStep(sb, steps.get(i));
		}
		return sb.toString();
	}

	private static void appendSegment(StringBuilder sb, Segment segment) {
		sb.append('/');
		sb.append(joinSteps(segment.getSteps()));
		Terminal terminal = segment.getTerminal();
		if (terminal.hasOffset()) {
			sb.append(':').append(terminal.getOffset());
			if (!terminal.getAssertion().isEmpty()) {
				sb.append('[').append(CfiEscapes.escapeTextAssertion(terminal.getAssertion())).append(']');
			}
		}
	}

	private static void appendStep(StringBuilder sb, Step step) {
		sb.append(StepCodec.encode(step));
		if (step.hasId()) {
			sb.append('[').append(CfiEscapes.escape(step.getId())).append(']');
		}
	}
}
