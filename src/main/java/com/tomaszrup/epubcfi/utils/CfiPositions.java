////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.epubcfi.utils;

import java.util.Comparator;
import java.util.List;

import com.tomaszrup.epubcfi.grammar.CfiParser;
import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.Terminal;

/**
 * Document-order comparison of CFIs.
 *
 * <p>Container ordinals are compared first, then sibling indices step by
 * step (node kind and id assertions are not looked at), then terminal
 * offsets with a missing offset counting as 0. A path that is a prefix of a
 * longer one sorts first. Ranges are ordered by their start boundary.</p>
 */
public class CfiPositions {
	private CfiPositions() {
	}

	public static final Comparator<Cfi> COMPARATOR = (Cfi a, Cfi b) -> {
		if (a.getContainerOrdinal() != b.getContainerOrdinal()) {
			return a.getContainerOrdinal() > b.getContainerOrdinal() ? 1 : -1;
		}

		List<Step> stepsA = anchorSteps(a);
		List<Step> stepsB = anchorSteps(b);
		for (int i = 0; i < stepsA.size(); i++) {
			if (i >= stepsB.size()) {
				return 1;
			}
			int indexA = stepsA.get(i).getSiblingIndex();
			int indexB = stepsB.get(i).getSiblingIndex();
			if (indexA != indexB) {
				return indexA > indexB ? 1 : -1;
			}
		}
		if (stepsA.size() < stepsB.size()) {
			return -1;
		}

		int offsetA = anchorTerminal(a).offsetOrZero();
		int offsetB = anchorTerminal(b).offsetOrZero();
		if (offsetA != offsetB) {
			return offsetA > offsetB ? 1 : -1;
		}
		return 0;
	};

	/** Compares two CFI strings after parsing them. */
	public static int compare(String a, String b) {
		return COMPARATOR.compare(CfiParser.parse(a), CfiParser.parse(b));
	}

	public static boolean valid(Cfi cfi) {
		return cfi != null && cfi.isValid();
	}

	/** Steps used for ordering: {@code path ++ start} for a range. */
	static List<Step> anchorSteps(Cfi cfi) {
		return cfi.startSegment().getSteps();
	}

	static Terminal anchorTerminal(Cfi cfi) {
		return cfi.startSegment().getTerminal();
	}
}
