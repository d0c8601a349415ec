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

import com.tomaszrup.epubcfi.model.Cfi;

public class CfiRanges {
	private CfiRanges() {
	}

	/**
	 * Whether {@code position} lies between the start and end of
	 * {@code range}, both ends included. A positional CFI only contains
	 * positions equal to itself.
	 */
	public static boolean contains(Cfi range, Cfi position) {
		return CfiPositions.COMPARATOR.compare(position, range.collapse(true)) >= 0
				&& CfiPositions.COMPARATOR.compare(position, range.collapse(false)) <= 0;
	}

	public static boolean intersect(Cfi r1, Cfi r2) {
		return contains(r1, r2.collapse(true)) || contains(r1, r2.collapse(false))
				|| contains(r2, r1.collapse(true));
	}

	/** Start boundary of a range as a positional CFI. */
	public static Cfi start(Cfi range) {
		return range.collapse(true);
	}

	/** End boundary of a range as a positional CFI. */
	public static Cfi end(Cfi range) {
		return range.collapse(false);
	}
}
