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

import java.util.Arrays;

import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.model.Step;

/**
 * Builds the base component that routes a CFI to a spine item.
 */
public final class CfiBases {

	private CfiBases() {
		// utility class
	}

	/**
	 * Base segment {@code /(spineNodeIndex+1)*2/(position+1)*2[idref]}.
	 *
	 * @param spineNodeIndex element index of the {@code spine} node inside the package document
	 * @param position       zero-based position of the item in the spine
	 * @param idref          id of the itemref, may be {@code null}
	 */
	public static Segment baseFor(int spineNodeIndex, int position, String idref) {
		return Segment.of(Arrays.asList(Step.element(spineNodeIndex), Step.element(position, idref)));
	}

	/** String form of {@link #baseFor(int, int, String)}. */
	public static String baseString(int spineNodeIndex, int position, String idref) {
		return CfiSerializer.segmentString(baseFor(spineNodeIndex, position, idref));
	}
}
