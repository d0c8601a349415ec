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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.epubcfi.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.epubcfi.grammar.CfiParser;
import com.tomaszrup.epubcfi.model.Cfi;

class SortedCfisTests {

	private static final Comparator<Integer> NATURAL = Comparator.naturalOrder();

	// ------------------------------------------------------------------
	// locationOf()
	// ------------------------------------------------------------------

	@Test
	void testLocationOfEmpty() {
		Assertions.assertEquals(0, SortedCfis.locationOf(5, Collections.<Integer>emptyList(), NATURAL));
	}

	@Test
	void testLocationOfBetweenElements() {
		List<Integer> sorted = Arrays.asList(1, 3, 5, 7);
		Assertions.assertEquals(0, SortedCfis.locationOf(0, sorted, NATURAL));
		Assertions.assertEquals(2, SortedCfis.locationOf(4, sorted, NATURAL));
		Assertions.assertEquals(4, SortedCfis.locationOf(9, sorted, NATURAL));
	}

	@Test
	void testLocationOfExistingElement() {
		List<Integer> sorted = Arrays.asList(1, 3, 5, 7);
		Assertions.assertEquals(2, SortedCfis.locationOf(5, sorted, NATURAL));
	}

	// ------------------------------------------------------------------
	// indexOfSorted()
	// ------------------------------------------------------------------

	@Test
	void testIndexOfSorted() {
		List<Integer> sorted = Arrays.asList(2, 4, 6, 8, 10);
		Assertions.assertEquals(0, SortedCfis.indexOfSorted(2, sorted, NATURAL));
		Assertions.assertEquals(4, SortedCfis.indexOfSorted(10, sorted, NATURAL));
		Assertions.assertEquals(-1, SortedCfis.indexOfSorted(5, sorted, NATURAL));
		Assertions.assertEquals(-1, SortedCfis.indexOfSorted(5, Collections.<Integer>emptyList(), NATURAL));
	}

	// ------------------------------------------------------------------
	// insert()
	// ------------------------------------------------------------------

	@Test
	void testInsertKeepsOrder() {
		Random random = new Random(7);
		List<Integer> sorted = new ArrayList<>();
		for (int i = 0; i < 200; i++) {
			SortedCfis.insert(random.nextInt(1000), sorted, NATURAL);
		}
		List<Integer> expected = new ArrayList<>(sorted);
		Collections.sort(expected);
		Assertions.assertEquals(expected, sorted);
	}

	@Test
	void testInsertLargeListDoesNotRecurse() {
		List<Integer> sorted = new ArrayList<>();
		for (int i = 0; i < 100_000; i++) {
			sorted.add(i * 2);
		}
		Assertions.assertEquals(50_000, SortedCfis.insert(99_999, sorted, NATURAL));
		Assertions.assertEquals(99_999, sorted.get(50_000).intValue());
	}

	@Test
	void testInsertCfis() {
		List<Cfi> sorted = new ArrayList<>();
		SortedCfis.insert(CfiParser.parse("epubcfi(/6/4!/4/10/1:0)"), sorted, CfiPositions.COMPARATOR);
		SortedCfis.insert(CfiParser.parse("epubcfi(/6/2!/4/10/1:0)"), sorted, CfiPositions.COMPARATOR);
		SortedCfis.insert(CfiParser.parse("epubcfi(/6/4!/4/2/1:5)"), sorted, CfiPositions.COMPARATOR);
		Assertions.assertEquals("epubcfi(/6/2!/4/10/1:0)", sorted.get(0).toString());
		Assertions.assertEquals("epubcfi(/6/4!/4/2/1:5)", sorted.get(1).toString());
		Assertions.assertEquals("epubcfi(/6/4!/4/10/1:0)", sorted.get(2).toString());
	}
}
