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
package com.tomaszrup.epubcfi.utils;

import java.util.Comparator;
import java.util.List;

/**
 * Binary search over lists kept sorted by a comparator, typically
 * {@link CfiPositions#COMPARATOR}. Iterative, so large location indexes do
 * not grow the stack.
 */
public final class SortedCfis {

	private SortedCfis() {
		// utility class
	}

	/**
	 * Index at which {@code item} would be inserted to keep {@code sorted}
	 * ordered. When an equal element exists, its index is returned.
	 */
	public static <T> int locationOf(T item, List<? extends T> sorted, Comparator<? super T> comparator) {
		int low = 0;
		int high = sorted.size();
		while (low < high) {
			int pivot = (low + high) >>> 1;
			int compared = comparator.compare(sorted.get(pivot), item);
			if (compared == 0) {
				return pivot;
			}
			if (compared < 0) {
				low = pivot + 1;
			} else {
				high = pivot;
			}
		}
		return low;
	}

	/**
	 * @return the index of an element equal to {@code item}, or {@code -1}
	 */
	public static <T> int indexOfSorted(T item, List<? extends T> sorted, Comparator<? super T> comparator) {
		int low = 0;
		int high = sorted.size();
		while (low < high) {
			int pivot = (low + high) >>> 1;
			int compared = comparator.compare(sorted.get(pivot), item);
			if (compared == 0) {
				return pivot;
			}
			if (compared < 0) {
				low = pivot + 1;
			} else {
				high = pivot;
			}
		}
		return -1;
	}

	/**
	 * Inserts {@code item} into a mutable sorted list.
	 *
	 * @return the index it was inserted at
	 */
	public static <T> int insert(T item, List<T> sorted, Comparator<? super T> comparator) {
		int location = locationOf(item, sorted, comparator);
		sorted.add(location, item);
		return location;
	}
}
