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
package com.tomaszrup.epubcfi.tree;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.model.StepKind;

/**
 * Best-effort placement of a character offset that does not fit the text
 * node a CFI resolved to, e.g. after a text node was split or decoration
 * was added around it.
 *
 * <p>The parent's children are re-read as merged text runs, the run with
 * the step's text index is picked, and its text leaves are walked while
 * subtracting their lengths. When several leaves could hold the offset the
 * earliest wins, so an offset at a leaf boundary lands at the end of the
 * earlier leaf. An offset past the whole run is clamped to the run's end.
 * Never throws; work is bounded by the number of siblings and leaves.</p>
 */
final class OffsetRepair {
	private static final Logger logger = LoggerFactory.getLogger(OffsetRepair.class);

	private OffsetRepair() {
		// utility class
	}

	/**
	 * @return the repaired boundary, or {@code null} when the parent has no
	 *         text run with that index
	 */
	static <N> Boundary<N> repair(DocumentTree<N> tree, N parent, int textIndex, int offset,
			IgnoreFilter<N> filter) {
		if (parent == null) {
			return null;
		}
		FilteredView<N> view = FilteredView.merged(tree, parent, filter);
		FilteredView.Sibling<N> run = view.get(StepKind.TEXT, textIndex);
		if (run == null) {
			logger.debug("No text run #{} to repair offset {} against", textIndex, offset);
			return null;
		}
		Boundary<N> repaired = locate(tree, run, offset);
		logger.debug("Repaired offset {} in text run #{} to {}", offset, textIndex, repaired);
		return repaired;
	}

	/**
	 * Finds the text leaf of {@code run} holding {@code offset}, counted from
	 * the start of the run.
	 */
	static <N> Boundary<N> locate(DocumentTree<N> tree, FilteredView.Sibling<N> run, int offset) {
		List<N> leaves = FilteredView.textLeaves(tree, run);
		if (leaves.isEmpty()) {
			return new Boundary<>(run.first(), 0);
		}
		int remaining = Math.max(offset, 0);
		for (N leaf : leaves) {
			int length = tree.getTextLength(leaf);
			if (remaining <= length) {
				return new Boundary<>(leaf, remaining);
			}
			remaining -= length;
		}
		N last = leaves.get(leaves.size() - 1);
		return new Boundary<>(last, tree.getTextLength(last));
	}
}
