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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.StepKind;
import com.tomaszrup.epubcfi.model.Terminal;

/**
 * Builds CFI paths from live tree positions by walking parent links up to
 * the root.
 *
 * <p>With an active ignore filter, ignored elements are addressed through:
 * an ignored element contributes no step, a node inside one is addressed as
 * the logical text run around it, and offsets are re-expressed relative to
 * the start of that run. Stored CFIs therefore stay valid whether or not the
 * decoration is present.</p>
 *
 * @param <N> the host's node type
 */
public final class PathBuilder<N> {

	private final DocumentTree<N> tree;

	public PathBuilder(DocumentTree<N> tree) {
		this.tree = Objects.requireNonNull(tree, "tree");
	}

	/**
	 * Path from the root to {@code node}.
	 *
	 * @param offset      character offset, or {@code null} / negative for none
	 * @param ignoreClass class of elements to address through, may be {@code null}
	 */
	public Segment pathTo(N node, Integer offset, String ignoreClass) {
		return pathToFiltered(node, offset, IgnoreFilter.of(tree, ignoreClass));
	}

	/**
	 * Same as {@link #pathTo(Object, Integer, String)} with a filter built
	 * once by the caller.
	 */
	public Segment pathToFiltered(N node, Integer offset, IgnoreFilter<N> filter) {
		Objects.requireNonNull(node, "node");
		boolean hasOffset = offset != null && offset >= 0;
		int adjustedOffset = hasOffset ? offset : 0;

		N current = node;
		if (filter.isActive()) {
			N ignored = filter.topmostIgnored(node);
			if (ignored != null && ignored.equals(node)) {
				// an ignored element has no step of its own
				current = tree.getParent(node);
			} else if (ignored != null || tree.getKind(node) == NodeKind.TEXT) {
				N member = ignored != null ? ignored : node;
				N parent = tree.getParent(member);
				if (parent != null && hasOffset) {
					FilteredView<N> view = FilteredView.of(tree, parent, filter);
					FilteredView.Sibling<N> run = view.siblingOf(member);
					if (run != null) {
						adjustedOffset += view.lengthBefore(run, member);
					}
					if (ignored != null) {
						adjustedOffset += textBefore(ignored, node);
					}
				}
				current = member;
			}
		}

		List<Step> steps = new ArrayList<>();
		N root = tree.getRoot();
		while (current != null && !current.equals(root)) {
			N parent = tree.getParent(current);
			if (parent == null) {
				break;
			}
			Step step = stepFor(current, parent, filter);
			if (step != null) {
				steps.add(step);
			}
			current = parent;
		}
		Collections.reverse(steps);

		Terminal terminal = Terminal.NONE;
		if (hasOffset) {
			terminal = Terminal.at(adjustedOffset);
			Step last = steps.isEmpty() ? null : steps.get(steps.size() - 1);
			if (last == null || !last.isText()) {
				// offsets always anchor to text
				steps.add(Step.text(0));
			}
		}
		return Segment.of(steps, terminal);
	}

	/**
	 * Positional CFI for a node, without an offset.
	 */
	public Cfi fromNode(N node, Segment base, String ignoreClass) {
		return Cfi.positional(base, pathTo(node, null, ignoreClass));
	}

	/**
	 * CFI for the range between two boundaries. Identical boundaries produce
	 * a positional CFI.
	 */
	public Cfi rangeFrom(N startNode, int startOffset, N endNode, int endOffset,
			Segment base, String ignoreClass) {
		return rangeFromFiltered(startNode, startOffset, endNode, endOffset, base,
				IgnoreFilter.of(tree, ignoreClass));
	}

	/**
	 * Same as {@link #rangeFrom(Object, int, Object, int, Segment, String)}
	 * with a filter built once by the caller, for callers emitting many
	 * ranges over the same tree.
	 */
	public Cfi rangeFromFiltered(N startNode, int startOffset, N endNode, int endOffset,
			Segment base, IgnoreFilter<N> filter) {
		Objects.requireNonNull(filter, "filter");
		Segment start = pathToFiltered(startNode, startOffset, filter);
		if (startNode.equals(endNode) && startOffset == endOffset) {
			return Cfi.positional(base, start);
		}
		Segment end = pathToFiltered(endNode, endOffset, filter);
		return factor(base, start, end);
	}

	/**
	 * CFI for a boundary pair produced by a resolver or a host selection.
	 */
	public Cfi rangeFrom(BoundaryPair<N> boundaries, Segment base, String ignoreClass) {
		return rangeFrom(boundaries.getStart().getContainer(), boundaries.getStart().getOffset(),
				boundaries.getEnd().getContainer(), boundaries.getEnd().getOffset(),
				base, ignoreClass);
	}

	/**
	 * Moves the longest common run of leading steps into the shared path.
	 * The last step of {@code start} stays on the start suffix unless both
	 * boundaries turn out identical.
	 */
	static Cfi factor(Segment base, Segment start, Segment end) {
		List<Step> startSteps = start.getSteps();
		List<Step> endSteps = end.getSteps();
		int common = 0;
		for (int i = 0; i < startSteps.size(); i++) {
			if (i >= endSteps.size() || !startSteps.get(i).equals(endSteps.get(i))) {
				break;
			}
			if (i == startSteps.size() - 1) {
				if (endSteps.size() == startSteps.size() && start.getTerminal().equals(end.getTerminal())) {
					return Cfi.positional(base, start);
				}
				break;
			}
			common++;
		}
		Segment path = Segment.of(startSteps.subList(0, common));
		return Cfi.range(base, path, start.drop(common), end.drop(common));
	}

	private Step stepFor(N node, N parent, IgnoreFilter<N> filter) {
		FilteredView<N> view = FilteredView.of(tree, parent, filter);
		FilteredView.Sibling<N> sibling = view.siblingOf(node);
		if (sibling == null) {
			return null;
		}
		if (sibling.getKind() == StepKind.TEXT) {
			return Step.text(sibling.getIndex());
		}
		return Step.element(sibling.getIndex(), tree.getId(node));
	}

	/**
	 * Length of the text inside {@code container} that precedes {@code node}
	 * in document order.
	 */
	private int textBefore(N container, N node) {
		List<N> leaves = new ArrayList<>();
		FilteredView.collectText(tree, container, leaves);
		int length = 0;
		for (N leaf : leaves) {
			if (isSameOrDescendant(leaf, node)) {
				break;
			}
			length += tree.getTextLength(leaf);
		}
		return length;
	}

	private boolean isSameOrDescendant(N node, N ancestor) {
		N current = node;
		while (current != null) {
			if (current.equals(ancestor)) {
				return true;
			}
			current = tree.getParent(current);
		}
		return false;
	}
}
