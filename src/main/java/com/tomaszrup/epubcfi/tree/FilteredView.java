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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.tomaszrup.epubcfi.model.StepKind;

/**
 * Logical children of one parent node, the list CFI sibling indices count.
 *
 * <p>Without merging every element and every text node is its own sibling.
 * With merging, ignored elements count as text and each maximal run of
 * adjacent text nodes and ignored elements becomes a single text sibling.
 * Nodes of kind {@link NodeKind#OTHER} are skipped and do not break a run.</p>
 *
 * @param <N> the host's node type
 */
public final class FilteredView<N> {

	/** One logical child: an element, or a run of raw nodes read as one text. */
	public static final class Sibling<N> {
		private final StepKind kind;
		private final int index;
		private final List<N> members = new ArrayList<>(1);

		private Sibling(StepKind kind, int index, N first) {
			this.kind = kind;
			this.index = index;
			members.add(first);
		}

		public StepKind getKind() {
			return kind;
		}

		/** Index among logical siblings of the same kind. */
		public int getIndex() {
			return index;
		}

		public List<N> getMembers() {
			return Collections.unmodifiableList(members);
		}

		public N first() {
			return members.get(0);
		}

		public boolean contains(N node) {
			return members.contains(node);
		}
	}

	private final DocumentTree<N> tree;
	private final List<Sibling<N>> siblings;

	private FilteredView(DocumentTree<N> tree, List<Sibling<N>> siblings) {
		this.tree = tree;
		this.siblings = siblings;
	}

	/**
	 * View used for indexing: merges text runs only when the filter is active.
	 */
	public static <N> FilteredView<N> of(DocumentTree<N> tree, N parent, IgnoreFilter<N> filter) {
		return build(tree, parent, filter, filter.isActive());
	}

	/**
	 * View that always merges adjacent text, used when repairing offsets.
	 */
	public static <N> FilteredView<N> merged(DocumentTree<N> tree, N parent, IgnoreFilter<N> filter) {
		return build(tree, parent, filter, true);
	}

	private static <N> FilteredView<N> build(DocumentTree<N> tree, N parent, IgnoreFilter<N> filter,
			boolean mergeText) {
		List<Sibling<N>> siblings = new ArrayList<>();
		int elementCount = 0;
		int textCount = 0;
		Sibling<N> openRun = null;
		for (N child : tree.getChildren(parent)) {
			NodeKind kind = tree.getKind(child);
			if (kind == NodeKind.OTHER) {
				continue;
			}
			if (kind == NodeKind.ELEMENT && !filter.test(child)) {
				siblings.add(new Sibling<>(StepKind.ELEMENT, elementCount++, child));
				openRun = null;
			} else if (mergeText && openRun != null) {
				openRun.members.add(child);
			} else {
				Sibling<N> run = new Sibling<>(StepKind.TEXT, textCount++, child);
				siblings.add(run);
				openRun = mergeText ? run : null;
			}
		}
		return new FilteredView<>(tree, siblings);
	}

	public List<Sibling<N>> getSiblings() {
		return Collections.unmodifiableList(siblings);
	}

	/**
	 * @return the {@code index}-th sibling of the given kind, or {@code null}
	 */
	public Sibling<N> get(StepKind kind, int index) {
		for (Sibling<N> sibling : siblings) {
			if (sibling.kind == kind && sibling.index == index) {
				return sibling;
			}
		}
		return null;
	}

	/**
	 * @return the logical sibling that contains the raw child, or {@code null}
	 */
	public Sibling<N> siblingOf(N rawChild) {
		for (Sibling<N> sibling : siblings) {
			if (sibling.contains(rawChild)) {
				return sibling;
			}
		}
		return null;
	}

	/**
	 * Total text length of the members of {@code run} that come before
	 * {@code member}.
	 */
	public int lengthBefore(Sibling<N> run, N member) {
		int length = 0;
		for (N node : run.members) {
			if (node.equals(member)) {
				break;
			}
			length += tree.getTextLength(node);
		}
		return length;
	}

	/**
	 * Raw text nodes of a run in document order, descending into ignored
	 * elements.
	 */
	public static <N> List<N> textLeaves(DocumentTree<N> tree, Sibling<N> run) {
		List<N> leaves = new ArrayList<>();
		for (N member : run.members) {
			collectText(tree, member, leaves);
		}
		return leaves;
	}

	static <N> void collectText(DocumentTree<N> tree, N from, List<N> out) {
		Deque<N> stack = new ArrayDeque<>();
		stack.push(from);
		while (!stack.isEmpty()) {
			N node = stack.pop();
			NodeKind kind = tree.getKind(node);
			if (kind == NodeKind.TEXT) {
				out.add(node);
			} else if (kind == NodeKind.ELEMENT) {
				List<N> children = tree.getChildren(node);
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(children.get(i));
				}
			}
		}
	}
}
