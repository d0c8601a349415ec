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
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Matches elements carrying an "ignore" class, such as highlight wrappers
 * injected into a rendered document.
 *
 * <p>A filter is only active when the tree actually contains a matching
 * element. An inactive filter matches nothing, so building and resolving fall
 * back to plain unfiltered indexing.</p>
 *
 * @param <N> the host's node type
 */
public final class IgnoreFilter<N> implements Predicate<N> {

	private final DocumentTree<N> tree;
	private final String ignoreClass;
	private final boolean active;

	private IgnoreFilter(DocumentTree<N> tree, String ignoreClass, boolean active) {
		this.tree = tree;
		this.ignoreClass = ignoreClass;
		this.active = active;
	}

	public static <N> IgnoreFilter<N> none(DocumentTree<N> tree) {
		return new IgnoreFilter<>(tree, null, false);
	}

	/**
	 * Creates a filter for {@code ignoreClass}, scanning the tree once to see
	 * whether anything needs ignoring.
	 */
	public static <N> IgnoreFilter<N> of(DocumentTree<N> tree, String ignoreClass) {
		if (ignoreClass == null || ignoreClass.trim().isEmpty()) {
			return none(tree);
		}
		String cls = ignoreClass.trim();
		return new IgnoreFilter<>(tree, cls, containsClass(tree, cls));
	}

	public boolean isActive() {
		return active;
	}

	public String getIgnoreClass() {
		return ignoreClass;
	}

	@Override
	public boolean test(N node) {
		return active
				&& node != null
				&& tree.getKind(node) == NodeKind.ELEMENT
				&& tree.hasClass(node, ignoreClass);
	}

	/**
	 * Topmost ignored ancestor-or-self of {@code node} below the root.
	 *
	 * @return that element, or {@code null} when the node is not inside
	 *         ignored content
	 */
	public N topmostIgnored(N node) {
		if (!active) {
			return null;
		}
		N root = tree.getRoot();
		N found = null;
		N current = node;
		while (current != null && !current.equals(root)) {
			if (test(current)) {
				found = current;
			}
			current = tree.getParent(current);
		}
		return found;
	}

	private static <N> boolean containsClass(DocumentTree<N> tree, String cls) {
		N root = tree.getRoot();
		if (root == null) {
			return false;
		}
		Deque<N> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			N node = stack.pop();
			if (tree.getKind(node) != NodeKind.ELEMENT) {
				continue;
			}
			if (tree.hasClass(node, cls)) {
				return true;
			}
			List<N> children = tree.getChildren(node);
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return false;
	}
}
