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
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.epubcfi.model.Cfi;
import com.tomaszrup.epubcfi.model.Segment;
import com.tomaszrup.epubcfi.model.Step;
import com.tomaszrup.epubcfi.model.StepKind;

/**
 * Turns CFI paths back into positions inside a live tree.
 *
 * <p>Two lookup strategies produce the same node. When the host offers a
 * {@link PathQuery} and no filtering is needed, the query is used first.
 * Otherwise, and whenever the query fails, the steps are walked manually
 * over {@link FilteredView}s. Element steps with an id assertion use the
 * tree's id lookup in both strategies.</p>
 *
 * <p>Nothing here throws for stale or malformed input: unresolvable paths
 * give {@code null}.</p>
 *
 * @param <N> the host's node type
 */
public final class Resolver<N> {
	private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

	private final DocumentTree<N> tree;
	private final boolean usePathQuery;

	public Resolver(DocumentTree<N> tree) {
		this(tree, true);
	}

	public Resolver(DocumentTree<N> tree, boolean usePathQuery) {
		this.tree = Objects.requireNonNull(tree, "tree");
		this.usePathQuery = usePathQuery;
	}

	/** A node reached by walking steps, plus the text run it stands for. */
	private static final class Located<N> {
		final N node;
		final N parent;
		final FilteredView.Sibling<N> run;

		Located(N node, N parent, FilteredView.Sibling<N> run) {
			this.node = node;
			this.parent = parent;
			this.run = run;
		}
	}

	/**
	 * Resolves a full segment (steps plus terminal) to a boundary.
	 *
	 * @return the boundary, or {@code null} when the path cannot be followed
	 */
	public Boundary<N> resolve(Segment segment, String ignoreClass) {
		return resolveFiltered(segment, IgnoreFilter.of(tree, ignoreClass));
	}

	/**
	 * Resolves both boundaries of a CFI. A positional CFI gives a collapsed
	 * pair. When only the end cannot be found the pair collapses onto the
	 * start.
	 *
	 * @return the boundary pair, or {@code null} when the start cannot be found
	 */
	public BoundaryPair<N> resolveRange(Cfi cfi, String ignoreClass) {
		if (!cfi.isValid()) {
			logger.debug("Refusing to resolve invalid CFI");
			return null;
		}
		IgnoreFilter<N> filter = IgnoreFilter.of(tree, ignoreClass);
		Boundary<N> start = resolveFiltered(cfi.startSegment(), filter);
		if (start == null) {
			logger.debug("No start container found for {}", cfi);
			return null;
		}
		if (!cfi.isRange()) {
			return BoundaryPair.collapsed(start);
		}
		Boundary<N> end = resolveFiltered(cfi.endSegment(), filter);
		if (end == null) {
			logger.warn("No end container found for {}, collapsing onto start", cfi);
			return BoundaryPair.collapsed(start);
		}
		return new BoundaryPair<>(start, end);
	}

	/**
	 * Node addressed by {@code steps}, ignoring any terminal. A text step
	 * resolves to the first raw node of its text run.
	 */
	public N findNode(List<Step> steps, String ignoreClass) {
		Located<N> located = locate(steps, IgnoreFilter.of(tree, ignoreClass));
		return located != null ? located.node : null;
	}

	Boundary<N> resolveFiltered(Segment segment, IgnoreFilter<N> filter) {
		Located<N> located = locate(segment.getSteps(), filter);
		if (located == null) {
			return null;
		}
		Integer offset = segment.getTerminal().getOffset();

		if (located.run == null) {
			if (offset == null) {
				return new Boundary<>(located.node, 0);
			}
			int childCount = tree.getChildren(located.node).size();
			return new Boundary<>(located.node, Math.min(Math.max(offset, 0), childCount));
		}

		if (offset == null) {
			return OffsetRepair.locate(tree, located.run, 0);
		}
		if (filter.isActive()) {
			return OffsetRepair.locate(tree, located.run, offset);
		}
		if (offset >= 0 && offset <= tree.getTextLength(located.node)) {
			return new Boundary<>(located.node, offset);
		}
		Step last = segment.lastStep();
		return OffsetRepair.repair(tree, located.parent, last.getSiblingIndex(), offset, filter);
	}

	private Located<N> locate(List<Step> steps, IgnoreFilter<N> filter) {
		if (usePathQuery && !filter.isActive()) {
			Optional<PathQuery<N>> query = tree.getPathQuery();
			if (query.isPresent()) {
				Located<N> fast = query(query.get(), steps, filter);
				if (fast != null) {
					return fast;
				}
			}
		}
		return walk(steps, filter);
	}

	private Located<N> query(PathQuery<N> query, List<Step> steps, IgnoreFilter<N> filter) {
		N node;
		try {
			node = query.select(steps);
		} catch (RuntimeException e) {
			logger.debug("Path query failed, walking instead: {}", e.getMessage());
			return null;
		}
		if (node == null) {
			return null;
		}
		N parent = tree.getParent(node);
		if (tree.getKind(node) != NodeKind.TEXT) {
			return new Located<>(node, parent, null);
		}
		if (parent == null) {
			return null;
		}
		FilteredView.Sibling<N> run = FilteredView.of(tree, parent, filter).siblingOf(node);
		if (run == null) {
			return null;
		}
		// adjacent text nodes are one node to XPath but separate steps here
		Step last = steps.get(steps.size() - 1);
		if (last.getKind() != StepKind.TEXT || run.getIndex() != last.getSiblingIndex()) {
			logger.debug("Path query landed on text #{} instead of {}, walking instead", run.getIndex(), last);
			return null;
		}
		return new Located<>(node, parent, run);
	}

	private Located<N> walk(List<Step> steps, IgnoreFilter<N> filter) {
		N container = tree.getRoot();
		if (container == null) {
			return null;
		}
		N parent = tree.getParent(container);
		FilteredView.Sibling<N> run = null;
		for (Step step : steps) {
			if (run != null) {
				logger.debug("Step {} follows a text step, cannot descend", step);
				return null;
			}
			if (step.getKind() == StepKind.ELEMENT && step.hasId()) {
				N byId = tree.getElementById(step.getId());
				if (byId == null) {
					logger.debug("No element with id '{}'", step.getId());
					return null;
				}
				parent = tree.getParent(byId);
				container = byId;
				continue;
			}
			FilteredView.Sibling<N> sibling = FilteredView.of(tree, container, filter)
					.get(step.getKind(), step.getSiblingIndex());
			if (sibling == null) {
				logger.debug("No {} child #{} under {}", step.getKind(), step.getSiblingIndex(), container);
				return null;
			}
			parent = container;
			container = sibling.first();
			if (sibling.getKind() == StepKind.TEXT) {
				run = sibling;
			}
		}
		return new Located<>(container, parent, run);
	}
}
