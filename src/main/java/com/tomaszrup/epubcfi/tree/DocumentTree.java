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
import java.util.Optional;

/**
 * Read-only view of a host document tree. This is everything the CFI engine
 * needs from a document implementation; it never mutates the tree.
 *
 * @param <N> the host's node type
 */
public interface DocumentTree<N> {

	/** The root element CFI paths start from (for XHTML, {@code <html>}). */
	N getRoot();

	/**
	 * @return the parent node, or {@code null} for the root or a detached node
	 */
	N getParent(N node);

	/** Ordered child nodes of every kind. */
	List<N> getChildren(N node);

	NodeKind getKind(N node);

	/**
	 * @return the element's id attribute, or {@code null} when absent or empty
	 */
	String getId(N node);

	/** Whether the element's class attribute contains {@code className}. */
	boolean hasClass(N node, String className);

	/** Text of a text node, or the concatenated descendant text of an element. */
	String getTextContent(N node);

	/**
	 * Document-wide id lookup.
	 *
	 * @return the first element in document order with that id, or {@code null}
	 */
	N getElementById(String id);

	/**
	 * Declarative path lookup offered by the host, if it has one.
	 */
	default Optional<PathQuery<N>> getPathQuery() {
		return Optional.empty();
	}

	default int getTextLength(N node) {
		String text = getTextContent(node);
		return text != null ? text.length() : 0;
	}
}
