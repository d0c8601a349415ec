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

import java.util.Objects;

/**
 * A (container, offset) position inside a host tree. For a text container
 * the offset counts characters, for an element it counts child nodes.
 *
 * @param <N> the host's node type
 */
public final class Boundary<N> {
	private final N container;
	private final int offset;

	public Boundary(N container, int offset) {
		this.container = Objects.requireNonNull(container, "container");
		this.offset = offset;
	}

	public N getContainer() {
		return container;
	}

	public int getOffset() {
		return offset;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Boundary)) {
			return false;
		}
		Boundary<?> that = (Boundary<?>) o;
		return offset == that.offset && container.equals(that.container);
	}

	@Override
	public int hashCode() {
		return Objects.hash(container, offset);
	}

	@Override
	public String toString() {
		return "Boundary{" + container + ":" + offset + "}";
	}
}
