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
 * Start and end {@link Boundary} of a resolved CFI. Callers turn this into
 * their own selection or range object.
 *
 * @param <N> the host's node type
 */
public final class BoundaryPair<N> {
	private final Boundary<N> start;
	private final Boundary<N> end;

	public BoundaryPair(Boundary<N> start, Boundary<N> end) {
		this.start = Objects.requireNonNull(start, "start");
		this.end = Objects.requireNonNull(end, "end");
	}

	public static <N> BoundaryPair<N> collapsed(Boundary<N> at) {
		return new BoundaryPair<>(at, at);
	}

	public Boundary<N> getStart() {
		return start;
	}

	public Boundary<N> getEnd() {
		return end;
	}

	public boolean isCollapsed() {
		return start.equals(end);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BoundaryPair)) {
			return false;
		}
		BoundaryPair<?> that = (BoundaryPair<?>) o;
		return start.equals(that.start) && end.equals(that.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return "BoundaryPair{" + start + " -> " + end + "}";
	}
}
