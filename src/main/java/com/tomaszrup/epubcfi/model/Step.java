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
package com.tomaszrup.epubcfi.model;

import java.util.Objects;

/**
 * One level of a CFI path: the kind of the addressed node, its zero-based
 * index among siblings of the same kind, and an optional id assertion.
 */
public final class Step {
	private final StepKind kind;
	private final int siblingIndex;
	private final String id;

	private Step(StepKind kind, int siblingIndex, String id) {
		this.kind = Objects.requireNonNull(kind, "kind");
		if (siblingIndex < 0) {
			throw new IllegalArgumentException("Negative sibling index: " + siblingIndex);
		}
		this.siblingIndex = siblingIndex;
		this.id = (id == null || id.isEmpty()) ? null : id;
	}

	public static Step of(StepKind kind, int siblingIndex, String id) {
		return new Step(kind, siblingIndex, id);
	}

	public static Step element(int siblingIndex) {
		return new Step(StepKind.ELEMENT, siblingIndex, null);
	}

	public static Step element(int siblingIndex, String id) {
		return new Step(StepKind.ELEMENT, siblingIndex, id);
	}

	public static Step text(int siblingIndex) {
		return new Step(StepKind.TEXT, siblingIndex, null);
	}

	public StepKind getKind() {
		return kind;
	}

	public boolean isText() {
		return kind == StepKind.TEXT;
	}

	public int getSiblingIndex() {
		return siblingIndex;
	}

	/**
	 * @return the id assertion, or {@code null} when the step carries none
	 */
	public String getId() {
		return id;
	}

	public boolean hasId() {
		return id != null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Step)) {
			return false;
		}
		Step that = (Step) o;
		return kind == that.kind
				&& siblingIndex == that.siblingIndex
				&& Objects.equals(id, that.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, siblingIndex, id);
	}

	@Override
	public String toString() {
		return "Step{" + kind + "#" + siblingIndex + (id != null ? ", id=" + id : "") + "}";
	}
}
