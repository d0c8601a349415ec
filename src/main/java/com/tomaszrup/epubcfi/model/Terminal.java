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
 * Character offset and text-location assertion attached to the deepest step
 * of a {@link Segment}.
 */
public final class Terminal {

	/** No offset, no assertion. */
	public static final Terminal NONE = new Terminal(null, "");

	private final Integer offset;
	private final String assertion;

	private Terminal(Integer offset, String assertion) {
		this.offset = offset;
		this.assertion = assertion != null ? assertion : "";
	}

	public static Terminal of(Integer offset, String assertion) {
		if (offset == null && (assertion == null || assertion.isEmpty())) {
			return NONE;
		}
		return new Terminal(offset, assertion);
	}

	public static Terminal at(int offset) {
		return new Terminal(offset, "");
	}

	/**
	 * @return the character offset, or {@code null} when none was recorded
	 */
	public Integer getOffset() {
		return offset;
	}

	public boolean hasOffset() {
		return offset != null;
	}

	/** Offset used for ordering: a missing offset counts as 0. */
	public int offsetOrZero() {
		return offset != null ? offset : 0;
	}

	public String getAssertion() {
		return assertion;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Terminal)) {
			return false;
		}
		Terminal that = (Terminal) o;
		return Objects.equals(offset, that.offset) && assertion.equals(that.assertion);
	}

	@Override
	public int hashCode() {
		return Objects.hash(offset, assertion);
	}

	@Override
	public String toString() {
		return "Terminal{offset=" + offset + (assertion.isEmpty() ? "" : ", assertion=" + assertion) + "}";
	}
}
