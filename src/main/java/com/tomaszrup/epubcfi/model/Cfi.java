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

import com.tomaszrup.epubcfi.grammar.CfiSerializer;

/**
 * Immutable Canonical Fragment Identifier.
 *
 * <p>A CFI is either {@link Positional} (the path is the complete address)
 * or {@link Ranged} (the path holds the steps shared by both boundaries and
 * {@link #getStart()} / {@link #getEnd()} hold the diverging suffixes). Both
 * variants carry a base segment whose second step names the container
 * (spine item) the CFI lives in.</p>
 *
 * <p>A base with fewer than two steps makes the CFI invalid: its
 * {@linkplain #getContainerOrdinal() container ordinal} is {@code -1}.
 * Callers must check {@link #isValid()} before resolving or comparing.</p>
 */
public abstract class Cfi {

	private static final Cfi INVALID = new Positional(Segment.EMPTY, Segment.EMPTY);

	private final Segment base;
	private final Segment path;
	private final int containerOrdinal;

	private Cfi(Segment base, Segment path) {
		this.base = Objects.requireNonNull(base, "base");
		this.path = Objects.requireNonNull(path, "path");
		this.containerOrdinal = base.size() >= 2 ? base.getSteps().get(1).getSiblingIndex() : -1;
	}

	/** The sentinel returned for malformed input. */
	public static Cfi invalid() {
		return INVALID;
	}

	public static Cfi positional(Segment base, Segment path) {
		return new Positional(base, path);
	}

	public static Cfi range(Segment base, Segment path, Segment start, Segment end) {
		return new Ranged(base, path, start, end);
	}

	/**
	 * Returns an equal, independent copy. CFIs are immutable, so this only
	 * matters to callers that rely on identity.
	 */
	public static Cfi copyOf(Cfi cfi) {
		if (cfi.isRange()) {
			return new Ranged(cfi.base, cfi.path, cfi.getStart(), cfi.getEnd());
		}
		return new Positional(cfi.base, cfi.path);
	}

	public Segment getBase() {
		return base;
	}

	public Segment getPath() {
		return path;
	}

	public int getContainerOrdinal() {
		return containerOrdinal;
	}

	public boolean isValid() {
		return containerOrdinal >= 0;
	}

	public abstract boolean isRange();

	/**
	 * @return the start suffix of a range, or {@code null} for a positional CFI
	 */
	public abstract Segment getStart();

	/**
	 * @return the end suffix of a range, or {@code null} for a positional CFI
	 */
	public abstract Segment getEnd();

	/** Full address of the start boundary ({@code path ++ start}). */
	public abstract Segment startSegment();

	/** Full address of the end boundary ({@code path ++ end}). */
	public abstract Segment endSegment();

	/**
	 * Reduces a range to a single position at one of its boundaries. A
	 * positional CFI is returned unchanged.
	 *
	 * @param toStart collapse onto the start boundary, otherwise onto the end
	 */
	public abstract Cfi collapse(boolean toStart);

	@Override
	public String toString() {
		return CfiSerializer.serialize(this);
	}

	/** A CFI addressing a single position. */
	public static final class Positional extends Cfi {

		private Positional(Segment base, Segment path) {
			super(base, path);
		}

		@Override
		public boolean isRange() {
			return false;
		}

		@Override
		public Segment getStart() {
			return null;
		}

		@Override
		public Segment getEnd() {
			return null;
		}

		@Override
		public Segment startSegment() {
			return getPath();
		}

		@Override
		public Segment endSegment() {
			return getPath();
		}

		@Override
		public Cfi collapse(boolean toStart) {
			return this;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Positional)) {
				return false;
			}
			Positional that = (Positional) o;
			return getBase().equals(that.getBase()) && getPath().equals(that.getPath());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getBase(), getPath());
		}
	}

	/** A CFI addressing a start/end pair that shares a common path. */
	public static final class Ranged extends Cfi {
		private final Segment start;
		private final Segment end;

		private Ranged(Segment base, Segment path, Segment start, Segment end) {
			super(base, path);
			this.start = Objects.requireNonNull(start, "start");
			this.end = Objects.requireNonNull(end, "end");
		}

		@Override
		public boolean isRange() {
			return true;
		}

		@Override
		public Segment getStart() {
			return start;
		}

		@Override
		public Segment getEnd() {
			return end;
		}

		@Override
		public Segment startSegment() {
			return getPath().append(start);
		}

		@Override
		public Segment endSegment() {
			return getPath().append(end);
		}

		@Override
		public Cfi collapse(boolean toStart) {
			return new Positional(getBase(), toStart ? startSegment() : endSegment());
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Ranged)) {
				return false;
			}
			Ranged that = (Ranged) o;
			return getBase().equals(that.getBase())
					&& getPath().equals(that.getPath())
					&& start.equals(that.start)
					&& end.equals(that.end);
		}

		@Override
		public int hashCode() {
			return Objects.hash(getBase(), getPath(), start, end);
		}
	}
}
