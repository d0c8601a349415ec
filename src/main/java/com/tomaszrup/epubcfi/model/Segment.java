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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A component of a CFI: root-to-leaf ordered steps plus a terminal.
 */
public final class Segment {

	public static final Segment EMPTY = new Segment(Collections.emptyList(), Terminal.NONE);

	private final List<Step> steps;
	private final Terminal terminal;

	private Segment(List<Step> steps, Terminal terminal) {
		this.steps = steps;
		this.terminal = terminal;
	}

	public static Segment of(List<Step> steps, Terminal terminal) {
		Objects.requireNonNull(steps, "steps");
		for (Step step : steps) {
			Objects.requireNonNull(step, "step");
		}
		return new Segment(Collections.unmodifiableList(new ArrayList<>(steps)),
				terminal != null ? terminal : Terminal.NONE);
	}

	public static Segment of(List<Step> steps) {
		return of(steps, Terminal.NONE);
	}

	public List<Step> getSteps() {
		return steps;
	}

	public Terminal getTerminal() {
		return terminal;
	}

	public int size() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * @return the deepest step, or {@code null} for an empty segment
	 */
	public Step lastStep() {
		return steps.isEmpty() ? null : steps.get(steps.size() - 1);
	}

	/**
	 * Concatenates the steps of {@code suffix} onto this segment. The result
	 * carries the suffix's terminal.
	 */
	public Segment append(Segment suffix) {
		List<Step> joined = new ArrayList<>(steps.size() + suffix.steps.size());
		joined.addAll(steps);
		joined.addAll(suffix.steps);
		return new Segment(Collections.unmodifiableList(joined), suffix.terminal);
	}

	/** Drops the first {@code count} steps, keeping the terminal. */
	public Segment drop(int count) {
		if (count <= 0) {
			return this;
		}
		int from = Math.min(count, steps.size());
		return new Segment(Collections.unmodifiableList(new ArrayList<>(steps.subList(from, steps.size()))),
				terminal);
	}

	public Segment withTerminal(Terminal newTerminal) {
		return new Segment(steps, newTerminal != null ? newTerminal : Terminal.NONE);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Segment)) {
			return false;
		}
		Segment that = (Segment) o;
		return steps.equals(that.steps) && terminal.equals(that.terminal);
	}

	@Override
	public int hashCode() {
		return Objects.hash(steps, terminal);
	}

	@Override
	public String toString() {
		return "Segment{steps=" + steps + ", terminal=" + terminal + "}";
	}
}
