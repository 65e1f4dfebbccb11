// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vspec.core;

/**
 * Identifies a leaf expression within its owning specification. Uniqueness
 * only holds relative to a given {@link SpecificationId}.
 */
public final class ExpressionId {
	private final long value;

	public ExpressionId(long value) {
		if (value < 0) {
			throw new IllegalArgumentException("negative expression identifier");
		}
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ExpressionId && ((ExpressionId) o).value == value;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value);
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}

	/**
	 * Hands out consecutive identifiers for the leaves of a single specification.
	 * A generator is not shared between threads.
	 */
	public static class Generator {
		private long next;

		public ExpressionId next() {
			return new ExpressionId(next++);
		}
	}
}
