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

import java.util.Locale;
import java.util.UUID;

/**
 * Identifies one top-level annotated assertion (e.g. a single precondition or
 * postcondition). Identifiers are drawn at random and so are never shared
 * between unrelated assertions.
 */
public final class SpecificationId {
	private final UUID uuid;

	private SpecificationId(UUID uuid) {
		if (uuid == null) {
			throw new IllegalArgumentException("invalid uuid");
		}
		this.uuid = uuid;
	}

	/**
	 * Construct a fresh identifier.
	 *
	 * @return
	 */
	public static SpecificationId fresh() {
		return new SpecificationId(UUID.randomUUID());
	}

	/**
	 * Parse an identifier from its canonical textual form.
	 *
	 * @param text
	 * @return
	 * @throws IllegalArgumentException if the text is not a valid identifier.
	 */
	public static SpecificationId fromString(String text) {
		UUID uuid = UUID.fromString(text);
		// UUID.fromString() also accepts abbreviated groups
		if (!uuid.toString().equals(text.toLowerCase(Locale.ROOT))) {
			throw new IllegalArgumentException("non-canonical uuid: " + text);
		}
		return new SpecificationId(uuid);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof SpecificationId && ((SpecificationId) o).uuid.equals(uuid);
	}

	@Override
	public int hashCode() {
		return uuid.hashCode();
	}

	@Override
	public String toString() {
		return uuid.toString();
	}
}
