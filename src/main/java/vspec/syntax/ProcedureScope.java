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
package vspec.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The table of variables in scope for the procedure whose specification is
 * being encoded. The return value occupies slot <code>_0</code>, whilst the
 * arguments followed by the locals occupy slots <code>_1</code>,
 * <code>_2</code>, etc in the order they are declared. A scope is immutable once
 * built and can be freely shared between threads.
 */
public class ProcedureScope {
	/**
	 * The distinguished name used in postconditions to refer to the value
	 * returned by the procedure.
	 */
	public static final String RESULT = "result";

	private final Local returns;
	private final Map<String, Local> bindings;

	private ProcedureScope(Local returns, Map<String, Local> bindings) {
		this.returns = returns;
		this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
	}

	/**
	 * Get the slot holding the procedure's return value.
	 *
	 * @return
	 */
	public Local getReturn() {
		return returns;
	}

	/**
	 * Look up an argument or local variable by its source-level name.
	 *
	 * @param name
	 * @return
	 */
	public Optional<Local> lookup(String name) {
		return Optional.ofNullable(bindings.get(name));
	}

	public List<Local> getBindings() {
		return new ArrayList<>(bindings.values());
	}

	@Override
	public String toString() {
		return bindings.values().toString();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * A single slot in the procedure's frame.
	 */
	public static class Local {
		private final String name;
		private final int index;
		private final Syntax.Type type;

		public Local(String name, int index, Syntax.Type type) {
			this.name = name;
			this.index = index;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		public int getIndex() {
			return index;
		}

		public Syntax.Type getType() {
			return type;
		}

		/**
		 * Get the canonical identifier of this slot, as used in the generated IR.
		 *
		 * @return
		 */
		public String getSlotName() {
			return "_" + index;
		}

		@Override
		public String toString() {
			return getSlotName() + "(" + name + ": " + type + ")";
		}
	}

	public static class Builder {
		private Syntax.Type returns = new Syntax.Type.Tuple(Collections.emptyList());
		private final Map<String, Local> bindings = new LinkedHashMap<>();

		public Builder returns(Syntax.Type type) {
			this.returns = type;
			return this;
		}

		public Builder argument(String name, Syntax.Type type) {
			return declare(name, type);
		}

		public Builder local(String name, Syntax.Type type) {
			return declare(name, type);
		}

		public ProcedureScope build() {
			return new ProcedureScope(new Local(RESULT, 0, returns), bindings);
		}

		private Builder declare(String name, Syntax.Type type) {
			if (RESULT.equals(name)) {
				throw new IllegalArgumentException("reserved variable name: " + name);
			} else if (bindings.containsKey(name)) {
				throw new IllegalArgumentException("duplicate variable: " + name);
			}
			bindings.put(name, new Local(name, bindings.size() + 1, type));
			return this;
		}
	}
}
