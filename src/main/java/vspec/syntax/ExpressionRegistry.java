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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import vspec.core.ExpressionId;
import vspec.core.ExpressionRef;
import vspec.core.SpecificationId;

/**
 * Maps expression references back onto the typed leaf expressions they
 * identify. This is used on the receiving side of a serialization boundary to
 * recover a typed assertion from its skeleton.
 */
public interface ExpressionRegistry {

	/**
	 * Resolve a given reference, returning nothing if it is not known to this
	 * registry.
	 *
	 * @param ref
	 * @return
	 */
	public Optional<TypedExpression> lookup(ExpressionRef ref);

	/**
	 * A simple in-memory registry which allocates expression identifiers on a per
	 * specification basis.
	 */
	public static class Default implements ExpressionRegistry {
		private final Map<ExpressionRef, TypedExpression> leaves = new HashMap<>();
		private final Map<SpecificationId, ExpressionId.Generator> generators = new HashMap<>();

		/**
		 * Register a fresh leaf expression for a given specification.
		 *
		 * @param spec
		 * @param expr
		 * @return
		 */
		public TypedExpression register(SpecificationId spec, Syntax.Expr expr) {
			ExpressionId.Generator generator = generators.computeIfAbsent(spec, s -> new ExpressionId.Generator());
			TypedExpression leaf = new TypedExpression(new ExpressionRef(spec, generator.next()), expr);
			leaves.put(leaf.getRef(), leaf);
			return leaf;
		}

		@Override
		public Optional<TypedExpression> lookup(ExpressionRef ref) {
			return Optional.ofNullable(leaves.get(ref));
		}

		public int size() {
			return leaves.size();
		}
	}
}
