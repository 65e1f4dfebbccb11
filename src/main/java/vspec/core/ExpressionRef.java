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
 * A reference to a leaf expression, consisting of its owning specification and
 * its identifier within that specification. This is all that crosses a
 * serialization boundary; the expression itself is recovered from a registry on
 * the receiving side.
 */
public final class ExpressionRef {
	private final SpecificationId specId;
	private final ExpressionId exprId;

	public ExpressionRef(SpecificationId specId, ExpressionId exprId) {
		if (specId == null) {
			throw new IllegalArgumentException("invalid specification identifier");
		} else if (exprId == null) {
			throw new IllegalArgumentException("invalid expression identifier");
		}
		this.specId = specId;
		this.exprId = exprId;
	}

	public SpecificationId getSpecificationId() {
		return specId;
	}

	public ExpressionId getExpressionId() {
		return exprId;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof ExpressionRef) {
			ExpressionRef r = (ExpressionRef) o;
			return specId.equals(r.specId) && exprId.equals(r.exprId);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return specId.hashCode() * 31 + exprId.hashCode();
	}

	@Override
	public String toString() {
		return specId + "#" + exprId;
	}
}
