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

import vspec.core.ExpressionRef;

/**
 * A leaf of a typed assertion: a type-checked surface expression paired with
 * the reference identifying it within its owning specification.
 */
public final class TypedExpression {
	private final ExpressionRef ref;
	private final Syntax.Expr expr;

	public TypedExpression(ExpressionRef ref, Syntax.Expr expr) {
		if (ref == null || expr == null) {
			throw new IllegalArgumentException("invalid typed expression");
		}
		this.ref = ref;
		this.expr = expr;
	}

	public ExpressionRef getRef() {
		return ref;
	}

	public Syntax.Expr getExpr() {
		return expr;
	}

	public Syntax.Type getType() {
		return expr.getType();
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof TypedExpression) {
			TypedExpression t = (TypedExpression) o;
			return ref.equals(t.ref) && expr == t.expr;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return ref.hashCode();
	}

	@Override
	public String toString() {
		return ref + ":" + expr;
	}
}
