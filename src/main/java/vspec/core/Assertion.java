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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import vspec.syntax.Syntax;

/**
 * A logical assertion (e.g. a precondition, postcondition or loop invariant)
 * built from leaf expressions, connectives and quantifiers. An assertion is
 * parameterised by the payload carried at its leaves. The typed tree carries
 * {@link vspec.syntax.TypedExpression}s, whilst the skeleton exchanged across a
 * serialization boundary carries only {@link ExpressionRef}s. Assertions are
 * immutable and compared structurally.
 *
 * @param <E>
 */
public final class Assertion<E> {
	private final Kind<E> kind;

	private Assertion(Kind<E> kind) {
		this.kind = kind;
	}

	public Kind<E> getKind() {
		return kind;
	}

	/**
	 * Rebuild this assertion with the same shape, transforming every leaf payload
	 * (including quantifier triggers, filters and bodies) using a given function.
	 *
	 * @param <F>
	 * @param fn
	 * @return
	 */
	public <F> Assertion<F> map(Function<? super E, ? extends F> fn) {
		if (kind instanceof Expr) {
			Expr<E> e = (Expr<E>) kind;
			return EXPR(fn.apply(e.getOperand()));
		} else if (kind instanceof And) {
			And<E> e = (And<E>) kind;
			List<Assertion<F>> operands = new ArrayList<>();
			for (Assertion<E> operand : e.getOperands()) {
				operands.add(operand.map(fn));
			}
			return AND(operands);
		} else if (kind instanceof Implies) {
			Implies<E> e = (Implies<E>) kind;
			return IMPLIES(e.getLeftHandSide().map(fn), e.getRightHandSide().map(fn));
		} else {
			ForAll<E> e = (ForAll<E>) kind;
			List<List<F>> triggers = new ArrayList<>();
			for (List<E> trigger : e.getTriggers()) {
				List<F> terms = new ArrayList<>();
				for (E term : trigger) {
					terms.add(fn.apply(term));
				}
				triggers.add(terms);
			}
			return FORALL(e.getVariables(), triggers, fn.apply(e.getFilter()), fn.apply(e.getBody()));
		}
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Assertion && ((Assertion<?>) o).kind.equals(kind);
	}

	@Override
	public int hashCode() {
		return kind.hashCode();
	}

	@Override
	public String toString() {
		return kind.toString();
	}

	// =========================================================================
	// Kinds
	// =========================================================================

	public interface Kind<E> {
	}

	public static final class Expr<E> implements Kind<E> {
		private final E operand;

		private Expr(E operand) {
			this.operand = Objects.requireNonNull(operand, "missing leaf");
		}

		public E getOperand() {
			return operand;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Expr && ((Expr<?>) o).operand.equals(operand);
		}

		@Override
		public int hashCode() {
			return operand.hashCode();
		}

		@Override
		public String toString() {
			return "EXPR(" + operand + ")";
		}
	}

	/**
	 * A conjunction of zero or more assertions. The order of operands is retained
	 * for diagnostics only.
	 */
	public static final class And<E> implements Kind<E> {
		private final List<Assertion<E>> operands;

		private And(List<Assertion<E>> operands) {
			this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
		}

		public List<Assertion<E>> getOperands() {
			return operands;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof And && ((And<?>) o).operands.equals(operands);
		}

		@Override
		public int hashCode() {
			return operands.hashCode() * 3;
		}

		@Override
		public String toString() {
			return "AND" + operands;
		}
	}

	public static final class Implies<E> implements Kind<E> {
		private final Assertion<E> lhs;
		private final Assertion<E> rhs;

		private Implies(Assertion<E> lhs, Assertion<E> rhs) {
			this.lhs = Objects.requireNonNull(lhs);
			this.rhs = Objects.requireNonNull(rhs);
		}

		public Assertion<E> getLeftHandSide() {
			return lhs;
		}

		public Assertion<E> getRightHandSide() {
			return rhs;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Implies) {
				Implies<?> i = (Implies<?>) o;
				return lhs.equals(i.lhs) && rhs.equals(i.rhs);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return lhs.hashCode() * 31 + rhs.hashCode();
		}

		@Override
		public String toString() {
			return "IMPLIES(" + lhs + ", " + rhs + ")";
		}
	}

	/**
	 * A universal quantifier over one or more bound variables. Each trigger is an
	 * ordered list of terms.
	 */
	public static final class ForAll<E> implements Kind<E> {
		private final List<Syntax.Binder> variables;
		private final List<List<E>> triggers;
		private final E filter;
		private final E body;

		private ForAll(List<Syntax.Binder> variables, List<List<E>> triggers, E filter, E body) {
			this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
			List<List<E>> ts = new ArrayList<>();
			for (List<E> trigger : triggers) {
				ts.add(Collections.unmodifiableList(new ArrayList<>(trigger)));
			}
			this.triggers = Collections.unmodifiableList(ts);
			this.filter = Objects.requireNonNull(filter, "missing filter");
			this.body = Objects.requireNonNull(body, "missing body");
		}

		public List<Syntax.Binder> getVariables() {
			return variables;
		}

		public List<List<E>> getTriggers() {
			return triggers;
		}

		public E getFilter() {
			return filter;
		}

		public E getBody() {
			return body;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof ForAll) {
				ForAll<?> f = (ForAll<?>) o;
				return variables.equals(f.variables) && triggers.equals(f.triggers) && filter.equals(f.filter)
						&& body.equals(f.body);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(variables, triggers, filter, body);
		}

		@Override
		public String toString() {
			return "FORALL(" + variables + ", " + triggers + ", " + filter + ", " + body + ")";
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static <E> Assertion<E> EXPR(E operand) {
		return new Assertion<>(new Expr<>(operand));
	}

	public static <E> Assertion<E> AND(List<Assertion<E>> operands) {
		return new Assertion<>(new And<>(operands));
	}

	@SafeVarargs
	public static <E> Assertion<E> AND(Assertion<E>... operands) {
		return AND(Arrays.asList(operands));
	}

	public static <E> Assertion<E> IMPLIES(Assertion<E> lhs, Assertion<E> rhs) {
		return new Assertion<>(new Implies<>(lhs, rhs));
	}

	public static <E> Assertion<E> FORALL(List<Syntax.Binder> variables, List<List<E>> triggers, E filter, E body) {
		return new Assertion<>(new ForAll<>(variables, triggers, filter, body));
	}
}
