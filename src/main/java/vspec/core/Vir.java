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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The verification intermediate representation produced by the specification
 * encoder. Every expression is immutable and reports its own semantic
 * {@link Type}, which allows the encoder to check operands without going back
 * to the surface tree. Items carry zero or more {@link Attribute}s which, in
 * practice, hold the surface expression each node was lowered from.
 *
 * @author David J. Pearce
 *
 */
public class Vir {

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		public Attribute[] getAttributes() {
			return attributes;
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();

		/**
		 * Check whether this type denotes a heap location (i.e. a typed reference)
		 * rather than a raw value.
		 *
		 * @return
		 */
		public boolean isRef();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean isRef() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "Bool";
			}
		}

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean isRef() {
				return false;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return "Int";
			}
		}

		/**
		 * A reference to a heap location whose contents are described by the named
		 * type predicate.
		 */
		public static class TypedRef extends AbstractItem implements Type {
			private final String name;

			public TypedRef(String name, Attribute... attributes) {
				super(attributes);
				if (name == null) {
					throw new IllegalArgumentException("invalid type name");
				}
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean isRef() {
				return true;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof TypedRef && ((TypedRef) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return "Ref(" + name + ")";
			}
		}
	}

	// =========================================================================
	// Fields & Triggers
	// =========================================================================

	/**
	 * A named, typed accessor used to step from one heap location to another (or
	 * to the raw value stored there).
	 */
	public static class Field extends AbstractItem implements Item {
		private final String name;
		private final Type type;

		private Field(String name, Type type, Attribute[] attributes) {
			super(attributes);
			this.name = name;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Field) {
				Field f = (Field) o;
				return name.equals(f.name) && type.equals(f.type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ type.hashCode();
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	/**
	 * An ordered set of terms handed to the prover as an instantiation hint for a
	 * quantified fact.
	 */
	public static class Trigger extends AbstractItem implements Item {
		private final List<Expr> terms;

		private Trigger(Collection<Expr> terms, Attribute[] attributes) {
			super(attributes);
			this.terms = new ArrayList<>(terms);
		}

		public List<Expr> getTerms() {
			return Collections.unmodifiableList(terms);
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		/**
		 * Get the semantic type of the value this expression produces.
		 *
		 * @return
		 */
		public Type getType();

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		/**
		 * A heap location (or raw quantified value) described by a base variable and
		 * a chain of field accessors.
		 */
		public interface Place extends Expr {
			/**
			 * Get the base variable of this place.
			 *
			 * @return
			 */
			public LocalVar getRoot();

			/**
			 * Extend this place by one accessor.
			 *
			 * @param field
			 * @param attributes
			 * @return
			 */
			public default FieldAccess access(Field field, Attribute... attributes) {
				return new FieldAccess(this, field, attributes);
			}
		}

		public static abstract class AbstractBinaryOperator extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;
			private final Type type;

			private AbstractBinaryOperator(Expr lhs, Expr rhs, Type type, Attribute[] attributes) {
				super(attributes);
				if (lhs == null || rhs == null) {
					throw new IllegalArgumentException("missing operand");
				}
				this.lhs = lhs;
				this.rhs = rhs;
				this.type = type;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Type getType() {
				return type;
			}
		}

		public static class LocalVar extends AbstractItem implements Place {
			private final String name;
			private final Type type;

			private LocalVar(String name, Type type, Attribute[] attributes) {
				super(attributes);
				if(name == null) {
					throw new IllegalArgumentException();
				}
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public LocalVar getRoot() {
				return this;
			}

			public String toString() {
				return "VAR(" + name + ")";
			}
		}

		public static class FieldAccess extends AbstractItem implements Place {
			private final Place base;
			private final Field field;

			private FieldAccess(Place base, Field field, Attribute[] attributes) {
				super(attributes);
				this.base = base;
				this.field = field;
			}

			public Place getBase() {
				return base;
			}

			public Field getField() {
				return field;
			}

			@Override
			public Type getType() {
				return field.getType();
			}

			@Override
			public LocalVar getRoot() {
				return base.getRoot();
			}

			public String toString() {
				return "FIELD(" + base + ", " + field.getName() + ")";
			}
		}

		public static class Boolean extends AbstractItem implements Expr {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			public String toString() {
				return "BOOL(" + value + ")";
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public Type getType() {
				return Type.Int;
			}

			public String toString() {
				return "INT(" + value + ")";
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return Type.Int;
			}
		}

		public static class LogicalNot extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private LogicalNot(Expr operand, Attribute[] attributes) {
				super(attributes); this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}

			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		/**
		 * Captures the value of its operand as observed at the designated earlier
		 * program point (typically procedure entry).
		 */
		public static class Old extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Old(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public Type getType() {
				return operand.getType();
			}

			public String toString() {
				return "OLD(" + operand + ")";
			}
		}

		public static class Equals extends AbstractBinaryOperator {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class NotEquals extends AbstractBinaryOperator {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class LessThan extends AbstractBinaryOperator {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinaryOperator {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinaryOperator {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinaryOperator {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class Addition extends AbstractBinaryOperator {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Int, attributes);
			}
		}

		public static class Subtraction extends AbstractBinaryOperator {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Int, attributes);
			}
		}

		public static class Multiplication extends AbstractBinaryOperator {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Int, attributes);
			}
		}

		public static class Division extends AbstractBinaryOperator {
			private Division(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Int, attributes);
			}
		}

		public static class Remainder extends AbstractBinaryOperator {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Int, attributes);
			}
		}

		public static class LogicalXor extends AbstractBinaryOperator {
			private LogicalXor(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class Implies extends AbstractBinaryOperator {
			private Implies(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, Type.Bool, attributes);
			}
		}

		public static class LogicalAnd extends AbstractItem implements Expr, NaryOperator {
			private final List<Expr> operands;

			private LogicalAnd(List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			public List<Expr> getOperands() {
				return Collections.unmodifiableList(operands);
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}
		}

		public static class LogicalOr extends AbstractItem implements Expr, NaryOperator {
			private final List<Expr> operands;

			private LogicalOr(List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			public List<Expr> getOperands() {
				return Collections.unmodifiableList(operands);
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}
		}

		/**
		 * A conditional expression. Both branches must produce values of the same
		 * type, which is taken from the true branch.
		 */
		public static class IfElse extends AbstractItem implements Expr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private IfElse(Expr condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}

			@Override
			public Type getType() {
				return trueBranch.getType();
			}

			public String toString() {
				return "ITE(" + condition + ", " + trueBranch + ", " + falseBranch + ")";
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Expr {
			private final List<LocalVar> variables;
			private final List<Trigger> triggers;
			private final Expr body;

			private UniversalQuantifier(Collection<LocalVar> variables, Collection<Trigger> triggers, Expr body,
					Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
				this.triggers = new ArrayList<>(triggers);
				this.body = body;
			}

			public List<LocalVar> getVariables() {
				return Collections.unmodifiableList(variables);
			}

			public List<Trigger> getTriggers() {
				return Collections.unmodifiableList(triggers);
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public Type getType() {
				return Type.Bool;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Places

	public static Expr.LocalVar VAR(String name, Type type, Attribute... attributes) {
		return new Expr.LocalVar(name, type, attributes);
	}

	public static Field FIELD(String name, Type type, Attribute... attributes) {
		return new Field(name, type, attributes);
	}

	// Logical Operators

	/**
	 * Construct an n-ary conjunction. A single operand is returned as is, whilst an
	 * empty list has no meaningful conjunction here and is rejected.
	 *
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Expr AND(List<Expr> operands, Attribute... attributes) {
		switch (operands.size()) {
			case 0:
				throw new IllegalArgumentException("empty conjunction");
			case 1:
				return operands.get(0);
			default:
				return new Expr.LogicalAnd(operands, attributes);
		}
	}

	public static Expr AND(Expr operand1, Expr operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr OR(List<Expr> operands, Attribute... attributes) {
		switch (operands.size()) {
			case 0:
				throw new IllegalArgumentException("empty disjunction");
			case 1:
				return operands.get(0);
			default:
				return new Expr.LogicalOr(operands, attributes);
		}
	}

	public static Expr OR(Expr operand1, Expr operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr.LogicalXor XOR(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LogicalXor(lhs, rhs, attributes);
	}

	public static Expr.Implies IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Implies(lhs, rhs, attributes);
	}

	public static Expr.LogicalNot NOT(Expr operand, Attribute... attributes) {
		return new Expr.LogicalNot(operand, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Expr.LocalVar> variables, List<Trigger> triggers, Expr body,
			Attribute... attributes) {
		return new Expr.UniversalQuantifier(variables, triggers, body, attributes);
	}

	public static Trigger TRIGGER(List<Expr> terms, Attribute... attributes) {
		return new Trigger(terms, attributes);
	}

	// Relational Operators

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	// Arithmetic Operators

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.Division DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Division(lhs, rhs, attributes);
	}

	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	// Misc

	public static Expr.IfElse IFELSE(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.IfElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Expr.Old OLD(Expr operand, Attribute... attributes) {
		return new Expr.Old(operand, attributes);
	}

	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}
}
