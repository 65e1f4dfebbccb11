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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The type-checked surface syntax of specification expressions, as handed over
 * by the parser and type checker. Every expression carries its inferred static
 * type along with the source span it was parsed from. Trees are immutable once
 * constructed.
 */
public class Syntax {

	// =========================================================================
	// Spans
	// =========================================================================

	/**
	 * Identifies a region of source text by its (inclusive) start and (exclusive)
	 * end offsets.
	 */
	public static class Span {
		public static final Span UNKNOWN = new Span(0, 0);

		private final int start;
		private final int end;

		public Span(int start, int end) {
			if (start < 0 || end < start) {
				throw new IllegalArgumentException("invalid span (" + start + "," + end + ")");
			}
			this.start = start;
			this.end = end;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Span) {
				Span s = (Span) o;
				return start == s.start && end == s.end;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return start * 31 + end;
		}

		@Override
		public String toString() {
			return start + ".." + end;
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type {
		public static final Type Bool = new Bool();
		public static final Type Str = new Str();

		/**
		 * Get the name of the type predicate describing values of this type. This is
		 * used to name typed references in the generated IR.
		 *
		 * @return
		 */
		public String getPredicateName();

		public static class Bool implements Type {
			@Override
			public String getPredicateName() {
				return "bool";
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
				return getPredicateName();
			}
		}

		public static class Str implements Type {
			@Override
			public String getPredicateName() {
				return "str";
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Str;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return getPredicateName();
			}
		}

		/**
		 * A fixed-width (or pointer-sized) integer type, such as <code>i32</code> or
		 * <code>usize</code>.
		 */
		public static class Int implements Type {
			private static final List<String> NAMES = Arrays.asList("i8", "i16", "i32", "i64", "i128", "isize", "u8",
					"u16", "u32", "u64", "u128", "usize");

			private final String name;

			public Int(String name) {
				if (!NAMES.contains(name)) {
					throw new IllegalArgumentException("unknown integer type: " + name);
				}
				this.name = name;
			}

			public boolean isSigned() {
				return name.charAt(0) == 'i';
			}

			@Override
			public String getPredicateName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int && ((Int) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class Tuple implements Type {
			private final List<Type> elements;

			public Tuple(List<Type> elements) {
				this.elements = new ArrayList<>(elements);
			}

			public List<Type> getElements() {
				return Collections.unmodifiableList(elements);
			}

			@Override
			public String getPredicateName() {
				StringBuilder sb = new StringBuilder("tuple" + elements.size());
				for (Type t : elements) {
					sb.append('$').append(t.getPredicateName());
				}
				return sb.toString();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Tuple && ((Tuple) o).elements.equals(elements);
			}

			@Override
			public int hashCode() {
				return elements.hashCode();
			}

			@Override
			public String toString() {
				return getPredicateName();
			}
		}

		/**
		 * A user-defined struct or enum.
		 */
		public static class Adt implements Type {
			private final String name;

			public Adt(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public String getPredicateName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Adt && ((Adt) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class Reference implements Type {
			private final Type target;

			public Reference(Type target) {
				this.target = target;
			}

			public Type getTarget() {
				return target;
			}

			@Override
			public String getPredicateName() {
				return "ref$" + target.getPredicateName();
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Reference && ((Reference) o).target.equals(target);
			}

			@Override
			public int hashCode() {
				return target.hashCode() * 7;
			}

			@Override
			public String toString() {
				return "&" + target;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr {
		/**
		 * Get the static type assigned to this expression by the type checker.
		 *
		 * @return
		 */
		public Type getType();

		/**
		 * Get the source span from which this expression was parsed.
		 *
		 * @return
		 */
		public Span getSpan();

		public enum LiteralKind {
			SIGNED, UNSIGNED, UNSUFFIXED
		}

		public enum UnaryOp {
			NEG, NOT
		}

		public enum BinaryOp {
			ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"), AND("&&"), OR("||"), BIT_AND("&"), BIT_OR("|"),
			BIT_XOR("^"), SHL("<<"), SHR(">>"), EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

			private final String symbol;

			BinaryOp(String symbol) {
				this.symbol = symbol;
			}

			public String getSymbol() {
				return symbol;
			}
		}

		public static abstract class AbstractExpr implements Expr {
			private final Type type;
			private final Span span;

			public AbstractExpr(Type type, Span span) {
				if (type == null) {
					throw new IllegalArgumentException("untyped expression");
				}
				this.type = type;
				this.span = span == null ? Span.UNKNOWN : span;
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public Span getSpan() {
				return span;
			}
		}

		public static class IntLiteral extends AbstractExpr {
			private final BigInteger value;
			private final LiteralKind kind;

			public IntLiteral(BigInteger value, LiteralKind kind, Type type, Span span) {
				super(type, span);
				this.value = value;
				this.kind = kind;
			}

			public BigInteger getValue() {
				return value;
			}

			public LiteralKind getKind() {
				return kind;
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public static class BoolLiteral extends AbstractExpr {
			private final boolean value;

			public BoolLiteral(boolean value, Span span) {
				super(Type.Bool, span);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public String toString() {
				return Boolean.toString(value);
			}
		}

		public static class StrLiteral extends AbstractExpr {
			private final String value;

			public StrLiteral(String value, Span span) {
				super(new Type.Reference(Type.Str), span);
				this.value = value;
			}

			public String getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "\"" + value + "\"";
			}
		}

		public static class Variable extends AbstractExpr {
			private final String name;

			public Variable(String name, Type type, Span span) {
				super(type, span);
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A projection from a struct, enum variant or tuple. Tuple fields are
		 * identified by index, whilst struct and enum fields are identified by the
		 * index of the enclosing variant (always zero for a struct) and their name.
		 */
		public static class FieldAccess extends AbstractExpr {
			private final Expr source;
			private final String field;
			private final int index;
			private final int variant;

			public FieldAccess(Expr source, String field, int index, int variant, Type type, Span span) {
				super(type, span);
				this.source = source;
				this.field = field;
				this.index = index;
				this.variant = variant;
			}

			public Expr getSource() {
				return source;
			}

			public String getField() {
				return field;
			}

			public int getIndex() {
				return index;
			}

			public int getVariant() {
				return variant;
			}

			@Override
			public String toString() {
				return source + "." + field;
			}
		}

		public static class Deref extends AbstractExpr {
			private final Expr operand;

			public Deref(Expr operand, Type type, Span span) {
				super(type, span);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "*" + operand;
			}
		}

		public static class Unary extends AbstractExpr {
			private final UnaryOp op;
			private final Expr operand;

			public Unary(UnaryOp op, Expr operand, Type type, Span span) {
				super(type, span);
				this.op = op;
				this.operand = operand;
			}

			public UnaryOp getOp() {
				return op;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return (op == UnaryOp.NEG ? "-" : "!") + "(" + operand + ")";
			}
		}

		public static class Binary extends AbstractExpr {
			private final BinaryOp op;
			private final Expr lhs;
			private final Expr rhs;

			public Binary(BinaryOp op, Expr lhs, Expr rhs, Type type, Span span) {
				super(type, span);
				this.op = op;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinaryOp getOp() {
				return op;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public String toString() {
				return "(" + lhs + " " + op.getSymbol() + " " + rhs + ")";
			}
		}

		/**
		 * A conditional expression. The false branch is <code>null</code> when none
		 * was written.
		 */
		public static class IfElse extends AbstractExpr {
			private final Expr condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			public IfElse(Expr condition, Expr trueBranch, Expr falseBranch, Type type, Span span) {
				super(type, span);
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
			public String toString() {
				return "if " + condition + " { " + trueBranch + " } else { " + falseBranch + " }";
			}
		}

		/**
		 * A block of zero or more statements, optionally followed by a tail
		 * expression (which is <code>null</code> when absent).
		 */
		public static class Block extends AbstractExpr {
			private final List<Expr> statements;
			private final Expr tail;

			public Block(Collection<Expr> statements, Expr tail, Type type, Span span) {
				super(type, span);
				this.statements = new ArrayList<>(statements);
				this.tail = tail;
			}

			public List<Expr> getStatements() {
				return Collections.unmodifiableList(statements);
			}

			public Expr getTail() {
				return tail;
			}

			@Override
			public String toString() {
				return "{ " + tail + " }";
			}
		}

		public static class Call extends AbstractExpr {
			private final Expr callee;
			private final List<Expr> arguments;

			public Call(Expr callee, Collection<Expr> arguments, Type type, Span span) {
				super(type, span);
				this.callee = callee;
				this.arguments = new ArrayList<>(arguments);
			}

			public Expr getCallee() {
				return callee;
			}

			public List<Expr> getArguments() {
				return Collections.unmodifiableList(arguments);
			}

			@Override
			public String toString() {
				return callee + arguments.toString();
			}
		}

		public static class Tuple extends AbstractExpr {
			private final List<Expr> items;

			public Tuple(Collection<Expr> items, Type type, Span span) {
				super(type, span);
				this.items = new ArrayList<>(items);
			}

			public List<Expr> getItems() {
				return Collections.unmodifiableList(items);
			}
		}

		public static class Match extends AbstractExpr {
			private final Expr scrutinee;
			private final List<Arm> arms;

			public Match(Expr scrutinee, Collection<Arm> arms, Type type, Span span) {
				super(type, span);
				this.scrutinee = scrutinee;
				this.arms = new ArrayList<>(arms);
			}

			public Expr getScrutinee() {
				return scrutinee;
			}

			public List<Arm> getArms() {
				return Collections.unmodifiableList(arms);
			}

			@Override
			public String toString() {
				return "match " + scrutinee + " " + arms;
			}
		}
	}

	// =========================================================================
	// Patterns
	// =========================================================================

	/**
	 * A single arm of a match expression. An arm may list several alternative
	 * patterns (e.g. <code>1 | 2 => ...</code>) and may have a guard (which is
	 * <code>null</code> when absent).
	 */
	public static class Arm {
		private final List<Pattern> patterns;
		private final Expr guard;
		private final Expr body;

		public Arm(Collection<Pattern> patterns, Expr guard, Expr body) {
			this.patterns = new ArrayList<>(patterns);
			this.guard = guard;
			this.body = body;
		}

		public List<Pattern> getPatterns() {
			return Collections.unmodifiableList(patterns);
		}

		public Expr getGuard() {
			return guard;
		}

		public Expr getBody() {
			return body;
		}

		@Override
		public String toString() {
			return patterns + " => " + body;
		}
	}

	public interface Pattern {

		public static class Wildcard implements Pattern {
			@Override
			public String toString() {
				return "_";
			}
		}

		public static class Literal implements Pattern {
			private final Expr value;

			public Literal(Expr value) {
				this.value = value;
			}

			public Expr getValue() {
				return value;
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public static class Binding implements Pattern {
			private final String name;

			public Binding(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A struct (or struct-like enum variant) pattern, such as
		 * <code>Point { x, .. }</code>.
		 */
		public static class Struct implements Pattern {
			private final String path;
			private final List<String> fields;

			public Struct(String path, Collection<String> fields) {
				this.path = path;
				this.fields = new ArrayList<>(fields);
			}

			public String getPath() {
				return path;
			}

			public List<String> getFields() {
				return Collections.unmodifiableList(fields);
			}

			@Override
			public String toString() {
				return path + " { " + String.join(", ", fields) + " }";
			}
		}

		/**
		 * A tuple-like struct or enum variant pattern, such as
		 * <code>Some(..)</code> or <code>None()</code>.
		 */
		public static class TupleStruct implements Pattern {
			private final String path;
			private final List<Pattern> items;

			public TupleStruct(String path, Collection<Pattern> items) {
				this.path = path;
				this.items = new ArrayList<>(items);
			}

			public String getPath() {
				return path;
			}

			public List<Pattern> getItems() {
				return Collections.unmodifiableList(items);
			}

			@Override
			public String toString() {
				return path + items;
			}
		}

		public static class Tuple implements Pattern {
			private final List<Pattern> items;

			public Tuple(Collection<Pattern> items) {
				this.items = new ArrayList<>(items);
			}

			public List<Pattern> getItems() {
				return Collections.unmodifiableList(items);
			}

			@Override
			public String toString() {
				return items.toString();
			}
		}
	}

	// =========================================================================
	// Binders
	// =========================================================================

	/**
	 * The declaration of a variable introduced by a quantifier.
	 */
	public static class Binder {
		private final String name;
		private final Type type;
		private final Span span;

		public Binder(String name, Type type, Span span) {
			this.name = name;
			this.type = type;
			this.span = span == null ? Span.UNKNOWN : span;
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public Span getSpan() {
			return span;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Binder) {
				Binder b = (Binder) o;
				return name.equals(b.name) && type.equals(b.type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ type.hashCode();
		}

		@Override
		public String toString() {
			return name + ": " + type;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Type.Int INT(String name) {
		return new Type.Int(name);
	}

	public static Type.Adt ADT(String name) {
		return new Type.Adt(name);
	}

	public static Type.Tuple TUPLE(Type... elements) {
		return new Type.Tuple(Arrays.asList(elements));
	}

	public static Type.Reference REF(Type target) {
		return new Type.Reference(target);
	}

	public static Expr.IntLiteral LITERAL(long value, Type type) {
		Expr.LiteralKind kind = ((Type.Int) type).isSigned() ? Expr.LiteralKind.SIGNED : Expr.LiteralKind.UNSIGNED;
		return new Expr.IntLiteral(BigInteger.valueOf(value), kind, type, Span.UNKNOWN);
	}

	public static Expr.BoolLiteral LITERAL(boolean value) {
		return new Expr.BoolLiteral(value, Span.UNKNOWN);
	}

	public static Expr.Variable VAR(String name, Type type) {
		return new Expr.Variable(name, type, Span.UNKNOWN);
	}

	public static Expr.FieldAccess FIELD(Expr source, String field, Type type) {
		return new Expr.FieldAccess(source, field, -1, 0, type, Span.UNKNOWN);
	}

	public static Expr.FieldAccess FIELD(Expr source, int index, Type type) {
		return new Expr.FieldAccess(source, Integer.toString(index), index, 0, type, Span.UNKNOWN);
	}

	public static Expr.Deref DEREF(Expr operand, Type type) {
		return new Expr.Deref(operand, type, Span.UNKNOWN);
	}

	public static Expr.Unary NEG(Expr operand) {
		return new Expr.Unary(Expr.UnaryOp.NEG, operand, operand.getType(), Span.UNKNOWN);
	}

	public static Expr.Unary NOT(Expr operand) {
		return new Expr.Unary(Expr.UnaryOp.NOT, operand, operand.getType(), Span.UNKNOWN);
	}

	/**
	 * Construct a binary expression, inferring its type from the operator: the
	 * comparisons and logical connectives produce booleans, everything else the
	 * type of the left-hand side.
	 *
	 * @param op
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr.Binary BINOP(Expr.BinaryOp op, Expr lhs, Expr rhs) {
		Type type;
		switch (op) {
			case EQ:
			case NE:
			case LT:
			case LE:
			case GT:
			case GE:
			case AND:
			case OR:
				type = Type.Bool;
				break;
			default:
				type = lhs.getType();
		}
		return new Expr.Binary(op, lhs, rhs, type, Span.UNKNOWN);
	}

	public static Expr.IfElse IFELSE(Expr condition, Expr trueBranch, Expr falseBranch) {
		return new Expr.IfElse(condition, trueBranch, falseBranch, trueBranch.getType(), Span.UNKNOWN);
	}

	public static Expr.Block BLOCK(Expr tail) {
		return new Expr.Block(Collections.emptyList(), tail, tail == null ? TUPLE() : tail.getType(), Span.UNKNOWN);
	}

	public static Expr.Call CALL(String name, Type type, Expr... arguments) {
		Expr callee = new Expr.Variable(name, type, Span.UNKNOWN);
		return new Expr.Call(callee, Arrays.asList(arguments), type, Span.UNKNOWN);
	}

	public static Expr.Call OLD(Expr argument) {
		return CALL("old", argument.getType(), argument);
	}

	public static Expr.Match MATCH(Expr scrutinee, Arm... arms) {
		return new Expr.Match(scrutinee, Arrays.asList(arms), arms[0].getBody().getType(), Span.UNKNOWN);
	}

	public static Arm ARM(Pattern pattern, Expr body) {
		return new Arm(Arrays.asList(pattern), null, body);
	}

	public static Pattern.Wildcard WILDCARD() {
		return new Pattern.Wildcard();
	}

	public static Pattern.Literal PLITERAL(Expr value) {
		return new Pattern.Literal(value);
	}

	public static Binder BINDER(String name, Type type) {
		return new Binder(name, type, Span.UNKNOWN);
	}
}
