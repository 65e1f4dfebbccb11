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
package vspec.encoder;

import static org.junit.jupiter.api.Assertions.*;
import static vspec.syntax.Syntax.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import vspec.core.ExpressionId;
import vspec.core.ExpressionRef;
import vspec.core.SpecificationId;
import vspec.core.Vir;
import vspec.io.VirPrinter;
import vspec.syntax.ProcedureScope;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;
import vspec.util.ExpressionEvaluator;

public class ExpressionEncoderTest {
	private static final Syntax.Type I32 = INT("i32");
	private static final Syntax.Type BOOL = Syntax.Type.Bool;
	private static final Syntax.Expr A = VAR("a", I32);
	private static final Syntax.Expr B = VAR("b", I32);
	private static final Syntax.Expr C = VAR("c", I32);
	private static final Syntax.Expr F = VAR("f", BOOL);
	private static final Syntax.Expr G = VAR("g", BOOL);

	private static final ProcedureScope SCOPE = ProcedureScope.builder()
			.returns(I32)
			.argument("a", I32)
			.argument("b", I32)
			.argument("c", I32)
			.argument("f", BOOL)
			.argument("g", BOOL)
			.argument("p", TUPLE(I32, I32))
			.argument("r", REF(I32))
			.build();

	private final ExpressionEncoder encoder = new ExpressionEncoder();

	private final EncodingContext context = EncodingContext.of(SCOPE);

	private Vir.Expr encode(Syntax.Expr expr) {
		return encoder.encode(expr, context);
	}

	private ErrorCode failure(Syntax.Expr expr) {
		return assertThrows(EncodingException.class, () -> encode(expr)).getCode();
	}

	private static Map<String, Object> state() {
		Map<String, Object> state = new HashMap<>();
		state.put("_1.val_int", BigInteger.valueOf(4));
		state.put("_2.val_int", BigInteger.valueOf(4));
		state.put("_3.val_int", BigInteger.valueOf(5));
		state.put("_4.val_bool", true);
		state.put("_5.val_bool", false);
		return state;
	}

	// ======================================================================
	// Operator table
	// ======================================================================

	private static Stream<Arguments> operators() {
		return Stream.of(
				Arguments.of(BINOP(Expr.BinaryOp.EQ, A, B), true),
				Arguments.of(BINOP(Expr.BinaryOp.NE, A, C), true),
				Arguments.of(NOT(BINOP(Expr.BinaryOp.EQ, A, C)), true),
				Arguments.of(BINOP(Expr.BinaryOp.LT, A, C), true),
				Arguments.of(BINOP(Expr.BinaryOp.LE, A, C), true),
				Arguments.of(BINOP(Expr.BinaryOp.GT, A, C), false),
				Arguments.of(BINOP(Expr.BinaryOp.GE, A, B), true),
				Arguments.of(BINOP(Expr.BinaryOp.EQ, BINOP(Expr.BinaryOp.ADD, A, B), LITERAL(8, I32)), true),
				Arguments.of(BINOP(Expr.BinaryOp.EQ, BINOP(Expr.BinaryOp.SUB, A, C), NEG(LITERAL(1, I32))), true),
				Arguments.of(BINOP(Expr.BinaryOp.EQ, BINOP(Expr.BinaryOp.MUL, A, C), LITERAL(20, I32)), true),
				Arguments.of(BINOP(Expr.BinaryOp.EQ, BINOP(Expr.BinaryOp.DIV, C, A), LITERAL(1, I32)), true),
				Arguments.of(BINOP(Expr.BinaryOp.EQ, BINOP(Expr.BinaryOp.REM, C, A), LITERAL(1, I32)), true),
				Arguments.of(BINOP(Expr.BinaryOp.AND, F, G), false),
				Arguments.of(BINOP(Expr.BinaryOp.OR, F, G), true),
				Arguments.of(BINOP(Expr.BinaryOp.BIT_AND, F, G), false),
				Arguments.of(BINOP(Expr.BinaryOp.BIT_OR, F, G), true),
				Arguments.of(BINOP(Expr.BinaryOp.BIT_XOR, F, F), false),
				Arguments.of(IFELSE(F, BINOP(Expr.BinaryOp.LT, A, C), LITERAL(false)), true),
				Arguments.of(BLOCK(BINOP(Expr.BinaryOp.EQ, A, B)), true));
	}

	@ParameterizedTest
	@MethodSource("operators")
	public void test_operator(Syntax.Expr expr, boolean expected) {
		Vir.Expr e = encode(expr);
		assertEquals(Vir.Type.Bool, e.getType());
		assertEquals(expected, new ExpressionEvaluator(state()).evaluateBoolean(e));
	}

	@Test
	public void test_comparisons_are_boolean() {
		Vir.Expr e = encode(BINOP(Expr.BinaryOp.EQ, F, G));
		assertTrue(e instanceof Vir.Expr.Equals);
		assertEquals(Vir.Type.Bool, e.getType());
	}

	@Test
	public void test_bitwise_on_booleans_is_logical() {
		assertTrue(encode(BINOP(Expr.BinaryOp.BIT_AND, F, G)) instanceof Vir.Expr.LogicalAnd);
		assertTrue(encode(BINOP(Expr.BinaryOp.BIT_OR, F, G)) instanceof Vir.Expr.LogicalOr);
		assertTrue(encode(BINOP(Expr.BinaryOp.BIT_XOR, F, G)) instanceof Vir.Expr.LogicalXor);
	}

	// ======================================================================
	// Literals and places
	// ======================================================================

	@Test
	public void test_literals() {
		BigInteger max = new BigInteger("340282366920938463463374607431768211455");
		Syntax.Expr big = new Syntax.Expr.IntLiteral(max, Expr.LiteralKind.UNSIGNED, INT("u128"), Span.UNKNOWN);
		assertEquals(max, ((Vir.Expr.Integer) encode(big)).getValue());
		Syntax.Expr plain = new Syntax.Expr.IntLiteral(BigInteger.TEN, Expr.LiteralKind.UNSUFFIXED, I32, Span.UNKNOWN);
		assertEquals(BigInteger.TEN, ((Vir.Expr.Integer) encode(plain)).getValue());
		assertTrue(((Vir.Expr.Boolean) encode(LITERAL(true))).getValue());
	}

	@Test
	public void test_primitive_places_are_unwrapped() {
		assertEquals("_1.val_int", VirPrinter.toString(encode(A)));
		assertEquals("_4.val_bool", VirPrinter.toString(encode(F)));
		assertEquals("_6.tuple_1.val_int", VirPrinter.toString(encode(FIELD(VAR("p", TUPLE(I32, I32)), 1, I32))));
		assertEquals("_0.val_int", VirPrinter.toString(encode(VAR(ProcedureScope.RESULT, I32))));
	}

	@Test
	public void test_aggregate_places_stay_references() {
		Vir.Expr e = encode(VAR("p", TUPLE(I32, I32)));
		assertEquals("_6", VirPrinter.toString(e));
		assertTrue(e.getType().isRef());
	}

	@Test
	public void test_encoded_items_carry_source() {
		Syntax.Expr expr = BINOP(Expr.BinaryOp.ADD, A, B);
		Vir.Expr.Addition e = (Vir.Expr.Addition) encode(expr);
		assertSame(expr, e.getAttribute(Syntax.Expr.class));
		assertSame(A, e.getLeftHandSide().getAttribute(Syntax.Expr.class));
	}

	// ======================================================================
	// Old
	// ======================================================================

	@Test
	public void test_old_is_transparent() {
		Syntax.Expr inner = BINOP(Expr.BinaryOp.ADD, A, FIELD(VAR("p", TUPLE(I32, I32)), 0, I32));
		Vir.Expr e = encode(OLD(inner));
		assertTrue(e instanceof Vir.Expr.Old);
		String expected = VirPrinter.toString(encode(inner));
		assertEquals(expected, VirPrinter.toString(((Vir.Expr.Old) e).getOperand()));
		assertEquals("old(" + expected + ")", VirPrinter.toString(e));
	}

	@Test
	public void test_old_reads_prestate() {
		Map<String, Object> pre = state();
		pre.put("_1.val_int", BigInteger.valueOf(3));
		Vir.Expr e = encode(BINOP(Expr.BinaryOp.EQ, A, BINOP(Expr.BinaryOp.ADD, OLD(A), LITERAL(1, I32))));
		assertTrue(new ExpressionEvaluator(state(), pre).evaluateBoolean(e));
	}

	@Test
	public void test_old_requires_one_argument() {
		Syntax.Expr callee = VAR(ExpressionEncoder.OLD, I32);
		Syntax.Expr call = new Syntax.Expr.Call(callee, Arrays.asList(A, B), I32, Span.UNKNOWN);
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(call));
		Syntax.Expr none = new Syntax.Expr.Call(callee, Collections.emptyList(), I32, Span.UNKNOWN);
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(none));
	}

	@Test
	public void test_other_calls_rejected() {
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(CALL("len", I32, A)));
	}

	// ======================================================================
	// Failures
	// ======================================================================

	@Test
	public void test_type_mismatches() {
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(NEG(F)));
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(NOT(A)));
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(BINOP(Expr.BinaryOp.ADD, F, A)));
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(BINOP(Expr.BinaryOp.AND, A, F)));
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(IFELSE(A, B, C)));
		assertEquals(ErrorCode.TYPE_MISMATCH, failure(BINOP(Expr.BinaryOp.MUL, VAR("p", TUPLE(I32, I32)), A)));
	}

	@Test
	public void test_unsupported_operators() {
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(BINOP(Expr.BinaryOp.BIT_AND, A, B)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(BINOP(Expr.BinaryOp.BIT_XOR, F, A)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(BINOP(Expr.BinaryOp.SHL, A, B)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(BINOP(Expr.BinaryOp.SHR, A, B)));
	}

	@Test
	public void test_unsupported_expressions() {
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(new Syntax.Expr.StrLiteral("hello", Span.UNKNOWN)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(IFELSE(F, A, null)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(BLOCK(null)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX,
				failure(new Syntax.Expr.Block(Arrays.asList(A), B, I32, Span.UNKNOWN)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX,
				failure(new Syntax.Expr.Tuple(Arrays.asList(A, B), TUPLE(I32, I32), Span.UNKNOWN)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, failure(VAR("r", REF(I32))));
	}

	@Test
	public void test_diagnostic_carries_span() {
		Syntax.Expr bad = new Syntax.Expr.Unary(Expr.UnaryOp.NOT, A, BOOL, new Span(3, 7));
		EncodingException e = assertThrows(EncodingException.class,
				() -> encode(BINOP(Expr.BinaryOp.AND, F, bad)));
		assertEquals(new Span(3, 7), e.getDiagnostic().getSpan().get());
		assertFalse(e.getDiagnostic().getLeaf().isPresent());
	}

	@Test
	public void test_diagnostic_carries_leaf() {
		ExpressionRef ref = new ExpressionRef(SpecificationId.fresh(), new ExpressionId(7));
		TypedExpression leaf = new TypedExpression(ref, NOT(A));
		EncodingException e = assertThrows(EncodingException.class, () -> encoder.encode(leaf, context));
		assertEquals(ref, e.getDiagnostic().getLeaf().get());
		assertEquals(ErrorCode.TYPE_MISMATCH, e.getCode());
	}
}
