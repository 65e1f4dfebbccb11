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
import static vspec.core.Assertion.AND;
import static vspec.core.Assertion.EXPR;
import static vspec.core.Assertion.FORALL;
import static vspec.core.Assertion.IMPLIES;
import static vspec.syntax.Syntax.BINDER;
import static vspec.syntax.Syntax.BINOP;
import static vspec.syntax.Syntax.INT;
import static vspec.syntax.Syntax.LITERAL;
import static vspec.syntax.Syntax.NOT;
import static vspec.syntax.Syntax.VAR;

import java.util.Arrays;
import java.util.Collections;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import vspec.core.Assertion;
import vspec.core.SpecificationId;
import vspec.core.Vir;
import vspec.io.VirPrinter;
import vspec.syntax.ExpressionRegistry;
import vspec.syntax.ProcedureScope;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;

public class AssertionEncoderTest {
	private static final Syntax.Type I32 = INT("i32");
	private static final Syntax.Type BOOL = Syntax.Type.Bool;

	private final EncodingContext context = EncodingContext.of(ProcedureScope.builder()
			.returns(I32)
			.argument("f", BOOL)
			.argument("g", BOOL)
			.argument("n", I32)
			.build());

	private final AssertionEncoder encoder = new AssertionEncoder();

	private final ExpressionRegistry.Default registry = new ExpressionRegistry.Default();

	private final SpecificationId spec = SpecificationId.fresh();

	private Assertion<TypedExpression> leaf(Syntax.Expr expr) {
		return EXPR(registry.register(spec, expr));
	}

	private String encode(Assertion<TypedExpression> assertion) {
		return VirPrinter.toString(encoder.encode(assertion, context));
	}

	@Test
	public void test_leaf() {
		assertEquals("_1.val_bool", encode(leaf(VAR("f", BOOL))));
	}

	@Test
	public void test_conjunction() {
		assertEquals("_1.val_bool && _2.val_bool && (_3.val_int > 0)",
				encode(AND(leaf(VAR("f", BOOL)), leaf(VAR("g", BOOL)),
						leaf(BINOP(Syntax.Expr.BinaryOp.GT, VAR("n", I32), LITERAL(0, I32))))));
	}

	@Test
	public void test_singleton_conjunction() {
		assertEquals("_1.val_bool", encode(AND(leaf(VAR("f", BOOL)))));
	}

	@Test
	public void test_empty_conjunction_rejected() {
		EncodingException e = assertThrows(EncodingException.class,
				() -> encoder.encode(AND(Collections.emptyList()), context));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, e.getCode());
	}

	@Test
	public void test_implication() {
		Assertion<TypedExpression> a = IMPLIES(leaf(VAR("f", BOOL)),
				AND(leaf(VAR("g", BOOL)), leaf(NOT(VAR("f", BOOL)))));
		assertEquals("_1.val_bool ==> (_2.val_bool && (!_1.val_bool))", encode(a));
	}

	@Test
	public void test_postcondition_over_result() {
		Syntax.Expr expr = BINOP(Syntax.Expr.BinaryOp.GE, VAR(ProcedureScope.RESULT, I32), VAR("n", I32));
		assertEquals("_0.val_int >= _3.val_int", encode(leaf(expr)));
	}

	@Test
	public void test_quantifier_delegated() {
		Syntax.Expr i = VAR("i", I32);
		Assertion<TypedExpression> a = FORALL(Arrays.asList(BINDER("i", I32)), Collections.emptyList(),
				registry.register(spec, LITERAL(true)),
				registry.register(spec, BINOP(Syntax.Expr.BinaryOp.GE, i, i)));
		Vir.Expr e = encoder.encode(IMPLIES(leaf(VAR("f", BOOL)), a), context);
		assertTrue(((Vir.Expr.Implies) e).getRightHandSide() instanceof Vir.Expr.UniversalQuantifier);
	}

	@Test
	public void test_failure_identifies_leaf() {
		TypedExpression bad = registry.register(spec, NOT(VAR("n", I32)));
		Assertion<TypedExpression> a = AND(leaf(VAR("f", BOOL)), IMPLIES(leaf(VAR("g", BOOL)), EXPR(bad)));
		EncodingResult r = encoder.tryEncode(a, context);
		assertFalse(r.isSuccess());
		assertEquals(ErrorCode.TYPE_MISMATCH, r.getDiagnostic().getCode());
		assertEquals(bad.getRef(), r.getDiagnostic().getLeaf().get());
		assertThrows(NoSuchElementException.class, r::getValue);
	}

	@Test
	public void test_non_boolean_leaf_rejected() {
		TypedExpression n = registry.register(spec, VAR("n", I32));
		EncodingResult r = encoder.tryEncode(IMPLIES(leaf(VAR("f", BOOL)), EXPR(n)), context);
		assertEquals(ErrorCode.TYPE_MISMATCH, r.getDiagnostic().getCode());
		assertEquals(n.getRef(), r.getDiagnostic().getLeaf().get());
		r = encoder.tryEncode(AND(leaf(VAR("g", BOOL)), leaf(LITERAL(3, I32))), context);
		assertEquals(ErrorCode.TYPE_MISMATCH, r.getDiagnostic().getCode());
	}

	@Test
	public void test_try_encode_success() {
		EncodingResult r = encoder.tryEncode(leaf(VAR("f", BOOL)), context);
		assertTrue(r.isSuccess());
		assertEquals("_1.val_bool", VirPrinter.toString(r.getValue()));
		assertThrows(NoSuchElementException.class, r::getDiagnostic);
	}

	@Test
	public void test_encoding_is_repeatable() {
		Assertion<TypedExpression> a = IMPLIES(leaf(VAR("f", BOOL)), leaf(VAR("g", BOOL)));
		Vir.Expr e1 = encoder.encode(a, context);
		Vir.Expr e2 = encoder.encode(a, context);
		assertNotSame(e1, e2);
		assertEquals(VirPrinter.toString(e1), VirPrinter.toString(e2));
	}
}
