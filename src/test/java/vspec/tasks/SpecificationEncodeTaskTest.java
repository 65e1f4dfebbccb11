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
package vspec.tasks;

import static org.junit.jupiter.api.Assertions.*;
import static vspec.core.Assertion.AND;
import static vspec.core.Assertion.EXPR;
import static vspec.core.Assertion.FORALL;
import static vspec.core.Assertion.IMPLIES;
import static vspec.syntax.Syntax.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import vspec.core.Assertion;
import vspec.core.SpecificationId;
import vspec.encoder.BindingPolicy;
import vspec.encoder.EncodingResult;
import vspec.encoder.ErrorCode;
import vspec.io.AssertionJson;
import vspec.io.VirPrinter;
import vspec.syntax.ExpressionRegistry;
import vspec.syntax.ProcedureScope;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;

public class SpecificationEncodeTaskTest {
	private static final Syntax.Type I32 = INT("i32");

	private final ProcedureScope scope = ProcedureScope.builder()
			.returns(I32)
			.argument("x", I32)
			.argument("ok", Syntax.Type.Bool)
			.build();

	private final ExpressionRegistry.Default registry = new ExpressionRegistry.Default();

	private TypedExpression leaf(SpecificationId spec, Syntax.Expr expr) {
		return registry.register(spec, expr);
	}

	@Test
	public void test_batch_reports_every_failure() {
		SpecificationId pre = SpecificationId.fresh();
		SpecificationId bad1 = SpecificationId.fresh();
		SpecificationId bad2 = SpecificationId.fresh();
		SpecificationId post = SpecificationId.fresh();
		List<Assertion<TypedExpression>> specs = Arrays.asList(
				EXPR(leaf(pre, BINOP(Expr.BinaryOp.GT, VAR("x", I32), LITERAL(0, I32)))),
				EXPR(leaf(bad1, NEG(VAR("ok", Syntax.Type.Bool)))),
				AND(EXPR(leaf(bad2, VAR("y", I32)))),
				IMPLIES(EXPR(leaf(post, VAR("ok", Syntax.Type.Bool))),
						EXPR(leaf(post, BINOP(Expr.BinaryOp.EQ, VAR(ProcedureScope.RESULT, I32), VAR("x", I32))))));
		List<EncodingResult> results = new SpecificationEncodeTask(scope).setVerbose(true).encodeAll(specs);
		assertEquals(4, results.size());
		assertTrue(results.get(0).isSuccess());
		assertEquals(ErrorCode.TYPE_MISMATCH, results.get(1).getDiagnostic().getCode());
		assertEquals(bad1, results.get(1).getDiagnostic().getLeaf().get().getSpecificationId());
		assertEquals(ErrorCode.UNRESOLVED_BINDING, results.get(2).getDiagnostic().getCode());
		assertEquals(bad2, results.get(2).getDiagnostic().getLeaf().get().getSpecificationId());
		assertEquals("_2.val_bool ==> (_0.val_int == _1.val_int)", VirPrinter.toString(results.get(3).getValue()));
	}

	@Test
	public void test_decode_and_encode() {
		SpecificationId spec = SpecificationId.fresh();
		Assertion<TypedExpression> typed = IMPLIES(EXPR(leaf(spec, VAR("ok", Syntax.Type.Bool))),
				EXPR(leaf(spec, BINOP(Expr.BinaryOp.GE, VAR("x", I32), LITERAL(1, I32)))));
		String json = AssertionJson.toJson(AssertionJson.skeleton(typed));
		EncodingResult result = new SpecificationEncodeTask(scope).decodeAndEncode(json, registry);
		assertTrue(result.isSuccess());
		assertEquals("_2.val_bool ==> (_1.val_int >= 1)", VirPrinter.toString(result.getValue()));
	}

	@Test
	public void test_decode_failures_are_results() {
		SpecificationEncodeTask task = new SpecificationEncodeTask(scope);
		EncodingResult malformed = task.decodeAndEncode("{\"kind\":", registry);
		assertEquals(ErrorCode.SERIALIZATION_ERROR, malformed.getDiagnostic().getCode());
		String unknown = "{\"kind\":{\"Expr\":{\"spec_id\":\"" + SpecificationId.fresh() + "\",\"expr_id\":0}}}";
		assertEquals(ErrorCode.SERIALIZATION_ERROR, task.decodeAndEncode(unknown, registry).getDiagnostic().getCode());
		StringBuilder deep = new StringBuilder();
		for (int i = 0; i != 10000; ++i) {
			deep.append("{\"kind\":{\"And\":[");
		}
		EncodingResult nested = task.decodeAndEncode(deep.toString(), registry);
		assertEquals(ErrorCode.SERIALIZATION_ERROR, nested.getDiagnostic().getCode());
	}

	@Test
	public void test_binding_policy() {
		SpecificationId spec = SpecificationId.fresh();
		Assertion<TypedExpression> forall = FORALL(Arrays.asList(BINDER("x", I32)), Collections.emptyList(),
				leaf(spec, LITERAL(true)), leaf(spec, BINOP(Expr.BinaryOp.GE, VAR("x", I32), LITERAL(0, I32))));
		EncodingResult pinned = new SpecificationEncodeTask(scope).encode(forall);
		assertEquals("(forall x: int :: true ==> (_1.val_int >= 0))", VirPrinter.toString(pinned.getValue()));
		EncodingResult scoped = new SpecificationEncodeTask(scope).setBindingPolicy(BindingPolicy.QUANTIFIER_FIRST)
				.encode(forall);
		assertEquals("(forall x: int :: true ==> (x >= 0))", VirPrinter.toString(scoped.getValue()));
	}

	@Test
	public void test_invalid_configuration() {
		assertThrows(IllegalArgumentException.class, () -> new SpecificationEncodeTask(null));
		assertThrows(IllegalArgumentException.class,
				() -> new SpecificationEncodeTask(scope).setBindingPolicy(null));
	}
}
