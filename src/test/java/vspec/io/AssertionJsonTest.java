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
package vspec.io;

import static org.junit.jupiter.api.Assertions.*;
import static vspec.core.Assertion.AND;
import static vspec.core.Assertion.EXPR;
import static vspec.core.Assertion.FORALL;
import static vspec.core.Assertion.IMPLIES;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import vspec.core.Assertion;
import vspec.core.ExpressionId;
import vspec.core.ExpressionRef;
import vspec.core.SpecificationId;
import vspec.encoder.EncodingException;
import vspec.encoder.ErrorCode;
import vspec.syntax.ExpressionRegistry;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;

public class AssertionJsonTest {
	private static final SpecificationId SPEC = SpecificationId.fromString("5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10");
	private static final SpecificationId OTHER = SpecificationId.fresh();

	private static Assertion<ExpressionRef> leaf(SpecificationId spec, long id) {
		return EXPR(new ExpressionRef(spec, new ExpressionId(id)));
	}

	private static Stream<Assertion<ExpressionRef>> skeletons() {
		return Stream.of(
				leaf(SPEC, 0),
				leaf(SPEC, Long.MAX_VALUE),
				AND(leaf(SPEC, 0), leaf(SPEC, 1)),
				AND(Collections.emptyList()),
				IMPLIES(leaf(SPEC, 0), leaf(OTHER, 0)),
				IMPLIES(AND(leaf(SPEC, 1), IMPLIES(leaf(SPEC, 2), leaf(SPEC, 3))), AND(leaf(OTHER, 4))));
	}

	@ParameterizedTest
	@MethodSource("skeletons")
	public void test_round_trip(Assertion<ExpressionRef> skeleton) {
		assertEquals(skeleton, AssertionJson.fromJson(AssertionJson.toJson(skeleton)));
	}

	@Test
	public void test_wire_format() {
		assertEquals("{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":3}}}",
				AssertionJson.toJson(leaf(SPEC, 3)));
		String e = "{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":1}}}";
		assertEquals("{\"kind\":{\"Implies\":[" + e + "," + e + "]}}",
				AssertionJson.toJson(IMPLIES(leaf(SPEC, 1), leaf(SPEC, 1))));
		assertEquals("{\"kind\":{\"And\":[]}}", AssertionJson.toJson(AND(Collections.emptyList())));
	}

	@Test
	public void test_whitespace_accepted() {
		String text = "{ \"kind\" : { \"And\" : [ { \"kind\" : { \"Expr\" : "
				+ "{ \"expr_id\" : 2, \"spec_id\" : \"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\" } } } ] } }\n";
		assertEquals(AND(leaf(SPEC, 2)), AssertionJson.fromJson(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"",
			"   ",
			"{",
			"not json",
			"null",
			"[]",
			"42",
			"{}",
			"{\"kind\":{}}",
			"{\"kind\":[]}",
			"{\"kind\":{\"Or\":[]}}",
			"{\"kind\":{\"And\":{}}}",
			"{\"kind\":{\"And\":[]},\"extra\":1}",
			"{\"kind\":{\"And\":[],\"Implies\":[]}}",
			"{\"kind\":{\"And\":[1]}}",
			"{\"kind\":{\"Implies\":[]}}",
			"{\"kind\":{\"Implies\":[{\"kind\":{\"And\":[]}}]}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\"}}}",
			"{\"kind\":{\"Expr\":{\"expr_id\":1}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"nope\",\"expr_id\":1}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":7,\"expr_id\":1}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":-1}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":1.5}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":\"1\"}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":99999999999999999999}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":1,\"x\":0}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":1,\"expr_id\":2}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"spec_id\":\"5c4a8e0e-3f64-4a43-9a52-8d2e5c1f7b10\",\"expr_id\":1}}}",
			"{\"kind\":{\"Expr\":{\"spec_id\":\"1-1-1-1-1\",\"expr_id\":1}}}",
			"{\"kind\":{\"And\":[]},\"kind\":{\"And\":[]}}",
			"{\"kind\":{\"And\":[],\"And\":[]}}",
			"{\"kind\":{\"And\":[]}} {\"kind\":{\"And\":[]}}",
			"{'kind':{'And':[]}}",
			"{\"kind\":{\"And\":[],}}"
	})
	public void test_malformed_input(String text) {
		EncodingException e = assertThrows(EncodingException.class, () -> AssertionJson.fromJson(text));
		assertEquals(ErrorCode.SERIALIZATION_ERROR, e.getCode());
	}

	private static String nested(int depth) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i != depth; ++i) {
			text.append("{\"kind\":{\"And\":[");
		}
		for (int i = 0; i != depth; ++i) {
			text.append("]}}");
		}
		return text.toString();
	}

	@Test
	public void test_nesting() {
		Assertion<ExpressionRef> expected = AND(Collections.emptyList());
		for (int i = 1; i != 100; ++i) {
			expected = AND(expected);
		}
		assertEquals(expected, AssertionJson.fromJson(nested(100)));
		EncodingException e = assertThrows(EncodingException.class, () -> AssertionJson.fromJson(nested(20000)));
		assertEquals(ErrorCode.SERIALIZATION_ERROR, e.getCode());
	}

	@Test
	public void test_null_input() {
		EncodingException e = assertThrows(EncodingException.class, () -> AssertionJson.fromJson(null));
		assertEquals(ErrorCode.SERIALIZATION_ERROR, e.getCode());
	}

	@Test
	public void test_quantifier_not_serializable() {
		Assertion<ExpressionRef> forall = FORALL(Arrays.asList(Syntax.BINDER("i", Syntax.INT("i32"))),
				Collections.emptyList(), new ExpressionRef(SPEC, new ExpressionId(0)),
				new ExpressionRef(SPEC, new ExpressionId(1)));
		EncodingException e = assertThrows(EncodingException.class,
				() -> AssertionJson.toJson(AND(leaf(SPEC, 2), forall)));
		assertEquals(ErrorCode.UNSUPPORTED_SYNTAX, e.getCode());
	}

	@Test
	public void test_skeleton_and_resolve() {
		ExpressionRegistry.Default registry = new ExpressionRegistry.Default();
		TypedExpression f = registry.register(SPEC, Syntax.VAR("f", Syntax.Type.Bool));
		TypedExpression g = registry.register(SPEC, Syntax.VAR("g", Syntax.Type.Bool));
		Assertion<TypedExpression> typed = IMPLIES(EXPR(f), AND(EXPR(g), EXPR(f)));
		Assertion<ExpressionRef> skeleton = AssertionJson.skeleton(typed);
		assertEquals(IMPLIES(EXPR(f.getRef()), AND(EXPR(g.getRef()), EXPR(f.getRef()))), skeleton);
		Assertion<ExpressionRef> received = AssertionJson.fromJson(AssertionJson.toJson(skeleton));
		assertEquals(typed, AssertionJson.resolve(received, registry));
	}

	@Test
	public void test_resolve_unknown_reference() {
		ExpressionRegistry.Default registry = new ExpressionRegistry.Default();
		registry.register(SPEC, Syntax.LITERAL(true));
		Assertion<ExpressionRef> skeleton = AND(leaf(SPEC, 0), leaf(SPEC, 1));
		EncodingException e = assertThrows(EncodingException.class,
				() -> AssertionJson.resolve(skeleton, registry));
		assertEquals(ErrorCode.SERIALIZATION_ERROR, e.getCode());
		assertEquals(new ExpressionRef(SPEC, new ExpressionId(1)), e.getDiagnostic().getLeaf().get());
	}
}
