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

import static org.junit.jupiter.api.Assertions.*;
import static vspec.core.Assertion.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import vspec.syntax.Syntax;

public class AssertionTest {
	private final SpecificationId spec = SpecificationId.fresh();

	private ExpressionRef ref(long id) {
		return new ExpressionRef(spec, new ExpressionId(id));
	}

	@Test
	public void test_equality_is_structural() {
		Assertion<ExpressionRef> a1 = IMPLIES(EXPR(ref(0)), AND(EXPR(ref(1)), EXPR(ref(2))));
		Assertion<ExpressionRef> a2 = IMPLIES(EXPR(ref(0)), AND(EXPR(ref(1)), EXPR(ref(2))));
		assertEquals(a1, a2);
		assertEquals(a1.hashCode(), a2.hashCode());
		assertNotEquals(a1, IMPLIES(EXPR(ref(0)), AND(EXPR(ref(2)), EXPR(ref(1)))));
		assertNotEquals(AND(EXPR(ref(0))), EXPR(ref(0)));
	}

	@Test
	public void test_map_preserves_shape() {
		Assertion<ExpressionRef> a = AND(EXPR(ref(0)), IMPLIES(EXPR(ref(1)), EXPR(ref(2))));
		Assertion<Long> ids = a.map(r -> r.getExpressionId().getValue());
		assertEquals(AND(EXPR(0L), IMPLIES(EXPR(1L), EXPR(2L))), ids);
	}

	@Test
	public void test_map_reaches_quantifier_leaves() {
		List<Syntax.Binder> vars = Arrays.asList(Syntax.BINDER("i", Syntax.INT("i32")));
		Assertion<ExpressionRef> a = FORALL(vars, Arrays.asList(Arrays.asList(ref(0))), ref(1), ref(2));
		Assertion<Long> ids = a.map(r -> r.getExpressionId().getValue());
		assertEquals(FORALL(vars, Arrays.asList(Arrays.asList(0L)), 1L, 2L), ids);
	}

	@Test
	public void test_children_are_copied() {
		List<Assertion<ExpressionRef>> operands = new ArrayList<>();
		operands.add(EXPR(ref(0)));
		Assertion<ExpressionRef> a = AND(operands);
		operands.add(EXPR(ref(1)));
		Assertion.And<ExpressionRef> and = (Assertion.And<ExpressionRef>) a.getKind();
		assertEquals(1, and.getOperands().size());
		assertThrows(UnsupportedOperationException.class, () -> and.getOperands().add(EXPR(ref(2))));
	}

	@Test
	public void test_empty_conjunction_is_representable() {
		Assertion<ExpressionRef> a = AND(Collections.emptyList());
		assertTrue(((Assertion.And<ExpressionRef>) a.getKind()).getOperands().isEmpty());
	}
}
