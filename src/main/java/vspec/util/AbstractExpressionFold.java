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
package vspec.util;

import vspec.core.Vir.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines information gathered from every subexpression of an IR expression
 * using a given join operation. Leaves contribute <code>BOTTOM()</code> unless
 * overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructBoolean(Expr.Boolean expr) {
        return BOTTOM();
    }

    @Override
    protected E constructInteger(Expr.Integer expr) {
        return BOTTOM();
    }

    @Override
    protected E constructLocalVar(Expr.LocalVar expr) {
        return BOTTOM();
    }

    @Override
    protected E constructFieldAccess(Expr.FieldAccess expr, E base) {
        return base;
    }

    @Override
    protected E constructNegation(Expr.Negation expr, E operand) {
        return operand;
    }

    @Override
    protected E constructLogicalNot(Expr.LogicalNot expr, E operand) {
        return operand;
    }

    @Override
    protected E constructOld(Expr.Old expr, E operand) {
        return operand;
    }

    @Override
    protected E constructEquals(Expr.Equals expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructNotEquals(Expr.NotEquals expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLessThan(Expr.LessThan expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLessThanOrEqual(Expr.LessThanOrEqual expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructGreaterThan(Expr.GreaterThan expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructAddition(Expr.Addition expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructDivision(Expr.Division expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructRemainder(Expr.Remainder expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLogicalXor(Expr.LogicalXor expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLogicalImplication(Expr.Implies expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructLogicalAnd(Expr.LogicalAnd expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructLogicalOr(Expr.LogicalOr expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructIfElse(Expr.IfElse expr, E condition, E trueBranch, E falseBranch) {
        return join(condition, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructUniversalQuantifier(Expr.UniversalQuantifier expr, List<List<E>> triggers, E body) {
        List<E> operands = new ArrayList<>();
        for (List<E> trigger : triggers) {
            operands.addAll(trigger);
        }
        operands.add(body);
        return join(operands);
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected abstract E join(List<E> operands);
}
