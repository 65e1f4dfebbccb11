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

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A reference interpreter for quantifier-free IR expressions. Places are read
 * from a state which maps the path of each place (see {@link Util#toPath}) onto
 * its value, where values are either {@link BigInteger}s or {@link Boolean}s.
 * Expressions under <code>old</code> are read from a separate state representing
 * the procedure's pre-state.
 */
public class ExpressionEvaluator extends AbstractExpressionVisitor<Object> {
    private final Map<String, Object> state;
    private final Map<String, Object> oldState;

    public ExpressionEvaluator(Map<String, Object> state) {
        this(state, state);
    }

    public ExpressionEvaluator(Map<String, Object> state, Map<String, Object> oldState) {
        this.state = new HashMap<>(state);
        this.oldState = new HashMap<>(oldState);
    }

    public boolean evaluateBoolean(Expr expr) {
        return (Boolean) visitExpression(expr);
    }

    public BigInteger evaluateInteger(Expr expr) {
        return (BigInteger) visitExpression(expr);
    }

    @Override
    protected Object visitFieldAccess(Expr.FieldAccess expr) {
        return read(expr);
    }

    @Override
    protected Object visitOld(Expr.Old expr) {
        return new ExpressionEvaluator(oldState, oldState).visitExpression(expr.getOperand());
    }

    @Override
    protected Object visitIfElse(Expr.IfElse expr) {
        if (evaluateBoolean(expr.getCondition())) {
            return visitExpression(expr.getTrueBranch());
        } else {
            return visitExpression(expr.getFalseBranch());
        }
    }

    @Override
    protected Object visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
        throw new UnsupportedOperationException("cannot evaluate quantified expression");
    }

    @Override
    protected Object constructBoolean(Expr.Boolean expr) {
        return expr.getValue();
    }

    @Override
    protected Object constructInteger(Expr.Integer expr) {
        return expr.getValue();
    }

    @Override
    protected Object constructLocalVar(Expr.LocalVar expr) {
        return read(expr);
    }

    @Override
    protected Object constructFieldAccess(Expr.FieldAccess expr, Object base) {
        return read(expr);
    }

    @Override
    protected Object constructNegation(Expr.Negation expr, Object operand) {
        return ((BigInteger) operand).negate();
    }

    @Override
    protected Object constructLogicalNot(Expr.LogicalNot expr, Object operand) {
        return !((Boolean) operand);
    }

    @Override
    protected Object constructOld(Expr.Old expr, Object operand) {
        return operand;
    }

    @Override
    protected Object constructEquals(Expr.Equals expr, Object lhs, Object rhs) {
        return lhs.equals(rhs);
    }

    @Override
    protected Object constructNotEquals(Expr.NotEquals expr, Object lhs, Object rhs) {
        return !lhs.equals(rhs);
    }

    @Override
    protected Object constructLessThan(Expr.LessThan expr, Object lhs, Object rhs) {
        return compare(lhs, rhs) < 0;
    }

    @Override
    protected Object constructLessThanOrEqual(Expr.LessThanOrEqual expr, Object lhs, Object rhs) {
        return compare(lhs, rhs) <= 0;
    }

    @Override
    protected Object constructGreaterThan(Expr.GreaterThan expr, Object lhs, Object rhs) {
        return compare(lhs, rhs) > 0;
    }

    @Override
    protected Object constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Object lhs, Object rhs) {
        return compare(lhs, rhs) >= 0;
    }

    @Override
    protected Object constructAddition(Expr.Addition expr, Object lhs, Object rhs) {
        return ((BigInteger) lhs).add((BigInteger) rhs);
    }

    @Override
    protected Object constructSubtraction(Expr.Subtraction expr, Object lhs, Object rhs) {
        return ((BigInteger) lhs).subtract((BigInteger) rhs);
    }

    @Override
    protected Object constructMultiplication(Expr.Multiplication expr, Object lhs, Object rhs) {
        return ((BigInteger) lhs).multiply((BigInteger) rhs);
    }

    @Override
    protected Object constructDivision(Expr.Division expr, Object lhs, Object rhs) {
        return ((BigInteger) lhs).divide((BigInteger) rhs);
    }

    @Override
    protected Object constructRemainder(Expr.Remainder expr, Object lhs, Object rhs) {
        return ((BigInteger) lhs).remainder((BigInteger) rhs);
    }

    @Override
    protected Object constructLogicalXor(Expr.LogicalXor expr, Object lhs, Object rhs) {
        return ((Boolean) lhs) ^ ((Boolean) rhs);
    }

    @Override
    protected Object constructLogicalImplication(Expr.Implies expr, Object lhs, Object rhs) {
        return !((Boolean) lhs) || ((Boolean) rhs);
    }

    @Override
    protected Object constructLogicalAnd(Expr.LogicalAnd expr, List<Object> operands) {
        for (Object operand : operands) {
            if (!((Boolean) operand)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Object constructLogicalOr(Expr.LogicalOr expr, List<Object> operands) {
        for (Object operand : operands) {
            if ((Boolean) operand) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected Object constructIfElse(Expr.IfElse expr, Object condition, Object trueBranch, Object falseBranch) {
        return ((Boolean) condition) ? trueBranch : falseBranch;
    }

    @Override
    protected Object constructUniversalQuantifier(Expr.UniversalQuantifier expr, List<List<Object>> triggers,
            Object body) {
        throw new UnsupportedOperationException("cannot evaluate quantified expression");
    }

    private Object read(Expr.Place place) {
        String path = Util.toPath(place);
        Object value = state.get(path);
        if (value == null) {
            throw new IllegalArgumentException("no value for place " + path);
        }
        return value;
    }

    private static int compare(Object lhs, Object rhs) {
        return ((BigInteger) lhs).compareTo((BigInteger) rhs);
    }
}
