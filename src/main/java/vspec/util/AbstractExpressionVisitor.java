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
import vspec.core.Vir.Trigger;

import java.util.ArrayList;
import java.util.List;

/**
 * A bottom-up traversal of IR expressions. Each kind of expression is first
 * dispatched to a <code>visit</code> method, which visits its children and then
 * hands their results to the corresponding <code>construct</code> method.
 * Subclasses can override a <code>visit</code> method to control the order in
 * which (or whether) children are visited.
 *
 * @param <E>
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Boolean) {
            return constructBoolean((Expr.Boolean) expr);
        } else if(expr instanceof Expr.Integer) {
            return constructInteger((Expr.Integer) expr);
        } else if(expr instanceof Expr.LocalVar) {
            return constructLocalVar((Expr.LocalVar) expr);
        } else if(expr instanceof Expr.FieldAccess) {
            return visitFieldAccess((Expr.FieldAccess) expr);
        } else if(expr instanceof Expr.Negation) {
            return visitNegation((Expr.Negation) expr);
        } else if(expr instanceof Expr.LogicalNot) {
            return visitLogicalNot((Expr.LogicalNot) expr);
        } else if(expr instanceof Expr.Old) {
            return visitOld((Expr.Old) expr);
        } else if(expr instanceof Expr.Equals) {
            return visitEquals((Expr.Equals) expr);
        } else if(expr instanceof Expr.NotEquals) {
            return visitNotEquals((Expr.NotEquals) expr);
        } else if(expr instanceof Expr.LessThan) {
            return visitLessThan((Expr.LessThan) expr);
        } else if(expr instanceof Expr.LessThanOrEqual) {
            return visitLessThanOrEqual((Expr.LessThanOrEqual) expr);
        } else if(expr instanceof Expr.GreaterThan) {
            return visitGreaterThan((Expr.GreaterThan) expr);
        } else if(expr instanceof Expr.GreaterThanOrEqual) {
            return visitGreaterThanOrEqual((Expr.GreaterThanOrEqual) expr);
        } else if(expr instanceof Expr.Addition) {
            return visitAddition((Expr.Addition) expr);
        } else if(expr instanceof Expr.Subtraction) {
            return visitSubtraction((Expr.Subtraction) expr);
        } else if(expr instanceof Expr.Multiplication) {
            return visitMultiplication((Expr.Multiplication) expr);
        } else if(expr instanceof Expr.Division) {
            return visitDivision((Expr.Division) expr);
        } else if(expr instanceof Expr.Remainder) {
            return visitRemainder((Expr.Remainder) expr);
        } else if(expr instanceof Expr.LogicalXor) {
            return visitLogicalXor((Expr.LogicalXor) expr);
        } else if(expr instanceof Expr.Implies) {
            return visitLogicalImplication((Expr.Implies) expr);
        } else if(expr instanceof Expr.LogicalAnd) {
            return visitLogicalAnd((Expr.LogicalAnd) expr);
        } else if(expr instanceof Expr.LogicalOr) {
            return visitLogicalOr((Expr.LogicalOr) expr);
        } else if(expr instanceof Expr.IfElse) {
            return visitIfElse((Expr.IfElse) expr);
        } else if(expr instanceof Expr.UniversalQuantifier) {
            return visitUniversalQuantifier((Expr.UniversalQuantifier) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<? extends Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitFieldAccess(Expr.FieldAccess expr) {
        E base = visitExpression(expr.getBase());
        return constructFieldAccess(expr, base);
    }

    protected E visitNegation(Expr.Negation expr) {
        E operand = visitExpression(expr.getOperand());
        return constructNegation(expr, operand);
    }

    protected E visitLogicalNot(Expr.LogicalNot expr) {
        E operand = visitExpression(expr.getOperand());
        return constructLogicalNot(expr, operand);
    }

    protected E visitOld(Expr.Old expr) {
        E operand = visitExpression(expr.getOperand());
        return constructOld(expr, operand);
    }

    protected E visitEquals(Expr.Equals expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructEquals(expr, lhs, rhs);
    }

    protected E visitNotEquals(Expr.NotEquals expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructNotEquals(expr, lhs, rhs);
    }

    protected E visitLessThan(Expr.LessThan expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructLessThan(expr, lhs, rhs);
    }

    protected E visitLessThanOrEqual(Expr.LessThanOrEqual expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructLessThanOrEqual(expr, lhs, rhs);
    }

    protected E visitGreaterThan(Expr.GreaterThan expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructGreaterThan(expr, lhs, rhs);
    }

    protected E visitGreaterThanOrEqual(Expr.GreaterThanOrEqual expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructGreaterThanOrEqual(expr, lhs, rhs);
    }

    protected E visitAddition(Expr.Addition expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructAddition(expr, lhs, rhs);
    }

    protected E visitSubtraction(Expr.Subtraction expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructSubtraction(expr, lhs, rhs);
    }

    protected E visitMultiplication(Expr.Multiplication expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructMultiplication(expr, lhs, rhs);
    }

    protected E visitDivision(Expr.Division expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructDivision(expr, lhs, rhs);
    }

    protected E visitRemainder(Expr.Remainder expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructRemainder(expr, lhs, rhs);
    }

    protected E visitLogicalXor(Expr.LogicalXor expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructLogicalXor(expr, lhs, rhs);
    }

    protected E visitLogicalImplication(Expr.Implies expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructLogicalImplication(expr, lhs, rhs);
    }

    protected E visitLogicalAnd(Expr.LogicalAnd expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructLogicalAnd(expr, operands);
    }

    protected E visitLogicalOr(Expr.LogicalOr expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructLogicalOr(expr, operands);
    }

    protected E visitIfElse(Expr.IfElse expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructIfElse(expr, condition, trueBranch, falseBranch);
    }

    protected E visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
        List<List<E>> triggers = new ArrayList<>();
        for (Trigger trigger : expr.getTriggers()) {
            triggers.add(visitExpressions(trigger.getTerms()));
        }
        E body = visitExpression(expr.getBody());
        return constructUniversalQuantifier(expr, triggers, body);
    }

    protected abstract E constructBoolean(Expr.Boolean expr);
    protected abstract E constructInteger(Expr.Integer expr);
    protected abstract E constructLocalVar(Expr.LocalVar expr);
    protected abstract E constructFieldAccess(Expr.FieldAccess expr, E base);
    protected abstract E constructNegation(Expr.Negation expr, E operand);
    protected abstract E constructLogicalNot(Expr.LogicalNot expr, E operand);
    protected abstract E constructOld(Expr.Old expr, E operand);
    protected abstract E constructEquals(Expr.Equals expr, E lhs, E rhs);
    protected abstract E constructNotEquals(Expr.NotEquals expr, E lhs, E rhs);
    protected abstract E constructLessThan(Expr.LessThan expr, E lhs, E rhs);
    protected abstract E constructLessThanOrEqual(Expr.LessThanOrEqual expr, E lhs, E rhs);
    protected abstract E constructGreaterThan(Expr.GreaterThan expr, E lhs, E rhs);
    protected abstract E constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, E lhs, E rhs);
    protected abstract E constructAddition(Expr.Addition expr, E lhs, E rhs);
    protected abstract E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs);
    protected abstract E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs);
    protected abstract E constructDivision(Expr.Division expr, E lhs, E rhs);
    protected abstract E constructRemainder(Expr.Remainder expr, E lhs, E rhs);
    protected abstract E constructLogicalXor(Expr.LogicalXor expr, E lhs, E rhs);
    protected abstract E constructLogicalImplication(Expr.Implies expr, E lhs, E rhs);
    protected abstract E constructLogicalAnd(Expr.LogicalAnd expr, List<E> operands);
    protected abstract E constructLogicalOr(Expr.LogicalOr expr, List<E> operands);
    protected abstract E constructIfElse(Expr.IfElse expr, E condition, E trueBranch, E falseBranch);
    protected abstract E constructUniversalQuantifier(Expr.UniversalQuantifier expr, List<List<E>> triggers, E body);
}
