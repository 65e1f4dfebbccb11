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

import static vspec.core.Vir.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Vir;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;

/**
 * Lowers type-checked surface expressions into IR expressions of matching
 * semantic type. Path expressions are delegated to a {@link PlaceResolver} and
 * then unwrapped according to their static type, whilst match expressions are
 * delegated to a {@link MatchDesugarer}. Any construct outside the supported
 * subset aborts encoding with an {@link EncodingException}.
 */
public class ExpressionEncoder {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEncoder.class);

    /**
     * The only call permitted in a specification.
     */
    public static final String OLD = "old";

    private final PlaceResolver resolver;
    private final MatchDesugarer desugarer;

    public ExpressionEncoder() {
        this(new PlaceResolver());
    }

    public ExpressionEncoder(PlaceResolver resolver) {
        this.resolver = resolver;
        this.desugarer = new MatchDesugarer(this);
    }

    /**
     * Encode the expression held in a given leaf. Any failure is tagged with the
     * leaf's reference.
     *
     * @param leaf
     * @param context
     * @return
     */
    public Vir.Expr encode(TypedExpression leaf, EncodingContext context) {
        try {
            return encode(leaf.getExpr(), context);
        } catch (EncodingException e) {
            throw e.attach(leaf.getRef());
        }
    }

    public Vir.Expr encode(Syntax.Expr expr, EncodingContext context) {
        LOG.trace("encoding expression {}", expr);
        if (expr instanceof Syntax.Expr.IntLiteral) {
            return CONST(((Syntax.Expr.IntLiteral) expr).getValue(), ATTRIBUTE(expr));
        } else if (expr instanceof Syntax.Expr.BoolLiteral) {
            return CONST(((Syntax.Expr.BoolLiteral) expr).getValue(), ATTRIBUTE(expr));
        } else if (expr instanceof Syntax.Expr.Variable || expr instanceof Syntax.Expr.FieldAccess
                || expr instanceof Syntax.Expr.Deref) {
            return encodePlace(expr, context);
        } else if (expr instanceof Syntax.Expr.Unary) {
            return encodeUnary((Syntax.Expr.Unary) expr, context);
        } else if (expr instanceof Syntax.Expr.Binary) {
            return encodeBinary((Syntax.Expr.Binary) expr, context);
        } else if (expr instanceof Syntax.Expr.IfElse) {
            return encodeIfElse((Syntax.Expr.IfElse) expr, context);
        } else if (expr instanceof Syntax.Expr.Block) {
            return encodeBlock((Syntax.Expr.Block) expr, context);
        } else if (expr instanceof Syntax.Expr.Call) {
            return encodeCall((Syntax.Expr.Call) expr, context);
        } else if (expr instanceof Syntax.Expr.Match) {
            return desugarer.desugar((Syntax.Expr.Match) expr, context);
        } else if (expr instanceof Syntax.Expr.StrLiteral) {
            throw EncodingException.unsupported("unsupported literal " + expr, expr);
        } else {
            throw EncodingException.unsupported("unsupported expression " + expr, expr);
        }
    }

    /**
     * Resolve a path expression and, where it denotes a heap location holding a
     * primitive value, append the accessor which reads that value. Places of
     * aggregate type are left as references.
     *
     * @param expr
     * @param context
     * @return
     */
    private Vir.Expr encodePlace(Syntax.Expr expr, EncodingContext context) {
        Vir.Expr.Place place = resolver.resolve(expr, context);
        if (!place.getType().isRef()) {
            return place;
        }
        Syntax.Type type = expr.getType();
        if (type instanceof Syntax.Type.Bool) {
            return place.access(PlaceResolver.VAL_BOOL, ATTRIBUTE(expr));
        } else if (type instanceof Syntax.Type.Int) {
            return place.access(PlaceResolver.VAL_INT, ATTRIBUTE(expr));
        } else if (type instanceof Syntax.Type.Tuple || type instanceof Syntax.Type.Adt) {
            return place;
        } else {
            throw EncodingException.unsupported("unsupported type " + type + " for " + expr, expr);
        }
    }

    private Vir.Expr encodeUnary(Syntax.Expr.Unary expr, EncodingContext context) {
        Vir.Expr operand = encode(expr.getOperand(), context);
        switch (expr.getOp()) {
            case NEG:
                checkOperand(operand, Vir.Type.Int, expr);
                return NEG(operand, ATTRIBUTE(expr));
            case NOT:
                checkOperand(operand, Vir.Type.Bool, expr);
                return NOT(operand, ATTRIBUTE(expr));
            default:
                throw EncodingException.unsupported("unsupported unary operator " + expr.getOp(), expr);
        }
    }

    private Vir.Expr encodeBinary(Syntax.Expr.Binary expr, EncodingContext context) {
        Vir.Expr lhs = encode(expr.getLeftHandSide(), context);
        Vir.Expr rhs = encode(expr.getRightHandSide(), context);
        Vir.Attribute attribute = ATTRIBUTE(expr);
        switch (expr.getOp()) {
            case EQ:
                return EQ(lhs, rhs, attribute);
            case NE:
                return NEQ(lhs, rhs, attribute);
            case LT:
                return LT(lhs, rhs, attribute);
            case LE:
                return LTEQ(lhs, rhs, attribute);
            case GT:
                return GT(lhs, rhs, attribute);
            case GE:
                return GTEQ(lhs, rhs, attribute);
            case ADD:
                checkOperands(lhs, rhs, Vir.Type.Int, expr);
                return ADD(lhs, rhs, attribute);
            case SUB:
                checkOperands(lhs, rhs, Vir.Type.Int, expr);
                return SUB(lhs, rhs, attribute);
            case MUL:
                checkOperands(lhs, rhs, Vir.Type.Int, expr);
                return MUL(lhs, rhs, attribute);
            case DIV:
                checkOperands(lhs, rhs, Vir.Type.Int, expr);
                return DIV(lhs, rhs, attribute);
            case REM:
                checkOperands(lhs, rhs, Vir.Type.Int, expr);
                return REM(lhs, rhs, attribute);
            case AND:
                checkOperands(lhs, rhs, Vir.Type.Bool, expr);
                return AND(lhs, rhs, attribute);
            case OR:
                checkOperands(lhs, rhs, Vir.Type.Bool, expr);
                return OR(lhs, rhs, attribute);
            case BIT_AND:
                checkBitwise(lhs, rhs, expr);
                return AND(lhs, rhs, attribute);
            case BIT_OR:
                checkBitwise(lhs, rhs, expr);
                return OR(lhs, rhs, attribute);
            case BIT_XOR:
                checkBitwise(lhs, rhs, expr);
                return XOR(lhs, rhs, attribute);
            default:
                throw EncodingException.unsupported("unsupported binary operator " + expr.getOp(), expr);
        }
    }

    private Vir.Expr encodeIfElse(Syntax.Expr.IfElse expr, EncodingContext context) {
        if (expr.getFalseBranch() == null) {
            throw EncodingException.unsupported("conditional without else branch", expr);
        }
        Vir.Expr condition = encode(expr.getCondition(), context);
        checkOperand(condition, Vir.Type.Bool, expr.getCondition());
        Vir.Expr trueBranch = encode(expr.getTrueBranch(), context);
        Vir.Expr falseBranch = encode(expr.getFalseBranch(), context);
        return IFELSE(condition, trueBranch, falseBranch, ATTRIBUTE(expr));
    }

    private Vir.Expr encodeBlock(Syntax.Expr.Block expr, EncodingContext context) {
        if (!expr.getStatements().isEmpty() || expr.getTail() == null) {
            throw EncodingException.unsupported("only blocks consisting of a single expression are supported", expr);
        }
        return encode(expr.getTail(), context);
    }

    private Vir.Expr encodeCall(Syntax.Expr.Call expr, EncodingContext context) {
        Syntax.Expr callee = expr.getCallee();
        if (!(callee instanceof Syntax.Expr.Variable) || !OLD.equals(((Syntax.Expr.Variable) callee).getName())) {
            throw EncodingException.unsupported("unsupported call to " + callee, expr);
        } else if (expr.getArguments().size() != 1) {
            throw EncodingException.unsupported("old expects exactly one argument", expr);
        }
        Vir.Expr operand = encode(expr.getArguments().get(0), context);
        return OLD(operand, ATTRIBUTE(expr));
    }

    private static void checkBitwise(Vir.Expr lhs, Vir.Expr rhs, Syntax.Expr expr) {
        if (!lhs.getType().equals(Vir.Type.Bool) || !rhs.getType().equals(Vir.Type.Bool)) {
            throw EncodingException.unsupported("bitwise operations on non-boolean values are not supported", expr);
        }
    }

    private static void checkOperands(Vir.Expr lhs, Vir.Expr rhs, Vir.Type expected, Syntax.Expr expr) {
        checkOperand(lhs, expected, expr);
        checkOperand(rhs, expected, expr);
    }

    private static void checkOperand(Vir.Expr operand, Vir.Type expected, Syntax.Expr expr) {
        if (!operand.getType().equals(expected)) {
            throw EncodingException.typeMismatch(
                    "expected operand of type " + expected + ", found " + operand.getType() + " in " + expr, expr);
        }
    }
}
