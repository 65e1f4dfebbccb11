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

import static vspec.core.Vir.AND;
import static vspec.core.Vir.IMPLIES;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Assertion;
import vspec.core.Vir;
import vspec.syntax.TypedExpression;

/**
 * Lowers a typed assertion into a single IR expression. Leaves are handed to an
 * {@link ExpressionEncoder}, quantifiers to a {@link QuantifierEncoder}, whilst
 * conjunctions and implications are composed directly. Encoding is a pure
 * function of the assertion and the given context, hence an encoder may be
 * shared between threads.
 */
public class AssertionEncoder {
    private static final Logger LOG = LoggerFactory.getLogger(AssertionEncoder.class);

    private final ExpressionEncoder expressions;
    private final QuantifierEncoder quantifiers;

    public AssertionEncoder() {
        this(new ExpressionEncoder());
    }

    public AssertionEncoder(ExpressionEncoder expressions) {
        this.expressions = expressions;
        this.quantifiers = new QuantifierEncoder(expressions);
    }

    /**
     * Encode a given assertion, aborting on the first unsupported construct.
     *
     * @param assertion
     * @param context
     * @return
     * @throws EncodingException
     */
    public Vir.Expr encode(Assertion<TypedExpression> assertion, EncodingContext context) {
        Assertion.Kind<TypedExpression> kind = assertion.getKind();
        LOG.trace("encoding assertion {}", kind);
        if (kind instanceof Assertion.Expr) {
            return encodeLeaf(((Assertion.Expr<TypedExpression>) kind).getOperand(), context);
        } else if (kind instanceof Assertion.And) {
            List<Assertion<TypedExpression>> operands = ((Assertion.And<TypedExpression>) kind).getOperands();
            if (operands.isEmpty()) {
                throw new EncodingException(
                        new Diagnostic(ErrorCode.UNSUPPORTED_SYNTAX, "empty conjunction", null, null));
            }
            List<Vir.Expr> clauses = new ArrayList<>();
            for (Assertion<TypedExpression> operand : operands) {
                clauses.add(encode(operand, context));
            }
            return AND(clauses);
        } else if (kind instanceof Assertion.Implies) {
            Assertion.Implies<TypedExpression> implies = (Assertion.Implies<TypedExpression>) kind;
            Vir.Expr lhs = encode(implies.getLeftHandSide(), context);
            Vir.Expr rhs = encode(implies.getRightHandSide(), context);
            return IMPLIES(lhs, rhs);
        } else {
            return quantifiers.encode((Assertion.ForAll<TypedExpression>) kind, context);
        }
    }

    private Vir.Expr encodeLeaf(TypedExpression leaf, EncodingContext context) {
        Vir.Expr e = expressions.encode(leaf, context);
        if (!e.getType().equals(Vir.Type.Bool)) {
            throw new EncodingException(new Diagnostic(ErrorCode.TYPE_MISMATCH,
                    "expected boolean assertion, found " + e.getType(), leaf.getExpr().getSpan(), leaf.getRef()));
        }
        return e;
    }

    /**
     * Encode a given assertion, reporting failure as a diagnostic rather than an
     * exception.
     *
     * @param assertion
     * @param context
     * @return
     */
    public EncodingResult tryEncode(Assertion<TypedExpression> assertion, EncodingContext context) {
        try {
            return EncodingResult.success(encode(assertion, context));
        } catch (EncodingException e) {
            LOG.debug("failed to encode assertion", e);
            return EncodingResult.failure(e.getDiagnostic());
        }
    }
}
