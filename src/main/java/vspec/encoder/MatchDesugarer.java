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

import static vspec.core.Vir.ATTRIBUTE;
import static vspec.core.Vir.CONST;
import static vspec.core.Vir.EQ;
import static vspec.core.Vir.IFELSE;
import static vspec.core.Vir.OR;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Vir;
import vspec.syntax.Syntax;

/**
 * Expands a restricted form of match expression into a chain of conditionals.
 * Arms are considered in order, so that <code>match x { 0 => A, 1 => B, _ => C }</code>
 * becomes <code>if x == 0 then A else (if x == 1 then B else C)</code>. The
 * final arm acts as the default and its patterns are never tested.
 */
public class MatchDesugarer {
    private static final Logger LOG = LoggerFactory.getLogger(MatchDesugarer.class);

    private final ExpressionEncoder encoder;

    public MatchDesugarer(ExpressionEncoder encoder) {
        this.encoder = encoder;
    }

    public Vir.Expr desugar(Syntax.Expr.Match expr, EncodingContext context) {
        List<Syntax.Arm> arms = expr.getArms();
        if (arms.isEmpty()) {
            throw EncodingException.unsupported("match without arms", expr);
        }
        for (Syntax.Arm arm : arms) {
            checkArm(arm, expr);
        }
        LOG.trace("desugaring match with {} arms", arms.size());
        Vir.Expr scrutinee = encoder.encode(expr.getScrutinee(), context);
        return desugar(expr, scrutinee, arms, 0, context);
    }

    private Vir.Expr desugar(Syntax.Expr.Match expr, Vir.Expr scrutinee, List<Syntax.Arm> arms, int index,
            EncodingContext context) {
        Syntax.Arm arm = arms.get(index);
        Vir.Expr body = encoder.encode(arm.getBody(), context);
        if (index == arms.size() - 1) {
            return body;
        }
        List<Vir.Expr> conditions = new ArrayList<>();
        for (Syntax.Pattern pattern : arm.getPatterns()) {
            conditions.add(encodeCondition(pattern, scrutinee, expr, context));
        }
        Vir.Expr rest = desugar(expr, scrutinee, arms, index + 1, context);
        return IFELSE(OR(conditions), body, rest, ATTRIBUTE(expr));
    }

    private Vir.Expr encodeCondition(Syntax.Pattern pattern, Vir.Expr scrutinee, Syntax.Expr.Match expr,
            EncodingContext context) {
        if (pattern instanceof Syntax.Pattern.Wildcard) {
            return CONST(true);
        } else if (pattern instanceof Syntax.Pattern.Literal) {
            Syntax.Expr value = ((Syntax.Pattern.Literal) pattern).getValue();
            return EQ(scrutinee, encoder.encode(value, context), ATTRIBUTE(value));
        } else {
            throw EncodingException.unsupported("matching pattern " + pattern + " requires discriminant extraction",
                    expr);
        }
    }

    /**
     * Check that an arm contains only guard-free, binding-free patterns.
     *
     * @param arm
     * @param expr
     */
    private static void checkArm(Syntax.Arm arm, Syntax.Expr.Match expr) {
        if (arm.getGuard() != null) {
            throw EncodingException.unsupported("guarded match arms are not supported", arm.getGuard());
        } else if (arm.getPatterns().isEmpty()) {
            throw EncodingException.unsupported("match arm without patterns", expr);
        }
        for (Syntax.Pattern pattern : arm.getPatterns()) {
            if (!isSupported(pattern)) {
                throw EncodingException.unsupported("unsupported pattern " + pattern, expr);
            }
        }
    }

    private static boolean isSupported(Syntax.Pattern pattern) {
        if (pattern instanceof Syntax.Pattern.Wildcard || pattern instanceof Syntax.Pattern.Literal) {
            return true;
        } else if (pattern instanceof Syntax.Pattern.Struct) {
            return ((Syntax.Pattern.Struct) pattern).getFields().isEmpty();
        } else if (pattern instanceof Syntax.Pattern.TupleStruct) {
            return ((Syntax.Pattern.TupleStruct) pattern).getItems().isEmpty();
        } else if (pattern instanceof Syntax.Pattern.Tuple) {
            return ((Syntax.Pattern.Tuple) pattern).getItems().isEmpty();
        } else {
            return false;
        }
    }
}
