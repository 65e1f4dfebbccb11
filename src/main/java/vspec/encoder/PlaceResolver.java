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
import static vspec.core.Vir.FIELD;
import static vspec.core.Vir.VAR;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Vir;
import vspec.syntax.ProcedureScope;
import vspec.syntax.Syntax;

/**
 * Resolves path-shaped surface expressions (variables, field projections and
 * dereferences) into places. Procedure variables and the return value resolve
 * to reference-typed slots, whilst quantified variables resolve to raw integer
 * values. Accessors are named deterministically so that repeated accesses to
 * the same logical field always produce the same place.
 */
public class PlaceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PlaceResolver.class);

    public static final Vir.Field VAL_BOOL = FIELD("val_bool", Vir.Type.Bool);
    public static final Vir.Field VAL_INT = FIELD("val_int", Vir.Type.Int);
    public static final String VAL_REF = "val_ref";
    public static final String RETURN_SLOT = "_0";

    public Vir.Expr.Place resolve(Syntax.Expr expr, EncodingContext context) {
        LOG.trace("resolving place {}", expr);
        if (expr instanceof Syntax.Expr.Variable) {
            return resolveVariable((Syntax.Expr.Variable) expr, context);
        } else if (expr instanceof Syntax.Expr.FieldAccess) {
            return resolveFieldAccess((Syntax.Expr.FieldAccess) expr, context);
        } else if (expr instanceof Syntax.Expr.Deref) {
            return resolveDeref((Syntax.Expr.Deref) expr, context);
        } else {
            throw EncodingException.unsupported("expected a path expression, found " + expr, expr);
        }
    }

    private Vir.Expr.Place resolveVariable(Syntax.Expr.Variable expr, EncodingContext context) {
        String name = expr.getName();
        if (ProcedureScope.RESULT.equals(name)) {
            ProcedureScope.Local returns = context.getScope().getReturn();
            return VAR(RETURN_SLOT, toRefType(returns.getType()), ATTRIBUTE(expr));
        }
        Optional<ProcedureScope.Local> local = context.getScope().lookup(name);
        boolean quantified = context.isQuantified(name);
        if (quantified && (context.getPolicy() == BindingPolicy.QUANTIFIER_FIRST || !local.isPresent())) {
            return VAR(name, Vir.Type.Int, ATTRIBUTE(expr));
        } else if (local.isPresent()) {
            if (quantified) {
                LOG.debug("quantified variable {} shadowed by procedure variable {}", name, local.get());
            }
            return VAR(local.get().getSlotName(), toRefType(local.get().getType()), ATTRIBUTE(expr));
        } else {
            throw EncodingException.unresolved("unknown variable " + name, expr);
        }
    }

    private Vir.Expr.Place resolveFieldAccess(Syntax.Expr.FieldAccess expr, EncodingContext context) {
        Vir.Expr.Place base = resolve(expr.getSource(), context);
        checkIsReference(base, expr);
        String name;
        if (expr.getSource().getType() instanceof Syntax.Type.Adt) {
            name = "enum_" + expr.getVariant() + "_" + expr.getField();
        } else if (expr.getIndex() >= 0) {
            name = "tuple_" + expr.getIndex();
        } else {
            throw EncodingException.unsupported("named field " + expr.getField() + " of non-algebraic type "
                    + expr.getSource().getType(), expr);
        }
        return base.access(FIELD(name, toRefType(expr.getType())), ATTRIBUTE(expr));
    }

    private Vir.Expr.Place resolveDeref(Syntax.Expr.Deref expr, EncodingContext context) {
        Vir.Expr.Place base = resolve(expr.getOperand(), context);
        checkIsReference(base, expr);
        return base.access(FIELD(VAL_REF, toRefType(expr.getType())), ATTRIBUTE(expr));
    }

    private static void checkIsReference(Vir.Expr.Place base, Syntax.Expr expr) {
        if (!base.getType().isRef()) {
            throw EncodingException.typeMismatch("cannot access " + expr + " through a non-reference place", expr);
        }
    }

    /**
     * Determine the IR type of a heap location holding values of a given surface
     * type.
     *
     * @param type
     * @return
     */
    public static Vir.Type toRefType(Syntax.Type type) {
        return new Vir.Type.TypedRef(type.getPredicateName());
    }
}
