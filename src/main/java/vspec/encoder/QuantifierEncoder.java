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
import static vspec.core.Vir.FORALL;
import static vspec.core.Vir.IMPLIES;
import static vspec.core.Vir.TRIGGER;
import static vspec.core.Vir.VAR;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Assertion;
import vspec.core.Vir;
import vspec.syntax.Syntax;
import vspec.syntax.TypedExpression;
import vspec.util.VariableCollector;

/**
 * Encodes a universally quantified assertion as <code>forall vars :: {
 * triggers } filter ==> body</code>. Only integer values can be quantified
 * over. Trigger terms are encoded exactly as ordinary expressions, so places
 * of primitive type are still read through their value accessor.
 */
public class QuantifierEncoder {
    private static final Logger LOG = LoggerFactory.getLogger(QuantifierEncoder.class);

    private final ExpressionEncoder encoder;

    public QuantifierEncoder(ExpressionEncoder encoder) {
        this.encoder = encoder;
    }

    public Vir.Expr encode(Assertion.ForAll<TypedExpression> forall, EncodingContext context) {
        LOG.trace("encoding quantifier over {}", forall.getVariables());
        List<Vir.Expr.LocalVar> variables = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (Syntax.Binder binder : forall.getVariables()) {
            if (!(binder.getType() instanceof Syntax.Type.Int)) {
                throw new EncodingException(new Diagnostic(ErrorCode.TYPE_MISMATCH,
                        "quantification is only supported over integer values (found " + binder + ")",
                        binder.getSpan(), null));
            }
            variables.add(VAR(binder.getName(), Vir.Type.Int, ATTRIBUTE(binder)));
            names.add(binder.getName());
        }
        EncodingContext inner = context.withQuantifiedVariables(names);
        List<Vir.Trigger> triggers = new ArrayList<>();
        for (List<TypedExpression> trigger : forall.getTriggers()) {
            triggers.add(encodeTrigger(trigger, names, inner));
        }
        Vir.Expr filter = encodeCondition(forall.getFilter(), inner);
        Vir.Expr body = encodeCondition(forall.getBody(), inner);
        return FORALL(variables, triggers, IMPLIES(filter, body), ATTRIBUTE(forall));
    }

    private Vir.Trigger encodeTrigger(List<TypedExpression> trigger, List<String> names, EncodingContext context) {
        if (trigger.isEmpty()) {
            throw new EncodingException(
                    new Diagnostic(ErrorCode.UNSUPPORTED_SYNTAX, "empty trigger", null, null));
        }
        List<Vir.Expr> terms = new ArrayList<>();
        Set<String> mentioned = new HashSet<>();
        for (TypedExpression term : trigger) {
            Vir.Expr t = encoder.encode(term, context);
            mentioned.addAll(VariableCollector.collect(t));
            terms.add(t);
        }
        if (!mentioned.containsAll(names)) {
            LOG.warn("trigger {} does not mention every quantified variable of {}", trigger, names);
        }
        return TRIGGER(terms);
    }

    private Vir.Expr encodeCondition(TypedExpression leaf, EncodingContext context) {
        Vir.Expr e = encoder.encode(leaf, context);
        if (!e.getType().equals(Vir.Type.Bool)) {
            throw new EncodingException(new Diagnostic(ErrorCode.TYPE_MISMATCH,
                    "expected boolean condition, found " + e.getType(), leaf.getExpr().getSpan(), leaf.getRef()));
        }
        return e;
    }
}
