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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import vspec.syntax.ProcedureScope;

/**
 * The read-only environment in which an assertion is encoded. This consists of
 * the enclosing procedure's variables, the variables bound by enclosing
 * quantifiers and the policy for resolving names bound by both. A context is
 * immutable and entering a quantifier produces a fresh one.
 */
public final class EncodingContext {
    private final ProcedureScope scope;
    private final Set<String> quantified;
    private final BindingPolicy policy;

    private EncodingContext(ProcedureScope scope, Set<String> quantified, BindingPolicy policy) {
        if (scope == null || policy == null) {
            throw new IllegalArgumentException("invalid encoding context");
        }
        this.scope = scope;
        this.quantified = Collections.unmodifiableSet(quantified);
        this.policy = policy;
    }

    public static EncodingContext of(ProcedureScope scope) {
        return of(scope, BindingPolicy.PROCEDURE_FIRST);
    }

    public static EncodingContext of(ProcedureScope scope, BindingPolicy policy) {
        return new EncodingContext(scope, new LinkedHashSet<>(), policy);
    }

    public ProcedureScope getScope() {
        return scope;
    }

    public BindingPolicy getPolicy() {
        return policy;
    }

    public boolean isQuantified(String name) {
        return quantified.contains(name);
    }

    /**
     * Construct the context for the body of a quantifier binding a given set of
     * variables.
     *
     * @param names
     * @return
     */
    public EncodingContext withQuantifiedVariables(Collection<String> names) {
        Set<String> vars = new LinkedHashSet<>(quantified);
        vars.addAll(names);
        return new EncodingContext(scope, vars, policy);
    }
}
