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

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Determines the names of all local variables mentioned in an IR expression,
 * either directly or as the root of a place.
 */
public class VariableCollector extends AbstractExpressionFold<Set<String>> {

    public static Set<String> collect(Expr expr) {
        return new VariableCollector().visitExpression(expr);
    }

    @Override
    protected Set<String> constructLocalVar(Expr.LocalVar expr) {
        return Collections.singleton(expr.getName());
    }

    @Override
    protected Set<String> BOTTOM() {
        return Collections.emptySet();
    }

    @Override
    protected Set<String> join(Set<String> lhs, Set<String> rhs) {
        HashSet<String> result = new HashSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    protected Set<String> join(List<Set<String>> operands) {
        HashSet<String> result = new HashSet<>();
        for (Set<String> operand : operands) {
            result.addAll(operand);
        }
        return result;
    }
}
