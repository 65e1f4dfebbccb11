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

/**
 * Determines how a variable name is resolved when it could denote both a
 * procedure argument (or local) and a variable bound by an enclosing
 * quantifier.
 */
public enum BindingPolicy {
    /**
     * Procedure arguments and locals shadow quantified variables of the same
     * name. This is the historical behaviour and remains the default, although a
     * quantified variable is then silently ignored.
     */
    PROCEDURE_FIRST,
    /**
     * Quantified variables shadow procedure arguments and locals of the same
     * name, as for ordinary lexical scoping.
     */
    QUANTIFIER_FIRST
}
