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
 * Classifies the ways in which encoding (or decoding) an assertion can fail.
 */
public enum ErrorCode {
    /**
     * A construct outside the supported surface grammar, such as a non-path in
     * path position, a call other than <code>old</code> or a guarded match arm.
     */
    UNSUPPORTED_SYNTAX,
    /**
     * An operator or quantifier applied to an operand of the wrong semantic type.
     */
    TYPE_MISMATCH,
    /**
     * A variable which is neither bound by the procedure nor by an enclosing
     * quantifier.
     */
    UNRESOLVED_BINDING,
    /**
     * Malformed or structurally invalid wire-format input.
     */
    SERIALIZATION_ERROR
}
