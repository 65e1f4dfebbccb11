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

import java.util.NoSuchElementException;

import vspec.core.Vir;

/**
 * The outcome of encoding a single assertion: either the generated IR
 * expression, or a diagnostic explaining why none could be generated.
 */
public final class EncodingResult {
    private final Vir.Expr value;
    private final Diagnostic diagnostic;

    private EncodingResult(Vir.Expr value, Diagnostic diagnostic) {
        this.value = value;
        this.diagnostic = diagnostic;
    }

    public static EncodingResult success(Vir.Expr value) {
        return new EncodingResult(value, null);
    }

    public static EncodingResult failure(Diagnostic diagnostic) {
        return new EncodingResult(null, diagnostic);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Vir.Expr getValue() {
        if (value == null) {
            throw new NoSuchElementException("encoding failed: " + diagnostic);
        }
        return value;
    }

    public Diagnostic getDiagnostic() {
        if (diagnostic == null) {
            throw new NoSuchElementException("encoding succeeded");
        }
        return diagnostic;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS(" + value + ")" : "FAILURE(" + diagnostic + ")";
    }
}
