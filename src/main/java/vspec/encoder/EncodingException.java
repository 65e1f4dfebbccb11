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

import vspec.core.ExpressionRef;
import vspec.syntax.Syntax;

/**
 * Signals that an assertion could not be encoded (or decoded). This aborts the
 * entire operation in which it arises. No partial result is produced.
 */
public class EncodingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Diagnostic diagnostic;

    public EncodingException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public EncodingException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.toString(), cause);
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    public ErrorCode getCode() {
        return diagnostic.getCode();
    }

    /**
     * Record the leaf expression in which this failure arose. Only the innermost
     * leaf is retained.
     *
     * @param ref
     * @return
     */
    public EncodingException attach(ExpressionRef ref) {
        if (diagnostic.getLeaf().isPresent()) {
            return this;
        }
        EncodingException e = new EncodingException(diagnostic.withLeaf(ref), getCause());
        e.setStackTrace(getStackTrace());
        return e;
    }

    public static EncodingException unsupported(String message, Syntax.Expr expr) {
        return new EncodingException(new Diagnostic(ErrorCode.UNSUPPORTED_SYNTAX, message, spanOf(expr), null));
    }

    public static EncodingException typeMismatch(String message, Syntax.Expr expr) {
        return new EncodingException(new Diagnostic(ErrorCode.TYPE_MISMATCH, message, spanOf(expr), null));
    }

    public static EncodingException unresolved(String message, Syntax.Expr expr) {
        return new EncodingException(new Diagnostic(ErrorCode.UNRESOLVED_BINDING, message, spanOf(expr), null));
    }

    public static EncodingException malformed(String message, Throwable cause) {
        return new EncodingException(new Diagnostic(ErrorCode.SERIALIZATION_ERROR, message, null, null), cause);
    }

    private static Syntax.Span spanOf(Syntax.Expr expr) {
        return expr == null ? null : expr.getSpan();
    }
}
