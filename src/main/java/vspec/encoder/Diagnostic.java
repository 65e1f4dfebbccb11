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

import java.util.Optional;

import vspec.core.ExpressionRef;
import vspec.syntax.Syntax;

/**
 * Describes a single failure to encode (or decode) an assertion. Where known, a
 * diagnostic identifies the region of source text responsible and the leaf
 * expression in which it arose.
 */
public final class Diagnostic {
    private final ErrorCode code;
    private final String message;
    private final Syntax.Span span;
    private final ExpressionRef leaf;

    public Diagnostic(ErrorCode code, String message, Syntax.Span span, ExpressionRef leaf) {
        if (code == null || message == null) {
            throw new IllegalArgumentException("invalid diagnostic");
        }
        this.code = code;
        this.message = message;
        this.span = span;
        this.leaf = leaf;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Syntax.Span> getSpan() {
        return Optional.ofNullable(span);
    }

    public Optional<ExpressionRef> getLeaf() {
        return Optional.ofNullable(leaf);
    }

    /**
     * Construct a copy of this diagnostic which records the leaf expression it
     * arose in.
     *
     * @param ref
     * @return
     */
    public Diagnostic withLeaf(ExpressionRef ref) {
        return new Diagnostic(code, message, span, ref);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(code).append(": ").append(message);
        if (span != null) {
            sb.append(" @").append(span);
        }
        if (leaf != null) {
            sb.append(" [").append(leaf).append("]");
        }
        return sb.toString();
    }
}
