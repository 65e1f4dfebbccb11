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
package vspec.tasks;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vspec.core.Assertion;
import vspec.core.ExpressionRef;
import vspec.encoder.AssertionEncoder;
import vspec.encoder.BindingPolicy;
import vspec.encoder.EncodingContext;
import vspec.encoder.EncodingException;
import vspec.encoder.EncodingResult;
import vspec.io.AssertionJson;
import vspec.io.VirPrinter;
import vspec.syntax.ExpressionRegistry;
import vspec.syntax.ProcedureScope;
import vspec.syntax.TypedExpression;

/**
 * Encodes the specifications attached to a single procedure. Unlike the
 * underlying {@link AssertionEncoder}, a task never stops at the first failure:
 * every specification in a batch produces its own {@link EncodingResult}.
 */
public class SpecificationEncodeTask {
	private static final Logger LOG = LoggerFactory.getLogger(SpecificationEncodeTask.class);

	private final AssertionEncoder encoder = new AssertionEncoder();
	/**
	 * The variables of the procedure whose specifications are being encoded.
	 */
	private final ProcedureScope scope;
	/**
	 * Determines how names bound both by the procedure and a quantifier are
	 * resolved.
	 */
	private BindingPolicy policy = BindingPolicy.PROCEDURE_FIRST;
	/**
	 * Specify whether to report every encoded expression or not
	 */
	private boolean verbose = false;

	public SpecificationEncodeTask(ProcedureScope scope) {
		if (scope == null) {
			throw new IllegalArgumentException("invalid scope");
		}
		this.scope = scope;
	}

	public SpecificationEncodeTask setBindingPolicy(BindingPolicy policy) {
		if (policy == null) {
			throw new IllegalArgumentException("invalid binding policy");
		}
		this.policy = policy;
		return this;
	}

	public SpecificationEncodeTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public EncodingResult encode(Assertion<TypedExpression> specification) {
		EncodingResult result = encoder.tryEncode(specification, EncodingContext.of(scope, policy));
		if (!result.isSuccess()) {
			LOG.info("failed to encode specification: {}", result.getDiagnostic());
		} else if (verbose) {
			LOG.info("encoded specification as {}", VirPrinter.toString(result.getValue()));
		} else if (LOG.isDebugEnabled()) {
			LOG.debug("encoded specification as {}", VirPrinter.toString(result.getValue()));
		}
		return result;
	}

	/**
	 * Encode a batch of specifications, producing one result for each in the
	 * same order.
	 *
	 * @param specifications
	 * @return
	 */
	public List<EncodingResult> encodeAll(List<Assertion<TypedExpression>> specifications) {
		List<EncodingResult> results = new ArrayList<>();
		int failures = 0;
		for (Assertion<TypedExpression> specification : specifications) {
			EncodingResult result = encode(specification);
			if (!result.isSuccess()) {
				failures = failures + 1;
			}
			results.add(result);
		}
		LOG.info("encoded {} specifications ({} failed)", specifications.size(), failures);
		return results;
	}

	/**
	 * Decode a specification received over the wire, recover its leaves from a
	 * given registry and encode it.
	 *
	 * @param json
	 * @param registry
	 * @return
	 */
	public EncodingResult decodeAndEncode(String json, ExpressionRegistry registry) {
		Assertion<TypedExpression> specification;
		try {
			Assertion<ExpressionRef> skeleton = AssertionJson.fromJson(json);
			specification = AssertionJson.resolve(skeleton, registry);
		} catch (EncodingException e) {
			LOG.info("failed to decode specification: {}", e.getDiagnostic());
			return EncodingResult.failure(e.getDiagnostic());
		}
		return encode(specification);
	}
}
