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
package vspec.io;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import vspec.core.Assertion;
import vspec.core.ExpressionId;
import vspec.core.ExpressionRef;
import vspec.core.SpecificationId;
import vspec.encoder.Diagnostic;
import vspec.encoder.EncodingException;
import vspec.encoder.ErrorCode;
import vspec.syntax.ExpressionRegistry;
import vspec.syntax.TypedExpression;

/**
 * Converts assertion skeletons to and from their JSON wire format. A skeleton
 * carries only the references identifying its leaves, never the expressions
 * themselves:
 *
 * <pre>
 * {"kind":{"Expr":{"spec_id":"&lt;uuid&gt;","expr_id":&lt;n&gt;}}}
 * {"kind":{"And":[&lt;assertion&gt;, ...]}}
 * {"kind":{"Implies":[&lt;assertion&gt;,&lt;assertion&gt;]}}
 * </pre>
 *
 * Quantified assertions have no wire representation. Decoding is strict: any
 * input not conforming exactly to the above is rejected and nothing is
 * returned.
 */
public class AssertionJson {
	private static final Logger LOG = LoggerFactory.getLogger(AssertionJson.class);

	private static final String KIND = "kind";
	private static final String EXPR = "Expr";
	private static final String AND = "And";
	private static final String IMPLIES = "Implies";
	private static final String SPEC_ID = "spec_id";
	private static final String EXPR_ID = "expr_id";
	/**
	 * Nesting limit for decoded assertions, bounding the recursion of the reader.
	 */
	private static final int MAX_DEPTH = 512;

	private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

	/**
	 * Strip a typed assertion down to its skeleton.
	 *
	 * @param assertion
	 * @return
	 */
	public static Assertion<ExpressionRef> skeleton(Assertion<TypedExpression> assertion) {
		return assertion.map(TypedExpression::getRef);
	}

	public static String toJson(Assertion<ExpressionRef> assertion) {
		return GSON.toJson(write(assertion));
	}

	public static Assertion<ExpressionRef> fromJson(String text) {
		if (text == null) {
			throw malformed("missing input");
		}
		try {
			JsonReader reader = new JsonReader(new StringReader(text));
			reader.setLenient(false);
			Assertion<ExpressionRef> assertion = read(reader, 0);
			if (reader.peek() != JsonToken.END_DOCUMENT) {
				throw malformed("trailing content after assertion");
			}
			return assertion;
		} catch (IOException | IllegalStateException | NumberFormatException e) {
			LOG.debug("rejecting malformed assertion", e);
			throw EncodingException.malformed("malformed assertion: " + e.getMessage(), e);
		}
	}

	/**
	 * Recover a typed assertion from its skeleton by looking up every leaf in a
	 * given registry.
	 *
	 * @param skeleton
	 * @param registry
	 * @return
	 */
	public static Assertion<TypedExpression> resolve(Assertion<ExpressionRef> skeleton, ExpressionRegistry registry) {
		return skeleton.map(ref -> registry.lookup(ref).orElseThrow(() -> new EncodingException(
				new Diagnostic(ErrorCode.SERIALIZATION_ERROR, "unknown expression " + ref, null, ref))));
	}

	// =========================================================================
	// Writing
	// =========================================================================

	private static JsonObject write(Assertion<ExpressionRef> assertion) {
		Assertion.Kind<ExpressionRef> kind = assertion.getKind();
		JsonObject body = new JsonObject();
		if (kind instanceof Assertion.Expr) {
			ExpressionRef ref = ((Assertion.Expr<ExpressionRef>) kind).getOperand();
			JsonObject leaf = new JsonObject();
			leaf.addProperty(SPEC_ID, ref.getSpecificationId().toString());
			leaf.addProperty(EXPR_ID, ref.getExpressionId().getValue());
			body.add(EXPR, leaf);
		} else if (kind instanceof Assertion.And) {
			JsonArray operands = new JsonArray();
			for (Assertion<ExpressionRef> operand : ((Assertion.And<ExpressionRef>) kind).getOperands()) {
				operands.add(write(operand));
			}
			body.add(AND, operands);
		} else if (kind instanceof Assertion.Implies) {
			Assertion.Implies<ExpressionRef> implies = (Assertion.Implies<ExpressionRef>) kind;
			JsonArray operands = new JsonArray();
			operands.add(write(implies.getLeftHandSide()));
			operands.add(write(implies.getRightHandSide()));
			body.add(IMPLIES, operands);
		} else {
			throw new EncodingException(new Diagnostic(ErrorCode.UNSUPPORTED_SYNTAX,
					"quantified assertions cannot be serialized", null, null));
		}
		JsonObject result = new JsonObject();
		result.add(KIND, body);
		return result;
	}

	// =========================================================================
	// Reading
	// =========================================================================

	private static Assertion<ExpressionRef> read(JsonReader reader, int depth) throws IOException {
		if (depth > MAX_DEPTH) {
			throw malformed("assertion nested too deeply");
		}
		expect(reader, JsonToken.BEGIN_OBJECT, "assertion must be an object");
		reader.beginObject();
		Assertion<ExpressionRef> assertion = null;
		while (reader.hasNext()) {
			String name = reader.nextName();
			if (!name.equals(KIND)) {
				throw malformed("unexpected member " + name);
			} else if (assertion != null) {
				throw malformed("duplicate member " + name);
			}
			assertion = readKind(reader, depth);
		}
		reader.endObject();
		if (assertion == null) {
			throw malformed("assertion requires member " + KIND);
		}
		return assertion;
	}

	private static Assertion<ExpressionRef> readKind(JsonReader reader, int depth) throws IOException {
		expect(reader, JsonToken.BEGIN_OBJECT, KIND + " must be an object");
		reader.beginObject();
		if (!reader.hasNext()) {
			throw malformed(KIND + " must have exactly one member");
		}
		String variant = reader.nextName();
		Assertion<ExpressionRef> assertion;
		switch (variant) {
			case EXPR:
				assertion = Assertion.EXPR(readRef(reader));
				break;
			case AND:
				assertion = Assertion.AND(readOperands(reader, AND, depth));
				break;
			case IMPLIES: {
				List<Assertion<ExpressionRef>> operands = readOperands(reader, IMPLIES, depth);
				if (operands.size() != 2) {
					throw malformed("implication requires exactly two operands");
				}
				assertion = Assertion.IMPLIES(operands.get(0), operands.get(1));
				break;
			}
			default:
				throw malformed("unknown assertion kind " + variant);
		}
		if (reader.hasNext()) {
			throw malformed(KIND + " must have exactly one member");
		}
		reader.endObject();
		return assertion;
	}

	private static List<Assertion<ExpressionRef>> readOperands(JsonReader reader, String context, int depth)
			throws IOException {
		expect(reader, JsonToken.BEGIN_ARRAY, context + " must be an array");
		reader.beginArray();
		List<Assertion<ExpressionRef>> operands = new ArrayList<>();
		while (reader.hasNext()) {
			operands.add(read(reader, depth + 1));
		}
		reader.endArray();
		return operands;
	}

	private static ExpressionRef readRef(JsonReader reader) throws IOException {
		expect(reader, JsonToken.BEGIN_OBJECT, EXPR + " must be an object");
		reader.beginObject();
		String specId = null;
		String exprId = null;
		while (reader.hasNext()) {
			String name = reader.nextName();
			if (name.equals(SPEC_ID)) {
				if (specId != null) {
					throw malformed("duplicate member " + name);
				}
				expect(reader, JsonToken.STRING, SPEC_ID + " must be a string");
				specId = reader.nextString();
			} else if (name.equals(EXPR_ID)) {
				if (exprId != null) {
					throw malformed("duplicate member " + name);
				}
				expect(reader, JsonToken.NUMBER, EXPR_ID + " must be a number");
				exprId = reader.nextString();
			} else {
				throw malformed("unexpected member " + name);
			}
		}
		reader.endObject();
		if (specId == null || exprId == null) {
			throw malformed("expression requires exactly " + SPEC_ID + " and " + EXPR_ID);
		} else if (!exprId.matches("[0-9]+")) {
			throw malformed(EXPR_ID + " must be a non-negative integer");
		}
		try {
			return new ExpressionRef(SpecificationId.fromString(specId), new ExpressionId(Long.parseLong(exprId)));
		} catch (IllegalArgumentException e) {
			throw EncodingException.malformed("invalid expression reference: " + e.getMessage(), e);
		}
	}

	private static void expect(JsonReader reader, JsonToken token, String message) throws IOException {
		if (reader.peek() != token) {
			throw malformed(message);
		}
	}

	private static EncodingException malformed(String message) {
		return EncodingException.malformed(message, null);
	}
}
