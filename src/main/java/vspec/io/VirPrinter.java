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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import vspec.core.Vir;
import vspec.core.Vir.Expr;
import vspec.core.Vir.Type;
import vspec.util.MappablePrintWriter;

/**
 * Prints IR expressions in a Boogie-like concrete syntax. Every printed
 * fragment is mapped back to the IR item it came from and, since the encoder
 * attaches the originating surface expression to each item, from there to the
 * source.
 *
 * @author David J. Pearce
 *
 */
public class VirPrinter {
	private final MappablePrintWriter<Vir.Item> out;

	public VirPrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<Vir.Item> getMapping() {
		return out.getMapping();
	}

	public void write(Expr e) {
		writeExpression(e);
		out.println();
		out.flush();
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.Old) {
			writeExpression(e);
		} else if (e instanceof Expr.UnaryOperator || e instanceof Expr.BinaryOperator
				|| e instanceof Expr.NaryOperator || e instanceof Expr.IfElse) {
			out.print("(", e);
			writeExpression(e);
			out.print(")", e);
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " == ");
		} else if (e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, " != ");
		} else if (e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, " ==> ");
		} else if (e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ");
		} else if (e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " <= ");
		} else if (e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ");
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " >= ");
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ");
		} else if (e instanceof Expr.Division) {
			writeInfix((Expr.BinaryOperator) e, " / ");
		} else if (e instanceof Expr.Remainder) {
			writeInfix((Expr.BinaryOperator) e, " % ");
		} else if (e instanceof Expr.LogicalXor) {
			writeInfix((Expr.BinaryOperator) e, " ^ ");
		} else if (e instanceof Expr.Boolean) {
			writeBoolean((Expr.Boolean) e);
		} else if (e instanceof Expr.Integer) {
			writeInteger((Expr.Integer) e);
		} else if (e instanceof Expr.LogicalAnd) {
			writeNary((Expr.LogicalAnd) e, " && ");
		} else if (e instanceof Expr.LogicalOr) {
			writeNary((Expr.LogicalOr) e, " || ");
		} else if (e instanceof Expr.IfElse) {
			writeIfElse((Expr.IfElse) e);
		} else if (e instanceof Expr.UniversalQuantifier) {
			writeQuantifier((Expr.UniversalQuantifier) e);
		} else if (e instanceof Expr.LogicalNot) {
			writeLogicalNot((Expr.LogicalNot) e);
		} else if (e instanceof Expr.Old) {
			writeOld((Expr.Old) e);
		} else if (e instanceof Expr.Negation) {
			writeNegation((Expr.Negation) e);
		} else if (e instanceof Expr.FieldAccess) {
			writeFieldAccess((Expr.FieldAccess) e);
		} else if (e instanceof Expr.LocalVar) {
			writeLocalVar((Expr.LocalVar) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator, (Expr) e);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeNary(Expr.NaryOperator e, String operator) {
		List<? extends Expr> operands = e.getOperands();
		//
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(operator, (Expr) e);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeBoolean(Expr.Boolean e) {
		out.print(Boolean.toString(e.getValue()), e);
	}

	private void writeInteger(Expr.Integer e) {
		out.print(e.getValue().toString(), e);
	}

	private void writeIfElse(Expr.IfElse e) {
		out.print("if ", e);
		writeExpression(e.getCondition());
		out.print(" then ", e);
		writeExpressionWithBraces(e.getTrueBranch());
		out.print(" else ", e);
		writeExpressionWithBraces(e.getFalseBranch());
	}

	private void writeQuantifier(Expr.UniversalQuantifier e) {
		out.print("(forall ", e);
		List<Expr.LocalVar> params = e.getVariables();
		for (int i = 0; i != params.size(); ++i) {
			Expr.LocalVar ith = params.get(i);
			if (i != 0) {
				out.print(", ", ith);
			}
			out.print(ith.getName(), ith);
			out.print(": ", ith);
			writeType(ith.getType());
		}
		out.print(" ::", e);
		for (Vir.Trigger trigger : e.getTriggers()) {
			out.print(" { ", trigger);
			List<Expr> terms = trigger.getTerms();
			for (int i = 0; i != terms.size(); ++i) {
				if (i != 0) {
					out.print(", ", trigger);
				}
				writeExpression(terms.get(i));
			}
			out.print(" }", trigger);
		}
		out.print(" ", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeOld(Expr.Old e) {
		out.print("old(", e);
		writeExpression(e.getOperand());
		out.print(")", e);
	}

	private void writeNegation(Expr.Negation e) {
		out.print("-", e);
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeLogicalNot(Expr.LogicalNot e) {
		out.print("!", e);
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeFieldAccess(Expr.FieldAccess e) {
		writeExpression(e.getBase());
		out.print(".", e);
		out.print(e.getField().getName(), e.getField());
	}

	private void writeLocalVar(Expr.LocalVar e) {
		out.print(e.getName(), e);
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("bool", t);
		} else if (t instanceof Type.Int) {
			out.print("int", t);
		} else if (t instanceof Type.TypedRef) {
			out.print("ref<" + ((Type.TypedRef) t).getName() + ">", t);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		VirPrinter p = new VirPrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
