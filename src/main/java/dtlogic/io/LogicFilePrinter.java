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
package dtlogic.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.core.LogicFile.Type;

/**
 * Writes a <code>LogicFile</code> as an SMT-LIB2 script. Symbols which are not simple SMT-LIB2 symbols (for example
 * those containing <code>#</code> or <code>,</code>) are written in their quoted <code>|...|</code> form.
 *
 * @author David J. Pearce
 *
 */
public class LogicFilePrinter {
	private final PrintWriter out;

	public LogicFilePrinter(OutputStream output) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public void flush() {
		out.flush();
	}

	public void write(LogicFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(d);
		}
		out.flush();
	}

	/**
	 * Write a check that a given formula holds, by asserting its negation within a fresh assertion scope.
	 *
	 * @param formula
	 */
	public void writeCheck(Expr.Logical formula) {
		out.println("(push)");
		out.print("(assert (not ");
		writeExpression(formula);
		out.println("))");
		out.println("(check-sat)");
		out.println("(pop)");
		out.flush();
	}

	private void writeDecl(Decl d) {
		if(d == null) {
			out.println();
		} else if(d instanceof Decl.Axiom) {
			writeAxiom((Decl.Axiom) d);
		} else if(d instanceof Decl.Constant) {
			writeConstant((Decl.Constant) d);
		} else if(d instanceof Decl.Datatypes) {
			writeDatatypes((Decl.Datatypes) d);
		} else if(d instanceof Decl.Function) {
			writeFunction((Decl.Function) d);
		} else if(d instanceof Decl.LineComment) {
			writeLineComment((Decl.LineComment) d);
		} else if(d instanceof Decl.Sequence) {
			writeSequence((Decl.Sequence) d);
		} else if(d instanceof Decl.Sort) {
			writeSort((Decl.Sort) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeAxiom(Decl.Axiom d) {
		out.print("(assert ");
		writeExpression(d.getOperand());
		out.println(")");
	}

	private void writeConstant(Decl.Constant d) {
		out.print("(declare-const ");
		out.print(symbol(d.getName()));
		out.print(" ");
		writeType(d.getType());
		out.println(")");
	}

	private void writeDatatypes(Decl.Datatypes d) {
		List<Decl.Datatype> datatypes = d.getDatatypes();
		out.print("(declare-datatypes (");
		for (int i = 0; i != datatypes.size(); ++i) {
			if (i != 0) {
				out.print(" ");
			}
			out.print("(" + symbol(datatypes.get(i).getName()) + " 0)");
		}
		out.println(") (");
		for (Decl.Datatype dt : datatypes) {
			out.print("  (");
			List<Decl.Constructor> constructors = dt.getConstructors();
			for (int i = 0; i != constructors.size(); ++i) {
				Decl.Constructor c = constructors.get(i);
				if (i != 0) {
					out.print(" ");
				}
				out.print("(" + symbol(c.getName()));
				for (Decl.Parameter f : c.getFields()) {
					out.print(" (" + symbol(f.getName()) + " ");
					writeType(f.getType());
					out.print(")");
				}
				out.print(")");
			}
			out.println(")");
		}
		out.println("))");
	}

	private void writeFunction(Decl.Function d) {
		out.print("(declare-fun ");
		out.print(symbol(d.getName()));
		out.print(" (");
		List<Decl.Parameter> params = d.getParameters();
		for (int i = 0; i != params.size(); ++i) {
			if (i != 0) {
				out.print(" ");
			}
			writeType(params.get(i).getType());
		}
		out.print(") ");
		writeType(d.getReturns());
		out.println(")");
	}

	private void writeLineComment(Decl.LineComment d) {
		out.print(";; ");
		out.println(d.getMessage());
	}

	private void writeSequence(Decl.Sequence d) {
		for (Decl e : d.getAll()) {
			writeDecl(e);
		}
	}

	private void writeSort(Decl.Sort d) {
		out.print("(declare-sort ");
		out.print(symbol(d.getName()));
		out.println(" 0)");
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("Bool");
		} else if (t instanceof Type.Int) {
			out.print("Int");
		} else if (t instanceof Type.Synonym) {
			out.print(symbol(((Type.Synonym) t).getSynonym()));
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeExpression(Expr e) {
		if(e instanceof Expr.Apply) {
			writeApply((Expr.Apply) e);
		} else if(e instanceof Expr.Boolean) {
			out.print(Boolean.toString(((Expr.Boolean) e).getValue()));
		} else if(e instanceof Expr.Equals) {
			writeBinary("=", (Expr.Equals) e);
		} else if(e instanceof Expr.GreaterThanOrEqual) {
			writeBinary(">=", (Expr.GreaterThanOrEqual) e);
		} else if(e instanceof Expr.Implies) {
			writeBinary("=>", (Expr.Implies) e);
		} else if(e instanceof Expr.Integer) {
			writeInteger((Expr.Integer) e);
		} else if(e instanceof Expr.Invoke) {
			writeInvoke((Expr.Invoke) e);
		} else if(e instanceof Expr.LogicalAnd) {
			writeNary("and", (Expr.LogicalAnd) e);
		} else if(e instanceof Expr.LogicalOr) {
			writeNary("or", (Expr.LogicalOr) e);
		} else if(e instanceof Expr.LogicalNot) {
			out.print("(not ");
			writeExpression(((Expr.LogicalNot) e).getOperand());
			out.print(")");
		} else if(e instanceof Expr.UniversalQuantifier) {
			writeQuantifier((Expr.UniversalQuantifier) e);
		} else if(e instanceof Expr.VariableAccess) {
			out.print(symbol(((Expr.VariableAccess) e).getVariable()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeApply(Expr.Apply e) {
		out.print("(" + symbol(e.getName()) + " ");
		writeExpression(e.getFunction());
		for (Expr arg : e.getArguments()) {
			out.print(" ");
			writeExpression(arg);
		}
		out.print(")");
	}

	private void writeBinary(String operator, Expr.BinaryOperator<?> e) {
		out.print("(" + operator + " ");
		writeExpression(e.getLeftHandSide());
		out.print(" ");
		writeExpression(e.getRightHandSide());
		out.print(")");
	}

	private void writeNary(String operator, Expr.NaryOperator e) {
		out.print("(" + operator);
		for (Expr operand : e.getOperands()) {
			out.print(" ");
			writeExpression(operand);
		}
		out.print(")");
	}

	private void writeInteger(Expr.Integer e) {
		if (e.getValue().signum() < 0) {
			out.print("(- " + e.getValue().negate() + ")");
		} else {
			out.print(e.getValue().toString());
		}
	}

	private void writeInvoke(Expr.Invoke e) {
		List<Expr> args = e.getArguments();
		if (args.isEmpty()) {
			out.print(symbol(e.getName()));
			return;
		}
		out.print("(" + symbol(e.getName()));
		for (Expr arg : args) {
			out.print(" ");
			writeExpression(arg);
		}
		out.print(")");
	}

	private void writeQuantifier(Expr.UniversalQuantifier e) {
		out.print("(forall (");
		List<Decl.Parameter> params = e.getParameters();
		for (int i = 0; i != params.size(); ++i) {
			Decl.Parameter ith = params.get(i);
			if (i != 0) {
				out.print(" ");
			}
			out.print("(" + symbol(ith.getName()) + " ");
			writeType(ith.getType());
			out.print(")");
		}
		out.print(") ");
		List<Expr> trigger = e.getTrigger();
		if (trigger.isEmpty() && e.getQid() == null) {
			writeExpression(e.getBody());
		} else {
			out.print("(! ");
			writeExpression(e.getBody());
			if (!trigger.isEmpty()) {
				out.print(" :pattern (");
				for (int i = 0; i != trigger.size(); ++i) {
					if (i != 0) {
						out.print(" ");
					}
					writeExpression(trigger.get(i));
				}
				out.print(")");
			}
			if (e.getQid() != null) {
				out.print(" :qid " + symbol(e.getQid()));
				out.print(" :skolemid " + symbol("skolem_" + e.getQid()));
			}
			out.print(")");
		}
		out.print(")");
	}

	/**
	 * Render a name as an SMT-LIB2 symbol, quoting it when it is not a simple symbol.
	 *
	 * @param name
	 * @return
	 */
	public static String symbol(String name) {
		if (isSimpleSymbol(name)) {
			return name;
		} else if (name.indexOf('|') >= 0 || name.indexOf('\\') >= 0) {
			throw new IllegalArgumentException("symbol cannot be quoted (" + name + ")");
		} else {
			return "|" + name + "|";
		}
	}

	private static boolean isSimpleSymbol(String name) {
		if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
			return false;
		}
		for (int i = 0; i != name.length(); ++i) {
			char c = name.charAt(i);
			boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
					|| "~!@$%^&*_-+=<>.?/".indexOf(c) >= 0;
			if (!ok) {
				return false;
			}
		}
		return true;
	}

	public static String toString(LogicFile.Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		LogicFilePrinter p = new LogicFilePrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return buf.toString(StandardCharsets.UTF_8);
	}

	public static String toString(LogicFile file) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new LogicFilePrinter(buf).write(file);
		return buf.toString(StandardCharsets.UTF_8);
	}
}
