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
package dtlogic.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.core.LogicFile.Type;

/**
 * Checks that a stream of declarations can be submitted to the prover in order. That is, every symbol is declared at
 * most once and no symbol is used by a command appearing before the command which declares it. Symbols used but never
 * declared in the stream are assumed to come from elsewhere (e.g. the built-in theories) and are not reported.
 *
 * @author David J. Pearce
 *
 */
public class CommandStreamChecker extends AbstractExpressionFold<Set<String>> {

	/**
	 * Check a given stream of declarations.
	 *
	 * @param file
	 * @return A description of the first problem found, or <code>null</code> if there were none.
	 */
	public String check(LogicFile file) {
		return check(file, Collections.emptySet());
	}

	/**
	 * Check a stream of declarations which follows on from others already submitted. Symbols declared previously may
	 * be used anywhere in the stream, but must not be declared again.
	 *
	 * @param file
	 * @param previous Symbols declared ahead of this stream.
	 * @return A description of the first problem found, or <code>null</code> if there were none.
	 */
	public String check(LogicFile file, Set<String> previous) {
		List<Decl> decls = flatten(file.getDeclarations());
		// Determine everything declared by this stream
		Set<String> declaredAnywhere = new HashSet<>();
		for (Decl d : decls) {
			for (String name : declared(d)) {
				if (previous.contains(name) || !declaredAnywhere.add(name)) {
					return "duplicate declaration of " + name;
				}
			}
		}
		// Now check declaration order
		Set<String> declared = new HashSet<>();
		for (Decl d : decls) {
			List<String> names = declared(d);
			// Datatype groups can refer to themselves
			if (d instanceof Decl.Datatypes) {
				declared.addAll(names);
			}
			for (String used : used(d)) {
				if (declaredAnywhere.contains(used) && !declared.contains(used)) {
					return used + " used before declaration";
				}
			}
			declared.addAll(names);
		}
		return null;
	}

	/**
	 * Determine every symbol declared by a stream, in order of declaration.
	 *
	 * @param file
	 * @return
	 */
	public static List<String> declared(LogicFile file) {
		ArrayList<String> names = new ArrayList<>();
		for (Decl d : flatten(file.getDeclarations())) {
			names.addAll(declared(d));
		}
		return names;
	}

	private static List<Decl> flatten(List<Decl> decls) {
		ArrayList<Decl> result = new ArrayList<>();
		for (Decl d : decls) {
			if (d instanceof Decl.Sequence) {
				result.addAll(flatten(((Decl.Sequence) d).getAll()));
			} else if (d != null) {
				result.add(d);
			}
		}
		return result;
	}

	/**
	 * Determine the set of symbols declared by a given declaration.
	 *
	 * @param d
	 * @return
	 */
	public static List<String> declared(Decl d) {
		ArrayList<String> names = new ArrayList<>();
		if (d instanceof Decl.Sort) {
			names.add(((Decl.Sort) d).getName());
		} else if (d instanceof Decl.Function) {
			names.add(((Decl.Function) d).getName());
		} else if (d instanceof Decl.Constant) {
			names.add(((Decl.Constant) d).getName());
		} else if (d instanceof Decl.Datatypes) {
			for (Decl.Datatype dt : ((Decl.Datatypes) d).getDatatypes()) {
				names.add(dt.getName());
				for (Decl.Constructor c : dt.getConstructors()) {
					names.add(c.getName());
					names.add("is-" + c.getName());
					for (Decl.Parameter f : c.getFields()) {
						names.add(f.getName());
					}
				}
			}
		}
		return names;
	}

	private Set<String> used(Decl d) {
		Set<String> names = new LinkedHashSet<>();
		if (d instanceof Decl.Function) {
			Decl.Function f = (Decl.Function) d;
			for (Decl.Parameter p : f.getParameters()) {
				addSort(p.getType(), names);
			}
			addSort(f.getReturns(), names);
		} else if (d instanceof Decl.Constant) {
			addSort(((Decl.Constant) d).getType(), names);
		} else if (d instanceof Decl.Datatypes) {
			for (Decl.Datatype dt : ((Decl.Datatypes) d).getDatatypes()) {
				for (Decl.Constructor c : dt.getConstructors()) {
					for (Decl.Parameter f : c.getFields()) {
						addSort(f.getType(), names);
					}
				}
			}
		} else if (d instanceof Decl.Axiom) {
			names.addAll(visitExpression(((Decl.Axiom) d).getOperand()));
		}
		return names;
	}

	private static void addSort(Type type, Set<String> names) {
		if (type instanceof Type.Synonym) {
			names.add(((Type.Synonym) type).getSynonym());
		}
	}

	@Override
	protected Set<String> visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
		Set<String> names = new LinkedHashSet<>(visitExpression(expr.getBody()));
		names.addAll(join(visitExpressions(expr.getTrigger())));
		for (Decl.Parameter p : expr.getParameters()) {
			names.remove(p.getName());
		}
		for (Decl.Parameter p : expr.getParameters()) {
			addSort(p.getType(), names);
		}
		return names;
	}

	@Override
	protected Set<String> constructInvoke(Expr.Invoke expr, List<Set<String>> operands) {
		Set<String> names = join(operands);
		names.add(expr.getName());
		return names;
	}

	@Override
	protected Set<String> constructApply(Expr.Apply expr, Set<String> function, List<Set<String>> arguments) {
		Set<String> names = join(function, join(arguments));
		names.add(expr.getName());
		return names;
	}

	@Override
	protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
		Set<String> names = new LinkedHashSet<>();
		names.add(expr.getVariable());
		return names;
	}

	@Override
	protected Set<String> BOTTOM() {
		return new LinkedHashSet<>();
	}

	@Override
	protected Set<String> join(Set<String> lhs, Set<String> rhs) {
		Set<String> names = new LinkedHashSet<>(lhs);
		names.addAll(rhs);
		return names;
	}

	@Override
	protected Set<String> join(List<Set<String>> operands) {
		Set<String> names = new LinkedHashSet<>();
		for (Collection<String> o : operands) {
			names.addAll(o);
		}
		return names;
	}
}
