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
package dtlogic.tasks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile;
import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.IntRange;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Transparency;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.util.CommandStreamChecker;

/**
 * Datatypes shared by the encoding tests, along with helpers for inspecting what was generated.
 */
final class Fixtures {
	static final Path MODULE = Path.of("m");

	static final Path LIST = Path.of("m::List");
	static final Path PAIR = Path.of("m::Pair");
	static final Path POINT = Path.of("m::Point");
	static final Path BYTE = Path.of("m::Byte");
	static final Path TREE = Path.of("m::Tree");
	static final Path HIDDEN = Path.of("m::Hidden");

	static final Type T = new Type.Variable("T");

	/**
	 * <code>List&lt;T&gt; = Nil | Cons(head: T, tail: List&lt;T&gt;)</code>
	 */
	static final Datatype LIST_T = new Datatype(LIST, Collections.singletonList("T"),
			Arrays.asList(new Variant("Nil"),
					new Variant("Cons", new Field("head", T), new Field("tail", new Type.Nominal(LIST, T)))),
			Transparency.ALWAYS, false);

	/**
	 * <code>Pair&lt;A,B&gt; = Pair(fst: A, snd: B)</code>
	 */
	static final Datatype PAIR_AB = new Datatype(PAIR, Arrays.asList("A", "B"),
			Collections.singletonList(new Variant("Pair", new Field("fst", new Type.Variable("A")),
					new Field("snd", new Type.Variable("B")))),
			Transparency.ALWAYS, false);

	/**
	 * <code>Point = Point(x: int, y: int)</code>, whose membership holds of every value.
	 */
	static final Datatype POINT_XY = new Datatype(POINT, Collections.emptyList(),
			Collections.singletonList(new Variant("Point", new Field("x", Type.Int), new Field("y", Type.Int))),
			Transparency.ALWAYS, false);

	/**
	 * <code>Byte = Byte(value: u8)</code>, whose membership depends on the range of its field.
	 */
	static final Datatype BYTE_U8 = new Datatype(BYTE, Collections.emptyList(),
			Collections.singletonList(new Variant("Byte", new Field("value", new Type.Int(IntRange.unsigned(8))))),
			Transparency.ALWAYS, false);

	/**
	 * <code>Tree = Leaf | Node(size: int, children: spec_fn(int) -&gt; Tree)</code>, compared extensionally.
	 */
	static final Datatype TREE_FN = new Datatype(TREE, Collections.emptyList(),
			Arrays.asList(new Variant("Leaf"),
					new Variant("Node", new Field("size", Type.Int), new Field("children",
							new Type.SpecFn(Collections.singletonList(Type.Int), new Type.Nominal(TREE))))),
			Transparency.ALWAYS, true);

	static final Datatype HIDDEN_T = new Datatype(HIDDEN, Collections.singletonList("T"),
			Collections.singletonList(new Variant("Hidden", new Field("value", T))), Transparency.NEVER, false);

	private Fixtures() {
	}

	static DatatypeFile file(Datatype... datatypes) {
		return new DatatypeFile(MODULE, Arrays.asList(datatypes));
	}

	static Context context(Datatype... datatypes) {
		return new Context.Builder(file(datatypes)).build();
	}

	static List<Decl.Axiom> axioms(LogicFile file) {
		ArrayList<Decl.Axiom> axioms = new ArrayList<>();
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Axiom) {
				axioms.add((Decl.Axiom) d);
			}
		}
		return axioms;
	}

	static List<Decl.Axiom> axioms(LogicFile file, AxiomShape shape) {
		ArrayList<Decl.Axiom> axioms = new ArrayList<>();
		for (Decl.Axiom a : axioms(file)) {
			if (a.getAttribute(AxiomShape.class) == shape) {
				axioms.add(a);
			}
		}
		return axioms;
	}

	/**
	 * Get the identifier of a quantified axiom, or <code>null</code> if it is not quantified.
	 */
	static String qid(Decl.Axiom axiom) {
		Expr.Logical e = axiom.getOperand();
		return e instanceof Expr.UniversalQuantifier ? ((Expr.UniversalQuantifier) e).getQid() : null;
	}

	static List<String> qids(LogicFile file) {
		ArrayList<String> qids = new ArrayList<>();
		for (Decl.Axiom a : axioms(file)) {
			String qid = qid(a);
			if (qid != null) {
				qids.add(qid);
			}
		}
		return qids;
	}

	static List<String> declared(LogicFile file) {
		return CommandStreamChecker.declared(file);
	}

	/**
	 * Prefix the base theory to a stream, as it would be submitted to the prover.
	 */
	static LogicFile withPrelude(LogicFile file) {
		ArrayList<Decl> decls = new ArrayList<>(Prelude.basis());
		decls.addAll(file.getDeclarations());
		return new LogicFile(decls);
	}
}
