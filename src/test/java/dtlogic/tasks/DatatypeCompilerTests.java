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

import static dtlogic.tasks.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.io.LogicFilePrinter;
import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.IntRange;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Transparency;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.lang.MonoType;
import dtlogic.lang.Specialization;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.util.CommandStreamChecker;
import dtlogic.util.InternalFailure;

public class DatatypeCompilerTests {
	private static final MonoType INT = MonoType.Int(IntRange.INT);

	private static final Path INT_LIST = Path.of("m::IntList");
	private static final Path FN_LIST = Path.of("m::FnList");

	/**
	 * <code>IntList = Nil | Cons(head: int, tail: IntList)</code>
	 */
	private static final Datatype INT_LIST_DT = new Datatype(INT_LIST, Collections.emptyList(),
			Arrays.asList(new Variant("Nil"), new Variant("Cons", new Field("head", Type.Int),
					new Field("tail", new Type.Nominal(INT_LIST)))),
			Transparency.ALWAYS, false);

	/**
	 * <code>FnList = Nil | Cons(head: spec_fn(int) -&gt; int, tail: FnList)</code>, compared extensionally.
	 */
	private static final Datatype FN_LIST_DT = new Datatype(FN_LIST, Collections.emptyList(),
			Arrays.asList(new Variant("Nil"),
					new Variant("Cons",
							new Field("head", new Type.SpecFn(Collections.singletonList(Type.Int), Type.Int)),
							new Field("tail", new Type.Nominal(FN_LIST)))),
			Transparency.ALWAYS, true);

	private static LogicFile compile(Context context) {
		return new DatatypeCompiler(context).compile();
	}

	private static String print(Decl.Axiom axiom) {
		return LogicFilePrinter.toString(axiom.getOperand());
	}

	private static Decl.Axiom axiom(LogicFile file, String qid) {
		for (Decl.Axiom a : axioms(file)) {
			if (qid.equals(qid(a))) {
				return a;
			}
		}
		fail("missing axiom " + qid);
		return null;
	}

	/**
	 * A complete module exercising every kind of encoding.
	 */
	private static Context everything() {
		return new Context.Builder(file(LIST_T, PAIR_AB, POINT_XY, BYTE_U8, TREE_FN, HIDDEN_T, FN_LIST_DT))
				.addSpecialization(PAIR, Specialization.of(INT, MonoType.Bool))
				.addSpecialization(PAIR, Specialization.of(MonoType.Bool, INT))
				.addSpecialization(PAIR, Specialization.of(INT, null))
				.addClosureArity(1)
				.addClosureArity(0)
				.addMonoType(MonoType.Nominal(HIDDEN, INT))
				.addMonoType(MonoType.Primitive(Type.PrimitiveKind.STRSLICE))
				.addFnDef(Path.of("m::f"), 1)
				.setUsesArray(true)
				.build();
	}

	// ==============================================================================
	// Boxing
	// ==============================================================================

	@Test
	public void unboxOfBoxAxiom() {
		LogicFile file = compile(context(POINT_XY));
		assertEquals("(forall ((x m.Point)) (! (= x (|m.Point#unbox| (|m.Point#box| x))) "
				+ ":pattern ((|m.Point#box| x)) :qid m.Point_box_axiom :skolemid skolem_m.Point_box_axiom))",
				print(axiom(file, "m.Point_box_axiom")));
	}

	@Test
	public void boxOfUnboxConditionalOnMembership() {
		// Unboxing only round-trips for members of the type
		LogicFile file = compile(context(POINT_XY));
		assertEquals("(forall ((x Poly)) (! (=> (has_type x |m.Point#Type|) "
				+ "(= x (|m.Point#box| (|m.Point#unbox| x)))) :pattern ((has_type x |m.Point#Type|)) "
				+ ":qid m.Point_unbox_axiom :skolemid skolem_m.Point_unbox_axiom))",
				print(axiom(file, "m.Point_unbox_axiom")));
	}

	@Test
	public void genericRoundTripsBindTypeParameters() {
		// Generic round trips quantify over the type parameters
		LogicFile file = compile(context(LIST_T));
		String unbox = print(axiom(file, "m.List_unbox_axiom"));
		assertTrue(unbox.startsWith("(forall ((T& Type) (x Poly))"), unbox);
		assertTrue(unbox.contains("(has_type x (|m.List#Type| T&))"), unbox);
	}

	// ==============================================================================
	// Membership
	// ==============================================================================

	@Test
	public void alwaysAxiomOnlyWithoutInvariants() {
		// Membership holds of every value only without field invariants
		LogicFile file = compile(context(LIST_T, POINT_XY, BYTE_U8));
		List<Decl.Axiom> always = axioms(file, AxiomShape.HAS_TYPE_ALWAYS);
		assertEquals(1, always.size());
		assertEquals("m.Point_has_type_always", qid(always.get(0)));
		assertEquals("(forall ((x m.Point)) (! (has_type (|m.Point#box| x) |m.Point#Type|) "
				+ ":pattern ((has_type (|m.Point#box| x) |m.Point#Type|)) "
				+ ":qid m.Point_has_type_always :skolemid skolem_m.Point_has_type_always))", print(always.get(0)));
	}

	@Test
	public void constructorInvariantAxiom() {
		LogicFile file = compile(context(BYTE_U8));
		assertEquals("(forall ((_value Int)) (! (=> (uInv 8 _value) "
				+ "(has_type (|m.Byte#box| (m.Byte/Byte _value)) |m.Byte#Type|)) "
				+ ":pattern ((has_type (|m.Byte#box| (m.Byte/Byte _value)) |m.Byte#Type|)) "
				+ ":qid m.Byte/Byte_constructor :skolemid skolem_m.Byte/Byte_constructor))",
				print(axiom(file, "m.Byte/Byte_constructor")));
		String invariant = print(axiom(file, "m.Byte/Byte/value_invariant"));
		assertTrue(invariant.contains("(uInv 8 (m.Byte/Byte/value (|m.Byte#unbox| x)))"), invariant);
	}

	@Test
	public void nullaryConstructorBindsTypeParameters() {
		// Nullary constructors of generic datatypes still quantify over the type parameters
		LogicFile file = compile(context(LIST_T));
		String nil = print(axiom(file, "m.List/Nil_constructor"));
		assertTrue(nil.startsWith("(forall ((T& Type))"), nil);
	}

	// ==============================================================================
	// Fields
	// ==============================================================================

	@Test
	public void accessorBridgeAxiom() {
		LogicFile file = compile(context(LIST_T));
		assertEquals("(forall ((x m.List)) (! (= (m.List/Cons/tail x) (m.List/Cons/?tail x)) "
				+ ":pattern ((m.List/Cons/tail x)) :qid m.List/Cons/tail_accessor "
				+ ":skolemid skolem_m.List/Cons/tail_accessor))", print(axiom(file, "m.List/Cons/tail_accessor")));
		// Only the bridging axiom mentions the selector
		for (Decl.Axiom a : axioms(file)) {
			if (a.getAttribute(AxiomShape.class) != AxiomShape.ACCESSOR_BRIDGE) {
				assertFalse(print(a).contains("?"), print(a));
			}
		}
	}

	@Test
	public void fieldWrappersAndSelectorsDeclared() {
		LogicFile file = compile(context(LIST_T));
		List<String> declared = declared(file);
		assertTrue(declared.contains("m.List/Cons/head"));
		assertTrue(declared.contains("m.List/Cons/?head"));
		assertTrue(declared.contains("is-m.List/Nil"));
		assertTrue(declared.contains("m.List#Type"));
	}

	// ==============================================================================
	// Height
	// ==============================================================================

	@Test
	public void tailHeightAxiom() {
		LogicFile file = compile(context(LIST_T));
		assertEquals("(forall ((x m.List)) (! (=> (is-m.List/Cons x) "
				+ "(height_lt (height (|m.List#box| (m.List/Cons/tail x))) (height (|m.List#box| x)))) "
				+ ":pattern ((height (|m.List#box| (m.List/Cons/tail x)))) :qid m.List/Cons/tail_height "
				+ ":skolemid skolem_m.List/Cons/tail_height))", print(axiom(file, "m.List/Cons/tail_height")));
		// Type parameters may be instantiated with the datatype itself
		assertNotNull(axiom(file, "m.List/Cons/head_height"));
	}

	@Test
	public void noHeightForUnrelatedFields() {
		// No obligation for fields which cannot lead back to the datatype
		LogicFile file = compile(context(INT_LIST_DT, POINT_XY));
		List<String> qids = qids(file);
		assertTrue(qids.contains("m.IntList/Cons/tail_height"));
		assertFalse(qids.contains("m.IntList/Cons/head_height"));
		assertEquals(1, axioms(file, AxiomShape.FIELD_HEIGHT).size());
	}

	@Test
	public void recursiveClosureFieldCredited() {
		// Closures returning the datatype are credited through the recursive field marker
		Context context = new Context.Builder(file(TREE_FN)).addClosureArity(1).build();
		LogicFile file = compile(context);
		String height = print(axiom(file, "m.Tree/Node/children_height"));
		assertTrue(height.contains("(height (fun_from_recursive_field (|Fn#1#box| (m.Tree/Node/children x))))"),
				height);
		assertFalse(qids(file).contains("m.Tree/Node/size_height"));
	}

	@Test
	public void closureOverForeignParameterNotCredited() {
		// A closure whose result mentions a parameter outside the datatype gets no credit
		Path opt = Path.of("m::Opt");
		Datatype d = new Datatype(opt, Collections.singletonList("T"),
				Arrays.asList(new Variant("None"), new Variant("Some", new Field("f",
						new Type.SpecFn(Collections.singletonList(Type.Int), T)))),
				Transparency.ALWAYS, false);
		Context context = new Context.Builder(file(d)).addClosureArity(1).build();
		String height = print(axiom(compile(context), "m.Opt/Some/f_height"));
		assertFalse(height.contains("fun_from_recursive_field"), height);
	}

	// ==============================================================================
	// Extensional equality
	// ==============================================================================

	@Test
	public void extEqualAvoidsRecursiveFields() {
		Context context = new Context.Builder(file(FN_LIST_DT)).addClosureArity(1).build();
		LogicFile file = compile(context);
		String eq = print(axiom(file, "m.FnList/Cons_ext_equal"));
		// Recursive fields use plain equality
		assertTrue(eq.contains("(= (m.FnList/Cons/tail (|m.FnList#unbox| x)) (m.FnList/Cons/tail (|m.FnList#unbox| y)))"), eq);
		assertTrue(eq.contains("(ext_eq deep (|Fn#1#Type| |Int#Type| |Int#Type|) "
				+ "(|Fn#1#box| (m.FnList/Cons/head (|m.FnList#unbox| x))) "
				+ "(|Fn#1#box| (m.FnList/Cons/head (|m.FnList#unbox| y))))"), eq);
		assertTrue(eq.contains("(is-m.FnList/Cons (|m.FnList#unbox| x))"), eq);
		assertTrue(eq.contains(":pattern ((ext_eq deep |m.FnList#Type| x y))"), eq);
		assertNotNull(axiom(file, "m.FnList/Nil_ext_equal"));
	}

	@Test
	public void singleVariantNeedsNoTester() {
		// Single variant datatypes need no variant test
		Datatype d = new Datatype(Path.of("m::Box"), Collections.emptyList(),
				Collections.singletonList(new Variant("Box", new Field("f",
						new Type.SpecFn(Collections.singletonList(Type.Int), Type.Int)))),
				Transparency.ALWAYS, true);
		Context context = new Context.Builder(file(d)).addClosureArity(1).build();
		String eq = print(axiom(compile(context), "m.Box/Box_ext_equal"));
		assertFalse(eq.contains("is-"), eq);
	}

	@Test
	public void noExtEqualUnlessRequested() {
		// Datatypes not compared extensionally get no axioms
		LogicFile file = compile(context(LIST_T, POINT_XY));
		assertTrue(axioms(file, AxiomShape.EXT_EQUAL).isEmpty());
	}

	@Test
	public void closureExtEqualPointwise() {
		Context context = new Context.Builder(file()).addClosureArity(1).build();
		String eq = print(axiom(compile(context), "Fn#1_ext_equal"));
		assertTrue(eq.contains(":qid |Fn#1_inner_ext_equal|"), eq);
		assertTrue(eq.contains("(ext_eq deep T%1& (|apply#1| (|Fn#1#unbox| x) a%0) (|apply#1| (|Fn#1#unbox| y) a%0))"),
				eq);
	}

	@Test
	public void genericExtEqualComparesParametersButNotRecursiveFields() {
		// List<T> compared extensionally: the T field defers to the element type, the tail does not recurse
		Datatype list = new Datatype(LIST, Collections.singletonList("T"), LIST_T.getVariants(),
				Transparency.ALWAYS, true);
		String eq = print(axiom(compile(context(list)), "m.List/Cons_ext_equal"));
		assertTrue(eq.startsWith("(forall ((T& Type) (deep Bool) (x Poly) (y Poly)) "), eq);
		assertTrue(eq.contains("(ext_eq deep T& (m.List/Cons/head (|m.List#unbox| x)) "
				+ "(m.List/Cons/head (|m.List#unbox| y)))"), eq);
		assertTrue(eq.contains("(= (m.List/Cons/tail (|m.List#unbox| x)) (m.List/Cons/tail (|m.List#unbox| y)))"), eq);
		assertFalse(eq.contains("(ext_eq deep (|m.List#Type| T&) (m.List/Cons/tail"), eq);
		assertTrue(eq.contains(":pattern ((ext_eq deep (|m.List#Type| T&) x y))"), eq);
	}

	// ==============================================================================
	// Closures
	// ==============================================================================

	@Test
	public void closureArityAxiomFamilies() {
		Context context = new Context.Builder(file()).addClosureArity(1).build();
		LogicFile file = compile(context);
		for (AxiomShape shape : Arrays.asList(AxiomShape.CLOSURE_CONSTRUCTOR, AxiomShape.CLOSURE_APPLY,
				AxiomShape.CLOSURE_HEIGHT)) {
			List<Decl.Axiom> axioms = axioms(file, shape);
			assertEquals(1, axioms.size(), shape.toString());
			assertTrue(qid(axioms.get(0)).startsWith("Fn#1_"));
		}
		assertTrue(declared(file).contains("apply#1"));
		assertTrue(declared(file).contains("Fn#1#Type"));
	}

	@Test
	public void closureApplyAxiom() {
		Context context = new Context.Builder(file()).addClosureArity(1).build();
		LogicFile file = compile(context);
		String apply = print(axiom(file, "Fn#1_apply"));
		assertEquals("(forall ((T%0& Type) (T%1& Type) (x Fun) (a%0 Poly)) (! (=> (and "
				+ "(has_type (|Fn#1#box| x) (|Fn#1#Type| T%0& T%1&)) (has_type a%0 T%0&)) "
				+ "(has_type (|apply#1| x a%0) T%1&)) "
				+ ":pattern ((|apply#1| x a%0) (has_type (|Fn#1#box| x) (|Fn#1#Type| T%0& T%1&))) "
				+ ":qid |Fn#1_apply| :skolemid |skolem_Fn#1_apply|))", apply);
		String height = print(axiom(file, "Fn#1_height_apply"));
		assertTrue(height.contains("(height_lt (height (|apply#1| x a%0)) "
				+ "(height (fun_from_recursive_field (|Fn#1#box| (mk_fun x)))))"), height);
	}

	@Test
	public void nullaryClosureHasNoInnerQuantifier() {
		// Closures of no arguments need no inner quantifier
		Context context = new Context.Builder(file()).addClosureArity(0).build();
		String constructor = print(axiom(compile(context), "Fn#0_constructor"));
		assertFalse(constructor.contains("constructor_inner"), constructor);
	}

	// ==============================================================================
	// Specialization
	// ==============================================================================

	@Test
	public void specializationsHaveDisjointNames() {
		Context context = new Context.Builder(file(PAIR_AB))
				.addSpecialization(PAIR, Specialization.of(INT, MonoType.Bool))
				.addSpecialization(PAIR, Specialization.of(MonoType.Bool, INT)).build();
		LogicFile file = compile(context);
		List<String> declared = declared(file);
		assertEquals(new HashSet<>(declared).size(), declared.size());
		assertTrue(declared.contains("m.Pair<int,bool>"));
		assertTrue(declared.contains("m.Pair<bool,int>"));
		assertTrue(declared.contains("m.Pair<int,bool>/Pair/fst"));
		assertTrue(declared.contains("m.Pair<bool,int>/Pair/fst"));
		assertTrue(declared.contains("m.Pair<int,bool>#Type"));
		for (String name : declared) {
			assertFalse(name.endsWith("#box") || name.endsWith("#unbox"), name);
			assertFalse(name.equals("m.Pair"), name);
		}
		// Nothing but field bridges
		for (Decl.Axiom a : axioms(file)) {
			assertEquals(AxiomShape.ACCESSOR_BRIDGE, a.getAttribute(AxiomShape.class));
		}
	}

	@Test
	public void specializationsAreUnboxed() {
		Context context = new Context.Builder(file(PAIR_AB))
				.addSpecialization(PAIR, Specialization.of(INT, MonoType.Bool)).build();
		LogicFile file = compile(context);
		for (Decl d : file.getDeclarations()) {
			if (d instanceof Decl.Datatypes) {
				Decl.Constructor c = ((Decl.Datatypes) d).getDatatypes().get(0).getConstructors().get(0);
				assertEquals(LogicFile.Type.Int, c.getFields().get(0).getType());
				assertEquals(LogicFile.Type.Bool, c.getFields().get(1).getType());
				return;
			}
		}
		fail("missing datatype declaration");
	}

	@Test
	public void partialSpecializationToken() {
		// Partially specialized encodings are identified over the remaining parameters
		Context context = new Context.Builder(file(PAIR_AB)).addSpecialization(PAIR, Specialization.of(INT, null))
				.build();
		LogicFile file = compile(context);
		assertTrue(LogicFilePrinter.toString(file).contains("(declare-fun |m.Pair<int,_>#Type| (Type) Type)"));
	}

	@Test
	public void specializationArityChecked() {
		assertThrows(InternalFailure.class, () -> new Context.Builder(file(PAIR_AB))
				.addSpecialization(PAIR, Specialization.of(INT)).build());
		assertThrows(InternalFailure.class, () -> new Context.Builder(file(PAIR_AB))
				.addSpecialization(LIST, Specialization.of(INT)).build());
		assertThrows(InternalFailure.class, () -> context(PAIR_AB, PAIR_AB));
	}

	@Test
	public void repeatedSpecializationsAreEncodedOnce() {
		Context context = new Context.Builder(file(PAIR_AB))
				.addSpecialization(PAIR, Specialization.of(INT, MonoType.Bool))
				.addSpecialization(PAIR, Specialization.of(INT, MonoType.Bool))
				.addSpecialization(PAIR, Specialization.GENERIC)
				.addSpecialization(PAIR, Specialization.of(null, null)).build();
		assertEquals(2, context.getSpecializations(PAIR).size());
		LogicFile file = compile(context);
		List<String> names = declared(file);
		assertEquals(new HashSet<>(names).size(), names.size(), names.toString());
		assertNull(new CommandStreamChecker().check(withPrelude(file)));
	}

	// ==============================================================================
	// Opaque types
	// ==============================================================================

	@Test
	public void opaqueInstantiations() {
		Context context = new Context.Builder(file(HIDDEN_T)).addMonoType(MonoType.Nominal(HIDDEN, INT)).build();
		LogicFile file = compile(context);
		List<String> declared = declared(file);
		assertTrue(declared.contains("m.Hidden#Type"));
		assertTrue(declared.contains("mono#m.Hidden<int>"));
		assertTrue(declared.contains("mono#m.Hidden<int>#box"));
		assertFalse(declared.contains("m.Hidden"));
		assertFalse(declared.contains("m.Hidden/Hidden/value"));
		assertNotNull(axiom(file, "mono#m.Hidden<int>_has_type_always"));
		assertTrue(print(axiom(file, "mono#m.Hidden<int>_unbox_axiom"))
				.contains("(has_type x (|m.Hidden#Type| |Int#Type|))"));
	}

	// ==============================================================================
	// Stream
	// ==============================================================================

	@Test
	public void streamIsWellOrdered() {
		LogicFile file = compile(everything());
		assertNull(new CommandStreamChecker().check(withPrelude(file)));
	}

	@Test
	public void commentaryHeadings() {
		LogicFile file = new DatatypeCompiler(everything()).setCommentary(true).compile();
		assertNull(new CommandStreamChecker().check(withPrelude(file)));
		String text = LogicFilePrinter.toString(file);
		assertTrue(text.contains(";; AXIOMS"));
		assertTrue(text.contains(";; closure/1"));
	}

	@Test
	public void encodingIsDeterministic() {
		// Encoding is deterministic, whether or not jobs run in parallel
		String first = LogicFilePrinter.toString(compile(everything()));
		String second = LogicFilePrinter.toString(compile(everything()));
		String parallel = LogicFilePrinter.toString(new DatatypeCompiler(everything()).setParallel(true).compile());
		assertEquals(first, second);
		assertEquals(first, parallel);
	}

	@Test
	public void sectionOrdering() {
		// Sorts, then datatypes, fields, tokens, boxes and finally axioms
		List<Decl> decls = compile(everything()).getDeclarations();
		int datatypes = -1;
		int firstAxiom = -1;
		int lastSort = -1;
		for (int i = 0; i != decls.size(); ++i) {
			Decl d = decls.get(i);
			if (d instanceof Decl.Sort) {
				lastSort = i;
			} else if (d instanceof Decl.Datatypes) {
				assertEquals(-1, datatypes, "only one datatype group");
				datatypes = i;
			} else if (d instanceof Decl.Axiom && firstAxiom < 0) {
				firstAxiom = i;
			}
		}
		assertTrue(lastSort < datatypes);
		assertTrue(datatypes < firstAxiom);
		assertTrue(decls.get(decls.size() - 1) instanceof Decl.Axiom);
	}

	@Test
	public void builtInExtensionsWhenUsed() {
		List<String> declared = declared(compile(everything()));
		assertTrue(declared.contains("fndef#m.f#Type"));
		assertTrue(declared.contains(Prelude.ARRAY_INDEX));
		assertTrue(declared.contains(Prelude.STRSLICE_LEN));
		assertTrue(declared.contains("array#box"));
	}

	@Test
	public void builtInExtensionsOnlyWhenUsed() {
		// Built-in extensions are only included when used
		List<String> declared = declared(compile(context(POINT_XY)));
		assertFalse(declared.contains(Prelude.ARRAY_INDEX));
		assertFalse(declared.contains(Prelude.STRSLICE_LEN));
	}

	@Test
	public void heightOnNonDatatypeFails() {
		// Requesting height axioms for anything but a datatype is an internal failure
		Encoding enc = new Encoding.Builder(new EncodedKind.FnSpec(1), Naming.closure(1), LogicFile.SORT("Fun"))
				.setAddHeight(true).build();
		HeightAxioms heights = new HeightAxioms(new TypeTranslator(context()));
		assertThrows(InternalFailure.class, () -> heights.encode(enc, new Commands()));
	}

	@Test
	public void variantsOnClosureFail() {
		Encoding enc = new Encoding.Builder(new EncodedKind.FnSpec(1), Naming.closure(1), LogicFile.SORT("Fun"))
				.setVariants(POINT_XY.getVariants()).setAddExtEqual(true).build();
		ExtEqualAxioms eqs = new ExtEqualAxioms(new TypeTranslator(context()));
		assertThrows(InternalFailure.class, () -> eqs.encode(enc, new Commands()));
	}

	@Test
	public void specializedEncodingHasNoBoxedForm() {
		Specialization s = Specialization.of(INT, MonoType.Bool);
		String path = Naming.datatype(PAIR, s);
		Encoding enc = new Encoding.Builder(new EncodedKind.Dt(PAIR_AB), path, LogicFile.SORT(path))
				.setSpecialization(s).setVariants(PAIR_AB.getVariants()).setDeclareBox(true).build();
		assertFalse(enc.declaresBox());
		assertThrows(InternalFailure.class, () -> enc.box(LogicFile.VAR("x")));
		assertThrows(InternalFailure.class, () -> enc.unbox(LogicFile.VAR("x")));
	}
}
