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

import static dtlogic.core.LogicFile.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;

public class LogicFilePrinterTests {

	private static Stream<Arguments> symbols() {
		return Stream.of(
				Arguments.of("x", "x"),
				Arguments.of("has_type", "has_type"),
				Arguments.of("m.List/Cons/?tail", "m.List/Cons/?tail"),
				Arguments.of("T&", "T&"),
				Arguments.of("Fn#1", "|Fn#1|"),
				Arguments.of("m.Pair<int,bool>", "|m.Pair<int,bool>|"),
				Arguments.of("0x", "|0x|"));
	}

	@ParameterizedTest
	@MethodSource("symbols")
	public void quotesOnlyWhenNeeded(String name, String expected) {
		assertEquals(expected, LogicFilePrinter.symbol(name));
	}

	@Test
	public void rejectsUnquotableSymbol() {
		assertThrows(IllegalArgumentException.class, () -> LogicFilePrinter.symbol("a|b"));
	}

	@Test
	public void quantifierWithPatternAndQid() {
		Decl.Parameter x = new Decl.Parameter("x", SORT("Poly"));
		Expr trigger = INVOKE("f", VAR("x"));
		Expr.Logical q = FORALL(Arrays.asList(x), Arrays.asList(trigger), "f_q",
				EQ(trigger, VAR("x")));
		assertEquals("(forall ((x Poly)) (! (= (f x) x) :pattern ((f x)) :qid f_q :skolemid skolem_f_q))",
				LogicFilePrinter.toString(q));
	}

	@Test
	public void negativeIntegers() {
		Decl.Parameter x = new Decl.Parameter("x", Type.Int);
		Expr.Logical q = FORALL(Arrays.asList(x), GTEQ(VAR("x"), CONST(-1)));
		assertEquals("(forall ((x Int)) (>= x (- 1)))", LogicFilePrinter.toString(q));
	}

	@Test
	public void applyAndQuotedInvocations() {
		Expr e = APPLY("apply#1", VAR("f"), Collections.singletonList(VAR("a")));
		assertEquals("(|apply#1| f a)", LogicFilePrinter.toString(e));
		assertEquals("|Bool#Type|", LogicFilePrinter.toString(INVOKE("Bool#Type")));
	}

	@Test
	public void writesFullFile() {
		Decl.Datatype list = new Decl.Datatype("L", Arrays.asList(
				new Decl.Constructor("L/Nil", Collections.emptyList()),
				new Decl.Constructor("L/Cons", Arrays.asList(new Decl.Parameter("L/Cons/?head", Type.Int),
						new Decl.Parameter("L/Cons/?tail", SORT("L"))))));
		LogicFile file = new LogicFile(Arrays.asList(new Decl.Sort("Poly"), null, new Decl.LineComment("hello"),
				new Decl.Datatypes(Collections.singletonList(list)), FUNCTION("f", Type.Int, Type.Bool),
				new Decl.Constant("c", SORT("Poly")), AXIOM(INVOKE("f", CONST(1)))));
		String text = LogicFilePrinter.toString(file);
		String[] lines = text.split("\\R");
		assertEquals("(declare-sort Poly 0)", lines[0]);
		assertEquals("", lines[1]);
		assertEquals(";; hello", lines[2]);
		assertEquals("(declare-datatypes ((L 0)) (", lines[3]);
		assertEquals("  ((L/Nil) (L/Cons (L/Cons/?head Int) (L/Cons/?tail L)))", lines[4]);
		assertEquals("))", lines[5]);
		assertEquals("(declare-fun f (Int) Bool)", lines[6]);
		assertEquals("(declare-const c Poly)", lines[7]);
		assertEquals("(assert (f 1))", lines[8]);
	}

	@Test
	public void writesNegatedCheck() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		new LogicFilePrinter(out).writeCheck(INVOKE("p"));
		String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
		assertArrayEquals(new String[] { "(push)", "(assert (not p))", "(check-sat)", "(pop)" }, lines);
	}
}
