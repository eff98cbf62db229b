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

import static dtlogic.core.LogicFile.*;
import static dtlogic.tasks.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.tasks.TheoremProverBackend.Outcome;
import dtlogic.tasks.TheoremProverBackend.Submission;

public class ScriptBackendTests {

	@Test
	public void writesPreludeAndStream() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out);
		Submission s = backend.submit(new DatatypeCompiler(context(LIST_T, POINT_XY)).compile());
		assertTrue(s.isAccepted(), s.toString());
		assertNull(s.getReason());
		String script = out.toString(StandardCharsets.UTF_8);
		assertTrue(script.startsWith("(declare-sort Poly 0)"), script);
		assertTrue(script.contains("(declare-datatypes ((m.List 0) (m.Point 0))"), script);
	}

	@Test
	public void rejectsUseBeforeDeclaration() {
		// A stream using a symbol ahead of its declaration is rejected, and nothing is written
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out);
		LogicFile file = new LogicFile(Arrays.asList(AXIOM(INVOKE("f", CONST(1))), FUNCTION("f", Type.Int, Type.Bool)));
		Submission s = backend.submit(file);
		assertFalse(s.isAccepted());
		assertEquals("f used before declaration", s.getReason());
		assertEquals(0, out.size());
	}

	@Test
	public void assertionsAppendNegatedCheck() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out);
		assertThrows(IllegalStateException.class, () -> backend.proveAssertion(CONST(true)));
		backend.submit(new LogicFile());
		assertEquals(Outcome.UNKNOWN, backend.proveAssertion(INVOKE("has_type", VAR("x"), INVOKE("Int#Type"))));
		String script = out.toString(StandardCharsets.UTF_8);
		assertTrue(script.contains("(assert (not (has_type x |Int#Type|)))"), script);
		assertTrue(script.contains("(check-sat)"), script);
	}

	@Test
	public void preludeWrittenOnce() {
		// The base theory is only written once
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out);
		backend.submit(new LogicFile(Arrays.asList(new Decl.Sort("A"))));
		backend.submit(new LogicFile(Arrays.asList(new Decl.Sort("B"))));
		String script = out.toString(StandardCharsets.UTF_8);
		assertEquals(script.indexOf("(declare-sort Poly 0)"), script.lastIndexOf("(declare-sort Poly 0)"));
		assertTrue(script.contains("(declare-sort B 0)"));
	}

	@Test
	public void optionsDisablePreludeAndChecking() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out).setIncludePrelude(false).setCheckOrder(false);
		LogicFile file = new LogicFile(Arrays.asList(AXIOM(INVOKE("f", CONST(1))), FUNCTION("f", Type.Int, Type.Bool)));
		assertTrue(backend.submit(file).isAccepted());
		assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("(assert (f 1))"));
	}

	@Test
	public void invalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> new ScriptBackend(null));
		assertThrows(IllegalArgumentException.class, () -> Submission.rejected(null));
	}

	@Test
	public void rejectsRedeclarationAcrossSubmissions() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptBackend backend = new ScriptBackend(out);
		LogicFile file = new DatatypeCompiler(context(POINT_XY)).compile();
		assertTrue(backend.submit(file).isAccepted());
		int written = out.size();
		Submission again = backend.submit(file);
		assertFalse(again.isAccepted());
		assertEquals("duplicate declaration of m.Point", again.getReason());
		assertEquals(written, out.size());
		// Later submissions may still use what was declared before
		LogicFile next = new LogicFile(Arrays.asList(
				FUNCTION("origin", SORT("m.Point"), Type.Bool),
				AXIOM(INVOKE("origin", INVOKE("m.Point/Point", CONST(0), CONST(0))))));
		Submission s = backend.submit(next);
		assertTrue(s.isAccepted(), s.toString());
	}
}
