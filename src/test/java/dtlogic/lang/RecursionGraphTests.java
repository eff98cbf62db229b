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
package dtlogic.lang;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Transparency;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;

public class RecursionGraphTests {
	private static final Path A = Path.of("m::A");
	private static final Path B = Path.of("m::B");
	private static final Path C = Path.of("m::C");

	@Test
	public void componentsFromExplicitEdges() {
		RecursionGraph g = new RecursionGraph(Arrays.asList(A, B, C),
				Arrays.asList(new int[] { 1 }, new int[] { 0 }, new int[] { 0 }));
		assertEquals(3, g.size());
		assertEquals(g.getComponent(A), g.getComponent(B));
		assertNotEquals(g.getComponent(A), g.getComponent(C));
		assertTrue(g.inSameScc(A, B));
		assertFalse(g.inSameScc(A, C));
		assertTrue(g.inSameScc(C, C));
	}

	@Test
	public void unknownPathHasNoComponent() {
		RecursionGraph g = new RecursionGraph(Collections.singletonList(A),
				Collections.singletonList(new int[0]));
		assertEquals(-1, g.getComponent(B));
		assertFalse(g.inSameScc(A, B));
	}

	@Test
	public void edgeListMustMatchNodes() {
		assertThrows(IllegalArgumentException.class,
				() -> new RecursionGraph(Arrays.asList(A, B), Collections.singletonList(new int[0])));
	}

	@Test
	public void mutualRecursionFromDatatypes() {
		// Tree and Forest are mutually recursive, Leaf is not part of the cycle
		Path tree = Path.of("m::Tree");
		Path forest = Path.of("m::Forest");
		Path leaf = Path.of("m::Leaf");
		Datatype t = new Datatype(tree, Collections.emptyList(),
				Arrays.asList(new Variant("Node", new Field("leaf", new Type.Nominal(leaf)),
						new Field("children", new Type.Nominal(forest)))),
				Transparency.ALWAYS, false);
		Datatype f = new Datatype(forest, Collections.emptyList(),
				Arrays.asList(new Variant("Nil"), new Variant("Cons", new Field("head", new Type.Nominal(tree)),
						new Field("tail", new Type.Nominal(forest)))),
				Transparency.ALWAYS, false);
		Datatype l = new Datatype(leaf, Collections.emptyList(),
				Arrays.asList(new Variant("Leaf", new Field("value", Type.Int))), Transparency.ALWAYS, false);
		RecursionGraph g = RecursionGraph.of(Arrays.asList(t, f, l));
		assertTrue(g.inSameScc(tree, forest));
		assertFalse(g.inSameScc(tree, leaf));
		assertFalse(g.inSameScc(forest, leaf));
	}
}
