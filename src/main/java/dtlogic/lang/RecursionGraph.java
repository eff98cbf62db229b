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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;

/**
 * The type recursion graph, stored as an arena of datatype paths indexed by position. Each node has a precomputed
 * strongly-connected-component identifier. Two datatypes are in the same component exactly when each can reach the
 * other through the types of their fields.
 *
 * @author David J. Pearce
 *
 */
public final class RecursionGraph {
	private final Map<Path, Integer> index;
	private final int[] components;

	/**
	 * Construct a graph from nodes and edges given by node index.
	 *
	 * @param nodes
	 *            Datatype paths, one per node.
	 * @param edges
	 *            For each node, the indices of the nodes it references.
	 */
	public RecursionGraph(List<Path> nodes, List<int[]> edges) {
		if (nodes.size() != edges.size()) {
			throw new IllegalArgumentException("invalid edge list");
		}
		this.index = new HashMap<>();
		for (int i = 0; i != nodes.size(); ++i) {
			index.put(nodes.get(i), i);
		}
		this.components = new Tarjan(edges).run();
	}

	/**
	 * Build the recursion graph for a given set of datatypes, where there is an edge from one datatype to another if
	 * some field of the first mentions the second.
	 *
	 * @param datatypes
	 * @return
	 */
	public static RecursionGraph of(Collection<Datatype> datatypes) {
		ArrayList<Path> nodes = new ArrayList<>();
		HashMap<Path, Integer> lookup = new HashMap<>();
		for (Datatype d : datatypes) {
			lookup.put(d.getName(), nodes.size());
			nodes.add(d.getName());
		}
		ArrayList<int[]> edges = new ArrayList<>();
		for (Datatype d : datatypes) {
			BitSet targets = new BitSet();
			for (Variant v : d.getVariants()) {
				for (Field f : v.getFields()) {
					collect(f.getType(), lookup, targets);
				}
			}
			edges.add(targets.stream().toArray());
		}
		return new RecursionGraph(nodes, edges);
	}

	private static void collect(Type type, Map<Path, Integer> lookup, BitSet targets) {
		if (type instanceof Type.Nominal) {
			Integer target = lookup.get(((Type.Nominal) type).getName());
			if (target != null) {
				targets.set(target);
			}
		}
		for (Type child : type.getOperands()) {
			collect(child, lookup, targets);
		}
	}

	public int size() {
		return components.length;
	}

	/**
	 * Get the component identifier for a given datatype, or <code>-1</code> if it is not part of this graph.
	 *
	 * @param path
	 * @return
	 */
	public int getComponent(Path path) {
		Integer i = index.get(path);
		return i == null ? -1 : components[i];
	}

	/**
	 * Check whether two datatypes lie in the same strongly connected component. Every datatype is in the same
	 * component as itself.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public boolean inSameScc(Path a, Path b) {
		if (a.equals(b)) {
			return true;
		}
		int ca = getComponent(a);
		return ca >= 0 && ca == getComponent(b);
	}

	/**
	 * Tarjan's strongly connected components algorithm.
	 */
	private static final class Tarjan {
		private final List<int[]> edges;
		private final int[] order;
		private final int[] lowlink;
		private final int[] component;
		private final boolean[] onStack;
		private final int[] stack;
		private int sp = 0;
		private int counter = 0;
		private int components = 0;

		public Tarjan(List<int[]> edges) {
			int n = edges.size();
			this.edges = edges;
			this.order = new int[n];
			this.lowlink = new int[n];
			this.component = new int[n];
			this.onStack = new boolean[n];
			this.stack = new int[n];
			Arrays.fill(order, -1);
		}

		public int[] run() {
			for (int i = 0; i != order.length; ++i) {
				if (order[i] < 0) {
					visit(i);
				}
			}
			return component;
		}

		private void visit(int v) {
			order[v] = lowlink[v] = counter++;
			stack[sp++] = v;
			onStack[v] = true;
			for (int w : edges.get(v)) {
				if (order[w] < 0) {
					visit(w);
					lowlink[v] = Math.min(lowlink[v], lowlink[w]);
				} else if (onStack[w]) {
					lowlink[v] = Math.min(lowlink[v], order[w]);
				}
			}
			if (lowlink[v] == order[v]) {
				int w;
				do {
					w = stack[--sp];
					onStack[w] = false;
					component[w] = components;
				} while (w != v);
				components = components + 1;
			}
		}
	}
}
