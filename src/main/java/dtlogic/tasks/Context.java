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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import dtlogic.lang.DatatypeFile;
import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.lang.MonoType;
import dtlogic.lang.RecursionGraph;
import dtlogic.lang.Specialization;
import dtlogic.util.InternalFailure;

/**
 * Everything the encoder knows about the program being verified, gathered once before encoding begins. A context is
 * immutable and is passed explicitly to every part of the encoder, so encodings of different datatypes can safely
 * proceed in parallel.
 *
 * @author David J. Pearce
 *
 */
public final class Context {
	public static final Path DEFAULT_MAP_PATH = Path.of("vstd::map::Map");

	private final Path module;
	private final Map<Path, Datatype> datatypes;
	private final RecursionGraph graph;
	private final Map<Path, List<Specialization>> specializations;
	private final SortedSet<Integer> closureArities;
	private final Set<MonoType> monoTypes;
	private final Map<Path, Integer> fnDefs;
	private final boolean usesArray;
	private final Path mapPath;
	private final Set<Path> datatypesWithInvariant;

	private Context(Builder builder) {
		this.module = builder.file.getModule();
		this.datatypes = new LinkedHashMap<>();
		for (Datatype d : builder.file.getDatatypes()) {
			if (datatypes.put(d.getName(), d) != null) {
				throw new InternalFailure("duplicate datatype " + d.getName());
			}
		}
		this.graph = builder.graph != null ? builder.graph : RecursionGraph.of(datatypes.values());
		this.specializations = new HashMap<>();
		for (Map.Entry<Path, Set<Specialization>> e : builder.specializations.entrySet()) {
			Datatype d = datatypes.get(e.getKey());
			if (d == null) {
				throw new InternalFailure("specialization of unknown datatype " + e.getKey());
			}
			for (Specialization s : e.getValue()) {
				if (!s.isEmpty() && s.size() != d.getTypeParameters().size()) {
					throw new InternalFailure("specialization " + s + " has wrong arity for " + d.getName());
				}
			}
			specializations.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
		}
		this.closureArities = Collections.unmodifiableSortedSet(new TreeSet<>(builder.closureArities));
		this.monoTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.monoTypes));
		this.fnDefs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fnDefs));
		this.usesArray = builder.usesArray;
		this.mapPath = builder.mapPath;
		this.datatypesWithInvariant = Collections.unmodifiableSet(computeDatatypesWithInvariant());
	}

	public Path getModule() {
		return module;
	}

	public Iterable<Datatype> getDatatypes() {
		return datatypes.values();
	}

	/**
	 * Get the datatype declaration for a given path.
	 *
	 * @param path
	 * @return
	 * @throws InternalFailure
	 *             if no such datatype exists.
	 */
	public Datatype getDatatype(Path path) {
		Datatype d = datatypes.get(path);
		if (d == null) {
			throw new InternalFailure("unknown datatype " + path);
		}
		return d;
	}

	public RecursionGraph getRecursionGraph() {
		return graph;
	}

	/**
	 * Get the distinct specializations required for a datatype, in the order they were first added. An empty list
	 * means only the generic encoding is required.
	 *
	 * @param path
	 * @return
	 */
	public List<Specialization> getSpecializations(Path path) {
		return specializations.getOrDefault(path, Collections.emptyList());
	}

	/**
	 * Find the concrete specialization exactly matching a given instantiation of a datatype, if there is one.
	 *
	 * @param type
	 * @return
	 */
	public Specialization findSpecialization(Type.Nominal type) {
		for (Specialization s : getSpecializations(type.getName())) {
			if (s.matches(type.getArguments())) {
				return s;
			}
		}
		return null;
	}

	public SortedSet<Integer> getClosureArities() {
		return closureArities;
	}

	public Set<MonoType> getMonoTypes() {
		return monoTypes;
	}

	/**
	 * Get the functions whose identities are used as values, mapped to their number of type parameters.
	 *
	 * @return
	 */
	public Map<Path, Integer> getFnDefs() {
		return fnDefs;
	}

	public boolean usesArray() {
		return usesArray;
	}

	public Path getMapPath() {
		return mapPath;
	}

	/**
	 * Check whether the structure of a datatype is visible from the module being verified.
	 *
	 * @param datatype
	 * @return
	 */
	public boolean isTransparent(Datatype datatype) {
		return datatype.getTransparency().isVisibleTo(module);
	}

	/**
	 * Check whether membership of a datatype depends on invariants of its fields, rather than holding of every value.
	 *
	 * @param path
	 * @return
	 */
	public boolean hasInvariant(Path path) {
		return datatypesWithInvariant.contains(path);
	}

	public boolean inSameScc(Path a, Path b) {
		return graph.inSameScc(a, b);
	}

	/**
	 * Determine the datatypes with invariants as a least fixpoint, since whether a datatype has an invariant depends on
	 * whether the datatypes mentioned by its fields do.
	 *
	 * @return
	 */
	private Set<Path> computeDatatypesWithInvariant() {
		HashSet<Path> result = new HashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Datatype d : datatypes.values()) {
				if (!result.contains(d.getName()) && isTransparent(d) && hasRefinedField(d, result)) {
					result.add(d.getName());
					changed = true;
				}
			}
		}
		return result;
	}

	private static boolean hasRefinedField(Datatype d, Set<Path> withInvariant) {
		for (Variant v : d.getVariants()) {
			for (Field f : v.getFields()) {
				if (isRefined(f.getType(), withInvariant)) {
					return true;
				}
			}
		}
		return false;
	}

	private static boolean isRefined(Type type, Set<Path> withInvariant) {
		if (type instanceof Type.Decorate) {
			return isRefined(((Type.Decorate) type).getOperand(), withInvariant);
		} else if (type instanceof Type.Int) {
			return !((Type.Int) type).getRange().equals(DatatypeFile.IntRange.INT);
		} else if (type instanceof Type.Nominal) {
			return withInvariant.contains(((Type.Nominal) type).getName());
		} else if (type instanceof Type.Primitive) {
			Type.PrimitiveKind k = ((Type.Primitive) type).getKind();
			return k == Type.PrimitiveKind.ARRAY || k == Type.PrimitiveKind.SLICE;
		} else {
			return type instanceof Type.Variable || type instanceof Type.Boxed || type instanceof Type.Projection
					|| type instanceof Type.SpecFn;
		}
	}

	/**
	 * Gathers the inputs to an encoding run.
	 */
	public static final class Builder {
		private final DatatypeFile file;
		private RecursionGraph graph;
		private final Map<Path, Set<Specialization>> specializations = new LinkedHashMap<>();
		private final Set<Integer> closureArities = new TreeSet<>();
		private final Set<MonoType> monoTypes = new LinkedHashSet<>();
		private final Map<Path, Integer> fnDefs = new LinkedHashMap<>();
		private boolean usesArray;
		private Path mapPath = DEFAULT_MAP_PATH;

		public Builder(DatatypeFile file) {
			if (file == null) {
				throw new IllegalArgumentException("invalid datatype file");
			}
			this.file = file;
		}

		/**
		 * Use a precomputed recursion graph, rather than building one from the datatype declarations.
		 *
		 * @param graph
		 * @return
		 */
		public Builder setRecursionGraph(RecursionGraph graph) {
			this.graph = graph;
			return this;
		}

		public Builder addSpecialization(Path datatype, Specialization specialization) {
			specializations.computeIfAbsent(datatype, k -> new LinkedHashSet<>()).add(specialization);
			return this;
		}

		public Builder addClosureArity(int arity) {
			if (arity < 0) {
				throw new IllegalArgumentException("invalid closure arity");
			}
			closureArities.add(arity);
			return this;
		}

		public Builder addMonoType(MonoType type) {
			monoTypes.add(type);
			return this;
		}

		public Builder addFnDef(Path function, int typeParameters) {
			fnDefs.put(function, typeParameters);
			return this;
		}

		public Builder setUsesArray(boolean flag) {
			this.usesArray = flag;
			return this;
		}

		public Builder setMapPath(Path path) {
			this.mapPath = path;
			return this;
		}

		public Context build() {
			return new Context(this);
		}
	}
}
