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
import java.util.Collections;
import java.util.List;

import dtlogic.lang.DatatypeFile.Type;

/**
 * Records which type parameters of a datatype are replaced by concrete types. There is one entry per type parameter,
 * where a <code>null</code> entry means the parameter is kept generic. A specialization in which every parameter is
 * kept generic is <i>empty</i> and denotes the ordinary boxed encoding.
 *
 * @author David J. Pearce
 *
 */
public final class Specialization {
	public static final Specialization GENERIC = new Specialization(Collections.emptyList());

	private final List<MonoType> entries;

	private Specialization(List<MonoType> entries) {
		this.entries = entries;
	}

	/**
	 * Construct a specialization, where <code>null</code> entries mark type parameters which are kept generic.
	 *
	 * @param entries
	 * @return
	 */
	public static Specialization of(MonoType... entries) {
		return of(Arrays.asList(entries));
	}

	public static Specialization of(List<MonoType> entries) {
		// Normalise so that all-generic specialisations compare equal to GENERIC
		for (MonoType m : entries) {
			if (m != null) {
				return new Specialization(new ArrayList<>(entries));
			}
		}
		return GENERIC;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Get the concrete type for the ith parameter, or <code>null</code> if that parameter is kept generic.
	 *
	 * @param i
	 * @return
	 */
	public MonoType get(int i) {
		return i < entries.size() ? entries.get(i) : null;
	}

	/**
	 * Check whether every parameter is replaced by a concrete type.
	 *
	 * @return
	 */
	public boolean isConcrete() {
		if (entries.isEmpty()) {
			return false;
		}
		for (MonoType m : entries) {
			if (m == null) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Check whether this specialization matches a given list of type arguments exactly.
	 *
	 * @param arguments
	 * @return
	 */
	public boolean matches(List<Type> arguments) {
		if (!isConcrete() || arguments.size() != entries.size()) {
			return false;
		}
		for (int i = 0; i != entries.size(); ++i) {
			if (!entries.get(i).equals(MonoType.from(arguments.get(i)))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Extend a base name with the mangle of this specialization. The empty specialization leaves the name unchanged.
	 *
	 * @param name
	 * @return
	 */
	public String mangle(String name) {
		if (entries.isEmpty()) {
			return name;
		}
		ArrayList<String> items = new ArrayList<>();
		for (MonoType m : entries) {
			items.add(m == null ? "_" : m.getMangle());
		}
		return name + "<" + String.join(",", items) + ">";
	}

	/**
	 * Determine those parameters which are kept generic by this specialization.
	 *
	 * @param parameters
	 * @return
	 */
	public List<String> keptParameters(List<String> parameters) {
		ArrayList<String> kept = new ArrayList<>();
		for (int i = 0; i != parameters.size(); ++i) {
			if (get(i) == null) {
				kept.add(parameters.get(i));
			}
		}
		return kept;
	}

	/**
	 * Replace occurrences of specialised type parameters in a given type with their concrete types.
	 *
	 * @param parameters
	 * @param type
	 * @return
	 */
	public Type substitute(List<String> parameters, Type type) {
		if (entries.isEmpty()) {
			return type;
		} else if (type instanceof Type.Variable) {
			int index = parameters.indexOf(((Type.Variable) type).getName());
			MonoType m = index < 0 ? null : get(index);
			return m == null ? type : m.toType();
		} else if (type instanceof Type.Nominal) {
			Type.Nominal t = (Type.Nominal) type;
			return new Type.Nominal(t.getName(), substitute(parameters, t.getArguments()));
		} else if (type instanceof Type.SpecFn) {
			Type.SpecFn t = (Type.SpecFn) type;
			return new Type.SpecFn(substitute(parameters, t.getParameters()), substitute(parameters, t.getReturns()));
		} else if (type instanceof Type.Decorate) {
			Type.Decorate t = (Type.Decorate) type;
			return new Type.Decorate(t.getDecoration(), substitute(parameters, t.getOperand()));
		} else if (type instanceof Type.Boxed) {
			return new Type.Boxed(substitute(parameters, ((Type.Boxed) type).getOperand()));
		} else if (type instanceof Type.Projection) {
			Type.Projection t = (Type.Projection) type;
			return new Type.Projection(t.getTrait(), t.getName(), substitute(parameters, t.getArguments()));
		} else if (type instanceof Type.Primitive) {
			Type.Primitive t = (Type.Primitive) type;
			return new Type.Primitive(t.getKind(), substitute(parameters, t.getArguments()));
		} else if (type instanceof Type.FnDef) {
			Type.FnDef t = (Type.FnDef) type;
			return new Type.FnDef(t.getFunction(), substitute(parameters, t.getArguments()));
		} else {
			return type;
		}
	}

	private List<Type> substitute(List<String> parameters, List<Type> types) {
		ArrayList<Type> result = new ArrayList<>();
		for (Type t : types) {
			result.add(substitute(parameters, t));
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Specialization && ((Specialization) o).entries.equals(entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return mangle("");
	}
}
