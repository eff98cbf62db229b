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
import java.util.List;

import dtlogic.lang.DatatypeFile.IntRange;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;

/**
 * A fully concrete type, as used to instantiate the type parameters of a datatype or to name an instantiation of an
 * opaque type. Every monotype has a deterministic textual mangle which is used when building identifiers.
 *
 * @author David J. Pearce
 *
 */
public abstract class MonoType {

	private MonoType() {
	}

	/**
	 * Get a deterministic name for this monotype. Distinct monotypes always have distinct mangles.
	 *
	 * @return
	 */
	public abstract String getMangle();

	/**
	 * Convert this monotype back into an ordinary type.
	 *
	 * @return
	 */
	public abstract Type toType();

	public static final MonoType Bool = new Bool();

	public static MonoType Int(IntRange range) {
		return new Int(range);
	}

	public static MonoType Nominal(Path name, MonoType... arguments) {
		return new Nominal(name, Arrays.asList(arguments));
	}

	public static MonoType Primitive(Type.PrimitiveKind kind, MonoType... arguments) {
		return new Primitive(kind, Arrays.asList(arguments));
	}

	/**
	 * Attempt to convert a type into a monotype. This fails (returning <code>null</code>) when the type is not fully
	 * concrete, for example because it mentions a type parameter.
	 *
	 * @param type
	 * @return
	 */
	public static MonoType from(Type type) {
		if (type instanceof Type.Decorate) {
			return from(((Type.Decorate) type).getOperand());
		} else if (type instanceof Type.Bool) {
			return Bool;
		} else if (type instanceof Type.Int) {
			return new Int(((Type.Int) type).getRange());
		} else if (type instanceof Type.Nominal) {
			Type.Nominal t = (Type.Nominal) type;
			List<MonoType> args = from(t.getArguments());
			return args == null ? null : new Nominal(t.getName(), args);
		} else if (type instanceof Type.Primitive) {
			Type.Primitive t = (Type.Primitive) type;
			List<MonoType> args = from(t.getArguments());
			return args == null ? null : new Primitive(t.getKind(), args);
		} else {
			return null;
		}
	}

	private static List<MonoType> from(List<Type> types) {
		ArrayList<MonoType> result = new ArrayList<>();
		for (Type t : types) {
			MonoType m = from(t);
			if (m == null) {
				return null;
			}
			result.add(m);
		}
		return result;
	}

	@Override
	public String toString() {
		return getMangle();
	}

	public static final class Bool extends MonoType {
		private Bool() {
		}

		@Override
		public String getMangle() {
			return "bool";
		}

		@Override
		public Type toType() {
			return Type.Bool;
		}
	}

	public static final class Int extends MonoType {
		private final IntRange range;

		private Int(IntRange range) {
			this.range = range;
		}

		public IntRange getRange() {
			return range;
		}

		@Override
		public String getMangle() {
			return range.toString();
		}

		@Override
		public Type toType() {
			return new Type.Int(range);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Int && ((Int) o).range.equals(range);
		}

		@Override
		public int hashCode() {
			return range.hashCode();
		}
	}

	public static final class Nominal extends MonoType {
		private final Path name;
		private final List<MonoType> arguments;

		private Nominal(Path name, List<MonoType> arguments) {
			this.name = name;
			this.arguments = new ArrayList<>(arguments);
		}

		public Path getName() {
			return name;
		}

		public List<MonoType> getArguments() {
			return arguments;
		}

		@Override
		public String getMangle() {
			return mangle(String.join(".", name.getSegments()), arguments);
		}

		@Override
		public Type toType() {
			return new Type.Nominal(name, toTypes(arguments));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Nominal) {
				Nominal n = (Nominal) o;
				return n.name.equals(name) && n.arguments.equals(arguments);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ arguments.hashCode();
		}
	}

	public static final class Primitive extends MonoType {
		private final Type.PrimitiveKind kind;
		private final List<MonoType> arguments;

		private Primitive(Type.PrimitiveKind kind, List<MonoType> arguments) {
			this.kind = kind;
			this.arguments = new ArrayList<>(arguments);
		}

		public Type.PrimitiveKind getKind() {
			return kind;
		}

		public List<MonoType> getArguments() {
			return arguments;
		}

		@Override
		public String getMangle() {
			return mangle(kind.getName(), arguments);
		}

		@Override
		public Type toType() {
			return new Type.Primitive(kind, toTypes(arguments));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Primitive) {
				Primitive p = (Primitive) o;
				return p.kind == kind && p.arguments.equals(arguments);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ arguments.hashCode();
		}
	}

	private static String mangle(String head, List<MonoType> arguments) {
		if (arguments.isEmpty()) {
			return head;
		}
		ArrayList<String> items = new ArrayList<>();
		for (MonoType m : arguments) {
			items.add(m.getMangle());
		}
		return head + "<" + String.join(",", items) + ">";
	}

	private static List<Type> toTypes(List<MonoType> arguments) {
		ArrayList<Type> types = new ArrayList<>();
		for (MonoType m : arguments) {
			types.add(m.toType());
		}
		return types;
	}
}
