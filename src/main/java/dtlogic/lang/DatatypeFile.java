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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The typed datatype declarations handed over by the front end for one verification run. This is the only input the
 * encoder reads about the program being verified: every declaration here is already name-resolved, and every type is
 * already simplified (e.g. anonymous closures have been replaced by <code>SpecFn</code> types).
 *
 * @author David J. Pearce
 *
 */
public class DatatypeFile {
	/**
	 * The module on whose behalf the encoding is being produced. This determines which datatypes are transparent.
	 */
	private final Path module;

	/**
	 * The list of datatype declarations, in the order produced by the front end.
	 */
	private final List<Datatype> datatypes;

	public DatatypeFile(Path module) {
		this(module, Collections.emptyList());
	}

	public DatatypeFile(Path module, List<Datatype> datatypes) {
		if (module == null) {
			throw new IllegalArgumentException("invalid module");
		}
		this.module = module;
		this.datatypes = new ArrayList<>(datatypes);
	}

	public Path getModule() {
		return module;
	}

	public List<Datatype> getDatatypes() {
		return datatypes;
	}

	// =========================================================================
	// Paths
	// =========================================================================

	/**
	 * A globally unique, fully qualified name such as <code>lib::list::List</code>.
	 */
	public static final class Path {
		/**
		 * Characters reserved as separators in generated identifiers, or not permitted within a quoted symbol.
		 */
		private static final String RESERVED = "./#<>,|\\:";

		private final List<String> segments;

		public Path(String... segments) {
			this(Arrays.asList(segments));
		}

		public Path(List<String> segments) {
			if (segments.isEmpty()) {
				throw new IllegalArgumentException("empty path");
			}
			for (String s : segments) {
				if (s == null || s.isEmpty()) {
					throw new IllegalArgumentException("invalid path segment");
				}
				for (int i = 0; i != s.length(); ++i) {
					if (RESERVED.indexOf(s.charAt(i)) >= 0) {
						throw new IllegalArgumentException("invalid character in path segment \"" + s + "\"");
					}
				}
			}
			this.segments = new ArrayList<>(segments);
		}

		/**
		 * Parse a path written with <code>::</code> separators.
		 *
		 * @param text
		 * @return
		 */
		public static Path of(String text) {
			return new Path(text.split("::"));
		}

		public List<String> getSegments() {
			return Collections.unmodifiableList(segments);
		}

		public String last() {
			return segments.get(segments.size() - 1);
		}

		/**
		 * Check whether this path is equal to, or encloses, another path.
		 *
		 * @param other
		 * @return
		 */
		public boolean isPrefixOf(Path other) {
			if (segments.size() > other.segments.size()) {
				return false;
			}
			return other.segments.subList(0, segments.size()).equals(segments);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Path && ((Path) o).segments.equals(segments);
		}

		@Override
		public int hashCode() {
			return segments.hashCode();
		}

		@Override
		public String toString() {
			return String.join("::", segments);
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public enum Mode {
		EXEC, GHOST, SPEC
	}

	/**
	 * Determines whether the structure of a datatype is visible from a given module. An opaque datatype is still
	 * encoded, but only through its type identifier and its concrete (monomorphised) instantiations.
	 */
	public static final class Transparency {
		public static final Transparency NEVER = new Transparency(false, null);
		public static final Transparency ALWAYS = new Transparency(true, null);

		private final boolean visible;
		private final Path restrictedTo;

		private Transparency(boolean visible, Path restrictedTo) {
			this.visible = visible;
			this.restrictedTo = restrictedTo;
		}

		/**
		 * Construct a transparency which is visible only from within a given module (and its submodules).
		 *
		 * @param restrictedTo
		 * @return
		 */
		public static Transparency whenVisible(Path restrictedTo) {
			if (restrictedTo == null) {
				return ALWAYS;
			}
			return new Transparency(true, restrictedTo);
		}

		public boolean isVisibleTo(Path module) {
			if (!visible) {
				return false;
			} else if (restrictedTo == null) {
				return true;
			} else {
				return restrictedTo.isPrefixOf(module);
			}
		}

		@Override
		public String toString() {
			return !visible ? "never" : restrictedTo == null ? "always" : ("visible(" + restrictedTo + ")");
		}
	}

	public static class Datatype {
		private final Path name;
		private final List<String> typeParameters;
		private final List<Variant> variants;
		private final Transparency transparency;
		private final boolean extEqual;

		public Datatype(Path name, List<String> typeParameters, List<Variant> variants, Transparency transparency,
				boolean extEqual) {
			if (name == null) {
				throw new IllegalArgumentException("invalid name");
			} else if (transparency == null) {
				throw new IllegalArgumentException("invalid transparency");
			}
			this.name = name;
			this.typeParameters = new ArrayList<>(typeParameters);
			this.variants = new ArrayList<>(variants);
			this.transparency = transparency;
			this.extEqual = extEqual;
		}

		public Path getName() {
			return name;
		}

		public List<String> getTypeParameters() {
			return typeParameters;
		}

		public List<Variant> getVariants() {
			return variants;
		}

		public Transparency getTransparency() {
			return transparency;
		}

		/**
		 * Check whether values of this type must be compared using extensional (rather than plain) equality.
		 *
		 * @return
		 */
		public boolean isExtEqual() {
			return extEqual;
		}

		/**
		 * Get the type of this datatype applied to its own type parameters.
		 *
		 * @return
		 */
		public Type.Nominal getSelfType() {
			ArrayList<Type> args = new ArrayList<>();
			for (String p : typeParameters) {
				args.add(new Type.Variable(p));
			}
			return new Type.Nominal(name, args);
		}

		@Override
		public String toString() {
			return name + "<" + String.join(",", typeParameters) + ">" + variants;
		}
	}

	public static class Variant {
		private final String name;
		private final List<Field> fields;

		public Variant(String name, Field... fields) {
			this(name, Arrays.asList(fields));
		}

		public Variant(String name, List<Field> fields) {
			if (name == null) {
				throw new IllegalArgumentException("invalid variant name");
			}
			this.name = name;
			this.fields = new ArrayList<>(fields);
		}

		public String getName() {
			return name;
		}

		public List<Field> getFields() {
			return fields;
		}

		@Override
		public String toString() {
			return name + fields;
		}
	}

	public static class Field {
		private final String name;
		private final Type type;
		private final Mode mode;

		public Field(String name, Type type) {
			this(name, type, Mode.EXEC);
		}

		public Field(String name, Type type, Mode mode) {
			if (name == null) {
				throw new IllegalArgumentException("invalid field name");
			} else if (type == null) {
				throw new IllegalArgumentException("invalid field type");
			}
			this.name = name;
			this.type = type;
			this.mode = mode;
		}

		/**
		 * Construct a positional field (e.g. of a tuple-like variant).
		 *
		 * @param position
		 * @param type
		 * @return
		 */
		public static Field positional(int position, Type type) {
			return new Field(Integer.toString(position), type);
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public Mode getMode() {
			return mode;
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int(IntRange.INT);
		public static final Type Nat = new Int(IntRange.NAT);
		public static final Type TypeId = new TypeId();
		public static final Type Poly = new Poly();

		/**
		 * Get the types immediately nested within this type.
		 *
		 * @return
		 */
		public List<Type> getOperands();

		public static final class Bool extends AbstractType {
			private Bool() {
			}

			@Override
			public String toString() {
				return "bool";
			}
		}

		public static final class Int extends AbstractType {
			private final IntRange range;

			public Int(IntRange range) {
				this.range = range;
			}

			public IntRange getRange() {
				return range;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int && ((Int) o).range.equals(range);
			}

			@Override
			public int hashCode() {
				return range.hashCode();
			}

			@Override
			public String toString() {
				return range.toString();
			}
		}

		/**
		 * A named datatype applied to zero or more type arguments.
		 */
		public static final class Nominal extends AbstractType {
			private final Path name;
			private final List<Type> arguments;

			public Nominal(Path name, Type... arguments) {
				this(name, Arrays.asList(arguments));
			}

			public Nominal(Path name, List<Type> arguments) {
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public Path getName() {
				return name;
			}

			public List<Type> getArguments() {
				return arguments;
			}

			@Override
			public List<Type> getOperands() {
				return arguments;
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

			@Override
			public String toString() {
				return arguments.isEmpty() ? name.toString() : (name + "<" + join(arguments) + ">");
			}
		}

		/**
		 * A type parameter of the enclosing declaration.
		 */
		public static final class Variable extends AbstractType {
			private final String name;

			public Variable(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A specification function value taking a fixed number of arguments.
		 */
		public static final class SpecFn extends AbstractType {
			private final List<Type> parameters;
			private final Type returns;

			public SpecFn(List<Type> parameters, Type returns) {
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
			}

			public List<Type> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			@Override
			public List<Type> getOperands() {
				ArrayList<Type> operands = new ArrayList<>(parameters);
				operands.add(returns);
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof SpecFn) {
					SpecFn f = (SpecFn) o;
					return f.parameters.equals(parameters) && f.returns.equals(returns);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return parameters.hashCode() ^ returns.hashCode();
			}

			@Override
			public String toString() {
				return "spec_fn(" + join(parameters) + ")->" + returns;
			}
		}

		/**
		 * A closure type which should have been eliminated before encoding.
		 */
		public static final class AnonymousClosure extends AbstractType {
			private final List<Type> parameters;
			private final Type returns;
			private final int id;

			public AnonymousClosure(List<Type> parameters, Type returns, int id) {
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.id = id;
			}

			@Override
			public List<Type> getOperands() {
				ArrayList<Type> operands = new ArrayList<>(parameters);
				operands.add(returns);
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof AnonymousClosure && ((AnonymousClosure) o).id == id;
			}

			@Override
			public int hashCode() {
				return id;
			}

			@Override
			public String toString() {
				return "closure#" + id;
			}
		}

		public enum Decoration {
			REF, MUT_REF, BOX, RC, ARC, GHOST, TRACKED, NEVER
		}

		/**
		 * A type wrapped in a decoration which has no bearing on its logical representation.
		 */
		public static final class Decorate extends AbstractType {
			private final Decoration decoration;
			private final Type operand;

			public Decorate(Decoration decoration, Type operand) {
				this.decoration = decoration;
				this.operand = operand;
			}

			public Decoration getDecoration() {
				return decoration;
			}

			public Type getOperand() {
				return operand;
			}

			@Override
			public List<Type> getOperands() {
				return Collections.singletonList(operand);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Decorate) {
					Decorate d = (Decorate) o;
					return d.decoration == decoration && d.operand.equals(operand);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return decoration.hashCode() ^ operand.hashCode();
			}

			@Override
			public String toString() {
				return decoration.name().toLowerCase() + " " + operand;
			}
		}

		/**
		 * A type whose values are held in their boxed (polymorphic) representation.
		 */
		public static final class Boxed extends AbstractType {
			private final Type operand;

			public Boxed(Type operand) {
				this.operand = operand;
			}

			public Type getOperand() {
				return operand;
			}

			@Override
			public List<Type> getOperands() {
				return Collections.singletonList(operand);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boxed && ((Boxed) o).operand.equals(operand);
			}

			@Override
			public int hashCode() {
				return 31 * operand.hashCode();
			}

			@Override
			public String toString() {
				return "box(" + operand + ")";
			}
		}

		/**
		 * An associated type projection, such as <code>&lt;T as Iterator&gt;::Item</code>.
		 */
		public static final class Projection extends AbstractType {
			private final Path trait;
			private final String name;
			private final List<Type> arguments;

			public Projection(Path trait, String name, List<Type> arguments) {
				this.trait = trait;
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public Path getTrait() {
				return trait;
			}

			public String getName() {
				return name;
			}

			public List<Type> getArguments() {
				return arguments;
			}

			@Override
			public List<Type> getOperands() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Projection) {
					Projection p = (Projection) o;
					return p.trait.equals(trait) && p.name.equals(name) && p.arguments.equals(arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return trait.hashCode() ^ name.hashCode() ^ arguments.hashCode();
			}

			@Override
			public String toString() {
				return "<" + join(arguments) + " as " + trait + ">::" + name;
			}
		}

		public static final class TypeId extends AbstractType {
			private TypeId() {
			}

			@Override
			public String toString() {
				return "type_id";
			}
		}

		public static final class ConstInt extends AbstractType {
			private final BigInteger value;

			public ConstInt(BigInteger value) {
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof ConstInt && ((ConstInt) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public enum PrimitiveKind {
			ARRAY("array"), SLICE("slice"), STRSLICE("strslice"), PTR("ptr"), GLOBAL("global");

			private final String name;

			PrimitiveKind(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		public static final class Primitive extends AbstractType {
			private final PrimitiveKind kind;
			private final List<Type> arguments;

			public Primitive(PrimitiveKind kind, Type... arguments) {
				this(kind, Arrays.asList(arguments));
			}

			public Primitive(PrimitiveKind kind, List<Type> arguments) {
				this.kind = kind;
				this.arguments = new ArrayList<>(arguments);
			}

			public PrimitiveKind getKind() {
				return kind;
			}

			public List<Type> getArguments() {
				return arguments;
			}

			@Override
			public List<Type> getOperands() {
				return arguments;
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

			@Override
			public String toString() {
				return arguments.isEmpty() ? kind.getName() : (kind.getName() + "<" + join(arguments) + ">");
			}
		}

		/**
		 * The (zero-sized) type identifying a particular function, used when a function is passed as a value.
		 */
		public static final class FnDef extends AbstractType {
			private final Path function;
			private final List<Type> arguments;

			public FnDef(Path function, List<Type> arguments) {
				this.function = function;
				this.arguments = new ArrayList<>(arguments);
			}

			public Path getFunction() {
				return function;
			}

			public List<Type> getArguments() {
				return arguments;
			}

			@Override
			public List<Type> getOperands() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FnDef) {
					FnDef f = (FnDef) o;
					return f.function.equals(function) && f.arguments.equals(arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return function.hashCode() ^ arguments.hashCode();
			}

			@Override
			public String toString() {
				return "fn " + function;
			}
		}

		public static final class Poly extends AbstractType {
			private Poly() {
			}

			@Override
			public String toString() {
				return "poly";
			}
		}

		/**
		 * A type given directly by the name of a logic sort.
		 */
		public static final class Air extends AbstractType {
			private final String sort;

			public Air(String sort) {
				this.sort = sort;
			}

			public String getSort() {
				return sort;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Air && ((Air) o).sort.equals(sort);
			}

			@Override
			public int hashCode() {
				return sort.hashCode();
			}

			@Override
			public String toString() {
				return "air(" + sort + ")";
			}
		}
	}

	/**
	 * The range of values admitted by an integer type.
	 */
	public static final class IntRange {
		public static final IntRange INT = new IntRange(Kind.INT, 0);
		public static final IntRange NAT = new IntRange(Kind.NAT, 0);

		public enum Kind {
			INT, NAT, UNSIGNED, SIGNED
		}

		private final Kind kind;
		private final int bits;

		private IntRange(Kind kind, int bits) {
			this.kind = kind;
			this.bits = bits;
		}

		public static IntRange unsigned(int bits) {
			return new IntRange(Kind.UNSIGNED, bits);
		}

		public static IntRange signed(int bits) {
			return new IntRange(Kind.SIGNED, bits);
		}

		public Kind getKind() {
			return kind;
		}

		public int getBits() {
			return bits;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof IntRange) {
				IntRange r = (IntRange) o;
				return r.kind == kind && r.bits == bits;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, bits);
		}

		@Override
		public String toString() {
			switch (kind) {
			case INT:
				return "int";
			case NAT:
				return "nat";
			case UNSIGNED:
				return "u" + bits;
			default:
				return "i" + bits;
			}
		}
	}

	/**
	 * Types without operands compare by identity, which suffices as each is a singleton.
	 */
	private static abstract class AbstractType implements Type {
		@Override
		public List<Type> getOperands() {
			return Collections.emptyList();
		}
	}

	private static String join(List<Type> types) {
		ArrayList<String> items = new ArrayList<>();
		for (Type t : types) {
			items.add(t.toString());
		}
		return String.join(",", items);
	}
}
