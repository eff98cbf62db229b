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

import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.MonoType;
import dtlogic.lang.Specialization;

/**
 * Responsible for constructing every identifier which appears in the generated stream. Identifiers are built from
 * datatype paths, variant names and field names using separators (<code>.</code>, <code>/</code>, <code>#</code>,
 * <code>&lt;...&gt;</code>) which cannot occur within those names. Hence, distinct declarations always receive distinct
 * identifiers, and the same declaration always receives the same identifier.
 *
 * @author David J. Pearce
 *
 */
public final class Naming {
	// Sorts of the base theory
	public static final String POLY = "Poly";
	public static final String TYPE = "Type";
	public static final String FUN = "Fun";
	public static final String HEIGHT_SORT = "Height";
	public static final String FNDEF = "FnDef";
	// Functions of the base theory
	public static final String HAS_TYPE = "has_type";
	public static final String HEIGHT = "height";
	public static final String HEIGHT_LT = "height_lt";
	public static final String HEIGHT_REC_FUN = "fun_from_recursive_field";
	public static final String EXT_EQ = "ext_eq";
	public static final String MK_FUN = "mk_fun";
	public static final String U_INV = "uInv";
	public static final String I_INV = "iInv";
	// Encoded paths of built-in types
	public static final String INT = "Int";
	public static final String BOOL = "Bool";
	public static final String NAT = "Nat";
	public static final String UINT = "UInt";
	public static final String SINT = "SInt";
	public static final String CONST_INT = "const_int";
	// Fixed variable names
	public static final String X = "x";
	public static final String Y = "y";
	public static final String DEEP = "deep";

	private Naming() {
	}

	/**
	 * Get the identifier for a datatype path, with segments separated by <code>.</code>.
	 *
	 * @param path
	 * @return
	 */
	public static String toIdent(Path path) {
		return String.join(".", path.getSegments());
	}

	/**
	 * Get the encoded path (and sort name) of a datatype under a given specialization.
	 *
	 * @param path
	 * @param specialization
	 * @return
	 */
	public static String datatype(Path path, Specialization specialization) {
		return specialization.mangle(toIdent(path));
	}

	/**
	 * Get the encoded path of the closure family for a given arity.
	 *
	 * @param arity
	 * @return
	 */
	public static String closure(int arity) {
		return "Fn#" + arity;
	}

	/**
	 * Get the encoded path (and sort name) of an opaque instantiation.
	 *
	 * @param type
	 * @return
	 */
	public static String monotype(MonoType type) {
		return "mono#" + type.getMangle();
	}

	public static String box(String path) {
		return path + "#box";
	}

	public static String unbox(String path) {
		return path + "#unbox";
	}

	public static String typeId(String path) {
		return path + "#Type";
	}

	/**
	 * Get the encoded path of a function whose identity is used as a value.
	 *
	 * @param function
	 * @return
	 */
	public static String fnDef(Path function) {
		return "fndef#" + toIdent(function);
	}

	public static String fnDefTypeId(Path function) {
		return typeId(fnDef(function));
	}

	public static String constructor(String path, String variant) {
		return path + "/" + variant;
	}

	public static String isVariant(String path, String variant) {
		return "is-" + constructor(path, variant);
	}

	/**
	 * Get the name of the wrapper function through which a field is always accessed.
	 *
	 * @param path
	 * @param variant
	 * @param field
	 * @return
	 */
	public static String field(String path, String variant, String field) {
		return path + "/" + variant + "/" + field;
	}

	/**
	 * Get the name of the datatype selector for a field. This is only mentioned by the datatype declaration and the
	 * bridging axiom for the field wrapper.
	 *
	 * @param path
	 * @param variant
	 * @param field
	 * @return
	 */
	public static String fieldInternal(String path, String variant, String field) {
		return path + "/" + variant + "/?" + field;
	}

	public static String apply(int arity) {
		return "apply#" + arity;
	}

	/**
	 * Get the name of the variable holding the type identifier for a type parameter.
	 *
	 * @param parameter
	 * @return
	 */
	public static String typeParameter(String parameter) {
		return parameter + "&";
	}

	public static String closureTypeParameter(int i) {
		return "T%" + i;
	}

	public static String closureArgument(int i) {
		return "a%" + i;
	}

	public static String fieldVariable(String field) {
		return "_" + field;
	}

	public static String qid(String prefix, String suffix) {
		return prefix + "_" + suffix;
	}
}
