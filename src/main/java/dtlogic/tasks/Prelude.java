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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.core.LogicFile.Type;

/**
 * The base theory on which every generated stream relies, along with the extensions for built-in types which are
 * only included when those types are used.
 *
 * @author David J. Pearce
 *
 */
public final class Prelude {
    private static final Type POLY = SORT(Naming.POLY);
    private static final Type TYPE = SORT(Naming.TYPE);
    private static final Type FUN = SORT(Naming.FUN);
    private static final Type HEIGHT = SORT(Naming.HEIGHT_SORT);
    private static final Type FNDEF = SORT(Naming.FNDEF);

    public static final String ARRAY_NEW = "array#new";
    public static final String ARRAY_INDEX = "array#index";
    public static final String STRSLICE_LEN = "strslice#len";
    public static final String STRSLICE_GET_CHAR = "strslice#get_char";
    public static final String STRSLICE_NEW_STRLIT = "strslice#new_strlit";

    private Prelude() {
    }

    /**
     * Construct the declarations of the base theory.
     *
     * @return
     */
    public static List<Decl> basis() {
        ArrayList<Decl> decls = new ArrayList<>();
        for (String sort : Arrays.asList(Naming.POLY, Naming.TYPE, Naming.FUN, Naming.HEIGHT_SORT, Naming.FNDEF)) {
            decls.add(new Decl.Sort(sort));
        }
        decls.add(FUNCTION(Naming.HAS_TYPE, POLY, TYPE, Type.Bool));
        decls.add(FUNCTION(Naming.HEIGHT, POLY, HEIGHT));
        decls.add(FUNCTION(Naming.HEIGHT_LT, HEIGHT, HEIGHT, Type.Bool));
        decls.add(FUNCTION(Naming.HEIGHT_REC_FUN, POLY, POLY));
        decls.add(FUNCTION(Naming.EXT_EQ, Arrays.asList(Type.Bool, TYPE, POLY, POLY), Type.Bool));
        decls.add(FUNCTION(Naming.MK_FUN, FUN, FUN));
        // Boxing of primitives
        decls.addAll(boxing(Naming.INT, Type.Int));
        decls.addAll(boxing(Naming.BOOL, Type.Bool));
        decls.addAll(boxing(Naming.FNDEF, FNDEF));
        // Integer ranges
        decls.add(FUNCTION(Naming.U_INV, Type.Int, Type.Int, Type.Bool));
        decls.add(FUNCTION(Naming.I_INV, Type.Int, Type.Int, Type.Bool));
        // Type identifiers of primitives
        decls.add(new Decl.Constant(Naming.typeId(Naming.BOOL), TYPE));
        decls.add(new Decl.Constant(Naming.typeId(Naming.INT), TYPE));
        decls.add(new Decl.Constant(Naming.typeId(Naming.NAT), TYPE));
        decls.add(FUNCTION(Naming.typeId(Naming.UINT), Type.Int, TYPE));
        decls.add(FUNCTION(Naming.typeId(Naming.SINT), Type.Int, TYPE));
        decls.add(FUNCTION(Naming.typeId("array"), TYPE, TYPE, TYPE));
        decls.add(FUNCTION(Naming.typeId("slice"), TYPE, TYPE));
        decls.add(new Decl.Constant(Naming.typeId("strslice"), TYPE));
        decls.add(FUNCTION(Naming.typeId("ptr"), TYPE, TYPE));
        decls.add(FUNCTION(Naming.typeId("global"), TYPE, TYPE));
        decls.add(FUNCTION(Naming.typeId(Naming.CONST_INT), Type.Int, TYPE));
        return decls;
    }

    private static List<Decl> boxing(String path, Type sort) {
        return Arrays.asList(FUNCTION(Naming.box(path), sort, POLY), FUNCTION(Naming.unbox(path), POLY, sort));
    }

    /**
     * Construct the functions for creating and indexing arrays, which are needed only when arrays are used.
     *
     * @param box
     *            Name of the function boxing array values.
     * @return
     */
    public static List<Decl> arrayFunctions(String box) {
        Expr t = VAR(Naming.typeParameter("T"));
        Expr n = VAR(Naming.typeParameter("N"));
        Expr len = VAR("len");
        Expr fn = VAR("fn");
        Expr i = VAR("i");
        Expr arrayType = INVOKE(Naming.typeId("array"), t, n);
        Decl.Parameter tParam = new Decl.Parameter(Naming.typeParameter("T"), TYPE);
        Decl.Parameter nParam = new Decl.Parameter(Naming.typeParameter("N"), TYPE);
        Decl.Parameter fnParam = new Decl.Parameter("fn", FUN);
        ArrayList<Decl> decls = new ArrayList<>();
        decls.add(FUNCTION(ARRAY_NEW, Arrays.asList(TYPE, TYPE, Type.Int, FUN), POLY));
        decls.add(FUNCTION(ARRAY_INDEX, Arrays.asList(TYPE, TYPE, FUN, POLY), POLY));
        // A new array is a member of its array type
        Expr newArray = INVOKE(ARRAY_NEW, Arrays.asList(t, n, len, fn));
        decls.add(AXIOM(FORALL(Arrays.asList(tParam, nParam, new Decl.Parameter("len", Type.Int), fnParam),
                Collections.singletonList(newArray), "array_new_has_type",
                TypeTranslator.hasType(newArray, arrayType))));
        // Indexing an array yields a member of its element type
        Expr index = INVOKE(ARRAY_INDEX, Arrays.asList(t, n, fn, i));
        Expr.Logical member = TypeTranslator.hasType(INVOKE(box, fn), arrayType);
        decls.add(AXIOM(FORALL(Arrays.asList(tParam, nParam, fnParam, new Decl.Parameter("i", POLY)),
                Arrays.asList(index, member), "array_index_has_type",
                IMPLIES(member, TypeTranslator.hasType(index, t)))));
        return decls;
    }

    /**
     * Construct the functions over string slices, which are needed only when string slices are used.
     *
     * @param sort
     *            Name of the sort representing string slices.
     * @return
     */
    public static List<Decl> strSliceFunctions(String sort) {
        Type s = SORT(sort);
        Expr x = VAR(Naming.X);
        ArrayList<Decl> decls = new ArrayList<>();
        decls.add(FUNCTION(STRSLICE_LEN, s, Type.Int));
        decls.add(FUNCTION(STRSLICE_GET_CHAR, s, Type.Int, Type.Int));
        decls.add(FUNCTION(STRSLICE_NEW_STRLIT, Type.Int, s));
        Expr len = INVOKE(STRSLICE_LEN, x);
        decls.add(AXIOM(FORALL(Arrays.asList(new Decl.Parameter(Naming.X, s)), Collections.singletonList(len),
                "strslice_len_nonneg", GTEQ(len, CONST(0)))));
        return decls;
    }
}
