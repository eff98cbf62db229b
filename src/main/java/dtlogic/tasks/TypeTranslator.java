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
import java.util.List;
import java.util.function.Predicate;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.IntRange;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.MonoType;
import dtlogic.lang.Specialization;
import dtlogic.util.InternalFailure;

/**
 * Translates program types into their logical counterparts: the sort used to represent values of the type, the term
 * identifying the type at runtime, the functions used to box and unbox values, and the invariant which values of the
 * type must satisfy.
 *
 * @author David J. Pearce
 *
 */
public class TypeTranslator {
    private final Context context;

    public TypeTranslator(Context context) {
        this.context = context;
    }

    public Context getContext() {
        return context;
    }

    // ==============================================================================
    // Sorts
    // ==============================================================================

    /**
     * Determine the sort used to represent values of a given type.
     *
     * @param type
     * @return
     */
    public LogicFile.Type toSort(Type type) {
        if (type instanceof Type.Decorate) {
            return toSort(((Type.Decorate) type).getOperand());
        } else if (type instanceof Type.Bool) {
            return LogicFile.Type.Bool;
        } else if (type instanceof Type.Int) {
            return LogicFile.Type.Int;
        } else if (type instanceof Type.Nominal) {
            String path = encodedPath((Type.Nominal) type);
            return SORT(path == null ? Naming.POLY : path);
        } else if (type instanceof Type.Variable || type instanceof Type.Boxed || type instanceof Type.Projection
                || type instanceof Type.Poly) {
            return SORT(Naming.POLY);
        } else if (type instanceof Type.SpecFn) {
            return SORT(Naming.FUN);
        } else if (type instanceof Type.Primitive) {
            Type.Primitive t = (Type.Primitive) type;
            if (t.getKind() == Type.PrimitiveKind.ARRAY) {
                return SORT(Naming.FUN);
            }
            String path = monotypePath(t);
            return SORT(path == null ? Naming.POLY : path);
        } else if (type instanceof Type.FnDef) {
            return SORT(Naming.FNDEF);
        } else {
            throw new InternalFailure("type " + type + " has no sort");
        }
    }

    /**
     * Determine the encoded path for a datatype reference, or <code>null</code> if values of the type are only held
     * boxed. A transparent datatype uses the specialization which exactly matches its arguments (if any) and, otherwise,
     * its generic encoding. An opaque datatype uses its registered concrete instantiation (if any).
     *
     * @param type
     * @return
     */
    public String encodedPath(Type.Nominal type) {
        Datatype d = context.getDatatype(type.getName());
        if (context.isTransparent(d)) {
            Specialization s = context.findSpecialization(type);
            return Naming.datatype(type.getName(), s == null ? Specialization.GENERIC : s);
        } else {
            return monotypePath(type);
        }
    }

    /**
     * Check whether a datatype reference resolves to a specialized encoding, whose values are never boxed.
     *
     * @param type
     * @return
     */
    public boolean isSpecialized(Type.Nominal type) {
        Datatype d = context.getDatatype(type.getName());
        return context.isTransparent(d) && context.findSpecialization(type) != null;
    }

    private String monotypePath(Type type) {
        MonoType m = MonoType.from(type);
        if (m != null && context.getMonoTypes().contains(m)) {
            return Naming.monotype(m);
        }
        return null;
    }

    // ==============================================================================
    // Type Identifiers
    // ==============================================================================

    /**
     * Construct the term which identifies a given type. Type parameters are identified by variables bound in the
     * enclosing quantifier.
     *
     * @param type
     * @return
     */
    public Expr typeId(Type type) {
        if (type instanceof Type.Decorate) {
            return typeId(((Type.Decorate) type).getOperand());
        } else if (type instanceof Type.Boxed) {
            return typeId(((Type.Boxed) type).getOperand());
        } else if (type instanceof Type.Bool) {
            return INVOKE(Naming.typeId(Naming.BOOL));
        } else if (type instanceof Type.Int) {
            return typeId(((Type.Int) type).getRange());
        } else if (type instanceof Type.Nominal) {
            Type.Nominal t = (Type.Nominal) type;
            if (isSpecialized(t)) {
                // Fully concrete, hence no remaining type arguments
                return INVOKE(Naming.typeId(encodedPath(t)));
            }
            return INVOKE(Naming.typeId(Naming.toIdent(t.getName())), typeIds(t.getArguments()));
        } else if (type instanceof Type.Variable) {
            return VAR(Naming.typeParameter(((Type.Variable) type).getName()));
        } else if (type instanceof Type.SpecFn) {
            Type.SpecFn t = (Type.SpecFn) type;
            List<Expr> ids = typeIds(t.getParameters());
            ids.add(typeId(t.getReturns()));
            return INVOKE(Naming.typeId(Naming.closure(t.getParameters().size())), ids);
        } else if (type instanceof Type.Primitive) {
            Type.Primitive t = (Type.Primitive) type;
            return INVOKE(Naming.typeId(t.getKind().getName()), typeIds(t.getArguments()));
        } else if (type instanceof Type.Projection) {
            Type.Projection t = (Type.Projection) type;
            String name = "proj#" + Naming.toIdent(t.getTrait()) + "/" + t.getName();
            return INVOKE(name, typeIds(t.getArguments()));
        } else if (type instanceof Type.FnDef) {
            Type.FnDef t = (Type.FnDef) type;
            return INVOKE(Naming.fnDefTypeId(t.getFunction()), typeIds(t.getArguments()));
        } else if (type instanceof Type.ConstInt) {
            return INVOKE(Naming.typeId(Naming.CONST_INT), CONST(((Type.ConstInt) type).getValue()));
        } else {
            throw new InternalFailure("type " + type + " has no type identifier");
        }
    }

    public List<Expr> typeIds(List<Type> types) {
        ArrayList<Expr> ids = new ArrayList<>();
        for (Type t : types) {
            ids.add(typeId(t));
        }
        return ids;
    }

    private static Expr typeId(IntRange range) {
        switch (range.getKind()) {
            case INT:
                return INVOKE(Naming.typeId(Naming.INT));
            case NAT:
                return INVOKE(Naming.typeId(Naming.NAT));
            case UNSIGNED:
                return INVOKE(Naming.typeId(Naming.UINT), CONST(range.getBits()));
            default:
                return INVOKE(Naming.typeId(Naming.SINT), CONST(range.getBits()));
        }
    }

    // ==============================================================================
    // Boxing
    // ==============================================================================

    /**
     * Determine the name of the function which boxes values of a given type, or <code>null</code> if values of the
     * type are already held boxed.
     *
     * @param type
     * @return
     * @throws InternalFailure
     *             if values of this type cannot be boxed.
     */
    public String boxPath(Type type) {
        if (type instanceof Type.Decorate) {
            return boxPath(((Type.Decorate) type).getOperand());
        } else if (type instanceof Type.Bool) {
            return Naming.BOOL;
        } else if (type instanceof Type.Int) {
            return Naming.INT;
        } else if (type instanceof Type.Nominal) {
            Type.Nominal t = (Type.Nominal) type;
            if (isSpecialized(t)) {
                throw new InternalFailure("specialized datatype " + t + " has no boxed form");
            }
            return encodedPath(t);
        } else if (type instanceof Type.SpecFn) {
            return Naming.closure(((Type.SpecFn) type).getParameters().size());
        } else if (type instanceof Type.Primitive) {
            Type.Primitive t = (Type.Primitive) type;
            return t.getKind() == Type.PrimitiveKind.ARRAY ? t.getKind().getName() : monotypePath(t);
        } else if (type instanceof Type.FnDef) {
            return Naming.FNDEF;
        } else if (type instanceof Type.Variable || type instanceof Type.Boxed || type instanceof Type.Projection
                || type instanceof Type.Poly) {
            return null;
        } else {
            throw new InternalFailure("type " + type + " has no boxed form");
        }
    }

    /**
     * Box a given expression of a given type into a <code>Poly</code> as necessary.
     *
     * @param type The type the expression is being boxed from.
     * @param expr The expression being boxed.
     * @return
     */
    public Expr box(Type type, Expr expr) {
        String path = boxPath(type);
        return path == null ? expr : coerce(expr, Naming.unbox(path), Naming.box(path));
    }

    /**
     * Apply a coercion, eliminating it where it would immediately undo a coercion in the opposite direction.
     *
     * @param e
     * @param from
     * @param to
     * @return
     */
    static Expr coerce(Expr e, String from, String to) {
        if (e instanceof Expr.Invoke) {
            Expr.Invoke i = (Expr.Invoke) e;
            if (i.getName().equals(from)) {
                return i.getArguments().get(0);
            }
        }
        return INVOKE(to, e, e.getAttributes());
    }

    // ==============================================================================
    // Invariants
    // ==============================================================================

    /**
     * Construct the invariant which any value of the given type must satisfy, or <code>null</code> if there is no such
     * invariant.
     *
     * @param type
     * @param expr
     * @return
     */
    public Expr.Logical typeInvariant(Type type, Expr expr) {
        if (type instanceof Type.Decorate) {
            return typeInvariant(((Type.Decorate) type).getOperand(), expr);
        } else if (type instanceof Type.Int) {
            IntRange range = ((Type.Int) type).getRange();
            switch (range.getKind()) {
                case INT:
                    return null;
                case NAT:
                    return GTEQ(expr, CONST(0));
                case UNSIGNED:
                    return INVOKE(Naming.U_INV, CONST(range.getBits()), expr);
                default:
                    return INVOKE(Naming.I_INV, CONST(range.getBits()), expr);
            }
        } else if (type instanceof Type.Nominal) {
            Type.Nominal t = (Type.Nominal) type;
            if (isSpecialized(t) || !context.hasInvariant(t.getName())) {
                return null;
            }
            return hasType(box(t, expr), typeId(t));
        } else if (type instanceof Type.Variable || type instanceof Type.Boxed || type instanceof Type.Projection) {
            return hasType(expr, typeId(type));
        } else if (type instanceof Type.SpecFn) {
            return hasType(box(type, expr), typeId(type));
        } else if (type instanceof Type.Primitive) {
            Type.PrimitiveKind k = ((Type.Primitive) type).getKind();
            if (k == Type.PrimitiveKind.ARRAY || k == Type.PrimitiveKind.SLICE) {
                return hasType(box(type, expr), typeId(type));
            }
            return null;
        } else if (type instanceof Type.Bool || type instanceof Type.ConstInt || type instanceof Type.FnDef
                || type instanceof Type.Poly) {
            return null;
        } else {
            throw new InternalFailure("type " + type + " has no invariant");
        }
    }

    public static Expr.Invoke hasType(Expr value, Expr typeId) {
        return INVOKE(Naming.HAS_TYPE, value, typeId);
    }

    // ==============================================================================
    // Equality
    // ==============================================================================

    /**
     * Check whether values of a given type must be compared with extensional equality, rather than plain equality.
     *
     * @param type
     * @return
     */
    public boolean usesExtEqual(Type type) {
        if (type instanceof Type.Decorate) {
            return usesExtEqual(((Type.Decorate) type).getOperand());
        } else if (type instanceof Type.Boxed) {
            return usesExtEqual(((Type.Boxed) type).getOperand());
        } else if (type instanceof Type.Bool || type instanceof Type.Int || type instanceof Type.ConstInt
                || type instanceof Type.FnDef || type instanceof Type.Poly) {
            return false;
        } else if (type instanceof Type.SpecFn || type instanceof Type.Variable || type instanceof Type.Projection) {
            return true;
        } else if (type instanceof Type.Nominal) {
            Type.Nominal t = (Type.Nominal) type;
            // Specialized values are compared structurally
            return !isSpecialized(t) && context.getDatatype(t.getName()).isExtEqual();
        } else if (type instanceof Type.Primitive) {
            Type.PrimitiveKind k = ((Type.Primitive) type).getKind();
            return k == Type.PrimitiveKind.ARRAY || k == Type.PrimitiveKind.SLICE;
        } else {
            throw new InternalFailure("type " + type + " has no notion of equality");
        }
    }

    // ==============================================================================
    // Helpers
    // ==============================================================================

    /**
     * Check whether a type mentions a datatype in the same recursion component as a given datatype.
     *
     * @param type
     * @param container
     * @return
     */
    public boolean isRecursive(Type type, Path container) {
        return mentions(type, t -> t instanceof Type.Nominal
                && context.inSameScc(((Type.Nominal) t).getName(), container));
    }

    /**
     * Check whether a type, or any type nested within it, satisfies a given predicate.
     *
     * @param type
     * @param predicate
     * @return
     */
    public static boolean mentions(Type type, Predicate<Type> predicate) {
        if (predicate.test(type)) {
            return true;
        }
        for (Type child : type.getOperands()) {
            if (mentions(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static Type undecorate(Type type) {
        while (type instanceof Type.Decorate) {
            type = ((Type.Decorate) type).getOperand();
        }
        return type;
    }
}
