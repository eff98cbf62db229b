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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.tasks.Triggers.Term;
import dtlogic.tasks.Triggers.Terms;
import dtlogic.util.InternalFailure;

/**
 * Generates the axioms stating that a field of a datatype value is strictly lower in height than the value itself.
 * These are what justify termination of recursive definitions over the datatype. An axiom is only generated for a
 * field which could lead back to the enclosing datatype, i.e. one whose type mentions a datatype in the same recursion
 * component or a type parameter.
 *
 * @author David J. Pearce
 *
 */
public class HeightAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(HeightAxioms.class);

    private final Context context;
    private final TypeTranslator translator;

    public HeightAxioms(TypeTranslator translator) {
        this.context = translator.getContext();
        this.translator = translator;
    }

    public void encode(Encoding enc, Commands out) {
        if (!enc.addsHeight()) {
            return;
        }
        if (enc.getKind().getOpcode() != EncodedKind.KIND_datatype) {
            throw new InternalFailure("height axioms requested for " + enc.getKind());
        }
        DatatypeFile.Datatype datatype = ((EncodedKind.Dt) enc.getKind()).getDatatype();
        for (Variant v : enc.getVariants()) {
            for (Field f : v.getFields()) {
                Decl axiom = constructHeightAxiom(enc, datatype, v, f);
                if (axiom != null) {
                    out.getAxioms().add(axiom);
                }
            }
        }
    }

    private Decl constructHeightAxiom(Encoding enc, DatatypeFile.Datatype datatype, Variant v, Field f) {
        final Path container = datatype.getName();
        Type type = f.getType();
        boolean recursionOrParameter = TypeTranslator.mentions(type,
                t -> t instanceof Type.Variable || (t instanceof Type.Nominal
                        && context.inSameScc(((Type.Nominal) t).getName(), container)));
        if (!recursionOrParameter) {
            return null;
        }
        type = TypeTranslator.undecorate(type);
        if (!(type instanceof Type.SpecFn || type instanceof Type.Nominal || type instanceof Type.Boxed
                || type instanceof Type.Variable)) {
            return null;
        } else if (type instanceof Type.Nominal && translator.isSpecialized((Type.Nominal) type)) {
            // No boxed form to measure
            return null;
        }
        String wrapper = Naming.field(enc.getPath(), v.getName(), f.getName());
        Expr x = VAR(Naming.X);
        Expr field = translator.box(type, INVOKE(wrapper, x));
        if (isRecursiveFunctionField(type, datatype)) {
            field = INVOKE(Naming.HEIGHT_REC_FUN, field);
        }
        Expr heightField = INVOKE(Naming.HEIGHT, field);
        Expr.Logical lt = INVOKE(Naming.HEIGHT_LT, heightField, INVOKE(Naming.HEIGHT, enc.box(x)));
        Expr.Logical body = IMPLIES(INVOKE(Naming.isVariant(enc.getPath(), v.getName()), x), lt);
        List<Expr> trigger = Triggers.select(AxiomShape.FIELD_HEIGHT, new Terms().put(Term.FIELD_HEIGHT, heightField));
        Expr.Logical axiom = enc.bind(wrapper, AxiomShape.FIELD_HEIGHT, false,
                Collections.singletonList(enc.parameter(Naming.X)), trigger, body);
        LOG.trace("Height axiom {}", wrapper);
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.FIELD_HEIGHT));
    }

    /**
     * Determine whether a field is a closure (or unbounded map) whose results can be credited as lower than the
     * enclosing value. This holds only when the only use of type parameters within the result type is to instantiate
     * the enclosing datatype with exactly its own parameters. For example, it holds of <code>f</code> in
     * <code>S&lt;A,B&gt; { f: spec_fn(int) -&gt; Option&lt;S&lt;A,B&gt;&gt; }</code>, but not in
     * <code>S&lt;A,B&gt; { f: spec_fn(int) -&gt; Option&lt;(A,B)&gt; }</code>.
     *
     * @param type
     *            The undecorated field type.
     * @param datatype
     * @return
     */
    private boolean isRecursiveFunctionField(Type type, DatatypeFile.Datatype datatype) {
        Type unboxed = type instanceof Type.Boxed ? ((Type.Boxed) type).getOperand() : type;
        Type ret = null;
        if (unboxed instanceof Type.SpecFn) {
            ret = ((Type.SpecFn) unboxed).getReturns();
        } else if (unboxed instanceof Type.Nominal) {
            Type.Nominal n = (Type.Nominal) unboxed;
            if (n.getName().equals(context.getMapPath()) && n.getArguments().size() == 2) {
                ret = n.getArguments().get(1);
            }
        }
        return ret != null && onlyRecursiveParameters(ret, datatype.getSelfType());
    }

    /**
     * Search a type for type parameters, without descending into exact occurrences of the enclosing datatype.
     */
    private static boolean onlyRecursiveParameters(Type type, Type self) {
        if (type.equals(self)) {
            return true;
        } else if (type instanceof Type.Variable) {
            return false;
        }
        for (Type child : type.getOperands()) {
            if (!onlyRecursiveParameters(child, self)) {
                return false;
            }
        }
        return true;
    }
}
