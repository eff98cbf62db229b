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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile;
import dtlogic.lang.DatatypeFile.Field;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.tasks.Triggers.Term;
import dtlogic.tasks.Triggers.Terms;
import dtlogic.util.InternalFailure;

/**
 * Generates the axioms for extensional equality <code>ext_eq(deep, T, x, y)</code>. Two datatype values are
 * extensionally equal when they are built with the same variant and their fields are pairwise equal, where fields
 * containing closures or other opaque content are themselves compared extensionally. Fields which lead back into the
 * same recursion component are compared with plain equality, as otherwise the axiom would trigger itself on the field
 * values indefinitely. Two closures are extensionally equal when they agree (extensionally) on every argument.
 *
 * @author David J. Pearce
 *
 */
public class ExtEqualAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(ExtEqualAxioms.class);

    private final TypeTranslator translator;

    public ExtEqualAxioms(TypeTranslator translator) {
        this.translator = translator;
    }

    public void encode(Encoding enc, Commands out) {
        if (!enc.addsExtEqual()) {
            return;
        }
        List<Variant> variants = enc.getVariants();
        if (!variants.isEmpty() && enc.getKind().getOpcode() != EncodedKind.KIND_datatype) {
            throw new InternalFailure("variants given for " + enc.getKind());
        }
        Expr x = VAR(Naming.X);
        Expr y = VAR(Naming.Y);
        for (Variant v : variants) {
            DatatypeFile.Datatype datatype = ((EncodedKind.Dt) enc.getKind()).getDatatype();
            ArrayList<Expr.Logical> pre = new ArrayList<>();
            pre.add(enc.has(x));
            pre.add(enc.has(y));
            if (variants.size() > 1) {
                String tester = Naming.isVariant(enc.getPath(), v.getName());
                pre.add(INVOKE(tester, enc.unbox(x)));
                pre.add(INVOKE(tester, enc.unbox(y)));
            }
            for (Field f : v.getFields()) {
                pre.add(constructFieldEquality(enc, datatype, v, f));
            }
            out.getAxioms().add(constructAxiom(enc, Naming.constructor(enc.getPath(), v.getName()), pre));
        }
        if (enc.getKind().getOpcode() == EncodedKind.KIND_closure) {
            int arity = ((EncodedKind.FnSpec) enc.getKind()).getArity();
            out.getAxioms().add(constructClosureAxiom(enc, arity));
        }
    }

    private Expr.Logical constructFieldEquality(Encoding enc, DatatypeFile.Datatype datatype, Variant v, Field f) {
        DatatypeFile.Type type = f.getType();
        String wrapper = Naming.field(enc.getPath(), v.getName(), f.getName());
        Expr xf = INVOKE(wrapper, enc.unbox(VAR(Naming.X)));
        Expr yf = INVOKE(wrapper, enc.unbox(VAR(Naming.Y)));
        if (translator.usesExtEqual(type) && !translator.isRecursive(type, datatype.getName())) {
            return INVOKE(Naming.EXT_EQ, Arrays.asList(VAR(Naming.DEEP), translator.typeId(type),
                    translator.box(type, xf), translator.box(type, yf)));
        } else {
            return EQ(xf, yf);
        }
    }

    /**
     * Two closures which are extensionally equal on every argument are extensionally equal.
     */
    private Decl constructClosureAxiom(Encoding enc, int arity) {
        ClosureAxioms.Application app = ClosureAxioms.application(arity);
        Expr x = VAR(Naming.X);
        Expr y = VAR(Naming.Y);
        Expr xapp = APPLY(Naming.apply(arity), enc.unbox(x), app.getArguments());
        Expr yapp = APPLY(Naming.apply(arity), enc.unbox(y), app.getArguments());
        Expr.Invoke extEq = INVOKE(Naming.EXT_EQ,
                Arrays.asList(VAR(Naming.DEEP), app.getReturnTypeId(), xapp, yapp));
        List<Expr> trigger = Triggers.select(AxiomShape.EXT_EQUAL_INNER, new Terms().put(Term.EXT_EQUAL, extEq));
        Expr.Logical inner = enc.bind(enc.getPath(), AxiomShape.EXT_EQUAL_INNER, false, app.getParameters(),
                trigger, IMPLIES(AND(app.getPreconditions()), extEq));
        return constructAxiom(enc, enc.getPath(), Arrays.asList(enc.has(x), enc.has(y), inner));
    }

    private Decl constructAxiom(Encoding enc, String prefix, List<Expr.Logical> pre) {
        Decl.Parameter poly = new Decl.Parameter(Naming.X, SORT(Naming.POLY));
        List<Decl.Parameter> params = Arrays.asList(new Decl.Parameter(Naming.DEEP, Type.Bool), poly,
                new Decl.Parameter(Naming.Y, SORT(Naming.POLY)));
        Expr.Invoke extEq = INVOKE(Naming.EXT_EQ,
                Arrays.asList(VAR(Naming.DEEP), enc.getTypeId(), VAR(Naming.X), VAR(Naming.Y)));
        List<Expr> trigger = Triggers.select(AxiomShape.EXT_EQUAL, new Terms().put(Term.EXT_EQUAL, extEq));
        Expr.Logical axiom = enc.bind(prefix, AxiomShape.EXT_EQUAL, true, params, trigger,
                IMPLIES(AND(pre), extEq));
        LOG.trace("Extensional equality axiom {}", prefix);
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.EXT_EQUAL));
    }
}
