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
import java.util.Collections;
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

/**
 * Declares the constructors and fields of a datatype. Every field is accessed through an uninterpreted wrapper
 * function, which is connected to the underlying datatype selector by a single bridging axiom. All other axioms refer
 * only to the wrapper, which prevents the prover from matching them against terms produced by its own datatype
 * reasoning.
 *
 * @author David J. Pearce
 *
 */
public class FieldAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(FieldAxioms.class);

    private final Context context;
    private final TypeTranslator translator;

    public FieldAxioms(TypeTranslator translator) {
        this.context = translator.getContext();
        this.translator = translator;
    }

    /**
     * Construct the native datatype declaration for an encoding, whose selectors are the internal field names.
     *
     * @param enc
     * @param datatype
     * @return
     */
    public Decl.Datatype constructDatatype(Encoding enc, DatatypeFile.Datatype datatype) {
        String path = enc.getPath();
        ArrayList<Decl.Constructor> constructors = new ArrayList<>();
        for (Variant v : enc.getVariants()) {
            ArrayList<Decl.Parameter> fields = new ArrayList<>();
            for (Field f : v.getFields()) {
                String name = Naming.fieldInternal(path, v.getName(), f.getName());
                fields.add(new Decl.Parameter(name, translator.toSort(fieldType(enc, datatype, f))));
            }
            constructors.add(new Decl.Constructor(Naming.constructor(path, v.getName()), fields));
        }
        return new Decl.Datatype(path, constructors);
    }

    public void encode(Encoding enc, DatatypeFile.Datatype datatype, Commands out) {
        // Invariants are stated over boxed values, hence need boxing
        boolean invariants = enc.declaresBox() && datatype != null && context.hasInvariant(datatype.getName());
        for (Variant v : enc.getVariants()) {
            if (invariants) {
                out.getAxioms().add(constructConstructorInvariant(enc, datatype, v));
            }
            for (Field f : v.getFields()) {
                Type sort = translator.toSort(fieldType(enc, datatype, f));
                String wrapper = Naming.field(enc.getPath(), v.getName(), f.getName());
                out.getFields().add(FUNCTION(wrapper, enc.getSort(), sort));
                out.getAxioms().add(constructAccessorAxiom(enc, v, f));
                if (invariants) {
                    Decl axiom = constructFieldInvariant(enc, datatype, v, f);
                    if (axiom != null) {
                        out.getAxioms().add(axiom);
                    }
                }
            }
        }
    }

    /**
     * Determine the type of a field under the specialization of an encoding.
     */
    private static DatatypeFile.Type fieldType(Encoding enc, DatatypeFile.Datatype datatype, Field f) {
        if (datatype == null) {
            return f.getType();
        }
        return enc.getSpecialization().substitute(datatype.getTypeParameters(), f.getType());
    }

    /**
     * The field wrapper agrees with the datatype selector.
     */
    private Decl constructAccessorAxiom(Encoding enc, Variant v, Field f) {
        String path = enc.getPath();
        String wrapper = Naming.field(path, v.getName(), f.getName());
        Expr x = VAR(Naming.X);
        Expr access = INVOKE(wrapper, x);
        List<Expr> trigger = Triggers.select(AxiomShape.ACCESSOR_BRIDGE, new Terms().put(Term.ACCESSOR, access));
        Expr.Logical body = EQ(access, INVOKE(Naming.fieldInternal(path, v.getName(), f.getName()), x));
        Expr.Logical axiom = enc.bind(wrapper, AxiomShape.ACCESSOR_BRIDGE, false,
                Collections.singletonList(enc.parameter(Naming.X)), trigger, body);
        LOG.trace("Accessor axiom {}", wrapper);
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.ACCESSOR_BRIDGE));
    }

    /**
     * A constructor applied to values meeting their field invariants produces a member of the datatype.
     */
    private Decl constructConstructorInvariant(Encoding enc, DatatypeFile.Datatype datatype, Variant v) {
        String constructor = Naming.constructor(enc.getPath(), v.getName());
        ArrayList<Decl.Parameter> params = new ArrayList<>();
        ArrayList<Expr> args = new ArrayList<>();
        ArrayList<Expr.Logical> pre = new ArrayList<>();
        for (Field f : v.getFields()) {
            DatatypeFile.Type type = fieldType(enc, datatype, f);
            String name = Naming.fieldVariable(f.getName());
            params.add(new Decl.Parameter(name, translator.toSort(type)));
            args.add(VAR(name));
            Expr.Logical inv = translator.typeInvariant(type, VAR(name));
            if (inv != null) {
                pre.add(inv);
            }
        }
        Expr.Invoke has = enc.has(enc.box(INVOKE(constructor, args)));
        List<Expr> trigger = Triggers.select(AxiomShape.CONSTRUCTOR_INVARIANT,
                new Terms().put(Term.BOXED_MEMBERSHIP, has));
        Expr.Logical axiom = enc.bind(constructor, AxiomShape.CONSTRUCTOR_INVARIANT, true, params, trigger,
                IMPLIES(AND(pre), has));
        LOG.trace("Constructor axiom {}", constructor);
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.CONSTRUCTOR_INVARIANT));
    }

    /**
     * A field of a member of the datatype meets the invariant of its type.
     */
    private Decl constructFieldInvariant(Encoding enc, DatatypeFile.Datatype datatype, Variant v, Field f) {
        String wrapper = Naming.field(enc.getPath(), v.getName(), f.getName());
        Expr x = VAR(Naming.X);
        Expr access = INVOKE(wrapper, enc.unbox(x));
        Expr.Logical inv = translator.typeInvariant(fieldType(enc, datatype, f), access);
        if (inv == null) {
            return null;
        }
        Expr.Invoke has = enc.has(x);
        List<Expr> trigger = Triggers.select(AxiomShape.FIELD_INVARIANT,
                new Terms().put(Term.UNBOXED_ACCESSOR, access).put(Term.MEMBERSHIP, has));
        Expr.Logical axiom = enc.bind(wrapper, AxiomShape.FIELD_INVARIANT, true,
                Collections.singletonList(new Decl.Parameter(Naming.X, SORT(Naming.POLY))), trigger,
                IMPLIES(has, inv));
        LOG.trace("Field invariant axiom {}", wrapper);
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.FIELD_INVARIANT));
    }
}
