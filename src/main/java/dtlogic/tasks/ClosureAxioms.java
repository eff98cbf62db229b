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
import static dtlogic.util.Util.append;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.tasks.Triggers.Term;
import dtlogic.tasks.Triggers.Terms;

/**
 * Encodes the family of specification function types of a given arity. A closure <code>f</code> of arity N is a value
 * of sort <code>Fun</code> with type <code>Fn#N(T0,...,TN-1,TRet)</code>, and is applied with <code>apply#N</code>. The
 * axioms state that a closure mapping members of the parameter types to members of the result type is a member of the
 * closure type (constructor), that applying a member of the closure type to members of the parameter types gives a
 * member of the result type (apply), and that the result of an application is lower than the closure itself (height).
 *
 * @author David J. Pearce
 *
 */
public class ClosureAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(ClosureAxioms.class);

    /**
     * The pieces of a closure application <code>apply#N(x, a%0, ..., a%N-1)</code>, shared with the extensional
     * equality axioms.
     */
    public static final class Application {
        private final List<Decl.Parameter> parameters;
        private final List<Expr> arguments;
        private final List<Expr.Logical> preconditions;
        private final Expr returnTypeId;

        private Application(List<Decl.Parameter> parameters, List<Expr> arguments, List<Expr.Logical> preconditions,
                Expr returnTypeId) {
            this.parameters = parameters;
            this.arguments = arguments;
            this.preconditions = preconditions;
            this.returnTypeId = returnTypeId;
        }

        /**
         * Get the argument parameters, each of sort <code>Poly</code>.
         */
        public List<Decl.Parameter> getParameters() {
            return parameters;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        /**
         * Get the membership of each argument in its parameter type.
         */
        public List<Expr.Logical> getPreconditions() {
            return preconditions;
        }

        public Expr getReturnTypeId() {
            return returnTypeId;
        }
    }

    /**
     * Construct the type parameters of the closure family of a given arity, one per parameter and one for the result.
     *
     * @param arity
     * @return
     */
    public static List<String> typeParameters(int arity) {
        ArrayList<String> params = new ArrayList<>();
        for (int i = 0; i <= arity; ++i) {
            params.add(Naming.closureTypeParameter(i));
        }
        return params;
    }

    public static Application application(int arity) {
        ArrayList<Decl.Parameter> params = new ArrayList<>();
        ArrayList<Expr> args = new ArrayList<>();
        ArrayList<Expr.Logical> pre = new ArrayList<>();
        for (int i = 0; i != arity; ++i) {
            String name = Naming.closureArgument(i);
            params.add(new Decl.Parameter(name, SORT(Naming.POLY)));
            args.add(VAR(name));
            pre.add(TypeTranslator.hasType(VAR(name), VAR(Naming.typeParameter(Naming.closureTypeParameter(i)))));
        }
        Expr ret = VAR(Naming.typeParameter(Naming.closureTypeParameter(arity)));
        return new Application(params, args, pre, ret);
    }

    public void encode(Encoding enc, int arity, Commands out) {
        Application app = application(arity);
        ArrayList<Type> params = new ArrayList<>();
        params.add(SORT(Naming.FUN));
        for (int i = 0; i != arity; ++i) {
            params.add(SORT(Naming.POLY));
        }
        out.getBoxes().add(FUNCTION(Naming.apply(arity), params, SORT(Naming.POLY)));
        Expr x = VAR(Naming.X);
        Expr applied = APPLY(Naming.apply(arity), x, app.getArguments());
        Expr.Invoke hasApplied = TypeTranslator.hasType(applied, app.getReturnTypeId());
        out.getAxioms().add(constructConstructorAxiom(enc, app, hasApplied));
        out.getAxioms().add(constructApplyAxiom(enc, app, applied, hasApplied));
        out.getAxioms().add(constructHeightAxiom(enc, app, applied));
    }

    /**
     * If applying a closure to members of its parameter types always gives a member of its result type, then the
     * closure is a member of the closure type.
     */
    private Decl constructConstructorAxiom(Encoding enc, Application app, Expr.Invoke hasApplied) {
        List<Expr> innerTrigger = Triggers.select(AxiomShape.CLOSURE_CONSTRUCTOR_INNER,
                new Terms().put(Term.APPLICATION_MEMBERSHIP, hasApplied));
        Expr.Logical inner = enc.bind(enc.getPath(), AxiomShape.CLOSURE_CONSTRUCTOR_INNER, false,
                app.getParameters(), innerTrigger, IMPLIES(AND(app.getPreconditions()), hasApplied));
        Expr.Invoke hasFun = enc.has(enc.box(INVOKE(Naming.MK_FUN, VAR(Naming.X))));
        List<Expr> trigger = Triggers.select(AxiomShape.CLOSURE_CONSTRUCTOR,
                new Terms().put(Term.BOXED_MEMBERSHIP, hasFun));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.CLOSURE_CONSTRUCTOR, true,
                Collections.singletonList(enc.parameter(Naming.X)), trigger, IMPLIES(inner, hasFun));
        LOG.trace("Closure constructor axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.CLOSURE_CONSTRUCTOR));
    }

    /**
     * Applying a member of the closure type to members of its parameter types gives a member of its result type.
     */
    private Decl constructApplyAxiom(Encoding enc, Application app, Expr applied, Expr.Invoke hasApplied) {
        Expr.Invoke hasBox = enc.has(enc.box(VAR(Naming.X)));
        List<Expr> trigger = Triggers.select(AxiomShape.CLOSURE_APPLY,
                new Terms().put(Term.APPLICATION, applied).put(Term.BOXED_MEMBERSHIP, hasBox));
        Expr.Logical pre = AND(append((Expr.Logical) hasBox, app.getPreconditions()));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.CLOSURE_APPLY, true,
                append(enc.parameter(Naming.X), app.getParameters()), trigger, IMPLIES(pre, hasApplied));
        LOG.trace("Closure apply axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.CLOSURE_APPLY));
    }

    /**
     * Applying a member of the closure type to members of its parameter types gives a result lower than the closure,
     * when the closure was obtained from a recursive field.
     */
    private Decl constructHeightAxiom(Encoding enc, Application app, Expr applied) {
        Expr.Invoke hasBox = enc.has(enc.box(VAR(Naming.X)));
        Expr heightApplied = INVOKE(Naming.HEIGHT, applied);
        Expr field = INVOKE(Naming.HEIGHT_REC_FUN, enc.box(INVOKE(Naming.MK_FUN, VAR(Naming.X))));
        Expr.Logical lt = INVOKE(Naming.HEIGHT_LT, heightApplied, INVOKE(Naming.HEIGHT, field));
        Expr.Logical body = IMPLIES(AND(append((Expr.Logical) hasBox, app.getPreconditions())), lt);
        List<Expr> trigger = Triggers.select(AxiomShape.CLOSURE_HEIGHT,
                new Terms().put(Term.APPLICATION_HEIGHT, heightApplied).put(Term.BOXED_MEMBERSHIP, hasBox));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.CLOSURE_HEIGHT, true,
                append(enc.parameter(Naming.X), app.getParameters()), trigger, body);
        LOG.trace("Closure height axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.CLOSURE_HEIGHT));
    }
}
