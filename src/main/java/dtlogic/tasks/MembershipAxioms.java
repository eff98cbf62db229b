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
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.tasks.Triggers.Term;
import dtlogic.tasks.Triggers.Terms;
import dtlogic.util.InternalFailure;

/**
 * Declares the type identifier of an encoded type and, where no refinement of the type is visible, the axiom stating
 * that every boxed native value is a member of it. Where refinements are visible, membership is instead established by
 * the constructor invariants.
 *
 * @author David J. Pearce
 *
 */
public class MembershipAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(MembershipAxioms.class);

    private final Context context;

    public MembershipAxioms(Context context) {
        this.context = context;
    }

    public void encode(Encoding enc, Commands out) {
        if (enc.declaresToken()) {
            out.getTokens().add(constructToken(enc.getPath(), enc.getTypeParameters().size()));
        }
        if (enc.declaresBox() && alwaysHolds(enc.getKind())) {
            out.getAxioms().add(constructAlwaysAxiom(enc));
        }
    }

    /**
     * Construct the declaration of a type identifier taking a given number of type arguments.
     *
     * @param path
     * @param arity
     * @return
     */
    public static Decl constructToken(String path, int arity) {
        if (arity == 0) {
            return new Decl.Constant(Naming.typeId(path), SORT(Naming.TYPE));
        }
        ArrayList<Type> params = new ArrayList<>();
        for (int i = 0; i != arity; ++i) {
            params.add(SORT(Naming.TYPE));
        }
        return FUNCTION(Naming.typeId(path), params, SORT(Naming.TYPE));
    }

    /**
     * Determine whether membership holds of every native value of a given kind.
     *
     * @param kind
     * @return
     */
    private boolean alwaysHolds(EncodedKind kind) {
        switch (kind.getOpcode()) {
            case EncodedKind.KIND_datatype:
                return !context.hasInvariant(((EncodedKind.Dt) kind).getDatatype().getName());
            case EncodedKind.KIND_monotype:
                return true;
            case EncodedKind.KIND_closure:
            case EncodedKind.KIND_array:
                return false;
            default:
                throw new InternalFailure("unknown kind " + kind);
        }
    }

    private Decl constructAlwaysAxiom(Encoding enc) {
        Expr x = VAR(Naming.X);
        Expr.Invoke has = enc.has(enc.box(x));
        List<Expr> trigger = Triggers.select(AxiomShape.HAS_TYPE_ALWAYS, new Terms().put(Term.BOXED_MEMBERSHIP, has));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.HAS_TYPE_ALWAYS, true,
                Collections.singletonList(enc.parameter(Naming.X)), trigger, has);
        LOG.trace("Membership axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.HAS_TYPE_ALWAYS));
    }
}
