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
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.tasks.Triggers.Term;
import dtlogic.tasks.Triggers.Terms;

/**
 * Declares the functions moving values between their native sort and the universal sort <code>Poly</code>, along with
 * the two round-trip laws which connect them. For example, for a datatype <code>List</code> we have:
 *
 * <pre>
 * (declare-fun List#box (List) Poly)
 * (declare-fun List#unbox (Poly) List)
 * (assert (forall ((x List)) (! (= x (List#unbox (List#box x))) :pattern ((List#box x)) ...)))
 * (assert (forall ((T&amp; Type) (x Poly)) (! (=&gt; (has_type x (List#Type T&amp;)) (= x (List#box (List#unbox x)))) ...)))
 * </pre>
 *
 * The second law is conditional, since not every value of sort <code>Poly</code> is the image of a list.
 *
 * @author David J. Pearce
 *
 */
public class BoxingAxioms {
    private static final Logger LOG = LoggerFactory.getLogger(BoxingAxioms.class);

    public void encode(Encoding enc, Commands out) {
        if (!enc.declaresBox()) {
            return;
        }
        String path = enc.getPath();
        String box = Naming.box(path);
        String unbox = Naming.unbox(path);
        out.getBoxes().add(FUNCTION(box, enc.getSort(), SORT(Naming.POLY)));
        out.getBoxes().add(FUNCTION(unbox, SORT(Naming.POLY), enc.getSort()));
        out.getAxioms().add(constructBoxAxiom(enc, box, unbox));
        out.getAxioms().add(constructUnboxAxiom(enc, box, unbox));
    }

    /**
     * Unboxing a boxed value gives back the original value.
     */
    private Decl constructBoxAxiom(Encoding enc, String box, String unbox) {
        Expr x = VAR(Naming.X);
        Expr boxX = INVOKE(box, x);
        List<Expr> trigger = Triggers.select(AxiomShape.BOX_ROUND_TRIP, new Terms().put(Term.BOX, boxX));
        Expr.Logical body = EQ(x, INVOKE(unbox, boxX));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.BOX_ROUND_TRIP, false,
                Collections.singletonList(enc.parameter(Naming.X)), trigger, body);
        LOG.trace("Box axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.BOX_ROUND_TRIP));
    }

    /**
     * Boxing an unboxed value gives back the original value, provided it was a member of the encoded type.
     */
    private Decl constructUnboxAxiom(Encoding enc, String box, String unbox) {
        Expr x = VAR(Naming.X);
        Expr.Invoke has = enc.has(x);
        List<Expr> trigger = Triggers.select(AxiomShape.UNBOX_ROUND_TRIP, new Terms().put(Term.MEMBERSHIP, has));
        Expr.Logical body = IMPLIES(has, EQ(x, INVOKE(box, INVOKE(unbox, x))));
        Expr.Logical axiom = enc.bind(enc.getPath(), AxiomShape.UNBOX_ROUND_TRIP, true,
                Collections.singletonList(new Decl.Parameter(Naming.X, SORT(Naming.POLY))), trigger, body);
        LOG.trace("Unbox axiom {}", enc.getPath());
        return AXIOM(axiom, ATTRIBUTE(AxiomShape.UNBOX_ROUND_TRIP));
    }
}
