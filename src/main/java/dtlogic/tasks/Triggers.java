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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

import dtlogic.core.LogicFile.Expr;
import dtlogic.util.InternalFailure;

/**
 * Selects the trigger (i.e. the multi-pattern) for each quantified axiom. Selection depends only on the shape of the
 * axiom and on the subterms it offers, so every axiom family picks its triggers in one place.
 *
 * @author David J. Pearce
 *
 */
public final class Triggers {

	/**
	 * The distinguished subterms of an axiom which may be used as trigger terms.
	 */
	public enum Term {
		/** A native value being boxed, <code>box(x)</code>. */
		BOX,
		/** Membership of a boxed variable, <code>has_type(x, T)</code>. */
		MEMBERSHIP,
		/** Membership of a boxed native value, <code>has_type(box(x), T)</code>. */
		BOXED_MEMBERSHIP,
		/** A field wrapper applied to a native value. */
		ACCESSOR,
		/** A field wrapper applied to an unboxed value. */
		UNBOXED_ACCESSOR,
		/** The application of a closure to its arguments. */
		APPLICATION,
		/** Membership of the result of applying a closure. */
		APPLICATION_MEMBERSHIP,
		/** The height of the result of applying a closure. */
		APPLICATION_HEIGHT,
		/** The height of a (boxed) field. */
		FIELD_HEIGHT,
		/** Extensional equality of two values. */
		EXT_EQUAL
	}

	/**
	 * The shapes of quantified axiom generated by the encoder. Each shape determines the suffix of its quantifier
	 * identifier and the subterms from which its trigger is drawn.
	 */
	public enum AxiomShape {
		BOX_ROUND_TRIP("box_axiom", Term.BOX),
		UNBOX_ROUND_TRIP("unbox_axiom", Term.MEMBERSHIP),
		HAS_TYPE_ALWAYS("has_type_always", Term.BOXED_MEMBERSHIP),
		ACCESSOR_BRIDGE("accessor", Term.ACCESSOR),
		FIELD_INVARIANT("invariant", Term.UNBOXED_ACCESSOR, Term.MEMBERSHIP),
		CONSTRUCTOR_INVARIANT("constructor", Term.BOXED_MEMBERSHIP),
		CLOSURE_CONSTRUCTOR("constructor", Term.BOXED_MEMBERSHIP),
		CLOSURE_CONSTRUCTOR_INNER("constructor_inner", Term.APPLICATION_MEMBERSHIP),
		CLOSURE_APPLY("apply", Term.APPLICATION, Term.BOXED_MEMBERSHIP),
		CLOSURE_HEIGHT("height_apply", Term.APPLICATION_HEIGHT, Term.BOXED_MEMBERSHIP),
		FIELD_HEIGHT("height", Term.FIELD_HEIGHT),
		EXT_EQUAL("ext_equal", Term.EXT_EQUAL),
		EXT_EQUAL_INNER("inner_ext_equal", Term.EXT_EQUAL);

		private final String suffix;
		private final List<Term> terms;

		AxiomShape(String suffix, Term... terms) {
			this.suffix = suffix;
			this.terms = Collections.unmodifiableList(Arrays.asList(terms));
		}

		/**
		 * Get the suffix appended to the quantifier identifier of axioms with this shape.
		 *
		 * @return
		 */
		public String getSuffix() {
			return suffix;
		}

		public List<Term> getTerms() {
			return terms;
		}
	}

	/**
	 * The subterms offered by a particular axiom.
	 */
	public static final class Terms {
		private final EnumMap<Term, Expr> terms = new EnumMap<>(Term.class);

		public Terms put(Term term, Expr expr) {
			terms.put(term, expr);
			return this;
		}

		public Expr get(Term term) {
			return terms.get(term);
		}
	}

	private Triggers() {
	}

	/**
	 * Select the trigger for an axiom of a given shape.
	 *
	 * @param shape
	 * @param terms
	 * @return The trigger terms, which together form a single multi-pattern.
	 * @throws InternalFailure
	 *             if a required subterm was not provided.
	 */
	public static List<Expr> select(AxiomShape shape, Terms terms) {
		ArrayList<Expr> trigger = new ArrayList<>();
		for (Term t : shape.getTerms()) {
			Expr e = terms.get(t);
			if (e == null) {
				throw new InternalFailure("axiom " + shape + " missing trigger term " + t);
			}
			trigger.add(e);
		}
		return trigger;
	}
}
