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

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile.Variant;
import dtlogic.lang.Specialization;
import dtlogic.tasks.Triggers.AxiomShape;
import dtlogic.util.InternalFailure;

/**
 * Describes a single unit of encoding work: one kind (under one specialization), together with the identifiers and
 * flags which determine what gets emitted for it. Every axiom family reads the same description, so the choices made
 * here (such as whether values are boxed) apply uniformly across all of them.
 *
 * @author David J. Pearce
 *
 */
public final class Encoding {
	private final EncodedKind kind;
	private final String path;
	private final LogicFile.Type sort;
	private final Specialization specialization;
	private final List<String> typeParameters;
	private final List<Variant> variants;
	private final Expr typeId;
	private final boolean declareToken;
	private final boolean declareBox;
	private final boolean addHeight;
	private final boolean addExtEqual;

	private Encoding(Builder b) {
		this.kind = b.kind;
		this.path = b.path;
		this.sort = b.sort;
		this.specialization = b.specialization;
		this.typeParameters = Collections.unmodifiableList(new ArrayList<>(b.typeParameters));
		this.variants = Collections.unmodifiableList(new ArrayList<>(b.variants));
		this.declareBox = b.declareBox && specialization.isEmpty();
		this.addHeight = b.addHeight;
		this.addExtEqual = b.addExtEqual;
		if (b.typeId != null) {
			this.typeId = b.typeId;
			this.declareToken = false;
		} else {
			ArrayList<Expr> args = new ArrayList<>();
			for (String p : typeParameters) {
				args.add(VAR(Naming.typeParameter(p)));
			}
			this.typeId = INVOKE(Naming.typeId(path), args);
			this.declareToken = true;
		}
	}

	public EncodedKind getKind() {
		return kind;
	}

	/**
	 * Get the encoded path, from which every identifier of this encoding is derived.
	 *
	 * @return
	 */
	public String getPath() {
		return path;
	}

	/**
	 * Get the native sort of values being encoded.
	 *
	 * @return
	 */
	public LogicFile.Type getSort() {
		return sort;
	}

	public Specialization getSpecialization() {
		return specialization;
	}

	/**
	 * Get the type parameters over which axioms are quantified. For a specialized encoding, these are only the
	 * parameters which remain generic.
	 *
	 * @return
	 */
	public List<String> getTypeParameters() {
		return typeParameters;
	}

	public List<Variant> getVariants() {
		return variants;
	}

	/**
	 * Get the term identifying the encoded type, expressed over the type parameters.
	 *
	 * @return
	 */
	public Expr getTypeId() {
		return typeId;
	}

	/**
	 * Check whether the type identifier is a fresh token which this encoding must declare.
	 *
	 * @return
	 */
	public boolean declaresToken() {
		return declareToken;
	}

	public boolean declaresBox() {
		return declareBox;
	}

	public boolean addsHeight() {
		return addHeight;
	}

	public boolean addsExtEqual() {
		return addExtEqual;
	}

	// ==============================================================================
	// Helpers
	// ==============================================================================

	/**
	 * Box a native value. Only boxed encodings have box functions, and specialized encodings are never boxed.
	 *
	 * @param e
	 * @return
	 * @throws InternalFailure
	 *             if this encoding is not boxed.
	 */
	public Expr box(Expr e) {
		return INVOKE(Naming.box(checkBoxed()), e);
	}

	/**
	 * Unbox a boxed value.
	 *
	 * @param e
	 * @return
	 * @throws InternalFailure
	 *             if this encoding is not boxed.
	 */
	public Expr unbox(Expr e) {
		return INVOKE(Naming.unbox(checkBoxed()), e);
	}

	private String checkBoxed() {
		if (!declareBox) {
			throw new InternalFailure(this + " has no boxed form");
		}
		return path;
	}

	/**
	 * Construct the membership test of a given value in the encoded type.
	 *
	 * @param e
	 * @return
	 */
	public Expr.Invoke has(Expr e) {
		return TypeTranslator.hasType(e, typeId);
	}

	public Decl.Parameter parameter(String name) {
		return new Decl.Parameter(name, sort);
	}

	/**
	 * Construct an axiom quantified over the type parameters of this encoding (as type identifiers) followed by the
	 * given parameters.
	 *
	 * @param prefix
	 *            The prefix of the quantifier identifier.
	 * @param shape
	 * @param bindTypeParameters
	 *            Whether or not the type parameters are bound.
	 * @param parameters
	 * @param trigger
	 * @param body
	 * @return
	 */
	public Expr.Logical bind(String prefix, AxiomShape shape, boolean bindTypeParameters,
			List<Decl.Parameter> parameters, List<Expr> trigger, Expr.Logical body) {
		ArrayList<Decl.Parameter> params = new ArrayList<>();
		if (bindTypeParameters) {
			for (String p : typeParameters) {
				params.add(new Decl.Parameter(Naming.typeParameter(p), SORT(Naming.TYPE)));
			}
		}
		params.addAll(parameters);
		if (params.isEmpty()) {
			// Nothing to quantify over (e.g. a closure of no arguments)
			return body;
		}
		return FORALL(params, trigger, Naming.qid(prefix, shape.getSuffix()), body);
	}

	@Override
	public String toString() {
		return kind + " as " + path;
	}

	public static final class Builder {
		private final EncodedKind kind;
		private final String path;
		private final LogicFile.Type sort;
		private Specialization specialization = Specialization.GENERIC;
		private List<String> typeParameters = Collections.emptyList();
		private List<Variant> variants = Collections.emptyList();
		private Expr typeId;
		private boolean declareBox;
		private boolean addHeight;
		private boolean addExtEqual;

		public Builder(EncodedKind kind, String path, LogicFile.Type sort) {
			this.kind = kind;
			this.path = path;
			this.sort = sort;
		}

		public Builder setSpecialization(Specialization specialization) {
			this.specialization = specialization;
			return this;
		}

		public Builder setTypeParameters(List<String> typeParameters) {
			this.typeParameters = typeParameters;
			return this;
		}

		public Builder setVariants(List<Variant> variants) {
			this.variants = variants;
			return this;
		}

		/**
		 * Use an existing type identifier, rather than declaring a fresh token.
		 *
		 * @param typeId
		 * @return
		 */
		public Builder setTypeId(Expr typeId) {
			this.typeId = typeId;
			return this;
		}

		public Builder setDeclareBox(boolean flag) {
			this.declareBox = flag;
			return this;
		}

		public Builder setAddHeight(boolean flag) {
			this.addHeight = flag;
			return this;
		}

		public Builder setAddExtEqual(boolean flag) {
			this.addExtEqual = flag;
			return this;
		}

		public Encoding build() {
			return new Encoding(this);
		}
	}
}
