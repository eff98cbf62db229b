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
import java.util.List;

import dtlogic.core.LogicFile.Decl;

/**
 * Accumulates generated declarations into buckets, one per position in the output stream. Encoding different kinds
 * only ever appends to buckets, so the final ordering is fixed by the order in which the buckets are concatenated
 * rather than by the order in which kinds happen to be encoded.
 *
 * @author David J. Pearce
 *
 */
public final class Commands {
	private final List<Decl> sorts = new ArrayList<>();
	private final List<Decl.Datatype> datatypes = new ArrayList<>();
	private final List<Decl> fields = new ArrayList<>();
	private final List<Decl> tokens = new ArrayList<>();
	private final List<Decl> boxes = new ArrayList<>();
	private final List<Decl> axioms = new ArrayList<>();

	/** Opaque sort declarations. */
	public List<Decl> getSorts() {
		return sorts;
	}

	/** Datatypes, all declared together in one group. */
	public List<Decl.Datatype> getDatatypes() {
		return datatypes;
	}

	/** Field wrapper declarations. */
	public List<Decl> getFields() {
		return fields;
	}

	/** Type identifier tokens. */
	public List<Decl> getTokens() {
		return tokens;
	}

	/** Box, unbox and apply declarations. */
	public List<Decl> getBoxes() {
		return boxes;
	}

	public List<Decl> getAxioms() {
		return axioms;
	}

	/**
	 * Append the contents of another set of buckets to this one, bucket by bucket.
	 *
	 * @param other
	 */
	public void append(Commands other) {
		sorts.addAll(other.sorts);
		datatypes.addAll(other.datatypes);
		fields.addAll(other.fields);
		tokens.addAll(other.tokens);
		boxes.addAll(other.boxes);
		axioms.addAll(other.axioms);
	}

	public int size() {
		return sorts.size() + datatypes.size() + fields.size() + tokens.size() + boxes.size() + axioms.size();
	}
}
