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

import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.MonoType;

/**
 * Identifies what kind of thing is being encoded: a declared datatype, an opaque concrete instantiation, a closure
 * family of some arity or the built-in array type. The set of kinds is closed, and every use dispatches over the
 * opcode with an explicit case for each kind.
 *
 * @author David J. Pearce
 *
 */
public abstract class EncodedKind {
	public static final int KIND_datatype = 0;
	public static final int KIND_monotype = 1;
	public static final int KIND_closure = 2;
	public static final int KIND_array = 3;

	public static final EncodedKind ARRAY = new Array();

	private final int opcode;

	private EncodedKind(int opcode) {
		this.opcode = opcode;
	}

	public int getOpcode() {
		return opcode;
	}

	public static final class Dt extends EncodedKind {
		private final Datatype datatype;

		public Dt(Datatype datatype) {
			super(KIND_datatype);
			this.datatype = datatype;
		}

		public Datatype getDatatype() {
			return datatype;
		}

		@Override
		public String toString() {
			return "datatype " + datatype.getName();
		}
	}

	public static final class Monotype extends EncodedKind {
		private final MonoType type;

		public Monotype(MonoType type) {
			super(KIND_monotype);
			this.type = type;
		}

		public MonoType getType() {
			return type;
		}

		@Override
		public String toString() {
			return "monotype " + type;
		}
	}

	public static final class FnSpec extends EncodedKind {
		private final int arity;

		public FnSpec(int arity) {
			super(KIND_closure);
			this.arity = arity;
		}

		public int getArity() {
			return arity;
		}

		@Override
		public String toString() {
			return "closure/" + arity;
		}
	}

	public static final class Array extends EncodedKind {
		private Array() {
			super(KIND_array);
		}

		@Override
		public String toString() {
			return "array";
		}
	}
}
