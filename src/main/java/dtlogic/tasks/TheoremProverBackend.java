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

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Expr;

/**
 * A theorem prover which accepts a stream of declarations and axioms, and can then be asked to prove assertions
 * against them.
 *
 * @author David J. Pearce
 *
 */
public interface TheoremProverBackend {

	/**
	 * The possible results of attempting to prove an assertion.
	 */
	public enum Outcome {
		/** The assertion holds. */
		PROVED,
		/** The assertion does not hold. */
		COUNTEREXAMPLE,
		/** The prover gave up, or no prover was run. */
		UNKNOWN
	}

	/**
	 * Submit a stream of declarations and axioms to the prover.
	 *
	 * @param file
	 * @return Whether the stream was accepted and, if not, why.
	 */
	public Submission submit(LogicFile file);

	/**
	 * Attempt to prove an assertion in the context of everything submitted so far.
	 *
	 * @param assertion
	 * @return
	 */
	public Outcome proveAssertion(Expr.Logical assertion);

	/**
	 * The response to a submission.
	 */
	public static final class Submission {
		private static final Submission ACCEPTED = new Submission(null);

		private final String reason;

		private Submission(String reason) {
			this.reason = reason;
		}

		public static Submission accepted() {
			return ACCEPTED;
		}

		public static Submission rejected(String reason) {
			if (reason == null) {
				throw new IllegalArgumentException("rejection requires a reason");
			}
			return new Submission(reason);
		}

		public boolean isAccepted() {
			return reason == null;
		}

		/**
		 * Get the reason the submission was rejected, or <code>null</code> if it was accepted.
		 *
		 * @return
		 */
		public String getReason() {
			return reason;
		}

		@Override
		public String toString() {
			return isAccepted() ? "accepted" : "rejected: " + reason;
		}
	}
}
