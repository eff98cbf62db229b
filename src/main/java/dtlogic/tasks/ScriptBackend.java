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

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.io.LogicFilePrinter;
import dtlogic.util.CommandStreamChecker;

/**
 * A backend which writes everything it is given as an SMT-LIB2 script, rather than running a prover directly. The
 * script can subsequently be passed to any SMT-LIB2 compliant prover. Since no prover is run, every assertion has an
 * unknown outcome.
 *
 * @author David J. Pearce
 *
 */
public class ScriptBackend implements TheoremProverBackend {
	private static final Logger LOG = LoggerFactory.getLogger(ScriptBackend.class);

	private final LogicFilePrinter printer;

	/**
	 * Determines whether the base theory is written ahead of the first submission.
	 */
	private boolean includePrelude = true;

	/**
	 * Determines whether each submission is checked for declaration order before being written.
	 */
	private boolean checkOrder = true;

	private int submissions;

	/**
	 * Every symbol declared by the submissions written so far.
	 */
	private final Set<String> declared = new HashSet<>();

	public ScriptBackend(OutputStream output) {
		if (output == null) {
			throw new IllegalArgumentException("invalid output stream");
		}
		this.printer = new LogicFilePrinter(output);
	}

	public ScriptBackend setIncludePrelude(boolean flag) {
		this.includePrelude = flag;
		return this;
	}

	public ScriptBackend setCheckOrder(boolean flag) {
		this.checkOrder = flag;
		return this;
	}

	@Override
	public Submission submit(LogicFile file) {
		if (file == null) {
			throw new IllegalArgumentException("invalid submission");
		}
		List<Decl> decls = new ArrayList<>();
		if (includePrelude && submissions == 0) {
			decls.addAll(Prelude.basis());
		}
		decls.addAll(file.getDeclarations());
		LogicFile script = new LogicFile(decls);
		if (checkOrder) {
			String problem = new CommandStreamChecker().check(script, declared);
			if (problem != null) {
				LOG.debug("Rejected submission: {}", problem);
				return Submission.rejected(problem);
			}
		}
		printer.write(script);
		declared.addAll(CommandStreamChecker.declared(script));
		submissions = submissions + 1;
		LOG.debug("Accepted submission of {} declarations", decls.size());
		return Submission.accepted();
	}

	@Override
	public Outcome proveAssertion(Expr.Logical assertion) {
		if (submissions == 0) {
			throw new IllegalStateException("nothing submitted");
		}
		printer.writeCheck(assertion);
		return Outcome.UNKNOWN;
	}
}
