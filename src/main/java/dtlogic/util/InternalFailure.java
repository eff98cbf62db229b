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
package dtlogic.util;

/**
 * Signals that the encoder was handed input which violates one of its internal invariants, such as a type which
 * should have been eliminated by an earlier pass. There is no recovery from such a failure: it indicates a bug
 * upstream, and no partial output should be used.
 *
 * @author David J. Pearce
 *
 */
public class InternalFailure extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public InternalFailure(String message) {
		super("internal error: " + message);
	}

	public InternalFailure(String message, Throwable cause) {
		super("internal error: " + message, cause);
	}
}
