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
package dtlogic.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An ordered stream of declarations (sorts, datatypes, functions, constants and axioms) in the many-sorted first-order
 * logic understood by the theorem prover. Declarations are held in the order they must be submitted, and every symbol
 * is expected to be declared before it is used.
 *
 * @author David J. Pearce
 *
 */
public class LogicFile {
	private final List<Decl> declarations;

	public LogicFile() {
		this.declarations = new ArrayList<>();
	}

	public LogicFile(Collection<Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for (Attribute a : attributes) {
				T value = a.as(kind);
				if (value != null) {
					return value;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * Declares an uninterpreted sort. Values of the sort can only be related to each other through the functions
		 * and axioms which mention it.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Sort extends AbstractItem implements Decl {
			private final String name;

			public Sort(String name, Attribute... attributes) {
				super(attributes);
				if (name == null) {
					throw new IllegalArgumentException("invalid sort name");
				}
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		/**
		 * A group of mutually recursive algebraic datatypes, declared together. Each constructor implicitly declares
		 * its selectors (one per field) and its tester <code>is-C</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Datatypes extends AbstractItem implements Decl {
			private final List<Datatype> datatypes;

			public Datatypes(List<Datatype> datatypes, Attribute... attributes) {
				super(attributes);
				this.datatypes = new ArrayList<>(datatypes);
			}

			public List<Datatype> getDatatypes() {
				return datatypes;
			}
		}

		public static class Datatype extends AbstractItem {
			private final String name;
			private final List<Constructor> constructors;

			public Datatype(String name, List<Constructor> constructors, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.constructors = new ArrayList<>(constructors);
			}

			public String getName() {
				return name;
			}

			public List<Constructor> getConstructors() {
				return constructors;
			}
		}

		public static class Constructor extends AbstractItem {
			private final String name;
			private final List<Parameter> fields;

			public Constructor(String name, List<Parameter> fields, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.fields = new ArrayList<>(fields);
			}

			public String getName() {
				return name;
			}

			/**
			 * Get the fields of this constructor, where the name of each is the name of its selector.
			 *
			 * @return
			 */
			public List<Parameter> getFields() {
				return fields;
			}
		}

		/**
		 * <p>
		 * Axioms are used to postulate properties of constants and functions. <i>Care must be taken to ensure a given
		 * set of axioms are not inconsistent</i>. For example, <code>(assert false)</code> is the simplest inconsistent
		 * axiom, after which every proof obligation is discharged regardless of whether it is correct or otherwise!
		 * </p>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Axiom extends AbstractItem implements Decl {
			private final Expr.Logical operand;

			public Axiom(Expr.Logical operand, Attribute... attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.Logical getOperand() {
				return operand;
			}
		}

		/**
		 * Allows a line comment to be included in a <code>LogicFile</code>. This is helpful for annotating generated
		 * declarations with helpful information about them.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class LineComment extends AbstractItem implements Decl {
			private final String message;

			public LineComment(String message, Attribute... attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		/**
		 * Represents a global (symbolic) constant value, i.e. a function without parameters.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Constant extends Parameter implements Decl {
			public Constant(String name, Type type, Attribute... attributes) {
				super(name, type, attributes);
			}
		}

		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;

			public Function(String name, List<Parameter> parameters, Type returns, Attribute... attributes) {
				super(attributes);
				if (name == null) {
					throw new IllegalArgumentException("invalid function name");
				}
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		public static class Sequence extends AbstractItem implements Decl {
			private final List<Decl> decls;

			public Sequence(Decl... decls) {
				this(Arrays.asList(decls));
			}

			public Sequence(Collection<Decl> decls, Attribute... attributes) {
				super(attributes);
				this.decls = new ArrayList<>(decls);
			}

			public int size() {
				return decls.size();
			}

			public Decl get(int i) {
				return decls.get(i);
			}

			public List<Decl> getAll() {
				return decls;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface Logical extends Expr {
			public boolean isFalse();
			public boolean isTrue();
		}

		/**
		 * An operator over exactly two operands. The operand type is narrowed for connectives which only make sense over
		 * logical operands.
		 */
		public static abstract class BinaryOperator<T extends Expr> extends AbstractItem implements Logical {
			private final T lhs;
			private final T rhs;

			private BinaryOperator(T lhs, T rhs, Attribute[] attributes) {
				super(attributes);
				if (lhs == null || rhs == null) {
					throw new IllegalArgumentException("missing operand");
				}
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public T getLeftHandSide() {
				return lhs;
			}

			public T getRightHandSide() {
				return rhs;
			}
		}

		public static abstract class NaryOperator extends AbstractItem implements Logical {
			private final List<Logical> operands;

			private NaryOperator(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class Equals extends BinaryOperator<Expr> {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends BinaryOperator<Expr> {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Implies extends BinaryOperator<Logical> {
			private Implies(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "INT(" + value + ")";
			}
		}

		/**
		 * An application of an uninterpreted (or datatype-provided) function symbol. An invocation may have logical
		 * result, as for membership and height predicates.
		 */
		public static class Invoke extends AbstractItem implements Logical {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return "FNCALL(" + name + "," + arguments.toString() + ")";
			}
		}

		/**
		 * The application of a function value of sort <code>Fun</code> to a fixed number of boxed arguments, through
		 * the apply symbol of the matching arity.
		 */
		public static class Apply extends AbstractItem implements Expr {
			private final String name;
			private final Expr function;
			private final List<Expr> arguments;

			private Apply(String name, Expr function, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.function = function;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public int getArity() {
				return arguments.size();
			}

			public Expr getFunction() {
				return function;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return "APPLY(" + name + "," + function + "," + arguments.toString() + ")";
			}
		}

		public static class LogicalNot extends AbstractItem implements Logical {
			private final Logical operand;

			private LogicalNot(Logical operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Logical getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		public static class LogicalAnd extends NaryOperator {
			private LogicalAnd(List<Logical> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		public static class LogicalOr extends NaryOperator {
			private LogicalOr(List<Logical> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		/**
		 * A universally quantified formula. The trigger terms form a single multi-pattern which instructs the prover
		 * when to instantiate the quantifier. The quantifier identifier is used by the prover to report instantiation
		 * statistics and must be unique across the stream.
		 */
		public static class UniversalQuantifier extends AbstractItem implements Logical {
			private final List<Decl.Parameter> parameters;
			private final List<Expr> trigger;
			private final String qid;
			private final Logical body;

			private UniversalQuantifier(Collection<Decl.Parameter> parameters, List<Expr> trigger, String qid,
					Expr.Logical body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.trigger = new ArrayList<>(trigger);
				this.qid = qid;
				this.body = body;
			}

			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			public List<Expr> getTrigger() {
				return trigger;
			}

			/**
			 * Get the quantifier identifier, or <code>null</code> if none was given.
			 *
			 * @return
			 */
			public String getQid() {
				return qid;
			}

			public Logical getBody() {
				return body;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical {
			private final String variable;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				if(var == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
			}

			public String getVariable() {
				return variable;
			}

			@Override
			public String toString() {
				return "VAR(" + variable + ")";
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Int extends AbstractItem  implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}
		}

		/**
		 * A reference to a declared sort (or datatype) by name.
		 */
		public static class Synonym extends AbstractItem implements Type {
			private final String name;

			public Synonym(String name, Attribute... attributes) {
				super(attributes); this.name = name;
			}

			public String getSynonym() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Synonym && ((Synonym) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	@SuppressWarnings("unchecked")
	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
		};
	}

	public static Type SORT(String name) {
		return new Type.Synonym(name);
	}

	// Declarations
	public static Decl.Function FUNCTION(String name, LogicFile.Type parameter, LogicFile.Type returns, Attribute... attributes) {
		return FUNCTION(name, Arrays.asList(parameter), returns, attributes);
	}

	public static Decl.Function FUNCTION(String name, LogicFile.Type param1, LogicFile.Type param2,
			LogicFile.Type returns, Attribute... attributes) {
		return FUNCTION(name, Arrays.asList(param1, param2), returns, attributes);
	}

	public static Decl.Function FUNCTION(String name, List<LogicFile.Type> parameters, LogicFile.Type returns,
			Attribute... attributes) {
		ArrayList<Decl.Parameter> params = new ArrayList<>();
		for (LogicFile.Type t : parameters) {
			params.add(new Decl.Parameter(null, t));
		}
		return new Decl.Function(name, params, returns, attributes);
	}

	public static Decl.Axiom AXIOM(Expr.Logical operand, Attribute... attributes) {
		return new Decl.Axiom(operand, attributes);
	}

	// Logical Operators
	public static Expr.Logical AND(List<Expr.Logical> operands, Attribute... attributes) {
		List<Expr.Logical> kept = simplify(operands, true);
		if (kept == null) {
			return CONST(false, attributes);
		} else if (kept.size() < 2) {
			return kept.isEmpty() ? CONST(true, attributes) : kept.get(0);
		}
		return new Expr.LogicalAnd(kept, attributes);
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2), attributes);
	}

	public static Expr.Logical OR(List<Expr.Logical> operands, Attribute... attributes) {
		List<Expr.Logical> kept = simplify(operands, false);
		if (kept == null) {
			return CONST(true, attributes);
		} else if (kept.size() < 2) {
			return kept.isEmpty() ? CONST(false, attributes) : kept.get(0);
		}
		return new Expr.LogicalOr(kept, attributes);
	}

	/**
	 * Drop operands equal to the connective's unit. Returns <code>null</code> if some operand is the absorbing
	 * constant, in which case the whole connective collapses.
	 */
	private static List<Expr.Logical> simplify(List<Expr.Logical> operands, boolean unit) {
		ArrayList<Expr.Logical> kept = new ArrayList<>(operands.size());
		for (Expr.Logical operand : operands) {
			if (unit ? operand.isFalse() : operand.isTrue()) {
				return null;
			} else if (!(unit ? operand.isTrue() : operand.isFalse())) {
				kept.add(operand);
			}
		}
		return kept;
	}

	/**
	 * Construct a universal quantifier with a single multi-pattern trigger and a quantifier identifier.
	 *
	 * @param parameters
	 * @param trigger
	 * @param qid
	 * @param body
	 * @param attributes
	 * @return
	 */
	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, List<Expr> trigger, String qid,
			Expr.Logical body, Attribute... attributes) {
		if (parameters.isEmpty()) {
			throw new IllegalArgumentException("quantifier requires at least one parameter");
		}
		return new Expr.UniversalQuantifier(parameters, trigger, qid, body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, Expr.Logical body, Attribute... attributes) {
		return FORALL(parameters, Collections.emptyList(), null, body, attributes);
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if (lhs.isTrue()) {
			return rhs;
		} else if (lhs.isFalse() || rhs.isTrue()) {
			return CONST(true, attributes);
		}
		return rhs.isFalse() ? NOT(lhs, attributes) : new Expr.Implies(lhs, rhs, attributes);
	}

	public static Expr.Logical NOT(Expr.Logical operand, Attribute... attributes) {
		if (operand instanceof Expr.Boolean) {
			return CONST(!((Expr.Boolean) operand).getValue(), attributes);
		} else if (operand instanceof Expr.LogicalNot) {
			return ((Expr.LogicalNot) operand).getOperand();
		}
		return new Expr.LogicalNot(operand, attributes);
	}

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.Logical CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(int i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Attribute... attributes) {
		return new Expr.Invoke(name, Collections.emptyList(), attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr parameter, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(parameter), attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr parameter1, Expr parameter2, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(parameter1, parameter2), attributes);
	}

	public static Expr.Invoke INVOKE(String name, List<Expr> parameters, Attribute... attributes) {
		return new Expr.Invoke(name, parameters, attributes);
	}

	public static Expr.Apply APPLY(String name, Expr function, List<Expr> arguments, Attribute... attributes) {
		return new Expr.Apply(name, function, arguments, attributes);
	}

	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name, attributes);
	}
}
