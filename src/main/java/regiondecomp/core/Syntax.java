// This file is part of the RegionDecomp Library (rdl).
//
// The RegionDecomp Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The RegionDecomp Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the RegionDecomp Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package regiondecomp.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import regiondecomp.util.Pair;

/**
 * Defines the term language over which decompositions are computed. This is a
 * small, first-order functional language over unbounded integers, booleans
 * and user-defined variants. Every term is immutable and identified by an
 * opcode, and every transformer over terms dispatches on that opcode.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_variable = 0;
	public final static int TERM_integer = 1;
	public final static int TERM_boolean = 2;
	public final static int TERM_construct = 3;
	public final static int TERM_field = 4;
	public final static int TERM_is = 5;
	public final static int TERM_operator = 6;
	public final static int TERM_invoke = 7;
	public final static int TERM_ifelse = 8;
	public final static int TERM_match = 9;

	/**
	 * The reserved name of the output symbol used in region invariants.
	 */
	public final static String RESULT = "$F";

	public interface Term {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Get the type of value this term produces.
		 *
		 * @return
		 */
		public Type type();

		/**
		 * Get the immediate subterms of this term, in a fixed order.
		 *
		 * @return
		 */
		public Term[] getOperands();

		/**
		 * Construct a term of the same shape as this, but with the given immediate
		 * subterms. No simplification is applied.
		 *
		 * @param operands
		 * @return
		 */
		public Term construct(Term[] operands);

		/**
		 * An abstract term to be implemented by all other terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm implements Term {
			private final int opcode;
			private int hash;

			public AbstractTerm(int opcode) {
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public Term[] getOperands() {
				return NO_TERMS;
			}

			@Override
			public Term construct(Term[] operands) {
				return this;
			}

			@Override
			public int hashCode() {
				int h = hash;
				if (h == 0) {
					h = computeHash();
					hash = h;
				}
				return h;
			}

			protected abstract int computeHash();
		}

		/**
		 * Represents a variable of a given type. The free variables of a region's
		 * constraints are exactly the parameters of the target function.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractTerm {
			private final String name;
			private final Type type;

			public Variable(String name, Type type) {
				super(TERM_variable);
				this.name = name;
				this.type = type;
			}

			public String name() {
				return name;
			}

			@Override
			public Type type() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variable) {
					Variable v = (Variable) o;
					return name.equals(v.name) && type.equals(v.type);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return name.hashCode() ^ type.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents the application of a variant constructor, such as
		 * <code>Cons(1, Nil)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Construct extends AbstractTerm {
			private final Type.Variant type;
			private final String constructor;
			private final Term[] operands;

			public Construct(Type.Variant type, String constructor, Term... operands) {
				super(TERM_construct);
				this.type = type;
				this.constructor = constructor;
				this.operands = operands;
			}

			public String constructor() {
				return constructor;
			}

			public Term get(int i) {
				return operands[i];
			}

			public int size() {
				return operands.length;
			}

			@Override
			public Type.Variant type() {
				return type;
			}

			@Override
			public Term[] getOperands() {
				return operands;
			}

			@Override
			public Term construct(Term[] operands) {
				return new Construct(type, constructor, operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Construct) {
					Construct c = (Construct) o;
					return constructor.equals(c.constructor) && type.equals(c.type)
							&& Arrays.equals(operands, c.operands);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return constructor.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public String toString() {
				if (operands.length == 0) {
					return constructor;
				} else {
					return constructor + "(" + join(operands, ", ") + ")";
				}
			}
		}

		/**
		 * Represents the extraction of the i<sup>th</sup> field from a value built
		 * with a given constructor. This is how pattern variables are eliminated
		 * during case splitting.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Field extends AbstractTerm {
			private final Type.Variant variant;
			private final String constructor;
			private final int index;
			private final Term operand;
			private final Type type;

			public Field(Type.Variant variant, String constructor, int index, Term operand, Type type) {
				super(TERM_field);
				this.variant = variant;
				this.constructor = constructor;
				this.index = index;
				this.operand = operand;
				this.type = type;
			}

			public Type.Variant variant() {
				return variant;
			}

			public String constructor() {
				return constructor;
			}

			public int index() {
				return index;
			}

			public Term operand() {
				return operand;
			}

			@Override
			public Type type() {
				return type;
			}

			@Override
			public Term[] getOperands() {
				return new Term[] { operand };
			}

			@Override
			public Term construct(Term[] operands) {
				return new Field(variant, constructor, index, operands[0], type);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Field) {
					Field f = (Field) o;
					return index == f.index && constructor.equals(f.constructor) && variant.equals(f.variant)
							&& operand.equals(f.operand) && type.equals(f.type);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return constructor.hashCode() ^ (31 * index) ^ operand.hashCode();
			}

			@Override
			public String toString() {
				return constructor + "." + index + "(" + operand + ")";
			}
		}

		/**
		 * Represents a test of whether a variant value was built with a given
		 * constructor.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Is extends AbstractTerm {
			private final Type.Variant variant;
			private final String constructor;
			private final Term operand;

			public Is(Type.Variant variant, String constructor, Term operand) {
				super(TERM_is);
				this.variant = variant;
				this.constructor = constructor;
				this.operand = operand;
			}

			public Type.Variant variant() {
				return variant;
			}

			public String constructor() {
				return constructor;
			}

			public Term operand() {
				return operand;
			}

			@Override
			public Type type() {
				return Type.Bool;
			}

			@Override
			public Term[] getOperands() {
				return new Term[] { operand };
			}

			@Override
			public Term construct(Term[] operands) {
				return new Is(variant, constructor, operands[0]);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Is) {
					Is i = (Is) o;
					return constructor.equals(i.constructor) && variant.equals(i.variant) && operand.equals(i.operand);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return 7 * constructor.hashCode() ^ operand.hashCode();
			}

			@Override
			public String toString() {
				return "is(" + constructor + ", " + operand + ")";
			}
		}

		/**
		 * Represents the application of a built-in operator.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Operator extends AbstractTerm {
			public enum Kind {
				ADD("+", 2, true),
				SUB("-", 2, true),
				MUL("*", 2, true),
				/**
				 * Euclidean division, as for SMT-LIB integers.
				 */
				DIV("/", 2, true),
				MOD("mod", 2, true),
				NEG("-", 1, true),
				LT("<", 2, false),
				LTEQ("<=", 2, false),
				GT(">", 2, false),
				GTEQ(">=", 2, false),
				EQ("=", 2, false),
				NEQ("<>", 2, false),
				/**
				 * Variadic conjunction
				 */
				AND("&&", -1, false),
				/**
				 * Variadic disjunction
				 */
				OR("||", -1, false),
				NOT("not", 1, false),
				IMPLIES("==>", 2, false);

				private final String symbol;
				private final int arity;
				private final boolean arithmetic;

				Kind(String symbol, int arity, boolean arithmetic) {
					this.symbol = symbol;
					this.arity = arity;
					this.arithmetic = arithmetic;
				}

				public String symbol() {
					return symbol;
				}

				/**
				 * Get the number of operands required, or -1 for variadic operators.
				 *
				 * @return
				 */
				public int arity() {
					return arity;
				}

				public boolean isArithmetic() {
					return arithmetic;
				}
			}

			private final Kind kind;
			private final Term[] operands;

			public Operator(Kind kind, Term... operands) {
				super(TERM_operator);
				this.kind = kind;
				this.operands = operands;
			}

			public Kind kind() {
				return kind;
			}

			public Term get(int i) {
				return operands[i];
			}

			public int size() {
				return operands.length;
			}

			@Override
			public Type type() {
				return kind.isArithmetic() ? Type.Int : Type.Bool;
			}

			@Override
			public Term[] getOperands() {
				return operands;
			}

			@Override
			public Term construct(Term[] operands) {
				return new Operator(kind, operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Operator) {
					Operator b = (Operator) o;
					return kind == b.kind && Arrays.equals(operands, b.operands);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return kind.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public String toString() {
				switch (kind) {
				case NEG:
					return "-" + bracket(operands[0]);
				case NOT:
					return "not (" + operands[0] + ")";
				default:
					String r = "";
					for (int i = 0; i != operands.length; ++i) {
						if (i != 0) {
							r += " " + kind.symbol + " ";
						}
						r += bracket(operands[i]);
					}
					return r;
				}
			}

			private static String bracket(Term t) {
				if (t instanceof Operator && ((Operator) t).kind != Kind.NOT) {
					return "(" + t + ")";
				} else {
					return t.toString();
				}
			}
		}

		/**
		 * Represents the application of a named function to zero or more operands.
		 * Depending on the basis, such an application is either inlined during case
		 * splitting or kept as an opaque term.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Invoke extends AbstractTerm {
			private final String name;
			private final Term[] operands;
			private final Type type;

			public Invoke(String name, Type type, Term... operands) {
				super(TERM_invoke);
				this.name = name;
				this.type = type;
				this.operands = operands;
			}

			public String name() {
				return name;
			}

			@Override
			public Type type() {
				return type;
			}

			@Override
			public Term[] getOperands() {
				return operands;
			}

			@Override
			public Term construct(Term[] operands) {
				return new Invoke(name, type, operands);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Invoke) {
					Invoke i = (Invoke) o;
					return name.equals(i.name) && type.equals(i.type) && Arrays.equals(operands, i.operands);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return name.hashCode() ^ Arrays.hashCode(operands);
			}

			@Override
			public String toString() {
				return name + "(" + join(operands, ", ") + ")";
			}
		}

		/**
		 * Represents a conditional expression of the form:
		 *
		 * <pre>
		 * if c then e1 else e2
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class IfElse extends AbstractTerm {
			private final Term condition;
			private final Term trueBranch;
			private final Term falseBranch;

			public IfElse(Term condition, Term trueBranch, Term falseBranch) {
				super(TERM_ifelse);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Term condition() {
				return condition;
			}

			public Term trueBranch() {
				return trueBranch;
			}

			public Term falseBranch() {
				return falseBranch;
			}

			@Override
			public Type type() {
				return trueBranch.type();
			}

			@Override
			public Term[] getOperands() {
				return new Term[] { condition, trueBranch, falseBranch };
			}

			@Override
			public Term construct(Term[] operands) {
				return new IfElse(operands[0], operands[1], operands[2]);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof IfElse) {
					IfElse i = (IfElse) o;
					return condition.equals(i.condition) && trueBranch.equals(i.trueBranch)
							&& falseBranch.equals(i.falseBranch);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return condition.hashCode() ^ (3 * trueBranch.hashCode()) ^ (5 * falseBranch.hashCode());
			}

			@Override
			public String toString() {
				return "if " + condition + " then " + trueBranch + " else " + falseBranch;
			}
		}

		/**
		 * Represents a pattern match over a variant value, such as:
		 *
		 * <pre>
		 * match l with
		 * | Nil -> 0
		 * | Cons(h, t) -> h
		 * </pre>
		 *
		 * Cases are tried in order. A wildcard case (written <code>_</code>) matches
		 * anything not matched by an earlier case and must come last.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Match extends AbstractTerm {
			private final Term scrutinee;
			private final Case[] cases;
			private final Type type;

			public Match(Term scrutinee, Type type, Case... cases) {
				super(TERM_match);
				this.scrutinee = scrutinee;
				this.type = type;
				this.cases = cases;
			}

			public Term scrutinee() {
				return scrutinee;
			}

			public int size() {
				return cases.length;
			}

			public Case get(int i) {
				return cases[i];
			}

			@Override
			public Type type() {
				return type;
			}

			@Override
			public Term[] getOperands() {
				Term[] operands = new Term[cases.length + 1];
				operands[0] = scrutinee;
				for (int i = 0; i != cases.length; ++i) {
					operands[i + 1] = cases[i].body;
				}
				return operands;
			}

			@Override
			public Term construct(Term[] operands) {
				Case[] ncases = new Case[cases.length];
				for (int i = 0; i != cases.length; ++i) {
					ncases[i] = new Case(cases[i].constructor, cases[i].variables, operands[i + 1]);
				}
				return new Match(operands[0], type, ncases);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Match) {
					Match m = (Match) o;
					return scrutinee.equals(m.scrutinee) && type.equals(m.type) && Arrays.equals(cases, m.cases);
				}
				return false;
			}

			@Override
			protected int computeHash() {
				return scrutinee.hashCode() ^ Arrays.hashCode(cases);
			}

			@Override
			public String toString() {
				String r = "match " + scrutinee + " with";
				for (Case c : cases) {
					r += " | " + c;
				}
				return r;
			}

			public static class Case {
				private final String constructor;
				private final Variable[] variables;
				private final Term body;

				/**
				 * Construct a case for a given constructor.
				 *
				 * @param constructor Constructor being matched, or <code>null</code> for the
				 *                    wildcard.
				 * @param variables   Variables bound to the constructor's fields, in order.
				 * @param body        Body evaluated when this case matches.
				 */
				public Case(String constructor, Variable[] variables, Term body) {
					this.constructor = constructor;
					this.variables = variables;
					this.body = body;
				}

				public String constructor() {
					return constructor;
				}

				public boolean isWildcard() {
					return constructor == null;
				}

				public Variable[] variables() {
					return variables;
				}

				public Term body() {
					return body;
				}

				@Override
				public boolean equals(Object o) {
					if (o instanceof Case) {
						Case c = (Case) o;
						return (constructor == null ? c.constructor == null : constructor.equals(c.constructor))
								&& Arrays.equals(variables, c.variables) && body.equals(c.body);
					}
					return false;
				}

				@Override
				public int hashCode() {
					return (constructor == null ? 0 : constructor.hashCode()) ^ body.hashCode();
				}

				@Override
				public String toString() {
					if (constructor == null) {
						return "_ -> " + body;
					} else if (variables.length == 0) {
						return constructor + " -> " + body;
					} else {
						return constructor + "(" + join(variables, ", ") + ") -> " + body;
					}
				}
			}
		}
	}

	/**
	 * A value is a term which cannot be reduced any further. Ground constructor
	 * applications are also values (see {@link Syntax#isValue(Term)}), though they
	 * are represented with {@link Term.Construct}.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Value extends Term {

		public static final Boolean True = new Boolean(true);
		public static final Boolean False = new Boolean(false);

		public class Integer extends Term.AbstractTerm implements Value {
			private final BigInteger value;

			public Integer(BigInteger value) {
				super(TERM_integer);
				this.value = value;
			}

			public Integer(long value) {
				this(BigInteger.valueOf(value));
			}

			public BigInteger value() {
				return value;
			}

			@Override
			public Type type() {
				return Type.Int;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Integer && ((Integer) o).value.equals(value);
			}

			@Override
			protected int computeHash() {
				return value.hashCode();
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public class Boolean extends Term.AbstractTerm implements Value {
			private final boolean value;

			public Boolean(boolean value) {
				super(TERM_boolean);
				this.value = value;
			}

			public boolean value() {
				return value;
			}

			@Override
			public Type type() {
				return Type.Bool;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boolean && ((Boolean) o).value == value;
			}

			@Override
			protected int computeHash() {
				return value ? 1231 : 1237;
			}

			@Override
			public String toString() {
				return value ? "true" : "false";
			}
		}
	}

	public interface Type {
		public static final Int Int = new Int();
		public static final Bool Bool = new Bool();

		public class Int implements Type {
			private Int() {
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "int";
			}
		}

		public class Bool implements Type {
			private Bool() {
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return "bool";
			}
		}

		/**
		 * A reference to a variant declared in a {@link Registry}.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variant implements Type {
			private final String name;

			public Variant(String name) {
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variant && ((Variant) o).name.equals(name);
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

	/**
	 * Represents the declaration of a variant (i.e. algebraic datatype), such as:
	 *
	 * <pre>
	 * type list = Nil | Cons of { head : int; tail : list }
	 * </pre>
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class VariantDeclaration {
		private final String name;
		private final Constructor[] constructors;

		public VariantDeclaration(String name, Constructor... constructors) {
			this.name = name;
			this.constructors = constructors;
		}

		public String getName() {
			return name;
		}

		public Type.Variant getType() {
			return new Type.Variant(name);
		}

		public Constructor[] getConstructors() {
			return constructors;
		}

		/**
		 * Get the constructor with a given name, or <code>null</code> if no such
		 * constructor exists.
		 *
		 * @param name
		 * @return
		 */
		public Constructor getConstructor(String name) {
			for (Constructor c : constructors) {
				if (c.getName().equals(name)) {
					return c;
				}
			}
			return null;
		}

		@Override
		public String toString() {
			return "type " + name + " = " + join(constructors, " | ");
		}

		public static class Constructor {
			private final String name;
			private final Pair<String, Type>[] fields;

			@SafeVarargs
			public Constructor(String name, Pair<String, Type>... fields) {
				this.name = name;
				this.fields = fields;
			}

			public String getName() {
				return name;
			}

			public int size() {
				return fields.length;
			}

			public String getFieldName(int i) {
				return fields[i].first();
			}

			public Type getFieldType(int i) {
				return fields[i].second();
			}

			@Override
			public String toString() {
				if (fields.length == 0) {
					return name;
				} else {
					return name + " of " + join(fields, " * ");
				}
			}
		}
	}

	/**
	 * Represents the declaration of a pure, total function. The
	 * <code>admitted</code> flag records whether the function has been proved
	 * terminating by the surrounding logic, which is a precondition for
	 * decomposition.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class FunctionDeclaration {
		private final String name;
		private final Pair<String, Type>[] params;
		private final Type ret;
		private final Term body;
		private final boolean admitted;

		@SafeVarargs
		public FunctionDeclaration(String name, Type ret, Term body, Pair<String, Type>... params) {
			this(name, true, ret, body, params);
		}

		@SafeVarargs
		public FunctionDeclaration(String name, boolean admitted, Type ret, Term body, Pair<String, Type>... params) {
			this.name = name;
			this.admitted = admitted;
			this.ret = ret;
			this.body = body;
			this.params = params;
		}

		/**
		 * Get the name of this function.
		 *
		 * @return
		 */
		public String getName() {
			return name;
		}

		/**
		 * Get the declared parameters for this function.
		 *
		 * @return
		 */
		public Pair<String, Type>[] getParameters() {
			return params;
		}

		/**
		 * Get the return type for this function.
		 *
		 * @return
		 */
		public Type getReturn() {
			return ret;
		}

		/**
		 * Get the body of this function.
		 *
		 * @return
		 */
		public Term getBody() {
			return body;
		}

		/**
		 * Determine whether this function has been established as terminating.
		 *
		 * @return
		 */
		public boolean isAdmitted() {
			return admitted;
		}

		/**
		 * Get a variable for each parameter of this function, in order.
		 *
		 * @return
		 */
		public Term.Variable[] toVariables() {
			Term.Variable[] vars = new Term.Variable[params.length];
			for (int i = 0; i != params.length; ++i) {
				vars[i] = new Term.Variable(params[i].first(), params[i].second());
			}
			return vars;
		}

		@Override
		public String toString() {
			String r = name + "(";
			for (int i = 0; i != params.length; ++i) {
				if (i != 0) {
					r += ", ";
				}
				r += params[i].first() + " : " + params[i].second();
			}
			return r + ") : " + ret;
		}
	}

	public static final Term[] NO_TERMS = new Term[0];

	// ==============================================================
	// Constructors
	// ==============================================================

	public static Pair<String, Type> param(String name, Type type) {
		return new Pair<>(name, type);
	}

	public static Term.Variable var(String name, Type type) {
		return new Term.Variable(name, type);
	}

	public static Value.Integer integer(long value) {
		return new Value.Integer(value);
	}

	public static Value.Boolean bool(boolean value) {
		return value ? Value.True : Value.False;
	}

	public static Term.Construct construct(Type.Variant type, String constructor, Term... operands) {
		return new Term.Construct(type, constructor, operands);
	}

	public static Term.Invoke invoke(String name, Type type, Term... operands) {
		return new Term.Invoke(name, type, operands);
	}

	public static Term.Match match(Term scrutinee, Type type, Term.Match.Case... cases) {
		return new Term.Match(scrutinee, type, cases);
	}

	public static Term.Match.Case when(String constructor, Term body, Term.Variable... variables) {
		return new Term.Match.Case(constructor, variables, body);
	}

	public static Term.Match.Case otherwise(Term body) {
		return new Term.Match.Case(null, new Term.Variable[0], body);
	}

	/**
	 * Extract a field from a variant value. Extraction from a literal constructor
	 * application of the same constructor is folded away.
	 */
	public static Term field(Type.Variant variant, String constructor, int index, Term operand, Type type) {
		if (operand instanceof Term.Construct) {
			Term.Construct c = (Term.Construct) operand;
			if (c.constructor().equals(constructor)) {
				return c.get(index);
			}
		}
		return new Term.Field(variant, constructor, index, operand, type);
	}

	/**
	 * Test whether a variant value has a given constructor. The test is decided
	 * immediately for literal constructor applications.
	 */
	public static Term is(Type.Variant variant, String constructor, Term operand) {
		if (operand instanceof Term.Construct) {
			return bool(((Term.Construct) operand).constructor().equals(constructor));
		}
		return new Term.Is(variant, constructor, operand);
	}

	public static Term ifElse(Term condition, Term trueBranch, Term falseBranch) {
		if (condition instanceof Value.Boolean) {
			return ((Value.Boolean) condition).value() ? trueBranch : falseBranch;
		} else if (trueBranch.equals(falseBranch)) {
			return trueBranch;
		}
		return new Term.IfElse(condition, trueBranch, falseBranch);
	}

	public static Term and(Term... operands) {
		ArrayList<Term> terms = new ArrayList<>();
		for (Term t : operands) {
			if (t instanceof Value.Boolean) {
				if (!((Value.Boolean) t).value()) {
					return Value.False;
				}
			} else if (t instanceof Term.Operator && ((Term.Operator) t).kind() == Term.Operator.Kind.AND) {
				for (Term o : t.getOperands()) {
					if (!terms.contains(o)) {
						terms.add(o);
					}
				}
			} else if (!terms.contains(t)) {
				terms.add(t);
			}
		}
		switch (terms.size()) {
		case 0:
			return Value.True;
		case 1:
			return terms.get(0);
		default:
			return new Term.Operator(Term.Operator.Kind.AND, terms.toArray(new Term[terms.size()]));
		}
	}

	public static Term or(Term... operands) {
		ArrayList<Term> terms = new ArrayList<>();
		for (Term t : operands) {
			if (t instanceof Value.Boolean) {
				if (((Value.Boolean) t).value()) {
					return Value.True;
				}
			} else if (t instanceof Term.Operator && ((Term.Operator) t).kind() == Term.Operator.Kind.OR) {
				for (Term o : t.getOperands()) {
					if (!terms.contains(o)) {
						terms.add(o);
					}
				}
			} else if (!terms.contains(t)) {
				terms.add(t);
			}
		}
		switch (terms.size()) {
		case 0:
			return Value.False;
		case 1:
			return terms.get(0);
		default:
			return new Term.Operator(Term.Operator.Kind.OR, terms.toArray(new Term[terms.size()]));
		}
	}

	/**
	 * Negate a boolean term. Negated comparisons are flipped rather than wrapped,
	 * so that <code>not(x &gt; 0)</code> becomes <code>x &lt;= 0</code>.
	 */
	public static Term not(Term operand) {
		if (operand instanceof Value.Boolean) {
			return bool(!((Value.Boolean) operand).value());
		} else if (operand instanceof Term.Operator) {
			Term.Operator o = (Term.Operator) operand;
			switch (o.kind()) {
			case NOT:
				return o.get(0);
			case LT:
				return new Term.Operator(Term.Operator.Kind.GTEQ, o.getOperands());
			case LTEQ:
				return new Term.Operator(Term.Operator.Kind.GT, o.getOperands());
			case GT:
				return new Term.Operator(Term.Operator.Kind.LTEQ, o.getOperands());
			case GTEQ:
				return new Term.Operator(Term.Operator.Kind.LT, o.getOperands());
			case EQ:
				return new Term.Operator(Term.Operator.Kind.NEQ, o.getOperands());
			case NEQ:
				return new Term.Operator(Term.Operator.Kind.EQ, o.getOperands());
			default:
				break;
			}
		}
		return new Term.Operator(Term.Operator.Kind.NOT, operand);
	}

	public static Term implies(Term lhs, Term rhs) {
		if (lhs instanceof Value.Boolean) {
			return ((Value.Boolean) lhs).value() ? rhs : Value.True;
		} else if (rhs instanceof Value.Boolean && ((Value.Boolean) rhs).value()) {
			return Value.True;
		}
		return new Term.Operator(Term.Operator.Kind.IMPLIES, lhs, rhs);
	}

	public static Term equal(Term lhs, Term rhs) {
		if (lhs.equals(rhs)) {
			return Value.True;
		} else if (isValue(lhs) && isValue(rhs)) {
			return Value.False;
		}
		return new Term.Operator(Term.Operator.Kind.EQ, lhs, rhs);
	}

	public static Term notEqual(Term lhs, Term rhs) {
		return not(equal(lhs, rhs));
	}

	public static Term lessThan(Term lhs, Term rhs) {
		return compare(Term.Operator.Kind.LT, lhs, rhs);
	}

	public static Term lessThanOrEqual(Term lhs, Term rhs) {
		return compare(Term.Operator.Kind.LTEQ, lhs, rhs);
	}

	public static Term greaterThan(Term lhs, Term rhs) {
		return compare(Term.Operator.Kind.GT, lhs, rhs);
	}

	public static Term greaterThanOrEqual(Term lhs, Term rhs) {
		return compare(Term.Operator.Kind.GTEQ, lhs, rhs);
	}

	public static Term add(Term lhs, Term rhs) {
		return arithmetic(Term.Operator.Kind.ADD, lhs, rhs);
	}

	public static Term subtract(Term lhs, Term rhs) {
		return arithmetic(Term.Operator.Kind.SUB, lhs, rhs);
	}

	public static Term multiply(Term lhs, Term rhs) {
		return arithmetic(Term.Operator.Kind.MUL, lhs, rhs);
	}

	public static Term divide(Term lhs, Term rhs) {
		return arithmetic(Term.Operator.Kind.DIV, lhs, rhs);
	}

	public static Term remainder(Term lhs, Term rhs) {
		return arithmetic(Term.Operator.Kind.MOD, lhs, rhs);
	}

	public static Term negate(Term operand) {
		if (operand instanceof Value.Integer) {
			return new Value.Integer(((Value.Integer) operand).value().negate());
		}
		return new Term.Operator(Term.Operator.Kind.NEG, operand);
	}

	/**
	 * Apply an operator of any kind to a given set of operands, folding where all
	 * relevant operands are literals.
	 *
	 * @param kind
	 * @param operands
	 * @return
	 */
	public static Term operator(Term.Operator.Kind kind, Term... operands) {
		switch (kind) {
		case AND:
			return and(operands);
		case OR:
			return or(operands);
		case NOT:
			return not(operands[0]);
		case IMPLIES:
			return implies(operands[0], operands[1]);
		case EQ:
			return equal(operands[0], operands[1]);
		case NEQ:
			return notEqual(operands[0], operands[1]);
		case NEG:
			return negate(operands[0]);
		case LT:
		case LTEQ:
		case GT:
		case GTEQ:
			return compare(kind, operands[0], operands[1]);
		default:
			return arithmetic(kind, operands[0], operands[1]);
		}
	}

	private static Term compare(Term.Operator.Kind kind, Term lhs, Term rhs) {
		if (lhs instanceof Value.Integer && rhs instanceof Value.Integer) {
			int c = ((Value.Integer) lhs).value().compareTo(((Value.Integer) rhs).value());
			switch (kind) {
			case LT:
				return bool(c < 0);
			case LTEQ:
				return bool(c <= 0);
			case GT:
				return bool(c > 0);
			default:
				return bool(c >= 0);
			}
		}
		return new Term.Operator(kind, lhs, rhs);
	}

	private static Term arithmetic(Term.Operator.Kind kind, Term lhs, Term rhs) {
		if (lhs instanceof Value.Integer && rhs instanceof Value.Integer) {
			BigInteger l = ((Value.Integer) lhs).value();
			BigInteger r = ((Value.Integer) rhs).value();
			switch (kind) {
			case ADD:
				return new Value.Integer(l.add(r));
			case SUB:
				return new Value.Integer(l.subtract(r));
			case MUL:
				return new Value.Integer(l.multiply(r));
			case DIV:
				if (r.signum() != 0) {
					BigInteger m = l.mod(r.abs());
					return new Value.Integer(l.subtract(m).divide(r));
				}
				break;
			case MOD:
				if (r.signum() != 0) {
					return new Value.Integer(l.mod(r.abs()));
				}
				break;
			default:
				throw new IllegalArgumentException("invalid arithmetic operator: " + kind);
			}
		}
		return new Term.Operator(kind, lhs, rhs);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Determine whether a given term is a value. That is, a literal or a
	 * constructor applied only to values.
	 *
	 * @param t
	 * @return
	 */
	public static boolean isValue(Term t) {
		switch (t.getOpcode()) {
		case TERM_integer:
		case TERM_boolean:
			return true;
		case TERM_construct:
			for (Term o : t.getOperands()) {
				if (!isValue(o)) {
					return false;
				}
			}
			return true;
		default:
			return false;
		}
	}

	/**
	 * Rebuild a term from a given set of operands, simplifying the result where
	 * possible. This is the counterpart of {@link Term#construct(Term[])} which
	 * performs no simplification.
	 *
	 * @param t
	 * @param operands
	 * @return
	 */
	public static Term rebuild(Term t, Term[] operands) {
		switch (t.getOpcode()) {
		case TERM_field: {
			Term.Field f = (Term.Field) t;
			return field(f.variant(), f.constructor(), f.index(), operands[0], f.type());
		}
		case TERM_is: {
			Term.Is i = (Term.Is) t;
			return is(i.variant(), i.constructor(), operands[0]);
		}
		case TERM_operator:
			return operator(((Term.Operator) t).kind(), operands);
		case TERM_ifelse:
			return ifElse(operands[0], operands[1], operands[2]);
		default:
			return t.construct(operands);
		}
	}

	/**
	 * Substitute terms for the free variables of a given term. Pattern matches
	 * are lowered into conditionals over <code>is</code> tests and field
	 * extractions in the process, hence the result contains no binders and
	 * substitution cannot capture variables.
	 *
	 * @param t
	 * @param binding
	 * @return
	 */
	public static Term substitute(Term t, Map<String, Term> binding) {
		switch (t.getOpcode()) {
		case TERM_variable: {
			Term r = binding.get(((Term.Variable) t).name());
			return r == null ? t : r;
		}
		case TERM_integer:
		case TERM_boolean:
			return t;
		case TERM_match: {
			Term.Match m = (Term.Match) t;
			Term scrutinee = substitute(m.scrutinee(), binding);
			return lower(m, scrutinee, 0, binding);
		}
		default: {
			Term[] operands = t.getOperands();
			Term[] noperands = new Term[operands.length];
			for (int i = 0; i != operands.length; ++i) {
				noperands[i] = substitute(operands[i], binding);
			}
			return rebuild(t, noperands);
		}
		}
	}

	private static Term lower(Term.Match m, Term scrutinee, int index, Map<String, Term> binding) {
		Term.Match.Case c = m.get(index);
		if (c.isWildcard()) {
			return substitute(c.body(), binding);
		}
		Type.Variant variant = (Type.Variant) scrutinee.type();
		HashMap<String, Term> nbinding = new HashMap<>(binding);
		Term.Variable[] vars = c.variables();
		for (int i = 0; i != vars.length; ++i) {
			nbinding.put(vars[i].name(), field(variant, c.constructor(), i, scrutinee, vars[i].type()));
		}
		Term body = substitute(c.body(), nbinding);
		if (index + 1 == m.size()) {
			// Last case of an exhaustive match
			return body;
		} else {
			return ifElse(is(variant, c.constructor(), scrutinee), body, lower(m, scrutinee, index + 1, binding));
		}
	}

	/**
	 * Collect all subterms with a given opcode, in depth-first order.
	 *
	 * @param t
	 * @param opcode
	 * @param items
	 */
	public static void collect(Term t, int opcode, List<Term> items) {
		if (t.getOpcode() == opcode) {
			items.add(t);
		}
		for (Term o : t.getOperands()) {
			collect(o, opcode, items);
		}
	}

	/**
	 * Check whether any subterm of the given terms has a given opcode.
	 *
	 * @param opcode
	 * @param terms
	 * @return
	 */
	public static boolean contains(int opcode, Term... terms) {
		for (Term t : terms) {
			if (t.getOpcode() == opcode || contains(opcode, t.getOperands())) {
				return true;
			}
		}
		return false;
	}

	public static String join(Object[] items, String separator) {
		String r = "";
		for (int i = 0; i != items.length; ++i) {
			if (i != 0) {
				r += separator;
			}
			r += items[i];
		}
		return r;
	}
}
