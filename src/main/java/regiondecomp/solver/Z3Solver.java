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
package regiondecomp.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Params;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Z3Exception;

import regiondecomp.core.Model;
import regiondecomp.core.Registry;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.core.Syntax.VariantDeclaration;
import regiondecomp.util.Pair;

/**
 * A solver backed by Z3. Integers and booleans map directly onto the
 * corresponding Z3 sorts, whilst variants are declared as (possibly mutually
 * recursive) algebraic datatypes. Function applications are unrolled to a
 * fixed depth, and any left at the frontier are treated as uninterpreted. In
 * that case, a model returned by Z3 need not be a genuine witness and is
 * confirmed by evaluating the original constraints.
 *
 * @author David J. Pearce
 *
 */
public class Z3Solver implements Solver {
	private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

	public static final String INSUFFICIENT_UNROLLING = "insufficient unrolling";

	private final Registry registry;

	public Z3Solver(Registry registry) {
		this.registry = registry;
	}

	@Override
	public Status check(Query query, Cancellation cancellation) {
		if (cancellation.isCancelled()) {
			return new Status.Unknown(cancellation.getReason());
		}
		Term[] constraints = new Unroller(registry, query.getUnrollBudget()).unroll(query.getConstraints());
		boolean frontier = Syntax.contains(Syntax.TERM_invoke, constraints);
		try (Context ctx = new Context()) {
			Interrupter interrupter = new Interrupter(ctx);
			cancellation.addListener(interrupter);
			try {
				return check(ctx, query, constraints, frontier, cancellation);
			} finally {
				interrupter.close();
				cancellation.removeListener(interrupter);
			}
		} catch (Z3Exception e) {
			logger.warn("z3 failed on {}: {}", query, e.getMessage());
			if (cancellation.isCancelled()) {
				return new Status.Unknown(cancellation.getReason());
			}
			return new Status.Unknown(String.valueOf(e.getMessage()));
		}
	}

	private Status check(Context ctx, Query query, Term[] constraints, boolean frontier, Cancellation cancellation) {
		Translator translator = new Translator(ctx, query.getArguments());
		com.microsoft.z3.Solver solver = ctx.mkSolver();
		Params params = ctx.mkParams();
		params.add("timeout", (int) Math.min(Integer.MAX_VALUE, Math.max(1, query.getTimeout())));
		solver.setParameters(params);
		for (Term c : constraints) {
			solver.add((BoolExpr) translator.translate(c));
		}
		com.microsoft.z3.Status result = solver.check();
		switch (result) {
		case UNSATISFIABLE:
			return Status.INFEASIBLE;
		case SATISFIABLE: {
			Model model = translator.extract(solver.getModel());
			if (frontier && !confirm(query.getConstraints(), model)) {
				logger.debug("model {} not confirmed for {}", model, query);
				return new Status.Unknown(INSUFFICIENT_UNROLLING);
			}
			return new Status.Feasible(model);
		}
		default:
			if (cancellation.isCancelled()) {
				return new Status.Unknown(cancellation.getReason());
			}
			return new Status.Unknown(solver.getReasonUnknown());
		}
	}

	/**
	 * Check a candidate model against the original constraints. Evaluation is
	 * bounded, so failure to evaluate means the model is not confirmed.
	 */
	private boolean confirm(Term[] constraints, Model model) {
		try {
			return new Interpreter(registry).holds(constraints, model);
		} catch (Interpreter.Fault e) {
			logger.debug("confirmation failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Interrupts a context on cancellation, provided the context is still open.
	 */
	private static class Interrupter implements Runnable {
		private final Context ctx;
		private boolean open = true;

		public Interrupter(Context ctx) {
			this.ctx = ctx;
		}

		@Override
		public synchronized void run() {
			if (open) {
				ctx.interrupt();
			}
		}

		public synchronized void close() {
			open = false;
		}
	}

	/**
	 * Responsible for translating terms into Z3 expressions within a single
	 * context, and for translating Z3 models back.
	 *
	 * @author David J. Pearce
	 *
	 */
	@SuppressWarnings({ "unchecked", "rawtypes" })
	private class Translator {
		private final Context ctx;
		private final HashMap<String, Integer> variants = new HashMap<>();
		private final DatatypeSort[] sorts;
		private final LinkedHashMap<String, Pair<Expr, Type>> variables = new LinkedHashMap<>();
		private final HashMap<String, FuncDecl> functions = new HashMap<>();
		private final HashMap<Term, Expr> cache = new HashMap<>();

		public Translator(Context ctx, Pair<String, Type>[] args) {
			this.ctx = ctx;
			this.sorts = declare(new ArrayList<>(registry.getVariants()));
			for (Pair<String, Type> arg : args) {
				variables.put(arg.first(), new Pair<>(ctx.mkConst(arg.first(), toSort(arg.second())), arg.second()));
			}
		}

		/**
		 * Declare all variants together, since they may be mutually recursive.
		 */
		private DatatypeSort[] declare(List<VariantDeclaration> decls) {
			if (decls.isEmpty()) {
				return new DatatypeSort[0];
			}
			String[] names = new String[decls.size()];
			for (int i = 0; i != names.length; ++i) {
				names[i] = decls.get(i).getName();
				variants.put(names[i], i);
			}
			Constructor[][] constructors = new Constructor[names.length][];
			for (int i = 0; i != names.length; ++i) {
				VariantDeclaration.Constructor[] cs = decls.get(i).getConstructors();
				constructors[i] = new Constructor[cs.length];
				for (int j = 0; j != cs.length; ++j) {
					VariantDeclaration.Constructor c = cs[j];
					String[] fields = new String[c.size()];
					Sort[] fieldSorts = new Sort[c.size()];
					int[] refs = new int[c.size()];
					for (int k = 0; k != c.size(); ++k) {
						fields[k] = names[i] + "_" + c.getName() + "_" + k;
						Type t = c.getFieldType(k);
						if (t instanceof Type.Variant) {
							refs[k] = variants.get(((Type.Variant) t).name());
						} else {
							fieldSorts[k] = toSort(t);
						}
					}
					constructors[i][j] = ctx.mkConstructor(names[i] + "_" + c.getName(),
							"is_" + names[i] + "_" + c.getName(), fields, fieldSorts, refs);
				}
			}
			return ctx.mkDatatypeSorts(names, constructors);
		}

		private Sort toSort(Type type) {
			if (type instanceof Type.Int) {
				return ctx.mkIntSort();
			} else if (type instanceof Type.Bool) {
				return ctx.mkBoolSort();
			} else {
				return sorts[indexOf((Type.Variant) type)];
			}
		}

		private int indexOf(Type.Variant type) {
			Integer i = variants.get(type.name());
			if (i == null) {
				throw new Z3Exception("unknown variant " + type);
			}
			return i;
		}

		private int indexOf(Type.Variant type, String constructor) {
			VariantDeclaration.Constructor[] cs = registry.getVariant(type).getConstructors();
			for (int i = 0; i != cs.length; ++i) {
				if (cs[i].getName().equals(constructor)) {
					return i;
				}
			}
			throw new Z3Exception("unknown constructor " + constructor);
		}

		public Expr translate(Term term) {
			Expr e = cache.get(term);
			if (e == null) {
				e = translateTerm(term);
				cache.put(term, e);
			}
			return e;
		}

		private Expr translateTerm(Term term) {
			switch (term.getOpcode()) {
			case Syntax.TERM_variable: {
				Pair<Expr, Type> v = variables.get(((Term.Variable) term).name());
				if (v == null) {
					throw new Z3Exception("unbound variable " + term);
				}
				return v.first();
			}
			case Syntax.TERM_integer:
				return ctx.mkInt(((Value.Integer) term).value().toString());
			case Syntax.TERM_boolean:
				return ctx.mkBool(((Value.Boolean) term).value());
			case Syntax.TERM_construct: {
				Term.Construct c = (Term.Construct) term;
				FuncDecl decl = sorts[indexOf(c.type())].getConstructors()[indexOf(c.type(), c.constructor())];
				return ctx.mkApp(decl, translate(c.getOperands()));
			}
			case Syntax.TERM_field: {
				Term.Field f = (Term.Field) term;
				FuncDecl[][] accessors = sorts[indexOf(f.variant())].getAccessors();
				FuncDecl decl = accessors[indexOf(f.variant(), f.constructor())][f.index()];
				return ctx.mkApp(decl, translate(f.operand()));
			}
			case Syntax.TERM_is: {
				Term.Is i = (Term.Is) term;
				FuncDecl decl = sorts[indexOf(i.variant())].getRecognizers()[indexOf(i.variant(), i.constructor())];
				return ctx.mkApp(decl, translate(i.operand()));
			}
			case Syntax.TERM_operator:
				return translateOperator((Term.Operator) term);
			case Syntax.TERM_invoke: {
				Term.Invoke i = (Term.Invoke) term;
				return ctx.mkApp(toFunction(i), translate(i.getOperands()));
			}
			case Syntax.TERM_ifelse: {
				Term.IfElse i = (Term.IfElse) term;
				return ctx.mkITE((BoolExpr) translate(i.condition()), translate(i.trueBranch()),
						translate(i.falseBranch()));
			}
			case Syntax.TERM_match:
				return translate(Syntax.substitute(term, Collections.emptyMap()));
			}
			throw new IllegalArgumentException("Invalid term encountered: " + term);
		}

		private Expr translateOperator(Term.Operator term) {
			Expr[] ops = translate(term.getOperands());
			switch (term.kind()) {
			case ADD:
				return ctx.mkAdd(ops);
			case SUB:
				return ctx.mkSub(ops);
			case MUL:
				return ctx.mkMul(ops);
			case DIV:
				return ctx.mkDiv(ops[0], ops[1]);
			case MOD:
				return ctx.mkMod(ops[0], ops[1]);
			case NEG:
				return ctx.mkUnaryMinus(ops[0]);
			case LT:
				return ctx.mkLt(ops[0], ops[1]);
			case LTEQ:
				return ctx.mkLe(ops[0], ops[1]);
			case GT:
				return ctx.mkGt(ops[0], ops[1]);
			case GTEQ:
				return ctx.mkGe(ops[0], ops[1]);
			case EQ:
				return ctx.mkEq(ops[0], ops[1]);
			case NEQ:
				return ctx.mkNot(ctx.mkEq(ops[0], ops[1]));
			case AND:
				return ctx.mkAnd(ops);
			case OR:
				return ctx.mkOr(ops);
			case NOT:
				return ctx.mkNot(ops[0]);
			case IMPLIES:
				return ctx.mkImplies(ops[0], ops[1]);
			default:
				throw new IllegalArgumentException("Invalid operator encountered: " + term);
			}
		}

		private Expr[] translate(Term[] terms) {
			Expr[] es = new Expr[terms.length];
			for (int i = 0; i != terms.length; ++i) {
				es[i] = translate(terms[i]);
			}
			return es;
		}

		/**
		 * Get the uninterpreted function standing in for applications of a given
		 * function at the unrolling frontier.
		 */
		private FuncDecl toFunction(Term.Invoke term) {
			FuncDecl f = functions.get(term.name());
			if (f == null) {
				Pair<String, Type>[] params = registry.getFunction(term.name()).getParameters();
				Sort[] domain = new Sort[params.length];
				for (int i = 0; i != params.length; ++i) {
					domain[i] = toSort(params[i].second());
				}
				f = ctx.mkFuncDecl("uf_" + term.name(), domain, toSort(term.type()));
				functions.put(term.name(), f);
			}
			return f;
		}

		/**
		 * Extract values for every argument from a Z3 model.
		 */
		public Model extract(com.microsoft.z3.Model model) {
			LinkedHashMap<String, Term> values = new LinkedHashMap<>();
			for (String name : variables.keySet()) {
				Pair<Expr, Type> v = variables.get(name);
				values.put(name, toTerm(model.evaluate(v.first(), true), v.second()));
			}
			return new Model(values);
		}

		private Term toTerm(Expr e, Type type) {
			if (type instanceof Type.Int) {
				if (!(e instanceof IntNum)) {
					throw new Z3Exception("expected integer value, found " + e);
				}
				return new Value.Integer(((IntNum) e).getBigInteger());
			} else if (type instanceof Type.Bool) {
				if (e.isTrue()) {
					return Value.True;
				} else if (e.isFalse()) {
					return Value.False;
				}
				throw new Z3Exception("expected boolean value, found " + e);
			} else {
				Type.Variant variant = (Type.Variant) type;
				if (!e.isApp()) {
					throw new Z3Exception("expected constructor, found " + e);
				}
				String name = e.getFuncDecl().getName().toString();
				VariantDeclaration decl = registry.getVariant(variant);
				for (VariantDeclaration.Constructor c : decl.getConstructors()) {
					if (name.equals(variant.name() + "_" + c.getName())) {
						Expr[] args = e.getArgs();
						Term[] fields = new Term[args.length];
						for (int i = 0; i != args.length; ++i) {
							fields[i] = toTerm(args[i], c.getFieldType(i));
						}
						return Syntax.construct(variant, c.getName(), fields);
					}
				}
				throw new Z3Exception("unknown constructor " + name);
			}
		}
	}
}
