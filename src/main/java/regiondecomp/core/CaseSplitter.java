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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.util.AbstractTransformer;
import regiondecomp.util.DecompositionError;
import regiondecomp.util.Pair;

/**
 * Symbolically evaluates the body of a function, splitting on every
 * conditional and pattern match encountered, to produce the raw regions of a
 * decomposition. Evaluating a term yields zero or more <i>paths</i>, each
 * being a symbolic state paired with the term computed along it. The state
 * records the path condition, the choices leading to it and the current
 * binding of variables to terms.
 *
 * @author David J. Pearce
 *
 */
public class CaseSplitter extends AbstractTransformer<CaseSplitter.State, List<Pair<CaseSplitter.State, Term>>> {
	private static final Logger logger = LoggerFactory.getLogger(CaseSplitter.class);

	private final Registry registry;
	private final TermArena arena;
	/**
	 * Functions which are not inlined.
	 */
	private final Set<String> basis;

	public CaseSplitter(Registry registry, TermArena arena, Set<String> basis) {
		this.registry = registry;
		this.arena = arena;
		this.basis = basis;
	}

	/**
	 * Decompose a given function into its raw regions.
	 *
	 * @param registry The registry holding the target and everything it calls.
	 * @param arena    Arena into which all region terms are interned.
	 * @param target   Name of the function being decomposed.
	 * @param assuming Name of a side condition restricting the regions produced,
	 *                 or <code>null</code>.
	 * @param basis    Names of functions to be left uninterpreted. The target is
	 *                 always included.
	 * @return
	 */
	public static Decomposition decompose(Registry registry, TermArena arena, String target, String assuming,
			Set<String> basis) {
		registry.validate(target);
		FunctionDeclaration f = registry.getFunction(target);
		LinkedHashSet<String> b = new LinkedHashSet<>();
		b.add(target);
		if (basis != null) {
			for (String n : basis) {
				// Check function exists
				registry.getFunction(n);
				b.add(n);
			}
		}
		FunctionDeclaration side = null;
		if (assuming != null) {
			registry.validate(assuming);
			side = registry.getFunction(assuming);
			checkSideCondition(f, side);
		}
		CaseSplitter splitter = new CaseSplitter(registry, arena, b);
		List<Region> regions = splitter.split(f, side);
		logger.debug("split {} into {} regions", target, regions.size());
		return new Decomposition(f, b, assuming, regions);
	}

	/**
	 * Check a side condition can be applied to a given target. Its parameters
	 * must match those of the target, optionally followed by one further
	 * parameter for the output. It must also return a boolean.
	 *
	 * @param target
	 * @param side
	 */
	private static void checkSideCondition(FunctionDeclaration target, FunctionDeclaration side) {
		Pair<String, Type>[] tparams = target.getParameters();
		Pair<String, Type>[] sparams = side.getParameters();
		boolean ok = side.getReturn().equals(Type.Bool)
				&& (sparams.length == tparams.length || sparams.length == tparams.length + 1);
		for (int i = 0; ok && i != tparams.length; ++i) {
			ok = tparams[i].second().equals(sparams[i].second());
		}
		if (ok && sparams.length > tparams.length) {
			ok = sparams[tparams.length].second().equals(target.getReturn());
		}
		if (!ok) {
			throw new DecompositionError.TypeMismatch(DecompositionError.INVALID_SIDE_CONDITION, side);
		}
	}

	/**
	 * Produce the regions for a given function, restricted by a given side
	 * condition (if applicable).
	 *
	 * @param f
	 * @param side
	 * @return
	 */
	public List<Region> split(FunctionDeclaration f, FunctionDeclaration side) {
		Term.Variable[] args = f.toVariables();
		HashMap<String, Term> bindings = new HashMap<>();
		for (Term.Variable v : args) {
			bindings.put(v.name(), v);
		}
		State init = new State(Syntax.NO_TERMS, new Choice[0], bindings);
		Term.Variable result = Syntax.var(Syntax.RESULT, f.getReturn());
		ArrayList<Region> regions = new ArrayList<>();
		for (Pair<State, Term> p : apply(init, f.getBody())) {
			State s = p.first();
			Term output = p.second();
			if (side != null) {
				s = s.assume(instantiate(side, args, output), null);
				if (s == null) {
					// Excluded by side condition
					continue;
				}
			}
			Term[] constraints = arena.intern(s.path);
			Term invariant = arena.intern(new Term.Operator(Term.Operator.Kind.EQ, result, output));
			Region r = new Region(regions.size(), f.getParameters(), constraints, invariant, Status.UNCHECKED,
					intern(s.provenance));
			logger.debug("region {}: {} ==> {}", r.getId(), Arrays.toString(constraints), invariant);
			regions.add(r);
		}
		return regions;
	}

	/**
	 * Apply a side condition to the arguments of a region, and its output.
	 * Conditionals in the side condition are not split upon.
	 */
	private Term instantiate(FunctionDeclaration side, Term.Variable[] args, Term output) {
		Term[] operands = Arrays.copyOf(args, side.getParameters().length, Term[].class);
		if (operands.length > args.length) {
			operands[args.length] = output;
		}
		if (basis.contains(side.getName())) {
			return Syntax.invoke(side.getName(), Type.Bool, operands);
		}
		HashMap<String, Term> binding = new HashMap<>();
		Pair<String, Type>[] params = side.getParameters();
		for (int i = 0; i != params.length; ++i) {
			binding.put(params[i].first(), operands[i]);
		}
		return Syntax.substitute(side.getBody(), binding);
	}

	private Choice[] intern(Choice[] choices) {
		Choice[] r = new Choice[choices.length];
		for (int i = 0; i != choices.length; ++i) {
			r[i] = new Choice(choices[i].kind(), arena.intern(choices[i].guard()));
		}
		return r;
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Variable term) {
		Term t = state.bindings.get(term.name());
		return single(state, t == null ? term : t);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Value.Integer value) {
		return single(state, value);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Value.Boolean value) {
		return single(state, value);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Construct term) {
		return rebuild(state, term);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Field term) {
		return rebuild(state, term);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Is term) {
		return rebuild(state, term);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Operator term) {
		return rebuild(state, term);
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Invoke term) {
		ArrayList<Pair<State, Term>> results = new ArrayList<>();
		String name = term.name();
		boolean opaque = basis.contains(name) || registry.isRecursive(name);
		for (Pair<State, Term[]> p : applyAll(state, term.getOperands())) {
			if (opaque) {
				results.add(new Pair<>(p.first(), Syntax.invoke(name, term.type(), p.second())));
			} else {
				// Inline the body with parameters bound to arguments
				FunctionDeclaration callee = registry.getFunction(name);
				Pair<String, Type>[] params = callee.getParameters();
				HashMap<String, Term> bindings = new HashMap<>();
				for (int i = 0; i != params.length; ++i) {
					bindings.put(params[i].first(), p.second()[i]);
				}
				State caller = p.first();
				for (Pair<State, Term> q : apply(caller.bind(bindings), callee.getBody())) {
					results.add(new Pair<>(q.first().bind(caller.bindings), q.second()));
				}
			}
		}
		return results;
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.IfElse term) {
		ArrayList<Pair<State, Term>> results = new ArrayList<>();
		for (Pair<State, Term> p : apply(state, term.condition())) {
			State s = p.first();
			Term c = p.second();
			Term known = s.lookup(c);
			if (Value.True.equals(known)) {
				results.addAll(apply(s, term.trueBranch()));
			} else if (Value.False.equals(known)) {
				results.addAll(apply(s, term.falseBranch()));
			} else {
				State t = s.assume(c, new Choice(Choice.Kind.TRUE, c));
				if (t != null) {
					results.addAll(apply(t, term.trueBranch()));
				}
				State f = s.assume(Syntax.not(c), new Choice(Choice.Kind.FALSE, c));
				if (f != null) {
					results.addAll(apply(f, term.falseBranch()));
				}
			}
		}
		return results;
	}

	@Override
	public List<Pair<State, Term>> apply(State state, Term.Match term) {
		ArrayList<Pair<State, Term>> results = new ArrayList<>();
		for (Pair<State, Term> p : apply(state, term.scrutinee())) {
			State s = p.first();
			Term scrutinee = p.second();
			Type.Variant variant = (Type.Variant) scrutinee.type();
			ArrayList<Term> earlier = new ArrayList<>();
			for (int i = 0; i != term.size(); ++i) {
				Term.Match.Case c = term.get(i);
				Term guard;
				if (c.isWildcard()) {
					Term[] negations = new Term[earlier.size()];
					for (int j = 0; j != negations.length; ++j) {
						negations[j] = Syntax.not(earlier.get(j));
					}
					guard = Syntax.and(negations);
				} else {
					guard = Syntax.is(variant, c.constructor(), scrutinee);
					earlier.add(guard);
				}
				Term known = s.lookup(guard);
				if (Value.False.equals(known)) {
					continue;
				}
				State t = Value.True.equals(known) ? s : s.assume(guard, new Choice(Choice.Kind.CASE, guard));
				if (t == null) {
					continue;
				}
				HashMap<String, Term> bindings = new HashMap<>(s.bindings);
				Term.Variable[] vars = c.variables();
				for (int j = 0; j != vars.length; ++j) {
					bindings.put(vars[j].name(), Syntax.field(variant, c.constructor(), j, scrutinee, vars[j].type()));
				}
				for (Pair<State, Term> q : apply(t.bind(bindings), c.body())) {
					results.add(new Pair<>(q.first().bind(s.bindings), q.second()));
				}
				if (Value.True.equals(known)) {
					// Remaining cases cannot be reached
					break;
				}
			}
		}
		return results;
	}

	/**
	 * Evaluate each operand of a compound term in turn, then rebuild the term on
	 * every resulting path.
	 */
	private List<Pair<State, Term>> rebuild(State state, Term term) {
		ArrayList<Pair<State, Term>> results = new ArrayList<>();
		for (Pair<State, Term[]> p : applyAll(state, term.getOperands())) {
			results.add(new Pair<>(p.first(), Syntax.rebuild(term, p.second())));
		}
		return results;
	}

	/**
	 * Evaluate a sequence of terms from left to right, producing the cartesian
	 * product of their paths.
	 */
	private List<Pair<State, Term[]>> applyAll(State state, Term[] terms) {
		List<Pair<State, Term[]>> results = new ArrayList<>();
		results.add(new Pair<>(state, Syntax.NO_TERMS));
		for (Term term : terms) {
			ArrayList<Pair<State, Term[]>> next = new ArrayList<>();
			for (Pair<State, Term[]> p : results) {
				Term[] prefix = p.second();
				for (Pair<State, Term> q : apply(p.first(), term)) {
					Term[] items = Arrays.copyOf(prefix, prefix.length + 1);
					items[prefix.length] = q.second();
					next.add(new Pair<>(q.first(), items));
				}
			}
			results = next;
		}
		return results;
	}

	private static List<Pair<State, Term>> single(State state, Term term) {
		return Collections.singletonList(new Pair<>(state, term));
	}

	/**
	 * A symbolic state along one path of evaluation. States are never modified
	 * once constructed.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class State {
		private final Term[] path;
		private final Choice[] provenance;
		private final Map<String, Term> bindings;

		public State(Term[] path, Choice[] provenance, Map<String, Term> bindings) {
			this.path = path;
			this.provenance = provenance;
			this.bindings = bindings;
		}

		public State bind(Map<String, Term> bindings) {
			return new State(path, provenance, bindings);
		}

		/**
		 * Extend the path condition of this state with a given condition, recording
		 * a given choice (if not <code>null</code>). Conjunctions are broken into
		 * their conjuncts and conjuncts already implied by the path are skipped.
		 *
		 * @param condition
		 * @param choice
		 * @return The extended state or <code>null</code> if the condition
		 *         contradicts the path.
		 */
		public State assume(Term condition, Choice choice) {
			Term[] conjuncts;
			if (condition instanceof Term.Operator && ((Term.Operator) condition).kind() == Term.Operator.Kind.AND) {
				conjuncts = condition.getOperands();
			} else {
				conjuncts = new Term[] { condition };
			}
			ArrayList<Term> npath = new ArrayList<>(Arrays.asList(path));
			State s = this;
			for (Term c : conjuncts) {
				Term known = s.lookup(c);
				if (Value.False.equals(known)) {
					return null;
				} else if (known == null) {
					npath.add(c);
					s = new State(npath.toArray(new Term[npath.size()]), provenance, bindings);
				}
			}
			Choice[] nprovenance = provenance;
			if (choice != null) {
				nprovenance = Arrays.copyOf(provenance, provenance.length + 1);
				nprovenance[provenance.length] = choice;
			}
			return new State(s.path, nprovenance, bindings);
		}

		/**
		 * Determine whether a given condition is already decided by the path
		 * condition of this state.
		 *
		 * @param condition
		 * @return <code>true</code> or <code>false</code> when the outcome is
		 *         known, otherwise <code>null</code>.
		 */
		public Term lookup(Term condition) {
			if (condition instanceof Value.Boolean) {
				return condition;
			} else if (condition instanceof Term.Operator) {
				Term.Operator o = (Term.Operator) condition;
				if (o.kind() == Term.Operator.Kind.NOT) {
					Term r = lookup(o.get(0));
					return r == null ? null : Syntax.not(r);
				} else if (o.kind() == Term.Operator.Kind.AND) {
					boolean all = true;
					for (Term c : o.getOperands()) {
						Term r = lookup(c);
						if (Value.False.equals(r)) {
							return Value.False;
						}
						all &= Value.True.equals(r);
					}
					return all ? Value.True : null;
				}
			}
			Term negation = Syntax.not(condition);
			for (Term p : path) {
				if (p.equals(condition)) {
					return Value.True;
				} else if (p.equals(negation) || Syntax.not(p).equals(condition)) {
					return Value.False;
				} else if (p instanceof Term.Is && condition instanceof Term.Is) {
					Term.Is i = (Term.Is) p;
					Term.Is j = (Term.Is) condition;
					if (i.operand().equals(j.operand()) && !i.constructor().equals(j.constructor())) {
						// Constructors are disjoint
						return Value.False;
					}
				}
			}
			return null;
		}
	}
}
