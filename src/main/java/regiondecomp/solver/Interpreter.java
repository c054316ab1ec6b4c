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

import java.util.HashMap;
import java.util.Map;

import regiondecomp.core.Model;
import regiondecomp.core.Registry;
import regiondecomp.core.Syntax;
import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.util.AbstractTransformer;
import regiondecomp.util.Pair;

/**
 * Evaluates ground terms to values under a given binding of variables. This is
 * used to confirm candidate models, hence evaluation is bounded by a given
 * amount of <i>fuel</i> which is consumed by every function application.
 * Evaluation which cannot complete raises a {@link Fault}.
 *
 * @author David J. Pearce
 *
 */
public class Interpreter extends AbstractTransformer<Map<String, Term>, Term> {
	public static final long DEFAULT_FUEL = 10000;

	private final Registry registry;
	private long fuel;

	public Interpreter(Registry registry) {
		this(registry, DEFAULT_FUEL);
	}

	public Interpreter(Registry registry, long fuel) {
		this.registry = registry;
		this.fuel = fuel;
	}

	/**
	 * Determine whether a given model satisfies every one of a set of
	 * constraints. Constraints are evaluated in order, stopping at the first
	 * which does not hold.
	 *
	 * @param constraints
	 * @param model
	 * @return
	 */
	public boolean holds(Term[] constraints, Model model) {
		Map<String, Term> binding = model.toMap();
		for (Term c : constraints) {
			if (!Value.True.equals(apply(binding, c))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Variable term) {
		Term v = binding.get(term.name());
		if (v == null) {
			throw new Fault("unbound variable " + term.name());
		}
		return v;
	}

	@Override
	public Term apply(Map<String, Term> binding, Value.Integer value) {
		return value;
	}

	@Override
	public Term apply(Map<String, Term> binding, Value.Boolean value) {
		return value;
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Construct term) {
		return term.construct(applyAll(binding, term.getOperands()));
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Field term) {
		Term.Construct c = toConstruct(apply(binding, term.operand()));
		if (!c.constructor().equals(term.constructor())) {
			throw new Fault("invalid field access " + term);
		}
		return c.get(term.index());
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Is term) {
		Term.Construct c = toConstruct(apply(binding, term.operand()));
		return Syntax.bool(c.constructor().equals(term.constructor()));
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Operator term) {
		switch (term.kind()) {
		case AND:
			for (Term operand : term.getOperands()) {
				if (!toBoolean(apply(binding, operand))) {
					return Value.False;
				}
			}
			return Value.True;
		case OR:
			for (Term operand : term.getOperands()) {
				if (toBoolean(apply(binding, operand))) {
					return Value.True;
				}
			}
			return Value.False;
		case IMPLIES:
			if (!toBoolean(apply(binding, term.get(0)))) {
				return Value.True;
			}
			return Syntax.bool(toBoolean(apply(binding, term.get(1))));
		default:
			Term r = Syntax.operator(term.kind(), applyAll(binding, term.getOperands()));
			if (!Syntax.isValue(r)) {
				// Only division by zero fails to fold
				throw new Fault("division by zero");
			}
			return r;
		}
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Invoke term) {
		if (fuel <= 0) {
			throw new Fault("out of fuel");
		}
		fuel = fuel - 1;
		FunctionDeclaration f = registry.getFunction(term.name());
		Term[] args = applyAll(binding, term.getOperands());
		Pair<String, Type>[] params = f.getParameters();
		HashMap<String, Term> frame = new HashMap<>();
		for (int i = 0; i != params.length; ++i) {
			frame.put(params[i].first(), args[i]);
		}
		return apply(frame, f.getBody());
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.IfElse term) {
		if (toBoolean(apply(binding, term.condition()))) {
			return apply(binding, term.trueBranch());
		} else {
			return apply(binding, term.falseBranch());
		}
	}

	@Override
	public Term apply(Map<String, Term> binding, Term.Match term) {
		Term.Construct c = toConstruct(apply(binding, term.scrutinee()));
		for (int i = 0; i != term.size(); ++i) {
			Term.Match.Case k = term.get(i);
			if (k.isWildcard()) {
				return apply(binding, k.body());
			} else if (k.constructor().equals(c.constructor())) {
				HashMap<String, Term> frame = new HashMap<>(binding);
				Term.Variable[] vars = k.variables();
				for (int j = 0; j != vars.length; ++j) {
					frame.put(vars[j].name(), c.get(j));
				}
				return apply(frame, k.body());
			}
		}
		throw new Fault("no case matched " + c);
	}

	private Term[] applyAll(Map<String, Term> binding, Term[] terms) {
		Term[] r = new Term[terms.length];
		for (int i = 0; i != terms.length; ++i) {
			r[i] = apply(binding, terms[i]);
		}
		return r;
	}

	private static boolean toBoolean(Term t) {
		if (t instanceof Value.Boolean) {
			return ((Value.Boolean) t).value();
		}
		throw new Fault("expected boolean, found " + t);
	}

	private static Term.Construct toConstruct(Term t) {
		if (t instanceof Term.Construct) {
			return (Term.Construct) t;
		}
		throw new Fault("expected constructor, found " + t);
	}

	/**
	 * Signals that evaluation could not be completed.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Fault extends RuntimeException {
		public Fault(String msg) {
			super(msg);
		}

		public static final long serialVersionUID = 1l;
	}
}
