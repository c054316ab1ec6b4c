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

import java.util.Collections;
import java.util.HashMap;

import regiondecomp.core.Registry;
import regiondecomp.core.Syntax;
import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.util.Pair;

/**
 * Expands function applications within a constraint by inlining their bodies,
 * up to a fixed depth. Applications remaining once the budget is used up form
 * the <i>frontier</i> and are left as they are. Pattern matches are lowered
 * into conditionals as a side effect.
 *
 * @author David J. Pearce
 *
 */
public class Unroller {
	private final Registry registry;
	private final int budget;

	public Unroller(Registry registry, int budget) {
		this.registry = registry;
		this.budget = budget;
	}

	public Term unroll(Term term) {
		return unroll(Syntax.substitute(term, Collections.emptyMap()), budget);
	}

	public Term[] unroll(Term[] terms) {
		Term[] r = new Term[terms.length];
		for (int i = 0; i != terms.length; ++i) {
			r[i] = unroll(terms[i]);
		}
		return r;
	}

	private Term unroll(Term term, int depth) {
		if (depth == 0 || !Syntax.contains(Syntax.TERM_invoke, term)) {
			return term;
		}
		Term[] operands = term.getOperands();
		Term[] noperands = new Term[operands.length];
		for (int i = 0; i != operands.length; ++i) {
			noperands[i] = unroll(operands[i], depth);
		}
		if (term instanceof Term.Invoke) {
			Term.Invoke invoke = (Term.Invoke) term;
			if (!registry.isFunction(invoke.name())) {
				return invoke.construct(noperands);
			}
			FunctionDeclaration f = registry.getFunction(invoke.name());
			Pair<String, Type>[] params = f.getParameters();
			HashMap<String, Term> binding = new HashMap<>();
			for (int i = 0; i != params.length; ++i) {
				binding.put(params[i].first(), noperands[i]);
			}
			return unroll(Syntax.substitute(f.getBody(), binding), depth - 1);
		} else {
			return Syntax.rebuild(term, noperands);
		}
	}
}
