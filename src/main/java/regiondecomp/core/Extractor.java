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

import java.util.Optional;

import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.util.DecompositionError;
import regiondecomp.util.DecompositionError.TypeMismatch;
import regiondecomp.util.Pair;

/**
 * Turns the model of a feasible region into concrete arguments for a given
 * function, such that the function can be applied to them. An extractor is
 * bound once to a function signature and can then be reused across models.
 *
 * @author David J. Pearce
 *
 */
public class Extractor {
	private final FunctionDeclaration signature;

	private Extractor(FunctionDeclaration signature) {
		this.signature = signature;
	}

	public static Extractor bind(FunctionDeclaration signature) {
		return new Extractor(signature);
	}

	/**
	 * Get the model of a region, which is present only when the region is known
	 * to be feasible.
	 *
	 * @param region
	 * @return
	 */
	public static Optional<Model> getModel(Region region) {
		Status status = region.getStatus();
		if (status instanceof Status.Feasible) {
			return Optional.of(((Status.Feasible) status).getModel());
		} else {
			return Optional.empty();
		}
	}

	public FunctionDeclaration getSignature() {
		return signature;
	}

	/**
	 * Get the argument values of a model, in parameter order.
	 *
	 * @param model
	 * @return
	 */
	public Term[] arguments(Model model) {
		Pair<String, Type>[] params = signature.getParameters();
		Term[] args = new Term[params.length];
		for (int i = 0; i != params.length; ++i) {
			Term v = model.get(params[i].first());
			if (v == null) {
				throw new TypeMismatch(DecompositionError.MISSING_ARGUMENT, params[i].first());
			} else if (!Syntax.isValue(v) || !v.type().equals(params[i].second())) {
				throw new TypeMismatch(DecompositionError.EXPECTED_TYPE, params[i].first() + " = " + v);
			}
			args[i] = v;
		}
		return args;
	}

	/**
	 * Get an application of the bound function to the argument values of a
	 * model.
	 *
	 * @param model
	 * @return
	 */
	public Term.Invoke invocation(Model model) {
		return Syntax.invoke(signature.getName(), signature.getReturn(), arguments(model));
	}
}
