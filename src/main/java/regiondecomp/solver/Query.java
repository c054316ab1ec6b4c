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

import java.util.Arrays;

import regiondecomp.core.Region;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.util.Pair;

/**
 * A request to determine whether a conjunction of constraints over a set of
 * arguments is satisfiable.
 *
 * @author David J. Pearce
 *
 */
public class Query {
	private final Pair<String, Type>[] args;
	private final Term[] constraints;
	private final int unrollBudget;
	private final long timeout;

	public Query(Pair<String, Type>[] args, Term[] constraints, int unrollBudget, long timeout) {
		this.args = args;
		this.constraints = constraints;
		this.unrollBudget = unrollBudget;
		this.timeout = timeout;
	}

	/**
	 * Construct a query for the constraints of a given region.
	 *
	 * @param region
	 * @param unrollBudget
	 * @param timeout
	 * @return
	 */
	public static Query of(Region region, int unrollBudget, long timeout) {
		Term[] constraints = region.getConstraints().toArray(new Term[0]);
		return new Query(region.getArguments(), constraints, unrollBudget, timeout);
	}

	public Pair<String, Type>[] getArguments() {
		return args;
	}

	public Term[] getConstraints() {
		return constraints;
	}

	/**
	 * Get the number of levels to which opaque function applications may be
	 * expanded by a solver.
	 *
	 * @return
	 */
	public int getUnrollBudget() {
		return unrollBudget;
	}

	/**
	 * Get the wall clock time allowed for this query, in milliseconds.
	 *
	 * @return
	 */
	public long getTimeout() {
		return timeout;
	}

	@Override
	public String toString() {
		return Arrays.toString(constraints);
	}
}
