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

import regiondecomp.core.Status;

/**
 * A decision procedure for the satisfiability of region constraints. A solver
 * never throws on timeout or exhaustion, it reports an unknown status instead.
 *
 * @author David J. Pearce
 *
 */
public interface Solver {
	/**
	 * Check whether the constraints of a query are satisfiable.
	 *
	 * @param query        The query to check.
	 * @param cancellation Signals that the caller is no longer interested in the
	 *                     outcome.
	 * @return <code>Feasible</code> with a witnessing model,
	 *         <code>Infeasible</code> or <code>Unknown</code>.
	 */
	public Status check(Query query, Cancellation cancellation);
}
