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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.util.Pair;

/**
 * A symbolic region of the input space of a function. The region covers
 * exactly those inputs satisfying all of its constraints, and on every such
 * input the function's output is described by its invariant. Regions are
 * immutable.
 *
 * @author David J. Pearce
 *
 */
public class Region {
	private final int id;
	private final Pair<String, Type>[] args;
	private final Term[] constraints;
	private final Term invariant;
	private final Status status;
	private final Choice[] provenance;

	public Region(int id, Pair<String, Type>[] args, Term[] constraints, Term invariant, Status status,
			Choice[] provenance) {
		this.id = id;
		this.args = args;
		this.constraints = constraints;
		this.invariant = invariant;
		this.status = status;
		this.provenance = provenance;
	}

	/**
	 * Get the position of this region within the original (raw) decomposition it
	 * came from. This is preserved by pruning and refinement.
	 *
	 * @return
	 */
	public int getId() {
		return id;
	}

	/**
	 * Get the arguments of the decomposed function, over which all constraints
	 * are expressed.
	 *
	 * @return
	 */
	public Pair<String, Type>[] getArguments() {
		return args.clone();
	}

	/**
	 * Get the constraints of this region, all of which must hold.
	 *
	 * @return
	 */
	public List<Term> getConstraints() {
		return Collections.unmodifiableList(Arrays.asList(constraints));
	}

	/**
	 * Get the invariant of this region, which always has the form
	 * <code>$F = e</code>.
	 *
	 * @return
	 */
	public Term getInvariant() {
		return invariant;
	}

	/**
	 * Get the expression describing the output on this region. That is, the
	 * right-hand side of the invariant.
	 *
	 * @return
	 */
	public Term getOutput() {
		return ((Term.Operator) invariant).get(1);
	}

	public Status getStatus() {
		return status;
	}

	public List<Choice> getProvenance() {
		return Collections.unmodifiableList(Arrays.asList(provenance));
	}

	public Region withStatus(Status status) {
		return new Region(id, args, constraints, invariant, status, provenance);
	}

	public Region withConstraints(Term[] constraints, Choice[] provenance, Status status) {
		return new Region(id, args, constraints, invariant, status, provenance);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Region) {
			Region r = (Region) o;
			return id == r.id && Arrays.equals(args, r.args) && Arrays.equals(constraints, r.constraints)
					&& invariant.equals(r.invariant) && status.equals(r.status)
					&& Arrays.equals(provenance, r.provenance);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return id ^ Arrays.hashCode(constraints) ^ invariant.hashCode();
	}

	@Override
	public String toString() {
		String r = "---[ Region " + id + " (" + status + ") ]---\n";
		r += "Constraints: [ ";
		for (int i = 0; i != constraints.length; ++i) {
			if (i != 0) {
				r += "; ";
			}
			r += constraints[i];
		}
		r += " ]\nInvariant: " + invariant + "\n";
		return r;
	}
}
