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

/**
 * Records what is known about the satisfiability of a region's constraints.
 * A region is either known to be feasible (in which case a witnessing model is
 * available), known to be infeasible, or its status is unknown. The latter
 * covers regions which have not been checked yet, along with checks which ran
 * out of time or budget.
 *
 * @author David J. Pearce
 *
 */
public abstract class Status {
	public enum Kind {
		FEASIBLE, INFEASIBLE, UNKNOWN
	}

	/**
	 * The reason given to a region which has never been submitted to a solver.
	 */
	public static final String UNCHECKED_REASON = "unchecked";

	public static final Unknown UNCHECKED = new Unknown(UNCHECKED_REASON);

	public static final Infeasible INFEASIBLE = new Infeasible();

	private final Kind kind;

	private Status(Kind kind) {
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Determine whether this status settles the feasibility of a region. Unknown
	 * statuses, including the initial one, may change when checked again.
	 *
	 * @return
	 */
	public boolean isResolved() {
		return kind != Kind.UNKNOWN;
	}

	public static class Feasible extends Status {
		private final Model model;

		public Feasible(Model model) {
			super(Kind.FEASIBLE);
			this.model = model;
		}

		public Model getModel() {
			return model;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Feasible && ((Feasible) o).model.equals(model);
		}

		@Override
		public int hashCode() {
			return model.hashCode();
		}

		@Override
		public String toString() {
			return "Feasible" + model;
		}
	}

	public static class Infeasible extends Status {
		private Infeasible() {
			super(Kind.INFEASIBLE);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Infeasible;
		}

		@Override
		public int hashCode() {
			return 0;
		}

		@Override
		public String toString() {
			return "Infeasible";
		}
	}

	public static class Unknown extends Status {
		private final String reason;

		public Unknown(String reason) {
			super(Kind.UNKNOWN);
			this.reason = reason;
		}

		public String getReason() {
			return reason;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Unknown && ((Unknown) o).reason.equals(reason);
		}

		@Override
		public int hashCode() {
			return reason.hashCode();
		}

		@Override
		public String toString() {
			return "Unknown(" + reason + ")";
		}
	}
}
