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

import regiondecomp.core.Syntax.Term;

/**
 * A single decision taken on the way to a region. The provenance of a region
 * is the sequence of choices made by case splitting, followed by any
 * constraints added through refinement.
 *
 * @author David J. Pearce
 *
 */
public class Choice {
	public enum Kind {
		/**
		 * The condition of a conditional was taken to hold.
		 */
		TRUE,
		/**
		 * The condition of a conditional was taken not to hold.
		 */
		FALSE,
		/**
		 * A particular case of a match was taken.
		 */
		CASE,
		/**
		 * A constraint added by refinement.
		 */
		REFINE
	}

	private final Kind kind;
	private final Term guard;

	public Choice(Kind kind, Term guard) {
		this.kind = kind;
		this.guard = guard;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Get the term which this choice is about. For conditionals this is the
	 * condition itself (not its negation), for cases it is the guard under which
	 * the case is taken.
	 *
	 * @return
	 */
	public Term guard() {
		return guard;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Choice) {
			Choice c = (Choice) o;
			return kind == c.kind && guard.equals(c.guard);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ guard.hashCode();
	}

	@Override
	public String toString() {
		switch (kind) {
		case TRUE:
			return "[" + guard + "]";
		case FALSE:
			return "[not (" + guard + ")]";
		case CASE:
			return "[case " + guard + "]";
		default:
			return "[refine " + guard + "]";
		}
	}
}
