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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import regiondecomp.core.Syntax.Term;

/**
 * A concrete assignment of values to the arguments of a function, as produced
 * by a solver when showing a region is feasible. Values are literal terms,
 * namely integers, booleans or ground constructor applications.
 *
 * @author David J. Pearce
 *
 */
public class Model {
	private final LinkedHashMap<String, Term> values;

	public Model(Map<String, Term> values) {
		this.values = new LinkedHashMap<>(values);
	}

	/**
	 * Get the value assigned to a given argument, or <code>null</code> if none.
	 *
	 * @param name
	 * @return
	 */
	public Term get(String name) {
		return values.get(name);
	}

	public Set<String> getNames() {
		return Collections.unmodifiableSet(values.keySet());
	}

	public Map<String, Term> toMap() {
		return Collections.unmodifiableMap(values);
	}

	public int size() {
		return values.size();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Model && ((Model) o).values.equals(values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		String r = "{";
		boolean firstTime = true;
		for (Map.Entry<String, Term> e : values.entrySet()) {
			if (!firstTime) {
				r += ", ";
			}
			firstTime = false;
			r += e.getKey() + " = " + e.getValue();
		}
		return r + "}";
	}
}
