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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import regiondecomp.core.Syntax.FunctionDeclaration;

/**
 * The result of decomposing a function, made up from an ordered list of
 * regions. A decomposition is immutable, so pruning and refinement produce new
 * decompositions rather than altering this one.
 *
 * @author David J. Pearce
 *
 */
public class Decomposition {
	private final FunctionDeclaration target;
	private final Set<String> basis;
	private final String assuming;
	private final List<Region> regions;

	public Decomposition(FunctionDeclaration target, Set<String> basis, String assuming, List<Region> regions) {
		this.target = target;
		this.basis = Collections.unmodifiableSet(new LinkedHashSet<>(basis));
		this.assuming = assuming;
		this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
	}

	/**
	 * Get the function which was decomposed.
	 *
	 * @return
	 */
	public FunctionDeclaration getTarget() {
		return target;
	}

	/**
	 * Get the names of functions which were treated as opaque during case
	 * splitting. This always includes the target itself.
	 *
	 * @return
	 */
	public Set<String> getBasis() {
		return basis;
	}

	/**
	 * Get the name of the side condition used, or <code>null</code> if there was
	 * none.
	 *
	 * @return
	 */
	public String getAssuming() {
		return assuming;
	}

	public List<Region> getRegions() {
		return regions;
	}

	public int size() {
		return regions.size();
	}

	public Region get(int i) {
		return regions.get(i);
	}

	/**
	 * Find the region with a given identifier, or <code>null</code> if it is not
	 * part of this decomposition (e.g. because it was pruned).
	 *
	 * @param id
	 * @return
	 */
	public Region getRegion(int id) {
		for (Region r : regions) {
			if (r.getId() == id) {
				return r;
			}
		}
		return null;
	}

	public Decomposition withRegions(List<Region> regions) {
		return new Decomposition(target, basis, assuming, regions);
	}

	@Override
	public String toString() {
		String r = "Decomposition of " + target + " (" + regions.size() + " regions)\n";
		for (Region region : regions) {
			r += region;
		}
		return r;
	}
}
