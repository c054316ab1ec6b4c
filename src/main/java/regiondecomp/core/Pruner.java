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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import regiondecomp.solver.Dispatcher;
import regiondecomp.solver.Query;

/**
 * Removes regions which cannot be entered from a decomposition. Every region
 * not yet checked is submitted to a solver, and those shown to be infeasible
 * are dropped. Regions whose status could not be determined are kept by
 * default, though this can be changed. Regions whose status is unknown are
 * submitted again, since a larger unrolling budget or timeout may now resolve
 * them. Feasible regions keep their status.
 *
 * @author David J. Pearce
 *
 */
public class Pruner {
	private static final Logger logger = LoggerFactory.getLogger(Pruner.class);

	private final Dispatcher dispatcher;
	private final int unrollBudget;
	private final long timeout;
	/**
	 * Determines whether regions of unknown status are kept.
	 */
	private boolean retainUnknown = true;

	public Pruner(Dispatcher dispatcher, int unrollBudget, long timeout) {
		this.dispatcher = dispatcher;
		this.unrollBudget = unrollBudget;
		this.timeout = timeout;
	}

	public Pruner setRetainUnknown(boolean flag) {
		this.retainUnknown = flag;
		return this;
	}

	public Decomposition prune(Decomposition decomposition) {
		List<Region> regions = decomposition.getRegions();
		Dispatcher.Request[] requests = new Dispatcher.Request[regions.size()];
		for (int i = 0; i != requests.length; ++i) {
			Region r = regions.get(i);
			if (!r.getStatus().isResolved()) {
				requests[i] = dispatcher.submit(Query.of(r, unrollBudget, timeout));
			}
		}
		ArrayList<Region> remaining = new ArrayList<>();
		for (int i = 0; i != requests.length; ++i) {
			Region r = regions.get(i);
			Status status = requests[i] == null ? r.getStatus() : requests[i].get();
			switch (status.kind()) {
			case INFEASIBLE:
				logger.debug("pruned region {}", r.getId());
				break;
			case UNKNOWN:
				if (!retainUnknown) {
					logger.debug("dropped region {} ({})", r.getId(), status);
					break;
				}
				// fall through
			default:
				remaining.add(r.withStatus(status));
			}
		}
		logger.info("pruned {}: {} of {} regions remain", decomposition.getTarget().getName(), remaining.size(),
				regions.size());
		return decomposition.withRegions(remaining);
	}
}
