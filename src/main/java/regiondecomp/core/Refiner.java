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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.solver.Dispatcher;
import regiondecomp.solver.Query;
import regiondecomp.util.Pair;

/**
 * Narrows a region by adding further constraints to it, for example to explore
 * the part of a region where some argument takes a particular value. The
 * refined region is checked afresh, and is discarded when it turns out to be
 * empty.
 *
 * @author David J. Pearce
 *
 */
public class Refiner {
	private final Registry registry;
	private final TermArena arena;
	private final Dispatcher dispatcher;
	private final int unrollBudget;
	private final long timeout;

	public Refiner(Registry registry, TermArena arena, Dispatcher dispatcher, int unrollBudget, long timeout) {
		this.registry = registry;
		this.arena = arena;
		this.dispatcher = dispatcher;
		this.unrollBudget = unrollBudget;
		this.timeout = timeout;
	}

	/**
	 * Refine a region with a number of additional constraints.
	 *
	 * @param region The region being refined, which is left unchanged.
	 * @param extra  Constraints over the arguments of the region.
	 * @return Either an empty list (if the refined region is infeasible) or a list
	 *         containing the refined region.
	 */
	public List<Region> refine(Region region, List<Term> extra) {
		Region r = narrow(region, extra);
		return select(r, dispatcher.submit(Query.of(r, unrollBudget, timeout)).get());
	}

	/**
	 * Refine several regions with the same additional constraints. The regions
	 * are checked in parallel and the results returned in order.
	 *
	 * @param regions
	 * @param extra
	 * @return
	 */
	public List<Region> refine(List<Region> regions, List<Term> extra) {
		ArrayList<Region> narrowed = new ArrayList<>();
		for (Region region : regions) {
			narrowed.add(narrow(region, extra));
		}
		ArrayList<Dispatcher.Request> requests = new ArrayList<>();
		for (Region r : narrowed) {
			requests.add(dispatcher.submit(Query.of(r, unrollBudget, timeout)));
		}
		ArrayList<Region> results = new ArrayList<>();
		for (int i = 0; i != narrowed.size(); ++i) {
			results.addAll(select(narrowed.get(i), requests.get(i).get()));
		}
		return results;
	}

	private Region narrow(Region region, List<Term> extra) {
		Pair<String, Type>[] args = region.getArguments();
		Map<String, Type> environment = environment(args);
		TypeChecker checker = new TypeChecker(registry);
		for (Term e : extra) {
			checker.check(environment, e, Type.Bool);
		}
		ArrayList<Term> constraints = new ArrayList<>(region.getConstraints());
		ArrayList<Choice> provenance = new ArrayList<>(region.getProvenance());
		for (Term e : extra) {
			Term c = arena.intern(e);
			if (!constraints.contains(c)) {
				constraints.add(c);
			}
			provenance.add(new Choice(Choice.Kind.REFINE, c));
		}
		return region.withConstraints(constraints.toArray(new Term[constraints.size()]),
				provenance.toArray(new Choice[provenance.size()]), Status.UNCHECKED);
	}

	private static List<Region> select(Region region, Status status) {
		if (status.kind() == Status.Kind.INFEASIBLE) {
			return Collections.emptyList();
		} else {
			return Collections.singletonList(region.withStatus(status));
		}
	}

	private static Map<String, Type> environment(Pair<String, Type>[] args) {
		HashMap<String, Type> env = new HashMap<>();
		for (Pair<String, Type> arg : args) {
			env.put(arg.first(), arg.second());
		}
		return env;
	}
}
