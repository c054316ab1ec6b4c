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
package regiondecomp;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import regiondecomp.core.CaseSplitter;
import regiondecomp.core.Decomposition;
import regiondecomp.core.Extractor;
import regiondecomp.core.Hierarchy;
import regiondecomp.core.Model;
import regiondecomp.core.Pruner;
import regiondecomp.core.Refiner;
import regiondecomp.core.Region;
import regiondecomp.core.Registry;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.TermArena;
import regiondecomp.solver.Dispatcher;
import regiondecomp.solver.Solver;
import regiondecomp.solver.Z3Solver;

/**
 * The entry point for decomposing functions held in a registry into regions,
 * and for subsequently pruning, refining and extracting witnesses from those
 * regions. A decomposer owns the worker threads on which solver queries are
 * run, hence it should be closed when no longer required.
 *
 * @author David J. Pearce
 *
 */
public class Decomposer implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(Decomposer.class);

	private final Registry registry;

	/**
	 * Arena shared by all decompositions from this decomposer.
	 */
	private final TermArena arena = new TermArena();

	/**
	 * Solver used to check regions.
	 */
	private Solver solver;

	/**
	 * Number of levels to which function applications are unrolled by a solver.
	 */
	private int unrollBudget = 2;

	/**
	 * Wall clock time allowed for each solver query, in milliseconds.
	 */
	private long timeout = 10000;

	/**
	 * Configure number of threads to use for solver queries.
	 */
	private int nthreads = Runtime.getRuntime().availableProcessors();

	/**
	 * Determines whether pruning keeps regions of unknown status.
	 */
	private boolean retainUnknown = true;

	/**
	 * Created on demand, and discarded whenever the configuration changes.
	 */
	private Dispatcher dispatcher;

	public Decomposer(Registry registry) {
		this.registry = registry;
		this.solver = new Z3Solver(registry);
	}

	public Registry getRegistry() {
		return registry;
	}

	public TermArena getArena() {
		return arena;
	}

	/**
	 * Configure the depth to which opaque function applications are unrolled
	 * when checking regions.
	 *
	 * @param budget
	 * @return
	 */
	public Decomposer setUnrollBudget(int budget) {
		if (budget < 0) {
			throw new IllegalArgumentException("invalid unroll budget");
		}
		this.unrollBudget = budget;
		return this;
	}

	/**
	 * Configure the time allowed for checking any one region.
	 *
	 * @param millis
	 * @return
	 */
	public synchronized Decomposer setTimeout(long millis) {
		this.timeout = millis;
		reset();
		return this;
	}

	/**
	 * Configure the number of regions which may be checked at the same time.
	 *
	 * @param nthreads
	 * @return
	 */
	public synchronized Decomposer setDispatchWidth(int nthreads) {
		this.nthreads = nthreads;
		reset();
		return this;
	}

	/**
	 * Configure whether pruning retains regions whose status could not be
	 * determined.
	 *
	 * @param flag
	 * @return
	 */
	public Decomposer setRetainUnknown(boolean flag) {
		this.retainUnknown = flag;
		return this;
	}

	public synchronized Decomposer setSolver(Solver solver) {
		this.solver = solver;
		reset();
		return this;
	}

	/**
	 * Decompose a given function into regions, treating only the function itself
	 * as opaque.
	 *
	 * @param name
	 * @return
	 */
	public Decomposition top(String name) {
		return top(name, null, false, null);
	}

	/**
	 * Decompose a given function into regions.
	 *
	 * @param name     Function to decompose.
	 * @param assuming Side condition restricting the regions, or
	 *                 <code>null</code>.
	 * @param prune    Whether or not to remove infeasible regions.
	 * @param basis    Functions to leave uninterpreted, or <code>null</code>.
	 * @return
	 */
	public Decomposition top(String name, String assuming, boolean prune, Set<String> basis) {
		Decomposition d = CaseSplitter.decompose(registry, arena, name, assuming, basis);
		logger.info("decomposed {} into {} regions", name, d.size());
		return prune ? prune(d) : d;
	}

	public List<Region> getRegions(Decomposition decomposition) {
		return decomposition.getRegions();
	}

	public Status.Kind status(Region region) {
		return region.getStatus().kind();
	}

	public Optional<Model> getModel(Region region) {
		return Extractor.getModel(region);
	}

	public Decomposition prune(Decomposition decomposition) {
		return new Pruner(getDispatcher(), unrollBudget, timeout).setRetainUnknown(retainUnknown).prune(decomposition);
	}

	public List<Region> refine(Region region, Term... extra) {
		return refine(region, Arrays.asList(extra));
	}

	public List<Region> refine(Region region, List<Term> extra) {
		return newRefiner().refine(region, extra);
	}

	/**
	 * Refine several regions at once, returning the refined regions which remain
	 * in order.
	 *
	 * @param regions
	 * @param extra
	 * @return
	 */
	public List<Region> refine(List<Region> regions, List<Term> extra) {
		return newRefiner().refine(regions, extra);
	}

	public Hierarchy.Node hierarchy(Decomposition decomposition) {
		return Hierarchy.build(decomposition);
	}

	/**
	 * Get an extractor for turning models into arguments for a given function.
	 *
	 * @param name
	 * @return
	 */
	public Extractor extractor(String name) {
		return Extractor.bind(registry.getFunction(name));
	}

	@Override
	public synchronized void close() {
		reset();
	}

	private Refiner newRefiner() {
		return new Refiner(registry, arena, getDispatcher(), unrollBudget, timeout);
	}

	private synchronized Dispatcher getDispatcher() {
		if (dispatcher == null) {
			dispatcher = new Dispatcher(solver, nthreads, timeout);
		}
		return dispatcher;
	}

	private void reset() {
		if (dispatcher != null) {
			dispatcher.close();
			dispatcher = null;
		}
	}
}
