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
package regiondecomp.testing;

import static org.junit.Assert.*;
import static regiondecomp.core.Syntax.*;
import static regiondecomp.testing.Fixtures.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import org.junit.*;

import regiondecomp.Decomposer;
import regiondecomp.core.Decomposition;
import regiondecomp.core.Model;
import regiondecomp.core.Region;
import regiondecomp.core.Registry;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.solver.EnumerativeSolver;
import regiondecomp.solver.Interpreter;
import regiondecomp.util.Pair;

/**
 * Tests which check decompositions against concrete evaluation over small
 * input spaces. Every input must fall into exactly one region, and the output
 * of that region must agree with evaluating the function.
 *
 * @author David J. Pearce
 *
 */
public class PropertyTests {
	private static final Registry REGISTRY = Fixtures.registry();

	// ==============================================================
	// Coverage
	// ==============================================================

	@Test
	public void test_01() {
		checkCoverage("sign", null);
	}

	@Test
	public void test_02() {
		checkCoverage("nested", null);
	}

	@Test
	public void test_03() {
		checkCoverage("classify", null);
	}

	@Test
	public void test_04() {
		checkCoverage("fixed", null);
	}

	@Test
	public void test_05() {
		checkCoverage("fixed", Collections.singleton("inc"));
	}

	@Test
	public void test_06() {
		checkCoverage("len", null);
	}

	@Test
	public void test_07() {
		checkCoverage("first", null);
	}

	@Test
	public void test_08() {
		checkCoverage("pair", null);
	}

	@Test
	public void test_09() {
		checkCoverage("parity", null);
	}

	@Test
	public void test_10() {
		// Inputs excluded by a side condition fall into no region
		try (Decomposer decomposer = new Decomposer(REGISTRY)) {
			Decomposition d = decomposer.top("sign", "isPos", false, null);
			for (Model input : inputs(d)) {
				Term admitted = new Interpreter(REGISTRY).apply(input.toMap(), invoke("isPos", Type.Bool, X));
				assertEquals(admitted.equals(bool(true)) ? 1 : 0, matching(d, input).size());
			}
		}
	}

	// ==============================================================
	// Pruning
	// ==============================================================

	@Test
	public void test_20() {
		// Bounded search cannot refute x * x < 0
		try (Decomposer decomposer = new Decomposer(REGISTRY).setSolver(enumerative())) {
			Decomposition d = decomposer.prune(decomposer.top("nested"));
			assertEquals(3, d.size());
			assertEquals(new Status.Unknown(EnumerativeSolver.BOUND_EXHAUSTED), d.get(0).getStatus());
			assertEquals(Status.Kind.FEASIBLE, decomposer.status(d.get(1)));
			assertEquals(Status.Kind.FEASIBLE, decomposer.status(d.get(2)));
			checkCoverage(d);
		}
	}

	@Test
	public void test_21() {
		// Pruning is idempotent
		try (Decomposer decomposer = new Decomposer(REGISTRY).setSolver(enumerative())) {
			Decomposition once = decomposer.top("classify", null, true, null);
			Decomposition twice = decomposer.prune(once);
			assertEquals(once.getRegions(), twice.getRegions());
		}
	}

	@Test
	public void test_22() {
		// Unknown regions can be discarded
		try (Decomposer decomposer = new Decomposer(REGISTRY).setSolver(enumerative()).setRetainUnknown(false)) {
			Decomposition d = decomposer.top("nested", null, true, null);
			assertEquals(2, d.size());
			assertEquals(1, d.get(0).getId());
			assertEquals(2, d.get(1).getId());
		}
	}

	@Test
	public void test_23() {
		// Pruning only removes regions
		try (Decomposer decomposer = new Decomposer(REGISTRY)) {
			for (String name : new String[] { "sign", "nested", "fixed", "classify", "first", "pair" }) {
				Decomposition raw = decomposer.top(name);
				Decomposition pruned = decomposer.prune(raw);
				Set<Integer> ids = new HashSet<>();
				for (Region r : raw.getRegions()) {
					ids.add(r.getId());
				}
				for (Region r : pruned.getRegions()) {
					assertTrue(ids.contains(r.getId()));
					Region original = raw.getRegion(r.getId());
					assertEquals(original.getConstraints(), r.getConstraints());
					assertEquals(original.getInvariant(), r.getInvariant());
					checkModel(r);
				}
				checkCoverage(pruned);
			}
		}
	}

	// ==============================================================
	// Refinement
	// ==============================================================

	@Test
	public void test_30() {
		// Refined regions contain only inputs of the region refined
		try (Decomposer decomposer = new Decomposer(REGISTRY)) {
			Decomposition d = decomposer.top("classify");
			Term extra = lessThan(X, integer(3));
			List<Region> refined = decomposer.refine(d.getRegions(), Collections.singletonList(extra));
			Interpreter interpreter = new Interpreter(REGISTRY);
			for (Region r : refined) {
				Region original = d.getRegion(r.getId());
				assertTrue(r.getConstraints().containsAll(original.getConstraints()));
				for (Model input : inputs(d)) {
					Term[] constraints = r.getConstraints().toArray(new Term[0]);
					if (interpreter.holds(constraints, input)) {
						assertTrue(interpreter.holds(original.getConstraints().toArray(new Term[0]), input));
					}
				}
				checkModel(r);
			}
		}
	}

	@Test
	public void test_31() {
		// Refining with constraints already present changes nothing
		try (Decomposer decomposer = new Decomposer(REGISTRY)) {
			Region r = decomposer.top("nested").get(1);
			Region refined = decomposer.refine(r, r.getConstraints()).get(0);
			assertEquals(r.getConstraints(), refined.getConstraints());
			assertEquals(r.getInvariant(), refined.getInvariant());
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static EnumerativeSolver enumerative() {
		return new EnumerativeSolver(REGISTRY).setIntegerRange(-5, 5);
	}

	private static void checkCoverage(String name, Set<String> basis) {
		try (Decomposer decomposer = new Decomposer(REGISTRY)) {
			checkCoverage(decomposer.top(name, null, false, basis));
		}
	}

	/**
	 * Check every input considered falls into exactly one region, and that the
	 * output of that region agrees with the function itself.
	 *
	 * @param d
	 */
	private static void checkCoverage(Decomposition d) {
		Term call = invoke(d.getTarget().getName(), d.getTarget().getReturn(), d.getTarget().toVariables());
		for (Model input : inputs(d)) {
			List<Region> regions = matching(d, input);
			assertEquals("regions for " + input, 1, regions.size());
			Term expected = new Interpreter(REGISTRY).apply(input.toMap(), call);
			assertEquals(expected, new Interpreter(REGISTRY).apply(input.toMap(), regions.get(0).getOutput()));
		}
	}

	private static List<Region> matching(Decomposition d, Model input) {
		Interpreter interpreter = new Interpreter(REGISTRY);
		List<Region> regions = new ArrayList<>();
		for (Region r : d.getRegions()) {
			if (interpreter.holds(r.getConstraints().toArray(new Term[0]), input)) {
				regions.add(r);
			}
		}
		return regions;
	}

	private static List<Model> inputs(Decomposition d) {
		Pair<String, Type>[] args = d.getTarget().getParameters();
		Iterator<Term[]> iterator = enumerative().setVariantDepth(4).toDomain(args).iterator();
		List<Model> models = new ArrayList<>();
		while (iterator.hasNext()) {
			Term[] values = iterator.next();
			LinkedHashMap<String, Term> map = new LinkedHashMap<>();
			for (int i = 0; i != args.length; ++i) {
				map.put(args[i].first(), values[i]);
			}
			models.add(new Model(map));
		}
		return models;
	}

	private static void checkModel(Region r) {
		if (r.getStatus() instanceof Status.Feasible) {
			Model m = ((Status.Feasible) r.getStatus()).getModel();
			assertTrue(new Interpreter(REGISTRY).holds(r.getConstraints().toArray(new Term[0]), m));
		}
	}
}
