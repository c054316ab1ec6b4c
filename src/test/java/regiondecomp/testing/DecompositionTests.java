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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.*;

import regiondecomp.Decomposer;
import regiondecomp.core.Choice;
import regiondecomp.core.Decomposition;
import regiondecomp.core.Hierarchy;
import regiondecomp.core.Model;
import regiondecomp.core.Region;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.solver.Interpreter;
import regiondecomp.solver.Z3Solver;

/**
 * Tests for decomposing functions over integers and booleans, along with
 * pruning, refinement and model extraction using the default solver.
 *
 * @author David J. Pearce
 *
 */
public class DecompositionTests {
	private Decomposer decomposer;

	@Before
	public void setup() {
		decomposer = new Decomposer(Fixtures.registry()).setTimeout(20000);
	}

	@After
	public void teardown() {
		decomposer.close();
	}

	// ==============================================================
	// Case Splitting
	// ==============================================================

	@Test
	public void test_01() {
		// if x > 0 then 1 else -1
		Decomposition d = decomposer.top("sign");
		assertEquals(2, d.size());
		checkRegion(d.get(0), 0, Arrays.asList(greaterThan(X, integer(0))), integer(1));
		checkRegion(d.get(1), 1, Arrays.asList(lessThanOrEqual(X, integer(0))), integer(-1));
		for (Region r : d.getRegions()) {
			assertEquals(Status.UNCHECKED, r.getStatus());
			assertEquals(Status.Kind.UNKNOWN, decomposer.status(r));
			assertFalse(decomposer.getModel(r).isPresent());
		}
	}

	@Test
	public void test_02() {
		// Nested conditional produces three raw regions
		Decomposition d = decomposer.top("nested");
		assertEquals(3, d.size());
		Term c1 = greaterThan(X, integer(0));
		Term c2 = lessThan(multiply(X, X), integer(0));
		checkRegion(d.get(0), 0, Arrays.asList(c1, c2), integer(1));
		checkRegion(d.get(1), 1, Arrays.asList(c1, not(c2)), integer(2));
		checkRegion(d.get(2), 2, Arrays.asList(not(c1)), integer(3));
	}

	@Test
	public void test_03() {
		// Basis functions remain opaque
		Decomposition d = decomposer.top("fixed", null, false, Collections.singleton("inc"));
		assertEquals(2, d.size());
		Term call = invoke("inc", Type.Int, X);
		checkRegion(d.get(0), 0, Arrays.asList(equal(call, X)), integer(1));
		checkRegion(d.get(1), 1, Arrays.asList(notEqual(call, X)), integer(2));
		assertEquals(new HashSet<>(Arrays.asList("fixed", "inc")), d.getBasis());
	}

	@Test
	public void test_04() {
		// Functions outside the basis are inlined
		Decomposition d = decomposer.top("fixed");
		// inc(x) = x folds to x + 1 = x which is not decided statically
		assertEquals(2, d.size());
		checkRegion(d.get(0), 0, Arrays.asList(equal(add(X, integer(1)), X)), integer(1));
	}

	@Test
	public void test_05() {
		// Inlining splits on the callee's conditionals
		Decomposition d = decomposer.top("classify");
		assertEquals(3, d.size());
		Term c = greaterThan(X, integer(0));
		checkRegion(d.get(0), 0, Arrays.asList(B, c), integer(1));
		checkRegion(d.get(1), 1, Arrays.asList(B, not(c)), integer(-1));
		checkRegion(d.get(2), 2, Arrays.asList(not(B)), integer(0));
	}

	@Test
	public void test_06() {
		// Mutually recursive functions are never inlined
		assertTrue(decomposer.getRegistry().isRecursive("even"));
		assertTrue(decomposer.getRegistry().isRecursive("odd"));
		assertFalse(decomposer.getRegistry().isRecursive("parity"));
		Decomposition d = decomposer.top("parity");
		assertEquals(2, d.size());
		Term call = invoke("even", Type.Bool, N);
		checkRegion(d.get(0), 0, Arrays.asList(call), integer(0));
		checkRegion(d.get(1), 1, Arrays.asList(not(call)), integer(1));
	}

	@Test
	public void test_07() {
		// Regions share interned terms
		Decomposition d1 = decomposer.top("nested");
		Decomposition d2 = decomposer.top("nested");
		for (int i = 0; i != d1.size(); ++i) {
			List<Term> c1 = d1.get(i).getConstraints();
			List<Term> c2 = d2.get(i).getConstraints();
			for (int j = 0; j != c1.size(); ++j) {
				assertSame(c1.get(j), c2.get(j));
			}
			assertSame(d1.get(i).getInvariant(), d2.get(i).getInvariant());
		}
	}

	// ==============================================================
	// Side Conditions
	// ==============================================================

	@Test
	public void test_10() {
		// Input filter removes the region it contradicts
		Decomposition d = decomposer.top("sign", "isPos", false, null);
		assertEquals(1, d.size());
		checkRegion(d.get(0), 0, Arrays.asList(greaterThan(X, integer(0))), integer(1));
		assertEquals("isPos", d.getAssuming());
	}

	@Test
	public void test_11() {
		// Output filter is applied to each region's output
		Decomposition d = decomposer.top("sign", "isOutPos", false, null);
		assertEquals(1, d.size());
		assertEquals(integer(1), d.get(0).getOutput());
	}

	@Test
	public void test_12() {
		// A side condition in the basis is kept opaque
		Decomposition d = decomposer.top("sign", "isPos", false, Collections.singleton("isPos"));
		assertEquals(2, d.size());
		Term side = invoke("isPos", Type.Bool, X);
		checkRegion(d.get(0), 0, Arrays.asList(greaterThan(X, integer(0)), side), integer(1));
		checkRegion(d.get(1), 1, Arrays.asList(lessThanOrEqual(X, integer(0)), side), integer(-1));
		// Unrolling exposes the contradiction
		Decomposition p = decomposer.prune(d);
		assertEquals(1, p.size());
		assertEquals(0, p.get(0).getId());
	}

	// ==============================================================
	// Pruning
	// ==============================================================

	@Test
	public void test_20() {
		Decomposition d = decomposer.top("nested", null, true, null);
		assertEquals(2, d.size());
		assertEquals(1, d.get(0).getId());
		assertEquals(2, d.get(1).getId());
		for (Region r : d.getRegions()) {
			assertEquals(Status.Kind.FEASIBLE, decomposer.status(r));
			checkModel(r);
		}
	}

	@Test
	public void test_21() {
		// inc(x) = x has no solution once inc is unrolled
		Decomposition d = decomposer.top("fixed", null, true, Collections.singleton("inc"));
		assertEquals(1, d.size());
		assertEquals(1, d.get(0).getId());
		checkModel(d.get(0));
	}

	@Test
	public void test_22() {
		Decomposition raw = decomposer.top("classify");
		Decomposition d = decomposer.prune(raw);
		assertEquals(3, d.size());
		// Original is unchanged
		assertEquals(Status.UNCHECKED, raw.get(0).getStatus());
		for (Region r : d.getRegions()) {
			checkModel(r);
		}
	}

	@Test
	public void test_23() {
		// Without unrolling inc(x) = x cannot be refuted
		decomposer.setUnrollBudget(0);
		Decomposition once = decomposer.top("fixed", null, true, Collections.singleton("inc"));
		assertEquals(2, once.size());
		assertEquals(new Status.Unknown(Z3Solver.INSUFFICIENT_UNROLLING), once.get(0).getStatus());
		assertEquals(Status.Kind.FEASIBLE, decomposer.status(once.get(1)));
		// Unknown regions are checked again under the larger budget
		decomposer.setUnrollBudget(2);
		Decomposition twice = decomposer.prune(once);
		assertEquals(1, twice.size());
		assertEquals(1, twice.get(0).getId());
		assertEquals(once.get(1), twice.get(0));
	}

	// ==============================================================
	// Refinement
	// ==============================================================

	@Test
	public void test_30() {
		// Refining with a contradictory constraint gives nothing
		Decomposition d = decomposer.top("sign");
		assertTrue(decomposer.refine(d.get(1), equal(X, integer(1))).isEmpty());
	}

	@Test
	public void test_31() {
		Decomposition d = decomposer.top("sign");
		Region region = d.get(0);
		List<Region> rs = decomposer.refine(region, equal(X, integer(1)));
		assertEquals(1, rs.size());
		Region r = rs.get(0);
		assertEquals(region.getId(), r.getId());
		assertEquals(2, r.getConstraints().size());
		assertEquals(Choice.Kind.REFINE, r.getProvenance().get(r.getProvenance().size() - 1).kind());
		Model m = decomposer.getModel(r).get();
		assertEquals(integer(1), m.get("x"));
		// Original is unchanged
		assertEquals(1, region.getConstraints().size());
		assertEquals(Status.UNCHECKED, region.getStatus());
	}

	@Test
	public void test_32() {
		// Duplicate constraints are not added twice
		Decomposition d = decomposer.top("sign");
		Region region = d.get(0);
		List<Region> rs = decomposer.refine(region, greaterThan(X, integer(0)), lessThan(X, integer(5)));
		assertEquals(1, rs.size());
		assertEquals(Arrays.asList(greaterThan(X, integer(0)), lessThan(X, integer(5))), rs.get(0).getConstraints());
	}

	@Test
	public void test_33() {
		// Refining many regions at once preserves order
		Decomposition d = decomposer.top("nested");
		List<Region> rs = decomposer.refine(d.getRegions(), Arrays.asList(lessThan(X, integer(10))));
		assertEquals(2, rs.size());
		assertEquals(1, rs.get(0).getId());
		assertEquals(2, rs.get(1).getId());
	}

	// ==============================================================
	// Extraction & Hierarchy
	// ==============================================================

	@Test
	public void test_40() {
		Decomposition d = decomposer.top("sign", null, true, null);
		Region r = d.get(0);
		Model m = decomposer.getModel(r).get();
		Term[] args = decomposer.extractor("sign").arguments(m);
		assertEquals(1, args.length);
		assertTrue(((Value.Integer) args[0]).value().signum() > 0);
		Term.Invoke call = decomposer.extractor("sign").invocation(m);
		assertEquals(integer(1), new Interpreter(decomposer.getRegistry()).apply(Collections.emptyMap(), call));
	}

	@Test
	public void test_41() {
		Decomposition d = decomposer.top("nested");
		Hierarchy.Node root = decomposer.hierarchy(d);
		assertEquals(2, root.getChildren().size());
		Hierarchy.Node lhs = root.getChildren().get(0);
		Hierarchy.Node rhs = root.getChildren().get(1);
		assertEquals(new Choice(Choice.Kind.TRUE, greaterThan(X, integer(0))), lhs.getChoice());
		assertEquals(new Choice(Choice.Kind.FALSE, greaterThan(X, integer(0))), rhs.getChoice());
		assertEquals(2, lhs.getChildren().size());
		assertEquals(d.getRegions(), root.getRegions());
		assertEquals(1, rhs.getRegions().size());
		assertEquals(2, rhs.getRegions().get(0).getId());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	public static void checkRegion(Region r, int id, List<Term> constraints, Term output) {
		assertEquals(id, r.getId());
		assertEquals(constraints, r.getConstraints());
		assertEquals(equal(var(RESULT, output.type()), output), r.getInvariant());
		assertEquals(output, r.getOutput());
	}

	/**
	 * Check the model of a feasible region satisfies its constraints.
	 *
	 * @param r
	 */
	public void checkModel(Region r) {
		Model m = decomposer.getModel(r).get();
		Term[] constraints = r.getConstraints().toArray(new Term[0]);
		if (!new Interpreter(decomposer.getRegistry()).holds(constraints, m)) {
			fail("model " + m + " does not satisfy " + r);
		}
	}
}
