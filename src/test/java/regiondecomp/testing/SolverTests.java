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
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.*;

import regiondecomp.core.Model;
import regiondecomp.core.Registry;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.solver.Cancellation;
import regiondecomp.solver.Dispatcher;
import regiondecomp.solver.EnumerativeSolver;
import regiondecomp.solver.Interpreter;
import regiondecomp.solver.Query;
import regiondecomp.solver.Solver;
import regiondecomp.solver.Z3Solver;
import regiondecomp.util.Pair;

/**
 * Tests for the solvers used to check regions, and for the dispatcher which
 * runs them under a deadline.
 *
 * @author David J. Pearce
 *
 */
public class SolverTests {
	private static final Registry REGISTRY = Fixtures.registry();

	// ==============================================================
	// Z3
	// ==============================================================

	@Test
	public void test_01() {
		Status s = checkZ3(args(param("x", Type.Int)), greaterThan(X, integer(3)), lessThan(X, integer(5)));
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		assertEquals(integer(4), ((Status.Feasible) s).getModel().get("x"));
	}

	@Test
	public void test_02() {
		Status s = checkZ3(args(param("x", Type.Int)), greaterThan(X, integer(3)), lessThan(X, integer(2)));
		assertEquals(Status.INFEASIBLE, s);
	}

	@Test
	public void test_03() {
		Status s = checkZ3(args(param("b", Type.Bool), param("x", Type.Int)), B, not(B));
		assertEquals(Status.INFEASIBLE, s);
	}

	@Test
	public void test_04() {
		// Division and remainder are Euclidean
		Status s = checkZ3(args(param("x", Type.Int)), equal(divide(X, integer(2)), integer(-2)),
				equal(remainder(X, integer(2)), integer(1)));
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		assertEquals(integer(-3), ((Status.Feasible) s).getModel().get("x"));
	}

	@Test
	public void test_05() {
		// Models of variant arguments are built from constructors
		Term tail = field(LIST, "Cons", 1, L, LIST);
		Term[] constraints = { is(LIST, "Cons", L), is(LIST, "Cons", tail),
				equal(field(LIST, "Cons", 0, L, Type.Int), integer(5)) };
		Status s = checkZ3(args(param("l", LIST)), constraints);
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		Model m = ((Status.Feasible) s).getModel();
		assertTrue(new Interpreter(REGISTRY).holds(constraints, m));
		assertEquals(integer(5), ((Term.Construct) m.get("l")).get(0));
	}

	@Test
	public void test_06() {
		// Distinct constructors are disjoint
		Status s = checkZ3(args(param("l", LIST)), is(LIST, "Cons", L), equal(L, NIL));
		assertEquals(Status.INFEASIBLE, s);
	}

	@Test
	public void test_07() {
		// Frontier applications are confirmed by evaluation
		Status s = checkZ3(1, args(param("n", Type.Int)), equal(invoke("even", Type.Bool, N), bool(true)),
				greaterThan(N, integer(0)), lessThan(N, integer(3)));
		if (s instanceof Status.Feasible) {
			Model m = ((Status.Feasible) s).getModel();
			assertEquals(integer(2), m.get("n"));
		} else {
			assertEquals(new Status.Unknown(Z3Solver.INSUFFICIENT_UNROLLING), s);
		}
	}

	@Test
	public void test_08() {
		// Sufficient unrolling decides recursive applications
		Status s = checkZ3(4, args(param("n", Type.Int)), invoke("even", Type.Bool, N), greaterThan(N, integer(0)),
				lessThan(N, integer(3)));
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		assertEquals(integer(2), ((Status.Feasible) s).getModel().get("n"));
	}

	@Test
	public void test_09() {
		Cancellation c = new Cancellation();
		c.cancel("stopped");
		Query q = new Query(args(param("x", Type.Int)), new Term[] { greaterThan(X, integer(0)) }, 2, 10000);
		assertEquals(new Status.Unknown("stopped"), new Z3Solver(REGISTRY).check(q, c));
	}

	// ==============================================================
	// Enumeration
	// ==============================================================

	@Test
	public void test_10() {
		// Booleans are enumerated completely
		Status s = checkEnumerative(args(param("b", Type.Bool)), B, not(B));
		assertEquals(Status.INFEASIBLE, s);
	}

	@Test
	public void test_11() {
		// Integers never are
		Status s = checkEnumerative(args(param("x", Type.Int)), greaterThan(X, integer(3)), lessThan(X, integer(2)));
		assertEquals(new Status.Unknown(EnumerativeSolver.BOUND_EXHAUSTED), s);
	}

	@Test
	public void test_12() {
		Status s = checkEnumerative(args(param("x", Type.Int)), equal(multiply(X, X), integer(9)),
				greaterThan(X, integer(0)));
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		assertEquals(integer(3), ((Status.Feasible) s).getModel().get("x"));
	}

	@Test
	public void test_13() {
		Term[] constraints = { equal(invoke("len", Type.Int, L), integer(2)) };
		Status s = checkEnumerative(args(param("l", LIST)), constraints);
		assertEquals(Status.Kind.FEASIBLE, s.kind());
		Model m = ((Status.Feasible) s).getModel();
		assertTrue(new Interpreter(REGISTRY).holds(constraints, m));
	}

	@Test
	public void test_14() {
		// Candidates which fault are not treated as refuted
		Status s = checkEnumerative(args(param("b", Type.Bool), param("x", Type.Int)),
				equal(divide(X, integer(0)), integer(1)));
		assertEquals(new Status.Unknown(EnumerativeSolver.BOUND_EXHAUSTED), s);
	}

	@Test
	public void test_15() {
		EnumerativeSolver solver = new EnumerativeSolver(REGISTRY).setIntegerRange(0, 3).setVariantDepth(2);
		// Nil, Cons(0, Nil) ... Cons(3, Nil)
		assertEquals(5, solver.toDomain(LIST, 2).bigSize().intValue());
		assertEquals(2, solver.toDomain(Type.Bool, 0).bigSize().intValue());
	}

	// ==============================================================
	// Dispatch
	// ==============================================================

	@Test
	public void test_20() {
		// A cooperative solver observes the deadline
		Solver blocking = (query, cancellation) -> {
			CountDownLatch latch = new CountDownLatch(1);
			cancellation.addListener(latch::countDown);
			try {
				latch.await();
			} catch (InterruptedException e) {
				return new Status.Unknown("interrupted");
			}
			return new Status.Unknown(cancellation.getReason());
		};
		try (Dispatcher d = new Dispatcher(blocking, 1, 100)) {
			assertEquals(new Status.Unknown(Dispatcher.TIMEOUT), d.submit(query()).get());
		}
	}

	@Test
	public void test_21() {
		// A solver ignoring cancellation is abandoned
		Solver stubborn = (query, cancellation) -> {
			long end = System.currentTimeMillis() + 60000;
			while (System.currentTimeMillis() < end) {
				try {
					Thread.sleep(50);
				} catch (InterruptedException e) {
					break;
				}
			}
			return new Status.Feasible(new Model(Collections.emptyMap()));
		};
		try (Dispatcher d = new Dispatcher(stubborn, 1, 100)) {
			long start = System.nanoTime();
			Status s = d.submit(query()).get();
			long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
			assertEquals(new Status.Unknown(Dispatcher.TIMEOUT), s);
			assertTrue(elapsed < 30000);
		}
	}

	@Test
	public void test_22() {
		// Failures are reported as unknown
		Solver failing = (query, cancellation) -> {
			throw new IllegalStateException("broken");
		};
		try (Dispatcher d = new Dispatcher(failing, 2, 1000)) {
			assertEquals(Status.Kind.UNKNOWN, d.submit(query()).get().kind());
		}
	}

	@Test
	public void test_23() {
		// Outcomes are returned in order of submission
		Query q1 = new Query(args(param("x", Type.Int)), new Term[] { lessThan(X, integer(0)) }, 2, 10000);
		Query q2 = new Query(args(param("x", Type.Int)), new Term[] { lessThan(X, X) }, 2, 10000);
		Query q3 = new Query(args(param("b", Type.Bool)), new Term[] { B }, 2, 10000);
		try (Dispatcher d = new Dispatcher(new Z3Solver(REGISTRY), 3, 10000)) {
			List<Status> results = d.run(Arrays.asList(q1, q2, q3, q1));
			assertEquals(4, results.size());
			assertEquals(Status.Kind.FEASIBLE, results.get(0).kind());
			assertEquals(Status.INFEASIBLE, results.get(1));
			assertEquals(Value.True, ((Status.Feasible) results.get(2)).getModel().get("b"));
			assertEquals(Status.Kind.FEASIBLE, results.get(3).kind());
		}
	}

	@Test
	public void test_24() {
		Cancellation c = new Cancellation();
		int[] count = new int[1];
		c.addListener(() -> count[0]++);
		c.cancel("first");
		c.cancel("second");
		assertEquals("first", c.getReason());
		assertEquals(1, count[0]);
		// Listeners added late run immediately
		c.addListener(() -> count[0]++);
		assertEquals(2, count[0]);
	}

	@Test(timeout = 10000)
	public void test_25() throws InterruptedException {
		// Closing releases running and queued requests
		CountDownLatch started = new CountDownLatch(1);
		Solver blocking = (query, cancellation) -> {
			CountDownLatch done = new CountDownLatch(1);
			cancellation.addListener(done::countDown);
			started.countDown();
			try {
				done.await();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return new Status.Unknown(cancellation.getReason());
		};
		Dispatcher d = new Dispatcher(blocking, 1, 60000);
		Dispatcher.Request running = d.submit(query());
		Dispatcher.Request queued = d.submit(query());
		assertTrue(started.await(5, TimeUnit.SECONDS));
		d.close();
		assertEquals(new Status.Unknown(Dispatcher.CLOSED), running.get());
		assertEquals(new Status.Unknown(Dispatcher.CLOSED), queued.get());
		// Submitting after close does not block either
		assertEquals(new Status.Unknown(Dispatcher.CLOSED), d.submit(query()).get());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	@SafeVarargs
	private static Pair<String, Type>[] args(Pair<String, Type>... params) {
		return params;
	}

	private static Query query() {
		return new Query(args(param("x", Type.Int)), new Term[] { greaterThan(X, integer(0)) }, 2, 100);
	}

	private static Status checkZ3(Pair<String, Type>[] args, Term... constraints) {
		return checkZ3(2, args, constraints);
	}

	private static Status checkZ3(int budget, Pair<String, Type>[] args, Term... constraints) {
		Query q = new Query(args, constraints, budget, 10000);
		return new Z3Solver(REGISTRY).check(q, new Cancellation());
	}

	private static Status checkEnumerative(Pair<String, Type>[] args, Term... constraints) {
		Query q = new Query(args, constraints, 2, 10000);
		return new EnumerativeSolver(REGISTRY).check(q, new Cancellation());
	}
}
