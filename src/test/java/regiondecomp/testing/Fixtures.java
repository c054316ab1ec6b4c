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

import static regiondecomp.core.Syntax.*;

import regiondecomp.core.Registry;
import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.VariantDeclaration;

/**
 * Functions and variants shared between tests.
 *
 * @author David J. Pearce
 *
 */
public class Fixtures {
	public static final Type.Variant LIST = new Type.Variant("List");

	public static final Term.Variable X = var("x", Type.Int);
	public static final Term.Variable N = var("n", Type.Int);
	public static final Term.Variable D = var("d", Type.Int);
	public static final Term.Variable R = var("r", Type.Int);
	public static final Term.Variable B = var("b", Type.Bool);
	public static final Term.Variable L = var("l", LIST);
	public static final Term.Variable H = var("h", Type.Int);
	public static final Term.Variable T = var("t", LIST);
	public static final Term.Variable U = var("u", LIST);
	public static final Term.Variable A = var("a", Type.Int);
	public static final Term.Variable C = var("c", Type.Int);

	public static final Term NIL = construct(LIST, "Nil");

	public static Term cons(long head, Term tail) {
		return construct(LIST, "Cons", integer(head), tail);
	}

	/**
	 * Construct a registry containing the standard functions used in testing.
	 *
	 * @return
	 */
	public static Registry registry() {
		Registry r = new Registry();
		r.declare(new VariantDeclaration("List", new VariantDeclaration.Constructor("Nil"),
				new VariantDeclaration.Constructor("Cons", param("head", Type.Int), param("tail", LIST))));
		// sign(x) = if x > 0 then 1 else -1
		r.declare(new FunctionDeclaration("sign", Type.Int,
				ifElse(greaterThan(X, integer(0)), integer(1), integer(-1)), param("x", Type.Int)));
		// nested(x) = if x > 0 then (if x * x < 0 then 1 else 2) else 3
		r.declare(new FunctionDeclaration("nested", Type.Int,
				ifElse(greaterThan(X, integer(0)),
						ifElse(lessThan(multiply(X, X), integer(0)), integer(1), integer(2)), integer(3)),
				param("x", Type.Int)));
		// inc(x) = x + 1
		r.declare(new FunctionDeclaration("inc", Type.Int, add(X, integer(1)), param("x", Type.Int)));
		// fixed(x) = if inc(x) = x then 1 else 2
		r.declare(new FunctionDeclaration("fixed", Type.Int,
				ifElse(equal(invoke("inc", Type.Int, X), X), integer(1), integer(2)), param("x", Type.Int)));
		// classify(x, b) = if b then sign(x) else 0
		r.declare(new FunctionDeclaration("classify", Type.Int, ifElse(B, invoke("sign", Type.Int, X), integer(0)),
				param("x", Type.Int), param("b", Type.Bool)));
		// len(l) = match l with Nil -> 0 | Cons(h, t) -> 1 + len(t)
		r.declare(new FunctionDeclaration("len", Type.Int, match(L, Type.Int, when("Nil", integer(0)),
				when("Cons", add(integer(1), invoke("len", Type.Int, T)), H, T)), param("l", LIST)));
		// first(l, d) = match l with Cons(h, t) -> h | _ -> d
		r.declare(new FunctionDeclaration("first", Type.Int, match(L, Type.Int, when("Cons", H, H, T), otherwise(D)),
				param("l", LIST), param("d", Type.Int)));
		// pair(l) = match l with Cons(a, t) -> (match t with Cons(c, u) -> a + c | _ -> a) | _ -> 0
		r.declare(new FunctionDeclaration("pair", Type.Int,
				match(L, Type.Int,
						when("Cons", match(T, Type.Int, when("Cons", add(A, C), C, U), otherwise(A)), A, T),
						otherwise(integer(0))),
				param("l", LIST)));
		// even(n) = if n <= 0 then true else odd(n - 1)
		r.declare(new FunctionDeclaration("even", Type.Bool,
				ifElse(lessThanOrEqual(N, integer(0)), bool(true), invoke("odd", Type.Bool, subtract(N, integer(1)))),
				param("n", Type.Int)));
		// odd(n) = if n <= 0 then false else even(n - 1)
		r.declare(new FunctionDeclaration("odd", Type.Bool,
				ifElse(lessThanOrEqual(N, integer(0)), bool(false), invoke("even", Type.Bool, subtract(N, integer(1)))),
				param("n", Type.Int)));
		// parity(n) = if even(n) then 0 else 1
		r.declare(new FunctionDeclaration("parity", Type.Int,
				ifElse(invoke("even", Type.Bool, N), integer(0), integer(1)), param("n", Type.Int)));
		// isPos(x) = x > 0
		r.declare(new FunctionDeclaration("isPos", Type.Bool, greaterThan(X, integer(0)), param("x", Type.Int)));
		// isOutPos(x, r) = r > 0
		r.declare(new FunctionDeclaration("isOutPos", Type.Bool, greaterThan(R, integer(0)), param("x", Type.Int),
				param("r", Type.Int)));
		return r;
	}
}
