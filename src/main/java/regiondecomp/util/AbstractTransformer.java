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
package regiondecomp.util;

import regiondecomp.core.Syntax;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Value;

/**
 * Provides a generic traversal over terms which dispatches on the opcode of
 * each term to a dedicated method. Type checking, case splitting and
 * evaluation are all implemented as transformers.
 *
 * @author David J. Pearce
 *
 * @param <S> The state threaded through the transformation (e.g. a typing
 *            environment or variable binding).
 * @param <R> The result of transforming a term.
 */
public abstract class AbstractTransformer<S, R> {

	public R apply(S state, Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_variable:
			return apply(state, (Term.Variable) term);
		case Syntax.TERM_integer:
			return apply(state, (Value.Integer) term);
		case Syntax.TERM_boolean:
			return apply(state, (Value.Boolean) term);
		case Syntax.TERM_construct:
			return apply(state, (Term.Construct) term);
		case Syntax.TERM_field:
			return apply(state, (Term.Field) term);
		case Syntax.TERM_is:
			return apply(state, (Term.Is) term);
		case Syntax.TERM_operator:
			return apply(state, (Term.Operator) term);
		case Syntax.TERM_invoke:
			return apply(state, (Term.Invoke) term);
		case Syntax.TERM_ifelse:
			return apply(state, (Term.IfElse) term);
		case Syntax.TERM_match:
			return apply(state, (Term.Match) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Apply this transformer to a given variable.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Variable term);

	/**
	 * Apply this transformer to a given integer constant.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param value The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Value.Integer value);

	/**
	 * Apply this transformer to a given boolean constant.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param value The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Value.Boolean value);

	/**
	 * Apply this transformer to a given constructor application.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Construct term);

	/**
	 * Apply this transformer to a given field extraction.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Field term);

	/**
	 * Apply this transformer to a given constructor test.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Is term);

	/**
	 * Apply this transformer to a given operator application.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Operator term);

	/**
	 * Apply this transformer to a given function invocation.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Invoke term);

	/**
	 * Apply this transformer to a given conditional.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.IfElse term);

	/**
	 * Apply this transformer to a given pattern match.
	 *
	 * @param state The current state (e.g. typing environment or binding)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract R apply(S state, Term.Match term);
}
