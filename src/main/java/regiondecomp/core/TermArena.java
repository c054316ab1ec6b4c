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
import java.util.HashMap;

import regiondecomp.core.Syntax.Term;

/**
 * Maintains a canonical copy of every term produced during a decomposition
 * (i.e. hash-consing). Structurally equal terms interned in the same arena are
 * physically identical, and every interned term has a stable index. Hence,
 * constraints sharing subterms form a DAG and anything computed per node can
 * be cached by index.
 *
 * @author David J. Pearce
 *
 */
public class TermArena {
	private final ArrayList<Term> nodes = new ArrayList<>();
	private final HashMap<Term, Integer> index = new HashMap<>();

	/**
	 * Get the canonical copy of a given term, creating it if necessary. All
	 * subterms are interned as well.
	 *
	 * @param term
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public synchronized <T extends Term> T intern(T term) {
		Integer i = index.get(term);
		if (i != null) {
			return (T) nodes.get(i);
		}
		Term[] operands = term.getOperands();
		Term[] noperands = null;
		for (int j = 0; j != operands.length; ++j) {
			Term o = intern(operands[j]);
			if (o != operands[j]) {
				if (noperands == null) {
					noperands = operands.clone();
				}
				noperands[j] = o;
			}
		}
		Term t = noperands == null ? term : term.construct(noperands);
		index.put(t, nodes.size());
		nodes.add(t);
		return (T) t;
	}

	public Term[] intern(Term... terms) {
		Term[] r = new Term[terms.length];
		for (int i = 0; i != terms.length; ++i) {
			r[i] = intern(terms[i]);
		}
		return r;
	}

	/**
	 * Get the index of a given term, or -1 if it was not interned here.
	 *
	 * @param term
	 * @return
	 */
	public synchronized int indexOf(Term term) {
		Integer i = index.get(term);
		return i == null ? -1 : i;
	}

	public synchronized Term get(int i) {
		return nodes.get(i);
	}

	public synchronized int size() {
		return nodes.size();
	}
}
