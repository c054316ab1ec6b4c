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
package regiondecomp.solver;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jmodelgen.core.Domain;
import jmodelgen.core.Domains;
import regiondecomp.core.Model;
import regiondecomp.core.Registry;
import regiondecomp.core.Status;
import regiondecomp.core.Syntax;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.VariantDeclaration;
import regiondecomp.util.Pair;

/**
 * A solver which searches for a witness by brute force. Arguments are drawn
 * from a bounded domain of values (integers within a given range, booleans and
 * variant values up to a given depth) and each candidate is checked by
 * evaluating the constraints directly. A region is only reported infeasible
 * when every argument type is finite and the search covered all of it.
 *
 * @author David J. Pearce
 *
 */
public class EnumerativeSolver implements Solver {
	private static final Logger logger = LoggerFactory.getLogger(EnumerativeSolver.class);

	public static final String BOUND_EXHAUSTED = "bound exhausted";

	private final Registry registry;
	/**
	 * Smallest integer value to consider.
	 */
	private int minInteger = -10;
	/**
	 * Largest integer value to consider.
	 */
	private int maxInteger = 10;
	/**
	 * Maximum nesting of variant values to consider.
	 */
	private int variantDepth = 3;
	/**
	 * Maximum number of candidates to consider for any one query.
	 */
	private long maxCandidates = 100000;

	public EnumerativeSolver(Registry registry) {
		this.registry = registry;
	}

	public EnumerativeSolver setIntegerRange(int min, int max) {
		if (min > max) {
			throw new IllegalArgumentException("invalid integer range");
		}
		this.minInteger = min;
		this.maxInteger = max;
		return this;
	}

	public EnumerativeSolver setVariantDepth(int depth) {
		this.variantDepth = depth;
		return this;
	}

	public EnumerativeSolver setMaxCandidates(long max) {
		this.maxCandidates = max;
		return this;
	}

	@Override
	public Status check(Query query, Cancellation cancellation) {
		Pair<String, Type>[] args = query.getArguments();
		Term[] constraints = query.getConstraints();
		Domain.Big<Term[]> domain = toDomain(args);
		BigInteger size = domain.bigSize();
		boolean exhaustive = size.compareTo(BigInteger.valueOf(maxCandidates)) <= 0 && isFinite(args);
		long count = 0;
		Iterator<Term[]> iterator = domain.iterator();
		while (iterator.hasNext() && count < maxCandidates) {
			if (cancellation.isCancelled()) {
				return new Status.Unknown(cancellation.getReason());
			}
			Model model = toModel(args, iterator.next());
			count = count + 1;
			try {
				if (new Interpreter(registry).holds(constraints, model)) {
					logger.debug("found witness {} after {} candidates", model, count);
					return new Status.Feasible(model);
				}
			} catch (Interpreter.Fault e) {
				// Cannot rule this candidate out
				exhaustive = false;
			}
		}
		if (exhaustive) {
			return Status.INFEASIBLE;
		}
		logger.debug("no witness in {} of {} candidates", count, size);
		return new Status.Unknown(BOUND_EXHAUSTED);
	}

	/**
	 * Construct the domain of all argument tuples considered.
	 *
	 * @param args
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public Domain.Big<Term[]> toDomain(Pair<String, Type>[] args) {
		Domain.Big<Term>[] domains = new Domain.Big[args.length];
		for (int i = 0; i != args.length; ++i) {
			domains[i] = toDomain(args[i].second(), variantDepth);
		}
		return toTupleDomain(domains);
	}

	/**
	 * Construct the domain of values of a given type.
	 *
	 * @param type
	 * @param depth Maximum nesting of variant values.
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public Domain.Big<Term> toDomain(Type type, int depth) {
		if (type instanceof Type.Int) {
			return Domains.Adaptor(Domains.Int(minInteger, maxInteger), i -> (Term) Syntax.integer(i));
		} else if (type instanceof Type.Bool) {
			return Domains.Adaptor(Domains.BOOL, b -> (Term) Syntax.bool(b));
		} else if (depth <= 0) {
			return Domains.EMPTY;
		} else {
			Type.Variant variant = (Type.Variant) type;
			VariantDeclaration decl = registry.getVariant(variant);
			VariantDeclaration.Constructor[] constructors = decl.getConstructors();
			Domain.Big<? extends Term>[] domains = new Domain.Big[constructors.length];
			for (int i = 0; i != constructors.length; ++i) {
				VariantDeclaration.Constructor c = constructors[i];
				Domain.Big<Term>[] fields = new Domain.Big[c.size()];
				for (int j = 0; j != fields.length; ++j) {
					fields[j] = toDomain(c.getFieldType(j), depth - 1);
				}
				domains[i] = Domains.Adaptor(toTupleDomain(fields), ts -> (Term) Syntax.construct(variant, c.getName(), ts));
			}
			return Domains.Union(domains);
		}
	}

	/**
	 * Construct the domain of tuples drawn from a sequence of domains.
	 */
	private static Domain.Big<Term[]> toTupleDomain(Domain.Big<Term>[] domains) {
		if (domains.length == 0) {
			return Domains.Finite(new Term[][] { Syntax.NO_TERMS });
		}
		Domain.Big<Term[]> tuples = Domains.Adaptor(domains[0], t -> new Term[] { t });
		for (int i = 1; i != domains.length; ++i) {
			tuples = Domains.Product(tuples, domains[i], (ts, t) -> {
				Term[] nts = Arrays.copyOf(ts, ts.length + 1);
				nts[ts.length] = t;
				return nts;
			});
		}
		return tuples;
	}

	private static Model toModel(Pair<String, Type>[] args, Term[] values) {
		LinkedHashMap<String, Term> map = new LinkedHashMap<>();
		for (int i = 0; i != args.length; ++i) {
			map.put(args[i].first(), values[i]);
		}
		return new Model(map);
	}

	/**
	 * Determine whether the domains of the given arguments contain every value of
	 * their types.
	 */
	private boolean isFinite(Pair<String, Type>[] args) {
		for (Pair<String, Type> arg : args) {
			if (height(arg.second()) < 0) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Determine the maximum nesting of values of a given type, or -1 if it is
	 * unbounded or exceeds the variant depth. Integers are never finite here,
	 * since only a range of them is considered.
	 */
	private int height(Type type) {
		if (type instanceof Type.Bool) {
			return 0;
		} else if (type instanceof Type.Int) {
			return -1;
		}
		Type.Variant variant = (Type.Variant) type;
		if (registry.isRecursiveVariant(variant.name())) {
			return -1;
		}
		int h = 0;
		for (VariantDeclaration.Constructor c : registry.getVariant(variant).getConstructors()) {
			for (int i = 0; i != c.size(); ++i) {
				int f = height(c.getFieldType(i));
				if (f < 0) {
					return -1;
				}
				h = Math.max(h, f);
			}
		}
		h = h + 1;
		return h <= variantDepth ? h : -1;
	}
}
