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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.VariantDeclaration;
import regiondecomp.util.DecompositionError;
import regiondecomp.util.Pair;
import regiondecomp.util.Tarjan;

/**
 * Holds the variant and function declarations against which decompositions
 * are computed. Functions are supplied here already built as terms. The
 * registry also determines which functions are recursive, since such functions
 * are never inlined during case splitting.
 *
 * @author David J. Pearce
 *
 */
public class Registry {
	private static final Logger logger = LoggerFactory.getLogger(Registry.class);

	private final LinkedHashMap<String, VariantDeclaration> variants = new LinkedHashMap<>();
	private final LinkedHashMap<String, FunctionDeclaration> functions = new LinkedHashMap<>();
	/**
	 * Names of functions which are part of a call graph cycle. This is computed
	 * on demand and discarded whenever a function is declared.
	 */
	private HashSet<String> recursive;
	/**
	 * Names of functions which have been successfully validated.
	 */
	private final HashSet<String> validated = new HashSet<>();

	public synchronized Registry declare(VariantDeclaration decl) {
		String name = decl.getName();
		if (variants.containsKey(name)) {
			throw new IllegalArgumentException("duplicate variant declaration: " + name);
		}
		HashSet<String> ctors = new HashSet<>();
		for (VariantDeclaration.Constructor c : decl.getConstructors()) {
			if (!ctors.add(c.getName())) {
				throw new IllegalArgumentException("duplicate constructor " + c.getName() + " in " + name);
			}
		}
		variants.put(name, decl);
		validated.clear();
		return this;
	}

	public synchronized Registry declare(FunctionDeclaration decl) {
		String name = decl.getName();
		if (functions.containsKey(name)) {
			throw new IllegalArgumentException("duplicate function declaration: " + name);
		}
		HashSet<String> names = new HashSet<>();
		for (Pair<String, Type> p : decl.getParameters()) {
			if (p.first().equals(Syntax.RESULT)) {
				throw new DecompositionError.TypeMismatch(DecompositionError.RESERVED_NAME, p.first());
			} else if (!names.add(p.first())) {
				throw new IllegalArgumentException("duplicate parameter " + p.first() + " in " + name);
			}
		}
		functions.put(name, decl);
		recursive = null;
		validated.clear();
		return this;
	}

	/**
	 * Get the function declaration with a given name.
	 *
	 * @param name
	 * @return
	 * @throws DecompositionError.UnknownFunction if no such function exists.
	 */
	public synchronized FunctionDeclaration getFunction(String name) {
		FunctionDeclaration f = functions.get(name);
		if (f == null) {
			throw new DecompositionError.UnknownFunction(name);
		}
		return f;
	}

	public synchronized boolean isFunction(String name) {
		return functions.containsKey(name);
	}

	/**
	 * Get the variant declaration with a given name.
	 *
	 * @param name
	 * @return
	 * @throws DecompositionError.TypeMismatch if no such variant exists.
	 */
	public synchronized VariantDeclaration getVariant(String name) {
		VariantDeclaration v = variants.get(name);
		if (v == null) {
			throw new DecompositionError.TypeMismatch(DecompositionError.UNKNOWN_VARIANT, name);
		}
		return v;
	}

	public VariantDeclaration getVariant(Type.Variant type) {
		return getVariant(type.name());
	}

	public synchronized Collection<VariantDeclaration> getVariants() {
		return Collections.unmodifiableCollection(new ArrayList<>(variants.values()));
	}

	/**
	 * Determine whether a given function is recursive, either directly or
	 * through some cycle of mutually recursive functions.
	 *
	 * @param name
	 * @return
	 */
	public synchronized boolean isRecursive(String name) {
		if (recursive == null) {
			recursive = computeRecursive();
		}
		return recursive.contains(name);
	}

	/**
	 * Determine whether a given variant is recursive, either directly or through
	 * some other variant. Values of recursive variants have unbounded depth.
	 *
	 * @param name
	 * @return
	 */
	public synchronized boolean isRecursiveVariant(String name) {
		return reaches(name, name, new HashSet<>());
	}

	private boolean reaches(String from, String to, HashSet<String> visited) {
		VariantDeclaration v = variants.get(from);
		if (v == null || !visited.add(from)) {
			return false;
		}
		for (VariantDeclaration.Constructor c : v.getConstructors()) {
			for (int i = 0; i != c.size(); ++i) {
				Type t = c.getFieldType(i);
				if (t instanceof Type.Variant) {
					String n = ((Type.Variant) t).name();
					if (n.equals(to) || reaches(n, to, visited)) {
						return true;
					}
				}
			}
		}
		return false;
	}

	/**
	 * Check that a given function and everything it may call is well-formed.
	 * That is, every function reached exists, has been admitted and is well
	 * typed.
	 *
	 * @param name
	 */
	public synchronized void validate(String name) {
		if (validated.contains(name)) {
			return;
		}
		FunctionDeclaration f = getFunction(name);
		checkVariants();
		if (!f.isAdmitted()) {
			throw new DecompositionError.NotAdmitted(name);
		}
		// Mark before descending so that recursive calls terminate
		validated.add(name);
		try {
			new TypeChecker(this).check(f);
			for (String callee : getCallees(f)) {
				validate(callee);
			}
		} catch (RuntimeException e) {
			validated.remove(name);
			throw e;
		}
		logger.debug("validated function {}", name);
	}

	/**
	 * Check every field of every variant refers only to declared variants. This
	 * cannot be done on declaration, since variants may refer to each other.
	 */
	private void checkVariants() {
		for (VariantDeclaration v : variants.values()) {
			for (VariantDeclaration.Constructor c : v.getConstructors()) {
				for (int i = 0; i != c.size(); ++i) {
					Type t = c.getFieldType(i);
					if (t instanceof Type.Variant && !variants.containsKey(((Type.Variant) t).name())) {
						throw new DecompositionError.TypeMismatch(DecompositionError.UNKNOWN_VARIANT, t);
					}
				}
			}
		}
	}

	/**
	 * Get the names of all functions invoked directly from the body of a given
	 * function.
	 *
	 * @param f
	 * @return
	 */
	public static List<String> getCallees(FunctionDeclaration f) {
		ArrayList<Term> invokes = new ArrayList<>();
		Syntax.collect(f.getBody(), Syntax.TERM_invoke, invokes);
		ArrayList<String> names = new ArrayList<>();
		for (Term t : invokes) {
			String n = ((Term.Invoke) t).name();
			if (!names.contains(n)) {
				names.add(n);
			}
		}
		return names;
	}

	@SuppressWarnings("unchecked")
	private HashSet<String> computeRecursive() {
		ArrayList<String> names = new ArrayList<>(functions.keySet());
		HashMap<String, Integer> indices = new HashMap<>();
		for (int i = 0; i != names.size(); ++i) {
			indices.put(names.get(i), i);
		}
		List<Integer>[] graph = new List[names.size()];
		HashSet<String> selfLoops = new HashSet<>();
		for (int i = 0; i != names.size(); ++i) {
			graph[i] = new ArrayList<>();
			for (String callee : getCallees(functions.get(names.get(i)))) {
				Integer j = indices.get(callee);
				if (j != null) {
					graph[i].add(j);
				}
				if (callee.equals(names.get(i))) {
					selfLoops.add(callee);
				}
			}
		}
		Tarjan tarjan = new Tarjan();
		int[] components = tarjan.getSCComponents(graph);
		HashSet<String> result = new HashSet<>(selfLoops);
		for (int i = 0; i != names.size(); ++i) {
			if (tarjan.sizeOf(components[i]) > 1) {
				result.add(names.get(i));
			}
		}
		logger.debug("recursive functions: {}", result);
		return result;
	}

	/**
	 * Construct a typing environment for the parameters of a given function.
	 *
	 * @param f
	 * @return
	 */
	public static Map<String, Type> environment(FunctionDeclaration f) {
		HashMap<String, Type> env = new HashMap<>();
		for (Pair<String, Type> p : f.getParameters()) {
			env.put(p.first(), p.second());
		}
		return env;
	}
}
