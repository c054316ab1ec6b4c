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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import regiondecomp.core.Syntax.FunctionDeclaration;
import regiondecomp.core.Syntax.Term;
import regiondecomp.core.Syntax.Type;
import regiondecomp.core.Syntax.Value;
import regiondecomp.core.Syntax.VariantDeclaration;
import regiondecomp.util.AbstractTransformer;
import regiondecomp.util.DecompositionError;
import regiondecomp.util.DecompositionError.TypeMismatch;
import regiondecomp.util.Pair;

/**
 * Responsible for type checking terms against a typing environment which maps
 * variable names to their types. Function bodies, side conditions and
 * refinement constraints all pass through here before they are used.
 *
 * @author David J. Pearce
 *
 */
public class TypeChecker extends AbstractTransformer<Map<String, Type>, Type> {
	private final Registry registry;

	public TypeChecker(Registry registry) {
		this.registry = registry;
	}

	/**
	 * Check a function declaration is well-typed. That is, its parameter types
	 * are valid and its body produces its return type.
	 *
	 * @param f
	 */
	public void check(FunctionDeclaration f) {
		for (Pair<String, Type> p : f.getParameters()) {
			check(p.second());
		}
		check(f.getReturn());
		check(Registry.environment(f), f.getBody(), f.getReturn());
	}

	/**
	 * Check a term is well-typed and produces a given type.
	 *
	 * @param environment
	 * @param term
	 * @param expected
	 */
	public void check(Map<String, Type> environment, Term term, Type expected) {
		Type actual = apply(environment, term);
		checkEqual(expected, actual, term);
	}

	/**
	 * Check a given type is valid, meaning every variant it refers to is declared.
	 *
	 * @param type
	 */
	public void check(Type type) {
		if (type instanceof Type.Variant) {
			registry.getVariant((Type.Variant) type);
		}
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Variable term) {
		Type type = environment.get(term.name());
		if (type == null) {
			throw new TypeMismatch(DecompositionError.UNKNOWN_VARIABLE, term);
		}
		checkEqual(type, term.type(), term);
		return type;
	}

	@Override
	public Type apply(Map<String, Type> environment, Value.Integer value) {
		return Type.Int;
	}

	@Override
	public Type apply(Map<String, Type> environment, Value.Boolean value) {
		return Type.Bool;
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Construct term) {
		VariantDeclaration.Constructor c = getConstructor(term.type(), term.constructor(), term);
		if (c.size() != term.size()) {
			throw new TypeMismatch(DecompositionError.INVALID_ARGUMENT_COUNT, term);
		}
		for (int i = 0; i != c.size(); ++i) {
			check(environment, term.get(i), c.getFieldType(i));
		}
		return term.type();
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Field term) {
		check(environment, term.operand(), term.variant());
		VariantDeclaration.Constructor c = getConstructor(term.variant(), term.constructor(), term);
		if (term.index() < 0 || term.index() >= c.size()) {
			throw new TypeMismatch(DecompositionError.INVALID_FIELD_INDEX, term);
		}
		checkEqual(c.getFieldType(term.index()), term.type(), term);
		return term.type();
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Is term) {
		check(environment, term.operand(), term.variant());
		getConstructor(term.variant(), term.constructor(), term);
		return Type.Bool;
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Operator term) {
		Term.Operator.Kind kind = term.kind();
		if (kind.arity() >= 0 && kind.arity() != term.size()) {
			throw new TypeMismatch(DecompositionError.INVALID_ARGUMENT_COUNT, term);
		}
		switch (kind) {
		case EQ:
		case NEQ: {
			Type lhs = apply(environment, term.get(0));
			Type rhs = apply(environment, term.get(1));
			checkEqual(lhs, rhs, term);
			return Type.Bool;
		}
		case AND:
		case OR:
		case NOT:
		case IMPLIES:
			for (Term operand : term.getOperands()) {
				check(environment, operand, Type.Bool);
			}
			return Type.Bool;
		default:
			// Arithmetic and comparisons
			for (Term operand : term.getOperands()) {
				check(environment, operand, Type.Int);
			}
			return term.type();
		}
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Invoke term) {
		FunctionDeclaration f = registry.getFunction(term.name());
		Pair<String, Type>[] params = f.getParameters();
		Term[] operands = term.getOperands();
		if (params.length != operands.length) {
			throw new TypeMismatch(DecompositionError.INVALID_ARGUMENT_COUNT, term);
		}
		for (int i = 0; i != params.length; ++i) {
			check(environment, operands[i], params[i].second());
		}
		checkEqual(f.getReturn(), term.type(), term);
		return f.getReturn();
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.IfElse term) {
		check(environment, term.condition(), Type.Bool);
		Type lhs = apply(environment, term.trueBranch());
		Type rhs = apply(environment, term.falseBranch());
		checkEqual(lhs, rhs, term);
		return lhs;
	}

	@Override
	public Type apply(Map<String, Type> environment, Term.Match term) {
		Type type = apply(environment, term.scrutinee());
		if (!(type instanceof Type.Variant)) {
			throw new TypeMismatch(DecompositionError.EXPECTED_VARIANT, term.scrutinee());
		} else if (term.size() == 0) {
			throw new TypeMismatch(DecompositionError.INVALID_PATTERN, term);
		}
		Type.Variant variant = (Type.Variant) type;
		HashSet<String> seen = new HashSet<>();
		for (int i = 0; i != term.size(); ++i) {
			Term.Match.Case c = term.get(i);
			HashMap<String, Type> env = new HashMap<>(environment);
			if (c.isWildcard()) {
				if (i + 1 != term.size() || c.variables().length != 0) {
					throw new TypeMismatch(DecompositionError.INVALID_PATTERN, c);
				}
			} else {
				VariantDeclaration.Constructor ctor = getConstructor(variant, c.constructor(), c);
				Term.Variable[] vars = c.variables();
				if (!seen.add(c.constructor()) || vars.length != ctor.size()) {
					throw new TypeMismatch(DecompositionError.INVALID_PATTERN, c);
				}
				for (int j = 0; j != vars.length; ++j) {
					checkEqual(ctor.getFieldType(j), vars[j].type(), vars[j]);
					env.put(vars[j].name(), vars[j].type());
				}
			}
			check(env, c.body(), term.type());
		}
		if (!term.get(term.size() - 1).isWildcard()
				&& seen.size() != registry.getVariant(variant).getConstructors().length) {
			// Non-exhaustive match
			throw new TypeMismatch(DecompositionError.INVALID_PATTERN, term);
		}
		return term.type();
	}

	private VariantDeclaration.Constructor getConstructor(Type.Variant type, String name, Object element) {
		VariantDeclaration decl = registry.getVariant(type);
		VariantDeclaration.Constructor c = decl.getConstructor(name);
		if (c == null) {
			throw new TypeMismatch(DecompositionError.UNKNOWN_CONSTRUCTOR, element);
		}
		return c;
	}

	private static void checkEqual(Type expected, Type actual, Object element) {
		if (!expected.equals(actual)) {
			throw new TypeMismatch(DecompositionError.EXPECTED_TYPE, element + " : " + actual + " (expected " + expected + ")");
		}
	}
}
