// This file is part of the HigherRanked Inference library.
//
// The HigherRanked Inference library is free software; you can
// redistribute it and/or modify it under the terms of the GNU General
// Public License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The HigherRanked Inference library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the HigherRanked Inference library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package higherranked.core;

import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Type;
import higherranked.util.TypeFolder;

/**
 * The state shared by the relations used during a single comparison: the
 * inference context, and which of the two sides is the expected one. Also
 * responsible for instantiating type variables.
 *
 * @author David J. Pearce
 *
 */
public class CombineFields {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	/**
	 * The relationship required between a type and the variable it is being used
	 * to instantiate.
	 */
	public enum Direction {
		SUBTYPE_OF, SUPERTYPE_OF, EQUAL_TO
	}

	private final InferenceContext infcx;
	private final boolean aIsExpected;

	public CombineFields(InferenceContext infcx, boolean aIsExpected) {
		this.infcx = infcx;
		this.aIsExpected = aIsExpected;
	}

	public InferenceContext infcx() {
		return infcx;
	}

	public boolean aIsExpected() {
		return aIsExpected;
	}

	/**
	 * Get the same fields, but with the expected side swapped. This is used when
	 * the operands of a relation are swapped.
	 *
	 * @return
	 */
	public CombineFields switchExpected() {
		return new CombineFields(infcx, !aIsExpected);
	}

	public TypeRelation.Sub sub() {
		return new TypeRelation.Sub(this);
	}

	public TypeRelation.Lub lub() {
		return new TypeRelation.Lub(this);
	}

	public TypeRelation.Glb glb() {
		return new TypeRelation.Glb(this);
	}

	public TypeRelation.Equate equate() {
		return new TypeRelation.Equate(this);
	}

	/**
	 * Instantiate an unresolved type variable so that a given type stands in the
	 * required relationship to it. The variable is assigned a copy of the type in
	 * which every region is replaced by a fresh variable (unless an equality is
	 * required), and the type is then related against that copy.
	 *
	 * @param type
	 * @param direction
	 * @param variable
	 */
	public void instantiate(Type type, Direction direction, Type.Variable variable) {
		Type generalized = generalize(type, variable, direction == Direction.EQUAL_TO);
		if (DEBUG) {
			System.err.println("instantiate(" + type + ", " + direction + ", " + variable + ") = " + generalized);
		}
		infcx.typeVariables().instantiate(variable, generalized);
		switch (direction) {
		case EQUAL_TO:
			equate().relate(type, generalized);
			break;
		case SUBTYPE_OF:
			sub().relate(type, generalized);
			break;
		case SUPERTYPE_OF:
			sub().relateWithVariance(TypeRelation.Variance.CONTRAVARIANT, type, generalized);
			break;
		}
	}

	/**
	 * Make one unresolved type variable stand for another.
	 *
	 * @param a
	 * @param b
	 */
	public void unify(Type.Variable a, Type.Variable b) {
		infcx.typeVariables().instantiate(a, b);
	}

	/**
	 * Copy a type for use as the value of a given type variable. Regions bound
	 * within the type are kept, whilst all others are replaced with fresh region
	 * variables unless they are to be kept. Instantiated type variables are
	 * followed, and encountering the variable itself means the type would be
	 * infinite.
	 *
	 * @param type
	 * @param variable
	 * @param keepRegions
	 * @return
	 */
	private Type generalize(Type type, Type.Variable variable, boolean keepRegions) {
		TypeFolder generalizer = new TypeFolder() {
			@Override
			public Type fold(Type.Variable v, int depth) {
				Type value = infcx.typeVariables().probe(v);
				if (value != null) {
					return value.fold(this, depth);
				} else if (v.equals(variable)) {
					throw TypeError.expectedFound(TypeError.Kind.CYCLIC_TYPE, aIsExpected, variable, type);
				}
				return v;
			}

			@Override
			public Region fold(Region.Free r, int depth) {
				return generalize(r);
			}

			@Override
			public Region fold(Region.Variable r, int depth) {
				return generalize(r);
			}

			@Override
			public Region fold(Region.Skolemized r, int depth) {
				return generalize(r);
			}

			private Region generalize(Region r) {
				if (keepRegions) {
					return r;
				}
				return infcx.regions().newVariable(RegionStore.Origin.GENERALIZED);
			}
		};
		return type.fold(generalizer, 1);
	}

	@Override
	public String toString() {
		return "CombineFields(aIsExpected=" + aIsExpected + ")";
	}
}
