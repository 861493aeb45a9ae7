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

import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Relatable;
import higherranked.core.Syntax.Type;
import higherranked.util.InternalFailure;

/**
 * A structural relation between two values, such as subtyping or computing a
 * least upper bound. Values are walked in parallel, with each component related
 * according to its variance. The relation determines what happens at the
 * leaves (types, regions and binders).
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeRelation {
	public enum Variance {
		COVARIANT, CONTRAVARIANT, INVARIANT
	}

	protected final CombineFields fields;

	public TypeRelation(CombineFields fields) {
		this.fields = fields;
	}

	/**
	 * A short name identifying this relation, for debugging.
	 *
	 * @return
	 */
	public abstract String tag();

	public CombineFields fields() {
		return fields;
	}

	public InferenceContext infcx() {
		return fields.infcx();
	}

	public boolean aIsExpected() {
		return fields.aIsExpected();
	}

	/**
	 * Relate two values covariantly.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public <T extends Relatable<T>> T relate(T a, T b) {
		return a.relate(this, b);
	}

	public abstract <T extends Relatable<T>> T relateWithVariance(Variance variance, T a, T b);

	public abstract Type tys(Type a, Type b);

	public abstract Region regions(Region a, Region b);

	public abstract <T extends Relatable<T>> Binder<T> binders(Binder<T> a, Binder<T> b);

	/**
	 * Relate two types which are not type variables, by walking their structure.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	protected Type superCombineTys(Type a, Type b) {
		if (a.getOpcode() != b.getOpcode()) {
			throw TypeError.expectedFound(TypeError.Kind.MISMATCH, aIsExpected(), a, b);
		}
		switch (a.getOpcode()) {
		case Syntax.TYPE_unit:
		case Syntax.TYPE_int:
			return a;
		case Syntax.TYPE_reference:
			return superCombineTys((Type.Reference) a, (Type.Reference) b);
		case Syntax.TYPE_function: {
			Binder<Syntax.Signature> s = relate(((Type.Function) a).signature(), ((Type.Function) b).signature());
			return new Type.Function(s);
		}
		case Syntax.TYPE_tuple:
			return superCombineTys((Type.Tuple) a, (Type.Tuple) b);
		case Syntax.TYPE_parameter:
			if (a.equals(b)) {
				return a;
			}
			throw TypeError.expectedFound(TypeError.Kind.MISMATCH, aIsExpected(), a, b);
		}
		throw new InternalFailure("unexpected type encountered: " + a);
	}

	private Type superCombineTys(Type.Reference a, Type.Reference b) {
		if (a.isMutable() != b.isMutable()) {
			throw TypeError.expectedFound(TypeError.Kind.MUTABILITY, aIsExpected(), a, b);
		}
		// A longer lived reference is a subtype of a shorter lived one
		Region r = relateWithVariance(Variance.CONTRAVARIANT, a.region(), b.region());
		Type e;
		if (a.isMutable()) {
			e = relateWithVariance(Variance.INVARIANT, a.element(), b.element());
		} else {
			e = relate(a.element(), b.element());
		}
		return new Type.Reference(r, a.isMutable(), e);
	}

	private Type superCombineTys(Type.Tuple a, Type.Tuple b) {
		if (a.size() != b.size()) {
			throw TypeError.expectedFound(TypeError.Kind.MISMATCH, aIsExpected(), a, b);
		}
		Type[] elements = new Type[a.size()];
		for (int i = 0; i != elements.length; ++i) {
			elements[i] = relate(a.get(i), b.get(i));
		}
		return new Type.Tuple(elements);
	}

	@Override
	public String toString() {
		return tag() + "(" + (aIsExpected() ? "a" : "b") + ")";
	}

	// ================================================================================
	// Sub
	// ================================================================================

	/**
	 * Relates <code>a</code> as a subtype of <code>b</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Sub extends TypeRelation {

		public Sub(CombineFields fields) {
			super(fields);
		}

		@Override
		public String tag() {
			return "Sub";
		}

		@Override
		public <T extends Relatable<T>> T relateWithVariance(Variance variance, T a, T b) {
			switch (variance) {
			case COVARIANT:
				return relate(a, b);
			case CONTRAVARIANT:
				return fields.switchExpected().sub().relate(b, a);
			default:
				return fields.equate().relate(a, b);
			}
		}

		@Override
		public Type tys(Type a, Type b) {
			if (a.equals(b)) {
				return a;
			}
			InferenceContext infcx = infcx();
			Type ra = infcx.shallowResolve(a);
			Type rb = infcx.shallowResolve(b);
			if (ra.equals(rb)) {
				return a;
			} else if (ra instanceof Type.Variable && rb instanceof Type.Variable) {
				fields.unify((Type.Variable) ra, (Type.Variable) rb);
			} else if (ra instanceof Type.Variable) {
				fields.switchExpected().instantiate(rb, CombineFields.Direction.SUPERTYPE_OF, (Type.Variable) ra);
			} else if (rb instanceof Type.Variable) {
				fields.instantiate(ra, CombineFields.Direction.SUBTYPE_OF, (Type.Variable) rb);
			} else {
				superCombineTys(ra, rb);
			}
			return a;
		}

		@Override
		public Region regions(Region a, Region b) {
			infcx().regions().makeSubRegion(a, b);
			return a;
		}

		@Override
		public <T extends Relatable<T>> Binder<T> binders(Binder<T> a, Binder<T> b) {
			return new HigherRanked(fields).sub(a, b);
		}
	}

	// ================================================================================
	// Lub
	// ================================================================================

	/**
	 * Computes the least upper bound of two values.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Lub extends TypeRelation {

		public Lub(CombineFields fields) {
			super(fields);
		}

		@Override
		public String tag() {
			return "Lub";
		}

		@Override
		public <T extends Relatable<T>> T relateWithVariance(Variance variance, T a, T b) {
			switch (variance) {
			case COVARIANT:
				return relate(a, b);
			case CONTRAVARIANT:
				return fields.glb().relate(a, b);
			default:
				return fields.equate().relate(a, b);
			}
		}

		@Override
		public Type tys(Type a, Type b) {
			if (a.equals(b)) {
				return a;
			}
			InferenceContext infcx = infcx();
			Type ra = infcx.shallowResolve(a);
			Type rb = infcx.shallowResolve(b);
			if (ra instanceof Type.Variable || rb instanceof Type.Variable) {
				// Defer to a fresh variable above both
				Type.Variable v = infcx.nextTypeVariable();
				Sub sub = fields.sub();
				sub.relate(ra, v);
				sub.relate(rb, v);
				return v;
			}
			return superCombineTys(ra, rb);
		}

		@Override
		public Region regions(Region a, Region b) {
			return infcx().regions().lubRegions(a, b);
		}

		@Override
		public <T extends Relatable<T>> Binder<T> binders(Binder<T> a, Binder<T> b) {
			return new HigherRanked(fields).lub(a, b);
		}
	}

	// ================================================================================
	// Glb
	// ================================================================================

	/**
	 * Computes the greatest lower bound of two values.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Glb extends TypeRelation {

		public Glb(CombineFields fields) {
			super(fields);
		}

		@Override
		public String tag() {
			return "Glb";
		}

		@Override
		public <T extends Relatable<T>> T relateWithVariance(Variance variance, T a, T b) {
			switch (variance) {
			case COVARIANT:
				return relate(a, b);
			case CONTRAVARIANT:
				return fields.lub().relate(a, b);
			default:
				return fields.equate().relate(a, b);
			}
		}

		@Override
		public Type tys(Type a, Type b) {
			if (a.equals(b)) {
				return a;
			}
			InferenceContext infcx = infcx();
			Type ra = infcx.shallowResolve(a);
			Type rb = infcx.shallowResolve(b);
			if (ra instanceof Type.Variable || rb instanceof Type.Variable) {
				// Defer to a fresh variable below both
				Type.Variable v = infcx.nextTypeVariable();
				Sub sub = fields.sub();
				sub.relate(v, ra);
				sub.relate(v, rb);
				return v;
			}
			return superCombineTys(ra, rb);
		}

		@Override
		public Region regions(Region a, Region b) {
			return infcx().regions().glbRegions(a, b);
		}

		@Override
		public <T extends Relatable<T>> Binder<T> binders(Binder<T> a, Binder<T> b) {
			return new HigherRanked(fields).glb(a, b);
		}
	}

	// ================================================================================
	// Equate
	// ================================================================================

	/**
	 * Requires two values to be the same.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Equate extends TypeRelation {

		public Equate(CombineFields fields) {
			super(fields);
		}

		@Override
		public String tag() {
			return "Equate";
		}

		@Override
		public <T extends Relatable<T>> T relateWithVariance(Variance variance, T a, T b) {
			return relate(a, b);
		}

		@Override
		public Type tys(Type a, Type b) {
			if (a.equals(b)) {
				return a;
			}
			InferenceContext infcx = infcx();
			Type ra = infcx.shallowResolve(a);
			Type rb = infcx.shallowResolve(b);
			if (ra.equals(rb)) {
				return a;
			} else if (ra instanceof Type.Variable && rb instanceof Type.Variable) {
				fields.unify((Type.Variable) ra, (Type.Variable) rb);
			} else if (ra instanceof Type.Variable) {
				fields.instantiate(rb, CombineFields.Direction.EQUAL_TO, (Type.Variable) ra);
			} else if (rb instanceof Type.Variable) {
				fields.instantiate(ra, CombineFields.Direction.EQUAL_TO, (Type.Variable) rb);
			} else {
				superCombineTys(ra, rb);
			}
			return a;
		}

		@Override
		public Region regions(Region a, Region b) {
			infcx().regions().makeEqRegion(a, b);
			return a;
		}

		@Override
		public <T extends Relatable<T>> Binder<T> binders(Binder<T> a, Binder<T> b) {
			HigherRanked hr = new HigherRanked(fields);
			hr.sub(a, b);
			hr.sub(b, a);
			return a;
		}
	}
}
