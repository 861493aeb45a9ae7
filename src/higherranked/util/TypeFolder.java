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
package higherranked.util;

import java.util.Set;
import java.util.function.BiFunction;

import higherranked.core.Syntax;
import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.Foldable;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Relatable;
import higherranked.core.Syntax.Signature;
import higherranked.core.Syntax.Type;

/**
 * Rebuilds a value bottom-up, threading the current de Bruijn depth through the
 * traversal. By default every component is rebuilt unchanged, and subclasses
 * override the cases they are interested in.
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeFolder {

	public Region fold(Region region, int depth) {
		switch (region.getOpcode()) {
		case Syntax.REGION_free:
			return fold((Region.Free) region, depth);
		case Syntax.REGION_variable:
			return fold((Region.Variable) region, depth);
		case Syntax.REGION_bound:
			return fold((Region.Bound) region, depth);
		case Syntax.REGION_skolemized:
			return fold((Region.Skolemized) region, depth);
		}
		throw new IllegalArgumentException("Invalid region encountered: " + region);
	}

	public Region fold(Region.Free region, int depth) {
		return region;
	}

	public Region fold(Region.Variable region, int depth) {
		return region;
	}

	public Region fold(Region.Bound region, int depth) {
		return region;
	}

	public Region fold(Region.Skolemized region, int depth) {
		return region;
	}

	public Type fold(Type type, int depth) {
		switch (type.getOpcode()) {
		case Syntax.TYPE_unit:
		case Syntax.TYPE_int:
			return type;
		case Syntax.TYPE_reference:
			return fold((Type.Reference) type, depth);
		case Syntax.TYPE_function:
			return fold((Type.Function) type, depth);
		case Syntax.TYPE_tuple:
			return fold((Type.Tuple) type, depth);
		case Syntax.TYPE_variable:
			return fold((Type.Variable) type, depth);
		case Syntax.TYPE_parameter:
			return fold((Type.Parameter) type, depth);
		}
		throw new IllegalArgumentException("Invalid type encountered: " + type);
	}

	public Type fold(Type.Reference type, int depth) {
		Region region = type.region().fold(this, depth);
		Type element = type.element().fold(this, depth);
		return new Type.Reference(region, type.isMutable(), element);
	}

	public Type fold(Type.Function type, int depth) {
		return new Type.Function(fold(type.signature(), depth));
	}

	public Type fold(Type.Tuple type, int depth) {
		Type[] elements = new Type[type.size()];
		for (int i = 0; i != elements.length; ++i) {
			elements[i] = type.get(i).fold(this, depth);
		}
		return new Type.Tuple(elements);
	}

	public Type fold(Type.Variable type, int depth) {
		return type;
	}

	public Type fold(Type.Parameter type, int depth) {
		return type;
	}

	public Signature fold(Signature signature, int depth) {
		Type[] parameters = signature.parameters();
		Type[] ps = new Type[parameters.length];
		for (int i = 0; i != ps.length; ++i) {
			ps[i] = parameters[i].fold(this, depth);
		}
		return new Signature(ps, signature.result().fold(this, depth));
	}

	/**
	 * Fold the body of a binder. Entering a binder increases the depth by one.
	 *
	 * @param binder
	 * @param depth
	 * @return
	 */
	public <T extends Relatable<T>> Binder<T> fold(Binder<T> binder, int depth) {
		return new Binder<>(binder.body().fold(this, depth + 1));
	}

	/**
	 * Apply a function to every region in a value which is not bound within that
	 * value. The function is given the depth at which the region was found, so a
	 * bound region of that same depth escapes the value.
	 *
	 * @param value
	 * @param fn
	 * @return
	 */
	public static <T extends Foldable<T>> T foldRegions(T value, BiFunction<Region, Integer, Region> fn) {
		return value.fold(new RegionFolder(fn), 1);
	}

	/**
	 * Add every region which is not bound within a given value into a set.
	 *
	 * @param value
	 * @param regions
	 */
	public static <T extends Foldable<T>> void collectRegions(T value, Set<Region> regions) {
		foldRegions(value, (r, depth) -> {
			regions.add(r);
			return r;
		});
	}

	public static class RegionFolder extends TypeFolder {
		private final BiFunction<Region, Integer, Region> fn;

		public RegionFolder(BiFunction<Region, Integer, Region> fn) {
			this.fn = fn;
		}

		@Override
		public Region fold(Region region, int depth) {
			if (region instanceof Region.Bound && ((Region.Bound) region).depth() < depth) {
				// Bound within the value itself
				return region;
			}
			return fn.apply(region, depth);
		}
	}
}
