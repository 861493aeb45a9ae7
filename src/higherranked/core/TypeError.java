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

import higherranked.core.Syntax.BoundRegion;
import higherranked.core.Syntax.Region;

/**
 * This exception is thrown when two types cannot be related. Such errors are
 * reported to the user, rather than indicating a problem with the inference
 * engine itself.
 *
 * @author David J. Pearce
 *
 */
public class TypeError extends RuntimeException {
	public enum Kind {
		MISMATCH("mismatched types"),
		ARGUMENT_COUNT("incorrect number of function parameters"),
		MUTABILITY("types differ in mutability"),
		TRAIT_MISMATCH("mismatched traits"),
		CYCLIC_TYPE("cyclic type of infinite size"),
		/**
		 * The candidate is not as polymorphic as required. For example,
		 * <code>fn(&amp;'static int)</code> is not a subtype of
		 * <code>for&lt;'a&gt; fn(&amp;'a int)</code>.
		 */
		INSUFFICIENT_POLYMORPHISM("expected bound lifetime parameter"),
		/**
		 * The candidate is more polymorphic than expected. This is the same leak as
		 * above, but observed with the opposite polarity.
		 */
		OVERLY_POLYMORPHIC("expected concrete lifetime");

		private final String description;

		private Kind(String description) {
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	private final Kind kind;
	private final Object expected;
	private final Object found;
	private final BoundRegion boundRegion;
	private final Region region;

	private TypeError(Kind kind, Object expected, Object found, BoundRegion boundRegion, Region region) {
		this.kind = kind;
		this.expected = expected;
		this.found = found;
		this.boundRegion = boundRegion;
		this.region = region;
	}

	/**
	 * Construct an error relating two items. These are given in the order they
	 * were compared, and reported as expected / found according to which side the
	 * comparison expected.
	 *
	 * @param kind
	 * @param aIsExpected
	 * @param a
	 * @param b
	 * @return
	 */
	public static TypeError expectedFound(Kind kind, boolean aIsExpected, Object a, Object b) {
		if (aIsExpected) {
			return new TypeError(kind, a, b, null, null);
		} else {
			return new TypeError(kind, b, a, null, null);
		}
	}

	public static TypeError insufficientPolymorphism(BoundRegion boundRegion, Region region) {
		return new TypeError(Kind.INSUFFICIENT_POLYMORPHISM, null, null, boundRegion, region);
	}

	public static TypeError overlyPolymorphic(BoundRegion boundRegion, Region region) {
		return new TypeError(Kind.OVERLY_POLYMORPHIC, null, null, boundRegion, region);
	}

	public Kind kind() {
		return kind;
	}

	public Object expected() {
		return expected;
	}

	public Object found() {
		return found;
	}

	/**
	 * For a region leak, the quantified position which leaked.
	 *
	 * @return
	 */
	public BoundRegion boundRegion() {
		return boundRegion;
	}

	/**
	 * For a region leak, the region the quantified position leaked into.
	 *
	 * @return
	 */
	public Region region() {
		return region;
	}

	@Override
	public String getMessage() {
		if (boundRegion != null) {
			return kind + ": " + boundRegion + " related to " + region;
		} else {
			return kind + ": expected " + expected + ", found " + found;
		}
	}

	public static final long serialVersionUID = 1l;
}
