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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.BoundRegion;
import higherranked.core.Syntax.Foldable;
import higherranked.core.Syntax.Instantiation;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Relatable;
import higherranked.util.InternalFailure;
import higherranked.util.TypeFolder;

/**
 * Relates values which quantify over regions, such as
 * <code>for&lt;'a&gt; fn(&amp;'a int)</code>. Subtyping between binders is
 * decided by opening the supertype's binder with placeholders, opening the
 * subtype's binder with fresh variables, relating the bodies and then checking
 * that no placeholder was forced to equal anything but itself (the leak check).
 * Least upper and greatest lower bounds open both sides with fresh variables,
 * and then decide which regions of the result can be quantified over again.
 *
 * @author David J. Pearce
 *
 */
public class HigherRanked {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	public final static String ESCAPING_BOUND_REGION = "escaping bound region encountered";
	public final static String NOT_ASSOCIATED_WITH_A = "region is not associated with any bound region from A";
	public final static String NON_REGION_VARIABLE = "found non-region-vid";
	public final static String NO_ORIGINAL_BOUND_REGION = "could not find original bound region";
	public final static String PLUG_WITHOUT_BINDER = "placeholder does not appear within a binder";
	public final static String PLUG_AFTER_LEAK = "cannot plug leaks when the leak check fails";

	private final CombineFields fields;
	private final InferenceContext infcx;

	public HigherRanked(CombineFields fields) {
		this.fields = fields;
		this.infcx = fields.infcx();
	}

	// ================================================================================
	// Subtyping
	// ================================================================================

	/**
	 * Check that one binder is a subtype of another. For example,
	 * <code>for&lt;'a&gt; fn(&amp;'a int)</code> is a subtype of
	 * <code>fn(&amp;'static int)</code> but not vice versa.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public <T extends Relatable<T>> Binder<T> sub(Binder<T> a, Binder<T> b) {
		if (DEBUG) {
			System.err.println("higher_ranked_sub(a=" + a + ", b=" + b + ")");
		}
		return infcx.commitIfOk(snapshot -> {
			// Subtype must hold for some choice of its bound regions
			T aPrime = infcx.replaceLateBoundRegionsWithFreshVar(a).value();
			// Supertype must hold for every choice of its bound regions
			Instantiation<T> bPrime = skolemizeLateBoundRegions(infcx, b, snapshot);
			if (DEBUG) {
				System.err.println("a_prime=" + aPrime);
				System.err.println("b_prime=" + bPrime.value());
			}
			T result = fields.sub().relate(aPrime, bPrime.value());
			Leak leak = leakCheck(infcx, bPrime.map(), snapshot);
			if (leak == null) {
				if (DEBUG) {
					System.err.println("higher_ranked_sub: OK result=" + result);
				}
				return new Binder<>(result);
			} else if (fields.aIsExpected()) {
				if (DEBUG) {
					System.err.println("Not as polymorphic!");
				}
				throw TypeError.insufficientPolymorphism(leak.boundRegion(), leak.region());
			} else {
				if (DEBUG) {
					System.err.println("Overly polymorphic!");
				}
				throw TypeError.overlyPolymorphic(leak.boundRegion(), leak.region());
			}
		});
	}

	// ================================================================================
	// Least Upper Bound
	// ================================================================================

	/**
	 * Compute the least upper bound of two binders. A region of the result is
	 * quantified over when it was created during this computation and relates only
	 * to regions created during it, at least one of which stands for a bound region
	 * of <code>a</code>.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public <T extends Relatable<T>> Binder<T> lub(Binder<T> a, Binder<T> b) {
		return infcx.commitIfOk(snapshot -> {
			Instantiation<T> aWithFresh = infcx.replaceLateBoundRegionsWithFreshVar(a);
			Instantiation<T> bWithFresh = infcx.replaceLateBoundRegionsWithFreshVar(b);
			Map<BoundRegion, Region> aMap = aWithFresh.map();
			T result0 = fields.lub().relate(aWithFresh.value(), bWithFresh.value());
			result0 = infcx.resolveTypeVarsIfPossible(result0);
			if (DEBUG) {
				System.err.println("lub result0 = " + result0);
			}
			Set<Region> newVars = infcx.regionVarsConfinedToSnapshot(snapshot);
			T result1 = foldRegionsIn(result0,
					(r, depth) -> generalizeLubRegion(snapshot, depth, newVars, aMap, r));
			if (DEBUG) {
				System.err.println("lub(" + a + "," + b + ") = " + result1);
			}
			return new Binder<>(result1);
		});
	}

	private Region generalizeLubRegion(InferenceContext.Snapshot snapshot, int depth, Set<Region> newVars,
			Map<BoundRegion, Region> aMap, Region r0) {
		// Regions which predate this computation stay as they are
		if (!newVars.contains(r0)) {
			InternalFailure.check(!r0.isBound(), ESCAPING_BOUND_REGION);
			if (DEBUG) {
				System.err.println("generalize_region(r0=" + r0 + "): not new variable");
			}
			return r0;
		}
		List<Region> tainted = infcx.taintedRegions(snapshot, r0);
		// So do new variables which are related to regions that predate it
		if (!newVars.containsAll(tainted)) {
			if (DEBUG) {
				System.err.println("generalize_region(r0=" + r0 + "): non-new-variables found in " + tainted);
			}
			return r0;
		}
		// Otherwise, replace with the first bound region from a it is associated
		// with.
		for (Map.Entry<BoundRegion, Region> e : aMap.entrySet()) {
			if (tainted.contains(e.getValue())) {
				if (DEBUG) {
					System.err.println("generalize_region(r0=" + r0 + "): replacing with " + e.getKey()
							+ ", tainted=" + tainted);
				}
				return new Region.Bound(depth, e.getKey());
			}
		}
		throw new InternalFailure(NOT_ASSOCIATED_WITH_A + ": " + r0);
	}

	// ================================================================================
	// Greatest Lower Bound
	// ================================================================================

	/**
	 * Compute the greatest lower bound of two binders. This is not always the
	 * greatest lower bound. When a region of the result relates to more than one
	 * bound region on either side, or to a bound region and some other region, a
	 * fresh bound region is used. This gives a lower bound, but not necessarily
	 * the greatest one.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public <T extends Relatable<T>> Binder<T> glb(Binder<T> a, Binder<T> b) {
		if (DEBUG) {
			System.err.println("higher_ranked_glb(" + a + ", " + b + ")");
		}
		return infcx.commitIfOk(snapshot -> {
			Instantiation<T> aWithFresh = infcx.replaceLateBoundRegionsWithFreshVar(a);
			Instantiation<T> bWithFresh = infcx.replaceLateBoundRegionsWithFreshVar(b);
			Map<BoundRegion, Region> aMap = aWithFresh.map();
			List<Region> aVars = varIds(aMap);
			List<Region> bVars = varIds(bWithFresh.map());
			T result0 = fields.glb().relate(aWithFresh.value(), bWithFresh.value());
			result0 = infcx.resolveTypeVarsIfPossible(result0);
			if (DEBUG) {
				System.err.println("glb result0 = " + result0);
			}
			Set<Region> newVars = infcx.regionVarsConfinedToSnapshot(snapshot);
			T result1 = foldRegionsIn(result0,
					(r, depth) -> generalizeGlbRegion(snapshot, depth, newVars, aMap, aVars, bVars, r));
			if (DEBUG) {
				System.err.println("glb(" + a + "," + b + ") = " + result1);
			}
			return new Binder<>(result1);
		});
	}

	private Region generalizeGlbRegion(InferenceContext.Snapshot snapshot, int depth, Set<Region> newVars,
			Map<BoundRegion, Region> aMap, List<Region> aVars, List<Region> bVars, Region r0) {
		if (!newVars.contains(r0)) {
			InternalFailure.check(!r0.isBound(), ESCAPING_BOUND_REGION);
			return r0;
		}
		List<Region> tainted = infcx.taintedRegions(snapshot, r0);
		Region aR = null;
		Region bR = null;
		boolean onlyNewVars = true;
		for (Region r : tainted) {
			if (aVars.contains(r)) {
				if (aR != null) {
					return freshBoundVariable(depth);
				}
				aR = r;
			} else if (bVars.contains(r)) {
				if (bR != null) {
					return freshBoundVariable(depth);
				}
				bR = r;
			} else if (!newVars.contains(r)) {
				onlyNewVars = false;
			}
		}
		if (aR != null && bR != null && onlyNewVars) {
			// Related to exactly one bound region from each side
			return revLookup(aMap, aR, depth);
		} else if (aR == null && bR == null) {
			// Related to no bound region from either side
			InternalFailure.check(!r0.isBound(), ESCAPING_BOUND_REGION);
			return r0;
		} else {
			return freshBoundVariable(depth);
		}
	}

	private static Region revLookup(Map<BoundRegion, Region> aMap, Region r, int depth) {
		for (Map.Entry<BoundRegion, Region> e : aMap.entrySet()) {
			if (e.getValue().equals(r)) {
				return new Region.Bound(depth, e.getKey());
			}
		}
		throw new InternalFailure(NO_ORIGINAL_BOUND_REGION + ": " + r);
	}

	private Region freshBoundVariable(int depth) {
		return infcx.regions().newBound(depth);
	}

	private static List<Region> varIds(Map<BoundRegion, Region> map) {
		ArrayList<Region> vars = new ArrayList<>();
		for (Region r : map.values()) {
			if (!(r instanceof Region.Variable)) {
				throw new InternalFailure(NON_REGION_VARIABLE + ": " + r);
			}
			vars.add(r);
		}
		return vars;
	}

	/**
	 * Fold every region of a value which was instantiated from a binder. None of
	 * these can be bound at the level of the value itself, since such regions were
	 * replaced with fresh variables.
	 *
	 * @param value
	 * @param fn
	 * @return
	 */
	private static <T extends Foldable<T>> T foldRegionsIn(T value,
			BiFunction<Region, Integer, Region> fn) {
		return TypeFolder.foldRegions(value, (r, depth) -> {
			InternalFailure.check(!r.isBound(), ESCAPING_BOUND_REGION + ": " + r);
			return fn.apply(r, depth);
		});
	}

	// ================================================================================
	// Skolemization & Leaks
	// ================================================================================

	/**
	 * Replace every region bound by a given binder with a fresh placeholder, scoped
	 * to a given snapshot.
	 *
	 * @param infcx
	 * @param binder
	 * @param snapshot
	 * @return The opened body, and the placeholder used for each bound region in
	 *         order of first occurrence.
	 */
	public static <T extends Relatable<T>> Instantiation<T> skolemizeLateBoundRegions(InferenceContext infcx,
			Binder<T> binder, InferenceContext.Snapshot snapshot) {
		Instantiation<T> result = binder
				.replaceLateBoundRegions(br -> infcx.regions().newSkolemized(br, snapshot.regionSnapshot()));
		if (DEBUG) {
			System.err.println("skolemize_bound_regions(binder=" + binder + ", result=" + result.value() + ", map="
					+ result.map() + ")");
		}
		return result;
	}

	/**
	 * Check whether any placeholder has been related (since a given snapshot) to a
	 * region other than itself, or a region variable confined to the snapshot.
	 *
	 * @param infcx
	 * @param skolMap
	 * @param snapshot
	 * @return The first such leak found, or <code>null</code> if there is none.
	 */
	public static Leak leakCheck(InferenceContext infcx, Map<BoundRegion, Region> skolMap,
			InferenceContext.Snapshot snapshot) {
		if (DEBUG) {
			System.err.println("leak_check: skol_map=" + skolMap);
		}
		Set<Region> newVars = infcx.regionVarsConfinedToSnapshot(snapshot);
		for (Map.Entry<BoundRegion, Region> e : skolMap.entrySet()) {
			Region skol = e.getValue();
			for (Region tainted : infcx.taintedRegions(snapshot, skol)) {
				if (tainted instanceof Region.Variable ? newVars.contains(tainted) : tainted.equals(skol)) {
					continue;
				}
				if (DEBUG) {
					System.err.println(skol + " (which replaced " + e.getKey() + ") is tainted by " + tainted);
				}
				return new Leak(e.getKey(), tainted);
			}
		}
		return null;
	}

	/**
	 * Turn the placeholders created by skolemization back into bound regions. Every
	 * region in the taint set of a placeholder is replaced by the bound region it
	 * stands for, bound by the outermost binder of the given value. This may only
	 * be used when the leak check passes.
	 *
	 * @param infcx
	 * @param skolMap
	 * @param snapshot
	 * @param value
	 * @return
	 */
	public static <T extends Foldable<T>> T plugLeaks(InferenceContext infcx, Map<BoundRegion, Region> skolMap,
			InferenceContext.Snapshot snapshot, T value) {
		if (infcx.checkPlugPreconditions()) {
			InternalFailure.check(leakCheck(infcx, skolMap, snapshot) == null, PLUG_AFTER_LEAK);
		}
		if (DEBUG) {
			System.err.println("plug_leaks(skol_map=" + skolMap + ", value=" + value + ")");
		}
		// Taint sets are disjoint, since the leak check passed
		HashMap<Region, BoundRegion> inverse = new HashMap<>();
		for (Map.Entry<BoundRegion, Region> e : skolMap.entrySet()) {
			for (Region tainted : infcx.taintedRegions(snapshot, e.getValue())) {
				inverse.put(tainted, e.getKey());
			}
		}
		if (DEBUG) {
			System.err.println("plug_leaks: inv_skol_map=" + inverse);
		}
		// Type variables can hide regions from the fold
		T resolved = infcx.resolveTypeVarsIfPossible(value);
		T result = TypeFolder.foldRegions(resolved, (r, depth) -> {
			BoundRegion br = inverse.get(r);
			if (br == null) {
				return r;
			}
			InternalFailure.check(depth > 1, PLUG_WITHOUT_BINDER + ": " + r);
			return new Region.Bound(depth - 1, br);
		});
		if (DEBUG) {
			System.err.println("plug_leaks: result=" + result);
		}
		return result;
	}

	/**
	 * Identifies a placeholder which has leaked, by the bound region it replaced
	 * and the region it was found to be related to.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Leak {
		private final BoundRegion boundRegion;
		private final Region region;

		public Leak(BoundRegion boundRegion, Region region) {
			this.boundRegion = boundRegion;
			this.region = region;
		}

		public BoundRegion boundRegion() {
			return boundRegion;
		}

		public Region region() {
			return region;
		}

		@Override
		public String toString() {
			return "(" + boundRegion + ", " + region + ")";
		}
	}
}
