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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import higherranked.core.Syntax.BoundRegion;
import higherranked.core.Syntax.Region;
import higherranked.util.InternalFailure;
import higherranked.util.UndoLog;

/**
 * Responsible for allocating region variables and recording the constraints
 * between regions which arise when types are related. Constraints are only
 * recorded here; solving them is the business of region inference proper.
 *
 * @author David J. Pearce
 *
 */
public class RegionStore {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	public final static String CANNOT_RELATE_BOUND = "cannot relate bound region";
	public final static String SKOLEMIZE_OUTSIDE_SNAPSHOT = "cannot skolemize outside of a snapshot";

	/**
	 * Describes why a region variable was created.
	 */
	public enum Origin {
		HIGHER_RANKED_TYPE, GENERALIZED, COMBINATION, MISC
	}

	/**
	 * Identifies the two operations for which combination variables are created.
	 */
	public enum Combine {
		LUB, GLB
	}

	private final ArrayList<Origin> variables = new ArrayList<>();
	private final ArrayList<Constraint> constraints = new ArrayList<>();
	private final Map<Pair, Integer> lubs = new HashMap<>();
	private final Map<Pair, Integer> glbs = new HashMap<>();
	private final UndoLog<Action> log = new UndoLog<>(this::reverse);
	private int skolemizationCount;
	private int boundCount;

	// ================================================================================
	// Allocation
	// ================================================================================

	public Region.Variable newVariable(Origin origin) {
		int id = variables.size();
		variables.add(origin);
		log.push(new AddVariable(id));
		if (DEBUG) {
			System.err.println("created region variable '?" + id + " (" + origin + ")");
		}
		return new Region.Variable(id);
	}

	/**
	 * Create a fresh placeholder for a given bound region. Placeholders may only be
	 * created within the innermost open snapshot, which they are scoped to.
	 *
	 * @param br
	 * @param snapshot
	 * @return
	 */
	public Region.Skolemized newSkolemized(BoundRegion br, Snapshot snapshot) {
		InternalFailure.check(log.inSnapshot(), SKOLEMIZE_OUTSIDE_SNAPSHOT);
		InternalFailure.check(log.isInnermost(snapshot.log), SKOLEMIZE_OUTSIDE_SNAPSHOT);
		int sc = skolemizationCount++;
		return new Region.Skolemized(sc, br);
	}

	/**
	 * Create a bound region at a given depth whose identity is distinct from every
	 * other bound region created so far.
	 *
	 * @param depth
	 * @return
	 */
	public Region.Bound newBound(int depth) {
		int sc = boundCount++;
		return new Region.Bound(depth, BoundRegion.fresh(sc));
	}

	/**
	 * Get the number of region variables created so far.
	 *
	 * @return
	 */
	public int size() {
		return variables.size();
	}

	public Origin origin(Region.Variable variable) {
		return variables.get(variable.id());
	}

	public List<Constraint> constraints() {
		return Collections.unmodifiableList(constraints);
	}

	// ================================================================================
	// Constraints
	// ================================================================================

	/**
	 * Record that one region is contained within another.
	 *
	 * @param sub
	 * @param sup
	 */
	public void makeSubRegion(Region sub, Region sup) {
		if (sub.isBound() || sup.isBound()) {
			throw new InternalFailure(CANNOT_RELATE_BOUND + ": " + sub + " <= " + sup);
		} else if (sub.equals(sup) || sup.equals(Region.STATIC)) {
			// Trivially true
			return;
		}
		boolean subVar = sub instanceof Region.Variable;
		boolean supVar = sup instanceof Region.Variable;
		Constraint.Kind kind;
		if (subVar && supVar) {
			kind = Constraint.Kind.VAR_SUB_VAR;
		} else if (supVar) {
			kind = Constraint.Kind.REG_SUB_VAR;
		} else if (subVar) {
			kind = Constraint.Kind.VAR_SUB_REG;
		} else {
			kind = Constraint.Kind.VERIFY;
		}
		Constraint c = new Constraint(kind, sub, sup);
		if (DEBUG) {
			System.err.println("constraint " + c);
		}
		constraints.add(c);
		log.push(new AddConstraint(c));
	}

	public void makeEqRegion(Region a, Region b) {
		makeSubRegion(a, b);
		makeSubRegion(b, a);
	}

	/**
	 * Determine a region which contains both of two given regions.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public Region lubRegions(Region a, Region b) {
		checkNotBound(a, b);
		if (a.equals(Region.STATIC) || b.equals(Region.STATIC)) {
			// Nothing lives longer than static
			return Region.STATIC;
		} else if (a.equals(b)) {
			return a;
		} else {
			return combineVariables(Combine.LUB, a, b);
		}
	}

	/**
	 * Determine a region contained within both of two given regions.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public Region glbRegions(Region a, Region b) {
		checkNotBound(a, b);
		if (a.equals(Region.STATIC)) {
			return b;
		} else if (b.equals(Region.STATIC)) {
			return a;
		} else if (a.equals(b)) {
			return a;
		} else {
			return combineVariables(Combine.GLB, a, b);
		}
	}

	private Region combineVariables(Combine kind, Region a, Region b) {
		Map<Pair, Integer> map = kind == Combine.LUB ? lubs : glbs;
		Pair key = new Pair(a, b);
		Integer existing = map.get(key);
		if (existing != null) {
			return new Region.Variable(existing);
		}
		Region.Variable c = newVariable(Origin.COMBINATION);
		map.put(key, c.id());
		log.push(new AddCombination(kind, key));
		if (kind == Combine.LUB) {
			makeSubRegion(a, c);
			makeSubRegion(b, c);
		} else {
			makeSubRegion(c, a);
			makeSubRegion(c, b);
		}
		return c;
	}

	private void checkNotBound(Region a, Region b) {
		if (a.isBound() || b.isBound()) {
			throw new InternalFailure(CANNOT_RELATE_BOUND + ": " + a + ", " + b);
		}
	}

	// ================================================================================
	// Snapshots
	// ================================================================================

	public Snapshot startSnapshot() {
		return new Snapshot(log.start(), skolemizationCount);
	}

	public void commit(Snapshot snapshot) {
		log.commit(snapshot.log);
		// Placeholders never outlive the snapshot which created them
		skolemizationCount = snapshot.skolemizationCount;
	}

	public void rollbackTo(Snapshot snapshot) {
		log.rollbackTo(snapshot.log);
		skolemizationCount = snapshot.skolemizationCount;
	}

	/**
	 * Determine every region variable created since a given snapshot was opened.
	 *
	 * @param snapshot
	 * @return
	 */
	public List<Integer> varsCreatedSince(Snapshot snapshot) {
		ArrayList<Integer> vars = new ArrayList<>();
		for (Action a : log.actionsSince(snapshot.log)) {
			if (a instanceof AddVariable) {
				vars.add(((AddVariable) a).id);
			}
		}
		return vars;
	}

	/**
	 * Compute the set of regions which are related to a given region by
	 * constraints recorded since a given snapshot. Constraints are followed in both
	 * directions and the result always includes the region itself, which comes
	 * first.
	 *
	 * @param snapshot
	 * @param r0
	 * @return
	 */
	public List<Region> tainted(Snapshot snapshot, Region r0) {
		List<Action> actions = log.actionsSince(snapshot.log);
		// Acts as a worklist
		ArrayList<Region> result = new ArrayList<>();
		result.add(r0);
		for (int i = 0; i < result.size(); ++i) {
			Region r = result.get(i);
			for (Action a : actions) {
				if (a instanceof AddConstraint) {
					Constraint c = ((AddConstraint) a).constraint;
					if (r.equals(c.sub) && !result.contains(c.sup)) {
						result.add(c.sup);
					} else if (r.equals(c.sup) && !result.contains(c.sub)) {
						result.add(c.sub);
					}
				}
			}
		}
		return result;
	}

	private void reverse(Action action) {
		if (action instanceof AddVariable) {
			int id = ((AddVariable) action).id;
			InternalFailure.check(id == variables.size() - 1, "region variables rolled back out of order");
			variables.remove(id);
		} else if (action instanceof AddConstraint) {
			constraints.remove(constraints.size() - 1);
		} else {
			AddCombination c = (AddCombination) action;
			(c.kind == Combine.LUB ? lubs : glbs).remove(c.regions);
		}
	}

	/**
	 * Records the state of this store at a given moment.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Snapshot {
		private final UndoLog.Snapshot log;
		private final int skolemizationCount;

		private Snapshot(UndoLog.Snapshot log, int skolemizationCount) {
			this.log = log;
			this.skolemizationCount = skolemizationCount;
		}

		@Override
		public String toString() {
			return log.toString();
		}
	}

	/**
	 * A constraint that one region is contained within another. Constraints
	 * between two concrete regions cannot influence inference and are recorded
	 * only so they can be verified later.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Constraint {
		public enum Kind {
			VAR_SUB_VAR, REG_SUB_VAR, VAR_SUB_REG, VERIFY
		}

		private final Kind kind;
		private final Region sub;
		private final Region sup;

		public Constraint(Kind kind, Region sub, Region sup) {
			this.kind = kind;
			this.sub = sub;
			this.sup = sup;
		}

		public Kind kind() {
			return kind;
		}

		public Region sub() {
			return sub;
		}

		public Region sup() {
			return sup;
		}

		@Override
		public String toString() {
			return sub + " <= " + sup;
		}
	}

	private interface Action {

	}

	private static final class AddVariable implements Action {
		private final int id;

		public AddVariable(int id) {
			this.id = id;
		}
	}

	private static final class AddConstraint implements Action {
		private final Constraint constraint;

		public AddConstraint(Constraint constraint) {
			this.constraint = constraint;
		}
	}

	private static final class AddCombination implements Action {
		private final Combine kind;
		private final Pair regions;

		public AddCombination(Combine kind, Pair regions) {
			this.kind = kind;
			this.regions = regions;
		}
	}

	private static final class Pair {
		private final Region first;
		private final Region second;

		public Pair(Region first, Region second) {
			this.first = first;
			this.second = second;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Pair) {
				Pair p = (Pair) o;
				return first.equals(p.first) && second.equals(p.second);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return first.hashCode() ^ (31 * second.hashCode());
		}
	}
}
