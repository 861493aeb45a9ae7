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

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.Foldable;
import higherranked.core.Syntax.Instantiation;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Relatable;
import higherranked.core.Syntax.Type;
import higherranked.util.InternalFailure;
import higherranked.util.TypeFolder;
import higherranked.util.UndoLog;

/**
 * The session object threaded through every relation. This owns the region
 * store and the type variable store, and provides transactions over both of
 * them together.
 *
 * @author David J. Pearce
 *
 */
public class InferenceContext {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	private final RegionStore regions = new RegionStore();
	private final TypeVariables typeVariables = new TypeVariables();
	/**
	 * Determines whether the leak check is rerun before plugging leaks.
	 */
	private final boolean checkPlugPreconditions;

	public InferenceContext() {
		this(true);
	}

	public InferenceContext(boolean checkPlugPreconditions) {
		this.checkPlugPreconditions = checkPlugPreconditions;
	}

	public RegionStore regions() {
		return regions;
	}

	public TypeVariables typeVariables() {
		return typeVariables;
	}

	public boolean checkPlugPreconditions() {
		return checkPlugPreconditions;
	}

	public Type.Variable nextTypeVariable() {
		return typeVariables.newVariable();
	}

	public Region.Variable nextRegionVariable() {
		return regions.newVariable(RegionStore.Origin.MISC);
	}

	// ================================================================================
	// Relations
	// ================================================================================

	/**
	 * Check that one value is a subtype of another, committing any constraints
	 * this generates only if it holds.
	 *
	 * @param aIsExpected Determines which side errors report as expected.
	 * @param a
	 * @param b
	 * @return
	 */
	public <T extends Relatable<T>> T subtype(boolean aIsExpected, T a, T b) {
		return commitIfOk(s -> new CombineFields(this, aIsExpected).sub().relate(a, b));
	}

	public <T extends Relatable<T>> T lub(boolean aIsExpected, T a, T b) {
		return commitIfOk(s -> new CombineFields(this, aIsExpected).lub().relate(a, b));
	}

	public <T extends Relatable<T>> T glb(boolean aIsExpected, T a, T b) {
		return commitIfOk(s -> new CombineFields(this, aIsExpected).glb().relate(a, b));
	}

	public <T extends Relatable<T>> T equate(boolean aIsExpected, T a, T b) {
		return commitIfOk(s -> new CombineFields(this, aIsExpected).equate().relate(a, b));
	}

	// ================================================================================
	// Transactions
	// ================================================================================

	/**
	 * Open a snapshot over both stores. Unless committed, the snapshot is rolled
	 * back when closed.
	 *
	 * @return
	 */
	public Snapshot begin() {
		return new Snapshot();
	}

	/**
	 * Run a given operation within a fresh snapshot, committing if it returns
	 * normally and rolling back otherwise.
	 *
	 * @param operation
	 * @return
	 */
	public <T> T commitIfOk(Function<Snapshot, T> operation) {
		try (Snapshot snapshot = begin()) {
			T result = operation.apply(snapshot);
			snapshot.commit();
			return result;
		}
	}

	/**
	 * Run a given operation within a fresh snapshot which is always rolled back.
	 *
	 * @param operation
	 * @return
	 */
	public <T> T probe(Function<Snapshot, T> operation) {
		try (Snapshot snapshot = begin()) {
			return operation.apply(snapshot);
		}
	}

	public List<Region> taintedRegions(Snapshot snapshot, Region r) {
		return regions.tainted(snapshot.regionSnapshot, r);
	}

	/**
	 * Determine the region variables created since a given snapshot which cannot
	 * be observed outside of it. A region variable created during the snapshot
	 * escapes when it ends up in the value of a type variable that already existed
	 * before the snapshot.
	 *
	 * @param snapshot
	 * @return
	 */
	public Set<Region> regionVarsConfinedToSnapshot(Snapshot snapshot) {
		LinkedHashSet<Region> vars = new LinkedHashSet<>();
		for (int id : regions.varsCreatedSince(snapshot.regionSnapshot)) {
			vars.add(new Region.Variable(id));
		}
		List<Type> escapingTypes = typeVariables.typesEscaping(snapshot.typeSnapshot);
		HashSet<Region> escaping = new HashSet<>();
		for (Type type : escapingTypes) {
			TypeFolder.collectRegions(resolveTypeVarsIfPossible(type), escaping);
		}
		vars.removeAll(escaping);
		if (DEBUG) {
			System.err.println("region_vars_confined_to_snapshot: vars=" + vars + " escaping=" + escapingTypes);
		}
		return vars;
	}

	// ================================================================================
	// Resolution
	// ================================================================================

	/**
	 * Follow any instantiated type variables at the outermost level of a type.
	 *
	 * @param type
	 * @return
	 */
	public Type shallowResolve(Type type) {
		while (type instanceof Type.Variable) {
			Type value = typeVariables.probe((Type.Variable) type);
			if (value == null) {
				break;
			}
			type = value;
		}
		return type;
	}

	/**
	 * Replace every instantiated type variable within a value by its value.
	 * Unresolved variables are left in place.
	 *
	 * @param value
	 * @return
	 */
	public <T extends Foldable<T>> T resolveTypeVarsIfPossible(T value) {
		return value.fold(resolver, 1);
	}

	private final TypeFolder resolver = new TypeFolder() {
		@Override
		public Type fold(Type.Variable type, int depth) {
			Type value = typeVariables.probe(type);
			if (value == null) {
				return type;
			}
			return value.fold(this, depth);
		}
	};

	/**
	 * Replace each region bound by a given binder with a fresh region variable.
	 *
	 * @param binder
	 * @return
	 */
	public <T extends Relatable<T>> Instantiation<T> replaceLateBoundRegionsWithFreshVar(Binder<T> binder) {
		return binder.replaceLateBoundRegions(br -> regions.newVariable(RegionStore.Origin.HIGHER_RANKED_TYPE));
	}

	/**
	 * A snapshot over both the region store and the type variable store. These
	 * must be closed in the reverse order to which they were opened.
	 *
	 * @author David J. Pearce
	 *
	 */
	public class Snapshot implements AutoCloseable {
		private final RegionStore.Snapshot regionSnapshot;
		private final UndoLog.Snapshot typeSnapshot;
		private boolean closed;

		private Snapshot() {
			this.regionSnapshot = regions.startSnapshot();
			this.typeSnapshot = typeVariables.startSnapshot();
		}

		public RegionStore.Snapshot regionSnapshot() {
			return regionSnapshot;
		}

		public UndoLog.Snapshot typeSnapshot() {
			return typeSnapshot;
		}

		public boolean isClosed() {
			return closed;
		}

		public void commit() {
			InternalFailure.check(!closed, "snapshot already closed");
			typeVariables.commit(typeSnapshot);
			regions.commit(regionSnapshot);
			closed = true;
		}

		public void rollback() {
			InternalFailure.check(!closed, "snapshot already closed");
			typeVariables.rollbackTo(typeSnapshot);
			regions.rollbackTo(regionSnapshot);
			closed = true;
		}

		/**
		 * Roll back this snapshot, unless it was already committed or rolled back.
		 */
		@Override
		public void close() {
			if (!closed) {
				rollback();
			}
		}

		@Override
		public String toString() {
			return "(" + regionSnapshot + "," + typeSnapshot + ")";
		}
	}
}
