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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A log of the actions performed on a store since the outermost open snapshot.
 * Actions are only recorded whilst a snapshot is open. Rolling back to a
 * snapshot reverses every action recorded since it, newest first, whilst
 * committing a snapshot keeps them so that an enclosing snapshot can still see
 * (and roll back) the work of a committed inner one. Snapshots must be closed in
 * the reverse order to which they were opened.
 *
 * @author David J. Pearce
 *
 * @param <A> The kind of action being recorded.
 */
public class UndoLog<A> {
	private static final Object OPEN_SNAPSHOT = new Object() {
		@Override
		public String toString() {
			return "OpenSnapshot";
		}
	};
	private static final Object COMMITTED_SNAPSHOT = new Object() {
		@Override
		public String toString() {
			return "CommittedSnapshot";
		}
	};

	private final List<Object> log = new ArrayList<>();
	private final Consumer<A> reverse;

	/**
	 * Construct an undo log.
	 *
	 * @param reverse Responsible for reversing a given action on rollback.
	 */
	public UndoLog(Consumer<A> reverse) {
		this.reverse = reverse;
	}

	/**
	 * Check whether any snapshot is currently open.
	 *
	 * @return
	 */
	public boolean inSnapshot() {
		return !log.isEmpty();
	}

	/**
	 * Record an action, if there is a snapshot it might need to be rolled back to.
	 *
	 * @param action
	 */
	public void push(A action) {
		if (inSnapshot()) {
			log.add(action);
		}
	}

	public Snapshot start() {
		Snapshot s = new Snapshot(log.size());
		log.add(OPEN_SNAPSHOT);
		return s;
	}

	public void commit(Snapshot snapshot) {
		checkInnermost(snapshot);
		if (snapshot.length == 0) {
			// Nothing left to roll back to
			log.clear();
		} else {
			log.set(snapshot.length, COMMITTED_SNAPSHOT);
		}
	}

	@SuppressWarnings("unchecked")
	public void rollbackTo(Snapshot snapshot) {
		checkInnermost(snapshot);
		while (log.size() > snapshot.length + 1) {
			Object entry = log.remove(log.size() - 1);
			if (entry != COMMITTED_SNAPSHOT) {
				reverse.accept((A) entry);
			}
		}
		log.remove(snapshot.length);
	}

	/**
	 * Check whether a given snapshot is still open (i.e. has been neither committed
	 * nor rolled back).
	 *
	 * @param snapshot
	 * @return
	 */
	public boolean isOpen(Snapshot snapshot) {
		return snapshot.length < log.size() && log.get(snapshot.length) == OPEN_SNAPSHOT;
	}

	/**
	 * Check whether a given snapshot is open and no other snapshot has been opened
	 * since.
	 *
	 * @param snapshot
	 * @return
	 */
	public boolean isInnermost(Snapshot snapshot) {
		if (!isOpen(snapshot)) {
			return false;
		}
		for (int i = snapshot.length + 1; i < log.size(); ++i) {
			if (log.get(i) == OPEN_SNAPSHOT) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Return every action recorded since a given snapshot was opened, oldest first.
	 * This includes actions recorded by inner snapshots which have since been
	 * committed.
	 *
	 * @param snapshot
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public List<A> actionsSince(Snapshot snapshot) {
		InternalFailure.check(isOpen(snapshot), "snapshot is not open");
		ArrayList<A> actions = new ArrayList<>();
		for (int i = snapshot.length + 1; i < log.size(); ++i) {
			Object entry = log.get(i);
			if (entry != OPEN_SNAPSHOT && entry != COMMITTED_SNAPSHOT) {
				actions.add((A) entry);
			}
		}
		return actions;
	}

	private void checkInnermost(Snapshot snapshot) {
		InternalFailure.check(isOpen(snapshot), "snapshot is not open");
		InternalFailure.check(isInnermost(snapshot), "failure to observe stack discipline");
	}

	/**
	 * Identifies a point in the log to which we may later return.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Snapshot {
		private final int length;

		private Snapshot(int length) {
			this.length = length;
		}

		@Override
		public String toString() {
			return "#" + length;
		}
	}
}
