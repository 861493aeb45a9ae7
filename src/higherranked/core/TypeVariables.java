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
import java.util.List;

import higherranked.core.Syntax.Type;
import higherranked.util.InternalFailure;
import higherranked.util.UndoLog;

/**
 * Stores the type inference variables created so far, along with the type (if
 * any) each has been instantiated with. Every variable is instantiated at most
 * once.
 *
 * @author David J. Pearce
 *
 */
public class TypeVariables {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	public final static String ALREADY_INSTANTIATED = "type variable instantiated twice";

	/**
	 * The value of each variable, where <code>null</code> means not yet known.
	 */
	private final ArrayList<Type> values = new ArrayList<>();
	private final UndoLog<Action> log = new UndoLog<>(this::reverse);

	public Type.Variable newVariable() {
		int id = values.size();
		values.add(null);
		log.push(new NewVariable(id));
		return new Type.Variable(id);
	}

	/**
	 * Get the type a given variable has been instantiated with, or
	 * <code>null</code> if it remains unknown.
	 *
	 * @param variable
	 * @return
	 */
	public Type probe(Type.Variable variable) {
		return values.get(variable.id());
	}

	public int size() {
		return values.size();
	}

	public void instantiate(Type.Variable variable, Type type) {
		int id = variable.id();
		InternalFailure.check(values.get(id) == null, ALREADY_INSTANTIATED + ": " + variable);
		if (DEBUG) {
			System.err.println("instantiate " + variable + " := " + type);
		}
		values.set(id, type);
		log.push(new Instantiate(id));
	}

	public UndoLog.Snapshot startSnapshot() {
		return log.start();
	}

	public void commit(UndoLog.Snapshot snapshot) {
		log.commit(snapshot);
	}

	public void rollbackTo(UndoLog.Snapshot snapshot) {
		log.rollbackTo(snapshot);
	}

	/**
	 * Determine the values given since a snapshot to variables which already
	 * existed before it. Anything reachable from such a type is visible outside
	 * the snapshot.
	 *
	 * @param snapshot
	 * @return
	 */
	public List<Type> typesEscaping(UndoLog.Snapshot snapshot) {
		List<Action> actions = log.actionsSince(snapshot);
		// Variables with an id at or above this were created within the snapshot
		int threshold = values.size();
		for (Action a : actions) {
			if (a instanceof NewVariable) {
				threshold = Math.min(threshold, ((NewVariable) a).id);
			}
		}
		ArrayList<Type> escaping = new ArrayList<>();
		for (Action a : actions) {
			if (a instanceof Instantiate) {
				int id = ((Instantiate) a).id;
				if (id < threshold) {
					escaping.add(values.get(id));
				}
			}
		}
		return escaping;
	}

	private void reverse(Action action) {
		if (action instanceof NewVariable) {
			int id = ((NewVariable) action).id;
			InternalFailure.check(id == values.size() - 1, "type variables rolled back out of order");
			values.remove(id);
		} else {
			values.set(((Instantiate) action).id, null);
		}
	}

	private interface Action {

	}

	private static final class NewVariable implements Action {
		private final int id;

		public NewVariable(int id) {
			this.id = id;
		}
	}

	private static final class Instantiate implements Action {
		private final int id;

		public Instantiate(int id) {
			this.id = id;
		}
	}
}
