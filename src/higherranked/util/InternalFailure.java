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

/**
 * Signals that an invariant of the inference engine has been violated. This
 * indicates a bug rather than an ill-typed input, and is never recovered from.
 * Any enclosing transaction is still rolled back as the failure propagates.
 *
 * @author David J. Pearce
 *
 */
public class InternalFailure extends RuntimeException {

	public InternalFailure(String msg) {
		super(msg);
	}

	/**
	 * Raise an internal failure if a given condition does not hold.
	 *
	 * @param condition
	 * @param msg
	 */
	public static void check(boolean condition, String msg) {
		if (!condition) {
			throw new InternalFailure(msg);
		}
	}

	public static final long serialVersionUID = 1l;
}
