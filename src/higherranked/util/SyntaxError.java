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

import java.io.PrintStream;

/**
 * This exception is thrown when a syntax error occurs whilst reading a type.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {
	private final String msg;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in some source text.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The source text this error is referring to.
	 * @param start
	 *            Index of the first offending character.
	 * @param end
	 *            Index of the last offending character.
	 */
	public SyntaxError(String msg, String src, int start, int end) {
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		return msg == null ? "" : msg;
	}

	public String msg() {
		return msg;
	}

	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Output the syntax error to a given output stream, highlighting the offending
	 * characters beneath the line on which they occur.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println("syntax error: " + getMessage());
			return;
		}
		int line = 1;
		int lineStart = 0;
		for (int i = 0; i < start && i < src.length(); ++i) {
			if (src.charAt(i) == '\n') {
				line = line + 1;
				lineStart = i + 1;
			}
		}
		int lineEnd = src.indexOf('\n', lineStart);
		if (lineEnd < 0) {
			lineEnd = src.length();
		}
		output.println("line " + line + ": " + getMessage());
		output.println(src.substring(lineStart, lineEnd));
		StringBuilder marker = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			marker.append(src.charAt(i) == '\t' ? '\t' : ' ');
		}
		for (int i = start; i <= end; ++i) {
			marker.append('^');
		}
		output.println(marker);
	}

	public static final long serialVersionUID = 1l;
}
