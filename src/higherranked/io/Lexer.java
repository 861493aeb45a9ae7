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
package higherranked.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import higherranked.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {
	private final StringBuffer input;
	private int pos;

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);
		StringBuffer text = new StringBuffer();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}
		input = text;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding list
	 * of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '/') {
				scanLineComment();
			} else if (c == '\'') {
				tokens.add(scanLifetime());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("syntax error");
			}
		}

		return tokens;
	}

	static final char[] opStarts = { '&', ',', '(', ')', '<', '>', '-' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		char c = input.charAt(pos);

		if (c == '&') {
			return new Ampersand(pos++);
		} else if (c == ',') {
			return new Comma(pos++);
		} else if (c == '(') {
			return new LeftBrace(pos++);
		} else if (c == ')') {
			return new RightBrace(pos++);
		} else if (c == '<') {
			return new LeftAngle(pos++);
		} else if (c == '>') {
			return new RightAngle(pos++);
		} else if (c == '-' && (pos + 1) < input.length() && input.charAt(pos + 1) == '>') {
			Arrow a = new Arrow(pos);
			pos += 2;
			return a;
		}

		syntaxError("unknown operator encountered: " + c);
		return null;
	}

	public static final String[] keywords = { "int", "mut", "fn", "for", "impl", "where" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	/**
	 * Scan a lifetime, such as <code>'a</code> or <code>'static</code>.
	 *
	 * @return
	 */
	public Token scanLifetime() {
		int start = pos++;
		if (pos >= input.length() || !Character.isJavaIdentifierStart(input.charAt(pos))) {
			syntaxError("invalid lifetime");
		}
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		return new Lifetime(input.substring(start, pos), start);
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	/**
	 * Skip over any whitespace at the current index position in the input string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input.toString(), pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}
	}

	/**
	 * Represents a type parameter or trait name. That is, an alphabetic character
	 * (or '_'), followed by a sequence of zero or more alpha-numeric characters.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a lifetime, which is a single quote followed by an identifier.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Lifetime extends Token {

		public Lifetime(String text, int pos) {
			super(text, pos);
		}

		/**
		 * Get the name of this lifetime, excluding the leading quote.
		 *
		 * @return
		 */
		public String name() {
			return text.substring(1);
		}
	}

	public static class Ampersand extends Token {
		public Ampersand(int pos) {
			super("&", pos);
		}
	}

	public static class Comma extends Token {
		public Comma(int pos) {
			super(",", pos);
		}
	}

	public static class LeftBrace extends Token {
		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {
		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class LeftAngle extends Token {
		public LeftAngle(int pos) {
			super("<", pos);
		}
	}

	public static class RightAngle extends Token {
		public RightAngle(int pos) {
			super(">", pos);
		}
	}

	public static class Arrow extends Token {
		public Arrow(int pos) {
			super("->", pos);
		}
	}
}
