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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import higherranked.core.InferenceContext;
import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.BoundRegion;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Signature;
import higherranked.core.Syntax.Type;
import higherranked.extensions.Traits;
import higherranked.io.Lexer.*;
import higherranked.util.SyntaxError;

/**
 * Responsible for turning a sequence of tokens into types, trait references and
 * impls. Lifetimes introduced by a <code>for&lt;...&gt;</code> become regions
 * bound at the appropriate de Bruijn depth, whilst <code>_</code> produces a
 * fresh type variable in the given inference context.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	public static final Context ROOT_CONTEXT = new Context();

	private final String sourcefile;
	private final ArrayList<Token> tokens;
	private final InferenceContext infcx;
	private int index;

	public Parser(String sourcefile, List<Token> tokens, InferenceContext infcx) {
		this.sourcefile = sourcefile;
		this.tokens = new ArrayList<>(tokens);
		this.infcx = infcx;
	}

	/**
	 * Parse a complete type, where the entire input must be consumed.
	 *
	 * @return
	 */
	public Type parseType() {
		Type type = parseType(ROOT_CONTEXT);
		matchEndOfInput();
		return type;
	}

	/**
	 * Parse a complete trait reference, which may be quantified over some
	 * lifetimes. The entire input must be consumed.
	 *
	 * @return
	 */
	public Binder<Traits.Syntax.TraitRef> parsePolyTraitRef() {
		String[] lifetimes = parseLifetimeBinder();
		Traits.Syntax.TraitRef ref = parseTraitRef(ROOT_CONTEXT.enter(lifetimes));
		matchEndOfInput();
		return new Binder<>(ref);
	}

	/**
	 * Parse a complete impl, of the form:
	 *
	 * <pre>
	 * Impl ::= 'impl' ['<' Ident (',' Ident)* '>'] TraitRef ['where' TraitRef (',' TraitRef)*]
	 * </pre>
	 *
	 * @return
	 */
	public Traits.Syntax.Impl parseImpl() {
		matchKeyword("impl");
		ArrayList<String> parameters = new ArrayList<>();
		if (tryMatch("<")) {
			do {
				parameters.add(matchIdentifier().text);
			} while (tryMatch(","));
			match(">");
		}
		Traits.Syntax.TraitRef header = parseTraitRef(ROOT_CONTEXT);
		ArrayList<Traits.Syntax.TraitRef> predicates = new ArrayList<>();
		if (tryMatch("where")) {
			do {
				predicates.add(parseTraitRef(ROOT_CONTEXT));
			} while (tryMatch(","));
		}
		matchEndOfInput();
		return new Traits.Syntax.Impl(parameters.toArray(new String[parameters.size()]), header,
				predicates.toArray(new Traits.Syntax.TraitRef[predicates.size()]));
	}

	/**
	 * Parse a type, of the form:
	 *
	 * <pre>
	 * Type ::= 'int'
	 *        | '(' ')'
	 *        | '(' Type (',' Type)* ')'
	 *        | '&' Lifetime ['mut'] Type
	 *        | ['for' '<' Lifetime (',' Lifetime)* '>'] 'fn' '(' [Type (',' Type)*] ')' ['->' Type]
	 *        | '_'
	 *        | Ident
	 * </pre>
	 *
	 * A parenthesised type with one element and no trailing comma is just that
	 * element.
	 *
	 * @param context
	 * @return
	 */
	public Type parseType(Context context) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t.text.equals("int")) {
			matchKeyword("int");
			return Type.Int;
		} else if (t instanceof LeftBrace) {
			return parseTupleType(context);
		} else if (t instanceof Ampersand) {
			return parseReferenceType(context);
		} else if (t.text.equals("for") || t.text.equals("fn")) {
			return parseFunctionType(context);
		} else if (t.text.equals("_")) {
			index = index + 1;
			return infcx.nextTypeVariable();
		} else if (t instanceof Identifier) {
			index = index + 1;
			return new Type.Parameter(t.text);
		}
		syntaxError("unknown type encountered", t);
		return null; // deadcode
	}

	public Type parseTupleType(Context context) {
		match("(");
		if (tryMatch(")")) {
			return Type.Unit;
		}
		ArrayList<Type> elements = new ArrayList<>();
		boolean trailing = false;
		do {
			if (index < tokens.size() && tokens.get(index) instanceof RightBrace) {
				trailing = true;
				break;
			}
			elements.add(parseType(context));
		} while (tryMatch(","));
		match(")");
		if (elements.size() == 1 && !trailing) {
			return elements.get(0);
		}
		return new Type.Tuple(elements.toArray(new Type[elements.size()]));
	}

	public Type parseReferenceType(Context context) {
		match("&");
		Lexer.Lifetime lifetime = match(Lexer.Lifetime.class, "lifetime");
		Region region = context.lookup(lifetime.name());
		boolean mutable = tryMatch("mut");
		Type element = parseType(context);
		return new Type.Reference(region, mutable, element);
	}

	public Type parseFunctionType(Context context) {
		String[] lifetimes = parseLifetimeBinder();
		// Every function type introduces a binder, even if it binds nothing
		Context inner = context.enter(lifetimes);
		matchKeyword("fn");
		Type[] parameters = parseTypeList(inner);
		Type result = Type.Unit;
		if (tryMatch("->")) {
			result = parseType(inner);
		}
		return new Type.Function(new Binder<>(new Signature(parameters, result)));
	}

	/**
	 * Parse a trait reference, of the form:
	 *
	 * <pre>
	 * TraitRef ::= Ident '(' [Type (',' Type)*] ')'
	 * </pre>
	 *
	 * @param context
	 * @return
	 */
	public Traits.Syntax.TraitRef parseTraitRef(Context context) {
		Identifier name = matchIdentifier();
		return new Traits.Syntax.TraitRef(name.text, parseTypeList(context));
	}

	private Type[] parseTypeList(Context context) {
		match("(");
		ArrayList<Type> types = new ArrayList<>();
		if (!tryMatch(")")) {
			do {
				types.add(parseType(context));
			} while (tryMatch(","));
			match(")");
		}
		return types.toArray(new Type[types.size()]);
	}

	/**
	 * Parse an optional list of quantified lifetimes, such as
	 * <code>for&lt;'a, 'b&gt;</code>.
	 *
	 * @return
	 */
	private String[] parseLifetimeBinder() {
		ArrayList<String> lifetimes = new ArrayList<>();
		if (index < tokens.size() && tokens.get(index).text.equals("for")) {
			matchKeyword("for");
			match("<");
			do {
				Lexer.Lifetime l = match(Lexer.Lifetime.class, "lifetime");
				if (l.name().equals("static")) {
					syntaxError("cannot quantify over 'static", l);
				} else if (lifetimes.contains(l.name())) {
					syntaxError("lifetime declared twice", l);
				}
				lifetimes.add(l.name());
			} while (tryMatch(","));
			match(">");
		}
		return lifetimes.toArray(new String[lifetimes.size()]);
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			throw new SyntaxError("unexpected end-of-file", sourcefile, sourcefile.length() - 1, sourcefile.length() - 1);
		}
		return;
	}

	private void matchEndOfInput() {
		if (index < tokens.size()) {
			syntaxError("unexpected input", tokens.get(index));
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	/**
	 * Match a given token if it is next, without raising an error otherwise.
	 *
	 * @param op
	 * @return
	 */
	private boolean tryMatch(String op) {
		if (index < tokens.size() && tokens.get(index).text.equals(op)) {
			index = index + 1;
			return true;
		}
		return false;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier && !t.text.equals("_")) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected", t);
		return null; // unreachable.
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword) {
			if (t.text.equals(keyword)) {
				index = index + 1;
				return (Keyword) t;
			}
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, sourcefile, t.start, t.end());
	}

	/**
	 * Provides information about the binders enclosing the position at which the
	 * parser is operating.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Context {
		/**
		 * The lifetimes declared by each enclosing binder, innermost last.
		 */
		private final List<String[]> binders;

		public Context() {
			this.binders = new ArrayList<>();
		}

		private Context(List<String[]> binders) {
			this.binders = binders;
		}

		/**
		 * Create a context for the body of a binder declaring some lifetimes.
		 *
		 * @param lifetimes
		 * @return
		 */
		public Context enter(String... lifetimes) {
			ArrayList<String[]> nbinders = new ArrayList<>(binders);
			nbinders.add(lifetimes);
			return new Context(nbinders);
		}

		/**
		 * Determine the region referred to by a given lifetime in this context.
		 *
		 * @param lifetime
		 * @return
		 */
		public Region lookup(String lifetime) {
			for (int k = 0; k < binders.size(); ++k) {
				String[] declared = binders.get(binders.size() - 1 - k);
				if (Arrays.asList(declared).contains(lifetime)) {
					return new Region.Bound(k + 1, BoundRegion.named(lifetime));
				}
			}
			if (lifetime.equals("static")) {
				return Region.STATIC;
			}
			return new Region.Free(lifetime);
		}
	}
}
